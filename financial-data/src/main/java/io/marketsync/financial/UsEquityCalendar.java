package io.marketsync.financial;

import io.marketsync.core.TradingCalendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;

/**
 * NYSE trading days (simplified): weekends, fixed-date holidays with observed rules, floating Monday holidays,
 * Thanksgiving and Good Friday. Ad-hoc closures are not modelled.
 */
public final class UsEquityCalendar implements TradingCalendar {
    public static final UsEquityCalendar INSTANCE = new UsEquityCalendar();

    private UsEquityCalendar() {}

    @Override
    public boolean isTradingDay(LocalDate d) {
        return TradingCalendar.isWeekday(d) && !isHoliday(d);
    }

    public static boolean isHoliday(LocalDate d) {
        int y = d.getYear();
        // fixed-date, observed on the nearest weekday
        if (isObserved(d, Month.JANUARY, 1)) return true;
        if (y >= 2022 && isObserved(d, Month.JUNE, 19)) return true;
        if (isObserved(d, Month.JULY, 4)) return true;
        if (isObserved(d, Month.DECEMBER, 25)) return true;

        if (isNthWeekdayOfMonth(d, 3, DayOfWeek.MONDAY, Month.JANUARY)) return true;   // MLK Day
        if (isNthWeekdayOfMonth(d, 3, DayOfWeek.MONDAY, Month.FEBRUARY)) return true;  // Presidents' Day
        if (isLastWeekdayOfMonth(d, DayOfWeek.MONDAY, Month.MAY)) return true;         // Memorial Day
        if (isNthWeekdayOfMonth(d, 1, DayOfWeek.MONDAY, Month.SEPTEMBER)) return true; // Labor Day
        if (isNthWeekdayOfMonth(d, 4, DayOfWeek.THURSDAY, Month.NOVEMBER)) return true;// Thanksgiving

        return d.equals(easterSunday(y).minusDays(2));
    }

    // a Saturday New Year's Day is not observed on the preceding Friday, which belongs to the previous year
    private static boolean isObserved(LocalDate d, Month m, int day) {
        LocalDate date = LocalDate.of(d.getYear(), m, day);
        DayOfWeek dow = date.getDayOfWeek();
        LocalDate observed = date;
        if (dow == DayOfWeek.SATURDAY) observed = date.minusDays(1);
        else if (dow == DayOfWeek.SUNDAY) observed = date.plusDays(1);
        return d.equals(observed);
    }

    private static boolean isNthWeekdayOfMonth(LocalDate d, int n, DayOfWeek dow, Month m) {
        if (d.getMonth() != m || d.getDayOfWeek() != dow) return false;
        return (d.getDayOfMonth() + 6) / 7 == n;
    }

    private static boolean isLastWeekdayOfMonth(LocalDate d, DayOfWeek dow, Month m) {
        if (d.getMonth() != m || d.getDayOfWeek() != dow) return false;
        return d.getDayOfMonth() + 7 > d.lengthOfMonth();
    }

    // anonymous Gregorian algorithm
    static LocalDate easterSunday(int year) {
        int a = year % 19;
        int b = year / 100;
        int c = year % 100;
        int h = (19 * a + b - b / 4 - (b - (b + 8) / 25 + 1) / 3 + 15) % 30;
        int l = (32 + 2 * (b % 4) + 2 * (c / 4) - h - c % 4) % 7;
        int m = (a + 11 * h + 22 * l) / 451;
        int month = (h + l - 7 * m + 114) / 31;
        int day = ((h + l - 7 * m + 114) % 31) + 1;
        return LocalDate.of(year, month, day);
    }
}
