package io.marketsync.core;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * Decides which dates a market trades on. The default only knows about weekends.
 */
public interface TradingCalendar {
    TradingCalendar WEEKDAYS = TradingCalendar::isWeekday;

    boolean isTradingDay(LocalDate date);

    /** The given date if it trades, otherwise the closest earlier trading day. */
    default LocalDate onOrBefore(LocalDate date) {
        LocalDate d = date;
        while (!isTradingDay(d)) d = d.minusDays(1);
        return d;
    }

    static boolean isWeekday(LocalDate d) {
        DayOfWeek dow = d.getDayOfWeek();
        return dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY;
    }
}
