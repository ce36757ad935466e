package io.marketsync.retry;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@FunctionalInterface
public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;

    Sleeper SYSTEM = d -> TimeUnit.NANOSECONDS.sleep(d.toNanos());
}
