package io.marketsync.error;

import java.io.IOException;

/**
 * Classification of fetch failures into the retry taxonomy.
 */
public final class FetchErrors {
    private FetchErrors() {}

    public static boolean isRetryable(Exception e) {
        if (e instanceof NotFoundException) return false;
        return e instanceof TransientFetchException
                || e instanceof ThrottledException
                || e instanceof IOException;
    }

    public static boolean isThrottle(Exception e) {
        return e instanceof ThrottledException;
    }
}
