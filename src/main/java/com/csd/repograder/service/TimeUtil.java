package com.csd.repograder.service;

import java.time.Duration;
import java.time.Instant;

public final class TimeUtil {
    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private TimeUtil() {}

    /**
     * Whole days between {@code timestamp} and {@code now}, rounded up.
     * Timestamps in the future count the same as timestamps in the past.
     */
    public static long daysSince(Instant timestamp, Instant now) {
        long diffMillis = Math.abs(now.toEpochMilli() - timestamp.toEpochMilli());
        return (long) Math.ceil(diffMillis / MILLIS_PER_DAY);
    }

    public static double millisToDays(double millis) {
        return millis / MILLIS_PER_DAY;
    }
}
