package com.questrail.coverage.persistence;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Conversion between {@link Instant} and microseconds since the epoch, the unit
 * used both in the store and in submitted {@code timestamp_microseconds}.
 */
public final class EpochMicros {

    private EpochMicros() {
    }

    public static long of(Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000L), instant.getNano() / 1_000L);
    }

    public static Instant toInstant(long micros) {
        return Instant.EPOCH.plus(micros, ChronoUnit.MICROS);
    }
}
