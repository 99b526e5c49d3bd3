/*
 * Copyright 2024, AutoMQ CO.,LTD.
 *
 * Use of this software is governed by the Business Source License
 * included in the file BSL.md
 *
 * As of the Change Date specified in that file, in accordance with
 * the Business Source License, use of this software will be governed
 * by the Apache License, Version 2.0
 */

package com.automq.chrono.util;

import com.automq.chrono.Resolution;
import com.automq.chrono.TickDuration;
import com.google.common.base.Preconditions;
import java.math.BigInteger;

/**
 * Writes a {@link TickDuration} in the compound form accepted by {@link DurationParser}, largest unit first and
 * without zero components, e.g. {@code 1h33m7s}. Negative durations sign every component: {@code -1h-30m}.
 */
public final class DurationFormatter {
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private static final Resolution[] UNITS = {
        Resolution.HOURS,
        Resolution.MINUTES,
        Resolution.SECONDS,
        Resolution.MILLISECONDS,
        Resolution.MICROSECONDS,
        Resolution.NANOSECONDS
    };

    private DurationFormatter() {
    }

    /**
     * Whether durations of {@code resolution} can be written without loss, i.e. one tick is a whole number of
     * nanoseconds.
     */
    public static boolean canFormat(Resolution resolution) {
        return NANOS_PER_SECOND % resolution.denominator() == 0;
    }

    /**
     * @throws IllegalArgumentException if the tick of the duration's resolution is not a whole number of nanoseconds
     */
    public static String format(TickDuration<?> duration) {
        Preconditions.checkNotNull(duration, "duration");
        Resolution resolution = duration.resolution();
        Preconditions.checkArgument(canFormat(resolution), "Cannot format durations of resolution %s", resolution);

        long ticks = duration.ticks();
        if (ticks == 0) {
            return "0" + (resolution.symbol() != null ? resolution.symbol() : "s");
        }

        // Exact total in nanoseconds; standard resolutions at Long.MAX_VALUE ticks do not fit a long.
        BigInteger nanos = BigInteger.valueOf(ticks)
            .multiply(BigInteger.valueOf(resolution.numerator()))
            .multiply(BigInteger.valueOf(NANOS_PER_SECOND / resolution.denominator()));
        StringBuilder sb = new StringBuilder();
        for (Resolution unit : UNITS) {
            BigInteger[] quotientAndRemainder = nanos.divideAndRemainder(
                BigInteger.valueOf(Resolution.NANOSECONDS.convert(1, unit)));
            if (quotientAndRemainder[0].signum() != 0) {
                sb.append(quotientAndRemainder[0]).append(unit.symbol());
            }
            nanos = quotientAndRemainder[1];
        }
        return sb.toString();
    }
}
