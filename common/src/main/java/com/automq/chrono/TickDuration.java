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

package com.automq.chrono;

import com.automq.chrono.util.DurationFormatter;
import com.google.common.base.Preconditions;
import com.google.common.math.LongMath;
import java.time.Duration;

/**
 * An amount of time held as a signed {@code long} tick count at a fixed {@link Resolution}.
 *
 * @param <R> the resolution, fixed at construction time
 */
public final class TickDuration<R extends Resolution> implements Comparable<TickDuration<R>> {
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final long ticks;
    private final R resolution;

    private TickDuration(long ticks, R resolution) {
        this.ticks = ticks;
        this.resolution = resolution;
    }

    public static <R extends Resolution> TickDuration<R> of(long ticks, R resolution) {
        Preconditions.checkNotNull(resolution, "resolution");
        return new TickDuration<>(ticks, resolution);
    }

    public static <R extends Resolution> TickDuration<R> zero(R resolution) {
        return of(0, resolution);
    }

    public long ticks() {
        return ticks;
    }

    public R resolution() {
        return resolution;
    }

    public boolean isZero() {
        return ticks == 0;
    }

    public boolean isNegative() {
        return ticks < 0;
    }

    /**
     * @throws ArithmeticException on overflow
     */
    public TickDuration<R> plus(TickDuration<R> other) {
        return new TickDuration<>(LongMath.checkedAdd(ticks, other.ticks), resolution);
    }

    /**
     * @throws ArithmeticException if this duration holds {@link Long#MIN_VALUE} ticks
     */
    public TickDuration<R> negated() {
        return new TickDuration<>(LongMath.checkedSubtract(0, ticks), resolution);
    }

    /**
     * Converts to another resolution, dropping any remainder.
     *
     * @throws ArithmeticException if the converted tick count does not fit in a {@code long}
     */
    public <T extends Resolution> TickDuration<T> convertTo(T target) {
        Preconditions.checkNotNull(target, "target");
        return new TickDuration<>(target.convert(ticks, resolution), target);
    }

    /**
     * Converts to a {@link Duration}. Exact for every standard resolution; custom ratios are truncated to whole
     * nanoseconds.
     *
     * @throws ArithmeticException if the value lies outside the range of {@link Duration}, e.g. {@link Long#MAX_VALUE}
     *                             hours
     */
    public Duration toJavaDuration() {
        long num = resolution.numerator();
        long den = resolution.denominator();
        if (den == 1) {
            return Duration.ofSeconds(ticks).multipliedBy(num);
        }
        long gcd = LongMath.gcd(NANOS_PER_SECOND, den);
        long remainder = ticks % den;
        long nanos = LongMath.checkedMultiply(LongMath.checkedMultiply(remainder, NANOS_PER_SECOND / gcd), num)
            / (den / gcd);
        return Duration.ofSeconds(ticks / den).multipliedBy(num).plusNanos(nanos);
    }

    @Override
    public int compareTo(TickDuration<R> other) {
        return Long.compare(ticks, other.ticks);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TickDuration<?> other)) {
            return false;
        }
        return ticks == other.ticks && resolution.equals(other.resolution);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(ticks) * 31 + resolution.hashCode();
    }

    @Override
    public String toString() {
        return DurationFormatter.canFormat(resolution) ? DurationFormatter.format(this) : ticks + "x" + resolution;
    }
}
