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

import com.google.common.base.Preconditions;
import com.google.common.math.LongMath;
import java.math.BigInteger;
import java.util.concurrent.TimeUnit;

/**
 * Tick resolution of a {@link TickDuration}, expressed as the number of seconds one tick represents
 * ({@code numerator / denominator}).
 * <p>
 * Every standard resolution has its own final class so that the resolution of a duration is part of its static
 * type, e.g. {@code TickDuration<Resolution.Seconds>}. Arbitrary ratios are available through
 * {@link #ofRatio(long, long)}.
 */
public abstract class Resolution {
    public static final Nanoseconds NANOSECONDS = new Nanoseconds();
    public static final Microseconds MICROSECONDS = new Microseconds();
    public static final Milliseconds MILLISECONDS = new Milliseconds();
    public static final Seconds SECONDS = new Seconds();
    public static final Minutes MINUTES = new Minutes();
    public static final Hours HOURS = new Hours();

    private final long numerator;
    private final long denominator;
    private final String symbol;
    private final TimeUnit timeUnit;

    Resolution(long numerator, long denominator, String symbol, TimeUnit timeUnit) {
        Preconditions.checkArgument(numerator > 0 && denominator > 0,
            "Resolution ratio must be positive, but was %s/%s", numerator, denominator);
        long gcd = LongMath.gcd(numerator, denominator);
        this.numerator = numerator / gcd;
        this.denominator = denominator / gcd;
        this.symbol = symbol;
        this.timeUnit = timeUnit;
    }

    /**
     * Creates a resolution whose tick lasts {@code numerator / denominator} seconds.
     *
     * @throws IllegalArgumentException if either part of the ratio is not positive
     */
    public static Ratio ofRatio(long numerator, long denominator) {
        return new Ratio(numerator, denominator);
    }

    /**
     * Maps a {@link TimeUnit} onto its resolution. {@link TimeUnit#DAYS} has no counterpart.
     */
    public static Resolution of(TimeUnit unit) {
        Preconditions.checkNotNull(unit, "unit");
        return switch (unit) {
            case NANOSECONDS -> Resolution.NANOSECONDS;
            case MICROSECONDS -> Resolution.MICROSECONDS;
            case MILLISECONDS -> Resolution.MILLISECONDS;
            case SECONDS -> Resolution.SECONDS;
            case MINUTES -> Resolution.MINUTES;
            case HOURS -> Resolution.HOURS;
            default -> throw new IllegalArgumentException("Unsupported time unit: " + unit);
        };
    }

    public long numerator() {
        return numerator;
    }

    public long denominator() {
        return denominator;
    }

    /**
     * Unit suffix of this resolution, {@code null} for ratios without a suffix in the duration grammar.
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Matching {@link TimeUnit}, {@code null} for custom ratios.
     */
    public TimeUnit timeUnit() {
        return timeUnit;
    }

    /**
     * Converts {@code amount} ticks of {@code source} into ticks of this resolution, truncating toward zero.
     *
     * @throws ArithmeticException if the result does not fit in a {@code long}
     */
    public long convert(long amount, Resolution source) {
        Preconditions.checkNotNull(source, "source");
        if (sameRatio(source)) {
            return amount;
        }
        long g1 = LongMath.gcd(source.numerator, numerator);
        long g2 = LongMath.gcd(source.denominator, denominator);
        long num = LongMath.checkedMultiply(source.numerator / g1, denominator / g2);
        long den = LongMath.checkedMultiply(source.denominator / g2, numerator / g1);
        if (den == 1) {
            return LongMath.checkedMultiply(amount, num);
        }
        if (num == 1) {
            return amount / den;
        }
        // amount = q * den + r with r carrying the sign of amount, so both terms truncate the same way.
        long q = amount / den;
        long r = amount % den;
        return LongMath.checkedAdd(LongMath.checkedMultiply(q, num), remainderTicks(r, num, den));
    }

    // |r| < den, so the result is below num in magnitude even when r * num is not representable.
    private static long remainderTicks(long r, long num, long den) {
        if (Math.abs(r) <= Long.MAX_VALUE / num) {
            return r * num / den;
        }
        return BigInteger.valueOf(r).multiply(BigInteger.valueOf(num)).divide(BigInteger.valueOf(den))
            .longValueExact();
    }

    boolean sameRatio(Resolution other) {
        return numerator == other.numerator && denominator == other.denominator;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Resolution other)) {
            return false;
        }
        return sameRatio(other);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(numerator) * 31 + Long.hashCode(denominator);
    }

    @Override
    public String toString() {
        return symbol != null ? symbol : numerator + "/" + denominator + "s";
    }

    public static final class Nanoseconds extends Resolution {
        private Nanoseconds() {
            super(1, 1_000_000_000L, "ns", TimeUnit.NANOSECONDS);
        }
    }

    public static final class Microseconds extends Resolution {
        private Microseconds() {
            super(1, 1_000_000L, "us", TimeUnit.MICROSECONDS);
        }
    }

    public static final class Milliseconds extends Resolution {
        private Milliseconds() {
            super(1, 1_000L, "ms", TimeUnit.MILLISECONDS);
        }
    }

    public static final class Seconds extends Resolution {
        private Seconds() {
            super(1, 1, "s", TimeUnit.SECONDS);
        }
    }

    public static final class Minutes extends Resolution {
        private Minutes() {
            super(60, 1, "m", TimeUnit.MINUTES);
        }
    }

    public static final class Hours extends Resolution {
        private Hours() {
            super(3600, 1, "h", TimeUnit.HOURS);
        }
    }

    /**
     * Custom resolution, e.g. {@code Resolution.ofRatio(1, 100)} for centiseconds.
     */
    public static final class Ratio extends Resolution {
        private Ratio(long numerator, long denominator) {
            super(numerator, denominator, null, null);
        }
    }
}
