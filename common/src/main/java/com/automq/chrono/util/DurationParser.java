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
import com.automq.chrono.exception.MalformedDurationException;
import com.google.common.base.Preconditions;
import com.google.common.math.LongMath;
import io.netty.util.AsciiString;
import java.nio.CharBuffer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Parses compound duration strings such as {@code 1h33m7s}, {@code -12ms} or {@code 500ns}.
 * <p>
 * The text is a sequence of tokens {@code [+-]?[0-9]*(ns|us|ms|s|m|h)}. Every token is converted to the target
 * resolution on its own, truncating toward zero, and the results are summed. A token without digits counts as zero,
 * so {@code "s"} parses to zero seconds. The empty string parses to zero.
 *
 * <pre>{@code
 * TickDuration<Resolution.Seconds> d = DurationParser.parse("1h33m7s", Resolution.SECONDS);
 * d.ticks(); // 5587
 * }</pre>
 * <p>
 * All methods are pure functions of their arguments and safe for concurrent use.
 */
public final class DurationParser {
    private DurationParser() {
    }

    /**
     * Parses {@code text} into a duration at {@code resolution}.
     *
     * @throws MalformedDurationException if the text is not a valid duration or its value overflows a {@code long}
     *                                    tick count
     */
    public static <R extends Resolution> TickDuration<R> parse(CharSequence text, R resolution) {
        Preconditions.checkNotNull(text, "text");
        Preconditions.checkNotNull(resolution, "resolution");

        final int length = text.length();
        long total = 0;
        int pos = 0;
        while (pos < length) {
            final int tokenStart = pos;

            char c = text.charAt(pos);
            boolean negative = c == '-';
            if (negative || c == '+') {
                pos++;
            }

            // Accumulate as a negative number so that Long.MIN_VALUE stays reachable.
            long magnitude = 0;
            while (pos < length && isDigit(text.charAt(pos))) {
                int digit = text.charAt(pos) - '0';
                try {
                    magnitude = LongMath.checkedSubtract(LongMath.checkedMultiply(magnitude, 10), digit);
                } catch (ArithmeticException e) {
                    throw new MalformedDurationException("Magnitude overflow", text, tokenStart, e);
                }
                pos++;
            }
            if (!negative) {
                if (magnitude == Long.MIN_VALUE) {
                    throw new MalformedDurationException("Magnitude overflow", text, tokenStart);
                }
                magnitude = -magnitude;
            }

            if (pos >= length) {
                throw new MalformedDurationException("Missing unit suffix", text, pos);
            }
            Resolution unit;
            switch (text.charAt(pos)) {
                case 'n' -> {
                    expectSecondLetter(text, pos, 's');
                    unit = Resolution.NANOSECONDS;
                    pos += 2;
                }
                case 'u' -> {
                    expectSecondLetter(text, pos, 's');
                    unit = Resolution.MICROSECONDS;
                    pos += 2;
                }
                case 'm' -> {
                    if (pos + 1 < length && text.charAt(pos + 1) == 's') {
                        unit = Resolution.MILLISECONDS;
                        pos += 2;
                    } else {
                        unit = Resolution.MINUTES;
                        pos++;
                    }
                }
                case 's' -> {
                    unit = Resolution.SECONDS;
                    pos++;
                }
                case 'h' -> {
                    unit = Resolution.HOURS;
                    pos++;
                }
                default ->
                    throw new MalformedDurationException("Unknown unit '" + text.charAt(pos) + "'", text, pos);
            }

            try {
                total = LongMath.checkedAdd(total, resolution.convert(magnitude, unit));
            } catch (ArithmeticException e) {
                throw new MalformedDurationException("Duration overflows " + resolution + " ticks", text, tokenStart,
                    e);
            }
        }
        return TickDuration.of(total, resolution);
    }

    /**
     * Wide-character form of {@link #parse(CharSequence, Resolution)}. The array is read in place.
     */
    public static <R extends Resolution> TickDuration<R> parse(char[] text, R resolution) {
        Preconditions.checkNotNull(text, "text");
        return parse(CharBuffer.wrap(text), resolution);
    }

    /**
     * Narrow-character form of {@link #parse(CharSequence, Resolution)}: one byte per character, as in ASCII. The
     * array is read in place.
     */
    public static <R extends Resolution> TickDuration<R> parse(byte[] text, R resolution) {
        Preconditions.checkNotNull(text, "text");
        return parse(new AsciiString(text, false), resolution);
    }

    /**
     * Parses {@code text} into a tick count of {@code unit}.
     *
     * @throws IllegalArgumentException if {@code unit} is {@link TimeUnit#DAYS}
     */
    public static long parse(CharSequence text, TimeUnit unit) {
        return parse(text, Resolution.of(unit)).ticks();
    }

    /**
     * Parses {@code text} at nanosecond resolution into a {@link Duration}. The result is limited to the range of a
     * {@code long} nanosecond count, roughly 292 years either way.
     */
    public static Duration parseDuration(CharSequence text) {
        return Duration.ofNanos(parse(text, Resolution.NANOSECONDS).ticks());
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static void expectSecondLetter(CharSequence text, int pos, char expected) {
        if (pos + 1 >= text.length()) {
            throw new MalformedDurationException("Truncated unit '" + text.charAt(pos) + "'", text, pos + 1);
        }
        if (text.charAt(pos + 1) != expected) {
            throw new MalformedDurationException("Unknown unit '" + text.charAt(pos) + text.charAt(pos + 1) + "'",
                text, pos + 1);
        }
    }
}
