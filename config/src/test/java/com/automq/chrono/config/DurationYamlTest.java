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

package com.automq.chrono.config;

import com.automq.chrono.Resolution;
import com.automq.chrono.TickDuration;
import com.automq.chrono.exception.MalformedDurationException;
import com.google.common.base.Throwables;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.error.YAMLException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DurationYamlTest {
    private static final String CONFIG_STR = """
        name: proxy1
        lockExpireTime: 1h30m
        networkRtt: 250ms
        store:
          maxFetchTime: 1s500ms
          transactionTimeout: -1m
          fetchPause: 10us5ns
        """;

    @Test
    void load() {
        TimeoutConfig config = DurationYaml.loadAs(CONFIG_STR, TimeoutConfig.class);
        assertEquals("proxy1", config.name());
        assertEquals(Duration.ofMinutes(90), config.lockExpireTime());
        assertEquals(Duration.ofMillis(250), config.networkRtt());
        assertEquals(Duration.ofMillis(1500), config.store().maxFetchTime());
        assertEquals(Duration.ofMinutes(-1), config.store().transactionTimeout());
        assertEquals(TickDuration.of(10_005, Resolution.NANOSECONDS), config.store().fetchPause());

        // Default value kept.
        assertEquals(Duration.ofSeconds(120), config.channelExpiredTimeout());
    }

    @Test
    void loadFromReader() throws Exception {
        try (Reader reader = new InputStreamReader(
            DurationYamlTest.class.getResourceAsStream("/timeout-config.yaml"), StandardCharsets.UTF_8)) {
            TimeoutConfig config = DurationYaml.loadAs(reader, TimeoutConfig.class);
            assertEquals("broker1", config.name());
            assertEquals(Duration.ofMinutes(15), config.lockExpireTime());
            assertEquals(Duration.ofSeconds(2), config.channelExpiredTimeout());
            assertNotNull(config.store());
            assertEquals(Duration.ofSeconds(10), config.store().maxFetchTime());
        }
    }

    @Test
    void malformedDuration() {
        String yaml = """
            name: proxy1
            lockExpireTime: 15min
            """;
        YAMLException e = assertThrows(YAMLException.class, () -> DurationYaml.loadAs(yaml, TimeoutConfig.class));
        MalformedDurationException cause = assertInstanceOf(MalformedDurationException.class,
            Throwables.getRootCause(e));
        assertEquals("15min", cause.getInput());
        assertEquals(3, cause.getErrorIndex());
        assertTrue(Throwables.getCausalChain(e).stream()
            .anyMatch(t -> t.getMessage() != null && t.getMessage().contains("line 2")));
    }

    @Test
    void tickDurationKeepsDeclaredResolution() {
        String yaml = """
            store:
              retentionCheckInterval: 1m5s
              retentionTime: 2h59m
            """;
        TimeoutConfig config = DurationYaml.loadAs(yaml, TimeoutConfig.class);
        TickDuration<Resolution.Seconds> interval = config.store().retentionCheckInterval();
        assertEquals(65, interval.ticks());
        Resolution.Seconds seconds = interval.resolution();
        assertSame(Resolution.SECONDS, seconds);

        // Truncated toward zero at the declared resolution.
        TickDuration<Resolution.Hours> retention = config.store().retentionTime();
        assertEquals(2, retention.ticks());
        Resolution.Hours hours = retention.resolution();
        assertSame(Resolution.HOURS, hours);

        // Default value kept.
        assertEquals(TickDuration.zero(Resolution.NANOSECONDS), config.store().fetchPause());
    }

    @Test
    void ratioResolutionIsRejected() {
        String yaml = """
            pollInterval: 5s
            """;
        YAMLException e = assertThrows(YAMLException.class, () -> DurationYaml.loadAs(yaml, RatioConfig.class));
        assertTrue(Throwables.getCausalChain(e).stream()
            .anyMatch(t -> t.getMessage() != null && t.getMessage().contains("Resolution$Ratio")));
    }

    @Test
    void plainNumberIsNotADuration() {
        String yaml = """
            lockExpireTime: 900
            """;
        assertThrows(YAMLException.class, () -> DurationYaml.loadAs(yaml, TimeoutConfig.class));
    }

    @SuppressWarnings("FieldMayBeFinal")
    public static class RatioConfig {
        private TickDuration<Resolution.Ratio> pollInterval;
    }
}
