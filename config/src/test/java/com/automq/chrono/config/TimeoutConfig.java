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

import java.time.Duration;

@SuppressWarnings({"FieldMayBeFinal", "FieldCanBeLocal"})
public class TimeoutConfig {
    private String name;

    // lock expire time, default is 15min.
    private Duration lockExpireTime = Duration.ofMinutes(15);

    private Duration channelExpiredTimeout = Duration.ofSeconds(120);

    private Duration networkRtt = Duration.ofMillis(100);

    private final StoreTimeoutConfig store;

    public TimeoutConfig() {
        this.store = new StoreTimeoutConfig();
    }

    public String name() {
        return name;
    }

    public Duration lockExpireTime() {
        return lockExpireTime;
    }

    public Duration channelExpiredTimeout() {
        return channelExpiredTimeout;
    }

    public Duration networkRtt() {
        return networkRtt;
    }

    public StoreTimeoutConfig store() {
        return store;
    }
}
