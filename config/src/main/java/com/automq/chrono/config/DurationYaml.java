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

import com.google.common.base.Preconditions;
import java.io.Reader;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.introspector.BeanAccess;

/**
 * Loads YAML configuration beans whose duration fields are written in compound notation. Fields are accessed
 * directly, so defaults assigned in field initializers survive when a key is absent.
 */
public final class DurationYaml {
    private DurationYaml() {
    }

    public static <T> T loadAs(String yaml, Class<T> type) {
        Preconditions.checkNotNull(yaml, "yaml");
        return newYaml(type).loadAs(yaml, type);
    }

    public static <T> T loadAs(Reader reader, Class<T> type) {
        Preconditions.checkNotNull(reader, "reader");
        return newYaml(type).loadAs(reader, type);
    }

    private static Yaml newYaml(Class<?> type) {
        Preconditions.checkNotNull(type, "type");
        Yaml yaml = new Yaml(new DurationConstructor(type, new LoaderOptions()));
        yaml.setBeanAccess(BeanAccess.FIELD);
        return yaml;
    }
}
