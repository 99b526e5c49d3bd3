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
import com.automq.chrono.util.DurationParser;
import com.google.common.collect.ImmutableMap;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.introspector.Property;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeId;
import org.yaml.snakeyaml.nodes.ScalarNode;

/**
 * SnakeYAML constructor that binds compound duration strings, e.g. {@code lockExpireTime: 15m}, to
 * {@link Duration} and {@link TickDuration} properties.
 * <p>
 * A {@link TickDuration} property is bound at the resolution named by its type argument, so
 * {@code TickDuration<Resolution.Seconds>} receives seconds. Raw, wildcard and {@code TickDuration<Resolution>}
 * properties receive nanoseconds. {@code TickDuration<Resolution.Ratio>} cannot be bound because the type does not
 * name a ratio.
 * <p>
 * Like every SnakeYAML constructor, instances are not thread-safe.
 */
public class DurationConstructor extends Constructor {
    private static final Logger LOGGER = LoggerFactory.getLogger(DurationConstructor.class);

    private static final Map<Class<?>, Resolution> RESOLUTIONS = ImmutableMap.<Class<?>, Resolution>builder()
        .put(Resolution.class, Resolution.NANOSECONDS)
        .put(Resolution.Nanoseconds.class, Resolution.NANOSECONDS)
        .put(Resolution.Microseconds.class, Resolution.MICROSECONDS)
        .put(Resolution.Milliseconds.class, Resolution.MILLISECONDS)
        .put(Resolution.Seconds.class, Resolution.SECONDS)
        .put(Resolution.Minutes.class, Resolution.MINUTES)
        .put(Resolution.Hours.class, Resolution.HOURS)
        .build();

    // Type argument of the TickDuration property whose value is constructed next, null when undeclared.
    private Class<?> pendingResolutionType;

    public DurationConstructor(Class<?> rootType, LoaderOptions options) {
        super(rootType, options);
        this.yamlClassConstructors.put(NodeId.scalar, new ConstructDurationScalar());
        this.yamlClassConstructors.put(NodeId.mapping, new ConstructDurationMapping());
    }

    private class ConstructDurationMapping extends ConstructMapping {
        @Override
        protected Property getProperty(Class<?> type, String name) {
            Property property = super.getProperty(type, name);
            pendingResolutionType = null;
            if (property.getType() == TickDuration.class) {
                Class<?>[] arguments = property.getActualTypeArguments();
                if (arguments != null && arguments.length == 1) {
                    pendingResolutionType = arguments[0];
                }
            }
            return property;
        }
    }

    private class ConstructDurationScalar extends ConstructScalar {
        @Override
        public Object construct(Node node) {
            Class<?> type = node.getType();
            if (type != Duration.class && type != TickDuration.class) {
                return super.construct(node);
            }

            String value = ((ScalarNode) node).getValue();
            try {
                Object result = type == Duration.class
                    ? DurationParser.parseDuration(value)
                    : DurationParser.parse(value, takeResolution(node));
                LOGGER.debug("Bound duration '{}' to {}", value, result);
                return result;
            } catch (MalformedDurationException e) {
                LOGGER.warn("Rejected duration '{}'{}", value, node.getStartMark());
                throw new YAMLException("Invalid duration '" + value + "'" + node.getStartMark(), e);
            }
        }

        private Resolution takeResolution(Node node) {
            Class<?> resolutionType = pendingResolutionType;
            pendingResolutionType = null;
            if (resolutionType == null) {
                return Resolution.NANOSECONDS;
            }
            Resolution resolution = RESOLUTIONS.get(resolutionType);
            if (resolution == null) {
                LOGGER.warn("No fixed resolution for {}{}", resolutionType.getName(), node.getStartMark());
                throw new YAMLException("Cannot bind a duration at resolution " + resolutionType.getName()
                    + "; declare a standard resolution such as Resolution.Seconds" + node.getStartMark());
            }
            return resolution;
        }
    }
}
