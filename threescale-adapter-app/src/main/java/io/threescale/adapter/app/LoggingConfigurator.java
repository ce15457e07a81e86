/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.app;

import java.util.Locale;
import java.util.Map;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;

import io.threescale.adapter.config.Settings;
import io.threescale.adapter.tag.VisibleForTesting;

import static io.threescale.adapter.config.SettingNames.LOG_GRPC;
import static io.threescale.adapter.config.SettingNames.LOG_JSON;
import static io.threescale.adapter.config.SettingNames.LOG_LEVEL;

/**
 * Applies the logging settings to Log4j: the level, whether events are written as JSON and
 * whether the transport library may log at all.
 */
final class LoggingConfigurator {

    /**
     * System property consulted by {@code log4j2.xml} to choose the console appender.
     */
    static final String APPENDER_PROPERTY = "threescale.log.appender";
    static final String PLAIN_APPENDER = "PLAIN";
    static final String JSON_APPENDER = "JSON";

    static final String TRANSPORT_LOGGER = "io.netty";

    private static final Map<String, Level> LEVELS = Map.of(
            "debug", Level.DEBUG,
            "info", Level.INFO,
            "warn", Level.WARN,
            "error", Level.ERROR,
            "none", Level.OFF);

    private LoggingConfigurator() {
    }

    static void configure(Settings settings) {
        System.setProperty(APPENDER_PROPERTY, settings.getBool(LOG_JSON) ? JSON_APPENDER : PLAIN_APPENDER);
        Configurator.reconfigure();
        Configurator.setRootLevel(toLevel(settings.getString(LOG_LEVEL)));
        if (settings.isSet(LOG_GRPC) && !settings.getBool(LOG_GRPC)) {
            Configurator.setLevel(TRANSPORT_LOGGER, Level.OFF);
        }
    }

    /**
     * Unknown or absent names mean info.
     */
    @VisibleForTesting
    static Level toLevel(String name) {
        return LEVELS.getOrDefault(name.trim().toLowerCase(Locale.ROOT), Level.INFO);
    }
}
