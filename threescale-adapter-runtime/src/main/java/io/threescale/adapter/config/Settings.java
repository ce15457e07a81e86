/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.config;

import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import io.threescale.adapter.tag.VisibleForTesting;

/**
 * <p>Immutable view of the adapter's settings, bound once at startup and handed to every resolver.</p>
 *
 * <p>A setting is either unset, in which case the typed getters return the zero value of their type,
 * or set to a raw string value, which may be empty. An empty value reads as the zero value of the
 * requested type, yet still counts as set. Callers that need to tell "absent" apart from
 * "present but false/zero/empty" must consult {@link #isSet(String)} first.</p>
 */
public final class Settings {

    /**
     * Prefix of the environment variables the settings are bound to.
     * The setting {@code listen_addr} is read from {@code THREESCALE_LISTEN_ADDR}.
     */
    public static final String ENV_PREFIX = "THREESCALE_";

    private static final Set<String> TRUE_VALUES = Set.of("1", "t", "T", "TRUE", "true", "True");
    private static final Set<String> FALSE_VALUES = Set.of("0", "f", "F", "FALSE", "false", "False");

    private final Map<String, String> values;

    private Settings(Map<String, String> values) {
        this.values = Map.copyOf(values);
    }

    /**
     * Creates settings from explicit name/value pairs.
     * @param values setting values keyed by setting name
     * @return settings
     */
    public static Settings of(Map<String, String> values) {
        Objects.requireNonNull(values);
        return new Settings(values);
    }

    public static Settings empty() {
        return new Settings(Map.of());
    }

    /**
     * Binds the known settings to the process environment.
     * @return settings
     */
    public static Settings fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    @VisibleForTesting
    static Settings fromEnvironment(Map<String, String> environment) {
        var bound = new HashMap<String, String>();
        for (String name : SettingNames.ALL) {
            String value = environment.get(environmentVariableName(name));
            if (value != null) {
                bound.put(name, value);
            }
        }
        return new Settings(bound);
    }

    public static String environmentVariableName(String name) {
        return ENV_PREFIX + name.toUpperCase(Locale.ROOT);
    }

    public boolean isSet(String name) {
        return values.containsKey(name);
    }

    public String getString(String name) {
        return values.getOrDefault(name, "");
    }

    public int getInt(String name) {
        String value = values.get(name);
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e) {
            throw new IllegalConfigurationException("setting " + name + " must be an integer, but was '" + value + "'", e);
        }
    }

    public boolean getBool(String name) {
        String value = values.get(name);
        if (value == null || value.isBlank()) {
            return false;
        }
        String trimmed = value.trim();
        if (TRUE_VALUES.contains(trimmed)) {
            return true;
        }
        if (FALSE_VALUES.contains(trimmed)) {
            return false;
        }
        throw new IllegalConfigurationException("setting " + name + " must be a boolean, but was '" + value + "'");
    }

    /**
     * Reads an integer setting as a number of seconds.
     * @param name setting name
     * @return duration, {@link Duration#ZERO} if unset
     */
    public Duration getSeconds(String name) {
        return Duration.ofSeconds(getInt(name));
    }

    @Override
    public String toString() {
        return "Settings" + values.keySet();
    }
}
