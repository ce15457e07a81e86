/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;

import org.slf4j.LoggerFactory;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Build information embedded in {@code META-INF/metadata.properties} at packaging time.
 */
public interface VersionInfo {

    String UNDEFINED = "undefined";

    VersionInfo VERSION_INFO = load(Info.class.getClassLoader().getResourceAsStream("META-INF/metadata.properties"));

    String version();

    static VersionInfo of(@NonNull String version) {
        return new Info(version);
    }

    /**
     * Reads the build information, falling back to {@value #UNDEFINED} when it was never embedded.
     * @param resource properties, may be null
     * @return version info
     */
    static VersionInfo load(@Nullable InputStream resource) {
        if (resource == null) {
            return Info.UNDEFINED_VERSION_INFO;
        }
        try (resource) {
            Properties properties = new Properties();
            properties.load(resource);
            String version = properties.getProperty("threescale-adapter.version", "").trim();
            return version.isEmpty() ? Info.UNDEFINED_VERSION_INFO : new Info(version);
        }
        catch (IOException e) {
            LoggerFactory.getLogger(Info.class).warn("Failed to retrieve version information (ignored)", e);
            return Info.UNDEFINED_VERSION_INFO;
        }
    }

    final class Info implements VersionInfo {
        private static final Info UNDEFINED_VERSION_INFO = new Info(UNDEFINED);

        private final String version;

        private Info(@NonNull String version) {
            this.version = Objects.requireNonNull(version);
        }

        @Override
        public String version() {
            return version;
        }

        @Override
        public String toString() {
            return version;
        }
    }
}
