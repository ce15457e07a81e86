/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VersionInfoTest {

    @Test
    void readsVersion() {
        VersionInfo info = VersionInfo.load(stream("threescale-adapter.version=2.3.4\n"));

        assertThat(info.version()).isEqualTo("2.3.4");
    }

    @Test
    void missingResource() {
        assertThat(VersionInfo.load(null).version()).isEqualTo(VersionInfo.UNDEFINED);
    }

    @Test
    void missingProperty() {
        assertThat(VersionInfo.load(stream("other=1\n")).version()).isEqualTo(VersionInfo.UNDEFINED);
    }

    @Test
    void unreadableResource() {
        InputStream broken = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("gone");
            }
        };

        assertThat(VersionInfo.load(broken).version()).isEqualTo(VersionInfo.UNDEFINED);
    }

    @Test
    void explicitVersion() {
        assertThat(VersionInfo.of("1.0.0")).hasToString("1.0.0");
    }

    private static InputStream stream(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }
}
