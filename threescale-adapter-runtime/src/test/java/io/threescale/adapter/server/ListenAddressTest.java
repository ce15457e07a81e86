/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.server;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import io.threescale.adapter.config.IllegalConfigurationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ListenAddressTest {

    @Test
    void barePort() {
        assertThat(ListenAddress.parse("3333")).isEqualTo(new ListenAddress(null, 3333));
    }

    @Test
    void portWithEmptyHost() {
        assertThat(ListenAddress.parse(":8090")).isEqualTo(new ListenAddress(null, 8090));
    }

    @Test
    void hostAndPort() {
        assertThat(ListenAddress.parse("localhost:3333")).isEqualTo(new ListenAddress("localhost", 3333));
    }

    @Test
    void ipv6HostAndPort() {
        assertThat(ListenAddress.parse("[::1]:3333")).isEqualTo(new ListenAddress("::1", 3333));
    }

    @Test
    void defaultBindsAllInterfaces() {
        ListenAddress address = ListenAddress.parse(ListenAddress.DEFAULT);

        assertThat(address.toSocketAddress().getAddress().isAnyLocalAddress()).isTrue();
        assertThat(address.toSocketAddress().getPort()).isEqualTo(3333);
    }

    @Test
    void printsInParseableForm() {
        assertThat(new ListenAddress(null, 3333)).hasToString(":3333");
        assertThat(new ListenAddress("::1", 3333)).hasToString("[::1]:3333");
        assertThat(ListenAddress.parse(new ListenAddress("::1", 3333).toString())).isEqualTo(new ListenAddress("::1", 3333));
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "localhost", "localhost:", "::1", "host:port", "[::1]:x" })
    void rejectsMalformed(String address) {
        assertThatThrownBy(() -> ListenAddress.parse(address))
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessageContaining("unexpected listen address");
    }

    @Test
    void rejectsPortOutOfRange() {
        assertThatThrownBy(() -> ListenAddress.parse("65536"))
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessageContaining("out of range");
    }
}
