/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.server;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.regex.Pattern;

import io.threescale.adapter.config.IllegalConfigurationException;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Address the adapter server listens on.
 *
 * @param host interface to bind, or null for all interfaces
 * @param port port number
 */
public record ListenAddress(@Nullable String host, int port) {

    public static final String DEFAULT = "3333";

    @SuppressWarnings("java:S5852") // regex not vulnerable to DOS as it is used only for configuration, not uncontrolled input
    private static final Pattern IPV6_WITH_PORT = Pattern.compile("^\\[(.+)]:(.+)$");

    public ListenAddress {
        if (port < 0 || port > 65535) {
            throw new IllegalConfigurationException("listen port " + port + " is out of range");
        }
    }

    /**
     * Parses a listen address.  A bare port ({@code 3333}) or a port with an empty host
     * ({@code :3333}) binds all interfaces; {@code host:3333} and {@code [::1]:3333} bind the given host.
     *
     * @param address address
     * @return listen address
     */
    public static ListenAddress parse(@NonNull String address) {
        Objects.requireNonNull(address);
        var exceptionText = ("unexpected listen address '%s'."
                + " Valid formations are '3333', ':3333', 'host:3333' or '[::1]:3333'").formatted(address);
        String trimmed = address.trim();

        var ipv6Match = IPV6_WITH_PORT.matcher(trimmed);
        if (ipv6Match.matches()) {
            return new ListenAddress(ipv6Match.group(1), parsePort(exceptionText, ipv6Match.group(2)));
        }
        int separator = trimmed.lastIndexOf(':');
        if (separator < 0) {
            return new ListenAddress(null, parsePort(exceptionText, trimmed));
        }
        String host = trimmed.substring(0, separator);
        if (host.contains(":")) {
            throw new IllegalConfigurationException(exceptionText);
        }
        return new ListenAddress(host.isBlank() ? null : host, parsePort(exceptionText, trimmed.substring(separator + 1)));
    }

    private static int parsePort(String exceptionText, String port) {
        try {
            return Integer.parseInt(port);
        }
        catch (NumberFormatException nfe) {
            throw new IllegalConfigurationException(exceptionText, nfe);
        }
    }

    public InetSocketAddress toSocketAddress() {
        return host == null ? new InetSocketAddress(port) : new InetSocketAddress(host, port);
    }

    @Override
    public String toString() {
        if (host == null) {
            return ":" + port;
        }
        return (host.contains(":") ? "[" + host + "]" : host) + ":" + port;
    }
}
