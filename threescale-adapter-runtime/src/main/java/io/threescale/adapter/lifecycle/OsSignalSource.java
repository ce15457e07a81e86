/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.lifecycle;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sun.misc.Signal;
import sun.misc.SignalHandler;

/**
 * Delivers SIGINT and SIGTERM.  While registered, these signals no longer terminate the JVM on
 * their own; the previous handlers are put back on {@link #close()}.
 * <br>
 * Shutdown hooks are not used: they only run once the JVM has already decided to exit.
 */
@SuppressWarnings("java:S1191") // sun.misc.Signal is the only way to intercept a signal without exiting
public class OsSignalSource implements SignalSource {

    private static final Logger LOGGER = LoggerFactory.getLogger(OsSignalSource.class);

    static final List<String> SIGNALS = List.of("INT", "TERM");

    private final Map<Signal, SignalHandler> previousHandlers = new LinkedHashMap<>();

    @Override
    public synchronized void register(Consumer<String> listener) {
        for (String name : SIGNALS) {
            Signal signal = new Signal(name);
            SignalHandler previous = Signal.handle(signal, s -> listener.accept("SIG" + s.getName()));
            previousHandlers.putIfAbsent(signal, previous);
            LOGGER.debug("Handling SIG{}", name);
        }
    }

    @Override
    public synchronized void close() {
        previousHandlers.forEach(Signal::handle);
        previousHandlers.clear();
    }
}
