/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.lifecycle;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionException;
import java.util.concurrent.LinkedBlockingQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.util.concurrent.DefaultThreadFactory;

import io.threescale.adapter.ResolvedConfig;
import io.threescale.adapter.VersionInfo;
import io.threescale.adapter.authorizer.Authorizer;
import io.threescale.adapter.authorizer.AuthorizerManager;
import io.threescale.adapter.config.Settings;
import io.threescale.adapter.server.AdapterConfig;
import io.threescale.adapter.server.AdapterServer;
import io.threescale.adapter.server.ListenAddress;
import io.threescale.adapter.server.NettyAdapterServer;
import io.threescale.adapter.tag.RunsOnThread;

import edu.umd.cs.findbugs.annotations.Nullable;

import static io.threescale.adapter.config.SettingNames.GRPC_CONN_MAX_SECONDS;
import static io.threescale.adapter.config.SettingNames.LISTEN_ADDR;

/**
 * <p>Supervises one run of the adapter: builds the authorizer and the server, runs the server in the
 * background and waits until either a signal or the server's own termination ends the run.</p>
 *
 * <p>Both triggers feed a single queue that only the controlling thread consumes, so exactly one
 * reaction runs at a time. A signal shuts the authorizer down and then closes the server; the run
 * then continues until the server reports its termination. A clean termination ends the run
 * normally; a termination with an error, or a failed close, ends it with a {@link LifecycleException}.
 * A further signal during shutdown is handled like the first.</p>
 */
public class LifecycleController {

    private static final Logger LOGGER = LoggerFactory.getLogger(LifecycleController.class);
    private static final Logger STARTUP_SHUTDOWN_LOGGER = LoggerFactory.getLogger("io.threescale.adapter.StartupShutdownLogger");

    /**
     * Builds the authorizer from the resolved startup configuration.
     */
    @FunctionalInterface
    public interface AuthorizerFactory {
        Authorizer create(ResolvedConfig resolved);
    }

    /**
     * Builds the adapter server.
     */
    @FunctionalInterface
    public interface AdapterServerFactory {
        AdapterServer create(ListenAddress address, AdapterConfig config);
    }

    private final Settings settings;
    private final ResolvedConfig resolved;
    private final AuthorizerFactory authorizerFactory;
    private final AdapterServerFactory serverFactory;
    private final SignalSource signalSource;
    private final VersionInfo versionInfo;
    private final BlockingQueue<ShutdownEvent> events = new LinkedBlockingQueue<>();
    private volatile LifecycleState state = LifecycleState.STARTING;

    public LifecycleController(Settings settings, ResolvedConfig resolved, VersionInfo versionInfo) {
        this(settings, resolved, LifecycleController::newAuthorizer, NettyAdapterServer::create, new OsSignalSource(), versionInfo);
    }

    public LifecycleController(Settings settings,
                               ResolvedConfig resolved,
                               AuthorizerFactory authorizerFactory,
                               AdapterServerFactory serverFactory,
                               SignalSource signalSource,
                               VersionInfo versionInfo) {
        this.settings = Objects.requireNonNull(settings);
        this.resolved = Objects.requireNonNull(resolved);
        this.authorizerFactory = Objects.requireNonNull(authorizerFactory);
        this.serverFactory = Objects.requireNonNull(serverFactory);
        this.signalSource = Objects.requireNonNull(signalSource);
        this.versionInfo = Objects.requireNonNull(versionInfo);
    }

    private static Authorizer newAuthorizer(ResolvedConfig resolved) {
        return new AuthorizerManager(resolved.client(), resolved.systemCache(), resolved.backendConfig(), resolved.metricsReporter());
    }

    public LifecycleState state() {
        return state;
    }

    /**
     * Runs the adapter until it stops.
     * @throws LifecycleException if the server cannot be started, ends with an error or cannot be closed
     */
    public void run() {
        try {
            supervise();
        }
        catch (RuntimeException e) {
            state = LifecycleState.FATAL;
            throw e;
        }
        finally {
            signalSource.close();
        }
    }

    private void supervise() {
        ListenAddress address = ListenAddress.parse(settings.isSet(LISTEN_ADDR) ? settings.getString(LISTEN_ADDR) : ListenAddress.DEFAULT);
        Duration keepAliveMaxAge = AdapterConfig.DEFAULT_KEEP_ALIVE_MAX_AGE;
        if (settings.isSet(GRPC_CONN_MAX_SECONDS)) {
            keepAliveMaxAge = settings.getSeconds(GRPC_CONN_MAX_SECONDS);
        }

        Authorizer authorizer = authorizerFactory.create(resolved);
        AdapterServer server;
        try {
            server = serverFactory.create(address, new AdapterConfig(authorizer, keepAliveMaxAge));
        }
        catch (RuntimeException e) {
            throw new LifecycleException("Unable to start server: " + e.getMessage(), e);
        }

        signalSource.register(name -> events.add(new ShutdownEvent.OsSignal(name)));
        launch(server);
        state = LifecycleState.RUNNING;

        while (true) {
            ShutdownEvent event = nextEvent();
            if (event instanceof ShutdownEvent.OsSignal signal) {
                state = LifecycleState.SHUTTING_DOWN;
                STARTUP_SHUTDOWN_LOGGER.info("{} received. Attempting graceful shutdown", signal.name());
                authorizer.shutdown();
                try {
                    server.close();
                }
                catch (Exception e) {
                    throw new LifecycleException("Error calling graceful shutdown", e);
                }
            }
            else if (event instanceof ShutdownEvent.ServerTerminated terminated) {
                if (terminated.error() != null) {
                    throw new LifecycleException("server has shut down: " + terminated.error().getMessage(), terminated.error());
                }
                STARTUP_SHUTDOWN_LOGGER.info("server has shut down gracefully");
                state = LifecycleState.STOPPED;
                return;
            }
        }
    }

    private void launch(AdapterServer server) {
        Thread serving = new DefaultThreadFactory("adapter-server", true).newThread(() -> serve(server));
        serving.start();
    }

    @RunsOnThread("adapter-server")
    private void serve(AdapterServer server) {
        STARTUP_SHUTDOWN_LOGGER.info("Starting server version {}", versionInfo.version());
        try {
            server.run().whenComplete((ignored, t) -> events.add(new ShutdownEvent.ServerTerminated(unwrap(t))));
        }
        catch (RuntimeException e) {
            events.add(new ShutdownEvent.ServerTerminated(e));
        }
    }

    private ShutdownEvent nextEvent() {
        try {
            ShutdownEvent event = events.take();
            LOGGER.debug("Lifecycle event {} in state {}", event, state);
            return event;
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LifecycleException("interrupted while waiting for the server", e);
        }
    }

    @Nullable
    private static Throwable unwrap(@Nullable Throwable t) {
        if (t instanceof CompletionException && t.getCause() != null) {
            return t.getCause();
        }
        return t;
    }
}
