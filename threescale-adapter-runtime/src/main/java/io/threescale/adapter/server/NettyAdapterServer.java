/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.server;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.ServerChannel;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.GlobalEventExecutor;

import io.threescale.adapter.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>{@link AdapterServer} built on Netty.</p>
 *
 * <p>The listener is bound when the server is created, so an unusable address is reported
 * before anything runs. Every accepted connection is closed once it reaches the configured
 * maximum age.</p>
 */
public final class NettyAdapterServer implements AdapterServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyAdapterServer.class);

    private static final int DEFAULT_SHUTDOWN_QUIET_PERIOD_SECONDS = 2;

    record EventGroupConfig(EventLoopGroup bossGroup, EventLoopGroup workerGroup, Class<? extends ServerChannel> clazz) {

        @SuppressWarnings("java:S1452") // wildcard generics expected, shutdownGracefully returns wildcard
        List<Future<?>> shutdownGracefully(int shutdownQuietPeriodSeconds) {
            return List.of(bossGroup.shutdownGracefully(shutdownQuietPeriodSeconds, 15, TimeUnit.SECONDS),
                    workerGroup.shutdownGracefully(shutdownQuietPeriodSeconds, 15, TimeUnit.SECONDS));
        }

        static EventGroupConfig build(String name) {
            // Specifying 0 threads means Netty's default, 2 * available cores or io.netty.eventLoopThreads.
            var ioHandlerFactory = NioIoHandler.newFactory();
            return new EventGroupConfig(
                    new MultiThreadIoEventLoopGroup(1, new DefaultThreadFactory(name + "-boss"), ioHandlerFactory),
                    new MultiThreadIoEventLoopGroup(0, new DefaultThreadFactory(name + "-worker"), ioHandlerFactory),
                    NioServerSocketChannel.class);
        }
    }

    private final EventGroupConfig eventGroup;
    private final ChannelGroup connections;
    private final Channel serverChannel;
    private final int shutdownQuietPeriodSeconds;
    private final AtomicBoolean closeRequested = new AtomicBoolean();
    private final CompletableFuture<Void> termination = new CompletableFuture<>();
    private @Nullable CompletableFuture<Void> running;

    private NettyAdapterServer(EventGroupConfig eventGroup, ChannelGroup connections, Channel serverChannel, int shutdownQuietPeriodSeconds) {
        this.eventGroup = eventGroup;
        this.connections = connections;
        this.serverChannel = serverChannel;
        this.shutdownQuietPeriodSeconds = shutdownQuietPeriodSeconds;
    }

    /**
     * Creates a server and binds its listener.
     * @param address where to listen
     * @param config adapter configuration
     * @return bound server, not yet reporting through {@link #run()}
     * @throws AdapterServerException if the address cannot be bound
     */
    public static NettyAdapterServer create(ListenAddress address, AdapterConfig config) {
        return create(address, config, DEFAULT_SHUTDOWN_QUIET_PERIOD_SECONDS);
    }

    @VisibleForTesting
    static NettyAdapterServer create(ListenAddress address, AdapterConfig config, int shutdownQuietPeriodSeconds) {
        Objects.requireNonNull(address);
        Objects.requireNonNull(config);
        var eventGroup = EventGroupConfig.build("adapter");
        var connections = new DefaultChannelGroup("adapter-connections", GlobalEventExecutor.INSTANCE);
        var bootstrap = new ServerBootstrap()
                .group(eventGroup.bossGroup(), eventGroup.workerGroup())
                .channel(eventGroup.clazz())
                .option(ChannelOption.SO_REUSEADDR, true)
                .childHandler(new AdapterInitializer(config, connections))
                .childOption(ChannelOption.TCP_NODELAY, true);
        LOGGER.info("Binding adapter listener: {}", address);
        var bindFuture = bootstrap.bind(address.toSocketAddress()).awaitUninterruptibly();
        if (!bindFuture.isSuccess()) {
            eventGroup.shutdownGracefully(0).forEach(Future::syncUninterruptibly);
            throw new AdapterServerException("failed to listen on " + address, bindFuture.cause());
        }
        return new NettyAdapterServer(eventGroup, connections, bindFuture.channel(), shutdownQuietPeriodSeconds);
    }

    public InetSocketAddress localAddress() {
        return (InetSocketAddress) serverChannel.localAddress();
    }

    @Override
    public synchronized CompletionStage<Void> run() {
        if (running == null) {
            running = termination;
            serverChannel.closeFuture().addListener((ChannelFutureListener) f -> ForkJoinPool.commonPool().execute(() -> {
                // complete off the Netty thread so that chained work doesn't run on the event loop
                if (!closeRequested.get()) {
                    termination.completeExceptionally(new AdapterServerException("adapter listener closed unexpectedly", f.cause()));
                }
            }));
            LOGGER.info("Adapter serving on {}", localAddress());
        }
        return running.minimalCompletionStage();
    }

    /**
     * Stops accepting connections, closes the open ones and releases the event loops.
     * Calling it again once stopped has no effect.
     */
    @Override
    public void close() {
        if (!closeRequested.compareAndSet(false, true)) {
            return;
        }
        try {
            serverChannel.close().syncUninterruptibly();
            connections.close().awaitUninterruptibly();
            eventGroup.shutdownGracefully(shutdownQuietPeriodSeconds).forEach(Future::syncUninterruptibly);
            LOGGER.info("Adapter listener stopped");
            termination.complete(null);
        }
        catch (RuntimeException e) {
            termination.completeExceptionally(e);
            throw new AdapterServerException("failed to stop adapter listener", e);
        }
    }
}
