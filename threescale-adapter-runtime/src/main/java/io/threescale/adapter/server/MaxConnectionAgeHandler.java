/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.server;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.concurrent.ScheduledFuture;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Closes a connection once it has been open for the configured maximum age, forcing clients
 * to reconnect and so spreading load across replicas.
 */
public class MaxConnectionAgeHandler extends ChannelInboundHandlerAdapter {

    private static final Logger LOGGER = LoggerFactory.getLogger(MaxConnectionAgeHandler.class);

    private final long maxAgeNanos;
    private @Nullable ScheduledFuture<?> expiry;

    public MaxConnectionAgeHandler(Duration maxAge) {
        this.maxAgeNanos = maxAge.toNanos();
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        if (ctx.channel().isActive()) {
            schedule(ctx);
        }
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        schedule(ctx);
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        cancel();
        super.channelInactive(ctx);
    }

    @Override
    public void handlerRemoved(ChannelHandlerContext ctx) {
        cancel();
    }

    private void schedule(ChannelHandlerContext ctx) {
        if (expiry != null || maxAgeNanos <= 0) {
            return;
        }
        expiry = ctx.executor().schedule(() -> {
            LOGGER.debug("Closing connection {} having reached its maximum age", ctx.channel());
            ctx.close();
        }, maxAgeNanos, TimeUnit.NANOSECONDS);
    }

    private void cancel() {
        if (expiry != null) {
            expiry.cancel(false);
            expiry = null;
        }
    }
}
