/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.server;

import java.util.Objects;

import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.group.ChannelGroup;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpServerExpectContinueHandler;

/**
 * Builds the pipeline of each accepted connection.
 */
public class AdapterInitializer extends ChannelInitializer<Channel> {

    static final String LIVEZ = "/livez";

    private final AdapterConfig config;
    private final ChannelGroup connections;

    public AdapterInitializer(AdapterConfig config, ChannelGroup connections) {
        this.config = Objects.requireNonNull(config);
        this.connections = Objects.requireNonNull(connections);
    }

    @Override
    public void initChannel(Channel ch) {
        connections.add(ch);
        ChannelPipeline p = ch.pipeline();
        p.addLast(new MaxConnectionAgeHandler(config.keepAliveMaxAge()));
        p.addLast(new HttpServerCodec());
        p.addLast(new HttpServerExpectContinueHandler());
        p.addLast(AdapterRoutes.builder()
                .withRoute(LIVEZ, httpRequest -> AdapterRoutes.responseWithStatus(httpRequest, HttpResponseStatus.OK))
                .build());
    }
}
