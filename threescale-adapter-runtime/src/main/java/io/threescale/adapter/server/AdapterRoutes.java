/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.server;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObject;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.QueryStringDecoder;

/**
 * Answers plain GET requests on the adapter port from a fixed table of paths.  Query strings
 * are ignored when matching.  Anything but GET is refused and the connection closed without
 * reading the request body.
 */
public class AdapterRoutes extends SimpleChannelInboundHandler<HttpObject> {

    private static final Logger LOGGER = LoggerFactory.getLogger(AdapterRoutes.class);

    private final Map<String, Function<HttpRequest, HttpResponse>> routes;

    AdapterRoutes(Map<String, Function<HttpRequest, HttpResponse>> routes) {
        this.routes = Map.copyOf(routes);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void channelRead0(ChannelHandlerContext ctx, HttpObject msg) {
        if (!(msg instanceof HttpRequest request)) {
            // bodies of GET requests carry nothing we use
            return;
        }
        boolean get = HttpMethod.GET.equals(request.method());
        HttpResponse response = get ? dispatch(request) : responseWithStatus(request, HttpResponseStatus.METHOD_NOT_ALLOWED);
        if (!get) {
            ctx.channel().config().setAutoRead(false);
            response.headers().set(HttpHeaderNames.ALLOW, HttpMethod.GET.name());
        }
        boolean keepAlive = get && HttpUtil.isKeepAlive(request);
        HttpUtil.setKeepAlive(response, keepAlive);
        var written = ctx.writeAndFlush(response);
        if (!keepAlive) {
            written.addListener(ChannelFutureListener.CLOSE);
        }
    }

    private HttpResponse dispatch(HttpRequest request) {
        String path = new QueryStringDecoder(request.uri()).path();
        var route = routes.get(path);
        if (route == null) {
            return responseWithStatus(request, HttpResponseStatus.NOT_FOUND);
        }
        try {
            return route.apply(request);
        }
        catch (RuntimeException e) {
            LOGGER.atError()
                    .setMessage("route {} failed")
                    .addArgument(path)
                    .setCause(e)
                    .log();
            return responseWithStatus(request, HttpResponseStatus.INTERNAL_SERVER_ERROR);
        }
    }

    /**
     * Builds a response whose body is the status' reason phrase.
     * @param request request being answered
     * @param status status
     * @return response
     */
    public static FullHttpResponse responseWithStatus(HttpRequest request, HttpResponseStatus status) {
        byte[] body = status.reasonPhrase().getBytes(StandardCharsets.UTF_8);
        FullHttpResponse response = new DefaultFullHttpResponse(request.protocolVersion(), status, Unpooled.wrappedBuffer(body));
        response.headers()
                .set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.TEXT_PLAIN)
                .setInt(HttpHeaderNames.CONTENT_LENGTH, body.length);
        return response;
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.warn("closing connection {} after error: {}", ctx.channel(), cause.toString());
        ctx.close();
    }

    public static class Builder {

        private final Map<String, Function<HttpRequest, HttpResponse>> routes = new HashMap<>();

        public Builder withRoute(String path, Function<HttpRequest, HttpResponse> responseFunction) {
            routes.put(path, responseFunction);
            return this;
        }

        public AdapterRoutes build() {
            return new AdapterRoutes(routes);
        }
    }
}
