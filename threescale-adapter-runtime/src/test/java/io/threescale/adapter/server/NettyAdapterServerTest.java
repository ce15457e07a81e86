/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.server;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.threescale.adapter.authorizer.Authorizer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(MockitoExtension.class)
class NettyAdapterServerTest {

    @Mock
    private Authorizer authorizer;

    private final HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    private NettyAdapterServer server;

    @BeforeEach
    void setUp() {
        server = NettyAdapterServer.create(new ListenAddress("localhost", 0), new AdapterConfig(authorizer, AdapterConfig.DEFAULT_KEEP_ALIVE_MAX_AGE), 0);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void livezAnswersOk() throws Exception {
        server.run();

        HttpResponse<String> response = client.send(request("/livez").GET().build(), HttpResponse.BodyHandlers.ofString());

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("OK");
    }

    @Test
    void queryStringIgnoredWhenRouting() throws Exception {
        server.run();

        HttpResponse<Void> response = client.send(request("/livez?verbose=true").GET().build(), HttpResponse.BodyHandlers.discarding());

        assertThat(response.statusCode()).isEqualTo(200);
    }

    @Test
    void unknownPath() throws Exception {
        server.run();

        HttpResponse<Void> response = client.send(request("/nope").GET().build(), HttpResponse.BodyHandlers.discarding());

        assertThat(response.statusCode()).isEqualTo(404);
    }

    @Test
    void onlyGetAllowed() throws Exception {
        server.run();

        HttpResponse<Void> response = client.send(request("/livez").POST(HttpRequest.BodyPublishers.noBody()).build(),
                HttpResponse.BodyHandlers.discarding());

        assertThat(response.statusCode()).isEqualTo(405);
        assertThat(response.headers().firstValue("Allow")).hasValue("GET");
    }

    @Test
    void closeCompletesRunNormally() throws Exception {
        CompletionStage<Void> running = server.run();

        server.close();

        assertThat(running.toCompletableFuture().get(10, TimeUnit.SECONDS)).isNull();
    }

    @Test
    void closeIsIdempotent() {
        server.close();
        server.close();

        assertThat(server.run().toCompletableFuture()).isCompleted();
    }

    @Test
    void addressInUse() {
        var inUse = new ListenAddress("localhost", server.localAddress().getPort());
        var config = new AdapterConfig(authorizer, Duration.ZERO);

        assertThatThrownBy(() -> NettyAdapterServer.create(inUse, config, 0))
                .isInstanceOf(AdapterServerException.class)
                .hasMessageStartingWith("failed to listen on localhost:");
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder(URI.create("http://localhost:" + server.localAddress().getPort() + path)).timeout(Duration.ofSeconds(5));
    }
}
