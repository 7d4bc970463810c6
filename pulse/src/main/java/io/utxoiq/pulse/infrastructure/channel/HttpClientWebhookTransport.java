package io.utxoiq.pulse.infrastructure.channel;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Blocking HTTP transport for chat webhooks. Runs on the channel's delivery worker.
 */
public final class HttpClientWebhookTransport implements WebhookTransport {
    private final HttpClient client;
    private final Duration requestTimeout;

    public HttpClientWebhookTransport(Duration requestTimeout) {
        this(HttpClient.newBuilder().connectTimeout(requestTimeout).build(), requestTimeout);
    }

    public HttpClientWebhookTransport(HttpClient client, Duration requestTimeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    @Override
    public int post(URI uri, String jsonPayload) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(requestTimeout)
            .header("Content-Type", "application/json; charset=utf-8")
            .POST(HttpRequest.BodyPublishers.ofString(jsonPayload, StandardCharsets.UTF_8))
            .build();

        return client.send(request, HttpResponse.BodyHandlers.discarding()).statusCode();
    }
}
