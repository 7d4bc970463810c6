package io.utxoiq.pulse.infrastructure.channel;

import java.net.URI;

/**
 * Transport hook for webhook delivery.
 */
@FunctionalInterface
public interface WebhookTransport {
    /**
     * @return HTTP status code of the response
     */
    int post(URI uri, String jsonPayload) throws Exception;
}
