package io.utxoiq.pulse.transport.http;

import io.utxoiq.pulse.service.ratelimit.ClientIdentity;
import io.undertow.server.HttpServerExchange;

import java.net.InetSocketAddress;
import java.util.function.Function;

/**
 * Decides which rate-limit bucket a request is charged to: a valid bearer token's
 * user, then an API key, then the remote address.
 */
public final class ClientIdentityResolver {

    private final Function<String, String> tokenValidator;

    public ClientIdentityResolver(Function<String, String> tokenValidator) {
        this.tokenValidator = tokenValidator;
    }

    public ClientIdentity resolve(HttpServerExchange exchange) {
        return resolve(HttpResponses.extractBearer(exchange),
            exchange.getRequestHeaders().getFirst(IntakeHandler.API_KEY_HEADER),
            remoteAddress(exchange.getSourceAddress()));
    }

    public ClientIdentity resolve(String bearerToken, String apiKey, String remoteAddress) {
        if (bearerToken != null) {
            String userId = tokenValidator.apply(bearerToken);
            if (userId != null) {
                return ClientIdentity.user(userId);
            }
        }
        if (apiKey != null && !apiKey.isBlank()) {
            return ClientIdentity.apiKey(apiKey);
        }
        return ClientIdentity.anonymous(remoteAddress);
    }

    static String remoteAddress(InetSocketAddress address) {
        if (address == null) {
            return null;
        }
        return address.getAddress() != null ? address.getAddress().getHostAddress() : address.getHostString();
    }
}
