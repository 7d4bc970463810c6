package io.utxoiq.pulse.transport.http;

import io.utxoiq.pulse.service.ratelimit.ClientIdentity;
import io.utxoiq.pulse.service.ratelimit.RateLimitDecision;
import io.utxoiq.pulse.service.ratelimit.RateLimitPolicy;
import io.utxoiq.pulse.service.ratelimit.TokenBucketRateLimiter;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Token-bucket gate in front of the API routes.
 *
 * Permitted requests carry {@code X-RateLimit-Limit} and {@code X-RateLimit-Remaining};
 * denied ones get 429 with {@code Retry-After} in whole seconds.
 */
public final class RateLimitHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(RateLimitHandler.class);

    static final HttpString LIMIT = HttpString.tryFromString("X-RateLimit-Limit");
    static final HttpString REMAINING = HttpString.tryFromString("X-RateLimit-Remaining");

    private final HttpHandler next;
    private final TokenBucketRateLimiter limiter;
    private final ClientIdentityResolver identities;

    public RateLimitHandler(HttpHandler next, TokenBucketRateLimiter limiter, ClientIdentityResolver identities) {
        this.next = next;
        this.limiter = limiter;
        this.identities = identities;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        // Handlers below talk to the database.
        if (exchange.isInIoThread()) {
            exchange.dispatch(this);
            return;
        }

        ClientIdentity identity = identities.resolve(exchange);
        RateLimitDecision decision = limiter.allow(identity);
        RateLimitPolicy policy = limiter.policyFor(identity.kind());
        exchange.getResponseHeaders().put(LIMIT, policy.capacity());

        if (!decision.permitted()) {
            long retryAfter = Math.max(1, (decision.retryAfter().toMillis() + 999) / 1000);
            log.debug("Rate limited {} on {}, retry after {}s", identity.bucketKey(), exchange.getRequestPath(),
                retryAfter);
            exchange.setStatusCode(StatusCodes.TOO_MANY_REQUESTS);
            exchange.getResponseHeaders().put(REMAINING, 0);
            exchange.getResponseHeaders().put(Headers.RETRY_AFTER, retryAfter);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
            exchange.getResponseSender().send("{\"error\":\"Rate limit exceeded\",\"retry_after\":" + retryAfter + "}");
            return;
        }

        exchange.getResponseHeaders().put(REMAINING, decision.remaining());
        next.handleRequest(exchange);
    }
}
