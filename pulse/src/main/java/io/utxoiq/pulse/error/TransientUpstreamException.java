package io.utxoiq.pulse.error;

/**
 * A collaborator (channel provider, store) failed in a way that may succeed on retry.
 */
public class TransientUpstreamException extends RuntimeException {

    private final String upstream;

    public TransientUpstreamException(String upstream, String message) {
        super(String.format("[%s] %s", upstream, message));
        this.upstream = upstream;
    }

    public TransientUpstreamException(String upstream, String message, Throwable cause) {
        super(String.format("[%s] %s", upstream, message), cause);
        this.upstream = upstream;
    }

    public String getUpstream() {
        return upstream;
    }
}
