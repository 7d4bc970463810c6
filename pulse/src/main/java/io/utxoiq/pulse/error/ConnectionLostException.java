package io.utxoiq.pulse.error;

/**
 * A client connection went away. Handled by local cleanup only.
 */
public class ConnectionLostException extends RuntimeException {

    private final String connectionId;

    public ConnectionLostException(String connectionId, Throwable cause) {
        super("Connection lost: " + connectionId, cause);
        this.connectionId = connectionId;
    }

    public String getConnectionId() {
        return connectionId;
    }
}
