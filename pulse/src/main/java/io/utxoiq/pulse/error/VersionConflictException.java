package io.utxoiq.pulse.error;

/**
 * Optimistic concurrency failure on an alert configuration write.
 */
public class VersionConflictException extends RuntimeException {

    private final String alertId;
    private final long expectedVersion;
    private final long actualVersion;

    public VersionConflictException(String alertId, long expectedVersion, long actualVersion) {
        super(String.format("Alert %s: expected version %d but found %d", alertId, expectedVersion, actualVersion));
        this.alertId = alertId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getAlertId() {
        return alertId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
