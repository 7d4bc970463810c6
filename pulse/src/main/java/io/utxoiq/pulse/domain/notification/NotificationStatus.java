package io.utxoiq.pulse.domain.notification;

public enum NotificationStatus {
    PENDING,
    SENT,
    FAILED,
    SUPPRESSED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
