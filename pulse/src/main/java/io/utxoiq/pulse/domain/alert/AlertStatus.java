package io.utxoiq.pulse.domain.alert;

public enum AlertStatus {
    OK,
    PENDING,
    TRIGGERED
}
