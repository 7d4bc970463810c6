package io.utxoiq.pulse.domain.alert;

/**
 * Transitions that leave the evaluation engine.
 * PENDING entries and exits are internal and never emitted.
 */
public enum TransitionKind {
    TRIGGERED,
    RESOLVED,
    RENOTIFY
}
