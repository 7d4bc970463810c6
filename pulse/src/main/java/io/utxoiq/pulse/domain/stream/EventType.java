package io.utxoiq.pulse.domain.stream;

/**
 * Frame types pushed to live clients.
 */
public enum EventType {
    // ═══════════════════════════════════════════════════════════════
    // DATA EVENTS (sequenced per topic, replayable)
    // ═══════════════════════════════════════════════════════════════

    SIGNAL,
    INSIGHT,
    ALERT_TRIGGERED,
    ALERT_RESOLVED,
    ALERT_RENOTIFY,
    ALERT_DELIVERY_FAILED,

    // ═══════════════════════════════════════════════════════════════
    // CONTROL FRAMES (unsequenced, per connection)
    // ═══════════════════════════════════════════════════════════════

    ACK,
    ERROR,
    PONG,
    HEARTBEAT,
    DROPPED,
    GAP;

    public boolean isControl() {
        return ordinal() >= ACK.ordinal();
    }
}
