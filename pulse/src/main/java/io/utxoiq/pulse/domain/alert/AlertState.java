package io.utxoiq.pulse.domain.alert;

import io.utxoiq.pulse.domain.signal.SignalSample;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Evaluation state for one enabled alert configuration.
 *
 * Not thread-safe. Owned by exactly one evaluation shard; other threads only
 * ever see {@link #snapshot()} copies.
 */
public final class AlertState {
    private final String alertId;
    private final Deque<SignalSample> windowBuffer = new ArrayDeque<>();

    private AlertStatus status = AlertStatus.OK;
    private Instant pendingSince;
    private Instant lastTransitionAt;
    private Instant lastNotifiedAt;
    private int samplesSinceNotified;
    private int consecutiveBreaches;
    private SignalSample lastSample;

    public AlertState(String alertId) {
        this.alertId = alertId;
    }

    public String getAlertId() {
        return alertId;
    }

    public AlertStatus getStatus() {
        return status;
    }

    public Deque<SignalSample> getWindowBuffer() {
        return windowBuffer;
    }

    public Instant getPendingSince() {
        return pendingSince;
    }

    public Instant getLastTransitionAt() {
        return lastTransitionAt;
    }

    public Instant getLastNotifiedAt() {
        return lastNotifiedAt;
    }

    public int getSamplesSinceNotified() {
        return samplesSinceNotified;
    }

    public int getConsecutiveBreaches() {
        return consecutiveBreaches;
    }

    public void countBreach() {
        consecutiveBreaches++;
    }

    public SignalSample getLastSample() {
        return lastSample;
    }

    public void setLastSample(SignalSample lastSample) {
        this.lastSample = lastSample;
    }

    public void moveTo(AlertStatus next, Instant at) {
        if (next != status) {
            status = next;
            lastTransitionAt = at;
        }
        if (next == AlertStatus.PENDING && pendingSince == null) {
            pendingSince = at;
        }
        if (next == AlertStatus.OK) {
            pendingSince = null;
            consecutiveBreaches = 0;
        }
    }

    public void markNotified(Instant at) {
        lastNotifiedAt = at;
        samplesSinceNotified = 0;
    }

    public void countSampleSinceNotified() {
        samplesSinceNotified++;
    }

    /**
     * Back to OK with an empty window. Used on configuration changes.
     */
    public void reset() {
        windowBuffer.clear();
        status = AlertStatus.OK;
        pendingSince = null;
        lastSample = null;
        samplesSinceNotified = 0;
        consecutiveBreaches = 0;
    }

    public Snapshot snapshot() {
        return new Snapshot(alertId, status, List.copyOf(windowBuffer), pendingSince,
            lastTransitionAt, lastNotifiedAt);
    }

    /**
     * Immutable copy for persistence and diagnostics.
     */
    public record Snapshot(
        String alertId,
        AlertStatus status,
        List<SignalSample> window,
        Instant pendingSince,
        Instant lastTransitionAt,
        Instant lastNotifiedAt
    ) {}
}
