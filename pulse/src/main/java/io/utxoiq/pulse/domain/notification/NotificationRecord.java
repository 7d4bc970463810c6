package io.utxoiq.pulse.domain.notification;

import io.utxoiq.pulse.domain.alert.ChannelKind;
import io.utxoiq.pulse.domain.alert.TransitionKind;

import java.time.Instant;

/**
 * Delivery record for one transition on one channel.
 *
 * Records are never deleted; only status, attempt count, next attempt deadline
 * and last error change after creation.
 */
public record NotificationRecord(
    String id,
    String alertId,
    String transitionId,
    TransitionKind transitionKind,
    ChannelKind channel,
    String target,
    NotificationStatus status,
    int attemptCount,
    Instant triggeredAt,
    Instant resolvedAt,      // set for RESOLVED transitions
    Instant nextAttemptAt,   // retry deadline while PENDING
    String lastError,
    Instant updatedAt
) {
    public NotificationRecord withStatus(NotificationStatus newStatus, String error, Instant at) {
        return new NotificationRecord(id, alertId, transitionId, transitionKind, channel, target,
            newStatus, attemptCount, triggeredAt, resolvedAt,
            newStatus == NotificationStatus.PENDING ? nextAttemptAt : null,
            error, at);
    }

    public NotificationRecord withAttempt(Instant nextAttempt, String error, Instant at) {
        return new NotificationRecord(id, alertId, transitionId, transitionKind, channel, target,
            status, attemptCount + 1, triggeredAt, resolvedAt, nextAttempt, error, at);
    }
}
