package io.utxoiq.pulse.service.notify;

import io.utxoiq.pulse.domain.notification.NotificationRecord;
import io.utxoiq.pulse.domain.notification.NotificationStatus;

/**
 * Latest state wins.
 *
 * A newer notification for the same alert and channel supersedes an earlier one that
 * has not left the dispatcher yet: still queued, or waiting for a retry deadline. The
 * earlier record is marked SUPPRESSED. A send already in flight is never interrupted.
 */
public final class CoalescingRule {

    public static final String SUPERSEDED = "superseded by a newer transition";

    /**
     * Deliveries sharing a key coalesce: same alert, same channel kind, same target.
     */
    public String key(NotificationRecord record) {
        return record.alertId() + "|" + record.channel() + "|" + record.target();
    }

    public boolean supersedes(NotificationRecord incoming, NotificationRecord earlier, boolean earlierInFlight) {
        return !earlierInFlight
            && earlier.status() == NotificationStatus.PENDING
            && !earlier.transitionId().equals(incoming.transitionId())
            && key(incoming).equals(key(earlier))
            && !incoming.triggeredAt().isBefore(earlier.triggeredAt());
    }
}
