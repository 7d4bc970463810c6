package io.utxoiq.pulse.application.port.output;

import io.utxoiq.pulse.domain.notification.NotificationRecord;

import java.util.List;

/**
 * Append-only history of notification deliveries. Records are updated in place, never deleted.
 */
public interface NotificationRecordRepository {
    void insert(NotificationRecord record);

    void update(NotificationRecord record);

    List<NotificationRecord> findByAlertId(String alertId, int limit);
}
