package io.utxoiq.pulse.testutil;

import io.utxoiq.pulse.application.port.output.NotificationRecordRepository;
import io.utxoiq.pulse.domain.notification.NotificationRecord;
import io.utxoiq.pulse.domain.notification.NotificationStatus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Notification history kept in insertion order.
 */
public final class InMemoryNotificationRecordRepository implements NotificationRecordRepository {
    private final Map<String, NotificationRecord> records = new LinkedHashMap<>();

    @Override
    public synchronized void insert(NotificationRecord record) {
        if (records.containsKey(record.id())) {
            throw new IllegalStateException("Duplicate record " + record.id());
        }
        records.put(record.id(), record);
    }

    @Override
    public synchronized void update(NotificationRecord record) {
        if (!records.containsKey(record.id())) {
            throw new IllegalStateException("Unknown record " + record.id());
        }
        records.put(record.id(), record);
    }

    @Override
    public synchronized List<NotificationRecord> findByAlertId(String alertId, int limit) {
        List<NotificationRecord> out = new ArrayList<>();
        for (NotificationRecord record : records.values()) {
            if (record.alertId().equals(alertId) && out.size() < limit) {
                out.add(record);
            }
        }
        return out;
    }

    public synchronized List<NotificationRecord> all() {
        return new ArrayList<>(records.values());
    }

    public synchronized NotificationRecord get(String id) {
        return records.get(id);
    }

    public synchronized long countByStatus(NotificationStatus status) {
        return records.values().stream().filter(r -> r.status() == status).count();
    }
}
