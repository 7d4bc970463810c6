package io.utxoiq.pulse.service.alert;

import io.utxoiq.pulse.application.port.output.AlertConfigurationRepository;
import io.utxoiq.pulse.application.port.output.AlertStateSnapshotRepository;
import io.utxoiq.pulse.application.port.output.NotificationRecordRepository;
import io.utxoiq.pulse.domain.alert.AlertConfiguration;
import io.utxoiq.pulse.domain.alert.ChannelTarget;
import io.utxoiq.pulse.domain.alert.EvaluationWindow;
import io.utxoiq.pulse.domain.notification.NotificationRecord;
import io.utxoiq.pulse.error.AccessDeniedException;
import io.utxoiq.pulse.error.ConfigurationException;
import io.utxoiq.pulse.error.NotFoundException;
import io.utxoiq.pulse.error.VersionConflictException;
import io.utxoiq.pulse.service.intake.MetricRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Owner-scoped CRUD over alert configurations.
 *
 * Every write is validated, persisted with an optimistic version check, then pushed
 * into the evaluation engine so the engine registry always mirrors the store.
 */
public final class AlertConfigurationService {
    private static final Logger log = LoggerFactory.getLogger(AlertConfigurationService.class);

    static final int MAX_NAME_LENGTH = 200;
    static final int MAX_WINDOW_SAMPLES = 1000;
    static final Duration MAX_WINDOW_DURATION = Duration.ofHours(24);

    private final AlertConfigurationRepository repository;
    private final NotificationRecordRepository notifications;
    private final AlertStateSnapshotRepository snapshots;
    private final AlertEvaluationEngine engine;
    private final MetricRegistry metricRegistry;
    private final Clock clock;

    public AlertConfigurationService(AlertConfigurationRepository repository,
                                     NotificationRecordRepository notifications,
                                     AlertStateSnapshotRepository snapshots,
                                     AlertEvaluationEngine engine,
                                     MetricRegistry metricRegistry,
                                     Clock clock) {
        this.repository = repository;
        this.notifications = notifications;
        this.snapshots = snapshots;
        this.engine = engine;
        this.metricRegistry = metricRegistry;
        this.clock = clock;
    }

    /**
     * Register every enabled configuration with the engine. Called once at startup.
     */
    public int loadEnabled() {
        List<AlertConfiguration> enabled = repository.findAllEnabled();
        for (AlertConfiguration config : enabled) {
            if (!metricRegistry.isKnown(config.metric())) {
                log.warn("[ALERTS] Alert {} references unknown metric {}, it will never fire",
                    config.id(), config.metric());
            }
            engine.register(config);
        }
        log.info("[ALERTS] Loaded {} enabled alert configurations", enabled.size());
        return enabled.size();
    }

    public AlertConfiguration create(String owner, AlertConfiguration.Builder draft) {
        Instant now = clock.instant();
        AlertConfiguration config = build(draft
            .id(UUID.randomUUID().toString())
            .owner(owner)
            .version(1)
            .createdAt(now)
            .updatedAt(now));
        validate(config);

        repository.insert(config);
        engine.register(config);
        log.info("[ALERTS] {} created alert {} ({} {} {})", owner, config.id(), config.metric(),
            config.operator().symbol(), config.threshold());
        return config;
    }

    public AlertConfiguration get(String owner, String alertId) {
        AlertConfiguration config = repository.findById(alertId)
            .orElseThrow(() -> new NotFoundException("Alert not found: " + alertId));
        if (!config.owner().equals(owner)) {
            throw new AccessDeniedException("Alert " + alertId + " belongs to another user");
        }
        return config;
    }

    public List<AlertConfiguration> list(String owner) {
        return repository.findByOwner(owner);
    }

    /**
     * Replace an alert's definition. Fails with {@link VersionConflictException} when
     * {@code expectedVersion} is not the stored version.
     */
    public AlertConfiguration update(String owner, String alertId, AlertConfiguration.Builder draft,
                                     long expectedVersion) {
        AlertConfiguration existing = get(owner, alertId);
        if (existing.version() != expectedVersion) {
            throw new VersionConflictException(alertId, expectedVersion, existing.version());
        }

        AlertConfiguration updated = build(draft
            .id(alertId)
            .owner(owner)
            .version(expectedVersion + 1)
            .createdAt(existing.createdAt())
            .updatedAt(clock.instant()));
        validate(updated);

        write(updated, expectedVersion);
        log.info("[ALERTS] {} updated alert {} to v{}", owner, alertId, updated.version());
        return updated;
    }

    public AlertConfiguration setEnabled(String owner, String alertId, boolean enabled) {
        AlertConfiguration existing = get(owner, alertId);
        if (existing.enabled() == enabled) {
            return existing;
        }
        AlertConfiguration updated = existing.withEnabled(enabled, clock.instant());
        write(updated, existing.version());
        log.info("[ALERTS] {} {} alert {}", owner, enabled ? "enabled" : "disabled", alertId);
        return updated;
    }

    public void delete(String owner, String alertId) {
        get(owner, alertId);
        repository.delete(alertId);
        engine.unregister(alertId);
        try {
            snapshots.delete(alertId);
        } catch (RuntimeException e) {
            log.warn("[ALERTS] Failed to delete state snapshot for {}: {}", alertId, e.getMessage());
        }
        log.info("[ALERTS] {} deleted alert {}", owner, alertId);
    }

    public List<NotificationRecord> notifications(String owner, String alertId, int limit) {
        get(owner, alertId);
        return notifications.findByAlertId(alertId, Math.max(1, Math.min(limit, 500)));
    }

    private void write(AlertConfiguration updated, long expectedVersion) {
        if (!repository.updateIfVersion(updated, expectedVersion)) {
            long actual = repository.findById(updated.id()).map(AlertConfiguration::version).orElse(-1L);
            throw new VersionConflictException(updated.id(), expectedVersion, actual);
        }
        engine.register(updated);
    }

    private static AlertConfiguration build(AlertConfiguration.Builder draft) {
        try {
            return draft.build();
        } catch (IllegalArgumentException | IllegalStateException | NullPointerException e) {
            throw new ConfigurationException(e.getMessage());
        }
    }

    /**
     * @throws ConfigurationException listing every violation found
     */
    void validate(AlertConfiguration config) {
        List<String> violations = new ArrayList<>();

        if (config.metric().isBlank()) {
            violations.add("metric is required");
        } else if (!metricRegistry.isKnown(config.metric())) {
            violations.add("unknown metric: " + config.metric());
        }
        if (config.name() == null || config.name().isBlank()) {
            violations.add("name is required");
        } else if (config.name().length() > MAX_NAME_LENGTH) {
            violations.add("name longer than " + MAX_NAME_LENGTH + " characters");
        }
        if (Double.isNaN(config.threshold()) || Double.isInfinite(config.threshold())) {
            violations.add("threshold must be a finite number");
        }

        EvaluationWindow window = config.window();
        if (window.kind() == EvaluationWindow.Kind.SAMPLES && window.samples() > MAX_WINDOW_SAMPLES) {
            violations.add("evaluation window larger than " + MAX_WINDOW_SAMPLES + " samples");
        }
        if (window.kind() == EvaluationWindow.Kind.DURATION && window.duration().compareTo(MAX_WINDOW_DURATION) > 0) {
            violations.add("evaluation window longer than " + MAX_WINDOW_DURATION.toHours() + " hours");
        }

        if (config.channels().isEmpty()) {
            violations.add("at least one notification channel is required");
        }
        for (ChannelTarget channel : config.channels()) {
            if (channel.target().isBlank()) {
                violations.add(channel.kind() + " channel needs a target");
            }
        }

        if (!violations.isEmpty()) {
            throw new ConfigurationException(violations);
        }
    }
}
