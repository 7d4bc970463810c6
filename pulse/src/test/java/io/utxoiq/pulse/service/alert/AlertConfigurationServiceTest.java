package io.utxoiq.pulse.service.alert;

import io.utxoiq.pulse.application.port.output.AlertConfigurationRepository;
import io.utxoiq.pulse.application.port.output.AlertStateSnapshotRepository;
import io.utxoiq.pulse.application.port.output.NotificationRecordRepository;
import io.utxoiq.pulse.domain.alert.AlertConfiguration;
import io.utxoiq.pulse.domain.alert.ChannelKind;
import io.utxoiq.pulse.domain.alert.ComparisonOperator;
import io.utxoiq.pulse.domain.alert.EvaluationWindow;
import io.utxoiq.pulse.error.AccessDeniedException;
import io.utxoiq.pulse.error.ConfigurationException;
import io.utxoiq.pulse.error.NotFoundException;
import io.utxoiq.pulse.error.VersionConflictException;
import io.utxoiq.pulse.service.intake.MetricRegistry;
import io.utxoiq.pulse.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertConfigurationServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private AlertConfigurationRepository repository;
    @Mock
    private NotificationRecordRepository notifications;
    @Mock
    private AlertStateSnapshotRepository snapshots;
    @Mock
    private AlertEvaluationEngine engine;

    private MutableClock clock;
    private AlertConfigurationService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        MetricRegistry registry = new MetricRegistry(List.of("mempool_fee_rate", "hash_rate"));
        service = new AlertConfigurationService(repository, notifications, snapshots, engine, registry, clock);
    }

    private static AlertConfiguration.Builder draft() {
        return AlertConfiguration.builder()
            .name("Fee spike")
            .metric("mempool_fee_rate")
            .operator(ComparisonOperator.GREATER_THAN)
            .threshold(50)
            .window(EvaluationWindow.ofSamples(3))
            .channel(ChannelKind.EMAIL, "ops@example.com");
    }

    private static AlertConfiguration stored(String owner, long version) {
        return draft().id("a1").owner(owner).version(version).createdAt(NOW).updatedAt(NOW).build();
    }

    @Test
    void create_persistsAndRegistersWithEngine() {
        AlertConfiguration created = service.create("alice", draft());

        assertNotNull(created.id());
        assertEquals("alice", created.owner());
        assertEquals(1, created.version());
        assertEquals(NOW, created.createdAt());
        verify(repository).insert(created);
        verify(engine).register(created);
    }

    @Test
    void create_rejectsUnknownMetricAndMissingChannels() {
        AlertConfiguration.Builder bad = AlertConfiguration.builder()
            .name("bad")
            .metric("not_a_metric")
            .window(EvaluationWindow.ofSamples(5000));

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> service.create("alice", bad));

        assertTrue(ex.getViolations().contains("unknown metric: not_a_metric"));
        assertTrue(ex.getViolations().contains("at least one notification channel is required"));
        assertTrue(ex.getViolations().stream().anyMatch(v -> v.contains("1000 samples")));
        verifyNoInteractions(repository, engine);
    }

    @Test
    void create_rejectsOverlongDurationWindow() {
        AlertConfiguration.Builder bad = draft().window(EvaluationWindow.ofDuration(Duration.ofHours(48)));

        assertThrows(ConfigurationException.class, () -> service.create("alice", bad));
    }

    @Test
    void get_enforcesOwnership() {
        when(repository.findById("a1")).thenReturn(Optional.of(stored("alice", 1)));

        assertEquals("a1", service.get("alice", "a1").id());
        assertThrows(AccessDeniedException.class, () -> service.get("mallory", "a1"));
    }

    @Test
    void get_missingAlertIsNotFound() {
        when(repository.findById("nope")).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> service.get("alice", "nope"));
    }

    @Test
    void update_bumpsVersionAndReRegisters() {
        when(repository.findById("a1")).thenReturn(Optional.of(stored("alice", 3)));
        when(repository.updateIfVersion(any(), eq(3L))).thenReturn(true);
        clock.advance(Duration.ofMinutes(5));

        AlertConfiguration updated = service.update("alice", "a1", draft().threshold(75), 3);

        assertEquals(4, updated.version());
        assertEquals(75, updated.threshold());
        assertEquals(NOW, updated.createdAt(), "Creation time is preserved");
        assertEquals(NOW.plus(Duration.ofMinutes(5)), updated.updatedAt());
        verify(engine).register(updated);
    }

    @Test
    void update_staleVersionConflicts() {
        when(repository.findById("a1")).thenReturn(Optional.of(stored("alice", 5)));

        VersionConflictException ex = assertThrows(VersionConflictException.class,
            () -> service.update("alice", "a1", draft(), 4));

        assertEquals(4, ex.getExpectedVersion());
        assertEquals(5, ex.getActualVersion());
        verify(repository, never()).updateIfVersion(any(), anyLong());
        verifyNoInteractions(engine);
    }

    @Test
    void update_concurrentWriterConflicts() {
        when(repository.findById("a1"))
            .thenReturn(Optional.of(stored("alice", 2)))
            .thenReturn(Optional.of(stored("alice", 3)));
        when(repository.updateIfVersion(any(), eq(2L))).thenReturn(false);

        VersionConflictException ex = assertThrows(VersionConflictException.class,
            () -> service.update("alice", "a1", draft(), 2));

        assertEquals(3, ex.getActualVersion(), "Reports the version that won");
        verifyNoInteractions(engine);
    }

    @Test
    void setEnabled_disablingUnregistersThroughEngine() {
        when(repository.findById("a1")).thenReturn(Optional.of(stored("alice", 1)));
        when(repository.updateIfVersion(any(), eq(1L))).thenReturn(true);

        AlertConfiguration disabled = service.setEnabled("alice", "a1", false);

        assertFalse(disabled.enabled());
        assertEquals(2, disabled.version());
        ArgumentCaptor<AlertConfiguration> captor = ArgumentCaptor.forClass(AlertConfiguration.class);
        verify(engine).register(captor.capture());
        assertFalse(captor.getValue().enabled(), "Engine drops disabled configurations on register");
    }

    @Test
    void setEnabled_noChangeIsNoOp() {
        when(repository.findById("a1")).thenReturn(Optional.of(stored("alice", 1)));

        AlertConfiguration same = service.setEnabled("alice", "a1", true);

        assertEquals(1, same.version());
        verify(repository, never()).updateIfVersion(any(), anyLong());
    }

    @Test
    void delete_removesFromStoreEngineAndSnapshots() {
        when(repository.findById("a1")).thenReturn(Optional.of(stored("alice", 1)));

        service.delete("alice", "a1");

        verify(repository).delete("a1");
        verify(engine).unregister("a1");
        verify(snapshots).delete("a1");
    }

    @Test
    void loadEnabled_registersEveryEnabledAlert() {
        AlertConfiguration a = stored("alice", 1);
        AlertConfiguration b = draft().id("b1").owner("bob").metric("retired_metric").build();
        when(repository.findAllEnabled()).thenReturn(List.of(a, b));

        assertEquals(2, service.loadEnabled());

        verify(engine).register(a);
        verify(engine).register(b);
    }

    @Test
    void notifications_clampsLimit() {
        when(repository.findById("a1")).thenReturn(Optional.of(stored("alice", 1)));
        when(notifications.findByAlertId("a1", 500)).thenReturn(List.of());

        assertTrue(service.notifications("alice", "a1", 10_000).isEmpty());
        verify(notifications).findByAlertId("a1", 500);
    }
}
