package io.utxoiq.pulse.service.alert;

import io.utxoiq.pulse.domain.alert.AlertConfiguration;
import io.utxoiq.pulse.domain.alert.AlertState;
import io.utxoiq.pulse.domain.alert.AlertStatus;
import io.utxoiq.pulse.domain.alert.EvaluationWindow;
import io.utxoiq.pulse.domain.alert.ThresholdType;
import io.utxoiq.pulse.domain.alert.TransitionEvent;
import io.utxoiq.pulse.domain.alert.TransitionKind;
import io.utxoiq.pulse.domain.signal.SignalSample;
import io.utxoiq.pulse.domain.stats.BaselineStats;

import java.time.Duration;
import java.time.Instant;
import java.util.Deque;
import java.util.Iterator;
import java.util.Optional;
import java.util.UUID;

/**
 * OK / PENDING / TRIGGERED state machine for one alert.
 *
 * <pre>
 * OK        --breach, window not yet spanned-->  PENDING
 * OK        --breach, window spanned--------->  TRIGGERED   (TRIGGERED event)
 * PENDING   --breach, window spanned--------->  TRIGGERED   (TRIGGERED event)
 * PENDING   --no breach---------------------->  OK          (no event)
 * TRIGGERED --breach------------------------->  TRIGGERED   (RENOTIFY event if enabled and due)
 * TRIGGERED --no breach---------------------->  OK          (RESOLVED event)
 * </pre>
 *
 * A sample-count window is spanned by N consecutive breaching samples, a duration
 * window by a breaching sample observed at least the duration after the first breach.
 * RATE thresholds compare the mean of the trailing window and need the window full.
 *
 * Times come from sample observation times, never the wall clock. Not thread-safe:
 * callers serialize access per {@link AlertState}.
 */
public final class AlertStateMachine {

    /**
     * @param baseline required for PERCENTAGE and RATE thresholds, ignored otherwise
     */
    public Optional<TransitionEvent> evaluate(AlertConfiguration config, AlertState state,
                                              SignalSample sample, BaselineStats baseline) {
        if (sample.equals(state.getLastSample())) {
            return Optional.empty();
        }
        state.setLastSample(sample);
        appendToWindow(config.window(), state.getWindowBuffer(), sample);

        double observed = observedValue(config, state, sample, baseline);
        boolean breach = config.operator().test(observed, config.threshold());
        Instant at = sample.observedAt();
        AlertStatus from = state.getStatus();

        switch (from) {
            case OK, PENDING -> {
                if (!breach) {
                    state.moveTo(AlertStatus.OK, at);
                    return Optional.empty();
                }
                state.countBreach();
                if (windowSpanned(config, state, at)) {
                    state.moveTo(AlertStatus.TRIGGERED, at);
                    state.markNotified(at);
                    return Optional.of(event(config, TransitionKind.TRIGGERED, from, AlertStatus.TRIGGERED,
                        observed, at));
                }
                state.moveTo(AlertStatus.PENDING, at);
                return Optional.empty();
            }
            case TRIGGERED -> {
                if (!breach) {
                    state.moveTo(AlertStatus.OK, at);
                    return Optional.of(event(config, TransitionKind.RESOLVED, from, AlertStatus.OK,
                        observed, at));
                }
                state.countSampleSinceNotified();
                if (config.renotify() && renotifyDue(config.window(), state, at)) {
                    state.markNotified(at);
                    return Optional.of(event(config, TransitionKind.RENOTIFY, from, AlertStatus.TRIGGERED,
                        observed, at));
                }
                return Optional.empty();
            }
            default -> throw new IllegalStateException("Unknown status " + from);
        }
    }

    double observedValue(AlertConfiguration config, AlertState state, SignalSample sample, BaselineStats baseline) {
        ThresholdType type = config.thresholdType();
        if (type == ThresholdType.ABSOLUTE) {
            return sample.value();
        }
        if (baseline == null) {
            throw new IllegalStateException(type + " threshold needs a baseline for " + config.metric());
        }
        if (type == ThresholdType.PERCENTAGE) {
            return baseline.percentDeviation(sample.value());
        }
        return baseline.percentDeviation(mean(state.getWindowBuffer()));
    }

    private boolean windowSpanned(AlertConfiguration config, AlertState state, Instant at) {
        EvaluationWindow window = config.window();
        if (config.thresholdType() == ThresholdType.RATE) {
            return windowFull(window, state.getWindowBuffer(), at);
        }
        if (window.satisfiedByFirstBreach()) {
            return true;
        }
        if (window.kind() == EvaluationWindow.Kind.SAMPLES) {
            return state.getConsecutiveBreaches() >= window.samples();
        }
        Instant firstBreach = state.getPendingSince() != null ? state.getPendingSince() : at;
        return Duration.between(firstBreach, at).compareTo(window.duration()) >= 0;
    }

    private boolean renotifyDue(EvaluationWindow window, AlertState state, Instant at) {
        if (window.kind() == EvaluationWindow.Kind.SAMPLES) {
            return state.getSamplesSinceNotified() >= Math.max(1, window.samples());
        }
        Instant last = state.getLastNotifiedAt();
        return last == null || !at.isBefore(last.plus(window.duration()));
    }

    /**
     * Sample windows keep the last N samples. Duration windows keep the samples inside
     * the duration plus the newest one at or before its start, so a full window is one
     * whose oldest sample is at or before the start.
     */
    static void appendToWindow(EvaluationWindow window, Deque<SignalSample> buffer, SignalSample sample) {
        buffer.addLast(sample);
        if (window.kind() == EvaluationWindow.Kind.SAMPLES) {
            int keep = Math.max(1, window.samples());
            while (buffer.size() > keep) {
                buffer.removeFirst();
            }
            return;
        }
        Instant start = sample.observedAt().minus(window.duration());
        while (buffer.size() >= 2 && !secondOldest(buffer).observedAt().isAfter(start)) {
            buffer.removeFirst();
        }
    }

    static boolean windowFull(EvaluationWindow window, Deque<SignalSample> buffer, Instant at) {
        if (window.kind() == EvaluationWindow.Kind.SAMPLES) {
            return buffer.size() >= window.samples();
        }
        SignalSample oldest = buffer.peekFirst();
        return oldest != null && !oldest.observedAt().isAfter(at.minus(window.duration()));
    }

    private static SignalSample secondOldest(Deque<SignalSample> buffer) {
        Iterator<SignalSample> it = buffer.iterator();
        it.next();
        return it.next();
    }

    private static double mean(Deque<SignalSample> buffer) {
        double sum = 0.0;
        for (SignalSample s : buffer) {
            sum += s.value();
        }
        return buffer.isEmpty() ? 0.0 : sum / buffer.size();
    }

    private static TransitionEvent event(AlertConfiguration config, TransitionKind kind, AlertStatus from,
                                         AlertStatus to, double observed, Instant at) {
        return new TransitionEvent(
            UUID.randomUUID().toString(),
            config.id(),
            config.owner(),
            config.name(),
            kind,
            from,
            to,
            config.metric(),
            observed,
            config.threshold(),
            config.operator(),
            config.severity(),
            config.channels(),
            at,
            config.version()
        );
    }
}
