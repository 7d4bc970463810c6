package io.utxoiq.pulse.bootstrap;

import io.utxoiq.pulse.config.PulseSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Startup configuration validator.
 *
 * Runs before anything is wired. Every problem is collected and reported together;
 * the process refuses to start on any of them. Production mode adds the checks that
 * local runs are allowed to skip.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    private StartupConfigValidator() {
    }

    /**
     * @throws IllegalStateException listing every invalid setting
     */
    public static void validate(PulseSettings settings) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");
        log.info("Production mode: {}", settings.productionMode());

        List<String> problems = new ArrayList<>(check(settings));
        if (settings.productionMode()) {
            problems.addAll(checkProduction(settings));
        } else {
            warnNonProduction(settings);
        }

        if (!problems.isEmpty()) {
            throw new IllegalStateException(
                "INVALID CONFIG: system refuses to start.\n  - " + String.join("\n  - ", problems));
        }
        log.info("Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    static List<String> check(PulseSettings s) {
        List<String> problems = new ArrayList<>();
        if (s.port() < 1 || s.port() > 65535) {
            problems.add("PORT must be between 1 and 65535, got " + s.port());
        }
        if (s.dbPoolSize() < 1) {
            problems.add("DB_POOL_SIZE must be positive");
        }
        if (s.evaluationShards() < 1) {
            problems.add("EVAL_SHARDS must be positive");
        }
        if (s.knownMetrics().isEmpty()) {
            problems.add("KNOWN_METRICS is empty: no alert could ever be evaluated");
        }
        if (s.retryMaxAttempts() < 1) {
            problems.add("NOTIFY_MAX_ATTEMPTS must be positive");
        }
        if (s.retryMultiplier() < 1.0) {
            problems.add("NOTIFY_BACKOFF_MULTIPLIER must be at least 1.0");
        }
        if (!isPositive(s.retryInitialDelay()) || !isPositive(s.retryMaxDelay())
            || s.retryInitialDelay().compareTo(s.retryMaxDelay()) > 0) {
            problems.add("NOTIFY_INITIAL_DELAY_MS must be positive and not exceed NOTIFY_MAX_DELAY_MS");
        }
        if (s.channelCapacity() < 1) {
            problems.add("NOTIFY_CHANNEL_CAPACITY must be positive");
        }
        if (!isPositive(s.dispatchSweepInterval()) || !isPositive(s.hubSweepInterval())) {
            problems.add("sweep intervals must be positive");
        }
        if (s.connectionQueueSize() < 1 || s.replayBufferSize() < 1 || s.hubWorkerThreads() < 1) {
            problems.add("WS_QUEUE_SIZE, WS_REPLAY_BUFFER_SIZE and WS_WORKER_THREADS must be positive");
        }
        if (!isPositive(s.replayMaxAge()) || !isPositive(s.baselineTtl()) || !isPositive(s.feedbackTtl())) {
            problems.add("WS_REPLAY_MAX_AGE_MS, BASELINE_TTL_MS and FEEDBACK_TTL_MS must be positive");
        }
        if (s.userBucketCapacity() < 1 || s.apiKeyBucketCapacity() < 1 || s.anonymousBucketCapacity() < 1) {
            problems.add("rate limit capacities must be positive");
        }
        if (s.userRefillPerSecond() <= 0 || s.apiKeyRefillPerSecond() <= 0 || s.anonymousRefillPerSecond() <= 0) {
            problems.add("rate limit refill rates must be positive");
        }
        return problems;
    }

    private static List<String> checkProduction(PulseSettings s) {
        log.info("PRODUCTION MODE detected - enforcing strict validation");
        List<String> problems = new ArrayList<>();
        if (PulseSettings.DEFAULT_TOKEN_SECRET.equals(s.tokenSecret()) || s.tokenSecret().length() < 32) {
            problems.add("TOKEN_SECRET must be set to a secret of at least 32 characters");
        }
        if (s.intakeApiKeys().isEmpty()) {
            problems.add("INTAKE_API_KEYS must be set: intake would accept anonymous signals");
        }
        return problems;
    }

    private static void warnNonProduction(PulseSettings s) {
        if (PulseSettings.DEFAULT_TOKEN_SECRET.equals(s.tokenSecret())) {
            log.warn("TOKEN_SECRET is the built-in default; set PRODUCTION_MODE=true to enforce a real one");
        }
        if (s.intakeApiKeys().isEmpty()) {
            log.warn("INTAKE_API_KEYS is empty; intake accepts unauthenticated signals");
        }
        if (s.chatWebhookUrl().isBlank()) {
            log.warn("CHAT_WEBHOOK_URL is empty; chat alerts need a per-alert target URL");
        }
    }

    private static boolean isPositive(Duration d) {
        return d != null && !d.isNegative() && !d.isZero();
    }
}
