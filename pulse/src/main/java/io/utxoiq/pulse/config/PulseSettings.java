package io.utxoiq.pulse.config;

import io.utxoiq.pulse.util.Env;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Runtime settings for the alerting core, read once at startup.
 *
 * Every value comes from an environment variable (or -D system property) with a
 * default suitable for local runs.
 */
public record PulseSettings(
    // HTTP / WS
    boolean productionMode,
    int port,
    String tokenSecret,
    long tokenExpirationMs,
    List<String> intakeApiKeys,

    // Database
    String dbUrl,
    String dbUser,
    String dbPass,
    int dbPoolSize,

    // Evaluation engine
    int evaluationShards,
    List<String> knownMetrics,
    Duration baselineTtl,

    // Dispatcher
    int retryMaxAttempts,
    Duration retryInitialDelay,
    Duration retryMaxDelay,
    double retryMultiplier,
    int channelCapacity,
    Duration dispatchStallWarning,
    Duration dispatchSweepInterval,
    String chatWebhookUrl,

    // Subscription hub
    int connectionQueueSize,
    int replayBufferSize,
    Duration replayMaxAge,
    Duration hubSweepInterval,
    int hubWorkerThreads,

    // Cache
    Duration feedbackTtl,

    // Rate limiter
    int userBucketCapacity,
    double userRefillPerSecond,
    int apiKeyBucketCapacity,
    double apiKeyRefillPerSecond,
    int anonymousBucketCapacity,
    double anonymousRefillPerSecond
) {

    public static final String DEFAULT_TOKEN_SECRET = "utxoiq-pulse-secret-change-in-production";

    public static final String DEFAULT_METRICS =
        "mempool,mempool_fee_rate,mempool_size,exchange,exchange_inflow,exchange_outflow,"
            + "miner,hash_rate,miner_outflow,whale,whale_transfer,treasury,treasury_balance,"
            + "predictive,fee_forecast,cpu_usage,memory_usage,error_rate,latency_p95";

    public static PulseSettings fromEnv() {
        return new PulseSettings(
            Env.getBool("PRODUCTION_MODE", false),
            Env.getInt("PORT", 9090),
            Env.get("TOKEN_SECRET", DEFAULT_TOKEN_SECRET),
            Env.getLong("TOKEN_EXPIRATION_HOURS", 24L) * 3_600_000L,
            parseList(Env.get("INTAKE_API_KEYS", "")),

            Env.get("DB_URL", "jdbc:postgresql://localhost:5432/utxoiq"),
            Env.get("DB_USER", "postgres"),
            Env.get("DB_PASS", "postgres"),
            Env.getInt("DB_POOL_SIZE", 10),

            Env.getInt("EVAL_SHARDS", Math.max(2, Runtime.getRuntime().availableProcessors())),
            parseList(Env.get("KNOWN_METRICS", DEFAULT_METRICS)),
            Env.getDuration("BASELINE_TTL_MS", Duration.ofSeconds(60)),

            Env.getInt("NOTIFY_MAX_ATTEMPTS", 3),
            Env.getDuration("NOTIFY_INITIAL_DELAY_MS", Duration.ofMillis(500)),
            Env.getDuration("NOTIFY_MAX_DELAY_MS", Duration.ofSeconds(30)),
            Env.getDouble("NOTIFY_BACKOFF_MULTIPLIER", 2.0),
            Env.getInt("NOTIFY_CHANNEL_CAPACITY", 256),
            Env.getDuration("NOTIFY_DISPATCH_STALL_WARN_MS", Duration.ofSeconds(30)),
            Env.getDuration("NOTIFY_SWEEP_INTERVAL_MS", Duration.ofMillis(200)),
            Env.get("CHAT_WEBHOOK_URL", ""),

            Env.getInt("WS_QUEUE_SIZE", 512),
            Env.getInt("WS_REPLAY_BUFFER_SIZE", 1024),
            Env.getDuration("WS_REPLAY_MAX_AGE_MS", Duration.ofMinutes(5)),
            Env.getDuration("WS_SWEEP_INTERVAL_MS", Duration.ofSeconds(5)),
            Env.getInt("WS_WORKER_THREADS", 4),

            Env.getDuration("FEEDBACK_TTL_MS", Duration.ofHours(1)),

            Env.getInt("RATE_USER_CAPACITY", 120),
            Env.getDouble("RATE_USER_REFILL_PER_SEC", 2.0),
            Env.getInt("RATE_API_KEY_CAPACITY", 600),
            Env.getDouble("RATE_API_KEY_REFILL_PER_SEC", 10.0),
            Env.getInt("RATE_ANON_CAPACITY", 30),
            Env.getDouble("RATE_ANON_REFILL_PER_SEC", 0.5)
        );
    }

    private static List<String> parseList(String raw) {
        return Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }
}
