package io.utxoiq.pulse.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.utxoiq.pulse.auth.TokenService;
import io.utxoiq.pulse.config.PulseSettings;
import io.utxoiq.pulse.infrastructure.channel.ChannelRegistry;
import io.utxoiq.pulse.infrastructure.channel.ChatWebhookChannel;
import io.utxoiq.pulse.infrastructure.channel.HttpClientWebhookTransport;
import io.utxoiq.pulse.infrastructure.channel.LoggingProviderTransport;
import io.utxoiq.pulse.infrastructure.channel.ProviderNotificationChannel;
import io.utxoiq.pulse.infrastructure.metrics.PrometheusMetricsHandler;
import io.utxoiq.pulse.infrastructure.metrics.PrometheusPulseMetrics;
import io.utxoiq.pulse.infrastructure.persistence.PostgresAlertConfigurationRepository;
import io.utxoiq.pulse.infrastructure.persistence.PostgresAlertStateSnapshotRepository;
import io.utxoiq.pulse.infrastructure.persistence.PostgresBaselineStatsSource;
import io.utxoiq.pulse.infrastructure.persistence.PostgresFeedbackStore;
import io.utxoiq.pulse.infrastructure.persistence.PostgresNotificationRecordRepository;
import io.utxoiq.pulse.infrastructure.persistence.SchemaBootstrap;
import io.utxoiq.pulse.domain.alert.ChannelKind;
import io.utxoiq.pulse.service.alert.AlertConfigurationService;
import io.utxoiq.pulse.service.alert.AlertEvaluationEngine;
import io.utxoiq.pulse.service.alert.AlertStateMachine;
import io.utxoiq.pulse.service.alert.BaselineService;
import io.utxoiq.pulse.service.cache.ResultCache;
import io.utxoiq.pulse.service.feedback.FeedbackService;
import io.utxoiq.pulse.service.intake.MetricRegistry;
import io.utxoiq.pulse.service.intake.SignalIntakeAdapter;
import io.utxoiq.pulse.service.notify.CoalescingRule;
import io.utxoiq.pulse.service.notify.NotificationDispatcher;
import io.utxoiq.pulse.service.notify.RetryPolicy;
import io.utxoiq.pulse.service.ratelimit.IdentityKind;
import io.utxoiq.pulse.service.ratelimit.RateLimitPolicy;
import io.utxoiq.pulse.service.ratelimit.TokenBucketRateLimiter;
import io.utxoiq.pulse.service.stream.ClientConnection;
import io.utxoiq.pulse.service.stream.SubscriptionHub;
import io.utxoiq.pulse.transport.http.AlertConfigHandler;
import io.utxoiq.pulse.transport.http.ClientIdentityResolver;
import io.utxoiq.pulse.transport.http.IntakeHandler;
import io.utxoiq.pulse.transport.http.RateLimitHandler;
import io.utxoiq.pulse.transport.http.ReadApiHandler;
import io.utxoiq.pulse.transport.ws.WsHub;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Entry point of the alerting core (no framework).
 *
 * Intake → evaluation engine → notification dispatcher → channels, with the
 * subscription hub streaming signals, insights and alert events to live clients.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== utxoIQ Pulse Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        PulseSettings settings = PulseSettings.fromEnv();

        // ═══════════════════════════════════════════════════════════════
        // STARTUP VALIDATION GATE
        // ═══════════════════════════════════════════════════════════════
        try {
            StartupConfigValidator.validate(settings);
        } catch (IllegalStateException e) {
            log.error("STARTUP VALIDATION FAILED", e);
            System.err.println("\n" + e.getMessage() + "\n");
            System.exit(1);
        }

        Clock clock = Clock.systemUTC();
        ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        DataSource dataSource = createDataSource(settings);
        new SchemaBootstrap(dataSource).run();

        PostgresAlertConfigurationRepository alertRepo = new PostgresAlertConfigurationRepository(dataSource, mapper);
        PostgresNotificationRecordRepository recordRepo = new PostgresNotificationRecordRepository(dataSource);
        PostgresAlertStateSnapshotRepository snapshotRepo = new PostgresAlertStateSnapshotRepository(dataSource, mapper);
        PostgresBaselineStatsSource baselineSource = new PostgresBaselineStatsSource(dataSource);
        PostgresFeedbackStore feedbackStore = new PostgresFeedbackStore(dataSource);

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusPulseMetrics metrics = new PrometheusPulseMetrics();
        log.info("Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Tokens, rate limiting, cache
        // ═══════════════════════════════════════════════════════════════
        TokenService tokenService = new TokenService(settings.tokenSecret(), settings.tokenExpirationMs(), mapper, clock);
        Function<String, String> tokenValidator = token -> {
            if (token == null) return null;
            return tokenService.validateAndGetUserId(token);
        };

        Map<IdentityKind, RateLimitPolicy> policies = new EnumMap<>(IdentityKind.class);
        policies.put(IdentityKind.USER,
            new RateLimitPolicy(settings.userBucketCapacity(), settings.userRefillPerSecond()));
        policies.put(IdentityKind.API_KEY,
            new RateLimitPolicy(settings.apiKeyBucketCapacity(), settings.apiKeyRefillPerSecond()));
        policies.put(IdentityKind.ANONYMOUS,
            new RateLimitPolicy(settings.anonymousBucketCapacity(), settings.anonymousRefillPerSecond()));
        TokenBucketRateLimiter rateLimiter = new TokenBucketRateLimiter(policies, clock, metrics);

        ResultCache cache = new ResultCache(clock, metrics);
        BaselineService baselines = new BaselineService(baselineSource, cache, settings.baselineTtl());
        FeedbackService feedback = new FeedbackService(feedbackStore, cache, settings.feedbackTtl());

        // ═══════════════════════════════════════════════════════════════
        // Subscription hub (owned connection registry, shared drain pool)
        // ═══════════════════════════════════════════════════════════════
        ExecutorService drainPool = Executors.newFixedThreadPool(settings.hubWorkerThreads(),
            daemonThreads("hub-drain"));
        SubscriptionHub hub = new SubscriptionHub(new ConcurrentHashMap<String, ClientConnection>(), drainPool,
            metrics, clock, settings.connectionQueueSize(), settings.replayBufferSize(), settings.replayMaxAge());
        hub.start(settings.hubSweepInterval());

        // ═══════════════════════════════════════════════════════════════
        // Notification dispatcher
        // ═══════════════════════════════════════════════════════════════
        LoggingProviderTransport providerTransport = new LoggingProviderTransport();
        ChannelRegistry channels = new ChannelRegistry(List.of(
            ProviderNotificationChannel.email(providerTransport),
            ProviderNotificationChannel.sms(providerTransport),
            new ChatWebhookChannel(new HttpClientWebhookTransport(Duration.ofSeconds(10)), mapper,
                settings.chatWebhookUrl())));
        RetryPolicy retryPolicy = RetryPolicy.builder()
            .maxAttempts(settings.retryMaxAttempts())
            .initialDelay(settings.retryInitialDelay())
            .maxDelay(settings.retryMaxDelay())
            .multiplier(settings.retryMultiplier())
            .build();
        NotificationDispatcher dispatcher = new NotificationDispatcher(channels, recordRepo, retryPolicy,
            new CoalescingRule(), hub, metrics, mapper, clock, settings.channelCapacity(),
            settings.dispatchStallWarning());
        dispatcher.start(settings.dispatchSweepInterval());
        log.info("Channels: {}", channels.asMap().keySet());
        if (settings.chatWebhookUrl().isBlank()) {
            log.warn("CHAT_WEBHOOK_URL not set: {} deliveries need a per-alert target", ChannelKind.CHAT_WEBHOOK);
        }

        // ═══════════════════════════════════════════════════════════════
        // Evaluation engine + alert configuration
        // ═══════════════════════════════════════════════════════════════
        MetricRegistry metricRegistry = new MetricRegistry(settings.knownMetrics());
        AlertEvaluationEngine engine = new AlertEvaluationEngine(metricRegistry, baselines, new AlertStateMachine(),
            dispatcher, snapshotRepo, metrics, settings.evaluationShards());
        AlertConfigurationService alertService = new AlertConfigurationService(alertRepo, recordRepo, snapshotRepo,
            engine, metricRegistry, clock);
        alertService.loadEnabled();

        SignalIntakeAdapter intake = new SignalIntakeAdapter(metricRegistry, engine, hub, mapper, clock);

        // ═══════════════════════════════════════════════════════════════
        // Maintenance: cache expiry, idle buckets, revoked tokens
        // ═══════════════════════════════════════════════════════════════
        ScheduledExecutorService maintenance = Executors.newSingleThreadScheduledExecutor(daemonThreads("maintenance"));
        maintenance.scheduleAtFixedRate(() -> {
            try {
                int expired = cache.evictExpired();
                int idle = rateLimiter.evictIdle(Duration.ofMinutes(10));
                int revoked = tokenService.cleanupRevoked();
                log.debug("Maintenance: {} cache entries, {} idle buckets, {} revoked tokens", expired, idle, revoked);
            } catch (RuntimeException e) {
                log.error("Maintenance failed: {}", e.getMessage(), e);
            }
        }, 1, 1, TimeUnit.MINUTES);

        // ═══════════════════════════════════════════════════════════════
        // Transport: HTTP + WS
        // ═══════════════════════════════════════════════════════════════
        AlertConfigHandler alertHandler = new AlertConfigHandler(alertService, tokenValidator, mapper);
        IntakeHandler intakeHandler = new IntakeHandler(intake, new HashSet<>(settings.intakeApiKeys()), mapper);
        ReadApiHandler readHandler = new ReadApiHandler(baselines, feedback, metricRegistry, engine, hub, cache,
            tokenValidator, mapper, clock);
        WsHub wsHub = new WsHub(hub, tokenValidator, rateLimiter, mapper, clock);
        ClientIdentityResolver identities = new ClientIdentityResolver(tokenValidator);

        RoutingHandler api = Handlers.routing()
            .get("/api/health", readHandler::health)
            .post("/api/intake/signals", intakeHandler::signals)
            .post("/api/intake/insights", intakeHandler::insights)
            .get("/api/alerts", alertHandler::list)
            .post("/api/alerts", alertHandler::create)
            .get("/api/alerts/{id}", alertHandler::get)
            .put("/api/alerts/{id}", alertHandler::update)
            .delete("/api/alerts/{id}", alertHandler::delete)
            .post("/api/alerts/{id}/enable", alertHandler::enable)
            .post("/api/alerts/{id}/disable", alertHandler::disable)
            .get("/api/alerts/{id}/notifications", alertHandler::notifications)
            .get("/api/baselines/{metric}", readHandler::baseline)
            .get("/api/feedback/{insightId}/stats", readHandler::feedbackStats)
            .post("/api/feedback/{insightId}", readHandler::recordFeedback)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "utxoIQ Pulse\n\n" +
                    "API:     /api/alerts, /api/intake/signals, /api/baselines/{metric}, /api/health\n" +
                    "Metrics: GET /metrics\n" +
                    "WS:      ws://localhost:" + settings.port() + "/ws?token=<jwt>&since=alerts:0\n"
                );
            });
        HttpHandler limitedApi = new RateLimitHandler(api, rateLimiter, identities);

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
            .get("/ws", wsHub.websocketHandler())
            .setFallbackHandler(limitedApi);

        // CORS Handler
        HttpHandler corsHandler = exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, PUT, DELETE, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type, Authorization, X-API-Key")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (exchange.getRequestMethod().toString().equals("OPTIONS")) {
                exchange.setStatusCode(200);
                exchange.endExchange();
            } else {
                routes.handleRequest(exchange);
            }
        };

        Undertow server = Undertow.builder()
            .addHttpListener(settings.port(), "0.0.0.0")
            .setHandler(corsHandler)
            .build();
        server.start();
        log.info("utxoIQ Pulse started on http://localhost:{}/", settings.port());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            maintenance.shutdownNow();
            engine.close();
            dispatcher.close();
            hub.close();
            drainPool.shutdownNow();
            if (dataSource instanceof HikariDataSource) {
                ((HikariDataSource) dataSource).close();
            }
            log.info("Shutdown complete");
        }, "shutdown"));
    }

    private static DataSource createDataSource(PulseSettings settings) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(settings.dbUrl());
        config.setUsername(settings.dbUser());
        config.setPassword(settings.dbPass());
        config.setMaximumPoolSize(settings.dbPoolSize());
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setPoolName("pulse-hikari");

        log.info("DB: url={}, user={}, pool={}", settings.dbUrl(), settings.dbUser(), settings.dbPoolSize());
        return new HikariDataSource(config);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
