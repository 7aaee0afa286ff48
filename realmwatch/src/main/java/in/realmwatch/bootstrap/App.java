package in.realmwatch.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.realmwatch.application.event.PresenceEventBus;
import in.realmwatch.application.invalidation.InvalidationPolicy;
import in.realmwatch.application.monitoring.AlertService;
import in.realmwatch.application.monitoring.ErrorReporter;
import in.realmwatch.application.notification.NotificationDispatcher;
import in.realmwatch.application.notification.NotificationRenderer;
import in.realmwatch.application.notification.StalenessWarningHandler;
import in.realmwatch.application.persistence.SessionPersistenceListener;
import in.realmwatch.application.polling.PollScheduler;
import in.realmwatch.application.port.output.DestinationConfigRepository;
import in.realmwatch.application.port.output.ParticipantSessionRepository;
import in.realmwatch.application.presence.DiffEngine;
import in.realmwatch.application.presence.IdentityResolver;
import in.realmwatch.application.presence.OfflineRealmTracker;
import in.realmwatch.application.presence.PresenceStateStore;
import in.realmwatch.config.TrackerConfig;
import in.realmwatch.domain.event.PresenceChangedEvent;
import in.realmwatch.domain.event.PresenceObservedEvent;
import in.realmwatch.domain.event.RealmDownEvent;
import in.realmwatch.domain.event.RealmStaleEvent;
import in.realmwatch.infrastructure.delivery.WebhookDeliveryGateway;
import in.realmwatch.infrastructure.metrics.MetricsServer;
import in.realmwatch.infrastructure.metrics.PrometheusPresenceMetrics;
import in.realmwatch.infrastructure.persistence.PostgresDestinationConfigRepository;
import in.realmwatch.infrastructure.persistence.PostgresOfflineRealmRepository;
import in.realmwatch.infrastructure.persistence.PostgresParticipantSessionRepository;
import in.realmwatch.infrastructure.source.CachingDisplayNameLookup;
import in.realmwatch.infrastructure.source.HttpDisplayNameSource;
import in.realmwatch.infrastructure.source.HttpPresenceSource;
import in.realmwatch.migration.SchemaMigration;
import in.realmwatch.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * RealmWatch presence tracker.
 *
 * Wires:
 * - PostgreSQL repositories and schema migration
 * - Startup recovery of sessions and offline markers
 * - Presence source, display names and webhook delivery
 * - Event bus with persistence, notification and staleness consumers
 * - Poll scheduler
 * - Prometheus /metrics endpoint
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== RealmWatch Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        String presenceApiUrl = Env.get("PRESENCE_API_URL", null);
        String presenceApiToken = Env.get("PRESENCE_API_TOKEN", null);
        String displayApiUrl = Env.get("DISPLAY_API_URL", presenceApiUrl);
        String accountName = Env.get("PRESENCE_ACCOUNT_NAME", "realmwatch");
        int metricsPort = Env.getInt("METRICS_PORT", 9091);

        // ═══════════════════════════════════════════════════════════════
        // STARTUP VALIDATION GATE
        // ═══════════════════════════════════════════════════════════════
        TrackerConfig config;
        try {
            config = TrackerConfig.fromEnv();
            StartupConfigValidator.validate(config, presenceApiUrl);
        } catch (IllegalStateException e) {
            log.error("❌ STARTUP VALIDATION FAILED", e);
            System.err.println("\n" + e.getMessage() + "\n");
            System.exit(1);
            return;
        }

        Clock clock = Clock.systemUTC();
        AlertService alertService = new AlertService();
        ErrorReporter errorReporter = new ErrorReporter(alertService);
        Thread.setDefaultUncaughtExceptionHandler(errorReporter);

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = createDataSource();
        new SchemaMigration(dataSource).migrate();

        ParticipantSessionRepository sessionRepo = new PostgresParticipantSessionRepository(dataSource);
        DestinationConfigRepository configRepo = new PostgresDestinationConfigRepository(dataSource);
        PostgresOfflineRealmRepository offlineRepo = new PostgresOfflineRealmRepository(dataSource);

        // ═══════════════════════════════════════════════════════════════
        // Recovery: expire stale sessions, rebuild online sets, load offline markers
        // ═══════════════════════════════════════════════════════════════
        IdentityResolver identityResolver = new IdentityResolver();
        PresenceStateStore stateStore = new PresenceStateStore();
        stateStore.recover(sessionRepo, identityResolver, clock.instant(), config.sessionGraceWindow());

        OfflineRealmTracker offlineTracker = new OfflineRealmTracker(offlineRepo);
        offlineTracker.load();

        // ═══════════════════════════════════════════════════════════════
        // Pipeline
        // ═══════════════════════════════════════════════════════════════
        PrometheusPresenceMetrics metrics = new PrometheusPresenceMetrics();
        HttpPresenceSource presenceSource = new HttpPresenceSource(presenceApiUrl, presenceApiToken);
        CachingDisplayNameLookup displayNames = new CachingDisplayNameLookup(
            new HttpDisplayNameSource(displayApiUrl, presenceApiToken), config.displayNameCacheTtl(), clock);

        DiffEngine diffEngine = new DiffEngine(stateStore, config.stalenessThreshold());
        InvalidationPolicy invalidationPolicy = new InvalidationPolicy(configRepo, metrics, alertService, config);
        PresenceEventBus eventBus = new PresenceEventBus(metrics, errorReporter);

        PollScheduler scheduler = new PollScheduler(presenceSource, configRepo, diffEngine, stateStore,
            offlineTracker, invalidationPolicy, eventBus, metrics, alertService, errorReporter, config, clock);

        NotificationDispatcher dispatcher = new NotificationDispatcher(configRepo, new WebhookDeliveryGateway(),
            displayNames, new NotificationRenderer(accountName), invalidationPolicy, metrics);
        SessionPersistenceListener sessions = new SessionPersistenceListener(sessionRepo, identityResolver);
        StalenessWarningHandler stalenessHandler =
            new StalenessWarningHandler(invalidationPolicy, dispatcher, scheduler, metrics);

        // Persistence first: a cycle is complete once its rows are written
        eventBus.register(PresenceChangedEvent.class, "session-persistence", sessions::onPresenceChanged);
        eventBus.register(RealmDownEvent.class, "session-persistence", sessions::onRealmDown);
        eventBus.register(PresenceObservedEvent.class, "session-heartbeat", sessions::onPresenceObserved);
        eventBus.register(PresenceChangedEvent.class, "live-updates", dispatcher::onPresenceChanged);
        eventBus.register(RealmDownEvent.class, "realm-offline", dispatcher::onRealmDown);
        eventBus.register(RealmStaleEvent.class, "staleness-warning", stalenessHandler::onRealmStale);

        scheduler.start();

        MetricsServer metricsServer = new MetricsServer("0.0.0.0", metricsPort, metrics.getRegistry(),
            scheduler::isRunning);
        metricsServer.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("[SHUTDOWN] Stopping RealmWatch");
            scheduler.stop(Duration.ofSeconds(30));
            metricsServer.stop();
            dataSource.close();
            log.info("[SHUTDOWN] Done");
        }, "shutdown"));

        log.info("✓ RealmWatch started: {} realms in rotation, metrics on port {}",
            scheduler.rotation().size(), metricsPort);
    }

    private static HikariDataSource createDataSource() {
        String url = Env.get("DB_URL", "jdbc:postgresql://localhost:5432/realmwatch");
        String user = Env.get("DB_USER", "postgres");
        String pass = Env.get("DB_PASS", "postgres");
        int maxPool = Env.getInt("DB_POOL_SIZE", 10);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setPoolName("realmwatch-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }
}
