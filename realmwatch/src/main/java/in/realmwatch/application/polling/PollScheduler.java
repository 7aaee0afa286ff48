package in.realmwatch.application.polling;

import in.realmwatch.application.event.PresenceEventBus;
import in.realmwatch.application.invalidation.InvalidationPolicy;
import in.realmwatch.application.monitoring.AlertService;
import in.realmwatch.application.monitoring.ErrorReporter;
import in.realmwatch.application.port.output.DestinationConfigRepository;
import in.realmwatch.application.port.output.PresenceMetrics;
import in.realmwatch.application.port.output.PresenceSource;
import in.realmwatch.application.port.output.PresenceSourceException;
import in.realmwatch.application.presence.DiffEngine;
import in.realmwatch.application.presence.OfflineRealmTracker;
import in.realmwatch.application.presence.PresenceStateStore;
import in.realmwatch.config.TrackerConfig;
import in.realmwatch.domain.common.InvariantViolationException;
import in.realmwatch.domain.event.PresenceChangedEvent;
import in.realmwatch.domain.event.PresenceObservedEvent;
import in.realmwatch.domain.event.RealmDownEvent;
import in.realmwatch.domain.presence.PollResult;
import in.realmwatch.domain.presence.PresenceDelta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one poll cycle per realm on a fixed interval.
 *
 * A single ticker thread submits cycles to a worker pool. Every call to the
 * presence source passes a process-wide admission gate, and a realm whose
 * previous cycle is still running skips the tick. A cycle applies its diff,
 * publishes its events and waits for their consumers before it is marked
 * complete.
 *
 * Reachability per realm:
 * <pre>
 * Reachable --(unreachable)--> Unreachable --(snapshot)--> Reachable
 * Unreachable --(no viable destination)--> Dropped (terminal)
 * </pre>
 */
public final class PollScheduler implements RealmRotation {
    private static final Logger log = LoggerFactory.getLogger(PollScheduler.class);

    private final PresenceSource presenceSource;
    private final DestinationConfigRepository configRepo;
    private final DiffEngine diffEngine;
    private final PresenceStateStore stateStore;
    private final OfflineRealmTracker offlineTracker;
    private final InvalidationPolicy invalidationPolicy;
    private final PresenceEventBus eventBus;
    private final PresenceMetrics metrics;
    private final AlertService alertService;
    private final ErrorReporter errorReporter;
    private final TrackerConfig config;
    private final Clock clock;

    private final Semaphore admissionGate;
    private final AtomicInteger pollsInFlight = new AtomicInteger();
    private final Set<String> cyclesInFlight = ConcurrentHashMap.newKeySet();
    private final Set<String> droppedRealms = ConcurrentHashMap.newKeySet();

    private final ScheduledExecutorService ticker;
    private final ExecutorService workers;
    private volatile boolean running = false;

    public PollScheduler(PresenceSource presenceSource,
                         DestinationConfigRepository configRepo,
                         DiffEngine diffEngine,
                         PresenceStateStore stateStore,
                         OfflineRealmTracker offlineTracker,
                         InvalidationPolicy invalidationPolicy,
                         PresenceEventBus eventBus,
                         PresenceMetrics metrics,
                         AlertService alertService,
                         ErrorReporter errorReporter,
                         TrackerConfig config,
                         Clock clock) {
        this.presenceSource = presenceSource;
        this.configRepo = configRepo;
        this.diffEngine = diffEngine;
        this.stateStore = stateStore;
        this.offlineTracker = offlineTracker;
        this.invalidationPolicy = invalidationPolicy;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.alertService = alertService;
        this.errorReporter = errorReporter;
        this.config = config;
        this.clock = clock;
        this.admissionGate = new Semaphore(config.pollConcurrency(), true);

        this.ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "poll-ticker");
            t.setDaemon(true);
            t.setUncaughtExceptionHandler(errorReporter);
            return t;
        });
        AtomicInteger workerIds = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(config.pollWorkers(), r -> {
            Thread t = new Thread(r, "poll-worker-" + workerIds.incrementAndGet());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler(errorReporter);
            return t;
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    public synchronized void start() {
        if (running) {
            log.warn("[POLL] Scheduler already running");
            return;
        }
        running = true;
        log.info("[POLL] Starting scheduler (interval: {}s, concurrency: {}, workers: {})",
            config.pollInterval().toSeconds(), config.pollConcurrency(), config.pollWorkers());

        ticker.scheduleAtFixedRate(() -> {
            try {
                tick();
            } catch (Exception e) {
                log.error("[POLL] Error in tick: {}", e.getMessage(), e);
            }
        }, 0, config.pollInterval().toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stop ticking and let in-flight cycles finish, cancelling them after the timeout.
     */
    public synchronized void stop(Duration timeout) {
        running = false;
        log.info("[POLL] Stopping scheduler ({} cycles in flight)", cyclesInFlight.size());

        ticker.shutdown();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[POLL] Cycles still running after {}s, cancelling", timeout.toSeconds());
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        ticker.shutdownNow();
    }

    public boolean isRunning() {
        return running;
    }

    // ═══════════════════════════════════════════════════════════════
    // SCHEDULING
    // ═══════════════════════════════════════════════════════════════

    /**
     * Submit a cycle for every realm in rotation.
     *
     * @return number of cycles submitted
     */
    public int tick() {
        Set<String> realms = rotation();
        metrics.setTrackedRealms(realms.size());
        metrics.setOnlineParticipants(stateStore.totalOnline());

        int submitted = 0;
        for (String realmId : realms) {
            if (cyclesInFlight.contains(realmId)) {
                metrics.recordCycleSkipped();
                log.debug("[POLL] realm={} still polling, skipping tick", realmId);
                continue;
            }
            try {
                workers.execute(() -> runCycle(realmId));
                submitted++;
            } catch (RejectedExecutionException e) {
                log.debug("[POLL] Worker pool shut down, realm={} not submitted", realmId);
            }
        }
        log.debug("[POLL] Tick submitted {} of {} realms", submitted, realms.size());
        return submitted;
    }

    /**
     * Realms to poll: linked by a destination with a channel, minus dropped realms.
     */
    public Set<String> rotation() {
        Set<String> realms = new HashSet<>(configRepo.findPolledRealmIds());
        realms.removeAll(droppedRealms);
        return realms;
    }

    /**
     * Run one complete cycle for the realm on the calling thread.
     * A second cycle for a realm whose cycle is in flight is rejected.
     */
    public CycleOutcome runCycle(String realmId) {
        if (droppedRealms.contains(realmId)) {
            return CycleOutcome.SKIPPED;
        }
        if (!cyclesInFlight.add(realmId)) {
            metrics.recordCycleSkipped();
            log.debug("[POLL] realm={} cycle already in flight, rejected", realmId);
            return CycleOutcome.SKIPPED;
        }

        try {
            PollResult result;
            try {
                result = pollThroughGate(realmId);
            } catch (PresenceSourceException e) {
                log.warn("[POLL] realm={} poll failed, retrying next tick: {}", realmId, e.getMessage());
                publishStalenessIfDue(realmId, clock.instant());
                return CycleOutcome.FAILED;
            }

            Instant now = clock.instant();
            CycleOutcome outcome;
            if (result.isUnreachable()) {
                processUnreachable(realmId, result, now);
                outcome = CycleOutcome.UNREACHABLE;
            } else {
                processSnapshot(realmId, result.online(), now);
                outcome = CycleOutcome.SNAPSHOT;
            }

            publishStalenessIfDue(realmId, now);
            return outcome;

        } catch (InvariantViolationException e) {
            errorReporter.reportFatal("poll cycle for realm " + realmId, e);
            return CycleOutcome.FAILED;
        } catch (RuntimeException e) {
            errorReporter.reportContained("poll cycle for realm " + realmId, e);
            return CycleOutcome.FAILED;
        } finally {
            cyclesInFlight.remove(realmId);
        }
    }

    public boolean isCycleInFlight(String realmId) {
        return cyclesInFlight.contains(realmId);
    }

    // ═══════════════════════════════════════════════════════════════
    // ROTATION
    // ═══════════════════════════════════════════════════════════════

    @Override
    public void dropRealm(String realmId, String reason) {
        if (!droppedRealms.add(realmId)) {
            return;
        }
        log.warn("[POLL] Dropping realm {} from rotation: {}", realmId, reason);

        diffEngine.forget(realmId);
        stateStore.clear(realmId);
        offlineTracker.markOnline(realmId);
        metrics.recordRealmDropped();

        try {
            if (!presenceSource.unsubscribe(realmId)) {
                log.warn("[POLL] Could not leave realm {}: unknown to the source", realmId);
            }
        } catch (PresenceSourceException e) {
            log.error("[POLL] Failed to unsubscribe realm {}: {}", realmId, e.getMessage());
        }

        alertService.sendWarningAlert("REALM_DROPPED", realmId, reason);
    }

    @Override
    public void restoreRealm(String realmId) {
        if (droppedRealms.remove(realmId)) {
            log.info("[POLL] Realm {} restored to rotation", realmId);
        }
    }

    public Set<String> droppedRealms() {
        return Set.copyOf(droppedRealms);
    }

    // ═══════════════════════════════════════════════════════════════
    // INTERNAL
    // ═══════════════════════════════════════════════════════════════

    private PollResult pollThroughGate(String realmId) {
        try {
            admissionGate.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PresenceSourceException(realmId, "interrupted waiting for admission", e);
        }

        metrics.setPollsInFlight(pollsInFlight.incrementAndGet());
        long started = System.nanoTime();
        String outcome = "error";
        try {
            PollResult result = presenceSource.poll(realmId);
            outcome = result.isUnreachable() ? "unreachable" : "snapshot";
            return result;
        } finally {
            metrics.recordPoll(outcome, Duration.ofNanos(System.nanoTime() - started));
            metrics.setPollsInFlight(pollsInFlight.decrementAndGet());
            admissionGate.release();
        }
    }

    private void processSnapshot(String realmId, Set<String> online, Instant now) {
        if (offlineTracker.markOnline(realmId)) {
            log.info("[POLL] realm={} reachable again", realmId);
        }

        Optional<PresenceDelta> delta = diffEngine.observe(realmId, online, now);
        if (delta.isPresent()) {
            PresenceDelta d = delta.get();
            metrics.recordDelta(d.joined().size(), d.left().size());
            eventBus.publish(new PresenceChangedEvent(d, stateStore.current(realmId).size()));
        }

        if (!online.isEmpty()) {
            invalidationPolicy.recordRealmDataReceived(realmId);
        }
        eventBus.publish(new PresenceObservedEvent(realmId, online, now));
    }

    private void processUnreachable(String realmId, PollResult result, Instant now) {
        if (!offlineTracker.markOffline(realmId, now)) {
            log.debug("[POLL] realm={} still unreachable", realmId);
            return;
        }

        Set<String> disconnected = stateStore.clear(realmId);
        metrics.recordRealmDown();
        log.info("[POLL] realm={} went down ({}), {} participants disconnected",
            realmId, result.reason(), disconnected.size());
        eventBus.publish(new RealmDownEvent(realmId, disconnected, now));
    }

    private void publishStalenessIfDue(String realmId, Instant now) {
        diffEngine.checkStaleness(realmId, now).ifPresent(eventBus::publish);
    }
}
