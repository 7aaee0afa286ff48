package in.realmwatch.infrastructure.metrics;

import in.realmwatch.application.port.output.DeliveryResult;
import in.realmwatch.application.port.output.PresenceMetrics;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of PresenceMetrics.
 *
 * Key Metrics:
 * - presence_polls_total{outcome} - Source calls by outcome (snapshot, unreachable, error)
 * - presence_poll_latency_seconds - Source call latency distribution
 * - presence_cycles_skipped_total - Ticks skipped because the realm was still polling
 * - presence_polls_in_flight - Calls currently holding the admission gate
 * - presence_tracked_realms / presence_online_participants - Rotation size and online total
 * - presence_participants_changed_total{direction} - Joins and leaves
 * - presence_notifications_total{kind, result} - Delivery attempts
 * - presence_deactivations_total{reason} - Destination features switched off
 *
 * Usage:
 * <pre>
 * PrometheusPresenceMetrics metrics = new PrometheusPresenceMetrics();
 * Handlers.path().addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusPresenceMetrics implements PresenceMetrics {

    private final CollectorRegistry registry;

    // Poll metrics
    private final Counter pollCounter;
    private final Histogram pollLatency;
    private final Counter cyclesSkipped;
    private final Gauge pollsInFlight;

    // State
    private final Gauge trackedRealms;
    private final Gauge onlineParticipants;
    private final Counter participantChanges;
    private final Counter realmDownCounter;
    private final Counter stalenessCounter;
    private final Counter realmsDropped;

    // Fan-out
    private final Counter notificationCounter;
    private final Counter listenerFailures;
    private final Counter deactivationCounter;

    public PrometheusPresenceMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusPresenceMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.pollCounter = Counter.build()
            .name("presence_polls_total")
            .help("Total number of presence source calls")
            .labelNames("outcome")
            .register(registry);

        this.pollLatency = Histogram.build()
            .name("presence_poll_latency_seconds")
            .help("Presence source call latency in seconds")
            .buckets(0.05, 0.1, 0.25, 0.5, 1.0, 2.0, 5.0, 10.0)
            .register(registry);

        this.cyclesSkipped = Counter.build()
            .name("presence_cycles_skipped_total")
            .help("Poll cycles skipped because the previous cycle of the realm was still running")
            .register(registry);

        this.pollsInFlight = Gauge.build()
            .name("presence_polls_in_flight")
            .help("Presence source calls currently admitted")
            .register(registry);

        this.trackedRealms = Gauge.build()
            .name("presence_tracked_realms")
            .help("Realms in the polling rotation")
            .register(registry);

        this.onlineParticipants = Gauge.build()
            .name("presence_online_participants")
            .help("Participants currently online across all realms")
            .register(registry);

        this.participantChanges = Counter.build()
            .name("presence_participants_changed_total")
            .help("Participants that joined or left")
            .labelNames("direction")
            .register(registry);

        this.realmDownCounter = Counter.build()
            .name("presence_realm_down_total")
            .help("Realm transitions into unreachable")
            .register(registry);

        this.stalenessCounter = Counter.build()
            .name("presence_staleness_signals_total")
            .help("Staleness signals raised for realms without data")
            .register(registry);

        this.realmsDropped = Counter.build()
            .name("presence_realms_dropped_total")
            .help("Realms dropped from the rotation")
            .register(registry);

        this.notificationCounter = Counter.build()
            .name("presence_notifications_total")
            .help("Notification delivery attempts")
            .labelNames("kind", "result")
            .register(registry);

        this.listenerFailures = Counter.build()
            .name("presence_listener_failures_total")
            .help("Event listener invocations that raised")
            .labelNames("listener")
            .register(registry);

        this.deactivationCounter = Counter.build()
            .name("presence_deactivations_total")
            .help("Destination features deactivated")
            .labelNames("reason")
            .register(registry);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    @Override
    public void recordPoll(String outcome, Duration latency) {
        pollCounter.labels(outcome).inc();
        pollLatency.observe(latency.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void recordCycleSkipped() {
        cyclesSkipped.inc();
    }

    @Override
    public void setPollsInFlight(int inFlight) {
        pollsInFlight.set(inFlight);
    }

    @Override
    public void setTrackedRealms(int realms) {
        trackedRealms.set(realms);
    }

    @Override
    public void setOnlineParticipants(int participants) {
        onlineParticipants.set(participants);
    }

    @Override
    public void recordDelta(int joined, int left) {
        if (joined > 0) {
            participantChanges.labels("joined").inc(joined);
        }
        if (left > 0) {
            participantChanges.labels("left").inc(left);
        }
    }

    @Override
    public void recordRealmDown() {
        realmDownCounter.inc();
    }

    @Override
    public void recordStaleness() {
        stalenessCounter.inc();
    }

    @Override
    public void recordNotification(String kind, DeliveryResult result) {
        notificationCounter.labels(kind, result.name().toLowerCase()).inc();
    }

    @Override
    public void recordListenerFailure(String listener) {
        listenerFailures.labels(listener).inc();
    }

    @Override
    public void recordDeactivation(String reason) {
        deactivationCounter.labels(reason).inc();
    }

    @Override
    public void recordRealmDropped() {
        realmsDropped.inc();
    }
}
