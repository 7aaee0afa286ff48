package in.realmwatch.application.invalidation;

import in.realmwatch.application.monitoring.AlertService;
import in.realmwatch.application.port.output.DestinationConfigRepository;
import in.realmwatch.application.port.output.PresenceMetrics;
import in.realmwatch.config.TrackerConfig;
import in.realmwatch.domain.destination.DestinationConfig;
import in.realmwatch.domain.destination.FailureClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Failure accounting and deactivation of subscriber destinations.
 *
 * Every failure class has its own persisted counter and limit. Reaching the
 * limit deactivates the features that class concerns and resets the counter;
 * deactivation is idempotent. Entitlement loss is authoritative and bypasses
 * the counters entirely.
 *
 * Usage:
 * <pre>
 * if (result.isChannelProblem()) {
 *     boolean disabled = policy.recordFailure(destination, FailureClass.CHANNEL);
 * } else if (result == DeliveryResult.DELIVERED) {
 *     policy.recordSuccess(destination, FailureClass.CHANNEL);
 * }
 * </pre>
 */
public final class InvalidationPolicy {
    private static final Logger log = LoggerFactory.getLogger(InvalidationPolicy.class);

    private final DestinationConfigRepository configRepo;
    private final PresenceMetrics metrics;
    private final AlertService alertService;
    private final Map<FailureClass, Integer> limits;

    // Realms with at least one REALM_DATA_MISSING failure recorded by this process
    private final Set<String> realmsMissingData = ConcurrentHashMap.newKeySet();
    // Realms that produced data since this process started
    private final Set<String> realmsWithData = ConcurrentHashMap.newKeySet();

    public InvalidationPolicy(DestinationConfigRepository configRepo, PresenceMetrics metrics,
                              AlertService alertService, Map<FailureClass, Integer> limits) {
        for (FailureClass failureClass : FailureClass.values()) {
            Integer limit = limits.get(failureClass);
            if (limit == null || limit <= 0) {
                throw new IllegalArgumentException("Missing or non-positive limit for " + failureClass);
            }
        }
        this.configRepo = configRepo;
        this.metrics = metrics;
        this.alertService = alertService;
        this.limits = Collections.unmodifiableMap(new EnumMap<>(limits));
    }

    public InvalidationPolicy(DestinationConfigRepository configRepo, PresenceMetrics metrics,
                              AlertService alertService, TrackerConfig config) {
        this(configRepo, metrics, alertService, limitsFrom(config));
    }

    public static Map<FailureClass, Integer> limitsFrom(TrackerConfig config) {
        Map<FailureClass, Integer> limits = new EnumMap<>(FailureClass.class);
        limits.put(FailureClass.CHANNEL, config.channelFailureLimit());
        limits.put(FailureClass.OFFLINE_ROLE, config.offlineRoleFailureLimit());
        limits.put(FailureClass.REALM_DATA_MISSING, config.realmMissingFailureLimit());
        return limits;
    }

    public int limitFor(FailureClass failureClass) {
        return limits.get(failureClass);
    }

    // ═══════════════════════════════════════════════════════════════
    // COUNTERS
    // ═══════════════════════════════════════════════════════════════

    /**
     * Record one failure of the given class.
     *
     * @return true if this failure reached the limit and the destination's
     *         features for that class were deactivated
     */
    public boolean recordFailure(DestinationConfig destination, FailureClass failureClass) {
        if (failureClass == FailureClass.REALM_DATA_MISSING && destination.realmId() != null) {
            realmsMissingData.add(destination.realmId());
        }

        int count = configRepo.incrementFailureCount(destination.destinationId(), failureClass);
        int limit = limitFor(failureClass);

        if (count < limit) {
            log.info("[INVALIDATION] destination={} class={} failures={}/{}",
                destination.destinationId(), failureClass, count, limit);
            return false;
        }

        deactivate(destination.destinationId(), failureClass);
        configRepo.resetFailureCount(destination.destinationId(), failureClass);
        return true;
    }

    /**
     * Reset the class's counter after a success.
     */
    public void recordSuccess(DestinationConfig destination, FailureClass failureClass) {
        configRepo.resetFailureCount(destination.destinationId(), failureClass);
    }

    /**
     * The realm produced data again; forgive missing-data failures of all its destinations.
     *
     * Counters survive restarts, so the first data seen by this process resets
     * them as well.
     */
    public void recordRealmDataReceived(String realmId) {
        boolean firstData = realmsWithData.add(realmId);
        if (realmsMissingData.remove(realmId) || firstData) {
            configRepo.resetFailureCountsForRealm(realmId, FailureClass.REALM_DATA_MISSING);
            log.info("[INVALIDATION] realm={} returned data, missing-data counters reset", realmId);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // IMMEDIATE DEACTIVATIONS
    // ═══════════════════════════════════════════════════════════════

    /**
     * The destination no longer holds an active entitlement: turn its premium features off.
     */
    public DestinationConfig invalidateEntitlement(DestinationConfig destination) {
        DestinationConfig updated = destination.withoutEntitledFeatures();
        if (!updated.equals(destination)) {
            configRepo.save(updated);
            metrics.recordDeactivation("ENTITLEMENT");
            log.warn("[INVALIDATION] destination={} lost its entitlement, live updates disabled",
                destination.destinationId());
        }
        return updated;
    }

    /**
     * Live updates requested without a delivery channel: turn them off.
     */
    public DestinationConfig deactivateMissingChannel(DestinationConfig destination) {
        DestinationConfig updated = destination.withLiveUpdates(false);
        if (!updated.equals(destination)) {
            configRepo.save(updated);
            metrics.recordDeactivation("MISSING_CHANNEL");
            log.warn("[INVALIDATION] destination={} has no channel, live updates disabled",
                destination.destinationId());
        }
        return updated;
    }

    // ═══════════════════════════════════════════════════════════════
    // REALM AGGREGATE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Account for one staleness period of the realm across all its destinations.
     *
     * Destinations without a channel are unlinked from the realm. Destinations
     * with warnings enabled record a REALM_DATA_MISSING failure and are
     * returned for warning unless that failure deactivated them. The realm
     * should be dropped when no destination remains viable.
     */
    public MissingDataVerdict recordRealmDataMissing(String realmId) {
        List<DestinationConfig> toWarn = new ArrayList<>();
        boolean anyViable = false;

        for (DestinationConfig destination : configRepo.findByRealm(realmId)) {
            if (!destination.hasChannel()) {
                configRepo.save(destination.unlinkedFromRealm());
                metrics.recordDeactivation("UNLINKED");
                log.warn("[INVALIDATION] destination={} has no channel, unlinked from realm {}",
                    destination.destinationId(), realmId);
                continue;
            }

            if (!destination.warningNotifications()) {
                anyViable = true;
                continue;
            }

            if (recordFailure(destination, FailureClass.REALM_DATA_MISSING)) {
                continue;
            }

            anyViable = true;
            toWarn.add(destination);
        }

        return new MissingDataVerdict(realmId, List.copyOf(toWarn), !anyViable);
    }

    /**
     * Outcome of a staleness period for one realm.
     *
     * @param toWarn destinations that should receive a warning notification
     * @param dropRealm no destination can receive data any more
     */
    public record MissingDataVerdict(String realmId, List<DestinationConfig> toWarn, boolean dropRealm) {
    }

    // ═══════════════════════════════════════════════════════════════
    // INTERNAL
    // ═══════════════════════════════════════════════════════════════

    private void deactivate(String destinationId, FailureClass failureClass) {
        DestinationConfig current = configRepo.findById(destinationId).orElse(null);
        if (current == null) {
            log.warn("[INVALIDATION] destination={} vanished before {} deactivation", destinationId, failureClass);
            return;
        }

        DestinationConfig updated = switch (failureClass) {
            case CHANNEL, REALM_DATA_MISSING -> current.withoutChannel();
            case OFFLINE_ROLE -> current.withoutOfflineRole();
        };

        if (updated.equals(current)) {
            log.debug("[INVALIDATION] destination={} already deactivated for {}", destinationId, failureClass);
            return;
        }

        configRepo.save(updated);
        metrics.recordDeactivation(failureClass.name());
        alertService.sendWarningAlert("DESTINATION_DEACTIVATED", current.realmId(),
            "Destination " + destinationId + " reached the " + failureClass + " failure limit of "
                + limitFor(failureClass));
    }
}
