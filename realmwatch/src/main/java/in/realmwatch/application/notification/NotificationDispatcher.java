package in.realmwatch.application.notification;

import in.realmwatch.application.invalidation.InvalidationPolicy;
import in.realmwatch.application.port.output.DeliveryGateway;
import in.realmwatch.application.port.output.DeliveryResult;
import in.realmwatch.application.port.output.DestinationConfigRepository;
import in.realmwatch.application.port.output.DisplayNameLookup;
import in.realmwatch.application.port.output.PresenceMetrics;
import in.realmwatch.domain.destination.DestinationConfig;
import in.realmwatch.domain.destination.FailureClass;
import in.realmwatch.domain.event.PresenceChangedEvent;
import in.realmwatch.domain.event.RealmDownEvent;
import in.realmwatch.domain.event.RealmStaleEvent;
import in.realmwatch.domain.notification.Notification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders and delivers notifications to a realm's destinations.
 *
 * Each destination is attempted independently; delivery problems are routed
 * to the InvalidationPolicy and never raised.
 */
public final class NotificationDispatcher {
    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    static final String KIND_LIVE_UPDATE = "live_update";
    static final String KIND_REALM_OFFLINE = "realm_offline";
    static final String KIND_STALENESS_WARNING = "staleness_warning";

    private final DestinationConfigRepository configRepo;
    private final DeliveryGateway gateway;
    private final DisplayNameLookup displayNameLookup;
    private final NotificationRenderer renderer;
    private final InvalidationPolicy invalidationPolicy;
    private final PresenceMetrics metrics;

    public NotificationDispatcher(DestinationConfigRepository configRepo, DeliveryGateway gateway,
                                  DisplayNameLookup displayNameLookup, NotificationRenderer renderer,
                                  InvalidationPolicy invalidationPolicy, PresenceMetrics metrics) {
        this.configRepo = configRepo;
        this.gateway = gateway;
        this.displayNameLookup = displayNameLookup;
        this.renderer = renderer;
        this.invalidationPolicy = invalidationPolicy;
        this.metrics = metrics;
    }

    public void onPresenceChanged(PresenceChangedEvent event) {
        sendLiveUpdate(event.realmId(), event.delta().joined(), event.delta().left(),
            event.onlineCount(), event.timestamp());
    }

    /**
     * Live destinations hear about the disconnected participants first;
     * destinations with an offline role then get the offline notice.
     */
    public void onRealmDown(RealmDownEvent event) {
        if (!event.disconnected().isEmpty()) {
            sendLiveUpdate(event.realmId(), Set.of(), event.disconnected(), 0, event.timestamp());
        }

        for (DestinationConfig destination : configRepo.findByRealm(event.realmId())) {
            if (!destination.hasChannel() || !destination.hasOfflineRole()) {
                continue;
            }

            boolean mentionable = canMention(destination);
            Notification notification = renderer.realmOffline(event, destination.offlineRoleId(), mentionable);
            deliver(destination, notification, KIND_REALM_OFFLINE);

            if (!mentionable) {
                invalidationPolicy.recordFailure(destination, FailureClass.OFFLINE_ROLE);
            }
        }
    }

    /**
     * Warn one destination that its realm has produced no data.
     */
    public DeliveryResult sendStalenessWarning(DestinationConfig destination, RealmStaleEvent event) {
        return deliver(destination, renderer.stalenessWarning(event), KIND_STALENESS_WARNING);
    }

    // ═══════════════════════════════════════════════════════════════
    // INTERNAL
    // ═══════════════════════════════════════════════════════════════

    private void sendLiveUpdate(String realmId, Set<String> joined, Set<String> left,
                                int onlineCount, Instant timestamp) {
        List<DestinationConfig> targets = configRepo.findByRealm(realmId).stream()
            .filter(DestinationConfig::liveUpdates)
            .collect(Collectors.toList());
        if (targets.isEmpty()) {
            return;
        }

        Set<String> participants = new HashSet<>(joined);
        participants.addAll(left);

        // Device-fetching destinations need fresh data for everyone who just joined
        Set<String> bypassCache = targets.stream().anyMatch(DestinationConfig::fetchDevices) ? joined : Set.of();

        Notification notification = renderer.presenceChange(
            joined, left, resolveNames(realmId, participants, bypassCache), onlineCount, timestamp);

        for (DestinationConfig destination : targets) {
            if (!destination.entitled()) {
                invalidationPolicy.invalidateEntitlement(destination);
                continue;
            }
            if (!destination.hasChannel()) {
                invalidationPolicy.deactivateMissingChannel(destination);
                continue;
            }
            deliver(destination, notification, KIND_LIVE_UPDATE);
        }
    }

    private DeliveryResult deliver(DestinationConfig destination, Notification notification, String kind) {
        DeliveryResult result;
        try {
            result = gateway.deliver(destination, notification);
        } catch (RuntimeException e) {
            log.warn("[DISPATCH] {} to destination={} failed: {}", kind, destination.destinationId(), e.getMessage());
            result = DeliveryResult.TRANSIENT_FAILURE;
        }

        metrics.recordNotification(kind, result);

        if (result == DeliveryResult.DELIVERED) {
            invalidationPolicy.recordSuccess(destination, FailureClass.CHANNEL);
        } else if (result.isChannelProblem()) {
            log.info("[DISPATCH] {} to destination={} rejected: {}", kind, destination.destinationId(), result);
            invalidationPolicy.recordFailure(destination, FailureClass.CHANNEL);
        }
        return result;
    }

    private Map<String, String> resolveNames(String realmId, Set<String> participants, Set<String> bypassCache) {
        try {
            return displayNameLookup.displayNames(participants, bypassCache);
        } catch (RuntimeException e) {
            log.warn("[DISPATCH] Display name lookup failed for realm {}: {}", realmId, e.getMessage());
            return Map.of();
        }
    }

    private boolean canMention(DestinationConfig destination) {
        try {
            return gateway.canMentionRole(destination, destination.offlineRoleId());
        } catch (RuntimeException e) {
            log.warn("[DISPATCH] Role check for destination={} failed: {}", destination.destinationId(), e.getMessage());
            return true;
        }
    }
}
