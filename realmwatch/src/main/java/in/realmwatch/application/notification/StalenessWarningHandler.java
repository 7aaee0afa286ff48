package in.realmwatch.application.notification;

import in.realmwatch.application.invalidation.InvalidationPolicy;
import in.realmwatch.application.invalidation.InvalidationPolicy.MissingDataVerdict;
import in.realmwatch.application.polling.RealmRotation;
import in.realmwatch.application.port.output.PresenceMetrics;
import in.realmwatch.domain.destination.DestinationConfig;
import in.realmwatch.domain.event.RealmStaleEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reacts to a realm that produced no data for the staleness threshold:
 * warns the destinations that still want it, and drops the realm from
 * rotation once nobody does.
 */
public final class StalenessWarningHandler {
    private static final Logger log = LoggerFactory.getLogger(StalenessWarningHandler.class);

    private final InvalidationPolicy invalidationPolicy;
    private final NotificationDispatcher dispatcher;
    private final RealmRotation rotation;
    private final PresenceMetrics metrics;

    public StalenessWarningHandler(InvalidationPolicy invalidationPolicy, NotificationDispatcher dispatcher,
                                   RealmRotation rotation, PresenceMetrics metrics) {
        this.invalidationPolicy = invalidationPolicy;
        this.dispatcher = dispatcher;
        this.rotation = rotation;
        this.metrics = metrics;
    }

    public void onRealmStale(RealmStaleEvent event) {
        metrics.recordStaleness();
        MissingDataVerdict verdict = invalidationPolicy.recordRealmDataMissing(event.realmId());

        for (DestinationConfig destination : verdict.toWarn()) {
            dispatcher.sendStalenessWarning(destination, event);
        }

        if (verdict.dropRealm()) {
            log.warn("[STALE] realm={} has no viable destination left", event.realmId());
            rotation.dropRealm(event.realmId(), "no data since " + event.lastDataAt() + " and no viable destination");
        }
    }
}
