package in.realmwatch.application.presence;

import in.realmwatch.domain.event.RealmStaleEvent;
import in.realmwatch.domain.presence.PresenceDelta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns successive snapshots of a realm into join/leave deltas.
 *
 * Only membership is compared; a participant present in both the stored set
 * and the snapshot is neither joined nor left. Separately tracks when each
 * realm last returned a non-empty snapshot and signals staleness once the
 * threshold passes, then restarts the timer.
 */
public final class DiffEngine {
    private static final Logger log = LoggerFactory.getLogger(DiffEngine.class);

    private final PresenceStateStore stateStore;
    private final Duration stalenessThreshold;

    // Last non-empty snapshot per realm (or first time the realm was seen)
    private final ConcurrentHashMap<String, Instant> lastDataAt = new ConcurrentHashMap<>();

    public DiffEngine(PresenceStateStore stateStore, Duration stalenessThreshold) {
        this.stateStore = stateStore;
        this.stalenessThreshold = stalenessThreshold;
    }

    /**
     * Diff a snapshot against the stored online set and apply it.
     *
     * @return the delta, or empty for a quiet poll
     */
    public Optional<PresenceDelta> observe(String realmId, Set<String> snapshot, Instant timestamp) {
        if (snapshot.isEmpty()) {
            lastDataAt.putIfAbsent(realmId, timestamp);
        } else {
            lastDataAt.put(realmId, timestamp);
        }

        Set<String> previous = stateStore.current(realmId);

        Set<String> joined = new HashSet<>(snapshot);
        joined.removeAll(previous);

        Set<String> left = new HashSet<>(previous);
        left.removeAll(snapshot);

        if (joined.isEmpty() && left.isEmpty()) {
            return Optional.empty();
        }

        stateStore.apply(realmId, joined, left);
        log.debug("[DIFF] realm={} joined={} left={}", realmId, joined.size(), left.size());
        return Optional.of(new PresenceDelta(realmId, joined, left, timestamp));
    }

    /**
     * Staleness signal for the realm, if due.
     * Must be called once per cycle whatever the poll outcome was.
     */
    public Optional<RealmStaleEvent> checkStaleness(String realmId, Instant now) {
        Instant last = lastDataAt.putIfAbsent(realmId, now);
        if (last == null) {
            return Optional.empty();
        }
        if (Duration.between(last, now).compareTo(stalenessThreshold) < 0) {
            return Optional.empty();
        }

        lastDataAt.put(realmId, now);
        log.info("[DIFF] realm={} returned no data since {}", realmId, last);
        return Optional.of(new RealmStaleEvent(realmId, last, now));
    }

    public Optional<Instant> lastDataAt(String realmId) {
        return Optional.ofNullable(lastDataAt.get(realmId));
    }

    /**
     * Stop tracking staleness for a realm leaving the rotation.
     */
    public void forget(String realmId) {
        lastDataAt.remove(realmId);
    }
}
