package in.realmwatch.application.presence;

import in.realmwatch.application.port.output.OfflineRealmRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Durable set of realms believed unreachable.
 *
 * Memory mirrors the repository; a failed write rolls the memory change back
 * and rethrows, so the transition is retried on the next cycle.
 */
public final class OfflineRealmTracker {
    private static final Logger log = LoggerFactory.getLogger(OfflineRealmTracker.class);

    private final OfflineRealmRepository repository;
    private final ConcurrentHashMap<String, Instant> offline = new ConcurrentHashMap<>();

    public OfflineRealmTracker(OfflineRealmRepository repository) {
        this.repository = repository;
    }

    /**
     * Load markers persisted by a previous run.
     */
    public int load() {
        Map<String, Instant> persisted = repository.findAll();
        offline.putAll(persisted);
        log.info("[OFFLINE] Loaded {} offline realm markers", persisted.size());
        return persisted.size();
    }

    /**
     * Mark the realm offline.
     *
     * @return true only on the transition into offline
     */
    public boolean markOffline(String realmId, Instant since) {
        if (offline.putIfAbsent(realmId, since) != null) {
            return false;
        }
        try {
            repository.insert(realmId, since);
        } catch (RuntimeException e) {
            offline.remove(realmId, since);
            throw e;
        }
        log.info("[OFFLINE] Realm {} marked offline", realmId);
        return true;
    }

    /**
     * Clear the realm's marker.
     *
     * @return true only if the realm was offline
     */
    public boolean markOnline(String realmId) {
        Instant since = offline.remove(realmId);
        if (since == null) {
            return false;
        }
        try {
            repository.delete(realmId);
        } catch (RuntimeException e) {
            offline.putIfAbsent(realmId, since);
            throw e;
        }
        log.info("[OFFLINE] Realm {} reachable again (offline since {})", realmId, since);
        return true;
    }

    public boolean isOffline(String realmId) {
        return offline.containsKey(realmId);
    }

    public Optional<Instant> offlineSince(String realmId) {
        return Optional.ofNullable(offline.get(realmId));
    }

    public Set<String> offlineRealms() {
        return Set.copyOf(offline.keySet());
    }
}
