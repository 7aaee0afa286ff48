package in.realmwatch.application.presence;

import in.realmwatch.domain.common.InvariantViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stable correlation ids for (realm, participant) pairs.
 *
 * An id, once handed out, is returned for the same pair for the rest of the
 * process lifetime. Ids loaded from durable session rows at startup are
 * seeded so that upserts keep hitting the same row across restarts.
 * The map only grows; a restart is the only eviction.
 */
public final class IdentityResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private final ConcurrentHashMap<RealmParticipant, String> correlationIds = new ConcurrentHashMap<>();

    /**
     * Correlation id for the pair, allocating one on first lookup.
     */
    public String resolve(String realmId, String participantId) {
        return correlationIds.computeIfAbsent(
            new RealmParticipant(realmId, participantId),
            k -> UUID.randomUUID().toString());
    }

    /**
     * Register an id read from durable storage.
     *
     * @throws InvariantViolationException if the pair already maps to another id
     */
    public void seed(String realmId, String participantId, String correlationId) {
        String existing = correlationIds.putIfAbsent(new RealmParticipant(realmId, participantId), correlationId);
        if (existing != null && !existing.equals(correlationId)) {
            throw new InvariantViolationException(realmId,
                "participant " + participantId + " has two correlation ids: " + existing + " and " + correlationId);
        }
        log.trace("Seeded correlation id {} for {}/{}", correlationId, realmId, participantId);
    }

    public int size() {
        return correlationIds.size();
    }

    private record RealmParticipant(String realmId, String participantId) {
        RealmParticipant {
            if (realmId == null || participantId == null) {
                throw new IllegalArgumentException("realmId and participantId cannot be null");
            }
        }
    }
}
