package in.realmwatch.application.presence;

import in.realmwatch.application.port.output.ParticipantSessionRepository;
import in.realmwatch.domain.common.InvariantViolationException;
import in.realmwatch.domain.presence.ParticipantSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Authoritative in-memory online set per realm.
 *
 * Each realm entry is replaced atomically; realms never lock each other.
 * Only the realm's own poll cycle writes its entry.
 */
public final class PresenceStateStore {
    private static final Logger log = LoggerFactory.getLogger(PresenceStateStore.class);

    private final ConcurrentHashMap<String, Set<String>> online = new ConcurrentHashMap<>();

    /**
     * Participants currently online in the realm (immutable copy).
     */
    public Set<String> current(String realmId) {
        return online.getOrDefault(realmId, Set.of());
    }

    /**
     * Apply a delta to the realm's online set.
     *
     * @throws InvariantViolationException if a joined participant is already
     *         online or a left participant is not
     */
    public void apply(String realmId, Set<String> joined, Set<String> left) {
        online.compute(realmId, (key, existing) -> {
            Set<String> next = existing == null ? new HashSet<>() : new HashSet<>(existing);
            for (String participant : left) {
                if (!next.remove(participant)) {
                    throw new InvariantViolationException(realmId, "left participant " + participant + " was not online");
                }
            }
            for (String participant : joined) {
                if (!next.add(participant)) {
                    throw new InvariantViolationException(realmId, "joined participant " + participant + " was already online");
                }
            }
            return next.isEmpty() ? null : Set.copyOf(next);
        });
    }

    /**
     * Drop the realm's online set.
     *
     * @return the participants that were online
     */
    public Set<String> clear(String realmId) {
        Set<String> previous = online.remove(realmId);
        return previous == null ? Set.of() : previous;
    }

    public int realmCount() {
        return online.size();
    }

    public int totalOnline() {
        return online.values().stream().mapToInt(Set::size).sum();
    }

    /**
     * Rebuild state from durable session rows.
     *
     * Rows still marked online but not seen within the grace window belong to
     * sessions that ended while the process was down; they are corrected to
     * offline before loading. The correlation id of every row, online or not,
     * is seeded into the resolver so a returning participant keeps its row.
     *
     * @return number of participants loaded as online
     */
    public int recover(ParticipantSessionRepository sessionRepo, IdentityResolver identityResolver,
                       Instant now, Duration graceWindow) {
        int expired = sessionRepo.markOfflineSeenBefore(now.minus(graceWindow));
        if (expired > 0) {
            log.info("[RECOVERY] Marked {} sessions offline (not seen since {})", expired, now.minus(graceWindow));
        }

        int seeded = 0;
        int loaded = 0;
        for (ParticipantSession session : sessionRepo.findAll()) {
            identityResolver.seed(session.realmId(), session.participantId(), session.correlationId());
            seeded++;
            if (!session.online()) {
                continue;
            }
            online.compute(session.realmId(), (key, existing) -> {
                Set<String> next = existing == null ? new HashSet<>() : new HashSet<>(existing);
                next.add(session.participantId());
                return Set.copyOf(next);
            });
            loaded++;
        }

        log.info("[RECOVERY] Seeded {} correlation ids, loaded {} online participants across {} realms",
            seeded, loaded, online.size());
        return loaded;
    }
}
