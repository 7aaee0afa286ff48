package in.realmwatch.application.port.output;

import in.realmwatch.domain.presence.ParticipantSession;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Repository for participant_sessions table.
 */
public interface ParticipantSessionRepository {

    /**
     * Bulk idempotent upsert keyed by (realm, participant).
     * On conflict only online and last_seen are updated; the stored
     * correlation id is kept.
     */
    void upsertAll(Collection<ParticipantSession> sessions);

    /**
     * Refresh last_seen of participants that are still online.
     */
    void touchLastSeen(String realmId, Collection<String> participantIds, Instant lastSeen);

    /**
     * Mark every online row with last_seen before the cutoff as offline.
     *
     * @return number of rows corrected
     */
    int markOfflineSeenBefore(Instant cutoff);

    /**
     * Every stored row, online or not.
     */
    List<ParticipantSession> findAll();

    /**
     * Delete every row of a realm.
     */
    int deleteByRealm(String realmId);
}
