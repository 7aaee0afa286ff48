package in.realmwatch.domain.presence;

import java.time.Instant;

/**
 * Durable presence row of one participant in one realm.
 * correlationId is the upsert conflict key.
 */
public record ParticipantSession(
    String correlationId,
    String realmId,
    String participantId,
    boolean online,
    Instant lastSeen
) {
    public ParticipantSession {
        if (correlationId == null || realmId == null || participantId == null || lastSeen == null) {
            throw new IllegalArgumentException("correlationId, realmId, participantId and lastSeen are required");
        }
    }
}
