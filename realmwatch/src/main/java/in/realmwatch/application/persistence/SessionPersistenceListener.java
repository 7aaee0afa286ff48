package in.realmwatch.application.persistence;

import in.realmwatch.application.port.output.ParticipantSessionRepository;
import in.realmwatch.application.presence.IdentityResolver;
import in.realmwatch.domain.event.PresenceChangedEvent;
import in.realmwatch.domain.event.PresenceObservedEvent;
import in.realmwatch.domain.event.RealmDownEvent;
import in.realmwatch.domain.presence.ParticipantSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Writes presence changes to durable session rows.
 *
 * Rows are keyed by the resolver's correlation id, so a repeated event
 * updates the same row instead of adding one.
 */
public final class SessionPersistenceListener {
    private static final Logger log = LoggerFactory.getLogger(SessionPersistenceListener.class);

    private final ParticipantSessionRepository sessionRepo;
    private final IdentityResolver identityResolver;

    public SessionPersistenceListener(ParticipantSessionRepository sessionRepo, IdentityResolver identityResolver) {
        this.sessionRepo = sessionRepo;
        this.identityResolver = identityResolver;
    }

    public void onPresenceChanged(PresenceChangedEvent event) {
        List<ParticipantSession> sessions = new ArrayList<>();
        addSessions(sessions, event.realmId(), event.delta().joined(), true, event.timestamp());
        addSessions(sessions, event.realmId(), event.delta().left(), false, event.timestamp());

        sessionRepo.upsertAll(sessions);
        log.debug("[SESSIONS] realm={} upserted {} sessions", event.realmId(), sessions.size());
    }

    public void onRealmDown(RealmDownEvent event) {
        if (event.disconnected().isEmpty()) {
            return;
        }
        List<ParticipantSession> sessions = new ArrayList<>();
        addSessions(sessions, event.realmId(), event.disconnected(), false, event.timestamp());
        sessionRepo.upsertAll(sessions);
        log.debug("[SESSIONS] realm={} marked {} sessions offline", event.realmId(), sessions.size());
    }

    /**
     * Keep last_seen of online participants fresh so startup recovery does not expire them.
     */
    public void onPresenceObserved(PresenceObservedEvent event) {
        if (event.online().isEmpty()) {
            return;
        }
        sessionRepo.touchLastSeen(event.realmId(), event.online(), event.timestamp());
    }

    private void addSessions(List<ParticipantSession> sessions, String realmId, Set<String> participants,
                             boolean online, Instant timestamp) {
        for (String participantId : participants) {
            sessions.add(new ParticipantSession(
                identityResolver.resolve(realmId, participantId),
                realmId,
                participantId,
                online,
                timestamp));
        }
    }
}
