package in.realmwatch.domain.event;

import java.time.Instant;
import java.util.Set;

/**
 * The realm moved from reachable to unreachable.
 *
 * @param disconnected participants that were online before the realm went down
 */
public record RealmDownEvent(String realmId, Set<String> disconnected, Instant timestamp) implements PresenceEvent {

    public RealmDownEvent {
        disconnected = Set.copyOf(disconnected);
    }
}
