package in.realmwatch.domain.event;

import java.time.Instant;
import java.util.Set;

/**
 * A poll returned a snapshot. Emitted after any PresenceChangedEvent of the same cycle.
 */
public record PresenceObservedEvent(String realmId, Set<String> online, Instant timestamp) implements PresenceEvent {

    public PresenceObservedEvent {
        online = Set.copyOf(online);
    }
}
