package in.realmwatch.domain.event;

import java.time.Instant;

/**
 * No non-empty snapshot arrived for the realm within the staleness threshold.
 *
 * @param lastDataAt last time the realm returned a non-empty snapshot
 *                   (or the time tracking started)
 */
public record RealmStaleEvent(String realmId, Instant lastDataAt, Instant timestamp) implements PresenceEvent {
}
