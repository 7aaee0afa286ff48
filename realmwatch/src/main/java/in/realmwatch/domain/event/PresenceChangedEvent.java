package in.realmwatch.domain.event;

import in.realmwatch.domain.presence.PresenceDelta;

import java.time.Instant;

/**
 * A poll produced a non-empty delta.
 *
 * @param onlineCount size of the realm's online set after the delta was applied
 */
public record PresenceChangedEvent(PresenceDelta delta, int onlineCount) implements PresenceEvent {

    public PresenceChangedEvent {
        if (delta == null || delta.isEmpty()) {
            throw new IllegalArgumentException("delta must be present and non-empty");
        }
    }

    @Override
    public String realmId() {
        return delta.realmId();
    }

    @Override
    public Instant timestamp() {
        return delta.timestamp();
    }
}
