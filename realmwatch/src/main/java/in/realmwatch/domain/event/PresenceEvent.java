package in.realmwatch.domain.event;

import java.time.Instant;

/**
 * Event emitted by a realm's poll cycle.
 */
public interface PresenceEvent {

    String realmId();

    Instant timestamp();
}
