package in.realmwatch.application.event;

import in.realmwatch.domain.event.PresenceEvent;

/**
 * Consumer of one presence event type.
 */
@FunctionalInterface
public interface PresenceEventListener<E extends PresenceEvent> {

    void onEvent(E event) throws Exception;
}
