package in.realmwatch.application.port.output;

import in.realmwatch.domain.presence.PollResult;

/**
 * External source of realm presence.
 */
public interface PresenceSource {

    /**
     * Fetch the current online set of a realm.
     *
     * @return a snapshot, or an explicit unreachable result
     * @throws PresenceSourceException on transient failures (network, timeout, 5xx)
     */
    PollResult poll(String realmId);

    /**
     * Stop tracking a realm at the source.
     *
     * @return false if the source does not know the realm
     * @throws PresenceSourceException on transient failures
     */
    boolean unsubscribe(String realmId);
}
