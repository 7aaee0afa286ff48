package in.realmwatch.application.port.output;

import java.time.Instant;
import java.util.Map;

/**
 * Durable set of realms currently believed unreachable.
 */
public interface OfflineRealmRepository {

    /**
     * All offline markers, realm id to the time the realm went offline.
     */
    Map<String, Instant> findAll();

    /**
     * Insert a marker; an existing marker is left untouched.
     */
    void insert(String realmId, Instant offlineSince);

    void delete(String realmId);
}
