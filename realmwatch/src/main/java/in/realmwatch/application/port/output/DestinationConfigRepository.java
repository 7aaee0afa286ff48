package in.realmwatch.application.port.output;

import in.realmwatch.domain.destination.DestinationConfig;
import in.realmwatch.domain.destination.FailureClass;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repository for destination configuration and failure counters.
 */
public interface DestinationConfigRepository {

    Optional<DestinationConfig> findById(String destinationId);

    /**
     * All destinations currently linked to the realm.
     */
    List<DestinationConfig> findByRealm(String realmId);

    /**
     * Realms linked by at least one destination with a delivery channel.
     */
    Set<String> findPolledRealmIds();

    void save(DestinationConfig config);

    void delete(String destinationId);

    /**
     * Increment the counter and return the new value.
     */
    int incrementFailureCount(String destinationId, FailureClass failureClass);

    void resetFailureCount(String destinationId, FailureClass failureClass);

    int getFailureCount(String destinationId, FailureClass failureClass);

    /**
     * Reset one failure class for every destination linked to the realm.
     */
    void resetFailureCountsForRealm(String realmId, FailureClass failureClass);
}
