package in.realmwatch.application.subscription;

import in.realmwatch.application.polling.RealmRotation;
import in.realmwatch.application.port.output.DestinationConfigRepository;
import in.realmwatch.application.port.output.ParticipantSessionRepository;
import in.realmwatch.domain.destination.DestinationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Links and removes destinations.
 *
 * Removing the last destination of a realm stops tracking the realm: it
 * leaves the rotation, is unsubscribed at the source and its session rows
 * are deleted.
 */
public final class SubscriptionService {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionService.class);

    private final DestinationConfigRepository configRepo;
    private final ParticipantSessionRepository sessionRepo;
    private final RealmRotation rotation;

    public SubscriptionService(DestinationConfigRepository configRepo,
                               ParticipantSessionRepository sessionRepo,
                               RealmRotation rotation) {
        this.configRepo = configRepo;
        this.sessionRepo = sessionRepo;
        this.rotation = rotation;
    }

    /**
     * Save a destination and put its realm (back) into rotation.
     */
    public void link(DestinationConfig config) {
        configRepo.save(config);
        if (config.realmId() != null) {
            rotation.restoreRealm(config.realmId());
            log.info("[SUBSCRIPTION] destination={} linked to realm {}", config.destinationId(), config.realmId());
        }
    }

    /**
     * Remove a destination.
     *
     * @return false if no such destination exists
     */
    public boolean remove(String destinationId) {
        Optional<DestinationConfig> existing = configRepo.findById(destinationId);
        if (existing.isEmpty()) {
            return false;
        }

        String realmId = existing.get().realmId();
        configRepo.delete(destinationId);
        log.info("[SUBSCRIPTION] destination={} removed", destinationId);

        if (realmId != null && isLastDestination(realmId, destinationId)) {
            rotation.dropRealm(realmId, "last destination " + destinationId + " removed");
            int deleted = sessionRepo.deleteByRealm(realmId);
            log.info("[SUBSCRIPTION] realm={} no longer tracked, {} session rows deleted", realmId, deleted);
        }
        return true;
    }

    private boolean isLastDestination(String realmId, String removedId) {
        List<DestinationConfig> remaining = configRepo.findByRealm(realmId);
        return remaining.stream().allMatch(d -> d.destinationId().equals(removedId));
    }
}
