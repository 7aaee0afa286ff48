package in.realmwatch.domain.destination;

/**
 * Subscriber settings for one destination.
 *
 * Owned by the configuration store; the pipeline reads it and writes back
 * modified copies when a feature is deactivated.
 */
public record DestinationConfig(
    String destinationId,
    String realmId,              // null when not linked to a realm
    String channelId,            // delivery channel reference, null when unset
    boolean liveUpdates,
    boolean warningNotifications,
    String offlineRoleId,        // role mentioned on realm-down, null when unset
    boolean fetchDevices,        // always refresh display data of joining participants
    boolean entitled             // active entitlement for premium features
) {
    public DestinationConfig {
        if (destinationId == null || destinationId.isBlank()) {
            throw new IllegalArgumentException("destinationId cannot be blank");
        }
    }

    public boolean hasChannel() {
        return channelId != null && !channelId.isBlank();
    }

    public boolean hasOfflineRole() {
        return offlineRoleId != null && !offlineRoleId.isBlank();
    }

    public DestinationConfig withoutChannel() {
        return new DestinationConfig(destinationId, realmId, null, false,
            warningNotifications, null, fetchDevices, entitled);
    }

    public DestinationConfig withoutOfflineRole() {
        return new DestinationConfig(destinationId, realmId, channelId, liveUpdates,
            warningNotifications, null, fetchDevices, entitled);
    }

    public DestinationConfig withLiveUpdates(boolean enabled) {
        return new DestinationConfig(destinationId, realmId, channelId, enabled,
            warningNotifications, offlineRoleId, fetchDevices, entitled);
    }

    public DestinationConfig withoutEntitledFeatures() {
        return new DestinationConfig(destinationId, realmId, channelId, false,
            warningNotifications, offlineRoleId, false, entitled);
    }

    public DestinationConfig unlinkedFromRealm() {
        return new DestinationConfig(destinationId, null, channelId, false,
            warningNotifications, offlineRoleId, false, entitled);
    }
}
