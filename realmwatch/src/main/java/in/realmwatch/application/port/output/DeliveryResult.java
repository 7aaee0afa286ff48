package in.realmwatch.application.port.output;

/**
 * Outcome of one delivery attempt.
 */
public enum DeliveryResult {
    DELIVERED,
    PERMISSION_DENIED,
    CHANNEL_MISSING,
    /**
     * Network trouble or rate limiting; not held against the destination.
     */
    TRANSIENT_FAILURE;

    public boolean isChannelProblem() {
        return this == PERMISSION_DENIED || this == CHANNEL_MISSING;
    }
}
