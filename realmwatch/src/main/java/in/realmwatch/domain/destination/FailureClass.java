package in.realmwatch.domain.destination;

/**
 * Categories of destination failures, each with its own counter and limit.
 */
public enum FailureClass {
    /**
     * Delivery rejected: missing channel or missing permissions.
     */
    CHANNEL,

    /**
     * The configured offline role cannot be mentioned.
     */
    OFFLINE_ROLE,

    /**
     * The linked realm produced no data for the staleness threshold.
     */
    REALM_DATA_MISSING
}
