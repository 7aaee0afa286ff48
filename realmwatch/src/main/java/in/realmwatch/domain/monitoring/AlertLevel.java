package in.realmwatch.domain.monitoring;

/**
 * Alert severity levels for pipeline monitoring
 */
public enum AlertLevel {
    /**
     * Invariant violated or a consumer crashed; needs an operator.
     */
    CRITICAL,

    /**
     * Degraded resource: realm dropped, destination deactivated.
     */
    WARNING,

    /**
     * General information
     */
    INFO
}
