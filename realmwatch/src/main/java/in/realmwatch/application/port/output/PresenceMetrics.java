package in.realmwatch.application.port.output;

import java.time.Duration;

/**
 * Pipeline metrics for monitoring and alerting.
 *
 * Implementations can publish to Prometheus, CloudWatch, etc.
 */
public interface PresenceMetrics {

    /**
     * Record a finished call to the presence source.
     *
     * @param outcome snapshot, unreachable or error
     */
    void recordPoll(String outcome, Duration latency);

    /**
     * A realm's cycle was skipped because the previous one was still running.
     */
    void recordCycleSkipped();

    /**
     * Number of presence-source calls currently holding the admission gate.
     */
    void setPollsInFlight(int inFlight);

    void setTrackedRealms(int realms);

    void setOnlineParticipants(int participants);

    void recordDelta(int joined, int left);

    void recordRealmDown();

    void recordStaleness();

    /**
     * @param kind live_update, realm_offline or staleness_warning
     */
    void recordNotification(String kind, DeliveryResult result);

    void recordListenerFailure(String listener);

    /**
     * @param reason failure class name, ENTITLEMENT, MISSING_CHANNEL or UNLINKED
     */
    void recordDeactivation(String reason);

    void recordRealmDropped();

    /**
     * Metrics sink that records nothing.
     */
    static PresenceMetrics noop() {
        return NoopPresenceMetrics.INSTANCE;
    }
}
