package in.realmwatch.application.port.output;

import java.time.Duration;

final class NoopPresenceMetrics implements PresenceMetrics {
    static final NoopPresenceMetrics INSTANCE = new NoopPresenceMetrics();

    private NoopPresenceMetrics() {}

    @Override public void recordPoll(String outcome, Duration latency) {}
    @Override public void recordCycleSkipped() {}
    @Override public void setPollsInFlight(int inFlight) {}
    @Override public void setTrackedRealms(int realms) {}
    @Override public void setOnlineParticipants(int participants) {}
    @Override public void recordDelta(int joined, int left) {}
    @Override public void recordRealmDown() {}
    @Override public void recordStaleness() {}
    @Override public void recordNotification(String kind, DeliveryResult result) {}
    @Override public void recordListenerFailure(String listener) {}
    @Override public void recordDeactivation(String reason) {}
    @Override public void recordRealmDropped() {}
}
