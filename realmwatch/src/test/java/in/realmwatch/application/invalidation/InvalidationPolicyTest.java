package in.realmwatch.application.invalidation;

import in.realmwatch.application.invalidation.InvalidationPolicy.MissingDataVerdict;
import in.realmwatch.application.monitoring.AlertService;
import in.realmwatch.application.port.output.PresenceMetrics;
import in.realmwatch.config.TrackerConfig;
import in.realmwatch.domain.destination.DestinationConfig;
import in.realmwatch.domain.destination.FailureClass;
import in.realmwatch.domain.monitoring.Alert;
import in.realmwatch.support.Destinations;
import in.realmwatch.support.InMemoryDestinationConfigRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for InvalidationPolicy.
 *
 * Tests:
 * - Deactivation exactly at the limit
 * - Counter reset on success
 * - Entitlement and missing-channel deactivations
 * - Realm-wide missing-data accounting
 */
class InvalidationPolicyTest {

    private InMemoryDestinationConfigRepository repo;
    private List<Alert> alerts;
    private InvalidationPolicy policy;

    @BeforeEach
    void setUp() {
        repo = new InMemoryDestinationConfigRepository();
        alerts = new ArrayList<>();
        AlertService alertService = new AlertService();
        alertService.addSink(alerts::add);
        policy = new InvalidationPolicy(repo, PresenceMetrics.noop(), alertService, TrackerConfig.defaults());
    }

    @Test
    void testLimitsFromConfig() {
        assertEquals(3, policy.limitFor(FailureClass.CHANNEL));
        assertEquals(3, policy.limitFor(FailureClass.OFFLINE_ROLE));
        assertEquals(7, policy.limitFor(FailureClass.REALM_DATA_MISSING));
    }

    @Test
    void testMissingLimitRejected() {
        assertThrows(IllegalArgumentException.class, () -> new InvalidationPolicy(repo, PresenceMetrics.noop(),
            new AlertService(), Map.of(FailureClass.CHANNEL, 3)));
    }

    @Test
    void testChannelDisabledExactlyOnThirdFailure() {
        DestinationConfig dest = Destinations.live("D1", "R1");
        repo.save(dest);

        assertFalse(policy.recordFailure(dest, FailureClass.CHANNEL));
        assertFalse(policy.recordFailure(dest, FailureClass.CHANNEL));
        assertTrue(repo.get("D1").hasChannel(), "Still active after two failures");

        assertTrue(policy.recordFailure(dest, FailureClass.CHANNEL));

        DestinationConfig disabled = repo.get("D1");
        assertFalse(disabled.hasChannel());
        assertFalse(disabled.liveUpdates());
        assertEquals(0, repo.getFailureCount("D1", FailureClass.CHANNEL), "Counter resets after deactivation");
        assertEquals(1, alerts.size());
        assertEquals("DESTINATION_DEACTIVATED", alerts.get(0).getAlertType());
    }

    @Test
    void testSuccessResetsCounter() {
        DestinationConfig dest = Destinations.live("D1", "R1");
        repo.save(dest);

        policy.recordFailure(dest, FailureClass.CHANNEL);
        policy.recordFailure(dest, FailureClass.CHANNEL);
        policy.recordSuccess(dest, FailureClass.CHANNEL);
        policy.recordFailure(dest, FailureClass.CHANNEL);

        assertTrue(repo.get("D1").hasChannel());
        assertEquals(1, repo.getFailureCount("D1", FailureClass.CHANNEL));
    }

    @Test
    void testFailureClassesCountIndependently() {
        DestinationConfig dest = Destinations.withOfflineRole("D1", "R1", "role-1");
        repo.save(dest);

        policy.recordFailure(dest, FailureClass.CHANNEL);
        policy.recordFailure(dest, FailureClass.CHANNEL);
        policy.recordFailure(dest, FailureClass.OFFLINE_ROLE);
        policy.recordFailure(dest, FailureClass.OFFLINE_ROLE);

        assertTrue(policy.recordFailure(dest, FailureClass.OFFLINE_ROLE));

        DestinationConfig updated = repo.get("D1");
        assertNull(updated.offlineRoleId());
        assertTrue(updated.hasChannel(), "Offline-role limit leaves the channel alone");
        assertEquals(2, repo.getFailureCount("D1", FailureClass.CHANNEL));
    }

    @Test
    void testEntitlementLossBypassesCounters() {
        DestinationConfig dest = new DestinationConfig("D1", "R1", "https://hooks.test/D1",
            true, true, null, true, false);
        repo.save(dest);

        DestinationConfig updated = policy.invalidateEntitlement(dest);

        assertFalse(updated.liveUpdates());
        assertFalse(updated.fetchDevices());
        assertTrue(updated.hasChannel());
        assertEquals(updated, repo.get("D1"));
    }

    @Test
    void testMissingChannelDisablesLiveUpdates() {
        DestinationConfig dest = new DestinationConfig("D1", "R1", null, true, true, null, false, true);
        repo.save(dest);

        assertFalse(policy.deactivateMissingChannel(dest).liveUpdates());
        assertFalse(repo.get("D1").liveUpdates());
    }

    @Test
    void testRealmDataMissingWarnsViableDestinations() {
        repo.save(Destinations.live("D1", "R1"));
        repo.save(Destinations.withoutChannel("D2", "R1"));

        MissingDataVerdict verdict = policy.recordRealmDataMissing("R1");

        assertEquals(List.of("D1"), verdict.toWarn().stream().map(DestinationConfig::destinationId).toList());
        assertFalse(verdict.dropRealm());
        assertNull(repo.get("D2").realmId(), "Destination without channel is unlinked");
        assertEquals(1, repo.getFailureCount("D1", FailureClass.REALM_DATA_MISSING));
    }

    @Test
    void testRealmDroppedWhenNoDestinationHasChannel() {
        repo.save(Destinations.withoutChannel("D1", "R1"));

        MissingDataVerdict verdict = policy.recordRealmDataMissing("R1");

        assertTrue(verdict.toWarn().isEmpty());
        assertTrue(verdict.dropRealm());
    }

    @Test
    void testSeventhMissingDataWarningDeactivates() {
        repo.save(Destinations.live("D1", "R1"));

        for (int i = 1; i < 7; i++) {
            MissingDataVerdict verdict = policy.recordRealmDataMissing("R1");
            assertEquals(1, verdict.toWarn().size(), "Warning " + i + " is delivered");
            assertFalse(verdict.dropRealm());
        }

        MissingDataVerdict last = policy.recordRealmDataMissing("R1");

        assertTrue(last.toWarn().isEmpty());
        assertTrue(last.dropRealm());
        assertFalse(repo.get("D1").hasChannel());
    }

    @Test
    void testDestinationWithWarningsOffKeepsRealmAlive() {
        repo.save(new DestinationConfig("D1", "R1", "https://hooks.test/D1", true, false, null, false, true));

        MissingDataVerdict verdict = policy.recordRealmDataMissing("R1");

        assertTrue(verdict.toWarn().isEmpty());
        assertFalse(verdict.dropRealm());
        assertEquals(0, repo.getFailureCount("D1", FailureClass.REALM_DATA_MISSING));
    }

    @Test
    void testDataReceivedResetsMissingDataCounters() {
        repo.save(Destinations.live("D1", "R1"));
        policy.recordRealmDataMissing("R1");
        policy.recordRealmDataMissing("R1");

        policy.recordRealmDataReceived("R1");

        assertEquals(0, repo.getFailureCount("D1", FailureClass.REALM_DATA_MISSING));
    }

    @Test
    void testFirstDataAfterRestartResetsPersistedCounters() {
        repo.save(Destinations.live("D1", "R1"));
        for (int i = 0; i < 6; i++) {
            repo.incrementFailureCount("D1", FailureClass.REALM_DATA_MISSING);
        }
        InvalidationPolicy restarted = new InvalidationPolicy(repo, PresenceMetrics.noop(),
            new AlertService(), TrackerConfig.defaults());

        restarted.recordRealmDataReceived("R1");
        assertEquals(0, repo.getFailureCount("D1", FailureClass.REALM_DATA_MISSING));

        MissingDataVerdict verdict = restarted.recordRealmDataMissing("R1");
        assertEquals(1, repo.getFailureCount("D1", FailureClass.REALM_DATA_MISSING));
        assertEquals(1, verdict.toWarn().size());
        assertTrue(repo.get("D1").hasChannel());
    }

    @Test
    void testRepeatedDataWithoutWarningLeavesCountersAlone() {
        repo.save(Destinations.live("D1", "R1"));
        policy.recordRealmDataReceived("R1");
        repo.incrementFailureCount("D1", FailureClass.REALM_DATA_MISSING);

        policy.recordRealmDataReceived("R1");

        assertEquals(1, repo.getFailureCount("D1", FailureClass.REALM_DATA_MISSING));
    }
}
