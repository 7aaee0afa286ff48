package in.realmwatch.integration;

import in.realmwatch.application.polling.CycleOutcome;
import in.realmwatch.application.subscription.SubscriptionService;
import in.realmwatch.domain.destination.FailureClass;
import in.realmwatch.domain.event.PresenceChangedEvent;
import in.realmwatch.domain.event.RealmDownEvent;
import in.realmwatch.domain.presence.ParticipantSession;
import in.realmwatch.domain.presence.PresenceDelta;
import in.realmwatch.support.Destinations;
import in.realmwatch.support.TestPipeline;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static in.realmwatch.support.ScriptedPresenceSource.snapshot;
import static in.realmwatch.support.ScriptedPresenceSource.unreachable;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end cycles over in-memory adapters.
 *
 * Flow: source -> diff -> state store -> event bus -> session rows + notifications
 */
class PresencePipelineIntegrationTest {

    private TestPipeline pipeline;

    @BeforeEach
    void setUp() {
        pipeline = new TestPipeline();
        pipeline.configRepo.save(Destinations.live("D1", "R1"));
    }

    @AfterEach
    void tearDown() {
        pipeline.scheduler.stop(Duration.ofSeconds(5));
    }

    @Test
    void testJoinAndLeaveFlowThroughPipeline() {
        pipeline.source.script("R1", snapshot("A", "B"), snapshot("B", "C"));

        pipeline.scheduler.runCycle("R1");
        int upsertsAfterFirst = pipeline.sessionRepo.upserts().size();
        pipeline.clock.advance(Duration.ofMinutes(1));
        assertEquals(CycleOutcome.SNAPSHOT, pipeline.scheduler.runCycle("R1"));

        List<PresenceChangedEvent> changes = pipeline.eventsOf(PresenceChangedEvent.class);
        PresenceDelta delta = changes.get(1).delta();
        assertEquals(Set.of("C"), delta.joined());
        assertEquals(Set.of("A"), delta.left());
        assertEquals(2, changes.get(1).onlineCount());
        assertEquals(Set.of("B", "C"), pipeline.stateStore.current("R1"));

        List<ParticipantSession> second = pipeline.sessionRepo.upserts()
            .subList(upsertsAfterFirst, pipeline.sessionRepo.upserts().size());
        Map<String, Boolean> written = second.stream()
            .collect(Collectors.toMap(ParticipantSession::participantId, ParticipantSession::online));
        assertEquals(Map.of("A", false, "C", true), written, "Only A and C are touched");

        assertEquals(2, pipeline.gateway.deliveriesTo("D1").size());
    }

    @Test
    void testRestartRecoveryKeepsCorrelationIds() {
        pipeline.source.script("R1", snapshot("A"));
        pipeline.scheduler.runCycle("R1");
        String correlationId = pipeline.sessionRepo.find("R1", "A").orElseThrow().correlationId();

        TestPipeline restarted = new TestPipeline();
        pipeline.sessionRepo.findAll().forEach(restarted.sessionRepo::insert);
        restarted.stateStore.recover(restarted.sessionRepo, restarted.identityResolver,
            restarted.clock.instant(), Duration.ofMinutes(5));

        assertEquals(Set.of("A"), restarted.stateStore.current("R1"));
        assertEquals(correlationId, restarted.identityResolver.resolve("R1", "A"));

        restarted.source.script("R1", snapshot("A"));
        restarted.scheduler.runCycle("R1");
        assertTrue(restarted.eventsOf(PresenceChangedEvent.class).isEmpty(), "Recovered state produces no join");
        restarted.scheduler.stop(Duration.ofSeconds(1));
    }

    @Test
    void testRealmDownMarksSessionsOfflineAndNotifies() {
        pipeline.configRepo.save(Destinations.withOfflineRole("D2", "R1", "role-1"));
        pipeline.source.script("R1", snapshot("A", "B"), unreachable(), unreachable());

        pipeline.scheduler.runCycle("R1");
        pipeline.scheduler.runCycle("R1");
        pipeline.scheduler.runCycle("R1");

        assertEquals(1, pipeline.eventsOf(RealmDownEvent.class).size());
        assertTrue(pipeline.sessionRepo.findOnline().isEmpty());
        assertEquals(1, pipeline.gateway.deliveriesTo("D2").size());
        assertEquals("Realm Offline", pipeline.gateway.deliveriesTo("D2").get(0).notification().getTitle());
        assertTrue(pipeline.offlineRepo.contains("R1"));
    }

    @Test
    void testDeadRealmIsDroppedAfterSeventhWarning() {
        pipeline.source.setFallback(snapshot());

        pipeline.scheduler.runCycle("R1");
        for (int i = 0; i < 7; i++) {
            pipeline.clock.advance(Duration.ofHours(24));
            pipeline.scheduler.runCycle("R1");
        }

        assertEquals(6, pipeline.gateway.deliveriesTo("D1").stream()
            .filter(d -> "Warning".equals(d.notification().getTitle())).count());
        assertFalse(pipeline.configRepo.get("D1").hasChannel());
        assertTrue(pipeline.scheduler.droppedRealms().contains("R1"));
        assertEquals(Set.of("R1"), pipeline.source.unsubscribed());
        assertEquals(Set.of(), pipeline.scheduler.rotation());
    }

    @Test
    void testDataAfterWarningResetsMissingDataCounter() {
        pipeline.source.setFallback(snapshot());
        pipeline.scheduler.runCycle("R1");
        pipeline.clock.advance(Duration.ofHours(24));
        pipeline.scheduler.runCycle("R1");
        assertEquals(1, pipeline.configRepo.getFailureCount("D1",
            FailureClass.REALM_DATA_MISSING));

        pipeline.source.script("R1", snapshot("A"));
        pipeline.scheduler.runCycle("R1");

        assertEquals(0, pipeline.configRepo.getFailureCount("D1",
            FailureClass.REALM_DATA_MISSING));
    }

    @Test
    void testOfflineParticipantRejoiningAfterRestartKeepsItsRow() {
        pipeline.source.script("R1", snapshot("A"), snapshot());
        pipeline.scheduler.runCycle("R1");
        pipeline.scheduler.runCycle("R1");
        String correlationId = pipeline.sessionRepo.find("R1", "A").orElseThrow().correlationId();

        TestPipeline restarted = new TestPipeline();
        restarted.configRepo.save(Destinations.live("D1", "R1"));
        pipeline.sessionRepo.findAll().forEach(restarted.sessionRepo::insert);
        restarted.stateStore.recover(restarted.sessionRepo, restarted.identityResolver,
            restarted.clock.instant(), Duration.ofMinutes(5));

        restarted.source.script("R1", snapshot("A"));
        restarted.scheduler.runCycle("R1");

        assertEquals(1, restarted.sessionRepo.rowCount());
        ParticipantSession row = restarted.sessionRepo.find("R1", "A").orElseThrow();
        assertEquals(correlationId, row.correlationId());
        assertTrue(row.online());
        assertEquals(0, restarted.errorReporter.fatalCount());
        restarted.scheduler.stop(Duration.ofSeconds(1));
    }

    @Test
    void testRelinkAfterRemovalWritesRowsForParticipantsStillOnline() {
        SubscriptionService subscriptions = new SubscriptionService(
            pipeline.configRepo, pipeline.sessionRepo, pipeline.scheduler);
        pipeline.source.script("R1", snapshot("A"), snapshot("A"));

        pipeline.scheduler.runCycle("R1");
        assertTrue(subscriptions.remove("D1"));
        assertEquals(Set.of(), pipeline.stateStore.current("R1"));
        assertTrue(pipeline.sessionRepo.find("R1", "A").isEmpty());

        subscriptions.link(Destinations.live("D1", "R1"));
        assertEquals(CycleOutcome.SNAPSHOT, pipeline.scheduler.runCycle("R1"));

        assertEquals(Set.of("A"), pipeline.stateStore.current("R1"));
        assertTrue(pipeline.sessionRepo.find("R1", "A").orElseThrow().online());
    }
}
