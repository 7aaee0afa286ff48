package in.realmwatch.application.event;

import in.realmwatch.application.monitoring.AlertService;
import in.realmwatch.application.monitoring.ErrorReporter;
import in.realmwatch.application.port.output.PresenceMetrics;
import in.realmwatch.domain.common.InvariantViolationException;
import in.realmwatch.domain.event.PresenceChangedEvent;
import in.realmwatch.domain.event.PresenceEvent;
import in.realmwatch.domain.event.RealmDownEvent;
import in.realmwatch.domain.monitoring.Alert;
import in.realmwatch.domain.monitoring.AlertLevel;
import in.realmwatch.domain.presence.PresenceDelta;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PresenceEventBus.
 *
 * Tests:
 * - Type routing and registration order
 * - Listener isolation, crashes raise a CRITICAL alert
 * - Invariant violations are surfaced after dispatch
 */
@ExtendWith(MockitoExtension.class)
class PresenceEventBusTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private PresenceMetrics metrics;

    private ErrorReporter errorReporter;
    private PresenceEventBus bus;
    private List<Alert> alerts;

    @BeforeEach
    void setUp() {
        alerts = new ArrayList<>();
        AlertService alertService = new AlertService();
        alertService.addSink(alerts::add);
        errorReporter = new ErrorReporter(alertService);
        bus = new PresenceEventBus(metrics, errorReporter);
    }

    @Test
    void testListenersRunInRegistrationOrder() {
        List<String> calls = new ArrayList<>();
        bus.register(PresenceChangedEvent.class, "first", e -> calls.add("first"));
        bus.register(PresenceChangedEvent.class, "second", e -> calls.add("second"));
        bus.register(PresenceEvent.class, "any", e -> calls.add("any"));

        assertEquals(0, bus.publish(changed("R1")));
        assertEquals(List.of("first", "second", "any"), calls);
    }

    @Test
    void testEventsRouteByType() {
        List<PresenceEvent> changes = new ArrayList<>();
        List<PresenceEvent> downs = new ArrayList<>();
        bus.register(PresenceChangedEvent.class, "changes", changes::add);
        bus.register(RealmDownEvent.class, "downs", downs::add);

        bus.publish(new RealmDownEvent("R1", Set.of("A"), T0));

        assertTrue(changes.isEmpty());
        assertEquals(1, downs.size());
    }

    @Test
    void testFailingListenerDoesNotAffectOthers() {
        List<String> calls = new ArrayList<>();
        bus.register(PresenceChangedEvent.class, "broken", e -> {
            throw new IllegalStateException("boom");
        });
        bus.register(PresenceChangedEvent.class, "healthy", e -> calls.add(e.realmId()));

        int failures = bus.publish(changed("R1"));

        assertEquals(1, failures);
        assertEquals(List.of("R1"), calls);
        verify(metrics).recordListenerFailure("broken");
        assertEquals(0, errorReporter.fatalCount(), "Contained failures are not fatal");
        assertEquals(1, alerts.size());
        assertEquals(AlertLevel.CRITICAL, alerts.get(0).getLevel());
        assertTrue(alerts.get(0).getMessage().contains("listener 'broken'"));
    }

    @Test
    void testCheckedExceptionIsContained() {
        bus.register(PresenceChangedEvent.class, "io", e -> {
            throw new java.io.IOException("disk full");
        });

        assertEquals(1, bus.publish(changed("R1")));
    }

    @Test
    void testInvariantViolationRethrownAfterAllListeners() {
        List<String> calls = new ArrayList<>();
        bus.register(PresenceChangedEvent.class, "checker", e -> {
            throw new InvariantViolationException(e.realmId(), "inconsistent");
        });
        bus.register(PresenceChangedEvent.class, "after", e -> calls.add("after"));

        InvariantViolationException thrown = assertThrows(InvariantViolationException.class,
            () -> bus.publish(changed("R1")));

        assertEquals("R1", thrown.getRealmId());
        assertEquals(List.of("after"), calls, "Remaining listeners still run");
    }

    @Test
    void testListenerCount() {
        bus.register(PresenceChangedEvent.class, "a", e -> { });
        bus.register(RealmDownEvent.class, "b", e -> { });

        assertEquals(2, bus.listenerCount());
    }

    private static PresenceChangedEvent changed(String realmId) {
        return new PresenceChangedEvent(new PresenceDelta(realmId, Set.of("A"), Set.of(), T0), 1);
    }
}
