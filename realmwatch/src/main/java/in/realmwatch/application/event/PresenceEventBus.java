package in.realmwatch.application.event;

import in.realmwatch.application.monitoring.ErrorReporter;
import in.realmwatch.application.port.output.PresenceMetrics;
import in.realmwatch.domain.common.InvariantViolationException;
import in.realmwatch.domain.event.PresenceEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous in-process fan-out of presence events.
 *
 * Listeners run on the publishing thread in registration order, each inside
 * its own error boundary. A realm's events are published by that realm's
 * cycle only, so per-realm order is publication order. An invariant
 * violation raised by a listener does not stop the remaining listeners but
 * is rethrown to the publisher once all of them ran.
 */
public final class PresenceEventBus {
    private static final Logger log = LoggerFactory.getLogger(PresenceEventBus.class);

    private final List<Registration<?>> registrations = new CopyOnWriteArrayList<>();
    private final PresenceMetrics metrics;
    private final ErrorReporter errorReporter;

    public PresenceEventBus(PresenceMetrics metrics, ErrorReporter errorReporter) {
        this.metrics = metrics;
        this.errorReporter = errorReporter;
    }

    /**
     * Register a listener for an event type (and its subtypes).
     */
    public <E extends PresenceEvent> void register(Class<E> type, String name, PresenceEventListener<? super E> listener) {
        registrations.add(new Registration<>(type, name, listener));
        log.info("[BUS] Registered listener '{}' for {}", name, type.getSimpleName());
    }

    /**
     * Deliver an event to every matching listener.
     *
     * @return number of listeners that failed
     * @throws InvariantViolationException after dispatch, if a listener raised one
     */
    public int publish(PresenceEvent event) {
        int failures = 0;
        InvariantViolationException violation = null;

        for (Registration<?> registration : registrations) {
            if (!registration.type().isInstance(event)) {
                continue;
            }
            try {
                registration.dispatch(event);
            } catch (InvariantViolationException e) {
                failures++;
                metrics.recordListenerFailure(registration.name());
                if (violation == null) {
                    violation = e;
                } else {
                    violation.addSuppressed(e);
                }
            } catch (Exception e) {
                failures++;
                metrics.recordListenerFailure(registration.name());
                errorReporter.reportContained(
                    "listener '" + registration.name() + "' on " + event.getClass().getSimpleName()
                        + " for realm " + event.realmId(), e);
            }
        }

        if (violation != null) {
            throw violation;
        }
        return failures;
    }

    public int listenerCount() {
        return registrations.size();
    }

    private record Registration<E extends PresenceEvent>(
        Class<E> type, String name, PresenceEventListener<? super E> listener) {

        void dispatch(PresenceEvent event) throws Exception {
            listener.onEvent(type.cast(event));
        }
    }
}
