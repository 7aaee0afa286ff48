package in.realmwatch.application.monitoring;

import in.realmwatch.domain.common.InvariantViolationException;
import in.realmwatch.domain.monitoring.Alert;
import in.realmwatch.domain.monitoring.AlertLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-level error reporter.
 *
 * Every reported error becomes a CRITICAL alert. Fatal errors (invariant
 * violations, uncaught crashes) are also counted; contained errors, such as
 * a crashing event consumer, were stopped at a component boundary and the
 * pipeline keeps running.
 */
public final class ErrorReporter implements Thread.UncaughtExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ErrorReporter.class);

    private final AlertService alertService;
    private final AtomicLong fatalCount = new AtomicLong();

    public ErrorReporter(AlertService alertService) {
        this.alertService = alertService;
    }

    /**
     * Report an error that must reach an operator.
     */
    public void reportFatal(String context, Throwable error) {
        fatalCount.incrementAndGet();
        log.error("[ERROR] {} failed: {}", context, error.getMessage(), error);

        String realmId = error instanceof InvariantViolationException
            ? ((InvariantViolationException) error).getRealmId()
            : null;
        alertService.sendAlert(Alert.builder()
            .alertType(error instanceof InvariantViolationException ? "INVARIANT_VIOLATION" : "UNEXPECTED_ERROR")
            .level(AlertLevel.CRITICAL)
            .realmId(realmId)
            .message(describe(context, error))
            .build());
    }

    /**
     * Report an error that was contained where it happened.
     */
    public void reportContained(String context, Throwable error) {
        log.error("[ERROR] {} failed (contained): {}", context, error.getMessage(), error);
        alertService.sendAlert(Alert.builder()
            .alertType("CONTAINED_ERROR")
            .level(AlertLevel.CRITICAL)
            .message(describe(context, error))
            .build());
    }

    public long fatalCount() {
        return fatalCount.get();
    }

    private static String describe(String context, Throwable error) {
        return context + ": " + error.getClass().getSimpleName() + ": " + error.getMessage();
    }

    @Override
    public void uncaughtException(Thread thread, Throwable error) {
        reportFatal("thread " + thread.getName(), error);
    }
}
