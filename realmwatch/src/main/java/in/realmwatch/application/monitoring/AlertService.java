package in.realmwatch.application.monitoring;

import in.realmwatch.domain.monitoring.Alert;
import in.realmwatch.domain.monitoring.AlertLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Alert notification service.
 *
 * Logs every alert through SLF4J and forwards it to registered sinks
 * (operator DM, pager, ...).
 */
public final class AlertService {
    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private final List<Consumer<Alert>> sinks = new CopyOnWriteArrayList<>();

    public void addSink(Consumer<Alert> sink) {
        sinks.add(sink);
    }

    /**
     * Send alert to configured channels.
     *
     * @param alert Alert to send
     */
    public void sendAlert(Alert alert) {
        switch (alert.getLevel()) {
            case CRITICAL -> log.error("[ALERT-CRITICAL] {} - {}", alert.getAlertType(), alert.getMessage());
            case WARNING -> log.warn("[ALERT-WARNING] {} - {}", alert.getAlertType(), alert.getMessage());
            case INFO -> log.info("[ALERT-INFO] {} - {}", alert.getAlertType(), alert.getMessage());
        }

        for (Consumer<Alert> sink : sinks) {
            try {
                sink.accept(alert);
            } catch (RuntimeException e) {
                log.error("[ALERT] Sink failed for {}: {}", alert.getAlertType(), e.getMessage(), e);
            }
        }
    }

    public void sendCriticalAlert(String alertType, String realmId, String message) {
        sendAlert(Alert.builder()
            .alertType(alertType)
            .level(AlertLevel.CRITICAL)
            .realmId(realmId)
            .message(message)
            .build());
    }

    public void sendWarningAlert(String alertType, String realmId, String message) {
        sendAlert(Alert.builder()
            .alertType(alertType)
            .level(AlertLevel.WARNING)
            .realmId(realmId)
            .message(message)
            .build());
    }
}
