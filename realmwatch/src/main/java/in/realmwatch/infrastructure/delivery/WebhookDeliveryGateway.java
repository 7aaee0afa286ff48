package in.realmwatch.infrastructure.delivery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.realmwatch.application.port.output.DeliveryGateway;
import in.realmwatch.application.port.output.DeliveryResult;
import in.realmwatch.domain.destination.DestinationConfig;
import in.realmwatch.domain.notification.Notification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Delivers notifications by POSTing JSON to the destination's webhook URL
 * (the destination's channel id).
 *
 * HTTP status mapping:
 * - 2xx: DELIVERED
 * - 401/403: PERMISSION_DENIED
 * - 404/410: CHANNEL_MISSING
 * - anything else, or an I/O error: TRANSIENT_FAILURE
 *
 * A webhook cannot read role settings and the receiving end accepts an
 * unresolvable mention as plain text, so {@link #canMentionRole} only checks
 * that a role is configured. With this gateway the OFFLINE_ROLE failure class
 * therefore only fires for gateways that can inspect roles; a broken offline
 * role is never cleared automatically.
 */
public final class WebhookDeliveryGateway implements DeliveryGateway {
    private static final Logger log = LoggerFactory.getLogger(WebhookDeliveryGateway.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public WebhookDeliveryGateway() {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), new ObjectMapper());
    }

    public WebhookDeliveryGateway(HttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public DeliveryResult deliver(DestinationConfig destination, Notification notification) {
        if (!destination.hasChannel()) {
            return DeliveryResult.CHANNEL_MISSING;
        }

        URI uri;
        try {
            uri = URI.create(destination.channelId());
        } catch (IllegalArgumentException e) {
            log.warn("[WEBHOOK] destination={} has a malformed channel: {}", destination.destinationId(), e.getMessage());
            return DeliveryResult.CHANNEL_MISSING;
        }

        String payload;
        try {
            payload = objectMapper.writeValueAsString(toPayload(notification));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize notification", e);
        }

        HttpRequest request = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(REQUEST_TIMEOUT)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(payload))
            .build();

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            DeliveryResult result = classify(response.statusCode());
            if (result != DeliveryResult.DELIVERED) {
                log.info("[WEBHOOK] destination={} HTTP {} -> {}", destination.destinationId(), response.statusCode(), result);
            }
            return result;
        } catch (IOException e) {
            log.warn("[WEBHOOK] destination={} delivery failed: {}", destination.destinationId(), e.getMessage());
            return DeliveryResult.TRANSIENT_FAILURE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeliveryResult.TRANSIENT_FAILURE;
        }
    }

    /**
     * True for any configured role; see the class notes.
     */
    @Override
    public boolean canMentionRole(DestinationConfig destination, String roleId) {
        return roleId != null && !roleId.isBlank();
    }

    static DeliveryResult classify(int statusCode) {
        if (statusCode / 100 == 2) {
            return DeliveryResult.DELIVERED;
        }
        return switch (statusCode) {
            case 401, 403 -> DeliveryResult.PERMISSION_DENIED;
            case 404, 410 -> DeliveryResult.CHANNEL_MISSING;
            default -> DeliveryResult.TRANSIENT_FAILURE;
        };
    }

    ObjectNode toPayload(Notification notification) {
        ObjectNode root = objectMapper.createObjectNode();
        if (notification.getMentionRoleId() != null) {
            root.put("content", "<@&" + notification.getMentionRoleId() + ">");
        }

        ObjectNode embed = objectMapper.createObjectNode();
        if (notification.getTitle() != null) {
            embed.put("title", notification.getTitle());
        }
        if (notification.getDescription() != null) {
            embed.put("description", notification.getDescription());
        }
        if (notification.getColor() != null) {
            embed.put("color", colorValue(notification.getColor()));
        }
        if (!notification.getFields().isEmpty()) {
            ArrayNode fields = embed.putArray("fields");
            for (Notification.Field field : notification.getFields()) {
                fields.addObject()
                    .put("name", field.name())
                    .put("value", field.value());
            }
        }
        if (notification.getFooter() != null) {
            embed.putObject("footer").put("text", notification.getFooter());
        }
        if (notification.getTimestamp() != null) {
            embed.put("timestamp", notification.getTimestamp().toString());
        }

        root.putArray("embeds").add(embed);
        return root;
    }

    private static int colorValue(Notification.Color color) {
        return switch (color) {
            case GREY -> 0x979C9F;
            case YELLOW -> 0xF1C40F;
        };
    }
}
