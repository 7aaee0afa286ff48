package in.realmwatch.support;

import in.realmwatch.application.port.output.DeliveryGateway;
import in.realmwatch.application.port.output.DeliveryResult;
import in.realmwatch.domain.destination.DestinationConfig;
import in.realmwatch.domain.notification.Notification;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Gateway that records deliveries and answers with configured results.
 */
public final class RecordingDeliveryGateway implements DeliveryGateway {

    public record Delivery(String destinationId, Notification notification) {
    }

    private final List<Delivery> deliveries = new CopyOnWriteArrayList<>();
    private final Map<String, DeliveryResult> results = new ConcurrentHashMap<>();
    private final Set<String> unmentionableRoles = ConcurrentHashMap.newKeySet();

    @Override
    public DeliveryResult deliver(DestinationConfig destination, Notification notification) {
        deliveries.add(new Delivery(destination.destinationId(), notification));
        return results.getOrDefault(destination.destinationId(), DeliveryResult.DELIVERED);
    }

    @Override
    public boolean canMentionRole(DestinationConfig destination, String roleId) {
        return !unmentionableRoles.contains(roleId);
    }

    public void respondWith(String destinationId, DeliveryResult result) {
        results.put(destinationId, result);
    }

    public void makeUnmentionable(String roleId) {
        unmentionableRoles.add(roleId);
    }

    public List<Delivery> deliveries() {
        return List.copyOf(deliveries);
    }

    public List<Delivery> deliveriesTo(String destinationId) {
        return deliveries.stream().filter(d -> d.destinationId().equals(destinationId)).toList();
    }
}
