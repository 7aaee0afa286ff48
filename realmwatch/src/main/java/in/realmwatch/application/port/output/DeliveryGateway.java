package in.realmwatch.application.port.output;

import in.realmwatch.domain.destination.DestinationConfig;
import in.realmwatch.domain.notification.Notification;

/**
 * Delivers rendered notifications to a destination's channel.
 */
public interface DeliveryGateway {

    DeliveryResult deliver(DestinationConfig destination, Notification notification);

    /**
     * Whether a notification sent to the destination's channel can ping the role.
     */
    boolean canMentionRole(DestinationConfig destination, String roleId);
}
