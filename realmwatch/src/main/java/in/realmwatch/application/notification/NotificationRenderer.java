package in.realmwatch.application.notification;

import in.realmwatch.domain.event.RealmDownEvent;
import in.realmwatch.domain.event.RealmStaleEvent;
import in.realmwatch.domain.notification.Notification;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the notifications sent to destinations.
 */
public final class NotificationRenderer {

    static final String JOINED_FIELD = "Joined";
    static final String LEFT_FIELD = "Left";

    private final String trackerAccountName;

    public NotificationRenderer(String trackerAccountName) {
        this.trackerAccountName = trackerAccountName;
    }

    /**
     * Live summary of who joined and who left.
     */
    public Notification presenceChange(Set<String> joined, Set<String> left, Map<String, String> displayNames,
                                       int onlineCount, Instant timestamp) {
        Notification.Builder builder = Notification.builder()
            .color(Notification.Color.GREY)
            .timestamp(timestamp)
            .footer(onlineCount + (onlineCount == 1 ? " participant" : " participants") + " online as of");

        if (!joined.isEmpty()) {
            builder.field(JOINED_FIELD, listNames(joined, displayNames));
        }
        if (!left.isEmpty()) {
            builder.field(LEFT_FIELD, listNames(left, displayNames));
        }
        return builder.build();
    }

    public Notification realmOffline(RealmDownEvent event, String roleId, boolean roleMentionable) {
        Notification.Builder builder = Notification.builder()
            .title("Realm Offline")
            .description("The realm appears to be offline (or possibly it has no participants).")
            .color(Notification.Color.YELLOW)
            .timestamp(event.timestamp())
            .mentionRoleId(roleId);

        if (!roleMentionable) {
            builder.appendDescription("\n\nThe configured offline role cannot be mentioned. Make sure the role"
                + " still exists and that it is mentionable or that all roles may be mentioned here."
                + "\nAfter a while, offline notices will stop mentioning the role if this is not fixed.");
        }
        return builder.build();
    }

    public Notification stalenessWarning(RealmStaleEvent event) {
        return Notification.builder()
            .title("Warning")
            .description("No information about the realm has been received since "
                + event.lastDataAt() + ". The realm may have been turned off or be inactive. If it is"
                + " not, make sure `" + trackerAccountName + "` has not been banned or kicked from it,"
                + " then link the realm again.\n\nIf nothing changes, updates for this realm will be"
                + " switched off automatically.")
            .color(Notification.Color.YELLOW)
            .timestamp(event.timestamp())
            .build();
    }

    private static String listNames(Set<String> participants, Map<String, String> displayNames) {
        return participants.stream()
            .map(p -> displayNames.getOrDefault(p, p))
            .sorted(Comparator.comparing(String::toLowerCase))
            .collect(Collectors.joining("\n"));
    }
}
