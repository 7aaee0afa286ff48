package in.realmwatch.domain.notification;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Rendered message handed to the delivery gateway.
 */
public final class Notification {
    private final String title;
    private final String description;
    private final List<Field> fields;
    private final String footer;
    private final Color color;
    private final Instant timestamp;
    private final String mentionRoleId;

    public enum Color {
        GREY,
        YELLOW
    }

    public record Field(String name, String value) {
    }

    private Notification(Builder builder) {
        this.title = builder.title;
        this.description = builder.description;
        this.fields = List.copyOf(builder.fields);
        this.footer = builder.footer;
        this.color = builder.color;
        this.timestamp = builder.timestamp;
        this.mentionRoleId = builder.mentionRoleId;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public List<Field> getFields() {
        return fields;
    }

    public String getFooter() {
        return footer;
    }

    public Color getColor() {
        return color;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getMentionRoleId() {
        return mentionRoleId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String title;
        private String description;
        private final List<Field> fields = new ArrayList<>();
        private String footer;
        private Color color = Color.GREY;
        private Instant timestamp;
        private String mentionRoleId;

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder appendDescription(String addition) {
            this.description = description == null ? addition : description + addition;
            return this;
        }

        public Builder field(String name, String value) {
            this.fields.add(new Field(name, value));
            return this;
        }

        public Builder footer(String footer) {
            this.footer = footer;
            return this;
        }

        public Builder color(Color color) {
            this.color = color;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder mentionRoleId(String mentionRoleId) {
            this.mentionRoleId = mentionRoleId;
            return this;
        }

        public Notification build() {
            if (title == null && description == null && fields.isEmpty()) {
                throw new IllegalStateException("notification needs a title, description or field");
            }
            return new Notification(this);
        }
    }

    @Override
    public String toString() {
        return String.format("Notification[%s, %d fields, %s]", title, fields.size(), timestamp);
    }
}
