package in.realmwatch.domain.monitoring;

/**
 * Operator-facing alert raised by the pipeline.
 */
public class Alert {
    private final String alertType;
    private final AlertLevel level;
    private final String message;
    private final String realmId;   // null for process-wide alerts

    private Alert(Builder builder) {
        this.alertType = builder.alertType;
        this.level = builder.level;
        this.message = builder.message;
        this.realmId = builder.realmId;
    }

    public String getAlertType() {
        return alertType;
    }

    public AlertLevel getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public String getRealmId() {
        return realmId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String alertType;
        private AlertLevel level;
        private String message;
        private String realmId;

        public Builder alertType(String alertType) {
            this.alertType = alertType;
            return this;
        }

        public Builder level(AlertLevel level) {
            this.level = level;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder realmId(String realmId) {
            this.realmId = realmId;
            return this;
        }

        public Alert build() {
            if (alertType == null || level == null || message == null) {
                throw new IllegalStateException("alertType, level and message are required");
            }
            return new Alert(this);
        }
    }
}
