package in.realmwatch.application.port.output;

/**
 * Transient presence-source failure. The next scheduled cycle retries.
 */
public class PresenceSourceException extends RuntimeException {

    private final String realmId;

    public PresenceSourceException(String realmId, String message) {
        super(String.format("[realm %s] %s", realmId, message));
        this.realmId = realmId;
    }

    public PresenceSourceException(String realmId, String message, Throwable cause) {
        super(String.format("[realm %s] %s", realmId, message), cause);
        this.realmId = realmId;
    }

    public String getRealmId() {
        return realmId;
    }
}
