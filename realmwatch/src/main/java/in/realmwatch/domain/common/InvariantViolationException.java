package in.realmwatch.domain.common;

/**
 * Internal state contradicts itself. Never contained by error boundaries.
 */
public class InvariantViolationException extends IllegalStateException {

    private final String realmId;

    public InvariantViolationException(String realmId, String message) {
        super(String.format("[realm %s] %s", realmId, message));
        this.realmId = realmId;
    }

    public String getRealmId() {
        return realmId;
    }
}
