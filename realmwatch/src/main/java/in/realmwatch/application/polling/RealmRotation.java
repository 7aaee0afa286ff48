package in.realmwatch.application.polling;

/**
 * The set of realms being polled.
 */
public interface RealmRotation {

    /**
     * Remove a realm from rotation for good and unsubscribe it at the source.
     */
    void dropRealm(String realmId, String reason);

    /**
     * Allow a previously dropped realm back into rotation.
     */
    void restoreRealm(String realmId);
}
