package in.realmwatch.application.polling;

/**
 * How a realm's poll cycle ended.
 */
public enum CycleOutcome {
    /** Snapshot received and processed. */
    SNAPSHOT,
    /** Source reported the realm unreachable. */
    UNREACHABLE,
    /** Transient source failure or processing error; retried next tick. */
    FAILED,
    /** Previous cycle for the realm still running, or realm dropped. */
    SKIPPED
}
