package in.realmwatch.domain.presence;

import java.time.Instant;
import java.util.Set;

/**
 * Participants that joined or left a realm between two polls.
 */
public record PresenceDelta(
    String realmId,
    Set<String> joined,
    Set<String> left,
    Instant timestamp
) {
    public PresenceDelta {
        if (realmId == null || timestamp == null) {
            throw new IllegalArgumentException("realmId and timestamp cannot be null");
        }
        joined = Set.copyOf(joined);
        left = Set.copyOf(left);
    }

    public boolean isEmpty() {
        return joined.isEmpty() && left.isEmpty();
    }
}
