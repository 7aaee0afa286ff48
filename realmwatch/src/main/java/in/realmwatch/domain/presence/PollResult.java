package in.realmwatch.domain.presence;

import java.util.Set;

/**
 * Answer of the presence source for one realm.
 *
 * A SNAPSHOT carries the full online set (possibly empty). UNREACHABLE is the
 * source's explicit statement that the realm cannot be reached; it is never
 * a network error, those surface as exceptions.
 */
public record PollResult(Status status, Set<String> online, String reason) {

    public enum Status {
        SNAPSHOT,
        UNREACHABLE
    }

    public PollResult {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        online = online == null ? Set.of() : Set.copyOf(online);
    }

    public static PollResult snapshot(Set<String> online) {
        return new PollResult(Status.SNAPSHOT, online, null);
    }

    public static PollResult unreachable(String reason) {
        return new PollResult(Status.UNREACHABLE, Set.of(), reason);
    }

    public boolean isUnreachable() {
        return status == Status.UNREACHABLE;
    }
}
