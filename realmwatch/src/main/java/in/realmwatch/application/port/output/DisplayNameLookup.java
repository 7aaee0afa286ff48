package in.realmwatch.application.port.output;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * Resolves participant ids to human-readable names.
 */
public interface DisplayNameLookup {

    /**
     * Batch lookup. Ids in bypassCache are always fetched fresh.
     * Ids that cannot be resolved map to a fallback rendering of the id.
     */
    Map<String, String> displayNames(Collection<String> participantIds, Set<String> bypassCache);
}
