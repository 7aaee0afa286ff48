package in.realmwatch.infrastructure.source;

import java.util.Collection;
import java.util.Map;

/**
 * Uncached batch lookup of participant display names.
 */
public interface DisplayNameSource {

    /**
     * @return names for the ids the source knows; unknown ids are absent
     */
    Map<String, String> fetch(Collection<String> participantIds);
}
