package in.realmwatch.infrastructure.source;

import in.realmwatch.application.port.output.DisplayNameLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Display name lookup with a per-entry TTL.
 *
 * Misses, expired entries and ids in the bypass set are fetched in one batch.
 * When the fetch fails, expired entries are still served and unknown ids
 * render as the raw id; failures are never cached.
 */
public final class CachingDisplayNameLookup implements DisplayNameLookup {
    private static final Logger log = LoggerFactory.getLogger(CachingDisplayNameLookup.class);

    private final DisplayNameSource source;
    private final Duration ttl;
    private final Clock clock;
    private final ConcurrentHashMap<String, CachedName> cache = new ConcurrentHashMap<>();

    public CachingDisplayNameLookup(DisplayNameSource source, Duration ttl, Clock clock) {
        this.source = source;
        this.ttl = ttl;
        this.clock = clock;
    }

    @Override
    public Map<String, String> displayNames(Collection<String> participantIds, Set<String> bypassCache) {
        Instant now = clock.instant();
        Map<String, String> names = new HashMap<>();
        List<String> toFetch = new ArrayList<>();

        for (String id : participantIds) {
            CachedName cached = cache.get(id);
            if (cached != null && !bypassCache.contains(id) && cached.isFresh(now, ttl)) {
                names.put(id, cached.name());
            } else {
                toFetch.add(id);
            }
        }

        if (!toFetch.isEmpty()) {
            Map<String, String> fetched = fetch(toFetch);
            for (String id : toFetch) {
                String name = fetched.get(id);
                if (name != null) {
                    cache.put(id, new CachedName(name, now));
                    names.put(id, name);
                } else {
                    CachedName stale = cache.get(id);
                    names.put(id, stale != null ? stale.name() : id);
                }
            }
        }
        return names;
    }

    public int cachedCount() {
        return cache.size();
    }

    /**
     * Drop entries older than the TTL.
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int before = cache.size();
        cache.values().removeIf(entry -> !entry.isFresh(now, ttl));
        return before - cache.size();
    }

    private Map<String, String> fetch(List<String> ids) {
        try {
            return source.fetch(ids);
        } catch (RuntimeException e) {
            log.warn("[NAMES] Lookup of {} ids failed, using fallbacks: {}", ids.size(), e.getMessage());
            return Map.of();
        }
    }

    private record CachedName(String name, Instant fetchedAt) {
        boolean isFresh(Instant now, Duration ttl) {
            return fetchedAt.plus(ttl).isAfter(now);
        }
    }
}
