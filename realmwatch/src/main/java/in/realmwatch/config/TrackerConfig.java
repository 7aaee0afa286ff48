package in.realmwatch.config;

import in.realmwatch.util.Env;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Tunables of the presence pipeline, fixed at process start.
 */
public record TrackerConfig(
    Duration pollInterval,          // time between two scheduler ticks
    int pollConcurrency,            // max in-flight presence-source calls
    int pollWorkers,                // threads executing realm cycles
    int channelFailureLimit,        // CHANNEL deliveries before deactivation
    int offlineRoleFailureLimit,    // unmentionable offline role before clearing it
    int realmMissingFailureLimit,   // staleness warnings before deactivation
    Duration stalenessThreshold,    // no non-empty snapshot for this long -> warning
    Duration sessionGraceWindow,    // online rows older than this are expired at startup
    Duration displayNameCacheTtl
) {

    public TrackerConfig {
        if (pollInterval == null || stalenessThreshold == null
            || sessionGraceWindow == null || displayNameCacheTtl == null) {
            throw new IllegalArgumentException("durations cannot be null");
        }
    }

    /**
     * Reference policy.
     */
    public static TrackerConfig defaults() {
        return new TrackerConfig(
            Duration.ofSeconds(60),
            12,
            24,
            3,
            3,
            7,
            Duration.ofHours(24),
            Duration.ofMinutes(5),
            Duration.ofMinutes(5)
        );
    }

    public static TrackerConfig fromEnv() {
        TrackerConfig d = defaults();
        return new TrackerConfig(
            Env.getDuration("POLL_INTERVAL_SECONDS", ChronoUnit.SECONDS, d.pollInterval().toSeconds()),
            Env.getInt("POLL_CONCURRENCY", d.pollConcurrency()),
            Env.getInt("POLL_WORKERS", d.pollWorkers()),
            Env.getInt("CHANNEL_FAILURE_LIMIT", d.channelFailureLimit()),
            Env.getInt("OFFLINE_ROLE_FAILURE_LIMIT", d.offlineRoleFailureLimit()),
            Env.getInt("REALM_MISSING_FAILURE_LIMIT", d.realmMissingFailureLimit()),
            Env.getDuration("STALENESS_THRESHOLD_HOURS", ChronoUnit.HOURS, d.stalenessThreshold().toHours()),
            Env.getDuration("SESSION_GRACE_MINUTES", ChronoUnit.MINUTES, d.sessionGraceWindow().toMinutes()),
            Env.getDuration("DISPLAY_NAME_CACHE_SECONDS", ChronoUnit.SECONDS, d.displayNameCacheTtl().toSeconds())
        );
    }

    public boolean isValid() {
        return !pollInterval.isNegative() && !pollInterval.isZero()
            && pollConcurrency > 0
            && pollWorkers >= pollConcurrency
            && channelFailureLimit > 0
            && offlineRoleFailureLimit > 0
            && realmMissingFailureLimit > 0
            && stalenessThreshold.compareTo(pollInterval) > 0
            && !sessionGraceWindow.isNegative()
            && !displayNameCacheTtl.isNegative();
    }
}
