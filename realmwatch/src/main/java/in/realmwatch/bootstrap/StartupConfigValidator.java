package in.realmwatch.bootstrap;

import in.realmwatch.config.TrackerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Startup configuration validator.
 *
 * Validates tunables before anything is wired. Throws IllegalStateException
 * listing every problem found, and the process refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * @param config pipeline tunables
     * @param presenceApiUrl base URL of the presence source
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(TrackerConfig config, String presenceApiUrl) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        List<String> problems = new ArrayList<>();

        if (config.pollInterval().isZero() || config.pollInterval().isNegative()) {
            problems.add("POLL_INTERVAL_SECONDS must be positive");
        }
        if (config.pollConcurrency() <= 0) {
            problems.add("POLL_CONCURRENCY must be positive");
        }
        if (config.pollWorkers() < config.pollConcurrency()) {
            problems.add("POLL_WORKERS (" + config.pollWorkers() + ") must be at least POLL_CONCURRENCY ("
                + config.pollConcurrency() + ")");
        }
        if (config.channelFailureLimit() <= 0 || config.offlineRoleFailureLimit() <= 0
            || config.realmMissingFailureLimit() <= 0) {
            problems.add("failure limits must be positive");
        }
        if (config.stalenessThreshold().compareTo(config.pollInterval()) <= 0) {
            problems.add("STALENESS_THRESHOLD_HOURS must exceed the poll interval");
        }
        if (config.sessionGraceWindow().isNegative() || config.displayNameCacheTtl().isNegative()) {
            problems.add("SESSION_GRACE_MINUTES and DISPLAY_NAME_CACHE_SECONDS cannot be negative");
        }

        if (presenceApiUrl == null || presenceApiUrl.isBlank()) {
            problems.add("PRESENCE_API_URL is required");
        } else {
            try {
                URI uri = URI.create(presenceApiUrl);
                if (uri.getScheme() == null || !uri.getScheme().startsWith("http")) {
                    problems.add("PRESENCE_API_URL must be an http(s) URL: " + presenceApiUrl);
                }
            } catch (IllegalArgumentException e) {
                problems.add("PRESENCE_API_URL is malformed: " + presenceApiUrl);
            }
        }

        if (!problems.isEmpty()) {
            problems.forEach(p -> log.error("❌ {}", p));
            throw new IllegalStateException("Invalid configuration:\n  - " + String.join("\n  - ", problems));
        }

        log.info("Poll interval: {}s, concurrency: {}, workers: {}",
            config.pollInterval().toSeconds(), config.pollConcurrency(), config.pollWorkers());
        log.info("Failure limits: channel={}, offline role={}, realm missing={}",
            config.channelFailureLimit(), config.offlineRoleFailureLimit(), config.realmMissingFailureLimit());
        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private StartupConfigValidator() {}
}
