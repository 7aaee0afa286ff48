package in.realmwatch.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class TrackerConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("POLL_CONCURRENCY");
        System.clearProperty("POLL_WORKERS");
        System.clearProperty("STALENESS_THRESHOLD_HOURS");
    }

    @Test
    void testDefaults() {
        TrackerConfig config = TrackerConfig.defaults();

        assertEquals(Duration.ofSeconds(60), config.pollInterval());
        assertEquals(12, config.pollConcurrency());
        assertEquals(3, config.channelFailureLimit());
        assertEquals(3, config.offlineRoleFailureLimit());
        assertEquals(7, config.realmMissingFailureLimit());
        assertEquals(Duration.ofHours(24), config.stalenessThreshold());
        assertTrue(config.isValid());
    }

    @Test
    void testOverridesFromProperties() {
        System.setProperty("POLL_CONCURRENCY", "4");
        System.setProperty("POLL_WORKERS", "8");
        System.setProperty("STALENESS_THRESHOLD_HOURS", "12");

        TrackerConfig config = TrackerConfig.fromEnv();

        assertEquals(4, config.pollConcurrency());
        assertEquals(8, config.pollWorkers());
        assertEquals(Duration.ofHours(12), config.stalenessThreshold());
        assertEquals(Duration.ofSeconds(60), config.pollInterval());
    }

    @Test
    void testWorkersBelowConcurrencyInvalid() {
        TrackerConfig d = TrackerConfig.defaults();
        TrackerConfig config = new TrackerConfig(d.pollInterval(), 12, 6, 3, 3, 7,
            d.stalenessThreshold(), d.sessionGraceWindow(), d.displayNameCacheTtl());

        assertFalse(config.isValid());
    }

    @Test
    void testNullDurationRejected() {
        assertThrows(IllegalArgumentException.class, () ->
            new TrackerConfig(null, 12, 24, 3, 3, 7, Duration.ofHours(24), Duration.ZERO, Duration.ZERO));
    }
}
