package in.realmwatch.application.presence;

import in.realmwatch.domain.common.InvariantViolationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class IdentityResolverTest {

    @Test
    void testSamePairResolvesToSameId() {
        IdentityResolver resolver = new IdentityResolver();

        String first = resolver.resolve("R1", "alice");
        String second = resolver.resolve("R1", "alice");

        assertEquals(first, second);
        assertEquals(1, resolver.size());
    }

    @Test
    void testDistinctPairsGetDistinctIds() {
        IdentityResolver resolver = new IdentityResolver();

        String a = resolver.resolve("R1", "alice");
        String b = resolver.resolve("R2", "alice");
        String c = resolver.resolve("R1", "bob");

        assertEquals(3, Set.of(a, b, c).size(), "Each (realm, participant) pair needs its own id");
    }

    @Test
    void testIdsWithSeparatorCharactersDoNotCollide() {
        IdentityResolver resolver = new IdentityResolver();

        String a = resolver.resolve("R1-x", "y");
        String b = resolver.resolve("R1", "x-y");

        assertNotEquals(a, b);
    }

    @Test
    void testSeededIdIsReturned() {
        IdentityResolver resolver = new IdentityResolver();
        resolver.seed("R1", "alice", "corr-1");

        assertEquals("corr-1", resolver.resolve("R1", "alice"));
    }

    @Test
    void testSeedingSameIdTwiceIsAllowed() {
        IdentityResolver resolver = new IdentityResolver();
        resolver.seed("R1", "alice", "corr-1");

        assertDoesNotThrow(() -> resolver.seed("R1", "alice", "corr-1"));
    }

    @Test
    void testConflictingSeedIsInvariantViolation() {
        IdentityResolver resolver = new IdentityResolver();
        resolver.seed("R1", "alice", "corr-1");

        InvariantViolationException e = assertThrows(InvariantViolationException.class,
            () -> resolver.seed("R1", "alice", "corr-2"));
        assertEquals("R1", e.getRealmId());
    }

    @Test
    void testConcurrentResolutionAllocatesOneId() throws Exception {
        IdentityResolver resolver = new IdentityResolver();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        Set<String> seen = ConcurrentHashMap.newKeySet();

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    seen.add(resolver.resolve("R1", "alice"));
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, seen.size(), "Concurrent lookups must agree on one id");
    }
}
