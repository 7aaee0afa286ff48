package in.realmwatch.support;

import in.realmwatch.application.port.output.PresenceSource;
import in.realmwatch.application.port.output.PresenceSourceException;
import in.realmwatch.domain.presence.PollResult;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Presence source answering from per-realm scripts.
 *
 * Realms without a script (or whose script ran out) answer with the fallback.
 * Tracks how many calls are in flight at once.
 */
public final class ScriptedPresenceSource implements PresenceSource {

    @FunctionalInterface
    public interface Response {
        PollResult answer(String realmId);
    }

    private final Map<String, Deque<Response>> scripts = new ConcurrentHashMap<>();
    private final Set<String> unsubscribed = ConcurrentHashMap.newKeySet();
    private final Set<String> unknownRealms = ConcurrentHashMap.newKeySet();
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    private volatile Response fallback = snapshot();
    private volatile long delayMillis = 0;
    private volatile CountDownLatch entered;
    private volatile CountDownLatch release;

    public static Response snapshot(String... participants) {
        return realmId -> PollResult.snapshot(Set.of(participants));
    }

    public static Response unreachable() {
        return realmId -> PollResult.unreachable("realm offline");
    }

    public static Response failure() {
        return realmId -> {
            throw new PresenceSourceException(realmId, "connection reset");
        };
    }

    public void script(String realmId, Response... responses) {
        Deque<Response> queue = scripts.computeIfAbsent(realmId, k -> new ArrayDeque<>());
        synchronized (queue) {
            for (Response response : responses) {
                queue.addLast(response);
            }
        }
    }

    public void setFallback(Response fallback) {
        this.fallback = fallback;
    }

    public void setDelayMillis(long delayMillis) {
        this.delayMillis = delayMillis;
    }

    /**
     * Block every poll until {@link #releaseBlocked()} is called.
     *
     * @return latch counted down whenever a poll starts waiting
     */
    public CountDownLatch blockPolls(int expectedEntries) {
        entered = new CountDownLatch(expectedEntries);
        release = new CountDownLatch(1);
        return entered;
    }

    public void releaseBlocked() {
        if (release != null) {
            release.countDown();
        }
    }

    public void markUnknown(String realmId) {
        unknownRealms.add(realmId);
    }

    @Override
    public PollResult poll(String realmId) {
        calls.incrementAndGet();
        int now = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(now, Math::max);
        try {
            awaitRelease();
            if (delayMillis > 0) {
                Thread.sleep(delayMillis);
            }
            return next(realmId).answer(realmId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PresenceSourceException(realmId, "interrupted", e);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    @Override
    public boolean unsubscribe(String realmId) {
        unsubscribed.add(realmId);
        return !unknownRealms.contains(realmId);
    }

    public int calls() {
        return calls.get();
    }

    public int maxInFlight() {
        return maxInFlight.get();
    }

    public Set<String> unsubscribed() {
        return Set.copyOf(unsubscribed);
    }

    private void awaitRelease() throws InterruptedException {
        CountDownLatch enteredLatch = entered;
        CountDownLatch releaseLatch = release;
        if (releaseLatch == null) {
            return;
        }
        enteredLatch.countDown();
        if (!releaseLatch.await(10, TimeUnit.SECONDS)) {
            throw new IllegalStateException("poll was never released");
        }
    }

    private Response next(String realmId) {
        Deque<Response> queue = scripts.get(realmId);
        if (queue != null) {
            synchronized (queue) {
                Response response = queue.pollFirst();
                if (response != null) {
                    return response;
                }
            }
        }
        return fallback;
    }
}
