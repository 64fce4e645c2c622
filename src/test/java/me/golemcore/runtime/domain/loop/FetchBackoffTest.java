package me.golemcore.runtime.domain.loop;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FetchBackoffTest {

    @Test
    void onFailure_growsExponentiallyUpToMax() {
        FetchBackoff backoff = new FetchBackoff(500, 3000, 2.0);

        assertEquals(500, backoff.onFailure());
        assertEquals(1000, backoff.onFailure());
        assertEquals(2000, backoff.onFailure());
        assertEquals(3000, backoff.onFailure());
        assertEquals(3000, backoff.onFailure());
        assertEquals(5, backoff.getConsecutiveFailures());
    }

    @Test
    void reset_restartsFromInitialDelay() {
        FetchBackoff backoff = new FetchBackoff(100, 10_000, 3.0);
        backoff.onFailure();
        backoff.onFailure();

        backoff.reset();

        assertEquals(0, backoff.getConsecutiveFailures());
        assertEquals(100, backoff.onFailure());
    }

    @Test
    void multiplierOfOne_keepsConstantDelay() {
        FetchBackoff backoff = new FetchBackoff(250, 250, 1.0);

        assertEquals(250, backoff.onFailure());
        assertEquals(250, backoff.onFailure());
    }

    @Test
    void from_usesLoopConfig() {
        RuntimeLoopConfig config = RuntimeLoopConfig.builder()
                .backoffInitialDelayMs(10)
                .backoffMaxDelayMs(15)
                .backoffMultiplier(2.0)
                .build();

        FetchBackoff backoff = FetchBackoff.from(config);

        assertEquals(10, backoff.onFailure());
        assertEquals(15, backoff.onFailure());
    }

    @Test
    void rejectsInvalidBounds() {
        assertThrows(IllegalArgumentException.class, () -> new FetchBackoff(-1, 100, 2.0));
        assertThrows(IllegalArgumentException.class, () -> new FetchBackoff(200, 100, 2.0));
        assertThrows(IllegalArgumentException.class, () -> new FetchBackoff(100, 200, 0.5));
    }
}
