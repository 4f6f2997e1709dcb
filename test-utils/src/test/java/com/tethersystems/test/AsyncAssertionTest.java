package com.tethersystems.test;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AsyncAssertionTest {

    @Test
    void testEventuallySucceedsWhenConditionBecomesTrue() {
        long start = System.currentTimeMillis();
        AsyncAssertion.eventually(() -> System.currentTimeMillis() - start > 100, Duration.ofSeconds(2));
    }

    @Test
    void testEventuallyFailsAfterTimeout() {
        AssertionError error = assertThrows(AssertionError.class,
                () -> AsyncAssertion.eventually(() -> false, Duration.ofMillis(100)));
        assertTrue(error.getMessage().contains("did not become true"));
    }

    @Test
    void testAwaitValueReportsValuesSeen() {
        AtomicInteger counter = new AtomicInteger();

        AssertionError error = assertThrows(AssertionError.class,
                () -> AsyncAssertion.awaitValue(counter::incrementAndGet, -1, Duration.ofMillis(150), 50));

        assertTrue(error.getMessage().contains("Values seen"));
    }

    @Test
    void testAwaitValueReturnsMatch() {
        AtomicInteger counter = new AtomicInteger();

        int value = AsyncAssertion.awaitValue(counter::incrementAndGet, 3, Duration.ofSeconds(2), 10);

        assertEquals(3, value);
    }

    @Test
    void testEventuallyAssertRetriesUntilPassing() {
        AtomicInteger attempts = new AtomicInteger();

        AsyncAssertion.eventuallyAssert(() -> assertTrue(attempts.incrementAndGet() >= 3), Duration.ofSeconds(2), 10);

        assertTrue(attempts.get() >= 3);
    }
}
