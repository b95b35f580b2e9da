package com.questrail.homehub.state;

import com.questrail.homehub.api.SensorKey;
import com.questrail.homehub.api.SensorProperty;
import com.questrail.homehub.time.ManualMonotonicClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PersistenceThrottleTest {

    private static final SensorKey KITCHEN_TEMP = new SensorKey("kitchen", SensorProperty.TEMPERATURE);
    private static final SensorKey KITCHEN_HUM = new SensorKey("kitchen", SensorProperty.HUMIDITY);

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final PersistenceThrottle throttle = new PersistenceThrottle(clock, Duration.ofSeconds(5));

    @Test
    void firstCallPerKeyIsGranted() {
        assertTrue(throttle.shouldPersist(KITCHEN_TEMP));
        assertTrue(throttle.shouldPersist(KITCHEN_HUM), "keys are independent");
    }

    @Test
    void callsInsideTheWindowAreRefused() {
        assertTrue(throttle.shouldPersist(KITCHEN_TEMP));
        clock.advance(Duration.ofSeconds(2));
        assertFalse(throttle.shouldPersist(KITCHEN_TEMP));
        clock.advance(Duration.ofMillis(2_999));
        assertFalse(throttle.shouldPersist(KITCHEN_TEMP));
    }

    @Test
    void windowIsMeasuredFromLastGrantNotLastCall() {
        assertTrue(throttle.shouldPersist(KITCHEN_TEMP));
        clock.advance(Duration.ofSeconds(4));
        assertFalse(throttle.shouldPersist(KITCHEN_TEMP));
        clock.advance(Duration.ofSeconds(1));
        assertTrue(throttle.shouldPersist(KITCHEN_TEMP), "5s after the first grant");
        clock.advance(Duration.ofSeconds(1));
        assertFalse(throttle.shouldPersist(KITCHEN_TEMP));
    }

    @Test
    void concurrentCallersGetExactlyOneGrant() throws InterruptedException {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger grants = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            pool.execute(() -> {
                try {
                    go.await();
                    for (int j = 0; j < 1_000; j++) {
                        if (throttle.shouldPersist(KITCHEN_TEMP)) {
                            grants.incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
        go.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(1, grants.get());
    }

    @Test
    void rejectsNegativeWindow() {
        assertThrows(IllegalArgumentException.class, () -> new PersistenceThrottle(clock, Duration.ofSeconds(-1)));
    }
}
