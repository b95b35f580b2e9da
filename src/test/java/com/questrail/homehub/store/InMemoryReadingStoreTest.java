package com.questrail.homehub.store;

import com.questrail.homehub.api.Reading;
import com.questrail.homehub.api.SensorProperty;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryReadingStoreTest {

    private static final Instant T0 = Instant.parse("2025-03-01T08:00:00Z");

    @Test
    void loadLatestKeepsNewestPerSensorAndProperty() {
        InMemoryReadingStore store = new InMemoryReadingStore();
        store.persist(new Reading("kitchen", SensorProperty.TEMPERATURE, 20.0, T0));
        store.persist(new Reading("kitchen", SensorProperty.HUMIDITY, 40.0, T0));
        store.persist(new Reading("kitchen", SensorProperty.TEMPERATURE, 21.0, T0.plusSeconds(60)));

        List<Reading> latest = store.loadLatest();

        assertEquals(2, latest.size());
        assertTrue(latest.contains(new Reading("kitchen", SensorProperty.TEMPERATURE, 21.0, T0.plusSeconds(60))));
        assertEquals(2, store.size());
    }

    @Test
    void repeatedWritesOfOneKeyDoNotGrowTheStore() {
        InMemoryReadingStore store = new InMemoryReadingStore();
        for (int i = 0; i < 10_000; i++) {
            store.persist(new Reading("kitchen", SensorProperty.TEMPERATURE, 20.0 + (i % 10), T0.plusSeconds(5L * i)));
        }

        assertEquals(1, store.size());
        assertEquals(T0.plusSeconds(5L * 9_999), store.loadLatest().get(0).observedAt());
    }

    @Test
    void seededRowsAreVisible() {
        Reading r = new Reading("attic", SensorProperty.PRESSURE, 990.0, T0);
        InMemoryReadingStore store = new InMemoryReadingStore(List.of(r));

        assertEquals(List.of(r), store.loadLatest());
    }

    @Test
    void emptyStoreLoadsNothing() {
        assertTrue(new InMemoryReadingStore().loadLatest().isEmpty());
    }
}
