package com.loopguard.runtime.cache;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCacheTest {

    @Test
    void tracksHitsAndMisses() {
        InMemoryCache<String, String> cache = new InMemoryCache<>();
        cache.put("user:1", "alice");

        assertEquals("alice", cache.get("user:1"));
        assertNull(cache.get("user:2"));
        assertNull(cache.get("user:3"));

        CacheStats stats = cache.stats();
        assertEquals(1, stats.hits());
        assertEquals(2, stats.misses());
        assertEquals(1.0 / 3, stats.hitRate(), 1e-9);
        assertEquals(1, stats.count());
    }

    @Test
    void jsonEstimatorCountsUtf8Bytes() {
        InMemoryCache<String, String> cache = new InMemoryCache<>();
        cache.put("k", "é");
        // "k" with quotes is 3 bytes; "é" with quotes is 4.
        assertEquals(7, cache.sizeBytes());
    }

    @Test
    void valuesThatCannotBeRenderedGetAFixedSize() {
        Map<String, Object> a = new LinkedHashMap<>();
        Map<String, Object> b = new LinkedHashMap<>();
        a.put("b", b);
        b.put("a", a);

        assertEquals(SizeEstimator.UNRENDERABLE_ENTRY_BYTES, SizeEstimator.json().estimate(null, a));
    }

    @Test
    void runningSizeFollowsPutAndRemove() {
        InMemoryCache<String, String> cache = new InMemoryCache<>((k, v) -> ((String) v).length());
        cache.put("a", "1234");
        cache.put("b", "12");
        assertEquals(6, cache.sizeBytes());

        cache.put("a", "1");
        assertEquals(3, cache.sizeBytes());

        assertEquals("12", cache.remove("b"));
        assertEquals(1, cache.sizeBytes());
        assertNull(cache.remove("missing"));
    }

    @Test
    void cleanEvictsOldestFirst() {
        InMemoryCache<String, Integer> cache = new InMemoryCache<>((k, v) -> 100);
        cache.put("first", 1);
        cache.put("second", 2);
        cache.put("third", 3);
        cache.put("first", 4);

        cache.clean(150);

        assertEquals(1, cache.size());
        assertTrue(cache.containsKey("first"));
        assertEquals(100, cache.sizeBytes());
    }

    @Test
    void cleanToCurrentSizeKeepsEverything() {
        InMemoryCache<String, Integer> cache = new InMemoryCache<>((k, v) -> 10);
        cache.put("a", 1);
        cache.put("b", 2);
        cache.clean(20);
        assertEquals(2, cache.size());
    }

    @Test
    void clearResetsSize() {
        InMemoryCache<String, Integer> cache = new InMemoryCache<>((k, v) -> 10);
        cache.put("a", 1);
        cache.clear();
        assertEquals(0, cache.sizeBytes());
        assertEquals(0, cache.size());
    }

    @Test
    void rejectsNullValues() {
        InMemoryCache<String, String> cache = new InMemoryCache<>();
        assertThrows(NullPointerException.class, () -> cache.put("a", null));
    }

    @Test
    void mapAdapterEvictsFromTheOwnersMap() {
        Map<String, String> sessions = new LinkedHashMap<>();
        sessions.put("s1", "a");
        sessions.put("s2", "b");
        sessions.put("s3", "c");
        MonitoredCache adapter = CacheAdapters.forMap(sessions, (k, v) -> 10);

        assertEquals(30, adapter.sizeBytes());
        adapter.clean(10);

        assertEquals(List.of("s3"), new ArrayList<>(sessions.keySet()));
        assertEquals(1, adapter.stats().count());
    }

    @Test
    void collectionAdapterEvictsInIterationOrder() {
        List<String> recent = new ArrayList<>(List.of("one", "two", "three"));
        MonitoredCache adapter = CacheAdapters.forCollection(recent, (k, v) -> ((String) v).length());

        assertEquals(11, adapter.sizeBytes());
        adapter.clean(5);
        assertEquals(List.of("three"), recent);

        adapter.clear();
        assertTrue(recent.isEmpty());
    }
}
