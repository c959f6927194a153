package com.example.lrucache;

import com.example.lrucache.core.LruCache;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
    "lru.capacity=10",
    "lru.workload.enabled=true",
    "lru.workload.writers=3",
    "lru.workload.readers=3",
    "lru.workload.keys-per-thread=10"
})
class LruCacheApplicationTests {

    @Autowired
    private LruCache<String, String> cache;

    @Test
    void contextLoadsAndStartupWorkloadRespectsCapacity() {
        assertEquals(10, cache.capacity());
        assertEquals(10, cache.size());
        assertEquals(20, cache.stats().getEvictions());
    }
}
