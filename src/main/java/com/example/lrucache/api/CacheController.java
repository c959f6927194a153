package com.example.lrucache.api;

import com.example.lrucache.core.CacheStats;
import com.example.lrucache.core.LruCache;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class CacheController {

    private static final Logger log = LoggerFactory.getLogger(CacheController.class);

    private final LruCache<String, String> cache;

    public CacheController(LruCache<String, String> cache) {
        this.cache = cache;
    }

    // A hit promotes the key, same as an in-process get
    @GetMapping("/cache/{key}")
    public ResponseEntity<String> getItem(@PathVariable String key) {
        return cache.get(key)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PutMapping("/cache/{key}")
    public ResponseEntity<Void> putItem(@PathVariable String key, @RequestBody String value) {
        if (key.isBlank()) {
            throw new IllegalArgumentException("Key must not be blank");
        }
        cache.put(key, value);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/cache/{key}")
    public ResponseEntity<Void> removeItem(@PathVariable String key) {
        return cache.remove(key)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }

    @GetMapping("/cache")
    public List<String> keys() {
        return cache.keys();
    }

    @GetMapping("/stats")
    public Map<String, Object> getStats() {
        CacheStats stats = cache.stats();
        return Map.of(
            "size", stats.getSize(),
            "capacity", stats.getCapacity(),
            "hits", stats.getHits(),
            "misses", stats.getMisses(),
            "evictions", stats.getEvictions(),
            "hitRate", stats.getHitRate()
        );
    }

    @GetMapping("/reset")
    public ResponseEntity<Void> reset() {
        cache.clear();
        log.info("Cache cleared");
        return ResponseEntity.noContent().build();
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> badRequest(IllegalArgumentException e) {
        log.warn("Rejected cache request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(e.getMessage());
    }
}
