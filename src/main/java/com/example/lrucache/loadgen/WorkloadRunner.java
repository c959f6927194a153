package com.example.lrucache.loadgen;

import com.example.lrucache.config.LruCacheProperties;
import com.example.lrucache.core.LruCache;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Drives the cache with writer threads followed by reader threads.
 *
 * <p>Writer {@code t} puts keys {@code t*stride + i} for {@code i < keysPerThread}, where the stride is
 * 100 or {@code keysPerThread} if larger; reader {@code t}
 * then reads the same range back. Ranges are disjoint per thread, so only capacity pressure
 * makes a reader miss.
 */
@Component
public class WorkloadRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(WorkloadRunner.class);

    private final LruCache<String, String> cache;
    private final LruCacheProperties properties;

    public WorkloadRunner(LruCache<String, String> cache, LruCacheProperties properties) {
        this.cache = cache;
        this.properties = properties;
    }

    @Override
    public void run(String... args) throws Exception {
        LruCacheProperties.Workload workload = properties.getWorkload();
        if (!workload.isEnabled()) {
            return;
        }
        log.info("Starting workload (Writers={}, Readers={}, KeysPerThread={}, Capacity={})",
            workload.getWriters(), workload.getReaders(), workload.getKeysPerThread(), cache.capacity());

        WorkloadReport report = execute(workload.getWriters(), workload.getReaders(), workload.getKeysPerThread());
        log.info("Workload finished. {}", report);
    }

    /**
     * Runs the write phase, waits for it, then runs the read phase.
     *
     * @throws ExecutionException if a worker thread failed
     */
    public WorkloadReport execute(int writers, int readers, int keysPerThread)
            throws InterruptedException, ExecutionException {
        if (writers < 0 || readers < 0 || keysPerThread < 0) {
            throw new IllegalArgumentException("Thread and key counts must not be negative");
        }

        int stride = stride(keysPerThread);
        long evictionsBefore = cache.stats().getEvictions();
        ConcurrentLinkedQueue<Double> latencies = new ConcurrentLinkedQueue<>();
        AtomicLong puts = new AtomicLong();
        AtomicLong hits = new AtomicLong();
        AtomicLong misses = new AtomicLong();

        runPhase(writers, threadId -> {
            for (int i = 0; i < keysPerThread; i++) {
                String key = key(threadId, i, stride);
                long start = System.nanoTime();
                cache.put(key, "Value_" + threadId + "_" + i);
                latencies.add((System.nanoTime() - start) / 1_000.0);
                puts.incrementAndGet();
            }
        });

        runPhase(readers, threadId -> {
            for (int i = 0; i < keysPerThread; i++) {
                String key = key(threadId, i, stride);
                long start = System.nanoTime();
                Optional<String> value = cache.get(key);
                latencies.add((System.nanoTime() - start) / 1_000.0);
                if (value.isPresent()) {
                    hits.incrementAndGet();
                    log.debug("Thread {} read: key={}, value={}", threadId, key, value.get());
                } else {
                    misses.incrementAndGet();
                }
            }
        });

        DescriptiveStatistics stats = new DescriptiveStatistics();
        latencies.forEach(stats::addValue);
        double p99 = stats.getN() > 0 ? stats.getPercentile(99) : 0.0;
        double max = stats.getN() > 0 ? stats.getMax() : 0.0;

        return new WorkloadReport(puts.get(), hits.get(), misses.get(), cache.size(),
            cache.stats().getEvictions() - evictionsBefore, p99, max);
    }

    static int stride(int keysPerThread) {
        return Math.max(100, keysPerThread);
    }

    static String key(int threadId, int i, int stride) {
        return String.valueOf((long) threadId * stride + i);
    }

    private static void runPhase(int threads, Worker worker) throws InterruptedException, ExecutionException {
        if (threads == 0) {
            return;
        }
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>(threads);
            for (int t = 0; t < threads; t++) {
                int threadId = t;
                futures.add(executor.submit(() -> worker.run(threadId)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @FunctionalInterface
    private interface Worker {
        void run(int threadId);
    }
}
