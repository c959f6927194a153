package com.example.lrucache.loadgen;

/**
 * Outcome of one {@link WorkloadRunner} execution. Latencies are per cache call, in microseconds.
 */
public class WorkloadReport {

    private final long puts;
    private final long hits;
    private final long misses;
    private final int finalSize;
    private final long evictions;
    private final double p99Micros;
    private final double maxMicros;

    public WorkloadReport(long puts, long hits, long misses, int finalSize, long evictions,
                          double p99Micros, double maxMicros) {
        this.puts = puts;
        this.hits = hits;
        this.misses = misses;
        this.finalSize = finalSize;
        this.evictions = evictions;
        this.p99Micros = p99Micros;
        this.maxMicros = maxMicros;
    }

    public long getPuts() {
        return puts;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    public int getFinalSize() {
        return finalSize;
    }

    public long getEvictions() {
        return evictions;
    }

    public double getP99Micros() {
        return p99Micros;
    }

    public double getMaxMicros() {
        return maxMicros;
    }

    @Override
    public String toString() {
        return String.format("Puts=%d, Hits=%d, Misses=%d, FinalSize=%d, Evictions=%d, P99=%.1fus, Max=%.1fus",
            puts, hits, misses, finalSize, evictions, p99Micros, maxMicros);
    }
}
