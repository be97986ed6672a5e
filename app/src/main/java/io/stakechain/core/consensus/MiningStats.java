package io.stakechain.core.consensus;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters shared by every search run by one {@link ProofOfWork}.
 * Reset only through {@link #reset()}.
 */
public final class MiningStats {
    private final AtomicLong hashesComputed = new AtomicLong();
    private final AtomicLong blocksMined = new AtomicLong();
    private final AtomicLong totalMiningTimeMs = new AtomicLong();

    void record(long hashes, long elapsedMs, boolean sealed) {
        hashesComputed.addAndGet(hashes);
        totalMiningTimeMs.addAndGet(elapsedMs);
        if (sealed) blocksMined.incrementAndGet();
    }

    public long hashesComputed() { return hashesComputed.get(); }
    public long blocksMined() { return blocksMined.get(); }
    public long totalMiningTimeMs() { return totalMiningTimeMs.get(); }

    /** Hashes per second over all searches so far; 0 before any time has elapsed. */
    public double averageHashRate() {
        long ms = totalMiningTimeMs.get();
        if (ms <= 0) return 0.0;
        return hashesComputed.get() / (ms / 1000.0);
    }

    public void reset() {
        hashesComputed.set(0);
        blocksMined.set(0);
        totalMiningTimeMs.set(0);
    }

    @Override public String toString() {
        return "MiningStats{hashes=" + hashesComputed() + ", blocks=" + blocksMined()
                + ", timeMs=" + totalMiningTimeMs() + "}";
    }
}
