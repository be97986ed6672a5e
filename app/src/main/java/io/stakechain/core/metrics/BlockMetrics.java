package io.stakechain.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.stakechain.core.consensus.MiningStats;

import java.util.function.IntSupplier;
import java.util.function.Supplier;

public class BlockMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter blocksMined = registry.counter("blocks.mined");
    private static final Counter txConfirmed = registry.counter("transactions.confirmed");
    private static final Counter staleBlocks = registry.counter("blocks.stale");
    private static final Timer miningTime = registry.timer("block.mining.time");

    public static <T> T recordMining(Supplier<T> blockProductionLogic) {
        return miningTime.record(blockProductionLogic);
    }

    public static void incrementBlocks() {
        blocksMined.increment();
    }

    public static void incrementStale() {
        staleBlocks.increment();
    }

    public static void recordConfirmed(int transactions) {
        txConfirmed.increment(transactions);
    }

    /** Expose PoW counters and the current difficulty. The first binding of each name wins. */
    public static void bind(MiningStats stats, IntSupplier difficulty) {
        FunctionCounter.builder("pow.hashes", stats, MiningStats::hashesComputed).register(registry);
        FunctionCounter.builder("pow.blocks.sealed", stats, MiningStats::blocksMined).register(registry);
        FunctionCounter.builder("pow.mining.time.ms", stats, MiningStats::totalMiningTimeMs).register(registry);
        Gauge.builder("pow.hash.rate", stats, MiningStats::averageHashRate).register(registry);
        Gauge.builder("chain.difficulty", difficulty, IntSupplier::getAsInt).strongReference(true).register(registry);
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName())
                  .append("{stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
