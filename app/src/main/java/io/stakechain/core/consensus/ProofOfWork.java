package io.stakechain.core.consensus;

import io.stakechain.core.protocol.Block;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Hex-digit proof of work:
 * - A block meets difficulty d when its hex hash starts with d '0' characters.
 * - The search advances the block nonce in batches; between batches it checks for
 *   cancellation (token or thread interrupt) and yields the CPU.
 *
 * Example:
 *   difficulty = 4 -> hash must start with "0000" (about 65,536 attempts on average).
 */
public class ProofOfWork {
    private static final Logger LOG = Logger.getLogger(ProofOfWork.class.getName());

    public enum State { IDLE, SEARCHING, SEALED }

    private final int batchSize;
    private final MiningStats stats = new MiningStats();
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);

    public ProofOfWork(int batchSize) {
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
        this.batchSize = batchSize;
    }

    public State state() { return state.get(); }
    public MiningStats stats() { return stats; }
    public int batchSize() { return batchSize; }

    /**
     * Search for a nonce so that the block hash meets {@code difficulty}, then seal the block.
     *
     * @return true when sealed, false when cancelled before a solution was found
     */
    public boolean mineBlock(Block block, int difficulty, CancellationToken token) {
        if (block == null) throw new IllegalArgumentException("block required");
        block.setDifficulty(difficulty);
        state.set(State.SEARCHING);
        long start = System.nanoTime();
        long hashes = 1;
        int batches = 0;
        try {
            String hash = block.hash();
            while (!Block.meetsTarget(hash, difficulty)) {
                for (int i = 0; i < batchSize && !Block.meetsTarget(hash, difficulty); i++) {
                    hash = block.advanceNonce();
                    hashes++;
                }
                if (Block.meetsTarget(hash, difficulty)) break;
                batches++;
                if (isCancelled(token)) {
                    state.set(State.IDLE);
                    stats.record(hashes, elapsedMs(start), false);
                    LOG.info("Mining of block " + block.height() + " cancelled after " + hashes + " hashes");
                    return false;
                }
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("Block " + block.height() + ": batch " + batches + " done, nonce=" + block.nonce());
                }
                Thread.yield();
            }
            block.seal();
            stats.record(hashes, elapsedMs(start), true);
            state.set(State.SEALED);
            return true;
        } catch (RuntimeException e) {
            state.set(State.IDLE);
            stats.record(hashes, elapsedMs(start), false);
            throw e;
        }
    }

    /** Pure check: recomputed hash equals the stored one and meets {@code difficulty}. */
    public boolean verifyProofOfWork(Block block, int difficulty) {
        if (block == null) return false;
        String recomputed = block.computeHash();
        return recomputed.equals(block.hash()) && Block.meetsTarget(recomputed, difficulty);
    }

    /**
     * Retarget from the spacing of {@code recentBlocks} (the last window, oldest first).
     * Average spacing under half the target raises difficulty by one, over twice the target
     * lowers it by one; exact boundaries leave it unchanged. The result stays within the policy bounds.
     */
    public int calculateDifficulty(List<Block> recentBlocks, int currentDifficulty, RetargetPolicy policy) {
        if (recentBlocks == null || recentBlocks.size() < 2) return currentDifficulty;
        int n = Math.min(recentBlocks.size(), policy.interval());
        Block first = recentBlocks.get(recentBlocks.size() - n);
        Block last = recentBlocks.get(recentBlocks.size() - 1);
        long span = last.timestamp() - first.timestamp();
        long expected = policy.targetBlockTimeMs() * (n - 1);

        int next = currentDifficulty;
        if (2 * span < expected) {
            next = currentDifficulty + 1;
        } else if (span > 2 * expected) {
            next = currentDifficulty - 1;
        }
        next = Math.max(policy.minDifficulty(), Math.min(policy.maxDifficulty(), next));
        if (next != currentDifficulty) {
            LOG.info("Difficulty " + currentDifficulty + " -> " + next + " (span " + span + "ms, expected " + expected + "ms)");
        }
        return next;
    }

    /** Expected wall time to find a solution at {@code hashRate} hashes per second. */
    public static Duration estimateMiningTime(int difficulty, double hashRate) {
        if (hashRate <= 0) throw new IllegalArgumentException("hashRate must be > 0");
        double expectedHashes = Math.pow(16, difficulty);
        return Duration.ofMillis((long) Math.ceil(expectedHashes / hashRate * 1000.0));
    }

    public void resetStats() {
        stats.reset();
    }

    /** Override point for the cancellation check. */
    protected boolean isCancelled(CancellationToken token) {
        return (token != null && token.isCancelled()) || Thread.currentThread().isInterrupted();
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
