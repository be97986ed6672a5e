package io.stakechain.core.node;

import io.stakechain.core.consensus.RetargetPolicy;
import io.stakechain.core.protocol.ChainError;
import io.stakechain.core.protocol.ChainException;
import io.stakechain.core.protocol.ParameterValues;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Chain parameters in force right now. Retargeting and governance parameter changes
 * write here; mining and admission read here.
 */
public final class ChainParams {
    private volatile int difficulty;
    private volatile long blockTimeMs;
    private volatile long maxBlockSize;
    private volatile long miningReward;
    private volatile int maxTransactionsPerBlock;
    private volatile int mempoolCapacity;
    private final int adjustmentInterval;
    private final int minDifficulty;
    private final int maxDifficulty;

    public ChainParams(ChainConfig config) {
        this.difficulty = config.difficulty;
        this.blockTimeMs = config.blockTimeMs;
        this.maxBlockSize = config.maxBlockSize;
        this.miningReward = config.miningReward;
        this.maxTransactionsPerBlock = config.maxTransactionsPerBlock;
        this.mempoolCapacity = config.mempoolCapacity;
        this.adjustmentInterval = config.difficultyAdjustmentInterval;
        this.minDifficulty = config.minDifficulty;
        this.maxDifficulty = config.maxDifficulty;
    }

    public int difficulty() { return difficulty; }
    public long blockTimeMs() { return blockTimeMs; }
    public long maxBlockSize() { return maxBlockSize; }
    public long miningReward() { return miningReward; }
    public int maxTransactionsPerBlock() { return maxTransactionsPerBlock; }
    public int mempoolCapacity() { return mempoolCapacity; }
    public int adjustmentInterval() { return adjustmentInterval; }

    public RetargetPolicy retargetPolicy() {
        return new RetargetPolicy(blockTimeMs, adjustmentInterval, minDifficulty, maxDifficulty);
    }

    void setDifficulty(int difficulty) {
        if (difficulty < 0) throw new IllegalArgumentException("difficulty must be >= 0");
        this.difficulty = difficulty;
    }

    /**
     * Rejects a change {@link #set} would reject, without applying it.
     * @throws ChainException UNKNOWN_PARAMETER for an unknown name, INVALID_PROPOSAL for a bad value
     */
    public void check(String name, String value) {
        apply(name, value, false);
    }

    /**
     * Governance entry point for the {@code blockchain} module.
     * @throws ChainException UNKNOWN_PARAMETER for an unknown name, INVALID_PROPOSAL for a value
     *         that does not parse or is out of range
     */
    public synchronized void set(String name, String value) {
        apply(name, value, true);
    }

    private void apply(String name, String value, boolean commit) {
        switch (name) {
            case "difficulty": {
                int v = ParameterValues.parseInt(name, value, minDifficulty, maxDifficulty);
                if (commit) difficulty = v;
                break;
            }
            case "blockTime": {
                long v = ParameterValues.parseLong(name, value, 1, Long.MAX_VALUE);
                if (commit) blockTimeMs = v;
                break;
            }
            case "maxBlockSize": {
                long v = ParameterValues.parseLong(name, value, 1, Long.MAX_VALUE);
                if (commit) maxBlockSize = v;
                break;
            }
            case "miningReward": {
                long v = ParameterValues.parseLong(name, value, 0, Long.MAX_VALUE);
                if (commit) miningReward = v;
                break;
            }
            case "maxTransactionsPerBlock": {
                // room for the reward plus one user transaction
                int v = ParameterValues.parseInt(name, value, 2, Integer.MAX_VALUE);
                if (commit) maxTransactionsPerBlock = v;
                break;
            }
            case "mempoolCapacity": {
                int v = ParameterValues.parseInt(name, value, 1, Integer.MAX_VALUE);
                if (commit) mempoolCapacity = v;
                break;
            }
            default:
                throw new ChainException(ChainError.UNKNOWN_PARAMETER, "blockchain has no parameter " + name);
        }
    }

    public synchronized Map<String, Object> asMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("difficulty", difficulty);
        m.put("blockTime", blockTimeMs);
        m.put("maxBlockSize", maxBlockSize);
        m.put("miningReward", miningReward);
        m.put("maxTransactionsPerBlock", maxTransactionsPerBlock);
        m.put("mempoolCapacity", mempoolCapacity);
        return m;
    }
}
