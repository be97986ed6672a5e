package io.stakechain.core.staking;

import java.util.Map;

/**
 * Result of splitting a block reward.
 * {@code validatorAmount} holds the commission plus any rounding remainder.
 */
public record RewardSplit(String validator, long validatorAmount, Map<String, Long> delegatorAmounts) {
    public RewardSplit {
        delegatorAmounts = Map.copyOf(delegatorAmounts);
    }

    public long total() {
        long sum = validatorAmount;
        for (long v : delegatorAmounts.values()) sum += v;
        return sum;
    }
}
