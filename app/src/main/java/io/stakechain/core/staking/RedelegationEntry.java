package io.stakechain.core.staking;

/** Stake moved between validators; tracked until {@code completionTime}. */
public record RedelegationEntry(String delegator, String sourceValidator, String destinationValidator,
                                long amount, long creationTime, long completionTime) {
    public boolean isMature(long now) {
        return now >= completionTime;
    }
}
