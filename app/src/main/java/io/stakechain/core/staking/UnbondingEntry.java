package io.stakechain.core.staking;

/** Stake leaving a validator; liquid again at {@code completionTime}. */
public record UnbondingEntry(String delegator, String validator, long amount, long creationTime, long completionTime) {
    public boolean isMature(long now) {
        return now >= completionTime;
    }
}
