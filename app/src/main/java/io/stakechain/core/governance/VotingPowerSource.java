package io.stakechain.core.governance;

/** Voting weight of an address at call time. */
@FunctionalInterface
public interface VotingPowerSource {
    long votingPowerOf(String address);
}
