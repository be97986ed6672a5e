package io.stakechain.core.staking;

/** Anything that carries stake-weighted voting power. */
public interface StakeHolder {
    String address();

    long votingPower();
}
