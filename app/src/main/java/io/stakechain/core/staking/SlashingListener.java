package io.stakechain.core.staking;

/** Told about stake removed by slashing so the bonded funds can be burned. */
@FunctionalInterface
public interface SlashingListener {
    void onSlash(String validator, long amount);

    SlashingListener NONE = (validator, amount) -> { };
}
