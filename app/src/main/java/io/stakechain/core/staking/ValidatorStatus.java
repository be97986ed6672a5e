package io.stakechain.core.staking;

public enum ValidatorStatus {
    ACTIVE, INACTIVE, JAILED;

    public String wireName() { return name().toLowerCase(java.util.Locale.ROOT); }
}
