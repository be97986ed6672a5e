package io.stakechain.core.staking;

public record SlashingEvent(long timestamp, String reason, long amount, long height) {}
