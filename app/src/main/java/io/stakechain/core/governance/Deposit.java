package io.stakechain.core.governance;

public record Deposit(String depositor, long amount, long timestamp) {}
