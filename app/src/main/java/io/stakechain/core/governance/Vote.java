package io.stakechain.core.governance;

public record Vote(String voter, VoteOption option, long weight, long timestamp) {}
