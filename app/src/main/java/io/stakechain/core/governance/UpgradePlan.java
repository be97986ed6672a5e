package io.stakechain.core.governance;

/** Scheduled software upgrade from a passed proposal. Recorded only, never enforced. */
public record UpgradePlan(long proposalId, String name, long height, String info, long recordedAt) {}
