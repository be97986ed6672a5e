package io.stakechain.core.governance;

import java.util.Map;

public record GovernanceStats(int totalProposals, int activeProposals, int passedProposals,
                              int rejectedProposals, int failedProposals, long totalDeposits,
                              Map<String, Object> params) {}
