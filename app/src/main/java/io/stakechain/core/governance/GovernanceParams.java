package io.stakechain.core.governance;

import io.stakechain.core.protocol.ChainError;
import io.stakechain.core.protocol.ChainException;
import io.stakechain.core.protocol.ParameterValues;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Governance parameters. Proposals keep a {@link #copy()} taken at submission, so later
 * changes only affect new proposals (the voting period is the exception; it is read when
 * voting opens).
 */
public final class GovernanceParams {
    private long minDeposit;
    private long maxDepositPeriodMs;
    private long votingPeriodMs;
    private double quorum;
    private double threshold;
    private double vetoThreshold;
    private boolean burnVoteVeto;
    private boolean burnProposalDepositPrevote;

    public GovernanceParams(long minDeposit, long maxDepositPeriodMs, long votingPeriodMs, double quorum,
                            double threshold, double vetoThreshold, boolean burnVoteVeto,
                            boolean burnProposalDepositPrevote) {
        this.minDeposit = minDeposit;
        this.maxDepositPeriodMs = maxDepositPeriodMs;
        this.votingPeriodMs = votingPeriodMs;
        this.quorum = quorum;
        this.threshold = threshold;
        this.vetoThreshold = vetoThreshold;
        this.burnVoteVeto = burnVoteVeto;
        this.burnProposalDepositPrevote = burnProposalDepositPrevote;
    }

    public static GovernanceParams defaults() {
        long twoDays = 2L * 24 * 60 * 60 * 1000;
        return new GovernanceParams(1000L, twoDays, twoDays, 0.4, 0.5, 0.334, true, false);
    }

    public synchronized GovernanceParams copy() {
        return new GovernanceParams(minDeposit, maxDepositPeriodMs, votingPeriodMs, quorum, threshold,
                vetoThreshold, burnVoteVeto, burnProposalDepositPrevote);
    }

    public synchronized long minDeposit() { return minDeposit; }
    public synchronized long maxDepositPeriodMs() { return maxDepositPeriodMs; }
    public synchronized long votingPeriodMs() { return votingPeriodMs; }
    public synchronized double quorum() { return quorum; }
    public synchronized double threshold() { return threshold; }
    public synchronized double vetoThreshold() { return vetoThreshold; }
    public synchronized boolean burnVoteVeto() { return burnVoteVeto; }
    public synchronized boolean burnProposalDepositPrevote() { return burnProposalDepositPrevote; }

    public void check(String name, String value) {
        apply(name, value, false);
    }

    /**
     * @throws ChainException UNKNOWN_PARAMETER for a name governance does not have,
     *         INVALID_PROPOSAL for a value that does not parse or is out of range
     */
    public synchronized void set(String name, String value) {
        apply(name, value, true);
    }

    private void apply(String name, String value, boolean commit) {
        switch (name) {
            case "minDeposit": {
                long v = ParameterValues.parseLong(name, value, 0, Long.MAX_VALUE);
                if (commit) minDeposit = v;
                break;
            }
            case "maxDepositPeriod": {
                long v = ParameterValues.parseLong(name, value, 0, Long.MAX_VALUE);
                if (commit) maxDepositPeriodMs = v;
                break;
            }
            case "votingPeriod": {
                long v = ParameterValues.parseLong(name, value, 0, Long.MAX_VALUE);
                if (commit) votingPeriodMs = v;
                break;
            }
            case "quorum": {
                double v = ParameterValues.parseFraction(name, value);
                if (commit) quorum = v;
                break;
            }
            case "threshold": {
                double v = ParameterValues.parseFraction(name, value);
                if (commit) threshold = v;
                break;
            }
            case "vetoThreshold": {
                double v = ParameterValues.parseFraction(name, value);
                if (commit) vetoThreshold = v;
                break;
            }
            case "burnVoteVeto": {
                boolean v = ParameterValues.parseBoolean(name, value);
                if (commit) burnVoteVeto = v;
                break;
            }
            case "burnProposalDepositPrevote": {
                boolean v = ParameterValues.parseBoolean(name, value);
                if (commit) burnProposalDepositPrevote = v;
                break;
            }
            default:
                throw new ChainException(ChainError.UNKNOWN_PARAMETER, "governance has no parameter " + name);
        }
    }

    public synchronized Map<String, Object> asMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("minDeposit", minDeposit);
        m.put("maxDepositPeriod", maxDepositPeriodMs);
        m.put("votingPeriod", votingPeriodMs);
        m.put("quorum", quorum);
        m.put("threshold", threshold);
        m.put("vetoThreshold", vetoThreshold);
        m.put("burnVoteVeto", burnVoteVeto);
        m.put("burnProposalDepositPrevote", burnProposalDepositPrevote);
        return m;
    }
}
