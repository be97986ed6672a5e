package io.stakechain.core.governance;

/** Null fields match everything. */
public record ProposalFilter(ProposalStatus status, String proposer, ProposalType type) {
    public static final ProposalFilter ALL = new ProposalFilter(null, null, null);

    public boolean matches(Proposal p) {
        return (status == null || p.status() == status)
                && (proposer == null || proposer.equals(p.proposer()))
                && (type == null || p.type() == type);
    }
}
