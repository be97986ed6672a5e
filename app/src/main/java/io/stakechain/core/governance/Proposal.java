package io.stakechain.core.governance;

import io.stakechain.core.protocol.Hashes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Governance proposal. Owned and mutated by {@link GovernanceManager}; callers get copies.
 */
public final class Proposal {
    /** How escrowed deposits were settled once the proposal ended. */
    public enum DepositOutcome { PENDING, REFUNDED, BURNED }

    private final long id;
    private final String proposer;
    private final String title;
    private final String description;
    private final ProposalType type;
    private final Map<String, String> content;
    private final String contentHash;
    private final GovernanceParams params;
    private final long submitTime;
    private final long depositEndTime;

    private ProposalStatus status = ProposalStatus.DEPOSIT_PERIOD;
    private long votingStartTime;
    private long votingEndTime;
    private long totalDeposit;
    private final List<Deposit> deposits = new ArrayList<>();
    private final Map<String, Vote> votes = new LinkedHashMap<>();
    private TallyResult tally = TallyResult.EMPTY;
    private boolean votingOpened;
    private boolean vetoed;
    private boolean finalized;
    private boolean executed;
    private String executionError;
    private DepositOutcome depositOutcome = DepositOutcome.PENDING;

    Proposal(long id, String proposer, ProposalDraft draft, GovernanceParams params, long submitTime) {
        this.id = id;
        this.proposer = proposer;
        this.title = draft.title();
        this.description = draft.description();
        this.type = draft.type();
        this.content = Collections.unmodifiableMap(new TreeMap<>(draft.content()));
        this.params = params;
        this.submitTime = submitTime;
        this.depositEndTime = submitTime + params.maxDepositPeriodMs();
        this.contentHash = Hashes.sha256Hex(title + "|" + description + "|" + type.wireName() + "|" + this.content);
    }

    private Proposal(Proposal o) {
        this.id = o.id;
        this.proposer = o.proposer;
        this.title = o.title;
        this.description = o.description;
        this.type = o.type;
        this.content = o.content;
        this.contentHash = o.contentHash;
        this.params = o.params.copy();
        this.submitTime = o.submitTime;
        this.depositEndTime = o.depositEndTime;
        this.status = o.status;
        this.votingStartTime = o.votingStartTime;
        this.votingEndTime = o.votingEndTime;
        this.totalDeposit = o.totalDeposit;
        this.deposits.addAll(o.deposits);
        this.votes.putAll(o.votes);
        this.tally = o.tally;
        this.votingOpened = o.votingOpened;
        this.vetoed = o.vetoed;
        this.finalized = o.finalized;
        this.executed = o.executed;
        this.executionError = o.executionError;
        this.depositOutcome = o.depositOutcome;
    }

    Proposal copy() { return new Proposal(this); }

    public long id() { return id; }
    public String proposer() { return proposer; }
    public String title() { return title; }
    public String description() { return description; }
    public ProposalType type() { return type; }
    public Map<String, String> content() { return content; }
    public String contentHash() { return contentHash; }
    /** Parameters as they were when the proposal was submitted. */
    public GovernanceParams params() { return params; }
    public long submitTime() { return submitTime; }
    public long depositEndTime() { return depositEndTime; }
    public ProposalStatus status() { return status; }
    public long votingStartTime() { return votingStartTime; }
    public long votingEndTime() { return votingEndTime; }
    public long totalDeposit() { return totalDeposit; }
    public List<Deposit> deposits() { return Collections.unmodifiableList(deposits); }
    /** One effective vote per voter, in first-vote order. */
    public List<Vote> votes() { return List.copyOf(votes.values()); }
    public TallyResult tally() { return tally; }
    /** True once the deposit threshold was reached. */
    public boolean reachedVoting() { return votingOpened; }
    public boolean isVetoed() { return vetoed; }
    public boolean isExecuted() { return executed; }
    public String executionError() { return executionError; }
    public DepositOutcome depositOutcome() { return depositOutcome; }

    // -------------------- manager-only --------------------

    boolean isFinalized() { return finalized; }
    void markFinalized() { finalized = true; }
    void markExecuted() { executed = true; }
    void setExecutionError(String error) { executionError = error; }
    void setVetoed(boolean vetoed) { this.vetoed = vetoed; }
    void setDepositOutcome(DepositOutcome outcome) { depositOutcome = outcome; }

    void addDeposit(Deposit d) {
        deposits.add(d);
        totalDeposit += d.amount();
    }

    void openVoting(long start, long end) {
        status = ProposalStatus.VOTING_PERIOD;
        votingOpened = true;
        votingStartTime = start;
        votingEndTime = end;
    }

    void setStatus(ProposalStatus next) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Proposal " + id + " already " + status.wireName());
        }
        status = next;
    }

    void putVote(Vote v) {
        votes.put(v.voter(), v);
        tally = TallyResult.of(votes.values());
    }

    /** depositor -> total deposited, in first-deposit order. */
    Map<String, Long> depositsByDepositor() {
        Map<String, Long> out = new LinkedHashMap<>();
        for (Deposit d : deposits) out.merge(d.depositor(), d.amount(), Long::sum);
        return out;
    }

    @Override public String toString() {
        return "Proposal{" + id + " " + type.wireName() + " " + status.wireName() + " '" + title + "'}";
    }
}
