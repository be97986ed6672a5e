package io.stakechain.core.governance;

import io.stakechain.core.protocol.ChainError;
import io.stakechain.core.protocol.ChainException;
import io.stakechain.core.state.ModuleAccounts;
import io.stakechain.core.state.StateStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Proposal lifecycle: deposits, voting, tally, execution and deposit settlement.
 *
 * Deposits move through the {@link ModuleAccounts#GOV_ESCROW} ledger account, so
 * total supply only changes when a deposit is burned. Expiry is lazy on vote/deposit
 * and otherwise driven by {@link #updateExpiredProposals()}, which an outside scheduler
 * must call. All public methods run under the chain-wide lock.
 */
public final class GovernanceManager {
    private static final Logger LOG = Logger.getLogger(GovernanceManager.class.getName());

    public static final int MAX_TITLE_LENGTH = 200;
    public static final int MAX_DESCRIPTION_LENGTH = 2000;
    public static final String MODULE_GOVERNANCE = "governance";

    private final GovernanceParams params;
    private final StateStore ledger;
    private final VotingPowerSource votingPower;
    private final ParameterChanger parameterChanger;
    private final Clock clock;
    private final Object lock;

    private final Map<Long, Proposal> proposals = new LinkedHashMap<>();
    private final List<UpgradePlan> upgradePlans = new ArrayList<>();
    private long proposalCounter;

    public GovernanceManager(GovernanceParams params, StateStore ledger, VotingPowerSource votingPower,
                             ParameterChanger parameterChanger, Clock clock, Object lock) {
        this.params = params;
        this.ledger = ledger;
        this.votingPower = votingPower;
        this.parameterChanger = parameterChanger;
        this.clock = clock;
        this.lock = lock;
    }

    public GovernanceParams params() { return params; }

    // -------------------- submission and deposits --------------------

    /**
     * Create a proposal and escrow {@code draft.initialDeposit()} from the proposer.
     *
     * @throws ChainException INVALID_PROPOSAL for missing or oversized fields or bad content,
     *                        INSUFFICIENT_BALANCE when the proposer holds less than the minimum deposit
     *                        or the initial deposit
     */
    public Proposal createProposal(ProposalDraft draft, String proposer) {
        synchronized (lock) {
            validateDraft(draft, proposer);
            long balance = ledger.getBalance(proposer);
            if (balance < params.minDeposit()) {
                throw new ChainException(ChainError.INSUFFICIENT_BALANCE,
                        proposer + " holds " + balance + ", minimum deposit is " + params.minDeposit());
            }
            if (balance < draft.initialDeposit()) {
                throw new ChainException(ChainError.INSUFFICIENT_BALANCE,
                        proposer + " cannot cover initial deposit " + draft.initialDeposit());
            }
            long now = clock.millis();
            Proposal p = new Proposal(++proposalCounter, proposer, draft, params.copy(), now);
            proposals.put(p.id(), p);
            LOG.info("Proposal created: " + p);
            if (draft.initialDeposit() > 0) {
                depositInto(p, proposer, draft.initialDeposit(), now);
            }
            return p.copy();
        }
    }

    /**
     * @throws ChainException PROPOSAL_NOT_FOUND, NOT_IN_DEPOSIT_PERIOD (also once the deposit window has
     *                        closed, in which case the proposal is failed first) or INSUFFICIENT_BALANCE
     */
    public Proposal addDeposit(long proposalId, String depositor, long amount) {
        synchronized (lock) {
            Proposal p = require(proposalId);
            if (amount <= 0) {
                throw new ChainException(ChainError.INVALID_TRANSACTION, "Deposit must be positive");
            }
            long now = clock.millis();
            if (p.status() == ProposalStatus.DEPOSIT_PERIOD && now > p.depositEndTime()) {
                failDepositPeriod(p);
            }
            if (p.status() != ProposalStatus.DEPOSIT_PERIOD) {
                throw new ChainException(ChainError.NOT_IN_DEPOSIT_PERIOD,
                        "Proposal " + proposalId + " is " + p.status().wireName());
            }
            long balance = ledger.getBalance(depositor);
            if (balance < amount) {
                throw new ChainException(ChainError.INSUFFICIENT_BALANCE,
                        depositor + " holds " + balance + ", deposit is " + amount);
            }
            depositInto(p, depositor, amount, now);
            return p.copy();
        }
    }

    private void depositInto(Proposal p, String depositor, long amount, long now) {
        ledger.transfer(depositor, ModuleAccounts.GOV_ESCROW, amount);
        p.addDeposit(new Deposit(depositor, amount, now));
        if (p.totalDeposit() >= p.params().minDeposit()) {
            p.openVoting(now, now + params.votingPeriodMs());
            LOG.info("Proposal " + p.id() + " entered voting period, ends at " + p.votingEndTime());
        }
    }

    // -------------------- voting --------------------

    /**
     * Record or replace {@code voter}'s vote, weighted by liquid balance plus bonded stake.
     *
     * @throws ChainException PROPOSAL_NOT_FOUND, INVALID_OPTION, NOT_IN_VOTING_PERIOD (also once the
     *                        voting window has closed, in which case the proposal is tallied first) or
     *                        NO_VOTING_POWER
     */
    public Proposal vote(long proposalId, String voter, String option) {
        synchronized (lock) {
            Proposal p = require(proposalId);
            VoteOption parsed = VoteOption.fromWireName(option);
            long now = clock.millis();
            if (p.status() == ProposalStatus.VOTING_PERIOD && now > p.votingEndTime()) {
                endVoting(p);
            }
            if (p.status() != ProposalStatus.VOTING_PERIOD) {
                throw new ChainException(ChainError.NOT_IN_VOTING_PERIOD,
                        "Proposal " + proposalId + " is " + p.status().wireName());
            }
            long weight = votingPower.votingPowerOf(voter);
            if (weight <= 0) {
                throw new ChainException(ChainError.NO_VOTING_POWER, voter + " has no voting power");
            }
            p.putVote(new Vote(voter, parsed, weight, now));
            LOG.fine(() -> voter + " voted " + parsed.wireName() + " on " + proposalId + " with weight " + weight);
            return p.copy();
        }
    }

    /**
     * Tally a proposal in voting period and move it to its terminal status.
     * Quorum is turnout over total supply; the veto ratio is over every tallied vote; the pass
     * ratio is yes over yes + no + no_with_veto (abstain excluded).
     */
    void endVoting(Proposal p) {
        TallyResult t = p.tally();
        GovernanceParams snap = p.params();
        long total = t.total();
        long supply = ledger.totalSupply();
        ProposalStatus outcome;
        if (total == 0 || supply <= 0 || (double) total / supply < snap.quorum()) {
            outcome = ProposalStatus.FAILED;
        } else if ((double) t.noWithVeto() / total >= snap.vetoThreshold()) {
            p.setVetoed(true);
            outcome = ProposalStatus.REJECTED;
        } else {
            long decisive = t.yes() + t.no() + t.noWithVeto();
            outcome = decisive > 0 && (double) t.yes() / decisive >= snap.threshold()
                    ? ProposalStatus.PASSED : ProposalStatus.REJECTED;
        }
        p.setStatus(outcome);
        LOG.info("Proposal " + p.id() + " " + outcome.wireName() + " (tally " + t + ", supply " + supply + ")");
        finalizeProposal(p);
    }

    private void failDepositPeriod(Proposal p) {
        p.setStatus(ProposalStatus.FAILED);
        LOG.info("Proposal " + p.id() + " failed: deposit period ended with " + p.totalDeposit());
        finalizeProposal(p);
    }

    /** Runs once per proposal: execute when passed, then settle deposits. */
    private void finalizeProposal(Proposal p) {
        if (p.isFinalized()) return;
        if (p.status() == ProposalStatus.PASSED) {
            try {
                execute(p);
            } catch (ChainException | IllegalArgumentException e) {
                p.setExecutionError(e.getMessage());
                LOG.log(Level.WARNING, "Execution of proposal " + p.id() + " failed", e);
            }
        }
        settleDeposits(p);
        p.markFinalized();
    }

    private void settleDeposits(Proposal p) {
        boolean burn;
        if (p.isVetoed()) {
            burn = p.params().burnVoteVeto();
        } else {
            burn = p.status() == ProposalStatus.FAILED && !p.reachedVoting()
                    && p.params().burnProposalDepositPrevote();
        }
        long total = p.totalDeposit();
        if (burn) {
            if (total > 0) ledger.burn(ModuleAccounts.GOV_ESCROW, total);
            p.setDepositOutcome(Proposal.DepositOutcome.BURNED);
            LOG.info("Burned " + total + " deposit of proposal " + p.id());
        } else {
            for (Map.Entry<String, Long> e : p.depositsByDepositor().entrySet()) {
                ledger.transfer(ModuleAccounts.GOV_ESCROW, e.getKey(), e.getValue());
            }
            p.setDepositOutcome(Proposal.DepositOutcome.REFUNDED);
        }
    }

    // -------------------- execution --------------------

    /**
     * Execute a passed proposal. A second call is a no-op.
     *
     * @return true when this call applied the proposal
     * @throws ChainException INVALID_PROPOSAL when not passed, UNKNOWN_PARAMETER or INSUFFICIENT_BALANCE
     *                        from the type-specific action
     */
    public boolean executeProposal(long proposalId) {
        synchronized (lock) {
            Proposal p = require(proposalId);
            if (p.status() != ProposalStatus.PASSED) {
                throw new ChainException(ChainError.INVALID_PROPOSAL,
                        "Proposal " + proposalId + " is " + p.status().wireName() + ", not passed");
            }
            if (p.isExecuted()) return false;
            execute(p);
            p.setExecutionError(null);
            return true;
        }
    }

    private void execute(Proposal p) {
        if (p.isExecuted()) return;
        Map<String, String> c = p.content();
        if (p.type() == ProposalType.PARAMETER_CHANGE) {
            String module = c.get("module");
            String parameter = c.get("parameter");
            String value = c.get("value");
            if (MODULE_GOVERNANCE.equals(module)) {
                params.set(parameter, value);
            } else {
                parameterChanger.apply(module, parameter, value);
            }
            LOG.info("Parameter " + module + "." + parameter + " set to " + value + " by proposal " + p.id());
        } else if (p.type() == ProposalType.SPEND_POOL) {
            String recipient = c.get("recipient");
            long amount = Long.parseLong(c.get("amount"));
            ledger.transfer(ModuleAccounts.COMMUNITY_POOL, recipient, amount);
            LOG.info("Community pool paid " + amount + " to " + recipient + " by proposal " + p.id());
        } else if (p.type() == ProposalType.SOFTWARE_UPGRADE) {
            String height = c.get("height");
            UpgradePlan plan = new UpgradePlan(p.id(), c.get("name"),
                    height == null || height.isBlank() ? 0L : Long.parseLong(height),
                    c.getOrDefault("info", ""), clock.millis());
            upgradePlans.add(plan);
            LOG.info("Software upgrade scheduled: " + plan);
        }
        p.markExecuted();
    }

    // -------------------- expiry sweep --------------------

    /** Close every proposal whose deposit or voting window has passed; returns how many changed. */
    public int updateExpiredProposals() {
        synchronized (lock) {
            long now = clock.millis();
            int changed = 0;
            for (Proposal p : proposals.values()) {
                if (p.status() == ProposalStatus.DEPOSIT_PERIOD && now > p.depositEndTime()) {
                    failDepositPeriod(p);
                    changed++;
                } else if (p.status() == ProposalStatus.VOTING_PERIOD && now > p.votingEndTime()) {
                    endVoting(p);
                    changed++;
                }
            }
            return changed;
        }
    }

    // -------------------- queries --------------------

    public Optional<Proposal> getProposal(long proposalId) {
        synchronized (lock) {
            Proposal p = proposals.get(proposalId);
            return p == null ? Optional.empty() : Optional.of(p.copy());
        }
    }

    /** Matching proposals, newest first. */
    public List<Proposal> getProposals(ProposalFilter filter) {
        synchronized (lock) {
            ProposalFilter f = filter == null ? ProposalFilter.ALL : filter;
            List<Proposal> out = new ArrayList<>();
            for (Proposal p : proposals.values()) {
                if (f.matches(p)) out.add(p.copy());
            }
            out.sort(Comparator.comparingLong(Proposal::submitTime).thenComparingLong(Proposal::id).reversed());
            return out;
        }
    }

    public GovernanceStats getGovernanceStats() {
        synchronized (lock) {
            int active = 0, passed = 0, rejected = 0, failed = 0;
            long deposits = 0;
            for (Proposal p : proposals.values()) {
                if (!p.status().isTerminal()) active++;
                else if (p.status() == ProposalStatus.PASSED) passed++;
                else if (p.status() == ProposalStatus.REJECTED) rejected++;
                else failed++;
                deposits += p.totalDeposit();
            }
            return new GovernanceStats(proposals.size(), active, passed, rejected, failed, deposits, params.asMap());
        }
    }

    public List<UpgradePlan> upgradePlans() {
        synchronized (lock) {
            return List.copyOf(upgradePlans);
        }
    }

    /** Drop all proposals and plans. */
    public void clear() {
        synchronized (lock) {
            proposals.clear();
            upgradePlans.clear();
            proposalCounter = 0;
        }
    }

    // -------------------- helpers --------------------

    private Proposal require(long proposalId) {
        Proposal p = proposals.get(proposalId);
        if (p == null) {
            throw new ChainException(ChainError.PROPOSAL_NOT_FOUND, "Proposal " + proposalId + " not found");
        }
        return p;
    }

    private void validateDraft(ProposalDraft d, String proposer) {
        if (d == null || proposer == null || proposer.isBlank()) {
            throw invalid("Proposal and proposer required");
        }
        if (d.title() == null || d.title().isBlank() || d.title().length() > MAX_TITLE_LENGTH) {
            throw invalid("Title must be 1.." + MAX_TITLE_LENGTH + " characters");
        }
        if (d.description() == null || d.description().isBlank() || d.description().length() > MAX_DESCRIPTION_LENGTH) {
            throw invalid("Description must be 1.." + MAX_DESCRIPTION_LENGTH + " characters");
        }
        if (d.type() == null) throw invalid("Proposal type required");
        if (d.initialDeposit() < 0) throw invalid("Initial deposit must be >= 0");
        Map<String, String> c = d.content();
        if (d.type() == ProposalType.PARAMETER_CHANGE) {
            requireContent(c, "module");
            requireContent(c, "parameter");
            requireContent(c, "value");
            if (MODULE_GOVERNANCE.equals(c.get("module"))) {
                params.check(c.get("parameter"), c.get("value"));
            } else {
                parameterChanger.check(c.get("module"), c.get("parameter"), c.get("value"));
            }
        } else if (d.type() == ProposalType.SPEND_POOL) {
            requireContent(c, "recipient");
            requirePositiveLong(c, "amount");
        } else if (d.type() == ProposalType.SOFTWARE_UPGRADE) {
            requireContent(c, "name");
            if (c.containsKey("height") && !c.get("height").isBlank()) requirePositiveLong(c, "height");
        }
    }

    private static void requireContent(Map<String, String> c, String key) {
        String v = c.get(key);
        if (v == null || v.isBlank()) throw invalid("Missing content field " + key);
    }

    private static void requirePositiveLong(Map<String, String> c, String key) {
        requireContent(c, key);
        try {
            if (Long.parseLong(c.get(key)) <= 0) throw invalid(key + " must be positive");
        } catch (NumberFormatException e) {
            throw new ChainException(ChainError.INVALID_PROPOSAL, key + " is not a number", e);
        }
    }

    private static ChainException invalid(String msg) {
        return new ChainException(ChainError.INVALID_PROPOSAL, msg);
    }
}
