package io.stakechain.core.governance;

import io.stakechain.core.TestClock;
import io.stakechain.core.protocol.ChainError;
import io.stakechain.core.protocol.ChainException;
import io.stakechain.core.state.InMemoryStateStore;
import io.stakechain.core.state.ModuleAccounts;
import io.stakechain.core.state.StateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GovernanceManagerTest {

    private static final long TWO_DAYS = Duration.ofDays(2).toMillis();

    private TestClock clock;
    private StateStore ledger;
    private GovernanceParams params;
    private List<String> applied;
    private GovernanceManager gov;

    @BeforeEach
    void setUp() {
        clock = new TestClock();
        ledger = new InMemoryStateStore();
        ledger.mint("alice", 10_000);
        ledger.mint("bob", 10_000);
        params = GovernanceParams.defaults();
        applied = new ArrayList<>();
        ParameterChanger changer = (module, parameter, value) -> {
            if (!"blockchain".equals(module)) {
                throw new ChainException(ChainError.UNKNOWN_PARAMETER, "Unknown module " + module);
            }
            applied.add(parameter + "=" + value);
        };
        gov = new GovernanceManager(params, ledger, ledger::getBalance, changer, clock, new Object());
    }

    private static ProposalDraft paramChange(String module, String parameter, String value, long deposit) {
        return new ProposalDraft("Change " + parameter, "Set " + parameter + " to " + value,
                ProposalType.PARAMETER_CHANGE, Map.of("module", module, "parameter", parameter, "value", value), deposit);
    }

    private static ChainError errorOf(Runnable r) {
        return assertThrows(ChainException.class, r::run).error();
    }

    private void closeVoting() {
        clock.advanceMillis(TWO_DAYS + 1);
        gov.updateExpiredProposals();
    }

    @Test
    void initialDepositIsEscrowedAndOpensVoting() {
        Proposal p = gov.createProposal(paramChange("governance", "quorum", "0.5", 1_000), "alice");

        assertEquals(1, p.id());
        assertEquals(ProposalStatus.VOTING_PERIOD, p.status());
        assertEquals(clock.millis() + TWO_DAYS, p.votingEndTime());
        assertEquals(9_000, ledger.getBalance("alice"));
        assertEquals(1_000, ledger.getBalance(ModuleAccounts.GOV_ESCROW));
        assertEquals(20_000, ledger.totalSupply());
    }

    @Test
    void partialDepositWaitsForMinimum() {
        Proposal p = gov.createProposal(paramChange("governance", "quorum", "0.5", 500), "alice");
        assertEquals(ProposalStatus.DEPOSIT_PERIOD, p.status());

        clock.advanceMillis(1_000);
        Proposal after = gov.addDeposit(p.id(), "bob", 500);
        assertEquals(ProposalStatus.VOTING_PERIOD, after.status());
        assertEquals(1_000, after.totalDeposit());
        assertEquals(clock.millis() + params.votingPeriodMs(), after.votingEndTime());
        assertEquals(ChainError.NOT_IN_DEPOSIT_PERIOD, errorOf(() -> gov.addDeposit(p.id(), "bob", 1)));
    }

    @Test
    void rejectsBadSubmissions() {
        ledger.mint("poor", 10);
        assertEquals(ChainError.INSUFFICIENT_BALANCE,
                errorOf(() -> gov.createProposal(paramChange("governance", "quorum", "0.5", 0), "poor")));
        assertEquals(ChainError.INSUFFICIENT_BALANCE,
                errorOf(() -> gov.createProposal(paramChange("governance", "quorum", "0.5", 50_000), "alice")));
        assertEquals(ChainError.INVALID_PROPOSAL, errorOf(() -> gov.createProposal(
                new ProposalDraft("", "d", ProposalType.TEXT, Map.of(), 0), "alice")));
        assertEquals(ChainError.INVALID_PROPOSAL, errorOf(() -> gov.createProposal(
                new ProposalDraft("t".repeat(201), "d", ProposalType.TEXT, Map.of(), 0), "alice")));
        assertEquals(ChainError.INVALID_PROPOSAL, errorOf(() -> gov.createProposal(
                new ProposalDraft("t", "d", ProposalType.PARAMETER_CHANGE, Map.of("module", "governance"), 0), "alice")));
        assertEquals(ChainError.INVALID_PROPOSAL, errorOf(() -> gov.createProposal(
                new ProposalDraft("t", "d", ProposalType.SPEND_POOL, Map.of("recipient", "x", "amount", "-5"), 0), "alice")));
        assertEquals(ChainError.PROPOSAL_NOT_FOUND, errorOf(() -> gov.addDeposit(42, "alice", 1)));
        assertEquals(10_000, ledger.getBalance("alice"));
    }

    @Test
    void voteChecksOptionAndPower() {
        Proposal p = gov.createProposal(paramChange("governance", "quorum", "0.5", 1_000), "alice");

        assertEquals(ChainError.INVALID_OPTION, errorOf(() -> gov.vote(p.id(), "bob", "maybe")));
        assertEquals(ChainError.NO_VOTING_POWER, errorOf(() -> gov.vote(p.id(), "nobody", "yes")));
        assertEquals(ChainError.PROPOSAL_NOT_FOUND, errorOf(() -> gov.vote(99, "bob", "yes")));
    }

    @Test
    void repeatVoteReplacesEarlierOne() {
        Proposal p = gov.createProposal(paramChange("governance", "quorum", "0.5", 1_000), "alice");
        gov.vote(p.id(), "bob", "yes");
        Proposal after = gov.vote(p.id(), "bob", "no");

        assertEquals(1, after.votes().size());
        assertEquals(0, after.tally().yes());
        assertEquals(10_000, after.tally().no());
    }

    @Test
    void passedParameterChangeExecutesOnceAndRefunds() {
        Proposal p = gov.createProposal(paramChange("governance", "quorum", "0.5", 1_000), "alice");
        gov.vote(p.id(), "alice", "yes");
        gov.vote(p.id(), "bob", "yes");

        closeVoting();

        Proposal done = gov.getProposal(p.id()).orElseThrow();
        assertEquals(ProposalStatus.PASSED, done.status());
        assertTrue(done.isExecuted());
        assertEquals(0.5, params.quorum());
        assertEquals(Proposal.DepositOutcome.REFUNDED, done.depositOutcome());
        assertEquals(10_000, ledger.getBalance("alice"));
        assertEquals(0, ledger.getBalance(ModuleAccounts.GOV_ESCROW));

        assertFalse(gov.executeProposal(p.id()));
        assertEquals(0, gov.updateExpiredProposals());
    }

    @Test
    void otherModulesGoThroughTheChanger() {
        Proposal p = gov.createProposal(paramChange("blockchain", "miningReward", "60", 1_000), "alice");
        gov.vote(p.id(), "bob", "yes");
        closeVoting();

        assertEquals(List.of("miningReward=60"), applied);
    }

    @Test
    void unknownModuleRecordsExecutionError() {
        Proposal p = gov.createProposal(paramChange("nowhere", "x", "1", 1_000), "alice");
        gov.vote(p.id(), "bob", "yes");
        closeVoting();

        Proposal done = gov.getProposal(p.id()).orElseThrow();
        assertEquals(ProposalStatus.PASSED, done.status());
        assertFalse(done.isExecuted());
        assertNotNull(done.executionError());
        assertEquals(10_000, ledger.getBalance("alice"));
    }

    @Test
    void outOfRangeGovernanceValueIsRejectedAtSubmission() {
        assertEquals(ChainError.INVALID_PROPOSAL,
                errorOf(() -> gov.createProposal(paramChange("governance", "quorum", "1.5", 1_000), "alice")));
        assertEquals(ChainError.INVALID_PROPOSAL,
                errorOf(() -> gov.createProposal(paramChange("governance", "votingPeriod", "-1", 1_000), "alice")));
        assertEquals(ChainError.INVALID_PROPOSAL,
                errorOf(() -> gov.createProposal(paramChange("governance", "minDeposit", "lots", 1_000), "alice")));
        assertEquals(ChainError.INVALID_PROPOSAL,
                errorOf(() -> gov.createProposal(paramChange("governance", "burnVoteVeto", "yes", 1_000), "alice")));
        assertEquals(ChainError.UNKNOWN_PARAMETER,
                errorOf(() -> gov.createProposal(paramChange("governance", "gasPrice", "1", 1_000), "alice")));

        assertTrue(gov.getProposals(ProposalFilter.ALL).isEmpty());
        assertEquals(10_000, ledger.getBalance("alice"));
        assertEquals(0, ledger.getBalance(ModuleAccounts.GOV_ESCROW));
    }

    @Test
    void changerCheckRunsAtSubmission() {
        ParameterChanger strict = new ParameterChanger() {
            @Override
            public void apply(String module, String parameter, String value) {
                applied.add(parameter + "=" + value);
            }

            @Override
            public void check(String module, String parameter, String value) {
                if (value.startsWith("-")) throw new ChainException(ChainError.INVALID_PROPOSAL, "negative " + parameter);
            }
        };
        GovernanceManager checked = new GovernanceManager(params, ledger, ledger::getBalance, strict, clock, new Object());

        assertEquals(ChainError.INVALID_PROPOSAL,
                errorOf(() -> checked.createProposal(paramChange("blockchain", "difficulty", "-1", 1_000), "alice")));
        assertEquals(10_000, ledger.getBalance("alice"));
        checked.createProposal(paramChange("blockchain", "difficulty", "3", 1_000), "alice");
        assertEquals(9_000, ledger.getBalance("alice"));
    }

    @Test
    void failedExecutionStillRefundsDeposit() {
        ParameterChanger broken = (module, parameter, value) -> {
            throw new IllegalArgumentException(parameter + " rejected " + value);
        };
        GovernanceManager failing = new GovernanceManager(params, ledger, ledger::getBalance, broken, clock, new Object());
        Proposal p = failing.createProposal(paramChange("blockchain", "difficulty", "3", 1_000), "alice");
        failing.vote(p.id(), "bob", "yes");

        clock.advanceMillis(TWO_DAYS + 1);
        assertEquals(1, failing.updateExpiredProposals());

        Proposal done = failing.getProposal(p.id()).orElseThrow();
        assertEquals(ProposalStatus.PASSED, done.status());
        assertFalse(done.isExecuted());
        assertEquals("difficulty rejected 3", done.executionError());
        assertEquals(Proposal.DepositOutcome.REFUNDED, done.depositOutcome());
        assertEquals(10_000, ledger.getBalance("alice"));
        assertEquals(0, ledger.getBalance(ModuleAccounts.GOV_ESCROW));
        assertEquals(0, failing.updateExpiredProposals());
    }

    @Test
    void vetoRejectsAndBurnsDeposit() {
        Proposal p = gov.createProposal(paramChange("governance", "quorum", "0.5", 1_000), "alice");
        gov.vote(p.id(), "alice", "yes");
        gov.vote(p.id(), "bob", "no_with_veto");
        closeVoting();

        Proposal done = gov.getProposal(p.id()).orElseThrow();
        assertEquals(ProposalStatus.REJECTED, done.status());
        assertTrue(done.isVetoed());
        assertEquals(Proposal.DepositOutcome.BURNED, done.depositOutcome());
        assertEquals(19_000, ledger.totalSupply());
        assertEquals(9_000, ledger.getBalance("alice"));
        assertEquals(0.4, params.quorum());
    }

    @Test
    void abstainCountsForQuorumOnly() {
        Proposal p = gov.createProposal(paramChange("governance", "quorum", "0.5", 1_000), "alice");
        gov.vote(p.id(), "alice", "abstain");
        gov.vote(p.id(), "bob", "abstain");
        closeVoting();

        assertEquals(ProposalStatus.REJECTED, gov.getProposal(p.id()).orElseThrow().status());
    }

    @Test
    void lowTurnoutFailsAndRefunds() {
        ledger.mint("carol", 100);
        Proposal p = gov.createProposal(paramChange("governance", "quorum", "0.5", 1_000), "alice");
        gov.vote(p.id(), "carol", "yes");
        closeVoting();

        Proposal done = gov.getProposal(p.id()).orElseThrow();
        assertEquals(ProposalStatus.FAILED, done.status());
        assertEquals(Proposal.DepositOutcome.REFUNDED, done.depositOutcome());
        assertEquals(10_000, ledger.getBalance("alice"));
    }

    @Test
    void lateVoteTalliesInsteadOfCounting() {
        Proposal p = gov.createProposal(paramChange("governance", "quorum", "0.5", 1_000), "alice");
        gov.vote(p.id(), "bob", "yes");
        clock.advanceMillis(TWO_DAYS + 1);

        assertEquals(ChainError.NOT_IN_VOTING_PERIOD, errorOf(() -> gov.vote(p.id(), "alice", "no")));
        assertEquals(ProposalStatus.PASSED, gov.getProposal(p.id()).orElseThrow().status());
    }

    @Test
    void expiredDepositPeriodFailsProposal() {
        Proposal p = gov.createProposal(paramChange("governance", "quorum", "0.5", 500), "alice");
        clock.advanceMillis(TWO_DAYS + 1);

        assertEquals(ChainError.NOT_IN_DEPOSIT_PERIOD, errorOf(() -> gov.addDeposit(p.id(), "bob", 500)));
        Proposal done = gov.getProposal(p.id()).orElseThrow();
        assertEquals(ProposalStatus.FAILED, done.status());
        assertFalse(done.reachedVoting());
        assertEquals(10_000, ledger.getBalance("alice"));
        assertEquals(10_000, ledger.getBalance("bob"));
    }

    @Test
    void prevoteDepositBurnedWhenConfigured() {
        params.set("burnProposalDepositPrevote", "true");
        Proposal p = gov.createProposal(paramChange("governance", "quorum", "0.5", 500), "alice");

        clock.advanceMillis(TWO_DAYS + 1);
        assertEquals(1, gov.updateExpiredProposals());

        assertEquals(Proposal.DepositOutcome.BURNED, gov.getProposal(p.id()).orElseThrow().depositOutcome());
        assertEquals(9_500, ledger.getBalance("alice"));
        assertEquals(19_500, ledger.totalSupply());
    }

    @Test
    void spendPoolPaysFromCommunityPoolOnce() {
        ledger.mint(ModuleAccounts.COMMUNITY_POOL, 500);
        Proposal p = gov.createProposal(new ProposalDraft("Grant", "Fund dave", ProposalType.SPEND_POOL,
                Map.of("recipient", "dave", "amount", "200"), 1_000), "alice");
        gov.vote(p.id(), "alice", "yes");
        gov.vote(p.id(), "bob", "yes");
        closeVoting();

        assertEquals(200, ledger.getBalance("dave"));
        assertEquals(300, ledger.getBalance(ModuleAccounts.COMMUNITY_POOL));
        assertFalse(gov.executeProposal(p.id()));
        assertEquals(200, ledger.getBalance("dave"));
    }

    @Test
    void softwareUpgradeRecordsPlan() {
        Proposal p = gov.createProposal(new ProposalDraft("v2", "Upgrade", ProposalType.SOFTWARE_UPGRADE,
                Map.of("name", "v2", "height", "100"), 1_000), "alice");
        gov.vote(p.id(), "bob", "yes");
        closeVoting();

        assertEquals(1, gov.upgradePlans().size());
        assertEquals("v2", gov.upgradePlans().get(0).name());
        assertEquals(100, gov.upgradePlans().get(0).height());
    }

    @Test
    void executeRequiresPassedStatus() {
        Proposal p = gov.createProposal(paramChange("governance", "quorum", "0.5", 1_000), "alice");
        assertEquals(ChainError.INVALID_PROPOSAL, errorOf(() -> gov.executeProposal(p.id())));
    }

    @Test
    void queriesNewestFirstWithStats() {
        gov.createProposal(paramChange("governance", "quorum", "0.5", 1_000), "alice");
        clock.advanceMillis(10);
        gov.createProposal(new ProposalDraft("Hello", "Text", ProposalType.TEXT, Map.of(), 0), "bob");

        List<Proposal> all = gov.getProposals(ProposalFilter.ALL);
        assertEquals(List.of(2L, 1L), all.stream().map(Proposal::id).toList());
        assertEquals(1, gov.getProposals(new ProposalFilter(ProposalStatus.DEPOSIT_PERIOD, null, null)).size());
        assertEquals(1, gov.getProposals(new ProposalFilter(null, "alice", null)).size());

        GovernanceStats stats = gov.getGovernanceStats();
        assertEquals(2, stats.totalProposals());
        assertEquals(2, stats.activeProposals());
        assertEquals(1_000, stats.totalDeposits());
    }
}
