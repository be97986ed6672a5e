package io.stakechain.core.node;

import io.stakechain.core.TestClock;
import io.stakechain.core.consensus.CancellationToken;
import io.stakechain.core.consensus.ProofOfWork;
import io.stakechain.core.crypto.Wallet;
import io.stakechain.core.protocol.Block;
import io.stakechain.core.protocol.ChainError;
import io.stakechain.core.protocol.ChainException;
import io.stakechain.core.protocol.Transaction;
import io.stakechain.core.state.InMemoryStateStore;
import io.stakechain.core.state.ModuleAccounts;
import io.stakechain.core.storage.InMemoryChainStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BlockchainTest {

    private TestClock clock;
    private Wallet x;
    private Wallet y;
    private String miner;
    private Blockchain chain;

    @BeforeEach
    void setUp() {
        clock = new TestClock();
        x = Wallet.generate();
        y = Wallet.generate();
        miner = Wallet.generate().address();
        chain = new Blockchain(config(1), clock);
    }

    @AfterEach
    void tearDown() {
        chain.close();
    }

    private ChainConfig config(int difficulty) {
        Map<String, Long> alloc = new LinkedHashMap<>();
        alloc.put(x.address(), 1_000L);
        alloc.put(ChainConfig.DEFAULT_GENESIS_ADDRESS, 999_000L);
        return ChainConfig.defaultLocal().withDifficulty(difficulty).withGenesisAllocations(alloc);
    }

    private Transaction signedTransfer(Wallet from, String to, long amount) {
        Transaction tx = Transaction.transfer(from.address(), to, amount);
        tx.setNonce(chain.nextNonce(from.address()));
        tx.sign(from);
        return tx;
    }

    private static long sum(Map<String, Long> balances) {
        return balances.values().stream().mapToLong(Long::longValue).sum();
    }

    @Test
    void defaultGenesisHoldsWholeSupply() {
        try (Blockchain fresh = new Blockchain(ChainConfig.defaultLocal(), clock)) {
            assertEquals(1, fresh.chainLength());
            assertEquals(1_000_000, fresh.getBalance(ChainConfig.DEFAULT_GENESIS_ADDRESS));
            assertEquals(1_000_000, fresh.getTotalSupply());
            assertTrue(fresh.validateChain());
        }
    }

    @Test
    void minedTransferMovesFundsAndPaysReward() {
        Transaction tx = signedTransfer(x, y.address(), 100);
        assertEquals(tx.hash(), chain.submitTransaction(tx));
        assertEquals(1, chain.getPendingTransactions().size());

        Block block = chain.mine(miner);

        assertEquals(2, chain.chainLength());
        assertEquals(1, block.height());
        assertEquals(899, chain.getBalance(x.address()));
        assertEquals(100, chain.getBalance(y.address()));
        assertEquals(50, chain.getBalance(miner));
        assertEquals(1, chain.getBalance(ModuleAccounts.COMMUNITY_POOL));
        assertTrue(chain.getPendingTransactions().isEmpty());
        assertEquals(1_000_050, chain.getTotalSupply());
        assertEquals(chain.getTotalSupply(), sum(chain.getBalances()));
        assertTrue(chain.validateChain());
    }

    @Test
    void foreignKeyNeverReachesMempool() {
        Transaction tx = Transaction.transfer(x.address(), y.address(), 10);
        ChainException ex = assertThrows(ChainException.class, () -> tx.sign(y));
        assertEquals(ChainError.ADDRESS_MISMATCH, ex.error());

        ChainException rejected = assertThrows(ChainException.class, () -> chain.submitTransaction(tx));
        assertEquals(ChainError.INVALID_TRANSACTION, rejected.error());
        assertTrue(chain.getPendingTransactions().isEmpty());
    }

    @Test
    void secondMinerIsRejectedWhileFirstRuns() throws Exception {
        chain.close();
        chain = new Blockchain(config(8), clock);

        MiningJob job = chain.mineAsync(miner);
        assertTrue(chain.isMining());
        ChainException ex = assertThrows(ChainException.class, () -> chain.mine(miner));
        assertEquals(ChainError.ALREADY_MINING, ex.error());
        assertThrows(ChainException.class, () -> chain.mineAsync(miner));

        assertTrue(chain.stopMining());
        ExecutionException failed = assertThrows(ExecutionException.class, () -> job.result().get(10, TimeUnit.SECONDS));
        assertEquals(ChainError.MINING_ABORTED, ((ChainException) failed.getCause()).error());
        assertTrue(job.isDone());
        assertEquals(1, chain.chainLength());
    }

    @Test
    void asyncMiningCompletesWithAppendedBlock() throws Exception {
        chain.submitTransaction(signedTransfer(x, y.address(), 10));
        Block block = chain.mineAsync(miner).result().get(10, TimeUnit.SECONDS);

        assertEquals(block.hash(), chain.getLatestBlock().hash());
        assertEquals(10, chain.getBalance(y.address()));
    }

    @Test
    void blankMinerIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> chain.mine(" "));
        assertFalse(chain.isMining());
    }

    @Test
    void higherFeePicksComeFirst() {
        Transaction transfer = signedTransfer(x, y.address(), 10);
        Transaction vote = Transaction.vote(x.address(), 7, "yes");
        vote.setNonce(chain.nextNonce(x.address()));
        vote.sign(x);
        chain.submitTransaction(transfer);
        chain.submitTransaction(vote);

        List<Transaction> picked = chain.selectForBlock();
        assertEquals(List.of(vote.hash(), transfer.hash()), picked.stream().map(Transaction::hash).toList());
    }

    @Test
    void actionFailureStillConfirmsAndChargesFee() {
        Transaction vote = Transaction.vote(x.address(), 7, "yes");
        vote.setNonce(chain.nextNonce(x.address()));
        vote.sign(x);
        chain.submitTransaction(vote);

        chain.mine(miner);

        assertTrue(chain.getTransaction(vote.hash()).isPresent());
        assertEquals(ChainError.PROPOSAL_NOT_FOUND, chain.getFailedAction(vote.hash()).orElseThrow());
        assertEquals(1_000 - vote.fee(), chain.getBalance(x.address()));
        assertEquals(1, chain.getFailedActions().size());
    }

    @Test
    void blockNeverOverspendsSender() {
        Transaction first = signedTransfer(x, y.address(), 600);
        Transaction second = signedTransfer(x, y.address(), 600);
        chain.submitTransaction(first);
        chain.submitTransaction(second);
        assertEquals(2, chain.getPendingTransactions().size());

        Block block = chain.mine(miner);

        assertEquals(2, block.transactions().size(), "one transfer plus the reward");
        assertEquals(399, chain.getBalance(x.address()));
        assertEquals(600, chain.getBalance(y.address()));
        assertEquals(1, chain.getPendingTransactions().size());

        chain.mine(miner);
        assertEquals(399, chain.getBalance(x.address()));
    }

    @Test
    void duplicateSubmissionIsRejected() {
        Transaction tx = signedTransfer(x, y.address(), 10);
        chain.submitTransaction(tx);
        ChainException pending = assertThrows(ChainException.class, () -> chain.submitTransaction(tx));
        assertEquals(ChainError.DUPLICATE_TRANSACTION, pending.error());

        chain.mine(miner);
        ChainException confirmed = assertThrows(ChainException.class, () -> chain.submitTransaction(tx));
        assertEquals(ChainError.DUPLICATE_TRANSACTION, confirmed.error());
    }

    @Test
    void blockFoundAfterHeadMovedIsStale() {
        InMemoryChainStore store = new InMemoryChainStore();
        ProofOfWork racing = new ProofOfWork(100) {
            @Override
            public boolean mineBlock(Block block, int difficulty, CancellationToken token) {
                Block head = store.head().orElseThrow();
                Block competitor = new Block(head.height() + 1, head.timestamp(), head.hash(), "wtf1other", 0, 10);
                super.mineBlock(competitor, 0, token);
                store.append(competitor);
                return super.mineBlock(block, difficulty, token);
            }
        };
        chain.close();
        chain = new Blockchain(config(1), clock, racing, store, new InMemoryStateStore());
        chain.submitTransaction(signedTransfer(x, y.address(), 100));

        ChainException ex = assertThrows(ChainException.class, () -> chain.mine(miner));

        assertEquals(ChainError.STALE_BLOCK, ex.error());
        assertEquals(1, chain.getPendingTransactions().size());
        assertEquals(1_000, chain.getBalance(x.address()));
        assertEquals(0, chain.getBalance(miner));
        assertFalse(chain.isMining());
    }

    @Test
    void tamperedStoreFailsValidation() {
        InMemoryChainStore store = new InMemoryChainStore();
        chain.close();
        chain = new Blockchain(config(1), clock, new ProofOfWork(100), store, new InMemoryStateStore());
        chain.submitTransaction(signedTransfer(x, y.address(), 100));
        chain.mine(miner);
        chain.mine(miner);
        assertTrue(chain.validateChain());

        List<Block> blocks = new ArrayList<>(store.blocks());
        blocks.set(1, Block.builder().from(blocks.get(1)).nonce(blocks.get(1).nonce() + 1).build());
        store.replaceAll(blocks);

        assertFalse(chain.validateChain());
    }

    @Test
    void statsTrackBlocksAndSpacing() {
        chain.submitTransaction(signedTransfer(x, y.address(), 100));
        clock.advanceMillis(5_000);
        chain.mine(miner);
        clock.advanceMillis(5_000);
        chain.mine(miner);

        ChainStats stats = chain.getStats();
        assertEquals(3, stats.chainLength());
        assertEquals(2, stats.totalBlocks());
        assertEquals(1, stats.totalTransactions());
        assertEquals(5_000, stats.averageBlockTimeMs());
        assertEquals(0, stats.pendingTransactions());
        assertEquals(1, stats.difficulty());
        assertFalse(stats.mining());
        assertEquals(1_000_100, stats.totalSupply());
        assertEquals(2, chain.getMiningStats().blocksMined());
    }

    @Test
    void historyAndLookups() {
        Transaction tx = signedTransfer(x, y.address(), 100);
        chain.submitTransaction(tx);
        assertTrue(chain.getTransaction(tx.hash()).isPresent(), "pending lookup");

        Block block = chain.mine(miner);

        assertEquals(1, chain.getTransactionHistory(x.address()).size());
        assertEquals(1, chain.getTransactionHistory(y.address()).size());
        assertEquals(1, chain.getTransactionHistory(miner).size());
        assertEquals(block.hash(), chain.getBlockByHeight(1).orElseThrow().hash());
        assertEquals(1, chain.getBlockByHash(block.hash()).orElseThrow().height());
        assertTrue(chain.getBlockByHeight(5).isEmpty());
    }

    @Test
    void fastBlocksRaiseDifficultyAtInterval() {
        for (int i = 0; i < 10; i++) {
            chain.mine(miner);
        }
        assertEquals(2, chain.params().difficulty());
        assertTrue(chain.validateChain());
    }

    @Test
    void estimateNeedsMeasuredRate() {
        assertThrows(IllegalStateException.class, () -> chain.estimateMiningTime());
    }

    @Test
    void governanceCanChangeBlockchainParameters() {
        chain.params().set("miningReward", "75");
        chain.mine(miner);
        assertEquals(75, chain.getBalance(miner));

        ChainException ex = assertThrows(ChainException.class, () -> chain.params().set("gasPrice", "1"));
        assertEquals(ChainError.UNKNOWN_PARAMETER, ex.error());
    }

    @Test
    void outOfRangeParametersAreRefusedAndLeaveChainMineable() {
        for (String[] change : new String[][] {
                {"difficulty", "-1"}, {"difficulty", "65"}, {"maxTransactionsPerBlock", "0"},
                {"mempoolCapacity", "0"}, {"blockTime", "0"}, {"miningReward", "ten"}}) {
            ChainException ex = assertThrows(ChainException.class, () -> chain.params().set(change[0], change[1]));
            assertEquals(ChainError.INVALID_PROPOSAL, ex.error(), change[0] + "=" + change[1]);
        }

        assertEquals(1, chain.params().difficulty());
        chain.submitTransaction(signedTransfer(x, y.address(), 10));
        assertEquals(2, chain.mine(miner).transactions().size());
    }

    @Test
    void replayWithUsedNonceIsRejected() {
        chain.submitTransaction(signedTransfer(x, y.address(), 100));
        chain.mine(miner);

        Transaction replay = Transaction.transfer(x.address(), y.address(), 100);
        replay.setNonce(1);
        replay.sign(x);
        ChainException ex = assertThrows(ChainException.class, () -> chain.submitTransaction(replay));
        assertEquals(ChainError.INVALID_TRANSACTION, ex.error());
        assertEquals(2, chain.nextNonce(x.address()));
    }

    @Test
    void nextNonceCountsPendingTransactions() {
        assertEquals(1, chain.nextNonce(x.address()));
        chain.submitTransaction(signedTransfer(x, y.address(), 10));
        chain.submitTransaction(signedTransfer(x, y.address(), 10));
        assertEquals(3, chain.nextNonce(x.address()));

        chain.mine(miner);
        assertTrue(chain.getPendingTransactions().isEmpty());
        assertEquals(3, chain.nextNonce(x.address()));
        assertEquals(1, chain.nextNonce(y.address()));
    }
}
