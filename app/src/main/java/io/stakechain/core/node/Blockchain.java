package io.stakechain.core.node;

import io.stakechain.core.consensus.CancellationToken;
import io.stakechain.core.consensus.ConsensusRules;
import io.stakechain.core.consensus.MiningStats;
import io.stakechain.core.consensus.ProofOfWork;
import io.stakechain.core.crypto.SignatureUtil;
import io.stakechain.core.governance.GovernanceManager;
import io.stakechain.core.governance.ParameterChanger;
import io.stakechain.core.governance.ProposalDraft;
import io.stakechain.core.governance.ProposalType;
import io.stakechain.core.mempool.Mempool;
import io.stakechain.core.mempool.TxValidator;
import io.stakechain.core.metrics.BlockMetrics;
import io.stakechain.core.protocol.Block;
import io.stakechain.core.protocol.ChainError;
import io.stakechain.core.protocol.ChainException;
import io.stakechain.core.protocol.Transaction;
import io.stakechain.core.snapshot.ChainSnapshot;
import io.stakechain.core.staking.RewardSplit;
import io.stakechain.core.staking.SlashingEvent;
import io.stakechain.core.staking.UnbondingEntry;
import io.stakechain.core.staking.ValidatorQueries;
import io.stakechain.core.staking.ValidatorRegistry;
import io.stakechain.core.state.InMemoryStateStore;
import io.stakechain.core.state.ModuleAccounts;
import io.stakechain.core.state.StateStore;
import io.stakechain.core.storage.ChainStore;
import io.stakechain.core.storage.InMemoryChainStore;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Single source of truth for the block list, the ledger and the mempool; drives mining end to end.
 *
 * All ledger, registry and governance mutations share one lock. The proof-of-work search runs
 * outside it so queries stay responsive; the sealed block is then re-checked against the head
 * under the lock and rejected as stale if another block got there first.
 */
public final class Blockchain implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(Blockchain.class.getName());

    /** Blocks averaged for the reported block time. */
    static final int STATS_WINDOW = 10;

    private final Object lock = new Object();
    private final ChainConfig config;
    private final ChainParams params;
    private final Clock clock;
    private final SignatureUtil verifier;
    private final StateStore state;
    private final ChainStore chain;
    private final TxValidator txValidator;
    private final Mempool mempool;
    private final ProofOfWork pow;
    private final BlockProducer producer;
    private final ValidatorRegistry validators;
    private final GovernanceManager governance;

    private final AtomicBoolean mining = new AtomicBoolean(false);
    private volatile String currentMiner;
    private volatile CancellationToken currentToken;
    private final ExecutorService miningExecutor;

    private final Map<String, ChainError> failedActions = new LinkedHashMap<>();
    private long totalTransactions;
    private long totalBlocks;
    private volatile double hashRate;

    public Blockchain(ChainConfig config) {
        this(config, Clock.systemUTC());
    }

    public Blockchain(ChainConfig config, Clock clock) {
        this(config, clock, new ProofOfWork(config.powBatchSize), new InMemoryChainStore(), new InMemoryStateStore());
    }

    public Blockchain(ChainConfig config, Clock clock, ProofOfWork pow, ChainStore chain, StateStore state) {
        this.config = config;
        this.params = new ChainParams(config);
        this.clock = clock;
        this.verifier = new SignatureUtil(config.addressPrefix);
        this.state = state;
        this.chain = chain;
        this.pow = pow;
        this.txValidator = new TxValidator(state, chain, verifier);
        this.mempool = new Mempool(txValidator, params::mempoolCapacity);
        this.producer = new BlockProducer(state, txValidator);
        this.validators = new ValidatorRegistry(config.staking.toParams(), clock, lock,
                (validator, amount) -> state.burn(ModuleAccounts.BONDED_POOL, amount));
        this.governance = new GovernanceManager(config.governance.toParams(), state,
                address -> state.getBalance(address) + validators.bondedStakeOf(address),
                new ModuleParameterChanger(), clock, lock);
        this.miningExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "stakechain-miner");
            t.setDaemon(true);
            return t;
        });
        GenesisBuilder.initIfNeeded(chain, state, config.genesisAllocations, clock.millis(),
                params.maxTransactionsPerBlock());
        BlockMetrics.bind(pow.stats(), params::difficulty);
        LOG.info("Chain initialised: supply=" + state.totalSupply() + ", difficulty=" + params.difficulty());
    }

    // -------------------- transactions --------------------

    /**
     * Admit a signed transaction to the mempool. Balances are only checked, never reserved.
     *
     * @return the transaction hash
     * @throws ChainException INVALID_TRANSACTION, DUPLICATE_TRANSACTION, INSUFFICIENT_BALANCE or MEMPOOL_FULL
     */
    public String submitTransaction(Transaction tx) {
        synchronized (lock) {
            mempool.add(tx);
            return tx.hash();
        }
    }

    /** Pending transactions in the order a block would pick them. */
    public List<Transaction> selectForBlock() {
        synchronized (lock) {
            return producer.selectForBlock(mempool.snapshot(), params.maxTransactionsPerBlock() - 1,
                    params.maxBlockSize());
        }
    }

    public int evictExpiredTransactions() {
        synchronized (lock) {
            return mempool.evictExpired(clock.millis(), config.transactionMaxAgeMs);
        }
    }

    /** Nonce to stamp on the next transaction from {@code address}, counting pending ones. */
    public long nextNonce(String address) {
        synchronized (lock) {
            return mempool.highestNonce(address, state.getNonce(address)) + 1;
        }
    }

    // -------------------- mining --------------------

    /** Mine one block synchronously on the calling thread. */
    public Block mine(String minerAddress) {
        return mine(minerAddress, new CancellationToken());
    }

    /**
     * @throws ChainException ALREADY_MINING when another pass is in flight, MINING_ABORTED when cancelled,
     *                        STALE_BLOCK when the head moved during the search, INVALID_BLOCK when the sealed
     *                        block fails validation
     */
    public Block mine(String minerAddress, CancellationToken token) {
        beginMining(minerAddress, token);
        try {
            return doMine(minerAddress, token);
        } finally {
            endMining();
        }
    }

    /**
     * Start a mining pass on the background miner thread. The in-flight flag is taken before this
     * returns, so a second call fails with ALREADY_MINING right away.
     */
    public MiningJob mineAsync(String minerAddress) {
        CancellationToken token = new CancellationToken();
        beginMining(minerAddress, token);
        CompletableFuture<Block> result = new CompletableFuture<>();
        try {
            miningExecutor.execute(() -> {
                try {
                    result.complete(doMine(minerAddress, token));
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                } finally {
                    endMining();
                }
            });
        } catch (RejectedExecutionException e) {
            endMining();
            throw new ChainException(ChainError.MINING_ABORTED, "Miner is shut down", e);
        }
        return new MiningJob(result, token);
    }

    /** Advisory: the search stops at its next batch boundary unless it has already found a solution. */
    public boolean stopMining() {
        CancellationToken token = currentToken;
        if (token == null) return false;
        token.cancel();
        LOG.info("Stop requested for miner " + currentMiner);
        return true;
    }

    public boolean isMining() { return mining.get(); }

    private void beginMining(String minerAddress, CancellationToken token) {
        if (minerAddress == null || minerAddress.isBlank()) {
            throw new IllegalArgumentException("minerAddress required");
        }
        if (!mining.compareAndSet(false, true)) {
            throw new ChainException(ChainError.ALREADY_MINING, "Mining already in progress by " + currentMiner);
        }
        currentMiner = minerAddress;
        currentToken = token;
    }

    private void endMining() {
        currentToken = null;
        currentMiner = null;
        mining.set(false);
    }

    private Block doMine(String minerAddress, CancellationToken token) {
        Block candidate;
        List<Transaction> selected;
        int difficulty;
        synchronized (lock) {
            Block head = headBlock();
            difficulty = params.difficulty();
            List<Transaction> rewards = rewardTransactions(minerAddress, params.miningReward());
            int budget = Math.max(0, params.maxTransactionsPerBlock() - rewards.size());
            selected = producer.selectForBlock(mempool.snapshot(), budget, params.maxBlockSize());
            candidate = producer.assemble(head, minerAddress, selected, rewards, clock.millis(), difficulty,
                    params.maxTransactionsPerBlock());
        }

        long started = System.nanoTime();
        final Block toSeal = candidate;
        final int target = difficulty;
        boolean sealed = BlockMetrics.recordMining(() -> pow.mineBlock(toSeal, target, token));
        long elapsedMs = Math.max(1L, (System.nanoTime() - started) / 1_000_000L);
        if (!sealed) {
            throw new ChainException(ChainError.MINING_ABORTED, "Mining of block " + candidate.height() + " cancelled");
        }

        synchronized (lock) {
            Block head = headBlock();
            if (!head.hash().equals(candidate.previousHash())) {
                BlockMetrics.incrementStale();
                LOG.warning("Discarding block " + candidate.height() + ": head moved to " + head.hash());
                throw new ChainException(ChainError.STALE_BLOCK,
                        "Chain head advanced to height " + head.height() + " during mining");
            }
            ConsensusRules.validateBlock(candidate, head, params.maxTransactionsPerBlock(), verifier, clock.millis());
            producer.checkAffordable(candidate);

            chain.append(candidate);
            applyBlock(candidate);
            mempool.removeAll(selected);

            totalBlocks++;
            hashRate = Math.pow(16, difficulty) / (elapsedMs / 1000.0);
            validators.onBlockProposed(minerAddress);
            retargetIfDue(candidate.height());
            BlockMetrics.incrementBlocks();
            BlockMetrics.recordConfirmed(candidate.transactions().size());
            LOG.info("Block " + candidate.height() + " mined by " + minerAddress + " in " + elapsedMs + "ms: "
                    + candidate.transactions().size() + " txs, hash " + candidate.hash());
            return candidate;
        }
    }

    /** One reward, or a split across the miner's delegators when the miner is an active validator. */
    private List<Transaction> rewardTransactions(String minerAddress, long reward) {
        List<Transaction> out = new ArrayList<>();
        if (reward <= 0) return out;
        if (validators.isActive(minerAddress)) {
            RewardSplit split = validators.distributeReward(minerAddress, reward);
            if (split.delegatorAmounts().size() + 1 < params.maxTransactionsPerBlock()) {
                if (split.validatorAmount() > 0) out.add(Transaction.miningReward(minerAddress, split.validatorAmount()));
                new TreeMap<>(split.delegatorAmounts()).forEach((delegator, amount) ->
                        out.add(Transaction.miningReward(delegator, amount)));
                return out;
            }
        }
        out.add(Transaction.miningReward(minerAddress, reward));
        return out;
    }

    private void retargetIfDue(long height) {
        int interval = params.adjustmentInterval();
        if (interval < 2 || height == 0 || height % interval != 0) return;
        int next = pow.calculateDifficulty(chain.tail(interval), params.difficulty(), params.retargetPolicy());
        params.setDifficulty(next);
    }

    // -------------------- block application --------------------

    /** Mints rewards, charges fees to the community pool and dispatches each transaction by type. */
    private void applyBlock(Block block) {
        for (Transaction tx : block.transactions()) {
            if (tx.isProtocolMinted()) {
                state.mint(tx.toAddress(), tx.amount());
                if (tx.toAddress().equals(block.validator())) validators.recordReward(tx.toAddress(), tx.amount());
                continue;
            }
            state.transfer(tx.fromAddress(), ModuleAccounts.COMMUNITY_POOL, tx.fee());
            state.advanceNonce(tx.fromAddress(), tx.nonce());
            try {
                applyAction(tx, block.height());
            } catch (ChainException e) {
                failedActions.put(tx.hash(), e.error());
                LOG.warning("Transaction " + tx.hash() + " (" + tx.type() + ") confirmed without effect: " + e);
            }
            totalTransactions++;
        }
    }

    private void applyAction(Transaction tx, long height) {
        String from = tx.fromAddress();
        switch (tx.type()) {
            case TRANSFER:
                state.transfer(from, tx.toAddress(), tx.amount());
                break;
            case DELEGATE:
                requireBalance(from, tx.amount());
                validators.delegate(from, tx.toAddress(), tx.amount());
                state.transfer(from, ModuleAccounts.BONDED_POOL, tx.amount());
                break;
            case UNDELEGATE:
                validators.undelegate(from, tx.toAddress(), tx.amount());
                break;
            case REDELEGATE:
                validators.redelegate(from, tx.toAddress(), requirePayload(tx, "destination"), tx.amount());
                break;
            case CREATE_VALIDATOR:
                requireBalance(from, tx.amount());
                validators.register(from, tx.amount(), parseDouble(tx, "commission"), tx.payloadValue("description"));
                state.transfer(from, ModuleAccounts.BONDED_POOL, tx.amount());
                break;
            case EDIT_VALIDATOR:
                String commission = tx.payloadValue("commission");
                validators.edit(from, commission == null ? null : parseDouble(tx, "commission"),
                        tx.payloadValue("description"));
                break;
            case SUBMIT_PROPOSAL:
                governance.createProposal(draftOf(tx), from);
                break;
            case DEPOSIT:
                governance.addDeposit(parseLong(tx, "proposalId"), from, tx.amount());
                break;
            case VOTE:
                governance.vote(parseLong(tx, "proposalId"), from, requirePayload(tx, "option"));
                break;
            default:
                throw new ChainException(ChainError.INVALID_TRANSACTION, "Unexpected " + tx.type() + " at height " + height);
        }
    }

    private static ProposalDraft draftOf(Transaction tx) {
        Map<String, String> content = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : tx.payload().entrySet()) {
            if (e.getKey().startsWith("content.")) content.put(e.getKey().substring("content.".length()), e.getValue());
        }
        return new ProposalDraft(tx.payloadValue("title"), tx.payloadValue("description"),
                ProposalType.fromWireName(tx.payloadValue("proposalType")), content, tx.amount());
    }

    private void requireBalance(String address, long amount) {
        long balance = state.getBalance(address);
        if (balance < amount) {
            throw new ChainException(ChainError.INSUFFICIENT_BALANCE, address + " holds " + balance + ", needs " + amount);
        }
    }

    private static String requirePayload(Transaction tx, String key) {
        String v = tx.payloadValue(key);
        if (v == null || v.isBlank()) {
            throw new ChainException(ChainError.INVALID_TRANSACTION, "Missing payload field " + key);
        }
        return v;
    }

    private static long parseLong(Transaction tx, String key) {
        try {
            return Long.parseLong(requirePayload(tx, key));
        } catch (NumberFormatException e) {
            throw new ChainException(ChainError.INVALID_TRANSACTION, "Payload field " + key + " is not a number", e);
        }
    }

    private static double parseDouble(Transaction tx, String key) {
        try {
            return Double.parseDouble(requirePayload(tx, key));
        } catch (NumberFormatException e) {
            throw new ChainException(ChainError.INVALID_TRANSACTION, "Payload field " + key + " is not a number", e);
        }
    }

    /** Routes parameter changes for the blockchain and staking modules. */
    private final class ModuleParameterChanger implements ParameterChanger {
        @Override
        public void apply(String module, String parameter, String value) {
            if ("blockchain".equals(module)) {
                params.set(parameter, value);
            } else if ("staking".equals(module)) {
                validators.params().set(parameter, value);
            } else {
                throw new ChainException(ChainError.UNKNOWN_PARAMETER, "Unknown module " + module);
            }
        }

        @Override
        public void check(String module, String parameter, String value) {
            if ("blockchain".equals(module)) {
                params.check(parameter, value);
            } else if ("staking".equals(module)) {
                validators.params().check(parameter, value);
            } else {
                throw new ChainException(ChainError.UNKNOWN_PARAMETER, "Unknown module " + module);
            }
        }
    }

    // -------------------- maintenance --------------------

    /**
     * Release matured unbondings from the bonded pool back to their delegators. The pool is
     * checked before any entry is removed, so a shortfall leaves everything in place.
     *
     * @throws ChainException INSUFFICIENT_BALANCE when the bonded pool cannot cover the matured total
     */
    public int settleUnbondings() {
        synchronized (lock) {
            long now = clock.millis();
            long due = 0;
            for (UnbondingEntry e : validators.maturedUnbondings(now)) due = Math.addExact(due, e.amount());
            long pool = state.getBalance(ModuleAccounts.BONDED_POOL);
            if (pool < due) {
                throw new ChainException(ChainError.INSUFFICIENT_BALANCE,
                        "Bonded pool holds " + pool + ", matured unbondings need " + due);
            }
            List<UnbondingEntry> matured = validators.settleUnbondings(now);
            for (UnbondingEntry e : matured) {
                state.transfer(ModuleAccounts.BONDED_POOL, e.delegator(), e.amount());
            }
            return matured.size();
        }
    }

    // -------------------- staking --------------------

    /**
     * Bond more of the validator's own balance.
     *
     * @throws ChainException INSUFFICIENT_BALANCE, VALIDATOR_NOT_FOUND or INVALID_TRANSACTION
     */
    public void addSelfStake(String address, long amount) {
        synchronized (lock) {
            requireBalance(address, amount);
            validators.addSelfStake(address, amount);
            state.transfer(address, ModuleAccounts.BONDED_POOL, amount);
        }
    }

    /**
     * Unbond part of the validator's self stake straight back to its balance. The validator
     * goes inactive when what remains is under the minimum.
     *
     * @throws ChainException INSUFFICIENT_SELF_STAKE, VALIDATOR_NOT_FOUND or INVALID_TRANSACTION
     */
    public void removeSelfStake(String address, long amount) {
        synchronized (lock) {
            long pool = state.getBalance(ModuleAccounts.BONDED_POOL);
            if (pool < amount) {
                throw new ChainException(ChainError.INSUFFICIENT_BALANCE,
                        "Bonded pool holds " + pool + ", cannot release " + amount);
            }
            validators.removeSelfStake(address, amount);
            state.transfer(ModuleAccounts.BONDED_POOL, address, amount);
        }
    }

    public void activateValidator(String address) {
        synchronized (lock) {
            validators.activate(address);
        }
    }

    public void deactivateValidator(String address) {
        synchronized (lock) {
            validators.deactivate(address);
        }
    }

    /** Jail and slash at the current head height; the slashed stake is burned from the bonded pool. */
    public SlashingEvent jail(String address, String reason) {
        synchronized (lock) {
            return validators.jail(address, reason, headBlock().height());
        }
    }

    public void unjail(String address) {
        synchronized (lock) {
            validators.unjail(address);
        }
    }

    /** Credit a validator with validating the head block. */
    public void recordValidation(String address) {
        synchronized (lock) {
            validators.onBlockValidated(address);
        }
    }

    /** Count a missed head block against a validator; reaching the downtime threshold jails and slashes. */
    public void recordMissedBlock(String address) {
        synchronized (lock) {
            validators.onMissedBlock(address, headBlock().height());
        }
    }

    /** Full integrity recheck of every block and link. */
    public boolean validateChain() {
        return ConsensusRules.validateChain(chain.blocks(), verifier);
    }

    // -------------------- snapshot --------------------

    public ChainSnapshot exportSnapshot() {
        synchronized (lock) {
            return new ChainSnapshot(chain.blocks(), state.balances(), state.nonces(), getStats(),
                    params.difficulty(), mempool.snapshot());
        }
    }

    /**
     * Replace chain, ledger, difficulty and mempool with the snapshot. Validator and governance
     * state is not part of a snapshot and is reset.
     *
     * @throws ChainException INVALID_SNAPSHOT for an empty chain or balances that do not sum to the
     *                        recorded total supply; ALREADY_MINING while a pass is in flight
     */
    public void importSnapshot(ChainSnapshot snapshot) {
        synchronized (lock) {
            if (mining.get()) {
                throw new ChainException(ChainError.ALREADY_MINING, "Cannot import while mining");
            }
            if (snapshot.chain().isEmpty()) {
                throw new ChainException(ChainError.INVALID_SNAPSHOT, "Snapshot has no blocks");
            }
            long recorded = snapshot.stats() == null ? snapshot.balanceSum() : snapshot.stats().totalSupply();
            if (snapshot.balanceSum() != recorded) {
                throw new ChainException(ChainError.INVALID_SNAPSHOT,
                        "Balances sum to " + snapshot.balanceSum() + " but total supply is " + recorded);
            }
            if (!ConsensusRules.validateChain(snapshot.chain(), verifier)) {
                LOG.warning("Imported chain does not validate");
            }
            chain.replaceAll(snapshot.chain());
            state.restore(snapshot.balances(), snapshot.nonces());
            params.setDifficulty(snapshot.difficulty());
            mempool.replaceAll(snapshot.pendingTransactions());
            validators.clear();
            governance.clear();
            failedActions.clear();
            totalTransactions = snapshot.stats() == null ? 0 : snapshot.stats().totalTransactions();
            totalBlocks = snapshot.stats() == null ? chain.size() - 1 : snapshot.stats().totalBlocks();
            LOG.info("Imported snapshot: " + chain.size() + " blocks, supply " + state.totalSupply());
        }
    }

    // -------------------- queries --------------------

    public long getBalance(String address) { return state.getBalance(address); }

    public long getTotalSupply() { return state.totalSupply(); }

    public Map<String, Long> getBalances() { return state.balances(); }

    public Block getLatestBlock() { return headBlock(); }

    /** Number of blocks including genesis. */
    public long chainLength() { return chain.size(); }

    public Optional<Block> getBlockByHeight(long height) { return chain.getByHeight(height); }

    public Optional<Block> getBlockByHash(String hash) { return chain.getByHash(hash); }

    public List<Block> getBlocks() { return chain.blocks(); }

    public List<Transaction> getPendingTransactions() { return mempool.snapshot(); }

    /** Confirmed first, then pending. */
    public Optional<Transaction> getTransaction(String txHash) {
        Optional<Transaction> confirmed = chain.findTransaction(txHash);
        if (confirmed.isPresent()) return confirmed;
        for (Transaction tx : mempool.snapshot()) {
            if (tx.hash().equals(txHash)) return Optional.of(tx);
        }
        return Optional.empty();
    }

    /** Confirmed transactions sent or received by {@code address}, oldest first. */
    public List<Transaction> getTransactionHistory(String address) {
        List<Transaction> out = new ArrayList<>();
        for (Block b : chain.blocks()) {
            for (Transaction tx : b.transactions()) {
                if (address.equals(tx.fromAddress()) || address.equals(tx.toAddress())) out.add(tx);
            }
        }
        return out;
    }

    /** Failure kind of a confirmed transaction whose action was skipped. */
    public Optional<ChainError> getFailedAction(String txHash) {
        synchronized (lock) {
            return Optional.ofNullable(failedActions.get(txHash));
        }
    }

    public Map<String, ChainError> getFailedActions() {
        synchronized (lock) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(failedActions));
        }
    }

    public ChainStats getStats() {
        synchronized (lock) {
            return new ChainStats(state.totalSupply(), totalTransactions, totalBlocks, averageBlockTime(),
                    hashRate, chain.size(), mempool.size(), params.difficulty(), mining.get(), currentMiner);
        }
    }

    private long averageBlockTime() {
        List<Block> recent = chain.tail(STATS_WINDOW);
        if (recent.size() < 2) return 0L;
        return (recent.get(recent.size() - 1).timestamp() - recent.get(0).timestamp()) / (recent.size() - 1);
    }

    public MiningStats getMiningStats() { return pow.stats(); }

    public void resetMiningStats() { pow.resetStats(); }

    /** Expected time at the current difficulty, from the average hash rate so far. */
    public Duration estimateMiningTime() {
        double rate = pow.stats().averageHashRate();
        if (rate <= 0) throw new IllegalStateException("No hash rate measured yet");
        return ProofOfWork.estimateMiningTime(params.difficulty(), rate);
    }

    public ChainParams params() { return params; }
    public ChainConfig config() { return config; }
    /** Read-only; stake changes go through the staking methods above. */
    public ValidatorQueries validators() { return validators; }
    public GovernanceManager governance() { return governance; }
    public SignatureUtil verifier() { return verifier; }

    private Block headBlock() {
        return chain.head().orElseThrow(() -> new IllegalStateException("Chain has no genesis block"));
    }

    @Override
    public void close() {
        stopMining();
        miningExecutor.shutdownNow();
    }
}
