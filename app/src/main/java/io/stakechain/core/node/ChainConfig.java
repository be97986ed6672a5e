package io.stakechain.core.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.stakechain.core.crypto.Bech32Address;
import io.stakechain.core.governance.GovernanceParams;
import io.stakechain.core.staking.StakingParams;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Initial chain parameters. Runtime values that governance may change are copied out of
 * here into {@link ChainParams}, {@link StakingParams} and {@link GovernanceParams}.
 */
public final class ChainConfig {
    private static final ObjectMapper JSON = new ObjectMapper();

    public static final String DEFAULT_GENESIS_ADDRESS = "wtf1genesis000000000000000000000000";

    public final int difficulty;
    public final long miningReward;
    public final long blockTimeMs;
    public final long maxBlockSize;
    public final int maxTransactionsPerBlock;
    public final int mempoolCapacity;
    public final int difficultyAdjustmentInterval;
    public final int minDifficulty;
    public final int maxDifficulty;
    public final int powBatchSize;
    public final long transactionMaxAgeMs;
    public final long maintenanceIntervalMs;
    public final String addressPrefix;
    public final Map<String, Long> genesisAllocations;
    public final String minerAddress;
    public final Staking staking;
    public final Governance governance;

    /** Staking section. */
    public record Staking(long minSelfStake, long unbondingPeriodMs, double slashingFraction,
                          long jailTimeMs, int downtimeThreshold) {
        public StakingParams toParams() {
            return new StakingParams(minSelfStake, unbondingPeriodMs, slashingFraction, jailTimeMs, downtimeThreshold);
        }
    }

    /** Governance section. */
    public record Governance(long minDeposit, long maxDepositPeriodMs, long votingPeriodMs, double quorum,
                             double threshold, double vetoThreshold, boolean burnVoteVeto,
                             boolean burnProposalDepositPrevote) {
        public GovernanceParams toParams() {
            return new GovernanceParams(minDeposit, maxDepositPeriodMs, votingPeriodMs, quorum, threshold,
                    vetoThreshold, burnVoteVeto, burnProposalDepositPrevote);
        }
    }

    public ChainConfig(int difficulty, long miningReward, long blockTimeMs, long maxBlockSize,
                       int maxTransactionsPerBlock, int mempoolCapacity, int difficultyAdjustmentInterval,
                       int minDifficulty, int maxDifficulty, int powBatchSize, long transactionMaxAgeMs,
                       long maintenanceIntervalMs, String addressPrefix, Map<String, Long> genesisAllocations,
                       String minerAddress, Staking staking, Governance governance) {
        if (difficulty < 0) throw new IllegalArgumentException("difficulty must be >= 0");
        if (maxTransactionsPerBlock < 1) throw new IllegalArgumentException("maxTransactionsPerBlock must be >= 1");
        this.difficulty = difficulty;
        this.miningReward = miningReward;
        this.blockTimeMs = blockTimeMs;
        this.maxBlockSize = maxBlockSize;
        this.maxTransactionsPerBlock = maxTransactionsPerBlock;
        this.mempoolCapacity = mempoolCapacity;
        this.difficultyAdjustmentInterval = difficultyAdjustmentInterval;
        this.minDifficulty = minDifficulty;
        this.maxDifficulty = maxDifficulty;
        this.powBatchSize = powBatchSize;
        this.transactionMaxAgeMs = transactionMaxAgeMs;
        this.maintenanceIntervalMs = maintenanceIntervalMs;
        this.addressPrefix = addressPrefix;
        this.genesisAllocations = Collections.unmodifiableMap(new LinkedHashMap<>(genesisAllocations));
        this.minerAddress = (minerAddress == null || minerAddress.isBlank()) ? null : minerAddress;
        this.staking = staking;
        this.governance = governance;
    }

    public static ChainConfig defaultLocal() {
        Map<String, Long> alloc = new LinkedHashMap<>();
        alloc.put(DEFAULT_GENESIS_ADDRESS, 1_000_000L);
        StakingParams s = StakingParams.defaults();
        GovernanceParams g = GovernanceParams.defaults();
        return new ChainConfig(
                4,             // leading zero hex digits
                50L,           // block reward
                5_000L,        // target block time
                1_000_000L,    // block size budget, bytes
                1000,          // tx per block cap
                1000,          // mempool capacity
                10,            // retarget every N blocks
                1, 10,         // difficulty bounds
                10_000,        // nonces per PoW batch
                24L * 60 * 60 * 1000,
                1_000L,        // maintenance sweep period
                Bech32Address.DEFAULT_PREFIX,
                alloc,
                null,          // miner address resolved later
                new Staking(s.minSelfStake(), s.unbondingPeriodMs(), s.slashingFraction(), s.jailTimeMs(),
                        s.downtimeThreshold()),
                new Governance(g.minDeposit(), g.maxDepositPeriodMs(), g.votingPeriodMs(), g.quorum(),
                        g.threshold(), g.vetoThreshold(), g.burnVoteVeto(), g.burnProposalDepositPrevote())
        );
    }

    public static ChainConfig load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    /** Reads a JSON document; absent keys keep their {@link #defaultLocal()} values. */
    public static ChainConfig load(InputStream in) throws IOException {
        JsonNode root = JSON.readTree(in);
        ChainConfig d = defaultLocal();
        if (root == null || !root.isObject()) {
            throw new IOException("Config must be a JSON object");
        }
        Map<String, Long> alloc = d.genesisAllocations;
        JsonNode allocNode = root.get("genesisAllocations");
        if (allocNode != null && allocNode.isObject()) {
            alloc = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = allocNode.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                alloc.put(e.getKey(), e.getValue().asLong());
            }
        }
        JsonNode st = root.path("staking");
        JsonNode gv = root.path("governance");
        return new ChainConfig(
                root.path("difficulty").asInt(d.difficulty),
                root.path("miningReward").asLong(d.miningReward),
                root.path("blockTimeMs").asLong(d.blockTimeMs),
                root.path("maxBlockSize").asLong(d.maxBlockSize),
                root.path("maxTransactionsPerBlock").asInt(d.maxTransactionsPerBlock),
                root.path("mempoolCapacity").asInt(d.mempoolCapacity),
                root.path("difficultyAdjustmentInterval").asInt(d.difficultyAdjustmentInterval),
                root.path("minDifficulty").asInt(d.minDifficulty),
                root.path("maxDifficulty").asInt(d.maxDifficulty),
                root.path("powBatchSize").asInt(d.powBatchSize),
                root.path("transactionMaxAgeMs").asLong(d.transactionMaxAgeMs),
                root.path("maintenanceIntervalMs").asLong(d.maintenanceIntervalMs),
                root.path("addressPrefix").asText(d.addressPrefix),
                alloc,
                root.path("minerAddress").asText(null),
                new Staking(
                        st.path("minSelfStake").asLong(d.staking.minSelfStake()),
                        st.path("unbondingPeriodMs").asLong(d.staking.unbondingPeriodMs()),
                        st.path("slashingFraction").asDouble(d.staking.slashingFraction()),
                        st.path("jailTimeMs").asLong(d.staking.jailTimeMs()),
                        st.path("downtimeThreshold").asInt(d.staking.downtimeThreshold())),
                new Governance(
                        gv.path("minDeposit").asLong(d.governance.minDeposit()),
                        gv.path("maxDepositPeriodMs").asLong(d.governance.maxDepositPeriodMs()),
                        gv.path("votingPeriodMs").asLong(d.governance.votingPeriodMs()),
                        gv.path("quorum").asDouble(d.governance.quorum()),
                        gv.path("threshold").asDouble(d.governance.threshold()),
                        gv.path("vetoThreshold").asDouble(d.governance.vetoThreshold()),
                        gv.path("burnVoteVeto").asBoolean(d.governance.burnVoteVeto()),
                        gv.path("burnProposalDepositPrevote").asBoolean(d.governance.burnProposalDepositPrevote()))
        );
    }

    public ChainConfig withMiner(String minerAddress) {
        return new ChainConfig(difficulty, miningReward, blockTimeMs, maxBlockSize, maxTransactionsPerBlock,
                mempoolCapacity, difficultyAdjustmentInterval, minDifficulty, maxDifficulty, powBatchSize,
                transactionMaxAgeMs, maintenanceIntervalMs, addressPrefix, genesisAllocations, minerAddress,
                staking, governance);
    }

    public ChainConfig withDifficulty(int difficulty) {
        return new ChainConfig(difficulty, miningReward, blockTimeMs, maxBlockSize, maxTransactionsPerBlock,
                mempoolCapacity, difficultyAdjustmentInterval, minDifficulty, maxDifficulty, powBatchSize,
                transactionMaxAgeMs, maintenanceIntervalMs, addressPrefix, genesisAllocations, minerAddress,
                staking, governance);
    }

    public ChainConfig withGenesisAllocations(Map<String, Long> allocations) {
        return new ChainConfig(difficulty, miningReward, blockTimeMs, maxBlockSize, maxTransactionsPerBlock,
                mempoolCapacity, difficultyAdjustmentInterval, minDifficulty, maxDifficulty, powBatchSize,
                transactionMaxAgeMs, maintenanceIntervalMs, addressPrefix, allocations, minerAddress,
                staking, governance);
    }

    public ChainConfig withGovernance(Governance governance) {
        return new ChainConfig(difficulty, miningReward, blockTimeMs, maxBlockSize, maxTransactionsPerBlock,
                mempoolCapacity, difficultyAdjustmentInterval, minDifficulty, maxDifficulty, powBatchSize,
                transactionMaxAgeMs, maintenanceIntervalMs, addressPrefix, genesisAllocations, minerAddress,
                staking, governance);
    }

    public ChainConfig withStaking(Staking staking) {
        return new ChainConfig(difficulty, miningReward, blockTimeMs, maxBlockSize, maxTransactionsPerBlock,
                mempoolCapacity, difficultyAdjustmentInterval, minDifficulty, maxDifficulty, powBatchSize,
                transactionMaxAgeMs, maintenanceIntervalMs, addressPrefix, genesisAllocations, minerAddress,
                staking, governance);
    }
}
