package io.stakechain.core.node;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ChainConfigTest {

    @Test
    void loadsOverridesAndKeepsDefaults() throws IOException {
        ChainConfig config;
        try (InputStream in = getClass().getResourceAsStream("/chain-test.json")) {
            assertNotNull(in, "chain-test.json on the test classpath");
            config = ChainConfig.load(in);
        }
        ChainConfig d = ChainConfig.defaultLocal();

        assertEquals(2, config.difficulty);
        assertEquals(25, config.miningReward);
        assertEquals(50, config.maxTransactionsPerBlock);
        assertEquals(d.mempoolCapacity, config.mempoolCapacity);
        assertEquals(Map.of("wtf1alice", 700_000L, "wtf1bob", 300_000L), config.genesisAllocations);
        assertEquals(500, config.staking.minSelfStake());
        assertEquals(60_000, config.staking.unbondingPeriodMs());
        assertEquals(d.staking.slashingFraction(), config.staking.slashingFraction());
        assertEquals(120_000, config.governance.votingPeriodMs());
        assertEquals(0.25, config.governance.quorum());
        assertFalse(config.governance.burnVoteVeto());
        assertEquals(d.governance.minDeposit(), config.governance.minDeposit());
        assertNull(config.minerAddress);
    }

    @Test
    void rejectsNonObjectDocument() {
        InputStream in = new ByteArrayInputStream("[1,2]".getBytes(StandardCharsets.UTF_8));
        assertThrows(IOException.class, () -> ChainConfig.load(in));
    }

    @Test
    void copiesReplaceSingleFields() {
        ChainConfig base = ChainConfig.defaultLocal();
        ChainConfig mined = base.withMiner("wtf1miner").withDifficulty(3);

        assertEquals("wtf1miner", mined.minerAddress);
        assertEquals(3, mined.difficulty);
        assertEquals(base.miningReward, mined.miningReward);
        assertNull(base.minerAddress);
        assertThrows(IllegalArgumentException.class, () -> base.withDifficulty(-1));
    }

    @Test
    void paramsStartFromConfig() {
        ChainParams params = new ChainParams(ChainConfig.defaultLocal().withDifficulty(3));
        assertEquals(3, params.difficulty());
        assertEquals(50, params.miningReward());

        params.set("blockTime", "2000");
        assertEquals(2_000, params.retargetPolicy().targetBlockTimeMs());
        assertEquals(2_000L, params.asMap().get("blockTime"));
    }
}
