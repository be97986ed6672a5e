package io.stakechain.core.metrics;

import io.stakechain.core.TestClock;
import io.stakechain.core.node.Blockchain;
import io.stakechain.core.node.ChainConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BlockMetricsTest {

    @Test
    void miningUpdatesCounters() {
        double before = BlockMetrics.registry().counter("blocks.mined").count();
        try (Blockchain chain = new Blockchain(ChainConfig.defaultLocal().withDifficulty(1), new TestClock())) {
            chain.mine("wtf1miner");
        }
        assertEquals(before + 1, BlockMetrics.registry().counter("blocks.mined").count());

        String scrape = BlockMetrics.scrapeMetrics();
        assertTrue(scrape.contains("blocks.mined"));
        assertTrue(scrape.contains("chain.difficulty"));
        assertTrue(scrape.contains("pow.hashes"));
    }
}
