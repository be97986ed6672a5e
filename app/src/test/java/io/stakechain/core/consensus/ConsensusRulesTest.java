package io.stakechain.core.consensus;

import io.stakechain.core.crypto.SignatureUtil;
import io.stakechain.core.protocol.Block;
import io.stakechain.core.protocol.ChainError;
import io.stakechain.core.protocol.ChainException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsensusRulesTest {

    private static final SignatureUtil VERIFIER = SignatureUtil.verifier();

    private static Block child(Block parent, long timestamp) {
        Block b = new Block(parent.height() + 1, timestamp, parent.hash(), "wtf1miner", 0, 10);
        b.seal();
        return b;
    }

    @Test
    void rejectsUnknownParent() {
        long now = System.currentTimeMillis();
        Block genesis = Block.genesis(now, 10);
        Block orphan = new Block(1, now, "ff".repeat(32), "wtf1miner", 0, 10);
        orphan.seal();

        ChainException ex = assertThrows(ChainException.class,
                () -> ConsensusRules.validateBlock(orphan, genesis, 10, VERIFIER, now));
        assertEquals(ChainError.INVALID_BLOCK, ex.error());
    }

    @Test
    void rejectsTimestampBeforeParent() {
        long now = System.currentTimeMillis();
        Block genesis = Block.genesis(now, 10);
        Block early = child(genesis, now - 1_000);

        assertThrows(ChainException.class, () -> ConsensusRules.validateBlock(early, genesis, 10, VERIFIER, now));
    }

    @Test
    void rejectsTimestampFarInFuture() {
        long now = System.currentTimeMillis();
        Block genesis = Block.genesis(now, 10);
        Block future = child(genesis, now + ConsensusRules.MAX_FUTURE_DRIFT_MS + 1);

        assertThrows(ChainException.class, () -> ConsensusRules.validateBlock(future, genesis, 10, VERIFIER, now));
    }

    @Test
    void rejectsWrongHeight() {
        long now = System.currentTimeMillis();
        Block genesis = Block.genesis(now, 10);
        Block skipped = new Block(2, now, genesis.hash(), "wtf1miner", 0, 10);
        skipped.seal();

        assertThrows(ChainException.class, () -> ConsensusRules.validateBlock(skipped, genesis, 10, VERIFIER, now));
    }

    @Test
    void acceptsValidChild() {
        long now = System.currentTimeMillis();
        Block genesis = Block.genesis(now, 10);
        Block next = child(genesis, now + 1_000);

        assertDoesNotThrow(() -> ConsensusRules.validateBlock(next, genesis, 10, VERIFIER, now));
    }

    @Test
    void validateChainDetectsBrokenHistory() {
        long now = System.currentTimeMillis();
        List<Block> chain = new ArrayList<>();
        chain.add(Block.genesis(now, 10));
        chain.add(child(chain.get(0), now + 1));
        chain.add(child(chain.get(1), now + 2));
        assertTrue(ConsensusRules.validateChain(chain, VERIFIER));

        Block mid = chain.get(1);
        chain.set(1, Block.builder().from(mid).hash("f".repeat(64)).build());
        assertFalse(ConsensusRules.validateChain(chain, VERIFIER));

        assertFalse(ConsensusRules.validateChain(List.of(), VERIFIER));
    }
}
