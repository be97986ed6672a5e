package io.stakechain.core.snapshot;

import io.stakechain.core.TestClock;
import io.stakechain.core.crypto.Wallet;
import io.stakechain.core.node.Blockchain;
import io.stakechain.core.node.ChainConfig;
import io.stakechain.core.protocol.ChainError;
import io.stakechain.core.protocol.ChainException;
import io.stakechain.core.protocol.Transaction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotCodecTest {

    private TestClock clock;
    private Wallet alice;
    private ChainConfig config;
    private Blockchain source;

    @BeforeEach
    void setUp() {
        clock = new TestClock();
        alice = Wallet.generate();
        config = ChainConfig.defaultLocal().withDifficulty(1)
                .withGenesisAllocations(Map.of(alice.address(), 10_000L));
        source = new Blockchain(config, clock);

        Transaction mined = Transaction.transfer(alice.address(), "wtf1bob", 100);
        mined.setNonce(source.nextNonce(alice.address()));
        mined.sign(alice);
        source.submitTransaction(mined);
        source.mine(alice.address());

        Transaction pending = Transaction.transfer(alice.address(), "wtf1carol", 5);
        pending.setNonce(source.nextNonce(alice.address()));
        pending.sign(alice);
        source.submitTransaction(pending);
    }

    @AfterEach
    void tearDown() {
        source.close();
    }

    @Test
    void importRestoresChainLedgerAndPool(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("snapshot.json");
        SnapshotCodec.write(source.exportSnapshot(), file);

        try (Blockchain target = new Blockchain(config, clock)) {
            target.importSnapshot(SnapshotCodec.read(file));

            assertEquals(source.chainLength(), target.chainLength());
            assertEquals(source.getLatestBlock().hash(), target.getLatestBlock().hash());
            assertEquals(source.getBalances(), target.getBalances());
            assertEquals(source.getTotalSupply(), target.getTotalSupply());
            assertEquals(1, target.getPendingTransactions().size());
            assertEquals(source.getStats().totalBlocks(), target.getStats().totalBlocks());
            assertTrue(target.validateChain());

            target.mine(alice.address());
            assertEquals(5, target.getBalance("wtf1carol"));
        }
    }

    @Test
    void jsonKeepsSignaturesIntact() {
        ChainSnapshot snap = SnapshotCodec.fromJson(SnapshotCodec.toJson(source.exportSnapshot()));
        Transaction tx = snap.chain().get(1).transactions().get(0);
        assertTrue(tx.isValid());
        assertEquals(source.getBlocks().get(1).merkleRoot(), snap.chain().get(1).merkleRoot());
    }

    @Test
    void balancesMustMatchRecordedSupply() {
        ChainSnapshot snap = source.exportSnapshot();
        Map<String, Long> inflated = new HashMap<>(snap.balances());
        inflated.merge("wtf1bob", 1L, Long::sum);
        ChainSnapshot bad = new ChainSnapshot(snap.chain(), inflated, snap.nonces(), snap.stats(),
                snap.difficulty(), snap.pendingTransactions());

        try (Blockchain target = new Blockchain(config, clock)) {
            ChainException ex = assertThrows(ChainException.class, () -> target.importSnapshot(bad));
            assertEquals(ChainError.INVALID_SNAPSHOT, ex.error());
            assertEquals(1, target.chainLength());
        }
    }

    @Test
    void malformedJsonIsInvalidSnapshot() {
        ChainException ex = assertThrows(ChainException.class, () -> SnapshotCodec.fromJson("{\"chain\": 7,"));
        assertEquals(ChainError.INVALID_SNAPSHOT, ex.error());
    }
}
