package io.stakechain.core.node;

import io.stakechain.core.protocol.Block;
import io.stakechain.core.state.StateStore;
import io.stakechain.core.storage.ChainStore;

import java.util.Map;

/**
 * Creates the genesis block and seeds initial balances.
 * - Height = 0
 * - previousHash = "0"
 * - no transactions, so merkleRoot = sha256("empty")
 * - difficulty = 0 (no PoW needed)
 */
public final class GenesisBuilder {
    private GenesisBuilder(){}

    public static Block buildGenesis(long timestamp, int maxTxPerBlock) {
        return Block.genesis(timestamp, maxTxPerBlock);
    }

    /** Mint initial balances (allocations map) into state; total supply grows accordingly. */
    public static void seedBalances(StateStore state, Map<String, Long> allocations) {
        if (allocations == null || allocations.isEmpty()) return;
        for (Map.Entry<String, Long> e : allocations.entrySet()) {
            long amount = e.getValue() == null ? 0L : e.getValue();
            if (amount > 0) state.mint(e.getKey(), amount);
        }
    }

    /**
     * If the chain is empty, seed balances and store the genesis block.
     * Idempotent: does nothing if a head already exists.
     */
    public static void initIfNeeded(ChainStore chain, StateStore state, Map<String, Long> allocations,
                                    long timestamp, int maxTxPerBlock) {
        if (chain.head().isPresent()) return;
        seedBalances(state, allocations);
        chain.append(buildGenesis(timestamp, maxTxPerBlock));
    }
}
