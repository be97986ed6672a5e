package io.stakechain.core.snapshot;

import io.stakechain.core.node.ChainStats;
import io.stakechain.core.protocol.Block;
import io.stakechain.core.protocol.Transaction;

import java.util.List;
import java.util.Map;

/** Exported chain state: blocks, ledger, stats, difficulty and the pending pool. */
public record ChainSnapshot(List<Block> chain, Map<String, Long> balances, Map<String, Long> nonces,
                            ChainStats stats, int difficulty, List<Transaction> pendingTransactions) {
    public ChainSnapshot {
        chain = List.copyOf(chain);
        balances = Map.copyOf(balances);
        nonces = nonces == null ? Map.of() : Map.copyOf(nonces);
        pendingTransactions = pendingTransactions == null ? List.of() : List.copyOf(pendingTransactions);
    }

    public long balanceSum() {
        long sum = 0;
        for (long v : balances.values()) sum += v;
        return sum;
    }
}
