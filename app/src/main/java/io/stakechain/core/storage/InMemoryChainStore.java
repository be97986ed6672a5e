package io.stakechain.core.storage;

import io.stakechain.core.protocol.Block;
import io.stakechain.core.protocol.Transaction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Simple, fast in-memory chain store.
 * Blocks are kept in a list; hash lookups go through two maps rebuilt on import.
 */
public final class InMemoryChainStore implements ChainStore {

    private final List<Block> blocks = new ArrayList<>();

    /** Map: blockHash -> Block */
    private final Map<String, Block> byHash = new HashMap<>();

    /** Map: txHash -> Transaction */
    private final Map<String, Transaction> txIndex = new HashMap<>();

    @Override
    public synchronized void append(Block block) {
        if (block == null) throw new IllegalArgumentException("block required");
        if (!block.isSealed()) throw new IllegalArgumentException("block must be sealed");
        if (block.height() != blocks.size()) {
            throw new IllegalArgumentException("Expected height " + blocks.size() + ", got " + block.height());
        }
        blocks.add(block);
        index(block);
    }

    @Override
    public synchronized Optional<Block> head() {
        if (blocks.isEmpty()) return Optional.empty();
        return Optional.of(blocks.get(blocks.size() - 1));
    }

    @Override
    public synchronized Optional<Block> getByHeight(long height) {
        if (height < 0 || height >= blocks.size()) return Optional.empty();
        return Optional.of(blocks.get((int) height));
    }

    @Override
    public synchronized Optional<Block> getByHash(String blockHash) {
        if (blockHash == null) return Optional.empty();
        return Optional.ofNullable(byHash.get(blockHash));
    }

    @Override
    public synchronized Optional<Transaction> findTransaction(String txHash) {
        if (txHash == null) return Optional.empty();
        return Optional.ofNullable(txIndex.get(txHash));
    }

    @Override
    public synchronized boolean containsTransaction(String txHash) {
        return txHash != null && txIndex.containsKey(txHash);
    }

    @Override
    public synchronized long size() {
        return blocks.size();
    }

    @Override
    public synchronized List<Block> blocks() {
        return new ArrayList<>(blocks);
    }

    @Override
    public synchronized void replaceAll(List<Block> newBlocks) {
        blocks.clear();
        byHash.clear();
        txIndex.clear();
        for (Block b : newBlocks) {
            blocks.add(b);
            index(b);
        }
    }

    private void index(Block block) {
        byHash.put(block.hash(), block);
        for (Transaction tx : block.transactions()) {
            if (tx.hash() != null) txIndex.put(tx.hash(), tx);
        }
    }
}
