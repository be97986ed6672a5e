package io.stakechain.core.storage;

import io.stakechain.core.protocol.Block;
import io.stakechain.core.protocol.Transaction;

import java.util.List;
import java.util.Optional;

/**
 * Append-only canonical block list with hash and transaction indexes.
 *
 * Notes:
 * - Height equals list position; genesis is height 0.
 * - There is no fork choice, so the head is always the last appended block.
 */
public interface ChainStore {

    /** Append a sealed block whose height is {@link #size()}. */
    void append(Block block);

    Optional<Block> head();

    Optional<Block> getByHeight(long height);

    Optional<Block> getByHash(String blockHash);

    /** Confirmed transaction by hash. */
    Optional<Transaction> findTransaction(String txHash);

    boolean containsTransaction(String txHash);

    /** Number of blocks stored, i.e. chain length. */
    long size();

    /** Snapshot of the chain in height order. */
    List<Block> blocks();

    /** Drop everything and store {@code blocks} as the chain (used by import). */
    void replaceAll(List<Block> blocks);

    /** The last {@code n} blocks in height order. */
    default List<Block> tail(int n) {
        List<Block> all = blocks();
        return all.subList(Math.max(0, all.size() - n), all.size());
    }
}
