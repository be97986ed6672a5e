package io.stakechain.core.mempool;

import io.stakechain.core.protocol.ChainError;
import io.stakechain.core.protocol.ChainException;
import io.stakechain.core.protocol.Transaction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntSupplier;
import java.util.logging.Logger;

/**
 * Pending transactions keyed by hash, iterated in arrival order.
 * Admission never touches balances; several pending spends may together exceed a balance.
 */
public final class Mempool {
    private static final Logger LOG = Logger.getLogger(Mempool.class.getName());

    private final Map<String, Transaction> pending = new LinkedHashMap<>();
    private final TxValidator validator;
    private final IntSupplier capacity;

    /** {@code capacity} is read on every admission so governance changes apply immediately. */
    public Mempool(TxValidator validator, IntSupplier capacity) {
        this.validator = validator;
        this.capacity = capacity;
    }

    /**
     * Validate and add a tx.
     * @throws ChainException INVALID_TRANSACTION, DUPLICATE_TRANSACTION, INSUFFICIENT_BALANCE or MEMPOOL_FULL
     */
    public synchronized void add(Transaction tx) {
        validator.validate(tx);
        if (pending.containsKey(tx.hash())) {
            throw new ChainException(ChainError.DUPLICATE_TRANSACTION, "Transaction " + tx.hash() + " already pending");
        }
        for (Transaction other : pending.values()) {
            if (other.nonce() == tx.nonce() && tx.fromAddress().equals(other.fromAddress())) {
                throw new ChainException(ChainError.DUPLICATE_TRANSACTION,
                        "Nonce " + tx.nonce() + " of " + tx.fromAddress() + " already pending as " + other.hash());
            }
        }
        int cap = capacity.getAsInt();
        if (pending.size() >= cap) {
            throw new ChainException(ChainError.MEMPOOL_FULL, "Mempool holds " + cap + " transactions");
        }
        pending.put(tx.hash(), tx);
        LOG.fine(() -> "Accepted " + tx);
    }

    /** Highest pending nonce of {@code address}, or {@code floor} when none is higher. */
    public synchronized long highestNonce(String address, long floor) {
        long max = floor;
        for (Transaction tx : pending.values()) {
            if (address.equals(tx.fromAddress()) && tx.nonce() > max) max = tx.nonce();
        }
        return max;
    }

    /** Arrival-ordered copy. */
    public synchronized List<Transaction> snapshot() {
        return new ArrayList<>(pending.values());
    }

    public synchronized void removeAll(Collection<Transaction> included) {
        for (Transaction tx : included) {
            if (tx.hash() != null) pending.remove(tx.hash());
        }
    }

    public synchronized boolean contains(String txHash) {
        return txHash != null && pending.containsKey(txHash);
    }

    /** Drops transactions older than {@code maxAgeMillis}; returns how many were evicted. */
    public synchronized int evictExpired(long now, long maxAgeMillis) {
        int evicted = 0;
        Iterator<Transaction> it = pending.values().iterator();
        while (it.hasNext()) {
            if (it.next().isExpired(now, maxAgeMillis)) {
                it.remove();
                evicted++;
            }
        }
        if (evicted > 0) LOG.info("Evicted " + evicted + " expired transactions");
        return evicted;
    }

    /** Replace contents without admission checks (snapshot import). */
    public synchronized void replaceAll(Collection<Transaction> txs) {
        pending.clear();
        for (Transaction tx : txs) pending.put(tx.hash(), tx);
    }

    public synchronized void clear() { pending.clear(); }

    public synchronized int size() { return pending.size(); }
}
