package io.stakechain.core.state;

import io.stakechain.core.protocol.ChainError;
import io.stakechain.core.protocol.ChainException;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * In-memory implementation of StateStore.
 * Tracks balances and nonces using simple HashMaps.
 * Not persistent, resets every process run.
 */
public final class InMemoryStateStore implements StateStore {

    private final Map<String, Long> balances = new HashMap<>();
    private final Map<String, Long> nonces   = new HashMap<>();
    private long totalSupply;

    @Override
    public synchronized long getBalance(String address) {
        if (address == null) return 0L;
        return balances.getOrDefault(address, 0L);
    }

    @Override
    public synchronized long getNonce(String address) {
        if (address == null) return 0L;
        return nonces.getOrDefault(address, 0L);
    }

    @Override
    public synchronized long totalSupply() {
        return totalSupply;
    }

    @Override
    public synchronized void transfer(String from, String to, long amount) {
        requireAddress(from);
        requireAddress(to);
        requireNonNegative(amount);
        long fromBal = getBalance(from);
        if (fromBal < amount) {
            throw new ChainException(ChainError.INSUFFICIENT_BALANCE,
                    from + " holds " + fromBal + ", needs " + amount);
        }
        if (amount == 0 || from.equals(to)) return;
        put(from, fromBal - amount);
        put(to, getBalance(to) + amount);
    }

    @Override
    public synchronized void mint(String to, long amount) {
        requireAddress(to);
        requireNonNegative(amount);
        put(to, getBalance(to) + amount);
        totalSupply += amount;
    }

    @Override
    public synchronized void burn(String from, long amount) {
        requireAddress(from);
        requireNonNegative(amount);
        long fromBal = getBalance(from);
        if (fromBal < amount) {
            throw new ChainException(ChainError.INSUFFICIENT_BALANCE,
                    "Cannot burn " + amount + " from " + from + " holding " + fromBal);
        }
        put(from, fromBal - amount);
        totalSupply -= amount;
    }

    @Override
    public synchronized void advanceNonce(String address, long nonce) {
        requireAddress(address);
        if (nonce > getNonce(address)) nonces.put(address, nonce);
    }

    @Override
    public synchronized Map<String, Long> balances() {
        return new TreeMap<>(balances);
    }

    @Override
    public synchronized Map<String, Long> nonces() {
        return new TreeMap<>(nonces);
    }

    @Override
    public synchronized void restore(Map<String, Long> newBalances, Map<String, Long> newNonces) {
        long sum = 0;
        for (Map.Entry<String, Long> e : newBalances.entrySet()) {
            if (e.getValue() == null || e.getValue() < 0) {
                throw new IllegalArgumentException("Negative balance for " + e.getKey());
            }
            sum = Math.addExact(sum, e.getValue());
        }
        balances.clear();
        nonces.clear();
        newBalances.forEach(this::put);
        if (newNonces != null) nonces.putAll(newNonces);
        totalSupply = sum;
    }

    private void put(String address, long value) {
        if (value == 0) balances.remove(address);
        else balances.put(address, value);
    }

    private static void requireAddress(String address) {
        if (address == null || address.isBlank()) throw new IllegalArgumentException("address required");
    }

    private static void requireNonNegative(long amount) {
        if (amount < 0) throw new IllegalArgumentException("amount must be >= 0");
    }
}
