package io.stakechain.core.state;

import java.util.Map;

/**
 * Account ledger: balances, nonces and total supply.
 * Every mutation keeps {@code sum(balances) == totalSupply()}.
 */
public interface StateStore {
    long getBalance(String address);
    long getNonce(String address);
    long totalSupply();

    /**
     * Move {@code amount} between two accounts.
     * @throws io.stakechain.core.protocol.ChainException INSUFFICIENT_BALANCE when {@code from} is short
     */
    void transfer(String from, String to, long amount);

    /** Create new units (genesis allocation, block reward). */
    void mint(String to, long amount);

    /** Destroy units held by {@code from} (slashing, vetoed deposits). */
    void burn(String from, long amount);

    /** Raise the account nonce to {@code nonce}; a lower value leaves it unchanged. */
    void advanceNonce(String address, long nonce);

    /** Copy of all non-zero balances. */
    Map<String, Long> balances();

    Map<String, Long> nonces();

    /** Replace the whole ledger; total supply becomes the sum of {@code balances}. */
    void restore(Map<String, Long> balances, Map<String, Long> nonces);
}
