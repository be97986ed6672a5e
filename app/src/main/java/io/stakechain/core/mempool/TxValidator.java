package io.stakechain.core.mempool;

import io.stakechain.core.crypto.SignatureVerifier;
import io.stakechain.core.protocol.ChainError;
import io.stakechain.core.protocol.ChainException;
import io.stakechain.core.protocol.Transaction;
import io.stakechain.core.state.StateStore;
import io.stakechain.core.storage.ChainStore;

/**
 * Admission checks shared by the mempool and block assembly.
 * Reads the ledger and chain; never mutates them.
 */
public class TxValidator {
    private final StateStore state;
    private final ChainStore chain;
    private final SignatureVerifier verifier;

    public TxValidator(StateStore state, ChainStore chain, SignatureVerifier verifier) {
        this.state = state;
        this.chain = chain;
        this.verifier = verifier;
    }

    public SignatureVerifier verifier() { return verifier; }

    /** Checks against the current ledger balance of the sender. */
    public void validate(Transaction tx) {
        if (tx == null) {
            throw new IllegalArgumentException("Transaction required");
        }
        validate(tx, state.getBalance(tx.fromAddress()));
    }

    /**
     * Checks against {@code available}, e.g. a balance already reduced by earlier
     * transactions picked for the same block.
     */
    public void validate(Transaction tx, long available) {
        if (tx == null) {
            throw new IllegalArgumentException("Transaction required");
        }
        if (tx.isProtocolMinted()) {
            throw new ChainException(ChainError.INVALID_TRANSACTION, "Protocol-minted transactions cannot be submitted");
        }
        if (!tx.isValid(verifier)) {
            throw new ChainException(ChainError.INVALID_TRANSACTION, "Transaction " + tx.id() + " failed validation");
        }
        if (chain.containsTransaction(tx.hash())) {
            throw new ChainException(ChainError.DUPLICATE_TRANSACTION, "Transaction " + tx.hash() + " already confirmed");
        }
        long seen = state.getNonce(tx.fromAddress());
        if (tx.nonce() <= seen) {
            throw new ChainException(ChainError.INVALID_TRANSACTION,
                    "Nonce " + tx.nonce() + " of " + tx.fromAddress() + " already used (account at " + seen + ")");
        }
        long required = tx.requiredFunds();
        if (available < required) {
            throw new ChainException(ChainError.INSUFFICIENT_BALANCE,
                    tx.fromAddress() + " holds " + available + ", needs " + required);
        }
    }
}
