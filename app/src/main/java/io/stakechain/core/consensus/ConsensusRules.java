package io.stakechain.core.consensus;

import io.stakechain.core.crypto.SignatureVerifier;
import io.stakechain.core.protocol.Block;
import io.stakechain.core.protocol.ChainError;
import io.stakechain.core.protocol.ChainException;

import java.util.List;
import java.util.logging.Logger;

public final class ConsensusRules {
    private static final Logger LOG = Logger.getLogger(ConsensusRules.class.getName());

    /** Allowed clock drift into the future. */
    public static final long MAX_FUTURE_DRIFT_MS = 60_000L;

    private ConsensusRules() {}

    /**
     * Checks a sealed block against the block it claims to extend.
     *
     * @throws ChainException INVALID_BLOCK naming the first failed rule
     */
    public static void validateBlock(Block block, Block parent, int maxTxPerBlock,
                                     SignatureVerifier verifier, long now) {
        if (block == null || parent == null) {
            throw new ChainException(ChainError.INVALID_BLOCK, "Missing block or parent");
        }
        long expectedHeight = parent.height() + 1;
        if (block.height() != expectedHeight) {
            throw new ChainException(ChainError.INVALID_BLOCK,
                    "Bad block height: expected " + expectedHeight + ", got " + block.height());
        }
        if (!parent.hash().equals(block.previousHash())) {
            throw new ChainException(ChainError.INVALID_BLOCK, "Previous hash does not match parent");
        }
        if (!block.isValid(maxTxPerBlock, verifier)) {
            throw new ChainException(ChainError.INVALID_BLOCK, "Block " + block.height() + " failed validation");
        }
        if (block.timestamp() < parent.timestamp()) {
            throw new ChainException(ChainError.INVALID_BLOCK, "Timestamp before parent");
        }
        if (block.timestamp() > now + MAX_FUTURE_DRIFT_MS) {
            throw new ChainException(ChainError.INVALID_BLOCK, "Timestamp too far in future");
        }
    }

    /**
     * Full recheck of a chain: genesis shape, then every block valid (against the transaction cap it
     * was assembled with) and linked to its predecessor. Never throws; a failure is logged and reported as false.
     */
    public static boolean validateChain(List<Block> chain, SignatureVerifier verifier) {
        if (chain == null || chain.isEmpty()) return false;
        Block genesis = chain.get(0);
        if (genesis.height() != 0 || !Block.GENESIS_PREVIOUS_HASH.equals(genesis.previousHash())
                || !genesis.computeHash().equals(genesis.hash())) {
            LOG.warning("Genesis block is malformed");
            return false;
        }
        for (int i = 1; i < chain.size(); i++) {
            Block prev = chain.get(i - 1);
            Block cur = chain.get(i);
            if (cur.height() != i) {
                LOG.warning("Block at position " + i + " has height " + cur.height());
                return false;
            }
            if (!cur.isValid(cur.maxTransactions(), verifier)) {
                LOG.warning("Block " + i + " is invalid");
                return false;
            }
            if (!prev.hash().equals(cur.previousHash())) {
                LOG.warning("Broken link between blocks " + (i - 1) + " and " + i);
                return false;
            }
        }
        return true;
    }
}
