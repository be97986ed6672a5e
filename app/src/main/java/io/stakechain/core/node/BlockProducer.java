package io.stakechain.core.node;

import io.stakechain.core.mempool.TxValidator;
import io.stakechain.core.protocol.Block;
import io.stakechain.core.protocol.ChainError;
import io.stakechain.core.protocol.ChainException;
import io.stakechain.core.protocol.Transaction;
import io.stakechain.core.state.StateStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static java.lang.Math.addExact;

/**
 * Picks mempool transactions for a block and assembles the unsealed candidate.
 *
 * Selection is by fee, highest first, arrival order breaking ties. Each pick is re-validated
 * against the sender's balance minus what earlier picks in the same block already spend,
 * so a block never overspends an account.
 */
final class BlockProducer {
    private static final Logger LOG = Logger.getLogger(BlockProducer.class.getName());

    private final StateStore state;
    private final TxValidator validator;

    BlockProducer(StateStore state, TxValidator validator) {
        this.state = state;
        this.validator = validator;
    }

    List<Transaction> selectForBlock(List<Transaction> pending, int maxCount, long maxBytes) {
        List<Transaction> ordered = new ArrayList<>(pending);
        ordered.sort(Comparator.comparingLong(Transaction::fee).reversed());

        Map<String, Long> spent = new HashMap<>();
        List<Transaction> out = new ArrayList<>();
        long bytes = 0;
        for (Transaction tx : ordered) {
            if (out.size() >= maxCount) break;
            int size = tx.serializedSize();
            if (bytes + size > maxBytes) {
                LOG.fine(() -> "Skipping " + tx.id() + ": block size budget reached");
                continue;
            }
            String from = tx.fromAddress();
            long available = state.getBalance(from) - spent.getOrDefault(from, 0L);
            try {
                validator.validate(tx, available);
            } catch (ChainException e) {
                LOG.fine(() -> "Skipping " + tx.id() + ": " + e);
                continue;
            }
            spent.merge(from, tx.requiredFunds(), Long::sum);
            bytes += size;
            out.add(tx);
        }
        return out;
    }

    Block assemble(Block head, String miner, List<Transaction> selected, List<Transaction> rewards,
                   long timestamp, int difficulty, int maxTxPerBlock) {
        Block candidate = new Block(head.height() + 1, Math.max(timestamp, head.timestamp()), head.hash(),
                miner, difficulty, maxTxPerBlock);
        for (Transaction tx : selected) {
            if (!candidate.addTransaction(tx, validator.verifier())) {
                throw new IllegalStateException("Selected transaction rejected by block: " + tx.id());
            }
        }
        for (Transaction tx : rewards) {
            if (!candidate.addTransaction(tx, validator.verifier())) {
                throw new IllegalStateException("Reward transaction rejected by block: " + tx.id());
            }
        }
        return candidate;
    }

    /**
     * Re-checks that every sender still covers its spends in {@code block} against the current ledger.
     * @throws ChainException INVALID_BLOCK when one does not
     */
    void checkAffordable(Block block) {
        Map<String, Long> required = new HashMap<>();
        for (Transaction tx : block.transactions()) {
            if (tx.isProtocolMinted()) continue;
            required.merge(tx.fromAddress(), tx.requiredFunds(), (a, b) -> addExact(a, b));
        }
        for (Map.Entry<String, Long> e : required.entrySet()) {
            long balance = state.getBalance(e.getKey());
            if (balance < e.getValue()) {
                throw new ChainException(ChainError.INVALID_BLOCK,
                        e.getKey() + " needs " + e.getValue() + " in block " + block.height() + " but holds " + balance);
            }
        }
    }
}
