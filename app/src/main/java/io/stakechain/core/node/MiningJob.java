package io.stakechain.core.node;

import io.stakechain.core.consensus.CancellationToken;
import io.stakechain.core.protocol.Block;

import java.util.concurrent.CompletableFuture;

/** Handle on a background mining pass. */
public final class MiningJob {
    private final CompletableFuture<Block> result;
    private final CancellationToken token;

    MiningJob(CompletableFuture<Block> result, CancellationToken token) {
        this.result = result;
        this.token = token;
    }

    /** Completes with the appended block, or exceptionally with the ChainException that ended the pass. */
    public CompletableFuture<Block> result() { return result; }

    /** Ask the search to stop at its next batch boundary. It may still finish if a solution is already found. */
    public void cancel() { token.cancel(); }

    public boolean isDone() { return result.isDone(); }
}
