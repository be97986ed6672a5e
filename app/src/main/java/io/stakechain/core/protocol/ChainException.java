package io.stakechain.core.protocol;

/**
 * Typed rejection from a chain, staking or governance operation.
 * The operation that throws it has left all state unchanged.
 */
public class ChainException extends RuntimeException {
    private final ChainError error;

    public ChainException(ChainError error, String message) {
        super(message);
        this.error = error;
    }

    public ChainException(ChainError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public ChainError error() { return error; }

    @Override public String toString() {
        return "ERR[" + error + "]: " + getMessage();
    }
}
