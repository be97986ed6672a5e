package io.stakechain.core.governance;

/** Applies a parameter_change for modules other than governance itself. */
@FunctionalInterface
public interface ParameterChanger {
    /**
     * @throws io.stakechain.core.protocol.ChainException UNKNOWN_PARAMETER for an unknown module or name,
     *         INVALID_PROPOSAL for a value the module would not accept
     */
    void apply(String module, String parameter, String value);

    /** Rejects, at submission, a change {@link #apply} would reject. Accepts everything by default. */
    default void check(String module, String parameter, String value) {
    }
}
