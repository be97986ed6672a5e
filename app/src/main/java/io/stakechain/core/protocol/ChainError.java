package io.stakechain.core.protocol;

/** Every rejection a chain operation can report. */
public enum ChainError {
    INVALID_TRANSACTION,
    DUPLICATE_TRANSACTION,
    INSUFFICIENT_BALANCE,
    MEMPOOL_FULL,
    ALREADY_MINING,
    MINING_ABORTED,
    STALE_BLOCK,
    INVALID_BLOCK,
    ALREADY_REGISTERED,
    INSUFFICIENT_SELF_STAKE,
    INSUFFICIENT_DELEGATION,
    VALIDATOR_NOT_FOUND,
    ALREADY_JAILED,
    NOT_JAILED,
    JAIL_PERIOD_NOT_ELAPSED,
    PROPOSAL_NOT_FOUND,
    INVALID_PROPOSAL,
    NOT_IN_DEPOSIT_PERIOD,
    NOT_IN_VOTING_PERIOD,
    INVALID_OPTION,
    NO_VOTING_POWER,
    UNKNOWN_PARAMETER,
    ADDRESS_MISMATCH,
    CRYPTO_ERROR,
    INVALID_SNAPSHOT
}
