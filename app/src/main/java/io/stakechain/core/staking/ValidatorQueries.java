package io.stakechain.core.staking;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read side of {@link ValidatorRegistry}. Stake changes that move funds go through the
 * chain so the bonded pool and the registry never disagree.
 */
public interface ValidatorQueries {

    StakingParams params();

    Optional<Validator> getValidator(String address);

    boolean isRegistered(String address);

    List<Validator> getValidators();

    /** Active validators, highest voting power first. */
    List<Validator> getActiveValidators();

    boolean isActive(String address);

    /** validator -> amount delegated by {@code delegator}. */
    Map<String, Long> getDelegations(String delegator);

    List<UnbondingEntry> getUnbondings(String delegator);

    List<RedelegationEntry> getRedelegations(String delegator);

    /** Unbonding entries that have completed at {@code now}, oldest first. */
    List<UnbondingEntry> maturedUnbondings(long now);

    /** Own self stake (when a validator) plus everything the address has delegated. */
    long bondedStakeOf(String address);

    long totalBondedStake();
}
