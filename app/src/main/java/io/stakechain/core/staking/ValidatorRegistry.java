package io.stakechain.core.staking;

import io.stakechain.core.protocol.ChainError;
import io.stakechain.core.protocol.ChainException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Validator lifecycle, delegations, slashing and jailing.
 *
 * Every public method runs under the chain-wide lock handed in at construction and
 * either completes fully or throws a {@link ChainException} with nothing changed.
 * The registry never touches balances; moving funds in and out of the bonded pool
 * is the caller's job, which is why the chain only hands out the {@link ValidatorQueries} view.
 */
public final class ValidatorRegistry implements ValidatorQueries {
    private static final Logger LOG = Logger.getLogger(ValidatorRegistry.class.getName());

    private final StakingParams params;
    private final Clock clock;
    private final Object lock;
    private final SlashingListener slashingListener;

    private final Map<String, Validator> validators = new LinkedHashMap<>();
    private final List<UnbondingEntry> unbondings = new ArrayList<>();
    private final List<RedelegationEntry> redelegations = new ArrayList<>();

    public ValidatorRegistry(StakingParams params, Clock clock, Object lock, SlashingListener slashingListener) {
        this.params = params;
        this.clock = clock;
        this.lock = lock;
        this.slashingListener = slashingListener == null ? SlashingListener.NONE : slashingListener;
    }

    @Override
    public StakingParams params() { return params; }

    // -------------------- lifecycle --------------------

    public Validator register(String address, long selfStake, double commission, String description) {
        synchronized (lock) {
            requireAddress(address);
            if (validators.containsKey(address)) {
                throw new ChainException(ChainError.ALREADY_REGISTERED, "Validator " + address + " already registered");
            }
            if (selfStake < params.minSelfStake()) {
                throw new ChainException(ChainError.INSUFFICIENT_SELF_STAKE,
                        "Self stake " + selfStake + " below minimum " + params.minSelfStake());
            }
            requireCommission(commission);
            Validator v = new Validator(address, selfStake, commission, description, clock.millis());
            validators.put(address, v);
            LOG.info("Validator registered: " + address + " selfStake=" + selfStake);
            return v.copy();
        }
    }

    public Validator edit(String address, Double commission, String description) {
        synchronized (lock) {
            Validator v = require(address);
            if (commission != null) requireCommission(commission);
            if (commission != null) v.setCommission(commission);
            if (description != null) v.setDescription(description);
            return v.copy();
        }
    }

    public void addSelfStake(String address, long amount) {
        synchronized (lock) {
            Validator v = require(address);
            requirePositive(amount);
            v.setSelfStake(v.selfStake() + amount);
        }
    }

    /** Drops to INACTIVE when the remaining self stake is under the minimum. */
    public void removeSelfStake(String address, long amount) {
        synchronized (lock) {
            Validator v = require(address);
            requirePositive(amount);
            if (v.selfStake() < amount) {
                throw new ChainException(ChainError.INSUFFICIENT_SELF_STAKE,
                        "Validator " + address + " has self stake " + v.selfStake());
            }
            v.setSelfStake(v.selfStake() - amount);
            if (v.status() == ValidatorStatus.ACTIVE && v.selfStake() < params.minSelfStake()) {
                v.setStatus(ValidatorStatus.INACTIVE);
                LOG.warning("Validator " + address + " below minimum self stake, now inactive");
            }
        }
    }

    public void activate(String address) {
        synchronized (lock) {
            Validator v = require(address);
            if (v.isJailed()) {
                throw new ChainException(ChainError.ALREADY_JAILED, "Validator " + address + " is jailed");
            }
            if (v.selfStake() < params.minSelfStake()) {
                throw new ChainException(ChainError.INSUFFICIENT_SELF_STAKE,
                        "Validator " + address + " holds " + v.selfStake() + " self stake");
            }
            v.setStatus(ValidatorStatus.ACTIVE);
        }
    }

    public void deactivate(String address) {
        synchronized (lock) {
            Validator v = require(address);
            if (v.isJailed()) {
                throw new ChainException(ChainError.ALREADY_JAILED, "Validator " + address + " is jailed");
            }
            v.setStatus(ValidatorStatus.INACTIVE);
        }
    }

    // -------------------- delegation --------------------

    public void delegate(String delegator, String validator, long amount) {
        synchronized (lock) {
            requireAddress(delegator);
            Validator v = require(validator);
            requirePositive(amount);
            v.addDelegation(delegator, amount);
            LOG.fine(() -> "Delegated " + amount + " from " + delegator + " to " + validator);
        }
    }

    /** Removes the delegation now; the funds stay bonded until the returned entry matures. */
    public UnbondingEntry undelegate(String delegator, String validator, long amount) {
        synchronized (lock) {
            Validator v = require(validator);
            requirePositive(amount);
            requireDelegation(v, delegator, amount);
            v.removeDelegation(delegator, amount);
            long now = clock.millis();
            UnbondingEntry entry = new UnbondingEntry(delegator, validator, amount, now, now + params.unbondingPeriodMs());
            unbondings.add(entry);
            LOG.fine(() -> "Unbonding " + amount + " from " + validator + " for " + delegator);
            return entry;
        }
    }

    public RedelegationEntry redelegate(String delegator, String sourceValidator, String destinationValidator, long amount) {
        synchronized (lock) {
            Validator src = require(sourceValidator);
            Validator dst = require(destinationValidator);
            if (sourceValidator.equals(destinationValidator)) {
                throw new ChainException(ChainError.INVALID_TRANSACTION, "Cannot redelegate to the same validator");
            }
            requirePositive(amount);
            requireDelegation(src, delegator, amount);
            src.removeDelegation(delegator, amount);
            dst.addDelegation(delegator, amount);
            long now = clock.millis();
            RedelegationEntry entry = new RedelegationEntry(delegator, sourceValidator, destinationValidator,
                    amount, now, now + params.unbondingPeriodMs());
            redelegations.add(entry);
            return entry;
        }
    }

    /**
     * Removes matured unbonding and redelegation entries.
     * @return matured unbondings, whose amounts the caller must release from the bonded pool
     */
    public List<UnbondingEntry> settleUnbondings() {
        return settleUnbondings(clock.millis());
    }

    /** As {@link #settleUnbondings()}, with maturity judged at {@code now}. */
    public List<UnbondingEntry> settleUnbondings(long now) {
        synchronized (lock) {
            List<UnbondingEntry> matured = new ArrayList<>();
            Iterator<UnbondingEntry> it = unbondings.iterator();
            while (it.hasNext()) {
                UnbondingEntry e = it.next();
                if (e.isMature(now)) {
                    matured.add(e);
                    it.remove();
                }
            }
            redelegations.removeIf(r -> r.isMature(now));
            if (!matured.isEmpty()) LOG.info("Settled " + matured.size() + " unbonding entries");
            return matured;
        }
    }

    // -------------------- slashing and jailing --------------------

    /**
     * Jail and slash {@code floor(selfStake * slashingFraction)}.
     * @throws ChainException ALREADY_JAILED when the validator is already jailed
     */
    public SlashingEvent jail(String address, String reason, long height) {
        synchronized (lock) {
            Validator v = require(address);
            if (v.isJailed()) {
                throw new ChainException(ChainError.ALREADY_JAILED, "Validator " + address + " is already jailed");
            }
            long slashed = (long) Math.floor(v.selfStake() * params.slashingFraction());
            if (slashed > 0) slashingListener.onSlash(address, slashed);
            SlashingEvent event = new SlashingEvent(clock.millis(), reason, slashed, height);
            v.setSelfStake(v.selfStake() - slashed);
            v.setStatus(ValidatorStatus.JAILED);
            v.addSlashingEvent(event);
            LOG.warning("Validator jailed: " + address + ", reason: " + reason + ", slashed: " + slashed);
            return event;
        }
    }

    public void unjail(String address) {
        synchronized (lock) {
            Validator v = require(address);
            if (!v.isJailed()) {
                throw new ChainException(ChainError.NOT_JAILED, "Validator " + address + " is not jailed");
            }
            SlashingEvent last = v.lastSlashingEvent();
            long now = clock.millis();
            if (last != null && now - last.timestamp() < params.jailTimeMs()) {
                throw new ChainException(ChainError.JAIL_PERIOD_NOT_ELAPSED,
                        "Validator " + address + " jailed until " + (last.timestamp() + params.jailTimeMs()));
            }
            v.setStatus(v.selfStake() >= params.minSelfStake() ? ValidatorStatus.ACTIVE : ValidatorStatus.INACTIVE);
            v.resetMissed();
            LOG.info("Validator unjailed: " + address + " (" + v.status().wireName() + ")");
        }
    }

    /** Counts a missed block; jails once the downtime threshold is reached. Jailed validators are skipped. */
    public void onMissedBlock(String address, long height) {
        synchronized (lock) {
            Validator v = require(address);
            if (v.isJailed()) return;
            long missed = v.incrementMissed();
            LOG.warning("Validator " + address + " missed a block, total " + missed);
            if (missed >= params.downtimeThreshold()) {
                jail(address, "downtime: " + missed + " missed blocks", height);
            }
        }
    }

    public void onBlockProposed(String address) {
        synchronized (lock) {
            Validator v = validators.get(address);
            if (v == null) return;
            v.incrementProposed();
            v.touch(clock.millis());
        }
    }

    public void onBlockValidated(String address) {
        synchronized (lock) {
            Validator v = require(address);
            v.incrementValidated();
            v.touch(clock.millis());
        }
    }

    // -------------------- rewards --------------------

    /**
     * Split {@code totalReward}: commission {@code floor(total * rate)} to the validator, the rest
     * pro-rata to delegators by share of total delegation. Rounding dust goes to the validator.
     * Pure: nothing is recorded.
     */
    public RewardSplit distributeReward(String address, long totalReward) {
        synchronized (lock) {
            Validator v = require(address);
            if (totalReward < 0) throw new IllegalArgumentException("totalReward must be >= 0");
            long commission = (long) Math.floor(totalReward * v.commission());
            long delegatorPool = totalReward - commission;
            Map<String, Long> shares = new LinkedHashMap<>();
            long distributed = 0;
            if (v.totalDelegated() > 0) {
                for (Map.Entry<String, Long> e : v.delegators().entrySet()) {
                    long share = Math.multiplyExact(e.getValue(), delegatorPool) / v.totalDelegated();
                    if (share > 0) {
                        shares.merge(e.getKey(), share, Long::sum);
                        distributed += share;
                    }
                }
            }
            return new RewardSplit(address, totalReward - distributed, shares);
        }
    }

    public void recordReward(String address, long amount) {
        synchronized (lock) {
            Validator v = validators.get(address);
            if (v != null) v.addRewards(amount);
        }
    }

    // -------------------- queries --------------------

    @Override
    public Optional<Validator> getValidator(String address) {
        synchronized (lock) {
            Validator v = validators.get(address);
            return v == null ? Optional.empty() : Optional.of(v.copy());
        }
    }

    @Override
    public boolean isRegistered(String address) {
        synchronized (lock) {
            return address != null && validators.containsKey(address);
        }
    }

    @Override
    public List<Validator> getValidators() {
        synchronized (lock) {
            List<Validator> out = new ArrayList<>(validators.size());
            for (Validator v : validators.values()) out.add(v.copy());
            return out;
        }
    }

    /** Active validators, highest voting power first. */
    @Override
    public List<Validator> getActiveValidators() {
        synchronized (lock) {
            List<Validator> out = new ArrayList<>();
            for (Validator v : validators.values()) {
                if (v.isActive(params.minSelfStake())) out.add(v.copy());
            }
            out.sort(Comparator.comparingLong(Validator::votingPower).reversed());
            return out;
        }
    }

    @Override
    public boolean isActive(String address) {
        synchronized (lock) {
            Validator v = validators.get(address);
            return v != null && v.isActive(params.minSelfStake());
        }
    }

    /** validator -> amount delegated by {@code delegator}. */
    @Override
    public Map<String, Long> getDelegations(String delegator) {
        synchronized (lock) {
            Map<String, Long> out = new LinkedHashMap<>();
            for (Validator v : validators.values()) {
                long d = v.delegationOf(delegator);
                if (d > 0) out.put(v.address(), d);
            }
            return out;
        }
    }

    @Override
    public List<UnbondingEntry> getUnbondings(String delegator) {
        synchronized (lock) {
            List<UnbondingEntry> out = new ArrayList<>();
            for (UnbondingEntry e : unbondings) if (e.delegator().equals(delegator)) out.add(e);
            return out;
        }
    }

    @Override
    public List<RedelegationEntry> getRedelegations(String delegator) {
        synchronized (lock) {
            List<RedelegationEntry> out = new ArrayList<>();
            for (RedelegationEntry e : redelegations) if (e.delegator().equals(delegator)) out.add(e);
            return out;
        }
    }

    @Override
    public List<UnbondingEntry> maturedUnbondings(long now) {
        synchronized (lock) {
            List<UnbondingEntry> out = new ArrayList<>();
            for (UnbondingEntry e : unbondings) if (e.isMature(now)) out.add(e);
            return out;
        }
    }

    /** Own self stake (when a validator) plus everything the address has delegated. */
    @Override
    public long bondedStakeOf(String address) {
        synchronized (lock) {
            long total = 0;
            Validator own = validators.get(address);
            if (own != null) total += own.selfStake();
            for (Validator v : validators.values()) total += v.delegationOf(address);
            return total;
        }
    }

    @Override
    public long totalBondedStake() {
        synchronized (lock) {
            long total = 0;
            for (Validator v : validators.values()) total += v.votingPower();
            return total;
        }
    }

    /** Drop all validators and in-flight entries. */
    public void clear() {
        synchronized (lock) {
            validators.clear();
            unbondings.clear();
            redelegations.clear();
        }
    }

    // -------------------- helpers --------------------

    private Validator require(String address) {
        Validator v = address == null ? null : validators.get(address);
        if (v == null) {
            throw new ChainException(ChainError.VALIDATOR_NOT_FOUND, "Validator " + address + " not found");
        }
        return v;
    }

    private static void requireDelegation(Validator v, String delegator, long amount) {
        long current = v.delegationOf(delegator);
        if (current < amount) {
            throw new ChainException(ChainError.INSUFFICIENT_DELEGATION,
                    delegator + " delegated " + current + " to " + v.address() + ", requested " + amount);
        }
    }

    private static void requireAddress(String address) {
        if (address == null || address.isBlank()) {
            throw new ChainException(ChainError.INVALID_TRANSACTION, "Address required");
        }
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new ChainException(ChainError.INVALID_TRANSACTION, "Amount must be positive");
        }
    }

    private static void requireCommission(double commission) {
        if (Double.isNaN(commission) || commission < 0.0 || commission > 1.0) {
            throw new ChainException(ChainError.INVALID_TRANSACTION, "Commission must be within [0, 1]");
        }
    }
}
