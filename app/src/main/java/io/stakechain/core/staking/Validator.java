package io.stakechain.core.staking;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validator record kept by {@link ValidatorRegistry}.
 *
 * Mutators are package-private; outside callers only ever see copies.
 * Voting power is always {@code selfStake + totalDelegated}.
 */
public final class Validator implements StakeHolder {
    private final String address;
    private final long createdAt;
    private long selfStake;
    private double commission;
    private String description;
    private ValidatorStatus status = ValidatorStatus.ACTIVE;
    private long lastActiveTime;
    private long blocksProposed;
    private long blocksValidated;
    private long missedBlocks;
    private long totalRewards;
    private final List<SlashingEvent> slashingEvents = new ArrayList<>();
    private final Map<String, Long> delegators = new LinkedHashMap<>();
    private long totalDelegated;

    Validator(String address, long selfStake, double commission, String description, long createdAt) {
        this.address = address;
        this.selfStake = selfStake;
        this.commission = commission;
        this.description = description == null ? "" : description;
        this.createdAt = createdAt;
        this.lastActiveTime = createdAt;
    }

    Validator copy() {
        Validator v = new Validator(address, selfStake, commission, description, createdAt);
        v.status = status;
        v.lastActiveTime = lastActiveTime;
        v.blocksProposed = blocksProposed;
        v.blocksValidated = blocksValidated;
        v.missedBlocks = missedBlocks;
        v.totalRewards = totalRewards;
        v.slashingEvents.addAll(slashingEvents);
        v.delegators.putAll(delegators);
        v.totalDelegated = totalDelegated;
        return v;
    }

    @Override public String address() { return address; }
    @Override public long votingPower() { return selfStake + totalDelegated; }

    public long selfStake() { return selfStake; }
    public long totalDelegated() { return totalDelegated; }
    public double commission() { return commission; }
    public String description() { return description; }
    public ValidatorStatus status() { return status; }
    public boolean isJailed() { return status == ValidatorStatus.JAILED; }
    public long createdAt() { return createdAt; }
    public long lastActiveTime() { return lastActiveTime; }
    public long blocksProposed() { return blocksProposed; }
    public long blocksValidated() { return blocksValidated; }
    public long missedBlocks() { return missedBlocks; }
    public long totalRewards() { return totalRewards; }
    public List<SlashingEvent> slashingEvents() { return Collections.unmodifiableList(slashingEvents); }
    public Map<String, Long> delegators() { return Collections.unmodifiableMap(delegators); }

    public long delegationOf(String delegator) {
        return delegators.getOrDefault(delegator, 0L);
    }

    /** Active, unjailed and holding at least {@code minSelfStake}. */
    public boolean isActive(long minSelfStake) {
        return status == ValidatorStatus.ACTIVE && selfStake >= minSelfStake;
    }

    /** Share of blocks validated among all blocks this validator touched, in percent. */
    public double uptime() {
        long touched = blocksProposed + blocksValidated;
        return touched == 0 ? 0.0 : blocksValidated * 100.0 / touched;
    }

    // -------------------- registry-only mutators --------------------

    void addDelegation(String delegator, long amount) {
        delegators.merge(delegator, amount, Long::sum);
        totalDelegated += amount;
    }

    void removeDelegation(String delegator, long amount) {
        long remaining = delegationOf(delegator) - amount;
        if (remaining == 0) delegators.remove(delegator);
        else delegators.put(delegator, remaining);
        totalDelegated -= amount;
    }

    void setSelfStake(long selfStake) { this.selfStake = selfStake; }
    void setCommission(double commission) { this.commission = commission; }
    void setDescription(String description) { this.description = description; }
    void setStatus(ValidatorStatus status) { this.status = status; }
    void touch(long now) { this.lastActiveTime = now; }
    void incrementProposed() { blocksProposed++; }
    void incrementValidated() { blocksValidated++; }
    long incrementMissed() { return ++missedBlocks; }
    void resetMissed() { missedBlocks = 0; }
    void addRewards(long amount) { totalRewards += amount; }
    void addSlashingEvent(SlashingEvent e) { slashingEvents.add(e); }

    SlashingEvent lastSlashingEvent() {
        return slashingEvents.isEmpty() ? null : slashingEvents.get(slashingEvents.size() - 1);
    }

    @Override public String toString() {
        return "Validator{" + address + " " + status.wireName() + " power=" + votingPower() + "}";
    }
}
