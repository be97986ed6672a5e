package io.stakechain.core.staking;

import io.stakechain.core.protocol.ChainError;
import io.stakechain.core.protocol.ChainException;
import io.stakechain.core.protocol.ParameterValues;

import java.util.LinkedHashMap;
import java.util.Map;

/** Staking parameters; mutable through governance parameter changes. */
public final class StakingParams {
    public static final long DEFAULT_MIN_SELF_STAKE = 1000L;
    public static final long DEFAULT_UNBONDING_PERIOD_MS = 21L * 24 * 60 * 60 * 1000;
    public static final double DEFAULT_SLASHING_FRACTION = 0.01;
    public static final long DEFAULT_JAIL_TIME_MS = 10L * 60 * 1000;
    public static final int DEFAULT_DOWNTIME_THRESHOLD = 50;

    private volatile long minSelfStake;
    private volatile long unbondingPeriodMs;
    private volatile double slashingFraction;
    private volatile long jailTimeMs;
    private volatile int downtimeThreshold;

    public StakingParams(long minSelfStake, long unbondingPeriodMs, double slashingFraction,
                         long jailTimeMs, int downtimeThreshold) {
        this.minSelfStake = minSelfStake;
        this.unbondingPeriodMs = unbondingPeriodMs;
        this.slashingFraction = slashingFraction;
        this.jailTimeMs = jailTimeMs;
        this.downtimeThreshold = downtimeThreshold;
    }

    public static StakingParams defaults() {
        return new StakingParams(DEFAULT_MIN_SELF_STAKE, DEFAULT_UNBONDING_PERIOD_MS,
                DEFAULT_SLASHING_FRACTION, DEFAULT_JAIL_TIME_MS, DEFAULT_DOWNTIME_THRESHOLD);
    }

    public long minSelfStake() { return minSelfStake; }
    public long unbondingPeriodMs() { return unbondingPeriodMs; }
    public double slashingFraction() { return slashingFraction; }
    public long jailTimeMs() { return jailTimeMs; }
    public int downtimeThreshold() { return downtimeThreshold; }

    /** Validates a change without applying it. */
    public void check(String name, String value) {
        apply(name, value, false);
    }

    /**
     * Set one parameter by name.
     * @throws ChainException UNKNOWN_PARAMETER for a name this module does not have,
     *         INVALID_PROPOSAL for a value that does not parse or is out of range
     */
    public synchronized void set(String name, String value) {
        apply(name, value, true);
    }

    private void apply(String name, String value, boolean commit) {
        switch (name) {
            case "minSelfStake": {
                long v = ParameterValues.parseLong(name, value, 0, Long.MAX_VALUE);
                if (commit) minSelfStake = v;
                break;
            }
            case "unbondingPeriod": {
                long v = ParameterValues.parseLong(name, value, 0, Long.MAX_VALUE);
                if (commit) unbondingPeriodMs = v;
                break;
            }
            case "slashingFraction": {
                double v = ParameterValues.parseFraction(name, value);
                if (commit) slashingFraction = v;
                break;
            }
            case "jailTime": {
                long v = ParameterValues.parseLong(name, value, 0, Long.MAX_VALUE);
                if (commit) jailTimeMs = v;
                break;
            }
            case "downtimeThreshold": {
                int v = ParameterValues.parseInt(name, value, 1, Integer.MAX_VALUE);
                if (commit) downtimeThreshold = v;
                break;
            }
            default:
                throw new ChainException(ChainError.UNKNOWN_PARAMETER, "staking has no parameter " + name);
        }
    }

    public synchronized Map<String, Object> asMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("minSelfStake", minSelfStake);
        m.put("unbondingPeriod", unbondingPeriodMs);
        m.put("slashingFraction", slashingFraction);
        m.put("jailTime", jailTimeMs);
        m.put("downtimeThreshold", downtimeThreshold);
        return m;
    }
}
