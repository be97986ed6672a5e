package io.stakechain.core.consensus;

/**
 * Difficulty retarget inputs.
 *
 * @param targetBlockTimeMs desired average spacing between blocks
 * @param interval          blocks per retarget window
 * @param minDifficulty     floor
 * @param maxDifficulty     cap
 */
public record RetargetPolicy(long targetBlockTimeMs, int interval, int minDifficulty, int maxDifficulty) {
    public RetargetPolicy {
        if (targetBlockTimeMs <= 0) throw new IllegalArgumentException("targetBlockTimeMs must be > 0");
        if (interval < 2) throw new IllegalArgumentException("interval must be >= 2");
        if (minDifficulty < 0 || maxDifficulty < minDifficulty) {
            throw new IllegalArgumentException("bad difficulty bounds " + minDifficulty + ".." + maxDifficulty);
        }
    }
}
