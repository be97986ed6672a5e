package io.stakechain.core.node;

/**
 * Point-in-time chain statistics.
 *
 * @param averageBlockTimeMs mean spacing over the trailing window of blocks
 * @param hashRate           estimate from the last mined block: 16^difficulty / seconds spent
 * @param currentMiner       miner of the in-flight search, or null
 */
public record ChainStats(long totalSupply, long totalTransactions, long totalBlocks, long averageBlockTimeMs,
                         double hashRate, long chainLength, int pendingTransactions, int difficulty,
                         boolean mining, String currentMiner) {}
