package io.stakechain.core.node;

import io.stakechain.core.protocol.ChainError;
import io.stakechain.core.protocol.ChainException;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a {@link Blockchain} with its periodic housekeeping.
 * Call {@link #start()} once; the maintenance sweep then settles matured unbondings,
 * closes expired proposals and evicts stale mempool entries. Optionally mines continuously.
 */
public final class Node implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(Node.class.getName());

    private final Blockchain chain;
    private final ChainConfig config;
    private ScheduledExecutorService maintenance;
    private ScheduledExecutorService miner;

    public Node(Blockchain chain) {
        this.chain = chain;
        this.config = chain.config();
    }

    /** Convenience factory for an in-memory local node. */
    public static Node inMemory(ChainConfig config) {
        return new Node(new Blockchain(config));
    }

    /** Start the maintenance sweep. Safe to call multiple times. */
    public synchronized void start() {
        if (maintenance != null) return;
        maintenance = daemonScheduler("stakechain-maintenance");
        maintenance.scheduleWithFixedDelay(this::runMaintenance, config.maintenanceIntervalMs,
                config.maintenanceIntervalMs, TimeUnit.MILLISECONDS);
        LOG.info("Node started, maintenance every " + config.maintenanceIntervalMs + "ms");
    }

    /** Mine back to back on a background thread, crediting {@code minerAddress}. */
    public synchronized void startMining(String minerAddress) {
        if (miner != null) return;
        miner = daemonScheduler("stakechain-autominer");
        miner.scheduleWithFixedDelay(() -> mineOnce(minerAddress), 0, 10, TimeUnit.MILLISECONDS);
        LOG.info("Auto-mining -> " + minerAddress);
    }

    public synchronized void stopMining() {
        if (miner == null) return;
        chain.stopMining();
        miner.shutdownNow();
        miner = null;
    }

    /** One sweep of all periodic tasks; failures are logged and the next sweep runs as usual. */
    void runMaintenance() {
        try {
            int proposals = chain.governance().updateExpiredProposals();
            int unbondings = chain.settleUnbondings();
            int evicted = chain.evictExpiredTransactions();
            if (proposals + unbondings + evicted > 0) {
                LOG.fine("Maintenance: " + proposals + " proposals, " + unbondings + " unbondings, "
                        + evicted + " evicted");
            }
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Maintenance sweep failed", e);
        }
    }

    private void mineOnce(String minerAddress) {
        try {
            chain.mine(minerAddress);
        } catch (ChainException e) {
            if (e.error() == ChainError.MINING_ABORTED || e.error() == ChainError.STALE_BLOCK
                    || e.error() == ChainError.ALREADY_MINING) {
                LOG.fine("Mining pass ended: " + e);
            } else {
                LOG.log(Level.WARNING, "Background mining pass failed", e);
            }
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Background mining pass failed", e);
        }
    }

    private static ScheduledExecutorService daemonScheduler(String name) {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    public Blockchain chain() { return chain; }

    @Override
    public synchronized void close() {
        stopMining();
        if (maintenance != null) {
            maintenance.shutdownNow();
            maintenance = null;
        }
        chain.close();
    }
}
