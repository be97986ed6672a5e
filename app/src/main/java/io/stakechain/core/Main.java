package io.stakechain.core;

import io.stakechain.core.crypto.Wallet;
import io.stakechain.core.metrics.BlockMetrics;
import io.stakechain.core.node.Blockchain;
import io.stakechain.core.node.ChainConfig;
import io.stakechain.core.node.Node;
import io.stakechain.core.protocol.Block;
import io.stakechain.core.protocol.ChainException;
import io.stakechain.core.protocol.Transaction;
import io.stakechain.core.snapshot.SnapshotCodec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) throws Exception {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        ChainConfig config = loadConfig(options.configPath());
        if (options.difficulty() >= 0) {
            config = config.withDifficulty(options.difficulty());
        }

        Wallet alice = Wallet.generate(config.addressPrefix);
        Wallet bob = Wallet.generate(config.addressPrefix);
        if (options.configPath() == null) {
            Map<String, Long> alloc = new LinkedHashMap<>();
            alloc.put(alice.address(), 1_000_000L);
            alloc.put(bob.address(), 500_000L);
            config = config.withGenesisAllocations(alloc);
        }
        String minerAddress = options.minerAddress();
        if (minerAddress == null) {
            minerAddress = config.minerAddress != null ? config.minerAddress : alice.address();
        }
        config = config.withMiner(minerAddress);

        try (Node node = new Node(new Blockchain(config))) {
            node.start();
            LOG.info("Mining rewards -> " + minerAddress + " (reward " + config.miningReward + ")");

            runDemoFlow(node.chain(), alice, bob, minerAddress, options.blocks());

            if (options.snapshotOut() != null) {
                SnapshotCodec.write(node.chain().exportSnapshot(), options.snapshotOut());
                LOG.info("Snapshot written to " + options.snapshotOut());
            }

            if (options.keepAlive()) {
                CountDownLatch shutdownLatch = new CountDownLatch(1);
                Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "stakechain-shutdown"));
                node.startMining(minerAddress);
                LOG.info("Node running. Press CTRL+C to exit.");
                shutdownLatch.await();
            }
        }
    }

    private static ChainConfig loadConfig(Path path) throws IOException {
        if (path == null) {
            return ChainConfig.defaultLocal();
        }
        LOG.info("Loading config from " + path);
        return ChainConfig.load(path);
    }

    private static void runDemoFlow(Blockchain chain, Wallet alice, Wallet bob, String minerAddress, int blocks) {
        if (chain.getBalance(alice.address()) > 0) {
            Transaction tx = Transaction.transfer(alice.address(), bob.address(), 250);
            tx.setNonce(chain.nextNonce(alice.address()));
            tx.sign(alice);
            try {
                chain.submitTransaction(tx);
                LOG.info("Tx " + tx.hash() + " signed and added to mempool");
            } catch (ChainException e) {
                LOG.warning("Demo transaction rejected: " + e);
            }
        }

        for (int i = 0; i < blocks; i++) {
            try {
                Block b = chain.mine(minerAddress);
                LOG.info("Block mined at height " + b.height() + " nonce=" + b.nonce());
            } catch (ChainException e) {
                LOG.log(Level.WARNING, "Mining attempt " + (i + 1) + " failed", e);
            }
        }

        LOG.info("Alice balance=" + chain.getBalance(alice.address()));
        LOG.info("Bob   balance=" + chain.getBalance(bob.address()));
        LOG.info("Chain valid=" + chain.validateChain() + " stats=" + chain.getStats());
        LOG.info("=== Metrics ===\n" + BlockMetrics.scrapeMetrics());
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path configPath,
            int blocks,
            String minerAddress,
            int difficulty,
            boolean keepAlive,
            Path snapshotOut
    ) {
        static CliOptions parse(String[] args) {
            Path configPath = envPath("STAKECHAIN_CONFIG", null);
            int blocks = 3;
            String minerAddress = envOrDefault("STAKECHAIN_MINER_ADDRESS", null);
            int difficulty = -1;
            boolean keepAlive = "true".equalsIgnoreCase(System.getenv("STAKECHAIN_KEEP_ALIVE"));
            Path snapshotOut = null;
            boolean showHelp = false;
            String error = null;

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--config=")) {
                        configPath = Path.of(arg.substring("--config=".length()));
                    } else if (arg.startsWith("--blocks=")) {
                        try {
                            blocks = (int) parseNonNegative(arg.substring("--blocks=".length()), "--blocks");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--difficulty=")) {
                        try {
                            difficulty = (int) parseNonNegative(arg.substring("--difficulty=".length()), "--difficulty");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--miner-address=")) {
                        minerAddress = arg.substring("--miner-address=".length()).trim();
                    } else if (arg.startsWith("--snapshot-out=")) {
                        snapshotOut = Path.of(arg.substring("--snapshot-out=".length()));
                    } else if (arg.equals("--keep-alive")) {
                        keepAlive = true;
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            if (minerAddress != null && minerAddress.isBlank()) {
                minerAddress = null;
            }

            return new CliOptions(showHelp, error, configPath, blocks, minerAddress, difficulty, keepAlive, snapshotOut);
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: stakechain [options]

Options:
  --help, -h                 Show this help message and exit
  --config=<path>            JSON chain configuration (defaults built in)
  --blocks=<n>               Blocks to mine in the demo flow (default 3)
  --difficulty=<n>           Override the starting difficulty (leading zero hex digits)
  --miner-address=<addr>     Address that receives block rewards
  --snapshot-out=<path>      Write a JSON snapshot of the chain after the demo
  --keep-alive               Keep mining until interrupted

Environment overrides:
  STAKECHAIN_CONFIG          Default for --config
  STAKECHAIN_MINER_ADDRESS   Default for --miner-address
  STAKECHAIN_KEEP_ALIVE      Set to "true" to force keep-alive mode
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static String envOrDefault(String key, String fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static long parseNonNegative(String value, String flag) {
            try {
                long parsed = Long.parseLong(value);
                if (parsed < 0 || parsed > Integer.MAX_VALUE) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }
    }
}
