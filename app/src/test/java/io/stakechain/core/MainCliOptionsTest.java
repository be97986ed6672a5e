package io.stakechain.core;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainCliOptionsTest {

    @Test
    void parsesDefaults() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {});
        assertFalse(options.showHelp());
        assertNull(options.errorMessage());
        assertEquals(3, options.blocks());
        assertEquals(-1, options.difficulty());
        assertNull(options.snapshotOut());
    }

    @Test
    void readsAllFlags() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {
                "--config=conf/chain.json",
                "--blocks=7",
                "--difficulty=2",
                "--miner-address=wtf1miner",
                "--snapshot-out=out/snap.json",
                "--keep-alive"
        });
        assertFalse(options.showHelp());
        assertEquals(Path.of("conf/chain.json"), options.configPath());
        assertEquals(7, options.blocks());
        assertEquals(2, options.difficulty());
        assertEquals("wtf1miner", options.minerAddress());
        assertEquals(Path.of("out/snap.json"), options.snapshotOut());
        assertTrue(options.keepAlive());
    }

    @Test
    void blankMinerFallsBackToDefault() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--miner-address=  "});
        assertNull(options.minerAddress());
    }

    @Test
    void invalidBlockCountSetsError() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--blocks=-1"});
        assertTrue(options.showHelp());
        assertNotNull(options.errorMessage());
        assertTrue(options.errorMessage().contains("--blocks"));
    }

    @Test
    void unknownFlagTriggersHelp() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--unknown-flag"});
        assertTrue(options.showHelp());
        assertEquals("Unknown option: --unknown-flag", options.errorMessage());
    }
}
