package com.shipyard.preview;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class LocalProcessLauncherTest {

    @TempDir
    Path workDir;

    private LocalProcessLauncher launcher;

    @BeforeEach
    void setUp() {
        launcher = new LocalProcessLauncher();
    }

    @AfterEach
    void tearDown() {
        launcher.close();
    }

    @Test
    @DisplayName("forwards merged output and passes PORT in the environment")
    void forwardsOutput() throws Exception {
        List<String> lines = new CopyOnWriteArrayList<>();
        var request = new LaunchRequest("P1", workDir, 4321,
                List.of("sh", "-c", "echo port=$PORT; echo oops 1>&2"), Map.of("PORT", "4321"));

        PreviewProcess process = launcher.launch(request, lines::add);

        assertEquals(0, process.onExit().get(5, TimeUnit.SECONDS));
        long deadline = System.currentTimeMillis() + 2_000;
        while (lines.size() < 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(lines.contains("port=4321"));
        assertTrue(lines.contains("oops"));
    }

    @Test
    @DisplayName("destroy terminates a long-running process")
    void destroys() throws Exception {
        var request = new LaunchRequest("P1", workDir, 4321, List.of("sleep", "30"), Map.of());
        PreviewProcess process = launcher.launch(request, line -> { });
        assertTrue(process.isAlive());

        process.destroy(Duration.ofSeconds(2));

        process.onExit().get(5, TimeUnit.SECONDS);
        assertFalse(process.isAlive());
        process.destroy(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("a missing project directory is a spawn failure")
    void missingDirectory() {
        var request = new LaunchRequest("P1", workDir.resolve("missing"), 4321, List.of("true"), Map.of());

        assertThrows(ProcessSpawnException.class, () -> launcher.launch(request, line -> { }));
    }

    @Test
    @DisplayName("an unknown executable is a spawn failure")
    void unknownExecutable() {
        var request = new LaunchRequest("P1", workDir, 4321, List.of("definitely-not-a-command-xyz"), Map.of());

        assertThrows(ProcessSpawnException.class, () -> launcher.launch(request, line -> { }));
    }
}
