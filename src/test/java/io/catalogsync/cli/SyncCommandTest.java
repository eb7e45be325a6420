package io.catalogsync.cli;

import io.catalogsync.MirrorFixture;
import io.quarkus.test.junit.main.LaunchResult;
import io.quarkus.test.junit.main.QuarkusMainLauncher;
import io.quarkus.test.junit.main.QuarkusMainTest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@QuarkusMainTest
class SyncCommandTest {

    // Matches %test.catalogsync.catalog.local-root
    private static final Path MIRROR = Paths.get(System.getProperty("java.io.tmpdir"), "catalog-sync-test", "mirror");

    private Path target;

    @BeforeEach
    void setup() throws IOException {
        if (Files.exists(MIRROR)) {
            MirrorFixture.deleteRecursively(MIRROR);
        }
        MirrorFixture.writeFile(MIRROR, "2024/1S/Algorithms/Slides/lecture1.pdf", "first lecture");
        MirrorFixture.writeFile(MIRROR, "2024/1S/Algorithms/Exercises/sheet1.pdf", "sheet");
        target = Files.createTempDirectory("test-cli-");
    }

    @AfterEach
    void cleanup() throws IOException {
        if (target != null && Files.exists(target)) {
            MirrorFixture.deleteRecursively(target);
        }
        if (Files.exists(MIRROR)) {
            MirrorFixture.deleteRecursively(MIRROR);
        }
    }

    @Test
    void shouldTransferThenReportNothingNew(QuarkusMainLauncher launcher) {
        LaunchResult first = launcher.launch(target.toString());

        assertEquals(SyncCommand.EXIT_OK, first.exitCode());
        assertTrue(first.getOutput().contains("Transferred 2 file(s)"), first.getOutput());
        assertTrue(Files.exists(target.resolve("2024/1S/Algorithms/Slides/lecture1.pdf")));

        LaunchResult second = launcher.launch(target.toString());

        assertEquals(SyncCommand.EXIT_OK, second.exitCode());
        assertTrue(second.getOutput().contains("No new files found."), second.getOutput());
    }

    @Test
    void shouldAcceptHiddenDebugOption(QuarkusMainLauncher launcher) {
        LaunchResult result = launcher.launch(target.toString(), "--debug");

        assertEquals(SyncCommand.EXIT_OK, result.exitCode());
        assertTrue(result.getOutput().contains("Transferred 2 file(s)"), result.getOutput());
    }

    @Test
    void shouldExitWithAuthCodeForUnknownUser(QuarkusMainLauncher launcher) {
        LaunchResult result = launcher.launch(target.toString(), "--username", "intruder");

        assertEquals(SyncCommand.EXIT_AUTH, result.exitCode());
        assertTrue(result.getErrorOutput().contains("Login failed"), result.getErrorOutput());
    }

    @Test
    void shouldExitWithFatalCodeForFileTarget(QuarkusMainLauncher launcher) throws IOException {
        Path file = MirrorFixture.writeFile(target, "not-a-folder", "x");

        LaunchResult result = launcher.launch(file.toString());

        assertEquals(SyncCommand.EXIT_FATAL, result.exitCode());
    }

    @Test
    void shouldExitWithFatalCodeForUnknownYear(QuarkusMainLauncher launcher) {
        LaunchResult result = launcher.launch(target.toString(), "--year", "1999");

        assertEquals(SyncCommand.EXIT_FATAL, result.exitCode());
        assertTrue(result.getErrorOutput().contains("Unknown academic year"), result.getErrorOutput());
    }
}
