package io.catalogsync.service;

import io.catalogsync.MirrorFixture;
import io.catalogsync.auth.AuthException;
import io.catalogsync.config.SyncConfig;
import io.catalogsync.domain.Credentials;
import io.catalogsync.domain.SyncReport;
import io.catalogsync.orchestration.ProgressReporter;
import io.catalogsync.orchestration.SyncException;
import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;

@QuarkusTest
class CatalogSyncServiceTest {

    private static final Supplier<Credentials> STUDENT = () -> new Credentials("student", "secret");

    @Inject
    CatalogSyncService syncService;

    @Inject
    SyncConfig config;

    @InjectMock
    ProgressReporter progress;

    private Path mirror;
    private Path target;

    @BeforeEach
    void setup() throws IOException {
        mirror = Paths.get(config.catalog().localRoot().orElseThrow());
        if (Files.exists(mirror)) {
            MirrorFixture.deleteRecursively(mirror);
        }
        MirrorFixture.writeFile(mirror, "2024/1S/Algorithms/Slides/lecture1.pdf", "first lecture");
        MirrorFixture.writeFile(mirror, "2024/1S/Algorithms/Slides/lecture2.pdf", "second lecture");
        MirrorFixture.writeFile(mirror, "2024/1S/Algorithms/Exercises/sheet1.pdf", "sheet");
        Files.createDirectories(mirror.resolve("2024/1S/EmptyCourse/Notes"));
        MirrorFixture.writeFile(mirror, "2024/2S/Databases/Slides/intro.pdf", "intro");
        MirrorFixture.writeFile(mirror, "2023/1S/Old/Slides/old.pdf", "old");

        target = Files.createTempDirectory("test-clip-");
    }

    @AfterEach
    void cleanup() throws IOException {
        if (target != null && Files.exists(target)) {
            MirrorFixture.deleteRecursively(target);
        }
        if (mirror != null && Files.exists(mirror)) {
            MirrorFixture.deleteRecursively(mirror);
        }
    }

    @Test
    void shouldDownloadNewestYearOnFirstRun() throws AuthException {
        SyncReport report = syncService.run(target, STUDENT, Optional.empty(), true);

        assertEquals(4, report.filesTransferred());
        assertEquals(0, report.failedItems());
        assertEquals("first lecture", readString(target.resolve("2024/1S/Algorithms/Slides/lecture1.pdf")));
        assertTrue(Files.exists(target.resolve("2024/2S/Databases/Slides/intro.pdf")));
        assertTrue(Files.exists(target.resolve("2024/1S/Algorithms/.catalog-cache.json")));
        assertFalse(Files.exists(target.resolve("2024/1S/EmptyCourse")));
        assertFalse(Files.exists(target.resolve("2023")));
        verify(progress).report(6, "Done.");
    }

    @Test
    void shouldFindNothingOnSecondRun() throws AuthException {
        syncService.run(target, STUDENT, Optional.empty(), true);

        SyncReport report = syncService.run(target, STUDENT, Optional.empty(), true);

        assertEquals(0, report.filesTransferred());
        assertTrue(report.foldersTouched().isEmpty());
    }

    @Test
    void shouldDownloadOnlyNewDocument() throws IOException, AuthException {
        syncService.run(target, STUDENT, Optional.empty(), true);
        MirrorFixture.writeFile(mirror, "2024/1S/Algorithms/Slides/lecture3.pdf", "third lecture");

        SyncReport report = syncService.run(target, STUDENT, Optional.empty(), true);

        assertEquals(1, report.filesTransferred());
        assertEquals("third lecture", readString(target.resolve("2024/1S/Algorithms/Slides/lecture3.pdf")));
        assertEquals(1, report.foldersTouched().size());
        assertEquals(target.resolve("2024/1S/Algorithms/Slides"), report.foldersTouched().get(0));
    }

    @Test
    void shouldRestoreDeletedFile() throws IOException, AuthException {
        syncService.run(target, STUDENT, Optional.empty(), true);
        Files.delete(target.resolve("2024/1S/Algorithms/Slides/lecture2.pdf"));

        SyncReport report = syncService.run(target, STUDENT, Optional.empty(), true);

        assertEquals(1, report.filesTransferred());
        assertEquals("second lecture", readString(target.resolve("2024/1S/Algorithms/Slides/lecture2.pdf")));
    }

    @Test
    void shouldSynchronizeRequestedYear() throws AuthException {
        SyncReport report = syncService.run(target, STUDENT, Optional.of("2023"), true);

        assertEquals(1, report.filesTransferred());
        assertTrue(Files.exists(target.resolve("2023/1S/Old/Slides/old.pdf")));
        assertFalse(Files.exists(target.resolve("2024")));
    }

    @Test
    void shouldRequireYearWhenAutoSelectIsOff() {
        assertThrows(SyncException.class, () -> syncService.run(target, STUDENT, Optional.empty(), false));
    }

    @Test
    void shouldFailLoginWithWrongPassword() {
        assertThrows(AuthException.class,
                () -> syncService.run(target, () -> new Credentials("student", "nope"), Optional.empty(), true));
        assertFalse(Files.exists(target.resolve("2024")));
    }

    @Test
    void shouldRejectFileAsTarget() throws IOException {
        Path file = MirrorFixture.writeFile(target, "not-a-folder", "x");

        assertThrows(SyncException.class, () -> syncService.run(file, STUDENT, Optional.empty(), true));
    }

    private static String readString(Path file) {
        try {
            return Files.readString(file);
        } catch (IOException e) {
            throw new AssertionError("Cannot read " + file, e);
        }
    }
}
