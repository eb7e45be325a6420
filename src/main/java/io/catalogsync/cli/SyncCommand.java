package io.catalogsync.cli;

import io.catalogsync.auth.AuthException;
import io.catalogsync.config.SyncConfig;
import io.catalogsync.domain.Credentials;
import io.catalogsync.domain.SyncReport;
import io.catalogsync.orchestration.SyncException;
import io.catalogsync.service.CatalogSyncService;
import io.catalogsync.util.ByteSize;
import io.quarkus.picocli.runtime.annotations.TopCommand;
import jakarta.inject.Inject;
import picocli.CommandLine;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.System.err;
import static java.lang.System.out;

@TopCommand
@CommandLine.Command(
        name = "catalog-sync",
        mixinStandardHelpOptions = true,
        version = "catalog-sync 1.0",
        description = "Synchronizes the documents of your courses with a local folder")
public class SyncCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_AUTH = 1;
    static final int EXIT_FATAL = 2;

    static final String LOG_CATEGORY = "io.catalogsync";

    @CommandLine.Parameters(
            index = "0",
            arity = "0..1",
            description = "Folder where the documents are stored (default: ./CLIP)")
    Path path;

    @CommandLine.Option(
            names = {"--username"},
            description = "Catalog username (or set catalogsync.auth.username)")
    String username;

    @CommandLine.Option(
            names = {"--year"},
            description = "Academic year to synchronize, by label or key")
    String year;

    @CommandLine.Option(
            names = {"--no-auto"},
            description = "Do not pick the newest academic year automatically")
    boolean noAuto;

    @CommandLine.Option(
            names = {"--debug"},
            hidden = true,
            description = "Log every step of the run")
    boolean debug;

    @Inject
    CatalogSyncService syncService;

    @Inject
    SyncConfig config;

    @Override
    public Integer call() {
        if (debug) {
            enableDebugLogging();
        }

        Optional<String> user = Optional.ofNullable(username).or(() -> config.auth().username());
        if (user.isEmpty() || user.get().isBlank()) {
            err.println("No username given, use --username or set catalogsync.auth.username");
            return EXIT_FATAL;
        }

        Path target = targetDirectory();
        if (path == null) {
            out.println("Starting in " + target + "...");
        }

        try {
            SyncReport report = syncService.run(
                    target,
                    () -> new Credentials(user.get(), config.auth().password().orElse("")),
                    Optional.ofNullable(year),
                    config.autoSelectLatestYear() && !noAuto);
            printSummary(report);
            return EXIT_OK;
        } catch (AuthException e) {
            err.println("Login failed: " + e.getMessage());
            return EXIT_AUTH;
        } catch (SyncException e) {
            err.println(e.getMessage());
            return EXIT_FATAL;
        }
    }

    static void enableDebugLogging() {
        Logger.getLogger(LOG_CATEGORY).setLevel(Level.FINE);
    }

    private Path targetDirectory() {
        if (path != null) {
            return path.toAbsolutePath();
        }
        Path cwd = Paths.get("").toAbsolutePath();
        Path name = cwd.getFileName();
        if (name != null && name.toString().equals(config.defaultDirectoryName())) {
            return cwd;
        }
        return cwd.resolve(config.defaultDirectoryName());
    }

    private static void printSummary(SyncReport report) {
        if (report.filesTransferred() == 0) {
            out.println("No new files found.");
        } else {
            out.printf(Locale.ROOT, "Transferred %d file(s) (%s in %.1fs) to the folders:%n",
                    report.filesTransferred(),
                    ByteSize.humanReadable(report.bytesTransferred()),
                    report.elapsed().toMillis() / 1000.0);
            report.foldersTouched().forEach(folder -> out.println("'" + folder + "'"));
        }
        if (report.failedItems() > 0) {
            out.println(report.failedItems() + " item(s) could not be synchronized, see the log for details.");
        }
    }
}
