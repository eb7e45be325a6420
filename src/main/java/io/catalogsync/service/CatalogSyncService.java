package io.catalogsync.service;

import io.catalogsync.auth.AuthException;
import io.catalogsync.auth.LoginService;
import io.catalogsync.domain.Course;
import io.catalogsync.domain.Credentials;
import io.catalogsync.domain.Session;
import io.catalogsync.domain.SyncReport;
import io.catalogsync.orchestration.ProgressReporter;
import io.catalogsync.orchestration.SyncException;
import io.catalogsync.orchestration.SyncOrchestrator;
import io.catalogsync.source.CatalogBrowser;
import io.catalogsync.source.FetchException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Runs a complete synchronization: login, year and course discovery, then the
 * orchestrated diff and download of every course.
 */
@ApplicationScoped
public class CatalogSyncService {

    private static final Logger LOG = Logger.getLogger(CatalogSyncService.class);

    @Inject
    LoginService loginService;

    @Inject
    CatalogBrowser catalog;

    @Inject
    SyncOrchestrator orchestrator;

    @Inject
    ProgressReporter progress;

    /**
     * @param baseDirectory  local root; created when missing
     * @param credentials    asked again before every login attempt
     * @param requestedYear  label or key of the year to synchronize
     * @param autoSelectYear pick the newest year when several are available
     * @throws AuthException when every login attempt failed
     * @throws SyncException when the run cannot start or no course can be listed
     */
    public SyncReport run(Path baseDirectory,
                          Supplier<Credentials> credentials,
                          Optional<String> requestedYear,
                          boolean autoSelectYear) throws AuthException {
        prepareDirectory(baseDirectory);

        progress.report(0, "Logging in...");
        Session session = loginService.login(credentials);

        Map<String, String> years;
        try {
            years = catalog.listYears(session);
        } catch (FetchException e) {
            throw new SyncException("Could not list academic years: " + e.getMessage(), e);
        }
        String year = YearSelector.select(years, requestedYear, autoSelectYear);
        LOG.debugf("Synchronizing year %s", year);

        progress.report(1, "Looking for enrolled courses...");
        List<Course> courses;
        try {
            courses = catalog.listCourses(year, session);
        } catch (FetchException e) {
            throw new SyncException("Could not list courses of " + year + ": " + e.getMessage(), e);
        }
        LOG.infof("Found courses: %s", courses.stream().map(Course::name).collect(Collectors.joining(" | ")));

        SyncReport report = orchestrator.synchronize(baseDirectory, courses);
        progress.report(6, "Done.");
        return report;
    }

    private static void prepareDirectory(Path baseDirectory) {
        if (Files.exists(baseDirectory) && !Files.isDirectory(baseDirectory)) {
            throw new SyncException("Not a directory: " + baseDirectory);
        }
        try {
            if (!Files.exists(baseDirectory)) {
                LOG.infof("Creating directory %s", baseDirectory);
                Files.createDirectories(baseDirectory);
            }
        } catch (IOException e) {
            throw new SyncException("Cannot create directory " + baseDirectory, e);
        }
    }
}
