package io.catalogsync.source;

import io.catalogsync.config.SyncConfig;
import io.catalogsync.domain.CatalogIndex;
import io.catalogsync.domain.Course;
import io.catalogsync.domain.RemoteFileEntry;
import io.catalogsync.domain.Session;
import io.catalogsync.util.FileNames;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Catalog browser over a file-system mirror of the catalog.
 * Layout: {@code root/year/<semester><TYPE>/course/category/file}.
 */
@ApplicationScoped
public class LocalMirrorCatalog implements CatalogBrowser {

    private static final Pattern SEMESTER = Pattern.compile("(\\d+)(\\p{Alpha}+)");

    private final Optional<Path> root;

    @Inject
    public LocalMirrorCatalog(SyncConfig config) {
        this(config.catalog().localRoot().map(Paths::get));
    }

    public LocalMirrorCatalog(Optional<Path> root) {
        this.root = root.map(path -> path.toAbsolutePath().normalize());
    }

    @Override
    public Map<String, String> listYears(Session session) throws FetchException {
        Map<String, String> years = new TreeMap<>();
        for (Path year : directories(root())) {
            String name = year.getFileName().toString();
            years.put(name, name);
        }
        return years;
    }

    @Override
    public List<Course> listCourses(String yearKey, Session session) throws FetchException {
        Path base = root();
        Path yearDir = base.resolve(yearKey);
        if (!Files.isDirectory(yearDir)) {
            throw new FetchException("Unknown year: " + yearKey);
        }

        List<Course> courses = new ArrayList<>();
        for (Path semesterDir : directories(yearDir)) {
            String semesterName = semesterDir.getFileName().toString();
            Matcher matcher = SEMESTER.matcher(semesterName);
            if (!matcher.matches()) {
                throw new CatalogParseException("Not a semester folder: " + semesterDir);
            }

            for (Path courseDir : directories(semesterDir)) {
                courses.add(new Course(
                        yearKey,
                        matcher.group(1),
                        matcher.group(2).toLowerCase(Locale.ROOT),
                        toId(base.relativize(courseDir)),
                        courseDir.getFileName().toString()));
            }
        }
        return courses;
    }

    @Override
    public CatalogIndex listCategoryIndex(Course course) throws FetchException {
        Path courseDir = courseDir(course);

        CatalogIndex.Builder index = CatalogIndex.builder();
        for (Path category : directories(courseDir)) {
            String name = category.getFileName().toString();
            index.category(name, name, documents(category).size());
        }
        return index.build();
    }

    @Override
    public List<RemoteFileEntry> listCategoryFiles(Course course, String categoryId) throws FetchException {
        Path courseDir = courseDir(course);
        Path category = courseDir.resolve(categoryId).normalize();
        if (!category.startsWith(courseDir) || !Files.isDirectory(category)) {
            throw new FetchException("Unknown category " + categoryId + " in " + course.name());
        }

        List<RemoteFileEntry> entries = new ArrayList<>();
        for (Path file : documents(category)) {
            try {
                entries.add(new RemoteFileEntry(
                        file.getFileName().toString(),
                        file.toUri().toString(),
                        Files.size(file),
                        Files.getLastModifiedTime(file).toInstant()));
            } catch (IOException e) {
                throw new FetchException("Failed to read file attributes: " + file, e);
            }
        }
        return entries;
    }

    private Path root() throws FetchException {
        Path base = root.orElseThrow(() ->
                new FetchException("No catalog mirror configured (catalogsync.catalog.local-root)"));
        if (!Files.isDirectory(base)) {
            throw new FetchException("Catalog mirror does not exist: " + base);
        }
        return base;
    }

    private Path courseDir(Course course) throws FetchException {
        Path base = root();
        Path courseDir = base.resolve(course.id()).normalize();
        if (!courseDir.startsWith(base) || !Files.isDirectory(courseDir)) {
            throw new FetchException("Course not found in mirror: " + course);
        }
        return courseDir;
    }

    private static List<Path> directories(Path parent) throws FetchException {
        return list(parent, Files::isDirectory);
    }

    private static List<Path> documents(Path category) throws FetchException {
        return list(category, p -> Files.isRegularFile(p) && !FileNames.isHidden(p.getFileName().toString()));
    }

    private static List<Path> list(Path parent, Predicate<Path> filter) throws FetchException {
        try (Stream<Path> children = Files.list(parent)) {
            return children.filter(filter).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new FetchException("Failed to list " + parent, e);
        }
    }

    private static String toId(Path relative) {
        List<String> parts = new ArrayList<>();
        relative.forEach(part -> parts.add(part.toString()));
        return String.join("/", parts);
    }
}
