package io.catalogsync.domain;

import java.nio.file.Path;
import java.util.Locale;

/**
 * A remote course as discovered in the catalog.
 */
public record Course(
        String year,
        String semester,
        String semesterType,
        String id,
        String name
) {
    public Course {
        if (year == null || year.isBlank()) {
            throw new IllegalArgumentException("Course year cannot be blank");
        }
        if (semester == null || semester.isBlank()) {
            throw new IllegalArgumentException("Course semester cannot be blank");
        }
        if (semesterType == null || semesterType.isBlank()) {
            throw new IllegalArgumentException("Course semesterType cannot be blank");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Course id cannot be blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Course name cannot be blank");
        }
    }

    /**
     * Semester label used for the local folder, e.g. {@code 1S}.
     */
    public String fullSemester() {
        return semester + semesterType.toUpperCase(Locale.ROOT);
    }

    /**
     * Local folder of this course: {@code base/year/semester/name}.
     */
    public Path folderUnder(Path baseDirectory) {
        return baseDirectory.resolve(year).resolve(fullSemester()).resolve(name);
    }

    @Override
    public String toString() {
        return name + " (" + year + "/" + fullSemester() + ", id " + id + ")";
    }
}
