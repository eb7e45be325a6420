package io.catalogsync.domain;

import io.catalogsync.util.FileNames;

import java.nio.file.Path;

/**
 * A category flagged for listing resolution and possible download.
 */
public record SyncTask(
        String category,
        String categoryId,
        Course course,
        Path courseFolder
) {
    public SyncTask {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("category cannot be blank");
        }
        if (!FileNames.isPlainName(category)) {
            throw new IllegalArgumentException("category is not a plain folder name: " + category);
        }
        if (categoryId == null || categoryId.isBlank()) {
            throw new IllegalArgumentException("categoryId cannot be blank");
        }
        if (course == null) {
            throw new IllegalArgumentException("course cannot be null");
        }
        if (courseFolder == null) {
            throw new IllegalArgumentException("courseFolder cannot be null");
        }
    }

    public Path categoryFolder() {
        return courseFolder.resolve(category);
    }

    @Override
    public String toString() {
        return course.name() + " > " + category;
    }
}
