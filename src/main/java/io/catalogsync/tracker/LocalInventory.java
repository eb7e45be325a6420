package io.catalogsync.tracker;

import io.catalogsync.util.FileNames;
import jakarta.enterprise.context.ApplicationScoped;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Counts the files actually present in each category folder of a course.
 * Used to catch files the cache believes were downloaded but are missing.
 */
@ApplicationScoped
public class LocalInventory {

    /**
     * Category folder name to the number of regular files directly inside it.
     * Hidden files, including in-flight downloads, are not counted.
     *
     * @return an empty mapping when {@code coursePath} does not exist
     */
    public Map<String, Integer> countFilesPerCategory(Path coursePath) throws IOException {
        Map<String, Integer> counts = new TreeMap<>();
        if (!Files.isDirectory(coursePath)) {
            return counts;
        }

        try (Stream<Path> categories = Files.list(coursePath)) {
            for (Path category : (Iterable<Path>) categories.filter(Files::isDirectory)::iterator) {
                counts.put(category.getFileName().toString(), countFiles(category));
            }
        }
        return counts;
    }

    private int countFiles(Path categoryFolder) throws IOException {
        try (Stream<Path> files = Files.list(categoryFolder)) {
            return (int) files
                    .filter(Files::isRegularFile)
                    .filter(file -> !FileNames.isHidden(file.getFileName().toString()))
                    .count();
        }
    }
}
