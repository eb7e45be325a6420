package io.catalogsync.util;

/**
 * Checks for names coming from the catalog before they become local paths.
 */
public final class FileNames {

    private FileNames() {
        // Utility class
    }

    /**
     * A single path element: not blank, not {@code .} or {@code ..}, and free of separators.
     */
    public static boolean isPlainName(String name) {
        if (name == null || name.isBlank() || name.equals(".") || name.equals("..")) {
            return false;
        }
        return name.indexOf('/') < 0 && name.indexOf('\\') < 0 && name.indexOf('\0') < 0;
    }

    /**
     * Hidden on Unix, also the prefix of in-flight downloads and the cache record.
     */
    public static boolean isHidden(String name) {
        return name.startsWith(".");
    }
}
