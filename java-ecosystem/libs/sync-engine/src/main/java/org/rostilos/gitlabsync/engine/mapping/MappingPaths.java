package org.rostilos.gitlabsync.engine.mapping;

/**
 * Slash-separated resource path helpers. Paths never start or end with a slash.
 */
public final class MappingPaths {

    public static final char SEPARATOR = '/';

    private MappingPaths() {
        // Utility class
    }

    /**
     * @return true when {@code path} equals {@code ancestor} or lies below it, segment-wise
     */
    public static boolean isSameOrDescendant(String path, String ancestor) {
        if (path.equals(ancestor)) {
            return true;
        }
        return path.length() > ancestor.length()
                && path.startsWith(ancestor)
                && path.charAt(ancestor.length()) == SEPARATOR;
    }

    /**
     * Path of {@code path} relative to {@code ancestor}; empty when both are equal.
     *
     * @throws IllegalArgumentException when {@code path} is not below {@code ancestor}
     */
    public static String relativize(String ancestor, String path) {
        if (!isSameOrDescendant(path, ancestor)) {
            throw new IllegalArgumentException(path + " is not located under " + ancestor);
        }
        return path.equals(ancestor) ? "" : path.substring(ancestor.length() + 1);
    }

    public static String join(String base, String relative) {
        if (relative == null || relative.isEmpty()) {
            return base;
        }
        if (base == null || base.isEmpty()) {
            return relative;
        }
        return base + SEPARATOR + relative;
    }

    /**
     * @return the parent path, or an empty string for a top-level path
     */
    public static String parentOf(String path) {
        int index = path.lastIndexOf(SEPARATOR);
        return index < 0 ? "" : path.substring(0, index);
    }

    public static String baseName(String path) {
        return path.substring(path.lastIndexOf(SEPARATOR) + 1);
    }
}
