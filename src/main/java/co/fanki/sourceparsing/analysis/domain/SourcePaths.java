package co.fanki.sourceparsing.analysis.domain;

import java.nio.file.Path;

/**
 * Path arithmetic over repository-relative paths written with forward
 * slashes.
 *
 * <p>Only string manipulation happens here, the filesystem is never
 * touched.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SourcePaths {

    private SourcePaths() {
        // Utility class, not instantiable
    }

    /**
     * Normalizes a path, collapsing "." and ".." segments.
     *
     * @param path the path to normalize
     * @return the normalized path using forward slashes, "" for the root
     */
    public static String normalize(final String path) {
        return Path.of(path.replace('\\', '/')).normalize().toString()
                .replace('\\', '/');
    }

    /**
     * Returns the directory containing a file.
     *
     * @param path the file path
     * @return the parent directory, "" when the file sits at the root
     */
    public static String parent(final String path) {
        final Path parent = Path.of(path.replace('\\', '/')).getParent();
        return parent == null ? "" : parent.toString().replace('\\', '/');
    }

    /**
     * Joins a directory and a relative path, then normalizes the result.
     *
     * @param directory the base directory, "" for the root
     * @param relative the relative path to append
     * @return the normalized joined path
     */
    public static String join(final String directory,
            final String relative) {
        if (directory.isEmpty()) {
            return normalize(relative);
        }
        return normalize(directory + "/" + relative);
    }

    /**
     * Returns the extension of the last path segment.
     *
     * <p>A leading dot does not start an extension, so ".eslintrc" has
     * none.</p>
     *
     * @param path the file path
     * @return the extension including its dot, "" when there is none
     */
    public static String extension(final String path) {
        final int dot = extensionDot(path);
        return dot < 0 ? "" : path.substring(dot);
    }

    /**
     * Removes the extension of the last path segment.
     *
     * @param path the file path
     * @return the path without extension
     */
    public static String stripExtension(final String path) {
        final int dot = extensionDot(path);
        return dot < 0 ? path : path.substring(0, dot);
    }

    private static int extensionDot(final String path) {
        final int slash = Math.max(path.lastIndexOf('/'),
                path.lastIndexOf('\\'));
        final int dot = path.lastIndexOf('.');
        if (dot <= slash + 1) {
            return -1;
        }
        return dot;
    }

}
