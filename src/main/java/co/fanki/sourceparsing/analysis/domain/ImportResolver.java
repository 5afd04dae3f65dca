package co.fanki.sourceparsing.analysis.domain;

import co.fanki.sourceparsing.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves import specifiers to files of a repository.
 *
 * <p>The repository is described only by the collection of its known,
 * repository-relative paths. When more than one path matches, the first in
 * the collection's iteration order wins and is returned exactly as
 * given.</p>
 *
 * <p>A specifier that matches nothing is not an error: the result is
 * empty and the caller decides whether that matters.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ImportResolver {

    private static final Logger LOG = LoggerFactory.getLogger(
            ImportResolver.class);

    /** Extensions tried, in order, on an extension-less target. */
    public static final List<String> SOURCE_EXTENSIONS = List.of(
            ".py", ".js", ".ts", ".jsx", ".tsx", ".mjs", ".cjs");

    /** Files tried, in order, when the target is a directory. */
    public static final List<String> INDEX_FILES = List.of(
            "index.js", "index.ts", "index.tsx", "__init__.py");

    /**
     * Resolves a relative specifier against the importing file.
     *
     * <p>Dotted Python specifiers are rewritten to path form first, so
     * {@code ..pkg.mod} is looked up as {@code ../pkg/mod}. The target is
     * then matched exactly or without extension, then with each of
     * {@link #SOURCE_EXTENSIONS}, then as a directory holding one of
     * {@link #INDEX_FILES}.</p>
     *
     * @param source the import specifier
     * @param currentFile the path of the importing file
     * @param knownPaths the repository paths
     * @return the matching known path, empty when the specifier is not
     *         relative or nothing matches
     * @throws IllegalArgumentException if any argument is null
     */
    public Optional<String> resolveRelative(final String source,
            final String currentFile, final Collection<String> knownPaths) {

        Preconditions.requireNonNull(source, "Import source is required");
        Preconditions.requireNonNull(currentFile, "Current file is required");
        Preconditions.requireNonNull(knownPaths, "Known paths are required");

        if (!source.startsWith(".")) {
            return Optional.empty();
        }

        final String target;
        try {
            target = SourcePaths.join(SourcePaths.parent(currentFile),
                    toPathForm(source));
        } catch (final InvalidPathException e) {
            LOG.debug("Cannot build a path from {} and {}", currentFile,
                    source);
            return Optional.empty();
        }

        final String targetWithoutExtension = hasSourceExtension(target)
                ? SourcePaths.stripExtension(target) : target;

        for (final String path : knownPaths) {
            final String normalized = normalizeOrNull(path);
            if (normalized == null) {
                continue;
            }
            final String withoutExtension =
                    SourcePaths.stripExtension(normalized);
            if (normalized.equals(target) || withoutExtension.equals(target)
                    || withoutExtension.equals(targetWithoutExtension)) {
                return Optional.of(path);
            }
        }

        for (final String extension : SOURCE_EXTENSIONS) {
            final Optional<String> found = findExact(target + extension,
                    knownPaths);
            if (found.isPresent()) {
                return found;
            }
        }

        for (final String index : INDEX_FILES) {
            final Optional<String> found = findExact(
                    SourcePaths.join(target, index), knownPaths);
            if (found.isPresent()) {
                return found;
            }
        }

        return Optional.empty();
    }

    /**
     * Resolves a module name to a file.
     *
     * <p>Relative modules are resolved with
     * {@link #resolveRelative(String, String, Collection)}, which needs the
     * importing file. Bare modules turn their dots into slashes and match
     * the first known path that, without extension, equals the result or
     * ends with it after a slash.</p>
     *
     * @param module the module name or specifier
     * @param knownPaths the repository paths
     * @param currentFile the importing file, can be null
     * @return the matching known path, empty when nothing matches
     * @throws IllegalArgumentException if module or knownPaths is null
     */
    public Optional<String> resolveModule(final String module,
            final Collection<String> knownPaths, final String currentFile) {

        Preconditions.requireNonNull(module, "Module is required");
        Preconditions.requireNonNull(knownPaths, "Known paths are required");

        if (module.startsWith(".")) {
            return currentFile == null
                    ? Optional.empty()
                    : resolveRelative(module, currentFile, knownPaths);
        }
        if (module.isBlank()) {
            return Optional.empty();
        }

        final String modulePath = module.replace('.', '/');
        for (final String path : knownPaths) {
            final String normalized = normalizeOrNull(path);
            if (normalized == null) {
                continue;
            }
            final String withoutExtension =
                    SourcePaths.stripExtension(normalized);
            if (withoutExtension.equals(modulePath)
                    || withoutExtension.endsWith("/" + modulePath)) {
                return Optional.of(path);
            }
        }
        return Optional.empty();
    }

    /**
     * Rewrites a dotted relative module ({@code .}, {@code ..pkg.mod}) to
     * a path ({@code ./}, {@code ../pkg/mod}). Path specifiers are
     * returned unchanged.
     */
    static String toPathForm(final String source) {
        if (source.indexOf('/') >= 0) {
            return source;
        }
        int level = 0;
        while (level < source.length() && source.charAt(level) == '.') {
            level++;
        }
        final StringBuilder path = new StringBuilder(
                level == 1 ? "./" : "../".repeat(level - 1));
        path.append(source.substring(level).replace('.', '/'));
        return path.toString();
    }

    private static Optional<String> findExact(final String candidate,
            final Collection<String> knownPaths) {
        for (final String path : knownPaths) {
            if (candidate.equals(normalizeOrNull(path))) {
                return Optional.of(path);
            }
        }
        return Optional.empty();
    }

    private static boolean hasSourceExtension(final String path) {
        return SOURCE_EXTENSIONS.contains(
                SourcePaths.extension(path).toLowerCase(Locale.ROOT));
    }

    private static String normalizeOrNull(final String path) {
        if (path == null) {
            return null;
        }
        try {
            return SourcePaths.normalize(path);
        } catch (final InvalidPathException e) {
            return null;
        }
    }

}
