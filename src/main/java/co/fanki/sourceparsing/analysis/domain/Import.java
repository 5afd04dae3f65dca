package co.fanki.sourceparsing.analysis.domain;

import co.fanki.sourceparsing.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;

/**
 * One import statement, normalized across languages.
 *
 * <p>Relativity is not a component of this record: {@link #isRelative()}
 * is always derived from the specifier, so a caller cannot build an import
 * whose flag disagrees with its source. Python relative imports carry their
 * level as leading dots ({@code from .. import x} has source "..").</p>
 *
 * @param source the module specifier as written
 * @param names the imported names in source order, empty for side-effect
 *        imports
 * @param line the 1-based line of the statement
 * @param column the 1-based column of the statement
 * @param kind the syntactic shape of the statement
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Import(
        String source,
        List<ImportedName> names,
        int line,
        int column,
        ImportKind kind
) {

    public Import {
        Preconditions.requireNonNull(source, "Import source is required");
        Preconditions.requireNonNull(names, "Imported names are required");
        Preconditions.requirePositive(line, "Line must be 1-based");
        Preconditions.requirePositive(column, "Column must be 1-based");
        Preconditions.requireNonNull(kind, "Import kind is required");
        names = List.copyOf(names);
    }

    /**
     * Checks if the specifier is relative to the importing file.
     *
     * <p>True for path specifiers starting with "./" or "../" and for
     * specifiers with one or more leading relative markers, like the
     * Python ".models" or "..". Both forms start with a dot.</p>
     *
     * @return true if the import is relative
     */
    public boolean isRelative() {
        return source.startsWith(".");
    }

    /**
     * Returns the local names this import introduces in the importing file.
     *
     * <p>Uses the alias when present. A plain Python import of a dotted
     * module binds its first segment ({@code import os.path} binds "os").
     * A star import without alias binds nothing we can track.</p>
     *
     * @return the bound names, never null
     */
    public List<String> boundNames() {
        if (!kind.bindsNames()) {
            return List.of();
        }
        final List<String> bound = new ArrayList<>();
        for (final ImportedName imported : names) {
            if (imported.alias() != null) {
                bound.add(imported.alias());
            } else if (ImportedName.STAR.equals(imported.name())) {
                continue;
            } else if (kind == ImportKind.PLAIN_IMPORT) {
                final int dot = imported.name().indexOf('.');
                bound.add(dot > 0
                        ? imported.name().substring(0, dot)
                        : imported.name());
            } else {
                bound.add(imported.name());
            }
        }
        return bound;
    }

}
