package co.fanki.sourceparsing.analysis.domain;

import co.fanki.sourceparsing.shared.Preconditions;

/**
 * One name pulled in by an {@link Import}.
 *
 * @param name the name as exported by the source module, "*" for
 *        namespace and star imports
 * @param alias the local alias, null when the name is bound as-is
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ImportedName(String name, String alias) {

    /** The name used by namespace and star imports. */
    public static final String STAR = "*";

    public ImportedName {
        Preconditions.requireNonBlank(name, "Imported name is required");
    }

    /**
     * Creates a name bound without alias.
     *
     * @param name the imported name
     * @return the imported name
     */
    public static ImportedName of(final String name) {
        return new ImportedName(name, null);
    }

    /**
     * Returns the local name this entry binds in the importing file.
     *
     * @return the alias when present, otherwise the name
     */
    public String localName() {
        return alias != null ? alias : name;
    }

}
