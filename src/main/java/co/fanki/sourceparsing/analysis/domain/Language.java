package co.fanki.sourceparsing.analysis.domain;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * The languages a {@link ParseResult} can be tagged with.
 *
 * <p>{@link #UNKNOWN} is the sentinel returned when neither the filename
 * nor the content identify a supported language. It is a valid tag, not an
 * error.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum Language {

    /** Python, parsed through its own syntax tree. */
    PYTHON("python", Set.of(".py", ".pyi")),

    /** Untyped JavaScript. */
    JAVASCRIPT("javascript", Set.of(".js", ".jsx", ".mjs", ".cjs")),

    /** TypeScript, the statically typed superset of JavaScript. */
    TYPESCRIPT("typescript", Set.of(".ts", ".tsx", ".mts", ".cts")),

    /** Unrecognized content. */
    UNKNOWN("unknown", Set.of());

    private final String tag;
    private final Set<String> extensions;

    Language(final String theTag, final Set<String> theExtensions) {
        this.tag = theTag;
        this.extensions = theExtensions;
    }

    /**
     * Returns the lower-case tag of this language.
     *
     * @return the tag, e.g. "python" or "unknown"
     */
    public String tag() {
        return tag;
    }

    /**
     * Checks if this language belongs to the JavaScript family.
     *
     * @return true for JavaScript and TypeScript
     */
    public boolean isJavaScriptFamily() {
        return this == JAVASCRIPT || this == TYPESCRIPT;
    }

    /**
     * Maps a filename to a language through its extension.
     *
     * @param filename the file name or path, can be null
     * @return the language owning the extension, empty when the filename is
     *         null or its extension is not mapped
     */
    public static Optional<Language> fromFilename(final String filename) {
        if (filename == null) {
            return Optional.empty();
        }
        final String extension = SourcePaths.extension(filename)
                .toLowerCase(Locale.ROOT);
        if (extension.isEmpty()) {
            return Optional.empty();
        }
        for (final Language language : values()) {
            if (language.extensions.contains(extension)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }

    /**
     * Parses a tag into a Language, returning UNKNOWN if not recognized.
     *
     * @param value the tag to parse
     * @return the corresponding language or UNKNOWN
     */
    public static Language fromTag(final String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        for (final Language language : values()) {
            if (language.tag.equalsIgnoreCase(value.trim())) {
                return language;
            }
        }
        return UNKNOWN;
    }

}
