package co.fanki.sourceparsing.analysis.domain;

import co.fanki.sourceparsing.shared.Preconditions;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The complete, immutable outcome of parsing one source file.
 *
 * <p>Created once per parse call and never modified afterwards. Two parses
 * of the same input produce equal results: there are no counters or
 * timestamps inside.</p>
 *
 * @param language the language the content was parsed as
 * @param imports the imports in source order
 * @param declarations the top-level declarations keyed by name, the latest
 *        binding of a duplicated name wins
 * @param identifiers the free identifier references in load position
 * @param syntaxValid false only when the language's syntax tree could not
 *        be built at all
 * @param errors the diagnostics explaining an invalid syntax, empty when
 *        syntaxValid is true
 * @param raw the source text that was parsed
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ParseResult(
        Language language,
        List<Import> imports,
        Map<String, Declaration> declarations,
        List<IdentifierReference> identifiers,
        boolean syntaxValid,
        List<String> errors,
        String raw
) {

    public ParseResult {
        Preconditions.requireNonNull(language, "Language is required");
        Preconditions.requireNonNull(raw, "Raw source is required");
        imports = List.copyOf(imports);
        declarations = Collections.unmodifiableMap(
                new LinkedHashMap<>(declarations));
        identifiers = List.copyOf(identifiers);
        errors = List.copyOf(errors);
    }

    /**
     * Creates the result for content whose language was not recognized.
     *
     * @param raw the source text
     * @return an empty, syntactically valid result tagged UNKNOWN
     */
    public static ParseResult unknown(final String raw) {
        return new ParseResult(Language.UNKNOWN, List.of(), Map.of(),
                List.of(), true, List.of(), raw);
    }

    /**
     * Returns the set of names referenced anywhere in the file.
     *
     * @return the referenced names
     */
    public Set<String> usedNames() {
        final Set<String> used = new HashSet<>();
        for (final IdentifierReference reference : identifiers) {
            used.add(reference.name());
        }
        return used;
    }

    /**
     * Returns one line of the raw source.
     *
     * @param lineNumber the 1-based line number
     * @return the line without its terminator, empty when out of range
     */
    public String line(final int lineNumber) {
        if (lineNumber < 1) {
            return "";
        }
        final String[] lines = raw.split("\r?\n", -1);
        return lineNumber <= lines.length ? lines[lineNumber - 1] : "";
    }

}
