package co.fanki.sourceparsing.analysis.domain.python;

import co.fanki.sourceparsing.analysis.domain.Declaration;
import co.fanki.sourceparsing.analysis.domain.IdentifierReference;
import co.fanki.sourceparsing.analysis.domain.Import;

import java.util.List;
import java.util.Map;

/**
 * Carries what the embedded Python analyzer extracted from one module.
 *
 * <p>Either the syntax error is set and every collection is empty, or the
 * syntax error is null and the collections hold the module's imports,
 * module-level declarations and name references.</p>
 *
 * @param syntaxError the description of the syntax error, null when the
 *        module parsed
 * @param imports the imports in source order
 * @param declarations the module-level declarations keyed by name
 * @param identifiers the names read anywhere in the module
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record PythonAnalysis(
        String syntaxError,
        List<Import> imports,
        Map<String, Declaration> declarations,
        List<IdentifierReference> identifiers
) {

    /**
     * Creates the analysis of a module that does not parse.
     *
     * @param message the syntax error description
     * @return the analysis, never null
     */
    public static PythonAnalysis syntaxError(final String message) {
        return new PythonAnalysis(message, List.of(), Map.of(), List.of());
    }

    /**
     * Checks if the module failed to parse.
     *
     * @return true when a syntax error was reported
     */
    public boolean hasSyntaxError() {
        return syntaxError != null;
    }

}
