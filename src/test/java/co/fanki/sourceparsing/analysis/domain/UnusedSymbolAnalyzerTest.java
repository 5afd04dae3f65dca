package co.fanki.sourceparsing.analysis.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link UnusedSymbolAnalyzer}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class UnusedSymbolAnalyzerTest {

    private final UnusedSymbolAnalyzer analyzer = new UnusedSymbolAnalyzer();

    // -- Imports --

    @Test
    void whenFindingUnusedImports_givenMixedUsage_shouldReportOnlyUnbound() {
        final Import os = new Import("os.path",
                List.of(ImportedName.of("os.path")), 1, 1,
                ImportKind.PLAIN_IMPORT);
        final Import typing = new Import("typing",
                List.of(ImportedName.of("List"), ImportedName.of("Dict")),
                2, 1, ImportKind.FROM_IMPORT);
        final Import numpy = new Import("numpy",
                List.of(new ImportedName("numpy", "np")), 3, 1,
                ImportKind.PLAIN_IMPORT);
        final Import star = new Import("helpers",
                List.of(ImportedName.of(ImportedName.STAR)), 4, 1,
                ImportKind.FROM_IMPORT);

        final ParseResult result = result(List.of(os, typing, numpy, star),
                Map.of(), "os", "Dict", "numpy");

        assertEquals(List.of(numpy), analyzer.findUnusedImports(result));
    }

    @Test
    void whenFindingUnusedImports_givenRequireAndSideEffect_shouldNeverReport() {
        final Import required = new Import("./config", List.of(), 1, 1,
                ImportKind.COMMONJS_REQUIRE);
        final Import styles = new Import("./styles.css", List.of(), 2, 1,
                ImportKind.SIDE_EFFECT);
        final Import lazy = new Import("./page", List.of(), 3, 1,
                ImportKind.DYNAMIC);

        final ParseResult result = result(List.of(required, styles, lazy),
                Map.of());

        assertEquals(List.of(), analyzer.findUnusedImports(result));
    }

    @Test
    void whenFindingUnusedImports_givenNull_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> analyzer.findUnusedImports(null));
    }

    // -- Declarations --

    @Test
    void whenFindingUnusedDeclarations_givenReportAll_shouldIncludeExported() {
        final ParseResult result = result(List.of(), declarations(),
                "used");

        assertEquals(List.of("helper", "api"), analyzer.findUnusedDeclarations(
                result, UnusedDeclarationPolicy.REPORT_ALL));
    }

    @Test
    void whenFindingUnusedDeclarations_givenExemptExported_shouldSkipExported() {
        final ParseResult result = result(List.of(), declarations(),
                "used");

        assertEquals(List.of("helper"), analyzer.findUnusedDeclarations(
                result, UnusedDeclarationPolicy.EXEMPT_EXPORTED));
    }

    @Test
    void whenFindingUnusedDeclarations_givenNullPolicy_shouldThrowException() {
        final ParseResult result = result(List.of(), Map.of());

        assertThrows(IllegalArgumentException.class,
                () -> analyzer.findUnusedDeclarations(result, null));
    }

    private static Map<String, Declaration> declarations() {
        final Map<String, Declaration> declarations = new LinkedHashMap<>();
        declarations.put("helper", Declaration.of("helper",
                DeclarationKind.FUNCTION, 1, 1, "function"));
        declarations.put("used", Declaration.of("used",
                DeclarationKind.VARIABLE, 2, 1, "const"));
        declarations.put("api", new Declaration("api",
                DeclarationKind.FUNCTION, 3, 1, "function",
                "function api()", true));
        return declarations;
    }

    private static ParseResult result(final List<Import> imports,
            final Map<String, Declaration> declarations,
            final String... used) {
        final List<IdentifierReference> identifiers = new ArrayList<>();
        for (int i = 0; i < used.length; i++) {
            identifiers.add(new IdentifierReference(i + 10, used[i]));
        }
        return new ParseResult(Language.PYTHON, imports, declarations,
                identifiers, true, List.of(), "");
    }

}
