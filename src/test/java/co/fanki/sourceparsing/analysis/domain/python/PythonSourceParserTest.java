package co.fanki.sourceparsing.analysis.domain.python;

import co.fanki.sourceparsing.analysis.domain.Declaration;
import co.fanki.sourceparsing.analysis.domain.DeclarationKind;
import co.fanki.sourceparsing.analysis.domain.Import;
import co.fanki.sourceparsing.analysis.domain.ImportKind;
import co.fanki.sourceparsing.analysis.domain.ImportedName;
import co.fanki.sourceparsing.analysis.domain.Language;
import co.fanki.sourceparsing.analysis.domain.ParseResult;
import co.fanki.sourceparsing.analysis.domain.UnusedDeclarationPolicy;
import co.fanki.sourceparsing.analysis.domain.UnusedSymbolAnalyzer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link PythonSourceParser}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PythonSourceParserTest {

    private static final String MODULE = """
            import os
            import os.path as osp
            from . import sibling
            from ..pkg import thing as t
            from typing import List, Optional

            __all__ = ["public_fn"]

            def public_fn(a: int, b, *args, key: str = "", **kwargs) -> List:
                return os.getcwd()

            async def fetch(url):
                pass

            class Model:
                def method(self):
                    return helper

            if True:
                FLAG = 1
            FLAG = 2
            counter: int = 0
            """;

    private static PythonAstEngine engine;
    private static PythonSourceParser parser;

    @BeforeAll
    static void setUp() throws IOException {
        engine = new PythonAstEngine();
        parser = new PythonSourceParser(engine);
    }

    @AfterAll
    static void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    // -- Syntax tree path --

    @Test
    void whenParsing_givenValidModule_shouldReportValidSyntax() {
        final ParseResult result = parser.parse(MODULE, "pkg/sub/mod.py");

        assertEquals(Language.PYTHON, result.language());
        assertTrue(result.syntaxValid());
        assertTrue(result.errors().isEmpty());
        assertEquals(MODULE, result.raw());
    }

    @Test
    void whenParsing_givenImports_shouldKeepKindsAndRelativeLevels() {
        final List<Import> imports = parser.parse(MODULE, "mod.py").imports();

        assertEquals(List.of("os", "os.path", ".", "..pkg", "typing"),
                imports.stream().map(Import::source).toList());
        assertEquals(List.of(ImportKind.PLAIN_IMPORT, ImportKind.PLAIN_IMPORT,
                        ImportKind.FROM_IMPORT, ImportKind.FROM_IMPORT,
                        ImportKind.FROM_IMPORT),
                imports.stream().map(Import::kind).toList());
        assertEquals(List.of(new ImportedName("os.path", "osp")),
                imports.get(1).names());
        assertEquals(List.of(new ImportedName("thing", "t")),
                imports.get(3).names());
        assertEquals(List.of(ImportedName.of("List"),
                ImportedName.of("Optional")), imports.get(4).names());
        assertTrue(imports.get(2).isRelative());
        assertTrue(imports.get(3).isRelative());
        assertFalse(imports.get(4).isRelative());
        assertEquals(3, imports.get(2).line());
        assertEquals(1, imports.get(2).column());
    }

    @Test
    void whenParsing_givenModuleLevelStatements_shouldRecordDeclarations() {
        final ParseResult result = parser.parse(MODULE, "mod.py");

        assertEquals(List.of("__all__", "public_fn", "fetch", "Model", "FLAG",
                        "counter"),
                List.copyOf(result.declarations().keySet()));

        final Declaration publicFn = result.declarations().get("public_fn");
        assertEquals(DeclarationKind.FUNCTION, publicFn.kind());
        assertEquals("function", publicFn.descriptor());
        assertEquals("def public_fn(a: int, b, *args, key: str, **kwargs)"
                + " -> List", publicFn.signature());
        assertTrue(publicFn.exported());

        final Declaration fetch = result.declarations().get("fetch");
        assertEquals("async function", fetch.descriptor());
        assertEquals("async def fetch(url)", fetch.signature());
        assertFalse(fetch.exported());

        assertEquals(DeclarationKind.CLASS,
                result.declarations().get("Model").kind());
        assertEquals(20, result.declarations().get("FLAG").line());
        assertEquals("variable",
                result.declarations().get("FLAG").descriptor());
        assertEquals("annotated variable",
                result.declarations().get("counter").descriptor());
        assertFalse(result.declarations().containsKey("method"));
    }

    @Test
    void whenParsing_givenNameReads_shouldCollectLoadReferences() {
        final ParseResult result = parser.parse(MODULE, "mod.py");

        assertTrue(result.usedNames().contains("os"));
        assertTrue(result.usedNames().contains("helper"));
        assertTrue(result.usedNames().contains("List"));
        assertFalse(result.usedNames().contains("counter"));
    }

    @Test
    void whenAnalyzingUnusedImports_givenModule_shouldReportUnboundAliases() {
        final ParseResult result = parser.parse(MODULE, "mod.py");

        final List<Import> unused = new UnusedSymbolAnalyzer()
                .findUnusedImports(result);

        assertEquals(List.of("os.path", ".", "..pkg"),
                unused.stream().map(Import::source).toList());
    }

    @Test
    void whenAnalyzingUnusedDeclarations_givenForwardReference_shouldCountItAsUsed() {
        final ParseResult result = parser.parse("""
                def a():
                    return b()

                def b():
                    return 1
                """, "mod.py");

        assertEquals(List.of("a"), new UnusedSymbolAnalyzer()
                .findUnusedDeclarations(result,
                        UnusedDeclarationPolicy.REPORT_ALL));
    }

    @Test
    void whenParsing_givenParentPackageImport_shouldEncodeLevelAsDots() {
        final ParseResult result = parser.parse("from .. import x\n",
                "a/b/c.py");

        assertEquals("..", result.imports().get(0).source());
        assertTrue(result.imports().get(0).isRelative());
    }

    // -- Fallback path --

    @Test
    void whenParsing_givenSyntaxError_shouldFallBackWithOneError() {
        final ParseResult result = parser.parse(
                "def broken(:\n    pass\nimport json\nclass Ok:\n    pass\n",
                "broken.py");

        assertFalse(result.syntaxValid());
        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).startsWith("SyntaxError"));
        assertEquals("json", result.imports().get(0).source());
        assertTrue(result.declarations().containsKey("broken"));
        assertTrue(result.declarations().containsKey("Ok"));
    }

    @Test
    void whenParsing_givenNoEngine_shouldUseLineScan() {
        final ParseResult result = new PythonSourceParser().parse(
                "import os\n", "a.py");

        assertFalse(result.syntaxValid());
        assertEquals(1, result.errors().size());
        assertEquals("os", result.imports().get(0).source());
    }

    @Test
    void whenParsing_givenSameInputTwice_shouldProduceEqualResults() {
        assertEquals(parser.parse(MODULE, "mod.py"),
                parser.parse(MODULE, "mod.py"));
    }

}
