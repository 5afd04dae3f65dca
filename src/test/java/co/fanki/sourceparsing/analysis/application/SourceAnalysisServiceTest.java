package co.fanki.sourceparsing.analysis.application;

import co.fanki.sourceparsing.analysis.domain.Import;
import co.fanki.sourceparsing.analysis.domain.ImportGraph;
import co.fanki.sourceparsing.analysis.domain.Language;
import co.fanki.sourceparsing.analysis.domain.ParseResult;
import co.fanki.sourceparsing.analysis.domain.UnusedDeclarationPolicy;
import co.fanki.sourceparsing.analysis.domain.python.PythonAstEngine;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link SourceAnalysisService}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class SourceAnalysisServiceTest {

    private static PythonAstEngine engine;
    private static SourceAnalysisService service;

    @BeforeAll
    static void setUp() throws IOException {
        engine = new PythonAstEngine();
        service = new SourceAnalysisService(engine);
    }

    @AfterAll
    static void tearDown() {
        engine.close();
    }

    // -- Parsing --

    @Test
    void whenParsing_givenUnknownContent_shouldReturnEmptyUnknownResult() {
        final ParseResult result = service.parseFile("lorem ipsum",
                "notes.txt");

        assertEquals(Language.UNKNOWN, result.language());
        assertEquals("lorem ipsum", result.raw());
        assertTrue(result.syntaxValid());
        assertTrue(result.imports().isEmpty());
    }

    @Test
    void whenParsing_givenExtensionlessPython_shouldDetectAndParse() {
        final ParseResult result = service.parseFile(
                "import sys\n\ndef main():\n    sys.exit(0)\n", "manage");

        assertEquals(Language.PYTHON, result.language());
        assertTrue(result.syntaxValid());
        assertEquals(Set.of("main"), result.declarations().keySet());
    }

    @Test
    void whenParsing_givenExplicitLanguage_shouldSkipDetection() {
        final ParseResult result = service.parseFile("const a = 1;",
                "weird.py", Language.TYPESCRIPT);

        assertEquals(Language.TYPESCRIPT, result.language());
        assertEquals(Set.of("a"), result.declarations().keySet());
    }

    @Test
    void whenParsing_givenSameInputTwice_shouldReturnEqualResults() {
        final String python = "import os\nx = os.sep\n";
        final String script = "import { a } from './a';\nexport const b = a;\n";

        assertEquals(service.parseFile(python, "m.py"),
                service.parseFile(python, "m.py"));
        assertEquals(service.parseFile(script, "m.ts"),
                service.parseFile(script, "m.ts"));
    }

    @Test
    void whenParsing_givenNullContent_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> service.parseFile(null, "a.js"));
    }

    @Test
    void whenDetecting_givenFilename_shouldDelegateToDetector() {
        assertEquals(Language.JAVASCRIPT,
                service.detectLanguage("", "index.mjs"));
        assertEquals(Language.UNKNOWN, service.detectLanguage("", null));
    }

    // -- Unused symbols --

    @Test
    void whenFindingUnused_givenScript_shouldReportImportsAndDeclarations() {
        final ParseResult result = service.parseFile("""
                import { used, unused } from './a';
                import Default from './b';
                export function api() { return used; }
                function helper() { return 1; }
                """, "m.js");

        final List<Import> unusedImports = service.findUnusedImports(result);

        assertEquals(1, unusedImports.size());
        assertEquals("./b", unusedImports.get(0).source());
        assertEquals(List.of("api", "helper"),
                service.findUnusedDeclarations(result));
        assertEquals(List.of("helper"), service.findUnusedDeclarations(
                result, UnusedDeclarationPolicy.EXEMPT_EXPORTED));
    }

    // -- Resolution --

    @Test
    void whenResolving_givenKnownFiles_shouldReturnPathOrNull() {
        final Map<String, String> files = Map.of(
                "src/a/c/index.ts", "", "lib/app/models.py", "");

        assertEquals("src/a/c/index.ts",
                service.resolveRelativeImport("./c", "src/a/b.ts", files));
        assertNull(service.resolveRelativeImport("./d", "src/a/b.ts", files));
        assertEquals("lib/app/models.py",
                service.resolveModuleToFile("app.models", files, null));
        assertNull(service.resolveModuleToFile("django", files, null));
    }

    // -- Import graph --

    @Test
    void whenBuildingGraph_givenMixedRepository_shouldLinkResolvedImports() {
        final Map<String, String> files = new LinkedHashMap<>();
        files.put("src/index.ts", """
                import { helper } from './utils';
                import React from 'react';
                import './missing';
                helper(React);
                """);
        files.put("src/utils/index.ts",
                "export function helper(x: number) { return x; }\n");
        files.put("src/orphan.js", "const utils = require('./utils');\n");
        files.put("app/main.py", "from .models import User\n\nUser()\n");
        files.put("app/models.py", "class User:\n    pass\n");

        final ImportGraph graph = service.buildImportGraph(files);

        assertEquals(5, graph.fileCount());
        assertEquals(3, graph.edgeCount());
        assertEquals(Set.of("src/utils/index.ts"),
                graph.dependencies("src/index.ts"));
        assertEquals(Set.of("src/index.ts", "src/orphan.js"),
                graph.dependents("src/utils/index.ts"));
        assertEquals(Set.of("app/models.py"),
                graph.dependencies("app/main.py"));
        assertEquals(Set.of("src/index.ts", "src/orphan.js", "app/main.py"),
                graph.orphans());
        assertEquals(Set.of("src/index.ts"),
                graph.filesWithUnresolvedImports());
        assertEquals("./missing",
                graph.unresolvedImports("src/index.ts").get(0).source());
        assertEquals(Language.PYTHON,
                graph.parseResult("app/models.py").language());
    }

}
