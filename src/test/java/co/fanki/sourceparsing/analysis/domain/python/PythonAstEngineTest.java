package co.fanki.sourceparsing.analysis.domain.python;

import co.fanki.sourceparsing.analysis.domain.ImportKind;
import co.fanki.sourceparsing.shared.SourceParsingException;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link PythonAstEngine}.
 *
 * <p>Starts one GraalPy engine for the whole class, since the runtime is
 * slow to boot.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PythonAstEngineTest {

    private static PythonAstEngine engine;

    @BeforeAll
    static void setUp() throws IOException {
        engine = new PythonAstEngine();
    }

    @AfterAll
    static void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    @Test
    void whenAnalyzing_givenValidModule_shouldDecodeEverySection() {
        final PythonAnalysis analysis = engine.analyze("""
                import json
                from pathlib import Path as P

                def load(name: str) -> dict:
                    return json.loads(P(name).read_text())
                """);

        assertFalse(analysis.hasSyntaxError());
        assertEquals(2, analysis.imports().size());
        assertEquals(ImportKind.PLAIN_IMPORT, analysis.imports().get(0).kind());
        assertEquals(ImportKind.FROM_IMPORT, analysis.imports().get(1).kind());
        assertEquals("P", analysis.imports().get(1).names().get(0).alias());
        assertEquals("def load(name: str) -> dict",
                analysis.declarations().get("load").signature());
        assertTrue(analysis.identifiers().stream()
                .anyMatch(i -> i.name().equals("json") && i.line() == 5));
    }

    @Test
    void whenAnalyzing_givenSyntaxError_shouldReportItAsData() {
        final PythonAnalysis analysis = engine.analyze("def broken(:\n");

        assertTrue(analysis.hasSyntaxError());
        assertNotNull(analysis.syntaxError());
        assertTrue(analysis.imports().isEmpty());
        assertTrue(analysis.declarations().isEmpty());
    }

    @Test
    void whenAnalyzing_givenNullByte_shouldReportItAsSyntaxError() {
        final PythonAnalysis analysis = engine.analyze("x = 1\u0000");

        assertTrue(analysis.hasSyntaxError());
    }

    @Test
    void whenAnalyzing_givenConcurrentCalls_shouldReturnConsistentResults()
            throws Exception {

        final String module = "import os\n\ndef f(a, *, b):\n    return os\n";
        final PythonAnalysis expected = engine.analyze(module);

        final ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            final List<Future<PythonAnalysis>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(executor.submit(() -> engine.analyze(module)));
            }
            for (final Future<PythonAnalysis> future : futures) {
                assertEquals(expected, future.get());
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals("def f(a, *, b)",
                expected.declarations().get("f").signature());
    }

    @Test
    void whenAnalyzing_givenClosedEngine_shouldThrowSourceParsingException()
            throws IOException {

        final PythonAstEngine closed = new PythonAstEngine();
        closed.close();

        final SourceParsingException exception = assertThrows(
                SourceParsingException.class, () -> closed.analyze("x = 1"));
        assertEquals(SourceParsingException.PYTHON_ENGINE_ERROR,
                exception.getErrorCode());
    }

    @Test
    void whenAnalyzing_givenNull_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> engine.analyze(null));
    }

}
