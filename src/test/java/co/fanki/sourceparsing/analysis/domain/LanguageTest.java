package co.fanki.sourceparsing.analysis.domain;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link Language}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class LanguageTest {

    @Test
    void whenMappingFilename_givenKnownExtensions_shouldReturnLanguage() {
        assertEquals(Optional.of(Language.PYTHON),
                Language.fromFilename("stubs/types.pyi"));
        assertEquals(Optional.of(Language.JAVASCRIPT),
                Language.fromFilename("build.cjs"));
        assertEquals(Optional.of(Language.TYPESCRIPT),
                Language.fromFilename("src/App.TSX"));
    }

    @Test
    void whenMappingFilename_givenUnmappedOrMissing_shouldReturnEmpty() {
        assertEquals(Optional.empty(), Language.fromFilename(null));
        assertEquals(Optional.empty(), Language.fromFilename("README"));
        assertEquals(Optional.empty(), Language.fromFilename("notes.txt"));
    }

    @Test
    void whenParsingTag_givenValues_shouldIgnoreCaseAndDefaultToUnknown() {
        assertEquals(Language.TYPESCRIPT, Language.fromTag(" TypeScript "));
        assertEquals(Language.UNKNOWN, Language.fromTag("ruby"));
        assertEquals(Language.UNKNOWN, Language.fromTag(null));
    }

    @Test
    void whenCheckingFamily_givenLanguages_shouldGroupJavaScriptDialects() {
        assertTrue(Language.JAVASCRIPT.isJavaScriptFamily());
        assertTrue(Language.TYPESCRIPT.isJavaScriptFamily());
        assertFalse(Language.PYTHON.isJavaScriptFamily());
        assertEquals("unknown", Language.UNKNOWN.tag());
    }

}
