package co.fanki.sourceparsing.analysis.domain;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link ImportResolver}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ImportResolverTest {

    private final ImportResolver resolver = new ImportResolver();

    // -- Relative specifiers --

    @Test
    void whenResolvingRelative_givenDirectoryWithIndex_shouldReturnIndexFile() {
        assertEquals(Optional.of("src/a/c/index.ts"), resolver.resolveRelative(
                "./c", "src/a/b.ts", List.of("src/a/b.ts", "src/a/c/index.ts")));
    }

    @Test
    void whenResolvingRelative_givenSeveralParentSegments_shouldCollapseThem() {
        assertEquals(Optional.of("src/lib/util.js"), resolver.resolveRelative(
                "../../lib/util", "src/a/b/c.js",
                List.of("src/lib/util.py.bak", "src/lib/util.js")));
    }

    @Test
    void whenResolvingRelative_givenSpecifierWithExtension_shouldMatchExactly() {
        assertEquals(Optional.of("src/a/util.js"), resolver.resolveRelative(
                "./util.js", "src/a/b.js", List.of("src/a/util.js")));
    }

    @Test
    void whenResolvingRelative_givenJsSpecifierForTsFile_shouldMatchWithoutExtensions() {
        assertEquals(Optional.of("src/a/util.ts"), resolver.resolveRelative(
                "./util.js", "src/a/b.ts", List.of("src/a/util.ts")));
    }

    @Test
    void whenResolvingRelative_givenSeveralCandidates_shouldReturnFirstKnownPath() {
        assertEquals(Optional.of("src/a/c.ts"), resolver.resolveRelative(
                "./c", "src/a/b.ts", List.of("src/a/c.ts", "src/a/c.js")));
        assertEquals(Optional.of("src/a/c.js"), resolver.resolveRelative(
                "./c", "src/a/b.ts", List.of("src/a/c.js", "src/a/c.ts")));
    }

    @Test
    void whenResolvingRelative_givenUnnormalizedKnownPath_shouldReturnItAsGiven() {
        assertEquals(Optional.of("./src/a/c.ts"), resolver.resolveRelative(
                "./c", "src/a/b.ts", List.of("./src/a/c.ts")));
    }

    @Test
    void whenResolvingRelative_givenFileAtRoot_shouldResolveSibling() {
        assertEquals(Optional.of("utils.py"), resolver.resolveRelative(
                "./utils", "main.py", List.of("utils.py")));
    }

    @Test
    void whenResolvingRelative_givenDottedPythonModule_shouldRewriteToPath() {
        assertEquals(Optional.of("app/pkg/mod.py"), resolver.resolveRelative(
                "..pkg.mod", "app/sub/x.py", List.of("app/pkg/mod.py")));
    }

    @Test
    void whenResolvingRelative_givenCurrentPackage_shouldReturnInitFile() {
        assertEquals(Optional.of("app/sub/__init__.py"),
                resolver.resolveRelative(".", "app/sub/x.py",
                        List.of("app/sub/x.py", "app/sub/__init__.py")));
    }

    @Test
    void whenResolvingRelative_givenBareSpecifier_shouldReturnEmpty() {
        assertEquals(Optional.empty(), resolver.resolveRelative(
                "react", "src/a.js", List.of("src/react.js")));
    }

    @Test
    void whenResolvingRelative_givenNoMatch_shouldReturnEmpty() {
        assertEquals(Optional.empty(), resolver.resolveRelative(
                "./missing", "src/a.js", List.of("src/a.js")));
    }

    @Test
    void whenResolvingRelative_givenInvalidPathCharacters_shouldReturnEmpty() {
        assertEquals(Optional.empty(), resolver.resolveRelative(
                "./a\u0000b", "src/x.js", List.of("src/a.js")));
        assertEquals(Optional.of("src/a.js"), resolver.resolveRelative(
                "./a", "src/x.js", List.of("bad\u0000path.js", "src/a.js")));
    }

    @Test
    void whenResolvingRelative_givenNullKnownPaths_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> resolver.resolveRelative("./a", "src/x.js", null));
    }

    // -- Module names --

    @Test
    void whenResolvingModule_givenDottedModule_shouldMatchPathSuffix() {
        assertEquals(Optional.of("lib/app/models/user.py"),
                resolver.resolveModule("app.models.user",
                        List.of("lib/app/models/user.py"), null));
    }

    @Test
    void whenResolvingModule_givenPartialSegment_shouldNotMatch() {
        assertEquals(Optional.empty(), resolver.resolveModule("user",
                List.of("src/superuser.py"), null));
        assertEquals(Optional.of("user.py"), resolver.resolveModule("user",
                List.of("src/superuser.py", "user.py"), null));
    }

    @Test
    void whenResolvingModule_givenRelativeModuleWithoutCurrentFile_shouldReturnEmpty() {
        assertEquals(Optional.empty(), resolver.resolveModule("./a",
                List.of("a.js"), null));
    }

    @Test
    void whenResolvingModule_givenRelativeModuleWithCurrentFile_shouldDelegate() {
        assertEquals(Optional.of("src/a.js"), resolver.resolveModule("./a",
                List.of("src/a.js"), "src/b.js"));
    }

    // -- Path form --

    @Test
    void whenRewritingToPathForm_givenDottedSpecifiers_shouldUseSlashes() {
        assertEquals("./", ImportResolver.toPathForm("."));
        assertEquals("../", ImportResolver.toPathForm(".."));
        assertEquals("./models", ImportResolver.toPathForm(".models"));
        assertEquals("../../pkg/mod", ImportResolver.toPathForm("...pkg.mod"));
        assertEquals("../x.js", ImportResolver.toPathForm("../x.js"));
    }

}
