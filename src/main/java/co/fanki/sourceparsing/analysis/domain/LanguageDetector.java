package co.fanki.sourceparsing.analysis.domain;

import co.fanki.sourceparsing.shared.Preconditions;

import java.util.Optional;

/**
 * Guesses the language of a source file.
 *
 * <p>A known extension in the filename always wins. Otherwise each
 * language gets a score from textual markers in the content and the
 * highest score is taken. TypeScript adds its own markers on top of the
 * JavaScript score, so on equal footing JavaScript is kept and TypeScript
 * needs at least one marker of its own.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class LanguageDetector {

    /**
     * Detects the language of the given content.
     *
     * @param content the source text
     * @param filename the file name or path, can be null
     * @return the detected language, UNKNOWN when nothing matches
     * @throws IllegalArgumentException if content is null
     */
    public Language detect(final String content, final String filename) {
        Preconditions.requireNonNull(content, "Source content is required");

        final Optional<Language> byExtension = Language.fromFilename(filename);
        if (byExtension.isPresent()) {
            return byExtension.get();
        }

        final int python = pythonScore(content);
        final int javascript = javaScriptScore(content);
        final int typescript = javascript + typeScriptMarkers(content);

        if (python == 0 && javascript == 0 && typescript == 0) {
            return Language.UNKNOWN;
        }
        if (python >= javascript && python >= typescript) {
            return Language.PYTHON;
        }
        return typescript > javascript
                ? Language.TYPESCRIPT : Language.JAVASCRIPT;
    }

    private static int pythonScore(final String content) {
        int score = 0;
        if (content.contains("def ")) {
            score += 2;
        }
        if (content.contains("class ") && content.contains(":")) {
            score += 2;
        }
        if (content.contains("import ") || content.contains("from ")) {
            score += 2;
        }
        if (content.contains(":") && content.contains("#")) {
            score += 1;
        }
        if (content.contains("self.")) {
            score += 1;
        }
        return score;
    }

    private static int javaScriptScore(final String content) {
        int score = 0;
        if (content.contains("function ") || content.contains("=>")) {
            score += 2;
        }
        if (content.contains("const ") || content.contains("let ")
                || content.contains("var ")) {
            score += 2;
        }
        if (content.contains("require(")) {
            score += 2;
        }
        if (content.contains("{") && content.contains("}")) {
            score += 1;
        }
        return score;
    }

    private static int typeScriptMarkers(final String content) {
        int score = 0;
        if (content.contains(": string") || content.contains(": number")
                || content.contains(": boolean")) {
            score += 3;
        }
        if (content.contains("interface ")) {
            score += 3;
        }
        if (content.contains("type ") && content.contains("=")) {
            score += 2;
        }
        return score;
    }

}
