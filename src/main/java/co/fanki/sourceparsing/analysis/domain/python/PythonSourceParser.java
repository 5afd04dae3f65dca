package co.fanki.sourceparsing.analysis.domain.python;

import co.fanki.sourceparsing.analysis.domain.Language;
import co.fanki.sourceparsing.analysis.domain.ParseResult;
import co.fanki.sourceparsing.analysis.domain.SourceParser;
import co.fanki.sourceparsing.shared.SourceParsingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Python implementation of {@link SourceParser}.
 *
 * <p>Delegates to {@link PythonAstEngine}, which builds the module's real
 * syntax tree. When the module does not parse, or when no engine is
 * available, the whole result comes from {@link PythonRegexFallback} and
 * is flagged as syntactically invalid.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PythonSourceParser extends SourceParser {

    private static final Logger LOG = LoggerFactory.getLogger(
            PythonSourceParser.class);

    /** The syntax tree engine, null when disabled. */
    private final PythonAstEngine engine;

    /**
     * Creates a parser backed by the given engine.
     *
     * @param theEngine the engine, null to always use the line scan
     */
    public PythonSourceParser(final PythonAstEngine theEngine) {
        this.engine = theEngine;
    }

    /** Creates a parser without syntax tree engine. */
    public PythonSourceParser() {
        this(null);
    }

    /** {@inheritDoc} */
    @Override
    public Set<Language> languages() {
        return Set.of(Language.PYTHON);
    }

    /** {@inheritDoc} */
    @Override
    protected ParseResult doParse(final String content,
            final String filename) {

        if (engine == null) {
            return PythonRegexFallback.parse(content,
                    "Python syntax tree unavailable: AST engine disabled");
        }

        final PythonAnalysis analysis;
        try {
            analysis = engine.analyze(content);
        } catch (final SourceParsingException e) {
            LOG.warn("Python AST engine failed on {}, using line scan",
                    filename, e);
            return PythonRegexFallback.parse(content,
                    "Python syntax tree unavailable: " + e.getMessage());
        }

        if (analysis.hasSyntaxError()) {
            LOG.warn("Syntax error in {}, using line scan: {}",
                    filename, analysis.syntaxError());
            return PythonRegexFallback.parse(content,
                    "SyntaxError: " + analysis.syntaxError());
        }

        return new ParseResult(Language.PYTHON, analysis.imports(),
                analysis.declarations(), analysis.identifiers(), true,
                List.of(), content);
    }

}
