package co.fanki.sourceparsing.config;

import co.fanki.sourceparsing.analysis.application.SourceAnalysisService;
import co.fanki.sourceparsing.analysis.domain.ImportResolver;
import co.fanki.sourceparsing.analysis.domain.LanguageDetector;
import co.fanki.sourceparsing.analysis.domain.SourceParser;
import co.fanki.sourceparsing.analysis.domain.UnusedDeclarationPolicy;
import co.fanki.sourceparsing.analysis.domain.UnusedSymbolAnalyzer;
import co.fanki.sourceparsing.analysis.domain.javascript.JavaScriptSourceParser;
import co.fanki.sourceparsing.analysis.domain.python.PythonAstEngine;
import co.fanki.sourceparsing.analysis.domain.python.PythonSourceParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.util.List;

/**
 * Spring wiring for the source parsing library.
 *
 * <p>Registers the parsers, the language detector, the import resolver,
 * the unused-symbol analyzer and the {@link SourceAnalysisService} that
 * ties them together. The GraalPy engine is only started when
 * {@code source-parsing.python.ast-engine-enabled} is true (the default)
 * and is closed with the application context.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class SourceParsingConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            SourceParsingConfiguration.class);

    /**
     * Starts the embedded Python syntax tree engine.
     *
     * @return the engine, closed on context shutdown
     * @throws IOException if the analyzer script cannot be loaded
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "source-parsing.python.ast-engine-enabled",
            havingValue = "true", matchIfMissing = true)
    public PythonAstEngine pythonAstEngine() throws IOException {
        return new PythonAstEngine();
    }

    /**
     * Creates the Python parser.
     *
     * @param engine the engine, absent when disabled
     * @return the parser
     */
    @Bean
    public PythonSourceParser pythonSourceParser(
            final ObjectProvider<PythonAstEngine> engine) {
        final PythonAstEngine available = engine.getIfAvailable();
        if (available == null) {
            LOG.info("Python AST engine disabled, Python files will be"
                    + " parsed with the line scan");
        }
        return new PythonSourceParser(available);
    }

    /**
     * Creates the JavaScript and TypeScript parser.
     *
     * @return the parser
     */
    @Bean
    public JavaScriptSourceParser javaScriptSourceParser() {
        return new JavaScriptSourceParser();
    }

    /**
     * Creates the language detector.
     *
     * @return the detector
     */
    @Bean
    public LanguageDetector languageDetector() {
        return new LanguageDetector();
    }

    /**
     * Creates the import resolver.
     *
     * @return the resolver
     */
    @Bean
    public ImportResolver importResolver() {
        return new ImportResolver();
    }

    /**
     * Creates the unused-symbol analyzer.
     *
     * @return the analyzer
     */
    @Bean
    public UnusedSymbolAnalyzer unusedSymbolAnalyzer() {
        return new UnusedSymbolAnalyzer();
    }

    /**
     * Creates the source analysis service.
     *
     * @param parsers every registered parser
     * @param detector the language detector
     * @param resolver the import resolver
     * @param analyzer the unused-symbol analyzer
     * @param exemptExported whether exported declarations are left out of
     *        the unused report by default
     * @return the service
     */
    @Bean
    public SourceAnalysisService sourceAnalysisService(
            final List<SourceParser> parsers,
            final LanguageDetector detector,
            final ImportResolver resolver,
            final UnusedSymbolAnalyzer analyzer,
            @Value("${source-parsing.unused.exempt-exported:false}")
            final boolean exemptExported) {
        return new SourceAnalysisService(parsers, detector, resolver,
                analyzer, exemptExported
                        ? UnusedDeclarationPolicy.EXEMPT_EXPORTED
                        : UnusedDeclarationPolicy.REPORT_ALL);
    }

}
