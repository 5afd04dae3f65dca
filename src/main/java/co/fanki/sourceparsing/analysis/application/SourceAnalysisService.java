package co.fanki.sourceparsing.analysis.application;

import co.fanki.sourceparsing.analysis.domain.Import;
import co.fanki.sourceparsing.analysis.domain.ImportGraph;
import co.fanki.sourceparsing.analysis.domain.ImportResolver;
import co.fanki.sourceparsing.analysis.domain.Language;
import co.fanki.sourceparsing.analysis.domain.LanguageDetector;
import co.fanki.sourceparsing.analysis.domain.ParseResult;
import co.fanki.sourceparsing.analysis.domain.SourceParser;
import co.fanki.sourceparsing.analysis.domain.UnusedDeclarationPolicy;
import co.fanki.sourceparsing.analysis.domain.UnusedSymbolAnalyzer;
import co.fanki.sourceparsing.analysis.domain.javascript.JavaScriptSourceParser;
import co.fanki.sourceparsing.analysis.domain.python.PythonAstEngine;
import co.fanki.sourceparsing.analysis.domain.python.PythonSourceParser;
import co.fanki.sourceparsing.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Application service for source parsing and symbol resolution.
 *
 * <p>Entry point of the library. Detects the language of a file, routes
 * it to the parser registered for that language, and answers the
 * questions asked about the result: which imports and declarations are
 * unused, and which known file an import points at.</p>
 *
 * <p>Parse flow: content + filename -> language detection -> parser
 * registry lookup -> {@link ParseResult}.</p>
 *
 * <p>Graph flow: path to content map -> parse every file -> resolve every
 * import against the same paths -> {@link ImportGraph}.</p>
 *
 * <p>The service holds no per-call state and may be shared between
 * threads.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SourceAnalysisService {

    private static final Logger LOG = LoggerFactory.getLogger(
            SourceAnalysisService.class);

    private final Map<Language, SourceParser> parsers;
    private final LanguageDetector detector;
    private final ImportResolver resolver;
    private final UnusedSymbolAnalyzer analyzer;
    private final UnusedDeclarationPolicy defaultPolicy;

    /**
     * Creates a new SourceAnalysisService.
     *
     * @param theParsers the parsers, each registered for the languages it
     *        declares. A later parser replaces an earlier one for the same
     *        language.
     * @param theDetector the language detector
     * @param theResolver the import resolver
     * @param theAnalyzer the unused-symbol analyzer
     * @param theDefaultPolicy the policy used by
     *        {@link #findUnusedDeclarations(ParseResult)}
     */
    public SourceAnalysisService(
            final List<SourceParser> theParsers,
            final LanguageDetector theDetector,
            final ImportResolver theResolver,
            final UnusedSymbolAnalyzer theAnalyzer,
            final UnusedDeclarationPolicy theDefaultPolicy) {

        Preconditions.requireNonNull(theParsers, "Parsers are required");
        this.detector = Preconditions.requireNonNull(theDetector,
                "Language detector is required");
        this.resolver = Preconditions.requireNonNull(theResolver,
                "Import resolver is required");
        this.analyzer = Preconditions.requireNonNull(theAnalyzer,
                "Unused symbol analyzer is required");
        this.defaultPolicy = Preconditions.requireNonNull(theDefaultPolicy,
                "Default policy is required");

        final Map<Language, SourceParser> registry =
                new EnumMap<>(Language.class);
        for (final SourceParser parser : theParsers) {
            for (final Language language : parser.languages()) {
                registry.put(language, parser);
            }
        }
        this.parsers = registry;
    }

    /**
     * Creates a service with the built-in parsers and default
     * collaborators.
     *
     * @param pythonEngine the Python syntax tree engine, null to parse
     *        Python with the line scan only
     */
    public SourceAnalysisService(final PythonAstEngine pythonEngine) {
        this(List.of(new PythonSourceParser(pythonEngine),
                        new JavaScriptSourceParser()),
                new LanguageDetector(), new ImportResolver(),
                new UnusedSymbolAnalyzer(),
                UnusedDeclarationPolicy.REPORT_ALL);
    }

    /**
     * Detects the language of a file.
     *
     * @param content the source text
     * @param filename the file name, can be null
     * @return the language, UNKNOWN when not recognized
     */
    public Language detectLanguage(final String content,
            final String filename) {
        return detector.detect(content, filename);
    }

    /**
     * Parses a file, detecting its language first.
     *
     * @param content the source text
     * @param filename the file name, can be null
     * @return the parse result, an empty UNKNOWN result when the language
     *         is not supported
     * @throws IllegalArgumentException if content is null
     */
    public ParseResult parseFile(final String content,
            final String filename) {
        return parseFile(content, filename, null);
    }

    /**
     * Parses a file as the given language.
     *
     * @param content the source text
     * @param filename the file name, can be null
     * @param language the language, null to detect it
     * @return the parse result, an empty UNKNOWN result when no parser is
     *         registered for the language
     * @throws IllegalArgumentException if content is null
     */
    public ParseResult parseFile(final String content,
            final String filename, final Language language) {

        Preconditions.requireNonNull(content, "Source content is required");

        final Language effective = language != null
                ? language : detector.detect(content, filename);
        final SourceParser parser = parsers.get(effective);

        if (parser == null) {
            LOG.debug("No parser for {} ({}), returning empty result",
                    filename, effective.tag());
            return ParseResult.unknown(content);
        }
        return parser.parse(content, filename);
    }

    /**
     * Resolves a relative import to one of the known paths.
     *
     * @param source the import specifier
     * @param currentFile the importing file path
     * @param knownPaths the repository paths as keys
     * @return the matching path, null when not relative or not found
     */
    public String resolveRelativeImport(final String source,
            final String currentFile, final Map<String, String> knownPaths) {
        Preconditions.requireNonNull(knownPaths, "Known paths are required");
        return resolver.resolveRelative(source, currentFile,
                knownPaths.keySet()).orElse(null);
    }

    /**
     * Resolves a module name to one of the known paths.
     *
     * @param module the module name or specifier
     * @param knownPaths the repository paths as keys
     * @param currentFile the importing file, can be null
     * @return the matching path, null when not found
     */
    public String resolveModuleToFile(final String module,
            final Map<String, String> knownPaths, final String currentFile) {
        Preconditions.requireNonNull(knownPaths, "Known paths are required");
        return resolver.resolveModule(module, knownPaths.keySet(),
                currentFile).orElse(null);
    }

    /**
     * Returns the imports of a file whose bound names are never used.
     *
     * @param result the parse result
     * @return the unused imports in source order
     */
    public List<Import> findUnusedImports(final ParseResult result) {
        return analyzer.findUnusedImports(result);
    }

    /**
     * Returns the declarations of a file never referenced in it, using
     * the configured default policy.
     *
     * @param result the parse result
     * @return the unused declaration names
     */
    public List<String> findUnusedDeclarations(final ParseResult result) {
        return analyzer.findUnusedDeclarations(result, defaultPolicy);
    }

    /**
     * Returns the declarations of a file never referenced in it.
     *
     * @param result the parse result
     * @param policy decides which declarations may be reported
     * @return the unused declaration names
     */
    public List<String> findUnusedDeclarations(final ParseResult result,
            final UnusedDeclarationPolicy policy) {
        return analyzer.findUnusedDeclarations(result, policy);
    }

    /**
     * Parses every file and links each import to the file it resolves to.
     *
     * <p>Relative imports are resolved against the importing file, bare
     * modules by suffix. Bare modules that match no file are external
     * packages and are ignored, while relative imports that match nothing
     * are recorded as unresolved.</p>
     *
     * @param filesByPath the file contents keyed by repository path
     * @return the import graph
     * @throws IllegalArgumentException if the map or a content is null
     */
    public ImportGraph buildImportGraph(
            final Map<String, String> filesByPath) {

        Preconditions.requireNonNull(filesByPath, "Files are required");

        final ImportGraph graph = new ImportGraph();
        for (final Map.Entry<String, String> file : filesByPath.entrySet()) {
            graph.addFile(file.getKey(),
                    parseFile(file.getValue(), file.getKey()));
        }

        final Set<String> knownPaths = filesByPath.keySet();
        for (final String path : graph.paths()) {
            for (final Import found : graph.parseResult(path).imports()) {
                final Optional<String> target = found.isRelative()
                        ? resolver.resolveRelative(found.source(), path,
                                knownPaths)
                        : resolver.resolveModule(found.source(), knownPaths,
                                path);
                if (target.isPresent()) {
                    graph.addDependency(path, target.get());
                } else if (found.isRelative()) {
                    graph.addUnresolved(path, found);
                }
            }
        }

        LOG.info("Import graph built: {} files, {} edges, {} files with"
                        + " unresolved imports", graph.fileCount(),
                graph.edgeCount(), graph.filesWithUnresolvedImports().size());

        return graph;
    }

}
