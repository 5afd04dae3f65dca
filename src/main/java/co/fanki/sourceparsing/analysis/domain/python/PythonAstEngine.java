package co.fanki.sourceparsing.analysis.domain.python;

import co.fanki.sourceparsing.analysis.domain.Declaration;
import co.fanki.sourceparsing.analysis.domain.DeclarationKind;
import co.fanki.sourceparsing.analysis.domain.IdentifierReference;
import co.fanki.sourceparsing.analysis.domain.Import;
import co.fanki.sourceparsing.analysis.domain.ImportKind;
import co.fanki.sourceparsing.analysis.domain.ImportedName;
import co.fanki.sourceparsing.shared.Preconditions;
import co.fanki.sourceparsing.shared.SourceParsingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs Python's own {@code ast} module inside GraalPy.
 *
 * <p>Loads the analyzer script from the classpath and evaluates it in
 * polyglot contexts that share one {@link Engine}, so the parsed script
 * and the interpreter's warmed-up code are reused across contexts. A
 * context is not thread-safe: each call borrows an idle context from a
 * lock-free pool, or creates one, and returns it when done. The answer is
 * a JSON document decoded with Jackson.</p>
 *
 * <p>Syntax errors in the analyzed source are data, reported through
 * {@link PythonAnalysis#syntaxError()}. Only failures of the runtime
 * itself raise {@link SourceParsingException}. Call {@link #close()} when
 * done to release the engine and every pooled context.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PythonAstEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(
            PythonAstEngine.class);

    private static final String SCRIPT_RESOURCE = "python/ast_analyzer.py";

    private static final String ANALYZE_FUNCTION = "analyze";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Engine engine;
    private final Source script;
    private final Queue<Interpreter> idle = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Creates a new engine, loading the analyzer script from the classpath
     * and starting a first context so a broken runtime fails here rather
     * than on the first parse.
     *
     * @throws IOException if the script resource cannot be loaded
     * @throws SourceParsingException if the Python runtime cannot start
     */
    public PythonAstEngine() throws IOException {
        final String code = loadScriptFromClasspath();
        this.script = Source.newBuilder("python", code, "ast_analyzer.py")
                .build();
        try {
            this.engine = Engine.newBuilder("python")
                    .option("engine.WarnInterpreterOnly", "false")
                    .build();
        } catch (final PolyglotException | IllegalArgumentException e) {
            throw new SourceParsingException(
                    "Cannot start the Python runtime: " + e.getMessage(),
                    SourceParsingException.PYTHON_ENGINE_ERROR, e);
        }

        try {
            idle.add(createInterpreter());
        } catch (final SourceParsingException e) {
            engine.close();
            throw e;
        }

        LOG.info("GraalPy analyzer started ({} bytes of script)",
                code.length());
    }

    /**
     * Analyzes one Python module.
     *
     * @param content the module source
     * @return the analysis, carrying a syntax error when the module does
     *         not parse
     * @throws SourceParsingException if the engine is closed or the Python
     *         runtime fails
     */
    public PythonAnalysis analyze(final String content) {
        Preconditions.requireNonNull(content, "Source content is required");
        if (closed.get()) {
            throw new SourceParsingException("Python engine is closed",
                    SourceParsingException.PYTHON_ENGINE_ERROR);
        }

        final Interpreter interpreter = borrow();
        boolean healthy = true;
        try {
            final Value result = interpreter.analyze().execute(content);
            return decode(result.asString());
        } catch (final PolyglotException | IllegalStateException
                | ClassCastException e) {
            healthy = false;
            throw new SourceParsingException(
                    "Python analyzer failed: " + e.getMessage(),
                    SourceParsingException.PYTHON_ENGINE_ERROR, e);
        } catch (final IOException e) {
            throw new SourceParsingException(
                    "Unreadable Python analyzer output",
                    SourceParsingException.PYTHON_ENGINE_ERROR, e);
        } finally {
            release(interpreter, healthy);
        }
    }

    /** {@inheritDoc} */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        drain();
        engine.close();
        LOG.info("GraalPy analyzer closed");
    }

    private Interpreter borrow() {
        final Interpreter pooled = idle.poll();
        return pooled != null ? pooled : createInterpreter();
    }

    private void release(final Interpreter interpreter,
            final boolean healthy) {
        if (!healthy) {
            interpreter.context().close();
            return;
        }
        idle.offer(interpreter);
        if (closed.get()) {
            drain();
        }
    }

    private void drain() {
        Interpreter interpreter;
        while ((interpreter = idle.poll()) != null) {
            interpreter.context().close();
        }
    }

    /**
     * Creates a context bound to the shared engine, with the analyzer
     * script evaluated in it.
     */
    private Interpreter createInterpreter() {
        final Context context;
        try {
            context = Context.newBuilder("python")
                    .engine(engine)
                    .build();
        } catch (final PolyglotException | IllegalArgumentException e) {
            throw new SourceParsingException(
                    "Cannot create a Python context: " + e.getMessage(),
                    SourceParsingException.PYTHON_ENGINE_ERROR, e);
        }

        try {
            context.eval(script);
            final Value analyze = context.getBindings("python")
                    .getMember(ANALYZE_FUNCTION);
            if (analyze == null || !analyze.canExecute()) {
                throw new IllegalStateException(
                        ANALYZE_FUNCTION + " function not found in script");
            }
            return new Interpreter(context, analyze);
        } catch (final PolyglotException | IllegalStateException e) {
            context.close();
            throw new SourceParsingException(
                    "Cannot load the Python analyzer: " + e.getMessage(),
                    SourceParsingException.PYTHON_ENGINE_ERROR, e);
        }
    }

    /**
     * Decodes the JSON answer of the analyzer script.
     */
    private static PythonAnalysis decode(final String json)
            throws IOException {

        final JsonNode node = MAPPER.readTree(json);

        final JsonNode syntaxError = node.get("syntaxError");
        if (syntaxError != null && !syntaxError.isNull()) {
            return PythonAnalysis.syntaxError(syntaxError.asText());
        }

        final List<Import> imports = new ArrayList<>();
        for (final JsonNode importNode : node.get("imports")) {
            final List<ImportedName> names = new ArrayList<>();
            for (final JsonNode nameNode : importNode.get("names")) {
                names.add(new ImportedName(nameNode.get(0).asText(),
                        nameNode.get(1).isNull()
                                ? null : nameNode.get(1).asText()));
            }
            imports.add(new Import(
                    importNode.get("source").asText(),
                    names,
                    importNode.get("line").asInt(),
                    importNode.get("column").asInt(),
                    "import".equals(importNode.get("kind").asText())
                            ? ImportKind.PLAIN_IMPORT
                            : ImportKind.FROM_IMPORT));
        }

        final Map<String, Declaration> declarations = new LinkedHashMap<>();
        for (final JsonNode declarationNode : node.get("declarations")) {
            final Declaration declaration = new Declaration(
                    declarationNode.get("name").asText(),
                    declarationKind(declarationNode.get("kind").asText()),
                    declarationNode.get("line").asInt(),
                    declarationNode.get("column").asInt(),
                    declarationNode.get("descriptor").asText(),
                    declarationNode.get("signature").asText(),
                    declarationNode.get("exported").asBoolean());
            declarations.put(declaration.name(), declaration);
        }

        final List<IdentifierReference> identifiers = new ArrayList<>();
        for (final JsonNode reference : node.get("identifiers")) {
            identifiers.add(new IdentifierReference(reference.get(0).asInt(),
                    reference.get(1).asText()));
        }

        return new PythonAnalysis(null, imports, declarations, identifiers);
    }

    private static DeclarationKind declarationKind(final String kind) {
        return switch (kind) {
            case "function" -> DeclarationKind.FUNCTION;
            case "class" -> DeclarationKind.CLASS;
            default -> DeclarationKind.VARIABLE;
        };
    }

    /**
     * Loads the analyzer script from the classpath.
     */
    private static String loadScriptFromClasspath() throws IOException {
        try (InputStream is = PythonAstEngine.class.getClassLoader()
                .getResourceAsStream(SCRIPT_RESOURCE)) {
            if (is == null) {
                throw new IOException(
                        "Analyzer script not found on classpath: "
                                + SCRIPT_RESOURCE);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /** A context and the analyzer function evaluated inside it. */
    private record Interpreter(Context context, Value analyze) {
    }

}
