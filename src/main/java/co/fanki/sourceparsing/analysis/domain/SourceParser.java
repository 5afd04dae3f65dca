package co.fanki.sourceparsing.analysis.domain;

import co.fanki.sourceparsing.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Abstract strategy turning the source text of one file into a
 * {@link ParseResult}.
 *
 * <p>Each language has its own way to find imports, declarations and
 * identifier references. Subclasses implement {@link #doParse} while this
 * class provides the template method {@link #parse(String, String)} that
 * validates the input and reports what was found.</p>
 *
 * <p>Implementations must be stateless: a parse call depends only on its
 * arguments, so one instance can serve many threads at once. Supporting a
 * new language means writing one subclass and registering it.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public abstract class SourceParser {

    private static final Logger LOG = LoggerFactory.getLogger(
            SourceParser.class);

    /**
     * Returns the languages this parser can produce results for.
     *
     * @return the supported languages, never empty
     */
    public abstract Set<Language> languages();

    /**
     * Parses the given content.
     *
     * <p>Malformed content must never raise: implementations degrade to
     * whatever partial information they can recover.</p>
     *
     * @param content the source text, never null
     * @param filename the file name, can be null
     * @return the parse result
     */
    protected abstract ParseResult doParse(String content, String filename);

    /**
     * Parses one file.
     *
     * @param content the source text
     * @param filename the file name or repository path, can be null
     * @return the parse result, never null
     * @throws IllegalArgumentException if content is null
     */
    public ParseResult parse(final String content, final String filename) {
        Preconditions.requireNonNull(content, "Source content is required");

        final ParseResult result = doParse(content, filename);

        LOG.debug("Parsed {} as {}: {} imports, {} declarations,"
                        + " {} identifier references",
                filename == null ? "<unnamed>" : filename,
                result.language().tag(), result.imports().size(),
                result.declarations().size(), result.identifiers().size());

        return result;
    }

}
