package co.fanki.sourceparsing.analysis.domain;

/**
 * A free identifier used in load position.
 *
 * @param line the 1-based line of the reference
 * @param name the referenced name
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record IdentifierReference(int line, String name) {
}
