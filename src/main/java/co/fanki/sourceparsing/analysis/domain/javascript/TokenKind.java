package co.fanki.sourceparsing.analysis.domain.javascript;

/**
 * Lexical categories produced by the {@link Lexer}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum TokenKind {

    IDENTIFIER,

    KEYWORD,

    /** Single or double quoted string literal, quotes included. */
    STRING,

    /** Whole template literal, backticks and interpolations included. */
    TEMPLATE,

    /** Regular expression literal, slashes and flags included. */
    REGEX,

    NUMERIC,

    OPERATOR,

    /** One of {@code { } [ ] ( ) , ; : . @}. */
    PUNCTUATION

}
