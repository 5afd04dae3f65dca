package co.fanki.sourceparsing.analysis.domain.javascript;

/**
 * A classified, positioned slice of JavaScript or TypeScript source.
 *
 * @param kind the lexical category
 * @param text the exact source text of the token
 * @param line the 1-based line where the token starts
 * @param column the 1-based column where the token starts
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Token(TokenKind kind, String text, int line, int column) {

    /**
     * Checks the kind and text of this token.
     *
     * @param theKind the expected kind
     * @param theText the expected text
     * @return true if both match
     */
    public boolean is(final TokenKind theKind, final String theText) {
        return kind == theKind && text.equals(theText);
    }

    /**
     * Checks if this token is the given keyword.
     *
     * @param keyword the keyword text
     * @return true if this is that keyword
     */
    public boolean isKeyword(final String keyword) {
        return is(TokenKind.KEYWORD, keyword);
    }

    /**
     * Checks if this token is the given word, reserved or not.
     *
     * <p>Contextual keywords like {@code as} or {@code type} are lexed as
     * identifiers, so they are matched through this method.</p>
     *
     * @param word the word text
     * @return true if this is a keyword or identifier with that text
     */
    public boolean isWord(final String word) {
        return (kind == TokenKind.KEYWORD || kind == TokenKind.IDENTIFIER)
                && text.equals(word);
    }

    /**
     * Checks if this token is the given punctuation character.
     *
     * @param punctuation the punctuation text
     * @return true if this is that punctuation
     */
    public boolean isPunctuation(final String punctuation) {
        return is(TokenKind.PUNCTUATION, punctuation);
    }

    /**
     * Checks if this token is the given operator.
     *
     * @param operator the operator text
     * @return true if this is that operator
     */
    public boolean isOperator(final String operator) {
        return is(TokenKind.OPERATOR, operator);
    }

    /**
     * Returns the value of a string literal without its quotes.
     *
     * <p>Escape sequences are kept as written.</p>
     *
     * @return the unquoted text, or the raw text for other kinds
     */
    public String unquoted() {
        if (kind != TokenKind.STRING || text.isEmpty()) {
            return text;
        }
        final char quote = text.charAt(0);
        final int end = text.length() > 1
                && text.charAt(text.length() - 1) == quote
                ? text.length() - 1 : text.length();
        return text.substring(1, end);
    }

}
