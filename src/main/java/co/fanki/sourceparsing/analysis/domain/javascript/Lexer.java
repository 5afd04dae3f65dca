package co.fanki.sourceparsing.analysis.domain.javascript;

import co.fanki.sourceparsing.shared.Preconditions;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Hand-written scanner turning JavaScript or TypeScript source into a flat
 * list of {@link Token}s.
 *
 * <p>The scanner knows nothing about grammar. It makes a single forward
 * pass and never fails: an unterminated string, comment or template simply
 * runs to the end of the input, so callers can still extract what is
 * there from a broken file.</p>
 *
 * <p>Two decisions need context:</p>
 * <ul>
 *   <li>A {@code /} opens a regular expression unless the previous token
 *       is an identifier, a number, {@code )} or {@code ]}. The decision is
 *       taken before looking at what follows the slash. A regex that hits a
 *       newline before its closing slash degrades to a division
 *       operator.</li>
 *   <li>Inside a template literal, each {@code ${} starts an interpolation
 *       scanned like regular code until its matching {@code }}, so braces,
 *       strings and nested templates inside it cannot close the template.
 *       The whole template, interpolations included, is one
 *       {@link TokenKind#TEMPLATE} token.</li>
 * </ul>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Lexer {

    /** Multi-character operators, longest first. */
    private static final String[] OPERATORS = {
        ">>>=", "...", "===", "!==", "**=", "<<=", ">>=", ">>>", "&&=",
        "||=", "??=", "=>", "==", "!=", "<=", ">=", "&&", "||", "??", "?.",
        "++", "--", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "**",
        "<<", ">>"
    };

    private static final String SINGLE_OPERATORS = "+-*/%=!<>&|^~?";

    private static final String PUNCTUATION = "{}[](),;:.@";

    /** Marks a template body on the nesting stack. */
    private static final int TEMPLATE_BODY = -1;

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int pos;
    private int line = 1;
    private int lineStart;

    private Lexer(final String theSource) {
        this.source = theSource;
    }

    /**
     * Tokenizes a source text.
     *
     * @param source the source text, never null
     * @return the tokens in source order, possibly empty
     * @throws IllegalArgumentException if source is null
     */
    public static List<Token> tokenize(final String source) {
        Preconditions.requireNonNull(source, "Source is required");
        return new Lexer(source).scan();
    }

    /**
     * Extracts the expressions interpolated in a template literal.
     *
     * @param template the template token text, backticks included
     * @return each {@code ${...}} body in order with the number of lines
     *         between the template start and the body start
     */
    public static List<Interpolation> interpolations(final String template) {
        Preconditions.requireNonNull(template, "Template is required");
        final Lexer scanner = new Lexer(template);
        final List<Interpolation> result = new ArrayList<>();
        int i = template.startsWith("`") ? 1 : 0;
        while (i < template.length()) {
            final char c = template.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == '`') {
                break;
            } else if (c == '$' && scanner.charAt(i + 1) == '{') {
                final int bodyStart = i + 2;
                final int end = scanner.skipInterpolation(bodyStart);
                final boolean closed = end <= template.length()
                        && template.charAt(end - 1) == '}';
                final int bodyEnd = closed ? end - 1 : end;
                result.add(new Interpolation(
                        template.substring(bodyStart,
                                Math.max(bodyStart, bodyEnd)),
                        countNewlines(template, 0, bodyStart)));
                i = end;
            } else {
                i++;
            }
        }
        return result;
    }

    private List<Token> scan() {
        final int length = source.length();
        while (pos < length) {
            final char c = source.charAt(pos);
            final char next = charAt(pos + 1);

            if (Character.isWhitespace(c)) {
                advanceTo(pos + 1);
            } else if (c == '#' && pos == 0 && next == '!') {
                advanceTo(lineEnd(pos));
            } else if (c == '/' && next == '/') {
                advanceTo(lineEnd(pos));
            } else if (c == '/' && next == '*') {
                advanceTo(blockCommentEnd(pos + 2));
            } else if (c == '/') {
                scanSlash();
            } else if (c == '"' || c == '\'') {
                emit(TokenKind.STRING, skipString(pos));
            } else if (c == '`') {
                emit(TokenKind.TEMPLATE, skipTemplate(pos));
            } else if (isIdentifierStart(c)
                    || (c == '#' && isIdentifierStart(next))) {
                scanWord();
            } else if (Character.isDigit(c)
                    || (c == '.' && Character.isDigit(next))) {
                emit(TokenKind.NUMERIC, skipNumber(pos));
            } else if (c == '?' && next == '.'
                    && Character.isDigit(charAt(pos + 2))) {
                // a?.5:1 is a conditional, not an optional chain
                emit(TokenKind.OPERATOR, pos + 1);
            } else {
                scanSymbol(c);
            }
        }
        return tokens;
    }

    private void scanSymbol(final char c) {
        final int operatorLength = operatorLength(pos);
        if (operatorLength > 0) {
            emit(TokenKind.OPERATOR, pos + operatorLength);
        } else if (PUNCTUATION.indexOf(c) >= 0) {
            emit(TokenKind.PUNCTUATION, pos + 1);
        } else {
            advanceTo(pos + 1);
        }
    }

    private void scanSlash() {
        if (regexAllowed()) {
            final int end = skipRegex(pos);
            if (end > 0) {
                emit(TokenKind.REGEX, end);
                return;
            }
        }
        emit(TokenKind.OPERATOR, charAt(pos + 1) == '=' ? pos + 2 : pos + 1);
    }

    private void scanWord() {
        int end = pos + 1;
        while (end < source.length() && isIdentifierPart(source.charAt(end))) {
            end++;
        }
        final String word = source.substring(pos, end);
        emit(JavaScriptVocabulary.isKeyword(word)
                ? TokenKind.KEYWORD : TokenKind.IDENTIFIER, end);
    }

    /** Regex unless a value is in scope to be divided. */
    private boolean regexAllowed() {
        if (tokens.isEmpty()) {
            return true;
        }
        final Token previous = tokens.get(tokens.size() - 1);
        return switch (previous.kind()) {
            case IDENTIFIER, NUMERIC -> false;
            case PUNCTUATION -> !previous.text().equals(")")
                    && !previous.text().equals("]");
            case KEYWORD, STRING, TEMPLATE, REGEX, OPERATOR -> true;
        };
    }

    /**
     * Returns the end of the regex starting at the given slash, or -1 if it
     * reaches a line break or the end of input first.
     */
    private int skipRegex(final int start) {
        boolean inClass = false;
        int i = start + 1;
        while (i < source.length()) {
            final char c = source.charAt(i);
            if (c == '\n' || c == '\r') {
                return -1;
            }
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '[') {
                inClass = true;
            } else if (c == ']') {
                inClass = false;
            } else if (c == '/' && !inClass) {
                i++;
                while (i < source.length()
                        && isIdentifierPart(source.charAt(i))) {
                    i++;
                }
                return i;
            }
            i++;
        }
        return -1;
    }

    private int skipString(final int start) {
        final char quote = source.charAt(start);
        int i = start + 1;
        while (i < source.length()) {
            final char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == quote) {
                return i + 1;
            } else {
                i++;
            }
        }
        return source.length();
    }

    private int skipTemplate(final int start) {
        return skipNested(start + 1, TEMPLATE_BODY);
    }

    /**
     * Skips the body of a {@code ${...}} starting right after the opening
     * brace and returns the index after its matching closing brace.
     */
    private int skipInterpolation(final int start) {
        return skipNested(start, 1);
    }

    /**
     * Skips nested templates and interpolations without recursion.
     *
     * <p>Each stack entry is either {@link #TEMPLATE_BODY} or the brace
     * depth of an open interpolation. Returns the index after the construct
     * the scan started in, or the end of input if it never closes.</p>
     */
    private int skipNested(final int start, final int outermost) {
        final Deque<Integer> open = new ArrayDeque<>();
        open.push(outermost);
        int i = start;
        char previous = '(';

        while (i < source.length()) {
            final char c = source.charAt(i);
            final char next = charAt(i + 1);

            if (open.peek() == TEMPLATE_BODY) {
                if (c == '\\') {
                    i += 2;
                } else if (c == '`') {
                    open.pop();
                    i++;
                    if (open.isEmpty()) {
                        return i;
                    }
                    previous = '`';
                } else if (c == '$' && next == '{') {
                    open.push(1);
                    i += 2;
                    previous = '(';
                } else {
                    i++;
                }
                continue;
            }

            if (c == '"' || c == '\'') {
                i = skipString(i);
                previous = '"';
                continue;
            }
            if (c == '`') {
                open.push(TEMPLATE_BODY);
                i++;
                continue;
            }
            if (c == '/' && next == '/') {
                i = lineEnd(i);
                continue;
            }
            if (c == '/' && next == '*') {
                i = blockCommentEnd(i + 2);
                continue;
            }
            if (c == '/' && !isIdentifierPart(previous)
                    && previous != ')' && previous != ']') {
                final int end = skipRegex(i);
                if (end > 0) {
                    i = end;
                    previous = '/';
                    continue;
                }
            }
            if (c == '{') {
                open.push(open.pop() + 1);
            } else if (c == '}') {
                final int depth = open.pop() - 1;
                if (depth > 0) {
                    open.push(depth);
                } else if (open.isEmpty()) {
                    return i + 1;
                }
            }
            if (!Character.isWhitespace(c)) {
                previous = c;
            }
            i++;
        }
        return source.length();
    }

    private int skipNumber(final int start) {
        int i = start;
        if (source.charAt(i) == '0' && "xXoObB".indexOf(charAt(i + 1)) >= 0) {
            i += 2;
            while (i < source.length()
                    && (Character.digit(source.charAt(i), 16) >= 0
                    || source.charAt(i) == '_')) {
                i++;
            }
        } else {
            i = skipDigits(i);
            if (charAt(i) == '.') {
                i = skipDigits(i + 1);
            }
            if ((charAt(i) == 'e' || charAt(i) == 'E')
                    && (Character.isDigit(charAt(i + 1))
                    || ((charAt(i + 1) == '+' || charAt(i + 1) == '-')
                    && Character.isDigit(charAt(i + 2))))) {
                i = skipDigits(i + 2);
            }
        }
        if (charAt(i) == 'n') {
            i++;
        }
        return i;
    }

    private int skipDigits(final int start) {
        int i = start;
        while (i < source.length()
                && (Character.isDigit(source.charAt(i))
                || source.charAt(i) == '_')) {
            i++;
        }
        return i;
    }

    /** Returns the length of the operator at the given index, 0 if none. */
    private int operatorLength(final int start) {
        for (final String operator : OPERATORS) {
            if (source.startsWith(operator, start)) {
                return operator.length();
            }
        }
        return SINGLE_OPERATORS.indexOf(source.charAt(start)) >= 0 ? 1 : 0;
    }

    private int lineEnd(final int start) {
        final int newline = source.indexOf('\n', start);
        return newline < 0 ? source.length() : newline;
    }

    private int blockCommentEnd(final int start) {
        final int close = source.indexOf("*/", start);
        return close < 0 ? source.length() : close + 2;
    }

    private void emit(final TokenKind kind, final int end) {
        final int stop = Math.min(end, source.length());
        tokens.add(new Token(kind, source.substring(pos, stop), line,
                pos - lineStart + 1));
        advanceTo(stop);
    }

    /** Moves to the given index, keeping line bookkeeping in sync. */
    private void advanceTo(final int end) {
        final int stop = Math.min(end, source.length());
        for (int i = pos; i < stop; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        pos = stop;
    }

    private char charAt(final int index) {
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private static int countNewlines(final String text, final int from,
            final int to) {
        int count = 0;
        for (int i = from; i < to && i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }

    private static boolean isIdentifierStart(final char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(final char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    /**
     * An expression interpolated inside a template literal.
     *
     * @param expression the source text between {@code ${} and {@code }}
     * @param lineOffset the number of line breaks between the start of the
     *        template and the start of the expression
     */
    public record Interpolation(String expression, int lineOffset) {
    }

}
