package co.fanki.sourceparsing.analysis.domain.python;

import co.fanki.sourceparsing.analysis.domain.Declaration;
import co.fanki.sourceparsing.analysis.domain.DeclarationKind;
import co.fanki.sourceparsing.analysis.domain.IdentifierReference;
import co.fanki.sourceparsing.analysis.domain.Import;
import co.fanki.sourceparsing.analysis.domain.ImportKind;
import co.fanki.sourceparsing.analysis.domain.ImportedName;
import co.fanki.sourceparsing.analysis.domain.Language;
import co.fanki.sourceparsing.analysis.domain.ParseResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented recovery for Python modules without a syntax tree.
 *
 * <p>Used when the module has a syntax error or the embedded runtime is
 * not available. It finds line-anchored {@code import}, {@code from ...
 * import}, {@code def}, {@code async def} and {@code class} statements,
 * imports also after a semicolon, and collects the remaining words as
 * references. The result always reports an invalid syntax with exactly one
 * diagnostic.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PythonRegexFallback {

    private static final Pattern IMPORT_PATTERN = Pattern.compile(
            "^\\s*import\\s+(.+)$");

    private static final Pattern FROM_PATTERN = Pattern.compile(
            "^\\s*from\\s+(\\.+[\\w.]*|[\\w.]+)\\s+import\\s+(.+)$");

    private static final Pattern DEF_PATTERN = Pattern.compile(
            "^(async\\s+)?def\\s+([A-Za-z_]\\w*)\\s*\\(");

    private static final Pattern CLASS_PATTERN = Pattern.compile(
            "^class\\s+([A-Za-z_]\\w*)");

    private static final Pattern ALIAS_PATTERN = Pattern.compile(
            "^([\\w.*]+)(?:\\s+as\\s+(\\w+))?$");

    private static final Pattern STRING_PATTERN = Pattern.compile(
            "'[^'\\n]*'|\"[^\"\\n]*\"");

    private static final Pattern WORD_PATTERN = Pattern.compile(
            "(?<![\\w.])[A-Za-z_]\\w*");

    private static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async",
            "await", "break", "class", "continue", "def", "del", "elif",
            "else", "except", "finally", "for", "from", "global", "if",
            "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass",
            "raise", "return", "try", "while", "with", "yield");

    private PythonRegexFallback() {
        // Utility class, not instantiable
    }

    /**
     * Recovers what a line scan can find in a module.
     *
     * @param content the module source
     * @param diagnostic the single error explaining why no syntax tree was
     *        available
     * @return a Python result with syntaxValid false
     */
    public static ParseResult parse(final String content,
            final String diagnostic) {

        final String[] lines = content.split("\r?\n", -1);
        final List<Import> imports = new ArrayList<>();
        final Map<String, Declaration> declarations = new LinkedHashMap<>();
        final List<IdentifierReference> identifiers = new ArrayList<>();

        int index = 0;
        while (index < lines.length) {
            final int lineNumber = index + 1;
            final StringBuilder code = new StringBuilder(
                    stripComment(lines[index]));

            // import statements, blanked so the rest is scanned for words
            for (final int[] statement : statements(code.toString())) {
                final String text = code.substring(statement[0],
                        statement[1]);
                final int column = statement[0] + indentation(text) + 1;

                final Matcher from = FROM_PATTERN.matcher(text);
                final Matcher plain = IMPORT_PATTERN.matcher(text);
                if (from.matches()) {
                    final StringBuilder names = new StringBuilder(
                            from.group(2));
                    while (names.indexOf("(") >= 0 && names.indexOf(")") < 0
                            && index + 1 < lines.length) {
                        index++;
                        names.append(' ').append(stripComment(lines[index]));
                    }
                    imports.add(new Import(from.group(1),
                            aliases(names.toString()), lineNumber, column,
                            ImportKind.FROM_IMPORT));
                } else if (plain.matches()) {
                    for (final ImportedName module : aliases(plain.group(1))) {
                        imports.add(new Import(module.name(), List.of(module),
                                lineNumber, column, ImportKind.PLAIN_IMPORT));
                    }
                } else {
                    continue;
                }
                for (int i = statement[0]; i < statement[1]; i++) {
                    code.setCharAt(i, ' ');
                }
            }

            final String line = code.toString();
            int skipFrom = -1;
            final Matcher def = DEF_PATTERN.matcher(line);
            final Matcher type = CLASS_PATTERN.matcher(line);
            if (def.find()) {
                final boolean async = def.group(1) != null;
                declarations.put(def.group(2), Declaration.of(def.group(2),
                        DeclarationKind.FUNCTION, lineNumber, 1,
                        async ? "async function" : "function"));
                skipFrom = def.start(2);
            } else if (type.find()) {
                declarations.put(type.group(1), Declaration.of(type.group(1),
                        DeclarationKind.CLASS, lineNumber, 1, "class"));
                skipFrom = type.start(1);
            }

            collectWords(line, lineNumber, skipFrom, identifiers);
            index++;
        }

        return new ParseResult(Language.PYTHON, imports, declarations,
                identifiers, false, List.of(diagnostic), content);
    }

    /**
     * Returns the [start, end) offsets of the simple statements of a line,
     * split on semicolons outside string literals.
     */
    private static List<int[]> statements(final String line) {
        final String code = blankStrings(line);
        final List<int[]> statements = new ArrayList<>();
        int start = 0;
        int semicolon = code.indexOf(';');
        while (semicolon >= 0) {
            statements.add(new int[] {start, semicolon});
            start = semicolon + 1;
            semicolon = code.indexOf(';', start);
        }
        statements.add(new int[] {start, line.length()});
        return statements;
    }

    /** Splits {@code a, b as c} (parentheses allowed) into names. */
    private static List<ImportedName> aliases(final String text) {
        final List<ImportedName> names = new ArrayList<>();
        final String cleaned = text.replace("(", " ").replace(")", " ")
                .replace("\\", " ");
        for (final String part : cleaned.split(",")) {
            final Matcher matcher = ALIAS_PATTERN.matcher(part.trim());
            if (matcher.matches()) {
                names.add(new ImportedName(matcher.group(1),
                        matcher.group(2)));
            }
        }
        return names;
    }

    private static void collectWords(final String line, final int lineNumber,
            final int declaredNameStart,
            final List<IdentifierReference> identifiers) {

        final String code = blankStrings(line);
        final Matcher word = WORD_PATTERN.matcher(code);
        while (word.find()) {
            if (word.start() == declaredNameStart
                    || KEYWORDS.contains(word.group())) {
                continue;
            }
            identifiers.add(new IdentifierReference(lineNumber,
                    word.group()));
        }
    }

    /** Replaces string literals with spaces, keeping offsets stable. */
    private static String blankStrings(final String line) {
        final Matcher matcher = STRING_PATTERN.matcher(line);
        final StringBuilder blanked = new StringBuilder(line);
        while (matcher.find()) {
            for (int i = matcher.start(); i < matcher.end(); i++) {
                blanked.setCharAt(i, ' ');
            }
        }
        return blanked.toString();
    }

    private static String stripComment(final String line) {
        final String code = blankStrings(line);
        final int hash = code.indexOf('#');
        return hash < 0 ? line : line.substring(0, hash);
    }

    private static int indentation(final String line) {
        int i = 0;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        return i;
    }

}
