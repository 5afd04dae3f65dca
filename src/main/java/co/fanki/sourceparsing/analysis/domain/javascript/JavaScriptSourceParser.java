package co.fanki.sourceparsing.analysis.domain.javascript;

import co.fanki.sourceparsing.analysis.domain.Declaration;
import co.fanki.sourceparsing.analysis.domain.DeclarationKind;
import co.fanki.sourceparsing.analysis.domain.IdentifierReference;
import co.fanki.sourceparsing.analysis.domain.Import;
import co.fanki.sourceparsing.analysis.domain.ImportKind;
import co.fanki.sourceparsing.analysis.domain.ImportedName;
import co.fanki.sourceparsing.analysis.domain.Language;
import co.fanki.sourceparsing.analysis.domain.ParseResult;
import co.fanki.sourceparsing.analysis.domain.SourceParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.IntConsumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * JavaScript/TypeScript implementation of {@link SourceParser}.
 *
 * <p>Works on the token stream produced by the {@link Lexer}. Imports are
 * classified by the shape of the tokens following each {@code import}
 * keyword, CommonJS {@code require} calls are found both on tokens and with
 * a text-level scan that catches the calls the token pass cannot see.</p>
 *
 * <p>Declarations are only collected at brace depth zero, so names bound
 * inside functions and classes stay out of the model. Identifier references
 * skip import clauses, member names, object keys and names in declaring
 * position.</p>
 *
 * <p>The parser never fails on malformed input and always reports a valid
 * syntax: it is a heuristic, not a compiler front end.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class JavaScriptSourceParser extends SourceParser {

    private static final Logger LOG = LoggerFactory.getLogger(
            JavaScriptSourceParser.class);

    /** Matches CommonJS require calls with a literal specifier. */
    private static final Pattern REQUIRE_PATTERN = Pattern.compile(
            "require\\s*\\(\\s*['\"]([^'\"]+)['\"]\\s*\\)");

    /** Text markers that only appear in TypeScript. */
    private static final List<String> TYPESCRIPT_MARKERS = List.of(
            "interface ", ": string", ": number", ": boolean", "enum ",
            "declare ");

    /** Matches generic type usage like {@code Array<string>}. */
    private static final Pattern GENERIC_PATTERN = Pattern.compile(
            "\\b[A-Z][A-Za-z0-9_$]*<\\s*[A-Za-z_$][\\w$ ,.\\[\\]|<>]*>");

    /** Matches a type alias declaration at the start of a line. */
    private static final Pattern TYPE_ALIAS_PATTERN = Pattern.compile(
            "^\\s*(?:export\\s+)?type\\s+[A-Za-z_$][\\w$]*"
                    + "(?:<[^>\\n]*>)?\\s*=",
            Pattern.MULTILINE);

    /** Keywords that start a new statement after an implicit semicolon. */
    private static final Set<String> STATEMENT_KEYWORDS = Set.of(
            "const", "let", "var", "function", "class", "import", "export",
            "interface", "enum", "if", "for", "while", "do", "return",
            "switch", "try", "throw");

    /** Words that may sit between {@code export} and a declaration. */
    private static final Set<String> EXPORT_MODIFIERS = Set.of(
            "default", "declare", "async", "abstract", "const");

    /** Keywords that end an expression like a value does. */
    private static final Set<String> VALUE_KEYWORDS = Set.of(
            "this", "super", "true", "false");

    /** TypeScript parameter property modifiers. */
    private static final Set<String> PARAMETER_MODIFIERS = Set.of(
            "public", "private", "protected", "readonly");

    /** Deepest destructuring pattern or template interpolation walked. */
    private static final int MAX_NESTING = 64;

    /** {@inheritDoc} */
    @Override
    public Set<Language> languages() {
        return Set.of(Language.JAVASCRIPT, Language.TYPESCRIPT);
    }

    /** {@inheritDoc} */
    @Override
    protected ParseResult doParse(final String content,
            final String filename) {

        final List<Token> tokens = Lexer.tokenize(content);
        final Set<Integer> bindings = new HashSet<>();

        final List<Import> imports = findImports(tokens, content);
        final Map<String, Declaration> declarations =
                findDeclarations(tokens, bindings);
        final List<IdentifierReference> identifiers =
                findIdentifiers(tokens, bindings, 0, 0);

        return new ParseResult(dialect(content, filename), imports,
                declarations, identifiers, true, List.of(), content);
    }

    /**
     * Decides between JavaScript and TypeScript.
     *
     * <p>A JavaScript or TypeScript extension decides on its own. Without
     * one, any TypeScript marker in the content (type annotations,
     * interfaces, enums, ambient declarations, generics, type aliases)
     * selects TypeScript.</p>
     *
     * @param content the source text
     * @param filename the file name, can be null
     * @return JAVASCRIPT or TYPESCRIPT
     */
    public Language dialect(final String content, final String filename) {
        final Optional<Language> byExtension = Language.fromFilename(filename)
                .filter(Language::isJavaScriptFamily);
        if (byExtension.isPresent()) {
            return byExtension.get();
        }
        for (final String marker : TYPESCRIPT_MARKERS) {
            if (content.contains(marker)) {
                return Language.TYPESCRIPT;
            }
        }
        if (GENERIC_PATTERN.matcher(content).find()
                || TYPE_ALIAS_PATTERN.matcher(content).find()) {
            return Language.TYPESCRIPT;
        }
        return Language.JAVASCRIPT;
    }

    // -- Imports --

    private List<Import> findImports(final List<Token> tokens,
            final String content) {

        final List<Import> imports = new ArrayList<>();

        for (int i = 0; i < tokens.size(); i++) {
            final Token token = tokens.get(i);
            if (token.isKeyword("import")) {
                final Import found = importAt(tokens, i);
                if (found != null) {
                    imports.add(found);
                }
            } else if (isRequireCall(tokens, i)) {
                imports.add(new Import(tokens.get(i + 2).unquoted(),
                        List.of(), token.line(), token.column(),
                        ImportKind.COMMONJS_REQUIRE));
            }
        }

        addMissedRequires(content, imports);
        return imports;
    }

    /**
     * Classifies the import statement or expression starting at the given
     * {@code import} keyword, null when it is not an import.
     */
    private Import importAt(final List<Token> tokens, final int start) {
        final Token keyword = tokens.get(start);
        int j = start + 1;
        Token next = at(tokens, j);

        if (next == null || next.isPunctuation(".")) {
            return null;
        }
        if (next.isPunctuation("(")) {
            final Token argument = at(tokens, j + 1);
            return argument != null && argument.kind() == TokenKind.STRING
                    ? newImport(argument.unquoted(), List.of(), keyword,
                            ImportKind.DYNAMIC)
                    : null;
        }
        if (next.kind() == TokenKind.STRING) {
            return newImport(next.unquoted(), List.of(), keyword,
                    ImportKind.SIDE_EFFECT);
        }

        // import type {...} from '...', unless "type" is the default name
        if (next.isWord("type") && !isWordAt(tokens, j + 1, "from")
                && !isOperatorAt(tokens, j + 1, "=")
                && !isPunctuationAt(tokens, j + 1, ",")) {
            j++;
            next = at(tokens, j);
            if (next == null) {
                return null;
            }
        }

        final List<ImportedName> names = new ArrayList<>();
        ImportKind kind = null;

        if (next.kind() == TokenKind.IDENTIFIER) {
            names.add(ImportedName.of(next.text()));
            kind = ImportKind.DEFAULT;
            j++;
            if (isPunctuationAt(tokens, j, ",")) {
                j++;
            }
        }

        final Token clause = at(tokens, j);
        if (clause != null && clause.isOperator("*")) {
            final Token alias = at(tokens, j + 2);
            if (isWordAt(tokens, j + 1, "as") && alias != null
                    && alias.kind() == TokenKind.IDENTIFIER) {
                names.add(new ImportedName(ImportedName.STAR, alias.text()));
                kind = ImportKind.NAMESPACE;
                j += 3;
            }
        } else if (clause != null && clause.isPunctuation("{")) {
            j = namedImports(tokens, j, names);
            kind = ImportKind.NAMED;
        }

        if (kind == null) {
            return null;
        }

        final Token source = sourceAfterFrom(tokens, j);
        return source == null
                ? null
                : newImport(source.unquoted(), names, keyword, kind);
    }

    /**
     * Collects the entries of a {@code { ... }} import clause and returns
     * the index after its closing brace.
     */
    private int namedImports(final List<Token> tokens, final int open,
            final List<ImportedName> names) {

        int k = open + 1;
        while (k < tokens.size()) {
            final Token token = tokens.get(k);
            if (token.isPunctuation("}")) {
                return k + 1;
            }
            if (token.isPunctuation(";")) {
                return k;
            }
            if (token.isWord("type") && isName(at(tokens, k + 1))
                    && !isWordAt(tokens, k + 1, "as")) {
                k++;
                continue;
            }
            final Token alias = at(tokens, k + 2);
            if (isName(token) && isWordAt(tokens, k + 1, "as")
                    && isName(alias)) {
                names.add(new ImportedName(token.text(), alias.text()));
                k += 3;
                continue;
            }
            if (token.kind() == TokenKind.IDENTIFIER) {
                names.add(ImportedName.of(token.text()));
            }
            k++;
        }
        return k;
    }

    private Token sourceAfterFrom(final List<Token> tokens, final int start) {
        for (int k = start; k < tokens.size(); k++) {
            final Token token = tokens.get(k);
            if (token.isPunctuation(";") || token.isKeyword("import")) {
                return null;
            }
            if (token.isWord("from")) {
                final Token source = at(tokens, k + 1);
                return source != null && source.kind() == TokenKind.STRING
                        ? source : null;
            }
        }
        return null;
    }

    private boolean isRequireCall(final List<Token> tokens, final int i) {
        final Token argument = at(tokens, i + 2);
        return tokens.get(i).is(TokenKind.IDENTIFIER, "require")
                && isPunctuationAt(tokens, i + 1, "(")
                && argument != null && argument.kind() == TokenKind.STRING;
    }

    /**
     * Adds the require calls that only a text-level scan finds, skipping
     * every specifier already recorded as a require.
     */
    private void addMissedRequires(final String content,
            final List<Import> imports) {

        final Set<String> seen = new HashSet<>();
        for (final Import found : imports) {
            seen.add(found.kind() + ":" + found.source());
        }

        int recovered = 0;
        final Matcher matcher = REQUIRE_PATTERN.matcher(content);
        while (matcher.find()) {
            final String source = matcher.group(1);
            if (seen.add(ImportKind.COMMONJS_REQUIRE + ":" + source)) {
                imports.add(new Import(source, List.of(),
                        lineOf(content, matcher.start()),
                        columnOf(content, matcher.start()),
                        ImportKind.COMMONJS_REQUIRE));
                recovered++;
            }
        }

        if (recovered > 0) {
            LOG.debug("Recovered {} require calls missed by the token scan",
                    recovered);
        }
    }

    private static Import newImport(final String source,
            final List<ImportedName> names, final Token keyword,
            final ImportKind kind) {
        return new Import(source, names, keyword.line(), keyword.column(),
                kind);
    }

    // -- Declarations --

    private Map<String, Declaration> findDeclarations(
            final List<Token> tokens, final Set<Integer> bindings) {

        final Map<String, Declaration> declarations = new LinkedHashMap<>();
        int depth = 0;
        int i = 0;

        while (i < tokens.size()) {
            final Token token = tokens.get(i);
            if (token.isPunctuation("{")) {
                depth++;
                i++;
            } else if (token.isPunctuation("}")) {
                depth = Math.max(0, depth - 1);
                i++;
            } else if (depth > 0 || !startsDeclaration(token)) {
                i++;
            } else {
                i = declarationAt(tokens, i, declarations, bindings);
            }
        }

        return declarations;
    }

    /** Reserved words, and "type" which only declares before a name. */
    private static boolean startsDeclaration(final Token token) {
        return token.kind() == TokenKind.KEYWORD
                || token.is(TokenKind.IDENTIFIER, "type");
    }

    /**
     * Records the declaration introduced by the keyword at the given index
     * and returns the index to resume scanning from.
     */
    private int declarationAt(final List<Token> tokens, final int i,
            final Map<String, Declaration> declarations,
            final Set<Integer> bindings) {

        final Token keyword = tokens.get(i);
        final boolean exported = isExported(tokens, i);

        return switch (keyword.text()) {
            case "const", "let", "var" -> isKeywordAt(tokens, i + 1, "enum")
                    ? i + 1
                    : variableDeclarators(tokens, i, exported, declarations,
                            bindings);
            case "function" -> functionDeclaration(tokens, i, exported,
                    declarations, bindings);
            case "class", "interface", "enum" -> {
                final Token name = at(tokens, i + 1);
                if (isDeclarableName(name)) {
                    record(declarations, bindings, i + 1, new Declaration(
                            name.text(), namedKind(keyword.text()),
                            name.line(), name.column(),
                            describe(tokens, i), "", exported));
                }
                yield i + 1;
            }
            case "type" -> {
                final Token name = at(tokens, i + 1);
                if (isDeclarableName(name) && isTypeAliasBody(tokens, i + 2)) {
                    record(declarations, bindings, i + 1, new Declaration(
                            name.text(), DeclarationKind.TYPE_ALIAS,
                            name.line(), name.column(), "type", "",
                            exported));
                }
                yield i + 1;
            }
            default -> i + 1;
        };
    }

    private static DeclarationKind namedKind(final String keyword) {
        return switch (keyword) {
            case "interface" -> DeclarationKind.INTERFACE;
            case "enum" -> DeclarationKind.ENUM;
            default -> DeclarationKind.CLASS;
        };
    }

    /** Prefixes abstract classes and const enums. */
    private static String describe(final List<Token> tokens, final int i) {
        final String keyword = tokens.get(i).text();
        if (keyword.equals("class") && isWordAt(tokens, i - 1, "abstract")) {
            return "abstract class";
        }
        if (keyword.equals("enum") && isKeywordAt(tokens, i - 1, "const")) {
            return "const enum";
        }
        return keyword;
    }

    private int functionDeclaration(final List<Token> tokens, final int i,
            final boolean exported,
            final Map<String, Declaration> declarations,
            final Set<Integer> bindings) {

        int j = i + 1;
        if (isOperatorAt(tokens, j, "*")) {
            j++;
        }
        final Token name = at(tokens, j);
        if (isDeclarableName(name)) {
            final String descriptor = isWordAt(tokens, i - 1, "async")
                    ? "async function" : "function";
            record(declarations, bindings, j, new Declaration(name.text(),
                    DeclarationKind.FUNCTION, name.line(), name.column(),
                    descriptor, signature(tokens, j, descriptor), exported));
        }
        return j + 1;
    }

    /**
     * Records every name bound by a {@code const}, {@code let} or
     * {@code var} statement, plain or destructured, and returns the index
     * after the last declarator.
     */
    private int variableDeclarators(final List<Token> tokens, final int i,
            final boolean exported,
            final Map<String, Declaration> declarations,
            final Set<Integer> bindings) {

        final String descriptor = tokens.get(i).text();
        final IntConsumer bind = index -> {
            final Token name = tokens.get(index);
            if (isDeclarableName(name)) {
                record(declarations, bindings, index, new Declaration(
                        name.text(), DeclarationKind.VARIABLE, name.line(),
                        name.column(), descriptor, "", exported));
            }
        };

        int j = i + 1;
        while (j < tokens.size()) {
            final Token target = tokens.get(j);
            if (target.kind() == TokenKind.IDENTIFIER) {
                bind.accept(j);
                j++;
            } else if (target.isPunctuation("{")
                    || target.isPunctuation("[")) {
                j = bindingPattern(tokens, j, bind, 0);
            } else {
                return j;
            }
            if (isOperatorAt(tokens, j, "!")) {
                j++;
            }
            if (isPunctuationAt(tokens, j, ":")) {
                j = skipTypeAnnotation(tokens, j + 1);
            }
            if (isOperatorAt(tokens, j, "=")) {
                j = skipExpression(tokens, j + 1);
            }
            if (!isPunctuationAt(tokens, j, ",")) {
                return j;
            }
            j++;
        }
        return j;
    }

    /**
     * Walks an object or array destructuring pattern, feeding the index of
     * every bound name to the binder. Object keys and default values are
     * not bound names. Returns the index after the closing bracket.
     */
    private int bindingPattern(final List<Token> tokens, final int open,
            final IntConsumer bind, final int nesting) {

        if (nesting >= MAX_NESTING) {
            return skipBalanced(tokens, open);
        }
        final boolean object = tokens.get(open).isPunctuation("{");
        final String close = object ? "}" : "]";
        int k = open + 1;

        while (k < tokens.size()) {
            final int elementStart = k;
            if (tokens.get(k).isPunctuation(close)) {
                return k + 1;
            }
            if (tokens.get(k).isPunctuation(",")) {
                k++;
                continue;
            }
            if (tokens.get(k).isOperator("...")) {
                k++;
            }
            final Token first = at(tokens, k);
            if (object && first != null && first.isPunctuation("[")) {
                k = skipBalanced(tokens, k);
                if (isPunctuationAt(tokens, k, ":")) {
                    k++;
                }
            } else if (object && first != null
                    && first.kind() != TokenKind.PUNCTUATION
                    && isPunctuationAt(tokens, k + 1, ":")) {
                k += 2;
            }

            final Token target = at(tokens, k);
            if (target == null) {
                return k;
            }
            if (target.isPunctuation("{") || target.isPunctuation("[")) {
                k = bindingPattern(tokens, k, bind, nesting + 1);
            } else if (target.kind() == TokenKind.IDENTIFIER) {
                bind.accept(k);
                k++;
            }
            if (isOperatorAt(tokens, k, "=")) {
                k++;
            }
            k = skipExpression(tokens, k);
            if (k == elementStart) {
                k++;
            }
        }
        return k;
    }

    private boolean isTypeAliasBody(final List<Token> tokens, final int j) {
        final Token token = at(tokens, j);
        if (token == null) {
            return false;
        }
        if (token.isOperator("=")) {
            return true;
        }
        if (!token.isOperator("<")) {
            return false;
        }
        int angle = 0;
        for (int k = j; k < tokens.size(); k++) {
            final Token current = tokens.get(k);
            if (current.isOperator("<")) {
                angle++;
            } else if (current.isOperator(">=")) {
                return angle == 1;
            } else if (isAngleClose(current)) {
                angle -= current.text().length();
                if (angle <= 0) {
                    return isOperatorAt(tokens, k + 1, "=");
                }
            } else if (current.isPunctuation(";")
                    || current.isPunctuation("{")) {
                return false;
            }
        }
        return false;
    }

    private static boolean isExported(final List<Token> tokens, final int i) {
        int k = i - 1;
        for (int step = 0; step < 3; step++) {
            final Token token = at(tokens, k);
            if (token == null) {
                return false;
            }
            if (token.isKeyword("export")) {
                return true;
            }
            if (!isName(token) || !EXPORT_MODIFIERS.contains(token.text())) {
                return false;
            }
            k--;
        }
        return false;
    }

    private static void record(final Map<String, Declaration> declarations,
            final Set<Integer> bindings, final int index,
            final Declaration declaration) {
        declarations.put(declaration.name(), declaration);
        bindings.add(index);
    }

    private static boolean isDeclarableName(final Token token) {
        return token != null && token.kind() == TokenKind.IDENTIFIER
                && !token.text().startsWith("#")
                && JavaScriptVocabulary.isUserName(token.text());
    }

    // -- Signatures --

    /**
     * Rebuilds a function signature keeping only parameter names and
     * simple, directly annotated type names.
     */
    private String signature(final List<Token> tokens, final int nameIndex,
            final String descriptor) {

        int open = nameIndex + 1;
        if (isOperatorAt(tokens, open, "<")) {
            open = skipAngles(tokens, open);
        }
        if (!isPunctuationAt(tokens, open, "(")) {
            return "";
        }
        final int close = skipBalanced(tokens, open) - 1;

        final List<String> parameters = new ArrayList<>();
        for (final List<Token> parameter : splitParameters(tokens, open + 1,
                close)) {
            final String rendered = renderParameter(parameter);
            if (!rendered.isEmpty()) {
                parameters.add(rendered);
            }
        }

        final StringBuilder signature = new StringBuilder()
                .append(descriptor).append(' ')
                .append(tokens.get(nameIndex).text())
                .append('(').append(String.join(", ", parameters))
                .append(')');

        final Token returnType = at(tokens, close + 2);
        final Token afterReturn = at(tokens, close + 3);
        if (isPunctuationAt(tokens, close + 1, ":")
                && isSimpleTypeName(returnType)
                && (afterReturn == null || afterReturn.isPunctuation("{")
                || afterReturn.isPunctuation(";"))) {
            signature.append(": ").append(returnType.text());
        }
        return signature.toString();
    }

    private List<List<Token>> splitParameters(final List<Token> tokens,
            final int start, final int end) {

        final List<List<Token>> parameters = new ArrayList<>();
        int depth = 0;
        int angle = 0;
        int parameterStart = start;

        for (int k = start; k < end && k < tokens.size(); k++) {
            final Token token = tokens.get(k);
            if (isOpening(token)) {
                depth++;
            } else if (isClosing(token)) {
                depth--;
            } else if (token.isOperator("<")) {
                angle++;
            } else if (isAngleClose(token)) {
                angle = Math.max(0, angle - token.text().length());
            } else if (depth == 0 && angle == 0 && token.isPunctuation(",")) {
                parameters.add(tokens.subList(parameterStart, k));
                parameterStart = k + 1;
            }
        }
        final int last = Math.min(end, tokens.size());
        if (parameterStart < last) {
            parameters.add(tokens.subList(parameterStart, last));
        }
        return parameters;
    }

    private String renderParameter(final List<Token> parameter) {
        int k = 0;
        while (k + 1 < parameter.size()
                && isName(parameter.get(k))
                && PARAMETER_MODIFIERS.contains(parameter.get(k).text())
                && isBindingStart(parameter.get(k + 1))) {
            k++;
        }
        String prefix = "";
        if (k < parameter.size() && parameter.get(k).isOperator("...")) {
            prefix = "...";
            k++;
        }
        if (k >= parameter.size()) {
            return "";
        }

        final Token first = parameter.get(k);
        String name;
        if (first.kind() == TokenKind.IDENTIFIER || first.isKeyword("this")) {
            name = first.text();
            k++;
        } else if (first.isPunctuation("{")) {
            name = "{...}";
            k = skipBalanced(parameter, k);
        } else if (first.isPunctuation("[")) {
            name = "[...]";
            k = skipBalanced(parameter, k);
        } else {
            return "";
        }

        if (k < parameter.size() && parameter.get(k).isOperator("?")) {
            name += "?";
            k++;
        }

        String type = "";
        if (k + 1 < parameter.size() && parameter.get(k).isPunctuation(":")) {
            final Token typeName = parameter.get(k + 1);
            final boolean direct = k + 2 == parameter.size()
                    || parameter.get(k + 2).isOperator("=");
            if (isSimpleTypeName(typeName) && direct) {
                type = ": " + typeName.text();
            }
        }
        return prefix + name + type;
    }

    private static boolean isSimpleTypeName(final Token token) {
        return token != null && (token.kind() == TokenKind.IDENTIFIER
                || token.isKeyword("void"));
    }

    // -- Identifier references --

    private List<IdentifierReference> findIdentifiers(
            final List<Token> tokens, final Set<Integer> bindings,
            final int lineOffset, final int nesting) {

        final List<IdentifierReference> references = new ArrayList<>();
        boolean inImportClause = false;

        for (int i = 0; i < tokens.size(); i++) {
            final Token token = tokens.get(i);

            if (token.isKeyword("import")
                    && !isPunctuationAt(tokens, i + 1, "(")
                    && !isPunctuationAt(tokens, i + 1, ".")) {
                inImportClause = true;
                continue;
            }
            if (inImportClause) {
                if (token.kind() == TokenKind.STRING
                        || token.isPunctuation(";")) {
                    inImportClause = false;
                }
                continue;
            }

            if (token.kind() == TokenKind.TEMPLATE && nesting < MAX_NESTING) {
                references.addAll(templateReferences(token, lineOffset,
                        nesting + 1));
            } else if (token.kind() == TokenKind.IDENTIFIER
                    && !bindings.contains(i) && isFreeReference(tokens, i)) {
                references.add(new IdentifierReference(
                        token.line() + lineOffset, token.text()));
            }
        }
        return references;
    }

    private List<IdentifierReference> templateReferences(final Token template,
            final int lineOffset, final int nesting) {

        final List<IdentifierReference> references = new ArrayList<>();
        for (final Lexer.Interpolation interpolation
                : Lexer.interpolations(template.text())) {
            final int offset = lineOffset + template.line() - 1
                    + interpolation.lineOffset();
            references.addAll(findIdentifiers(
                    Lexer.tokenize(interpolation.expression()), Set.of(),
                    offset, nesting));
        }
        return references;
    }

    private static boolean isFreeReference(final List<Token> tokens,
            final int i) {

        final String name = tokens.get(i).text();
        if (name.startsWith("#") || !JavaScriptVocabulary.isUserName(name)
                || isContextualKeyword(tokens, i)) {
            return false;
        }
        final Token previous = at(tokens, i - 1);
        if (previous == null) {
            return true;
        }
        if ((previous.kind() == TokenKind.KEYWORD
                || isContextualKeyword(tokens, i - 1))
                && (JavaScriptVocabulary.isDeclaring(previous.text())
                || previous.text().equals("as")
                || previous.text().equals("from"))) {
            return false;
        }
        if (previous.isPunctuation(".") || previous.isOperator("?.")) {
            return false;
        }
        // object literal and pattern keys
        return !((previous.isPunctuation("{") || previous.isPunctuation(","))
                && isPunctuationAt(tokens, i + 1, ":"));
    }

    /**
     * Checks if a contextual word acts as a keyword: it is followed on the
     * same line by a name, a string or an opening brace, as in
     * {@code type Id = ...}, {@code x as T} or {@code export * from 'm'}.
     * Used as a value ({@code type = 1}, {@code of(1)}) it is a name.
     */
    private static boolean isContextualKeyword(final List<Token> tokens,
            final int i) {

        final Token token = tokens.get(i);
        final Token next = at(tokens, i + 1);
        if (!JavaScriptVocabulary.isContextual(token.text()) || next == null
                || next.line() != token.line()) {
            return false;
        }
        return next.kind() == TokenKind.IDENTIFIER
                || next.kind() == TokenKind.KEYWORD
                || next.kind() == TokenKind.STRING
                || next.isPunctuation("{");
    }

    // -- Token navigation --

    /**
     * Returns the index where the expression starting at the given index
     * ends: a comma or semicolon at depth zero, an unmatched closing
     * bracket, or the start of a new statement on a following line.
     */
    private static int skipExpression(final List<Token> tokens,
            final int start) {

        int depth = 0;
        for (int k = start; k < tokens.size(); k++) {
            final Token token = tokens.get(k);
            if (depth == 0 && (token.isPunctuation(",")
                    || token.isPunctuation(";"))) {
                return k;
            }
            if (isOpening(token)) {
                depth++;
            } else if (isClosing(token)) {
                if (depth == 0) {
                    return k;
                }
                depth--;
            } else if (depth == 0 && k > start
                    && startsStatement(tokens, k)) {
                return k;
            }
        }
        return tokens.size();
    }

    /** Like {@link #skipExpression} but also stops at "=" and tracks angles. */
    private static int skipTypeAnnotation(final List<Token> tokens,
            final int start) {

        int depth = 0;
        int angle = 0;
        for (int k = start; k < tokens.size(); k++) {
            final Token token = tokens.get(k);
            if (depth == 0 && angle == 0 && (token.isOperator("=")
                    || token.isPunctuation(",")
                    || token.isPunctuation(";"))) {
                return k;
            }
            if (isOpening(token)) {
                depth++;
            } else if (isClosing(token)) {
                if (depth == 0) {
                    return k;
                }
                depth--;
            } else if (token.isOperator("<")) {
                angle++;
            } else if (isAngleClose(token)) {
                angle = Math.max(0, angle - token.text().length());
            } else if (depth == 0 && angle == 0 && k > start
                    && startsStatement(tokens, k)) {
                return k;
            }
        }
        return tokens.size();
    }

    /** Implicit semicolon: a value ends a line and a new statement begins. */
    private static boolean startsStatement(final List<Token> tokens,
            final int k) {

        final Token token = tokens.get(k);
        final Token previous = tokens.get(k - 1);
        if (token.line() <= previous.line() || !endsValue(previous)) {
            return false;
        }
        return token.kind() == TokenKind.IDENTIFIER
                || (token.kind() == TokenKind.KEYWORD
                && STATEMENT_KEYWORDS.contains(token.text()));
    }

    private static boolean endsValue(final Token token) {
        return switch (token.kind()) {
            case IDENTIFIER, NUMERIC, STRING, TEMPLATE, REGEX -> true;
            case PUNCTUATION -> token.text().equals(")")
                    || token.text().equals("]") || token.text().equals("}");
            case KEYWORD -> VALUE_KEYWORDS.contains(token.text());
            case OPERATOR -> false;
        };
    }

    /** Returns the index after the bracket matching the one at open. */
    private static int skipBalanced(final List<Token> tokens, final int open) {
        int depth = 0;
        for (int k = open; k < tokens.size(); k++) {
            final Token token = tokens.get(k);
            if (isOpening(token)) {
                depth++;
            } else if (isClosing(token)) {
                depth--;
                if (depth == 0) {
                    return k + 1;
                }
            }
        }
        return tokens.size();
    }

    /** Returns the index after the angle bracket matching the one at open. */
    private static int skipAngles(final List<Token> tokens, final int open) {
        int angle = 0;
        for (int k = open; k < tokens.size(); k++) {
            final Token token = tokens.get(k);
            if (token.isOperator("<")) {
                angle++;
            } else if (isAngleClose(token)) {
                angle -= token.text().length();
                if (angle <= 0) {
                    return k + 1;
                }
            }
        }
        return tokens.size();
    }

    private static boolean isOpening(final Token token) {
        return token.isPunctuation("(") || token.isPunctuation("[")
                || token.isPunctuation("{");
    }

    private static boolean isClosing(final Token token) {
        return token.isPunctuation(")") || token.isPunctuation("]")
                || token.isPunctuation("}");
    }

    private static boolean isAngleClose(final Token token) {
        return token.isOperator(">") || token.isOperator(">>")
                || token.isOperator(">>>");
    }

    private static boolean isBindingStart(final Token token) {
        return isName(token) || token.isPunctuation("{")
                || token.isPunctuation("[") || token.isOperator("...");
    }

    private static boolean isName(final Token token) {
        return token != null && (token.kind() == TokenKind.IDENTIFIER
                || token.kind() == TokenKind.KEYWORD);
    }

    private static Token at(final List<Token> tokens, final int index) {
        return index >= 0 && index < tokens.size() ? tokens.get(index) : null;
    }

    private static boolean isKeywordAt(final List<Token> tokens,
            final int index, final String keyword) {
        final Token token = at(tokens, index);
        return token != null && token.isKeyword(keyword);
    }

    private static boolean isWordAt(final List<Token> tokens,
            final int index, final String word) {
        final Token token = at(tokens, index);
        return token != null && token.isWord(word);
    }

    private static boolean isOperatorAt(final List<Token> tokens,
            final int index, final String operator) {
        final Token token = at(tokens, index);
        return token != null && token.isOperator(operator);
    }

    private static boolean isPunctuationAt(final List<Token> tokens,
            final int index, final String punctuation) {
        final Token token = at(tokens, index);
        return token != null && token.isPunctuation(punctuation);
    }

    private static int lineOf(final String content, final int offset) {
        int line = 1;
        for (int i = 0; i < offset; i++) {
            if (content.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    private static int columnOf(final String content, final int offset) {
        return offset - content.lastIndexOf('\n', offset - 1);
    }

}
