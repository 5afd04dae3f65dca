package co.fanki.sourceparsing.analysis.domain.javascript;

import java.util.Set;

/**
 * Reserved words, contextual keywords and well-known globals of JavaScript
 * and TypeScript.
 *
 * <p>Reserved words and globals are never recorded as declarations nor
 * counted as references to a file's own bindings. Contextual keywords are
 * ordinary names outside the positions that give them meaning.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class JavaScriptVocabulary {

    /** Reserved words, strict mode ones included. */
    private static final Set<String> KEYWORDS = Set.of(
            "break", "case", "catch", "class", "const", "continue",
            "debugger", "default", "delete", "do", "else", "export",
            "extends", "finally", "for", "function", "if", "import", "in",
            "instanceof", "new", "return", "super", "switch", "this",
            "throw", "try", "typeof", "var", "void", "while", "with",
            "yield", "let", "static", "enum", "await", "implements",
            "package", "protected", "interface", "private", "public",
            "true", "false");

    /**
     * Words with a meaning only in some positions. They are lexed as
     * identifiers and stay valid binding names.
     */
    private static final Set<String> CONTEXTUAL_WORDS = Set.of(
            "as", "from", "of", "type", "get", "set", "async", "module",
            "namespace", "declare", "readonly", "abstract");

    /** Built-in types and runtime globals. */
    private static final Set<String> BUILTINS = Set.of(
            "string", "number", "boolean", "symbol", "bigint", "undefined",
            "null", "object", "any", "unknown", "never", "Array", "Record",
            "Partial", "Required", "Readonly", "Pick", "Omit", "Exclude",
            "Extract", "NonNullable", "Parameters", "ReturnType",
            "InstanceType", "ThisParameterType", "OmitThisParameter",
            "ThisType", "Uppercase", "Lowercase", "Capitalize",
            "Uncapitalize", "Promise", "Map", "Set", "WeakMap", "WeakSet",
            "Date", "RegExp", "Error", "Function", "String", "Number",
            "Boolean", "Object", "Symbol", "console", "window", "document",
            "process", "Buffer", "Math", "JSON", "globalThis");

    /** Words that introduce a declaration name. */
    private static final Set<String> DECLARING_KEYWORDS = Set.of(
            "const", "let", "var", "function", "class", "interface", "type",
            "enum");

    private JavaScriptVocabulary() {
        // Utility class, not instantiable
    }

    /**
     * Checks if a word is reserved.
     *
     * @param word the word to check
     * @return true if the lexer classifies it as a keyword
     */
    public static boolean isKeyword(final String word) {
        return KEYWORDS.contains(word);
    }

    /**
     * Checks if a word is a contextual keyword like {@code as} or
     * {@code type}.
     *
     * @param word the word to check
     * @return true if the word only acts as a keyword in some positions
     */
    public static boolean isContextual(final String word) {
        return CONTEXTUAL_WORDS.contains(word);
    }

    /**
     * Checks if a name is a built-in type or global.
     *
     * @param name the name to check
     * @return true if the name belongs to the runtime or the type system
     */
    public static boolean isBuiltin(final String name) {
        return BUILTINS.contains(name);
    }

    /**
     * Checks if a name may be recorded as a user binding or reference.
     *
     * @param name the name to check
     * @return false for keywords and built-ins
     */
    public static boolean isUserName(final String name) {
        return !KEYWORDS.contains(name) && !BUILTINS.contains(name);
    }

    /**
     * Checks if a word is followed by the name it declares.
     *
     * @param keyword the word
     * @return true for const, let, var, function, class, interface, type
     *         and enum
     */
    public static boolean isDeclaring(final String keyword) {
        return DECLARING_KEYWORDS.contains(keyword);
    }

}
