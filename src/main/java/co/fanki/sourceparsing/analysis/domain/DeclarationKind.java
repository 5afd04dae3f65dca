package co.fanki.sourceparsing.analysis.domain;

/**
 * The kind of binding a top-level {@link Declaration} introduces.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum DeclarationKind {

    VARIABLE,

    FUNCTION,

    CLASS,

    INTERFACE,

    TYPE_ALIAS,

    ENUM

}
