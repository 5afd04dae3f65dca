package co.fanki.sourceparsing.analysis.domain;

import co.fanki.sourceparsing.shared.Preconditions;

/**
 * One top-level named binding of a source file.
 *
 * @param name the bound name
 * @param kind the kind of binding
 * @param line the 1-based line of the declaration
 * @param column the 1-based column of the declaration
 * @param descriptor free text describing the declaration, e.g.
 *        "async function" or "const"
 * @param signature the reconstructed signature for functions, empty
 *        otherwise. Only directly annotated simple type names appear in it.
 * @param exported whether the module marks the name as part of its public
 *        surface (JavaScript {@code export}, Python {@code __all__})
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Declaration(
        String name,
        DeclarationKind kind,
        int line,
        int column,
        String descriptor,
        String signature,
        boolean exported
) {

    public Declaration {
        Preconditions.requireNonBlank(name, "Declaration name is required");
        Preconditions.requireNonNull(kind, "Declaration kind is required");
        Preconditions.requirePositive(line, "Line must be 1-based");
        Preconditions.requirePositive(column, "Column must be 1-based");
        descriptor = descriptor == null ? "" : descriptor;
        signature = signature == null ? "" : signature;
    }

    /**
     * Creates a non-exported declaration without signature.
     *
     * @param name the bound name
     * @param kind the kind of binding
     * @param line the 1-based line
     * @param column the 1-based column
     * @param descriptor the descriptor
     * @return the declaration
     */
    public static Declaration of(final String name,
            final DeclarationKind kind, final int line, final int column,
            final String descriptor) {
        return new Declaration(name, kind, line, column, descriptor, "",
                false);
    }

}
