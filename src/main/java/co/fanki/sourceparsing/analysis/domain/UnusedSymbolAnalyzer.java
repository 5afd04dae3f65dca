package co.fanki.sourceparsing.analysis.domain;

import co.fanki.sourceparsing.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Finds imports and declarations that a file never refers to.
 *
 * <p>A name counts as used when any identifier reference of the same
 * {@link ParseResult} carries it. The analysis is local to one file.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class UnusedSymbolAnalyzer {

    /**
     * Returns the imports whose bound names are all unused.
     *
     * <p>Imports binding no name (side-effect, require, dynamic, star) are
     * never reported.</p>
     *
     * @param result the parse result
     * @return the unused imports in source order
     * @throws IllegalArgumentException if result is null
     */
    public List<Import> findUnusedImports(final ParseResult result) {
        Preconditions.requireNonNull(result, "Parse result is required");

        final Set<String> used = result.usedNames();
        final List<Import> unused = new ArrayList<>();
        for (final Import found : result.imports()) {
            final List<String> bound = found.boundNames();
            if (!bound.isEmpty() && bound.stream().noneMatch(used::contains)) {
                unused.add(found);
            }
        }
        return unused;
    }

    /**
     * Returns the names of the declarations never referenced.
     *
     * @param result the parse result
     * @param policy decides which declarations may be reported
     * @return the unused declaration names in declaration order
     * @throws IllegalArgumentException if any argument is null
     */
    public List<String> findUnusedDeclarations(final ParseResult result,
            final UnusedDeclarationPolicy policy) {
        Preconditions.requireNonNull(result, "Parse result is required");
        Preconditions.requireNonNull(policy, "Policy is required");

        final Set<String> used = result.usedNames();
        final List<String> unused = new ArrayList<>();
        for (final Declaration declaration
                : result.declarations().values()) {
            if (policy.reports(declaration)
                    && !used.contains(declaration.name())) {
                unused.add(declaration.name());
            }
        }
        return unused;
    }

}
