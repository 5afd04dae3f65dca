package co.fanki.sourceparsing.analysis.domain;

/**
 * The syntactic shape an {@link Import} was written in.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ImportKind {

    /** Python {@code import a.b [as c]}. */
    PLAIN_IMPORT,

    /** Python {@code from x import a, b as c}. */
    FROM_IMPORT,

    /** JavaScript {@code import * as ns from 'm'}. */
    NAMESPACE,

    /** JavaScript {@code import {a, b as c} from 'm'}. */
    NAMED,

    /** JavaScript {@code import d from 'm'}. */
    DEFAULT,

    /** JavaScript {@code import 'm'}, binds nothing. */
    SIDE_EFFECT,

    /** CommonJS {@code require('m')}. */
    COMMONJS_REQUIRE,

    /** JavaScript {@code import('m')} expression. */
    DYNAMIC;

    /**
     * Checks if imports of this kind can bind local names at all.
     *
     * @return false for side-effect, require and dynamic imports
     */
    public boolean bindsNames() {
        return switch (this) {
            case PLAIN_IMPORT, FROM_IMPORT, NAMESPACE, NAMED, DEFAULT -> true;
            case SIDE_EFFECT, COMMONJS_REQUIRE, DYNAMIC -> false;
        };
    }

}
