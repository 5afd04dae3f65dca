package co.fanki.sourceparsing.analysis.domain;

/**
 * Decides which declarations may be reported as unused.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum UnusedDeclarationPolicy {

    /** Every declaration not referenced in its own file is reported. */
    REPORT_ALL,

    /** Exported declarations are assumed used by other files. */
    EXEMPT_EXPORTED;

    /**
     * Checks if a declaration is a candidate for the unused report.
     *
     * @param declaration the declaration
     * @return false when the policy exempts it
     */
    public boolean reports(final Declaration declaration) {
        return switch (this) {
            case REPORT_ALL -> true;
            case EXEMPT_EXPORTED -> !declaration.exported();
        };
    }

}
