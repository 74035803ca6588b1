package io.github.eutro.checkmerge.core.report;

/**
 * Options for how {@link CheckMergePrinter} renders reports.
 */
public final class ReportOptions {
    /**
     * Whether to render dependency kinds by default. Set by the {@code CHECKMERGE_RENDER_KINDS} environment variable.
     */
    public static boolean RENDER_KINDS = System.getenv("CHECKMERGE_RENDER_KINDS") != null;

    /**
     * Whether to append the {@link io.github.eutro.checkmerge.core.analysis.DependencyKind kind} of each
     * dependency to its direction code, as in {@code "RAW def"}.
     */
    public final boolean renderKinds;

    /**
     * Construct report options.
     *
     * @param renderKinds Whether to render dependency kinds.
     */
    public ReportOptions(boolean renderKinds) {
        this.renderKinds = renderKinds;
    }

    /**
     * Get the options selected by the environment.
     *
     * @return The options.
     */
    public static ReportOptions fromEnvironment() {
        return new ReportOptions(RENDER_KINDS);
    }
}
