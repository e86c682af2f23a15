package org.reactome.snf;

/**
 * Carries what a single subtyping run needs besides its data: a label used in the logs,
 * the configuration, and the view currently processed. It is passed to every step and
 * engine call instead of relying on global state.
 * @author wug
 *
 */
public final class RunContext {
    private final String label;
    private final AnalysisConfiguration configuration;
    // Null for cohort-wide stages
    private final View view;
    
    public RunContext(String label, AnalysisConfiguration configuration) {
        this(label, configuration, null);
    }
    
    private RunContext(String label, AnalysisConfiguration configuration, View view) {
        if (label == null || configuration == null)
            throw new IllegalArgumentException("A run needs a label and a configuration.");
        this.label = label;
        this.configuration = configuration;
        this.view = view;
    }
    
    /**
     * A run with the configuration loaded from the default resource.
     * @param label
     * @return
     */
    public static RunContext of(String label) {
        return new RunContext(label, AnalysisConfiguration.load());
    }
    
    /**
     * Derive a context for processing the passed view.
     * @param view
     * @return
     */
    public RunContext forView(View view) {
        if (view == this.view)
            return this;
        return new RunContext(label, configuration, view);
    }
    
    public RunContext withConfiguration(AnalysisConfiguration configuration) {
        return new RunContext(label, configuration, view);
    }

    public String getLabel() {
        return label;
    }

    public AnalysisConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * @return null if no single view is processed.
     */
    public View getView() {
        return view;
    }
    
    /**
     * The tag used in log lines: "run/view".
     * @return
     */
    public String getTag() {
        return label + "/" + (view == null ? "cohort" : view.getLabel());
    }

    @Override
    public String toString() {
        return "RunContext[" + getTag() + "]";
    }

}
