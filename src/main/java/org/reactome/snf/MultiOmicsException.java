package org.reactome.snf;

/**
 * Root of the errors raised while harmonizing, fusing, clustering or evaluating. The
 * message always names the view (when known) and the stage that failed.
 * @author wug
 *
 */
public class MultiOmicsException extends RuntimeException {
    private static final long serialVersionUID = 1L;
    
    private final View view;
    private final String stage;
    
    public MultiOmicsException(View view, String stage, String message) {
        super(format(view, stage, message));
        this.view = view;
        this.stage = stage;
    }
    
    public MultiOmicsException(View view, String stage, String message, Throwable cause) {
        super(format(view, stage, message), cause);
        this.view = view;
        this.stage = stage;
    }
    
    private static String format(View view, String stage, String message) {
        return "[" + (view == null ? "cohort" : view.getLabel()) + "/" + stage + "] " + message;
    }

    /**
     * @return null if the error is not tied to a single view.
     */
    public View getView() {
        return view;
    }

    public String getStage() {
        return stage;
    }

}
