package org.reactome.snf;

/**
 * A Dataset, a group of Datasets or a configuration value violates an identifier, shape or non-emptiness invariant.
 * @author wug
 *
 */
public class ValidationException extends MultiOmicsException {
    private static final long serialVersionUID = 1L;

    public ValidationException(View view, String stage, String message) {
        super(view, stage, message);
    }

}
