package org.reactome.snf;

/**
 * A computation produced a non-finite value or hit a zero denominator (zero variance, zero row sum).
 * @author wug
 *
 */
public class NumericInstabilityException extends MultiOmicsException {
    private static final long serialVersionUID = 1L;

    public NumericInstabilityException(View view, String stage, String message) {
        super(view, stage, message);
    }

}
