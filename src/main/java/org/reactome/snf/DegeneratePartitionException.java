package org.reactome.snf;

/**
 * A partition has a single cluster or one cluster per sample, so it cannot be clustered into or scored as a proper partition.
 * @author wug
 *
 */
public class DegeneratePartitionException extends MultiOmicsException {
    private static final long serialVersionUID = 1L;

    public DegeneratePartitionException(View view, String stage, String message) {
        super(view, stage, message);
    }

}
