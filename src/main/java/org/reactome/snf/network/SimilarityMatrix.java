package org.reactome.snf.network;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import org.reactome.snf.NumericInstabilityException;
import org.reactome.snf.ValidationException;
import org.reactome.snf.View;

/**
 * A symmetric, square matrix of pairwise similarities in [0, 1], with the same sample ids on
 * both axes.
 * <p>
 * Diagonal convention: every producer in this package ({@link SimilarityEngine},
 * {@link SimilarityNetworkFusion} and {@link MeanFusion}) puts {@link #SELF_SIMILARITY} on the
 * diagonal. Code that needs a dissimilarity must use {@link #toDistances()},
 * which is the only place where a similarity is turned into a distance: 1 minus the min-max
 * scaled similarity over all entries, with 0 on the diagonal.
 * @author wug
 *
 */
public final class SimilarityMatrix {
    // Allowed slack for symmetry and range checks
    public static final double TOLERANCE = 1.0e-9;
    public static final double SELF_SIMILARITY = 1.0d;

    private final String[] sampleIds;
    private final double[][] values;
    // Null for a fused network
    private final View view;
    private final Map<String, Integer> idToIndex;

    public SimilarityMatrix(String[] sampleIds, double[][] values, View view) {
        if (sampleIds == null || values == null)
            throw new IllegalArgumentException("sampleIds and values are required.");
        this.view = view;
        this.sampleIds = Arrays.copyOf(sampleIds, sampleIds.length);
        int n = sampleIds.length;
        if (values.length != n)
            throw new ValidationException(view, "SimilarityMatrix", "Expected " + n + " rows but got " + values.length + ".");
        this.values = new double[n][];
        this.idToIndex = new HashMap<>();
        for (int i = 0; i < n; i++) {
            if (values[i].length != n)
                throw new ValidationException(view, "SimilarityMatrix", "Row " + i + " has " + values[i].length + " columns for " + n + " samples.");
            this.values[i] = Arrays.copyOf(values[i], n);
            if (idToIndex.put(sampleIds[i], i) != null)
                throw new ValidationException(view, "SimilarityMatrix", "Duplicated sample id: " + sampleIds[i]);
        }
        check();
    }

    private void check() {
        for (int i = 0; i < values.length; i++) {
            for (int j = 0; j < values.length; j++) {
                double value = values[i][j];
                if (!Double.isFinite(value))
                    throw new NumericInstabilityException(view, "SimilarityMatrix", "Non-finite similarity at (" + i + ", " + j + ").");
                if (value < -TOLERANCE || value > 1.0d + TOLERANCE)
                    throw new ValidationException(view, "SimilarityMatrix", "Similarity " + value + " at (" + i + ", " + j + ") is out of [0, 1].");
                if (Math.abs(value - values[j][i]) > TOLERANCE)
                    throw new ValidationException(view, "SimilarityMatrix", "The matrix is not symmetric at (" + i + ", " + j + ").");
            }
        }
    }

    public int size() {
        return sampleIds.length;
    }

    public String[] getSampleIds() {
        return Arrays.copyOf(sampleIds, sampleIds.length);
    }

    /**
     * @return the view this network was built from, null for a fused network.
     */
    public View getView() {
        return view;
    }

    public double getValue(int i, int j) {
        return values[i][j];
    }

    public double getValue(String sample1, String sample2) {
        Integer i = idToIndex.get(sample1);
        Integer j = idToIndex.get(sample2);
        if (i == null || j == null)
            throw new ValidationException(view, "SimilarityMatrix", "Unknown sample: " + (i == null ? sample1 : sample2));
        return values[i][j];
    }

    /**
     * @return a copy of the values.
     */
    public double[][] toArray() {
        double[][] rtn = new double[values.length][];
        for (int i = 0; i < values.length; i++)
            rtn[i] = Arrays.copyOf(values[i], values[i].length);
        return rtn;
    }

    /**
     * Convert into the distance basis used for medoid partitioning and the silhouette score:
     * d = 1 - (s - min) / (max - min), min and max taken over all entries, and d = 0 on the
     * diagonal.
     * @return
     */
    public double[][] toDistances() {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double[] row : values) {
            for (double value : row) {
                min = Math.min(min, value);
                max = Math.max(max, value);
            }
        }
        double range = max - min;
        if (!(range > 0.0d))
            throw new NumericInstabilityException(view, "SimilarityMatrix", "All similarities are equal; min-max scaling is undefined.");
        int n = values.length;
        double[][] rtn = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (i == j)
                    continue;
                rtn[i][j] = 1.0d - (values[i][j] - min) / range;
            }
        }
        return rtn;
    }

    /**
     * Check if the passed matrix has exactly the same samples in the same order.
     * @param other
     * @return
     */
    public boolean isAlignedWith(SimilarityMatrix other) {
        return Arrays.equals(sampleIds, other.sampleIds);
    }

    @Override
    public String toString() {
        return "SimilarityMatrix[" + (view == null ? "fused" : view.getLabel()) + ", " + sampleIds.length + " x " + sampleIds.length + "]";
    }

}
