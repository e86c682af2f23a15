package org.reactome.snf.evaluation;

/**
 * A named score with the range it can take, so that scores with different ranges can be
 * put on the same [0, 1] scale.
 * @author wug
 *
 */
public final class Metric {
    public static final String RAND_SCORE = "Rand Score";
    public static final String ADJUSTED_RAND_SCORE = "Adjusted Rand Score";
    public static final String NORMALIZED_MUTUAL_INFO_SCORE = "Normalized Mutual Info Score";
    public static final String SILHOUETTE_SCORE = "Silhouette Score";

    private final String label;
    private final double value;
    private final double min;
    private final double max;

    public Metric(String label, double value, double min, double max) {
        if (label == null)
            throw new IllegalArgumentException("label cannot be null.");
        if (!(max > min))
            throw new IllegalArgumentException("Invalid range [" + min + ", " + max + "] for " + label);
        this.label = label;
        this.value = value;
        this.min = min;
        this.max = max;
    }

    /**
     * Rand index, in [0, 1].
     */
    public static Metric randScore(double value) {
        return new Metric(RAND_SCORE, value, 0.0d, 1.0d);
    }

    /**
     * Adjusted Rand index. It can go below 0 for worse than chance agreement; its lower bound is
     * documented as -0.5, the bound reached by two-cluster partitions.
     */
    public static Metric adjustedRandScore(double value) {
        return new Metric(ADJUSTED_RAND_SCORE, value, -0.5d, 1.0d);
    }

    /**
     * Normalized mutual information (arithmetic mean normalization), in [0, 1].
     */
    public static Metric normalizedMutualInfoScore(double value) {
        return new Metric(NORMALIZED_MUTUAL_INFO_SCORE, value, 0.0d, 1.0d);
    }

    /**
     * Mean silhouette width, in [-1, 1].
     */
    public static Metric silhouetteScore(double value) {
        return new Metric(SILHOUETTE_SCORE, value, -1.0d, 1.0d);
    }

    public String getLabel() {
        return label;
    }

    public double getValue() {
        return value;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    /**
     * @return (value - min) / (max - min)
     */
    public double getNormalizedValue() {
        return (value - min) / (max - min);
    }

    @Override
    public String toString() {
        return String.format("%s: %.4f [%s, %s]", label, value, min, max);
    }

}
