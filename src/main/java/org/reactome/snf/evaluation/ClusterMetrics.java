package org.reactome.snf.evaluation;

import java.util.HashMap;
import java.util.Map;

import org.reactome.snf.DegeneratePartitionException;
import org.reactome.snf.ValidationException;

import smile.validation.AdjustedRandIndex;
import smile.validation.NormalizedMutualInformation;
import smile.validation.RandIndex;

/**
 * Label-permutation invariant scores comparing two partitions of the same samples, and the
 * silhouette score of a partition over a distance matrix. The agreement scores come from
 * smile.validation; smile has no silhouette.
 * @author wug
 *
 */
public class ClusterMetrics {
    private static final String STAGE = "Evaluation";

    private ClusterMetrics() {
    }

    private static int[] remap(int[] labels) {
        Map<Integer, Integer> index = new HashMap<>();
        int[] rtn = new int[labels.length];
        for (int i = 0; i < labels.length; i++) {
            Integer mapped = index.get(labels[i]);
            if (mapped == null) {
                mapped = index.size();
                index.put(labels[i], mapped);
            }
            rtn[i] = mapped;
        }
        return rtn;
    }

    private static int max(int[] values) {
        int max = -1;
        for (int value : values)
            max = Math.max(max, value);
        return max;
    }

    private static int countClusters(int[] labels) {
        return max(remap(labels)) + 1;
    }

    private static void checkSizes(int[] truth, int[] predicted, int minimum, String metric) {
        if (truth.length != predicted.length)
            throw new ValidationException(null, STAGE, "The labelings have different sizes: " + truth.length + " vs " + predicted.length);
        if (truth.length < minimum)
            throw new ValidationException(null, STAGE, "At least " + minimum + " samples are needed for the " + metric + ".");
    }

    /**
     * The fraction of sample pairs on which the two partitions agree (same cluster in both, or
     * different clusters in both).
     * @param truth
     * @param predicted
     * @return
     */
    public static double randIndex(int[] truth, int[] predicted) {
        checkSizes(truth, predicted, 2, "Rand index");
        return RandIndex.of(truth, predicted);
    }

    /**
     * The Rand index corrected for chance (Hubert and Arabie). Undefined when both partitions
     * are trivial in the same way: one cluster each, or one sample per cluster in both.
     * @param truth
     * @param predicted
     * @return
     */
    public static double adjustedRandIndex(int[] truth, int[] predicted) {
        checkSizes(truth, predicted, 2, "adjusted Rand index");
        int n = truth.length;
        int truthClusters = countClusters(truth);
        int predictedClusters = countClusters(predicted);
        if ((truthClusters == 1 && predictedClusters == 1) || (truthClusters == n && predictedClusters == n))
            throw new DegeneratePartitionException(null, STAGE,
                                                   "The adjusted Rand index is undefined: both partitions are trivial.");
        return AdjustedRandIndex.of(truth, predicted);
    }

    /**
     * Mutual information normalized by the arithmetic mean of the two entropies. Two partitions
     * that both have a single cluster are identical and get 1.0.
     * @param truth
     * @param predicted
     * @return
     */
    public static double normalizedMutualInformation(int[] truth, int[] predicted) {
        checkSizes(truth, predicted, 1, "normalized mutual information");
        if (countClusters(truth) == 1 && countClusters(predicted) == 1)
            return 1.0d;
        double nmi = NormalizedMutualInformation.sum(truth, predicted);
        // Rounding can push the score slightly out of [0, 1]
        return Math.max(0.0d, Math.min(1.0d, nmi));
    }

    /**
     * The mean silhouette width of a partition. A sample alone in its cluster gets 0.
     * @param distances a symmetric distance matrix with 0 on the diagonal
     * @param labels
     * @return
     */
    public static double silhouette(double[][] distances, int[] labels) {
        int n = labels.length;
        if (distances.length != n)
            throw new ValidationException(null, STAGE, "The distance matrix has " + distances.length + " rows for " + n + " labels.");
        int[] clusters = remap(labels);
        int k = max(clusters) + 1;
        if (k < 2 || k >= n)
            throw new DegeneratePartitionException(null, STAGE,
                                                   "The silhouette needs between 2 and " + (n - 1) + " clusters, got " + k + ".");
        int[] sizes = new int[k];
        for (int cluster : clusters)
            sizes[cluster] ++;
        double total = 0.0d;
        for (int i = 0; i < n; i++) {
            if (sizes[clusters[i]] == 1)
                continue;
            double[] sums = new double[k];
            for (int j = 0; j < n; j++) {
                if (j != i)
                    sums[clusters[j]] += distances[i][j];
            }
            double a = sums[clusters[i]] / (sizes[clusters[i]] - 1);
            double b = Double.POSITIVE_INFINITY;
            for (int c = 0; c < k; c++) {
                if (c != clusters[i])
                    b = Math.min(b, sums[c] / sizes[c]);
            }
            double denominator = Math.max(a, b);
            if (denominator > 0.0d)
                total += (b - a) / denominator;
        }
        return total / n;
    }

}
