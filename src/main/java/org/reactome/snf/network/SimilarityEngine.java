package org.reactome.snf.network;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.reactome.snf.AnalysisConfiguration;
import org.reactome.snf.Dataset;
import org.reactome.snf.NumericInstabilityException;
import org.reactome.snf.RunContext;
import org.reactome.snf.ValidationException;
import org.reactome.snf.View;
import org.reactome.snf.steps.StandardizeFeatures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import smile.math.MathEx;

/**
 * Build the affinity network of one view with a self-tuning exponential kernel. For samples
 * i and j with Euclidean distance d, and mean distances m_i, m_j to their K nearest neighbors,
 * the bandwidth is sigma = (m_i + m_j + d) / 3 and the affinity is
 * exp(-d^2 / (2 * (mu * sigma)^2)). This is the scaled kernel of the similarity network fusion
 * method without the normal density constant, so that values stay in (0, 1] and the diagonal is
 * exactly 1.
 * <p>
 * The features are z-scored first (unless turned off), so any per-feature linear rescaling of
 * the input gives the same network.
 * @author wug
 *
 */
public class SimilarityEngine {
    private static final Logger logger = LoggerFactory.getLogger(SimilarityEngine.class);
    // Floor of the bandwidth, as in SNFtool
    private static final double EPS = 2.220446e-16;

    private final int neighbors;
    private final double mu;
    private final boolean standardize;

    public SimilarityEngine() {
        this(AnalysisConfiguration.DEFAULT_SIMILARITY_NEIGHBORS,
             AnalysisConfiguration.DEFAULT_SIMILARITY_MU,
             true);
    }

    public SimilarityEngine(int neighbors, double mu, boolean standardize) {
        if (neighbors <= 0)
            throw new IllegalArgumentException("neighbors must be positive: " + neighbors);
        if (!(mu > 0.0d))
            throw new IllegalArgumentException("mu must be positive: " + mu);
        this.neighbors = neighbors;
        this.mu = mu;
        this.standardize = standardize;
    }

    public static SimilarityEngine of(AnalysisConfiguration configuration) {
        return new SimilarityEngine(configuration.getSimilarityNeighbors(),
                                    configuration.getSimilarityMu(),
                                    true);
    }

    public int getNeighbors() {
        return neighbors;
    }

    /**
     * @param dataset a complete, numeric Dataset
     * @param context
     * @return
     */
    public SimilarityMatrix compute(Dataset dataset, RunContext context) {
        RunContext viewContext = context.forView(dataset.getView());
        if (dataset.size() < 2)
            throw new ValidationException(dataset.getView(), "Similarity", "At least two samples are needed: " + dataset.size());
        if (dataset.getFeatureCount() == 0)
            throw new ValidationException(dataset.getView(), "Similarity", "The dataset has no feature.");
        if (standardize)
            dataset = new StandardizeFeatures().apply(dataset, viewContext);
        double[][] data = dataset.toMatrix();
        for (double[] row : data) {
            for (double value : row) {
                if (!Double.isFinite(value))
                    throw new NumericInstabilityException(dataset.getView(), "Similarity", "The data contains missing or non-finite values.");
            }
        }
        double[][] distances = distances(data);
        double[][] affinities = affinities(distances, dataset.getView());
        logger.info("{} | Built a {} x {} affinity network from {} features (K = {}).",
                    viewContext.getTag(),
                    affinities.length,
                    affinities.length,
                    dataset.getFeatureCount(),
                    Math.min(neighbors, affinities.length - 1));
        return new SimilarityMatrix(dataset.getSampleIds(), affinities, dataset.getView());
    }

    /**
     * Build one network for each of the passed Datasets, in order.
     * @param datasets
     * @param context
     * @return
     */
    public List<SimilarityMatrix> computeAll(List<Dataset> datasets, RunContext context) {
        List<SimilarityMatrix> rtn = new ArrayList<>(datasets.size());
        for (Dataset dataset : datasets)
            rtn.add(compute(dataset, context));
        return rtn;
    }

    /**
     * Pairwise Euclidean distances between the rows.
     * @param data
     * @return
     */
    public static double[][] distances(double[][] data) {
        int n = data.length;
        double[][] rtn = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double d = MathEx.distance(data[i], data[j]);
                rtn[i][j] = d;
                rtn[j][i] = d;
            }
        }
        return rtn;
    }

    double[][] affinities(double[][] distances, View view) {
        int n = distances.length;
        int k = Math.min(neighbors, n - 1);
        // Mean distance to the K nearest neighbors, self excluded
        double[] means = new double[n];
        for (int i = 0; i < n; i++) {
            double[] others = new double[n - 1];
            int index = 0;
            for (int j = 0; j < n; j++) {
                if (j != i)
                    others[index ++] = distances[i][j];
            }
            Arrays.sort(others);
            double sum = 0.0d;
            for (int j = 0; j < k; j++)
                sum += others[j];
            means[i] = sum / k;
        }
        double[][] rtn = new double[n][n];
        for (int i = 0; i < n; i++) {
            rtn[i][i] = SimilarityMatrix.SELF_SIMILARITY;
            for (int j = i + 1; j < n; j++) {
                double d = distances[i][j];
                double sigma = (means[i] + means[j] + d) / 3.0d;
                if (sigma <= EPS)
                    sigma = EPS;
                double scale = mu * sigma;
                double value = Math.exp(-d * d / (2.0d * scale * scale));
                if (!Double.isFinite(value))
                    throw new NumericInstabilityException(view, "Similarity", "Non-finite affinity between samples " + i + " and " + j + ".");
                rtn[i][j] = value;
                rtn[j][i] = value;
            }
        }
        return rtn;
    }

}
