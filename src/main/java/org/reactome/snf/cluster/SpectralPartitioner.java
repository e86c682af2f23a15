package org.reactome.snf.cluster;

import java.util.Comparator;
import java.util.stream.IntStream;

import org.reactome.snf.AnalysisConfiguration;
import org.reactome.snf.DegeneratePartitionException;
import org.reactome.snf.NumericInstabilityException;
import org.reactome.snf.RunContext;
import org.reactome.snf.ValidationException;
import org.reactome.snf.network.SimilarityMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import smile.clustering.SpectralClustering;
import smile.math.MathEx;
import smile.math.matrix.Matrix;

/**
 * Spectral clustering of a network used directly as a precomputed affinity (Ng, Jordan and
 * Weiss), delegated to smile's SpectralClustering. The affinity is first reduced to a symmetric
 * k-nearest-neighbor graph when the neighbor count is below the number of samples. The smile
 * random generator is seeded right before the call so that the k-means step is reproducible.
 * @author wug
 *
 */
public class SpectralPartitioner implements ClusteringEngine {
    private static final Logger logger = LoggerFactory.getLogger(SpectralPartitioner.class);
    private static final String STAGE = "Spectral";

    private final int clusters;
    private final int neighbors;
    private final long seed;

    public SpectralPartitioner() {
        this(AnalysisConfiguration.DEFAULT_CLUSTERS,
             AnalysisConfiguration.DEFAULT_SPECTRAL_NEIGHBORS,
             AnalysisConfiguration.DEFAULT_SEED);
    }

    public SpectralPartitioner(int clusters, int neighbors, long seed) {
        if (clusters < 2)
            throw new ValidationException(null, STAGE, "At least 2 clusters are needed: " + clusters);
        if (neighbors <= 0)
            throw new IllegalArgumentException("neighbors must be positive: " + neighbors);
        this.clusters = clusters;
        this.neighbors = neighbors;
        this.seed = seed;
    }

    public static SpectralPartitioner of(AnalysisConfiguration configuration) {
        return new SpectralPartitioner(configuration.getClusters(),
                                       configuration.getSpectralNeighbors(),
                                       configuration.getSeed());
    }

    @Override
    public ClusterAssignment cluster(SimilarityMatrix network, RunContext context) {
        int n = network.size();
        if (clusters >= n)
            throw new DegeneratePartitionException(network.getView(), STAGE,
                                                   clusters + " clusters requested for " + n + " samples.");
        double[][] affinity = neighborGraph(network.toArray());
        for (int i = 0; i < n; i++) {
            if (!(MathEx.sum(affinity[i]) > 0.0d))
                throw new NumericInstabilityException(network.getView(), STAGE, "Sample " + i + " has no affinity to any sample.");
        }
        // The only place the smile random generator is seeded: k-means on the embedding draws from it
        MathEx.setSeed(seed);
        SpectralClustering spectral = SpectralClustering.fit(Matrix.of(affinity), clusters);
        ClusterAssignment rtn = new ClusterAssignment(network.getSampleIds(), spectral.y);
        if (rtn.getClusterCount() < 2)
            throw new DegeneratePartitionException(network.getView(), STAGE, "All samples fall into a single cluster.");
        logger.info("{} | Spectral clustering: {} clusters for {} samples.",
                    context.getTag(),
                    rtn.getClusterCount(),
                    n);
        return rtn;
    }

    /**
     * Keep, for each sample, its strongest neighbors (self excluded), and make the graph
     * symmetric: an edge is kept if either end selects it.
     * @param values
     * @return
     */
    double[][] neighborGraph(double[][] values) {
        int n = values.length;
        double[][] rtn = new double[n][n];
        if (neighbors >= n - 1) {
            for (int i = 0; i < n; i++)
                for (int j = 0; j < n; j++)
                    rtn[i][j] = i == j ? 0.0d : values[i][j];
            return rtn;
        }
        for (int i = 0; i < n; i++) {
            final int row = i;
            int[] order = IntStream.range(0, n)
                                   .filter(j -> j != row)
                                   .boxed()
                                   .sorted(Comparator.comparingDouble((Integer j) -> values[row][j]).reversed())
                                   .mapToInt(Integer::intValue)
                                   .toArray();
            for (int k = 0; k < neighbors; k++) {
                int j = order[k];
                rtn[i][j] = values[i][j];
                rtn[j][i] = values[j][i];
            }
        }
        return rtn;
    }

}
