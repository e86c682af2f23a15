package org.reactome.snf.cluster;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.reactome.snf.AnalysisConfiguration;
import org.reactome.snf.DegeneratePartitionException;
import org.reactome.snf.RunContext;
import org.reactome.snf.ValidationException;
import org.reactome.snf.network.SimilarityMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Partitioning around medoids (PAM) on the distance basis of a network
 * ({@link SimilarityMatrix#toDistances()}). The medoids are initialized either with the greedy
 * BUILD phase of Kaufman and Rousseeuw, which does not need any randomness, or with a seeded
 * k-medoids++ draw. The SWAP phase then applies the best improving medoid/non-medoid exchange
 * until none is left or the iteration cap is hit. The same network and seed always give the same
 * assignment.
 * @author wug
 *
 */
public class MedoidPartitioner implements ClusteringEngine {
    private static final Logger logger = LoggerFactory.getLogger(MedoidPartitioner.class);
    private static final String STAGE = "Medoids";
    // Minimum cost decrease for a swap to count
    private static final double MIN_IMPROVEMENT = 1.0e-12;

    public static enum Initialization {
        BUILD,
        KMEDOIDS_PLUS_PLUS;
    }

    private final int clusters;
    private final long seed;
    private final int maxIterations;
    private final Initialization initialization;

    public MedoidPartitioner() {
        this(AnalysisConfiguration.DEFAULT_CLUSTERS,
             AnalysisConfiguration.DEFAULT_SEED,
             AnalysisConfiguration.DEFAULT_MAX_ITERATIONS,
             Initialization.BUILD);
    }

    public MedoidPartitioner(int clusters, long seed) {
        this(clusters, seed, AnalysisConfiguration.DEFAULT_MAX_ITERATIONS, Initialization.BUILD);
    }

    public MedoidPartitioner(int clusters,
                             long seed,
                             int maxIterations,
                             Initialization initialization) {
        if (clusters < 2)
            throw new ValidationException(null, STAGE, "At least 2 clusters are needed: " + clusters);
        if (maxIterations <= 0)
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        this.clusters = clusters;
        this.seed = seed;
        this.maxIterations = maxIterations;
        this.initialization = initialization;
    }

    public static MedoidPartitioner of(AnalysisConfiguration configuration) {
        return new MedoidPartitioner(configuration.getClusters(),
                                     configuration.getSeed(),
                                     configuration.getMaxIterations(),
                                     Initialization.BUILD);
    }

    public int getClusters() {
        return clusters;
    }

    @Override
    public ClusterAssignment cluster(SimilarityMatrix network, RunContext context) {
        int n = network.size();
        if (clusters >= n)
            throw new DegeneratePartitionException(network.getView(), STAGE,
                                                   clusters + " clusters requested for " + n + " samples.");
        double[][] distances = network.toDistances();
        int[] medoids = initialization == Initialization.BUILD ? build(distances) : plusPlus(distances);
        double cost = cost(distances, medoids);
        int iteration = 0;
        while (iteration < maxIterations) {
            iteration ++;
            int bestSlot = -1;
            int bestCandidate = -1;
            double bestCost = cost;
            for (int slot = 0; slot < medoids.length; slot++) {
                int original = medoids[slot];
                for (int h = 0; h < n; h++) {
                    if (isMedoid(medoids, h))
                        continue;
                    medoids[slot] = h;
                    double swapped = cost(distances, medoids);
                    if (swapped < bestCost - MIN_IMPROVEMENT) {
                        bestCost = swapped;
                        bestSlot = slot;
                        bestCandidate = h;
                    }
                }
                medoids[slot] = original;
            }
            if (bestSlot < 0)
                break;
            medoids[bestSlot] = bestCandidate;
            cost = bestCost;
        }
        // Label clusters by the order of their medoids so the output doesn't depend on the swap history
        Arrays.sort(medoids);
        int[] labels = assign(distances, medoids);
        ClusterAssignment rtn = new ClusterAssignment(network.getSampleIds(), labels);
        if (rtn.getClusterCount() < 2)
            throw new DegeneratePartitionException(network.getView(), STAGE, "All samples fall into a single cluster.");
        logger.info("{} | PAM: {} clusters, total distance {} after {} swap iteration(s).",
                    context.getTag(),
                    rtn.getClusterCount(),
                    String.format("%.4f", cost),
                    iteration);
        return rtn;
    }

    /**
     * The BUILD phase: start from the sample with the smallest total distance, then keep adding the
     * sample that decreases the total distance the most. Ties go to the lower index.
     * @param distances
     * @return
     */
    int[] build(double[][] distances) {
        int n = distances.length;
        List<Integer> medoids = new ArrayList<>();
        double[] nearest = new double[n];
        int first = -1;
        double bestSum = Double.POSITIVE_INFINITY;
        for (int i = 0; i < n; i++) {
            double sum = 0.0d;
            for (int j = 0; j < n; j++)
                sum += distances[i][j];
            if (sum < bestSum) {
                bestSum = sum;
                first = i;
            }
        }
        medoids.add(first);
        for (int j = 0; j < n; j++)
            nearest[j] = distances[first][j];
        while (medoids.size() < clusters) {
            int best = -1;
            double bestGain = -1.0d;
            for (int i = 0; i < n; i++) {
                if (medoids.contains(i))
                    continue;
                double gain = 0.0d;
                for (int j = 0; j < n; j++)
                    gain += Math.max(0.0d, nearest[j] - distances[i][j]);
                if (gain > bestGain) {
                    bestGain = gain;
                    best = i;
                }
            }
            medoids.add(best);
            for (int j = 0; j < n; j++)
                nearest[j] = Math.min(nearest[j], distances[best][j]);
        }
        return medoids.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * k-medoids++: the first medoid is drawn uniformly, the next ones with a probability
     * proportional to the squared distance to the closest medoid chosen so far.
     * @param distances
     * @return
     */
    int[] plusPlus(double[][] distances) {
        int n = distances.length;
        Random random = new Random(seed);
        int[] medoids = new int[clusters];
        medoids[0] = random.nextInt(n);
        double[] nearest = new double[n];
        for (int j = 0; j < n; j++)
            nearest[j] = distances[medoids[0]][j];
        for (int c = 1; c < clusters; c++) {
            double total = 0.0d;
            for (int j = 0; j < n; j++)
                total += nearest[j] * nearest[j];
            int next = -1;
            if (total > 0.0d) {
                double target = random.nextDouble() * total;
                double cumulative = 0.0d;
                for (int j = 0; j < n; j++) {
                    cumulative += nearest[j] * nearest[j];
                    if (cumulative >= target && nearest[j] > 0.0d) {
                        next = j;
                        break;
                    }
                }
            }
            // Every sample sits on a medoid already: take the first free one
            if (next < 0) {
                for (int j = 0; j < n && next < 0; j++) {
                    if (!isMedoid(Arrays.copyOf(medoids, c), j))
                        next = j;
                }
            }
            medoids[c] = next;
            for (int j = 0; j < n; j++)
                nearest[j] = Math.min(nearest[j], distances[next][j]);
        }
        return medoids;
    }

    private boolean isMedoid(int[] medoids, int sample) {
        for (int medoid : medoids) {
            if (medoid == sample)
                return true;
        }
        return false;
    }

    private double cost(double[][] distances, int[] medoids) {
        double cost = 0.0d;
        for (int j = 0; j < distances.length; j++) {
            double min = Double.POSITIVE_INFINITY;
            for (int medoid : medoids)
                min = Math.min(min, distances[medoid][j]);
            cost += min;
        }
        return cost;
    }

    /**
     * Assign each sample to its closest medoid. A medoid always gets its own label; otherwise
     * ties go to the first medoid.
     * @param distances
     * @param medoids
     * @return
     */
    private int[] assign(double[][] distances, int[] medoids) {
        int[] labels = new int[distances.length];
        for (int j = 0; j < distances.length; j++) {
            int best = 0;
            for (int c = 1; c < medoids.length; c++) {
                if (distances[medoids[c]][j] < distances[medoids[best]][j])
                    best = c;
            }
            labels[j] = best;
        }
        for (int c = 0; c < medoids.length; c++)
            labels[medoids[c]] = c;
        return labels;
    }

}
