package org.reactome.snf.network;

import java.util.List;

import org.apache.commons.math3.linear.RealMatrix;
import org.reactome.snf.AnalysisConfiguration;
import org.reactome.snf.RunContext;
import org.reactome.snf.View;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Similarity Network Fusion (Wang et al., Nature Methods 2014) by iterative cross-diffusion.
 * For each view v two kernels are derived from its network W_v:
 * <ul>
 * <li>the full kernel P_v: W_v row-normalized and symmetrized;</li>
 * <li>the local kernel S_v: W_v restricted to the K largest entries of each row, then
 * row-normalized. S_v is kept fixed.</li>
 * </ul>
 * Each iteration updates all views at once: P_v = S_v * mean(P_u, u != v) * S_v^T, followed by
 * row normalization and symmetrization. The fused network is the average of the final P_v,
 * row-normalized and symmetrized, and its diagonal is then set to
 * {@link SimilarityMatrix#SELF_SIMILARITY}.
 * <p>
 * Fixed points: if every view has the same network W and its full kernel P satisfies
 * S P S^T = P (for example W uniform inside disjoint blocks, zero across, and K equal to the
 * block size), the fused network equals P off the diagonal. A general affinity matrix is not a
 * fixed point: the diffusion flattens its within-group values, while its group structure is
 * kept.
 * <p>
 * Any zero row sum or non-finite value stops the fusion with a NumericInstabilityException.
 * @author wug
 *
 */
public class SimilarityNetworkFusion implements FusionEngine {
    private static final Logger logger = LoggerFactory.getLogger(SimilarityNetworkFusion.class);
    private static final String STAGE = "SNF";

    private final int neighbors;
    private final int iterations;

    public SimilarityNetworkFusion() {
        this(AnalysisConfiguration.DEFAULT_FUSION_NEIGHBORS,
             AnalysisConfiguration.DEFAULT_FUSION_ITERATIONS);
    }

    public SimilarityNetworkFusion(int neighbors, int iterations) {
        if (neighbors <= 0)
            throw new IllegalArgumentException("neighbors must be positive: " + neighbors);
        if (iterations <= 0)
            throw new IllegalArgumentException("iterations must be positive: " + iterations);
        this.neighbors = neighbors;
        this.iterations = iterations;
    }

    public static SimilarityNetworkFusion of(AnalysisConfiguration configuration) {
        return new SimilarityNetworkFusion(configuration.getFusionNeighbors(),
                                           configuration.getFusionIterations());
    }

    public int getNeighbors() {
        return neighbors;
    }

    public int getIterations() {
        return iterations;
    }

    @Override
    public SimilarityMatrix fuse(List<SimilarityMatrix> networks, RunContext context) {
        NetworkUtilities.checkAligned(networks, 2, STAGE);
        int m = networks.size();
        int n = networks.get(0).size();
        int k = Math.min(neighbors, n);
        logger.info("{} | Fusing {} networks of {} samples (K = {}, t = {}).",
                    context.getTag(), m, n, k, iterations);
        RealMatrix[] full = new RealMatrix[m];
        RealMatrix[] local = new RealMatrix[m];
        View[] views = new View[m];
        for (int v = 0; v < m; v++) {
            views[v] = networks.get(v).getView();
            RealMatrix w = NetworkUtilities.toRealMatrix(networks.get(v));
            full[v] = NetworkUtilities.symmetrize(NetworkUtilities.rowNormalize(w, views[v], STAGE));
            local[v] = NetworkUtilities.rowNormalize(NetworkUtilities.keepNearestNeighbors(w, k), views[v], STAGE);
        }
        for (int t = 0; t < iterations; t++) {
            RealMatrix[] next = new RealMatrix[m];
            for (int v = 0; v < m; v++) {
                RealMatrix others = averageOthers(full, v);
                next[v] = local[v].multiply(others).multiply(local[v].transpose());
            }
            // All views are updated from the previous iteration
            for (int v = 0; v < m; v++) {
                NetworkUtilities.checkFinite(next[v], views[v], STAGE);
                full[v] = NetworkUtilities.symmetrize(NetworkUtilities.rowNormalize(next[v], views[v], STAGE));
            }
            logger.debug("{} | SNF iteration {} done.", context.getTag(), t + 1);
        }
        RealMatrix fused = full[0];
        for (int v = 1; v < m; v++)
            fused = fused.add(full[v]);
        fused = fused.scalarMultiply(1.0d / m);
        fused = NetworkUtilities.symmetrize(NetworkUtilities.rowNormalize(fused, null, STAGE));
        NetworkUtilities.checkFinite(fused, null, STAGE);
        double[][] values = fused.getData();
        for (int i = 0; i < n; i++)
            values[i][i] = SimilarityMatrix.SELF_SIMILARITY;
        return new SimilarityMatrix(networks.get(0).getSampleIds(), values, null);
    }

    private RealMatrix averageOthers(RealMatrix[] full, int excluded) {
        RealMatrix sum = null;
        for (int u = 0; u < full.length; u++) {
            if (u == excluded)
                continue;
            sum = sum == null ? full[u] : sum.add(full[u]);
        }
        return sum.scalarMultiply(1.0d / (full.length - 1));
    }

}
