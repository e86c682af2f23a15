package org.reactome.snf.network;

import java.util.List;

import org.reactome.snf.RunContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The baseline fusion: the element-wise average of the view networks, with
 * {@link SimilarityMatrix#SELF_SIMILARITY} on the diagonal.
 * @author wug
 *
 */
public class MeanFusion implements FusionEngine {
    private static final Logger logger = LoggerFactory.getLogger(MeanFusion.class);
    
    public MeanFusion() {
    }

    @Override
    public SimilarityMatrix fuse(List<SimilarityMatrix> networks, RunContext context) {
        NetworkUtilities.checkAligned(networks, 1, getName());
        int n = networks.get(0).size();
        double[][] rtn = new double[n][n];
        for (SimilarityMatrix network : networks) {
            for (int i = 0; i < n; i++)
                for (int j = 0; j < n; j++)
                    rtn[i][j] += network.getValue(i, j);
        }
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++)
                rtn[i][j] /= networks.size();
            rtn[i][i] = SimilarityMatrix.SELF_SIMILARITY;
        }
        logger.info("{} | Averaged {} networks of {} samples.", context.getTag(), networks.size(), n);
        return new SimilarityMatrix(networks.get(0).getSampleIds(), rtn, null);
    }

}
