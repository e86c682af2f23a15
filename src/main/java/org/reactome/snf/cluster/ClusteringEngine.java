package org.reactome.snf.cluster;

import org.reactome.snf.RunContext;
import org.reactome.snf.network.SimilarityMatrix;

/**
 * Partition the samples of a similarity network.
 * @author wug
 *
 */
public interface ClusteringEngine {
    
    ClusterAssignment cluster(SimilarityMatrix network, RunContext context);
    
    default String getName() {
        return getClass().getSimpleName();
    }

}
