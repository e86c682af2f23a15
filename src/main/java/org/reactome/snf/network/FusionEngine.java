package org.reactome.snf.network;

import java.util.List;

import org.reactome.snf.RunContext;

/**
 * Combine one similarity network per view into a single network. All the passed matrices
 * must have the same samples in the same order.
 * @author wug
 *
 */
public interface FusionEngine {
    
    SimilarityMatrix fuse(List<SimilarityMatrix> networks, RunContext context);
    
    default String getName() {
        return getClass().getSimpleName();
    }

}
