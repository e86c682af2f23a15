package org.reactome.snf;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.reactome.snf.cluster.ClusterAssignment;
import org.reactome.snf.evaluation.MetricsBundle;
import org.reactome.snf.network.SimilarityMatrix;

/**
 * Everything a subtyping run produces. Predictions and metrics are keyed by the same labels,
 * e.g. "Proteins-only prediction" or "SNF-fused prediction", in the order they were computed.
 * @author wug
 *
 */
public final class AnalysisResult {
    private final Map<View, Dataset> harmonized;
    private final Map<View, SimilarityMatrix> networks;
    private final SimilarityMatrix fused;
    private final ClusterAssignment truth;
    private final Map<String, ClusterAssignment> predictions;
    private final Map<String, MetricsBundle> metrics;

    AnalysisResult(Map<View, Dataset> harmonized,
                   Map<View, SimilarityMatrix> networks,
                   SimilarityMatrix fused,
                   ClusterAssignment truth,
                   Map<String, ClusterAssignment> predictions,
                   Map<String, MetricsBundle> metrics) {
        this.harmonized = Collections.unmodifiableMap(new LinkedHashMap<>(harmonized));
        this.networks = Collections.unmodifiableMap(new LinkedHashMap<>(networks));
        this.fused = fused;
        this.truth = truth;
        this.predictions = Collections.unmodifiableMap(new LinkedHashMap<>(predictions));
        this.metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    /**
     * @return the harmonized Datasets, all with the same samples in the same order.
     */
    public Map<View, Dataset> getHarmonized() {
        return harmonized;
    }

    public Map<View, SimilarityMatrix> getNetworks() {
        return networks;
    }

    /**
     * @return the network produced by similarity network fusion.
     */
    public SimilarityMatrix getFused() {
        return fused;
    }

    public ClusterAssignment getTruth() {
        return truth;
    }

    public Map<String, ClusterAssignment> getPredictions() {
        return predictions;
    }

    public Map<String, MetricsBundle> getMetrics() {
        return metrics;
    }

    public ClusterAssignment getPrediction(String label) {
        return predictions.get(label);
    }

    public MetricsBundle getMetrics(String label) {
        return metrics.get(label);
    }

}
