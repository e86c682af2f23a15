package org.reactome.snf.evaluation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.reactome.snf.DegeneratePartitionException;
import org.reactome.snf.RunContext;
import org.reactome.snf.ValidationException;
import org.reactome.snf.cluster.ClusterAssignment;
import org.reactome.snf.network.SimilarityMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Score a predicted partition against the known labels.
 * @author wug
 *
 */
public class EvaluationEngine {
    private static final Logger logger = LoggerFactory.getLogger(EvaluationEngine.class);
    private static final String STAGE = "Evaluation";

    public EvaluationEngine() {
    }

    /**
     * Compute the Rand, adjusted Rand and normalized mutual information scores over the samples
     * having a known label, and the silhouette score of the prediction over the distance basis of
     * the passed network (skipped if the network is null).
     * @param label the label of the returned bundle, e.g. "SNF-fused prediction"
     * @param truth
     * @param predicted
     * @param basis the network the prediction was made from, aligned with the prediction
     * @param context
     * @return
     * @throws DegeneratePartitionException if the prediction does not form a proper partition.
     */
    public MetricsBundle evaluate(String label,
                                  ClusterAssignment truth,
                                  ClusterAssignment predicted,
                                  SimilarityMatrix basis,
                                  RunContext context) {
        if (predicted.getClusterCount() < 2 || predicted.getClusterCount() >= predicted.size())
            throw new DegeneratePartitionException(context.getView(), STAGE,
                                                   label + ": " + predicted.getClusterCount() + " clusters for " + predicted.size() + " samples.");
        List<String> common = new ArrayList<>();
        for (String id : predicted.getSampleIds()) {
            if (truth.contains(id))
                common.add(id);
        }
        if (common.size() < 2)
            throw new ValidationException(context.getView(), STAGE,
                                          label + ": less than two predicted samples have a known label.");
        if (common.size() < predicted.size())
            logger.warn("{} | {}: {} of {} samples have no known label and are not scored.",
                        context.getTag(),
                        label,
                        predicted.size() - common.size(),
                        predicted.size());
        int[] trueLabels = truth.getLabels(common);
        int[] predictedLabels = predicted.getLabels(common);
        List<Metric> metrics = new ArrayList<>();
        metrics.add(Metric.randScore(ClusterMetrics.randIndex(trueLabels, predictedLabels)));
        metrics.add(Metric.adjustedRandScore(ClusterMetrics.adjustedRandIndex(trueLabels, predictedLabels)));
        metrics.add(Metric.normalizedMutualInfoScore(ClusterMetrics.normalizedMutualInformation(trueLabels, predictedLabels)));
        if (basis != null) {
            if (!Arrays.equals(basis.getSampleIds(), predicted.getSampleIds()))
                throw new ValidationException(context.getView(), STAGE,
                                              label + ": the network and the prediction have different samples.");
            metrics.add(Metric.silhouetteScore(ClusterMetrics.silhouette(basis.toDistances(), predicted.getLabels())));
        }
        MetricsBundle bundle = new MetricsBundle(label, metrics);
        logger.info("{} | {}", context.getTag(), bundle);
        return bundle;
    }

}
