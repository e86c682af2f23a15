package org.reactome.snf;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.reactome.snf.cluster.ClusterAssignment;
import org.reactome.snf.cluster.ClusteringEngine;
import org.reactome.snf.cluster.MedoidPartitioner;
import org.reactome.snf.cluster.SpectralPartitioner;
import org.reactome.snf.evaluation.EvaluationEngine;
import org.reactome.snf.evaluation.MetricsBundle;
import org.reactome.snf.network.FusionEngine;
import org.reactome.snf.network.MeanFusion;
import org.reactome.snf.network.SimilarityEngine;
import org.reactome.snf.network.SimilarityMatrix;
import org.reactome.snf.network.SimilarityNetworkFusion;
import org.reactome.snf.steps.Pipelines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Run a complete subtyping analysis over a cohort: harmonize and align the views, build one
 * network per omics view, fuse them, partition the samples and score each partition against the
 * known subtypes. Besides the SNF-fused prediction, every single-view prediction and the
 * mean-fused baseline are scored so that the benefit of the fusion can be checked.
 * <p>
 * The phenotype view, if passed, only restricts the cohort. It is not used for similarity.
 * @author wug
 *
 */
public class SubtypeAnalysis {
    private static final Logger logger = LoggerFactory.getLogger(SubtypeAnalysis.class);
    private static final String STAGE = "Analysis";

    public static final String SINGLE_VIEW_SUFFIX = "-only prediction";
    public static final String MEAN_FUSED_PREDICTION = "Mean-fused prediction";
    public static final String SNF_FUSED_PREDICTION = "SNF-fused prediction";
    public static final String SNF_SPECTRAL_PREDICTION = "SNF-fused spectral prediction";

    private final SimilarityEngine similarityEngine;
    private final FusionEngine fusionEngine;
    private final FusionEngine baselineEngine;
    private final ClusteringEngine clusteringEngine;
    // Optional
    private final ClusteringEngine spectralEngine;
    private final EvaluationEngine evaluationEngine;

    public SubtypeAnalysis(SimilarityEngine similarityEngine,
                           FusionEngine fusionEngine,
                           FusionEngine baselineEngine,
                           ClusteringEngine clusteringEngine,
                           ClusteringEngine spectralEngine) {
        this.similarityEngine = similarityEngine;
        this.fusionEngine = fusionEngine;
        this.baselineEngine = baselineEngine;
        this.clusteringEngine = clusteringEngine;
        this.spectralEngine = spectralEngine;
        this.evaluationEngine = new EvaluationEngine();
    }

    /**
     * The engines configured as in the passed configuration. The spectral prediction of the fused
     * network is scored too.
     * @param configuration
     * @return
     */
    public static SubtypeAnalysis of(AnalysisConfiguration configuration) {
        return new SubtypeAnalysis(SimilarityEngine.of(configuration),
                                   SimilarityNetworkFusion.of(configuration),
                                   new MeanFusion(),
                                   MedoidPartitioner.of(configuration),
                                   SpectralPartitioner.of(configuration));
    }

    public static String getSingleViewLabel(View view) {
        return view.getLabel() + SINGLE_VIEW_SUFFIX;
    }

    /**
     * @param inputs the raw Datasets keyed by their views. The subtypes and at least two omics
     * views are required.
     * @param context
     * @return
     */
    public AnalysisResult run(Map<View, Dataset> inputs, RunContext context) {
        AnalysisConfiguration configuration = context.getConfiguration();
        List<View> views = checkInputs(inputs, context);
        long start = System.currentTimeMillis();
        logger.info("{} | Subtyping {} with {}.", context.getTag(), views, configuration);

        List<Dataset> harmonized = new ArrayList<>();
        for (View view : views) {
            Dataset dataset = inputs.get(view);
            harmonized.add(Pipelines.forView(view, configuration).apply(dataset, context.forView(view)));
        }
        harmonized = Pipelines.cohort().apply(harmonized, context);
        logger.info("{} | {} samples are shared by all views.", context.getTag(), harmonized.get(0).size());

        Map<View, Dataset> byView = new LinkedHashMap<>();
        List<Dataset> omics = new ArrayList<>();
        for (Dataset dataset : harmonized) {
            if (dataset.getView().isOmics()) {
                dataset = Pipelines.modelReady().apply(dataset, context.forView(dataset.getView()));
                omics.add(dataset);
            }
            byView.put(dataset.getView(), dataset);
        }
        ClusterAssignment truth = ClusterAssignment.fromColumn(byView.get(View.SUBTYPES),
                                                               configuration.getSubtypeColumn());

        List<SimilarityMatrix> networks = similarityEngine.computeAll(omics, context);
        Map<View, SimilarityMatrix> networkMap = new LinkedHashMap<>();
        Map<String, ClusterAssignment> predictions = new LinkedHashMap<>();
        Map<String, MetricsBundle> metrics = new LinkedHashMap<>();
        for (SimilarityMatrix network : networks) {
            networkMap.put(network.getView(), network);
            predict(getSingleViewLabel(network.getView()),
                    network,
                    clusteringEngine,
                    truth,
                    context.forView(network.getView()),
                    predictions,
                    metrics);
        }
        SimilarityMatrix mean = baselineEngine.fuse(networks, context);
        predict(MEAN_FUSED_PREDICTION, mean, clusteringEngine, truth, context, predictions, metrics);
        SimilarityMatrix fused = fusionEngine.fuse(networks, context);
        predict(SNF_FUSED_PREDICTION, fused, clusteringEngine, truth, context, predictions, metrics);
        if (spectralEngine != null)
            predict(SNF_SPECTRAL_PREDICTION, fused, spectralEngine, truth, context, predictions, metrics);

        logger.info("{} | Subtyping done in {} ms.", context.getTag(), System.currentTimeMillis() - start);
        return new AnalysisResult(byView, networkMap, fused, truth, predictions, metrics);
    }

    private void predict(String label,
                         SimilarityMatrix network,
                         ClusteringEngine engine,
                         ClusterAssignment truth,
                         RunContext context,
                         Map<String, ClusterAssignment> predictions,
                         Map<String, MetricsBundle> metrics) {
        ClusterAssignment predicted = engine.cluster(network, context);
        predictions.put(label, predicted);
        metrics.put(label, evaluationEngine.evaluate(label, truth, predicted, network, context));
    }

    /**
     * @return the passed views in their declaration order.
     */
    private List<View> checkInputs(Map<View, Dataset> inputs, RunContext context) {
        if (inputs == null || !inputs.containsKey(View.SUBTYPES))
            throw new ValidationException(null, STAGE, "The known subtypes are required.");
        List<View> rtn = new ArrayList<>();
        int omicsCount = 0;
        for (View view : View.values()) {
            Dataset dataset = inputs.get(view);
            if (dataset == null)
                continue;
            if (dataset.getView() != view)
                throw new ValidationException(view, STAGE, "A " + dataset.getView() + " Dataset is passed as " + view + ".");
            if (dataset.isEmpty())
                throw new ValidationException(view, STAGE, "The Dataset has no sample.");
            if (view.isOmics())
                omicsCount ++;
            rtn.add(view);
        }
        if (omicsCount < 2)
            throw new ValidationException(null, STAGE, "At least two omics views are needed, got " + omicsCount + ".");
        if (inputs.get(View.SUBTYPES).getSchema().indexOf(context.getConfiguration().getSubtypeColumn()) < 0)
            throw new ValidationException(View.SUBTYPES, STAGE, "No column " + context.getConfiguration().getSubtypeColumn() + ".");
        return rtn;
    }

}
