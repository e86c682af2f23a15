package org.reactome.snf;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.Test;
import org.reactome.snf.cluster.ClusterAssignment;
import org.reactome.snf.cluster.MedoidPartitioner;
import org.reactome.snf.evaluation.ClusterMetrics;
import org.reactome.snf.evaluation.EvaluationEngine;
import org.reactome.snf.evaluation.Metric;
import org.reactome.snf.evaluation.MetricsBundle;
import org.reactome.snf.network.SimilarityEngine;
import org.reactome.snf.network.SimilarityMatrix;
import org.reactome.snf.network.SimilarityNetworkFusion;

/**
 * Runs on three views of 12 samples made of two well separated groups of 6.
 * @author wug
 *
 */
public class SubtypeAnalysisTests {
    
    private AnalysisConfiguration createConfiguration() {
        return new AnalysisConfiguration().withClusters(2)
                                          .withSimilarityNeighbors(5)
                                          .withFusionNeighbors(5);
    }
    
    @Test
    public void testRecoverPlantedGroups() {
        RunContext context = new RunContext("planted", createConfiguration());
        String[] ids = SyntheticCohorts.barcodes(SyntheticCohorts.SAMPLES);
        SimilarityEngine engine = SimilarityEngine.of(context.getConfiguration());
        List<SimilarityMatrix> networks = engine.computeAll(Arrays.asList(SyntheticCohorts.omicsView(View.PROTEINS, ids, 1L),
                                                                          SyntheticCohorts.omicsView(View.MRNA, ids, 2L),
                                                                          SyntheticCohorts.omicsView(View.MIRNA, ids, 3L)),
                                                            context);
        SimilarityMatrix fused = SimilarityNetworkFusion.of(context.getConfiguration()).fuse(networks, context);
        ClusterAssignment predicted = MedoidPartitioner.of(context.getConfiguration()).cluster(fused, context);
        ClusterAssignment truth = new ClusterAssignment(ids, SyntheticCohorts.plantedLabels(ids.length));
        MetricsBundle bundle = new EvaluationEngine().evaluate(SubtypeAnalysis.SNF_FUSED_PREDICTION, truth, predicted, fused, context);
        assertEquals(1.0d, bundle.getValue(Metric.RAND_SCORE), 0.0d);
        assertEquals(1.0d, ClusterMetrics.adjustedRandIndex(truth.getLabels(), predicted.getLabels()), 1.0e-12);
        assertTrue(bundle.getValue(Metric.SILHOUETTE_SCORE) > 0.0d);
    }
    
    @Test
    public void testRun() {
        RunContext context = new RunContext("cohort", createConfiguration());
        Map<View, Dataset> cohort = SyntheticCohorts.cohort();
        AnalysisResult result = SubtypeAnalysis.of(context.getConfiguration()).run(cohort, context);
        
        String[] patients = SyntheticCohorts.patients(SyntheticCohorts.SAMPLES);
        assertEquals(5, result.getHarmonized().size());
        for (Dataset dataset : result.getHarmonized().values())
            assertArrayEquals(patients, dataset.getSampleIds());
        // Only the omics views get a network
        assertEquals(Arrays.asList(View.PROTEINS, View.MRNA, View.MIRNA), Arrays.asList(result.getNetworks().keySet().toArray()));
        assertArrayEquals(patients, result.getFused().getSampleIds());
        
        List<String> expected = Arrays.asList("Proteins-only prediction",
                                              "mRNA-only prediction",
                                              "miRNA-only prediction",
                                              SubtypeAnalysis.MEAN_FUSED_PREDICTION,
                                              SubtypeAnalysis.SNF_FUSED_PREDICTION,
                                              SubtypeAnalysis.SNF_SPECTRAL_PREDICTION);
        assertEquals(expected, Arrays.asList(result.getMetrics().keySet().toArray()));
        for (String label : expected) {
            MetricsBundle bundle = result.getMetrics(label);
            assertEquals(label, bundle.getLabel());
            assertEquals(4, bundle.getMetrics().size());
            assertNotNull(result.getPrediction(label));
        }
        assertEquals(1.0d, result.getMetrics(SubtypeAnalysis.SNF_FUSED_PREDICTION).getValue(Metric.RAND_SCORE), 0.0d);
        assertEquals(2, result.getTruth().getClusterCount());
    }
    
    @Test
    public void testMissingSubtypes() {
        RunContext context = new RunContext("cohort", createConfiguration());
        Map<View, Dataset> cohort = SyntheticCohorts.cohort();
        cohort.remove(View.SUBTYPES);
        try {
            SubtypeAnalysis.of(context.getConfiguration()).run(cohort, context);
            fail("The known subtypes are required.");
        }
        catch(ValidationException e) {
            assertEquals("Analysis", e.getStage());
        }
    }
    
    @Test
    public void testSingleOmicsView() {
        RunContext context = new RunContext("cohort", createConfiguration());
        Map<View, Dataset> cohort = SyntheticCohorts.cohort();
        cohort.remove(View.MRNA);
        cohort.remove(View.MIRNA);
        try {
            SubtypeAnalysis.of(context.getConfiguration()).run(cohort, context);
            fail("Fusion needs two omics views.");
        }
        catch(ValidationException e) {
            assertTrue(e.getMessage().contains("two omics views"));
        }
    }
    
    @Test
    public void testNoSharedPatient() {
        RunContext context = new RunContext("cohort", createConfiguration());
        Map<View, Dataset> cohort = SyntheticCohorts.cohort();
        String[] others = new String[SyntheticCohorts.SAMPLES];
        for (int i = 0; i < others.length; i++)
            others[i] = SyntheticCohorts.barcode(i + 100);
        cohort.put(View.MIRNA, SyntheticCohorts.omicsView(View.MIRNA, others, 3L));
        try {
            SubtypeAnalysis.of(context.getConfiguration()).run(cohort, context);
            fail("The views share no patient.");
        }
        catch(ValidationException e) {
            assertEquals("IntersectAndOrder", e.getStage());
        }
    }
    
}
