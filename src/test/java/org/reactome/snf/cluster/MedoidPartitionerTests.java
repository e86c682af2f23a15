package org.reactome.snf.cluster;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.reactome.snf.AnalysisConfiguration;
import org.reactome.snf.DegeneratePartitionException;
import org.reactome.snf.RunContext;
import org.reactome.snf.SyntheticCohorts;
import org.reactome.snf.ValidationException;
import org.reactome.snf.View;
import org.reactome.snf.cluster.MedoidPartitioner.Initialization;
import org.reactome.snf.evaluation.ClusterMetrics;
import org.reactome.snf.network.SimilarityEngine;
import org.reactome.snf.network.SimilarityMatrix;

public class MedoidPartitionerTests {
    private final RunContext context = new RunContext("test", new AnalysisConfiguration());
    
    @Test
    public void testBuild() {
        SimilarityMatrix network = ClusterTestData.blocks(3, 3);
        int[] medoids = new MedoidPartitioner(3, 1L).build(network.toDistances());
        assertArrayEquals(new int[] {0, 3, 6}, medoids);
    }
    
    @Test
    public void testBlocks() {
        SimilarityMatrix network = ClusterTestData.blocks(3, 3);
        ClusterAssignment assignment = new MedoidPartitioner(3, 1L).cluster(network, context);
        assertEquals(3, assignment.getClusterCount());
        assertArrayEquals(ClusterTestData.blockLabels(3, 3), assignment.getLabels());
        assertArrayEquals(network.getSampleIds(), assignment.getSampleIds());
    }
    
    @Test
    public void testDeterminism() {
        String[] ids = SyntheticCohorts.barcodes(12);
        SimilarityMatrix network = new SimilarityEngine(5, 0.5d, true).compute(SyntheticCohorts.omicsView(View.MRNA, ids, 9L), context);
        for (Initialization initialization : Initialization.values()) {
            MedoidPartitioner partitioner = new MedoidPartitioner(2, 42L, 100, initialization);
            ClusterAssignment first = partitioner.cluster(network, context);
            ClusterAssignment second = new MedoidPartitioner(2, 42L, 100, initialization).cluster(network, context);
            assertArrayEquals(first.getLabels(), second.getLabels());
            assertEquals(2, first.getClusterCount());
            assertEquals(1.0d, ClusterMetrics.randIndex(SyntheticCohorts.plantedLabels(12), first.getLabels()), 1.0e-12);
        }
    }
    
    @Test
    public void testPlusPlus() {
        SimilarityMatrix network = ClusterTestData.blocks(4, 3);
        MedoidPartitioner partitioner = new MedoidPartitioner(4, 7L, 100, Initialization.KMEDOIDS_PLUS_PLUS);
        int[] medoids = partitioner.plusPlus(network.toDistances());
        assertEquals(4, medoids.length);
        assertArrayEquals(medoids, new MedoidPartitioner(4, 7L, 100, Initialization.KMEDOIDS_PLUS_PLUS).plusPlus(network.toDistances()));
        for (int i = 0; i < medoids.length; i++)
            for (int j = i + 1; j < medoids.length; j++)
                assertTrue(medoids[i] != medoids[j]);
        ClusterAssignment assignment = partitioner.cluster(network, context);
        assertEquals(1.0d, ClusterMetrics.randIndex(ClusterTestData.blockLabels(4, 3), assignment.getLabels()), 1.0e-12);
    }
    
    @Test(expected = DegeneratePartitionException.class)
    public void testTooManyClusters() {
        new MedoidPartitioner(9, 1L).cluster(ClusterTestData.blocks(3, 3), context);
    }
    
    @Test(expected = ValidationException.class)
    public void testTooFewClusters() {
        new MedoidPartitioner(1, 1L);
    }
    
}
