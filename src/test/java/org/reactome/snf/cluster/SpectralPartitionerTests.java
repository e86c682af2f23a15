package org.reactome.snf.cluster;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;
import org.reactome.snf.AnalysisConfiguration;
import org.reactome.snf.DegeneratePartitionException;
import org.reactome.snf.NumericInstabilityException;
import org.reactome.snf.RunContext;
import org.reactome.snf.evaluation.ClusterMetrics;
import org.reactome.snf.network.SimilarityMatrix;

public class SpectralPartitionerTests {
    private final RunContext context = new RunContext("test", new AnalysisConfiguration());
    
    @Test
    public void testBlocks() {
        SimilarityMatrix network = ClusterTestData.blocks(3, 3);
        ClusterAssignment assignment = new SpectralPartitioner(3, 20, 42L).cluster(network, context);
        assertEquals(3, assignment.getClusterCount());
        assertEquals(1.0d, ClusterMetrics.randIndex(ClusterTestData.blockLabels(3, 3), assignment.getLabels()), 1.0e-12);
    }
    
    @Test
    public void testReproducible() {
        SimilarityMatrix network = ClusterTestData.blocks(3, 3);
        SpectralPartitioner partitioner = new SpectralPartitioner(3, 4, 7L);
        int[] first = partitioner.cluster(network, context).getLabels();
        int[] second = partitioner.cluster(network, context).getLabels();
        assertArrayEquals(first, second);
    }
    
    @Test(expected = NumericInstabilityException.class)
    public void testIsolatedSample() {
        double[][] values = ClusterTestData.blocks(3, 3).toArray();
        for (int j = 0; j < values.length; j++) {
            if (j != 0) {
                values[0][j] = 0.0d;
                values[j][0] = 0.0d;
            }
        }
        SimilarityMatrix network = new SimilarityMatrix(ClusterTestData.blocks(3, 3).getSampleIds(), values, null);
        new SpectralPartitioner(3, 20, 42L).cluster(network, context);
    }
    
    @Test
    public void testNeighborGraph() {
        double[][] values = {
                {1.0d, 0.9d, 0.2d, 0.1d},
                {0.9d, 1.0d, 0.3d, 0.2d},
                {0.2d, 0.3d, 1.0d, 0.8d},
                {0.1d, 0.2d, 0.8d, 1.0d}
        };
        double[][] graph = new SpectralPartitioner(2, 1, 42L).neighborGraph(values);
        for (int i = 0; i < values.length; i++) {
            assertEquals(0.0d, graph[i][i], 0.0d);
            for (int j = 0; j < values.length; j++)
                assertEquals(graph[i][j], graph[j][i], 0.0d);
        }
        assertEquals(0.9d, graph[0][1], 0.0d);
        assertEquals(0.8d, graph[2][3], 0.0d);
        assertEquals(0.0d, graph[1][2], 0.0d);
        assertEquals(0.0d, graph[0][3], 0.0d);
    }
    
    @Test(expected = DegeneratePartitionException.class)
    public void testTooManyClusters() {
        new SpectralPartitioner(4, 20, 42L).cluster(ClusterTestData.blocks(2, 2), context);
    }
    
}
