package org.reactome.snf.steps;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.junit.Test;
import org.reactome.snf.AnalysisConfiguration;
import org.reactome.snf.Dataset;
import org.reactome.snf.FeatureColumn;
import org.reactome.snf.RunContext;
import org.reactome.snf.View;

/**
 * Tests for the steps selecting columns.
 * @author wug
 *
 */
public class ColumnFilterTests {
    private final RunContext context = new RunContext("test", new AnalysisConfiguration());
    private static final double NaN = Double.NaN;
    
    private Dataset createDataset() {
        String[] ids = {"s1", "s2", "s3", "s4", "s5"};
        List<FeatureColumn> columns = Arrays.asList(FeatureColumn.numeric("low", new double[] {1, 1, 1, 1, 2}),
                                                    FeatureColumn.numeric("high", new double[] {0, 10, 20, 30, 40}),
                                                    FeatureColumn.numeric("empty", new double[] {NaN, NaN, NaN, NaN, NaN}),
                                                    FeatureColumn.numeric("medium", new double[] {0, 1, NaN, 3, 4}),
                                                    FeatureColumn.categorical("grade", new String[] {"G1", "G2", "G3", "G1", "G2"}),
                                                    FeatureColumn.numeric("high2", new double[] {40, 30, 20, 10, 0}));
        return new Dataset(View.PROTEINS, ids, columns);
    }
    
    @Test
    public void testNanProfile() {
        NanProfile profile = NanProfile.of(createDataset());
        assertEquals(6, profile.size());
        assertEquals(1.0d, profile.getFraction(2), 0.0d);
        assertEquals(0.2d, profile.getFraction(3), 1.0e-12);
        assertEquals(2, profile.countColumnsWithMissing());
        assertEquals("medium", profile.getColumns().get(3));
    }
    
    @Test
    public void testFilterByNanPercentage() {
        Dataset dataset = createDataset();
        Dataset strict = new FilterByNanPercentage(0.0d).apply(dataset, context);
        assertArrayEquals(new String[] {"low", "high", "grade", "high2"}, strict.getSchema().getNames());
        Dataset relaxed = new FilterByNanPercentage(0.2d).apply(dataset, context);
        assertArrayEquals(new String[] {"low", "high", "medium", "grade", "high2"}, relaxed.getSchema().getNames());
        assertTrue(new FilterByNanPercentage(1.0d).apply(dataset, context).getFeatureCount() == 6);
    }
    
    @Test
    public void testFilterByVariance() {
        Dataset dataset = createDataset();
        // high and high2 tie: both are kept in their original order
        Dataset top2 = new FilterByVariance(2).apply(dataset, context);
        assertArrayEquals(new String[] {"high", "high2"}, top2.getSchema().getNames());
        // The tie is broken by the column order
        Dataset top1 = new FilterByVariance(1).apply(dataset, context);
        assertArrayEquals(new String[] {"high"}, top1.getSchema().getNames());
        // The encoded grade (0, 1, 2, 0, 1) has a larger variance than low
        Dataset top4 = new FilterByVariance(4).apply(dataset, context);
        assertArrayEquals(new String[] {"high", "medium", "grade", "high2"}, top4.getSchema().getNames());
        assertTrue(top4.getColumn("grade").isNumeric());
        // The all-missing column is never selected
        Dataset all = new FilterByVariance(100).apply(dataset, context);
        assertArrayEquals(new String[] {"low", "high", "medium", "grade", "high2"}, all.getSchema().getNames());
    }
    
    @Test
    public void testSingleValueColumn() {
        String[] ids = {"s1", "s2", "s3", "s4"};
        List<FeatureColumn> columns = Arrays.asList(FeatureColumn.numeric("spread", new double[] {0, 5, 10, 15}),
                                                    FeatureColumn.numeric("single", new double[] {NaN, NaN, 7, NaN}),
                                                    FeatureColumn.numeric("empty", new double[] {NaN, NaN, NaN, NaN}));
        Dataset dataset = new Dataset(View.MRNA, ids, columns);
        assertEquals(0.0d, FilterByVariance.variance(dataset.getColumn("single")), 0.0d);
        assertTrue(Double.isNaN(FilterByVariance.variance(dataset.getColumn("empty"))));
        Dataset top2 = new FilterByVariance(2).apply(dataset, context);
        assertArrayEquals(new String[] {"spread", "single"}, top2.getSchema().getNames());
        Dataset all = new FilterByVariance(3).apply(dataset, context);
        assertArrayEquals(new String[] {"spread", "single"}, all.getSchema().getNames());
    }
    
    @Test
    public void testFilterByVarianceCount() {
        Random random = new Random(11L);
        int columns = 30;
        double[][] values = new double[8][columns];
        String[] names = new String[columns];
        for (int j = 0; j < columns; j++) {
            names[j] = "f" + j;
            for (int i = 0; i < values.length; i++)
                values[i][j] = random.nextGaussian() * (1 + j % 7);
        }
        String[] ids = {"a", "b", "c", "d", "e", "f", "g", "h"};
        Dataset dataset = Dataset.of(View.MIRNA, ids, names, values);
        for (int k : new int[] {1, 5, 30, 50}) {
            Dataset filtered = new FilterByVariance(k).apply(dataset, context);
            assertEquals(Math.min(k, columns), filtered.getFeatureCount());
            double lowestKept = Double.POSITIVE_INFINITY;
            for (FeatureColumn column : filtered.getColumns())
                lowestKept = Math.min(lowestKept, FilterByVariance.variance(column));
            // No dropped column has a larger variance than a kept one
            for (FeatureColumn column : dataset.getColumns()) {
                if (filtered.getSchema().indexOf(column.getName()) < 0)
                    assertTrue(FilterByVariance.variance(column) <= lowestKept);
            }
        }
    }
    
    @Test
    public void testSelectFeatures() {
        Dataset selected = new SelectFeatures("grade", "low").apply(createDataset(), context);
        assertArrayEquals(new String[] {"grade", "low"}, selected.getSchema().getNames());
    }
    
}
