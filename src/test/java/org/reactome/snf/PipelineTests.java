package org.reactome.snf;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

public class PipelineTests {
    private final RunContext context = new RunContext("test", new AnalysisConfiguration());
    
    private Step<Dataset> addToAll(double delta, List<String> trace) {
        return new Step<Dataset>() {
            @Override
            public Dataset apply(Dataset input, RunContext context) {
                trace.add(getName());
                double[][] values = input.toMatrix();
                for (double[] row : values)
                    for (int j = 0; j < row.length; j++)
                        row[j] += delta;
                return Dataset.of(input.getView(), input.getSampleIds(), input.getSchema().getNames(), values);
            }
            
            @Override
            public String getName() {
                return "Add" + delta;
            }
        };
    }
    
    private Dataset createDataset() {
        return Dataset.of(View.PROTEINS,
                          new String[] {"a", "b"},
                          new String[] {"p1"},
                          new double[][] {{1.0d}, {2.0d}});
    }
    
    @Test
    public void testStepOrder() {
        List<String> trace = new ArrayList<>();
        Step<Dataset> doubling = (input, ctx) -> {
            trace.add("Double");
            double[][] values = input.toMatrix();
            for (double[] row : values)
                row[0] *= 2.0d;
            return Dataset.of(input.getView(), input.getSampleIds(), input.getSchema().getNames(), values);
        };
        Pipeline<Dataset> pipeline = Pipeline.of("Test", addToAll(1.0d, trace), doubling);
        Dataset result = pipeline.apply(createDataset(), context);
        // (x + 1) * 2, not x * 2 + 1
        assertEquals(4.0d, result.getColumn(0).getDouble(0), 0.0d);
        assertEquals(6.0d, result.getColumn(0).getDouble(1), 0.0d);
        assertEquals(2, trace.size());
        assertEquals("Add1.0", trace.get(0));
        assertEquals("Double", trace.get(1));
    }
    
    @Test
    public void testReentrant() {
        List<String> trace = new ArrayList<>();
        Pipeline<Dataset> pipeline = Pipeline.of("Test", addToAll(1.0d, trace));
        Dataset input = createDataset();
        Dataset first = pipeline.apply(input, context);
        Dataset second = pipeline.apply(input, context);
        assertArrayEquals(first.getColumn(0).toDoubleArray(), second.getColumn(0).toDoubleArray(), 0.0d);
        // The input is never changed
        assertEquals(1.0d, input.getColumn(0).getDouble(0), 0.0d);
    }
    
    @Test
    public void testThenKeepsOriginal() {
        List<String> trace = new ArrayList<>();
        Pipeline<Dataset> pipeline = Pipeline.of("Test", addToAll(1.0d, trace));
        Pipeline<Dataset> longer = pipeline.then(addToAll(2.0d, trace));
        assertEquals(1, pipeline.getSteps().size());
        assertEquals(2, longer.getSteps().size());
        assertEquals(4.0d, longer.apply(createDataset(), context).getColumn(0).getDouble(0), 0.0d);
    }
    
    @Test
    public void testFailFast() {
        List<String> trace = new ArrayList<>();
        Step<Dataset> failing = (input, ctx) -> {
            throw new IllegalStateException("boom");
        };
        Pipeline<Dataset> pipeline = Pipeline.of("Test", failing, addToAll(1.0d, trace));
        try {
            pipeline.apply(createDataset(), context);
            fail("The failure should be propagated.");
        }
        catch(MultiOmicsException e) {
            assertEquals(View.PROTEINS, e.getView());
            assertTrue(e.getMessage().contains("boom"));
            assertTrue(e.getCause() instanceof IllegalStateException);
        }
        // The later step never ran
        assertTrue(trace.isEmpty());
    }
    
    @Test
    public void testDomainErrorsAreNotWrapped() {
        ValidationException error = new ValidationException(View.MIRNA, "Check", "bad input");
        Step<Dataset> failing = (input, ctx) -> {
            throw error;
        };
        Pipeline<Dataset> outer = Pipeline.of("Outer", Pipeline.of("Inner", failing));
        try {
            outer.apply(createDataset(), context);
            fail("The failure should be propagated.");
        }
        catch(ValidationException e) {
            assertSame(error, e);
            assertEquals("Check", e.getStage());
            assertEquals("[miRNA/Check] bad input", e.getMessage());
        }
    }
    
    @Test(expected = ValidationException.class)
    public void testNullResult() {
        Step<Dataset> empty = (input, ctx) -> null;
        Pipeline.of("Test", empty).apply(createDataset(), context);
    }
    
}
