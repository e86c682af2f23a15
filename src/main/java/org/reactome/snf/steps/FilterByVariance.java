package org.reactome.snf.steps;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import org.reactome.snf.AnalysisConfiguration;
import org.reactome.snf.Dataset;
import org.reactome.snf.FeatureColumn;
import org.reactome.snf.RunContext;
import org.reactome.snf.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import smile.math.MathEx;

/**
 * Keep the top columns by variance. Categorical columns are encoded first. Variance is computed
 * over the non-missing values; a column with a single value has variance 0, and only an
 * entirely missing column is never selected. Ties are resolved by the original column order, and the kept columns stay
 * in their original order.
 * @author wug
 *
 */
public class FilterByVariance implements Step<Dataset> {
    private static final Logger logger = LoggerFactory.getLogger(FilterByVariance.class);
    
    private final int top;
    private final EncodeCategoricalData encoder = new EncodeCategoricalData();
    
    public FilterByVariance() {
        this(AnalysisConfiguration.DEFAULT_VARIANCE_TOP);
    }
    
    public FilterByVariance(int top) {
        if (top <= 0)
            throw new IllegalArgumentException("top must be positive: " + top);
        this.top = top;
    }
    
    public int getTop() {
        return top;
    }
    
    /**
     * Sample variance of the non-missing values.
     * @param column a numeric column
     * @return NaN if all values are missing, 0 for a single value.
     */
    public static double variance(FeatureColumn column) {
        double[] values = Arrays.stream(column.toDoubleArray())
                                .filter(v -> !Double.isNaN(v))
                                .toArray();
        if (values.length == 0)
            return Double.NaN;
        if (values.length == 1)
            return 0.0d;
        return MathEx.var(values);
    }

    @Override
    public Dataset apply(Dataset input, RunContext context) {
        Dataset encoded = encoder.apply(input, context);
        double[] variances = new double[encoded.getFeatureCount()];
        List<Integer> candidates = new ArrayList<>();
        for (int i = 0; i < variances.length; i++) {
            variances[i] = variance(encoded.getColumn(i));
            // An all-missing column is simply not a candidate
            if (!Double.isNaN(variances[i]))
                candidates.add(i);
        }
        // List.sort is stable, so equal variances keep the column order
        candidates.sort(Comparator.comparingDouble((Integer i) -> variances[i]).reversed());
        int[] kept = candidates.subList(0, Math.min(top, candidates.size()))
                               .stream()
                               .mapToInt(Integer::intValue)
                               .sorted()
                               .toArray();
        logger.debug("{} | Keep {} of {} columns by variance.",
                     context.getTag(),
                     kept.length,
                     variances.length);
        return encoded.selectFeatures(kept);
    }

}
