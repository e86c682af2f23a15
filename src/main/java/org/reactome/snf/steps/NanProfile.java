package org.reactome.snf.steps;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.reactome.snf.Dataset;
import org.reactome.snf.FeatureColumn;

/**
 * The fraction of missing values in each column of a Dataset.
 * @author wug
 *
 */
public final class NanProfile {
    private final List<String> columns;
    private final double[] fractions;
    
    private NanProfile(List<String> columns, double[] fractions) {
        this.columns = Collections.unmodifiableList(columns);
        this.fractions = fractions;
    }
    
    public static NanProfile of(Dataset dataset) {
        List<String> names = new ArrayList<>();
        double[] fractions = new double[dataset.getFeatureCount()];
        for (int i = 0; i < fractions.length; i++) {
            FeatureColumn col = dataset.getColumn(i);
            names.add(col.getName());
            fractions[i] = col.getMissingFraction();
        }
        return new NanProfile(names, fractions);
    }
    
    public List<String> getColumns() {
        return columns;
    }
    
    public double getFraction(int column) {
        return fractions[column];
    }
    
    public int size() {
        return fractions.length;
    }
    
    /**
     * @return the number of columns with at least one missing value.
     */
    public int countColumnsWithMissing() {
        int count = 0;
        for (double fraction : fractions) {
            if (fraction > 0.0d)
                count ++;
        }
        return count;
    }

}
