package org.reactome.snf.steps;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.reactome.snf.Dataset;
import org.reactome.snf.FeatureColumn;
import org.reactome.snf.RunContext;
import org.reactome.snf.Step;

/**
 * Replace each categorical column with a numeric column of integer codes. The distinct values
 * of a column are sorted and numbered from 0, so the same values always get the same codes.
 * Missing values stay missing (NaN). Numeric columns are left alone.
 * @author wug
 *
 */
public class EncodeCategoricalData implements Step<Dataset> {
    
    public EncodeCategoricalData() {
    }
    
    /**
     * Get the code of each distinct value of a categorical column.
     * @param column
     * @return
     */
    public Map<String, Integer> getCodes(FeatureColumn column) {
        TreeSet<String> values = new TreeSet<>();
        for (int i = 0; i < column.size(); i++) {
            String label = column.getLabel(i);
            if (label != null)
                values.add(label);
        }
        Map<String, Integer> codes = new HashMap<>();
        for (String value : values)
            codes.put(value, codes.size());
        return codes;
    }
    
    public FeatureColumn encode(FeatureColumn column) {
        if (column.isNumeric())
            return column;
        Map<String, Integer> codes = getCodes(column);
        double[] encoded = new double[column.size()];
        for (int i = 0; i < encoded.length; i++) {
            String label = column.getLabel(i);
            encoded[i] = label == null ? Double.NaN : codes.get(label);
        }
        return FeatureColumn.numeric(column.getName(), encoded);
    }

    @Override
    public Dataset apply(Dataset input, RunContext context) {
        boolean hasCategorical = input.getColumns().stream().anyMatch(col -> !col.isNumeric());
        if (!hasCategorical)
            return input;
        List<FeatureColumn> columns = new ArrayList<>();
        for (FeatureColumn column : input.getColumns())
            columns.add(encode(column));
        return input.withColumns(columns);
    }

}
