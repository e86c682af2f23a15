package org.reactome.snf.steps;

import java.util.ArrayList;
import java.util.List;

import org.reactome.snf.Dataset;
import org.reactome.snf.FeatureColumn;
import org.reactome.snf.RunContext;
import org.reactome.snf.Step;
import org.reactome.snf.ValidationException;

/**
 * Replace missing numeric values with the mean of the column. Columns must be numeric.
 * @author wug
 *
 */
public class ImputeMissingValues implements Step<Dataset> {
    
    public ImputeMissingValues() {
    }

    @Override
    public Dataset apply(Dataset input, RunContext context) {
        List<FeatureColumn> columns = new ArrayList<>();
        boolean changed = false;
        for (FeatureColumn column : input.getColumns()) {
            if (!column.isNumeric())
                throw new ValidationException(input.getView(), getName(), column.getName() + " is categorical. Encode it first.");
            int missing = column.countMissing();
            if (missing == 0) {
                columns.add(column);
                continue;
            }
            if (missing == column.size())
                throw new ValidationException(input.getView(), getName(), "All values are missing in " + column.getName() + ".");
            double[] values = column.toDoubleArray();
            double sum = 0.0d;
            for (double value : values) {
                if (!Double.isNaN(value))
                    sum += value;
            }
            double mean = sum / (values.length - missing);
            for (int i = 0; i < values.length; i++) {
                if (Double.isNaN(values[i]))
                    values[i] = mean;
            }
            columns.add(FeatureColumn.numeric(column.getName(), values));
            changed = true;
        }
        return changed ? input.withColumns(columns) : input;
    }

}
