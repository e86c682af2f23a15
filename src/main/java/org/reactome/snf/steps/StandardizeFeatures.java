package org.reactome.snf.steps;

import java.util.ArrayList;
import java.util.List;

import org.reactome.snf.Dataset;
import org.reactome.snf.FeatureColumn;
import org.reactome.snf.NumericInstabilityException;
import org.reactome.snf.RunContext;
import org.reactome.snf.Step;
import org.reactome.snf.ValidationException;

import smile.math.MathEx;

/**
 * Z-score each column: subtract the mean and divide by the sample standard deviation. The mean
 * and standard deviation are computed from the passed Dataset on each call and never kept.
 * @author wug
 *
 */
public class StandardizeFeatures implements Step<Dataset> {
    
    public StandardizeFeatures() {
    }

    @Override
    public Dataset apply(Dataset input, RunContext context) {
        if (input.size() < 2)
            throw new ValidationException(input.getView(), getName(), "At least two samples are needed to standardize.");
        List<FeatureColumn> columns = new ArrayList<>();
        for (FeatureColumn column : input.getColumns()) {
            if (!column.isNumeric())
                throw new ValidationException(input.getView(), getName(), column.getName() + " is categorical. Encode it first.");
            if (column.countMissing() > 0)
                throw new ValidationException(input.getView(), getName(), column.getName() + " has missing values. Impute them first.");
            double[] values = column.toDoubleArray();
            double mean = MathEx.mean(values);
            double sd = MathEx.sd(values);
            if (!(sd > 0.0d) || Double.isInfinite(sd))
                throw new NumericInstabilityException(input.getView(), 
                                                      getName(),
                                                      "Column " + column.getName() + " has zero or undefined variance.");
            for (int i = 0; i < values.length; i++)
                values[i] = (values[i] - mean) / sd;
            columns.add(FeatureColumn.numeric(column.getName(), values));
        }
        return input.withColumns(columns);
    }

}
