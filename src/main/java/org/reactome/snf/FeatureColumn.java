package org.reactome.snf;

import java.util.Arrays;

/**
 * Values of one feature over the samples of a Dataset. Numeric columns use NaN for a
 * missing value, categorical columns use null. Instances are never modified after
 * construction.
 * @author wug
 *
 */
public final class FeatureColumn {
    private final Feature feature;
    // Only one of these two is set, depending on the feature type
    private final double[] numbers;
    private final String[] labels;

    private FeatureColumn(Feature feature, double[] numbers, String[] labels) {
        this.feature = feature;
        this.numbers = numbers;
        this.labels = labels;
    }

    public static FeatureColumn numeric(String name, double[] values) {
        return new FeatureColumn(Feature.numeric(name),
                                 Arrays.copyOf(values, values.length),
                                 null);
    }

    public static FeatureColumn categorical(String name, String[] values) {
        return new FeatureColumn(Feature.categorical(name),
                                 null,
                                 Arrays.copyOf(values, values.length));
    }

    public Feature getFeature() {
        return feature;
    }

    public String getName() {
        return feature.getName();
    }

    public boolean isNumeric() {
        return feature.isNumeric();
    }

    public int size() {
        return isNumeric() ? numbers.length : labels.length;
    }

    public double getDouble(int row) {
        if (!isNumeric())
            throw new IllegalStateException(getName() + " is a categorical column.");
        return numbers[row];
    }

    public String getLabel(int row) {
        if (isNumeric())
            return Double.isNaN(numbers[row]) ? null : String.valueOf(numbers[row]);
        return labels[row];
    }

    public boolean isMissing(int row) {
        if (isNumeric())
            return Double.isNaN(numbers[row]);
        return labels[row] == null;
    }

    /**
     * @return a copy of the numeric values.
     */
    public double[] toDoubleArray() {
        if (!isNumeric())
            throw new IllegalStateException(getName() + " is a categorical column.");
        return Arrays.copyOf(numbers, numbers.length);
    }

    /**
     * @return a copy of the values as text, null for missing values.
     */
    public String[] toStringArray() {
        String[] rtn = new String[size()];
        for (int i = 0; i < rtn.length; i++)
            rtn[i] = getLabel(i);
        return rtn;
    }

    public int countMissing() {
        int count = 0;
        for (int i = 0; i < size(); i++) {
            if (isMissing(i))
                count ++;
        }
        return count;
    }

    public double getMissingFraction() {
        if (size() == 0)
            return 0.0d;
        return countMissing() / (double) size();
    }

    /**
     * Pick rows in the passed order.
     * @param rows
     * @return
     */
    public FeatureColumn select(int[] rows) {
        if (isNumeric()) {
            double[] copy = new double[rows.length];
            for (int i = 0; i < rows.length; i++)
                copy[i] = numbers[rows[i]];
            return new FeatureColumn(feature, copy, null);
        }
        String[] copy = new String[rows.length];
        for (int i = 0; i < rows.length; i++)
            copy[i] = labels[rows[i]];
        return new FeatureColumn(feature, null, copy);
    }

    @Override
    public String toString() {
        return feature + "(" + size() + " values)";
    }

}
