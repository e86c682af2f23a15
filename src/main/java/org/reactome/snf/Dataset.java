package org.reactome.snf;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import smile.data.DataFrame;
import smile.data.vector.BaseVector;
import smile.data.vector.DoubleVector;
import smile.data.vector.StringVector;

/**
 * A typed table for one view over a patient cohort: an ordered list of unique sample ids
 * (rows) and a fixed schema of feature columns. A Dataset is immutable. All the select
 * and with methods return new objects.
 * @author wug
 *
 */
@SuppressWarnings("rawtypes")
public final class Dataset {
    public static final String SAMPLE_ID_COLUMN = "SampleID";

    private final View view;
    private final String[] sampleIds;
    private final Map<String, Integer> idToRow;
    private final FeatureSchema schema;
    private final List<FeatureColumn> columns;

    public Dataset(View view,
                   String[] sampleIds,
                   FeatureSchema schema,
                   List<FeatureColumn> columns) {
        if (view == null || sampleIds == null || schema == null || columns == null)
            throw new IllegalArgumentException("view, sampleIds, schema and columns are required.");
        if (schema.size() != columns.size())
            throw new ValidationException(view, "Dataset",
                                          "Schema has " + schema.size() + " features but " + columns.size() + " columns are given.");
        this.view = view;
        this.sampleIds = Arrays.copyOf(sampleIds, sampleIds.length);
        this.schema = schema;
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.idToRow = new HashMap<>();
        for (int i = 0; i < this.sampleIds.length; i++) {
            if (this.sampleIds[i] == null)
                throw new ValidationException(view, "Dataset", "Null sample id at row " + i + ".");
            if (idToRow.put(this.sampleIds[i], i) != null)
                throw new ValidationException(view, "Dataset", "Duplicated sample id: " + this.sampleIds[i]);
        }
        for (int i = 0; i < this.columns.size(); i++) {
            FeatureColumn col = this.columns.get(i);
            if (!col.getFeature().equals(schema.getFeature(i)))
                throw new ValidationException(view, "Dataset",
                                              "Column " + i + " (" + col.getFeature() + ") does not match the schema (" + schema.getFeature(i) + ").");
            if (col.size() != this.sampleIds.length)
                throw new ValidationException(view, "Dataset",
                                              "Column " + col.getName() + " has " + col.size() + " values for " + this.sampleIds.length + " samples.");
        }
    }

    public Dataset(View view,
                   String[] sampleIds,
                   List<FeatureColumn> columns) {
        this(view, sampleIds, schemaOf(columns, 1), columns);
    }

    /**
     * A convenient method to create an all-numeric Dataset from a sample x feature matrix.
     * @param view
     * @param sampleIds
     * @param featureNames
     * @param values
     * @return
     */
    public static Dataset of(View view,
                             String[] sampleIds,
                             String[] featureNames,
                             double[][] values) {
        if (values.length != sampleIds.length)
            throw new ValidationException(view, "Dataset",
                                          "The number of rows is not the same as the number of sample ids!");
        List<FeatureColumn> columns = new ArrayList<>();
        for (int j = 0; j < featureNames.length; j++) {
            double[] col = new double[values.length];
            for (int i = 0; i < values.length; i++) {
                if (values[i].length != featureNames.length)
                    throw new ValidationException(view, "Dataset",
                                                  "Row " + i + " doesn't have " + featureNames.length + " values.");
                col[i] = values[i][j];
            }
            columns.add(FeatureColumn.numeric(featureNames[j], col));
        }
        return new Dataset(view, sampleIds, columns);
    }

    private static FeatureSchema schemaOf(List<FeatureColumn> columns, int version) {
        List<Feature> features = new ArrayList<>();
        columns.forEach(col -> features.add(col.getFeature()));
        return new FeatureSchema(features, version);
    }

    /**
     * Convert a DataFrame object produced by a loader into a Dataset. String columns become
     * categorical features, all other columns numeric features. Null cells are treated as
     * missing values.
     * @param frame
     * @param idCol the column holding the sample ids
     * @param view
     * @return
     */
    public static Dataset fromDataFrame(DataFrame frame,
                                        int idCol,
                                        View view) {
        BaseVector ids = frame.column(idCol);
        String[] sampleIds = new String[ids.size()];
        for (int i = 0; i < sampleIds.length; i++) {
            Object id = ids.get(i);
            sampleIds[i] = id == null ? null : id.toString();
        }
        String[] names = frame.names();
        List<FeatureColumn> columns = new ArrayList<>();
        for (int j = 0; j < names.length; j++) {
            if (j == idCol)
                continue;
            BaseVector vector = frame.column(j);
            if (vector instanceof StringVector || !isNumeric(vector)) {
                String[] values = new String[vector.size()];
                for (int i = 0; i < values.length; i++) {
                    Object value = vector.get(i);
                    values[i] = value == null ? null : value.toString();
                }
                columns.add(FeatureColumn.categorical(names[j], values));
            }
            else {
                double[] values = new double[vector.size()];
                for (int i = 0; i < values.length; i++) {
                    Object value = vector.get(i);
                    values[i] = value == null ? Double.NaN : ((Number) value).doubleValue();
                }
                columns.add(FeatureColumn.numeric(names[j], values));
            }
        }
        return new Dataset(view, sampleIds, columns);
    }

    private static boolean isNumeric(BaseVector vector) {
        for (int i = 0; i < vector.size(); i++) {
            Object value = vector.get(i);
            if (value != null && !(value instanceof Number))
                return false;
        }
        return true;
    }

    /**
     * Convert this Dataset into a smile DataFrame with the sample ids in the first column.
     * @return
     */
    public DataFrame toDataFrame() {
        BaseVector[] cols = new BaseVector[columns.size() + 1];
        cols[0] = StringVector.of(SAMPLE_ID_COLUMN, getSampleIds());
        for (int i = 0; i < columns.size(); i++) {
            FeatureColumn col = columns.get(i);
            if (col.isNumeric())
                cols[i + 1] = DoubleVector.of(col.getName(), col.toDoubleArray());
            else
                cols[i + 1] = StringVector.of(col.getName(), col.toStringArray());
        }
        return DataFrame.of(cols);
    }

    public View getView() {
        return view;
    }

    public String[] getSampleIds() {
        return Arrays.copyOf(sampleIds, sampleIds.length);
    }

    public String getSampleId(int row) {
        return sampleIds[row];
    }

    /**
     * @param sampleId
     * @return -1 if the sample is not in this Dataset.
     */
    public int indexOf(String sampleId) {
        Integer row = idToRow.get(sampleId);
        return row == null ? -1 : row;
    }

    public boolean contains(String sampleId) {
        return idToRow.containsKey(sampleId);
    }

    public FeatureSchema getSchema() {
        return schema;
    }

    public List<FeatureColumn> getColumns() {
        return columns;
    }

    public FeatureColumn getColumn(int index) {
        return columns.get(index);
    }

    /**
     * @param name
     * @return
     * @throws ValidationException if there is no such column.
     */
    public FeatureColumn getColumn(String name) {
        int index = schema.indexOf(name);
        if (index < 0)
            throw new ValidationException(view, "Dataset", "No feature named " + name + ".");
        return columns.get(index);
    }

    public int size() {
        return sampleIds.length;
    }

    public int getFeatureCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return sampleIds.length == 0;
    }

    /**
     * Keep the passed rows in the passed order.
     * @param rows
     * @return
     */
    public Dataset selectSamples(int[] rows) {
        String[] ids = new String[rows.length];
        for (int i = 0; i < rows.length; i++)
            ids[i] = sampleIds[rows[i]];
        List<FeatureColumn> selected = new ArrayList<>(columns.size());
        for (FeatureColumn col : columns)
            selected.add(col.select(rows));
        return new Dataset(view, ids, schema, selected);
    }

    /**
     * Keep the passed samples in the passed order.
     * @param ids
     * @return
     */
    public Dataset selectSamples(List<String> ids) {
        int[] rows = new int[ids.size()];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = indexOf(ids.get(i));
            if (rows[i] < 0)
                throw new ValidationException(view, "Dataset", "Sample " + ids.get(i) + " is not in the dataset.");
        }
        return selectSamples(rows);
    }

    /**
     * Keep the passed columns in the passed order.
     * @param colIndices
     * @return
     */
    public Dataset selectFeatures(int[] colIndices) {
        List<FeatureColumn> selected = new ArrayList<>(colIndices.length);
        for (int index : colIndices)
            selected.add(columns.get(index));
        return withColumns(selected);
    }

    /**
     * Replace the columns. The schema version is bumped.
     * @param newColumns
     * @return
     */
    public Dataset withColumns(List<FeatureColumn> newColumns) {
        List<Feature> features = new ArrayList<>();
        newColumns.forEach(col -> features.add(col.getFeature()));
        return new Dataset(view, sampleIds, schema.derive(features), newColumns);
    }

    /**
     * Rename the samples. The row order and the values are kept.
     * @param newIds
     * @return
     */
    public Dataset withSampleIds(String[] newIds) {
        if (newIds.length != sampleIds.length)
            throw new ValidationException(view, "Dataset",
                                          "Expected " + sampleIds.length + " sample ids but got " + newIds.length + ".");
        return new Dataset(view, newIds, schema, columns);
    }

    /**
     * Get the values in the sample x feature layout. All columns must be numeric. Missing values
     * are kept as NaN.
     * @return
     */
    public double[][] toMatrix() {
        double[][] rtn = new double[sampleIds.length][columns.size()];
        for (int j = 0; j < columns.size(); j++) {
            FeatureColumn col = columns.get(j);
            if (!col.isNumeric())
                throw new ValidationException(view, "Dataset",
                                              "Column " + col.getName() + " is categorical. Encode it first.");
            for (int i = 0; i < sampleIds.length; i++)
                rtn[i][j] = col.getDouble(i);
        }
        return rtn;
    }

    /**
     * Check if the passed Dataset has exactly the same samples in the same order.
     * @param other
     * @return
     */
    public boolean isAlignedWith(Dataset other) {
        return Arrays.equals(sampleIds, other.sampleIds);
    }

    @Override
    public String toString() {
        return "Dataset[" + view.getLabel() + ", " + sampleIds.length + " samples x " + columns.size() + " features]";
    }

}
