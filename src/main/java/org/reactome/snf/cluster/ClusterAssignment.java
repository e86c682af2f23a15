package org.reactome.snf.cluster;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.reactome.snf.Dataset;
import org.reactome.snf.FeatureColumn;
import org.reactome.snf.ValidationException;
import org.reactome.snf.steps.EncodeCategoricalData;

import smile.data.vector.IntVector;

/**
 * The cluster label of each sample. Labels have no meaning by themselves: two assignments
 * can only be compared through the partitions they induce.
 * @author wug
 *
 */
public final class ClusterAssignment {
    public static final String CLUSTER_COLUMN = "Cluster";

    private final String[] sampleIds;
    private final int[] labels;
    private final Map<String, Integer> idToIndex;

    public ClusterAssignment(String[] sampleIds, int[] labels) {
        if (sampleIds == null || labels == null)
            throw new IllegalArgumentException("sampleIds and labels are required.");
        if (sampleIds.length != labels.length)
            throw new ValidationException(null, "ClusterAssignment",
                                          sampleIds.length + " samples but " + labels.length + " labels.");
        this.sampleIds = Arrays.copyOf(sampleIds, sampleIds.length);
        this.labels = Arrays.copyOf(labels, labels.length);
        this.idToIndex = new HashMap<>();
        for (int i = 0; i < sampleIds.length; i++) {
            if (idToIndex.put(sampleIds[i], i) != null)
                throw new ValidationException(null, "ClusterAssignment", "Duplicated sample id: " + sampleIds[i]);
        }
    }

    /**
     * Use a column of a Dataset (e.g. the known subtypes) as an assignment. Categorical values are
     * encoded into integer labels. Samples with a missing value are left out.
     * @param dataset
     * @param column
     * @return
     */
    public static ClusterAssignment fromColumn(Dataset dataset, String column) {
        FeatureColumn encoded = new EncodeCategoricalData().encode(dataset.getColumn(column));
        int count = encoded.size() - encoded.countMissing();
        String[] ids = new String[count];
        int[] labels = new int[count];
        int index = 0;
        for (int i = 0; i < encoded.size(); i++) {
            if (encoded.isMissing(i))
                continue;
            double value = encoded.getDouble(i);
            if (value != Math.rint(value))
                throw new ValidationException(dataset.getView(), "ClusterAssignment",
                                              column + " has a non-integer label: " + value);
            ids[index] = dataset.getSampleId(i);
            labels[index] = (int) value;
            index ++;
        }
        return new ClusterAssignment(ids, labels);
    }

    public int size() {
        return sampleIds.length;
    }

    public String[] getSampleIds() {
        return Arrays.copyOf(sampleIds, sampleIds.length);
    }

    public int[] getLabels() {
        return Arrays.copyOf(labels, labels.length);
    }

    public int getLabel(int index) {
        return labels[index];
    }

    public int getLabel(String sampleId) {
        Integer index = idToIndex.get(sampleId);
        if (index == null)
            throw new ValidationException(null, "ClusterAssignment", "No label for sample " + sampleId + ".");
        return labels[index];
    }

    public boolean contains(String sampleId) {
        return idToIndex.containsKey(sampleId);
    }

    /**
     * @return the number of distinct labels.
     */
    public int getClusterCount() {
        TreeSet<Integer> distinct = new TreeSet<>();
        for (int label : labels)
            distinct.add(label);
        return distinct.size();
    }

    /**
     * Get the labels of the passed samples, in the passed order.
     * @param ids
     * @return
     */
    public int[] getLabels(List<String> ids) {
        int[] rtn = new int[ids.size()];
        for (int i = 0; i < rtn.length; i++)
            rtn[i] = getLabel(ids.get(i));
        return rtn;
    }

    /**
     * Wrap the labels into a smile vector named "Cluster" so that it can be merged into a
     * DataFrame having the same row order.
     * @return
     */
    public IntVector toVector() {
        return IntVector.of(CLUSTER_COLUMN, getLabels());
    }

    @Override
    public String toString() {
        return "ClusterAssignment[" + sampleIds.length + " samples, " + getClusterCount() + " clusters]";
    }

}
