package org.reactome.snf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The ordered list of features of a Dataset. The version is bumped every time a step
 * produces a new column layout so that two schemas with the same version and view are
 * known to come from the same chain of transformations.
 * @author wug
 *
 */
public final class FeatureSchema {
    private final List<Feature> features;
    private final Map<String, Integer> nameToIndex;
    private final int version;
    
    public FeatureSchema(List<Feature> features) {
        this(features, 1);
    }
    
    public FeatureSchema(List<Feature> features, int version) {
        this.features = Collections.unmodifiableList(new ArrayList<>(features));
        this.version = version;
        this.nameToIndex = new HashMap<>();
        for (int i = 0; i < this.features.size(); i++) {
            String name = this.features.get(i).getName();
            if (nameToIndex.put(name, i) != null)
                throw new ValidationException(null, 
                                              "Schema",
                                              "Duplicated feature name: " + name);
        }
    }
    
    /**
     * Create a new schema derived from this one with a bumped version.
     * @param features
     * @return
     */
    public FeatureSchema derive(List<Feature> features) {
        return new FeatureSchema(features, version + 1);
    }

    public List<Feature> getFeatures() {
        return features;
    }
    
    public Feature getFeature(int index) {
        return features.get(index);
    }
    
    public int size() {
        return features.size();
    }

    public int getVersion() {
        return version;
    }
    
    /**
     * @param name
     * @return -1 if there is no such feature.
     */
    public int indexOf(String name) {
        Integer index = nameToIndex.get(name);
        return index == null ? -1 : index;
    }
    
    public String[] getNames() {
        return features.stream().map(Feature::getName).toArray(String[]::new);
    }

    @Override
    public String toString() {
        return "FeatureSchema[v" + version + ", " + features.size() + " features]";
    }

}
