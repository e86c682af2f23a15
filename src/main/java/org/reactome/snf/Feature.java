package org.reactome.snf;

import java.util.Objects;

/**
 * A named column of a Dataset together with its kind.
 * @author wug
 *
 */
public final class Feature {
    private final String name;
    private final FeatureType type;
    
    public Feature(String name, FeatureType type) {
        if (name == null || type == null)
            throw new IllegalArgumentException("A feature needs both a name and a type.");
        this.name = name;
        this.type = type;
    }
    
    public static Feature numeric(String name) {
        return new Feature(name, FeatureType.NUMERIC);
    }
    
    public static Feature categorical(String name) {
        return new Feature(name, FeatureType.CATEGORICAL);
    }

    public String getName() {
        return name;
    }

    public FeatureType getType() {
        return type;
    }
    
    public boolean isNumeric() {
        return type == FeatureType.NUMERIC;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Feature))
            return false;
        Feature other = (Feature) obj;
        return name.equals(other.name) && type == other.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + ":" + type;
    }

}
