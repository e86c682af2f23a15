package org.reactome.snf;

public enum FeatureType {
    NUMERIC,
    CATEGORICAL;
}
