package org.reactome.snf;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Parameters of a subtyping run. Every value has an explicit default, which is also
 * listed in the snf-analysis.properties resource shipped with the jar. The object is
 * immutable: use the with methods to derive a changed copy.
 * @author wug
 *
 */
public final class AnalysisConfiguration {
    public static final String DEFAULT_RESOURCE = "snf-analysis.properties";

    public static final double DEFAULT_NAN_THRESHOLD = 0.1d;
    public static final int DEFAULT_VARIANCE_TOP = 100;
    public static final int DEFAULT_BARCODE_LENGTH = 12;
    public static final int DEFAULT_SAMPLE_TYPE_OFFSET = 13;
    public static final String DEFAULT_PRIMARY_TUMOR_CODE = "01";
    public static final String DEFAULT_CONTAMINATION_COLUMN = "patient.samples.sample.2.is_ffpe";
    public static final int DEFAULT_SIMILARITY_NEIGHBORS = 20;
    public static final double DEFAULT_SIMILARITY_MU = 0.5d;
    public static final int DEFAULT_FUSION_NEIGHBORS = 20;
    public static final int DEFAULT_FUSION_ITERATIONS = 20;
    public static final int DEFAULT_CLUSTERS = 3;
    public static final long DEFAULT_SEED = 42L;
    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final int DEFAULT_SPECTRAL_NEIGHBORS = 20;
    public static final String DEFAULT_SUBTYPE_COLUMN = "Subtype_Integrative";

    private double nanThreshold = DEFAULT_NAN_THRESHOLD;
    private int varianceTop = DEFAULT_VARIANCE_TOP;
    private int barcodeLength = DEFAULT_BARCODE_LENGTH;
    private int sampleTypeOffset = DEFAULT_SAMPLE_TYPE_OFFSET;
    private String primaryTumorCode = DEFAULT_PRIMARY_TUMOR_CODE;
    private String contaminationColumn = DEFAULT_CONTAMINATION_COLUMN;
    private int similarityNeighbors = DEFAULT_SIMILARITY_NEIGHBORS;
    private double similarityMu = DEFAULT_SIMILARITY_MU;
    private int fusionNeighbors = DEFAULT_FUSION_NEIGHBORS;
    private int fusionIterations = DEFAULT_FUSION_ITERATIONS;
    private int clusters = DEFAULT_CLUSTERS;
    private long seed = DEFAULT_SEED;
    private int maxIterations = DEFAULT_MAX_ITERATIONS;
    private int spectralNeighbors = DEFAULT_SPECTRAL_NEIGHBORS;
    private String subtypeColumn = DEFAULT_SUBTYPE_COLUMN;

    public AnalysisConfiguration() {
    }

    private AnalysisConfiguration copy() {
        AnalysisConfiguration rtn = new AnalysisConfiguration();
        rtn.nanThreshold = nanThreshold;
        rtn.varianceTop = varianceTop;
        rtn.barcodeLength = barcodeLength;
        rtn.sampleTypeOffset = sampleTypeOffset;
        rtn.primaryTumorCode = primaryTumorCode;
        rtn.contaminationColumn = contaminationColumn;
        rtn.similarityNeighbors = similarityNeighbors;
        rtn.similarityMu = similarityMu;
        rtn.fusionNeighbors = fusionNeighbors;
        rtn.fusionIterations = fusionIterations;
        rtn.clusters = clusters;
        rtn.seed = seed;
        rtn.maxIterations = maxIterations;
        rtn.spectralNeighbors = spectralNeighbors;
        rtn.subtypeColumn = subtypeColumn;
        return rtn;
    }

    /**
     * Load the defaults shipped in the classpath resource.
     * @return
     */
    public static AnalysisConfiguration load() {
        try (InputStream is = AnalysisConfiguration.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null)
                return new AnalysisConfiguration();
            return load(is);
        }
        catch(IOException e) {
            throw new ValidationException(null, "Configuration", "Cannot read " + DEFAULT_RESOURCE + ": " + e.getMessage());
        }
    }

    public static AnalysisConfiguration load(InputStream is) throws IOException {
        Properties properties = new Properties();
        properties.load(is);
        return fromProperties(properties);
    }

    /**
     * Keys not in the passed Properties keep their defaults.
     * @param properties
     * @return
     */
    public static AnalysisConfiguration fromProperties(Properties properties) {
        AnalysisConfiguration rtn = new AnalysisConfiguration();
        rtn.nanThreshold = getDouble(properties, "harmonize.nan.threshold", rtn.nanThreshold);
        rtn.varianceTop = getInt(properties, "harmonize.variance.top", rtn.varianceTop);
        rtn.barcodeLength = getInt(properties, "harmonize.barcode.length", rtn.barcodeLength);
        rtn.sampleTypeOffset = getInt(properties, "harmonize.sample.type.offset", rtn.sampleTypeOffset);
        rtn.primaryTumorCode = properties.getProperty("harmonize.primary.tumor.code", rtn.primaryTumorCode).trim();
        rtn.contaminationColumn = properties.getProperty("harmonize.contamination.column", rtn.contaminationColumn).trim();
        rtn.similarityNeighbors = getInt(properties, "similarity.neighbors", rtn.similarityNeighbors);
        rtn.similarityMu = getDouble(properties, "similarity.mu", rtn.similarityMu);
        rtn.fusionNeighbors = getInt(properties, "fusion.neighbors", rtn.fusionNeighbors);
        rtn.fusionIterations = getInt(properties, "fusion.iterations", rtn.fusionIterations);
        rtn.clusters = getInt(properties, "clustering.clusters", rtn.clusters);
        rtn.seed = getLong(properties, "clustering.seed", rtn.seed);
        rtn.maxIterations = getInt(properties, "clustering.max.iterations", rtn.maxIterations);
        rtn.spectralNeighbors = getInt(properties, "clustering.spectral.neighbors", rtn.spectralNeighbors);
        rtn.subtypeColumn = properties.getProperty("evaluation.subtype.column", rtn.subtypeColumn).trim();
        rtn.validate();
        return rtn;
    }

    private static double getDouble(Properties properties, String key, double defaultValue) {
        String text = properties.getProperty(key);
        if (text == null)
            return defaultValue;
        try {
            return Double.parseDouble(text.trim());
        }
        catch(NumberFormatException e) {
            throw new ValidationException(null, "Configuration", key + " is not a number: " + text);
        }
    }

    private static int getInt(Properties properties, String key, int defaultValue) {
        return (int) getLong(properties, key, defaultValue);
    }

    private static long getLong(Properties properties, String key, long defaultValue) {
        String text = properties.getProperty(key);
        if (text == null)
            return defaultValue;
        try {
            return Long.parseLong(text.trim());
        }
        catch(NumberFormatException e) {
            throw new ValidationException(null, "Configuration", key + " is not an integer: " + text);
        }
    }

    private AnalysisConfiguration validate() {
        if (!(nanThreshold >= 0.0d && nanThreshold <= 1.0d))
            throw new ValidationException(null, "Configuration", "harmonize.nan.threshold must be in [0, 1]: " + nanThreshold);
        requirePositive("harmonize.variance.top", varianceTop);
        requirePositive("harmonize.barcode.length", barcodeLength);
        if (sampleTypeOffset < 0)
            throw new ValidationException(null, "Configuration", "harmonize.sample.type.offset must not be negative.");
        if (primaryTumorCode.isEmpty())
            throw new ValidationException(null, "Configuration", "harmonize.primary.tumor.code must not be empty.");
        requirePositive("similarity.neighbors", similarityNeighbors);
        if (!(similarityMu > 0.0d) || Double.isInfinite(similarityMu))
            throw new ValidationException(null, "Configuration", "similarity.mu must be positive: " + similarityMu);
        requirePositive("fusion.neighbors", fusionNeighbors);
        requirePositive("fusion.iterations", fusionIterations);
        if (clusters < 2)
            throw new ValidationException(null, "Configuration", "clustering.clusters must be at least 2: " + clusters);
        requirePositive("clustering.max.iterations", maxIterations);
        requirePositive("clustering.spectral.neighbors", spectralNeighbors);
        return this;
    }

    private void requirePositive(String key, int value) {
        if (value <= 0)
            throw new ValidationException(null, "Configuration", key + " must be positive: " + value);
    }

    public double getNanThreshold() {
        return nanThreshold;
    }

    public AnalysisConfiguration withNanThreshold(double nanThreshold) {
        AnalysisConfiguration rtn = copy();
        rtn.nanThreshold = nanThreshold;
        return rtn.validate();
    }

    public int getVarianceTop() {
        return varianceTop;
    }

    public AnalysisConfiguration withVarianceTop(int varianceTop) {
        AnalysisConfiguration rtn = copy();
        rtn.varianceTop = varianceTop;
        return rtn.validate();
    }

    public int getBarcodeLength() {
        return barcodeLength;
    }

    public int getSampleTypeOffset() {
        return sampleTypeOffset;
    }

    public String getPrimaryTumorCode() {
        return primaryTumorCode;
    }

    public String getContaminationColumn() {
        return contaminationColumn;
    }

    public int getSimilarityNeighbors() {
        return similarityNeighbors;
    }

    public AnalysisConfiguration withSimilarityNeighbors(int similarityNeighbors) {
        AnalysisConfiguration rtn = copy();
        rtn.similarityNeighbors = similarityNeighbors;
        return rtn.validate();
    }

    public double getSimilarityMu() {
        return similarityMu;
    }

    public int getFusionNeighbors() {
        return fusionNeighbors;
    }

    public AnalysisConfiguration withFusionNeighbors(int fusionNeighbors) {
        AnalysisConfiguration rtn = copy();
        rtn.fusionNeighbors = fusionNeighbors;
        return rtn.validate();
    }

    public int getFusionIterations() {
        return fusionIterations;
    }

    public AnalysisConfiguration withFusionIterations(int fusionIterations) {
        AnalysisConfiguration rtn = copy();
        rtn.fusionIterations = fusionIterations;
        return rtn.validate();
    }

    public int getClusters() {
        return clusters;
    }

    public AnalysisConfiguration withClusters(int clusters) {
        AnalysisConfiguration rtn = copy();
        rtn.clusters = clusters;
        return rtn.validate();
    }

    public long getSeed() {
        return seed;
    }

    public AnalysisConfiguration withSeed(long seed) {
        AnalysisConfiguration rtn = copy();
        rtn.seed = seed;
        return rtn;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public int getSpectralNeighbors() {
        return spectralNeighbors;
    }

    public String getSubtypeColumn() {
        return subtypeColumn;
    }

    public AnalysisConfiguration withSubtypeColumn(String subtypeColumn) {
        AnalysisConfiguration rtn = copy();
        rtn.subtypeColumn = subtypeColumn;
        return rtn;
    }

    @Override
    public String toString() {
        return "AnalysisConfiguration[nanThreshold=" + nanThreshold +
               ", varianceTop=" + varianceTop +
               ", similarityNeighbors=" + similarityNeighbors +
               ", fusionNeighbors=" + fusionNeighbors +
               ", fusionIterations=" + fusionIterations +
               ", clusters=" + clusters +
               ", seed=" + seed + "]";
    }

}
