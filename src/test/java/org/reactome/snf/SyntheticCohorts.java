package org.reactome.snf;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Random;

/**
 * Small cohorts with a planted structure: the first half of the samples forms one group, the
 * second half another, and every omics view separates the two groups well.
 * @author wug
 *
 */
public class SyntheticCohorts {
    public static final int SAMPLES = 12;
    public static final int FEATURES = 10;
    public static final String SUBTYPE_COLUMN = "Subtype_Integrative";
    public static final String FFPE_COLUMN = "patient.samples.sample.2.is_ffpe";

    private SyntheticCohorts() {
    }

    /**
     * @param patient
     * @return a primary tumor barcode such as TCGA-AA-0001-01A
     */
    public static String barcode(int patient) {
        return String.format("%s-01A", patient(patient));
    }

    public static String patient(int patient) {
        return String.format("TCGA-AA-%04d", patient + 1);
    }

    public static String[] barcodes(int size) {
        String[] rtn = new String[size];
        for (int i = 0; i < size; i++)
            rtn[i] = barcode(i);
        return rtn;
    }

    public static String[] patients(int size) {
        String[] rtn = new String[size];
        for (int i = 0; i < size; i++)
            rtn[i] = patient(i);
        return rtn;
    }

    /**
     * @param size
     * @return 0 for the first half of the samples, 1 for the second half.
     */
    public static int[] plantedLabels(int size) {
        int[] rtn = new int[size];
        for (int i = 0; i < size; i++)
            rtn[i] = i < size / 2 ? 0 : 1;
        return rtn;
    }

    /**
     * Two groups of samples centered at 0 and 10 in every feature with a small gaussian noise.
     * Features are scaled differently so that standardization matters.
     */
    public static double[][] twoGroups(int size, int features, long seed) {
        Random random = new Random(seed);
        int[] labels = plantedLabels(size);
        double[][] rtn = new double[size][features];
        for (int i = 0; i < size; i++) {
            for (int j = 0; j < features; j++) {
                double center = labels[i] * 10.0d;
                rtn[i][j] = (j + 1) * (center + 0.1d * random.nextGaussian());
            }
        }
        return rtn;
    }

    public static String[] featureNames(String prefix, int features) {
        String[] rtn = new String[features];
        for (int j = 0; j < features; j++)
            rtn[j] = prefix + j;
        return rtn;
    }

    public static Dataset omicsView(View view, String[] sampleIds, long seed) {
        return Dataset.of(view,
                          sampleIds,
                          featureNames(view.getLabel() + "_", FEATURES),
                          twoGroups(sampleIds.length, FEATURES, seed));
    }

    public static Dataset subtypes(String[] sampleIds) {
        int[] labels = plantedLabels(sampleIds.length);
        String[] subtypes = new String[sampleIds.length];
        for (int i = 0; i < subtypes.length; i++)
            subtypes[i] = labels[i] == 0 ? "iC1" : "iC2";
        return new Dataset(View.SUBTYPES,
                           sampleIds,
                           Collections.singletonList(FeatureColumn.categorical(SUBTYPE_COLUMN, subtypes)));
    }

    public static Dataset phenotype(String[] patientIds) {
        String[] flags = new String[patientIds.length];
        double[] ages = new double[patientIds.length];
        for (int i = 0; i < flags.length; i++) {
            flags[i] = "NO";
            ages[i] = 40.0d + i;
        }
        return new Dataset(View.PHENOTYPE,
                           patientIds,
                           Arrays.asList(FeatureColumn.categorical(FFPE_COLUMN, flags),
                                                   FeatureColumn.numeric("age_at_diagnosis", ages)));
    }

    /**
     * A raw cohort: three omics views, the clinical table and the subtypes over the same
     * patients. The proteins also have a normal tissue sample that harmonization has to drop.
     */
    public static Map<View, Dataset> cohort() {
        Map<View, Dataset> rtn = new EnumMap<>(View.class);
        String[] ids = barcodes(SAMPLES);
        String[] withNormal = Arrays.copyOf(ids, SAMPLES + 1);
        withNormal[SAMPLES] = "TCGA-AA-0001-11A";
        Dataset proteins = omicsView(View.PROTEINS, withNormal, 1L);
        rtn.put(View.PROTEINS, proteins);
        rtn.put(View.MRNA, omicsView(View.MRNA, ids, 2L));
        rtn.put(View.MIRNA, omicsView(View.MIRNA, ids, 3L));
        rtn.put(View.PHENOTYPE, phenotype(patients(SAMPLES)));
        rtn.put(View.SUBTYPES, subtypes(ids));
        return rtn;
    }

}
