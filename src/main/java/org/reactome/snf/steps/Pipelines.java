package org.reactome.snf.steps;

import java.util.List;

import org.reactome.snf.AnalysisConfiguration;
import org.reactome.snf.Dataset;
import org.reactome.snf.Pipeline;
import org.reactome.snf.View;

/**
 * The standard pipelines of a subtyping run. Every call builds new Pipeline objects from the
 * passed configuration; nothing is shared between calls.
 * @author wug
 *
 */
public class Pipelines {

    private Pipelines() {
    }

    /**
     * Proteins, mRNA and miRNA: primary tumors only, drop columns with too many missing values,
     * keep the most variable columns and shorten the barcodes to the patient part.
     * @param configuration
     * @return
     */
    public static Pipeline<Dataset> omics(AnalysisConfiguration configuration) {
        return Pipeline.of("Omics",
                           new RetainMainTumors(configuration.getSampleTypeOffset(), configuration.getPrimaryTumorCode()),
                           new FilterByNanPercentage(configuration.getNanThreshold()),
                           new FilterByVariance(configuration.getVarianceTop()),
                           new TruncateBarcode(configuration.getBarcodeLength()));
    }

    /**
     * The clinical table is already indexed by patient.
     * @param configuration
     * @return
     */
    public static Pipeline<Dataset> phenotype(AnalysisConfiguration configuration) {
        return Pipeline.of("Phenotype",
                           new RemoveContaminatedSamples(configuration.getContaminationColumn()));
    }

    public static Pipeline<Dataset> subtypes(AnalysisConfiguration configuration) {
        return Pipeline.of("Subtypes",
                           new RetainMainTumors(configuration.getSampleTypeOffset(), configuration.getPrimaryTumorCode()),
                           new TruncateBarcode(configuration.getBarcodeLength()));
    }

    /**
     * Pick the harmonization pipeline of a view.
     * @param view
     * @param configuration
     * @return
     */
    public static Pipeline<Dataset> forView(View view, AnalysisConfiguration configuration) {
        switch (view) {
            case PHENOTYPE :
                return phenotype(configuration);
            case SUBTYPES :
                return subtypes(configuration);
            default :
                return omics(configuration);
        }
    }

    public static Pipeline<List<Dataset>> cohort() {
        return Pipeline.of("Cohort", new IntersectAndOrder());
    }

    /**
     * Turn a harmonized omics view into a complete, standardized numeric matrix ready for
     * affinity construction.
     * @return
     */
    public static Pipeline<Dataset> modelReady() {
        return Pipeline.of("ModelReady",
                           new EncodeCategoricalData(),
                           new ImputeMissingValues(),
                           new StandardizeFeatures());
    }

}
