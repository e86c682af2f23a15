package org.reactome.snf.steps;

import java.util.ArrayList;
import java.util.List;

import org.reactome.snf.AnalysisConfiguration;
import org.reactome.snf.Dataset;
import org.reactome.snf.RunContext;
import org.reactome.snf.Step;
import org.reactome.snf.ValidationException;

/**
 * Keep the samples coming from a primary tumor. In a TCGA barcode such as TCGA-AA-0001-01A, 
 * the two characters at offset 13 give the sample type, and 01 is the primary solid tumor.
 * @author wug
 *
 */
public class RetainMainTumors implements Step<Dataset> {
    private final int offset;
    private final String primaryTumorCode;
    
    public RetainMainTumors() {
        this(AnalysisConfiguration.DEFAULT_SAMPLE_TYPE_OFFSET,
             AnalysisConfiguration.DEFAULT_PRIMARY_TUMOR_CODE);
    }
    
    public RetainMainTumors(int offset, String primaryTumorCode) {
        if (offset < 0 || primaryTumorCode == null || primaryTumorCode.isEmpty())
            throw new IllegalArgumentException("Invalid sample type offset or code.");
        this.offset = offset;
        this.primaryTumorCode = primaryTumorCode;
    }
    
    /**
     * Extract the sample type code from a barcode.
     * @param barcode
     * @return null if the barcode is too short to carry a sample type.
     */
    public String getSampleType(String barcode) {
        int end = offset + primaryTumorCode.length();
        if (barcode.length() < end)
            return null;
        return barcode.substring(offset, end);
    }
    
    public boolean isPrimaryTumor(String barcode) {
        return primaryTumorCode.equals(getSampleType(barcode));
    }

    @Override
    public Dataset apply(Dataset input, RunContext context) {
        List<Integer> kept = new ArrayList<>();
        for (int i = 0; i < input.size(); i++) {
            String barcode = input.getSampleId(i);
            if (getSampleType(barcode) == null)
                throw new ValidationException(input.getView(), 
                                              getName(),
                                              "Sample id " + barcode + " has no sample type code at offset " + offset + ".");
            if (isPrimaryTumor(barcode))
                kept.add(i);
        }
        return input.selectSamples(kept.stream().mapToInt(Integer::intValue).toArray());
    }

}
