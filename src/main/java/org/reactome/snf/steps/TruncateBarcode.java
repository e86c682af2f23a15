package org.reactome.snf.steps;

import java.util.HashSet;
import java.util.Set;

import org.reactome.snf.AnalysisConfiguration;
import org.reactome.snf.Dataset;
import org.reactome.snf.RunContext;
import org.reactome.snf.Step;
import org.reactome.snf.ValidationException;

/**
 * Shorten the sample barcodes to the patient part (TCGA-AA-0001-01A becomes TCGA-AA-0001) so
 * that the views can be matched by patient. Running it twice gives the same ids as running
 * it once.
 * @author wug
 *
 */
public class TruncateBarcode implements Step<Dataset> {
    private final int length;
    
    public TruncateBarcode() {
        this(AnalysisConfiguration.DEFAULT_BARCODE_LENGTH);
    }
    
    public TruncateBarcode(int length) {
        if (length <= 0)
            throw new IllegalArgumentException("length must be positive: " + length);
        this.length = length;
    }
    
    /**
     * @param barcode
     * @return null if the barcode is shorter than the configured length.
     */
    public String truncate(String barcode) {
        if (barcode.length() < length)
            return null;
        return barcode.substring(0, length);
    }

    @Override
    public Dataset apply(Dataset input, RunContext context) {
        String[] ids = input.getSampleIds();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < ids.length; i++) {
            String truncated = truncate(ids[i]);
            if (truncated == null)
                throw new ValidationException(input.getView(),
                                              getName(),
                                              "Sample id " + ids[i] + " is shorter than " + length + " characters.");
            // e.g. two vials of the same patient
            if (!seen.add(truncated))
                throw new ValidationException(input.getView(),
                                              getName(),
                                              "More than one sample is truncated to " + truncated + ".");
            ids[i] = truncated;
        }
        return input.withSampleIds(ids);
    }

}
