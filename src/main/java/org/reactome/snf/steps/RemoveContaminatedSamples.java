package org.reactome.snf.steps;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.reactome.snf.AnalysisConfiguration;
import org.reactome.snf.Dataset;
import org.reactome.snf.FeatureColumn;
import org.reactome.snf.RunContext;
import org.reactome.snf.Step;
import org.reactome.snf.ValidationException;

/**
 * Drop the samples whose preservation may have been contaminated (e.g. FFPE samples in the
 * clinical table). Only the samples explicitly flagged as clean ("no", "false" or "0", case
 * insensitive) are kept: a missing flag is not trusted.
 * @author wug
 *
 */
public class RemoveContaminatedSamples implements Step<Dataset> {
    private static final Set<String> CLEAN_FLAGS = new HashSet<>(Arrays.asList("no", "false", "0", "0.0"));
    
    private final String flagColumn;
    
    public RemoveContaminatedSamples() {
        this(AnalysisConfiguration.DEFAULT_CONTAMINATION_COLUMN);
    }
    
    public RemoveContaminatedSamples(String flagColumn) {
        if (flagColumn == null)
            throw new IllegalArgumentException("flagColumn cannot be null.");
        this.flagColumn = flagColumn;
    }

    @Override
    public Dataset apply(Dataset input, RunContext context) {
        if (input.getSchema().indexOf(flagColumn) < 0)
            throw new ValidationException(input.getView(), getName(), "No quality flag column named " + flagColumn + ".");
        FeatureColumn flags = input.getColumn(flagColumn);
        List<Integer> kept = new ArrayList<>();
        for (int i = 0; i < input.size(); i++) {
            String flag = flags.getLabel(i);
            if (flag != null && CLEAN_FLAGS.contains(flag.trim().toLowerCase()))
                kept.add(i);
        }
        return input.selectSamples(kept.stream().mapToInt(Integer::intValue).toArray());
    }

}
