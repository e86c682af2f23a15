package org.reactome.snf.steps;

import java.util.ArrayList;
import java.util.List;

import org.reactome.snf.AnalysisConfiguration;
import org.reactome.snf.Dataset;
import org.reactome.snf.RunContext;
import org.reactome.snf.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keep the columns whose fraction of missing values is not above the threshold.
 * @author wug
 *
 */
public class FilterByNanPercentage implements Step<Dataset> {
    private static final Logger logger = LoggerFactory.getLogger(FilterByNanPercentage.class);
    
    private final double threshold;
    
    public FilterByNanPercentage() {
        this(AnalysisConfiguration.DEFAULT_NAN_THRESHOLD);
    }
    
    public FilterByNanPercentage(double threshold) {
        if (!(threshold >= 0.0d && threshold <= 1.0d))
            throw new IllegalArgumentException("threshold must be in [0, 1]: " + threshold);
        this.threshold = threshold;
    }
    
    public double getThreshold() {
        return threshold;
    }

    @Override
    public Dataset apply(Dataset input, RunContext context) {
        NanProfile profile = NanProfile.of(input);
        List<Integer> kept = new ArrayList<>();
        for (int i = 0; i < profile.size(); i++) {
            if (profile.getFraction(i) <= threshold)
                kept.add(i);
        }
        logger.debug("{} | {} of {} columns have at most {} missing values.",
                     context.getTag(),
                     kept.size(),
                     profile.size(),
                     threshold);
        return input.selectFeatures(kept.stream().mapToInt(Integer::intValue).toArray());
    }

}
