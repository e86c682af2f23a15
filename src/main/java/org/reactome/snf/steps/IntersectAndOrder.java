package org.reactome.snf.steps;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.reactome.snf.Dataset;
import org.reactome.snf.RunContext;
import org.reactome.snf.Step;
import org.reactome.snf.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Restrict all Datasets of a cohort to the samples they have in common and sort these samples
 * lexicographically, so that row i refers to the same patient in every view.
 * @author wug
 *
 */
public class IntersectAndOrder implements Step<List<Dataset>> {
    private static final Logger logger = LoggerFactory.getLogger(IntersectAndOrder.class);
    
    public IntersectAndOrder() {
    }
    
    /**
     * @param datasets
     * @return the sorted sample ids present in all the passed Datasets.
     */
    public List<String> getCommonSamples(List<Dataset> datasets) {
        Set<String> common = new LinkedHashSet<>(Arrays.asList(datasets.get(0).getSampleIds()));
        for (int i = 1; i < datasets.size(); i++)
            common.retainAll(Arrays.asList(datasets.get(i).getSampleIds()));
        List<String> rtn = new ArrayList<>(common);
        rtn.sort(null);
        return rtn;
    }

    @Override
    public List<Dataset> apply(List<Dataset> input, RunContext context) {
        if (input == null || input.isEmpty())
            throw new ValidationException(context.getView(), getName(), "No dataset to intersect.");
        List<String> common = getCommonSamples(input);
        if (common.isEmpty())
            throw new ValidationException(context.getView(), getName(), "The datasets have no sample in common.");
        List<Dataset> rtn = new ArrayList<>(input.size());
        for (Dataset dataset : input) {
            logger.debug("{} | {}: keep {} of {} samples.",
                         context.getTag(),
                         dataset.getView(),
                         common.size(),
                         dataset.size());
            rtn.add(dataset.selectSamples(common));
        }
        return rtn;
    }

}
