package org.reactome.snf.steps;

import java.util.ArrayList;
import java.util.List;

import org.reactome.snf.Dataset;
import org.reactome.snf.RunContext;
import org.reactome.snf.Step;

/**
 * Apply a per-Dataset step (or pipeline) to every Dataset of a cohort, keeping the order.
 * @author wug
 *
 */
public class ForEachView implements Step<List<Dataset>> {
    private final Step<Dataset> step;
    
    public ForEachView(Step<Dataset> step) {
        if (step == null)
            throw new IllegalArgumentException("step cannot be null.");
        this.step = step;
    }
    
    @Override
    public String getName() {
        return "ForEachView(" + step.getName() + ")";
    }

    @Override
    public List<Dataset> apply(List<Dataset> input, RunContext context) {
        List<Dataset> rtn = new ArrayList<>(input.size());
        for (Dataset dataset : input)
            rtn.add(step.apply(dataset, context.forView(dataset.getView())));
        return rtn;
    }

}
