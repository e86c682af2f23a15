package org.reactome.snf;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An ordered, immutable list of steps. The output of a step is fed into the next one. If a
 * step fails, the whole run is aborted and nothing is returned. A Pipeline is a Step itself
 * so that pipelines can be nested.
 * @param <T>
 * @author wug
 *
 */
public final class Pipeline<T> implements Step<T> {
    private static final Logger logger = LoggerFactory.getLogger(Pipeline.class);

    private final String name;
    private final List<Step<T>> steps;

    public Pipeline(String name, List<Step<T>> steps) {
        if (name == null || steps == null || steps.isEmpty())
            throw new IllegalArgumentException("A pipeline needs a name and at least one step.");
        this.name = name;
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    @SafeVarargs
    public static <T> Pipeline<T> of(String name, Step<T>... steps) {
        return new Pipeline<>(name, Arrays.asList(steps));
    }

    @Override
    public String getName() {
        return name;
    }

    public List<Step<T>> getSteps() {
        return steps;
    }

    /**
     * Create a new pipeline with the passed step appended. This pipeline is not changed.
     * @param step
     * @return
     */
    public Pipeline<T> then(Step<T> step) {
        List<Step<T>> list = new ArrayList<>(steps);
        list.add(step);
        return new Pipeline<>(name, list);
    }

    @Override
    public T apply(T input, RunContext context) {
        logger.debug("{} | Running {} pipeline...", context.getTag(), name);
        long start = System.currentTimeMillis();
        T result = input;
        for (Step<T> step : steps)
            result = runStep(step, result, context);
        logger.debug("{} | Pipeline {} ran in {} ms.",
                     context.getTag(),
                     name,
                     System.currentTimeMillis() - start);
        return result;
    }

    private T runStep(Step<T> step, T input, RunContext context) {
        logger.debug("{} | Running {}...", context.getTag(), step.getName());
        long start = System.currentTimeMillis();
        T result = null;
        try {
            result = step.apply(input, context);
        }
        catch(MultiOmicsException e) {
            // Nested pipelines have reported their own failure
            if (!(step instanceof Pipeline))
                logger.error("{} | {} failed in pipeline {}: {}", context.getTag(), step.getName(), name, e.getMessage());
            throw e;
        }
        catch(RuntimeException e) {
            logger.error("{} | {} failed in pipeline {}: {}", context.getTag(), step.getName(), name, e.getMessage());
            throw new MultiOmicsException(viewOf(input, context),
                                          step.getName(),
                                          "Unexpected failure: " + e.getMessage(),
                                          e);
        }
        if (result == null)
            throw new ValidationException(viewOf(input, context), step.getName(), "The step returned no result.");
        logger.debug("{} | {} ran in {} ms.",
                     context.getTag(),
                     step.getName(),
                     System.currentTimeMillis() - start);
        return result;
    }

    private View viewOf(T input, RunContext context) {
        if (input instanceof Dataset)
            return ((Dataset) input).getView();
        return context.getView();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(name).append("[");
        steps.forEach(step -> builder.append(step.getName()).append(", "));
        builder.setLength(builder.length() - 2);
        builder.append("]");
        return builder.toString();
    }

}
