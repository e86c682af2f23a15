package org.reactome.snf.steps;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.reactome.snf.Dataset;
import org.reactome.snf.RunContext;
import org.reactome.snf.Step;
import org.reactome.snf.ValidationException;

/**
 * Keep the named columns, in the given order.
 * @author wug
 *
 */
public class SelectFeatures implements Step<Dataset> {
    private final List<String> names;
    
    public SelectFeatures(String... names) {
        if (names.length == 0)
            throw new IllegalArgumentException("No feature to select.");
        this.names = Collections.unmodifiableList(new ArrayList<>(Arrays.asList(names)));
    }

    @Override
    public Dataset apply(Dataset input, RunContext context) {
        int[] indices = new int[names.size()];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = input.getSchema().indexOf(names.get(i));
            if (indices[i] < 0)
                throw new ValidationException(input.getView(), getName(), "No feature named " + names.get(i) + ".");
        }
        return input.selectFeatures(indices);
    }

}
