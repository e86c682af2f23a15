package org.reactome.snf;

/**
 * A single transformation over a Dataset (T = Dataset) or over a whole cohort
 * (T = List&lt;Dataset&gt;). Implementations must be pure functions of their configuration
 * and input: they must not modify the input, and must not keep anything learned from one
 * call for the next one.
 * @param <T>
 * @author wug
 *
 */
@FunctionalInterface
public interface Step<T> {
    
    T apply(T input, RunContext context);
    
    default String getName() {
        return getClass().getSimpleName();
    }

}
