package com.quakesieve.core.record;

import java.util.Collections;
import java.util.List;

/**
 * The two output catalogs of a run, ready to be written.
 *
 * @since 1.0.0
 */
public final class AssembledCatalog {

    private final List<String> independentHeader;
    private final List<OutputRecord> independent;
    private final List<String> dependentHeader;
    private final List<OutputRecord> dependent;

    public AssembledCatalog(List<String> independentHeader, List<OutputRecord> independent,
            List<String> dependentHeader, List<OutputRecord> dependent) {
        this.independentHeader = Collections.unmodifiableList(independentHeader);
        this.independent = Collections.unmodifiableList(independent);
        this.dependentHeader = Collections.unmodifiableList(dependentHeader);
        this.dependent = Collections.unmodifiableList(dependent);
    }

    public List<String> getIndependentHeader() {
        return independentHeader;
    }

    public List<OutputRecord> getIndependent() {
        return independent;
    }

    public List<String> getDependentHeader() {
        return dependentHeader;
    }

    public List<OutputRecord> getDependent() {
        return dependent;
    }

    @Override
    public String toString() {
        return "AssembledCatalog{independent=" + independent.size()
                + ", dependent=" + dependent.size() + '}';
    }
}
