package com.quakesieve.core.cluster;

import com.quakesieve.core.model.DeclusteringResult;
import com.quakesieve.core.model.Event;

import java.util.List;

/**
 * Contract for all declustering engines.
 * <p>
 * Implementations are <strong>stateless</strong>: every call to
 * {@link #decluster(List)} starts from scratch and returns an independent
 * result, so one instance can serve any number of runs. Configuration
 * problems are rejected when the engine is constructed, never half-way
 * through a catalog.
 * </p>
 */
public interface Declusterer {

    /**
     * Partition a catalog into independent and dependent events.
     *
     * @param events the catalog, in input order; ids must be unique
     * @return the partition, in input order
     * @throws IllegalArgumentException if the catalog contains duplicate ids
     *                                  or an event the engine cannot handle
     */
    DeclusteringResult decluster(List<Event> events);

    /**
     * Return a short name describing this engine, used in logs and summaries.
     *
     * @return engine name
     */
    String getMethodName();
}
