package com.quakesieve.core.record;

import com.quakesieve.core.model.Attribution;
import com.quakesieve.core.model.ClassifiedEvent;
import com.quakesieve.core.model.DeclusteringResult;
import com.quakesieve.core.model.Event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Re-projects a {@link DeclusteringResult} into output records.
 *
 * <p>
 * Every record carries its event's input fields verbatim and in input order.
 * With attributed output, dependent records additionally carry
 * {@value #PARENT_ID}, {@value #PARENT_MAGNITUDE}, {@value #DELTA_T_SECONDS}
 * (signed, parent to event) and {@value #DELTA_DISTANCE_KM}. Independent
 * records never carry them.
 * </p>
 *
 * @since 1.0.0
 */
public final class ResultAssembler {

    public static final String PARENT_ID = "parent_id";
    public static final String PARENT_MAGNITUDE = "parent_magnitude";
    public static final String DELTA_T_SECONDS = "delta_t_seconds";
    public static final String DELTA_DISTANCE_KM = "delta_distance_km";

    /** Attribution columns, in output order. */
    public static final List<String> ATTRIBUTION_COLUMNS = Collections.unmodifiableList(
            List.of(PARENT_ID, PARENT_MAGNITUDE, DELTA_T_SECONDS, DELTA_DISTANCE_KM));

    private ResultAssembler() {
        // utility class — not instantiable
    }

    /**
     * Assemble the output catalogs using the input header.
     *
     * @param result     the classification
     * @param header     input column names, in input order
     * @param attributed whether dependent records get attribution columns
     * @return the two catalogs
     */
    public static AssembledCatalog assemble(DeclusteringResult result, List<String> header, boolean attributed) {
        Objects.requireNonNull(result, "DeclusteringResult must not be null");
        Objects.requireNonNull(header, "Header must not be null");

        List<String> dependentHeader = new ArrayList<>(header);
        if (attributed) {
            dependentHeader.addAll(ATTRIBUTION_COLUMNS);
        }

        List<OutputRecord> independent = new ArrayList<>(result.getIndependent().size());
        for (ClassifiedEvent classified : result.getIndependent()) {
            independent.add(toRecord(classified.getEvent()));
        }

        List<OutputRecord> dependent = new ArrayList<>(result.getDependent().size());
        for (ClassifiedEvent classified : result.getDependent()) {
            OutputRecord record = toRecord(classified.getEvent());
            if (attributed) {
                Attribution attribution = classified.getAttribution()
                        .orElseThrow(() -> new IllegalStateException(
                                "Dependent event '" + classified.getEvent().getId() + "' has no attribution"));
                record.setField(PARENT_ID, attribution.getParentId());
                record.setField(PARENT_MAGNITUDE, attribution.getParentMagnitude());
                record.setField(DELTA_T_SECONDS, attribution.getDeltaSeconds());
                record.setField(DELTA_DISTANCE_KM, attribution.getDistanceKm());
            }
            dependent.add(record);
        }

        return new AssembledCatalog(new ArrayList<>(header), independent, dependentHeader, dependent);
    }

    /**
     * Assemble the output catalogs, deriving the header from the events'
     * attributes (first-seen column order).
     */
    public static AssembledCatalog assemble(DeclusteringResult result, boolean attributed) {
        Objects.requireNonNull(result, "DeclusteringResult must not be null");
        Set<String> columns = new LinkedHashSet<>();
        for (ClassifiedEvent e : result.getIndependent()) {
            columns.addAll(e.getEvent().getAttributes().keySet());
        }
        for (ClassifiedEvent e : result.getDependent()) {
            columns.addAll(e.getEvent().getAttributes().keySet());
        }
        return assemble(result, new ArrayList<>(columns), attributed);
    }

    private static OutputRecord toRecord(Event event) {
        OutputRecord record = new OutputRecord();
        event.getAttributes().forEach(record::setField);
        return record;
    }
}
