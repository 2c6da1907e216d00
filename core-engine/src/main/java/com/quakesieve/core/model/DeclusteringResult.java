package com.quakesieve.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Partition of a catalog into independent and dependent events.
 *
 * <p>
 * Both sequences follow the original input order. {@link #fromStates} checks
 * that every input event lands in exactly one of them.
 * </p>
 *
 * @since 1.0.0
 */
public final class DeclusteringResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<ClassifiedEvent> independent;
    private final List<ClassifiedEvent> dependent;

    private DeclusteringResult(List<ClassifiedEvent> independent, List<ClassifiedEvent> dependent) {
        this.independent = Collections.unmodifiableList(independent);
        this.dependent = Collections.unmodifiableList(dependent);
    }

    /**
     * @return a result with two empty sequences
     */
    public static DeclusteringResult empty() {
        return new DeclusteringResult(new ArrayList<>(), new ArrayList<>());
    }

    /**
     * Freeze per-event states into a result.
     *
     * @param events input events in input order
     * @param states states parallel to {@code events}
     * @return the partition, in input order
     * @throws IllegalArgumentException if the arrays differ in length or an id
     *                                  occurs twice
     */
    public static DeclusteringResult fromStates(List<Event> events, ClassificationState[] states) {
        Objects.requireNonNull(events, "events must not be null");
        Objects.requireNonNull(states, "states must not be null");
        if (events.size() != states.length) {
            throw new IllegalArgumentException(
                    "Expected " + events.size() + " classification states, got: " + states.length);
        }

        List<ClassifiedEvent> independent = new ArrayList<>();
        List<ClassifiedEvent> dependent = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < states.length; i++) {
            Event event = events.get(i);
            if (!seen.add(event.getId())) {
                throw new IllegalArgumentException("Duplicate event id in catalog: " + event.getId());
            }
            ClassifiedEvent classified = states[i].freeze(event);
            if (classified.isDependent()) {
                dependent.add(classified);
            } else {
                independent.add(classified);
            }
        }
        return new DeclusteringResult(independent, dependent);
    }

    public List<ClassifiedEvent> getIndependent() {
        return independent;
    }

    public List<ClassifiedEvent> getDependent() {
        return dependent;
    }

    public int size() {
        return independent.size() + dependent.size();
    }

    /**
     * Look up the classification of an event by id.
     *
     * @param eventId the event identifier
     * @return the classified event, or empty if the id is unknown
     */
    public Optional<ClassifiedEvent> find(String eventId) {
        for (ClassifiedEvent e : independent) {
            if (e.getEvent().getId().equals(eventId)) {
                return Optional.of(e);
            }
        }
        for (ClassifiedEvent e : dependent) {
            if (e.getEvent().getId().equals(eventId)) {
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "DeclusteringResult{independent=" + independent.size()
                + ", dependent=" + dependent.size() + '}';
    }
}
