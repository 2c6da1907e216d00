package com.quakesieve.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Mutable per-event classification state for one declustering run.
 *
 * <p>
 * Engines keep one instance per event in an array parallel to the event
 * list; events themselves are never mutated. Every state starts
 * {@link EventTag#INDEPENDENT}. {@link #freeze(Event)} turns it into an
 * immutable {@link ClassifiedEvent} once the pass completes.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. It is owned by a single
 * engine invocation.
 * </p>
 *
 * @since 1.0.0
 */
public final class ClassificationState {

    private EventTag tag = EventTag.INDEPENDENT;
    private Attribution attribution;

    public EventTag getTag() {
        return tag;
    }

    public boolean isDependent() {
        return tag == EventTag.DEPENDENT;
    }

    public Optional<Attribution> getAttribution() {
        return Optional.ofNullable(attribution);
    }

    /**
     * Mark the event dependent, replacing any previous attribution.
     *
     * @param candidate the new parent link; must not be {@code null}
     */
    public void claim(Attribution candidate) {
        this.attribution = Objects.requireNonNull(candidate, "Attribution must not be null");
        this.tag = EventTag.DEPENDENT;
    }

    /**
     * Claim the event only if {@code candidate} is closer in time than the
     * current parent. Equal elapsed times fall back to the smaller distance;
     * a full tie keeps the current parent.
     *
     * @param candidate the competing parent link
     * @return {@code true} if the candidate was taken
     */
    public boolean claimIfCloserInTime(Attribution candidate) {
        Objects.requireNonNull(candidate, "Attribution must not be null");
        if (attribution == null || isCloser(candidate, attribution)) {
            claim(candidate);
            return true;
        }
        return false;
    }

    private static boolean isCloser(Attribution candidate, Attribution current) {
        int byTime = Double.compare(Math.abs(candidate.getDeltaSeconds()), Math.abs(current.getDeltaSeconds()));
        if (byTime != 0) {
            return byTime < 0;
        }
        return candidate.getDistanceKm() < current.getDistanceKm();
    }

    /**
     * Freeze this state for {@code event}.
     *
     * @param event the event this state belongs to
     * @return immutable classified event
     */
    public ClassifiedEvent freeze(Event event) {
        return new ClassifiedEvent(event, tag, attribution);
    }

    @Override
    public String toString() {
        return "ClassificationState{tag=" + tag + ", attribution=" + attribution + '}';
    }
}
