package com.quakesieve.core.model;

import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;

/**
 * An event together with its final classification.
 *
 * <p>
 * Dependent events always carry an {@link Attribution}; independent events
 * never do.
 * </p>
 *
 * @since 1.0.0
 */
public final class ClassifiedEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Event event;
    private final EventTag tag;
    private final Attribution attribution;

    public ClassifiedEvent(Event event, EventTag tag, Attribution attribution) {
        this.event = Objects.requireNonNull(event, "event must not be null");
        this.tag = Objects.requireNonNull(tag, "tag must not be null");
        if (tag == EventTag.DEPENDENT && attribution == null) {
            throw new IllegalArgumentException("Dependent event '" + event.getId() + "' has no attribution");
        }
        this.attribution = tag == EventTag.DEPENDENT ? attribution : null;
    }

    public static ClassifiedEvent independent(Event event) {
        return new ClassifiedEvent(event, EventTag.INDEPENDENT, null);
    }

    public static ClassifiedEvent dependent(Event event, Attribution attribution) {
        return new ClassifiedEvent(event, EventTag.DEPENDENT, attribution);
    }

    public Event getEvent() {
        return event;
    }

    public EventTag getTag() {
        return tag;
    }

    public boolean isDependent() {
        return tag == EventTag.DEPENDENT;
    }

    public Optional<Attribution> getAttribution() {
        return Optional.ofNullable(attribution);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ClassifiedEvent that))
            return false;
        return event.equals(that.event)
                && tag == that.tag
                && Objects.equals(attribution, that.attribution);
    }

    @Override
    public int hashCode() {
        return Objects.hash(event, tag, attribution);
    }

    @Override
    public String toString() {
        return "ClassifiedEvent{" +
                "id='" + event.getId() + '\'' +
                ", tag=" + tag +
                (attribution != null ? ", parent='" + attribution.getParentId() + '\'' : "") +
                '}';
    }
}
