package com.quakesieve.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Link from a dependent event to the event that claimed it.
 *
 * <p>
 * {@code deltaSeconds} is signed: positive when the dependent event follows
 * its parent (aftershock), negative when it precedes it (foreshock).
 * </p>
 *
 * @since 1.0.0
 */
public final class Attribution implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String parentId;
    private final double parentMagnitude;
    private final double deltaSeconds;
    private final double distanceKm;

    public Attribution(String parentId, double parentMagnitude, double deltaSeconds, double distanceKm) {
        this.parentId = Objects.requireNonNull(parentId, "parentId must not be null");
        this.parentMagnitude = parentMagnitude;
        this.deltaSeconds = deltaSeconds;
        this.distanceKm = distanceKm;
    }

    /**
     * Build the attribution of {@code child} to {@code parent}.
     *
     * @param parent     the claiming event
     * @param child      the dependent event
     * @param distanceKm great-circle distance between the two
     * @return attribution with signed elapsed seconds parent to child
     */
    public static Attribution between(Event parent, Event child, double distanceKm) {
        return new Attribution(parent.getId(), parent.getMagnitude(),
                elapsedSeconds(parent, child), distanceKm);
    }

    /**
     * Signed elapsed time from {@code from} to {@code to} in seconds.
     */
    public static double elapsedSeconds(Event from, Event to) {
        return elapsedSeconds(from.getTime(), to.getTime());
    }

    /**
     * Signed elapsed time between two instants in seconds. Valid over the
     * whole {@link Instant} range.
     */
    public static double elapsedSeconds(Instant from, Instant to) {
        Duration elapsed = Duration.between(from, to);
        return elapsed.getSeconds() + elapsed.getNano() / 1_000_000_000.0;
    }

    public String getParentId() {
        return parentId;
    }

    public double getParentMagnitude() {
        return parentMagnitude;
    }

    public double getDeltaSeconds() {
        return deltaSeconds;
    }

    public double getDistanceKm() {
        return distanceKm;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Attribution that))
            return false;
        return Objects.equals(parentId, that.parentId)
                && Double.compare(parentMagnitude, that.parentMagnitude) == 0
                && Double.compare(deltaSeconds, that.deltaSeconds) == 0
                && Double.compare(distanceKm, that.distanceKm) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(parentId, parentMagnitude, deltaSeconds, distanceKm);
    }

    @Override
    public String toString() {
        return "Attribution{" +
                "parentId='" + parentId + '\'' +
                ", parentMagnitude=" + parentMagnitude +
                ", deltaSeconds=" + deltaSeconds +
                ", distanceKm=" + distanceKm +
                '}';
    }
}
