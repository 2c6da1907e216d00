package com.quakesieve.core.cluster;

import com.quakesieve.core.model.Event;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One cluster of the Reasenberg scheme.
 *
 * <p>
 * A cluster is created {@link State#OPEN} around its founding event, grows
 * while later events fall inside its interaction zone and lookback window,
 * and is {@link State#CLOSED} once the catalog moves past its lookback. A
 * closed cluster rejects every mutation.
 * </p>
 *
 * <p>
 * Members are recorded as positions in the input list.
 * </p>
 *
 * @since 1.0.0
 */
public final class ReasenbergCluster {

    /** Lifecycle of a cluster. */
    public enum State {
        OPEN,
        CLOSED
    }

    private final int sequence;
    private final List<Integer> members = new ArrayList<>();

    private State state = State.OPEN;
    private int largestPosition;
    private double largestMagnitude;
    private Instant lastActivity;
    private Instant closedAt;

    ReasenbergCluster(int sequence, int founderPosition, Event founder) {
        this.sequence = sequence;
        this.members.add(founderPosition);
        this.largestPosition = founderPosition;
        this.largestMagnitude = founder.getMagnitude();
        this.lastActivity = founder.getTime();
    }

    /**
     * Add an event. A strictly larger magnitude makes it the cluster's largest
     * event; {@code extendsLookback} advances the last-activity time.
     */
    void join(int position, Event event, boolean extendsLookback) {
        requireOpen();
        members.add(position);
        if (event.getMagnitude() > largestMagnitude) {
            largestMagnitude = event.getMagnitude();
            largestPosition = position;
        }
        if (extendsLookback) {
            lastActivity = event.getTime();
        }
    }

    /**
     * Close the cluster.
     *
     * @param at time of the event that found the cluster expired, or
     *           {@code null} when the catalog ran out
     */
    void close(Instant at) {
        requireOpen();
        state = State.CLOSED;
        closedAt = at;
    }

    private void requireOpen() {
        if (state != State.OPEN) {
            throw new IllegalStateException("Cluster #" + sequence + " is closed");
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return creation order, starting at 0
     */
    public int getSequence() {
        return sequence;
    }

    public State getState() {
        return state;
    }

    public boolean isOpen() {
        return state == State.OPEN;
    }

    /**
     * @return unmodifiable member positions, in joining order
     */
    public List<Integer> getMembers() {
        return Collections.unmodifiableList(members);
    }

    public int size() {
        return members.size();
    }

    /**
     * @return input position of the largest event (first among equals)
     */
    public int getLargestPosition() {
        return largestPosition;
    }

    public double getLargestMagnitude() {
        return largestMagnitude;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    /**
     * @return time of the event at which the cluster was found expired, or
     *         {@code null} if it was still open at the end of the catalog or
     *         is not yet closed
     */
    public Instant getClosedAt() {
        return closedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ReasenbergCluster that))
            return false;
        return sequence == that.sequence && members.equals(that.members);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sequence, members);
    }

    @Override
    public String toString() {
        return "ReasenbergCluster{" +
                "sequence=" + sequence +
                ", state=" + state +
                ", size=" + members.size() +
                ", largestMagnitude=" + largestMagnitude +
                '}';
    }
}
