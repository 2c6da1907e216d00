package com.quakesieve.cli;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one batch run, written as JSON when a summary path is given.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code method}, {@code startedAt} and
 * {@code finishedAt} are required.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "method", "input", "recordsRead", "eventsAccepted", "recordsRejected",
        "independent", "dependent", "startedAt", "finishedAt", "durationMillis", "rejections" })
@JsonIgnoreProperties(value = { "durationMillis" }, allowGetters = true)
public class RunSummary {

    /** Engine name, e.g. {@code gk-formula/single}. */
    private String method;

    private String input;
    private int recordsRead;
    private int eventsAccepted;
    private int recordsRejected;
    private int independent;
    private int dependent;
    private Instant startedAt;
    private Instant finishedAt;

    /** One line per dropped record: row, id and reason. */
    private List<String> rejections = new ArrayList<>();

    /** No-arg constructor required by Jackson. */
    public RunSummary() {
    }

    private RunSummary(Builder b) {
        this.method = Objects.requireNonNull(b.method, "method must not be null");
        this.input = b.input;
        this.recordsRead = b.recordsRead;
        this.eventsAccepted = b.eventsAccepted;
        this.recordsRejected = b.rejections.size();
        this.independent = b.independent;
        this.dependent = b.dependent;
        this.startedAt = Objects.requireNonNull(b.startedAt, "startedAt must not be null");
        this.finishedAt = Objects.requireNonNull(b.finishedAt, "finishedAt must not be null");
        this.rejections = new ArrayList<>(b.rejections);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link RunSummary} instances.
     */
    public static class Builder {
        private String method;
        private String input;
        private int recordsRead;
        private int eventsAccepted;
        private int independent;
        private int dependent;
        private Instant startedAt;
        private Instant finishedAt;
        private final List<String> rejections = new ArrayList<>();

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder input(String input) {
            this.input = input;
            return this;
        }

        public Builder recordsRead(int recordsRead) {
            this.recordsRead = recordsRead;
            return this;
        }

        public Builder eventsAccepted(int eventsAccepted) {
            this.eventsAccepted = eventsAccepted;
            return this;
        }

        public Builder independent(int independent) {
            this.independent = independent;
            return this;
        }

        public Builder dependent(int dependent) {
            this.dependent = dependent;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Builder rejection(String rejection) {
            this.rejections.add(rejection);
            return this;
        }

        public RunSummary build() {
            return new RunSummary(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method;
    }

    public String getInput() {
        return input;
    }

    public void setInput(String input) {
        this.input = input;
    }

    public int getRecordsRead() {
        return recordsRead;
    }

    public void setRecordsRead(int recordsRead) {
        this.recordsRead = recordsRead;
    }

    public int getEventsAccepted() {
        return eventsAccepted;
    }

    public void setEventsAccepted(int eventsAccepted) {
        this.eventsAccepted = eventsAccepted;
    }

    public int getRecordsRejected() {
        return recordsRejected;
    }

    public void setRecordsRejected(int recordsRejected) {
        this.recordsRejected = recordsRejected;
    }

    public int getIndependent() {
        return independent;
    }

    public void setIndependent(int independent) {
        this.independent = independent;
    }

    public int getDependent() {
        return dependent;
    }

    public void setDependent(int dependent) {
        this.dependent = dependent;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(Instant finishedAt) {
        this.finishedAt = finishedAt;
    }

    /**
     * @return wall-clock duration of the run in milliseconds
     */
    public long getDurationMillis() {
        if (startedAt == null || finishedAt == null) {
            return 0L;
        }
        return Duration.between(startedAt, finishedAt).toMillis();
    }

    public List<String> getRejections() {
        return Collections.unmodifiableList(rejections);
    }

    public void setRejections(List<String> rejections) {
        this.rejections = rejections != null ? new ArrayList<>(rejections) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "RunSummary{" +
                "method='" + method + '\'' +
                ", recordsRead=" + recordsRead +
                ", eventsAccepted=" + eventsAccepted +
                ", recordsRejected=" + recordsRejected +
                ", independent=" + independent +
                ", dependent=" + dependent +
                ", durationMillis=" + getDurationMillis() +
                '}';
    }
}
