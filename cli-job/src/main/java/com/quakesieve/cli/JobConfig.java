package com.quakesieve.cli;

import com.quakesieve.core.config.DeclusterConfig;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Typed, immutable description of one batch run: where to read, where to
 * write, in which format, and how to decluster.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@link Builder#build()} validates the paths and
 * the embedded {@link DeclusterConfig}, so a run never starts with a bad
 * configuration.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig {

    // ---------------------------------------------------------------
    // I/O
    // ---------------------------------------------------------------
    private final Path input;
    private final Path mainshocks;
    private final Path aftershocks;
    private final OutputFormat format;

    /** Optional JSON run summary; {@code null} when not requested. */
    private final Path summary;

    // ---------------------------------------------------------------
    // Declustering
    // ---------------------------------------------------------------
    private final DeclusterConfig decluster;

    private JobConfig(Builder b) {
        this.input = b.input;
        this.mainshocks = b.mainshocks;
        this.aftershocks = b.aftershocks;
        this.format = b.format;
        this.summary = b.summary;
        this.decluster = b.decluster;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Path getInput() {
        return input;
    }

    public Path getMainshocks() {
        return mainshocks;
    }

    public Path getAftershocks() {
        return aftershocks;
    }

    public OutputFormat getFormat() {
        return format;
    }

    public Path getSummary() {
        return summary;
    }

    public DeclusterConfig getDecluster() {
        return decluster;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * {@code input}, {@code mainshocks} and {@code aftershocks} are
     * required; the three paths must be distinct.
     * </p>
     */
    public static class Builder {
        private Path input;
        private Path mainshocks;
        private Path aftershocks;
        private OutputFormat format = OutputFormat.CSV;
        private Path summary;
        private DeclusterConfig decluster = new DeclusterConfig();

        public Builder input(Path v) {
            this.input = v;
            return this;
        }

        public Builder mainshocks(Path v) {
            this.mainshocks = v;
            return this;
        }

        public Builder aftershocks(Path v) {
            this.aftershocks = v;
            return this;
        }

        public Builder format(OutputFormat v) {
            this.format = v;
            return this;
        }

        public Builder summary(Path v) {
            this.summary = v;
            return this;
        }

        public Builder decluster(DeclusterConfig v) {
            this.decluster = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws NullPointerException     if a required value is missing
         * @throws IllegalArgumentException if two paths coincide
         * @throws IllegalStateException    if the declustering configuration is
         *                                  invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(input, "input path required");
            Objects.requireNonNull(mainshocks, "mainshocks path required");
            Objects.requireNonNull(aftershocks, "aftershocks path required");
            Objects.requireNonNull(format, "format required");
            Objects.requireNonNull(decluster, "decluster config required");

            Path in = input.toAbsolutePath().normalize();
            Path main = mainshocks.toAbsolutePath().normalize();
            Path after = aftershocks.toAbsolutePath().normalize();
            if (main.equals(after)) {
                throw new IllegalArgumentException("mainshocks and aftershocks must be different files: " + main);
            }
            if (in.equals(main) || in.equals(after)) {
                throw new IllegalArgumentException("Output would overwrite the input file: " + in);
            }

            decluster.validate();
            return new JobConfig(this);
        }
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "input=" + input +
                ", mainshocks=" + mainshocks +
                ", aftershocks=" + aftershocks +
                ", format=" + format +
                ", summary=" + summary +
                ", decluster=" + decluster +
                '}';
    }
}
