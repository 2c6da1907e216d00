package com.quakesieve.cli;

import com.quakesieve.core.config.DeclusterConfig;
import com.quakesieve.core.record.ColumnMapping;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Options shared by every declustering subcommand: input/output files,
 * output format, input strictness and column-name overrides.
 */
public class CommonOptions {

    @Option(names = { "-i", "--input" }, required = true, paramLabel = "<csv>",
            description = "Input CSV catalog (header row required)")
    Path input;

    @Option(names = "--mainshocks", required = true, paramLabel = "<file>",
            description = "Output path for independent (mainshock) events")
    Path mainshocks;

    @Option(names = "--aftershocks", required = true, paramLabel = "<file>",
            description = "Output path for dependent (aftershock/foreshock) events")
    Path aftershocks;

    @Option(names = "--format", defaultValue = "csv", paramLabel = "csv|json",
            description = "Output format (default: ${DEFAULT-VALUE})")
    OutputFormat format;

    @Option(names = "--strict",
            description = "Abort on the first invalid record instead of dropping it")
    boolean strict;

    @Option(names = "--summary", paramLabel = "<json>",
            description = "Optional path for a JSON run summary")
    Path summary;

    @Option(names = "--id-column", paramLabel = "<name>", description = "Event id column (default: event_id)")
    String idColumn;

    @Option(names = "--magnitude-column", paramLabel = "<name>", description = "Magnitude column (default: magnitude)")
    String magnitudeColumn;

    @Option(names = "--time-column", paramLabel = "<name>", description = "Timestamp column (default: timestamp)")
    String timeColumn;

    @Option(names = "--latitude-column", paramLabel = "<name>", description = "Latitude column (default: latitude)")
    String latitudeColumn;

    @Option(names = "--longitude-column", paramLabel = "<name>", description = "Longitude column (default: longitude)")
    String longitudeColumn;

    @Option(names = "--depth-column", paramLabel = "<name>", description = "Depth column (default: depth_km)")
    String depthColumn;

    /**
     * Apply the strictness flag and any column overrides to {@code config}.
     * Options left unset keep the configuration's values.
     */
    void applyTo(DeclusterConfig config) {
        if (strict) {
            config.setStrictInput(true);
        }
        ColumnMapping columns = config.getColumns() != null ? config.getColumns() : new ColumnMapping();
        if (idColumn != null) {
            columns.setId(idColumn);
        }
        if (magnitudeColumn != null) {
            columns.setMagnitude(magnitudeColumn);
        }
        if (timeColumn != null) {
            columns.setTimestamp(timeColumn);
        }
        if (latitudeColumn != null) {
            columns.setLatitude(latitudeColumn);
        }
        if (longitudeColumn != null) {
            columns.setLongitude(longitudeColumn);
        }
        if (depthColumn != null) {
            columns.setDepth(depthColumn);
        }
        config.setColumns(columns);
    }

    /**
     * Build the job configuration for {@code config}.
     */
    JobConfig toJobConfig(DeclusterConfig config) {
        applyTo(config);
        return JobConfig.builder()
                .input(input)
                .mainshocks(mainshocks)
                .aftershocks(aftershocks)
                .format(format)
                .summary(summary)
                .decluster(config)
                .build();
    }
}
