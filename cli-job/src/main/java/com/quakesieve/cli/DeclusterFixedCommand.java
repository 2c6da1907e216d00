package com.quakesieve.cli;

import com.quakesieve.core.config.DeclusterConfig;
import com.quakesieve.core.window.FixedWindow;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Declustering with one window for every magnitude.
 */
@Command(name = "decluster-fixed", aliases = "decluster-a1b", mixinStandardHelpOptions = true,
        description = "Decluster using fixed spatial and temporal windows")
class DeclusterFixedCommand extends AbstractDeclusterCommand {

    @Option(names = "--radius", defaultValue = "" + FixedWindow.DEFAULT_RADIUS_KM,
            description = "Spatial radius in km for all magnitudes (default: ${DEFAULT-VALUE})")
    double radiusKm;

    @Option(names = "--window", defaultValue = "" + FixedWindow.DEFAULT_WINDOW_DAYS,
            description = "Temporal window in days for all magnitudes (default: ${DEFAULT-VALUE})")
    double windowDays;

    @Override
    protected DeclusterConfig configure() {
        DeclusterConfig config = new DeclusterConfig();
        config.setMethod(DeclusterConfig.METHOD_FIXED);
        config.setFixedRadiusKm(radiusKm);
        config.setFixedWindowDays(windowDays);
        return config;
    }
}
