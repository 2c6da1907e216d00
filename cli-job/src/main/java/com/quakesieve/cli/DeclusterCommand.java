package com.quakesieve.cli;

import com.quakesieve.core.config.DeclusterConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Gardner-Knopoff declustering with the continuous window formula.
 */
@Command(name = "decluster", mixinStandardHelpOptions = true,
        description = "Decluster a CSV catalog using Gardner-Knopoff (1974) formula windows")
class DeclusterCommand extends AbstractDeclusterCommand {

    @Option(names = "--scale", defaultValue = "1.0",
            description = "Multiplier for both window extents (default: ${DEFAULT-VALUE})")
    double scale;

    @Override
    protected DeclusterConfig configure() {
        DeclusterConfig config = new DeclusterConfig();
        config.setMethod(DeclusterConfig.METHOD_FORMULA);
        config.setScale(scale);
        return config;
    }
}
