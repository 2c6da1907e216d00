package com.quakesieve.cli;

import com.quakesieve.core.config.DeclusterConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Gardner-Knopoff declustering with the published step table.
 */
@Command(name = "decluster-table", mixinStandardHelpOptions = true,
        description = "Decluster using the Gardner-Knopoff (1974) discrete lookup table "
                + "(not the continuous formula used by 'decluster')")
class DeclusterTableCommand extends AbstractDeclusterCommand {

    @Option(names = "--scale", defaultValue = "1.0",
            description = "Multiplier for both window extents (default: ${DEFAULT-VALUE})")
    double scale;

    @Option(names = "--table-underflow", defaultValue = "clamp", paramLabel = "clamp|reject",
            description = "Handling of magnitudes below the first table row (default: ${DEFAULT-VALUE})")
    String underflow;

    @Override
    protected DeclusterConfig configure() {
        DeclusterConfig config = new DeclusterConfig();
        config.setMethod(DeclusterConfig.METHOD_TABLE);
        config.setScale(scale);
        config.setTableUnderflow(underflow);
        return config;
    }
}
