package com.quakesieve.cli;

import com.quakesieve.core.config.DeclusterConfig;
import com.quakesieve.core.config.DeclusterConfigLoader;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Run whatever a YAML configuration describes.
 */
@Command(name = "run", mixinStandardHelpOptions = true,
        description = "Decluster as described by a YAML configuration "
                + "(--config, else $" + DeclusterConfigLoader.ENV_CONFIG_PATH
                + ", else classpath " + DeclusterConfigLoader.DEFAULT_RESOURCE + ")")
class RunCommand extends AbstractDeclusterCommand {

    @Option(names = { "-c", "--config" }, paramLabel = "<yaml>",
            description = "Declustering configuration file")
    Path configFile;

    @Override
    protected DeclusterConfig configure() {
        if (configFile != null) {
            return DeclusterConfigLoader.fromFile(configFile.toString());
        }
        return DeclusterConfigLoader.load();
    }
}
