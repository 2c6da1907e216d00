package com.quakesieve.cli;

import com.quakesieve.core.config.DeclusterConfig;
import com.quakesieve.core.config.ReasenbergParameters;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Reasenberg (1985) interaction clustering.
 */
@Command(name = "decluster-reasenberg", mixinStandardHelpOptions = true,
        description = "Decluster using the Reasenberg (1985) interaction-based algorithm")
class DeclusterReasenbergCommand extends AbstractDeclusterCommand {

    @Option(names = "--rfact", defaultValue = "" + ReasenbergParameters.DEFAULT_RFACT,
            description = "Interaction radius scale factor (default: ${DEFAULT-VALUE})")
    double rfact;

    @Option(names = "--tau-min", defaultValue = "" + ReasenbergParameters.DEFAULT_TAU_MIN,
            description = "Minimum cluster lookback in days (default: ${DEFAULT-VALUE})")
    double tauMin;

    @Option(names = "--tau-max", defaultValue = "" + ReasenbergParameters.DEFAULT_TAU_MAX,
            description = "Maximum cluster lookback in days (default: ${DEFAULT-VALUE})")
    double tauMax;

    @Option(names = "--p-value", defaultValue = "" + ReasenbergParameters.DEFAULT_P,
            description = "Probability of observing the next event of a sequence (default: ${DEFAULT-VALUE})")
    double p;

    @Option(names = "--xmeff", defaultValue = "" + ReasenbergParameters.DEFAULT_XMEFF,
            description = "Effective magnitude cutoff (default: ${DEFAULT-VALUE})")
    double xmeff;

    @Option(names = "--b-value", defaultValue = "" + ReasenbergParameters.DEFAULT_BVALUE,
            description = "Gutenberg-Richter b-value (default: ${DEFAULT-VALUE})")
    double bvalue;

    @Override
    protected DeclusterConfig configure() {
        ReasenbergParameters params = new ReasenbergParameters();
        params.setRfact(rfact);
        params.setTauMin(tauMin);
        params.setTauMax(tauMax);
        params.setP(p);
        params.setXmeff(xmeff);
        params.setBvalue(bvalue);

        DeclusterConfig config = new DeclusterConfig();
        config.setMethod(DeclusterConfig.METHOD_REASENBERG);
        config.setReasenberg(params);
        return config;
    }
}
