package com.quakesieve.core.cluster;

import com.quakesieve.core.config.DeclusterConfig;
import com.quakesieve.core.window.FixedWindow;
import com.quakesieve.core.window.GardnerKnopoffFormulaWindow;
import com.quakesieve.core.window.GardnerKnopoffTableWindow;
import com.quakesieve.core.window.ScaledWindowModel;
import com.quakesieve.core.window.WindowModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * Factory that creates {@link Declusterer} instances from a
 * {@link DeclusterConfig}.
 *
 * <p>
 * This is the single point of extension when adding new methods: register
 * the method name here and create the corresponding engine.
 * </p>
 *
 * @since 1.0.0
 */
public final class DeclustererFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DeclustererFactory.class);

    private DeclustererFactory() {
        // utility class — not instantiable
    }

    /**
     * Validate the configuration and create the engine it describes.
     *
     * @param config the configuration; must not be {@code null}
     * @return a ready-to-use engine
     * @throws IllegalStateException if the configuration is invalid
     */
    public static Declusterer create(DeclusterConfig config) {
        Objects.requireNonNull(config, "DeclusterConfig must not be null");
        config.validate();

        Declusterer declusterer = switch (config.getMethod()) {
            case DeclusterConfig.METHOD_REASENBERG -> new ReasenbergDeclusterer(config.getReasenberg());
            case DeclusterConfig.METHOD_FORMULA, DeclusterConfig.METHOD_TABLE, DeclusterConfig.METHOD_FIXED ->
                    new WindowDeclusterer(createWindowModel(config), ClaimMode.parse(config.getClaimMode()));
            default -> throw new IllegalArgumentException("Unknown method: '" + config.getMethod() + "'");
        };
        LOG.info("Created declusterer '{}'", declusterer.getMethodName());
        return declusterer;
    }

    /**
     * Build the window model of a window method, applying the configured
     * scale when it is not 1.
     *
     * @param config the configuration; must not be {@code null}
     * @return the window model
     * @throws IllegalArgumentException if the method is not a window method
     */
    public static WindowModel createWindowModel(DeclusterConfig config) {
        Objects.requireNonNull(config, "DeclusterConfig must not be null");
        String method = String.valueOf(config.getMethod()).toLowerCase(Locale.ROOT);
        WindowModel base = switch (method) {
            case DeclusterConfig.METHOD_FORMULA -> new GardnerKnopoffFormulaWindow();
            case DeclusterConfig.METHOD_TABLE -> new GardnerKnopoffTableWindow(
                    GardnerKnopoffTableWindow.Underflow.parse(config.getTableUnderflow()));
            case DeclusterConfig.METHOD_FIXED -> new FixedWindow(
                    config.getFixedRadiusKm(), config.getFixedWindowDays());
            default -> throw new IllegalArgumentException(
                    "Method '" + config.getMethod() + "' does not use a window model. "
                            + "Supported: formula, table, fixed");
        };
        return config.getScale() == 1.0 ? base : new ScaledWindowModel(base, config.getScale());
    }
}
