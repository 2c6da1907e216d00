package com.quakesieve.core.config;

import com.quakesieve.core.cluster.ClaimMode;
import com.quakesieve.core.record.ColumnMapping;
import com.quakesieve.core.window.FixedWindow;
import com.quakesieve.core.window.GardnerKnopoffTableWindow;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Top-level POJO for the declustering YAML configuration.
 *
 * <p>
 * Supported methods:
 * </p>
 * <ul>
 * <li>{@code formula} — continuous Gardner-Knopoff windows</li>
 * <li>{@code table} — Gardner-Knopoff published step table</li>
 * <li>{@code fixed} — constant radius and time window</li>
 * <li>{@code reasenberg} — adaptive interaction clustering</li>
 * </ul>
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * method: formula
 * claimMode: nearest
 * attributedOutput: true
 * scale: 1.25
 * reasenberg:
 *   rfact: 10
 *   tauMin: 1.0
 * columns:
 *   id: usgs_id
 *   magnitude: usgs_mag
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization; an invalid
 * configuration is never silently defaulted.
 * </p>
 *
 * @since 1.0.0
 */
public class DeclusterConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String METHOD_FORMULA = "formula";
    public static final String METHOD_TABLE = "table";
    public static final String METHOD_FIXED = "fixed";
    public static final String METHOD_REASENBERG = "reasenberg";

    /** Declustering method name. */
    private String method = METHOD_FORMULA;

    // --- Window-method fields ---
    /** "single" or "nearest". */
    private String claimMode = "single";

    /** Multiplier applied to both window extents. */
    private double scale = 1.0;

    /** "clamp" or "reject", for magnitudes below the first table row. */
    private String tableUnderflow = "clamp";

    private double fixedRadiusKm = FixedWindow.DEFAULT_RADIUS_KM;
    private double fixedWindowDays = FixedWindow.DEFAULT_WINDOW_DAYS;

    // --- Adaptive fields ---
    private ReasenbergParameters reasenberg = new ReasenbergParameters();

    // --- Record layer ---
    /** Append parent attribution columns to dependent output records. */
    private boolean attributedOutput;

    /** Abort on the first invalid record instead of dropping it. */
    private boolean strictInput;

    private ColumnMapping columns = new ColumnMapping();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that every field holds a legal value for the declared method.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (method == null || method.isBlank()) {
            errors.add("'method' is required");
        } else {
            switch (method) {
                case METHOD_FORMULA -> {
                    // no extra parameters
                }
                case METHOD_TABLE -> {
                    try {
                        GardnerKnopoffTableWindow.Underflow.parse(String.valueOf(tableUnderflow));
                    } catch (IllegalArgumentException e) {
                        errors.add(e.getMessage());
                    }
                }
                case METHOD_FIXED -> {
                    if (!Double.isFinite(fixedRadiusKm) || fixedRadiusKm <= 0) {
                        errors.add("Fixed method requires 'fixedRadiusKm' > 0, got: " + fixedRadiusKm);
                    }
                    if (!Double.isFinite(fixedWindowDays) || fixedWindowDays <= 0) {
                        errors.add("Fixed method requires 'fixedWindowDays' > 0, got: " + fixedWindowDays);
                    }
                }
                case METHOD_REASENBERG -> {
                    if (reasenberg == null) {
                        errors.add("Reasenberg method requires a 'reasenberg' section");
                    } else {
                        errors.addAll(reasenberg.collectErrors());
                    }
                    if (scale != 1.0) {
                        errors.add("'scale' is not supported by the reasenberg method, got: " + scale);
                    }
                    if (isNearestClaimMode()) {
                        errors.add("'claimMode: nearest' is not supported by the reasenberg method");
                    }
                }
                default -> errors.add("Unknown method: '" + method
                        + "'. Supported: formula, table, fixed, reasenberg");
            }
        }

        if (!Double.isFinite(scale) || scale <= 0) {
            errors.add("'scale' must be finite and > 0, got: " + scale);
        }
        try {
            ClaimMode.parse(String.valueOf(claimMode));
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        if (columns == null) {
            errors.add("'columns' must not be null");
        } else {
            errors.addAll(columns.collectErrors());
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DeclusterConfig: " + String.join("; ", errors));
        }
    }

    private boolean isNearestClaimMode() {
        return claimMode != null && "nearest".equalsIgnoreCase(claimMode);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getMethod() {
        return method;
    }

    /**
     * Set the method name, normalised to lowercase.
     *
     * @param method method name
     */
    public void setMethod(String method) {
        this.method = method != null ? method.toLowerCase(Locale.ROOT) : null;
    }

    public String getClaimMode() {
        return claimMode;
    }

    public void setClaimMode(String claimMode) {
        this.claimMode = claimMode;
    }

    public double getScale() {
        return scale;
    }

    public void setScale(double scale) {
        this.scale = scale;
    }

    public String getTableUnderflow() {
        return tableUnderflow;
    }

    public void setTableUnderflow(String tableUnderflow) {
        this.tableUnderflow = tableUnderflow;
    }

    public double getFixedRadiusKm() {
        return fixedRadiusKm;
    }

    public void setFixedRadiusKm(double fixedRadiusKm) {
        this.fixedRadiusKm = fixedRadiusKm;
    }

    public double getFixedWindowDays() {
        return fixedWindowDays;
    }

    public void setFixedWindowDays(double fixedWindowDays) {
        this.fixedWindowDays = fixedWindowDays;
    }

    public ReasenbergParameters getReasenberg() {
        return reasenberg;
    }

    public void setReasenberg(ReasenbergParameters reasenberg) {
        this.reasenberg = reasenberg;
    }

    public boolean isAttributedOutput() {
        return attributedOutput;
    }

    public void setAttributedOutput(boolean attributedOutput) {
        this.attributedOutput = attributedOutput;
    }

    public boolean isStrictInput() {
        return strictInput;
    }

    public void setStrictInput(boolean strictInput) {
        this.strictInput = strictInput;
    }

    public ColumnMapping getColumns() {
        return columns;
    }

    public void setColumns(ColumnMapping columns) {
        this.columns = columns;
    }

    @Override
    public String toString() {
        return "DeclusterConfig{" +
                "method='" + method + '\'' +
                ", claimMode='" + claimMode + '\'' +
                ", scale=" + scale +
                ", tableUnderflow='" + tableUnderflow + '\'' +
                ", fixedRadiusKm=" + fixedRadiusKm +
                ", fixedWindowDays=" + fixedWindowDays +
                ", reasenberg=" + reasenberg +
                ", attributedOutput=" + attributedOutput +
                ", strictInput=" + strictInput +
                ", columns=" + columns +
                '}';
    }
}
