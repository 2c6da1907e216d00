package com.quakesieve.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Parameters of the Reasenberg (1985) interaction clustering.
 *
 * <p>
 * Defaults are the published ones: {@code rfact} 10, {@code tauMin} 1 day,
 * {@code tauMax} 10 days, {@code p} 0.95, {@code xmeff} 1.5 and a
 * Gutenberg-Richter {@code bvalue} of 1.0.
 * </p>
 *
 * @since 1.0.0
 */
public class ReasenbergParameters implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final double DEFAULT_RFACT = 10.0;
    public static final double DEFAULT_TAU_MIN = 1.0;
    public static final double DEFAULT_TAU_MAX = 10.0;
    public static final double DEFAULT_P = 0.95;
    public static final double DEFAULT_XMEFF = 1.5;
    public static final double DEFAULT_BVALUE = 1.0;

    /** Interaction radius scale factor. */
    private double rfact = DEFAULT_RFACT;

    /** Minimum lookback window in days. */
    private double tauMin = DEFAULT_TAU_MIN;

    /** Maximum lookback window in days. */
    private double tauMax = DEFAULT_TAU_MAX;

    /** Probability of detecting the next event of the sequence. */
    private double p = DEFAULT_P;

    /** Effective lower magnitude cutoff. */
    private double xmeff = DEFAULT_XMEFF;

    private double bvalue = DEFAULT_BVALUE;

    /**
     * Collect every problem with these parameters.
     *
     * @return human-readable error messages, empty when valid
     */
    public List<String> collectErrors() {
        List<String> errors = new ArrayList<>();
        if (!Double.isFinite(rfact) || rfact <= 0) {
            errors.add("Reasenberg 'rfact' must be > 0, got: " + rfact);
        }
        if (!Double.isFinite(tauMin) || tauMin <= 0) {
            errors.add("Reasenberg 'tauMin' must be > 0, got: " + tauMin);
        }
        if (!Double.isFinite(tauMax) || tauMax <= 0) {
            errors.add("Reasenberg 'tauMax' must be > 0, got: " + tauMax);
        }
        if (tauMin > tauMax) {
            errors.add("Reasenberg 'tauMin' (" + tauMin + ") must not exceed 'tauMax' (" + tauMax + ")");
        }
        if (!(p > 0 && p < 1)) {
            errors.add("Reasenberg 'p' must be in (0, 1), got: " + p);
        }
        if (!Double.isFinite(xmeff)) {
            errors.add("Reasenberg 'xmeff' must be finite, got: " + xmeff);
        }
        if (!Double.isFinite(bvalue) || bvalue <= 0) {
            errors.add("Reasenberg 'bvalue' must be > 0, got: " + bvalue);
        }
        return errors;
    }

    /**
     * @throws IllegalStateException if any parameter is invalid
     */
    public void validate() {
        List<String> errors = collectErrors();
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid ReasenbergParameters: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getRfact() {
        return rfact;
    }

    public void setRfact(double rfact) {
        this.rfact = rfact;
    }

    public double getTauMin() {
        return tauMin;
    }

    public void setTauMin(double tauMin) {
        this.tauMin = tauMin;
    }

    public double getTauMax() {
        return tauMax;
    }

    public void setTauMax(double tauMax) {
        this.tauMax = tauMax;
    }

    public double getP() {
        return p;
    }

    public void setP(double p) {
        this.p = p;
    }

    public double getXmeff() {
        return xmeff;
    }

    public void setXmeff(double xmeff) {
        this.xmeff = xmeff;
    }

    public double getBvalue() {
        return bvalue;
    }

    public void setBvalue(double bvalue) {
        this.bvalue = bvalue;
    }

    @Override
    public String toString() {
        return "ReasenbergParameters{" +
                "rfact=" + rfact +
                ", tauMin=" + tauMin +
                ", tauMax=" + tauMax +
                ", p=" + p +
                ", xmeff=" + xmeff +
                ", bvalue=" + bvalue +
                '}';
    }
}
