package com.quakesieve.core.window;

import com.quakesieve.core.model.Window;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Discrete Gardner &amp; Knopoff (1974) window, read from the published
 * step table rather than the fitted curve.
 *
 * <p>
 * The row with the highest threshold not above the event's magnitude wins.
 * Magnitudes below the first row follow the configured {@link Underflow}
 * policy.
 * </p>
 *
 * @since 1.0.0
 */
public final class GardnerKnopoffTableWindow implements WindowModel {

    /** Behaviour for magnitudes below the lowest table threshold. */
    public enum Underflow {
        /** Use the lowest row. */
        CLAMP,
        /** Refuse the magnitude. */
        REJECT;

        /**
         * Parse a configuration value, case-insensitively.
         *
         * @throws IllegalArgumentException for unknown values
         */
        public static Underflow parse(String value) {
            Objects.requireNonNull(value, "Underflow policy must not be null");
            return switch (value.toLowerCase(Locale.ROOT)) {
                case "clamp" -> CLAMP;
                case "reject" -> REJECT;
                default -> throw new IllegalArgumentException(
                        "Unknown table underflow policy: '" + value + "'. Supported: clamp, reject");
            };
        }
    }

    private static final NavigableMap<Double, Window> TABLE = buildTable();

    private final Underflow underflow;

    public GardnerKnopoffTableWindow() {
        this(Underflow.CLAMP);
    }

    public GardnerKnopoffTableWindow(Underflow underflow) {
        this.underflow = Objects.requireNonNull(underflow, "Underflow policy must not be null");
    }

    @Override
    public Window windowFor(double magnitude) {
        if (!Double.isFinite(magnitude)) {
            throw new IllegalArgumentException("magnitude must be finite, got: " + magnitude);
        }
        Map.Entry<Double, Window> row = TABLE.floorEntry(magnitude);
        if (row != null) {
            return row.getValue();
        }
        if (underflow == Underflow.REJECT) {
            throw new IllegalArgumentException(String.format(Locale.ROOT,
                    "Magnitude %.2f is below the lowest window table threshold %.1f",
                    magnitude, minimumMagnitude()));
        }
        return TABLE.firstEntry().getValue();
    }

    /**
     * @return lowest magnitude threshold present in the table
     */
    public static double minimumMagnitude() {
        return TABLE.firstKey();
    }

    public Underflow getUnderflow() {
        return underflow;
    }

    @Override
    public String getName() {
        return "gk-table";
    }

    @Override
    public String toString() {
        return "GardnerKnopoffTableWindow{underflow=" + underflow + '}';
    }

    private static NavigableMap<Double, Window> buildTable() {
        NavigableMap<Double, Window> rows = new TreeMap<>();
        rows.put(2.5, new Window(19.5, 6));
        rows.put(3.0, new Window(22.5, 11.5));
        rows.put(3.5, new Window(26, 22));
        rows.put(4.0, new Window(30, 42));
        rows.put(4.5, new Window(35, 83));
        rows.put(5.0, new Window(40, 155));
        rows.put(5.5, new Window(47, 290));
        rows.put(6.0, new Window(54, 510));
        rows.put(6.5, new Window(61, 790));
        rows.put(7.0, new Window(70, 915));
        rows.put(7.5, new Window(81, 960));
        rows.put(8.0, new Window(94, 985));
        return Collections.unmodifiableNavigableMap(rows);
    }
}
