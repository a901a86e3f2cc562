package org.yaric.raster.expr;

import java.util.Arrays;
import java.util.Optional;

/**
 * Whole-band statistic referenced from a formula as {@code func_band_<kind>(SYMBOL)}.
 */
public record BandStatistic(Kind kind, String symbol) {

    public enum Kind {
        MAX("func_band_max"),
        MIN("func_band_min"),
        MEAN("func_band_mean"),
        STDDEV("func_band_stddev");

        private final String functionName;

        Kind(final String functionName) {
            this.functionName = functionName;
        }

        public String functionName() {
            return functionName;
        }

        public static Optional<Kind> forFunction(final String name) {
            return Arrays.stream(values()).filter(k -> k.functionName.equals(name)).findFirst();
        }
    }

    /**
     * Computes the statistic over all non-NaN samples; NaN when the band has none.
     */
    public static double compute(final Kind kind, final float[] samples) {
        long count = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0;
        for (final float s : samples) {
            if (Float.isNaN(s)) continue;
            count++;
            sum += s;
            min = Math.min(min, s);
            max = Math.max(max, s);
        }
        if (count == 0) return Double.NaN;

        switch (kind) {
            case MAX:
                return max;
            case MIN:
                return min;
            case MEAN:
                return sum / count;
            case STDDEV:
                final double mean = sum / count;
                double squares = 0;
                for (final float s : samples) {
                    if (Float.isNaN(s)) continue;
                    squares += (s - mean) * (s - mean);
                }
                return Math.sqrt(squares / count);
            default:
                throw new IllegalStateException("Unknown statistic " + kind);
        }
    }

    @Override
    public String toString() {
        return kind.functionName() + "(" + symbol + ")";
    }
}
