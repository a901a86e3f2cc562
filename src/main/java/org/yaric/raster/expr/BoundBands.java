package org.yaric.raster.expr;

import java.util.Map;

/**
 * Band samples and precomputed statistics an {@link Expression} is evaluated against.
 */
public final class BoundBands {

    private final Map<String, float[]> samples;
    private final Map<BandStatistic, Double> statistics;

    BoundBands(final Map<String, float[]> samples, final Map<BandStatistic, Double> statistics) {
        this.samples = samples;
        this.statistics = statistics;
    }

    float[] samples(final String symbol) {
        return samples.get(symbol);
    }

    double statistic(final BandStatistic statistic) {
        return statistics.get(statistic);
    }
}
