package org.yaric.raster.expr;

import org.yaric.raster.BandRaster;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link RasterEvaluator} backed by {@link BandMathParser}. Produces 32-bit float output;
 * division by zero follows IEEE rules and yields infinities or NaN rather than failing.
 */
public class BandMathEvaluator implements RasterEvaluator {

    private static final Logger LOGGER = Logger.getLogger(BandMathEvaluator.class.getName());

    @Override
    public BandRaster evaluate(final String formula, final Map<String, Integer> bandMapping, final BandRaster input)
            throws EvaluationException {
        final Expression expression = BandMathParser.parse(formula);

        final Set<String> symbols = new LinkedHashSet<>();
        expression.collectSymbols(symbols);
        final Map<String, float[]> samples = new HashMap<>();
        for (final String symbol : symbols) {
            final Integer bandNumber = bandMapping.get(symbol);
            if (bandNumber == null) {
                throw new EvaluationException("Band '" + symbol + "' is not mapped (formula: " + formula + ")");
            }
            if (bandNumber < 1 || bandNumber > input.bandCount()) {
                throw new EvaluationException("Band '" + symbol + "' maps to band " + bandNumber
                                              + " but the raster has " + input.bandCount() + " band(s)");
            }
            samples.put(symbol, input.band(bandNumber));
        }

        final Set<BandStatistic> wanted = new LinkedHashSet<>();
        expression.collectStatistics(wanted);
        final Map<BandStatistic, Double> statistics = new HashMap<>();
        for (final BandStatistic statistic : wanted) {
            final double value = BandStatistic.compute(statistic.kind(), samples.get(statistic.symbol()));
            LOGGER.log(Level.FINE, "{0} = {1}", new Object[]{statistic, value});
            statistics.put(statistic, value);
        }

        final BoundBands bound = new BoundBands(samples, statistics);
        final float[] out = new float[input.pixelCount()];
        for (int i = 0; i < out.length; i++) {
            out[i] = (float) expression.evaluate(bound, i);
        }
        return BandRaster.singleBand(input.width(), input.height(), out);
    }
}
