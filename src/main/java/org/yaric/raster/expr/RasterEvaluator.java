package org.yaric.raster.expr;

import org.yaric.raster.BandRaster;

import java.util.Map;

/**
 * Raster-algebra boundary: evaluates a formula over the bands of one raster.
 */
public interface RasterEvaluator {

    /**
     * @param formula     band-math formula over band symbols
     * @param bandMapping band symbol to 1-based band number
     * @param input       decoded input raster
     * @return a single-band raster with the input's dimensions
     * @throws EvaluationException if the formula is malformed or references a band the mapping or raster lacks
     */
    BandRaster evaluate(String formula, Map<String, Integer> bandMapping, BandRaster input) throws EvaluationException;
}
