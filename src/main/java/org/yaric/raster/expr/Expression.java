package org.yaric.raster.expr;

import java.util.Set;

/**
 * Parsed band-math expression, evaluated one pixel at a time against bound bands.
 */
public interface Expression {

    double evaluate(BoundBands bands, int pixel);

    /** Adds every band symbol the expression reads, including symbols passed to statistic functions. */
    void collectSymbols(Set<String> symbols);

    /** Adds every whole-band statistic the expression needs. */
    default void collectStatistics(Set<BandStatistic> statistics) {
    }

    record Constant(double value) implements Expression {
        @Override
        public double evaluate(final BoundBands bands, final int pixel) {
            return value;
        }

        @Override
        public void collectSymbols(final Set<String> symbols) {
        }
    }

    record Band(String symbol) implements Expression {
        @Override
        public double evaluate(final BoundBands bands, final int pixel) {
            return bands.samples(symbol)[pixel];
        }

        @Override
        public void collectSymbols(final Set<String> symbols) {
            symbols.add(symbol);
        }
    }

    record Negate(Expression operand) implements Expression {
        @Override
        public double evaluate(final BoundBands bands, final int pixel) {
            return -operand.evaluate(bands, pixel);
        }

        @Override
        public void collectSymbols(final Set<String> symbols) {
            operand.collectSymbols(symbols);
        }

        @Override
        public void collectStatistics(final Set<BandStatistic> statistics) {
            operand.collectStatistics(statistics);
        }
    }

    record Binary(char operator, Expression left, Expression right) implements Expression {
        @Override
        public double evaluate(final BoundBands bands, final int pixel) {
            final double l = left.evaluate(bands, pixel);
            final double r = right.evaluate(bands, pixel);
            switch (operator) {
                case '+':
                    return l + r;
                case '-':
                    return l - r;
                case '*':
                    return l * r;
                case '/':
                    return l / r;
                case '^':
                    return Math.pow(l, r);
                default:
                    throw new IllegalStateException("Unknown operator " + operator);
            }
        }

        @Override
        public void collectSymbols(final Set<String> symbols) {
            left.collectSymbols(symbols);
            right.collectSymbols(symbols);
        }

        @Override
        public void collectStatistics(final Set<BandStatistic> statistics) {
            left.collectStatistics(statistics);
            right.collectStatistics(statistics);
        }
    }

    record Statistic(BandStatistic statistic) implements Expression {
        @Override
        public double evaluate(final BoundBands bands, final int pixel) {
            return bands.statistic(statistic);
        }

        @Override
        public void collectSymbols(final Set<String> symbols) {
            symbols.add(statistic.symbol());
        }

        @Override
        public void collectStatistics(final Set<BandStatistic> statistics) {
            statistics.add(statistic);
        }
    }
}
