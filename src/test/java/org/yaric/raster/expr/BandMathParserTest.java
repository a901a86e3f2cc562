package org.yaric.raster.expr;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BandMathParserTest {

    @Test
    void testParse_powerIsRightAssociative() throws EvaluationException {
        Expression e = BandMathParser.parse("2 ^ 3 ^ 2");

        Expression.Binary top = assertInstanceOf(Expression.Binary.class, e);
        assertEquals('^', top.operator());
        assertEquals(new Expression.Constant(2), top.left());
        assertInstanceOf(Expression.Binary.class, top.right());
    }

    @Test
    void testParse_unaryMinusAppliesToPower() throws EvaluationException {
        Expression e = BandMathParser.parse("-G^2");

        Expression.Negate negate = assertInstanceOf(Expression.Negate.class, e);
        assertInstanceOf(Expression.Binary.class, negate.operand());
    }

    @Test
    void testParse_collectsSymbolsAndStatistics() throws EvaluationException {
        Expression e = BandMathParser.parse("(G - R) / func_band_max(B)");

        Set<String> symbols = new LinkedHashSet<>();
        e.collectSymbols(symbols);
        Set<BandStatistic> statistics = new LinkedHashSet<>();
        e.collectStatistics(statistics);

        assertEquals(Set.of("G", "R", "B"), symbols);
        assertEquals(Set.of(new BandStatistic(BandStatistic.Kind.MAX, "B")), statistics);
    }

    @Test
    void testParse_errorReportsPosition() {
        EvaluationException e = assertThrows(EvaluationException.class, () -> BandMathParser.parse("G + )"));
        assertTrue(e.getMessage().contains("position 4"), e.getMessage());
    }
}
