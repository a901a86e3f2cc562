package org.yaric.catalog;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FormulaSymbolsTest {

    @Test
    void testScan_ignoresFunctionNamesAndNumbers() {
        assertEquals(Set.of("G", "R"), FormulaSymbols.scan("(G ^ 2 - R * 1.4e2) / func_band_max (G)"));
    }

    @Test
    void testScan_multiCharacterSymbols() {
        assertEquals(Set.of("NIR", "Red_edge"), FormulaSymbols.scan("(NIR - Red_edge) / (NIR + Red_edge)"));
    }

    @Test
    void testScan_unicodeLetters() {
        assertEquals(Set.of("Grün", "Rot"), FormulaSymbols.scan("(Grün - Rot) / (Grün + Rot)"));
        assertEquals(Set.of("Nähe", "B2"), FormulaSymbols.scan("Nähe * B2 - func_band_mean(Nähe)"));
    }

    @Test
    void testScan_nullAndConstantFormulas() {
        assertTrue(FormulaSymbols.scan(null).isEmpty());
        assertTrue(FormulaSymbols.scan("2 * 3.5").isEmpty());
    }
}
