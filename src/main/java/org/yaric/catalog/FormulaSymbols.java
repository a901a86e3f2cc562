package org.yaric.catalog;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical scan of a formula for band symbols: identifiers that are not called as functions.
 * Deliberately tolerant of malformed formulas; syntax is checked when the formula is evaluated.
 */
public final class FormulaSymbols {

    private static final Pattern IDENTIFIER = Pattern.compile("(?<![\\p{L}\\p{Nd}_.])([\\p{L}_][\\p{L}\\p{Nd}_]*)(?![\\p{L}\\p{Nd}_])(?!\\s*\\()");

    private FormulaSymbols() {
    }

    public static Set<String> scan(final String formula) {
        if (formula == null) return Collections.emptySet();
        final Set<String> symbols = new LinkedHashSet<>();
        final Matcher m = IDENTIFIER.matcher(formula);
        while (m.find()) {
            symbols.add(m.group(1));
        }
        return symbols;
    }
}
