package org.yaric.raster.expr;

import java.util.Optional;

/**
 * Recursive-descent parser for band-math formulas.
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := unary (('*' | '/') unary)*
 * unary      := '-' unary | power
 * power      := primary ('^' unary)?
 * primary    := NUMBER | SYMBOL | FUNCTION '(' SYMBOL ')' | '(' expression ')'
 * </pre>
 * {@code ^} is right-associative and binds tighter than a leading minus: {@code -G^2 == -(G^2)}.
 */
public final class BandMathParser {

    private final String formula;
    private int pos;

    private BandMathParser(final String formula) {
        this.formula = formula;
    }

    public static Expression parse(final String formula) throws EvaluationException {
        if (formula == null || formula.isBlank()) {
            throw new EvaluationException("Empty formula");
        }
        final BandMathParser parser = new BandMathParser(formula);
        final Expression expression = parser.expression();
        parser.skipWhitespace();
        if (parser.pos < formula.length()) {
            throw parser.error("Unexpected '" + formula.charAt(parser.pos) + "'");
        }
        return expression;
    }

    private Expression expression() throws EvaluationException {
        Expression left = term();
        while (true) {
            if (accept('+')) {
                left = new Expression.Binary('+', left, term());
            } else if (accept('-')) {
                left = new Expression.Binary('-', left, term());
            } else {
                return left;
            }
        }
    }

    private Expression term() throws EvaluationException {
        Expression left = unary();
        while (true) {
            if (accept('*')) {
                left = new Expression.Binary('*', left, unary());
            } else if (accept('/')) {
                left = new Expression.Binary('/', left, unary());
            } else {
                return left;
            }
        }
    }

    private Expression unary() throws EvaluationException {
        if (accept('-')) {
            return new Expression.Negate(unary());
        }
        if (accept('+')) {
            return unary();
        }
        return power();
    }

    private Expression power() throws EvaluationException {
        final Expression base = primary();
        if (accept('^')) {
            return new Expression.Binary('^', base, unary());
        }
        return base;
    }

    private Expression primary() throws EvaluationException {
        skipWhitespace();
        if (pos >= formula.length()) {
            throw error("Unexpected end of formula");
        }
        final char c = formula.charAt(pos);
        if (c == '(') {
            pos++;
            final Expression inner = expression();
            expect(')');
            return inner;
        }
        if (Character.isDigit(c) || c == '.') {
            return number();
        }
        if (isIdentifierStart(c)) {
            final String name = identifier();
            if (accept('(')) {
                return function(name);
            }
            return new Expression.Band(name);
        }
        throw error("Unexpected '" + c + "'");
    }

    private Expression function(final String name) throws EvaluationException {
        final Optional<BandStatistic.Kind> kind = BandStatistic.Kind.forFunction(name);
        if (kind.isEmpty()) {
            throw error("Unknown function '" + name + "'");
        }
        skipWhitespace();
        if (pos >= formula.length() || !isIdentifierStart(formula.charAt(pos))) {
            throw error(name + " expects a band symbol");
        }
        final String symbol = identifier();
        expect(')');
        return new Expression.Statistic(new BandStatistic(kind.get(), symbol));
    }

    private Expression number() throws EvaluationException {
        final int start = pos;
        while (pos < formula.length() && (Character.isDigit(formula.charAt(pos)) || formula.charAt(pos) == '.')) {
            pos++;
        }
        if (pos < formula.length() && (formula.charAt(pos) == 'e' || formula.charAt(pos) == 'E')) {
            int p = pos + 1;
            if (p < formula.length() && (formula.charAt(p) == '+' || formula.charAt(p) == '-')) p++;
            if (p < formula.length() && Character.isDigit(formula.charAt(p))) {
                pos = p;
                while (pos < formula.length() && Character.isDigit(formula.charAt(pos))) pos++;
            }
        }
        final String text = formula.substring(start, pos);
        try {
            return new Expression.Constant(Double.parseDouble(text));
        } catch (final NumberFormatException e) {
            throw new EvaluationException("Malformed number '" + text + "' in formula: " + formula, e);
        }
    }

    private String identifier() {
        final int start = pos;
        while (pos < formula.length() && isIdentifierPart(formula.charAt(pos))) {
            pos++;
        }
        return formula.substring(start, pos);
    }

    private boolean accept(final char expected) {
        skipWhitespace();
        if (pos < formula.length() && formula.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private void expect(final char expected) throws EvaluationException {
        if (!accept(expected)) {
            throw error("Expected '" + expected + "'");
        }
    }

    private void skipWhitespace() {
        while (pos < formula.length() && Character.isWhitespace(formula.charAt(pos))) {
            pos++;
        }
    }

    private EvaluationException error(final String message) {
        return new EvaluationException(message + " at position " + pos + " in formula: " + formula);
    }

    static boolean isIdentifierStart(final char c) {
        return Character.isLetter(c) || c == '_';
    }

    static boolean isIdentifierPart(final char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
