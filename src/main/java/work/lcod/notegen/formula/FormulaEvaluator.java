package work.lcod.notegen.formula;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates template formulas with an explicit parser; formulas are data and never executed as code.
 */
public final class FormulaEvaluator {
    private final FormulaCache cache;

    public FormulaEvaluator(FormulaCache cache) {
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    /**
     * Parses (or fetches from the cache) the compiled form of a formula.
     */
    public Expression compile(String formula) {
        return cache.get(formula, source -> new FormulaParser(source).parse());
    }

    public Object evaluate(String formula, Map<String, Object> context) {
        return evaluate(formula, FormulaScope.of(context));
    }

    /**
     * Returns a {@link Long}, {@link Double}, {@link String}, {@link Boolean}, a referenced object, or
     * {@code null}. A blank formula evaluates to the empty string.
     */
    public Object evaluate(String formula, FormulaScope scope) {
        if (formula == null || formula.isBlank()) {
            return "";
        }
        var expression = compile(formula);
        try {
            return FormulaValues.toResult(expression.evaluate(scope));
        } catch (FormulaException ex) {
            throw new FormulaException(formula, ex.getMessage());
        } catch (ArithmeticException ex) {
            throw new FormulaException(formula, ex.getMessage());
        }
    }

    public static String format(Object value, FormatHint hint) {
        if (!(value instanceof Number number)) {
            return String.valueOf(value);
        }
        if (number instanceof Double d && (d.isNaN() || d.isInfinite())) {
            return String.valueOf(d);
        }
        var decimal = new BigDecimal(number.toString());
        switch (hint == null ? FormatHint.PLAIN : hint) {
            case DELTA_SCORE:
                return (decimal.signum() >= 0 ? "+" : "") + FormulaValues.numberText(decimal);
            case PERCENT:
                return decimal.multiply(BigDecimal.valueOf(100)).setScale(1, RoundingMode.HALF_UP).toPlainString() + "%";
            default:
                return FormulaValues.numberText(decimal);
        }
    }
}
