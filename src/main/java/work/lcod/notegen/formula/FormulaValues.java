package work.lcod.notegen.formula;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Value semantics for formulas. Numbers are carried as {@link BigDecimal} while evaluating.
 */
final class FormulaValues {
    private FormulaValues() {}

    static Object normalizeInput(Object value) {
        if (value instanceof BigDecimal) {
            return value;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        return value;
    }

    static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof BigDecimal number) {
            return number.signum() != 0;
        }
        if (value instanceof String str) {
            return !str.isEmpty();
        }
        return true;
    }

    static BigDecimal toNumber(Object value, String operator) {
        if (value instanceof BigDecimal number) {
            return number;
        }
        if (value == null) {
            throw new FormulaException("unresolved reference used with '" + operator + "'");
        }
        throw new FormulaException("operator '" + operator + "' expects numbers, got " + describe(value));
    }

    static Object apply(String operator, Object left, Object right) {
        switch (operator) {
            case "+":
                if (left instanceof String || right instanceof String) {
                    return text(left, operator) + text(right, operator);
                }
                return toNumber(left, operator).add(toNumber(right, operator));
            case "-":
                return toNumber(left, operator).subtract(toNumber(right, operator));
            case "*":
                return toNumber(left, operator).multiply(toNumber(right, operator));
            case "/": {
                var divisor = toNumber(right, operator);
                if (divisor.signum() == 0) {
                    throw new FormulaException("division by zero");
                }
                return toNumber(left, operator).divide(divisor, MathContext.DECIMAL64);
            }
            case "==":
                return same(left, right);
            case "!=":
                return !same(left, right);
            case "<":
                return compare(left, right, operator) < 0;
            case "<=":
                return compare(left, right, operator) <= 0;
            case ">":
                return compare(left, right, operator) > 0;
            case ">=":
                return compare(left, right, operator) >= 0;
            default:
                throw new FormulaException("unsupported operator '" + operator + "'");
        }
    }

    /**
     * Converts an evaluation result to the public form: integral numbers as {@link Long}, others as {@link Double}.
     */
    static Object toResult(Object value) {
        if (value instanceof BigDecimal number) {
            var stripped = number.stripTrailingZeros();
            if (stripped.scale() <= 0 && stripped.abs().compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) <= 0) {
                return stripped.longValueExact();
            }
            return number.doubleValue();
        }
        return value;
    }

    static String numberText(BigDecimal number) {
        return number.signum() == 0 ? "0" : number.stripTrailingZeros().toPlainString();
    }

    private static String text(Object value, String operator) {
        if (value == null) {
            throw new FormulaException("unresolved reference used with '" + operator + "'");
        }
        if (value instanceof BigDecimal number) {
            return numberText(number);
        }
        if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
            throw new FormulaException("cannot concatenate " + describe(value));
        }
        return String.valueOf(value);
    }

    private static boolean same(Object left, Object right) {
        if (left instanceof BigDecimal a && right instanceof BigDecimal b) {
            return a.compareTo(b) == 0;
        }
        return Objects.equals(left, right);
    }

    private static int compare(Object left, Object right, String operator) {
        if (left instanceof String a && right instanceof String b) {
            return a.compareTo(b);
        }
        return toNumber(left, operator).compareTo(toNumber(right, operator));
    }

    private static String describe(Object value) {
        if (value instanceof Map<?, ?>) {
            return "object";
        }
        if (value instanceof Collection<?>) {
            return "array";
        }
        return value instanceof String ? "string" : value.getClass().getSimpleName().toLowerCase(Locale.ROOT);
    }
}
