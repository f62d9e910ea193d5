package work.lcod.notegen.formula;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import work.lcod.notegen.path.PathParser;
import work.lcod.notegen.path.PathSegment;

/**
 * Parsed formula tree. Nodes are immutable so compiled formulas can be shared across threads.
 */
public interface Expression {
    Object evaluate(FormulaScope scope);

    record Literal(Object value) implements Expression {
        @Override
        public Object evaluate(FormulaScope scope) {
            return value;
        }
    }

    record PathRef(String path, List<PathSegment> segments) implements Expression {
        public PathRef {
            Objects.requireNonNull(path, "path");
            segments = List.copyOf(segments);
        }

        static PathRef of(String path) {
            return new PathRef(path, PathParser.parse(path));
        }

        @Override
        public Object evaluate(FormulaScope scope) {
            return FormulaValues.normalizeInput(scope.resolve(segments));
        }
    }

    record Unary(String operator, Expression operand) implements Expression {
        @Override
        public Object evaluate(FormulaScope scope) {
            var value = operand.evaluate(scope);
            if ("!".equals(operator)) {
                return !FormulaValues.truthy(value);
            }
            return FormulaValues.toNumber(value, "-").negate();
        }
    }

    record Binary(String operator, Expression left, Expression right) implements Expression {
        @Override
        public Object evaluate(FormulaScope scope) {
            if ("&&".equals(operator)) {
                var l = left.evaluate(scope);
                return FormulaValues.truthy(l) ? right.evaluate(scope) : l;
            }
            if ("||".equals(operator)) {
                var l = left.evaluate(scope);
                return FormulaValues.truthy(l) ? l : right.evaluate(scope);
            }
            return FormulaValues.apply(operator, left.evaluate(scope), right.evaluate(scope));
        }
    }

    record Conditional(Expression condition, Expression whenTrue, Expression whenFalse) implements Expression {
        @Override
        public Object evaluate(FormulaScope scope) {
            return FormulaValues.truthy(condition.evaluate(scope)) ? whenTrue.evaluate(scope) : whenFalse.evaluate(scope);
        }
    }

    static Literal number(String text) {
        return new Literal(new BigDecimal(text));
    }
}
