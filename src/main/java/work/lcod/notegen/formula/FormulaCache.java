package work.lcod.notegen.formula;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Compiled formulas keyed by their exact source text. Safe for concurrent resolution runs; two
 * threads compiling the same formula at once both succeed and one result wins.
 */
public final class FormulaCache {
    private final Map<String, Expression> compiled = new ConcurrentHashMap<>();

    Expression get(String formula, Function<String, Expression> compiler) {
        var cached = compiled.get(formula);
        if (cached != null) {
            return cached;
        }
        var expression = compiler.apply(formula);
        var previous = compiled.putIfAbsent(formula, expression);
        return previous != null ? previous : expression;
    }

    public int size() {
        return compiled.size();
    }

    public void clear() {
        compiled.clear();
    }
}
