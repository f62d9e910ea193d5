package work.lcod.notegen.formula;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FormulaEvaluatorTest {
    private FormulaCache cache;
    private FormulaEvaluator evaluator;

    @BeforeEach
    void setUp() {
        cache = new FormulaCache();
        evaluator = new FormulaEvaluator(cache);
    }

    @Test
    void subtractsFromNestedReference() {
        var data = Map.<String, Object>of("assessments", Map.of("phq9", Map.of("score", 21)));
        assertEquals(15L, evaluator.evaluate("assessments.phq9.score - 6", data));
    }

    @Test
    void respectsPrecedenceAndParentheses() {
        assertEquals(14L, evaluator.evaluate("2 + 3 * 4", Map.of()));
        assertEquals(20L, evaluator.evaluate("(2 + 3) * 4", Map.of()));
        assertEquals(2.5, evaluator.evaluate("10 / 4", Map.of()));
        assertEquals(-3L, evaluator.evaluate("-(1 + 2)", Map.of()));
    }

    @Test
    void concatenatesWhenEitherSideIsString() {
        var data = Map.<String, Object>of("patient", Map.of("first", "Alex", "visits", 3));
        assertEquals("Alex (3)", evaluator.evaluate("patient.first + ' (' + patient.visits + ')'", data));
        assertEquals("score: 2.5", evaluator.evaluate("\"score: \" + 2.50", Map.of()));
    }

    @Test
    void evaluatesTernaryWithComparisons() {
        var data = Map.<String, Object>of("score", 12, "prior", 8);
        assertEquals("worse", evaluator.evaluate("score > prior ? 'worse' : 'better'", data));
        assertEquals("none", evaluator.evaluate("missing ? 'some' : 'none'", data));
        assertEquals(true, evaluator.evaluate("score >= 10 && !(prior == 0)", data));
        assertEquals(false, evaluator.evaluate("score < 10 || prior != 8", data));
    }

    @Test
    void readsIndexedPaths() {
        var data = Map.<String, Object>of("scores", List.of(Map.of("value", 4), Map.of("value", 9)));
        assertEquals(5L, evaluator.evaluate("scores[1].value - scores[0].value", data));
    }

    @Test
    void missingReferenceInArithmeticFails() {
        var ex = assertThrows(FormulaException.class, () -> evaluator.evaluate("missing.value + 1", Map.of()));
        assertEquals("formula_error", ex.code());
        assertTrue(ex.getMessage().contains("missing.value + 1"));
    }

    @Test
    void divisionByZeroFails() {
        assertThrows(FormulaException.class, () -> evaluator.evaluate("1 / 0", Map.of()));
    }

    @Test
    void malformedInputFails() {
        for (var formula : List.of("1 +", "(1 + 2", "1 2", "a..b", "1 ? 2", "'open", "#", "1.", "a[x]")) {
            assertThrows(FormulaException.class, () -> evaluator.evaluate(formula, Map.of("a", 1)), formula);
        }
    }

    @Test
    void blankFormulaYieldsEmptyString() {
        assertEquals("", evaluator.evaluate("  ", Map.of()));
    }

    @Test
    void returnsReferencedValuesAsIs() {
        assertNull(evaluator.evaluate("missing", Map.of()));
        assertEquals("stable", evaluator.evaluate("mood", Map.of("mood", "stable")));
    }

    @Test
    void cachesCompiledExpressions() {
        var first = evaluator.compile("a + 1");
        var second = evaluator.compile("a + 1");
        assertSame(first, second);
        assertEquals(1, cache.size());
        evaluator.compile("a + 2");
        assertEquals(2, cache.size());
        cache.clear();
        assertEquals(0, cache.size());
    }

    @Test
    void formatsNumbers() {
        assertEquals("+4", FormulaEvaluator.format(4L, FormatHint.DELTA_SCORE));
        assertEquals("+0", FormulaEvaluator.format(0L, FormatHint.DELTA_SCORE));
        assertEquals("-3", FormulaEvaluator.format(-3L, FormatHint.DELTA_SCORE));
        assertEquals("42.5%", FormulaEvaluator.format(0.425, FormatHint.PERCENT));
        assertEquals("2.5", FormulaEvaluator.format(2.5, FormatHint.PLAIN));
        assertEquals("text", FormulaEvaluator.format("text", FormatHint.PERCENT));
        assertEquals(FormatHint.PLAIN, FormatHint.fromWire("unknown"));
        assertEquals(FormatHint.DELTA_SCORE, FormatHint.fromWire("deltaScore"));
    }
}
