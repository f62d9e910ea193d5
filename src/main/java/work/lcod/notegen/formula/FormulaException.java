package work.lcod.notegen.formula;

import java.util.Map;
import work.lcod.notegen.shared.NotegenException;

/**
 * Malformed formula or a value the formula cannot operate on.
 */
public final class FormulaException extends NotegenException {
    public FormulaException(String message) {
        super("formula_error", message, Map.of());
    }

    public FormulaException(String formula, String reason) {
        super("formula_error", "Failed to evaluate formula \"" + formula + "\": " + reason, Map.of("formula", formula));
    }
}
