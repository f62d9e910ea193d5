package work.lcod.notegen.template;

import java.util.List;

/**
 * Template-authored prompt text: system preamble, main purpose and optional hard rules.
 */
public record PromptConfig(String system, String main, List<String> rules) {
    public PromptConfig {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public static PromptConfig empty() {
        return new PromptConfig(null, null, List.of());
    }
}
