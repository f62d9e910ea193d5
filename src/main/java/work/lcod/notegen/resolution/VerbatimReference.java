package work.lcod.notegen.resolution;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parsed {@code source:id#locator} reference, e.g. {@code transcript:visit_123#t=40-55}.
 */
public record VerbatimReference(String source, String id, String locator) {
    private static final Pattern FORMAT = Pattern.compile("^([^:]+):([^#]+)(#(.+))?$");

    public static Optional<VerbatimReference> parse(String ref) {
        if (ref == null) {
            return Optional.empty();
        }
        var matcher = FORMAT.matcher(ref);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new VerbatimReference(matcher.group(1), matcher.group(2), matcher.group(4)));
    }

    public boolean hasLocator() {
        return locator != null && !locator.isEmpty();
    }
}
