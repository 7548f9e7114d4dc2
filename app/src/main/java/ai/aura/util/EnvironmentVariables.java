package ai.aura.util;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shell-style variable substitution for configuration values.
 *
 * <p>Both {@code ${NAME}} and {@code $NAME} are recognised. References to variables that are not defined are left
 * exactly as written, so a missing secret shows up verbatim instead of silently becoming an empty string.
 */
public final class EnvironmentVariables {
    private static final Pattern REFERENCE =
            Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}|\\$([A-Za-z_][A-Za-z0-9_]*)");

    private EnvironmentVariables() {}

    public static String expand(String value) {
        return expand(value, System.getenv());
    }

    public static String expand(String value, Map<String, String> environment) {
        if (value.indexOf('$') < 0) {
            return value;
        }
        Matcher m = REFERENCE.matcher(value);
        var sb = new StringBuilder(value.length());
        while (m.find()) {
            String name = m.group(1) != null ? m.group(1) : m.group(2);
            String replacement = environment.get(name);
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement != null ? replacement : m.group()));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /** Expand every value of {@code values}; keys are kept as they are and iteration order is preserved. */
    public static Map<String, String> expandAll(Map<String, String> values, Map<String, String> environment) {
        var resolved = new LinkedHashMap<String, String>();
        values.forEach((k, v) -> resolved.put(k, expand(v, environment)));
        return resolved;
    }
}
