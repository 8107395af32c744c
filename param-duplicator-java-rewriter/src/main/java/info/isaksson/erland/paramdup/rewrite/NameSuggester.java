package info.isaksson.erland.paramdup.rewrite;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Suggests a name for a duplicated parameter from the name of the original one.
 *
 * <p>Strategies are tried in a fixed order and the first match wins:</p>
 * <ol>
 *   <li>curated alternative for common parameter names (case-insensitive)</li>
 *   <li>increment of a trailing decimal number ({@code item1 -> item2})</li>
 *   <li>{@code is}/{@code has} prefix rewrite ({@code isActive -> shouldBeActive})</li>
 *   <li>{@code "2"} suffix for names of at most three characters</li>
 *   <li>{@code "alternative"} prefix with the first letter capitalized</li>
 * </ol>
 *
 * <p>The result never equals the input.</p>
 */
public final class NameSuggester {

    static final int SHORT_NAME_MAX_LENGTH = 3;

    private static final Map<String, String> SEMANTIC_ALTERNATIVES = createSemanticAlternatives();

    private NameSuggester() {}

    /**
     * Suggest a new parameter name.
     *
     * @param name the original identifier, never empty
     * @return a different identifier derived from {@code name}
     */
    public static String suggest(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("name must not be null or empty");
        }

        String semantic = SEMANTIC_ALTERNATIVES.get(name.toLowerCase(Locale.ROOT));
        if (semantic != null) return semantic;

        String incremented = incrementTrailingNumber(name);
        if (incremented != null) return incremented;

        if (hasPrefixWithRemainder(name, "is")) {
            return "shouldBe" + name.substring(2);
        }
        if (hasPrefixWithRemainder(name, "has")) {
            return "includes" + name.substring(3);
        }

        if (name.length() <= SHORT_NAME_MAX_LENGTH) {
            return name + "2";
        }

        return "alternative" + Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    /** Curated alternatives keyed by lower-case name. */
    public static Map<String, String> semanticAlternatives() {
        return SEMANTIC_ALTERNATIVES;
    }

    /**
     * Returns {@code prefix + (number + 1)} for names ending in ASCII digits, or null when the
     * name has no numeric suffix or the suffix does not fit an {@code int} after incrementing.
     */
    static String incrementTrailingNumber(String name) {
        int digitsStart = name.length();
        while (digitsStart > 0 && isAsciiDigit(name.charAt(digitsStart - 1))) {
            digitsStart--;
        }
        if (digitsStart == name.length()) return null;

        String prefix = name.substring(0, digitsStart);
        String digits = name.substring(digitsStart);
        int number;
        try {
            number = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            // Suffix too large for an int: let the remaining strategies handle the name.
            return null;
        }
        if (number == Integer.MAX_VALUE) return null;
        return prefix + (number + 1);
    }

    private static boolean hasPrefixWithRemainder(String name, String prefix) {
        return name.length() > prefix.length() && name.regionMatches(true, 0, prefix, 0, prefix.length());
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static Map<String, String> createSemanticAlternatives() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("value", "newValue");
        m.put("item", "otherItem");
        m.put("data", "additionalData");
        m.put("input", "secondInput");
        m.put("output", "secondOutput");
        m.put("source", "destination");
        m.put("text", "otherText");
        m.put("name", "displayName");
        m.put("id", "secondId");
        m.put("key", "secondaryKey");
        m.put("count", "maxCount");
        m.put("size", "preferredSize");
        m.put("index", "startIndex");
        m.put("length", "maxLength");
        return Collections.unmodifiableMap(m);
    }
}
