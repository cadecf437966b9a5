package com.papertrail.core.graph;

/**
 * Validation of values interpolated into Cypher. Labels, relationship types
 * and property keys cannot be parameterized, so they are restricted to
 * identifier characters.
 */
public final class InputSanitizer {

    /** Maximum allowed length for Cypher string values. */
    public static final int MAX_CYPHER_VALUE_LENGTH = 16_000;

    private InputSanitizer() {
        // utility class
    }

    /**
     * Validates a node label, relationship type or property key.
     *
     * @throws IllegalArgumentException if the identifier is blank or contains
     *                                  anything but letters, digits and underscores
     */
    public static void validateIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Identifier must not be null or blank");
        }
        if (!identifier.matches("^[A-Za-z_][A-Za-z0-9_]*$")) {
            throw new IllegalArgumentException(
                    "Identifier must contain only alphanumeric characters and underscores, got: '"
                            + identifier + "'");
        }
    }

    /**
     * Enforces the maximum length of a string value.
     *
     * @throws IllegalArgumentException if the value exceeds the maximum length
     */
    public static void sanitizeForCypher(String value) {
        if (value != null && value.length() > MAX_CYPHER_VALUE_LENGTH) {
            throw new IllegalArgumentException(
                    "Value exceeds maximum Cypher string length of " + MAX_CYPHER_VALUE_LENGTH
                            + " characters (was " + value.length() + ")");
        }
        if (value != null && containsControlCharacters(value)) {
            throw new IllegalArgumentException("Value must not contain control characters");
        }
    }

    /**
     * Checks for ASCII control characters (0x00-0x1F, 0x7F) other than tab,
     * newline and carriage return.
     */
    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 && c != '\t' && c != '\n' && c != '\r') {
                return true;
            }
            if (c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
