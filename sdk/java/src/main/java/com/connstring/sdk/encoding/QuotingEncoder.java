package com.connstring.sdk.encoding;

/**
 * Quoting for values in a semicolon-delimited key/value connection string.
 *
 * <p>SQL Server requires a value to be enclosed in single or double quotation
 * marks if it contains a semicolon, a Unicode control character, or leading or
 * trailing white space. The enclosing character may not occur inside the value
 * unless it is doubled.
 *
 * <p>Quotation marks are only added when they are required. Double quotation
 * marks are preferred:
 * <ul>
 *   <li>a value containing only one kind of quotation mark is enclosed in the other kind</li>
 *   <li>a value containing both kinds has its double quotation marks doubled and is
 *       enclosed in double quotation marks</li>
 * </ul>
 */
public final class QuotingEncoder {
    private static final char DOUBLE_QUOTE = '"';
    private static final char SINGLE_QUOTE = '\'';

    private QuotingEncoder() {
    }

    /**
     * Check if a value has to be enclosed in quotation marks
     */
    public static boolean needsQuotes(String value) {
        if (value == null) {
            throw new IllegalArgumentException("value to check must not be null");
        }
        return containsControlCharacter(value)
            || value.startsWith(" ")
            || value.endsWith(" ")
            || value.indexOf(';') >= 0;
    }

    /**
     * Quote a value if, and only if, it requires quoting.
     *
     * @param value Raw value
     * @return The value itself, or the quoted value
     */
    public static String encode(String value) {
        if (value == null) {
            throw new IllegalArgumentException("value to encode must not be null");
        }

        if (!needsQuotes(value)) {
            return value;
        }

        if (value.indexOf(DOUBLE_QUOTE) < 0) {
            return DOUBLE_QUOTE + value + DOUBLE_QUOTE;
        }

        if (value.indexOf(SINGLE_QUOTE) < 0) {
            return SINGLE_QUOTE + value + SINGLE_QUOTE;
        }

        return DOUBLE_QUOTE + value.replace("\"", "\"\"") + DOUBLE_QUOTE;
    }

    // Unicode general category Cc
    private static boolean containsControlCharacter(String value) {
        return value.codePoints().anyMatch(Character::isISOControl);
    }
}
