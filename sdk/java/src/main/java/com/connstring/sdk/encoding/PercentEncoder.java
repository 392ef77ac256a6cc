package com.connstring.sdk.encoding;

/**
 * Percent encoding for values in a URI-style connection string.
 *
 * Only the reserved characters of RFC 3986 section 2.2 are replaced:
 * {@code ! # $ & ' ( ) * + , / : ; = ? @ [ ]}. Every other character,
 * including {@code %}, non-ASCII and control characters, is copied unchanged.
 */
public final class PercentEncoder {
    private static final String RESERVED = "!#$&'()*+,/:;=?@[]";
    private static final String[] REPLACEMENTS = new String[128];

    static {
        for (char c : RESERVED.toCharArray()) {
            REPLACEMENTS[c] = String.format("%%%02X", (int) c);
        }
    }

    private PercentEncoder() {
    }

    /**
     * Check if a character belongs to the reserved set
     */
    public static boolean isReserved(char c) {
        return c < REPLACEMENTS.length && REPLACEMENTS[c] != null;
    }

    /**
     * Replace every reserved character with its uppercase percent escape.
     *
     * @param value Raw value
     * @return Encoded value
     */
    public static String encode(String value) {
        if (value == null) {
            throw new IllegalArgumentException("value to encode must not be null");
        }

        StringBuilder encoded = null;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (isReserved(c)) {
                if (encoded == null) {
                    encoded = new StringBuilder(value.length() + 16);
                    encoded.append(value, 0, i);
                }
                encoded.append(REPLACEMENTS[c]);
            } else if (encoded != null) {
                encoded.append(c);
            }
        }

        return encoded != null ? encoded.toString() : value;
    }
}
