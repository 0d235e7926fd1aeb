package io.eidos.core.engine;

/** Which block-end lines may close the innermost open block. */
public enum ClosePolicy {

    /** Any block rule's end prefix closes the innermost block, whichever rule opened it. */
    ANY_END,

    /**
     * Only the end prefix of the rule that opened the innermost block closes it. Other end prefixes
     * are classified as ordinary lines.
     */
    MATCHING_END;

    /**
     * Parses a policy name as used in configuration: {@code any}, {@code matching}, or the enum
     * constant name, case-insensitively.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static ClosePolicy fromConfig(String value) {
        return switch (value.trim().toLowerCase()) {
            case "any", "any_end" -> ANY_END;
            case "matching", "matching_end" -> MATCHING_END;
            default ->
                throw new IllegalArgumentException(
                        "Unknown close policy '" + value + "' — expected one of: any, matching");
        };
    }
}
