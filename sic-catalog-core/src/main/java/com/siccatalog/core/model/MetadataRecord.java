package com.siccatalog.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Descriptive metadata for one classification code.
 *
 * <p>Codes are alpha codes padded with {@code x}; partial codes stand for a whole
 * hierarchical group (for example {@code "A01xxx"} for division 01).
 *
 * @param code alpha code, e.g. {@code "A0111x"}
 * @param title short descriptive title
 * @param detail longer description (empty when absent)
 * @param includes titles that belong in this category
 * @param excludes titles that are classified elsewhere
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MetadataRecord(
    @JsonProperty("code") String code,
    @JsonProperty("title") String title,
    @JsonProperty("detail") String detail,
    @JsonProperty("includes") List<String> includes,
    @JsonProperty("excludes") List<String> excludes
) {
    private static final int MIN_MATCH_DIGITS = 2;

    /** Digit counts printed by {@link #prettyPrint(Set)} when none are given. */
    public static final Set<Integer> DEFAULT_PRINT_DIGITS = Set.of(4, 2);

    /**
     * Compact constructor with validation.
     */
    public MetadataRecord {
        Objects.requireNonNull(code, "code must not be null");
        if (title == null) {
            title = "";
        }
        if (detail == null) {
            detail = "";
        }
        includes = includes == null ? List.of() : List.copyOf(includes);
        excludes = excludes == null ? List.of() : List.copyOf(excludes);
    }

    /**
     * Checks whether a numeric code partially matches this record's code.
     *
     * <p>The section letter is ignored and only the shared digits are compared; at least
     * {@value #MIN_MATCH_DIGITS} digits must be compared for a match.
     *
     * @param subcode 2 to 5 digit numeric code
     * @return true if the leading digits agree
     */
    public boolean matchesCodePrefix(String subcode) {
        int n = Math.min(code.replace("x", "").length(), subcode.length() + 1);
        if (n <= MIN_MATCH_DIGITS) {
            return false;
        }
        return code.substring(1, n).equals(subcode.substring(0, n - 1));
    }

    /**
     * Renders the populated fields as one line of prose.
     *
     * @param digitCounts digit counts to render; {@code null} means {@link #DEFAULT_PRINT_DIGITS}
     * @return rendered text, or an empty string if this code's digit count is not selected
     */
    public String prettyPrint(Set<Integer> digitCounts) {
        Set<Integer> selected = digitCounts == null ? DEFAULT_PRINT_DIGITS : digitCounts;
        String numeric = code.substring(1).replace("x", "");
        if (!selected.contains(numeric.length())) {
            return "";
        }
        StringBuilder out = new StringBuilder("Code ").append(numeric).append(": ").append(title).append(". ");
        if (!detail.isEmpty()) {
            out.append(detail).append(". ");
        }
        if (!includes.isEmpty()) {
            out.append("Includes ").append(String.join(", ", includes)).append(". ");
        }
        if (!excludes.isEmpty()) {
            out.append("Excludes ").append(String.join(", ", excludes)).append(". ");
        }
        return out.toString();
    }
}
