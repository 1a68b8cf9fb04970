package com.siccatalog.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a rephrase lookup.
 *
 * <p>Exactly one of {@link #reviewedDescription()} and {@link #error()} is set.
 *
 * @param code requested code
 * @param reviewedDescription curated description, or null if not found
 * @param error not-found marker, or null if found
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RephraseResult(
    @JsonProperty("sic_code") String code,
    @JsonProperty("reviewed_description") String reviewedDescription,
    @JsonProperty("error") String error
) {
    /** Marker carried by results for codes without a rephrase entry. */
    public static final String NOT_FOUND = "SIC code not found";

    public static RephraseResult found(String code, String reviewedDescription) {
        return new RephraseResult(code, reviewedDescription, null);
    }

    public static RephraseResult notFound(String code) {
        return new RephraseResult(code, null, NOT_FOUND);
    }

    public boolean isFound() {
        return error == null;
    }
}
