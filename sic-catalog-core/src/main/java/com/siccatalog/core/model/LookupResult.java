package com.siccatalog.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a description lookup.
 *
 * <p>A miss is not an error: {@link #code()} and the metadata fields are null.
 *
 * @param description lower-cased query
 * @param code matched 5-digit code, or null
 * @param codeMeta metadata of the matched code, or null
 * @param codeDivision 2-digit division of the matched code, or null
 * @param codeDivisionMeta metadata of the division, or null
 * @param potentialMatches substring matches; null unless similarity was requested
 */
public record LookupResult(
    @JsonProperty("description") String description,
    @JsonProperty("code") String code,
    @JsonProperty("code_meta") MetadataRecord codeMeta,
    @JsonProperty("code_division") String codeDivision,
    @JsonProperty("code_division_meta") MetadataRecord codeDivisionMeta,
    @JsonProperty("potential_matches") @JsonInclude(JsonInclude.Include.NON_NULL) PotentialMatches potentialMatches
) {
    /**
     * Checks whether the exact lookup found a code.
     *
     * @return true if {@link #code()} is set
     */
    public boolean isFound() {
        return code != null;
    }
}
