package com.siccatalog.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Division of a code, as resolved by a description lookup.
 *
 * @param codeDivision 2-digit division, or null if the code has no metadata
 * @param codeDivisionMeta division metadata, or null
 */
public record DivisionInfo(
    @JsonProperty("code_division") String codeDivision,
    @JsonProperty("code_division_meta") MetadataRecord codeDivisionMeta
) {
    /**
     * Division info for a code that could not be resolved.
     *
     * @return info with both fields null
     */
    public static DivisionInfo unresolved() {
        return new DivisionInfo(null, null);
    }
}
