package com.siccatalog.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Substring matches found by a similarity lookup.
 *
 * @param descriptionsCount number of matching rows
 * @param descriptions distinct matching descriptions
 * @param codesCount number of distinct matching codes
 * @param codes distinct matching codes
 * @param divisionsCount number of distinct divisions
 * @param divisions distinct divisions of the matching codes
 */
public record PotentialMatches(
    @JsonProperty("descriptions_count") int descriptionsCount,
    @JsonProperty("descriptions") List<String> descriptions,
    @JsonProperty("codes_count") int codesCount,
    @JsonProperty("codes") List<String> codes,
    @JsonProperty("divisions_count") int divisionsCount,
    @JsonProperty("divisions") List<DivisionMeta> divisions
) {
    public PotentialMatches {
        descriptions = descriptions == null ? List.of() : List.copyOf(descriptions);
        codes = codes == null ? List.of() : List.copyOf(codes);
        divisions = divisions == null ? List.of() : List.copyOf(divisions);
    }

    /**
     * Result of a similarity scan that found nothing beyond the exact match.
     *
     * @return empty matches
     */
    public static PotentialMatches none() {
        return new PotentialMatches(0, List.of(), 0, List.of(), 0, List.of());
    }
}
