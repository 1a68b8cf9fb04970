package com.siccatalog.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of the rephrase source.
 *
 * @param code code as a string, e.g. {@code "01300"}
 * @param reviewedDescription curated alternative description
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RephraseRow(
    @JsonProperty("sic_code") String code,
    @JsonProperty("reviewed_description") String reviewedDescription
) {}
