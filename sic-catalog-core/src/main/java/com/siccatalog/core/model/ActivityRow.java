package com.siccatalog.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of the activity index: a free-text activity classified under a 5-digit code.
 *
 * @param code 5-digit numeric code, classes extended with a trailing zero
 * @param activity activity text
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ActivityRow(
    @JsonProperty("uk_sic_2007") String code,
    @JsonProperty("activity") String activity
) {}
