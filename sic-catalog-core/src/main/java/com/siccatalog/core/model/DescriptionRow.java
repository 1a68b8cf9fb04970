package com.siccatalog.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of the description lookup source.
 *
 * @param label numeric code label; leading zeros may have been lost
 * @param description free-text description
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DescriptionRow(
    @JsonProperty("label") String label,
    @JsonProperty("description") String description
) {}
