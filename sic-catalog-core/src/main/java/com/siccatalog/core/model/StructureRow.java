package com.siccatalog.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of the structural source.
 *
 * @param description category title
 * @param section section letter
 * @param mostDisaggregatedLevel numeric code at its most detailed level (the section letter for sections)
 * @param levelHeadings level name, e.g. {@code "Sub Class"}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StructureRow(
    @JsonProperty("description") String description,
    @JsonProperty("section") String section,
    @JsonProperty("most_disaggregated_level") String mostDisaggregatedLevel,
    @JsonProperty("level_headings") String levelHeadings
) {}
