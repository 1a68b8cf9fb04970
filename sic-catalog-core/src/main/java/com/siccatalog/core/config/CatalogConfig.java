package com.siccatalog.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration for a SIC catalog.
 *
 * <p>Loaded from {@code siccatalog.yaml}. Relative paths are resolved against the directory
 * holding the configuration file.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * sources:
 *   structure: "data/sic_2007_structure.csv"
 *   activities: "data/sic_2007_index.csv"
 *   metadata: "data/sic_2007_meta.json"
 *   descriptions: "data/sic_lookup.csv"
 *   rephrases: "data/sic_rephrased.csv"
 * }</pre>
 *
 * @param sources locations of the source files
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogConfig(
    @JsonProperty("sources") SourcesConfig sources
) {
    public CatalogConfig {
        if (sources == null) {
            sources = SourcesConfig.defaults();
        }
    }

    /**
     * Creates a default configuration pointing at the {@code data/} directory.
     *
     * @return default configuration
     */
    public static CatalogConfig defaults() {
        return new CatalogConfig(SourcesConfig.defaults());
    }

    /**
     * Source file locations. Missing entries fall back to their defaults.
     *
     * @param structure structural CSV
     * @param activities activity index CSV
     * @param metadata metadata JSON
     * @param descriptions description lookup CSV
     * @param rephrases rephrase CSV
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SourcesConfig(
        @JsonProperty("structure") String structure,
        @JsonProperty("activities") String activities,
        @JsonProperty("metadata") String metadata,
        @JsonProperty("descriptions") String descriptions,
        @JsonProperty("rephrases") String rephrases
    ) {
        public SourcesConfig {
            if (structure == null) {
                structure = "data/sic_2007_structure.csv";
            }
            if (activities == null) {
                activities = "data/sic_2007_index.csv";
            }
            if (metadata == null) {
                metadata = "data/sic_2007_meta.json";
            }
            if (descriptions == null) {
                descriptions = "data/sic_lookup.csv";
            }
            if (rephrases == null) {
                rephrases = "data/sic_rephrased.csv";
            }
        }

        public static SourcesConfig defaults() {
            return new SourcesConfig(null, null, null, null, null);
        }
    }
}
