package com.siccatalog.core.lookup;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifier response: a primary code with its description plus a list of candidates.
 *
 * <p>Serialized with the field names used by downstream consumers ({@code sic_code},
 * {@code sic_description}, {@code sic_candidates}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClassificationResponse {

    @JsonProperty("sic_code")
    private String code;

    @JsonProperty("sic_description")
    private String description;

    @JsonProperty("sic_candidates")
    private List<ClassificationCandidate> candidates = new ArrayList<>();

    public ClassificationResponse() {
    }

    public ClassificationResponse(String code, List<ClassificationCandidate> candidates) {
        this.code = code;
        this.candidates = candidates == null ? new ArrayList<>() : new ArrayList<>(candidates);
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public List<ClassificationCandidate> getCandidates() {
        return candidates;
    }

    public void setCandidates(List<ClassificationCandidate> candidates) {
        this.candidates = candidates == null ? new ArrayList<>() : candidates;
    }
}
