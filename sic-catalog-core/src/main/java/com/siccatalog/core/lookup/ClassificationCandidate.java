package com.siccatalog.core.lookup;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Candidate code proposed by a classifier, as carried in a {@link ClassificationResponse}.
 *
 * <p>Mutable so that {@link RephraseLookup#applyRephrase(ClassificationResponse)} can replace
 * the descriptive text in place.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClassificationCandidate {

    @JsonProperty("sic_code")
    private String code;

    @JsonProperty("sic_descriptive")
    private String descriptive;

    @JsonProperty("likelihood")
    private Double likelihood;

    public ClassificationCandidate() {
    }

    public ClassificationCandidate(String code) {
        this.code = code;
    }

    public ClassificationCandidate(String code, String descriptive, Double likelihood) {
        this.code = code;
        this.descriptive = descriptive;
        this.likelihood = likelihood;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getDescriptive() {
        return descriptive;
    }

    public void setDescriptive(String descriptive) {
        this.descriptive = descriptive;
    }

    public Double getLikelihood() {
        return likelihood;
    }

    public void setLikelihood(Double likelihood) {
        this.likelihood = likelihood;
    }
}
