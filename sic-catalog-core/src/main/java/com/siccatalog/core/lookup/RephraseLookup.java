package com.siccatalog.core.lookup;

import com.siccatalog.core.model.RephraseResult;
import com.siccatalog.core.model.RephraseRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps codes to curated, reviewed descriptions.
 *
 * <p>Missing codes are an expected outcome and are reported through
 * {@link RephraseResult#notFound(String)} rather than an exception.
 */
public class RephraseLookup {

    private static final Logger log = LoggerFactory.getLogger(RephraseLookup.class);

    private final Map<String, String> reviewedByCode;

    public RephraseLookup(List<RephraseRow> rows) {
        this.reviewedByCode = new HashMap<>();
        for (RephraseRow row : rows) {
            reviewedByCode.put(row.code(), row.reviewedDescription());
        }
        log.debug("Loaded {} rephrased descriptions", reviewedByCode.size());
    }

    /**
     * Retrieves the reviewed description for a code.
     *
     * @param code code as a string, e.g. {@code "01300"}
     * @return found result, or a result carrying {@link RephraseResult#NOT_FOUND}
     */
    public RephraseResult lookup(String code) {
        String reviewed = code == null ? null : reviewedByCode.get(code);
        if (reviewed == null) {
            return RephraseResult.notFound(code);
        }
        return RephraseResult.found(code, reviewed);
    }

    /**
     * Replaces the descriptions of a classifier response with their reviewed forms, in place.
     *
     * <p>The primary description is set to null when the primary code is null or has no
     * reviewed form. Candidates without a reviewed form keep their existing text.
     *
     * @param response response to update
     * @return the same response instance
     */
    public ClassificationResponse applyRephrase(ClassificationResponse response) {
        RephraseResult primary = response.getCode() == null ? null : lookup(response.getCode());
        response.setDescription(primary != null && primary.isFound() ? primary.reviewedDescription() : null);

        for (ClassificationCandidate candidate : response.getCandidates()) {
            RephraseResult rephrased = lookup(candidate.getCode());
            if (rephrased.isFound()) {
                candidate.setDescriptive(rephrased.reviewedDescription());
            }
        }
        return response;
    }
}
