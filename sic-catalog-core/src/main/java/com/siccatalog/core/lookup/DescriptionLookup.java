package com.siccatalog.core.lookup;

import com.siccatalog.core.meta.MetadataStore;
import com.siccatalog.core.model.DescriptionRow;
import com.siccatalog.core.model.DivisionInfo;
import com.siccatalog.core.model.DivisionMeta;
import com.siccatalog.core.model.LookupResult;
import com.siccatalog.core.model.MetadataRecord;
import com.siccatalog.core.model.PotentialMatches;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Looks up 5-digit codes from free-text descriptions.
 *
 * <p>Descriptions are matched after lower-casing. Labels shorter than five digits (classes
 * whose leading zero was lost, e.g. {@code 1700}) are left-padded with zeros.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DescriptionLookup lookup = new DescriptionLookup(rows, metadata);
 * LookupResult exact = lookup.lookup("Gamekeeper");
 * LookupResult fuzzy = lookup.lookup("farm", true);
 * }</pre>
 */
public class DescriptionLookup {

    private static final Logger log = LoggerFactory.getLogger(DescriptionLookup.class);

    private static final int CODE_DIGITS = 5;
    private static final int DIVISION_DIGITS = 2;

    private final List<DescriptionRow> rows;
    private final Map<String, String> codeByDescription;
    private final MetadataStore metadataStore;

    public DescriptionLookup(List<DescriptionRow> source, MetadataStore metadataStore) {
        this.metadataStore = Objects.requireNonNull(metadataStore, "metadataStore must not be null");
        this.rows = source.stream()
            .map(row -> new DescriptionRow(padLabel(row.label()), row.description().toLowerCase(Locale.ROOT)))
            .toList();
        this.codeByDescription = new HashMap<>();
        for (DescriptionRow row : rows) {
            codeByDescription.put(row.description(), row.label());
        }
        log.debug("Loaded {} descriptions ({} distinct)", rows.size(), codeByDescription.size());
    }

    static String padLabel(String label) {
        String trimmed = label.strip();
        if (trimmed.length() >= CODE_DIGITS) {
            return trimmed;
        }
        return "0".repeat(CODE_DIGITS - trimmed.length()) + trimmed;
    }

    /**
     * Looks up a description by exact match.
     *
     * @param description description in any case
     * @return result; {@link LookupResult#code()} is null on a miss
     */
    public LookupResult lookup(String description) {
        return lookup(description, false);
    }

    /**
     * Looks up a description, optionally scanning for descriptions that contain it.
     *
     * <p>With similarity enabled, potential matches list every row whose description contains
     * the query. When the only matching code is the exact match itself, the potential matches
     * are empty.
     *
     * @param description description in any case
     * @param useSimilarity whether to run the substring scan
     * @return result; potential matches are null unless similarity was requested
     */
    public LookupResult lookup(String description, boolean useSimilarity) {
        String query = description.toLowerCase(Locale.ROOT);

        String code = codeByDescription.get(query);
        MetadataRecord codeMeta = null;
        MetadataRecord divisionMeta = null;
        String division = null;
        if (code != null) {
            division = division(code);
            codeMeta = metadataStore.findByCode(code).orElse(null);
            divisionMeta = metadataStore.findByCode(division).orElse(null);
        }

        PotentialMatches potentialMatches = useSimilarity ? findPotentialMatches(query, code) : null;
        return new LookupResult(query, code, codeMeta, division, divisionMeta, potentialMatches);
    }

    private PotentialMatches findPotentialMatches(String query, String exactCode) {
        List<DescriptionRow> matches = rows.stream()
            .filter(row -> row.description().contains(query))
            .toList();

        Set<String> codes = new LinkedHashSet<>();
        Set<String> descriptions = new LinkedHashSet<>();
        for (DescriptionRow row : matches) {
            codes.add(row.label());
            descriptions.add(row.description());
        }

        if (codes.size() == 1 && codes.contains(exactCode)) {
            return PotentialMatches.none();
        }

        Set<String> divisionCodes = new LinkedHashSet<>();
        codes.forEach(c -> divisionCodes.add(division(c)));
        List<DivisionMeta> divisions = divisionCodes.stream()
            .map(d -> new DivisionMeta(d, metadataStore.findByCode(d).orElse(null)))
            .toList();

        log.debug("Similarity scan for '{}': {} rows, {} codes, {} divisions",
            query, matches.size(), codes.size(), divisions.size());
        return new PotentialMatches(
            matches.size(),
            new ArrayList<>(descriptions),
            codes.size(),
            new ArrayList<>(codes),
            divisions.size(),
            divisions
        );
    }

    /**
     * Resolves the division of a code that has metadata.
     *
     * @param code 5-digit code
     * @return division and its metadata; both null when the code itself has no metadata
     */
    public DivisionInfo lookupCodeDivision(String code) {
        if (code == null || metadataStore.findByCode(code).isEmpty()) {
            return DivisionInfo.unresolved();
        }
        String division = division(code);
        return new DivisionInfo(division, metadataStore.findByCode(division).orElse(null));
    }

    /**
     * Collapses candidates to their distinct divisions, in first-seen order.
     *
     * <p>Candidates whose code has no metadata are skipped.
     *
     * @param candidates classifier candidates
     * @return one entry per distinct division
     */
    public List<DivisionInfo> uniqueCodeDivisions(List<ClassificationCandidate> candidates) {
        Map<String, DivisionInfo> unique = new LinkedHashMap<>();
        for (ClassificationCandidate candidate : candidates) {
            DivisionInfo info = lookupCodeDivision(candidate.getCode());
            if (info.codeDivision() != null) {
                unique.putIfAbsent(info.codeDivision(), info);
            }
        }
        return new ArrayList<>(unique.values());
    }

    private static String division(String code) {
        return code.length() <= DIVISION_DIGITS ? code : code.substring(0, DIVISION_DIGITS);
    }
}
