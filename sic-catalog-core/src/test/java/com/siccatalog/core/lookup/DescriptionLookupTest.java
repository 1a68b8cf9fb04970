package com.siccatalog.core.lookup;

import com.siccatalog.core.Fixtures;
import com.siccatalog.core.model.DescriptionRow;
import com.siccatalog.core.model.DivisionInfo;
import com.siccatalog.core.model.DivisionMeta;
import com.siccatalog.core.model.LookupResult;
import com.siccatalog.core.model.PotentialMatches;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DescriptionLookup}.
 */
class DescriptionLookupTest {

    private DescriptionLookup lookup;

    @BeforeEach
    void setUp() {
        lookup = new DescriptionLookup(Fixtures.descriptions(), Fixtures.metadata());
    }

    // ========== lookup Tests ==========

    @Test
    void lookup_fourDigitLabel_isZeroPaddedToFiveDigits() {
        LookupResult result = lookup.lookup("gamekeeper");

        assertThat(result.code()).isEqualTo("01700");
        assertThat(result.isFound()).isTrue();
    }

    @Test
    void lookup_exactMatchIgnoresCase_andDecoratesWithMetadata() {
        LookupResult result = lookup.lookup("GameKeeper");

        assertThat(result.description()).isEqualTo("gamekeeper");
        assertThat(result.codeDivision()).isEqualTo("01");
        assertThat(result.codeMeta().code()).isEqualTo("A0170x");
        assertThat(result.codeDivisionMeta().code()).isEqualTo("A01xxx");
        assertThat(result.potentialMatches()).isNull();
    }

    @Test
    void lookup_noMatch_returnsNullCodeAndMetadata() {
        LookupResult result = lookup.lookup("nonexistent description");

        assertThat(result.isFound()).isFalse();
        assertThat(result.code()).isNull();
        assertThat(result.codeMeta()).isNull();
        assertThat(result.codeDivision()).isNull();
        assertThat(result.codeDivisionMeta()).isNull();
    }

    @Test
    void lookup_matchWithoutMetadata_leavesMetadataNull() {
        DescriptionLookup sparse = new DescriptionLookup(
            List.of(new DescriptionRow("99999", "Mystery trade")), Fixtures.metadata());

        LookupResult result = sparse.lookup("mystery trade");

        assertThat(result.code()).isEqualTo("99999");
        assertThat(result.codeDivision()).isEqualTo("99");
        assertThat(result.codeMeta()).isNull();
        assertThat(result.codeDivisionMeta()).isNull();
    }

    @Test
    void lookup_duplicateDescription_lastRowWins() {
        DescriptionLookup duplicates = new DescriptionLookup(List.of(
            new DescriptionRow("1110", "Farmer"),
            new DescriptionRow("1120", "farmer")
        ), Fixtures.metadata());

        assertThat(duplicates.lookup("farmer").code()).isEqualTo("01120");
    }

    // ========== similarity Tests ==========

    @Test
    void lookup_similarity_collectsSubstringMatches() {
        LookupResult result = lookup.lookup("farm", true);
        PotentialMatches matches = result.potentialMatches();

        assertThat(result.code()).isNull();
        assertThat(matches.descriptionsCount()).isEqualTo(4);
        assertThat(matches.descriptions())
            .containsExactly("barley farmer", "cereal farmer", "rice farmer", "livestock farm boarding");
        assertThat(matches.codes()).containsExactly("01110", "01120", "01621");
        assertThat(matches.codesCount()).isEqualTo(3);
        assertThat(matches.divisionsCount()).isEqualTo(1);
        assertThat(matches.divisions()).extracting(DivisionMeta::code).containsExactly("01");
        assertThat(matches.divisions().get(0).meta().code()).isEqualTo("A01xxx");
    }

    @Test
    void lookup_similarity_onlyExactMatch_returnsEmptyMatches() {
        LookupResult result = lookup.lookup("Gamekeeper", true);

        assertThat(result.code()).isEqualTo("01700");
        assertThat(result.potentialMatches()).isEqualTo(PotentialMatches.none());
    }

    @Test
    void lookup_similarity_exactMatchAmongOthers_keepsAllMatches() {
        DescriptionLookup overlapping = new DescriptionLookup(List.of(
            new DescriptionRow("1110", "Farmer"),
            new DescriptionRow("1120", "Rice farmer")
        ), Fixtures.metadata());

        LookupResult result = overlapping.lookup("farmer", true);

        assertThat(result.code()).isEqualTo("01110");
        assertThat(result.potentialMatches().codes()).containsExactly("01110", "01120");
        assertThat(result.potentialMatches().descriptionsCount()).isEqualTo(2);
    }

    @Test
    void lookup_similarity_exactMatchOnlyInOwnCode_returnsEmptyMatches() {
        LookupResult result = lookup.lookup("barley farmer", true);

        assertThat(result.code()).isEqualTo("01110");
        assertThat(result.potentialMatches()).isEqualTo(PotentialMatches.none());
    }

    @Test
    void lookup_similarity_acrossDivisions_decoratesEachDivision() {
        LookupResult result = lookup.lookup("er", true);

        assertThat(result.potentialMatches().divisions())
            .extracting(DivisionMeta::code)
            .containsExactly("01", "31");
        assertThat(result.potentialMatches().divisions().get(1).meta().title()).isEqualTo("Manufacture of furniture");
    }

    @Test
    void lookup_similarity_noMatches_returnsEmptyMatches() {
        LookupResult result = lookup.lookup("astronaut", true);

        assertThat(result.potentialMatches().codes()).isEmpty();
        assertThat(result.potentialMatches().descriptionsCount()).isZero();
    }

    // ========== division Tests ==========

    @Test
    void lookupCodeDivision_codeWithMetadata_returnsDivisionAndMeta() {
        DivisionInfo info = lookup.lookupCodeDivision("01700");

        assertThat(info.codeDivision()).isEqualTo("01");
        assertThat(info.codeDivisionMeta().title())
            .isEqualTo("Crop and animal production, hunting and related service activities");
    }

    @Test
    void lookupCodeDivision_codeWithoutMetadata_returnsUnresolved() {
        assertThat(lookup.lookupCodeDivision("99999")).isEqualTo(DivisionInfo.unresolved());
        assertThat(lookup.lookupCodeDivision(null)).isEqualTo(DivisionInfo.unresolved());
    }

    @Test
    void uniqueCodeDivisions_keepsFirstSeenOrder() {
        List<DivisionInfo> divisions = lookup.uniqueCodeDivisions(List.of(
            new ClassificationCandidate("01700"),
            new ClassificationCandidate("01120"),
            new ClassificationCandidate("31010")
        ));

        assertThat(divisions).extracting(DivisionInfo::codeDivision).containsExactly("01", "31");
    }

    @Test
    void uniqueCodeDivisions_duplicatesAndUnknownCodes_areCollapsed() {
        List<DivisionInfo> divisions = lookup.uniqueCodeDivisions(List.of(
            new ClassificationCandidate("31010"),
            new ClassificationCandidate("99999"),
            new ClassificationCandidate("01110"),
            new ClassificationCandidate("31010")
        ));

        assertThat(divisions).extracting(DivisionInfo::codeDivision).containsExactly("31", "01");
    }

    @Test
    void uniqueCodeDivisions_emptyList_returnsEmpty() {
        assertThat(lookup.uniqueCodeDivisions(List.of())).isEmpty();
    }

    @Test
    void padLabel_shortLabels_areLeftPadded() {
        assertThat(DescriptionLookup.padLabel("1700")).isEqualTo("01700");
        assertThat(DescriptionLookup.padLabel("111")).isEqualTo("00111");
        assertThat(DescriptionLookup.padLabel(" 31010 ")).isEqualTo("31010");
    }
}
