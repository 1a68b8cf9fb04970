package com.siccatalog.core.code;

import com.siccatalog.core.exception.CodeFormatException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Code}.
 */
class CodeTest {

    // ========== parse Tests ==========

    @ParameterizedTest
    @ValueSource(strings = {"Axxxxx", "A01xxx", "A011xx", "A0111x", "C10511"})
    void parse_validAlphaCode_keepsCanonicalForm(String alphaCode) {
        assertThat(Code.parse(alphaCode).getAlphaCode()).isEqualTo(alphaCode);
    }

    @ParameterizedTest
    @CsvSource({
        "Axxxxx, 1, section",
        "A01xxx, 2, division",
        "A011xx, 3, group",
        "A0111x, 4, class",
        "A01621, 5, subclass"
    })
    void parse_derivesDigitCountAndLevel(String alphaCode, int digitCount, String levelName) {
        Code code = Code.parse(alphaCode);

        assertThat(code.getDigitCount()).isEqualTo(digitCount);
        assertThat(code.getLevelName()).isEqualTo(levelName);
    }

    @Test
    void parse_lowerCaseSection_throwsException() {
        assertThatThrownBy(() -> Code.parse("a0111x"))
            .isInstanceOf(CodeFormatException.class)
            .hasMessageContaining("upper case letter");
    }

    @Test
    void parse_numericFirstCharacter_throwsException() {
        assertThatThrownBy(() -> Code.parse("01110x"))
            .isInstanceOf(CodeFormatException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"A0111", "A0111xx", "A"})
    void parse_wrongWidth_throwsException(String alphaCode) {
        assertThatThrownBy(() -> Code.parse(alphaCode))
            .isInstanceOf(CodeFormatException.class)
            .hasMessageContaining("padded to 6");
    }

    @Test
    void parse_singleNumericDigit_throwsException() {
        assertThatThrownBy(() -> Code.parse("A1xxxx"))
            .isInstanceOf(CodeFormatException.class)
            .hasMessageContaining("Invalid SIC code");
    }

    @ParameterizedTest
    @ValueSource(strings = {"A01x1x", "A0a11x", "A-111x"})
    void parse_fillerOrLetterInsideDigits_throwsException(String alphaCode) {
        assertThatThrownBy(() -> Code.parse(alphaCode))
            .isInstanceOf(CodeFormatException.class);
    }

    @Test
    void parse_null_throwsException() {
        assertThatThrownBy(() -> Code.parse(null))
            .isInstanceOf(CodeFormatException.class);
    }

    // ========== fromParts Tests ==========

    @Test
    void fromParts_section_padsLetter() {
        Code code = Code.fromParts("A", "A", "SECTION");

        assertThat(code.getAlphaCode()).isEqualTo("Axxxxx");
        assertThat(code.getLevel()).isEqualTo(CodeLevel.SECTION);
    }

    @Test
    void fromParts_division_padsToWidth() {
        assertThat(Code.fromParts("A", "01", "Division").getAlphaCode()).isEqualTo("A01xxx");
    }

    @Test
    void fromParts_fourDigitClass_padsToWidth() {
        assertThat(Code.fromParts("A", "0111", "Class").getAlphaCode()).isEqualTo("A0111x");
    }

    @Test
    void fromParts_fiveDigitClassEndingInZero_dropsTrailingZero() {
        Code code = Code.fromParts("A", "01110", "class");

        assertThat(code.getAlphaCode()).isEqualTo("A0111x");
        assertThat(code.getLevel()).isEqualTo(CodeLevel.CLASS);
    }

    @Test
    void fromParts_fiveDigitClassNotEndingInZero_throwsException() {
        assertThatThrownBy(() -> Code.fromParts("A", "01111", "class"))
            .isInstanceOf(CodeFormatException.class)
            .hasMessageContaining("must end in zero");
    }

    @Test
    void fromParts_subclassLevelNameWithSpace_isAccepted() {
        Code code = Code.fromParts("A", "01621", "Sub Class");

        assertThat(code.getAlphaCode()).isEqualTo("A01621");
        assertThat(code.getLevel()).isEqualTo(CodeLevel.SUBCLASS);
    }

    @ParameterizedTest
    @CsvSource({
        "0111, group",
        "011, class",
        "01, group",
        "0111, subclass",
        "01621, group"
    })
    void fromParts_codeLevelMismatch_throwsException(String code, String level) {
        assertThatThrownBy(() -> Code.fromParts("A", code, level))
            .isInstanceOf(CodeFormatException.class)
            .hasMessageContaining("Code/level mismatch");
    }

    @Test
    void fromParts_sectionCodeMismatch_throwsException() {
        assertThatThrownBy(() -> Code.fromParts("A", "B", "section"))
            .isInstanceOf(CodeFormatException.class)
            .hasMessageContaining("Section/code mismatch");
    }

    @Test
    void fromParts_unknownLevel_throwsException() {
        assertThatThrownBy(() -> Code.fromParts("A", "01", "chapter"))
            .isInstanceOf(CodeFormatException.class)
            .hasMessageContaining("Unknown level name");
    }

    @Test
    void fromParts_tooLong_throwsException() {
        assertThatThrownBy(() -> Code.fromParts("A", "016210", "subclass"))
            .isInstanceOf(CodeFormatException.class);
    }

    // ========== format Tests ==========

    @ParameterizedTest
    @CsvSource({
        "Axxxxx, A",
        "A01xxx, 01",
        "A011xx, 01.1",
        "A0111x, 01.11",
        "A01621, 01.62/1"
    })
    void format_perLevel_returnsDottedForm(String alphaCode, String formatted) {
        Code code = Code.parse(alphaCode);

        assertThat(code.format()).isEqualTo(formatted);
        assertThat(code).hasToString(formatted);
    }

    @Test
    void accessors_classCode_exposeStrippedAndNumericForms() {
        Code code = Code.parse("A0111x");

        assertThat(code.getStripped()).isEqualTo("A0111");
        assertThat(code.getNumeric()).isEqualTo("0111");
        assertThat(code.getSection()).isEqualTo('A');
    }

    // ========== parentCode Tests ==========

    @ParameterizedTest
    @CsvSource({
        "A01xxx, Axxxxx",
        "A011xx, A01xxx",
        "A0111x, A011xx",
        "A01621, A0162x"
    })
    void parentCode_truncatesToEnclosingLevel(String child, String parent) {
        assertThat(Code.parse(child).parentCode()).isEqualTo(Code.parse(parent));
    }

    @Test
    void parentCode_section_returnsNull() {
        assertThat(Code.parse("Axxxxx").parentCode()).isNull();
    }

    // ========== equality and ordering Tests ==========

    @Test
    void equals_sameCodeFromDifferentConstructors_areEqual() {
        Code parsed = Code.parse("A0111x");
        Code built = Code.fromParts("A", "01110", "class");

        assertThat(parsed).isEqualTo(built);
        assertThat(parsed).hasSameHashCodeAs(built);
    }

    @Test
    void equals_differentCodes_areNotEqual() {
        assertThat(Code.parse("A0111x")).isNotEqualTo(Code.parse("A0112x"));
    }

    @Test
    void compareTo_sectionSortsBeforeItsDescendants() {
        List<Code> codes = new ArrayList<>(List.of(
            Code.parse("A0112x"),
            Code.parse("Cxxxxx"),
            Code.parse("A01621"),
            Code.parse("A01xxx"),
            Code.parse("A0162x"),
            Code.parse("Axxxxx"),
            Code.parse("A011xx")
        ));

        codes.sort(null);

        assertThat(codes).extracting(Code::getAlphaCode).containsExactly(
            "Axxxxx", "A01xxx", "A011xx", "A0112x", "A0162x", "A01621", "Cxxxxx"
        );
    }

    @Test
    void compareTo_siblingsOrderByFollowingDigit() {
        assertThat(Code.parse("A0111x")).isLessThan(Code.parse("A0112x"));
        assertThat(Code.parse("A0119x")).isLessThan(Code.parse("A012xx"));
    }
}
