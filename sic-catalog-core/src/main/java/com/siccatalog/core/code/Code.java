package com.siccatalog.core.code;

import com.siccatalog.core.exception.CodeFormatException;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A Standard Industrial Classification code.
 *
 * <p>The canonical representation is the <em>alpha code</em>: the section letter, followed by
 * the numeric code, right-padded with {@value #FILLER} to {@value #WIDTH} characters.
 *
 * <p><b>Examples:</b>
 * <pre>{@code
 * Code.parse("Axxxxx");                     // section A
 * Code.parse("A0111x");                     // class 01.11
 * Code.fromParts("A", "01110", "class");    // same class, 5-digit zero form
 * Code.fromParts("C", "10511", "subclass"); // subclass 10.51/1
 * }</pre>
 *
 * <p>Equality, hashing and ordering use the alpha code with filler stripped. Ordering is
 * plain lexicographic on that string, so a code sorts directly before its descendants:
 * {@code A < A01 < A011 < A0111 < A0112 < A012}.
 *
 * <p>Beyond format and level consistency this class does not check that a code is actually
 * defined in the classification.
 */
public final class Code implements Comparable<Code> {

    /** Fixed width of the canonical alpha code. */
    public static final int WIDTH = 6;

    /** Padding character used to extend short codes to {@link #WIDTH}. */
    public static final char FILLER = 'x';

    private static final Pattern ALPHA_CODE = Pattern.compile("[A-Z]\\d*x*");

    private final String alphaCode;
    private final String stripped;
    private final CodeLevel level;
    private final String formatted;

    private Code(String alphaCode) {
        validate(alphaCode);
        this.alphaCode = alphaCode;
        this.stripped = alphaCode.replace(String.valueOf(FILLER), "");
        this.level = levelOf(stripped);
        this.formatted = formatStripped(stripped);
    }

    /**
     * Parses a padded alpha code such as {@code "A0111x"}.
     *
     * @param alphaCode six-character alpha code
     * @return parsed code
     * @throws CodeFormatException if the code is malformed
     */
    public static Code parse(String alphaCode) {
        return new Code(alphaCode);
    }

    /**
     * Creates a code from the columns of a structural source row.
     *
     * <p>A class may be supplied in its five-digit form ({@code "01110"}); the trailing digit
     * must then be zero and is dropped. Level names are matched ignoring case and spaces.
     *
     * @param section section letter, e.g. {@code "A"}
     * @param code most disaggregated code, e.g. {@code "0111"}, or the section letter for sections
     * @param levelName level label, e.g. {@code "class"}
     * @return validated code
     * @throws CodeFormatException on a code/level or section/code mismatch
     */
    public static Code fromParts(String section, String code, String levelName) {
        Objects.requireNonNull(section, "section must not be null");
        Objects.requireNonNull(code, "code must not be null");

        CodeLevel level = CodeLevel.fromName(levelName)
            .orElseThrow(() -> new CodeFormatException("Unknown level name: '" + levelName + "'"));

        int length = code.length();
        if (length < CodeLevel.SUBCLASS.getDigitCount()) {
            CodeLevel implied = CodeLevel.fromDigitCount(length)
                .orElseThrow(() -> new CodeFormatException("Code/level mismatch: '" + code + "' -> '" + levelName + "'"));
            if (implied != level) {
                throw new CodeFormatException("Code/level mismatch: '" + code + "' -> '" + levelName + "'");
            }
        } else if (length == CodeLevel.SUBCLASS.getDigitCount()) {
            if (level != CodeLevel.CLASS && level != CodeLevel.SUBCLASS) {
                throw new CodeFormatException("Code/level mismatch: '" + code + "' -> '" + levelName + "'");
            }
        } else {
            throw new CodeFormatException("Code too long: '" + code + "'");
        }

        String alpha;
        switch (level) {
            case SECTION -> {
                if (!section.equals(code)) {
                    throw new CodeFormatException("Section/code mismatch: '" + section + "' - '" + code + "'");
                }
                alpha = section;
            }
            case CLASS -> {
                String digits = code;
                if (length == CodeLevel.SUBCLASS.getDigitCount()) {
                    if (code.charAt(4) != '0') {
                        throw new CodeFormatException("4-digit code as 5 digits must end in zero: '" + code + "'");
                    }
                    digits = code.substring(0, 4);
                }
                alpha = section + digits;
            }
            default -> alpha = section + code;
        }

        return new Code(pad(alpha));
    }

    /**
     * Right-pads a (possibly partial) alpha code with {@link #FILLER} to {@link #WIDTH}.
     *
     * @param alpha alpha code of at most {@link #WIDTH} characters
     * @return padded alpha code
     */
    static String pad(String alpha) {
        StringBuilder sb = new StringBuilder(alpha);
        while (sb.length() < WIDTH) {
            sb.append(FILLER);
        }
        return sb.toString();
    }

    private static void validate(String alphaCode) {
        if (alphaCode == null || alphaCode.isEmpty()) {
            throw new CodeFormatException("SIC code must be a non-empty string");
        }
        char first = alphaCode.charAt(0);
        if (first < 'A' || first > 'Z') {
            throw new CodeFormatException("Alpha SIC code must start with an upper case letter A-Z: '" + alphaCode + "'");
        }
        if (alphaCode.length() != WIDTH) {
            throw new CodeFormatException("Alpha SIC code must be padded to " + WIDTH + " characters: '" + alphaCode + "'");
        }
        if (!ALPHA_CODE.matcher(alphaCode).matches()) {
            throw new CodeFormatException("Alpha SIC code must be a letter, digits, then filler: '" + alphaCode + "'");
        }
    }

    private static CodeLevel levelOf(String stripped) {
        if (stripped.length() == 1) {
            return CodeLevel.SECTION;
        }
        int digits = stripped.length() - 1;
        return CodeLevel.fromDigitCount(digits)
            .filter(level -> level != CodeLevel.SECTION)
            .orElseThrow(() -> new CodeFormatException("Invalid SIC code: \"" + stripped + "\""));
    }

    private static String formatStripped(String stripped) {
        return switch (stripped.length()) {
            case 1 -> stripped;
            case 3 -> stripped.substring(1, 3);
            case 4, 5 -> stripped.substring(1, 3) + "." + stripped.substring(3);
            case 6 -> stripped.substring(1, 3) + "." + stripped.substring(3, 5) + "/" + stripped.charAt(5);
            default -> throw new CodeFormatException("Unable to format code: \"" + stripped + "\"");
        };
    }

    /**
     * Returns the code of the enclosing level, e.g. {@code A011xx} for {@code A0111x}.
     *
     * @return parent code, or {@code null} for a section
     */
    public Code parentCode() {
        return level.parent()
            .map(parent -> new Code(pad(stripped.substring(0, parent == CodeLevel.SECTION ? 1 : parent.getDigitCount() + 1))))
            .orElse(null);
    }

    /** Padded canonical form, e.g. {@code "A0111x"}. */
    public String getAlphaCode() {
        return alphaCode;
    }

    /** Canonical form with filler stripped, e.g. {@code "A0111"}. */
    public String getStripped() {
        return stripped;
    }

    /** Numeric digits only, e.g. {@code "0111"}; empty for a section. */
    public String getNumeric() {
        return stripped.substring(1);
    }

    public char getSection() {
        return alphaCode.charAt(0);
    }

    public CodeLevel getLevel() {
        return level;
    }

    public int getDigitCount() {
        return level.getDigitCount();
    }

    public String getLevelName() {
        return level.getLevelName();
    }

    /**
     * Human-readable form: {@code A}, {@code 01}, {@code 01.1}, {@code 01.11} or {@code 10.51/1}.
     *
     * @return formatted code
     */
    public String format() {
        return formatted;
    }

    @Override
    public int compareTo(Code other) {
        return stripped.compareTo(other.stripped);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Code other)) {
            return false;
        }
        return stripped.equals(other.stripped);
    }

    @Override
    public int hashCode() {
        return stripped.hashCode();
    }

    @Override
    public String toString() {
        return formatted;
    }
}
