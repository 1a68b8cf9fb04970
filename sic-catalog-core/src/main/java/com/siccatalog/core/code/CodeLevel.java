package com.siccatalog.core.code;

import java.util.Locale;
import java.util.Optional;

/**
 * Depth of a code in the classification hierarchy.
 *
 * <p>Each level is identified by its digit count: a section is counted as one digit
 * (the section letter alone), divisions carry two numeric digits, and so on down to
 * five-digit subclasses.
 */
public enum CodeLevel {
    SECTION(1, "section"),
    DIVISION(2, "division"),
    GROUP(3, "group"),
    CLASS(4, "class"),
    SUBCLASS(5, "subclass");

    private final int digitCount;
    private final String levelName;

    CodeLevel(int digitCount, String levelName) {
        this.digitCount = digitCount;
        this.levelName = levelName;
    }

    public int getDigitCount() {
        return digitCount;
    }

    public String getLevelName() {
        return levelName;
    }

    /**
     * Returns the level one step closer to the section, if any.
     *
     * @return parent level, empty for {@link #SECTION}
     */
    public Optional<CodeLevel> parent() {
        return this == SECTION ? Optional.empty() : Optional.of(values()[ordinal() - 1]);
    }

    /**
     * Resolves a level by digit count.
     *
     * @param digitCount digit count between 1 and 5
     * @return matching level, or empty if the count has no level
     */
    public static Optional<CodeLevel> fromDigitCount(int digitCount) {
        for (CodeLevel level : values()) {
            if (level.digitCount == digitCount) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a level by its human label.
     *
     * <p>Matching ignores case and whitespace, so {@code " Sub Class "} resolves to
     * {@link #SUBCLASS}.
     *
     * @param levelName level label such as {@code "class"}
     * @return matching level, or empty if unknown
     */
    public static Optional<CodeLevel> fromName(String levelName) {
        if (levelName == null) {
            return Optional.empty();
        }
        String normalized = levelName.toLowerCase(Locale.ROOT).replaceAll("\\s", "");
        for (CodeLevel level : values()) {
            if (level.levelName.equals(normalized)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
