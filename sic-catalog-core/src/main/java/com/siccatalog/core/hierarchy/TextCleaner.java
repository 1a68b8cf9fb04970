package com.siccatalog.core.hierarchy;

import com.siccatalog.core.model.MetadataRecord;
import org.jsoup.parser.Parser;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Cleans free text taken from the metadata source.
 *
 * <p>HTML entities are unescaped and editorial cross-references such as
 * {@code ", see division ##47.1"} or {@code "##01.11/2"} are removed.
 */
public final class TextCleaner {

    static final Pattern SEE_CODE = Pattern.compile(
        "(,?\\s?see\\s(divisions?\\s)?)?##\\d+(\\.\\d+(/\\d)?)?",
        Pattern.CASE_INSENSITIVE
    );

    private TextCleaner() {
        // Utility class
    }

    /**
     * Unescapes HTML entities and strips cross-reference annotations.
     *
     * @param text raw text, may be null
     * @return cleaned text, or null if the input was null
     */
    public static String clean(String text) {
        if (text == null) {
            return null;
        }
        String unescaped = Parser.unescapeEntities(text, false);
        return SEE_CODE.matcher(unescaped).replaceAll("");
    }

    /**
     * Returns a copy of a metadata record with detail, includes and excludes cleaned.
     *
     * @param meta metadata as read from the source
     * @return cleaned copy; code and title are unchanged
     */
    public static MetadataRecord clean(MetadataRecord meta) {
        List<String> includes = meta.includes().stream().map(TextCleaner::clean).toList();
        List<String> excludes = meta.excludes().stream().map(TextCleaner::clean).toList();
        return new MetadataRecord(meta.code(), meta.title(), clean(meta.detail()), includes, excludes);
    }
}
