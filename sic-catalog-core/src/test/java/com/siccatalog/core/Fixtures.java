package com.siccatalog.core;

import com.siccatalog.core.meta.MetadataLoader;
import com.siccatalog.core.meta.MetadataStore;
import com.siccatalog.core.model.ActivityRow;
import com.siccatalog.core.model.DescriptionRow;
import com.siccatalog.core.model.RephraseRow;
import com.siccatalog.core.model.StructureRow;
import com.siccatalog.core.source.SourceReader;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Loads the sample sources under {@code src/test/resources/fixtures}.
 *
 * <p>The sample covers section A (divisions down to subclasses 01.62/1 and 01.62/9) and
 * section C (class 31.01): 15 codes in total.
 */
public final class Fixtures {

    public static final int NODE_COUNT = 15;

    private Fixtures() {
    }

    public static Path directory() {
        try {
            return Paths.get(Fixtures.class.getResource("/fixtures").toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    public static List<StructureRow> structure() {
        return csv("structure.csv", StructureRow.class);
    }

    public static List<ActivityRow> activities() {
        return csv("activities.csv", ActivityRow.class);
    }

    public static List<DescriptionRow> descriptions() {
        return csv("descriptions.csv", DescriptionRow.class);
    }

    public static List<RephraseRow> rephrases() {
        return csv("rephrased.csv", RephraseRow.class);
    }

    public static MetadataStore metadata() {
        try (InputStream in = open("metadata.json")) {
            return MetadataLoader.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static <T> List<T> csv(String name, Class<T> rowType) {
        try (Reader reader = new InputStreamReader(open(name), StandardCharsets.UTF_8)) {
            return SourceReader.read(reader, rowType);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static InputStream open(String name) {
        InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name);
        if (in == null) {
            throw new IllegalStateException("Missing fixture: " + name);
        }
        return in;
    }
}
