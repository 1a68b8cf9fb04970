package com.siccatalog.core.meta;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.siccatalog.core.model.MetadataRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads classification metadata from JSON.
 *
 * <p>The document is an object keyed by alpha code, in classification order:
 * <pre>{@code
 * {
 *   "Axxxxx": {"title": "Agriculture, forestry and fishing"},
 *   "A0111x": {
 *     "title": "Growing of cereals",
 *     "detail": "This class includes ...",
 *     "includes": ["growing of rice"],
 *     "excludes": ["growing of maize for fodder, see ##01.19"]
 *   }
 * }
 * }</pre>
 *
 * <p>Entry order is preserved. A {@code code} property inside an entry is ignored in favour of
 * the key.
 */
public final class MetadataLoader {

    private static final Logger log = LoggerFactory.getLogger(MetadataLoader.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Entry>> ENTRIES_TYPE = new TypeReference<>() {};

    private MetadataLoader() {
        // Utility class
    }

    /**
     * Loads metadata from a JSON file.
     *
     * @param path path to the metadata document
     * @return store holding every entry in file order
     * @throws IOException if the file cannot be read or parsed
     */
    public static MetadataStore load(Path path) throws IOException {
        log.debug("Loading metadata from: {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            MetadataStore store = load(in);
            log.info("Loaded {} metadata entries from: {}", store.size(), path);
            return store;
        }
    }

    /**
     * Loads metadata from a JSON stream. The stream is not closed.
     *
     * @param in JSON input
     * @return store holding every entry in document order
     * @throws IOException if the input cannot be parsed
     */
    public static MetadataStore load(InputStream in) throws IOException {
        Map<String, Entry> raw = JSON_MAPPER.readValue(in, ENTRIES_TYPE);
        List<MetadataRecord> entries = new ArrayList<>(raw.size());
        raw.forEach((code, entry) -> entries.add(
            new MetadataRecord(code, entry.title(), entry.detail(), entry.includes(), entry.excludes())
        ));
        return new InMemoryMetadataStore(entries);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record Entry(
        @JsonProperty("title") String title,
        @JsonProperty("detail") String detail,
        @JsonProperty("includes") List<String> includes,
        @JsonProperty("excludes") List<String> excludes
    ) {}
}
