package com.siccatalog.core.meta;

import com.siccatalog.core.model.MetadataRecord;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link MetadataStore} backed by an in-memory list.
 *
 * <p>Each record is reachable under its alpha code, its alpha code without filler and its
 * numeric digits. A 4-digit class is also reachable under its 5-digit zero form
 * ({@code "01110"}) unless another record already owns that key.
 */
public class InMemoryMetadataStore implements MetadataStore {

    private static final int CLASS_DIGITS = 4;

    private final List<MetadataRecord> entries;
    private final Map<String, MetadataRecord> byKey;

    public InMemoryMetadataStore(List<MetadataRecord> entries) {
        this.entries = List.copyOf(entries);
        this.byKey = new HashMap<>();

        for (MetadataRecord entry : this.entries) {
            String stripped = entry.code().replace("x", "");
            byKey.put(entry.code(), entry);
            byKey.put(stripped, entry);
            if (stripped.length() > 1) {
                byKey.put(stripped.substring(1), entry);
            }
        }
        for (MetadataRecord entry : this.entries) {
            String numeric = entry.code().substring(1).replace("x", "");
            if (numeric.length() == CLASS_DIGITS) {
                byKey.putIfAbsent(numeric + "0", entry);
            }
        }
    }

    @Override
    public List<MetadataRecord> entries() {
        return entries;
    }

    @Override
    public Optional<MetadataRecord> findByCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byKey.get(code.trim()));
    }
}
