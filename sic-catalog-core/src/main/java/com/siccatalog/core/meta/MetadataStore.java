package com.siccatalog.core.meta;

import com.siccatalog.core.model.MetadataRecord;

import java.util.List;
import java.util.Optional;

/**
 * Read-only source of per-code metadata.
 *
 * <p>Passed explicitly to the hierarchy builder and to description lookups so tests can
 * substitute their own entries.
 */
public interface MetadataStore {

    /**
     * Returns all entries in source order.
     *
     * @return immutable list of entries
     */
    List<MetadataRecord> entries();

    /**
     * Returns the number of entries.
     *
     * @return entry count
     */
    default int size() {
        return entries().size();
    }

    /**
     * Finds metadata by alpha code ({@code "A0111x"}, {@code "A0111"}) or numeric code
     * ({@code "01"}, {@code "0111"}, {@code "01110"}).
     *
     * @param code code in any supported spelling
     * @return matching metadata, or empty if the code is unknown
     */
    Optional<MetadataRecord> findByCode(String code);
}
