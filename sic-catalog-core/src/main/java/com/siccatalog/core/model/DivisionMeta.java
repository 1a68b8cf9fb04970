package com.siccatalog.core.model;

/**
 * A 2-digit division decorated with its metadata.
 *
 * @param code division code, e.g. {@code "01"}
 * @param meta division metadata, or null if the metadata source has none
 */
public record DivisionMeta(String code, MetadataRecord meta) {}
