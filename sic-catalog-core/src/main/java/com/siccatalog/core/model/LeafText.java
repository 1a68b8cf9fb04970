package com.siccatalog.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Row of the leaf text corpus.
 *
 * @param code formatted code, e.g. {@code "01.11"}
 * @param text description or activity text
 */
@JsonPropertyOrder({"code", "text"})
public record LeafText(String code, String text) {}
