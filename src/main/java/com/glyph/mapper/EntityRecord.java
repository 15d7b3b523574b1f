package com.glyph.mapper;

/**
 * A categorized entity recognized upstream.
 *
 * @param match      Source text the entity was recognized from
 * @param entityType Upstream entity type (e.g. {@code task_name})
 * @param value      Value the token is minted from
 */
public record EntityRecord(String match, String entityType, String value) {
}
