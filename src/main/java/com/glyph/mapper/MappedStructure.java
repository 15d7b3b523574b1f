package com.glyph.mapper;

import com.glyph.relationship.Relationship;
import com.glyph.token.Token;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical {tokens, relationships} structure consumed by the tree builder.
 *
 * @param tokens        Source text to token, in the order the sources were mapped
 * @param relationships Relationships over token identifiers, in input order
 */
public record MappedStructure(Map<String, Token> tokens, List<Relationship> relationships) {

    public MappedStructure {
        tokens = tokens == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tokens));
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
    }

    public static MappedStructure of(List<Relationship> relationships) {
        return new MappedStructure(Map.of(), relationships);
    }

    /**
     * First token in mapping order.
     */
    public Optional<Token> firstToken() {
        return tokens.values().stream().findFirst();
    }
}
