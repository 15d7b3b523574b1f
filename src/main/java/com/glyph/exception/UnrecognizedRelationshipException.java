package com.glyph.exception;

/**
 * Exception thrown when a relationship record carries a type tag
 * that maps to no known relationship kind.
 */
public class UnrecognizedRelationshipException extends GlyphException {

    private final String typeTag;

    public UnrecognizedRelationshipException(String typeTag) {
        super("Unrecognized relationship kind: '" + typeTag + "'");
        this.typeTag = typeTag;
    }

    public String getTypeTag() {
        return typeTag;
    }
}
