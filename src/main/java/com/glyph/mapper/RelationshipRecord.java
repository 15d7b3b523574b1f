package com.glyph.mapper;

import java.util.List;

/**
 * A typed relationship description as delivered by upstream recognition.
 * <p>
 * Participants by type: sequence {@code [source, target]}, parallel {@code [t1, t2, ...]},
 * conditional {@code [condition, trueBranch, falseBranch?]}, repetition {@code [token]}.
 * Each participant is either an entity's source text or a token value.
 *
 * @param type         Type tag (sequence, parallel, conditional, repetition)
 * @param participants Participants in role order
 * @param count        Repetition count, or {@code null} for the default of 1
 */
public record RelationshipRecord(String type, List<String> participants, Integer count) {

    public RelationshipRecord {
        participants = participants == null ? List.of() : List.copyOf(participants);
    }

    public RelationshipRecord(String type, List<String> participants) {
        this(type, participants, null);
    }
}
