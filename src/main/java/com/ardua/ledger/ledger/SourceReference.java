package com.ardua.ledger.ledger;

import lombok.Value;

import java.util.Objects;

/**
 * Tagged pointer from a journal entry back to its originating document.
 * Resolving it is a lookup in the repository for {@link #getType()}.
 */
@Value
public class SourceReference {
    SourceType type;
    Long id;

    private SourceReference(SourceType type, Long id) {
        this.type = Objects.requireNonNull(type);
        this.id = Objects.requireNonNull(id);
    }

    public static SourceReference of(SourceType type, Long id) {
        return new SourceReference(type, id);
    }

    @Override
    public String toString() {
        return type + "#" + id;
    }
}
