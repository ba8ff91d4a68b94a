package com.sports.sync.merge;

import java.util.Objects;

/**
 * A committed match between records of two different providers.
 *
 * @param left  the record of the provider whose tag sorts first
 * @param right the record of the other provider
 * @param stage name of the stage that committed the match
 * @param score similarity score of the match
 * @param pass  engine pass that produced the link (1 = pairwise, 2 = cross)
 */
public record IdentityLink(
        RecordRef left,
        RecordRef right,
        String stage,
        double score,
        int pass
) {
    public IdentityLink {
        Objects.requireNonNull(left, "left is required");
        Objects.requireNonNull(right, "right is required");
        if (left.provider() == right.provider()) {
            throw new IllegalArgumentException("A link must join records of two different providers");
        }
    }
}
