package com.sports.sync.strategy;

import com.sports.sync.core.model.Record;

import java.util.OptionalDouble;

/**
 * Scores a left/right record pair for one matching stage.
 * An empty result means the stage predicate does not hold and the pair is not a candidate.
 */
@FunctionalInterface
public interface CandidateScorer {

    OptionalDouble score(Record left, Record right);
}
