package com.sports.sync.strategy;

import com.sports.sync.core.model.MatchCandidate;

import java.util.List;

/**
 * Outcome of running a strategy over one left/right pair: committed matches in
 * stage order and the indexes left unmatched on each side.
 */
public record StrategyResult(
        List<MatchCandidate> matches,
        List<Integer> unmatchedLeft,
        List<Integer> unmatchedRight
) {
    public StrategyResult {
        matches = List.copyOf(matches);
        unmatchedLeft = List.copyOf(unmatchedLeft);
        unmatchedRight = List.copyOf(unmatchedRight);
    }

    public boolean hasMatches() {
        return !matches.isEmpty();
    }
}
