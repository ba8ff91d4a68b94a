package com.sports.sync.strategy;

import com.sports.sync.core.model.MatchCandidate;
import com.sports.sync.core.model.Record;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * One ordered matching attempt of a {@link MatchingStrategy}.
 *
 * <p>Two kinds exist:</p>
 * <ul>
 *   <li><b>Exact-key</b> stages partition both pools by a {@link KeyExtractor} and pair
 *   records with equal keys. Every match scores 1.0.</li>
 *   <li><b>Scored</b> stages evaluate a {@link CandidateScorer} over the Cartesian product
 *   of both pools and commit candidates greedily by descending score.</li>
 * </ul>
 *
 * <p>Ties are broken by ascending left index, then ascending right index, where
 * indexes are positions in the record lists handed to the strategy. A record is
 * committed at most once per stage.</p>
 */
public final class MatchingStage {

    private static final Comparator<MatchCandidate> GREEDY_ORDER =
            Comparator.comparingDouble(MatchCandidate::score).reversed()
                    .thenComparingInt(MatchCandidate::leftIndex)
                    .thenComparingInt(MatchCandidate::rightIndex);

    private final String name;
    private final KeyExtractor keyExtractor;
    private final CandidateScorer scorer;

    private MatchingStage(String name, KeyExtractor keyExtractor, CandidateScorer scorer) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.keyExtractor = keyExtractor;
        this.scorer = scorer;
    }

    public static MatchingStage exactKey(String name, KeyExtractor keyExtractor) {
        return new MatchingStage(name, Objects.requireNonNull(keyExtractor, "keyExtractor is required"), null);
    }

    public static MatchingStage scored(String name, CandidateScorer scorer) {
        return new MatchingStage(name, null, Objects.requireNonNull(scorer, "scorer is required"));
    }

    public String getName() {
        return name;
    }

    public boolean isExact() {
        return keyExtractor != null;
    }

    /**
     * Runs this stage over the unmatched pools.
     *
     * @param left        all left records of the pair
     * @param leftPool    ascending indexes into {@code left} that are still unmatched
     * @param right       all right records of the pair
     * @param rightPool   ascending indexes into {@code right} that are still unmatched
     * @param stageNumber 1-based position of this stage in its strategy
     * @return the committed matches, in commit order
     */
    public List<MatchCandidate> run(List<Record> left, List<Integer> leftPool,
                                    List<Record> right, List<Integer> rightPool, int stageNumber) {
        if (leftPool.isEmpty() || rightPool.isEmpty()) {
            return List.of();
        }
        return isExact()
                ? runExact(left, leftPool, right, rightPool, stageNumber)
                : runScored(left, leftPool, right, rightPool, stageNumber);
    }

    private List<MatchCandidate> runExact(List<Record> left, List<Integer> leftPool,
                                          List<Record> right, List<Integer> rightPool, int stageNumber) {
        Map<String, List<Integer>> rightByKey = new LinkedHashMap<>();
        for (int index : rightPool) {
            String key = keyExtractor.key(right.get(index));
            if (key != null) {
                rightByKey.computeIfAbsent(key, k -> new ArrayList<>()).add(index);
            }
        }

        // Within one key, records pair up in index order; equal to greedy with all scores at 1.0
        Map<String, Integer> consumed = new LinkedHashMap<>();
        List<MatchCandidate> matches = new ArrayList<>();
        for (int leftIndex : leftPool) {
            String key = keyExtractor.key(left.get(leftIndex));
            if (key == null) {
                continue;
            }
            List<Integer> bucket = rightByKey.get(key);
            if (bucket == null) {
                continue;
            }
            int next = consumed.getOrDefault(key, 0);
            if (next < bucket.size()) {
                matches.add(new MatchCandidate(leftIndex, bucket.get(next), 1.0, stageNumber));
                consumed.put(key, next + 1);
            }
        }
        return matches;
    }

    private List<MatchCandidate> runScored(List<Record> left, List<Integer> leftPool,
                                           List<Record> right, List<Integer> rightPool, int stageNumber) {
        List<MatchCandidate> candidates = new ArrayList<>();
        for (int leftIndex : leftPool) {
            Record leftRecord = left.get(leftIndex);
            for (int rightIndex : rightPool) {
                OptionalDouble score = scorer.score(leftRecord, right.get(rightIndex));
                if (score.isPresent()) {
                    double clamped = Math.max(0.0, Math.min(1.0, score.getAsDouble()));
                    candidates.add(new MatchCandidate(leftIndex, rightIndex, clamped, stageNumber));
                }
            }
        }
        candidates.sort(GREEDY_ORDER);

        Set<Integer> usedLeft = new HashSet<>();
        Set<Integer> usedRight = new HashSet<>();
        List<MatchCandidate> matches = new ArrayList<>();
        for (MatchCandidate candidate : candidates) {
            if (usedLeft.contains(candidate.leftIndex()) || usedRight.contains(candidate.rightIndex())) {
                continue;
            }
            usedLeft.add(candidate.leftIndex());
            usedRight.add(candidate.rightIndex());
            matches.add(candidate);
        }
        return matches;
    }

    @Override
    public String toString() {
        return "MatchingStage{" +
                "name='" + name + '\'' +
                ", exact=" + isExact() +
                '}';
    }
}
