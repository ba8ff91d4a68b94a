package com.sports.sync.strategy;

import com.sports.sync.core.model.EntityType;
import com.sports.sync.core.model.MatchCandidate;
import com.sports.sync.core.model.Record;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Ordered sequence of {@link MatchingStage}s for one entity type.
 * Each stage only sees the records no earlier stage committed, and a committed
 * match is never revisited within the same run.
 */
public final class MatchingStrategy {

    private final EntityType entityType;
    private final List<MatchingStage> stages;

    public MatchingStrategy(EntityType entityType, List<MatchingStage> stages) {
        this.entityType = Objects.requireNonNull(entityType, "entityType is required");
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("A strategy needs at least one stage");
        }
        this.stages = List.copyOf(stages);
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public List<MatchingStage> getStages() {
        return stages;
    }

    public StrategyResult run(List<Record> left, List<Record> right) {
        return run(left, right, StageListener.NONE);
    }

    /**
     * Runs every stage in order over the two record lists.
     */
    public StrategyResult run(List<Record> left, List<Record> right, StageListener listener) {
        List<Integer> leftPool = new ArrayList<>(IntStream.range(0, left.size()).boxed().toList());
        List<Integer> rightPool = new ArrayList<>(IntStream.range(0, right.size()).boxed().toList());
        List<MatchCandidate> matches = new ArrayList<>();

        for (int i = 0; i < stages.size(); i++) {
            if (leftPool.isEmpty() || rightPool.isEmpty()) {
                break;
            }
            MatchingStage stage = stages.get(i);
            int stageNumber = i + 1;
            List<MatchCandidate> committed = stage.run(left, leftPool, right, rightPool, stageNumber);

            Set<Integer> matchedLeft = new HashSet<>();
            Set<Integer> matchedRight = new HashSet<>();
            for (MatchCandidate candidate : committed) {
                matchedLeft.add(candidate.leftIndex());
                matchedRight.add(candidate.rightIndex());
                listener.onMatch(stage, stageNumber, left.get(candidate.leftIndex()),
                        right.get(candidate.rightIndex()), candidate.score());
            }
            leftPool.removeIf(matchedLeft::contains);
            rightPool.removeIf(matchedRight::contains);
            matches.addAll(committed);
            listener.onStageComplete(stage, stageNumber, committed.size(), leftPool.size(), rightPool.size());
        }
        return new StrategyResult(matches, leftPool, rightPool);
    }

    @Override
    public String toString() {
        return "MatchingStrategy{" +
                "entityType=" + entityType +
                ", stages=" + stages.stream().map(MatchingStage::getName).toList() +
                '}';
    }
}
