package com.sports.sync.api;

import com.sports.sync.core.SyncConfigurationException;
import com.sports.sync.core.model.EntityType;
import com.sports.sync.core.model.MatchCandidate;
import com.sports.sync.core.model.Record;
import com.sports.sync.core.model.ResultRow;
import com.sports.sync.core.model.ResultTable;
import com.sports.sync.core.model.SyncableContent;
import com.sports.sync.logging.LogContext;
import com.sports.sync.merge.IdentifierGraph;
import com.sports.sync.merge.IdentityLink;
import com.sports.sync.merge.RecordRef;
import com.sports.sync.merge.ResultDeduplicator;
import com.sports.sync.metrics.SyncMetrics;
import com.sports.sync.strategy.MatchingStage;
import com.sports.sync.strategy.MatchingStrategies;
import com.sports.sync.strategy.MatchingStrategy;
import com.sports.sync.strategy.StageListener;
import com.sports.sync.strategy.StrategyResult;
import com.sports.sync.tracing.SyncSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.stream.IntStream;

/**
 * Synchronizes the identifiers several providers use for the same matches, teams or players.
 *
 * <p>One call handles one group (a match, a competition season, a team's squad ...):</p>
 * <ol>
 *   <li>every pair of providers is run through the entity type's stage sequence and each
 *   committed match becomes a candidate {@link IdentityLink};</li>
 *   <li>candidates are unioned strongest first into clusters holding at most one
 *   identifier per provider;</li>
 *   <li>records left alone are pooled and every pair of providers is tried again;</li>
 *   <li>whatever is still alone becomes its own row;</li>
 *   <li>rows describing the same entity are collapsed by the deduplication columns.</li>
 * </ol>
 *
 * <p>Rows are ordered by their first provider's input order, then by the following
 * providers' input order. Engines are immutable and may be shared between threads;
 * every call allocates its own working state.</p>
 *
 * <pre>
 * SyncEngine engine = SyncEngine.forType(EntityType.TEAM, SyncOptions.defaults());
 * ResultTable teams = engine.synchronize(List.of(opta, statsbomb, wyscout));
 * </pre>
 */
public class SyncEngine {
    private static final Logger log = LoggerFactory.getLogger(SyncEngine.class);

    static final int PAIRWISE_PASS = 1;
    static final int CROSS_PASS = 2;

    private final EntityType entityType;
    private final SyncOptions options;
    private final MatchingStrategy strategy;
    private final ContentValidator validator;
    private final ResultDeduplicator deduplicator;
    private final List<String> carriedColumns;
    private final boolean partitioned;

    private SyncEngine(EntityType entityType, SyncOptions options) {
        this.entityType = Objects.requireNonNull(entityType, "entityType is required");
        this.options = Objects.requireNonNull(options, "options is required");
        this.strategy = MatchingStrategies.forType(entityType, options.getStrategySettings());
        this.partitioned = options.isUseCompetitionContext() && entityType.supportsCompetitionContext();
        this.validator = new ContentValidator(entityType, options.isUseCompetitionContext());
        this.deduplicator = new ResultDeduplicator(
                entityType.deduplicationColumns(options.isUseCompetitionContext()));

        List<String> columns = new ArrayList<>(entityType.deduplicationColumns(false));
        for (String column : entityType.getContextColumns()) {
            if (!columns.contains(column)) {
                columns.add(column);
            }
        }
        this.carriedColumns = List.copyOf(columns);
    }

    public static SyncEngine forType(EntityType entityType) {
        return forType(entityType, SyncOptions.defaults());
    }

    public static SyncEngine forType(EntityType entityType, SyncOptions options) {
        return new SyncEngine(entityType, options);
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public SyncOptions getOptions() {
        return options;
    }

    public MatchingStrategy getStrategy() {
        return strategy;
    }

    /**
     * Synchronizes one group of provider contents.
     *
     * @param contents one content per provider, all of this engine's entity type
     * @return one row per resolved entity, covering every input record
     * @throws SyncConfigurationException if the input is malformed
     */
    public ResultTable synchronize(List<SyncableContent> contents) {
        Objects.requireNonNull(contents, "contents is required");
        int totalRecords = contents.stream().filter(Objects::nonNull).mapToInt(SyncableContent::size).sum();
        SyncMetrics metrics = options.getMetrics();
        long start = System.nanoTime();

        try (LogContext logCtx = LogContext.forSynchronization(LogContext.generateCorrelationId(), entityType.name());
             SyncSpan span = options.getTracing().startSynchronization(entityType, contents.size(), totalRecords)) {
            try {
                validator.validate(contents);
                ResultTable table = run(contents, totalRecords);
                span.setAttribute("sync.rows", table.size());
                span.succeeded();
                return table;
            } catch (RuntimeException e) {
                span.failed(e);
                throw e;
            }
        } finally {
            metrics.recordSynchronizationDuration(entityType, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    /**
     * Synchronizes independent groups on the given executor. Results come back in group
     * order. The first failing group cancels the remaining work and its exception is rethrown.
     */
    public List<ResultTable> synchronizeAll(List<List<SyncableContent>> groups, ExecutorService executor) {
        Objects.requireNonNull(groups, "groups is required");
        Objects.requireNonNull(executor, "executor is required");

        List<Future<ResultTable>> futures = new ArrayList<>(groups.size());
        for (List<SyncableContent> group : groups) {
            futures.add(executor.submit(() -> synchronize(group)));
        }

        List<ResultTable> results = new ArrayList<>(futures.size());
        for (Future<ResultTable> future : futures) {
            try {
                results.add(future.get());
            } catch (InterruptedException e) {
                cancelAll(futures);
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for synchronization results", e);
            } catch (ExecutionException e) {
                cancelAll(futures);
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException runtimeException) {
                    throw runtimeException;
                }
                if (cause instanceof Error error) {
                    throw error;
                }
                throw new IllegalStateException("Synchronization failed", cause);
            }
        }
        return List.copyOf(results);
    }

    private static void cancelAll(List<Future<ResultTable>> futures) {
        for (Future<ResultTable> future : futures) {
            future.cancel(true);
        }
    }

    private ResultTable run(List<SyncableContent> contents, int totalRecords) {
        if (contents.isEmpty()) {
            trace("No {} content to synchronize", entityType);
            return ResultTable.empty(entityType);
        }
        List<String> providers = contents.stream().map(SyncableContent::getProvider).toList();
        options.getMetrics().recordGroupSize(entityType, totalRecords);
        trace("Synchronizing {} {} records from providers {}", totalRecords, entityType, providers);

        IdentifierGraph graph = new IdentifierGraph();
        for (int p = 0; p < contents.size(); p++) {
            for (int i = 0; i < contents.get(p).size(); i++) {
                graph.add(new RecordRef(p, i));
            }
        }

        if (contents.size() > 1) {
            trace("Pass {}: pairwise synchronization", PAIRWISE_PASS);
            runPass(contents, graph, PAIRWISE_PASS);

            trace("Pass {}: cross synchronization of unmatched records", CROSS_PASS);
            runPass(contents, graph, CROSS_PASS);
        }

        List<List<RecordRef>> clusters = graph.clusters();
        if (contents.size() > 1) {
            int residual = (int) clusters.stream().filter(cluster -> cluster.size() == 1).count();
            if (residual > 0) {
                options.getMetrics().incrementUnmatched(entityType, residual);
            }
            trace("Pass 3: {} records left without a counterpart", residual);
        }

        List<ResultRow> rows = new ArrayList<>(clusters.size());
        for (List<RecordRef> cluster : clusters) {
            rows.add(toRow(contents, cluster));
        }
        List<ResultRow> deduplicated = deduplicator.deduplicate(rows);

        trace("Synchronized {} {} records into {} rows ({} links accepted, {} rejected)",
                totalRecords, entityType, deduplicated.size(),
                graph.getAcceptedLinks().size(), graph.getRejectedLinks().size());
        return new ResultTable(entityType, providers, deduplicated);
    }

    /**
     * Runs every provider pair over the pass's pools, then unions the candidate links
     * strongest first: stage, then score, then the identifiers involved. Pools are fixed
     * when the pass starts, so neither the provider order nor the pair order changes
     * which link wins a conflict.
     */
    private void runPass(List<SyncableContent> contents, IdentifierGraph graph, int pass) {
        List<List<Integer>> pools = new ArrayList<>(contents.size());
        for (int p = 0; p < contents.size(); p++) {
            pools.add(pool(graph, p, contents.get(p), pass));
        }

        // Each pair is oriented by provider tag so a pair behaves the same in any input order
        List<Integer> byTag = IntStream.range(0, contents.size()).boxed()
                .sorted(Comparator.comparing((Integer p) -> contents.get(p).getProvider()))
                .toList();

        List<CandidateLink> candidates = new ArrayList<>();
        for (int i = 0; i < byTag.size(); i++) {
            for (int j = i + 1; j < byTag.size(); j++) {
                candidates.addAll(matchPair(contents, pools, byTag.get(i), byTag.get(j), pass));
            }
        }
        candidates.sort(CandidateLink.RANK);

        int accepted = 0;
        int rejected = 0;
        for (CandidateLink candidate : candidates) {
            IdentityLink link = candidate.link();
            if (graph.link(link)) {
                accepted++;
            } else {
                rejected++;
                options.getMetrics().incrementRejectedLinks(entityType);
                trace("Rejected {} link {}={} <-> {}={}: provider already linked in cluster",
                        link.stage(),
                        contents.get(link.left().provider()).idField(), candidate.leftId(),
                        contents.get(link.right().provider()).idField(), candidate.rightId());
            }
        }
        trace("Pass {}: {} links accepted, {} rejected", pass, accepted, rejected);
    }

    /**
     * Runs the strategy over one provider pair and returns its committed matches as
     * candidate links. In the pairwise pass every record takes part; in the cross pass
     * only records that were still alone in their cluster when the pass started do.
     */
    private List<CandidateLink> matchPair(List<SyncableContent> contents, List<List<Integer>> pools,
                                          int leftProvider, int rightProvider, int pass) {
        SyncableContent left = contents.get(leftProvider);
        SyncableContent right = contents.get(rightProvider);
        List<Integer> leftPool = pools.get(leftProvider);
        List<Integer> rightPool = pools.get(rightProvider);
        if (leftPool.isEmpty() || rightPool.isEmpty()) {
            return List.of();
        }

        try (LogContext pairCtx = LogContext.forPair(left.getProvider(), right.getProvider(), pass);
             SyncSpan span = options.getTracing().startPair(entityType, left.getProvider(), right.getProvider(), pass)) {
            try {
                List<CandidateLink> links = new ArrayList<>();
                StageListener listener = new PairTrace(left, right);

                for (Partition partition : partitions(left, leftPool, right, rightPool)) {
                    List<Record> leftRecords = partition.leftIndexes().stream()
                            .map(left.getRecords()::get).toList();
                    List<Record> rightRecords = partition.rightIndexes().stream()
                            .map(right.getRecords()::get).toList();
                    StrategyResult result = strategy.run(leftRecords, rightRecords, listener);

                    for (MatchCandidate candidate : result.matches()) {
                        IdentityLink link = new IdentityLink(
                                new RecordRef(leftProvider, partition.leftIndexes().get(candidate.leftIndex())),
                                new RecordRef(rightProvider, partition.rightIndexes().get(candidate.rightIndex())),
                                strategy.getStages().get(candidate.stage() - 1).getName(),
                                candidate.score(),
                                pass);
                        links.add(new CandidateLink(link, candidate.stage(),
                                left.getProvider(), left.identifierOf(leftRecords.get(candidate.leftIndex())),
                                right.getProvider(), right.identifierOf(rightRecords.get(candidate.rightIndex()))));
                    }
                }

                span.setAttribute("sync.candidates", links.size());
                span.succeeded();
                trace("{} <-> {} (pass {}): {} candidate links",
                        left.getProvider(), right.getProvider(), pass, links.size());
                return links;
            } catch (RuntimeException e) {
                span.failed(e);
                throw e;
            }
        }
    }

    /**
     * Splits both pools by competition context when partitioning is on. Only contexts
     * present on both sides produce a partition; missing context values form their own context.
     */
    private List<Partition> partitions(SyncableContent left, List<Integer> leftPool,
                                       SyncableContent right, List<Integer> rightPool) {
        if (!partitioned) {
            return List.of(new Partition(leftPool, rightPool));
        }
        Map<List<String>, List<Integer>> leftByContext = byContext(left, leftPool);
        Map<List<String>, List<Integer>> rightByContext = byContext(right, rightPool);

        List<Partition> partitions = new ArrayList<>();
        leftByContext.forEach((context, leftIndexes) -> {
            List<Integer> rightIndexes = rightByContext.get(context);
            if (rightIndexes != null) {
                partitions.add(new Partition(leftIndexes, rightIndexes));
            }
        });
        return partitions;
    }

    private Map<List<String>, List<Integer>> byContext(SyncableContent content, List<Integer> pool) {
        Map<List<String>, List<Integer>> groups = new LinkedHashMap<>();
        for (int index : pool) {
            Record record = content.getRecords().get(index);
            List<String> context = Arrays.asList(
                    record.keyValue(EntityType.COMPETITION_ID), record.keyValue(EntityType.SEASON_ID));
            groups.computeIfAbsent(context, k -> new ArrayList<>()).add(index);
        }
        return groups;
    }

    private ResultRow toRow(List<SyncableContent> contents, List<RecordRef> cluster) {
        Map<String, String> identifiers = new LinkedHashMap<>();
        for (SyncableContent content : contents) {
            identifiers.put(content.idField(), null);
        }
        Map<String, Object> columns = new LinkedHashMap<>();
        for (String column : carriedColumns) {
            columns.put(column, null);
        }

        // Members are in provider order, so the first provider with a value wins
        for (RecordRef ref : cluster) {
            SyncableContent content = contents.get(ref.provider());
            Record record = content.getRecords().get(ref.index());
            identifiers.put(content.idField(), content.identifierOf(record));
            for (String column : carriedColumns) {
                if (columns.get(column) == null && record.keyValue(column) != null) {
                    columns.put(column, record.get(column));
                }
            }
        }
        return new ResultRow(identifiers, columns);
    }

    private void trace(String format, Object... args) {
        if (options.isVerbose()) {
            log.info(format, args);
        } else {
            log.debug(format, args);
        }
    }

    private record Partition(List<Integer> leftIndexes, List<Integer> rightIndexes) {
    }

    /**
     * A committed pair match waiting to be unioned, with what it is ranked by.
     */
    private record CandidateLink(IdentityLink link, int stageNumber,
                                 String leftProvider, String leftId,
                                 String rightProvider, String rightId) {

        static final Comparator<CandidateLink> RANK = Comparator
                .comparingInt(CandidateLink::stageNumber)
                .thenComparing(Comparator.comparingDouble((CandidateLink c) -> c.link().score()).reversed())
                .thenComparing(CandidateLink::leftProvider)
                .thenComparing(CandidateLink::leftId)
                .thenComparing(CandidateLink::rightProvider)
                .thenComparing(CandidateLink::rightId)
                .thenComparingInt(c -> c.link().left().index())
                .thenComparingInt(c -> c.link().right().index());
    }

    /**
     * Reports committed matches of one provider pair to the metrics backend and the trace log.
     */
    private final class PairTrace implements StageListener {
        private final SyncableContent left;
        private final SyncableContent right;

        private PairTrace(SyncableContent left, SyncableContent right) {
            this.left = left;
            this.right = right;
        }

        @Override
        public void onMatch(MatchingStage stage, int stageNumber, Record leftRecord, Record rightRecord,
                            double score) {
            options.getMetrics().incrementStageMatches(entityType, stage.getName());
            options.getMetrics().recordSimilarityScore(entityType, score);
            trace("Stage {} ({}) matched {}={} with {}={}, score {}",
                    stageNumber, stage.getName(),
                    left.idField(), left.identifierOf(leftRecord),
                    right.idField(), right.identifierOf(rightRecord), score);
        }

        @Override
        public void onStageComplete(MatchingStage stage, int stageNumber, int matched,
                                    int remainingLeft, int remainingRight) {
            trace("Stage {} ({}) done: {} matched, {} {} and {} {} records remaining",
                    stageNumber, stage.getName(), matched,
                    remainingLeft, left.getProvider(), remainingRight, right.getProvider());
        }
    }

    @Override
    public String toString() {
        return "SyncEngine{" +
                "entityType=" + entityType +
                ", strategy=" + strategy +
                ", options=" + options +
                '}';
    }
}
