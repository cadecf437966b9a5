package com.papertrail.core.resolution;

import com.papertrail.core.config.ResolutionOptions;
import com.papertrail.core.metrics.MetricsService;
import com.papertrail.core.metrics.NoOpMetricsService;
import com.papertrail.core.model.CanonicalEntity;
import com.papertrail.core.model.DataQualityWarning;
import com.papertrail.core.model.EntityKind;
import com.papertrail.core.model.MatchDecision;
import com.papertrail.core.model.MergeDecision;
import com.papertrail.core.model.RawRecord;
import com.papertrail.core.model.RecordPair;
import com.papertrail.core.review.InMemoryReviewQueue;
import com.papertrail.core.review.ReviewItem;
import com.papertrail.core.review.ReviewQueue;
import com.papertrail.core.rules.Canonicalizer;
import com.papertrail.core.similarity.BlockingKeyStrategy;
import com.papertrail.core.similarity.DefaultBlockingKeyStrategy;
import com.papertrail.core.similarity.JaroWinklerSimilarity;
import com.papertrail.core.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Clusters raw records into canonical entities.
 *
 * <p>Records are compared only within their own kind and only when they share
 * a blocking key. Each candidate pair is scored once and classified against the
 * auto-merge and review thresholds. Auto-merges are applied through a
 * {@link DisjointSet}, so clustering is transitive and independent of the order
 * of decisions. Review-band pairs go to the {@link ReviewQueue} and do not affect
 * clustering until a reviewer confirms them; confirmed pairs merge on the next
 * pass and rejected pairs never merge directly.</p>
 *
 * <p>Blocks are scored in parallel. Each pair is claimed by the smallest blocking
 * key both records share, so blocks never score the same pair twice.</p>
 */
public class EntityResolver {
    private static final Logger log = LoggerFactory.getLogger(EntityResolver.class);

    private static final String STAGE = "RESOLVE";

    private final Canonicalizer canonicalizer;
    private final SimilarityAlgorithm similarity;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final ReviewQueue reviewQueue;
    private final ResolutionOptions options;
    private final MetricsService metrics;

    private EntityResolver(Builder builder) {
        this.options = builder.options != null ? builder.options : ResolutionOptions.defaults();
        this.canonicalizer = builder.canonicalizer != null ? builder.canonicalizer : new Canonicalizer();
        this.similarity = builder.similarity != null ? builder.similarity : new JaroWinklerSimilarity();
        this.blockingKeyStrategy = builder.blockingKeyStrategy != null ? builder.blockingKeyStrategy
                : new DefaultBlockingKeyStrategy(this.options.getRegistrationPrefixLength());
        this.reviewQueue = builder.reviewQueue != null ? builder.reviewQueue : new InMemoryReviewQueue();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMetricsService();
    }

    public ReviewQueue getReviewQueue() {
        return reviewQueue;
    }

    public ResolutionOptions getOptions() {
        return options;
    }

    /**
     * Resolves one batch of records.
     */
    public ResolutionResult resolve(List<RawRecord> records) {
        Objects.requireNonNull(records, "records is required");
        List<DataQualityWarning> warnings = new ArrayList<>();
        Map<EntityKind, List<Prepared>> byKind = new EnumMap<>(EntityKind.class);
        Set<String> seen = new HashSet<>();

        for (RawRecord record : records) {
            if (!seen.add(record.getId())) {
                warn(warnings, new DataQualityWarning(record.getId(), "id", "duplicate record id in batch"));
                continue;
            }
            if (!record.hasName()) {
                warn(warnings, new DataQualityWarning(record.getId(), "name", "missing name"));
                continue;
            }
            String canonical = canonicalizer.canonicalize(record.getName(), record.getKind());
            if (canonical.isEmpty()) {
                // unmatchable by name; still resolves, as a singleton unless its registration matches
                warn(warnings, new DataQualityWarning(record.getId(), "name",
                        "name has no comparable characters: '" + record.getName() + "'"));
            }
            String registration = DefaultBlockingKeyStrategy.normalizeRegistration(record.getRegistrationNumber());
            byKind.computeIfAbsent(record.getKind(), k -> new ArrayList<>())
                    .add(new Prepared(record, canonical, registration));
        }

        Set<RecordPair> confirmed = reviewQueue.confirmedPairs();
        Set<RecordPair> rejected = reviewQueue.rejectedPairs();

        List<CanonicalEntity> entities = new ArrayList<>();
        List<MergeDecision> decisions = new ArrayList<>();
        List<ReviewItem> newReviews = new ArrayList<>();
        Map<String, String> recordToEntity = new HashMap<>();

        ExecutorService executor = options.getParallelism() > 1
                ? Executors.newFixedThreadPool(options.getParallelism())
                : null;
        try {
            for (Map.Entry<EntityKind, List<Prepared>> entry : byKind.entrySet()) {
                resolveKind(entry.getKey(), entry.getValue(), confirmed, rejected, executor,
                        entities, decisions, newReviews, recordToEntity);
            }
        } finally {
            if (executor != null) {
                executor.shutdown();
            }
        }

        entities.sort(Comparator.comparing(CanonicalEntity::getId));
        log.info("resolve.completed records={} entities={} decisions={} newReviews={} warnings={}",
                records.size(), entities.size(), decisions.size(), newReviews.size(), warnings.size());
        return new ResolutionResult(entities, decisions, newReviews, warnings, recordToEntity);
    }

    /**
     * Compares two already-resolved entities by their closest alias pair.
     */
    public MergeDecision compare(CanonicalEntity a, CanonicalEntity b) {
        if (a.getKind() != b.getKind()) {
            throw new IllegalArgumentException("Cannot compare " + a.getKind() + " with " + b.getKind());
        }
        double best = 0.0;
        for (String left : a.getAliases()) {
            String ca = canonicalizer.canonicalize(left, a.getKind());
            for (String right : b.getAliases()) {
                best = Math.max(best, similarity.compute(ca, canonicalizer.canonicalize(right, b.getKind())));
            }
        }
        return MergeDecision.of(RecordPair.of(a.getId(), b.getId()), a.getKind(), best,
                options.getAutoMergeThreshold(), options.getReviewThreshold());
    }

    private void resolveKind(EntityKind kind, List<Prepared> records,
                             Set<RecordPair> confirmed, Set<RecordPair> rejected,
                             ExecutorService executor,
                             List<CanonicalEntity> entities, List<MergeDecision> decisions,
                             List<ReviewItem> newReviews, Map<String, String> recordToEntity) {
        int n = records.size();
        List<SortedSet<String>> keys = new ArrayList<>(n);
        Map<String, Integer> indexById = new HashMap<>();
        TreeMap<String, List<Integer>> blocks = new TreeMap<>();
        for (int i = 0; i < n; i++) {
            Prepared p = records.get(i);
            indexById.put(p.record().getId(), i);
            SortedSet<String> recordKeys = new TreeSet<>(
                    blockingKeyStrategy.generateKeys(p.canonical(), p.registration()));
            keys.add(recordKeys);
            for (String key : recordKeys) {
                blocks.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
            }
        }

        List<MergeDecision> kindDecisions = scoreBlocks(kind, records, keys, blocks, confirmed, rejected, executor);

        // Confirmed pairs whose names never shared a block.
        Set<RecordPair> decided = new HashSet<>();
        kindDecisions.forEach(d -> decided.add(d.pair()));
        confirmed.stream().sorted().forEach(pair -> {
            Integer a = indexById.get(pair.first());
            Integer b = indexById.get(pair.second());
            if (a != null && b != null && !decided.contains(pair)) {
                kindDecisions.add(decide(kind, records.get(a), records.get(b), confirmed, rejected));
            }
        });
        kindDecisions.sort(Comparator.comparing(MergeDecision::pair));

        DisjointSet clusters = new DisjointSet(n);
        for (MergeDecision decision : kindDecisions) {
            metrics.recordSimilarityScore(decision.score());
            metrics.recordMatchDecision(kind, decision.decision());
            if (decision.shouldMerge()) {
                clusters.union(indexById.get(decision.pair().first()), indexById.get(decision.pair().second()));
            } else if (decision.requiresReview()) {
                queueForReview(kind, decision, records.get(indexById.get(decision.pair().first())),
                        records.get(indexById.get(decision.pair().second())), newReviews);
            }
        }
        decisions.addAll(kindDecisions);

        Map<Integer, List<Prepared>> members = new TreeMap<>();
        for (int i = 0; i < n; i++) {
            members.computeIfAbsent(clusters.find(i), k -> new ArrayList<>()).add(records.get(i));
        }
        int produced = 0;
        for (List<Prepared> cluster : members.values()) {
            CanonicalEntity entity = buildEntity(kind, cluster);
            for (Prepared p : cluster) {
                recordToEntity.put(p.record().getId(), entity.getId());
            }
            entities.add(entity);
            produced++;
        }
        metrics.recordEntitiesResolved(kind, produced);
        log.debug("resolve.kind kind={} records={} blocks={} pairs={} entities={}",
                kind, n, blocks.size(), kindDecisions.size(), produced);
    }

    private List<MergeDecision> scoreBlocks(EntityKind kind, List<Prepared> records,
                                            List<SortedSet<String>> keys, TreeMap<String, List<Integer>> blocks,
                                            Set<RecordPair> confirmed, Set<RecordPair> rejected,
                                            ExecutorService executor) {
        List<MergeDecision> all = new ArrayList<>();
        if (executor == null) {
            blocks.forEach((key, idx) -> all.addAll(scoreBlock(kind, key, idx, records, keys, confirmed, rejected)));
            return all;
        }
        List<CompletableFuture<List<MergeDecision>>> futures = new ArrayList<>();
        blocks.forEach((key, idx) -> {
            if (idx.size() > 1) {
                futures.add(CompletableFuture.supplyAsync(
                        () -> scoreBlock(kind, key, idx, records, keys, confirmed, rejected), executor));
            }
        });
        try {
            for (CompletableFuture<List<MergeDecision>> future : futures) {
                all.addAll(future.join());
            }
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
        return all;
    }

    private List<MergeDecision> scoreBlock(EntityKind kind, String key, List<Integer> members,
                                           List<Prepared> records, List<SortedSet<String>> keys,
                                           Set<RecordPair> confirmed, Set<RecordPair> rejected) {
        List<MergeDecision> out = new ArrayList<>();
        for (int x = 0; x < members.size(); x++) {
            for (int y = x + 1; y < members.size(); y++) {
                int a = members.get(x);
                int b = members.get(y);
                if (!key.equals(smallestSharedKey(keys.get(a), keys.get(b)))) {
                    continue;
                }
                out.add(decide(kind, records.get(a), records.get(b), confirmed, rejected));
            }
        }
        return out;
    }

    private MergeDecision decide(EntityKind kind, Prepared a, Prepared b,
                                 Set<RecordPair> confirmed, Set<RecordPair> rejected) {
        RecordPair pair = RecordPair.of(a.record().getId(), b.record().getId());
        double score = similarity.compute(a.canonical(), b.canonical());
        if (rejected.contains(pair)) {
            return new MergeDecision(pair, kind, score, MatchDecision.DISTINCT, "rejected by reviewer");
        }
        if (confirmed.contains(pair)) {
            return new MergeDecision(pair, kind, score, MatchDecision.AUTO_MERGE, "confirmed by reviewer");
        }
        if (options.isRegistrationMatchMerges() && !a.registration().isEmpty()
                && a.registration().equals(b.registration())) {
            return new MergeDecision(pair, kind, score, MatchDecision.AUTO_MERGE, "registration-number match");
        }
        MergeDecision decision = MergeDecision.of(pair, kind, score,
                options.getAutoMergeThreshold(), options.getReviewThreshold());
        log.debug("resolve.pair pair={} score={} decision={}", pair, score, decision.decision());
        return decision;
    }

    private void queueForReview(EntityKind kind, MergeDecision decision, Prepared first, Prepared second,
                                List<ReviewItem> newReviews) {
        if (reviewQueue.findByPair(decision.pair()).isPresent()) {
            return;
        }
        ReviewItem item = reviewQueue.submit(ReviewItem.builder()
                .pair(decision.pair())
                .kind(kind)
                .names(first.record().getName(), second.record().getName())
                .similarityScore(decision.score())
                .build());
        newReviews.add(item);
    }

    private CanonicalEntity buildEntity(EntityKind kind, List<Prepared> cluster) {
        List<String> ids = new ArrayList<>();
        Map<String, Integer> spellings = new HashMap<>();
        for (Prepared p : cluster) {
            ids.add(p.record().getId());
            spellings.merge(p.record().getName().trim(), 1, Integer::sum);
        }
        ids.sort(Comparator.naturalOrder());
        Comparator<Map.Entry<String, Integer>> preference = Map.Entry.<String, Integer>comparingByValue().reversed()
                .thenComparing(Comparator.comparingInt((Map.Entry<String, Integer> e) -> e.getKey().length()).reversed())
                .thenComparing(Map.Entry.<String, Integer>comparingByKey());
        String displayName = spellings.entrySet().stream()
                .sorted(preference)
                .map(Map.Entry::getKey)
                .findFirst()
                .orElseThrow();

        CanonicalEntity entity = new CanonicalEntity(entityId(kind, ids), kind, displayName);
        for (Prepared p : cluster) {
            entity.addSource(p.record());
        }
        return entity;
    }

    /**
     * Id derived from the sorted member record ids, stable while membership is unchanged.
     */
    static String entityId(EntityKind kind, List<String> sortedMemberIds) {
        String joined = String.join("\n", sortedMemberIds);
        return kind.getIdPrefix() + "-" + UUID.nameUUIDFromBytes(joined.getBytes(StandardCharsets.UTF_8));
    }

    private static String smallestSharedKey(SortedSet<String> a, SortedSet<String> b) {
        for (String key : a) {
            if (b.contains(key)) {
                return key;
            }
        }
        return null;
    }

    private void warn(List<DataQualityWarning> warnings, DataQualityWarning warning) {
        warnings.add(warning);
        metrics.recordDataQualityWarning(STAGE);
        log.warn("resolve.data_quality record={} field={} reason={}", warning.recordId(), warning.field(), warning.reason());
    }

    private record Prepared(RawRecord record, String canonical, String registration) {
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Canonicalizer canonicalizer;
        private SimilarityAlgorithm similarity;
        private BlockingKeyStrategy blockingKeyStrategy;
        private ReviewQueue reviewQueue;
        private ResolutionOptions options;
        private MetricsService metrics;

        public Builder canonicalizer(Canonicalizer canonicalizer) {
            this.canonicalizer = canonicalizer;
            return this;
        }

        public Builder similarity(SimilarityAlgorithm similarity) {
            this.similarity = similarity;
            return this;
        }

        public Builder blockingKeyStrategy(BlockingKeyStrategy blockingKeyStrategy) {
            this.blockingKeyStrategy = blockingKeyStrategy;
            return this;
        }

        public Builder reviewQueue(ReviewQueue reviewQueue) {
            this.reviewQueue = reviewQueue;
            return this;
        }

        public Builder options(ResolutionOptions options) {
            this.options = options;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public EntityResolver build() {
            return new EntityResolver(this);
        }
    }
}
