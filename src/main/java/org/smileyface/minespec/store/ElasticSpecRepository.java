package org.smileyface.minespec.store;

import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.minespec.model.RimpullCurve;
import org.smileyface.minespec.model.ScoredCandidate;
import org.smileyface.minespec.model.SpecKey;
import org.smileyface.minespec.model.SpecStatus;
import org.smileyface.minespec.model.ValidatedSpec;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * {@link SpecRepository} on Elasticsearch. Three indices are used, all named after the context prefix:
 * {@code -specs} holds one record per key, {@code -candidates} the candidate set of each key and
 * {@code -rimpull} the source curves and merged curve of each machine.
 *
 * <p>Merges hold a lock per key for the read-derive-write sequence, so they are atomic within this
 * process only. I/O failures surface as {@link UncheckedIOException}.</p>
 */
public class ElasticSpecRepository implements SpecRepository {

    private static final Logger log = LogManager.getLogger();

    // Values may be numbers or text for the same field, so nothing beyond the keys is indexed.
    // brand and model carry a folded sub-field for case-insensitive filters; the raw fields sort.
    static final String MAPPING = """
            {
              "settings": {
                "analysis": {
                  "normalizer": {
                    "folded": { "type": "custom", "filter": ["trim", "lowercase"] }
                  }
                }
              },
              "mappings": {
                "dynamic": false,
                "properties": {
                  "brand": { "type": "keyword", "fields": { "folded": { "type": "keyword", "normalizer": "folded" } } },
                  "model": { "type": "keyword", "fields": { "folded": { "type": "keyword", "normalizer": "folded" } } },
                  "parameterName": { "type": "keyword" },
                  "status": { "type": "keyword" }
                }
              }
            }
            """;

    private static final List<String> KEY_FIELDS = List.of("brand", "model", "parameterName");

    private final ElasticRestClient client;
    private final String specsIndex;
    private final String candidatesIndex;
    private final String rimpullIndex;
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ElasticSpecRepository(ElasticRestClient client, ElasticContext context) {
        this.client = Objects.requireNonNull(client, "client");
        this.specsIndex = context.indexName("specs");
        this.candidatesIndex = context.indexName("candidates");
        this.rimpullIndex = context.indexName("rimpull");
    }

    /**
     * Creates the indices that do not exist yet.
     */
    public void init() {
        try {
            for (String index : List.of(specsIndex, candidatesIndex, rimpullIndex)) {
                if (client.createIndex(index, MAPPING)) {
                    log.info("Created index {}", index);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create spec indices", e);
        }
    }

    @Override
    public Optional<ValidatedSpec> mergeAndReconcile(SpecKey key, Collection<ScoredCandidate> added,
                                                     BiFunction<SpecKey, List<ScoredCandidate>, Optional<ValidatedSpec>> derive) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(derive, "derive");
        String id = key.id();
        ReentrantLock lock = locks.computeIfAbsent(id, k -> new ReentrantLock());
        lock.lock();
        try {
            List<ScoredCandidate> existing = client.getDocument(candidatesIndex, id, CandidateSet.class)
                    .map(CandidateSet::candidates)
                    .orElse(List.of());
            List<ScoredCandidate> merged = List.copyOf(StoreMerges.union(existing, added));
            client.indexDocument(candidatesIndex, id,
                    new CandidateSet(key.brand(), key.model(), key.parameterName(), merged));
            Optional<ValidatedSpec> derived = derive.apply(key, merged);
            if (derived.isPresent()) {
                client.indexDocument(specsIndex, id, derived.get());
            }
            log.debug("Merged {} candidates into {} -> {}", added == null ? 0 : added.size(), id, derived.orElse(null));
            return derived;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to merge candidates of " + id, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void upsert(ValidatedSpec spec) {
        try {
            client.indexDocument(specsIndex, spec.key().id(), spec);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store " + spec.key().id(), e);
        }
    }

    @Override
    public void upsert(RimpullCurve curve) {
        String id = StoreMerges.machineId(curve.getBrand(), curve.getModel());
        ReentrantLock lock = locks.computeIfAbsent(id, k -> new ReentrantLock());
        lock.lock();
        try {
            List<RimpullCurve> sources = client.getDocument(rimpullIndex, id, RimpullSet.class)
                    .map(RimpullSet::sources)
                    .orElse(List.of());
            client.indexDocument(rimpullIndex, id, new RimpullSet(curve.getBrand(), curve.getModel(), sources, curve));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store rimpull curve of " + id, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<RimpullCurve> mergeRimpull(String brand, String model, Collection<RimpullCurve> added,
                                               Function<List<RimpullCurve>, Optional<RimpullCurve>> merge) {
        String id = StoreMerges.machineId(brand, model);
        ReentrantLock lock = locks.computeIfAbsent(id, k -> new ReentrantLock());
        lock.lock();
        try {
            List<RimpullCurve> existing = client.getDocument(rimpullIndex, id, RimpullSet.class)
                    .map(RimpullSet::sources)
                    .orElse(List.of());
            List<RimpullCurve> all = List.copyOf(StoreMerges.unionCurves(existing, added));
            Optional<RimpullCurve> merged = merge.apply(all);
            client.indexDocument(rimpullIndex, id, new RimpullSet(brand, model, all, merged.orElse(null)));
            return merged;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to merge rimpull curves of " + id, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ValidatedSpec> getSpecs(String brand, String model) {
        try {
            List<ValidatedSpec> out = new ArrayList<>(
                    client.searchAll(specsIndex, specQuery(brand, model), KEY_FIELDS, ValidatedSpec.class));
            out.sort(Comparator.comparing(s -> s.key().id()));
            return out;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read specs", e);
        }
    }

    /** Non-rejected records, filtered on brand and model when given. */
    static Query specQuery(String brand, String model) {
        return Query.of(q -> q.bool(b -> {
            b.mustNot(mn -> mn.term(t -> t.field("status").value(SpecStatus.REJECTED.name())));
            if (brand != null && !brand.isBlank()) {
                b.filter(f -> f.term(t -> t.field("brand.folded").value(brand.trim())));
            }
            if (model != null && !model.isBlank()) {
                b.filter(f -> f.term(t -> t.field("model.folded").value(model.trim())));
            }
            return b;
        }));
    }

    @Override
    public Optional<RimpullCurve> getRimpull(String brand, String model) {
        if (brand == null || model == null) return Optional.empty();
        try {
            return client.getDocument(rimpullIndex, StoreMerges.machineId(brand, model), RimpullSet.class)
                    .map(RimpullSet::merged);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read rimpull curve of " + brand + "/" + model, e);
        }
    }

    @Override
    public List<ScoredCandidate> getCandidates(SpecKey key) {
        try {
            return client.getDocument(candidatesIndex, key.id(), CandidateSet.class)
                    .map(CandidateSet::candidates)
                    .orElse(List.of());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read candidates of " + key.id(), e);
        }
    }

    /** Stored candidate set of one key. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CandidateSet(String brand, String model, String parameterName, List<ScoredCandidate> candidates) {
        public CandidateSet {
            candidates = candidates == null ? List.of() : candidates;
        }
    }

    /** Stored source curves of one machine and the curve merged from them. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RimpullSet(String brand, String model, List<RimpullCurve> sources, RimpullCurve merged) {
        public RimpullSet {
            sources = sources == null ? List.of() : sources;
        }
    }
}
