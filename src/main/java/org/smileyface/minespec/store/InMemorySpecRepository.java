package org.smileyface.minespec.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.minespec.model.RimpullCurve;
import org.smileyface.minespec.model.ScoredCandidate;
import org.smileyface.minespec.model.SpecKey;
import org.smileyface.minespec.model.SpecStatus;
import org.smileyface.minespec.model.ValidatedSpec;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Process-local {@link SpecRepository}. A merge runs inside {@link ConcurrentMap#compute} of its key,
 * which serialises merges of the same key and leaves other keys unblocked.
 */
public class InMemorySpecRepository implements SpecRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemorySpecRepository.class);

    private final ConcurrentMap<String, List<ScoredCandidate>> candidates = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ValidatedSpec> specs = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<RimpullCurve>> curveSources = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, RimpullCurve> curves = new ConcurrentHashMap<>();

    @Override
    public Optional<ValidatedSpec> mergeAndReconcile(SpecKey key, Collection<ScoredCandidate> added,
                                                     BiFunction<SpecKey, List<ScoredCandidate>, Optional<ValidatedSpec>> derive) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(derive, "derive");
        ValidatedSpec[] result = new ValidatedSpec[1];
        candidates.compute(key.id(), (id, existing) -> {
            List<ScoredCandidate> merged = List.copyOf(StoreMerges.union(existing, added));
            Optional<ValidatedSpec> derived = derive.apply(key, merged);
            if (derived.isPresent()) {
                specs.put(id, derived.get());
                result[0] = derived.get();
            } else {
                specs.remove(id);
            }
            return merged.isEmpty() ? null : merged;
        });
        log.debug("Merged {} candidates into {} -> {}", added == null ? 0 : added.size(), key.id(), result[0]);
        return Optional.ofNullable(result[0]);
    }

    @Override
    public void upsert(ValidatedSpec spec) {
        specs.put(spec.key().id(), spec);
    }

    @Override
    public void upsert(RimpullCurve curve) {
        curves.put(StoreMerges.machineId(curve.getBrand(), curve.getModel()), curve);
    }

    @Override
    public Optional<RimpullCurve> mergeRimpull(String brand, String model, Collection<RimpullCurve> added,
                                               Function<List<RimpullCurve>, Optional<RimpullCurve>> merge) {
        String id = StoreMerges.machineId(brand, model);
        RimpullCurve[] result = new RimpullCurve[1];
        curveSources.compute(id, (k, existing) -> {
            List<RimpullCurve> all = List.copyOf(StoreMerges.unionCurves(existing, added));
            Optional<RimpullCurve> merged = merge.apply(all);
            if (merged.isPresent()) {
                curves.put(k, merged.get());
                result[0] = merged.get();
            } else {
                curves.remove(k);
            }
            return all.isEmpty() ? null : all;
        });
        return Optional.ofNullable(result[0]);
    }

    @Override
    public List<ValidatedSpec> getSpecs(String brand, String model) {
        List<ValidatedSpec> out = new ArrayList<>();
        for (ValidatedSpec s : specs.values()) {
            if (s.getStatus() != SpecStatus.REJECTED
                    && StoreMerges.matches(brand, s.getBrand())
                    && StoreMerges.matches(model, s.getModel())) {
                out.add(s);
            }
        }
        out.sort(Comparator.comparing(s -> s.key().id()));
        return out;
    }

    @Override
    public Optional<RimpullCurve> getRimpull(String brand, String model) {
        if (brand == null || model == null) return Optional.empty();
        return Optional.ofNullable(curves.get(StoreMerges.machineId(brand, model)));
    }

    @Override
    public List<ScoredCandidate> getCandidates(SpecKey key) {
        return candidates.getOrDefault(key.id(), List.of());
    }
}
