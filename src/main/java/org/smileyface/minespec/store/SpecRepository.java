package org.smileyface.minespec.store;

import org.smileyface.minespec.model.RimpullCurve;
import org.smileyface.minespec.model.ScoredCandidate;
import org.smileyface.minespec.model.SpecKey;
import org.smileyface.minespec.model.ValidatedSpec;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Storage for scored candidates, the records reconciled from them and rimpull curves.
 *
 * <p>Records are never patched: every merge stores the union of old and new candidates of a key and
 * re-derives the record from that full set. Merges on the same key are serialised.</p>
 */
public interface SpecRepository {

    /**
     * Adds {@code candidates} to the stored set of {@code key} (a candidate with a known id replaces
     * the stored one) and re-derives the record of the key from the complete set.
     *
     * @param derive computes the record from all candidates of the key, sorted by id
     * @return the stored record, empty when {@code derive} produced none
     */
    Optional<ValidatedSpec> mergeAndReconcile(SpecKey key, Collection<ScoredCandidate> candidates,
                                              BiFunction<SpecKey, List<ScoredCandidate>, Optional<ValidatedSpec>> derive);

    /**
     * Stores a record as is, replacing any record of the same key.
     */
    void upsert(ValidatedSpec spec);

    /**
     * Stores a curve as the merged curve of its machine, replacing the previous one.
     */
    void upsert(RimpullCurve curve);

    /**
     * Adds curves from new documents to the machine's source curves (one per document) and stores
     * what {@code merge} makes of all of them.
     */
    Optional<RimpullCurve> mergeRimpull(String brand, String model, Collection<RimpullCurve> curves,
                                        Function<List<RimpullCurve>, Optional<RimpullCurve>> merge);

    /**
     * Records matching the optional filters (case-insensitive; null or blank matches everything),
     * ordered by key. Rejected records are never returned.
     */
    List<ValidatedSpec> getSpecs(String brand, String model);

    Optional<RimpullCurve> getRimpull(String brand, String model);

    /**
     * Every stored candidate of a key, sorted by id.
     */
    List<ScoredCandidate> getCandidates(SpecKey key);
}
