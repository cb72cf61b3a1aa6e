package org.smileyface.minespec.store;

import org.smileyface.minespec.model.RimpullCurve;
import org.smileyface.minespec.model.ScoredCandidate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Set arithmetic shared by the repository implementations.
 */
final class StoreMerges {

    private StoreMerges() {
    }

    /** Union by candidate id, sorted by id; entries of {@code added} win. */
    static List<ScoredCandidate> union(Collection<ScoredCandidate> existing, Collection<ScoredCandidate> added) {
        Map<String, ScoredCandidate> byId = new TreeMap<>();
        if (existing != null) existing.forEach(c -> byId.put(c.getId(), c));
        if (added != null) added.forEach(c -> byId.put(c.getId(), c));
        return new ArrayList<>(byId.values());
    }

    /** Union by source table (document and table index), sorted by that key; entries of {@code added} win. */
    static List<RimpullCurve> unionCurves(Collection<RimpullCurve> existing, Collection<RimpullCurve> added) {
        Map<String, RimpullCurve> bySource = new TreeMap<>();
        if (existing != null) existing.forEach(c -> bySource.put(c.sourceKey(), c));
        if (added != null) added.forEach(c -> bySource.put(c.sourceKey(), c));
        return new ArrayList<>(bySource.values());
    }

    static boolean matches(String filter, String value) {
        return filter == null || filter.isBlank() || filter.trim().equalsIgnoreCase(value);
    }

    /** Case-insensitive id of a machine. */
    static String machineId(String brand, String model) {
        return (brand.trim() + "|" + model.trim()).toLowerCase(Locale.ROOT);
    }
}
