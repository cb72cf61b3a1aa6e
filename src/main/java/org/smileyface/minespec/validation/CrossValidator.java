package org.smileyface.minespec.validation;

import org.smileyface.minespec.config.SpecEngineConfig;
import org.smileyface.minespec.model.ScoredCandidate;
import org.smileyface.minespec.model.SourceTier;
import org.smileyface.minespec.model.SpecKey;
import org.smileyface.minespec.model.SpecStatus;
import org.smileyface.minespec.model.ValidatedSpec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Reconciles the scored candidates of a key into one {@link ValidatedSpec}.
 *
 * <p>Candidates are clustered (numeric values by relative tolerance around the cluster mean, text by
 * normalised string) and the cluster with the highest confidence mass wins. Ties go to the cluster
 * with more distinct source tiers, then more candidates, then the higher single confidence, then the
 * lower value. The record is {@link SpecStatus#VALIDATED} only when the winner is strong on its own
 * and nothing outside it is; otherwise it is {@link SpecStatus#FLAGGED}.</p>
 *
 * <p>Input is sorted by candidate id before any arithmetic, so the result does not depend on input
 * order and re-running on the same candidates yields an equal record.</p>
 *
 * <p>Record confidence is {@code maxConfidence * winnerMass / totalMass + diversityBonus * (tiers - 1)},
 * capped at 1 and rounded to four decimals, where {@code maxConfidence} and {@code tiers} are taken
 * over the winning cluster.</p>
 */
public class CrossValidator {

    private static final Logger log = LogManager.getLogger();

    private static final double MASS_EPSILON = 1e-9;

    private final SpecEngineConfig config;

    public CrossValidator(SpecEngineConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Reconciles every key present in {@code candidates}.
     *
     * @return one record per key, ordered by key
     */
    public List<ValidatedSpec> reconcile(List<ScoredCandidate> candidates) {
        Map<String, List<ScoredCandidate>> byKey = new TreeMap<>();
        Map<String, SpecKey> keys = new LinkedHashMap<>();
        for (ScoredCandidate c : candidates) {
            SpecKey key = c.key();
            keys.putIfAbsent(key.id(), key);
            byKey.computeIfAbsent(key.id(), k -> new ArrayList<>()).add(c);
        }
        List<ValidatedSpec> out = new ArrayList<>();
        for (Map.Entry<String, List<ScoredCandidate>> e : byKey.entrySet()) {
            reconcileKey(keys.get(e.getKey()), e.getValue()).ifPresent(out::add);
        }
        return out;
    }

    /**
     * Reconciles the candidates of one key. Candidates of other keys are ignored.
     *
     * @return the record, or empty when there is no candidate for the key
     */
    public Optional<ValidatedSpec> reconcileKey(SpecKey key, List<ScoredCandidate> group) {
        Objects.requireNonNull(key, "key");
        List<ScoredCandidate> sorted = new ArrayList<>();
        if (group != null) {
            for (ScoredCandidate c : group) {
                if (key.equals(c.key())) sorted.add(c);
            }
        }
        if (sorted.isEmpty()) return Optional.empty();
        sorted.sort(Comparator.comparing(ScoredCandidate::getId));

        SpecEngineConfig.ParameterBounds bounds = config.bounds(key.parameterName());
        boolean text = bounds != null ? bounds.isText() : sorted.stream().noneMatch(c -> c.getCandidate().isNumeric());
        List<Cluster> clusters = text ? clusterText(sorted) : clusterNumeric(sorted, tolerancePct(bounds));
        if (clusters.isEmpty()) return Optional.empty();

        clusters.sort(WINNER_ORDER);
        Cluster winner = clusters.get(0);
        List<Cluster> rivals = clusters.subList(1, clusters.size());

        SpecEngineConfig.Thresholds th = config.thresholds;
        String reason = null;
        if (!(winner.mass > th.acceptance)) {
            reason = String.format(Locale.ROOT, "winning cluster mass %.4f does not exceed %.2f", winner.mass, th.acceptance);
        } else if (!(winner.maxConfidence > th.acceptance)) {
            reason = String.format(Locale.ROOT, "no supporting candidate above %.2f", th.acceptance);
        } else {
            for (Cluster rival : rivals) {
                if (rival.mass + MASS_EPSILON >= th.disagreementRatio * winner.mass) {
                    reason = String.format(Locale.ROOT, "rival value %s holds mass %.4f against %.4f",
                            rival.display(), rival.mass, winner.mass);
                    break;
                }
                if (rival.maxConfidence > th.acceptance) {
                    reason = String.format(Locale.ROOT, "rival value %s has a candidate at %.4f",
                            rival.display(), rival.maxConfidence);
                    break;
                }
            }
        }
        SpecStatus status = reason == null ? SpecStatus.VALIDATED : SpecStatus.FLAGGED;

        List<ScoredCandidate> conflicting = new ArrayList<>();
        double totalMass = winner.mass;
        for (Cluster rival : rivals) {
            totalMass += rival.mass;
            if (rival.mass > th.visibility) conflicting.addAll(rival.members);
        }
        conflicting.sort(Comparator.comparing(ScoredCandidate::getId));

        List<ScoredCandidate> supporting = new ArrayList<>(winner.members);
        supporting.sort(Comparator.comparing(ScoredCandidate::getId));
        Object value = text ? winner.mode() : winner.weightedMean();
        String unit = text ? null : winner.unit(bounds);
        double confidence = recordConfidence(winner, totalMass);

        if (status == SpecStatus.FLAGGED) {
            log.debug("Flagged {}: {}", key.id(), reason);
        }
        return Optional.of(new ValidatedSpec(key.brand(), key.model(), key.parameterName(), value, unit, confidence,
                supporting, conflicting, status, reason));
    }

    private double recordConfidence(Cluster winner, double totalMass) {
        double share = totalMass > 0 ? winner.mass / totalMass : 0.0;
        double c = winner.maxConfidence * share + config.thresholds.diversityBonus * (winner.tiers().size() - 1);
        return BigDecimal.valueOf(Math.min(1.0, Math.max(0.0, c))).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }

    private static double tolerancePct(SpecEngineConfig.ParameterBounds bounds) {
        return bounds == null ? 2.0 : bounds.tolerancePct;
    }

    // clustering

    /**
     * Greedy clustering over ascending values: a value joins the current cluster when every member,
     * itself included, stays within {@code tolerancePct} of the cluster's new mean.
     */
    static List<Cluster> clusterNumeric(List<ScoredCandidate> sortedById, double tolerancePct) {
        List<ScoredCandidate> byValue = new ArrayList<>();
        for (ScoredCandidate c : sortedById) {
            if (c.getCandidate().isNumeric()) byValue.add(c);
        }
        byValue.sort(Comparator.comparingDouble((ScoredCandidate c) -> c.getCandidate().numericValue())
                .thenComparing(ScoredCandidate::getId));
        List<Cluster> clusters = new ArrayList<>();
        Cluster current = null;
        double sum = 0;
        for (ScoredCandidate c : byValue) {
            double v = c.getCandidate().numericValue();
            if (current != null) {
                double mean = (sum + v) / (current.members.size() + 1);
                double limit = Math.abs(mean) * tolerancePct / 100.0;
                double lowest = current.members.get(0).getCandidate().numericValue();
                if (Math.abs(v - mean) <= limit + MASS_EPSILON && Math.abs(lowest - mean) <= limit + MASS_EPSILON) {
                    current.add(c);
                    sum += v;
                    continue;
                }
            }
            current = new Cluster(false);
            current.add(c);
            sum = v;
            clusters.add(current);
        }
        return clusters;
    }

    static List<Cluster> clusterText(List<ScoredCandidate> sortedById) {
        Map<String, Cluster> byNorm = new TreeMap<>();
        for (ScoredCandidate c : sortedById) {
            String norm = normalizeText(String.valueOf(c.getCandidate().getNormalizedValue()));
            if (norm.isEmpty()) continue;
            byNorm.computeIfAbsent(norm, k -> new Cluster(true)).add(c);
        }
        return new ArrayList<>(byNorm.values());
    }

    static String normalizeText(String s) {
        return s.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}]+", "");
    }

    private static final Comparator<Cluster> WINNER_ORDER = Comparator
            .comparingDouble((Cluster c) -> -roundMass(c.mass))
            .thenComparingInt(c -> -c.tiers().size())
            .thenComparingInt(c -> -c.members.size())
            .thenComparingDouble(c -> -c.maxConfidence)
            .thenComparingDouble(Cluster::lowestValue)
            .thenComparing(Cluster::textKey);

    private static double roundMass(double mass) {
        return Math.round(mass * 1e6) / 1e6;
    }

    static final class Cluster {
        final boolean text;
        final List<ScoredCandidate> members = new ArrayList<>();
        double mass;
        double maxConfidence;

        Cluster(boolean text) {
            this.text = text;
        }

        void add(ScoredCandidate c) {
            members.add(c);
            mass += c.getConfidence();
            maxConfidence = Math.max(maxConfidence, c.getConfidence());
        }

        Set<SourceTier> tiers() {
            Set<SourceTier> tiers = EnumSet.noneOf(SourceTier.class);
            for (ScoredCandidate c : members) tiers.add(c.getSourceTier());
            return tiers;
        }

        /** Confidence-weighted mean, or the plain mean when every member has zero confidence. */
        double weightedMean() {
            double weighted = 0;
            double plain = 0;
            for (ScoredCandidate c : members) {
                double v = c.getCandidate().numericValue();
                weighted += v * c.getConfidence();
                plain += v;
            }
            double mean = mass > 0 ? weighted / mass : plain / members.size();
            return new BigDecimal(mean).round(new MathContext(10)).doubleValue();
        }

        /** Most frequent written form; ties go to the higher confidence mass, then the smaller string. */
        String mode() {
            Map<String, double[]> forms = new TreeMap<>();
            for (ScoredCandidate c : members) {
                double[] stats = forms.computeIfAbsent(String.valueOf(c.getCandidate().getNormalizedValue()),
                        k -> new double[2]);
                stats[0] += 1;
                stats[1] += c.getConfidence();
            }
            String best = null;
            double[] bestStats = null;
            for (Map.Entry<String, double[]> e : forms.entrySet()) {
                double[] s = e.getValue();
                if (bestStats == null || s[0] > bestStats[0]
                        || (s[0] == bestStats[0] && roundMass(s[1]) > roundMass(bestStats[1]))) {
                    best = e.getKey();
                    bestStats = s;
                }
            }
            return best;
        }

        /** Canonical unit when any member carries it, otherwise none. */
        String unit(SpecEngineConfig.ParameterBounds bounds) {
            for (ScoredCandidate c : members) {
                String u = c.getCandidate().getUnit();
                if (u != null && (bounds == null || u.equals(bounds.unit))) return u;
            }
            return null;
        }

        String display() {
            return text ? mode() : String.valueOf(weightedMean());
        }

        double lowestValue() {
            return text ? 0.0 : members.get(0).getCandidate().numericValue();
        }

        String textKey() {
            return text ? normalizeText(mode()) : "";
        }
    }
}
