package org.smileyface.minespec.scoring;

import org.smileyface.minespec.config.SpecEngineConfig;
import org.smileyface.minespec.model.ExtractionCandidate;
import org.smileyface.minespec.model.ScoredCandidate;
import org.smileyface.minespec.model.SourceTier;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Scores extraction candidates. The score is a pure function of the candidate and its source tier:
 *
 * <pre>
 * confidence = (tierShare * tierWeight + methodShare * methodWeight) * plausibility
 * </pre>
 *
 * where plausibility is 1 inside the parameter's plausible range, {@code unknownUnitFactor} when the
 * value's unit was not recognised and {@code outOfRangeFactor} outside the range. The result is
 * clamped to [0, 1] and rounded to four decimals.
 */
public class ConfidenceScorer {

    private final SpecEngineConfig config;

    public ConfidenceScorer(SpecEngineConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public ScoredCandidate score(ExtractionCandidate candidate, SourceTier tier) {
        Objects.requireNonNull(candidate, "candidate");
        SourceTier t = tier == null ? SourceTier.UNKNOWN : tier;
        SpecEngineConfig.Scoring s = config.scoring;
        double tierWeight = s.tierWeights.getOrDefault(t.name(), 0.0);
        double methodWeight = s.methodWeights.getOrDefault(candidate.getExtractionMethod().name(), 0.0);
        double base = s.tierShare * tierWeight + s.methodShare * methodWeight;
        double confidence = round4(Math.max(0.0, Math.min(1.0, base * plausibility(candidate))));
        return new ScoredCandidate(candidate, confidence, t);
    }

    public List<ScoredCandidate> scoreAll(List<ExtractionCandidate> candidates, SourceTier tier) {
        List<ScoredCandidate> out = new ArrayList<>(candidates.size());
        for (ExtractionCandidate c : candidates) {
            out.add(score(c, tier));
        }
        return out;
    }

    double plausibility(ExtractionCandidate candidate) {
        SpecEngineConfig.ParameterBounds bounds = config.bounds(candidate.getParameterName());
        if (bounds == null) return config.scoring.unknownUnitFactor;
        if (bounds.isText()) return 1.0;
        if (candidate.getUnit() == null || !candidate.isNumeric()) return config.scoring.unknownUnitFactor;
        double v = candidate.numericValue();
        if (v < bounds.plausibleMin || v > bounds.plausibleMax) return config.scoring.outOfRangeFactor;
        return 1.0;
    }

    static double round4(double v) {
        return BigDecimal.valueOf(v).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }
}
