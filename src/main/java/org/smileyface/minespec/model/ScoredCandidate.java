package org.smileyface.minespec.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * An {@link ExtractionCandidate} together with the confidence the scorer assigned to it and the tier
 * of the source it came from.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ScoredCandidate {

    private final ExtractionCandidate candidate;
    private final double confidence;
    private final SourceTier sourceTier;

    @JsonCreator
    public ScoredCandidate(@JsonProperty("candidate") ExtractionCandidate candidate,
                           @JsonProperty("confidence") double confidence,
                           @JsonProperty("sourceTier") SourceTier sourceTier) {
        this.candidate = Objects.requireNonNull(candidate, "candidate");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
        this.confidence = confidence;
        this.sourceTier = Objects.requireNonNull(sourceTier, "sourceTier");
    }

    public ExtractionCandidate getCandidate() { return candidate; }
    public double getConfidence() { return confidence; }
    public SourceTier getSourceTier() { return sourceTier; }

    @JsonIgnore
    public String getId() { return candidate.getId(); }

    @JsonIgnore
    public SpecKey key() { return candidate.key(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScoredCandidate that = (ScoredCandidate) o;
        return Double.compare(that.confidence, confidence) == 0
                && candidate.equals(that.candidate)
                && sourceTier == that.sourceTier;
    }

    @Override
    public int hashCode() {
        return Objects.hash(candidate, confidence, sourceTier);
    }

    @Override
    public String toString() {
        return "ScoredCandidate{" + candidate + ", confidence=" + confidence + ", tier=" + sourceTier + '}';
    }
}
