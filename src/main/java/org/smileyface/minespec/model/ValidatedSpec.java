package org.smileyface.minespec.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * The reconciled value of one (brand, model, parameter) key.
 *
 * <p>Always derived from the complete candidate set of its key, never patched in place. A
 * {@link SpecStatus#VALIDATED} record carries at least one supporting candidate above the acceptance
 * threshold and no conflicting candidate above it.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ValidatedSpec {

    private final String brand;
    private final String model;
    private final String parameterName;
    private final Object value;
    private final String unit;
    private final double confidence;
    private final List<ScoredCandidate> supportingCandidates;
    private final List<ScoredCandidate> conflictingCandidates;
    private final SpecStatus status;
    private final String statusReason;

    @JsonCreator
    public ValidatedSpec(@JsonProperty("brand") String brand,
                         @JsonProperty("model") String model,
                         @JsonProperty("parameterName") String parameterName,
                         @JsonProperty("value") Object value,
                         @JsonProperty("unit") String unit,
                         @JsonProperty("confidence") double confidence,
                         @JsonProperty("supportingCandidates") List<ScoredCandidate> supportingCandidates,
                         @JsonProperty("conflictingCandidates") List<ScoredCandidate> conflictingCandidates,
                         @JsonProperty("status") SpecStatus status,
                         @JsonProperty("statusReason") String statusReason) {
        this.brand = Objects.requireNonNull(brand, "brand");
        this.model = Objects.requireNonNull(model, "model");
        this.parameterName = Objects.requireNonNull(parameterName, "parameterName");
        this.value = value instanceof Number n ? (Object) n.doubleValue() : value;
        this.unit = unit;
        this.confidence = confidence;
        this.supportingCandidates = supportingCandidates == null ? List.of() : List.copyOf(supportingCandidates);
        this.conflictingCandidates = conflictingCandidates == null ? List.of() : List.copyOf(conflictingCandidates);
        this.status = Objects.requireNonNull(status, "status");
        this.statusReason = statusReason;
    }

    public String getBrand() { return brand; }
    public String getModel() { return model; }
    public String getParameterName() { return parameterName; }
    public Object getValue() { return value; }
    public String getUnit() { return unit; }
    public double getConfidence() { return confidence; }
    public List<ScoredCandidate> getSupportingCandidates() { return supportingCandidates; }
    public List<ScoredCandidate> getConflictingCandidates() { return conflictingCandidates; }
    public SpecStatus getStatus() { return status; }
    public String getStatusReason() { return statusReason; }

    @JsonIgnore
    public SpecKey key() {
        return new SpecKey(brand, model, parameterName);
    }

    /**
     * Copy of this record with a different status and reason; everything else is kept.
     */
    public ValidatedSpec withStatus(SpecStatus newStatus, String reason) {
        return new ValidatedSpec(brand, model, parameterName, value, unit, confidence,
                supportingCandidates, conflictingCandidates, newStatus, reason);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ValidatedSpec that = (ValidatedSpec) o;
        return Double.compare(that.confidence, confidence) == 0
                && brand.equals(that.brand)
                && model.equals(that.model)
                && parameterName.equals(that.parameterName)
                && Objects.equals(value, that.value)
                && Objects.equals(unit, that.unit)
                && supportingCandidates.equals(that.supportingCandidates)
                && conflictingCandidates.equals(that.conflictingCandidates)
                && status == that.status
                && Objects.equals(statusReason, that.statusReason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(brand, model, parameterName, value, unit, confidence, status);
    }

    @Override
    public String toString() {
        return "ValidatedSpec{" +
                brand + "/" + model + "/" + parameterName +
                ", value=" + value +
                ", unit=" + unit +
                ", confidence=" + confidence +
                ", status=" + status +
                (statusReason != null ? ", reason='" + statusReason + '\'' : "") +
                ", supporting=" + supportingCandidates.size() +
                ", conflicting=" + conflictingCandidates.size() +
                '}';
    }
}
