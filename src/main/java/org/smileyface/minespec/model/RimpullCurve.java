package org.smileyface.minespec.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Rimpull (tractive force against ground speed) curve for one machine, per gear.
 * Speeds are in km/h and forces in kN. Monotonicity problems are recorded in {@code violations};
 * the offending points stay in the curve.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RimpullCurve {

    private final String brand;
    private final String model;
    private final List<RimpullPoint> points;
    private final List<String> violations;
    private final String sourceDocumentRef;
    private final SourceTier sourceTier;
    private final int tableIndex;

    public RimpullCurve(String brand, String model, List<RimpullPoint> points, List<String> violations,
                        String sourceDocumentRef, SourceTier sourceTier) {
        this(brand, model, points, violations, sourceDocumentRef, sourceTier, 0);
    }

    @JsonCreator
    public RimpullCurve(@JsonProperty("brand") String brand,
                        @JsonProperty("model") String model,
                        @JsonProperty("points") List<RimpullPoint> points,
                        @JsonProperty("violations") List<String> violations,
                        @JsonProperty("sourceDocumentRef") String sourceDocumentRef,
                        @JsonProperty("sourceTier") SourceTier sourceTier,
                        @JsonProperty("tableIndex") int tableIndex) {
        this.brand = Objects.requireNonNull(brand, "brand");
        this.model = Objects.requireNonNull(model, "model");
        this.points = points == null ? List.of() : List.copyOf(points);
        this.violations = violations == null ? List.of() : List.copyOf(violations);
        this.sourceDocumentRef = sourceDocumentRef;
        this.sourceTier = sourceTier == null ? SourceTier.UNKNOWN : sourceTier;
        this.tableIndex = tableIndex;
    }

    public String getBrand() { return brand; }
    public String getModel() { return model; }
    public List<RimpullPoint> getPoints() { return points; }
    public List<String> getViolations() { return violations; }
    public String getSourceDocumentRef() { return sourceDocumentRef; }
    public SourceTier getSourceTier() { return sourceTier; }
    /** Position of the table the curve was read from within its document. */
    public int getTableIndex() { return tableIndex; }

    /** Identifies the source table: one document may hold several rimpull tables. */
    @JsonIgnore
    public String sourceKey() {
        return sourceDocumentRef + "#table[" + tableIndex + "]";
    }

    @JsonIgnore
    public SortedSet<Integer> gears() {
        SortedSet<Integer> gears = new TreeSet<>();
        for (RimpullPoint p : points) gears.add(p.gear());
        return gears;
    }

    /** Highest force of one gear, empty if the gear has no points. */
    public OptionalDouble peakForce(int gear) {
        return points.stream().filter(p -> p.gear() == gear).mapToDouble(RimpullPoint::forceKn).max();
    }

    /** Same curve with another tier and additional violations. */
    public RimpullCurve with(SourceTier tier, List<String> extraViolations) {
        List<String> merged = new ArrayList<>(violations);
        if (extraViolations != null) {
            for (String v : extraViolations) {
                if (!merged.contains(v)) merged.add(v);
            }
        }
        return new RimpullCurve(brand, model, points, merged, sourceDocumentRef, tier, tableIndex);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RimpullCurve that = (RimpullCurve) o;
        return brand.equals(that.brand)
                && model.equals(that.model)
                && points.equals(that.points)
                && violations.equals(that.violations)
                && Objects.equals(sourceDocumentRef, that.sourceDocumentRef)
                && sourceTier == that.sourceTier
                && tableIndex == that.tableIndex;
    }

    @Override
    public int hashCode() {
        return Objects.hash(brand, model, points, sourceDocumentRef, tableIndex);
    }

    @Override
    public String toString() {
        return "RimpullCurve{" + brand + "/" + model +
                ", points=" + points.size() +
                ", gears=" + gears() +
                ", violations=" + violations.size() +
                ", source='" + sourceKey() + '\'' +
                ", tier=" + sourceTier +
                '}';
    }
}
