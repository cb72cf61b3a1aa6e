package org.smileyface.minespec.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * A single value for one parameter, found in one place of one document.
 *
 * <p>The value is already converted to the parameter's canonical unit. {@code unit} is null when the
 * unit token next to the value was not recognised (the value is then kept as written) and for text
 * parameters. Instances are immutable; the id is derived from where the value was found so the same
 * match always yields the same id.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ExtractionCandidate {

    private final String id;
    private final String brand;
    private final String model;
    private final String parameterName;
    private final String rawMatch;
    private final Object normalizedValue;
    private final String unit;
    private final ExtractionMethod extractionMethod;
    private final String sourceDocumentRef;
    private final String matchedSpan;

    public ExtractionCandidate(String brand, String model, String parameterName, String rawMatch,
                               Object normalizedValue, String unit, ExtractionMethod extractionMethod,
                               String sourceDocumentRef, String matchedSpan) {
        this(computeId(sourceDocumentRef, parameterName, extractionMethod, matchedSpan, rawMatch),
                brand, model, parameterName, rawMatch, normalizedValue, unit, extractionMethod,
                sourceDocumentRef, matchedSpan);
    }

    @JsonCreator
    public ExtractionCandidate(@JsonProperty("id") String id,
                               @JsonProperty("brand") String brand,
                               @JsonProperty("model") String model,
                               @JsonProperty("parameterName") String parameterName,
                               @JsonProperty("rawMatch") String rawMatch,
                               @JsonProperty("normalizedValue") Object normalizedValue,
                               @JsonProperty("unit") String unit,
                               @JsonProperty("extractionMethod") ExtractionMethod extractionMethod,
                               @JsonProperty("sourceDocumentRef") String sourceDocumentRef,
                               @JsonProperty("matchedSpan") String matchedSpan) {
        this.id = Objects.requireNonNull(id, "id");
        this.brand = Objects.requireNonNull(brand, "brand");
        this.model = Objects.requireNonNull(model, "model");
        this.parameterName = Objects.requireNonNull(parameterName, "parameterName");
        this.rawMatch = rawMatch == null ? "" : rawMatch;
        this.normalizedValue = normalizeValue(Objects.requireNonNull(normalizedValue, "normalizedValue"));
        this.unit = unit;
        this.extractionMethod = Objects.requireNonNull(extractionMethod, "extractionMethod");
        this.sourceDocumentRef = Objects.requireNonNull(sourceDocumentRef, "sourceDocumentRef");
        this.matchedSpan = matchedSpan == null ? "" : matchedSpan;
    }

    public String getId() { return id; }
    public String getBrand() { return brand; }
    public String getModel() { return model; }
    public String getParameterName() { return parameterName; }
    public String getRawMatch() { return rawMatch; }
    public Object getNormalizedValue() { return normalizedValue; }
    public String getUnit() { return unit; }
    public ExtractionMethod getExtractionMethod() { return extractionMethod; }
    public String getSourceDocumentRef() { return sourceDocumentRef; }
    public String getMatchedSpan() { return matchedSpan; }

    @JsonIgnore
    public boolean isNumeric() {
        return normalizedValue instanceof Double;
    }

    @JsonIgnore
    public double numericValue() {
        if (!(normalizedValue instanceof Double d)) {
            throw new IllegalStateException("Candidate " + id + " holds a text value");
        }
        return d;
    }

    @JsonIgnore
    public SpecKey key() {
        return SpecKey.of(this);
    }

    /**
     * Computes the deterministic SHA-256 hex id from the document reference, parameter, method,
     * span and raw match. Fields are separated by NUL so different tuples never collide on concatenation.
     */
    public static String computeId(String sourceDocumentRef, String parameterName, ExtractionMethod method,
                                   String matchedSpan, String rawMatch) {
        String joined = String.join("\0",
                Objects.toString(sourceDocumentRef, ""),
                Objects.toString(parameterName, ""),
                method == null ? "" : method.name(),
                Objects.toString(matchedSpan, ""),
                Objects.toString(rawMatch, ""));
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return toHex(md.digest(joined.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static Object normalizeValue(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        return value.toString();
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(Character.forDigit((b >>> 4) & 0xF, 16));
            sb.append(Character.forDigit(b & 0xF, 16));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExtractionCandidate that = (ExtractionCandidate) o;
        return id.equals(that.id)
                && brand.equals(that.brand)
                && model.equals(that.model)
                && normalizedValue.equals(that.normalizedValue)
                && Objects.equals(unit, that.unit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, brand, model);
    }

    @Override
    public String toString() {
        return "ExtractionCandidate{" +
                "id='" + id.substring(0, 12) + '\'' +
                ", key=" + brand + "/" + model + "/" + parameterName +
                ", value=" + normalizedValue +
                ", unit=" + unit +
                ", method=" + extractionMethod +
                ", source='" + sourceDocumentRef + '\'' +
                ", span='" + matchedSpan + '\'' +
                '}';
    }
}
