package org.smileyface.minespec.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.minespec.model.ExtractionMethod;
import org.smileyface.minespec.model.SourceTier;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeSet;

/**
 * Tables that drive extraction, scoring, reconciliation and QA: thresholds, per-parameter bounds and
 * tolerances, the unit conversion table, source tier weights and the domain lists used to classify
 * sources. Loaded from a classpath JSON resource (default {@code SpecEngineConfig.json}) and validated
 * once; any out-of-range value fails the load with an {@link IllegalArgumentException}.
 */
public class SpecEngineConfig {

    private static final Logger log = LogManager.getLogger(SpecEngineConfig.class);

    public static final String DEFAULT_RESOURCE = "SpecEngineConfig.json";

    public Thresholds thresholds = new Thresholds();
    public Scoring scoring = new Scoring();
    /** Parameter name -> bounds, canonical unit and clustering tolerance. */
    public Map<String, ParameterBounds> parameters = new LinkedHashMap<>();
    /** Canonical unit -> (unit token -> factor into the canonical unit). */
    public Map<String, Map<String, Double>> unitConversions = new LinkedHashMap<>();
    public Domains domains = new Domains();
    /** Parameters a complete equipment record is expected to have. */
    public List<String> coreParameters = List.of();

    /**
     * Loads and validates the configuration from the named classpath resource.
     *
     * @throws IllegalArgumentException when the resource is missing, malformed or holds invalid values
     */
    public static SpecEngineConfig load(String resourceName) {
        String name = (resourceName == null || resourceName.isBlank()) ? DEFAULT_RESOURCE : resourceName;
        try (InputStream in = SpecEngineConfig.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) {
                throw new IllegalArgumentException("Engine configuration resource not found: " + name);
            }
            ObjectMapper mapper = new ObjectMapper()
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
            SpecEngineConfig cfg = mapper.readValue(in, SpecEngineConfig.class);
            cfg.validate();
            log.info("Loaded engine configuration {} ({} parameters, {} unit tables)",
                    name, cfg.parameters.size(), cfg.unitConversions.size());
            return cfg;
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read engine configuration " + name, e);
        }
    }

    /**
     * Checks every value against its declared bounds.
     *
     * @throws IllegalArgumentException naming the first offending entry
     */
    public void validate() {
        require(thresholds != null, "thresholds missing");
        requireUnit("thresholds.acceptance", thresholds.acceptance);
        requireUnit("thresholds.disagreementRatio", thresholds.disagreementRatio);
        requireUnit("thresholds.visibility", thresholds.visibility);
        requireRange("thresholds.diversityBonus", thresholds.diversityBonus, 0.0, 0.5);
        requireRange("thresholds.rimpullGearTolerancePct", thresholds.rimpullGearTolerancePct, 0.0, 100.0);
        require(thresholds.visibility <= thresholds.acceptance,
                "thresholds.visibility must not exceed thresholds.acceptance");

        require(scoring != null, "scoring missing");
        requireUnit("scoring.tierShare", scoring.tierShare);
        requireUnit("scoring.methodShare", scoring.methodShare);
        require(Math.abs(scoring.tierShare + scoring.methodShare - 1.0) < 1e-9,
                "scoring.tierShare + scoring.methodShare must equal 1");
        requireUnit("scoring.unknownUnitFactor", scoring.unknownUnitFactor);
        requireUnit("scoring.outOfRangeFactor", scoring.outOfRangeFactor);
        require(scoring.tierWeights != null && !scoring.tierWeights.isEmpty(), "scoring.tierWeights missing");
        requireEnumKeys("scoring.tierWeights", scoring.tierWeights, SourceTier.class);
        scoring.tierWeights.forEach((k, v) -> requireUnit("scoring.tierWeights." + k, v));
        require(scoring.methodWeights != null && !scoring.methodWeights.isEmpty(), "scoring.methodWeights missing");
        requireEnumKeys("scoring.methodWeights", scoring.methodWeights, ExtractionMethod.class);
        scoring.methodWeights.forEach((k, v) -> requireUnit("scoring.methodWeights." + k, v));

        require(unitConversions != null, "unitConversions missing");
        for (Map.Entry<String, Map<String, Double>> e : unitConversions.entrySet()) {
            Map<String, Double> table = e.getValue();
            require(table != null && !table.isEmpty(), "unitConversions." + e.getKey() + " is empty");
            for (Map.Entry<String, Double> t : table.entrySet()) {
                Double f = t.getValue();
                require(f != null && f > 0 && Double.isFinite(f),
                        "unitConversions." + e.getKey() + "." + t.getKey() + " must be a positive factor");
            }
        }

        require(parameters != null && !parameters.isEmpty(), "parameters missing");
        for (Map.Entry<String, ParameterBounds> e : parameters.entrySet()) {
            String p = "parameters." + e.getKey();
            ParameterBounds b = e.getValue();
            require(b != null, p + " is empty");
            if (b.unit == null) {
                continue; // text parameter
            }
            require(unitConversions.containsKey(b.unit), p + ".unit " + b.unit + " has no conversion table");
            require(b.plausibleMin != null && b.plausibleMax != null && b.plausibleMin < b.plausibleMax,
                    p + " plausible range invalid");
            require(b.qaMin != null && b.qaMax != null && b.qaMin < b.qaMax, p + " QA range invalid");
            require(b.qaMin >= 0, p + ".qaMin must not be negative");
            requireRange(p + ".tolerancePct", b.tolerancePct, 0.0, 100.0);
        }
        for (String core : coreParameters) {
            require(parameters.containsKey(core), "coreParameters." + core + " is not a configured parameter");
        }
        require(domains != null, "domains missing");
    }

    public ParameterBounds bounds(String parameterName) {
        return parameters.get(parameterName);
    }

    /**
     * Factor converting a value written with {@code token} into {@code canonicalUnit}; empty when the
     * token is not known for that unit.
     */
    public OptionalDouble conversionFactor(String canonicalUnit, String token) {
        if (canonicalUnit == null || token == null) return OptionalDouble.empty();
        Map<String, Double> table = unitConversions.get(canonicalUnit);
        if (table == null) return OptionalDouble.empty();
        Double f = table.get(normalizeUnitToken(token));
        return f == null ? OptionalDouble.empty() : OptionalDouble.of(f);
    }

    /**
     * Lower-cases a unit token, folds superscripts and dots and collapses whitespace so that
     * {@code "M³"}, {@code "m3"} and {@code " m 3 "} compare equal.
     */
    public static String normalizeUnitToken(String token) {
        String t = token.toLowerCase(Locale.ROOT)
                .replace('³', '3')
                .replace('²', '2')
                .replace('·', '.')
                .replace('\u00A0', ' ')
                .trim();
        t = t.replaceAll("\\s+", " ").replace(". ", " ");
        while (t.endsWith(".") || t.endsWith(")") || t.endsWith(",")) {
            t = t.substring(0, t.length() - 1).trim();
        }
        while (t.startsWith("(")) {
            t = t.substring(1).trim();
        }
        return t;
    }

    /** Every key must name a constant of {@code type} and every constant must have an entry. */
    private static <E extends Enum<E>> void requireEnumKeys(String name, Map<String, Double> weights, Class<E> type) {
        Set<String> expected = new TreeSet<>();
        for (E constant : type.getEnumConstants()) {
            expected.add(constant.name());
        }
        for (String key : weights.keySet()) {
            require(expected.contains(key), name + "." + key + " is not one of " + expected);
        }
        for (String constant : expected) {
            require(weights.get(constant) != null, name + "." + constant + " missing");
        }
    }

    private static void requireUnit(String name, double v) {
        requireRange(name, v, 0.0, 1.0);
    }

    private static void requireRange(String name, double v, double min, double max) {
        require(!Double.isNaN(v) && v >= min && v <= max, name + " must be within [" + min + "," + max + "]: " + v);
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException("Invalid engine configuration: " + message);
        }
    }

    // --------- Nested config DTOs for JSON mapping ---------
    public static class Thresholds {
        /** Confidence a cluster mass and a candidate must exceed for a VALIDATED record. */
        public double acceptance = 0.6;
        /** A rival cluster with mass at or above this share of the winner's mass makes the key FLAGGED. */
        public double disagreementRatio = 0.5;
        /** Clusters with mass above this are reported as conflicting. */
        public double visibility = 0.2;
        /** Added to a record's confidence per extra distinct source tier among the supporters. */
        public double diversityBonus = 0.05;
        /** Peak force disagreement per gear, in percent, above which merged rimpull curves are flagged. */
        public double rimpullGearTolerancePct = 10.0;
    }

    public static class Scoring {
        public double tierShare = 0.6;
        public double methodShare = 0.4;
        public double unknownUnitFactor = 0.6;
        public double outOfRangeFactor = 0.25;
        public Map<String, Double> tierWeights = new LinkedHashMap<>();
        public Map<String, Double> methodWeights = new LinkedHashMap<>();
    }

    public static class ParameterBounds {
        public ParameterBounds() {} // for JSON mapping
        public ParameterBounds(String unit, Double plausibleMin, Double plausibleMax, Double qaMin, Double qaMax,
                               double tolerancePct) {
            this.unit = unit;
            this.plausibleMin = plausibleMin;
            this.plausibleMax = plausibleMax;
            this.qaMin = qaMin;
            this.qaMax = qaMax;
            this.tolerancePct = tolerancePct;
        }
        /** Canonical unit; null for text parameters. */
        public String unit;
        public Double plausibleMin;
        public Double plausibleMax;
        public Double qaMin;
        public Double qaMax;
        public double tolerancePct = 2.0;

        public boolean isText() {
            return unit == null;
        }
    }

    public static class Domains {
        /** Brand -> domains owned by that manufacturer. */
        public Map<String, List<String>> oem = new LinkedHashMap<>();
        public List<String> specDatabases = List.of();
        public List<String> industryPublications = List.of();
        /** Substrings that mark a dealer or rental site. */
        public List<String> dealerPatterns = List.of();
    }
}
