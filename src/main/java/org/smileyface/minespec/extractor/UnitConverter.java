package org.smileyface.minespec.extractor;

import org.smileyface.minespec.config.SpecEngineConfig;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Converts values written with a unit token into a parameter's canonical unit, using the
 * configured conversion table. Conversion happens once, at extraction time.
 */
public class UnitConverter {

    private final SpecEngineConfig config;

    public UnitConverter(SpecEngineConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Factor for {@code token} into {@code canonicalUnit}. Trailing words are dropped one at a time until
     * a known token remains, so {@code "kg with bucket"} resolves to {@code kg}.
     */
    public OptionalDouble factor(String canonicalUnit, String token) {
        if (canonicalUnit == null || token == null || token.isBlank()) return OptionalDouble.empty();
        String t = SpecEngineConfig.normalizeUnitToken(token);
        while (!t.isEmpty()) {
            OptionalDouble f = config.conversionFactor(canonicalUnit, t);
            if (f.isPresent()) return f;
            int space = t.lastIndexOf(' ');
            if (space < 0) break;
            t = t.substring(0, space).trim();
        }
        return OptionalDouble.empty();
    }

    /**
     * Converts the value, or returns empty when the token is unknown for the canonical unit.
     */
    public OptionalDouble toCanonical(double value, String canonicalUnit, String token) {
        OptionalDouble f = factor(canonicalUnit, token);
        return f.isPresent() ? OptionalDouble.of(round(value * f.getAsDouble())) : OptionalDouble.empty();
    }

    /** Whether the token is a known unit for the canonical unit. */
    public boolean isUnitToken(String canonicalUnit, String token) {
        return factor(canonicalUnit, token).isPresent();
    }

    // Keeps converted values free of binary noise such as 180000.00000000003.
    static double round(double v) {
        if (v == 0 || !Double.isFinite(v)) return v;
        return new BigDecimal(v).round(new MathContext(10)).doubleValue();
    }
}
