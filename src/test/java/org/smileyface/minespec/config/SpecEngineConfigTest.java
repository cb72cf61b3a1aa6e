package org.smileyface.minespec.config;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class SpecEngineConfigTest {

    @Test
    void loadsDefaultResource() {
        SpecEngineConfig cfg = SpecEngineConfig.load(null);

        assertEquals(0.6, cfg.thresholds.acceptance, 1e-9);
        assertThat(cfg.coreParameters).containsExactly("operating_weight_kg", "engine_power_kw", "engine_model");
        assertThat(cfg.bounds("operating_weight_kg").unit).isEqualTo("kg");
        assertThat(cfg.bounds("engine_model").isText()).isTrue();
        assertThat(cfg.domains.oem.get("caterpillar")).contains("cat.com");
    }

    @Test
    void conversionFactorsIgnoreCaseAndPunctuation() {
        SpecEngineConfig cfg = SpecEngineConfig.load(SpecEngineConfig.DEFAULT_RESOURCE);

        assertEquals(0.45359237, cfg.conversionFactor("kg", "LBS.").getAsDouble(), 1e-12);
        assertEquals(1.0, cfg.conversionFactor("m3", "M³").getAsDouble(), 1e-12);
        assertEquals(1000.0, cfg.conversionFactor("kg", "(t)").getAsDouble(), 1e-12);
        assertThat(cfg.conversionFactor("kg", "furlongs")).isEmpty();
        assertThat(cfg.conversionFactor("parsec", "kg")).isEmpty();
        assertThat(cfg.conversionFactor(null, "kg")).isEmpty();
    }

    @Test
    void normalizesUnitTokens() {
        assertThat(SpecEngineConfig.normalizeUnitToken(" Cu.  Yd ")).isEqualTo("cu yd");
        assertThat(SpecEngineConfig.normalizeUnitToken("m²")).isEqualTo("m2");
        assertThat(SpecEngineConfig.normalizeUnitToken("(kW),")).isEqualTo("kw");
    }

    @Test
    void missingResourceFails() {
        assertThatThrownBy(() -> SpecEngineConfig.load("does-not-exist.json"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void unknownFieldsFailTheLoad() {
        assertThatThrownBy(() -> SpecEngineConfig.load("SpecEngineConfig-unknown-field.json"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Failed to read");
    }

    @Test
    void thresholdOutOfRangeIsRejected() {
        SpecEngineConfig cfg = SpecEngineConfig.load(null);
        cfg.thresholds.acceptance = 1.5;

        assertThatThrownBy(cfg::validate)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("thresholds.acceptance");
    }

    @Test
    void visibilityAboveAcceptanceIsRejected() {
        SpecEngineConfig cfg = SpecEngineConfig.load(null);
        cfg.thresholds.visibility = 0.9;

        assertThatThrownBy(cfg::validate).hasMessageContaining("visibility");
    }

    @Test
    void sharesMustAddUp() {
        SpecEngineConfig cfg = SpecEngineConfig.load(null);
        cfg.scoring.methodShare = 0.5;

        assertThatThrownBy(cfg::validate).hasMessageContaining("must equal 1");
    }

    @Test
    void parameterUnitNeedsConversionTable() {
        SpecEngineConfig cfg = SpecEngineConfig.load(null);
        cfg.parameters.put("boom_length_ft", new SpecEngineConfig.ParameterBounds("ft", 1.0, 100.0, 0.5, 200.0, 2.0));

        assertThatThrownBy(cfg::validate).hasMessageContaining("boom_length_ft.unit ft");
    }

    @Test
    void invertedRangeIsRejected() {
        SpecEngineConfig cfg = SpecEngineConfig.load(null);
        cfg.parameters.put("operating_weight_kg",
                new SpecEngineConfig.ParameterBounds("kg", 10000.0, 5000.0, 100.0, 200000.0, 1.0));

        assertThatThrownBy(cfg::validate).hasMessageContaining("plausible range invalid");
    }

    @Test
    void coreParameterMustBeConfigured() {
        SpecEngineConfig cfg = SpecEngineConfig.load(null);
        cfg.coreParameters = List.of("operating_weight_kg", "bucket_teeth");

        assertThatThrownBy(cfg::validate).hasMessageContaining("coreParameters.bucket_teeth");
    }

    @Test
    void misspelledTierWeightIsRejected() {
        SpecEngineConfig cfg = SpecEngineConfig.load(null);
        cfg.scoring.tierWeights = new LinkedHashMap<>(Map.of("OEM_PRIMRY", 1.0, "DEALER", 0.7));

        assertThatThrownBy(cfg::validate)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("scoring.tierWeights.OEM_PRIMRY is not one of");
    }

    @Test
    void everyExtractionMethodNeedsAWeight() {
        SpecEngineConfig cfg = SpecEngineConfig.load(null);
        cfg.scoring.methodWeights.remove("REGEX");

        assertThatThrownBy(cfg::validate).hasMessageContaining("scoring.methodWeights.REGEX missing");
    }
}
