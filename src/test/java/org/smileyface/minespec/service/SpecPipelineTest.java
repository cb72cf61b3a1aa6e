package org.smileyface.minespec.service;

import org.junit.jupiter.api.Test;
import org.smileyface.minespec.model.ContentType;
import org.smileyface.minespec.model.RawDocument;
import org.smileyface.minespec.model.RimpullCurve;
import org.smileyface.minespec.model.RimpullPoint;
import org.smileyface.minespec.model.ScoredCandidate;
import org.smileyface.minespec.model.SourceTier;
import org.smileyface.minespec.model.SpecKey;
import org.smileyface.minespec.model.SpecStatus;
import org.smileyface.minespec.model.ValidatedSpec;
import org.smileyface.minespec.testutil.TestPipelines;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.smileyface.minespec.testutil.Candidates.BRAND;
import static org.smileyface.minespec.testutil.Candidates.MODEL;
import static org.smileyface.minespec.testutil.Candidates.curve;
import static org.smileyface.minespec.testutil.Candidates.scored;
import static org.smileyface.minespec.testutil.Candidates.weight;

class SpecPipelineTest {

    private static final SpecKey WEIGHT = new SpecKey(BRAND, MODEL, "operating_weight_kg");

    private final SpecPipeline pipeline = TestPipelines.defaultPipeline();

    @Test
    void processScoresCandidatesWithTheDocumentTier() {
        RawDocument doc = new RawDocument("https://www.cat.com/793f", ContentType.HTML, "", List.of(
                List.of(List.of("Operating weight", "180 000 kg"), List.of("Engine model", "Cat C175-16")),
                List.of(List.of("Gear", "Speed (km/h)", "Rimpull (kN)"),
                        List.of("1", "5.2", "780"),
                        List.of("2", "9.8", "450"))),
                Instant.parse("2024-05-01T00:00:00Z"));

        SpecPipeline.DocumentResult result = pipeline.process(doc, BRAND, MODEL);

        assertThat(result.tier()).isEqualTo(SourceTier.OEM_PRIMARY);
        assertThat(result.candidates())
                .filteredOn(c -> c.key().equals(WEIGHT))
                .singleElement()
                .satisfies(c -> {
                    assertThat(c.getCandidate().getNormalizedValue()).isEqualTo(180000.0);
                    assertThat(c.getConfidence()).isEqualTo(1.0);
                });
        assertThat(result.curves()).singleElement()
                .satisfies(c -> assertThat(c.getSourceTier()).isEqualTo(SourceTier.OEM_PRIMARY));
    }

    @Test
    void deriveReconcilesAndPassesQa() {
        Optional<ValidatedSpec> spec = pipeline.derive(WEIGHT, List.of(
                weight(180000, 0.9, SourceTier.OEM_PRIMARY, "https://cat.com/a"),
                weight(181000, 0.7, SourceTier.DEALER, "https://dealer.example/b")));

        assertThat(spec).isPresent();
        assertThat(spec.get().getStatus()).isEqualTo(SpecStatus.VALIDATED);
        assertThat(spec.get().getSupportingCandidates()).hasSize(2);
    }

    @Test
    void deriveRejectsImplausibleRecords() {
        Optional<ValidatedSpec> spec = pipeline.derive(WEIGHT, List.of(
                weight(1000, 0.9, SourceTier.OEM_PRIMARY, "https://cat.com/a")));

        assertThat(spec).isPresent();
        assertThat(spec.get().getStatus()).isEqualTo(SpecStatus.REJECTED);
        assertThat(spec.get().getStatusReason()).isEqualTo("value 1000 below minimum 5000 kg");
    }

    @Test
    void deriveOfNothingIsEmpty() {
        assertThat(pipeline.derive(WEIGHT, List.of())).isEmpty();
    }

    @Test
    void deriveAllCoversEveryKey() {
        List<ScoredCandidate> candidates = List.of(
                weight(180000, 0.9, SourceTier.OEM_PRIMARY, "https://cat.com/a"),
                scored("engine_power_kw", 1976.0, "kW", 0.9, SourceTier.OEM_PRIMARY, "https://cat.com/a"),
                scored("engine_model", "Cat C175-16", null, 0.8, SourceTier.OEM_PRIMARY, "https://cat.com/a"));

        List<ValidatedSpec> specs = pipeline.deriveAll(candidates);

        assertThat(specs).extracting(ValidatedSpec::getParameterName)
                .containsExactly("engine_model", "engine_power_kw", "operating_weight_kg");
        assertThat(specs).allSatisfy(s -> assertThat(s.getStatus()).isEqualTo(SpecStatus.VALIDATED));
    }

    @Test
    void mergeCurvesSkipsUnusableCurves() {
        RimpullCurve single = curve(SourceTier.OEM_PRIMARY, "https://cat.com/a.pdf", new RimpullPoint(1, 5.0, 780.0));
        RimpullCurve full = curve(SourceTier.DEALER, "https://dealer.example/b",
                new RimpullPoint(1, 5.0, 770.0), new RimpullPoint(2, 9.8, 450.0));

        Optional<RimpullCurve> merged = pipeline.mergeCurves(List.of(single, full));

        assertThat(merged).isPresent();
        assertThat(merged.get().getSourceDocumentRef()).isEqualTo("https://dealer.example/b");
        assertThat(merged.get().getViolations()).isEmpty();
    }

    @Test
    void mergeCurvesOfOnlyUnusableCurvesIsEmpty() {
        RimpullCurve single = curve(SourceTier.OEM_PRIMARY, "https://cat.com/a.pdf", new RimpullPoint(1, 5.0, 780.0));
        assertThat(pipeline.mergeCurves(List.of(single))).isEmpty();
    }
}
