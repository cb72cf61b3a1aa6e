package org.smileyface.minespec.scoring;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.smileyface.minespec.config.SpecEngineConfig;
import org.smileyface.minespec.model.ExtractionCandidate;
import org.smileyface.minespec.model.ExtractionMethod;
import org.smileyface.minespec.model.ScoredCandidate;
import org.smileyface.minespec.model.SourceTier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.smileyface.minespec.testutil.Candidates.candidate;

class ConfidenceScorerTest {

    private static ConfidenceScorer scorer;

    @BeforeAll
    static void setUp() {
        scorer = new ConfidenceScorer(SpecEngineConfig.load(null));
    }

    private static ExtractionCandidate regex(String parameter, Object value, String unit) {
        return new ExtractionCandidate("Caterpillar", "793F", parameter, "raw", value, unit,
                ExtractionMethod.REGEX, "https://www.cat.com/793f", "text[0,10)");
    }

    @Test
    void tierAndMethodWeightsCombine() {
        ExtractionCandidate table = candidate("operating_weight_kg", 180000.0, "kg", "https://www.cat.com/793f");
        assertThat(scorer.score(table, SourceTier.OEM_PRIMARY).getConfidence()).isEqualTo(1.0);
        assertThat(scorer.score(table, SourceTier.DEALER).getConfidence()).isEqualTo(0.82);

        ExtractionCandidate text = regex("operating_weight_kg", 180000.0, "kg");
        assertThat(scorer.score(text, SourceTier.OEM_SECONDARY).getConfidence()).isEqualTo(0.86);
        assertThat(scorer.score(text, SourceTier.UNKNOWN).getConfidence()).isEqualTo(0.56);
    }

    @Test
    void unknownUnitAndImplausibleValuesAreDiscounted() {
        ExtractionCandidate noUnit = candidate("operating_weight_kg", 180000.0, null, "https://www.cat.com/793f");
        assertThat(scorer.score(noUnit, SourceTier.OEM_PRIMARY).getConfidence()).isEqualTo(0.6);

        ExtractionCandidate tooLight = candidate("operating_weight_kg", 500.0, "kg", "https://www.cat.com/793f");
        assertThat(scorer.score(tooLight, SourceTier.OEM_PRIMARY).getConfidence()).isEqualTo(0.25);
    }

    @Test
    void textParametersAreAlwaysPlausible() {
        ExtractionCandidate engine = candidate("engine_model", "Cat C27", null, "https://www.cat.com/793f");
        assertThat(scorer.score(engine, SourceTier.THIRD_PARTY).getConfidence()).isEqualTo(0.7);
    }

    @Test
    void missingTierScoresAsUnknown() {
        ScoredCandidate s = scorer.score(candidate("operating_weight_kg", 180000.0, "kg", "x"), null);
        assertThat(s.getSourceTier()).isEqualTo(SourceTier.UNKNOWN);
        assertThat(s.getConfidence()).isEqualTo(0.64);
    }

    @Test
    void scoringIsPureAndKeepsOrder() {
        List<ExtractionCandidate> input = List.of(
                candidate("operating_weight_kg", 180000.0, "kg", "a"),
                regex("engine_power_kw", 432.0, "kW"));
        List<ScoredCandidate> first = scorer.scoreAll(input, SourceTier.OEM_PRIMARY);
        List<ScoredCandidate> second = scorer.scoreAll(input, SourceTier.OEM_PRIMARY);
        assertThat(first).isEqualTo(second);
        assertThat(first).extracting(ScoredCandidate::getCandidate).containsExactlyElementsOf(input);
        assertThat(first).allSatisfy(s -> assertThat(s.getConfidence()).isBetween(0.0, 1.0));
    }
}
