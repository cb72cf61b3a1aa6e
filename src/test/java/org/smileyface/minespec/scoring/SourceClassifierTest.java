package org.smileyface.minespec.scoring;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.smileyface.minespec.config.SpecEngineConfig;
import org.smileyface.minespec.model.ContentType;
import org.smileyface.minespec.model.SourceTier;

import static org.assertj.core.api.Assertions.assertThat;

class SourceClassifierTest {

    private static SourceClassifier classifier;

    @BeforeAll
    static void setUp() {
        classifier = new SourceClassifier(SpecEngineConfig.load(null));
    }

    @ParameterizedTest
    @CsvSource({
            "https://www.cat.com/en_US/products/793f.html, HTML, Caterpillar, OEM_PRIMARY",
            "https://s7d2.scene7.caterpillar.com/is/content/793F.html, HTML, Caterpillar, OEM_PRIMARY",
            "https://www.komatsu.com/en/products/930e, HTML, Caterpillar, OEM_SECONDARY",
            "https://www.ritchiespecs.com/model/caterpillar-793f, HTML, Caterpillar, DEALER",
            "https://www.mining.com/web/cat-793f-review, HTML, Caterpillar, THIRD_PARTY",
            "https://www.finning.com/en_CA/products/793f, HTML, Caterpillar, DEALER",
            "https://brochures.example.org/793f, PDF, Caterpillar, OEM_SECONDARY",
            "https://files.example.org/793F.pdf?v=2, HTML, Caterpillar, OEM_SECONDARY",
            "https://forum.example.org/793f, HTML, Caterpillar, UNKNOWN",
            "https://www.cat.com/793f, HTML, Komatsu, OEM_SECONDARY"
    })
    void classifiesByDomain(String url, ContentType type, String brand, SourceTier expected) {
        assertThat(classifier.classify(url, type, brand)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"not a url", "''"})
    void unparseableUrlIsUnknown(String url) {
        assertThat(classifier.classify(url, ContentType.HTML, "Caterpillar")).isEqualTo(SourceTier.UNKNOWN);
    }
}
