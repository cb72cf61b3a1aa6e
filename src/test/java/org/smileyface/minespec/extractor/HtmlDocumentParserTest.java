package org.smileyface.minespec.extractor;

import org.junit.jupiter.api.Test;
import org.smileyface.minespec.model.ContentType;
import org.smileyface.minespec.model.RawDocument;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HtmlDocumentParserTest {

    private static final String URL = "https://www.cat.com/en_US/products/new/equipment/off-highway-trucks/793f.html";
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final HtmlDocumentParser parser = new HtmlDocumentParser();

    @Test
    void dropsScriptsAndNavigation() {
        String html = "<html><head><style>.x{}</style></head><body>"
                + "<nav>Products Dealers Careers</nav>"
                + "<script>var weight = 1;</script>"
                + "<p>Payload class 227 t</p>"
                + "<footer>Copyright</footer></body></html>";

        RawDocument doc = parser.parse(URL, html, NOW);

        assertThat(doc.getText()).isEqualTo("Payload class 227 t");
        assertThat(doc.getContentType()).isEqualTo(ContentType.HTML);
        assertThat(doc.getSourceDomain()).isEqualTo("cat.com");
        assertThat(doc.getFetchedAt()).isEqualTo(NOW);
    }

    @Test
    void readsTablesInDocumentOrderWithColspan() {
        String html = "<table>"
                + "<thead><tr><th colspan=\"2\">Engine</th></tr></thead>"
                + "<tbody><tr><td>Gross power</td><td>1976 kW</td></tr>"
                + "<tr><td></td><td></td></tr></tbody></table>"
                + "<table><tr><td>Operating weight</td><td>180 000 kg</td></tr></table>";

        RawDocument doc = parser.parse(URL, html, NOW);

        assertThat(doc.getTables()).containsExactly(
                List.of(List.of("Engine", "Engine"), List.of("Gross power", "1976 kW")),
                List.of(List.of("Operating weight", "180 000 kg")));
    }

    @Test
    void nestedTablesAreSeparate() {
        String html = "<table><tr><td>Dimensions</td><td>"
                + "<table><tr><td>Overall length</td><td>13.0 m</td></tr></table>"
                + "</td></tr></table>";

        RawDocument doc = parser.parse(URL, html, NOW);

        assertThat(doc.getTables()).hasSize(2);
        assertThat(doc.getTables().get(0)).hasSize(1);
        assertThat(doc.getTables().get(1)).containsExactly(List.of("Overall length", "13.0 m"));
    }

    @Test
    void colspanIsBounded() {
        String html = "<table><tr><td colspan=\"5000\">wide</td></tr><tr><td colspan=\"abc\">x</td></tr></table>";

        List<List<String>> rows = parser.parse(URL, html, NOW).getTables().get(0);

        assertThat(rows.get(0)).hasSize(HtmlDocumentParser.MAX_COLSPAN);
        assertThat(rows.get(1)).containsExactly("x");
    }

    @Test
    void definitionListsBecomeTwoColumnTables() {
        String html = "<dl><dt>Peso operativo</dt><dd>180.000 kg</dd><dt>Orphan</dt></dl>";

        RawDocument doc = parser.parse(URL, html, NOW);

        assertThat(doc.getTables()).containsExactly(List.of(List.of("Peso operativo", "180.000 kg")));
    }

    @Test
    void blankInputGivesEmptyDocument() {
        RawDocument doc = parser.parse(URL, "  ", NOW);
        assertThat(doc.getText()).isEmpty();
        assertThat(doc.getTables()).isEmpty();
    }
}
