package org.smileyface.minespec.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.smileyface.minespec.model.ContentType;
import org.smileyface.minespec.model.RawDocument;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts an HTML page into a {@link RawDocument}: the visible body text and every table, with
 * definition lists ({@code <dl>}) read as two-column tables.
 */
public final class HtmlDocumentParser {

    /** Upper bound on how many columns a single {@code colspan} may expand to. */
    static final int MAX_COLSPAN = 20;

    private static final String NOISE = "script, style, noscript, nav, footer, template, svg";

    /**
     * Parses the provided HTML. Scripts, styles, navigation and footers are removed before the text is
     * taken; tables keep document order and nested tables are read as tables of their own.
     *
     * @param url       the address the HTML was fetched from (used as document reference)
     * @param html      the HTML content string (may be null/blank)
     * @param fetchedAt when the page was fetched
     * @return the document, with empty text and no tables for blank input
     */
    public RawDocument parse(String url, String html, Instant fetchedAt) {
        if (html == null || html.isBlank()) {
            return new RawDocument(url, ContentType.HTML, "", List.of(), fetchedAt);
        }
        Document doc = Jsoup.parse(html, url);
        doc.select(NOISE).remove();
        Element root = doc.body() != null ? doc.body() : doc;

        List<List<List<String>>> tables = new ArrayList<>();
        for (Element table : root.select("table")) {
            List<List<String>> rows = readTable(table);
            if (!rows.isEmpty()) tables.add(rows);
        }
        for (Element dl : root.select("dl")) {
            List<List<String>> rows = readDefinitionList(dl);
            if (!rows.isEmpty()) tables.add(rows);
        }
        return new RawDocument(url, ContentType.HTML, root.text(), tables, fetchedAt);
    }

    private List<List<String>> readTable(Element table) {
        List<List<String>> rows = new ArrayList<>();
        for (Element tr : ownRows(table)) {
            List<String> cells = new ArrayList<>();
            for (Element cell : tr.children()) {
                if (!cell.is("td, th")) continue;
                String text = cell.text().trim();
                int span = colspan(cell);
                for (int i = 0; i < span; i++) {
                    cells.add(text);
                }
            }
            if (cells.stream().anyMatch(c -> !c.isEmpty())) {
                rows.add(cells);
            }
        }
        return rows;
    }

    // Rows of this table only; rows of nested tables belong to those tables.
    private static List<Element> ownRows(Element table) {
        List<Element> rows = new ArrayList<>();
        for (Element child : table.children()) {
            if (child.is("tr")) {
                rows.add(child);
            } else if (child.is("thead, tbody, tfoot")) {
                for (Element tr : child.children()) {
                    if (tr.is("tr")) rows.add(tr);
                }
            }
        }
        return rows;
    }

    private List<List<String>> readDefinitionList(Element dl) {
        List<List<String>> rows = new ArrayList<>();
        String term = null;
        for (Element child : dl.children()) {
            if (child.is("dt")) {
                term = child.text().trim();
            } else if (child.is("dd") && term != null) {
                rows.add(List.of(term, child.text().trim()));
                term = null;
            }
        }
        return rows;
    }

    private static int colspan(Element cell) {
        String raw = cell.attr("colspan").trim();
        if (raw.isEmpty()) return 1;
        try {
            return Math.max(1, Math.min(MAX_COLSPAN, Integer.parseInt(raw)));
        } catch (NumberFormatException e) {
            return 1;
        }
    }
}
