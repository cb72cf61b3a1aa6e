package org.smileyface.minespec.model;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of a fetched page or brochure: its visible text and the tables found in it.
 * Each table is a list of rows; rows may have different lengths.
 */
public final class RawDocument {

    private final String url;
    private final ContentType contentType;
    private final String text;
    private final List<List<List<String>>> tables;
    private final Instant fetchedAt;
    private final String sourceDomain;

    public RawDocument(String url, ContentType contentType, String text, List<List<List<String>>> tables,
                       Instant fetchedAt) {
        this.url = Objects.requireNonNull(url, "url");
        this.contentType = Objects.requireNonNull(contentType, "contentType");
        this.text = text == null ? "" : text;
        this.tables = copyTables(tables);
        this.fetchedAt = fetchedAt == null ? Instant.EPOCH : fetchedAt;
        this.sourceDomain = domainOf(url);
    }

    public String getUrl() { return url; }
    public ContentType getContentType() { return contentType; }
    public String getText() { return text; }
    public List<List<List<String>>> getTables() { return tables; }
    public Instant getFetchedAt() { return fetchedAt; }
    public String getSourceDomain() { return sourceDomain; }

    /**
     * Lower-cased host of the URL without a leading "www.", or an empty string if the URL has no host.
     */
    public static String domainOf(String url) {
        try {
            String host = URI.create(url.trim()).getHost();
            if (host == null) return "";
            host = host.toLowerCase();
            return host.startsWith("www.") ? host.substring(4) : host;
        } catch (Exception e) {
            return "";
        }
    }

    private static List<List<List<String>>> copyTables(List<List<List<String>>> tables) {
        if (tables == null || tables.isEmpty()) return List.of();
        List<List<List<String>>> out = new ArrayList<>(tables.size());
        for (List<List<String>> table : tables) {
            if (table == null) continue;
            List<List<String>> rows = new ArrayList<>(table.size());
            for (List<String> row : table) {
                if (row == null) continue;
                List<String> cells = new ArrayList<>(row.size());
                for (String cell : row) {
                    cells.add(cell == null ? "" : cell);
                }
                rows.add(Collections.unmodifiableList(cells));
            }
            out.add(Collections.unmodifiableList(rows));
        }
        return Collections.unmodifiableList(out);
    }

    @Override
    public String toString() {
        return "RawDocument{" +
                "url='" + url + '\'' +
                ", contentType=" + contentType +
                ", textLength=" + text.length() +
                ", tables=" + tables.size() +
                ", fetchedAt=" + fetchedAt +
                '}';
    }
}
