package org.smileyface.minespec.extractor;

import org.smileyface.minespec.config.SpecEngineConfig;
import org.smileyface.minespec.model.ExtractionCandidate;
import org.smileyface.minespec.model.ExtractionMethod;
import org.smileyface.minespec.model.RawDocument;
import org.smileyface.minespec.model.RimpullCurve;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns a {@link RawDocument} into extraction candidates for one (brand, model).
 *
 * <p>Three passes run over the document: the text patterns of every catalogued parameter, the
 * label/value cells of its tables, and rimpull tables. Parameters are matched concurrently; the
 * returned candidates are grouped in catalog order and, within a parameter, in text, table,
 * rimpull order. Values are converted to the parameter's canonical unit here and nowhere else.</p>
 *
 * <p>Extraction never throws: a failure while reading a document is logged and yields whatever was
 * found before it.</p>
 */
public class SpecExtractor {

    private static final Logger logger = LoggerFactory.getLogger(SpecExtractor.class);

    public static final int MAX_TEXT_LENGTH = 200_000;
    static final int MAX_MATCHES_PER_PATTERN = 25;
    static final int MAX_TEXT_VALUE_LENGTH = 80;
    static final int MAX_RAW_MATCH_LENGTH = 200;
    static final int MAX_HINT_LENGTH = 15;

    static final String MAX_RIMPULL = "max_rimpull_kn";
    static final String FORWARD_GEARS = "forward_gears";

    private static final List<String> UNIT_HEADERS = List.of("unit", "units", "unidad", "unidades", "uom");
    private static final Pattern BRACKETED = Pattern.compile("[(\\[]([^)\\]]{1,20})[)\\]]");
    private static final Pattern LEADING_NUMBER = Pattern.compile("\\s{0,5}[-−~≈]?\\s{0,2}\\d");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final ParameterCatalog catalog;
    private final UnitConverter converter;
    private final RimpullExtractor rimpullExtractor;

    /**
     * Result of a full extraction: the candidates and the rimpull curves read from the document.
     */
    public record ExtractionResult(List<ExtractionCandidate> candidates, List<RimpullCurve> curves) {
        public ExtractionResult {
            candidates = List.copyOf(candidates);
            curves = List.copyOf(curves);
        }

        static ExtractionResult empty() {
            return new ExtractionResult(List.of(), List.of());
        }
    }

    public SpecExtractor(SpecEngineConfig config, ParameterCatalog catalog, RimpullExtractor rimpullExtractor) {
        Objects.requireNonNull(config, "config");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.rimpullExtractor = Objects.requireNonNull(rimpullExtractor, "rimpullExtractor");
        this.converter = new UnitConverter(config);
        for (SpecParameter p : catalog.parameters()) {
            SpecEngineConfig.ParameterBounds bounds = config.bounds(p.getName());
            if (bounds == null) {
                throw new IllegalArgumentException("No configuration for parameter " + p.getName());
            }
            if (!Objects.equals(bounds.unit, p.getCanonicalUnit())) {
                throw new IllegalArgumentException("Parameter " + p.getName() + " is configured in "
                        + bounds.unit + " but extracted in " + p.getCanonicalUnit());
            }
        }
    }

    public SpecExtractor(SpecEngineConfig config) {
        this(config, ParameterCatalog.defaultCatalog(), new RimpullExtractor());
    }

    /**
     * Candidates only, see {@link #extractAll(RawDocument, String, String)}.
     */
    public List<ExtractionCandidate> extract(RawDocument doc, String brand, String model) {
        return extractAll(doc, brand, model).candidates();
    }

    /**
     * Extracts every candidate and rimpull curve for {@code brand}/{@code model} from the document.
     *
     * @return candidates in catalog order and the curves, both possibly empty
     */
    public ExtractionResult extractAll(RawDocument doc, String brand, String model) {
        if (doc == null || brand == null || model == null) return ExtractionResult.empty();
        Map<String, List<ExtractionCandidate>> byParameter = new LinkedHashMap<>();
        for (SpecParameter p : catalog.parameters()) {
            byParameter.put(p.getName(), new ArrayList<>());
        }
        List<RimpullCurve> curves = new ArrayList<>();
        try {
            String text = doc.getText();
            if (text.length() > MAX_TEXT_LENGTH) {
                logger.debug("Truncating {} characters of text from {}", text.length(), doc.getUrl());
                text = text.substring(0, MAX_TEXT_LENGTH);
            }
            final String input = text;
            List<List<ExtractionCandidate>> textMatches = catalog.parameters().parallelStream()
                    .map(p -> matchText(p, input, doc, brand, model))
                    .collect(Collectors.toList());
            for (List<ExtractionCandidate> found : textMatches) {
                for (ExtractionCandidate c : found) {
                    byParameter.get(c.getParameterName()).add(c);
                }
            }

            List<List<List<String>>> tables = doc.getTables();
            for (int t = 0; t < tables.size(); t++) {
                Optional<RimpullCurve> curve = rimpullExtractor.extract(doc, t, brand, model);
                if (curve.isPresent()) {
                    curves.add(curve.get());
                    for (ExtractionCandidate c : rimpullCandidates(curve.get(), t, doc, brand, model)) {
                        byParameter.computeIfAbsent(c.getParameterName(), k -> new ArrayList<>()).add(c);
                    }
                } else if (!rimpullExtractor.isRimpullTable(tables.get(t))) {
                    for (ExtractionCandidate c : matchTable(tables.get(t), t, doc, brand, model)) {
                        byParameter.get(c.getParameterName()).add(c);
                    }
                }
            }
        } catch (RuntimeException e) {
            logger.warn("Extraction from {} stopped early: {}", doc.getUrl(), e.toString());
        }
        List<ExtractionCandidate> out = new ArrayList<>();
        byParameter.values().forEach(out::addAll);
        logger.debug("Extracted {} candidates and {} rimpull curves for {}/{} from {}",
                out.size(), curves.size(), brand, model, doc.getUrl());
        return new ExtractionResult(out, curves);
    }

    // text

    List<ExtractionCandidate> matchText(SpecParameter p, String text, RawDocument doc, String brand, String model) {
        List<ExtractionCandidate> out = new ArrayList<>();
        if (text.isEmpty()) return out;
        List<int[]> taken = new ArrayList<>();
        for (Pattern pattern : p.getPatterns()) {
            boolean hasUnit = pattern.pattern().contains("(?<unit>");
            Matcher m = pattern.matcher(text);
            int count = 0;
            while (count < MAX_MATCHES_PER_PATTERN && m.find()) {
                count++;
                int start = m.start();
                int end = m.end();
                if (overlaps(taken, start, end)) continue;
                Optional<ExtractionCandidate> c = fromTextMatch(p, m, hasUnit, doc, brand, model);
                if (c.isPresent()) {
                    taken.add(new int[]{start, end});
                    out.add(c.get());
                } else {
                    logger.debug("No value for {} in '{}' of {}", p.getName(), m.group(), doc.getUrl());
                }
            }
        }
        return out;
    }

    private Optional<ExtractionCandidate> fromTextMatch(SpecParameter p, Matcher m, boolean hasUnit,
                                                        RawDocument doc, String brand, String model) {
        String rawValue = m.group("value");
        String raw = abbreviate(collapse(m.group()), MAX_RAW_MATCH_LENGTH);
        String span = "text[" + m.start() + "," + m.end() + ")";
        switch (p.getKind()) {
            case TEXT: {
                Optional<String> value = textValue(rawValue);
                return value.map(v -> new ExtractionCandidate(brand, model, p.getName(), raw, v, null,
                        ExtractionMethod.REGEX, doc.getUrl(), span));
            }
            case COUNT: {
                OptionalDouble n = ValueParser.parseNumber(rawValue);
                if (n.isEmpty() || n.getAsDouble() != Math.rint(n.getAsDouble())) return Optional.empty();
                return Optional.of(new ExtractionCandidate(brand, model, p.getName(), raw, n.getAsDouble(),
                        SpecParameter.COUNT_UNIT, ExtractionMethod.REGEX, doc.getUrl(), span));
            }
            default: {
                OptionalDouble n = ValueParser.parseNumber(rawValue);
                if (n.isEmpty()) return Optional.empty();
                String token = hasUnit ? m.group("unit") : null;
                OptionalDouble converted = converter.toCanonical(n.getAsDouble(), p.getCanonicalUnit(), token);
                if (converted.isPresent()) {
                    return Optional.of(new ExtractionCandidate(brand, model, p.getName(), raw,
                            converted.getAsDouble(), p.getCanonicalUnit(), ExtractionMethod.REGEX, doc.getUrl(), span));
                }
                return Optional.of(new ExtractionCandidate(brand, model, p.getName(), raw, n.getAsDouble(), null,
                        ExtractionMethod.REGEX, doc.getUrl(), span));
            }
        }
    }

    private static boolean overlaps(List<int[]> taken, int start, int end) {
        for (int[] span : taken) {
            if (start < span[1] && span[0] < end) return true;
        }
        return false;
    }

    // tables

    List<ExtractionCandidate> matchTable(List<List<String>> table, int t, RawDocument doc, String brand, String model) {
        List<ExtractionCandidate> out = new ArrayList<>();
        if (table.isEmpty()) return out;
        List<String> header = table.get(0);
        int unitColumn = unitColumn(header);

        if (isVerticalHeader(header)) {
            if (table.size() > 1) {
                List<String> values = table.get(1);
                for (int c = 0; c < header.size() && c < values.size(); c++) {
                    Optional<SpecParameter> p = catalog.lookupLabel(header.get(c));
                    if (p.isEmpty()) continue;
                    cellCandidate(p.get(), header.get(c), values.get(c), null, null, t, 1, c, doc, brand, model)
                            .ifPresent(out::add);
                }
            }
            return out;
        }

        for (int r = unitColumn >= 0 ? 1 : 0; r < table.size(); r++) {
            List<String> row = table.get(r);
            int c = 0;
            while (c < row.size()) {
                if (c == unitColumn) {
                    c++;
                    continue;
                }
                Optional<SpecParameter> p = catalog.lookupLabel(row.get(c));
                if (p.isEmpty()) {
                    c++;
                    continue;
                }
                int v = nextValueColumn(row, c + 1, unitColumn);
                if (v < 0) break;
                if (catalog.lookupLabel(row.get(v)).isPresent()) {
                    c = v;
                    continue;
                }
                String unitCell = unitColumn >= 0 && unitColumn < row.size() ? row.get(unitColumn) : null;
                String nextCell = v + 1 < row.size() && v + 1 != unitColumn ? row.get(v + 1) : null;
                Optional<ExtractionCandidate> found = cellCandidate(p.get(), row.get(c), row.get(v), unitCell, nextCell,
                        t, r, v, doc, brand, model);
                if (found.isPresent()) {
                    out.add(found.get());
                } else {
                    logger.debug("No value for {} in table {} row {} of {}", p.get().getName(), t, r, doc.getUrl());
                }
                c = v + 1;
            }
        }
        return out;
    }

    private Optional<ExtractionCandidate> cellCandidate(SpecParameter p, String label, String valueCell,
                                                        String unitCell, String nextCell, int t, int r, int c,
                                                        RawDocument doc, String brand, String model) {
        String raw = abbreviate(collapse(label) + " | " + collapse(valueCell), MAX_RAW_MATCH_LENGTH);
        String span = "table[" + t + "]:r" + r + ":c" + c;
        if (p.isText()) {
            return textValue(valueCell).map(v -> new ExtractionCandidate(brand, model, p.getName(), raw, v, null,
                    ExtractionMethod.TABLE_CELL, doc.getUrl(), span));
        }
        Optional<ValueParser.CellValue> parsed = ValueParser.parseCell(valueCell);
        if (parsed.isEmpty()) return Optional.empty();
        double value = parsed.get().value();
        if (p.getKind() == SpecParameter.Kind.COUNT) {
            if (value != Math.rint(value)) return Optional.empty();
            return Optional.of(new ExtractionCandidate(brand, model, p.getName(), raw, value, SpecParameter.COUNT_UNIT,
                    ExtractionMethod.TABLE_CELL, doc.getUrl(), span));
        }
        List<String> hints = new ArrayList<>();
        hints.add(parsed.get().unitToken());
        hints.add(bracketedUnit(label));
        hints.add(unitCell);
        if (nextCell != null && nextCell.length() <= MAX_HINT_LENGTH && nextCell.chars().noneMatch(Character::isDigit)) {
            hints.add(nextCell);
        }
        for (String hint : hints) {
            OptionalDouble converted = converter.toCanonical(value, p.getCanonicalUnit(), hint);
            if (converted.isPresent()) {
                return Optional.of(new ExtractionCandidate(brand, model, p.getName(), raw, converted.getAsDouble(),
                        p.getCanonicalUnit(), ExtractionMethod.TABLE_CELL, doc.getUrl(), span));
            }
        }
        return Optional.of(new ExtractionCandidate(brand, model, p.getName(), raw, value, null,
                ExtractionMethod.TABLE_CELL, doc.getUrl(), span));
    }

    /**
     * A header row that names at least two parameters and holds no numbers: values are in the row below.
     */
    private boolean isVerticalHeader(List<String> header) {
        int labels = 0;
        for (String cell : header) {
            if (LEADING_NUMBER.matcher(cell).lookingAt()) return false;
            if (catalog.lookupLabel(cell).isPresent()) labels++;
        }
        return labels >= 2;
    }

    private static int unitColumn(List<String> header) {
        for (int c = 0; c < header.size(); c++) {
            if (UNIT_HEADERS.contains(ParameterCatalog.normalizeLabel(header.get(c)))) return c;
        }
        return -1;
    }

    private static int nextValueColumn(List<String> row, int from, int unitColumn) {
        for (int c = from; c < row.size(); c++) {
            if (c != unitColumn && !row.get(c).isBlank()) return c;
        }
        return -1;
    }

    private static String bracketedUnit(String label) {
        Matcher m = BRACKETED.matcher(label);
        String last = null;
        while (m.find()) last = m.group(1);
        return last;
    }

    // rimpull

    private List<ExtractionCandidate> rimpullCandidates(RimpullCurve curve, int t, RawDocument doc,
                                                        String brand, String model) {
        List<ExtractionCandidate> out = new ArrayList<>();
        OptionalDouble peak = RimpullExtractor.peakForce(curve);
        if (peak.isPresent() && catalog.get(MAX_RIMPULL).isPresent()) {
            out.add(new ExtractionCandidate(brand, model, MAX_RIMPULL,
                    String.format(Locale.ROOT, "rimpull table peak %.1f kN", peak.getAsDouble()),
                    peak.getAsDouble(), "kN", ExtractionMethod.RIMPULL_TABLE, doc.getUrl(), "table[" + t + "]:rimpull"));
        }
        int gears = curve.gears().size();
        if (gears > 0 && catalog.get(FORWARD_GEARS).isPresent()) {
            out.add(new ExtractionCandidate(brand, model, FORWARD_GEARS, "rimpull table gears " + curve.gears(),
                    (double) gears, SpecParameter.COUNT_UNIT, ExtractionMethod.RIMPULL_TABLE, doc.getUrl(),
                    "table[" + t + "]:gears"));
        }
        return out;
    }

    // helpers

    private static Optional<String> textValue(String raw) {
        if (raw == null) return Optional.empty();
        String v = collapse(raw);
        if (v.isEmpty() || ValueParser.isPlaceholder(v)) return Optional.empty();
        return Optional.of(abbreviate(v, MAX_TEXT_VALUE_LENGTH).trim());
    }

    private static String collapse(String s) {
        if (s == null) return "";
        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }

    private static String abbreviate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }
}
