package org.smileyface.minespec.extractor;

import org.smileyface.minespec.model.RawDocument;
import org.smileyface.minespec.model.RimpullCurve;
import org.smileyface.minespec.model.RimpullPoint;
import org.smileyface.minespec.model.SourceTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads rimpull (tractive force per gear and ground speed) tables.
 *
 * <p>A rimpull table has, within its first three rows, a header row naming a gear column, a speed
 * column and a force column in any order, in English or Spanish. Units come from the header: force
 * in kN, lbf, kgf or tf and speed in km/h or mph. Rows that are reverse or neutral gears, that lack a
 * number, or whose speed or force is out of range are dropped one by one.</p>
 */
public class RimpullExtractor {

    private static final Logger logger = LoggerFactory.getLogger(RimpullExtractor.class);

    static final int HEADER_SCAN_ROWS = 3;
    static final int MIN_POINTS = 2;
    static final int MAX_GEAR = 12;
    static final double MAX_SPEED_KPH = 80.0;
    static final double MAX_FORCE_KN = 2000.0;

    private static final double LBF_TO_KN = 0.00444822162;
    private static final double KGF_TO_KN = 0.00980665;
    private static final double TF_TO_KN = 9.80665;
    private static final double MPH_TO_KPH = 1.609344;

    private static final Set<String> GEAR_WORDS = Set.of("gear", "gears", "marcha", "marchas", "cambio", "range");
    private static final Set<String> SPEED_WORDS = Set.of("speed", "velocidad", "km/h", "kmh", "kph", "mph");
    private static final Set<String> FORCE_WORDS = Set.of("rimpull", "force", "fuerza", "pull", "traccion",
            "tractive", "kn", "lbf", "kgf", "tf");

    private static final Map<String, Integer> ORDINALS = Map.ofEntries(
            Map.entry("first", 1), Map.entry("second", 2), Map.entry("third", 3), Map.entry("fourth", 4),
            Map.entry("fifth", 5), Map.entry("sixth", 6), Map.entry("seventh", 7), Map.entry("eighth", 8),
            Map.entry("primera", 1), Map.entry("primero", 1), Map.entry("segunda", 2), Map.entry("segundo", 2),
            Map.entry("tercera", 3), Map.entry("tercero", 3), Map.entry("cuarta", 4), Map.entry("quinta", 5),
            Map.entry("sexta", 6), Map.entry("septima", 7), Map.entry("octava", 8));

    private static final Pattern GEAR_LABEL = Pattern.compile(
            "^(?:(?:gear|marcha|cambio)\\s{0,2})?f?\\s{0,2}(\\d{1,2})\\s{0,2}(?:st|nd|rd|th|a|o|ª|º|°)?"
                    + "(?:\\s{0,2}(?:gear|marcha|cambio))?$");
    private static final Pattern REVERSE_OR_NEUTRAL = Pattern.compile(
            "^(?:(?:gear|marcha|cambio)\\s{0,2})?(?:r|n|rev|reverse|reversa|retroceso|neutral|neutro|punto muerto)"
                    + "(?:\\s{0,2}\\d{1,2})?(?:\\s{0,2}(?:gear|marcha))?$");

    /**
     * Column layout of a detected rimpull table.
     */
    record Layout(int headerRow, int gearColumn, int speedColumn, int forceColumn,
                  double speedFactor, double forceFactor) {
    }

    public boolean isRimpullTable(List<List<String>> table) {
        return detect(table).isPresent();
    }

    /**
     * Reads one table of the document as a rimpull curve.
     *
     * @return the curve, or empty when the table is not a rimpull table or yields fewer than two points
     */
    public Optional<RimpullCurve> extract(RawDocument doc, int tableIndex, String brand, String model) {
        List<List<List<String>>> tables = doc.getTables();
        if (tableIndex < 0 || tableIndex >= tables.size()) return Optional.empty();
        List<List<String>> table = tables.get(tableIndex);
        Optional<Layout> layout = detect(table);
        if (layout.isEmpty()) return Optional.empty();
        Layout l = layout.get();

        List<RimpullPoint> points = new ArrayList<>();
        for (int r = l.headerRow() + 1; r < table.size(); r++) {
            List<String> row = table.get(r);
            Optional<RimpullPoint> point = readRow(row, l);
            if (point.isPresent()) {
                points.add(point.get());
            } else {
                logger.debug("Dropped rimpull row {} of table {} in {}: {}", r, tableIndex, doc.getUrl(), row);
            }
        }
        if (points.size() < MIN_POINTS) {
            logger.debug("Rimpull table {} in {} has only {} usable rows", tableIndex, doc.getUrl(), points.size());
            return Optional.empty();
        }
        return Optional.of(new RimpullCurve(brand, model, points, monotonicityViolations(points),
                doc.getUrl(), SourceTier.UNKNOWN, tableIndex));
    }

    Optional<Layout> detect(List<List<String>> table) {
        if (table == null) return Optional.empty();
        int scan = Math.min(HEADER_SCAN_ROWS, table.size());
        for (int r = 0; r < scan; r++) {
            List<String> row = table.get(r);
            int gear = -1;
            int speed = -1;
            int force = -1;
            double speedFactor = 1.0;
            double forceFactor = 1.0;
            for (int c = 0; c < row.size(); c++) {
                Set<String> words = words(row.get(c));
                if (words.isEmpty()) continue;
                if (gear < 0 && containsAny(words, GEAR_WORDS)) {
                    gear = c;
                } else if (force < 0 && containsAny(words, FORCE_WORDS)) {
                    force = c;
                    forceFactor = forceFactor(words);
                } else if (speed < 0 && containsAny(words, SPEED_WORDS)) {
                    speed = c;
                    speedFactor = words.contains("mph") ? MPH_TO_KPH : 1.0;
                }
            }
            if (gear >= 0 && speed >= 0 && force >= 0) {
                return Optional.of(new Layout(r, gear, speed, force, speedFactor, forceFactor));
            }
        }
        return Optional.empty();
    }

    private Optional<RimpullPoint> readRow(List<String> row, Layout l) {
        int needed = Math.max(l.gearColumn(), Math.max(l.speedColumn(), l.forceColumn()));
        if (row.size() <= needed) return Optional.empty();
        OptionalInt gear = parseGear(row.get(l.gearColumn()));
        if (gear.isEmpty()) return Optional.empty();
        Optional<ValueParser.CellValue> speed = ValueParser.parseCell(row.get(l.speedColumn()));
        Optional<ValueParser.CellValue> force = ValueParser.parseCell(row.get(l.forceColumn()));
        if (speed.isEmpty() || force.isEmpty()) return Optional.empty();
        double kph = UnitConverter.round(speed.get().value() * l.speedFactor());
        double kn = UnitConverter.round(force.get().value() * l.forceFactor());
        if (kph < 0 || kph > MAX_SPEED_KPH || kn <= 0 || kn > MAX_FORCE_KN) return Optional.empty();
        return Optional.of(new RimpullPoint(gear.getAsInt(), kph, kn));
    }

    /**
     * Parses gear labels such as {@code 1}, {@code 1st}, {@code first}, {@code primera},
     * {@code gear 1} and {@code F1}. Reverse and neutral labels give empty.
     */
    static OptionalInt parseGear(String cell) {
        if (cell == null) return OptionalInt.empty();
        String s = fold(cell).replace('.', ' ').replaceAll("\\s{1,20}", " ").trim();
        if (s.isEmpty() || s.length() > 20 || REVERSE_OR_NEUTRAL.matcher(s).matches()) return OptionalInt.empty();
        Integer gear = null;
        Matcher m = GEAR_LABEL.matcher(s);
        if (m.matches()) {
            gear = Integer.parseInt(m.group(1));
        } else {
            for (String w : s.split(" ")) {
                Integer ordinal = ORDINALS.get(w);
                if (ordinal != null) {
                    gear = ordinal;
                    break;
                }
            }
        }
        if (gear == null || gear < 1 || gear > MAX_GEAR) return OptionalInt.empty();
        return OptionalInt.of(gear);
    }

    /**
     * Within a gear, force must not rise as speed rises. Each rise is reported once; points are kept.
     */
    static List<String> monotonicityViolations(List<RimpullPoint> points) {
        List<String> violations = new ArrayList<>();
        points.stream().map(RimpullPoint::gear).distinct().sorted().forEach(gear -> {
            List<RimpullPoint> inGear = new ArrayList<>();
            for (RimpullPoint p : points) {
                if (p.gear() == gear) inGear.add(p);
            }
            inGear.sort(Comparator.comparingDouble(RimpullPoint::speedKph));
            for (int i = 1; i < inGear.size(); i++) {
                RimpullPoint prev = inGear.get(i - 1);
                RimpullPoint cur = inGear.get(i);
                if (cur.speedKph() > prev.speedKph() && cur.forceKn() > prev.forceKn()) {
                    violations.add(String.format(Locale.ROOT,
                            "gear %d: force rises from %.1f kN at %.1f km/h to %.1f kN at %.1f km/h",
                            gear, prev.forceKn(), prev.speedKph(), cur.forceKn(), cur.speedKph()));
                }
            }
        });
        return violations;
    }

    /** Highest force over all gears. */
    static OptionalDouble peakForce(RimpullCurve curve) {
        return curve.getPoints().stream().mapToDouble(RimpullPoint::forceKn).max();
    }

    private static double forceFactor(Set<String> words) {
        if (words.contains("lbf") || words.contains("lb") || words.contains("lbs")) return LBF_TO_KN;
        if (words.contains("kgf") || words.contains("kg")) return KGF_TO_KN;
        if (words.contains("tf") || words.contains("ton") || words.contains("tons") || words.contains("tonf")) {
            return TF_TO_KN;
        }
        return 1.0;
    }

    private static Set<String> words(String cell) {
        if (cell == null || cell.isBlank() || cell.length() > 80) return Set.of();
        Set<String> words = new HashSet<>();
        for (String w : fold(cell).split("[^a-z0-9/]+")) {
            if (!w.isEmpty()) words.add(w);
        }
        return words;
    }

    private static boolean containsAny(Set<String> words, Set<String> vocabulary) {
        for (String w : words) {
            if (vocabulary.contains(w)) return true;
        }
        return false;
    }

    private static String fold(String s) {
        return Normalizer.normalize(s, Normalizer.Form.NFD).replaceAll("\\p{M}", "").toLowerCase(Locale.ROOT).trim();
    }
}
