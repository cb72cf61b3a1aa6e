package org.smileyface.minespec.extractor;

import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing of numbers, unit tokens and placeholders as they appear in spec sheets.
 *
 * <p>Numbers may carry thousands separators ({@code 180,000}, {@code 180 000}, {@code 180.000}) and a
 * decimal comma ({@code 3,5} or {@code 180.000,5}). When both separators occur, the last one is the
 * decimal separator. A single separator followed by exactly three digits is read as a thousands
 * separator unless the integer part is zero.</p>
 */
public final class ValueParser {

    /** Unsigned number with optional thousands groups and decimals; every quantifier is bounded. */
    public static final String NUMBER_REGEX =
            "\\d{1,3}(?:[,. \\u00A0]\\d{3}){1,4}(?:[.,]\\d{1,4})?|\\d{1,9}(?:[.,]\\d{1,4})?";

    private static final Pattern NUMBER = Pattern.compile("(?<![\\d.,])(?:" + NUMBER_REGEX + ")");

    private static final int MAX_CELL_LENGTH = 200;
    private static final int MAX_UNIT_TOKEN = 20;

    private static final Set<String> PLACEHOLDERS = Set.of(
            "", "-", "--", "---", "–", "—", "?", "n/a", "na", "n.a", "n/d", "nd", "s/d", "tbd", "tba",
            "tbc", "none", "not available", "no disponible", "varies", "variable", "optional", "opcional",
            "consultar", "consulte", "a consultar", "on request", "upon request", "bajo pedido", "x");

    private static final Set<String> RANGE_WORDS = Set.of("-", "–", "—", "~", "to", "a", "hasta");

    private ValueParser() {
        // utility
    }

    /**
     * Parsed numeric table cell: the (signed) value and the unit token written after it, possibly empty.
     */
    public record CellValue(double value, String unitToken) {
    }

    /**
     * Parses an unsigned number string such as {@code "180,000"} or {@code "2,5"}.
     */
    public static OptionalDouble parseNumber(String s) {
        if (s == null) return OptionalDouble.empty();
        String t = s.replace(" ", "").replace("\u00A0", "").trim();
        if (t.isEmpty()) return OptionalDouble.empty();
        int lastComma = t.lastIndexOf(',');
        int lastDot = t.lastIndexOf('.');
        String normalized;
        if (lastComma >= 0 && lastDot >= 0) {
            if (lastComma > lastDot) {
                normalized = t.replace(".", "").replace(',', '.');
            } else {
                normalized = t.replace(",", "");
            }
        } else if (lastComma >= 0) {
            normalized = resolveSingleSeparator(t, ',');
        } else if (lastDot >= 0) {
            normalized = resolveSingleSeparator(t, '.');
        } else {
            normalized = t;
        }
        try {
            double v = Double.parseDouble(normalized);
            return Double.isFinite(v) ? OptionalDouble.of(v) : OptionalDouble.empty();
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    private static String resolveSingleSeparator(String t, char sep) {
        int count = 0;
        for (int i = 0; i < t.length(); i++) {
            if (t.charAt(i) == sep) count++;
        }
        if (count > 1) {
            return t.replace(String.valueOf(sep), "");
        }
        int idx = t.indexOf(sep);
        String intPart = t.substring(0, idx);
        String frac = t.substring(idx + 1);
        boolean thousands = frac.length() == 3 && !intPart.isEmpty() && !intPart.chars().allMatch(c -> c == '0');
        return thousands ? intPart + frac : intPart + "." + frac;
    }

    /**
     * True for values that stand in for a missing number: {@code N/A}, {@code TBD}, {@code -},
     * {@code contact dealer} and similar.
     */
    public static boolean isPlaceholder(String s) {
        if (s == null) return true;
        String t = s.trim().toLowerCase(Locale.ROOT);
        while (t.endsWith(".") || t.endsWith("*")) {
            t = t.substring(0, t.length() - 1).trim();
        }
        return PLACEHOLDERS.contains(t) || t.startsWith("contact") || t.startsWith("contacte")
                || t.startsWith("ask ") || t.startsWith("see ") || t.startsWith("ver ");
    }

    /**
     * Reads the first number of a table cell together with the unit written after it. A leading minus
     * sign is kept. For ranges such as {@code 25 - 30 m3} the lower bound is returned with the unit
     * written after the upper bound.
     *
     * @return empty for placeholders, overlong cells and cells without a number
     */
    public static Optional<CellValue> parseCell(String cell) {
        if (cell == null) return Optional.empty();
        String c = cell.trim();
        if (c.length() > MAX_CELL_LENGTH || isPlaceholder(c)) return Optional.empty();
        Matcher m = NUMBER.matcher(c);
        if (!m.find()) return Optional.empty();
        OptionalDouble parsed = parseNumber(m.group());
        if (parsed.isEmpty()) return Optional.empty();
        double value = parsed.getAsDouble();
        if (isNegated(c, m.start())) {
            value = -value;
        }
        String token = unitTokenAt(c, m.end());
        if (token.isEmpty() || RANGE_WORDS.contains(token.toLowerCase(Locale.ROOT))) {
            if (m.find()) {
                String upperToken = unitTokenAt(c, m.end());
                if (!token.isEmpty() || !upperToken.isEmpty()) {
                    token = upperToken;
                }
            }
        }
        return Optional.of(new CellValue(value, token));
    }

    /**
     * Collects the unit token starting at {@code from}: characters up to the next number, bracket or
     * list separator, at most {@value #MAX_UNIT_TOKEN} characters, trimmed and cut at {@code @}.
     */
    static String unitTokenAt(String s, int from) {
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < s.length() && sb.length() < MAX_UNIT_TOKEN; i++) {
            char ch = s.charAt(i);
            if (Character.isDigit(ch) && (sb.length() == 0 || !Character.isLetter(sb.charAt(sb.length() - 1)))) {
                break; // m3, cm2 keep their digit
            }
            if (ch == '(' || ch == '[' || ch == ';' || ch == ',' || ch == '|' || ch == '@') {
                break;
            }
            sb.append(ch);
        }
        String token = sb.toString();
        int at = token.toLowerCase(Locale.ROOT).indexOf(" at ");
        if (at >= 0) token = token.substring(0, at);
        return token.trim();
    }

    private static boolean isNegated(String s, int numberStart) {
        int i = numberStart - 1;
        while (i >= 0 && s.charAt(i) == ' ') i--;
        if (i < 0) return false;
        char ch = s.charAt(i);
        if (ch != '-' && ch != '−') return false;
        return i == 0 || s.charAt(i - 1) == ' ' || s.charAt(i - 1) == '(';
    }
}
