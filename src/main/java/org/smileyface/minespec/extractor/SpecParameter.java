package org.smileyface.minespec.extractor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One entry of the {@link ParameterCatalog}: the parameter name, its kind and canonical unit, the
 * regular expressions that find it in running text and the labels that name it in tables.
 *
 * <p>Every text pattern exposes a named group {@code value} and, for numeric parameters, a named group
 * {@code unit}.</p>
 */
public final class SpecParameter {

    public enum Kind {
        /** Physical quantity with a canonical unit. */
        NUMERIC,
        /** Whole number without a unit (cylinders, gears). */
        COUNT,
        /** Free text such as an engine model or emission standard. */
        TEXT
    }

    /** Canonical "unit" recorded for {@link Kind#COUNT} parameters. */
    public static final String COUNT_UNIT = "count";

    private final String name;
    private final Kind kind;
    private final String canonicalUnit;
    private final List<Pattern> patterns;
    private final List<String> aliases;

    private SpecParameter(String name, Kind kind, String canonicalUnit, List<Pattern> patterns, List<String> aliases) {
        this.name = name;
        this.kind = kind;
        this.canonicalUnit = canonicalUnit;
        this.patterns = List.copyOf(patterns);
        this.aliases = List.copyOf(aliases);
    }

    public String getName() { return name; }
    public Kind getKind() { return kind; }
    /** Canonical unit, {@value #COUNT_UNIT} for counts, null for text parameters. */
    public String getCanonicalUnit() { return canonicalUnit; }
    public List<Pattern> getPatterns() { return patterns; }
    public List<String> getAliases() { return aliases; }

    public boolean isText() {
        return kind == Kind.TEXT;
    }

    static Builder numeric(String name, String canonicalUnit) {
        return new Builder(name, Kind.NUMERIC, Objects.requireNonNull(canonicalUnit, "canonicalUnit"));
    }

    static Builder count(String name) {
        return new Builder(name, Kind.COUNT, COUNT_UNIT);
    }

    static Builder text(String name) {
        return new Builder(name, Kind.TEXT, null);
    }

    @Override
    public String toString() {
        return "SpecParameter{" + name + ", " + kind + (canonicalUnit != null ? ", " + canonicalUnit : "") + '}';
    }

    static final class Builder {
        private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

        /** Optional bracketed qualifier after a label, e.g. "(with bucket)". */
        private static final String LABEL_SUFFIX = "(?:\\s{0,3}[(\\[][^)\\]\\n]{0,40}[)\\]])?";
        /** Separator between a label and its value. */
        private static final String SEP = "[\\s:=\\-–—*]{0,10}"
                + "(?:(?:of|approx\\.?|aprox\\.?|approximately|aproximadamente|up\\s{1,2}to|hasta|de)[\\s:]{1,5}){0,2}";
        private static final String VALUE = "(?<value>" + ValueParser.NUMBER_REGEX + ")";

        private final String name;
        private final Kind kind;
        private final String canonicalUnit;
        private final List<Pattern> patterns = new ArrayList<>();
        private final List<String> aliases = new ArrayList<>();

        private Builder(String name, Kind kind, String canonicalUnit) {
            this.name = Objects.requireNonNull(name, "name");
            this.kind = kind;
            this.canonicalUnit = canonicalUnit;
        }

        /**
         * Label followed by a number and one of the unit alternatives.
         */
        Builder label(String labelRegex, String unitAlternatives) {
            return raw("(?<![\\p{L}])(?:" + labelRegex + ")" + LABEL_SUFFIX + SEP + VALUE
                    + "\\s{0,3}(?<unit>" + unitAlternatives + ")(?![\\p{L}\\d])");
        }

        /**
         * Label followed by a whole number (counts).
         */
        Builder labelCount(String labelRegex) {
            return raw("(?<![\\p{L}])(?:" + labelRegex + ")" + LABEL_SUFFIX + "[\\s:=\\-–—]{0,10}"
                    + "(?<value>\\d{1,2})(?![\\d.,])");
        }

        /**
         * Any pattern exposing the named groups itself.
         */
        Builder raw(String regex) {
            patterns.add(Pattern.compile(regex, FLAGS));
            return this;
        }

        Builder aliases(String... names) {
            aliases.addAll(List.of(names));
            return this;
        }

        SpecParameter build() {
            if (patterns.isEmpty() && aliases.isEmpty()) {
                throw new IllegalStateException("Parameter " + name + " has neither patterns nor aliases");
            }
            return new SpecParameter(name, kind, canonicalUnit, patterns, aliases);
        }
    }
}
