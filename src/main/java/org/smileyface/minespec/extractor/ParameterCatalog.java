package org.smileyface.minespec.extractor;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed set of parameters the extractor knows, with their English and Spanish text patterns and
 * table labels. Catalog order is the order candidates are reported in.
 *
 * <p>Table labels are looked up by exact match after normalisation (lower case, accents and bracketed
 * qualifiers removed); failing that, the longest label contained in the cell as whole words wins.</p>
 */
public final class ParameterCatalog {

    private static final String MASS = "kilogramos|kilograms?|kgs?|metric\\s{1,2}tons?|short\\s{1,2}tons?"
            + "|tonnes?|toneladas?|tons?|t|lbs?|pounds|libras";
    private static final String POWER = "kilowatts?|kw|bhp|hp|horsepower|cv|ps|mw";
    private static final String VOLUME_M3 = "m3|m³|cu\\.\\s{0,2}m|cu\\s{1,2}m|cubic\\s{1,2}met(?:er|re)s"
            + "|metros\\s{1,2}c[uú]bicos|yd3|yd³|cu\\.\\s{0,2}yd|cu\\s{1,2}yd|cubic\\s{1,2}yards";
    private static final String TORQUE = "n[·.\\-]?\\s?m|lbf?[\\-.\\s]{0,2}ft|ft[\\-.\\s]{0,2}lbs?|kgf?[.\\-]?m";
    private static final String VOLUME_L = "litros|litres?|liters?|l|us\\s{1,2}gal|gallons|galones|gal"
            + "|cu\\.\\s{0,2}in|cu\\s{1,2}in";
    private static final String FORCE = "kilonewtons|kn|lbf|lbs?|kgf|kg|tf";
    private static final String PRESSURE_BAR = "bars?|psi|mpa|kpa|kgf?/cm[2²]";
    private static final String PRESSURE_KPA = "kpa|psi|bar|kgf?/cm[2²]";
    private static final String FLOW = "l/min|lpm|litros/min|liters/min|litres/min|gpm|gal/min";
    private static final String SPEED = "km/h|km/hr|kph|kmh|mph";
    private static final String FUEL_RATE = "l/h|l/hr|lph|litros/h|gal/hr|gal/h|gph";
    private static final String LENGTH = "mm|cm|meters|metres|metros|m|feet|ft|inches|in";
    private static final String ROTATION = "rpm|r/min|rev/min";
    private static final String PERCENT = "%|percent|por\\s{1,2}ciento";
    private static final String VOLTAGE = "volts?|vdc|kv|v";
    private static final String SHOE = "mm|cm|inches|in";

    private static final String MAX = "(?:max(?:imum)?\\.?\\s{1,3})?";

    private static final ParameterCatalog DEFAULT = new ParameterCatalog(buildDefault());

    private final List<SpecParameter> parameters;
    private final Map<String, SpecParameter> byName;
    private final Map<String, SpecParameter> aliasIndex;
    private final List<String> aliasesLongestFirst;

    public ParameterCatalog(List<SpecParameter> parameters) {
        this.parameters = List.copyOf(parameters);
        Map<String, SpecParameter> names = new LinkedHashMap<>();
        Map<String, SpecParameter> aliases = new LinkedHashMap<>();
        for (SpecParameter p : this.parameters) {
            if (names.put(p.getName(), p) != null) {
                throw new IllegalArgumentException("Duplicate parameter " + p.getName());
            }
            for (String a : p.getAliases()) {
                SpecParameter prev = aliases.putIfAbsent(normalizeLabel(a), p);
                if (prev != null && prev != p) {
                    throw new IllegalArgumentException("Alias '" + a + "' used by " + prev.getName() + " and " + p.getName());
                }
            }
        }
        this.byName = Collections.unmodifiableMap(names);
        this.aliasIndex = Collections.unmodifiableMap(aliases);
        List<String> sorted = new ArrayList<>(aliases.keySet());
        sorted.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));
        this.aliasesLongestFirst = List.copyOf(sorted);
    }

    public static ParameterCatalog defaultCatalog() {
        return DEFAULT;
    }

    public List<SpecParameter> parameters() {
        return parameters;
    }

    public Optional<SpecParameter> get(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    /**
     * Finds the parameter a table label names, if any.
     */
    public Optional<SpecParameter> lookupLabel(String cell) {
        if (cell == null || cell.length() > 120) return Optional.empty();
        String norm = normalizeLabel(cell);
        if (norm.isEmpty()) return Optional.empty();
        SpecParameter exact = aliasIndex.get(norm);
        if (exact != null) return Optional.of(exact);
        if (norm.length() > 60) return Optional.empty();
        String padded = " " + norm + " ";
        for (String alias : aliasesLongestFirst) {
            if (padded.contains(" " + alias + " ")) {
                return Optional.of(aliasIndex.get(alias));
            }
        }
        return Optional.empty();
    }

    /**
     * Lower-cases, strips accents and bracketed qualifiers, and reduces punctuation to single spaces.
     */
    public static String normalizeLabel(String s) {
        String t = Normalizer.normalize(s, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
        t = t.toLowerCase(Locale.ROOT);
        t = t.replaceAll("[(\\[][^)\\]]{0,60}[)\\]]", " ");
        t = t.replaceAll("[^a-z0-9%/]+", " ");
        return t.trim();
    }

    private static List<SpecParameter> buildDefault() {
        List<SpecParameter> list = new ArrayList<>();

        list.add(SpecParameter.numeric("operating_weight_kg", "kg")
                .label("(?:gross\\s{1,3}(?:machine\\s{1,3})?)?operating\\s{1,3}(?:weight|mass)"
                        + "|peso\\s{1,3}(?:de\\s{1,3})?operaci[oó]n|peso\\s{1,3}operativo"
                        + "|peso\\s{1,3}en\\s{1,3}orden\\s{1,3}de\\s{1,3}trabajo", MASS)
                .aliases("operating weight", "operating mass", "gross machine operating weight",
                        "machine operating weight", "peso operativo", "peso de operación", "peso en operación",
                        "peso en orden de trabajo")
                .build());
        list.add(SpecParameter.numeric("empty_weight_kg", "kg")
                .label("empty\\s{1,3}(?:vehicle\\s{1,3}|machine\\s{1,3})?weight|tare\\s{1,3}weight"
                        + "|peso\\s{1,3}(?:en\\s{1,3})?vac[ií]o|peso\\s{1,3}tara", MASS)
                .aliases("empty weight", "empty vehicle weight", "empty machine weight", "tare weight",
                        "peso vacío", "peso en vacío", "peso tara")
                .build());
        list.add(SpecParameter.numeric("engine_power_kw", "kW")
                .label("(?:gross|net|rated|flywheel|engine|gross\\s{1,3}engine|net\\s{1,3}engine)\\s{1,3}power"
                        + "|potencia(?:\\s{1,3}(?:bruta|neta|nominal|del\\s{1,3}motor))?|horsepower", POWER)
                .raw("(?<![\\d.,])(?<value>" + ValueParser.NUMBER_REGEX + ")\\s{0,3}(?<unit>kw|hp|bhp)"
                        + "(?![\\p{L}\\d])\\s{0,3}(?:@|at|a)\\s{0,3}\\d{1,2}[,. ]?\\d{3}\\s{0,3}(?:rpm|r/min)")
                .aliases("gross power", "net power", "rated power", "flywheel power", "engine power",
                        "gross engine power", "net engine power", "potencia", "potencia bruta",
                        "potencia neta", "potencia nominal", "potencia del motor")
                .build());
        list.add(SpecParameter.numeric("bucket_capacity_m3", "m3")
                .label("(?:rated\\s{1,3}|heaped\\s{1,3}|standard\\s{1,3})?bucket\\s{1,3}(?:capacity|size|volume)"
                        + "|capacidad\\s{1,3}(?:del\\s{1,3}|de\\s{1,3}la\\s{1,3})?(?:cuchar[oó]n|balde|pala)", VOLUME_M3)
                .aliases("bucket capacity", "bucket size", "bucket volume", "rated bucket capacity",
                        "heaped bucket capacity", "capacidad del cucharón", "capacidad de cucharón",
                        "capacidad del balde", "capacidad de la pala")
                .build());
        list.add(SpecParameter.numeric("dipper_capacity_m3", "m3")
                .label("(?:nominal\\s{1,3})?dipper\\s{1,3}(?:capacity|size|volume)"
                        + "|capacidad\\s{1,3}(?:del\\s{1,3})?dipper", VOLUME_M3)
                .aliases("dipper capacity", "dipper size", "nominal dipper capacity", "capacidad del dipper")
                .build());
        list.add(SpecParameter.numeric("payload_capacity_kg", "kg")
                .label("(?:rated\\s{1,3}|nominal\\s{1,3}|target\\s{1,3}|max(?:imum)?\\.?\\s{1,3})?payload"
                        + "(?:\\s{1,3}capacity)?|carga\\s{1,3}[uú]til|capacidad\\s{1,3}de\\s{1,3}carga", MASS)
                .aliases("payload", "payload capacity", "rated payload", "nominal payload", "target payload",
                        "maximum payload", "carga útil", "capacidad de carga")
                .build());
        list.add(SpecParameter.numeric("lifting_capacity_kg", "kg")
                .label(MAX + "lift(?:ing)?\\s{1,3}capacity|capacidad\\s{1,3}de\\s{1,3}(?:elevaci[oó]n|levante)", MASS)
                .aliases("lifting capacity", "lift capacity", "maximum lifting capacity",
                        "capacidad de elevación", "capacidad de levante")
                .build());
        list.add(SpecParameter.text("engine_model")
                .raw("(?<![\\p{L}])(?:engine\\s{1,3}model|engine\\s{1,3}make(?:\\s{1,3}(?:and|&)\\s{1,3}model)?"
                        + "|modelo\\s{1,3}(?:del\\s{1,3})?motor|motor\\s{1,3}modelo)[\\s:=\\-]{1,10}"
                        + "(?<value>(?-i:[A-Z0-9][A-Za-z0-9\\-/.]{1,19}(?:[ \\t]{1,2}[A-Z0-9][A-Za-z0-9\\-/.]{0,19}){0,3}))")
                .aliases("engine model", "engine make and model", "engine make model", "modelo del motor",
                        "modelo de motor", "motor modelo")
                .build());
        list.add(SpecParameter.numeric("max_torque_nm", "Nm")
                .label("(?:max(?:imum)?\\.?\\s{1,3}|peak\\s{1,3}|gross\\s{1,3})?(?:engine\\s{1,3})?torque"
                        + "|par\\s{1,3}(?:motor\\s{1,3})?m[aá]ximo|torque\\s{1,3}m[aá]ximo", TORQUE)
                .aliases("max torque", "maximum torque", "peak torque", "gross torque", "torque",
                        "engine torque", "par máximo", "par motor máximo", "torque máximo")
                .build());
        list.add(SpecParameter.numeric("displacement_l", "L")
                .label("(?:engine\\s{1,3})?displacement|cilindrada", VOLUME_L)
                .aliases("displacement", "engine displacement", "cilindrada")
                .build());
        list.add(SpecParameter.count("cylinder_count")
                .raw("(?<![\\d.,])(?<value>\\d{1,2})[\\s\\-]{0,2}(?:cylinders?|cilindros)(?![\\p{L}])")
                .labelCount("(?:number\\s{1,3}of\\s{1,3})?cylinders|n[uú]mero\\s{1,3}de\\s{1,3}cilindros|cilindros")
                .aliases("cylinders", "number of cylinders", "no of cylinders", "número de cilindros", "cilindros")
                .build());
        list.add(SpecParameter.text("emission_standard")
                .raw("(?<![\\p{L}\\d])(?<value>(?:u\\.?s\\.?\\s{1,2})?(?:epa\\s{1,2})?tier\\s{0,2}(?:4\\s{0,2}final|4\\s{0,2}interim|4f|4i|[1-4])"
                        + "|(?:eu\\s{1,2})?stage\\s{0,2}(?:v|iv|iiib|iiia|iii|ii)|euro\\s{0,2}[3-6])(?![\\p{L}\\d])")
                .aliases("emissions", "emission standard", "emissions rating", "emission certification",
                        "norma de emisiones", "emisiones", "nivel de emisiones")
                .build());
        list.add(SpecParameter.numeric("digging_force_kn", "kN")
                .label("(?:bucket\\s{1,3}|arm\\s{1,3}|stick\\s{1,3}|max(?:imum)?\\.?\\s{1,3})?(?:digging|breakout|crowd)"
                        + "\\s{1,3}force|fuerza\\s{1,3}de\\s{1,3}(?:excavaci[oó]n|arranque|penetraci[oó]n)", FORCE)
                .aliases("digging force", "bucket digging force", "arm digging force", "stick digging force",
                        "breakout force", "bucket breakout force", "crowd force", "fuerza de excavación",
                        "fuerza de arranque", "fuerza de penetración")
                .build());
        list.add(SpecParameter.numeric("hydraulic_pressure_bar", "bar")
                .label("(?:max(?:imum)?\\.?\\s{1,3})?(?:hydraulic|relief|working|implement)\\s{1,3}"
                        + "(?:system\\s{1,3})?(?:relief\\s{1,3})?pressure|system\\s{1,3}pressure"
                        + "|presi[oó]n\\s{1,3}(?:hidr[aá]ulica|del\\s{1,3}sistema|de\\s{1,3}trabajo|de\\s{1,3}alivio)",
                        PRESSURE_BAR)
                .aliases("hydraulic pressure", "system pressure", "relief pressure", "working pressure",
                        "maximum hydraulic pressure", "relief valve pressure", "implement pressure",
                        "hydraulic system pressure", "presión hidráulica", "presión del sistema",
                        "presión de trabajo", "presión de alivio")
                .build());
        list.add(SpecParameter.numeric("hydraulic_flow_lpm", "L/min")
                .label("(?:max(?:imum)?\\.?\\s{1,3}|total\\s{1,3})?(?:hydraulic\\s{1,3})?(?:pump\\s{1,3})?(?:oil\\s{1,3})?"
                        + "flow(?:\\s{1,3}rate)?|caudal(?:\\s{1,3}(?:hidr[aá]ulico|m[aá]ximo|de\\s{1,3}(?:la\\s{1,3})?bomba))?",
                        FLOW)
                .aliases("hydraulic flow", "pump flow", "max flow", "maximum flow", "total flow",
                        "hydraulic pump flow", "oil flow", "flow rate", "caudal", "caudal hidráulico",
                        "caudal máximo", "caudal de la bomba")
                .build());
        list.add(SpecParameter.numeric("max_speed_kph", "km/h")
                .label("(?:max(?:imum)?\\.?\\s{1,3}|top\\s{1,3})(?:travel\\s{1,3}|ground\\s{1,3})?speed|travel\\s{1,3}speed"
                        + "|velocidad\\s{1,3}(?:m[aá]xima|de\\s{1,3}desplazamiento|de\\s{1,3}traslaci[oó]n)", SPEED)
                .aliases("max speed", "maximum speed", "top speed", "max travel speed", "maximum travel speed",
                        "travel speed", "velocidad máxima", "velocidad de desplazamiento", "velocidad de traslación")
                .build());
        list.add(SpecParameter.numeric("fuel_consumption_lph", "L/h")
                .label("fuel\\s{1,3}(?:consumption|burn)(?:\\s{1,3}rate)?|consumo\\s{1,3}(?:de\\s{1,3})?combustible",
                        FUEL_RATE)
                .aliases("fuel consumption", "fuel burn", "fuel burn rate", "consumo de combustible")
                .build());
        list.add(SpecParameter.numeric("fuel_tank_l", "L")
                .label("fuel\\s{1,3}tank(?:\\s{1,3}capacity)?|(?:tanque|dep[oó]sito)\\s{1,3}de\\s{1,3}combustible"
                        + "|capacidad\\s{1,3}(?:del\\s{1,3})?tanque(?:\\s{1,3}de\\s{1,3}combustible)?", VOLUME_L)
                .aliases("fuel tank", "fuel tank capacity", "fuel capacity", "tanque de combustible",
                        "depósito de combustible", "capacidad del tanque")
                .build());
        list.add(SpecParameter.text("transmission_type")
                .raw("(?<![\\p{L}])(?:transmission(?:\\s{1,3}type)?|transmisi[oó]n)[\\s:=\\-]{1,10}"
                        + "(?<value>planetary\\s{1,2}power\\s{0,1}shift|power\\s{0,1}shift|automatic|manual|hydrostatic"
                        + "|diesel[\\s\\-]{1,2}electric|electric\\s{1,2}drive|ac\\s{1,2}drive|mechanical|cvt"
                        + "|autom[aá]tica|hidrost[aá]tica|planetaria|el[eé]ctrica|mec[aá]nica)(?![\\p{L}])")
                .raw("(?<![\\p{L}])(?<value>diesel[\\s\\-]{1,2}electric|ac\\s{1,2}electric|mechanical)\\s{1,2}drive(?![\\p{L}])")
                .aliases("transmission", "transmission type", "drive system", "drive type", "transmisión",
                        "tipo de transmisión")
                .build());
        list.add(SpecParameter.text("tire_size")
                .raw("(?<![\\p{L}])(?:tires?|tyres?|neum[aá]ticos?|llantas?)(?:\\s{1,3}(?:size|standard))?[\\s:=\\-]{1,10}"
                        + "(?<value>\\d{2}(?:\\.\\d{2})?(?:/\\d{2}(?:\\.\\d)?)?\\s?R\\s?\\d{2}(?:\\.\\d)?)(?![\\d])")
                .aliases("tire size", "tyre size", "tires", "tyres", "standard tires", "neumáticos",
                        "tamaño de neumáticos", "llantas")
                .build());
        list.add(SpecParameter.numeric("digging_depth_m", "m")
                .label(MAX + "digging\\s{1,3}depth|profundidad\\s{1,3}(?:m[aá]xima\\s{1,3})?de\\s{1,3}excavaci[oó]n", LENGTH)
                .aliases("digging depth", "max digging depth", "maximum digging depth",
                        "profundidad de excavación", "profundidad máxima de excavación")
                .build());
        list.add(SpecParameter.numeric("max_reach_m", "m")
                .label(MAX + "(?:digging\\s{1,3})?reach(?:\\s{1,3}at\\s{1,3}ground(?:\\s{1,3}level)?)?"
                        + "|alcance\\s{1,3}(?:m[aá]ximo|de\\s{1,3}excavaci[oó]n)", LENGTH)
                .aliases("max reach", "maximum reach", "digging reach", "reach at ground level",
                        "max reach at ground level", "alcance máximo", "alcance de excavación")
                .build());
        list.add(SpecParameter.numeric("dump_height_m", "m")
                .label(MAX + "(?:dump(?:ing)?|discharge)\\s{1,3}height"
                        + "|altura\\s{1,3}(?:m[aá]xima\\s{1,3})?de\\s{1,3}(?:descarga|vaciado)", LENGTH)
                .aliases("dump height", "dumping height", "max dump height", "maximum dump height",
                        "discharge height", "altura de descarga", "altura máxima de descarga", "altura de vaciado")
                .build());
        list.add(SpecParameter.numeric("ground_pressure_kpa", "kPa")
                .label("ground\\s{1,3}(?:bearing\\s{1,3})?pressure|presi[oó]n\\s{1,3}(?:sobre\\s{1,3}el|al)\\s{1,3}suelo",
                        PRESSURE_KPA)
                .aliases("ground pressure", "ground bearing pressure", "presión sobre el suelo", "presión al suelo")
                .build());
        list.add(SpecParameter.numeric("swing_speed_rpm", "rpm")
                .label("swing\\s{1,3}speed|velocidad\\s{1,3}de\\s{1,3}giro", ROTATION)
                .aliases("swing speed", "velocidad de giro")
                .build());
        list.add(SpecParameter.numeric("gradeability_pct", "%")
                .label("gradeability|max(?:imum)?\\.?\\s{1,3}grade|pendiente\\s{1,3}m[aá]xima"
                        + "|capacidad\\s{1,3}de\\s{1,3}(?:subir\\s{1,3})?pendientes?", PERCENT)
                .aliases("gradeability", "max grade", "maximum grade", "pendiente máxima", "capacidad de pendiente")
                .build());
        list.add(SpecParameter.numeric("turning_radius_m", "m")
                .label("(?:min(?:imum)?\\.?\\s{1,3})?turning\\s{1,3}(?:radius|circle)|radio\\s{1,3}de\\s{1,3}giro", LENGTH)
                .aliases("turning radius", "turning circle", "minimum turning radius", "radio de giro")
                .build());
        list.add(SpecParameter.numeric("overall_width_m", "m")
                .label("(?:overall|total|operating)\\s{1,3}width|ancho\\s{1,3}(?:total|de\\s{1,3}operaci[oó]n)", LENGTH)
                .aliases("overall width", "total width", "operating width", "ancho total",
                        "ancho de operación")
                .build());
        list.add(SpecParameter.numeric("overall_length_m", "m")
                .label("(?:overall|total)\\s{1,3}length|(?:largo|longitud)\\s{1,3}total", LENGTH)
                .aliases("overall length", "total length", "largo total", "longitud total")
                .build());
        list.add(SpecParameter.numeric("overall_height_m", "m")
                .label("(?:overall|total)\\s{1,3}height|altura\\s{1,3}total", LENGTH)
                .aliases("overall height", "total height", "altura total")
                .build());
        list.add(SpecParameter.numeric("system_voltage_v", "V")
                .label("(?:electrical\\s{1,3})?system\\s{1,3}voltage|electrical\\s{1,3}voltage"
                        + "|(?:voltaje|tensi[oó]n)\\s{1,3}(?:del\\s{1,3})?sistema", VOLTAGE)
                .aliases("system voltage", "electrical system voltage",
                        "voltaje del sistema", "tensión del sistema")
                .build());
        list.add(SpecParameter.numeric("track_shoe_width_mm", "mm")
                .label("(?:track\\s{1,3})?shoe\\s{1,3}width|(?:ancho|anchura)\\s{1,3}de\\s{1,3}(?:la\\s{1,3})?zapata", SHOE)
                .aliases("shoe width", "track shoe width", "ancho de zapata", "ancho de la zapata", "anchura de zapata")
                .build());
        list.add(SpecParameter.text("undercarriage_type")
                .raw("(?<![\\p{L}])(?:undercarriage(?:\\s{1,3}type)?|tren\\s{1,3}de\\s{1,3}rodaje)[\\s:=\\-]{1,10}"
                        + "(?<value>(?:heavy[\\s\\-]duty\\s{1,2}|long\\s{1,2}|standard\\s{1,2})?(?:crawler|tracked|wheeled|rubber[\\s\\-]tired"
                        + "|orugas|ruedas|neum[aá]ticos)(?:\\s{1,2}(?:track|tracks|undercarriage))?)(?![\\p{L}])")
                .aliases("undercarriage", "undercarriage type", "tren de rodaje", "tipo de tren de rodaje")
                .build());
        list.add(SpecParameter.numeric("max_rimpull_kn", "kN")
                .label(MAX + "rimpull|tractive\\s{1,3}(?:effort|force)|fuerza\\s{1,3}de\\s{1,3}tracci[oó]n", FORCE)
                .aliases("rimpull", "max rimpull", "maximum rimpull", "tractive effort", "tractive force",
                        "fuerza de tracción")
                .build());
        list.add(SpecParameter.count("forward_gears")
                .raw("(?<![\\d.,])(?<value>\\d{1,2})\\s{1,3}(?:forward\\s{1,3}(?:gears|speeds)|speeds?\\s{1,3}forward"
                        + "|velocidades\\s{1,3}(?:de\\s{1,3})?avance|marchas\\s{1,3}(?:hacia\\s{1,3})?adelante)(?![\\p{L}])")
                .labelCount("forward\\s{1,3}(?:gears|speeds)|marchas\\s{1,3}(?:hacia\\s{1,3})?adelante")
                .aliases("forward gears", "forward speeds", "number of forward gears", "marchas adelante",
                        "marchas hacia adelante", "velocidades de avance")
                .build());
        return list;
    }
}
