package org.smileyface.minespec.qa;

import org.smileyface.minespec.config.SpecEngineConfig;
import org.smileyface.minespec.extractor.ValueParser;
import org.smileyface.minespec.model.RimpullCurve;
import org.smileyface.minespec.model.SpecStatus;
import org.smileyface.minespec.model.ValidatedSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Last gate before a record is stored: physical bounds per parameter and cross-parameter checks.
 *
 * <p>Only {@link SpecStatus#VALIDATED} records are checked against bounds. {@link SpecStatus#FLAGGED}
 * records already carry their own reason and pass through unchanged.</p>
 */
public class QaPipeline {

    private static final Logger logger = LoggerFactory.getLogger(QaPipeline.class);

    static final String OPERATING_WEIGHT = "operating_weight_kg";
    static final String EMPTY_WEIGHT = "empty_weight_kg";
    static final String PAYLOAD = "payload_capacity_kg";
    static final String ENGINE_POWER = "engine_power_kw";

    private final SpecEngineConfig config;

    public QaPipeline(SpecEngineConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public QaOutcome check(ValidatedSpec spec) {
        Objects.requireNonNull(spec, "spec");
        if (spec.getStatus() == SpecStatus.REJECTED) {
            return new QaOutcome.Rejected(spec, Objects.toString(spec.getStatusReason(), "rejected"));
        }
        if (spec.getStatus() == SpecStatus.FLAGGED) {
            return new QaOutcome.Accepted(spec);
        }
        String failure = boundsFailure(spec);
        if (failure == null) {
            return new QaOutcome.Accepted(spec);
        }
        logger.info("QA rejected {}/{}/{} = {}: {}", spec.getBrand(), spec.getModel(), spec.getParameterName(),
                spec.getValue(), failure);
        return new QaOutcome.Rejected(spec.withStatus(SpecStatus.REJECTED, failure), failure);
    }

    private String boundsFailure(ValidatedSpec spec) {
        Object value = spec.getValue();
        SpecEngineConfig.ParameterBounds bounds = config.bounds(spec.getParameterName());
        if (value == null) return "no value";
        if (!(value instanceof Number)) {
            String text = value.toString();
            if (text.isBlank() || ValueParser.isPlaceholder(text)) return "placeholder value '" + text + "'";
            if (bounds != null && !bounds.isText()) return "text value for numeric parameter";
            return null;
        }
        double v = ((Number) value).doubleValue();
        if (!Double.isFinite(v)) return "value is not finite";
        if (v <= 0) return "value " + format(v) + " must be > 0";
        if (bounds == null || bounds.isText()) return null;
        if (bounds.qaMin != null && v < bounds.qaMin) {
            return "value " + format(v) + " below minimum " + format(bounds.qaMin) + " " + bounds.unit;
        }
        if (bounds.qaMax != null && v > bounds.qaMax) {
            return "value " + format(v) + " above maximum " + format(bounds.qaMax) + " " + bounds.unit;
        }
        return null;
    }

    /**
     * Cross-parameter checks over the records of one machine: empty weight and payload must be below
     * operating weight, and every core parameter should be present. REJECTED records are ignored.
     */
    public EquipmentReport checkEquipment(String brand, String model, List<ValidatedSpec> specs) {
        Map<String, ValidatedSpec> byParameter = new HashMap<>();
        for (ValidatedSpec s : specs) {
            if (s.getStatus() != SpecStatus.REJECTED && s.getBrand().equals(brand) && s.getModel().equals(model)) {
                byParameter.put(s.getParameterName(), s);
            }
        }
        List<String> warnings = new ArrayList<>();
        Double operating = numeric(byParameter.get(OPERATING_WEIGHT));
        Double empty = numeric(byParameter.get(EMPTY_WEIGHT));
        Double payload = numeric(byParameter.get(PAYLOAD));
        if (operating != null && empty != null && empty >= operating) {
            warnings.add("empty weight " + format(empty) + " kg is not below operating weight " + format(operating) + " kg");
        }
        if (operating != null && payload != null && payload >= operating) {
            warnings.add("payload " + format(payload) + " kg is not below operating weight " + format(operating) + " kg");
        }
        List<String> missing = new ArrayList<>();
        for (String core : config.coreParameters) {
            if (!byParameter.containsKey(core)) missing.add(core);
        }
        int coreCount = config.coreParameters.size();
        double completeness = coreCount == 0 ? 1.0 : (double) (coreCount - missing.size()) / coreCount;
        return new EquipmentReport(brand, model, warnings, missing, completeness);
    }

    public CurveReport checkCurve(RimpullCurve curve) {
        List<String> warnings = new ArrayList<>(curve.getViolations());
        boolean usable = curve.getPoints().size() >= 2;
        if (!usable) {
            warnings.add(0, "curve has fewer than 2 points");
        }
        return new CurveReport(usable, warnings);
    }

    private static Double numeric(ValidatedSpec spec) {
        if (spec == null || !(spec.getValue() instanceof Number n)) return null;
        return n.doubleValue();
    }

    private static String format(double v) {
        return v == Math.rint(v) && Math.abs(v) < 1e15 ? String.valueOf((long) v) : String.format(Locale.ROOT, "%.4g", v);
    }
}
