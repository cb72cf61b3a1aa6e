package org.smileyface.minespec.validation;

import org.smileyface.minespec.config.SpecEngineConfig;
import org.smileyface.minespec.model.RimpullCurve;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Chooses one rimpull curve per machine among the curves read from different documents.
 *
 * <p>The curve from the most trusted source tier wins, then the one with more points, then the one
 * from the lexically smaller source table (document reference, then table index). Every gear of the chosen curve whose peak force
 * differs from another curve's peak for the same gear by more than the configured percentage gets a
 * violation; no curve is modified otherwise.</p>
 */
public class RimpullReconciler {

    private static final Logger log = LogManager.getLogger();

    private static final Comparator<RimpullCurve> PREFERENCE = Comparator
            .comparingInt((RimpullCurve c) -> c.getSourceTier().ordinal())
            .thenComparing(Comparator.comparingInt((RimpullCurve c) -> c.getPoints().size()).reversed())
            .thenComparing(RimpullCurve::sourceKey);

    private final double tolerancePct;

    public RimpullReconciler(SpecEngineConfig config) {
        this.tolerancePct = Objects.requireNonNull(config, "config").thresholds.rimpullGearTolerancePct;
    }

    public Optional<RimpullCurve> merge(List<RimpullCurve> curves) {
        if (curves == null || curves.isEmpty()) return Optional.empty();
        List<RimpullCurve> sorted = new ArrayList<>(curves);
        sorted.sort(PREFERENCE);
        RimpullCurve best = sorted.get(0);

        List<String> disagreements = new ArrayList<>();
        for (int gear : best.gears()) {
            double peak = best.peakForce(gear).orElse(0.0);
            if (peak <= 0) continue;
            for (RimpullCurve other : sorted.subList(1, sorted.size())) {
                OptionalDouble otherPeak = other.peakForce(gear);
                if (otherPeak.isEmpty()) continue;
                double diffPct = Math.abs(otherPeak.getAsDouble() - peak) / peak * 100.0;
                if (diffPct > tolerancePct) {
                    disagreements.add(String.format(Locale.ROOT,
                            "gear %d: peak %.1f kN disagrees with %.1f kN from %s",
                            gear, peak, otherPeak.getAsDouble(), other.sourceKey()));
                }
            }
        }
        if (!disagreements.isEmpty()) {
            log.info("Rimpull curves for {}/{} disagree on {} gear peaks", best.getBrand(), best.getModel(),
                    disagreements.size());
        }
        return Optional.of(best.with(best.getSourceTier(), disagreements));
    }
}
