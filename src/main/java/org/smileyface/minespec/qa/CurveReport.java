package org.smileyface.minespec.qa;

import java.util.List;

/**
 * QA findings for a rimpull curve. A curve is usable when it has at least two points; monotonicity
 * violations are warnings only.
 */
public record CurveReport(boolean usable, List<String> warnings) {

    public CurveReport {
        warnings = List.copyOf(warnings);
    }
}
