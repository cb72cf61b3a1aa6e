package org.smileyface.minespec.qa;

import java.util.List;

/**
 * Cross-parameter findings for one machine.
 *
 * @param warnings              inconsistencies between parameters
 * @param missingCoreParameters core parameters without an accepted record
 * @param completeness          share of core parameters present, 0 to 1
 */
public record EquipmentReport(String brand, String model, List<String> warnings,
                              List<String> missingCoreParameters, double completeness) {

    public EquipmentReport {
        warnings = List.copyOf(warnings);
        missingCoreParameters = List.copyOf(missingCoreParameters);
    }

    public boolean isComplete() {
        return missingCoreParameters.isEmpty();
    }
}
