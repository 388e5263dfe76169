package org.stbridge.converter.report;

import lombok.Builder;

import java.util.ArrayList;
import java.util.List;

/**
 * Pre-scan of data a downgrade to v2.0.2 cannot represent.
 */
@Builder
public record DataLossReport(
        int jointArrangements,
        boolean pileStrengthList,
        int multiSectionBeams,
        int multiItemBasePlates,
        int complexBarArrangements
) {
    public static DataLossReport none() {
        return new DataLossReport(0, false, 0, 0, 0);
    }

    public boolean hasLoss() {
        return jointArrangements > 0 || pileStrengthList || multiSectionBeams > 0
                || multiItemBasePlates > 0 || complexBarArrangements > 0;
    }

    /**
     * Human readable warnings, one per affected category.
     */
    public List<String> toWarnings() {
        List<String> warnings = new ArrayList<>();
        if (jointArrangements > 0) {
            warnings.add(jointArrangements + " joint arrangements will be removed (not supported in v2.0.2)");
        }
        if (pileStrengthList) {
            warnings.add("Pile reinforcement strength list will be removed (not supported in v2.0.2)");
        }
        if (multiSectionBeams > 0) {
            warnings.add(multiSectionBeams + " multi-section beams will be simplified to single section");
        }
        if (multiItemBasePlates > 0) {
            warnings.add(multiItemBasePlates
                    + " base plates with several anchor bolts or rib plates will keep only the first of each");
        }
        if (complexBarArrangements > 0) {
            warnings.add(complexBarArrangements
                    + " complex bar arrangements will be collapsed to one representative section");
        }
        return warnings;
    }
}
