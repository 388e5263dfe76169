package org.stbridge.converter.report;

import java.util.List;

public record ReportSummary(
        int warningCount,
        int errorCount,
        List<String> warnings,
        List<String> errors
) {
}
