package org.stbridge.converter.report;

/**
 * One record of a conversion report.
 */
public record ReportEntry(LogLevel level, String message) {
}
