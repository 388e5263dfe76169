package org.stbridge.converter.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only record of one conversion call. Every entry is also forwarded to SLF4J.
 * <p>
 * A report belongs to exactly one conversion and is not shared between threads.
 */
public class ConversionReport {

    private static final Logger log = LoggerFactory.getLogger(ConversionReport.class);

    private final List<ReportEntry> entries = new ArrayList<>();
    private DataLossReport dataLoss = DataLossReport.none();

    public void debug(String message) {
        log.debug(message);
        entries.add(new ReportEntry(LogLevel.DEBUG, message));
    }

    public void info(String message) {
        log.info(message);
        entries.add(new ReportEntry(LogLevel.INFO, message));
    }

    public void warn(String message) {
        log.warn(message);
        entries.add(new ReportEntry(LogLevel.WARN, message));
    }

    public void error(String message) {
        log.error(message);
        entries.add(new ReportEntry(LogLevel.ERROR, message));
    }

    public List<ReportEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public List<String> messages(LogLevel level) {
        return entries.stream()
                .filter(e -> e.level() == level)
                .map(ReportEntry::message)
                .toList();
    }

    public List<String> getWarnings() {
        return messages(LogLevel.WARN);
    }

    public List<String> getErrors() {
        return messages(LogLevel.ERROR);
    }

    public DataLossReport getDataLoss() {
        return dataLoss;
    }

    public void setDataLoss(DataLossReport dataLoss) {
        this.dataLoss = dataLoss == null ? DataLossReport.none() : dataLoss;
    }

    public ReportSummary getSummary() {
        List<String> warnings = getWarnings();
        List<String> errors = getErrors();
        return new ReportSummary(warnings.size(), errors.size(), warnings, errors);
    }
}
