package org.stbridge.converter.report;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConversionReportTest {

    @Test
    void shouldKeepEntriesInOrderWithLevels() {
        ConversionReport report = new ConversionReport();
        report.info("started");
        report.warn("first warning");
        report.debug("detail");
        report.error("broken");
        report.warn("second warning");

        assertEquals(5, report.getEntries().size());
        assertEquals(new ReportEntry(LogLevel.INFO, "started"), report.getEntries().get(0));
        assertEquals(List.of("first warning", "second warning"), report.getWarnings());
        assertEquals(List.of("broken"), report.getErrors());
        assertEquals(List.of("detail"), report.messages(LogLevel.DEBUG));
    }

    @Test
    void shouldSummarizeWarningsAndErrors() {
        ConversionReport report = new ConversionReport();
        report.warn("w1");
        report.warn("w2");
        report.error("e1");

        ReportSummary summary = report.getSummary();

        assertEquals(2, summary.warningCount());
        assertEquals(1, summary.errorCount());
        assertEquals(List.of("w1", "w2"), summary.warnings());
        assertEquals(List.of("e1"), summary.errors());
    }

    @Test
    void shouldNotAllowEntriesToBeModifiedFromOutside() {
        ConversionReport report = new ConversionReport();
        report.info("x");

        assertThrows(UnsupportedOperationException.class,
                () -> report.getEntries().add(new ReportEntry(LogLevel.ERROR, "y")));
    }

    @Test
    void shouldDefaultToNoDataLoss() {
        ConversionReport report = new ConversionReport();

        assertFalse(report.getDataLoss().hasLoss());
        report.setDataLoss(null);
        assertEquals(DataLossReport.none(), report.getDataLoss());
    }

    @Test
    void shouldListOneWarningPerLossCategory() {
        DataLossReport loss = DataLossReport.builder()
                .jointArrangements(2)
                .pileStrengthList(true)
                .multiSectionBeams(1)
                .multiItemBasePlates(3)
                .complexBarArrangements(4)
                .build();

        assertTrue(loss.hasLoss());
        assertEquals(List.of(
                "2 joint arrangements will be removed (not supported in v2.0.2)",
                "Pile reinforcement strength list will be removed (not supported in v2.0.2)",
                "1 multi-section beams will be simplified to single section",
                "3 base plates with several anchor bolts or rib plates will keep only the first of each",
                "4 complex bar arrangements will be collapsed to one representative section"), loss.toWarnings());
        assertTrue(DataLossReport.none().toWarnings().isEmpty());
    }

    @Test
    void shouldFlagLossForBasePlatesOrComplexBarsAlone() {
        assertTrue(DataLossReport.builder().multiItemBasePlates(1).build().hasLoss());
        assertTrue(DataLossReport.builder().complexBarArrangements(1).build().hasLoss());
        assertFalse(DataLossReport.builder().build().hasLoss());
    }
}
