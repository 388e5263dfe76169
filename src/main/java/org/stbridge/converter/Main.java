package org.stbridge.converter;

import org.stbridge.converter.dom.DomTreeBridge;
import org.stbridge.converter.report.DataLossReport;
import org.stbridge.converter.report.ReportSummary;
import org.stbridge.converter.tree.StbDocument;

import java.io.File;

/**
 * Command line entry point: {@code Main <input.xml> <output.xml> <targetVersion>}.
 */
public class Main {

    private final File inputFile;
    private final File outputFile;
    private final String targetVersion;

    // ------- state of the current run
    private StbDocument inputDocument;
    private ConversionResult result;

    public Main(File inputFile, File outputFile, String targetVersion) {
        this.inputFile = inputFile;
        this.outputFile = outputFile;
        this.targetVersion = targetVersion;
    }

    public static void main(String[] args) {
        if (args.length != 3) {
            System.err.println("Usage: Main <input.xml> <output.xml> <targetVersion>");
            System.err.println("  targetVersion: 2.0.2 or 2.1.0");
            System.exit(2);
        }
        try {
            new Main(new File(args[0]), new File(args[1]), args[2]).run();
        } catch (Exception e) {
            System.err.println("Conversion failed: " + e.getMessage());
            System.exit(1);
        }
    }

    public ConversionResult run() {
        readInput();
        validateInput();
        convert();
        writeOutput();
        printSummary();
        return result;
    }

    private void readInput() {
        inputDocument = DomTreeBridge.read(inputFile);
    }

    private void validateInput() {
        ValidationResult validation = StbConverter.validateDocument(inputDocument);
        validation.warnings().forEach(w -> System.out.println("Warning: " + w));
        if (!validation.valid()) {
            throw new IllegalStateException("Invalid input document: " + String.join("; ", validation.errors()));
        }
    }

    private void convert() {
        result = new StbConverter().convert(inputDocument, targetVersion);
    }

    private void writeOutput() {
        DomTreeBridge.write(result.document(), outputFile);
    }

    private void printSummary() {
        if (!result.converted()) {
            System.out.println("Document already at version " + result.targetVersion() + ", written unchanged to "
                    + outputFile);
            return;
        }
        System.out.println("Converted " + inputFile + " (" + result.sourceVersion() + ") -> " + outputFile
                + " (" + result.targetVersion() + ")");
        DataLossReport dataLoss = result.report().getDataLoss();
        if (dataLoss.hasLoss()) {
            System.out.println("Data loss:");
            dataLoss.toWarnings().forEach(w -> System.out.println("  - " + w));
        }
        ReportSummary summary = result.report().getSummary();
        System.out.println("Warnings: " + summary.warningCount() + ", errors: " + summary.errorCount());
        summary.warnings().forEach(w -> System.out.println("  WARN  " + w));
        summary.errors().forEach(e -> System.err.println("  ERROR " + e));
    }
}
