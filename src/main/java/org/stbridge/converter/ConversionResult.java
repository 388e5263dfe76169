package org.stbridge.converter;

import org.stbridge.converter.report.ConversionReport;
import org.stbridge.converter.tree.StbDocument;

/**
 * Output of one conversion call.
 *
 * @param document      the converted document, or the input itself when nothing had to be converted
 * @param report        everything the rules logged during the call
 * @param converted     false when source and target version already agreed
 * @param sourceVersion version attribute found on the input, may be null
 * @param targetVersion version the document now declares
 */
public record ConversionResult(
        StbDocument document,
        ConversionReport report,
        boolean converted,
        String sourceVersion,
        String targetVersion
) {
}
