package org.stbridge.converter.rules;

import org.stbridge.converter.config.AttributeConfigTable;
import org.stbridge.converter.config.ElementRenameTable;
import org.stbridge.converter.report.ConversionReport;

/**
 * State shared by the rules of one conversion call: the report, the read-only tables and the
 * identifier synthesizer. A new context is created per call.
 */
public class RuleContext {

    private final ConversionReport report;
    private final ElementRenameTable renames;
    private final AttributeConfigTable attributes;
    private final IdSynthesizer ids = new IdSynthesizer();

    public RuleContext(ConversionReport report) {
        this(report, ElementRenameTable.defaults(), AttributeConfigTable.defaults());
    }

    public RuleContext(ConversionReport report, ElementRenameTable renames, AttributeConfigTable attributes) {
        this.report = report;
        this.renames = renames;
        this.attributes = attributes;
    }

    public ConversionReport report() {
        return report;
    }

    public ElementRenameTable renames() {
        return renames;
    }

    public AttributeConfigTable attributes() {
        return attributes;
    }

    public IdSynthesizer ids() {
        return ids;
    }
}
