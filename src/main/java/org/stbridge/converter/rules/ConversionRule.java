package org.stbridge.converter.rules;

import org.stbridge.converter.tree.StbDocument;

/**
 * One in-place pass over a document.
 */
@FunctionalInterface
public interface ConversionRule {
    void apply(StbDocument document, RuleContext context);
}
