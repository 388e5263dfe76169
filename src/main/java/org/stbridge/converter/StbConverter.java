package org.stbridge.converter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stbridge.converter.config.AttributeConfigTable;
import org.stbridge.converter.config.ConversionOptions;
import org.stbridge.converter.config.ElementRenameTable;
import org.stbridge.converter.report.ConversionReport;
import org.stbridge.converter.report.DataLossReport;
import org.stbridge.converter.rules.AttributeChangeRules;
import org.stbridge.converter.rules.BarArrangementRules;
import org.stbridge.converter.rules.BasePlateSectionRules;
import org.stbridge.converter.rules.ConversionRule;
import org.stbridge.converter.rules.ElementRenameRules;
import org.stbridge.converter.rules.JointElementRules;
import org.stbridge.converter.rules.NewElementRules;
import org.stbridge.converter.rules.OpenElementRules;
import org.stbridge.converter.rules.PileSectionRules;
import org.stbridge.converter.rules.RuleContext;
import org.stbridge.converter.rules.SlabSectionRules;
import org.stbridge.converter.rules.SrcBeamSteelSectionRules;
import org.stbridge.converter.rules.SteelBeamSectionRules;
import org.stbridge.converter.rules.VersionRules;
import org.stbridge.converter.tree.StbDocument;
import org.stbridge.converter.tree.XmlHelper;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the ordered rule pipeline of one direction over a document.
 * <p>
 * The order of each pipeline is a dependency chain: renames come before anything that looks up the new
 * tags, joints are relocated before the attribute pass strips them, and section wrappers are in place before
 * the attribute repairs descend into them. Reverse runs the chain backwards where the shapes require it.
 */
public class StbConverter {

    private static final Logger log = LoggerFactory.getLogger(StbConverter.class);

    /**
     * A rule together with the name reported when it fails.
     */
    record Step(String name, ConversionRule rule) {
    }

    static final List<Step> FORWARD_STEPS = List.of(
            new Step("updateVersionTo210", VersionRules::updateVersionTo210),
            new Step("renameElementsTo210", ElementRenameRules::renameElementsTo210),
            new Step("renameCommonElementsTo210", ElementRenameRules::renameCommonElementsTo210),
            new Step("convertHaunchToStraightTo210", ElementRenameRules::convertHaunchToStraightTo210),
            new Step("addOrderToSrcBeamFiguresTo210", ElementRenameRules::addOrderToSrcBeamFiguresTo210),
            new Step("convertJointsTo210", JointElementRules::convertJointsTo210),
            new Step("collapseComplexBeamBarsTo210", NewElementRules::collapseComplexBeamBarsTo210),
            new Step("convertBarArrangementTo210", BarArrangementRules::convertBarArrangementTo210),
            new Step("convertSlabSectionsTo210", SlabSectionRules::convertSlabSectionsTo210),
            new Step("convertSrcBeamSteelSectionsTo210", SrcBeamSteelSectionRules::convertSrcBeamSteelSectionsTo210),
            new Step("convertPileSectionsTo210", PileSectionRules::convertPileSectionsTo210),
            new Step("convertBasePlateSectionsTo210", BasePlateSectionRules::convertBasePlateSectionsTo210),
            new Step("convertOpensTo210", OpenElementRules::convertOpensTo210),
            new Step("applyAttributeChangesTo210", AttributeChangeRules::applyAttributeChangesTo210),
            new Step("convertSteelBeamSectionsTo210", SteelBeamSectionRules::convertSteelBeamSectionsTo210),
            new Step("removeLegacyApplyConditionsTo210", NewElementRules::removeLegacyApplyConditionsTo210));

    static final List<Step> REVERSE_STEPS = List.of(
            new Step("updateVersionTo202", VersionRules::updateVersionTo202),
            new Step("expandBeamTaperTo202", AttributeChangeRules::expandBeamTaperTo202),
            new Step("expandSlabTaperTo202", AttributeChangeRules::expandSlabTaperTo202),
            new Step("convertSlabSectionsTo202", SlabSectionRules::convertSlabSectionsTo202),
            new Step("convertSrcBeamSteelSectionsTo202", SrcBeamSteelSectionRules::convertSrcBeamSteelSectionsTo202),
            new Step("collapseComplexBeamBarsTo202", NewElementRules::collapseComplexBeamBarsTo202),
            new Step("convertBarArrangementTo202", BarArrangementRules::convertBarArrangementTo202),
            new Step("removeOrderFromBeamFiguresTo202", ElementRenameRules::removeOrderFromBeamFiguresTo202),
            new Step("renameElementsTo202", ElementRenameRules::renameElementsTo202),
            new Step("applyAttributeChangesTo202", AttributeChangeRules::applyAttributeChangesTo202),
            new Step("convertSteelBeamSectionsTo202", SteelBeamSectionRules::convertSteelBeamSectionsTo202),
            new Step("convertOpensTo202", OpenElementRules::convertOpensTo202),
            new Step("convertJointsTo202", JointElementRules::convertJointsTo202),
            new Step("convertPileSectionsTo202", PileSectionRules::convertPileSectionsTo202),
            new Step("convertBasePlateSectionsTo202", BasePlateSectionRules::convertBasePlateSectionsTo202),
            new Step("removeNewElementsTo202", NewElementRules::removeNewElementsTo202));

    private final ElementRenameTable renames;
    private final AttributeConfigTable attributes;

    public StbConverter() {
        this(ElementRenameTable.defaults(), AttributeConfigTable.defaults());
    }

    public StbConverter(ElementRenameTable renames, AttributeConfigTable attributes) {
        this.renames = Objects.requireNonNull(renames, "renames");
        this.attributes = Objects.requireNonNull(attributes, "attributes");
    }

    public ConversionResult convertForward(StbDocument document) {
        return convertForward(document, ConversionOptions.defaults());
    }

    /**
     * Converts a v2.0.2 document to v2.1.0.
     *
     * @throws ConversionException when a rule fails; the input is left untouched if {@code preserveOriginal} is set
     */
    public ConversionResult convertForward(StbDocument document, ConversionOptions options) {
        Objects.requireNonNull(document, "document");
        ConversionReport report = new ConversionReport();
        String sourceVersion = detectVersion(document);
        report.info("Starting conversion: v2.0.2 -> v2.1.0");

        if (!options.skipValidation()) {
            VersionRules.validateVersion(document, StbVersion.V202.label(), report);
        }
        StbDocument target = options.preserveOriginal() ? XmlHelper.cloneDocument(document) : document;
        run(FORWARD_STEPS, target, report);
        target.canonicalizeRootTag();

        report.info("Conversion complete: " + report.getWarnings().size() + " warnings");
        return new ConversionResult(target, report, true, sourceVersion, StbVersion.V210.label());
    }

    public ConversionResult convertReverse(StbDocument document) {
        return convertReverse(document, ConversionOptions.defaults());
    }

    /**
     * Converts a v2.1.0 document to v2.0.2. With {@code warnDataLoss} set, what the downgrade drops is
     * counted on the untouched input first and stored in the report.
     *
     * @throws ConversionException when a rule fails
     */
    public ConversionResult convertReverse(StbDocument document, ConversionOptions options) {
        Objects.requireNonNull(document, "document");
        ConversionReport report = new ConversionReport();
        String sourceVersion = detectVersion(document);
        report.info("Starting conversion: v2.1.0 -> v2.0.2");

        if (!options.skipValidation()) {
            VersionRules.validateVersion(document, StbVersion.V210.label(), report);
        }
        if (options.warnDataLoss()) {
            DataLossReport dataLoss = NewElementRules.checkDataLossTo202(document);
            report.setDataLoss(dataLoss);
            if (dataLoss.hasLoss()) {
                report.warn("Data loss warning: some v2.1.0 features are not supported in v2.0.2");
                dataLoss.toWarnings().forEach(report::warn);
            }
        }
        StbDocument target = options.preserveOriginal() ? XmlHelper.cloneDocument(document) : document;
        run(REVERSE_STEPS, target, report);
        target.canonicalizeRootTag();

        report.info("Conversion complete: " + report.getWarnings().size() + " warnings");
        return new ConversionResult(target, report, true, sourceVersion, StbVersion.V202.label());
    }

    /**
     * Converts to the requested version, picking the direction from the document's own version.
     *
     * @param targetVersion loose spellings are accepted, see {@link StbVersion#normalize(String)}
     * @throws IllegalArgumentException when the target is neither 2.0.2 nor 2.1.0, or the document carries no
     *                                  version
     */
    public ConversionResult convert(StbDocument document, String targetVersion, ConversionOptions options) {
        StbVersion target = StbVersion.normalize(targetVersion)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported target version: " + targetVersion
                        + ". Supported: 2.0.2, 2.1.0"));
        String detected = detectVersion(document);
        if (detected == null || detected.isEmpty()) {
            throw new IllegalArgumentException("Could not determine STB version");
        }
        StbVersion source = StbVersion.normalize(detected).orElse(null);

        if (source == target) {
            ConversionReport report = new ConversionReport();
            report.info("Document is already v" + target.label() + ", no conversion needed");
            StbDocument result = options.preserveOriginal() ? XmlHelper.cloneDocument(document) : document;
            result.canonicalizeRootTag();
            return new ConversionResult(result, report, false, detected, target.label());
        }
        if (source == null) {
            log.warn("Unknown source version {}, converting towards {}", detected, target.label());
        }
        return switch (target) {
            case V210 -> convertForward(document, options);
            case V202 -> convertReverse(document, options);
        };
    }

    public ConversionResult convert(StbDocument document, String targetVersion) {
        return convert(document, targetVersion, ConversionOptions.defaults());
    }

    public static String detectVersion(StbDocument document) {
        return document == null ? null : VersionRules.getVersion(document);
    }

    /**
     * Checks the document against an expected version. Mismatches are logged, never thrown.
     */
    public static boolean validate(StbDocument document, String expectedVersion) {
        ConversionReport report = new ConversionReport();
        return document != null && VersionRules.validateVersion(document, expectedVersion, report);
    }

    /**
     * Structural check before a conversion: the root and the model container must exist, the version should.
     */
    public static ValidationResult validateDocument(StbDocument document) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (document == null || XmlHelper.getRoot(document).isEmpty()) {
            errors.add("Invalid ST-Bridge document: root element not found");
            return new ValidationResult(false, errors, warnings, null);
        }
        String version = detectVersion(document);
        if (version == null || version.isEmpty()) {
            warnings.add("No version attribute found in ST-Bridge element");
        } else if (StbVersion.normalize(version).isEmpty()) {
            warnings.add("Unsupported version: " + version + ". Supported: 2.0.2, 2.1.0");
        }
        if (XmlHelper.getModel(document).isEmpty()) {
            errors.add("StbModel element not found");
        }
        return new ValidationResult(errors.isEmpty(), errors, warnings, version);
    }

    private void run(List<Step> steps, StbDocument document, ConversionReport report) {
        RuleContext context = new RuleContext(report, renames, attributes);
        for (Step step : steps) {
            try {
                step.rule().apply(document, context);
            } catch (RuntimeException e) {
                report.error("Conversion failed in " + step.name() + ": " + e.getMessage());
                throw new ConversionException(step.name(), e);
            }
        }
    }
}
