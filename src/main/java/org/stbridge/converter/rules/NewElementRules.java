package org.stbridge.converter.rules;

import org.stbridge.converter.report.DataLossReport;
import org.stbridge.converter.tree.StbDocument;
import org.stbridge.converter.tree.StbNode;
import org.stbridge.converter.tree.XmlHelper;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Elements that exist in only one of the two versions: the restructured apply-condition list, complex beam
 * bar arrangements and the pile reinforcement strength list. Also produces the data-loss pre-scan for
 * downgrades.
 */
public class NewElementRules {

    static final String APPLY_CONDITIONS = "StbApplyConditionsList";
    static final String PILE_STRENGTH_LIST = "StbReinforcementStrengthListPile";
    static final String BEAM_SIMPLE = "StbSecBarBeamSimple";
    static final String BEAM_COMPLEX = "StbSecBarBeamComplex";
    static final String COMPLEX_MAIN = "StbSecBarBeamComplexMain";
    static final String COMPLEX_STIRRUP = "StbSecBarBeamComplexStirrup";

    /**
     * Children of the v2.0.2 apply-condition list. v2.1.0 replaced them with the RC and S lists.
     */
    static final List<String> LEGACY_APPLY_CONDITIONS = List.of(
            "StbColumn_RC_RebarPositionApply",
            "StbColumn_RC_BarSpacingApply",
            "StbColumn_SRC_RebarPositionApply",
            "StbColumn_SRC_BarSpacingApply",
            "StbBeam_RC_RebarPositionApply",
            "StbBeam_RC_BarWebApply",
            "StbBeam_RC_BarSpacingApply",
            "StbBeam_SRC_RebarPositionApply",
            "StbBeam_SRC_BarWebApply",
            "StbBeam_SRC_BarSpacingApply",
            "StbSlab_RC_BarPositionApply",
            "StbWall_RC_BarPositionApply",
            "StbFoundation_RC_BarPositionApply",
            "StbPile_RC_BarPositionApply",
            "StbParapet_RC_BarPositionApply");

    private static final String[][] BEAM_BAR_ARRANGEMENTS = {
            {"StbSecBeam_RC", "StbSecBarArrangementBeam_RC"},
            {"StbSecBeam_SRC", "StbSecBarArrangementBeam_SRC"},
    };

    private NewElementRules() {
    }

    /**
     * Drops the legacy apply-condition children, and the list itself when nothing else is left in it.
     */
    public static void removeLegacyApplyConditionsTo210(StbDocument document, RuleContext context) {
        StbNode common = XmlHelper.getCommon(document).orElse(null);
        StbNode list = common == null ? null : common.child(APPLY_CONDITIONS);
        if (list == null) {
            return;
        }
        int removed = 0;
        for (String tag : LEGACY_APPLY_CONDITIONS) {
            if (!list.removeChildren(tag).isEmpty()) {
                removed++;
            }
        }
        if (removed == 0) {
            return;
        }
        context.report().info("Removed " + removed
                + " v2.0.2 StbApplyConditionsList child elements (restructured in v2.1.0)");
        if (!list.hasChildren()) {
            common.removeChildren(APPLY_CONDITIONS);
            context.report().info("Removed empty StbApplyConditionsList element");
        }
    }

    /**
     * Collapses position variants of a beam bar arrangement into one simple arrangement. The CENTER variant
     * wins, then START, then the first one.
     * <p>
     * Requires: renamed bar tags. Must run before the bar arrangement pass fills the simple element.
     */
    public static void collapseComplexBeamBarsTo210(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        int collapsed = 0;
        for (String[] config : BEAM_BAR_ARRANGEMENTS) {
            for (StbNode beam : XmlHelper.collect(sections, config[0])) {
                for (StbNode arrangement : beam.children(config[1])) {
                    List<StbNode> variants = arrangement.removeChildren(BEAM_COMPLEX);
                    if (variants.isEmpty()) {
                        continue;
                    }
                    if (arrangement.hasChild(BEAM_SIMPLE)) {
                        context.report().warn("Beam " + beam.attr("id") + ": " + variants.size()
                                + " complex bar variants dropped next to an existing simple arrangement");
                        continue;
                    }
                    StbNode representative = representative(variants);
                    representative.removeAttr("pos");
                    arrangement.setChildren(BEAM_SIMPLE, List.of(representative));
                    collapsed++;
                    if (variants.size() > 1) {
                        context.report().warn("Beam bar complex has " + variants.size()
                                + " position variants. Collapsed to one StbSecBarBeamSimple using representative section.");
                    }
                }
            }
        }
        if (collapsed > 0) {
            context.report().info("Collapsed " + collapsed + " complex beam bar arrangements");
        }
    }

    static StbNode representative(List<StbNode> variants) {
        for (String pos : List.of("CENTER", "START")) {
            for (StbNode variant : variants) {
                if (pos.equals(variant.attr("pos"))) {
                    return variant;
                }
            }
        }
        return variants.get(0);
    }

    /**
     * Folds v2.1.0 complex beam bar arrangements into one simple arrangement, which the bar arrangement pass
     * then flattens into the v2.0.2 bar element. Of the section positions only CENTER is kept, else START,
     * else the first one. The main bar rows of that position become {@code StbSecBarBeamSimpleMain} rows,
     * their bar face taken from {@code pos_bar}.
     * <p>
     * Must run before the bar arrangement pass.
     */
    public static void collapseComplexBeamBarsTo202(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        for (String[] config : BEAM_BAR_ARRANGEMENTS) {
            for (StbNode beam : XmlHelper.collect(sections, config[0])) {
                for (StbNode arrangement : beam.children(config[1])) {
                    List<StbNode> complexes = arrangement.removeChildren(BEAM_COMPLEX);
                    if (complexes.isEmpty()) {
                        continue;
                    }
                    if (arrangement.hasChild(BEAM_SIMPLE)) {
                        context.report().warn("StbSecBarBeamComplex removed for beam " + beam.attr("id")
                                + " (not supported in v2.0.2)");
                        continue;
                    }
                    StbNode complex = representative(complexes);
                    StbNode simple = new StbNode();
                    complex.attributes().forEach(simple::setAttr);
                    simple.removeAttr("pos");

                    List<StbNode> stirrups = complex.children(COMPLEX_STIRRUP);
                    if (!stirrups.isEmpty()) {
                        representative(stirrups).attributes().forEach((name, value) -> {
                            if (!"pos".equals(name)) {
                                simple.setAttrIfAbsent(name, value);
                            }
                        });
                    }
                    List<StbNode> mains = complex.children(COMPLEX_MAIN);
                    String kept = mains.isEmpty() ? complex.attr("pos") : representative(mains).attr("pos");
                    List<StbNode> rows = new ArrayList<>();
                    for (StbNode main : mains) {
                        if (Objects.equals(kept, main.attr("pos"))) {
                            rows.add(simpleMainRow(main));
                        }
                    }
                    if (!rows.isEmpty()) {
                        simple.setChildren(BarArrangementRules.BEAM_MAIN, rows);
                    }
                    arrangement.setChildren(BEAM_SIMPLE, List.of(simple));
                    context.report().warn("StbSecBarBeamComplex collapsed for beam " + beam.attr("id")
                            + ": only the " + (kept == null ? "first" : kept)
                            + " section kept (not supported in v2.0.2)");
                }
            }
        }
    }

    private static StbNode simpleMainRow(StbNode main) {
        StbNode row = new StbNode();
        main.attributes().forEach(row::setAttr);
        row.removeAttr("pos");
        String face = row.removeAttr("pos_bar");
        row.setAttr("pos", face == null ? "TOP" : face);
        return row;
    }

    /**
     * Removes the pile reinforcement strength list, wherever the common block sits.
     */
    public static void removeNewElementsTo202(StbDocument document, RuleContext context) {
        int removed = 0;
        for (StbNode common : commonBlocks(document)) {
            if (!common.removeChildren(PILE_STRENGTH_LIST).isEmpty()) {
                removed++;
                context.report().warn("Removed StbReinforcementStrengthListPile - not supported in v2.0.2");
            }
        }
        if (removed > 0) {
            context.report().info("Removed " + removed + " v2.1.0 specific elements");
        }
    }

    /**
     * Counts what a downgrade will drop or simplify. Does not modify the document.
     */
    public static DataLossReport checkDataLossTo202(StbDocument document) {
        StbNode model = XmlHelper.getModel(document).orElse(null);
        if (model == null) {
            return DataLossReport.none();
        }
        int joints = XmlHelper.all(model, XmlHelper.MEMBERS, "StbJointArrangements", "StbJointArrangement").size();
        boolean pileList = commonBlocks(document).stream().anyMatch(c -> c.hasChild(PILE_STRENGTH_LIST));
        int multiSection = 0;
        for (StbNode figure : XmlHelper.collect(model, XmlHelper.SECTIONS, "StbSecBeam_S",
                SteelBeamSectionRules.FIGURE)) {
            if (figure.children(SteelBeamSectionRules.SHAPE).size() > 1) {
                multiSection++;
            }
        }
        StbNode sections = model.child(XmlHelper.SECTIONS);
        int complexBars = BarArrangementRules.countColumnComplexBars(sections);
        for (String[] config : BEAM_BAR_ARRANGEMENTS) {
            for (StbNode arrangement : XmlHelper.collect(sections, config[0], config[1])) {
                if (arrangement.hasChild(BEAM_COMPLEX)) {
                    complexBars++;
                }
            }
        }
        return DataLossReport.builder()
                .jointArrangements(joints)
                .pileStrengthList(pileList)
                .multiSectionBeams(multiSection)
                .multiItemBasePlates(BasePlateSectionRules.countMultiItemBasePlates(sections))
                .complexBarArrangements(complexBars)
                .build();
    }

    // root-level common first, the model-level one is accepted too
    private static List<StbNode> commonBlocks(StbDocument document) {
        StbNode rootCommon = XmlHelper.getCommon(document).orElse(null);
        StbNode modelCommon = XmlHelper.getModel(document).map(m -> m.child(XmlHelper.COMMON)).orElse(null);
        if (rootCommon == null) {
            return modelCommon == null ? List.of() : List.of(modelCommon);
        }
        return modelCommon == null ? List.of(rootCommon) : List.of(rootCommon, modelCommon);
    }
}
