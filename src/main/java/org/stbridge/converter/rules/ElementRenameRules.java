package org.stbridge.converter.rules;

import org.stbridge.converter.config.ElementRenameTable;
import org.stbridge.converter.tree.StbDocument;
import org.stbridge.converter.tree.StbNode;
import org.stbridge.converter.tree.XmlHelper;

import java.util.ArrayList;
import java.util.List;

/**
 * Section sub-element renames between v2.0.2 and v2.1.0, driven by the scopes of
 * {@code stb/element-renames.json}.
 */
public class ElementRenameRules {

    private ElementRenameRules() {
    }

    public static void renameElementsTo210(StbDocument document, RuleContext context) {
        renameSections(document, context, true);
    }

    public static void renameElementsTo202(StbDocument document, RuleContext context) {
        renameSections(document, context, false);
    }

    /**
     * Fixes the lower-case spelling of the reinforcement strength list some v2.0.2 files use.
     */
    public static void renameCommonElementsTo210(StbDocument document, RuleContext context) {
        StbNode common = XmlHelper.getCommon(document).orElse(null);
        if (common == null) {
            context.report().debug("No StbCommon found");
            return;
        }
        ElementRenameTable table = context.renames();
        int count = 0;
        for (StbNode list : common.children("StbReinforcementstrengthList")) {
            count += table.apply(list, "common", true);
        }
        count += table.apply(common, "common", true);
        if (count > 0) {
            context.report().info("StbCommon element renaming complete: " + count + " elements renamed");
        }
    }

    /**
     * Folds haunched RC/SRC beam figures into a single straight figure. The CENTER position is kept,
     * or the middle element when no position is marked CENTER.
     */
    public static void convertHaunchToStraightTo210(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        if (sections == null) {
            return;
        }
        List<StbNode> figures = new ArrayList<>();
        figures.addAll(XmlHelper.collect(sections, "StbSecBeam_RC", "StbSecFigureBeam_RC"));
        figures.addAll(XmlHelper.collect(sections, "StbSecBeam_SRC", "StbSecFigureBeam_SRC"));

        int converted = 0;
        for (StbNode figure : figures) {
            List<StbNode> haunches = figure.children("StbSecBeamHaunch");
            if (haunches.isEmpty()) {
                continue;
            }
            StbNode representative = haunches.stream()
                    .filter(h -> "CENTER".equals(h.attr("pos")))
                    .findFirst()
                    .orElse(haunches.get(haunches.size() / 2));

            StbNode straight = new StbNode()
                    .setAttr("width", representative.attr("width"))
                    .setAttr("depth", representative.attr("depth"))
                    .setAttr("horizontal_offset", representative.attr("horizontal_offset"))
                    .setAttr("vertical_offset", representative.attr("vertical_offset"));
            figure.removeChildren("StbSecBeamHaunch");
            figure.setChildren("StbSecBeamStraight", List.of(straight));
            converted++;
        }
        if (converted > 0) {
            context.report().warn("Converted " + converted + " haunch beams to straight (lossy conversion)");
        }
    }

    /**
     * Numbers SRC beam figures and bar arrangements that carry no {@code order} yet.
     */
    public static void addOrderToSrcBeamFiguresTo210(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        if (sections == null) {
            return;
        }
        int count = 0;
        for (StbNode section : sections.children("StbSecBeam_SRC")) {
            count += addOrder(section.children("StbSecFigureBeam_SRC"));
            count += addOrder(section.children("StbSecBarArrangementBeam_SRC"));
        }
        if (count > 0) {
            context.report().info("Added " + count + " order attributes to SRC beam figures");
        }
    }

    /**
     * Drops the {@code order} index from RC and SRC beam figures and bar arrangements. v2.0.2 encodes the
     * sequence by element order alone.
     */
    public static void removeOrderFromBeamFiguresTo202(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        if (sections == null) {
            return;
        }
        int count = 0;
        for (String material : List.of("RC", "SRC")) {
            for (StbNode section : sections.children("StbSecBeam_" + material)) {
                for (String tag : List.of("StbSecFigureBeam_" + material, "StbSecBarArrangementBeam_" + material)) {
                    for (StbNode node : section.children(tag)) {
                        if (node.removeAttr("order") != null) {
                            count++;
                        }
                    }
                }
            }
        }
        if (count > 0) {
            context.report().info("Removed " + count + " order attributes from beam figures");
        }
    }

    /**
     * Sets {@code order} to the 1-based position for every node lacking one.
     *
     * @return number of nodes changed
     */
    static int addOrder(List<StbNode> nodes) {
        int count = 0;
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).setAttrIfAbsent("order", String.valueOf(i + 1))) {
                count++;
            }
        }
        return count;
    }

    private static void renameSections(StbDocument document, RuleContext context, boolean toV210) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        if (sections == null) {
            context.report().debug("No StbSections found");
            return;
        }
        ElementRenameTable table = context.renames();
        int count = 0;

        for (StbNode section : sections.children("StbSecColumn_RC")) {
            count += apply(table, section.children("StbSecFigureColumn_RC"), "rcColumnFigure", toV210);
            count += apply(table, section.children("StbSecBarArrangementColumn_RC"), "rcColumnBar", toV210);
        }

        for (StbNode section : sections.children("StbSecColumn_SRC")) {
            count += apply(table, section.children("StbSecFigureColumn_SRC"), "srcColumnFigure", toV210);
            for (StbNode steelFigure : section.children("StbSecSteelFigureColumn_SRC")) {
                count += apply(table, steelFigure.children("StbSecSteelColumn_SRC_Same"),
                        "srcColumnSteelSame", toV210);
                count += apply(table, steelFigure.children("StbSecSteelColumn_SRC_NotSame"),
                        "srcColumnSteelNotSame", toV210);
                count += apply(table, steelFigure.children("StbSecSteelColumn_SRC_ThreeTypes"),
                        "srcColumnSteelThreeTypes", toV210);
            }
            count += apply(table, section.children("StbSecBarArrangementColumn_SRC"), "srcColumnBar", toV210);
        }

        for (StbNode section : sections.children("StbSecBeam_RC")) {
            List<StbNode> figures = section.children("StbSecFigureBeam_RC");
            if (toV210) {
                addOrder(figures);
            }
            count += apply(table, figures, "rcBeamFigure", toV210);
            count += apply(table, section.children("StbSecBarArrangementBeam_RC"), "rcBeamBar", toV210);
        }

        for (StbNode section : sections.children("StbSecBeam_SRC")) {
            count += apply(table, section.children("StbSecFigureBeam_SRC"), "srcBeamFigure", toV210);
            for (StbNode steelFigure : section.children("StbSecSteelFigureBeam_SRC")) {
                count += table.apply(steelFigure, "srcBeamSteel", toV210);
                count += apply(table, steelFigure.children("StbSecSteelBeam_SRC_Same"), "srcBeamSteel", toV210);
                count += apply(table, steelFigure.children("StbSecSteelBeam_SRC_NotSame"), "srcBeamSteel", toV210);
                count += apply(table, steelFigure.children("StbSecSteelBeam_SRC_ThreeTypes"),
                        "srcBeamSteel", toV210);
            }
            count += apply(table, section.children("StbSecBarArrangementBeam_SRC"), "srcBeamBar", toV210);
        }

        context.report().info("Element renaming complete: " + count + " elements renamed");
    }

    private static int apply(ElementRenameTable table, List<StbNode> parents, String scope, boolean toV210) {
        int count = 0;
        for (StbNode parent : parents) {
            count += table.apply(parent, scope, toV210);
        }
        return count;
    }
}
