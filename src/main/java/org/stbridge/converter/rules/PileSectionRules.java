package org.stbridge.converter.rules;

import org.stbridge.converter.config.ElementRenameTable;
import org.stbridge.converter.tree.StbDocument;
import org.stbridge.converter.tree.StbNode;
import org.stbridge.converter.tree.XmlHelper;

import java.util.ArrayList;
import java.util.List;

/**
 * Pile sections gain a "conventional" wrapper in v2.1.0. Precast piles are also renamed from
 * {@code StbSecPileProduct} to {@code StbSecPilePrecast}.
 */
public class PileSectionRules {

    static final String RC_PILE = "StbSecPile_RC";
    static final String RC_FIGURE = "StbSecFigurePile_RC";
    static final String RC_BAR = "StbSecBarArrangementPile_RC";
    static final String RC_WRAPPER = "StbSecPile_RC_Conventional";
    static final String RC_FIGURE_210 = "StbSecFigurePile_RC_Conventional";
    static final String RC_BAR_210 = "StbSecBarArrangementPile_RC_Conventional";

    static final String S_PILE = "StbSecPile_S";
    static final String S_WRAPPER = "StbSecPile_S_Conventional";
    static final List<String> S_SEGMENTS = List.of(
            "StbSecPile_S_Straight", "StbSecPile_S_Rotational", "StbSecPile_S_Taper");

    static final String PRODUCT_PILE = "StbSecPileProduct";
    static final String PRECAST_PILE = "StbSecPilePrecast";
    static final String PRECAST_WRAPPER = "StbSecPilePrecastConventional";

    private PileSectionRules() {
    }

    public static void convertPileSectionsTo210(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        if (sections == null) {
            return;
        }
        convertRcPilesTo210(sections, context);
        convertSteelPilesTo210(sections, context);
        convertPrecastPilesTo210(sections, context);
    }

    public static void convertPileSectionsTo202(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        if (sections == null) {
            return;
        }
        convertRcPilesTo202(sections, context);
        convertSteelPilesTo202(sections, context);
        convertPrecastPilesTo202(sections, context);
    }

    // ------- RC

    private static void convertRcPilesTo210(StbNode sections, RuleContext context) {
        ElementRenameTable renames = context.renames();
        int converted = 0;
        for (StbNode pile : sections.children(RC_PILE)) {
            List<StbNode> figures = pile.children(RC_FIGURE);
            if (figures.isEmpty()) {
                continue;
            }
            StbNode figure = pile.removeChildren(RC_FIGURE).get(0);
            renames.apply(figure, "rcPileFigure", true);

            StbNode wrapper = new StbNode();
            wrapper.addChild(RC_FIGURE_210, figure);
            List<StbNode> bars = pile.removeChildren(RC_BAR);
            if (!bars.isEmpty()) {
                wrapper.addChild(RC_BAR_210, bars.get(0));
            }
            pile.setChildren(RC_WRAPPER, List.of(wrapper));
            converted++;
            context.report().debug("Converted RC pile section " + pile.attr("id") + " to v2.1.0 format");
        }
        if (converted > 0) {
            context.report().info("Converted " + converted + " StbSecPile_RC elements to v2.1.0 format");
        }
    }

    private static void convertRcPilesTo202(StbNode sections, RuleContext context) {
        ElementRenameTable renames = context.renames();
        int converted = 0;
        for (StbNode pile : sections.children(RC_PILE)) {
            StbNode wrapper = pile.child(RC_WRAPPER);
            StbNode figure = wrapper == null ? null : wrapper.child(RC_FIGURE_210);
            if (figure == null) {
                continue;
            }
            renames.apply(figure, "rcPileFigure", false);
            pile.removeChildren(RC_WRAPPER);
            if (!pile.removeChildren("StbSecPile_RC_Certified").isEmpty()) {
                context.report().warn("StbSecPile_RC " + pile.attr("id")
                        + ": certified pile data removed (not supported in v2.0.2)");
            }
            pile.setChildren(RC_FIGURE, List.of(figure));
            StbNode bar = wrapper.child(RC_BAR_210);
            if (bar != null) {
                pile.setChildren(RC_BAR, List.of(bar));
            }
            converted++;
        }
        if (converted > 0) {
            context.report().info("Converted " + converted + " StbSecPile_RC elements to v2.0.2 format");
        }
    }

    // ------- S

    private static void convertSteelPilesTo210(StbNode sections, RuleContext context) {
        int converted = 0;
        for (StbNode pile : sections.children(S_PILE)) {
            if (pile.hasChild(S_WRAPPER)) {
                continue;
            }
            StbNode wrapper = new StbNode();
            for (String segment : S_SEGMENTS) {
                wrapper.setChildren(segment, pile.removeChildren(segment));
            }
            pile.setChildren(S_WRAPPER, List.of(wrapper));
            converted++;
        }
        if (converted > 0) {
            context.report().info("Converted " + converted + " StbSecPile_S elements to v2.1.0 format");
        }
    }

    private static void convertSteelPilesTo202(StbNode sections, RuleContext context) {
        int converted = 0;
        for (StbNode pile : sections.children(S_PILE)) {
            StbNode wrapper = pile.child(S_WRAPPER);
            if (wrapper == null) {
                continue;
            }
            for (String segment : S_SEGMENTS) {
                pile.setChildren(segment, wrapper.children(segment));
            }
            pile.removeChildren(S_WRAPPER);
            for (String dropped : List.of("StbSecPile_S_Certified", "StbSecPile_S_Joint", "StbSecPile_S_Connection")) {
                if (!pile.removeChildren(dropped).isEmpty()) {
                    context.report().warn("StbSecPile_S " + pile.attr("id") + ": " + dropped
                            + " removed (not supported in v2.0.2)");
                }
            }
            converted++;
        }
        if (converted > 0) {
            context.report().info("Converted " + converted + " StbSecPile_S elements to v2.0.2 format");
        }
    }

    // ------- precast

    private static void convertPrecastPilesTo210(StbNode sections, RuleContext context) {
        List<StbNode> products = sections.children(PRODUCT_PILE);
        if (products.isEmpty()) {
            return;
        }
        for (StbNode pile : products) {
            context.renames().apply(pile, "precastPile", true);
            StbNode wrapper = new StbNode();
            moveAllChildren(pile, wrapper);
            pile.setChildren(PRECAST_WRAPPER, List.of(wrapper));
        }
        int converted = products.size();
        sections.renameChildTag(PRODUCT_PILE, PRECAST_PILE);
        context.report().info("Converted " + converted
                + " StbSecPileProduct elements to StbSecPilePrecast (v2.1.0 format)");
    }

    private static void convertPrecastPilesTo202(StbNode sections, RuleContext context) {
        List<StbNode> precast = sections.children(PRECAST_PILE);
        if (precast.isEmpty()) {
            return;
        }
        int converted = 0;
        for (StbNode pile : precast) {
            List<StbNode> wrappers = pile.removeChildren(PRECAST_WRAPPER);
            if (wrappers.isEmpty()) {
                context.report().warn("StbSecPilePrecast " + pile.attr("id")
                        + " has no Conventional wrapper - removing certified");
                pile.removeChildren("StbSecPilePrecastCertified");
                continue;
            }
            StbNode wrapper = wrappers.get(0);
            context.renames().apply(wrapper, "precastPile", false);
            pile.removeChildren("StbSecPilePrecastCertified");
            moveAllChildren(wrapper, pile);
            converted++;
        }
        sections.renameChildTag(PRECAST_PILE, PRODUCT_PILE);
        if (converted > 0) {
            context.report().info("Converted " + converted
                    + " StbSecPilePrecast elements to StbSecPileProduct (v2.0.2 format)");
        }
    }

    private static void moveAllChildren(StbNode from, StbNode to) {
        for (String tag : new ArrayList<>(from.childTags())) {
            to.setChildren(tag, from.removeChildren(tag));
        }
    }
}
