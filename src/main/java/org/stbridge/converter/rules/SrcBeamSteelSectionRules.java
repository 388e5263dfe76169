package org.stbridge.converter.rules;

import org.stbridge.converter.tree.StbDocument;
import org.stbridge.converter.tree.StbNode;
import org.stbridge.converter.tree.XmlHelper;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * SRC beam steel figures: v2.0.2 Straight/Taper/Haunch elements become ordered
 * {@code StbSecSteelBeam_SRC_Shape} wrappers in v2.1.0.
 */
public class SrcBeamSteelSectionRules {

    static final String FIGURE = "StbSecSteelFigureBeam_SRC";
    static final String SHAPE = "StbSecSteelBeam_SRC_Shape";

    private static final String STRAIGHT = "StbSecSteelBeam_SRC_Straight";
    private static final String TAPER = "StbSecSteelBeam_SRC_Taper";
    private static final String HAUNCH = "StbSecSteelBeam_SRC_Haunch";

    private SrcBeamSteelSectionRules() {
    }

    /**
     * START and END taper fragments are paired in document order. Fragments left without a partner, or
     * without any position, become straight shapes with a warning. Haunch fragments become straight shapes.
     * <p>
     * Requires: renamed tags. Must run before the attribute pass drops figures without a shape.
     */
    public static void convertSrcBeamSteelSectionsTo210(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        int converted = 0;
        for (StbNode figure : XmlHelper.collect(sections, "StbSecBeam_SRC", FIGURE)) {
            List<StbNode> shapes = new ArrayList<>();
            int order = 1;

            List<StbNode> straights = figure.removeChildren(STRAIGHT);
            for (StbNode straight : straights) {
                shapes.add(straightShape(order++, straight));
            }
            converted += straights.isEmpty() ? 0 : 1;

            List<StbNode> tapers = figure.removeChildren(TAPER);
            if (!tapers.isEmpty()) {
                List<StbNode> starts = withPos(tapers, "START");
                List<StbNode> ends = withPos(tapers, "END");
                int pairs = Math.min(starts.size(), ends.size());
                for (int i = 0; i < pairs; i++) {
                    shapes.add(taperShape(order++, starts.get(i), ends.get(i), context));
                }
                List<StbNode> unmatched = new ArrayList<>(starts.subList(pairs, starts.size()));
                unmatched.addAll(ends.subList(pairs, ends.size()));
                if (!unmatched.isEmpty()) {
                    context.report().warn("SRC Beam steel sections: " + unmatched.size()
                            + " unmatched taper endpoints found. Converting unmatched items as straight.");
                    for (StbNode taper : unmatched) {
                        shapes.add(straightShape(order++, taper));
                    }
                }
                if (starts.isEmpty() && ends.isEmpty()) {
                    context.report().warn("SRC Beam steel sections: taper elements missing pos START/END. "
                            + "Converting as straight.");
                    for (StbNode taper : tapers) {
                        shapes.add(straightShape(order++, taper));
                    }
                }
                converted++;
            }

            List<StbNode> haunches = figure.removeChildren(HAUNCH);
            for (StbNode haunch : haunches) {
                shapes.add(straightShape(order++, haunch));
            }
            converted += haunches.isEmpty() ? 0 : 1;

            if (!shapes.isEmpty()) {
                figure.setChildren(SHAPE, shapes);
            }
        }
        if (converted > 0) {
            context.report().info("SRC Beam steel sections: Converted " + converted + " elements to v2.1.0 format");
        }
    }

    private static List<StbNode> withPos(List<StbNode> nodes, String pos) {
        List<StbNode> result = new ArrayList<>();
        for (StbNode node : nodes) {
            if (pos.equals(node.attr("pos"))) {
                result.add(node);
            }
        }
        return result;
    }

    private static StbNode straightShape(int order, StbNode source) {
        StbNode shape = new StbNode().setAttr("order", String.valueOf(order));
        shape.addChild(SteelBeamSectionRules.STRAIGHT_210, new StbNode()
                .setAttr("shape", source.hasAttr("shape") ? source.attr("shape") : "")
                .setAttr("strength_main", source.hasAttr("strength_main") ? source.attr("strength_main") : "")
                .setAttr("strength_web", source.attr("strength_web"))
                .setAttr("horizontal_offset", source.attr("horizontal_offset"))
                .setAttr("vertical_offset", source.attr("vertical_offset")));
        return shape;
    }

    private static StbNode taperShape(int order, StbNode start, StbNode end, RuleContext context) {
        String startStrength = start.attr("strength_main");
        String endStrength = end.attr("strength_main");
        if (startStrength != null && endStrength != null && !startStrength.equals(endStrength)) {
            context.report().warn("SRC steel taper order=" + order + ": strength_main mismatch (" + startStrength
                    + " vs " + endStrength + "). Using START value.");
        }
        String strength = startStrength != null ? startStrength : endStrength;
        String web = start.attr("strength_web") != null ? start.attr("strength_web") : end.attr("strength_web");

        StbNode shape = new StbNode().setAttr("order", String.valueOf(order));
        shape.addChild(SteelBeamSectionRules.TAPER_210, new StbNode()
                .setAttr("start_shape", start.hasAttr("shape") ? start.attr("shape") : "")
                .setAttr("end_shape", end.hasAttr("shape") ? end.attr("shape") : "")
                .setAttr("strength_main", strength != null ? strength : "")
                .setAttr("strength_web", web)
                .setAttr("start_horizontal_offset", start.attr("horizontal_offset"))
                .setAttr("start_vertical_offset", start.attr("vertical_offset"))
                .setAttr("end_horizontal_offset", end.attr("horizontal_offset"))
                .setAttr("end_vertical_offset", end.attr("vertical_offset")));
        return shape;
    }

    /**
     * Each straight shape becomes a Straight element, each taper shape a START/END Taper pair, in shape order.
     */
    public static void convertSrcBeamSteelSectionsTo202(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        int converted = 0;
        for (StbNode figure : XmlHelper.collect(sections, "StbSecBeam_SRC", FIGURE)) {
            List<StbNode> shapes = new ArrayList<>(figure.removeChildren(SHAPE));
            if (shapes.isEmpty()) {
                continue;
            }
            shapes.sort(Comparator.comparingDouble(s -> {
                double order = XmlHelper.number(s.attr("order"));
                return Double.isNaN(order) ? Double.MAX_VALUE : order;
            }));
            for (StbNode shape : shapes) {
                StbNode straight = shape.child(SteelBeamSectionRules.STRAIGHT_210);
                StbNode taper = shape.child(SteelBeamSectionRules.TAPER_210);
                if (straight != null) {
                    figure.addChild(STRAIGHT, new StbNode(straight.attributes()));
                } else if (taper != null) {
                    for (String end : List.of("start", "end")) {
                        figure.addChild(TAPER, new StbNode()
                                .setAttr("pos", end.toUpperCase())
                                .setAttr("shape", taper.attr(end + "_shape"))
                                .setAttr("strength_main", taper.attr("strength_main"))
                                .setAttr("strength_web", taper.attr("strength_web"))
                                .setAttr("horizontal_offset", taper.attr(end + "_horizontal_offset"))
                                .setAttr("vertical_offset", taper.attr(end + "_vertical_offset")));
                    }
                }
            }
            if (shapes.size() > 1) {
                context.report().warn("SRC beam steel figure with " + shapes.size()
                        + " shapes flattened; segment order is kept only by element order");
            }
            converted++;
        }
        if (converted > 0) {
            context.report().info("SRC Beam steel sections: Converted " + converted + " figures to v2.0.2 format");
        }
    }
}
