package org.stbridge.converter.rules;

import org.stbridge.converter.tree.StbDocument;
import org.stbridge.converter.tree.StbNode;
import org.stbridge.converter.tree.XmlHelper;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Multi-section S beam restructuring.
 * <p>
 * v2.0.2 lists one element per fixed position (START, CENTER, END, ...). v2.1.0 lists shape segments
 * ordered by {@code order}: every pair of adjacent positions becomes one segment, a straight segment when
 * both ends share the cross-section name and a taper segment otherwise.
 */
public class SteelBeamSectionRules {

    static final String FIGURE = "StbSecSteelFigureBeam_S";
    static final String SHAPE = "StbSecSteelBeam_S_Shape";
    static final String STRAIGHT_210 = "StbSecSteelBeamStraight";
    static final String TAPER_210 = "StbSecSteelBeamTaper";

    private static final String STRAIGHT = "StbSecSteelBeam_S_Straight";
    private static final String TAPER = "StbSecSteelBeam_S_Taper";
    private static final String JOINT = "StbSecSteelBeam_S_Joint";
    private static final String HAUNCH = "StbSecSteelBeam_S_Haunch";
    private static final String FIVE_TYPES = "StbSecSteelBeam_S_FiveTypes";

    private static final Map<String, Integer> TAPER_POSITIONS = Map.of("START", 0, "END", 1);
    private static final Map<String, Integer> THREE_POSITIONS = Map.of("START", 0, "CENTER", 1, "END", 2);
    private static final Map<String, Integer> FIVE_POSITIONS =
            Map.of("START", 0, "HAUNCH_S", 1, "CENTER", 2, "HAUNCH_E", 3, "END", 4);

    private static final List<String> TWO_SEGMENT_POSITIONS = List.of("START", "CENTER", "END");
    private static final List<String> THREE_SEGMENT_POSITIONS = List.of("START", "HAUNCH_S", "CENTER", "END");
    private static final List<String> FOUR_SEGMENT_POSITIONS = List.of("START", "HAUNCH_S", "CENTER", "HAUNCH_E", "END");

    private SteelBeamSectionRules() {
    }

    /**
     * Converts position-based S beam figures to ordered shape segments.
     */
    public static void convertSteelBeamSectionsTo210(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        if (sections == null) {
            return;
        }
        int converted = 0;
        for (StbNode beam : sections.children("StbSecBeam_S")) {
            StbNode figure = beam.child(FIGURE);
            if (figure == null) {
                // legacy files put the shapes directly on the section
                List<StbNode> shapes = convertDirectElements(beam);
                if (!shapes.isEmpty()) {
                    beam.addChild(FIGURE, new StbNode()).setChildren(SHAPE, shapes);
                    converted++;
                }
                continue;
            }
            if (figure.hasChild(SHAPE)) {
                context.report().debug("Beam " + beam.attr("id") + ": already in v2.1.0 format");
                continue;
            }
            List<StbNode> shapes = convertFigure(figure);
            if (!shapes.isEmpty()) {
                figure.setChildren(SHAPE, shapes);
                converted++;
                context.report().debug("Beam " + beam.attr("id") + " (" + beam.attr("name") + "): converted "
                        + shapes.size() + " segments");
            }
        }
        if (converted > 0) {
            context.report().info("S Beam sections: Converted " + converted + " beams to v2.1.0 format");
        }
    }

    private static List<StbNode> convertFigure(StbNode figure) {
        List<StbNode> shapes = new ArrayList<>();
        int[] order = {1};

        for (StbNode straight : figure.removeChildren(STRAIGHT)) {
            shapes.add(straightShape(order[0]++, straight));
        }
        List<StbNode> tapers = sortByPosition(figure.removeChildren(TAPER), TAPER_POSITIONS);
        if (tapers.size() >= 2) {
            shapes.add(segmentShape(order[0]++, tapers.get(0), tapers.get(1)));
        }
        for (String tag : List.of(JOINT, HAUNCH)) {
            shapes.addAll(segments(sortByPosition(figure.removeChildren(tag), THREE_POSITIONS), order));
        }
        shapes.addAll(segments(sortByPosition(figure.removeChildren(FIVE_TYPES), FIVE_POSITIONS), order));
        return shapes;
    }

    private static List<StbNode> convertDirectElements(StbNode beam) {
        List<StbNode> shapes = new ArrayList<>();
        int order = 1;
        for (StbNode straight : beam.removeChildren(STRAIGHT)) {
            shapes.add(straightShape(order++, straight));
        }
        List<StbNode> tapers = sortByPosition(beam.removeChildren(TAPER), TAPER_POSITIONS);
        if (tapers.size() >= 2) {
            shapes.add(segmentShape(order, tapers.get(0), tapers.get(1)));
        }
        return shapes;
    }

    /**
     * One segment per adjacent pair of positions.
     */
    static List<StbNode> segments(List<StbNode> positions, int[] order) {
        List<StbNode> shapes = new ArrayList<>();
        for (int i = 0; i < positions.size() - 1; i++) {
            shapes.add(segmentShape(order[0]++, positions.get(i), positions.get(i + 1)));
        }
        return shapes;
    }

    static StbNode segmentShape(int order, StbNode start, StbNode end) {
        String startShape = start.attr("shape");
        if (startShape != null && startShape.equals(end.attr("shape"))) {
            return straightShape(order, start);
        }
        return taperShape(order, start, end);
    }

    private static StbNode straightShape(int order, StbNode source) {
        StbNode straight = new StbNode()
                .setAttr("shape", source.attr("shape"))
                .setAttr("strength_main", source.attr("strength_main"))
                .setAttr("strength_web", source.attr("strength_web"))
                .setAttr("horizontal_offset", source.attr("horizontal_offset"))
                .setAttr("vertical_offset", source.attr("vertical_offset"));
        StbNode shape = new StbNode().setAttr("order", String.valueOf(order));
        shape.addChild(STRAIGHT_210, straight);
        return shape;
    }

    private static StbNode taperShape(int order, StbNode start, StbNode end) {
        StbNode taper = new StbNode()
                .setAttr("start_shape", start.attr("shape"))
                .setAttr("end_shape", end.attr("shape"))
                .setAttr("strength_main", start.attr("strength_main"))
                .setAttr("strength_web", start.attr("strength_web"))
                .setAttr("start_horizontal_offset", start.attr("horizontal_offset"))
                .setAttr("start_vertical_offset", start.attr("vertical_offset"))
                .setAttr("end_horizontal_offset", end.attr("horizontal_offset"))
                .setAttr("end_vertical_offset", end.attr("vertical_offset"));
        StbNode shape = new StbNode().setAttr("order", String.valueOf(order));
        shape.addChild(TAPER_210, taper);
        return shape;
    }

    private static List<StbNode> sortByPosition(List<StbNode> nodes, Map<String, Integer> positions) {
        List<StbNode> sorted = new ArrayList<>(nodes);
        sorted.sort(Comparator.comparingInt(n -> positions.getOrDefault(n.attr("pos"), 99)));
        return sorted;
    }

    /**
     * Rebuilds position-based elements from shape segments. One segment gives a Straight or a START/END
     * Taper pair. Two segments give a three-position Haunch. Three or four give FiveTypes. Positions past
     * the fifth cannot be represented and are dropped with a warning.
     */
    public static void convertSteelBeamSectionsTo202(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        if (sections == null) {
            return;
        }
        int converted = 0;
        int multiSection = 0;
        for (StbNode beam : sections.children("StbSecBeam_S")) {
            StbNode figure = beam.child(FIGURE);
            if (figure == null || !figure.hasChild(SHAPE)) {
                continue;
            }
            List<StbNode> shapes = new ArrayList<>(figure.removeChildren(SHAPE));
            shapes.sort(Comparator.comparingDouble(s -> orderOf(s)));
            String beamName = beam.attr("name") != null ? beam.attr("name") : beam.attr("id");

            if (shapes.size() == 1) {
                restoreSingleSegment(figure, shapes.get(0));
            } else {
                multiSection++;
                context.report().warn("Multi-segment beam \"" + beamName + "\" has " + shapes.size()
                        + " segments. Converting to appropriate v2.0.2 format.");
                List<StbNode> positions = positionsFromSegments(shapes);
                List<String> names = shapes.size() == 2 ? TWO_SEGMENT_POSITIONS
                        : shapes.size() == 3 ? THREE_SEGMENT_POSITIONS
                        : FOUR_SEGMENT_POSITIONS;
                if (positions.size() > names.size()) {
                    context.report().warn("Beam \"" + beamName + "\": " + (positions.size() - names.size())
                            + " section positions beyond END dropped");
                }
                List<StbNode> legacy = new ArrayList<>();
                for (int i = 0; i < Math.min(positions.size(), names.size()); i++) {
                    legacy.add(positions.get(i).setAttr("pos", names.get(i)));
                }
                figure.setChildren(shapes.size() == 2 ? HAUNCH : FIVE_TYPES, legacy);
            }
            converted++;
        }
        if (converted > 0) {
            context.report().info("S Beam sections: Converted " + converted + " beams to v2.0.2 format");
        }
        if (multiSection > 0) {
            context.report().warn("Note: " + multiSection + " multi-segment beams were converted.");
        }
    }

    private static void restoreSingleSegment(StbNode figure, StbNode shape) {
        StbNode straight = shape.child(STRAIGHT_210);
        if (straight != null) {
            figure.addChild(STRAIGHT, new StbNode()
                    .setAttr("shape", straight.attr("shape"))
                    .setAttr("strength_main", straight.attr("strength_main"))
                    .setAttr("strength_web", straight.attr("strength_web"))
                    .setAttr("horizontal_offset", straight.attr("horizontal_offset"))
                    .setAttr("vertical_offset", straight.attr("vertical_offset")));
            return;
        }
        StbNode taper = shape.child(TAPER_210);
        if (taper != null) {
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

    /**
     * Each segment contributes its end section. The first segment also contributes its start section.
     */
    static List<StbNode> positionsFromSegments(List<StbNode> shapes) {
        List<StbNode> positions = new ArrayList<>();
        for (int i = 0; i < shapes.size(); i++) {
            StbNode straight = shapes.get(i).child(STRAIGHT_210);
            StbNode taper = shapes.get(i).child(TAPER_210);
            if (straight != null) {
                if (i == 0) {
                    positions.add(section(straight.attr("shape"), straight));
                }
                positions.add(section(straight.attr("shape"), straight));
            } else if (taper != null) {
                if (i == 0) {
                    positions.add(section(taper.attr("start_shape"), taper));
                }
                positions.add(section(taper.attr("end_shape"), taper));
            }
        }
        return positions;
    }

    private static StbNode section(String shape, StbNode source) {
        return new StbNode()
                .setAttr("shape", shape)
                .setAttr("strength_main", source.attr("strength_main"))
                .setAttr("strength_web", source.attr("strength_web"));
    }

    private static double orderOf(StbNode shape) {
        double order = XmlHelper.number(shape.attr("order"));
        return Double.isNaN(order) ? Double.MAX_VALUE : order;
    }
}
