package org.stbridge.converter.rules;

import org.stbridge.converter.tree.StbDocument;
import org.stbridge.converter.tree.StbNode;
import org.stbridge.converter.tree.XmlHelper;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Bar arrangement wrapper restructuring for RC and SRC columns and beams.
 * <p>
 * v2.0.2 keeps bar sizes and counts on the bar element and covers on the arrangement. v2.1.0 wants a
 * {@code ...Simple} child holding both. Beam main bars become one {@code StbSecBarBeamSimpleMain} row per
 * position and layer.
 * <p>
 * Requires: renamed bar tags and collapsed complex beam bars. Must run before the attribute pass removes
 * the arrangement covers.
 */
public class BarArrangementRules {

    private static final Map<String, String> RECT_COLUMN_ATTRS = orderedMap(
            "D_main", "D_main",
            "D_band", "D_hoop",
            "strength_main", "strength_main",
            "strength_band", "strength_hoop",
            "N_main_X_1st", "N_X",
            "N_main_Y_1st", "N_Y",
            "N_band_direction_X", "N_hoop_X",
            "N_band_direction_Y", "N_hoop_Y",
            "pitch_band", "pitch_hoop",
            "D_axial", "D_axial",
            "strength_axial", "strength_axial",
            "N_axial", "N_axial",
            "D_2nd_main", "D_sub",
            "strength_2nd_main", "strength_sub");

    private static final Map<String, String> CIRCLE_COLUMN_ATTRS = orderedMap(
            "D_main", "D_main",
            "D_band", "D_hoop",
            "strength_main", "strength_main",
            "strength_band", "strength_hoop",
            "N_main", "N_main",
            "N_band", "N_hoop_X",
            "pitch_band", "pitch_hoop",
            "D_axial", "D_axial",
            "strength_axial", "strength_axial",
            "N_axial", "N_axial");

    /**
     * Arrangement attributes that move down to the simple child.
     */
    static final List<String> PARENT_TO_CHILD = List.of(
            "depth_cover_start_X", "depth_cover_end_X", "depth_cover_start_Y", "depth_cover_end_Y",
            "depth_cover_left", "depth_cover_right", "depth_cover_top", "depth_cover_bottom",
            "interval", "center_start_X", "center_end_X", "center_start_Y", "center_end_Y", "center_interval");

    private static final List<String> RECT_ONLY = List.of(
            "depth_cover_start_X", "depth_cover_end_X", "depth_cover_start_Y", "depth_cover_end_Y",
            "interval", "center_start_X", "center_end_X", "center_start_Y", "center_end_Y", "center_interval");

    /**
     * Attributes with an exclusive minimum of zero. A zero value is dropped rather than kept.
     */
    private static final List<String> LENGTH_ATTRS = List.of(
            "depth_cover_start_X", "depth_cover_end_X", "depth_cover_start_Y", "depth_cover_end_Y",
            "depth_cover_left", "depth_cover_right", "depth_cover_top", "depth_cover_bottom", "depth_cover",
            "interval", "center_start_X", "center_end_X", "center_start_Y", "center_end_Y", "center_interval",
            "center", "pitch_hoop", "pitch_stirrup");

    private static final List<String> BAR_SPACING_ATTRS =
            List.of("D_bar_spacing", "strength_bar_spacing", "pitch_bar_spacing");

    private static final List<String> BEAM_SIMPLE_ATTRS = List.of(
            "D_stirrup", "strength_stirrup", "pitch_stirrup", "N_stirrup", "D_web", "N_web", "strength_web");

    private static final List<String> COLUMN_BARS = List.of(
            "StbSecBarColumnRectSame", "StbSecBarColumnRectNotSame",
            "StbSecBarColumnCircleSame", "StbSecBarColumnCircleNotSame");

    private static final String[][] COLUMN_ARRANGEMENTS = {
            {"StbSecColumn_RC", "StbSecBarArrangementColumn_RC"},
            {"StbSecColumn_SRC", "StbSecBarArrangementColumn_SRC"},
    };

    private static final String[][] BEAM_ARRANGEMENTS = {
            {"StbSecBeam_RC", "StbSecBarArrangementBeam_RC"},
            {"StbSecBeam_SRC", "StbSecBarArrangementBeam_SRC"},
    };

    static final String BEAM_SIMPLE = "StbSecBarBeamSimple";
    static final String BEAM_MAIN = "StbSecBarBeamSimpleMain";
    private static final List<String> LAYERS = List.of("1st", "2nd", "3rd");

    private BarArrangementRules() {
    }

    public static void convertBarArrangementTo210(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        if (sections == null) {
            return;
        }
        int columns = 0;
        int beams = 0;
        for (String[] config : COLUMN_ARRANGEMENTS) {
            for (StbNode section : sections.children(config[0])) {
                for (StbNode arrangement : section.children(config[1])) {
                    convertColumnArrangement(arrangement);
                    columns++;
                }
            }
        }
        for (String[] config : BEAM_ARRANGEMENTS) {
            for (StbNode section : sections.children(config[0])) {
                List<StbNode> arrangements = section.children(config[1]);
                ElementRenameRules.addOrder(arrangements);
                for (StbNode arrangement : arrangements) {
                    convertBeamArrangement(arrangement);
                    beams++;
                }
            }
        }
        if (columns > 0 || beams > 0) {
            context.report().info("Bar arrangement structure conversion: " + columns + " columns, " + beams + " beams");
        }
    }

    private static void convertColumnArrangement(StbNode arrangement) {
        boolean circle = arrangement.hasChild("StbSecBarColumnCircleSame")
                || arrangement.hasChild("StbSecBarColumnCircleNotSame");
        Map<String, String> attrMap = circle ? CIRCLE_COLUMN_ATTRS : RECT_COLUMN_ATTRS;

        for (String tag : COLUMN_BARS) {
            for (StbNode bar : arrangement.children(tag)) {
                if (bar.hasChild(tag + "Simple")) {
                    continue;
                }
                StbNode simple = new StbNode();
                attrMap.forEach((oldName, newName) -> simple.setAttr(newName, bar.attr(oldName)));
                simple.setAttr("pos", bar.attr("pos"));
                for (String name : PARENT_TO_CHILD) {
                    simple.setAttr(name, arrangement.attr(name));
                }
                if (circle) {
                    if (!simple.hasAttr("N_hoop_Y")) {
                        simple.setAttr("N_hoop_Y", bar.attr("N_band"));
                    }
                    XmlHelper.removeAttrs(simple, RECT_ONLY);
                }
                removeZeroLengths(simple);

                simple.setAttrIfAbsent("D_main", "D19");
                if (circle) {
                    simple.setAttrIfAbsent("N_main", "8");
                } else {
                    simple.setAttrIfAbsent("N_X", "3");
                    simple.setAttrIfAbsent("N_Y", "3");
                }
                simple.setAttrIfAbsent("D_hoop", "D10");
                simple.setAttrIfAbsent("N_hoop_X", "1");
                simple.setAttrIfAbsent("N_hoop_Y", "1");
                simple.setAttrIfAbsent("pitch_hoop", "100");

                retainOnly(bar, BAR_SPACING_ATTRS);
                bar.setChildren(tag + "Simple", List.of(simple));
            }
        }
        XmlHelper.removeAttrs(arrangement, PARENT_TO_CHILD);
    }

    private static void convertBeamArrangement(StbNode arrangement) {
        Map<String, String> barSpacing = new LinkedHashMap<>();
        for (StbNode simple : arrangement.children(BEAM_SIMPLE)) {
            if (simple.hasChild(BEAM_MAIN)) {
                continue;
            }
            for (String name : BAR_SPACING_ATTRS) {
                if (simple.hasAttr(name)) {
                    barSpacing.put(name, simple.attr(name));
                }
            }
            Map<String, String> legacy = new LinkedHashMap<>(simple.attributes());
            simple.attributes().clear();
            for (String name : BEAM_SIMPLE_ATTRS) {
                simple.setAttr(name, legacy.get(name));
            }
            for (String name : PARENT_TO_CHILD) {
                simple.setAttr(name, arrangement.attr(name));
            }
            removeZeroLengths(simple);
            simple.setAttrIfAbsent("D_stirrup", "D10");
            simple.setAttrIfAbsent("N_stirrup", "2");
            simple.setAttrIfAbsent("pitch_stirrup", "200");
            simple.setChildren(BEAM_MAIN, mainRows(legacy));
        }
        XmlHelper.removeAttrs(arrangement, PARENT_TO_CHILD);
        barSpacing.forEach(arrangement::setAttr);
    }

    /**
     * TOP rows first, then BOTTOM. Each position lists the main bar layers and continues the step count
     * with the second main bar layers. A position without layer counts gets one row from {@code N_top}
     * or {@code N_bottom}, else two bars.
     */
    static List<StbNode> mainRows(Map<String, String> legacy) {
        String mainD = valueOr(legacy.get("D_main"), "D19");
        List<StbNode> rows = new ArrayList<>();
        for (String pos : List.of("top", "bottom")) {
            int step = 1;
            String posName = pos.toUpperCase();
            for (String layer : LAYERS) {
                String n = legacy.get("N_main_" + pos + "_" + layer);
                if (n != null && !n.isEmpty()) {
                    rows.add(row(posName, step++, mainD, legacy.get("strength_main"), n));
                }
            }
            if (step == 1) {
                rows.add(row(posName, step++, mainD, legacy.get("strength_main"),
                        valueOr(legacy.get("N_" + pos), "2")));
            }
            String secondD = legacy.get("D_2nd_main");
            if (secondD != null && !secondD.isEmpty()) {
                for (String layer : LAYERS) {
                    String n = legacy.get("N_2nd_main_" + pos + "_" + layer);
                    if (n != null && !n.isEmpty()) {
                        rows.add(row(posName, step++, secondD, legacy.get("strength_2nd_main"), n));
                    }
                }
            }
        }
        return rows;
    }

    private static StbNode row(String pos, int step, String d, String strength, String n) {
        return new StbNode()
                .setAttr("pos", pos)
                .setAttr("step", String.valueOf(step))
                .setAttr("D", d)
                .setAttr("strength", strength)
                .setAttr("N", n);
    }

    /**
     * Moves the simple child's attributes back onto the bar element and the arrangement. Defaults filled
     * in on the way up are kept.
     */
    public static void convertBarArrangementTo202(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        if (sections == null) {
            return;
        }
        int columns = 0;
        int beams = 0;
        for (String[] config : COLUMN_ARRANGEMENTS) {
            for (StbNode section : sections.children(config[0])) {
                for (StbNode arrangement : section.children(config[1])) {
                    columns += flattenColumnArrangement(arrangement, section.attr("id"), context);
                }
            }
        }
        for (String[] config : BEAM_ARRANGEMENTS) {
            for (StbNode section : sections.children(config[0])) {
                for (StbNode arrangement : section.children(config[1])) {
                    beams += flattenBeamArrangement(arrangement, section.attr("id"), context);
                }
            }
        }
        if (columns > 0 || beams > 0) {
            context.report().info("Bar arrangement structure restored: " + columns + " column bars, "
                    + beams + " beam bars");
        }
    }

    /**
     * Counts complex column bar variants, which a downgrade folds into one simple bar element.
     */
    static int countColumnComplexBars(StbNode sections) {
        int count = 0;
        for (String[] config : COLUMN_ARRANGEMENTS) {
            for (String tag : COLUMN_BARS) {
                count += XmlHelper.collect(sections, config[0], config[1], tag, tag + "Complex").size();
            }
        }
        return count;
    }

    private static int flattenColumnArrangement(StbNode arrangement, String sectionId, RuleContext context) {
        int count = 0;
        for (String tag : COLUMN_BARS) {
            boolean circle = tag.contains("Circle");
            Map<String, String> attrMap = circle ? CIRCLE_COLUMN_ATTRS : RECT_COLUMN_ATTRS;
            for (StbNode bar : arrangement.children(tag)) {
                List<StbNode> complexes = bar.removeChildren(tag + "Complex");
                List<StbNode> simples = bar.removeChildren(tag + "Simple");
                if (!complexes.isEmpty()) {
                    if (simples.isEmpty()) {
                        StbNode kept = NewElementRules.representative(complexes);
                        simples = List.of(kept);
                        context.report().warn("Section " + sectionId + ": " + tag + "Complex collapsed, only the "
                                + (kept.attr("pos") == null ? "first" : kept.attr("pos"))
                                + " variant kept (not supported in v2.0.2)");
                    } else {
                        context.report().warn("Section " + sectionId + ": " + tag
                                + "Complex removed (not supported in v2.0.2)");
                    }
                }
                if (simples.isEmpty()) {
                    continue;
                }
                StbNode simple = simples.get(0);
                attrMap.forEach((oldName, newName) -> {
                    if (simple.hasAttr(newName)) {
                        bar.setAttr(oldName, simple.attr(newName));
                    }
                });
                bar.setAttr("pos", simple.attr("pos"));
                for (String name : PARENT_TO_CHILD) {
                    if (simple.hasAttr(name)) {
                        arrangement.setAttrIfAbsent(name, simple.attr(name));
                    }
                }
                count++;
            }
        }
        return count;
    }

    private static int flattenBeamArrangement(StbNode arrangement, String sectionId, RuleContext context) {
        int count = 0;
        Map<String, String> barSpacing = new LinkedHashMap<>();
        for (String name : BAR_SPACING_ATTRS) {
            String value = arrangement.removeAttr(name);
            if (value != null) {
                barSpacing.put(name, value);
            }
        }
        for (StbNode simple : arrangement.children(BEAM_SIMPLE)) {
            List<StbNode> rows = simple.removeChildren(BEAM_MAIN);
            for (String name : PARENT_TO_CHILD) {
                String value = simple.removeAttr(name);
                if (value != null) {
                    arrangement.setAttrIfAbsent(name, value);
                }
            }
            restoreMainBars(simple, rows, sectionId, context);
            barSpacing.forEach(simple::setAttr);
            count++;
        }
        return count;
    }

    /**
     * Leading rows sharing the first row's bar size and strength are main bar layers, up to three. Rows
     * after them are second main bar layers, up to three more.
     */
    static void restoreMainBars(StbNode simple, List<StbNode> rows, String sectionId, RuleContext context) {
        if (rows.isEmpty()) {
            return;
        }
        for (String pos : List.of("TOP", "BOTTOM")) {
            List<StbNode> atPos = new ArrayList<>();
            for (StbNode row : rows) {
                if (pos.equals(row.attr("pos"))) {
                    atPos.add(row);
                }
            }
            if (atPos.isEmpty()) {
                continue;
            }
            atPos.sort(Comparator.comparingDouble(r -> {
                double step = XmlHelper.number(r.attr("step"));
                return Double.isNaN(step) ? Double.MAX_VALUE : step;
            }));
            StbNode first = atPos.get(0);
            simple.setAttrIfAbsent("D_main", first.attr("D"));
            if (first.attr("strength") != null) {
                simple.setAttrIfAbsent("strength_main", first.attr("strength"));
            }
            String suffix = pos.toLowerCase();
            int i = 0;
            int layer = 0;
            while (i < atPos.size() && layer < LAYERS.size() && sameBar(first, atPos.get(i))) {
                simple.setAttr("N_main_" + suffix + "_" + LAYERS.get(layer++), atPos.get(i++).attr("N"));
            }
            layer = 0;
            if (i < atPos.size()) {
                StbNode second = atPos.get(i);
                simple.setAttrIfAbsent("D_2nd_main", second.attr("D"));
                if (second.attr("strength") != null) {
                    simple.setAttrIfAbsent("strength_2nd_main", second.attr("strength"));
                }
            }
            while (i < atPos.size() && layer < LAYERS.size()) {
                simple.setAttr("N_2nd_main_" + suffix + "_" + LAYERS.get(layer++), atPos.get(i++).attr("N"));
            }
            if (i < atPos.size()) {
                context.report().warn("Section " + sectionId + ": " + (atPos.size() - i) + " " + pos
                        + " main bar rows dropped (v2.0.2 holds three layers per bar size)");
            }
        }
    }

    private static boolean sameBar(StbNode a, StbNode b) {
        return Objects.equals(a.attr("D"), b.attr("D"))
                && Objects.equals(a.attr("strength"), b.attr("strength"));
    }

    private static void removeZeroLengths(StbNode node) {
        for (String name : LENGTH_ATTRS) {
            if ("0".equals(node.attr(name))) {
                node.removeAttr(name);
            }
        }
    }

    private static void retainOnly(StbNode node, List<String> names) {
        node.attributes().keySet().retainAll(names);
    }

    private static String valueOr(String value, String fallback) {
        return value == null || value.isEmpty() ? fallback : value;
    }

    private static Map<String, String> orderedMap(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return map;
    }
}
