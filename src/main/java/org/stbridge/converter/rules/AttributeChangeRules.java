package org.stbridge.converter.rules;

import org.stbridge.converter.config.AttributeConfigTable;
import org.stbridge.converter.config.AttributeConfigTable.Kind;
import org.stbridge.converter.config.AttributeRule;
import org.stbridge.converter.report.ConversionReport;
import org.stbridge.converter.tree.StbDocument;
import org.stbridge.converter.tree.StbNode;
import org.stbridge.converter.tree.XmlHelper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Attribute additions and removals between v2.0.2 and v2.1.0, plus the one-off repairs that make a
 * converted document satisfy the v2.1.0 value constraints (positive lengths, valid enumerations,
 * minimum list lengths).
 * <p>
 * Requires: renamed section tags, joints already relocated, slab and pile wrappers in place.
 */
public class AttributeChangeRules {

    private static final List<String> ZERO_BAR_COUNT_ATTRS = List.of(
            "N_X", "N_Y", "N_hoop_X", "N_hoop_Y", "N", "N_stirrup",
            "pitch_hoop", "pitch_stirrup", "pitch", "pitch_X", "pitch_Y");

    private static final List<String> ZERO_STEEL_LENGTH_ATTRS = List.of(
            "D", "t", "A", "B", "r", "r1", "r2", "t1", "t2");

    private static final List<String> PILE_LENGTH_ATTRS = List.of("length_all", "length_head", "length_foot");

    private static final List<String> PITCH_ATTRS = List.of(
            "pitch_hoop", "pitch_stirrup", "pitch", "pitch_band", "pitch_bar_spacing");

    private static final List<String> DEPTH_COVER_ATTRS = List.of(
            "depth_cover_start_X", "depth_cover_end_X", "depth_cover_start_Y", "depth_cover_end_Y",
            "depth_cover_X", "depth_cover_Y", "depth_cover");

    private static final Pattern STEEL_NAME_SEPARATOR = Pattern.compile("[x×-]");
    private static final String DEFAULT_FILLET_RADIUS = "13";

    private AttributeChangeRules() {
    }

    /**
     * Runs every v2.0.2 to v2.1.0 attribute pass in dependency order.
     */
    public static void applyAttributeChangesTo210(StbDocument document, RuleContext context) {
        AttributeConfigTable table = context.attributes();

        // members first, then new attributes, then sections
        for (AttributeRule rule : table.rules(Kind.REMOVED_IN_210)) {
            if (!rule.name().startsWith("StbSec")) {
                removeAttributes(document, rule, context.report());
            }
        }
        addAttributesTo210(document, context);
        for (AttributeRule rule : table.rules(Kind.REMOVED_IN_210)) {
            if (rule.name().startsWith("StbSec")) {
                removeAttributes(document, rule, context.report());
            }
        }

        removeGuidFromRestrictedElements(document, context);
        removeRcSectionAttributesTo210(document, context);
        removeBarArrangementParentAttrsTo210(document, context);
        removeSteelSectionAttributesTo210(document, context);
        addMissingSteelAttributesTo210(document, context);
        removeRollCTypeAttributeTo210(document, context);
        removeWallIsPressTo210(document, context);
        removeSlabTypeHaunchTo210(document, context);
        fixZeroBarCountsTo210(document, context);
        fixZeroSteelLengthsTo210(document, context);
        removeSs7ExtensionTo210(document, context);
        removeSrcBeamInvalidElementsTo210(document, context);
        fixPileLengthsTo210(document, context);
        convertBeamTaperTo210(document, context);
        convertSlabTaperTo210(document, context);
        removeInvalidNodeIdOrderTo210(document, context);
        removeEmptyNodeIdListTo210(document, context);
        fixZeroPitchAttrsTo210(document, context);
        renameSlabBarTo210(document, context);
        removeStbOpensDirectTo210(document, context);
        removeInvalidSecPipeTo210(document, context);
        removeEmptyBarArrangementFoundationTo210(document, context);
        removeInvalidSecOpenTo210(document, context);
        removeStbExtensionsTo210(document, context);
        removeInvalidJointsTo210(document, context);
    }

    /**
     * Drops the attributes v2.1.0 introduced and writes back the defaults v2.0.2 requires.
     */
    public static void applyAttributeChangesTo202(StbDocument document, RuleContext context) {
        AttributeConfigTable table = context.attributes();
        StbNode root = XmlHelper.getRoot(document).orElse(null);
        if (root == null) {
            return;
        }
        for (AttributeRule rule : table.rules(Kind.ADDED_IN_210)) {
            List<String> names = new ArrayList<>(rule.defaults().keySet());
            names.addAll(rule.specialHandling());
            names.addAll(rule.attributes());
            int count = 0;
            for (StbNode node : XmlHelper.collect(root, rule.path().toArray(String[]::new))) {
                count += XmlHelper.removeAttrs(node, names);
            }
            if (count > 0) {
                context.report().info(rule.name() + ": Removed " + count + " v2.1.0 attributes");
            }
        }
        for (AttributeRule rule : table.rules(Kind.RESTORED_IN_202)) {
            addDefaults(root, rule, context.report(), "v2.0.2");
        }
    }

    /**
     * Strips the attributes of one removal entry from every element at its path.
     *
     * @return number of attributes removed
     */
    static int removeAttributes(StbDocument document, AttributeRule rule, ConversionReport report) {
        StbNode root = XmlHelper.getRoot(document).orElse(null);
        if (root == null) {
            return 0;
        }
        int count = 0;
        for (StbNode node : XmlHelper.collect(root, rule.path().toArray(String[]::new))) {
            count += XmlHelper.removeAttrs(node, rule.attributes());
        }
        if (count > 0) {
            report.info(rule.name() + ": Removed " + count + " attributes for v2.1.0");
        } else {
            report.debug(rule.name() + ": no attributes removed");
        }
        return count;
    }

    /**
     * Adds the v2.1.0 attributes with their defaults. A story's {@code level_name} is derived from its height.
     */
    public static void addAttributesTo210(StbDocument document, RuleContext context) {
        StbNode root = XmlHelper.getRoot(document).orElse(null);
        if (root == null) {
            return;
        }
        for (AttributeRule rule : context.attributes().rules(Kind.ADDED_IN_210)) {
            if (rule.specialHandling().contains("level_name")) {
                int count = 0;
                for (StbNode node : XmlHelper.collect(root, rule.path().toArray(String[]::new))) {
                    String height = node.attr("height");
                    if (height != null && node.setAttrIfAbsent("level_name", "FL+" + height)) {
                        count++;
                    }
                }
                if (count > 0) {
                    context.report().info(rule.name() + ": Added " + count + " level_name attributes");
                }
            }
            addDefaults(root, rule, context.report(), "v2.1.0");
        }
    }

    private static void addDefaults(StbNode root, AttributeRule rule, ConversionReport report, String target) {
        if (rule.defaults().isEmpty()) {
            return;
        }
        int count = 0;
        for (StbNode node : XmlHelper.collect(root, rule.path().toArray(String[]::new))) {
            for (Map.Entry<String, String> entry : rule.defaults().entrySet()) {
                if (node.setAttrIfAbsent(entry.getKey(), entry.getValue())) {
                    count++;
                }
            }
        }
        if (count > 0) {
            report.info(rule.name() + ": Added " + count + " default attributes for " + target);
        }
    }

    public static void removeGuidFromRestrictedElements(StbDocument document, RuleContext context) {
        StbNode model = XmlHelper.getModel(document).orElse(null);
        if (model == null) {
            return;
        }
        List<StbNode> targets = new ArrayList<>();
        targets.addAll(XmlHelper.collect(model, "StbAxes", "StbParallelAxes"));
        targets.addAll(XmlHelper.collect(model, "StbStories", "StbStory"));
        StbNode sections = model.child(XmlHelper.SECTIONS);
        if (sections != null) {
            for (String kind : context.attributes().guidNotAllowed()) {
                if (kind.startsWith("StbSec")) {
                    targets.addAll(sections.children(kind));
                }
            }
        }
        int count = 0;
        for (StbNode node : targets) {
            if (node.removeAttr("guid") != null) {
                count++;
            }
        }
        if (count > 0) {
            context.report().info("Removed " + count + " guid attributes from restricted elements");
        }
    }

    /**
     * Removes the deprecated cover and center attributes from every child of RC and SRC figures.
     */
    public static void removeRcSectionAttributesTo210(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        List<String> names = context.attributes().removedAttributes("StbSecColumnRect");
        if (sections == null || names.isEmpty()) {
            return;
        }
        List<StbNode> figures = new ArrayList<>();
        figures.addAll(XmlHelper.collect(sections, "StbSecColumn_RC", "StbSecFigureColumn_RC"));
        figures.addAll(XmlHelper.collect(sections, "StbSecBeam_RC", "StbSecFigureBeam_RC"));
        figures.addAll(XmlHelper.collect(sections, "StbSecColumn_SRC", "StbSecFigureColumn_SRC"));
        figures.addAll(XmlHelper.collect(sections, "StbSecBeam_SRC", "StbSecFigureBeam_SRC"));

        int count = 0;
        for (StbNode figure : figures) {
            for (List<StbNode> children : figure.childMap().values()) {
                for (StbNode child : children) {
                    count += XmlHelper.removeAttrs(child, names);
                }
            }
        }
        if (count > 0) {
            context.report().info("Removed " + count + " deprecated RC section figure attributes");
        }
    }

    public static void removeBarArrangementParentAttrsTo210(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        List<String> names = context.attributes().removedAttributes("StbSecBarArrangementColumn_RC");
        if (sections == null || names.isEmpty()) {
            return;
        }
        List<StbNode> arrangements = new ArrayList<>();
        arrangements.addAll(XmlHelper.collect(sections, "StbSecColumn_RC", "StbSecBarArrangementColumn_RC"));
        arrangements.addAll(XmlHelper.collect(sections, "StbSecColumn_SRC", "StbSecBarArrangementColumn_SRC"));
        arrangements.addAll(XmlHelper.collect(sections, "StbSecBeam_RC", "StbSecBarArrangementBeam_RC"));
        arrangements.addAll(XmlHelper.collect(sections, "StbSecBeam_SRC", "StbSecBarArrangementBeam_SRC"));

        int count = 0;
        for (StbNode arrangement : arrangements) {
            count += XmlHelper.removeAttrs(arrangement, names);
        }
        if (count > 0) {
            context.report().info("Removed " + count + " bar arrangement parent attributes");
        }
    }

    /**
     * Removes the deprecated steel beam attributes everywhere below S, SRC and steel sections.
     */
    public static void removeSteelSectionAttributesTo210(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        List<String> names = context.attributes().removedAttributes("StbSecSteelBeam_S_Straight");
        if (sections == null || names.isEmpty()) {
            return;
        }
        int[] count = {0};
        for (String kind : List.of("StbSecBeam_S", "StbSecBrace_S", "StbSecColumn_S")) {
            for (StbNode section : sections.children(kind)) {
                count[0] += XmlHelper.removeAttrs(section, names);
                XmlHelper.forEachDescendant(section, node -> count[0] += XmlHelper.removeAttrs(node, names));
            }
        }
        for (String kind : List.of("StbSecBeam_SRC", "StbSecColumn_SRC", "StbSecSteel")) {
            for (StbNode section : sections.children(kind)) {
                XmlHelper.forEachDescendant(section, node -> count[0] += XmlHelper.removeAttrs(node, names));
            }
        }
        if (count[0] > 0) {
            context.report().info("Removed " + count[0] + " deprecated S section attributes");
        }
    }

    /**
     * Fills {@code type} and a positive {@code r} on rolled H shapes and {@code type} on rolled boxes.
     */
    public static void addMissingSteelAttributesTo210(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        if (sections == null) {
            return;
        }
        int count = 0;
        for (StbNode steel : sections.children("StbSecSteel")) {
            for (StbNode rollH : steel.children("StbSecRoll-H")) {
                String name = rollH.attr("name");
                if (rollH.setAttrIfAbsent("type", name != null && name.startsWith("SH") ? "SH" : "H")) {
                    count++;
                }
                String r = rollH.attr("r");
                if (r == null || r.isEmpty() || "0".equals(r)) {
                    rollH.setAttr("r", filletRadiusFromName(name));
                    count++;
                }
            }
            for (StbNode rollBox : steel.children("StbSecRoll-BOX")) {
                if (rollBox.setAttrIfAbsent("type", "ELSE")) {
                    count++;
                }
            }
        }
        if (count > 0) {
            context.report().info("Added " + count + " missing required attributes to steel sections");
        }
    }

    /**
     * Reads the fillet radius from names like {@code H-600x200x11x17x13}.
     */
    static String filletRadiusFromName(String name) {
        if (name == null) {
            return DEFAULT_FILLET_RADIUS;
        }
        String[] parts = STEEL_NAME_SEPARATOR.split(name, -1);
        if (parts.length >= 6) {
            String last = parts[parts.length - 1];
            String digits = last.replaceFirst("^(\\d+).*$", "$1");
            if (!digits.isEmpty() && digits.chars().allMatch(Character::isDigit) && Integer.parseInt(digits) > 0) {
                return last;
            }
        }
        return DEFAULT_FILLET_RADIUS;
    }

    public static void removeRollCTypeAttributeTo210(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        if (sections == null) {
            return;
        }
        int count = 0;
        for (StbNode steel : sections.children("StbSecSteel")) {
            for (String kind : List.of("StbSecRoll-C", "StbSecRoll-L")) {
                for (StbNode shape : steel.children(kind)) {
                    if (shape.removeAttr("type") != null) {
                        count++;
                    }
                }
            }
        }
        if (count > 0) {
            context.report().info("Removed 'type' attribute from " + count + " Roll-C/Roll-L elements");
        }
    }

    public static void removeWallIsPressTo210(StbDocument document, RuleContext context) {
        removeMemberAttribute(document, context, "StbWalls", "StbWall", "isPress");
    }

    public static void removeSlabTypeHaunchTo210(StbDocument document, RuleContext context) {
        removeMemberAttribute(document, context, "StbSlabs", "StbSlab", "type_haunch");
    }

    private static void removeMemberAttribute(StbDocument document, RuleContext context,
                                              String collection, String element, String attribute) {
        StbNode members = XmlHelper.getMembers(document).orElse(null);
        int count = 0;
        for (StbNode member : XmlHelper.collect(members, collection, element)) {
            if (member.removeAttr(attribute) != null) {
                count++;
            }
        }
        if (count > 0) {
            context.report().info("Removed '" + attribute + "' attribute from " + count + " " + element + " elements");
        }
    }

    /**
     * Bar counts and pitches of {@code 0} in RC columns and beams become {@code 1}.
     */
    public static void fixZeroBarCountsTo210(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        if (sections == null) {
            return;
        }
        int count = 0;
        for (String kind : List.of("StbSecColumn_RC", "StbSecBeam_RC")) {
            for (StbNode section : sections.children(kind)) {
                count += replaceZeroRecursively(section, ZERO_BAR_COUNT_ATTRS);
            }
        }
        if (count > 0) {
            context.report().info("Fixed " + count + " zero bar count values to positive integers");
        }
    }

    public static void fixZeroSteelLengthsTo210(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        if (sections == null) {
            return;
        }
        int count = 0;
        for (StbNode steel : sections.children("StbSecSteel")) {
            count += replaceZeroRecursively(steel, ZERO_STEEL_LENGTH_ATTRS);
        }
        if (count > 0) {
            context.report().info("Fixed " + count + " zero length attribute values");
        }
    }

    private static int replaceZeroRecursively(StbNode start, List<String> names) {
        int[] count = {replaceZero(start, names)};
        XmlHelper.forEachDescendant(start, node -> count[0] += replaceZero(node, names));
        return count[0];
    }

    private static int replaceZero(StbNode node, List<String> names) {
        int count = 0;
        for (String name : names) {
            if ("0".equals(node.attr(name))) {
                node.setAttr(name, "1");
                count++;
            }
        }
        return count;
    }

    /**
     * Removes {@code StbSS7ModelExtension} from the model or from the extension container.
     */
    public static void removeSs7ExtensionTo210(StbDocument document, RuleContext context) {
        StbNode root = XmlHelper.getRoot(document).orElse(null);
        StbNode model = root == null ? null : root.child(XmlHelper.MODEL);
        if (model != null && !model.removeChildren("StbSS7ModelExtension").isEmpty()) {
            context.report().info("Removed StbSS7ModelExtension from StbModel");
        }
        if (root == null) {
            return;
        }
        StbNode extension = root.child("StbExtension");
        if (extension == null && model != null) {
            extension = model.child("StbExtension");
        }
        if (extension != null && !extension.removeChildren("StbSS7ModelExtension").isEmpty()) {
            context.report().info("Removed StbSS7ModelExtension from StbExtension");
        }
    }

    /**
     * Drops Joint and FiveTypes steel shapes from SRC beams. Steel figures left without a Shape go too.
     */
    public static void removeSrcBeamInvalidElementsTo210(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        if (sections == null) {
            return;
        }
        int count = 0;
        for (StbNode section : sections.children("StbSecBeam_SRC")) {
            if (!section.hasChild("StbSecSteelFigureBeam_SRC")) {
                continue;
            }
            for (StbNode figure : section.children("StbSecSteelFigureBeam_SRC")) {
                count += figure.removeChildren("StbSecSteelBeam_SRC_Joint").isEmpty() ? 0 : 1;
                count += figure.removeChildren("StbSecSteelBeam_SRC_FiveTypes").isEmpty() ? 0 : 1;
            }
            XmlHelper.removeChildrenIf(section, "StbSecSteelFigureBeam_SRC",
                    figure -> !figure.hasChild("StbSecSteelBeam_SRC_Shape"));
        }
        if (count > 0) {
            context.report().info("Removed " + count + " invalid SRC beam steel elements");
        }
    }

    public static void fixPileLengthsTo210(StbDocument document, RuleContext context) {
        StbNode members = XmlHelper.getMembers(document).orElse(null);
        int count = 0;
        for (StbNode pile : XmlHelper.collect(members, "StbPiles", "StbPile")) {
            for (String name : PILE_LENGTH_ATTRS) {
                String value = pile.attr(name);
                if ("0".equals(value) || "0.0".equals(value)) {
                    pile.setAttr(name, "1");
                    count++;
                }
            }
        }
        if (count > 0) {
            context.report().info("Fixed " + count + " zero pile length attributes");
        }
    }

    /**
     * Collapses START/END beam taper fragments into one element carrying both ends.
     */
    public static void convertBeamTaperTo210(StbDocument document, RuleContext context) {
        int count = 0;
        for (StbNode figure : beamFigures(document)) {
            List<StbNode> tapers = figure.children("StbSecBeamTaper");
            if (tapers.isEmpty() || tapers.get(0).hasAttr("start_width")) {
                continue;
            }
            StbNode start = tapers.stream().filter(t -> "START".equals(t.attr("pos"))).findFirst().orElse(null);
            StbNode end = tapers.stream().filter(t -> "END".equals(t.attr("pos"))).findFirst().orElse(null);
            if (start == null && end == null) {
                start = tapers.get(0);
                end = tapers.get(tapers.size() - 1);
            }
            if (start == null) {
                start = end;
            }
            if (end == null) {
                end = start;
            }
            StbNode merged = new StbNode()
                    .setAttr("start_width", valueOr(start.attr("width"), "300"))
                    .setAttr("start_depth", valueOr(start.attr("depth"), "600"))
                    .setAttr("end_width", valueOr(end.attr("width"), "300"))
                    .setAttr("end_depth", valueOr(end.attr("depth"), "600"))
                    .setAttr("start_horizontal_offset", start.attr("horizontal_offset"))
                    .setAttr("start_vertical_offset", start.attr("vertical_offset"))
                    .setAttr("end_horizontal_offset", end.attr("horizontal_offset"))
                    .setAttr("end_vertical_offset", end.attr("vertical_offset"));
            figure.setChildren("StbSecBeamTaper", List.of(merged));
            count++;
        }
        if (count > 0) {
            context.report().info("Converted " + count + " beam taper elements to v2.1.0 format");
        }
    }

    /**
     * Splits a v2.1.0 beam taper back into its START and END fragments.
     */
    public static void expandBeamTaperTo202(StbDocument document, RuleContext context) {
        int count = 0;
        for (StbNode figure : beamFigures(document)) {
            List<StbNode> tapers = figure.children("StbSecBeamTaper");
            if (tapers.size() != 1 || !tapers.get(0).hasAttr("start_width")) {
                continue;
            }
            StbNode merged = tapers.get(0);
            List<StbNode> fragments = new ArrayList<>();
            for (String end : List.of("start", "end")) {
                fragments.add(new StbNode()
                        .setAttr("pos", end.toUpperCase())
                        .setAttr("width", merged.attr(end + "_width"))
                        .setAttr("depth", merged.attr(end + "_depth"))
                        .setAttr("horizontal_offset", merged.attr(end + "_horizontal_offset"))
                        .setAttr("vertical_offset", merged.attr(end + "_vertical_offset")));
            }
            figure.setChildren("StbSecBeamTaper", fragments);
            count++;
        }
        if (count > 0) {
            context.report().info("Expanded " + count + " beam taper elements to v2.0.2 format");
        }
    }

    private static List<StbNode> beamFigures(StbDocument document) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        List<StbNode> figures = new ArrayList<>();
        figures.addAll(XmlHelper.collect(sections, "StbSecBeam_RC", "StbSecFigureBeam_RC"));
        figures.addAll(XmlHelper.collect(sections, "StbSecBeam_SRC", "StbSecFigureBeam_SRC"));
        return figures;
    }

    /**
     * Collapses slab taper fragments into one element with {@code base_depth} and {@code tip_depth}.
     * BASE or START gives the base, TIP or END the tip. Without positions the first two depths are used.
     */
    public static void convertSlabTaperTo210(StbDocument document, RuleContext context) {
        int count = 0;
        for (StbNode figure : slabFigures(document)) {
            List<StbNode> tapers = figure.children("StbSecSlab_RC_ConventionalTaper");
            if (tapers.isEmpty() || tapers.get(0).hasAttr("base_depth")) {
                continue;
            }
            String base = null;
            String tip = null;
            for (StbNode taper : tapers) {
                String pos = taper.attr("pos");
                String depth = taper.attr("depth");
                if ("BASE".equals(pos) || "START".equals(pos)) {
                    base = depth;
                } else if ("TIP".equals(pos) || "END".equals(pos)) {
                    tip = depth;
                } else if (depth != null) {
                    if (base == null) {
                        base = depth;
                    } else if (tip == null) {
                        tip = depth;
                    }
                }
            }
            base = valueOr(base, valueOr(tip, "200"));
            tip = valueOr(tip, valueOr(base, "150"));
            figure.setChildren("StbSecSlab_RC_ConventionalTaper",
                    List.of(new StbNode().setAttr("base_depth", base).setAttr("tip_depth", tip)));
            count++;
        }
        if (count > 0) {
            context.report().info("Converted " + count + " slab taper elements to v2.1.0 format");
        }
    }

    /**
     * Splits a v2.1.0 slab taper back into BASE and TIP fragments.
     */
    public static void expandSlabTaperTo202(StbDocument document, RuleContext context) {
        int count = 0;
        for (StbNode figure : slabFigures(document)) {
            List<StbNode> tapers = figure.children("StbSecSlab_RC_ConventionalTaper");
            if (tapers.size() != 1 || !tapers.get(0).hasAttr("base_depth")) {
                continue;
            }
            StbNode merged = tapers.get(0);
            figure.setChildren("StbSecSlab_RC_ConventionalTaper", List.of(
                    new StbNode().setAttr("pos", "BASE").setAttr("depth", merged.attr("base_depth")),
                    new StbNode().setAttr("pos", "TIP").setAttr("depth", merged.attr("tip_depth"))));
            count++;
        }
        if (count > 0) {
            context.report().info("Expanded " + count + " slab taper elements to v2.0.2 format");
        }
    }

    private static List<StbNode> slabFigures(StbDocument document) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        return XmlHelper.collect(sections, "StbSecSlab_RC", "StbSecSlab_RC_Conventional",
                "StbSecFigureSlab_RC_Conventional");
    }

    /**
     * Drops node-id orders with fewer than three ids, and via-node elements left without any order.
     */
    public static void removeInvalidNodeIdOrderTo210(StbDocument document, RuleContext context) {
        StbNode members = XmlHelper.getMembers(document).orElse(null);
        if (members == null) {
            return;
        }
        String[][] configs = {
                {"StbGirders", "StbGirder", "StbGirderViaNode"},
                {"StbBeams", "StbBeam", "StbBeamViaNode"},
                {"StbBraces", "StbBrace", "StbBraceViaNode"},
                {"StbSlabs", "StbSlab", "StbViaNode"},
                {"StbWalls", "StbWall", "StbViaNode"},
        };
        int orders = 0;
        int viaNodes = 0;
        for (String[] config : configs) {
            for (StbNode member : XmlHelper.collect(members, config[0], config[1])) {
                for (StbNode viaNode : member.children(config[2])) {
                    orders += XmlHelper.removeChildrenIf(viaNode, "StbNodeIdOrder",
                            order -> !isValidNodeIdOrder(order));
                }
                viaNodes += XmlHelper.removeChildrenIf(member, config[2],
                        viaNode -> !viaNode.hasChild("StbNodeIdOrder"));
            }
        }
        if (orders > 0 || viaNodes > 0) {
            context.report().info("Removed " + orders + " invalid StbNodeIdOrder elements and "
                    + viaNodes + " empty ViaNode elements");
        }
    }

    private static boolean isValidNodeIdOrder(StbNode order) {
        String text = order.text();
        return text != null && !text.isBlank() && text.trim().split("\\s+").length >= 3;
    }

    public static void removeEmptyNodeIdListTo210(StbDocument document, RuleContext context) {
        StbNode model = XmlHelper.getModel(document).orElse(null);
        if (model == null) {
            return;
        }
        List<StbNode> owners = new ArrayList<>();
        owners.addAll(XmlHelper.collect(model, XmlHelper.MEMBERS, "StbSlabs", "StbSlab"));
        owners.addAll(XmlHelper.collect(model, XmlHelper.MEMBERS, "StbWalls", "StbWall"));
        owners.addAll(XmlHelper.collect(model, "StbStories", "StbStory"));
        for (String axes : List.of("StbParallelAxes", "StbRadialAxes", "StbArcAxes")) {
            owners.addAll(XmlHelper.collect(model, "StbAxes", axes, axes.replace("Axes", "Axis")));
        }
        int count = 0;
        for (StbNode owner : owners) {
            count += XmlHelper.removeChildrenIf(owner, "StbNodeIdList", list -> !list.hasChild("StbNodeId"));
        }
        if (count > 0) {
            context.report().info("Removed " + count + " empty StbNodeIdList elements");
        }
    }

    /**
     * Non-positive pitches become 100 and non-positive covers 40, anywhere inside a section.
     */
    public static void fixZeroPitchAttrsTo210(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        if (sections == null) {
            return;
        }
        int[] count = {0};
        for (Map.Entry<String, List<StbNode>> entry : sections.childMap().entrySet()) {
            if (!entry.getKey().startsWith("StbSec")) {
                continue;
            }
            for (StbNode section : entry.getValue()) {
                count[0] += fixNonPositive(section);
                XmlHelper.forEachDescendant(section, node -> count[0] += fixNonPositive(node));
            }
        }
        if (count[0] > 0) {
            context.report().info("Fixed " + count[0] + " zero pitch/depth_cover values to non-zero");
        }
    }

    private static int fixNonPositive(StbNode node) {
        int count = 0;
        for (String name : PITCH_ATTRS) {
            count += replaceNonPositive(node, name, "100");
        }
        for (String name : DEPTH_COVER_ATTRS) {
            count += replaceNonPositive(node, name, "40");
        }
        return count;
    }

    private static int replaceNonPositive(StbNode node, String name, String replacement) {
        if (!node.hasAttr(name)) {
            return 0;
        }
        double value = XmlHelper.number(node.attr(name));
        if (Double.isNaN(value) || value <= 0) {
            node.setAttr(name, replacement);
            return 1;
        }
        return 0;
    }

    /**
     * Renames slab bar elements inside the conventional wrapper.
     */
    public static void renameSlabBarTo210(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        int count = 0;
        for (StbNode bar : XmlHelper.collect(sections, "StbSecSlab_RC", "StbSecSlab_RC_Conventional",
                "StbSecBarArrangementSlab_RC_Conventional")) {
            count += context.renames().apply(bar, "slabBar", true);
        }
        if (count > 0) {
            context.report().info("Renamed " + count + " slab bar arrangement elements");
        }
    }

    /**
     * Removes legacy opening containers that survived relocation.
     */
    public static void removeStbOpensDirectTo210(StbDocument document, RuleContext context) {
        StbNode model = XmlHelper.getModel(document).orElse(null);
        if (model == null) {
            return;
        }
        int count = 0;
        if (!model.removeChildren("StbOpens").isEmpty()) {
            count++;
            context.report().info("Removed StbOpens from StbModel");
        }
        StbNode members = model.child(XmlHelper.MEMBERS);
        if (members != null) {
            if (!members.removeChildren("StbOpens").isEmpty()) {
                count++;
                context.report().info("Removed StbOpens from StbMembers");
            }
            List<StbNode> owners = new ArrayList<>(XmlHelper.collect(members, "StbWalls", "StbWall"));
            owners.addAll(XmlHelper.collect(members, "StbSlabs", "StbSlab"));
            for (StbNode owner : owners) {
                if (!owner.removeChildren("StbOpenIdList").isEmpty()) {
                    count++;
                }
            }
        }
        if (count > 0) {
            context.report().info("Removed " + count + " invalid StbOpens/StbOpenIdList elements");
        }
    }

    public static void removeInvalidSecPipeTo210(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        int count = 0;
        for (StbNode steel : XmlHelper.collect(sections, "StbSecSteel")) {
            count += XmlHelper.removeChildrenIf(steel, "StbSecPipe", pipe -> {
                double d = XmlHelper.number(pipe.attr("D"));
                return Double.isNaN(d) || d <= 0;
            });
        }
        if (count > 0) {
            context.report().info("Removed " + count + " StbSecPipe elements with invalid D attribute");
        }
    }

    public static void removeEmptyBarArrangementFoundationTo210(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        int count = 0;
        for (StbNode foundation : XmlHelper.collect(sections, "StbSecFoundation_RC")) {
            count += XmlHelper.removeChildrenIf(foundation, "StbSecBarArrangementFoundation_RC",
                    arrangement -> !arrangement.hasChildren());
        }
        if (count > 0) {
            context.report().info("Removed " + count + " empty StbSecBarArrangementFoundation_RC elements");
        }
    }

    public static void removeInvalidSecOpenTo210(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        int count = XmlHelper.removeChildrenIf(sections, "StbSecOpen_RC",
                open -> isBlank(open.attr("length_X")) || isBlank(open.attr("length_Y")));
        if (count > 0) {
            context.report().info("Removed " + count + " StbSecOpen_RC elements with missing required attributes");
        }
    }

    public static void removeStbExtensionsTo210(StbDocument document, RuleContext context) {
        XmlHelper.getModel(document).ifPresent(model -> {
            if (!model.removeChildren("StbExtensions").isEmpty()) {
                context.report().info("Removed StbExtensions from StbModel");
            }
        });
    }

    /**
     * Drops {@code StbJoints} when an H-shape joint still uses the v2.0.2 flange bolt layout
     * (first bolt without {@code id_order}).
     */
    public static void removeInvalidJointsTo210(StbDocument document, RuleContext context) {
        StbNode model = XmlHelper.getModel(document).orElse(null);
        StbNode joints = model == null ? null : model.child("StbJoints");
        if (joints == null) {
            return;
        }
        boolean legacy = false;
        for (String kind : List.of("StbJointBeamShapeH", "StbJointColumnShapeH")) {
            for (StbNode joint : joints.children(kind)) {
                StbNode flange = joint.child("StbJointShapeHFlange");
                if (flange == null) {
                    continue;
                }
                StbNode bolt = flange.child("StbJointShapeHFlangeBolt");
                if (bolt == null || isBlank(bolt.attr("id_order"))) {
                    legacy = true;
                }
            }
        }
        if (legacy) {
            model.removeChildren("StbJoints");
            context.report().info("Removed StbJoints (structure changed significantly in v2.1.0)");
        }
    }

    private static String valueOr(String value, String fallback) {
        return isBlank(value) ? fallback : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }
}
