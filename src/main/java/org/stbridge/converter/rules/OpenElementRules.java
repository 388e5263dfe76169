package org.stbridge.converter.rules;

import org.stbridge.converter.tree.StbDocument;
import org.stbridge.converter.tree.StbNode;
import org.stbridge.converter.tree.XmlHelper;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Opening relocation. v2.0.2 keeps openings in a model-level {@code StbOpens} list referenced from walls and
 * slabs through {@code StbOpenIdList}; v2.1.0 keeps one {@code StbOpenArrangement} per opening under
 * {@code StbMembers}, pointing back at its member, and moves the opening size onto {@code StbSecOpen_RC}.
 */
public class OpenElementRules {

    static final String OPENS = "StbOpens";
    static final String OPEN = "StbOpen";
    static final String ARRANGEMENTS = "StbOpenArrangements";
    static final String ARRANGEMENT = "StbOpenArrangement";
    static final String ID_LIST = "StbOpenIdList";

    private static final String[][] OWNERS = {
            {"StbWalls", "StbWall", "WALL"},
            {"StbSlabs", "StbSlab", "SLAB"},
    };

    private OpenElementRules() {
    }

    /**
     * Builds open arrangements from the referenced openings. Must run before the attribute pass, which
     * drops sections without {@code length_X}/{@code length_Y} and any opening list still left behind.
     */
    public static void convertOpensTo210(StbDocument document, RuleContext context) {
        StbNode model = XmlHelper.getModel(document).orElse(null);
        StbNode members = model == null ? null : model.child(XmlHelper.MEMBERS);
        if (members == null) {
            return;
        }
        List<StbNode> fromMembers = XmlHelper.all(members, OPENS, OPEN);
        List<StbNode> opens = fromMembers.isEmpty() ? XmlHelper.all(model, OPENS, OPEN) : fromMembers;
        if (opens.isEmpty()) {
            context.report().debug("No StbOpens found, skipping Open conversion");
            return;
        }

        Map<String, StbNode> byId = new HashMap<>();
        Map<String, StbNode> sizeBySection = new LinkedHashMap<>();
        for (StbNode open : opens) {
            if (open.attr("id") != null) {
                byId.put(open.attr("id"), open);
            }
            if (open.attr("id_section") != null && (open.hasAttr("length_X") || open.hasAttr("length_Y"))) {
                sizeBySection.put(open.attr("id_section"), open);
            }
        }

        List<StbNode> arrangements = new ArrayList<>();
        for (String[] owner : OWNERS) {
            for (StbNode member : XmlHelper.collect(members, owner[0], owner[1])) {
                for (StbNode ref : XmlHelper.collect(member, ID_LIST, "StbOpenId")) {
                    StbNode open = byId.get(ref.attr("id"));
                    if (open == null) {
                        context.report().warn(owner[1] + " " + member.attr("id") + ": StbOpen " + ref.attr("id")
                                + " not found");
                        continue;
                    }
                    arrangements.add(new StbNode()
                            .setAttr("id", ref.attr("id"))
                            .setAttr("id_member", member.attr("id"))
                            .setAttr("kind_member", owner[2])
                            .setAttr("name", open.attr("name"))
                            .setAttr("id_section", open.attr("id_section"))
                            .setAttr("position_X", firstPresent(open, "position_X", "offset_X"))
                            .setAttr("position_Y", firstPresent(open, "position_Y", "offset_Y"))
                            .setAttr("rotate", open.hasAttr("rotate") ? open.attr("rotate") : "0"));
                }
                member.removeChildren(ID_LIST);
            }
        }

        if (!fromMembers.isEmpty()) {
            members.removeChildren(OPENS);
        } else {
            model.removeChildren(OPENS);
        }

        int sized = 0;
        for (StbNode section : XmlHelper.collect(model, XmlHelper.SECTIONS, "StbSecOpen_RC")) {
            StbNode open = sizeBySection.get(section.attr("id"));
            if (open != null) {
                if (open.hasAttr("length_X")) {
                    section.setAttr("length_X", open.attr("length_X"));
                }
                if (open.hasAttr("length_Y")) {
                    section.setAttr("length_Y", open.attr("length_Y"));
                }
                sized++;
            }
        }
        if (sized > 0) {
            context.report().info("Open sections: Updated " + sized + " StbSecOpen_RC elements with length attributes");
        }
        if (!arrangements.isEmpty()) {
            members.getOrCreateChild(ARRANGEMENTS).setChildren(ARRANGEMENT, arrangements);
            context.report().info("Open elements: Converted " + arrangements.size() + " openings to v2.1.0 format");
        }
    }

    /**
     * Rebuilds the model-level opening list and the member id lists. Opening sizes come from the
     * referenced {@code StbSecOpen_RC}; a missing section gives zero lengths and a warning.
     */
    public static void convertOpensTo202(StbDocument document, RuleContext context) {
        StbNode model = XmlHelper.getModel(document).orElse(null);
        StbNode members = model == null ? null : model.child(XmlHelper.MEMBERS);
        List<StbNode> arrangements = XmlHelper.all(members, ARRANGEMENTS, ARRANGEMENT);
        if (arrangements.isEmpty()) {
            context.report().debug("No StbOpenArrangements found, skipping Open conversion");
            return;
        }

        Map<String, StbNode> sections = new HashMap<>();
        for (StbNode section : XmlHelper.collect(model, XmlHelper.SECTIONS, "StbSecOpen_RC")) {
            if (section.attr("id") != null) {
                sections.put(section.attr("id"), section);
            }
        }

        List<StbNode> opens = new ArrayList<>();
        Map<String, List<String>> idsByMember = new HashMap<>();
        for (StbNode arrangement : arrangements) {
            StbNode section = sections.get(arrangement.attr("id_section"));
            if (section == null) {
                context.report().warn("StbOpenArrangement " + arrangement.attr("id") + ": StbSecOpen_RC "
                        + arrangement.attr("id_section") + " not found. length_X/Y set to 0.");
            }
            opens.add(new StbNode()
                    .setAttr("id", arrangement.attr("id"))
                    .setAttr("name", arrangement.attr("name"))
                    .setAttr("id_section", arrangement.attr("id_section"))
                    .setAttr("position_X", valueOr(arrangement.attr("position_X"), "0"))
                    .setAttr("position_Y", valueOr(arrangement.attr("position_Y"), "0"))
                    .setAttr("length_X", section == null ? "0" : valueOr(section.attr("length_X"), "0"))
                    .setAttr("length_Y", section == null ? "0" : valueOr(section.attr("length_Y"), "0"))
                    .setAttr("rotate", valueOr(arrangement.attr("rotate"), "0")));
            idsByMember.computeIfAbsent(arrangement.attr("kind_member") + ":" + arrangement.attr("id_member"),
                    k -> new ArrayList<>()).add(arrangement.attr("id"));
        }

        members.removeChildren(ARRANGEMENTS);
        model.getOrCreateChild(OPENS).setChildren(OPEN, opens);

        for (String[] owner : OWNERS) {
            for (StbNode member : XmlHelper.collect(members, owner[0], owner[1])) {
                List<String> ids = idsByMember.get(owner[2] + ":" + member.attr("id"));
                if (ids == null) {
                    continue;
                }
                StbNode idList = new StbNode();
                for (String id : ids) {
                    idList.addChild("StbOpenId", new StbNode().setAttr("id", id));
                }
                member.setChildren(ID_LIST, List.of(idList));
            }
        }
        context.report().info("Open elements: Converted " + opens.size() + " openings to v2.0.2 format");
    }

    private static String firstPresent(StbNode node, String name, String fallbackName) {
        if (node.hasAttr(name)) {
            return node.attr(name);
        }
        return node.hasAttr(fallbackName) ? node.attr(fallbackName) : "0";
    }

    private static String valueOr(String value, String fallback) {
        return value == null ? fallback : value;
    }
}
