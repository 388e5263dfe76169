package org.stbridge.converter.rules;

import org.stbridge.converter.tree.StbDocument;
import org.stbridge.converter.tree.StbNode;
import org.stbridge.converter.tree.XmlHelper;

import java.util.ArrayList;
import java.util.List;

/**
 * Column base plates: the per-material {@code StbSecBaseConventional_S|SRC|CFT} elements of v2.0.2 are
 * unified as {@code StbSecBaseConventional} in v2.1.0, where anchor bolts and rib plates become lists.
 */
public class BasePlateSectionRules {

    static final String BASE_210 = "StbSecBaseConventional";
    static final String PLATE_210 = "StbSecBaseConventionalPlate";
    static final String ANCHOR_BOLTS_210 = "StbSecBaseConventionalAnchorBolts";
    static final String ANCHOR_BOLT_210 = "StbSecBaseConventionalAnchorBolt";
    static final String RIB_PLATES_210 = "StbSecBaseConventionalRibPlates";
    static final String RIB_PLATE_210 = "StbSecBaseConventionalRibPlate";

    /**
     * Column section type and the suffix of its v2.0.2 base element.
     */
    private static final String[][] COLUMN_TYPES = {
            {"StbSecColumn_S", "_S"},
            {"StbSecColumn_SRC", "_SRC"},
            {"StbSecColumn_CFT", "_CFT"},
    };

    private BasePlateSectionRules() {
    }

    public static void convertBasePlateSectionsTo210(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        if (sections == null) {
            return;
        }
        int converted = 0;
        for (String[] type : COLUMN_TYPES) {
            String legacyTag = BASE_210 + type[1];
            for (StbNode column : sections.children(type[0])) {
                List<StbNode> legacy = column.removeChildren(legacyTag);
                if (legacy.isEmpty()) {
                    continue;
                }
                StbNode old = legacy.get(0);
                StbNode base = new StbNode(old.attributes());
                StbNode plate = old.child(legacyTag + "_Plate");
                if (plate != null) {
                    base.addChild(PLATE_210, plate);
                }
                StbNode anchorBolt = old.child(legacyTag + "_AnchorBolt");
                if (anchorBolt != null) {
                    base.addChild(ANCHOR_BOLTS_210, new StbNode()).addChild(ANCHOR_BOLT_210, anchorBolt);
                }
                StbNode ribPlate = old.child(legacyTag + "_RibPlate");
                if (ribPlate != null) {
                    base.addChild(RIB_PLATES_210, new StbNode()).addChild(RIB_PLATE_210, ribPlate);
                }
                column.setChildren(BASE_210, List.of(base));
                converted++;
                context.report().debug("Converted base plate for " + type[0] + " column " + column.attr("id")
                        + " to v2.1.0 format");
            }
        }
        if (converted > 0) {
            context.report().info("Converted " + converted + " StbSecBaseConventional_* elements to v2.1.0 format");
        }
    }

    /**
     * Keeps the first anchor bolt and the first rib plate, warning when more exist.
     */
    public static void convertBasePlateSectionsTo202(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        if (sections == null) {
            return;
        }
        int converted = 0;
        for (String[] type : COLUMN_TYPES) {
            String legacyTag = BASE_210 + type[1];
            for (StbNode column : sections.children(type[0])) {
                List<StbNode> unified = column.removeChildren(BASE_210);
                if (unified.isEmpty()) {
                    continue;
                }
                StbNode base = unified.get(0);
                StbNode legacy = new StbNode(base.attributes());
                StbNode plate = base.child(PLATE_210);
                if (plate != null) {
                    legacy.addChild(legacyTag + "_Plate", plate);
                }
                StbNode anchorBolt = firstOf(base, ANCHOR_BOLTS_210, ANCHOR_BOLT_210, "anchor bolts", context);
                if (anchorBolt != null) {
                    legacy.addChild(legacyTag + "_AnchorBolt", anchorBolt);
                }
                StbNode ribPlate = firstOf(base, RIB_PLATES_210, RIB_PLATE_210, "rib plates", context);
                if (ribPlate != null) {
                    legacy.addChild(legacyTag + "_RibPlate", ribPlate);
                }
                column.setChildren(legacyTag, List.of(legacy));
                converted++;
            }
        }
        if (converted > 0) {
            context.report().info("Converted " + converted + " StbSecBaseConventional elements to v2.0.2 format");
        }
    }

    /**
     * Counts unified base plates holding more than one anchor bolt or rib plate. v2.0.2 keeps only one of each.
     */
    static int countMultiItemBasePlates(StbNode sections) {
        int count = 0;
        for (String[] type : COLUMN_TYPES) {
            for (StbNode base : XmlHelper.collect(sections, type[0], BASE_210)) {
                if (items(base, ANCHOR_BOLTS_210, ANCHOR_BOLT_210).size() > 1
                        || items(base, RIB_PLATES_210, RIB_PLATE_210).size() > 1) {
                    count++;
                }
            }
        }
        return count;
    }

    // items in the plural list, then any placed directly under the base
    private static List<StbNode> items(StbNode base, String listTag, String itemTag) {
        List<StbNode> items = new ArrayList<>(XmlHelper.all(base, listTag, itemTag));
        items.addAll(base.children(itemTag));
        return items;
    }

    private static StbNode firstOf(StbNode base, String listTag, String itemTag, String label, RuleContext context) {
        List<StbNode> items = items(base, listTag, itemTag);
        if (items.isEmpty()) {
            return null;
        }
        if (items.size() > 1) {
            context.report().warn("Multiple " + label + " (" + items.size()
                    + ") found - only first will be kept in v2.0.2");
        }
        return items.get(0);
    }
}
