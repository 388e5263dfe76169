package org.stbridge.converter.rules;

import org.stbridge.converter.config.ElementRenameTable;
import org.stbridge.converter.tree.StbDocument;
import org.stbridge.converter.tree.StbNode;
import org.stbridge.converter.tree.XmlHelper;

import java.util.List;

/**
 * RC slab sections gain a {@code StbSecSlab_RC_Conventional} wrapper in v2.1.0 around the figure and the
 * bar arrangement, whose children are renamed as well.
 */
public class SlabSectionRules {

    static final String WRAPPER = "StbSecSlab_RC_Conventional";
    static final String FIGURE = "StbSecFigureSlab_RC_Conventional";
    static final String BAR_ARRANGEMENT = "StbSecBarArrangementSlab_RC_Conventional";

    private SlabSectionRules() {
    }

    /**
     * Requires: nothing renamed yet below the slab section. The slab bar children are renamed later by the
     * attribute pass.
     */
    public static void convertSlabSectionsTo210(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        if (sections == null) {
            return;
        }
        ElementRenameTable renames = context.renames();
        int converted = 0;
        for (StbNode slab : sections.children("StbSecSlab_RC")) {
            renames.apply(slab, "slabSection", true);
            List<StbNode> figures = slab.removeChildren(FIGURE);
            if (figures.isEmpty()) {
                continue;
            }
            figures.forEach(figure -> renames.apply(figure, "slabFigure", true));

            StbNode wrapper = new StbNode();
            wrapper.setChildren(FIGURE, figures);
            wrapper.setChildren(BAR_ARRANGEMENT, slab.removeChildren(BAR_ARRANGEMENT));
            slab.setChildren(WRAPPER, List.of(wrapper));
            converted++;
        }
        if (converted > 0) {
            context.report().info("RC Slab sections: Converted " + converted + " slabs to v2.1.0 format");
        }
    }

    /**
     * Moves the figure and bar arrangement back up to the slab section and restores the v2.0.2 names.
     * Requires: slab tapers already split back into fragments.
     */
    public static void convertSlabSectionsTo202(StbDocument document, RuleContext context) {
        StbNode sections = XmlHelper.getSections(document).orElse(null);
        if (sections == null) {
            return;
        }
        ElementRenameTable renames = context.renames();
        int converted = 0;
        for (StbNode slab : sections.children("StbSecSlab_RC")) {
            List<StbNode> wrappers = slab.removeChildren(WRAPPER);
            if (wrappers.isEmpty()) {
                continue;
            }
            if (wrappers.size() > 1) {
                context.report().warn("StbSecSlab_RC " + slab.attr("id") + ": only the first of "
                        + wrappers.size() + " conventional wrappers kept");
            }
            StbNode wrapper = wrappers.get(0);
            List<StbNode> figures = wrapper.children(FIGURE);
            List<StbNode> bars = wrapper.children(BAR_ARRANGEMENT);
            figures.forEach(figure -> renames.apply(figure, "slabFigure", false));
            bars.forEach(bar -> renames.apply(bar, "slabBar", false));
            slab.setChildren(FIGURE, figures);
            slab.setChildren(BAR_ARRANGEMENT, bars);
            renames.apply(slab, "slabSection", false);
            converted++;
        }
        if (converted > 0) {
            context.report().info("RC Slab sections: Converted " + converted + " slabs to v2.0.2 format");
        }
    }
}
