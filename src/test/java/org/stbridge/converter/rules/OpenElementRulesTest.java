package org.stbridge.converter.rules;

import org.junit.jupiter.api.Test;
import org.stbridge.converter.StbFixtures;
import org.stbridge.converter.report.ConversionReport;
import org.stbridge.converter.tree.StbDocument;
import org.stbridge.converter.tree.StbNode;
import org.stbridge.converter.tree.XmlHelper;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.stbridge.converter.StbFixtures.node;

class OpenElementRulesTest {

    @Test
    void shouldBuildArrangementsFromMemberLevelOpens() {
        StbDocument document = StbFixtures.emptyDocument("2.0.2");
        StbNode slab = StbFixtures.addMember(document, "StbSlabs", "StbSlab", node("id", "30"));
        slab.addChild(OpenElementRules.ID_LIST, new StbNode()).addChild("StbOpenId", node("id", "8"));
        StbFixtures.members(document).addChild(OpenElementRules.OPENS, new StbNode())
                .addChild(OpenElementRules.OPEN, node("id", "8", "name", "OP", "id_section", "80",
                        "offset_X", "100", "offset_Y", "200", "length_X", "500", "length_Y", "400"));
        StbNode section = StbFixtures.sections(document).addChild("StbSecOpen_RC", node("id", "80"));

        OpenElementRules.convertOpensTo210(document, new RuleContext(new ConversionReport()));

        StbNode arrangement = XmlHelper.first(StbFixtures.members(document), OpenElementRules.ARRANGEMENTS,
                OpenElementRules.ARRANGEMENT).orElseThrow();
        assertEquals("30", arrangement.attr("id_member"));
        assertEquals("SLAB", arrangement.attr("kind_member"));
        assertEquals("100", arrangement.attr("position_X"));
        assertEquals("200", arrangement.attr("position_Y"));
        assertEquals("0", arrangement.attr("rotate"));
        assertEquals("500", section.attr("length_X"));
        assertEquals("400", section.attr("length_Y"));
        assertFalse(slab.hasChild(OpenElementRules.ID_LIST));
        assertFalse(StbFixtures.members(document).hasChild(OpenElementRules.OPENS));
    }

    @Test
    void shouldWarnForMissingOpening() {
        StbDocument document = StbFixtures.emptyDocument("2.0.2");
        StbNode wall = StbFixtures.addMember(document, "StbWalls", "StbWall", node("id", "40"));
        wall.addChild(OpenElementRules.ID_LIST, new StbNode()).addChild("StbOpenId", node("id", "99"));
        StbFixtures.model(document).addChild(OpenElementRules.OPENS, new StbNode())
                .addChild(OpenElementRules.OPEN, node("id", "1", "id_section", "80"));
        ConversionReport report = new ConversionReport();

        OpenElementRules.convertOpensTo210(document, new RuleContext(report));

        assertEquals(List.of("StbWall 40: StbOpen 99 not found"), report.getWarnings());
        assertFalse(StbFixtures.members(document).hasChild(OpenElementRules.ARRANGEMENTS));
    }

    @Test
    void shouldRebuildOpensWithZeroSizeForMissingSection() {
        StbDocument document = StbFixtures.emptyDocument("2.1.0");
        StbNode wall = StbFixtures.addMember(document, "StbWalls", "StbWall", node("id", "40"));
        StbFixtures.members(document).addChild(OpenElementRules.ARRANGEMENTS, new StbNode())
                .addChild(OpenElementRules.ARRANGEMENT, node("id", "5", "id_member", "40", "kind_member", "WALL",
                        "id_section", "81", "position_X", "10"));
        ConversionReport report = new ConversionReport();

        OpenElementRules.convertOpensTo202(document, new RuleContext(report));

        StbNode open = XmlHelper.first(StbFixtures.model(document), OpenElementRules.OPENS, OpenElementRules.OPEN)
                .orElseThrow();
        assertEquals("0", open.attr("length_X"));
        assertEquals("0", open.attr("length_Y"));
        assertEquals("10", open.attr("position_X"));
        assertEquals("0", open.attr("position_Y"));
        assertEquals("5", XmlHelper.first(wall, OpenElementRules.ID_LIST, "StbOpenId").orElseThrow().attr("id"));
        assertEquals(1, report.getWarnings().size());
        assertFalse(StbFixtures.members(document).hasChild(OpenElementRules.ARRANGEMENTS));
    }
}
