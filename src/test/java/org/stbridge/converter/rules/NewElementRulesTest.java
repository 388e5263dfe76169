package org.stbridge.converter.rules;

import org.junit.jupiter.api.Test;
import org.stbridge.converter.StbFixtures;
import org.stbridge.converter.report.ConversionReport;
import org.stbridge.converter.report.DataLossReport;
import org.stbridge.converter.tree.StbDocument;
import org.stbridge.converter.tree.StbNode;
import org.stbridge.converter.tree.XmlHelper;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.stbridge.converter.StbFixtures.node;

class NewElementRulesTest {

    @Test
    void shouldPreferCenterThenStart() {
        StbNode start = node("pos", "START");
        StbNode center = node("pos", "CENTER");
        StbNode end = node("pos", "END");

        assertSame(center, NewElementRules.representative(List.of(start, end, center)));
        assertSame(start, NewElementRules.representative(List.of(end, start)));
        assertSame(end, NewElementRules.representative(List.of(end, node("pos", "OTHER"))));
    }

    @Test
    void shouldCollapseComplexBeamBars() {
        StbDocument document = StbFixtures.emptyDocument("2.0.2");
        StbNode arrangement = StbFixtures.sections(document).addChild("StbSecBeam_RC", node("id", "1"))
                .addChild("StbSecBarArrangementBeam_RC", new StbNode());
        arrangement.addChild(NewElementRules.BEAM_COMPLEX, node("pos", "START", "D_main", "D22"));
        arrangement.addChild(NewElementRules.BEAM_COMPLEX, node("pos", "CENTER", "D_main", "D25"));
        ConversionReport report = new ConversionReport();

        NewElementRules.collapseComplexBeamBarsTo210(document, new RuleContext(report));

        assertFalse(arrangement.hasChild(NewElementRules.BEAM_COMPLEX));
        assertEquals(node("D_main", "D25"), arrangement.child(NewElementRules.BEAM_SIMPLE));
        assertEquals(1, report.getWarnings().size());
    }

    @Test
    void shouldDropComplexBarsNextToSimple() {
        StbDocument document = StbFixtures.emptyDocument("2.0.2");
        StbNode arrangement = StbFixtures.sections(document).addChild("StbSecBeam_SRC", node("id", "4"))
                .addChild("StbSecBarArrangementBeam_SRC", new StbNode());
        arrangement.addChild(NewElementRules.BEAM_SIMPLE, node("D_main", "D19"));
        arrangement.addChild(NewElementRules.BEAM_COMPLEX, node("pos", "CENTER", "D_main", "D25"));
        ConversionReport report = new ConversionReport();

        NewElementRules.collapseComplexBeamBarsTo210(document, new RuleContext(report));

        assertEquals(List.of(node("D_main", "D19")), arrangement.children(NewElementRules.BEAM_SIMPLE));
        assertEquals(List.of("Beam 4: 1 complex bar variants dropped next to an existing simple arrangement"),
                report.getWarnings());
    }

    @Test
    void shouldCollapseComplexBeamBarsToCenterSectionOnDowngrade() {
        StbDocument document = StbFixtures.emptyDocument("2.1.0");
        StbNode arrangement = StbFixtures.sections(document).addChild("StbSecBeam_RC", node("id", "20"))
                .addChild("StbSecBarArrangementBeam_RC", new StbNode());
        StbNode complex = arrangement.addChild(NewElementRules.BEAM_COMPLEX, new StbNode());
        complex.addChild(NewElementRules.COMPLEX_MAIN, node("pos", "START", "pos_bar", "TOP", "D", "D22", "N", "3"));
        complex.addChild(NewElementRules.COMPLEX_MAIN, node("pos", "CENTER", "pos_bar", "TOP", "D", "D25", "N", "4"));
        complex.addChild(NewElementRules.COMPLEX_MAIN, node("pos", "CENTER", "pos_bar", "BOTTOM", "D", "D25", "N", "2"));
        complex.addChild(NewElementRules.COMPLEX_STIRRUP, node("pos", "CENTER", "D_stirrup", "D10", "pitch_stirrup", "200"));
        ConversionReport report = new ConversionReport();

        NewElementRules.collapseComplexBeamBarsTo202(document, new RuleContext(report));

        assertFalse(arrangement.hasChild(NewElementRules.BEAM_COMPLEX));
        StbNode simple = arrangement.child(NewElementRules.BEAM_SIMPLE);
        assertEquals("D10", simple.attr("D_stirrup"));
        assertEquals("200", simple.attr("pitch_stirrup"));
        assertFalse(simple.hasAttr("pos"));
        List<StbNode> rows = simple.children(BarArrangementRules.BEAM_MAIN);
        assertEquals(2, rows.size());
        assertEquals("TOP", rows.get(0).attr("pos"));
        assertEquals("4", rows.get(0).attr("N"));
        assertEquals("BOTTOM", rows.get(1).attr("pos"));
        assertEquals("D25", rows.get(1).attr("D"));
        assertFalse(rows.get(1).hasAttr("pos_bar"));
        assertEquals(List.of("StbSecBarBeamComplex collapsed for beam 20: only the CENTER section kept"
                + " (not supported in v2.0.2)"), report.getWarnings());
    }

    @Test
    void shouldDropComplexBeamBarsNextToSimpleOnDowngrade() {
        StbDocument document = StbFixtures.emptyDocument("2.1.0");
        StbNode arrangement = StbFixtures.sections(document).addChild("StbSecBeam_SRC", node("id", "21"))
                .addChild("StbSecBarArrangementBeam_SRC", new StbNode());
        arrangement.addChild(NewElementRules.BEAM_SIMPLE, node("D_stirrup", "D13"));
        arrangement.addChild(NewElementRules.BEAM_COMPLEX, node("pos", "CENTER"));
        ConversionReport report = new ConversionReport();

        NewElementRules.collapseComplexBeamBarsTo202(document, new RuleContext(report));

        assertEquals(List.of(node("D_stirrup", "D13")), arrangement.children(NewElementRules.BEAM_SIMPLE));
        assertFalse(arrangement.hasChild(NewElementRules.BEAM_COMPLEX));
        assertEquals(List.of("StbSecBarBeamComplex removed for beam 21 (not supported in v2.0.2)"),
                report.getWarnings());
    }

    @Test
    void shouldRemoveLegacyApplyConditions() {
        StbDocument document = StbFixtures.emptyDocument("2.0.2");
        StbNode common = XmlHelper.getCommon(document).orElseThrow();
        StbNode list = common.addChild(NewElementRules.APPLY_CONDITIONS, new StbNode());
        list.addChild("StbColumn_RC_RebarPositionApply", new StbNode());
        list.addChild("StbBeam_RC_BarWebApply", new StbNode());

        NewElementRules.removeLegacyApplyConditionsTo210(document, new RuleContext(new ConversionReport()));

        assertFalse(common.hasChild(NewElementRules.APPLY_CONDITIONS));
    }

    @Test
    void shouldKeepApplyConditionListWithOtherChildren() {
        StbDocument document = StbFixtures.emptyDocument("2.0.2");
        StbNode common = XmlHelper.getCommon(document).orElseThrow();
        StbNode list = common.addChild(NewElementRules.APPLY_CONDITIONS, new StbNode());
        list.addChild("StbColumn_RC_RebarPositionApply", new StbNode());
        list.addChild("StbApplyConditions_RC", new StbNode());

        NewElementRules.removeLegacyApplyConditionsTo210(document, new RuleContext(new ConversionReport()));

        assertTrue(list.hasChild("StbApplyConditions_RC"));
        assertFalse(list.hasChild("StbColumn_RC_RebarPositionApply"));
    }

    @Test
    void shouldRemovePileStrengthListFromBothCommonBlocks() {
        StbDocument document = StbFixtures.emptyDocument("2.1.0");
        StbNode rootCommon = XmlHelper.getCommon(document).orElseThrow();
        StbNode modelCommon = StbFixtures.model(document).addChild(XmlHelper.COMMON, new StbNode());
        rootCommon.addChild(NewElementRules.PILE_STRENGTH_LIST, new StbNode());
        modelCommon.addChild(NewElementRules.PILE_STRENGTH_LIST, new StbNode());
        ConversionReport report = new ConversionReport();

        NewElementRules.removeNewElementsTo202(document, new RuleContext(report));

        assertFalse(rootCommon.hasChild(NewElementRules.PILE_STRENGTH_LIST));
        assertFalse(modelCommon.hasChild(NewElementRules.PILE_STRENGTH_LIST));
        assertEquals(2, report.getWarnings().size());
    }

    @Test
    void shouldCountDataLossWithoutModifyingDocument() {
        StbDocument document = StbFixtures.emptyDocument("2.1.0");
        StbFixtures.members(document).addChild("StbJointArrangements", new StbNode())
                .addChild("StbJointArrangement", node("id", "1"));
        StbFixtures.model(document).addChild(XmlHelper.COMMON, new StbNode())
                .addChild(NewElementRules.PILE_STRENGTH_LIST, new StbNode());
        StbFixtures.sections(document).addChild("StbSecBeam_S", StbFixtures.steelBeamWithSegments("1", 3));
        StbFixtures.sections(document).addChild("StbSecBeam_S", StbFixtures.steelBeamWithSegments("2", 1));
        StbDocument before = document.deepCopy();

        DataLossReport loss = NewElementRules.checkDataLossTo202(document);

        assertEquals(new DataLossReport(1, true, 1, 0, 0), loss);
        assertTrue(loss.hasLoss());
        assertEquals(before, document);
    }

    @Test
    void shouldCountBasePlatesAndComplexBarsForDowngrade() {
        StbDocument document = StbFixtures.emptyDocument("2.1.0");
        StbNode sections = StbFixtures.sections(document);
        StbNode base = sections.addChild("StbSecColumn_S", node("id", "1"))
                .addChild(BasePlateSectionRules.BASE_210, new StbNode());
        base.addChild(BasePlateSectionRules.ANCHOR_BOLT_210, node("name_bolt", "M24"));
        base.addChild(BasePlateSectionRules.ANCHOR_BOLT_210, node("name_bolt", "M30"));
        StbNode ribs = sections.addChild("StbSecColumn_CFT", node("id", "2"))
                .addChild(BasePlateSectionRules.BASE_210, new StbNode())
                .addChild(BasePlateSectionRules.RIB_PLATES_210, new StbNode());
        ribs.addChild(BasePlateSectionRules.RIB_PLATE_210, node("t", "12"));
        ribs.addChild(BasePlateSectionRules.RIB_PLATE_210, node("t", "16"));
        sections.addChild("StbSecColumn_SRC", node("id", "3"))
                .addChild(BasePlateSectionRules.BASE_210, new StbNode())
                .addChild(BasePlateSectionRules.ANCHOR_BOLT_210, node("name_bolt", "M24"));
        sections.addChild("StbSecBeam_RC", node("id", "4"))
                .addChild("StbSecBarArrangementBeam_RC", new StbNode())
                .addChild(NewElementRules.BEAM_COMPLEX, new StbNode());
        sections.addChild("StbSecColumn_RC", node("id", "5"))
                .addChild("StbSecBarArrangementColumn_RC", new StbNode())
                .addChild("StbSecBarColumnRectSame", new StbNode())
                .addChild("StbSecBarColumnRectSameComplex", node("pos", "CENTER"));

        DataLossReport loss = NewElementRules.checkDataLossTo202(document);

        assertEquals(new DataLossReport(0, false, 0, 2, 2), loss);
        assertTrue(loss.hasLoss());
    }

    @Test
    void shouldReportNoLossForPlainDocument() {
        assertFalse(NewElementRules.checkDataLossTo202(StbFixtures.emptyDocument("2.1.0")).hasLoss());
    }
}
