package org.stbridge.converter;

import org.junit.jupiter.api.Test;
import org.stbridge.converter.config.AttributeConfigTable;
import org.stbridge.converter.config.ConversionOptions;
import org.stbridge.converter.config.ElementRenameTable;
import org.stbridge.converter.config.models.ElementRenameFile;
import org.stbridge.converter.config.models.RenameScope;
import org.stbridge.converter.dom.DomTreeBridge;
import org.stbridge.converter.report.ConversionReport;
import org.stbridge.converter.rules.RuleContext;
import org.stbridge.converter.tree.StbDocument;
import org.stbridge.converter.tree.StbNode;
import org.stbridge.converter.tree.XmlHelper;

import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.stbridge.converter.StbFixtures.node;

class StbConverterTest {
    private static final String SAMPLE_V202 = "fixtures/sample-v202.xml";

    private final StbConverter converter = new StbConverter();

    private StbDocument loadSample() {
        InputStream in = getClass().getClassLoader().getResourceAsStream(SAMPLE_V202);
        assertNotNull(in, "missing test resource " + SAMPLE_V202);
        return DomTreeBridge.read(in);
    }

    @Test
    void shouldRoundTripConvertibleDocument() {
        StbDocument original = StbFixtures.convertibleV202();

        ConversionResult forward = converter.convertForward(original);
        ConversionResult reverse = converter.convertReverse(forward.document());

        assertTrue(forward.report().getErrors().isEmpty());
        assertTrue(reverse.report().getErrors().isEmpty());
        assertEquals(original, reverse.document());
    }

    @Test
    void shouldRoundTripSampleFileAndCanonicalizeLegacyRoot() {
        StbDocument original = loadSample();
        assertEquals(StbDocument.LEGACY_ROOT_TAG, original.getRootTag());

        ConversionResult forward = converter.convertForward(original);
        assertEquals(StbDocument.CANONICAL_ROOT_TAG, forward.document().getRootTag());
        assertEquals(StbDocument.LEGACY_ROOT_TAG, original.getRootTag());

        ConversionResult reverse = converter.convertReverse(forward.document());
        assertEquals(original.getRootNode(), reverse.document().getRootNode());
        assertEquals("https://www.building-smart.or.jp/dl", reverse.document().getRootNode().attr("xmlns"));
    }

    @Test
    void shouldProduceV210StructureWhenConvertingForward() {
        ConversionResult result = converter.convertForward(StbFixtures.convertibleV202());
        StbDocument converted = result.document();

        assertTrue(result.converted());
        assertEquals("2.0.2", result.sourceVersion());
        assertEquals("2.1.0", result.targetVersion());
        assertEquals("2.1.0", StbConverter.detectVersion(converted));

        StbNode sections = StbFixtures.sections(converted);
        assertTrue(XmlHelper.first(sections, "StbSecSlab_RC", "StbSecSlab_RC_Conventional",
                "StbSecFigureSlab_RC_Conventional", "StbSecSlab_RC_ConventionalStraight").isPresent());
        assertTrue(XmlHelper.first(sections, "StbSecBeam_S", "StbSecSteelFigureBeam_S", "StbSecSteelBeam_S_Shape",
                "StbSecSteelBeamStraight").isPresent());
        assertTrue(XmlHelper.first(sections, "StbSecColumn_RC", "StbSecBarArrangementColumn_RC",
                "StbSecBarColumnRectSame", "StbSecBarColumnRectSameSimple").isPresent());

        StbNode members = StbFixtures.members(converted);
        StbNode open = XmlHelper.first(members, "StbOpenArrangements", "StbOpenArrangement").orElseThrow();
        assertEquals("WALL", open.attr("kind_member"));
        assertEquals("400", open.attr("id_member"));
        assertFalse(StbFixtures.model(converted).hasChild("StbOpens"));

        StbNode story = XmlHelper.first(StbFixtures.model(converted), "StbStories", "StbStory").orElseThrow();
        assertEquals("GENERAL", story.attr("kind"));
        assertEquals("FL+0", story.attr("level_name"));
    }

    @Test
    void shouldLeaveInputUntouchedWhenPreservingOriginal() {
        StbDocument original = StbFixtures.convertibleV202();
        StbDocument snapshot = original.deepCopy();

        ConversionResult result = converter.convertForward(original);

        assertEquals(snapshot, original);
        assertNotSame(original, result.document());
        assertNotSame(original.getRootNode(), result.document().getRootNode());
    }

    @Test
    void shouldConvertInPlaceWhenNotPreservingOriginal() {
        StbDocument original = StbFixtures.convertibleV202();
        ConversionOptions options = ConversionOptions.builder().preserveOriginal(false).build();

        ConversionResult result = converter.convertForward(original, options);

        assertSame(original, result.document());
        assertEquals("2.1.0", StbConverter.detectVersion(original));
    }

    @Test
    void shouldRelocateJointToArrangement() {
        StbDocument document = StbFixtures.emptyDocument("2.0.2");
        StbFixtures.addMember(document, "StbColumns", "StbColumn", node(
                "id", "7", "id_node_bottom", "1", "id_node_top", "2", "id_section", "10",
                "joint_top", "0", "kind_joint_top", "FIXED", "joint_id_top", "101"));

        StbDocument converted = converter.convertForward(document).document();

        StbNode column = XmlHelper.first(StbFixtures.members(converted), "StbColumns", "StbColumn").orElseThrow();
        assertFalse(column.hasAttr("joint_top"));
        assertFalse(column.hasAttr("kind_joint_top"));
        assertFalse(column.hasAttr("joint_id_top"));

        List<StbNode> arrangements = XmlHelper.all(StbFixtures.members(converted),
                "StbJointArrangements", "StbJointArrangement");
        assertEquals(1, arrangements.size());
        StbNode arrangement = arrangements.get(0);
        assertEquals("101", arrangement.attr("id"));
        assertEquals("7", arrangement.attr("id_member"));
        assertEquals("COLUMN", arrangement.attr("kind_member"));
        assertEquals("10", arrangement.attr("id_section"));
        assertEquals("END", arrangement.attr("starting_point"));
        assertEquals("0", arrangement.attr("distance"));
    }

    @Test
    void shouldCollapseTaperWithSameShapeToStraight() {
        StbDocument document = StbFixtures.emptyDocument("2.0.2");
        StbNode figure = StbFixtures.sections(document).addChild("StbSecBeam_S", node("id", "30"))
                .addChild("StbSecSteelFigureBeam_S", new StbNode());
        figure.addChild("StbSecSteelBeam_S_Taper", node("pos", "START", "shape", "H-400x200", "strength_main", "SN400B"));
        figure.addChild("StbSecSteelBeam_S_Taper", node("pos", "END", "shape", "H-400x200", "strength_main", "SN490B"));

        StbDocument converted = converter.convertForward(document).document();

        StbNode convertedFigure = XmlHelper.first(StbFixtures.sections(converted),
                "StbSecBeam_S", "StbSecSteelFigureBeam_S").orElseThrow();
        List<StbNode> shapes = convertedFigure.children("StbSecSteelBeam_S_Shape");
        assertEquals(1, shapes.size());
        assertEquals("1", shapes.get(0).attr("order"));
        StbNode straight = shapes.get(0).child("StbSecSteelBeamStraight");
        assertNotNull(straight);
        assertEquals("H-400x200", straight.attr("shape"));
        assertFalse(convertedFigure.hasChild("StbSecSteelBeam_S_Taper"));
    }

    @Test
    void shouldReportDataLossForMultiSegmentBeams() {
        StbDocument document = StbFixtures.emptyDocument("2.1.0");
        StbNode sections = StbFixtures.sections(document);
        for (String id : List.of("1", "2", "3")) {
            sections.addChild("StbSecBeam_S", StbFixtures.steelBeamWithSegments(id, 4));
        }

        ConversionResult result = converter.convertReverse(document);

        assertEquals(3, result.report().getDataLoss().multiSectionBeams());
        assertTrue(result.report().getDataLoss().hasLoss());
        assertTrue(result.report().getWarnings().stream().anyMatch(w -> w.startsWith("Data loss warning")));
        assertTrue(result.report().getWarnings().contains("3 multi-section beams will be simplified to single section"));

        for (StbNode beam : StbFixtures.sections(result.document()).children("StbSecBeam_S")) {
            StbNode figure = beam.child("StbSecSteelFigureBeam_S");
            assertEquals(List.of("StbSecSteelBeam_S_FiveTypes"), List.copyOf(figure.childTags()));
            List<StbNode> positions = figure.children("StbSecSteelBeam_S_FiveTypes");
            assertEquals(5, positions.size());
            positions.forEach(p -> assertNotNull(p.attr("pos")));
            assertEquals("START", positions.get(0).attr("pos"));
            assertEquals("END", positions.get(4).attr("pos"));
        }
    }

    @Test
    void shouldSkipDataLossScanWhenDisabled() {
        StbDocument document = StbFixtures.emptyDocument("2.1.0");
        StbFixtures.sections(document).addChild("StbSecBeam_S", StbFixtures.steelBeamWithSegments("1", 2));
        ConversionOptions options = ConversionOptions.builder().warnDataLoss(false).build();

        ConversionResult result = converter.convertReverse(document, options);

        assertFalse(result.report().getDataLoss().hasLoss());
        assertTrue(result.report().getWarnings().stream().noneMatch(w -> w.startsWith("Data loss warning")));
    }

    @Test
    void shouldWarnOnVersionMismatchButStillConvert() {
        StbDocument document = StbFixtures.emptyDocument("2.1.0");

        ConversionResult result = converter.convertForward(document);

        assertTrue(result.converted());
        assertTrue(result.report().getWarnings().contains("Version mismatch: expected 2.0.2, got 2.1.0"));
        assertEquals("2.1.0", StbConverter.detectVersion(result.document()));
    }

    @Test
    void shouldReportErrorWhenVersionMissing() {
        StbDocument document = StbFixtures.emptyDocument("2.0.2");
        document.getRootNode().removeAttr("version");

        ConversionResult result = converter.convertForward(document);

        assertTrue(result.report().getErrors().contains("No version attribute found in ST-Bridge element"));
        assertEquals("2.1.0", StbConverter.detectVersion(result.document()));
    }

    @Test
    void shouldSkipVersionCheckWhenRequested() {
        StbDocument document = StbFixtures.emptyDocument("2.1.0");
        ConversionOptions options = ConversionOptions.builder().skipValidation(true).build();

        ConversionResult result = converter.convertForward(document, options);

        assertTrue(result.report().getWarnings().isEmpty());
    }

    @Test
    void shouldFillCommonMetadataWhenMissing() {
        StbDocument document = StbFixtures.emptyDocument("2.0.2");

        StbDocument converted = converter.convertForward(document).document();

        StbNode common = XmlHelper.getCommon(converted).orElseThrow();
        assertEquals("1.0.0", common.attr("app_version"));
        assertEquals("Untitled Project", common.attr("project_name"));
    }

    @Test
    void shouldPickDirectionFromTargetVersion() {
        ConversionResult up = converter.convert(StbFixtures.emptyDocument("2.0.2"), "2.1.0");
        ConversionResult down = converter.convert(StbFixtures.emptyDocument("2.1.0"), "202");

        assertEquals("2.1.0", StbConverter.detectVersion(up.document()));
        assertEquals("2.0.2", StbConverter.detectVersion(down.document()));
        assertTrue(up.converted());
        assertTrue(down.converted());
    }

    @Test
    void shouldReturnCanonicalCopyWhenAlreadyAtTarget() {
        StbDocument document = new StbDocument(StbDocument.LEGACY_ROOT_TAG,
                StbFixtures.emptyDocument("2.1.0").getRootNode());

        ConversionResult result = converter.convert(document, "2.1.0");

        assertFalse(result.converted());
        assertNotSame(document, result.document());
        assertEquals(StbDocument.CANONICAL_ROOT_TAG, result.document().getRootTag());
        assertEquals(document.getRootNode(), result.document().getRootNode());
        assertEquals(StbDocument.LEGACY_ROOT_TAG, document.getRootTag());
        assertTrue(result.report().getWarnings().isEmpty());
    }

    @Test
    void shouldReuseDocumentAtTargetWhenNotPreservingOriginal() {
        StbDocument document = StbFixtures.emptyDocument("2.0.2");
        ConversionOptions options = ConversionOptions.builder().preserveOriginal(false).build();

        ConversionResult result = converter.convert(document, "2.0.2", options);

        assertFalse(result.converted());
        assertSame(document, result.document());
    }

    @Test
    void shouldAcceptPrefixedAndUpperCaseTargetVersions() {
        ConversionResult up = converter.convert(StbFixtures.emptyDocument("2.0.2"), "v2.1.0");
        ConversionResult down = converter.convert(StbFixtures.emptyDocument("2.1.0"), "V202");

        assertEquals("2.1.0", StbConverter.detectVersion(up.document()));
        assertEquals("2.0.2", StbConverter.detectVersion(down.document()));
    }

    @Test
    void shouldRefuseToConvertDocumentWithoutVersion() {
        StbDocument document = StbFixtures.emptyDocument("2.0.2");
        document.getRootNode().removeAttr("version");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> converter.convert(document, "2.1.0"));
        assertEquals("Could not determine STB version", e.getMessage());
    }

    @Test
    void shouldLeaveDocumentUnchangedWhenStepRunsAgainWithoutItsShape() {
        RuleContext context = new RuleContext(new ConversionReport(),
                ElementRenameTable.defaults(), AttributeConfigTable.defaults());
        assertStepsIdempotent(StbConverter.FORWARD_STEPS, "2.0.2", context);
        assertStepsIdempotent(StbConverter.REVERSE_STEPS, "2.1.0", context);
    }

    private static void assertStepsIdempotent(List<StbConverter.Step> steps, String version, RuleContext context) {
        for (StbConverter.Step step : steps) {
            StbDocument once = StbFixtures.emptyDocument(version);
            step.rule().apply(once, context);
            StbDocument twice = once.deepCopy();
            step.rule().apply(twice, context);
            assertEquals(once, twice, step.name());
        }
    }

    @Test
    void shouldKeepCenterComplexBeamBarsOnDowngrade() {
        StbDocument document = StbFixtures.emptyDocument("2.1.0");
        StbNode arrangement = StbFixtures.sections(document).addChild("StbSecBeam_RC", node("id", "20"))
                .addChild("StbSecBarArrangementBeam_RC", new StbNode());
        StbNode complex = arrangement.addChild("StbSecBarBeamComplex", new StbNode());
        complex.addChild("StbSecBarBeamComplexMain", node("pos", "START", "pos_bar", "TOP", "D", "D22", "N", "3"));
        complex.addChild("StbSecBarBeamComplexMain", node("pos", "CENTER", "pos_bar", "TOP", "D", "D25", "N", "4"));

        ConversionResult result = converter.convertReverse(document);

        StbNode legacy = XmlHelper.first(XmlHelper.getSections(result.document()).orElseThrow(),
                "StbSecBeam_RC", "StbSecBarArrangementBeam_RC").orElseThrow();
        assertTrue(legacy.hasChildren());
        StbNode same = legacy.child("StbSecBarBeam_RC_Same");
        assertEquals("D25", same.attr("D_main"));
        assertEquals("4", same.attr("N_main_top_1st"));
        assertEquals(1, result.report().getDataLoss().complexBarArrangements());
    }

    @Test
    void shouldCountExtraAnchorBoltsBeforeDowngrade() {
        StbDocument document = StbFixtures.emptyDocument("2.1.0");
        StbNode base = StbFixtures.sections(document).addChild("StbSecColumn_S", node("id", "1"))
                .addChild("StbSecBaseConventional", new StbNode());
        base.addChild("StbSecBaseConventionalAnchorBolt", node("name_bolt", "M24"));
        base.addChild("StbSecBaseConventionalAnchorBolt", node("name_bolt", "M30"));

        ConversionResult result = converter.convertReverse(document);

        assertEquals(1, result.report().getDataLoss().multiItemBasePlates());
        assertTrue(result.report().getWarnings().contains(
                "1 base plates with several anchor bolts or rib plates will keep only the first of each"));
    }

    @Test
    void shouldRejectUnsupportedTargetVersion() {
        StbDocument document = StbFixtures.emptyDocument("2.0.2");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> converter.convert(document, "3.0.0"));
        assertTrue(e.getMessage().startsWith("Unsupported target version: 3.0.0"));
    }

    @Test
    void shouldValidateDocumentStructure() {
        ValidationResult valid = StbConverter.validateDocument(StbFixtures.emptyDocument("2.0.2"));
        assertTrue(valid.valid());
        assertEquals("2.0.2", valid.version());
        assertTrue(valid.errors().isEmpty());
        assertTrue(valid.warnings().isEmpty());

        StbDocument noModel = StbDocument.of(node("version", "2.1.0"));
        ValidationResult missingModel = StbConverter.validateDocument(noModel);
        assertFalse(missingModel.valid());
        assertEquals(List.of("StbModel element not found"), missingModel.errors());

        StbDocument unknownVersion = StbFixtures.emptyDocument("1.4.0");
        ValidationResult unsupported = StbConverter.validateDocument(unknownVersion);
        assertTrue(unsupported.valid());
        assertEquals(List.of("Unsupported version: 1.4.0. Supported: 2.0.2, 2.1.0"), unsupported.warnings());
    }

    @Test
    void shouldRejectDocumentWithUnknownRoot() {
        StbDocument document = new StbDocument("SomethingElse", node("version", "2.0.2"));

        ValidationResult result = StbConverter.validateDocument(document);

        assertFalse(result.valid());
        assertEquals(List.of("Invalid ST-Bridge document: root element not found"), result.errors());
        assertNull(result.version());
    }

    @Test
    void shouldCheckExpectedVersion() {
        assertTrue(StbConverter.validate(StbFixtures.emptyDocument("2.0.2"), "2.0.2"));
        assertTrue(StbConverter.validate(StbFixtures.emptyDocument("2.0.1"), "2.0.2"));
        assertFalse(StbConverter.validate(StbDocument.of(new StbNode()), "2.0.2"));
        assertFalse(StbConverter.validate(null, "2.0.2"));
    }

    @Test
    void shouldWrapRuleFailureWithRuleName() {
        RenameScope common = new RenameScope();
        common.name = "common";
        common.renames = new LinkedHashMap<>();
        ElementRenameFile file = new ElementRenameFile();
        file.scopes = List.of(common);
        StbConverter broken = new StbConverter(new ElementRenameTable(file), AttributeConfigTable.defaults());

        StbDocument document = StbFixtures.convertibleV202();
        ConversionException e = assertThrows(ConversionException.class, () -> broken.convertForward(document));

        assertEquals("renameElementsTo210", e.getRuleName());
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
        assertTrue(e.getMessage().contains("Unknown rename scope"));
        assertEquals("2.0.2", StbConverter.detectVersion(document));
    }

    @Test
    void shouldRejectNullDocument() {
        assertThrows(NullPointerException.class, () -> converter.convertForward(null));
        assertThrows(NullPointerException.class, () -> converter.convertReverse(null));
    }
}
