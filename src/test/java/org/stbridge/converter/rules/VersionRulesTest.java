package org.stbridge.converter.rules;

import org.junit.jupiter.api.Test;
import org.stbridge.converter.StbFixtures;
import org.stbridge.converter.report.ConversionReport;
import org.stbridge.converter.report.LogLevel;
import org.stbridge.converter.tree.StbDocument;
import org.stbridge.converter.tree.StbNode;
import org.stbridge.converter.tree.XmlHelper;

import static org.junit.jupiter.api.Assertions.*;

class VersionRulesTest {

    @Test
    void shouldKeepExistingCommonMetadata() {
        StbDocument document = StbFixtures.emptyDocument("2.0.2");
        XmlHelper.getCommon(document).orElseThrow()
                .setAttr("app_version", "5.0")
                .setAttr("project_name", "Tower");

        VersionRules.updateVersionTo210(document, new RuleContext(new ConversionReport()));

        StbNode common = XmlHelper.getCommon(document).orElseThrow();
        assertEquals("2.1.0", VersionRules.getVersion(document));
        assertEquals("5.0", common.attr("app_version"));
        assertEquals("Tower", common.attr("project_name"));
    }

    @Test
    void shouldFillEmptyCommonMetadata() {
        StbDocument document = StbFixtures.emptyDocument("2.0.2");
        XmlHelper.getCommon(document).orElseThrow().setAttr("project_name", "");

        VersionRules.updateVersionTo210(document, new RuleContext(new ConversionReport()));

        StbNode common = XmlHelper.getCommon(document).orElseThrow();
        assertEquals(VersionRules.DEFAULT_APP_VERSION, common.attr("app_version"));
        assertEquals(VersionRules.DEFAULT_PROJECT_NAME, common.attr("project_name"));
    }

    @Test
    void shouldDowngradeVersionOnly() {
        StbDocument document = StbFixtures.emptyDocument("2.1.0");
        ConversionReport report = new ConversionReport();

        VersionRules.updateVersionTo202(document, new RuleContext(report));

        assertEquals("2.0.2", VersionRules.getVersion(document));
        assertTrue(report.messages(LogLevel.INFO).contains("Version updated: 2.1.0 -> 2.0.2"));
    }

    @Test
    void shouldCompareMajorMinorOnly() {
        ConversionReport report = new ConversionReport();

        assertTrue(VersionRules.validateVersion(StbFixtures.emptyDocument("2.0.9"), "2.0.2", report));
        assertTrue(report.getWarnings().isEmpty());

        assertTrue(VersionRules.validateVersion(StbFixtures.emptyDocument("2.1.0"), "2.0.2", report));
        assertEquals(1, report.getWarnings().size());
    }

    @Test
    void shouldFailValidationWithoutVersion() {
        StbDocument document = StbFixtures.emptyDocument("2.0.2");
        document.getRootNode().removeAttr("version");
        ConversionReport report = new ConversionReport();

        assertFalse(VersionRules.validateVersion(document, "2.0.2", report));
        assertEquals(1, report.getErrors().size());
        assertNull(VersionRules.getVersion(document));
    }
}
