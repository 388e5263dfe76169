package org.stbridge.converter.rules;

import org.stbridge.converter.StbVersion;
import org.stbridge.converter.report.ConversionReport;
import org.stbridge.converter.tree.StbDocument;
import org.stbridge.converter.tree.StbNode;
import org.stbridge.converter.tree.XmlHelper;

/**
 * Document version attribute and the top-level metadata v2.1.0 requires.
 */
public class VersionRules {

    static final String DEFAULT_APP_VERSION = "1.0.0";
    static final String DEFAULT_PROJECT_NAME = "Untitled Project";

    private VersionRules() {
    }

    /**
     * Reads the {@code version} attribute of the root element.
     *
     * @param document the document
     * @return the version text, or null when the root or the attribute is missing
     */
    public static String getVersion(StbDocument document) {
        return XmlHelper.getRoot(document).map(root -> root.attr("version")).orElse(null);
    }

    /**
     * Sets the version to 2.1.0 and fills {@code app_version} and {@code project_name} on
     * {@code StbCommon} when they are absent.
     */
    public static void updateVersionTo210(StbDocument document, RuleContext context) {
        StbNode root = XmlHelper.getRoot(document).orElse(null);
        if (root == null) {
            return;
        }
        ConversionReport report = context.report();
        String previous = root.attr("version");
        root.setAttr("version", StbVersion.V210.label());
        report.info("Version updated: " + previous + " -> " + StbVersion.V210.label());

        StbNode common = root.child(XmlHelper.COMMON);
        if (common == null) {
            return;
        }
        if (common.setAttrIfAbsent("app_version", DEFAULT_APP_VERSION)) {
            report.info("Added app_version attribute to StbCommon");
        }
        if (common.setAttrIfAbsent("project_name", DEFAULT_PROJECT_NAME)) {
            report.info("Added project_name attribute to StbCommon");
        }
    }

    public static void updateVersionTo202(StbDocument document, RuleContext context) {
        XmlHelper.getRoot(document).ifPresent(root -> {
            String previous = root.attr("version");
            root.setAttr("version", StbVersion.V202.label());
            context.report().info("Version updated: " + previous + " -> " + StbVersion.V202.label());
        });
    }

    /**
     * Checks the source version before a conversion. Only major.minor is compared and a mismatch is
     * reported as a warning, since real documents often carry an imprecise version.
     *
     * @param document        the document
     * @param expectedVersion version the caller expects, e.g. {@code 2.0.2}
     * @param report          receives the error or warning
     * @return false only when the document has no version at all
     */
    public static boolean validateVersion(StbDocument document, String expectedVersion, ConversionReport report) {
        String version = getVersion(document);
        if (version == null || version.isEmpty()) {
            report.error("No version attribute found in ST-Bridge element");
            return false;
        }
        if (!majorMinor(version).equals(majorMinor(expectedVersion))) {
            report.warn("Version mismatch: expected " + expectedVersion + ", got " + version);
        }
        return true;
    }

    private static String majorMinor(String version) {
        String[] parts = version.split("\\.");
        return parts.length >= 2 ? parts[0] + "." + parts[1] : parts[0];
    }
}
