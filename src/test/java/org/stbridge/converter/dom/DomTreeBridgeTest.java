package org.stbridge.converter.dom;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stbridge.converter.tree.StbDocument;
import org.stbridge.converter.tree.StbNode;
import org.stbridge.converter.tree.XmlHelper;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DomTreeBridgeTest {

    private static StbDocument parse(String xml) {
        return DomTreeBridge.read(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void shouldReadSampleWithLegacyRootAndNamespace() {
        InputStream in = getClass().getClassLoader().getResourceAsStream("fixtures/sample-v202.xml");
        assertNotNull(in);

        StbDocument document = DomTreeBridge.read(in);

        assertEquals(StbDocument.LEGACY_ROOT_TAG, document.getRootTag());
        assertEquals("https://www.building-smart.or.jp/dl", document.getRootNode().attr("xmlns"));
        assertEquals("2.0.2", document.getRootNode().attr("version"));
        StbNode order = XmlHelper.first(XmlHelper.getMembers(document).orElseThrow(),
                "StbSlabs", "StbSlab", "StbNodeIdOrder").orElseThrow();
        assertEquals("1 2 3 4", order.text());
    }

    @Test
    void shouldTrimTextAndIgnoreWhitespaceBetweenElements() {
        StbDocument document = parse("<ST-Bridge version=\"2.1.0\">\n  <StbModel>\n"
                + "    <StbNodeIdOrder>\n      5 6 7\n    </StbNodeIdOrder>\n  </StbModel>\n</ST-Bridge>");

        StbNode model = document.getRootNode().child("StbModel");
        assertNull(model.text());
        assertEquals("5 6 7", model.child("StbNodeIdOrder").text());
    }

    @Test
    void shouldWriteCanonicalRootTag() {
        StbDocument document = parse("<ST_BRIDGE version=\"2.0.2\"><StbCommon app_name=\"x\"/></ST_BRIDGE>");

        String xml = DomTreeBridge.toXml(document);

        assertTrue(xml.contains("<ST-Bridge"));
        assertFalse(xml.contains("ST_BRIDGE"));
        assertTrue(xml.contains("app_name=\"x\""));
    }

    @Test
    void shouldWriteAndReadBackFile(@TempDir Path dir) {
        StbDocument document = parse("<ST-Bridge version=\"2.1.0\">"
                + "<StbModel><StbMembers><StbColumns><StbColumn id=\"1\"/><StbColumn id=\"2\"/></StbColumns>"
                + "</StbMembers></StbModel></ST-Bridge>");
        File file = dir.resolve("out.xml").toFile();

        DomTreeBridge.write(document, file);
        StbDocument reread = DomTreeBridge.read(file);

        assertEquals(document.getRootNode(), reread.getRootNode());
    }

    @Test
    void shouldWrapParseFailure() {
        RuntimeException e = assertThrows(RuntimeException.class, () -> parse("<ST-Bridge>"));

        assertEquals("Failed to parse ST-Bridge document from stream", e.getMessage());
        assertNotNull(e.getCause());
    }
}
