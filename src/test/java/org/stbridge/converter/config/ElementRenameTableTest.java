package org.stbridge.converter.config;

import org.junit.jupiter.api.Test;
import org.stbridge.converter.config.models.ElementRenameFile;
import org.stbridge.converter.config.models.RenameScope;
import org.stbridge.converter.tree.StbNode;

import java.util.LinkedHashMap;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ElementRenameTableTest {

    private static RenameScope scope(String name, boolean reversible, String... pairs) {
        RenameScope scope = new RenameScope();
        scope.name = name;
        scope.reversible = reversible;
        scope.renames = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            scope.renames.put(pairs[i], pairs[i + 1]);
        }
        return scope;
    }

    private static ElementRenameTable table(RenameScope... scopes) {
        ElementRenameFile file = new ElementRenameFile();
        file.scopes = List.of(scopes);
        return new ElementRenameTable(file);
    }

    @Test
    void shouldKeepFirstLegacyTagWhenReversing() {
        ElementRenameTable table = table(scope("beamBar", true,
                "StbSecBarBeam_RC_ThreeTypes", "StbSecBarBeamComplex",
                "StbSecBarBeam_RC_StartEnd", "StbSecBarBeamComplex"));

        assertEquals("StbSecBarBeam_RC_ThreeTypes", table.reverse("beamBar").get("StbSecBarBeamComplex"));
        assertEquals(2, table.forward("beamBar").size());
    }

    @Test
    void shouldHaveEmptyReverseForOneWayScope() {
        ElementRenameTable table = table(scope("common", false,
                "StbReinforcementstrengthList", "StbReinforcementStrengthList"));

        assertTrue(table.reverse("common").isEmpty());
        assertEquals(1, table.forward("common").size());
    }

    @Test
    void shouldRenameChildrenInBothDirections() {
        ElementRenameTable table = table(scope("rcColumnFigure", true,
                "StbSecColumn_RC_Rect", "StbSecColumnRect",
                "StbSecColumn_RC_Circle", "StbSecColumnCircle"));
        StbNode figure = new StbNode();
        figure.addChild("StbSecColumn_RC_Rect", new StbNode().setAttr("width_X", "600"));

        assertEquals(1, table.apply(figure, "rcColumnFigure", true));
        assertEquals("600", figure.child("StbSecColumnRect").attr("width_X"));

        assertEquals(1, table.apply(figure, "rcColumnFigure", false));
        assertTrue(figure.hasChild("StbSecColumn_RC_Rect"));
        assertFalse(figure.hasChild("StbSecColumnRect"));
        assertEquals(0, table.apply(null, "rcColumnFigure", true));
    }

    @Test
    void shouldRejectUnknownScope() {
        ElementRenameTable table = table(scope("a", true, "StbX", "StbY"));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> table.forward("b"));
        assertEquals("Unknown rename scope: b", e.getMessage());
    }

    @Test
    void shouldRejectDuplicateScope() {
        assertThrows(IllegalStateException.class,
                () -> table(scope("a", true, "StbX", "StbY"), scope("a", true, "StbZ", "StbW")));
    }

    @Test
    void shouldLoadBundledTable() {
        ElementRenameTable table = ElementRenameTable.defaults();

        assertSame(table, ElementRenameTable.defaults());
        assertEquals("StbSecBarBeamSimple", table.forward("rcBeamBar").get("StbSecBarBeam_RC_Same"));
        assertEquals("StbSecBarBeam_RC_Same", table.reverse("rcBeamBar").get("StbSecBarBeamSimple"));
        assertEquals("StbSecBarColumn_SRC_RectSame", table.reverse("srcColumnBar").get("StbSecBarColumnRectSame"));
    }
}
