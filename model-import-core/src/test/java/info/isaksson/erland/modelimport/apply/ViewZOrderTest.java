package info.isaksson.erland.modelimport.apply;

import info.isaksson.erland.modelimport.domain.ViewNodeLayout;
import info.isaksson.erland.modelimport.domain.ViewObjectType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ViewZOrderTest {

    @Test
    void containerGoesBehindWhatItContainsEvenWhenImportedLater() {
        ViewNodeLayout inner = el("inner", 50, 50, 100, 60);
        ViewNodeLayout outer = el("outer", 0, 0, 400, 300);
        ViewNodeLayout beside = el("beside", 500, 0, 100, 60);

        List<ViewNodeLayout> out = ViewZOrder.normalize(List.of(inner, outer, beside), Map.of(), Map.of());

        assertEquals(ViewZOrder.NORMAL_BASE, out.get(1).zIndex);
        assertTrue(out.get(0).zIndex > out.get(1).zIndex);
        assertTrue(out.get(2).zIndex > out.get(1).zIndex);
    }

    @Test
    void bandsSeparateBackgroundNormalAndOverlay() {
        ViewNodeLayout note = new ViewNodeLayout(null, "o-note", 0d, 0d, 50d, 50d, null);
        ViewNodeLayout group = new ViewNodeLayout(null, "o-group", 0d, 0d, 800d, 600d, null);
        ViewNodeLayout pkg = el("pkg", 10, 10, 20, 20);
        ViewNodeLayout plain = el("plain", 100, 100, 20, 20);
        ViewNodeLayout unplaced = ViewNodeLayout.forElement("floating");

        List<ViewNodeLayout> out = ViewZOrder.normalize(List.of(note, group, pkg, plain, unplaced),
                Map.of("pkg", "uml.package", "plain", "uml.class"),
                Map.of("o-note", ViewObjectType.NOTE, "o-group", ViewObjectType.GROUP_BOX));

        assertEquals(ViewZOrder.OVERLAY_BASE, out.get(0).zIndex);
        assertEquals(ViewZOrder.BACKGROUND_BASE, out.get(1).zIndex);
        assertEquals(ViewZOrder.BACKGROUND_BASE + 1, out.get(2).zIndex);
        assertEquals(ViewZOrder.NORMAL_BASE, out.get(3).zIndex);
        assertNull(out.get(4).zIndex);
    }

    private static ViewNodeLayout el(String id, double x, double y, double w, double h) {
        return new ViewNodeLayout(id, null, x, y, w, h, null);
    }
}
