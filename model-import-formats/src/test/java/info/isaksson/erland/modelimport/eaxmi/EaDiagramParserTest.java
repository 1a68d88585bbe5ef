package info.isaksson.erland.modelimport.eaxmi;

import info.isaksson.erland.modelimport.ir.IrBounds;
import info.isaksson.erland.modelimport.ir.IrPoint;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EaDiagramParserTest {

    @Test
    void eaGeometryEdgesBecomeBounds() {
        IrBounds b = EaDiagramParser.parseBoundsString("Left=10;Top=20;Right=110;Bottom=70;");
        assertNotNull(b);
        assertEquals(10, b.x);
        assertEquals(20, b.y);
        assertEquals(100, b.width);
        assertEquals(50, b.height);
    }

    @Test
    void xywhAndBareNumbersAreAccepted() {
        IrBounds kv = EaDiagramParser.parseBoundsString("x=5, y=6, w=30, h=40");
        assertEquals(30, kv.width);
        assertEquals(40, kv.height);

        IrBounds edges = EaDiagramParser.parseBoundsString("10 20 110 70");
        assertEquals(100, edges.width, "increasing pairs are read as edges");

        IrBounds sized = EaDiagramParser.parseBoundsString("300 200 50 40");
        assertEquals(300, sized.x);
        assertEquals(50, sized.width);
    }

    @Test
    void degenerateGeometryHasNoBounds() {
        assertNull(EaDiagramParser.parseBoundsString(""));
        assertNull(EaDiagramParser.parseBoundsString("Left=10;Top=20;Right=10;Bottom=70;"));
        assertNull(EaDiagramParser.parseBoundsString("1 2 3"));
    }

    @Test
    void linkPathYieldsBendPoints() {
        List<IrPoint> pts = EaDiagramParser.geometryPath("SX=0;SY=0;EX=0;EY=0;EDGE=2;Path=130:40$200:40$250:90$;");
        assertEquals(3, pts.size());
        assertEquals(250, pts.get(2).x);
        assertEquals(90, pts.get(2).y);

        assertNull(EaDiagramParser.geometryPath("SX=0;SY=0;EDGE=2;Path=;"));
        assertNull(EaDiagramParser.geometryPath("SX=0;SY=0;EDGE=2;"));
    }

    @Test
    void styleValuesAreCaseInsensitive() {
        String style = "Mode=3;EOID=BBBB0001;SOID=BBBB0002;Color=-1;";
        assertEquals("BBBB0002", EaDiagramParser.styleValue(style, "soid"));
        assertEquals("BBBB0001", EaDiagramParser.styleValue(style, "EOID"));
        assertNull(EaDiagramParser.styleValue(style, "DUID"));
        assertNull(EaDiagramParser.styleValue(null, "DUID"));
    }
}
