package info.isaksson.erland.modelimport.normalize;

import info.isaksson.erland.modelimport.ir.IrBounds;
import info.isaksson.erland.modelimport.ir.IrElement;
import info.isaksson.erland.modelimport.ir.IrExternalId;
import info.isaksson.erland.modelimport.ir.IrFolder;
import info.isaksson.erland.modelimport.ir.IrMeta;
import info.isaksson.erland.modelimport.ir.IrModel;
import info.isaksson.erland.modelimport.ir.IrPoint;
import info.isaksson.erland.modelimport.ir.IrRelationship;
import info.isaksson.erland.modelimport.ir.IrTaggedValue;
import info.isaksson.erland.modelimport.ir.IrView;
import info.isaksson.erland.modelimport.ir.IrViewConnection;
import info.isaksson.erland.modelimport.ir.IrViewNode;
import info.isaksson.erland.modelimport.ir.IrViewNodeKind;
import info.isaksson.erland.modelimport.report.ImportReport;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ImportIrNormalizerTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    @Test
    void danglingRelationshipIsDroppedWithExactlyOneWarning() {
        IrModel in = new IrModel(null,
                List.of(element("a", "BusinessActor", "A")),
                List.of(new IrRelationship("r1", "Serving", "a", "nope", null, null, null, null, null, null)),
                null, null);
        ImportReport report = new ImportReport("test");
        int before = report.getWarnings().size();

        IrModel out = ImportIrNormalizer.normalize(in, report, options());

        assertTrue(out.relationships.isEmpty());
        assertEquals(before + 1, report.getWarnings().size());
        assertEquals("Test: Normalize: Dropped relationship \"r1\" because it references missing element(s) (source: \"a\", target: \"nope\").",
                report.getWarnings().get(0));
    }

    @Test
    void danglingRelationshipCanBeKept() {
        IrModel in = new IrModel(null,
                List.of(element("a", "BusinessActor", "A")),
                List.of(new IrRelationship("r1", "Serving", "a", "nope", null, null, null, null, null, null)),
                null, null);
        NormalizeOptions o = options();
        o.dropDanglingRelationships = false;

        IrModel out = ImportIrNormalizer.normalize(in, new ImportReport("test"), o);
        assertEquals(1, out.relationships.size());
    }

    @Test
    void duplicateAndEmptyIdsAreDropped() {
        IrModel in = new IrModel(null,
                List.of(element("a", "BusinessActor", "first"), element("a", "BusinessActor", "second"), element(" ", "BusinessActor", "blank")),
                null, null, null);
        ImportReport report = new ImportReport("test");

        IrModel out = ImportIrNormalizer.normalize(in, report, options());

        assertEquals(1, out.elements.size());
        assertEquals("first", out.elements.get(0).name);
        assertEquals(2, report.getWarnings().size());
    }

    @Test
    void namesTypesAndTextAreDefaultedAndTrimmed() {
        IrElement e = new IrElement(" a ", "  ", "  ", "line1\r\nline2\r", null, null,
                List.of(new IrTaggedValue(" k ", " v "), new IrTaggedValue("", "x"), new IrTaggedValue("k", "v")),
                List.of(new IrExternalId(" ", " id-1 ", "")),
                null, null);
        IrModel out = ImportIrNormalizer.normalize(new IrModel(null, List.of(e), null, null, null), new ImportReport("t"), options());

        IrElement n = out.elements.get(0);
        assertEquals("a", n.id);
        assertEquals(ImportIrNormalizer.UNKNOWN_TYPE, n.type);
        assertEquals("Unnamed element", n.name);
        assertEquals("line1\nline2", n.documentation);
        assertEquals(List.of(new IrTaggedValue("k", "v")), n.taggedValues);
        assertEquals(List.of(new IrExternalId(null, "id-1", null)), n.externalIds);
    }

    @Test
    void invalidSelfAndCyclicFolderParentsMoveToRoot() {
        List<IrFolder> folders = List.of(
                new IrFolder("f1", "One", "f2", null, null, null, null),
                new IrFolder("f2", "Two", "f1", null, null, null, null),
                new IrFolder("f3", "Three", "f3", null, null, null, null),
                new IrFolder("f4", "Four", "missing", null, null, null, null),
                new IrFolder("f5", "Five", "f2", null, null, null, null));
        ImportReport report = new ImportReport("test");

        IrModel out = ImportIrNormalizer.normalize(new IrModel(folders, null, null, null, null), report, options());

        Map<String, String> parents = new LinkedHashMap<>();
        for (IrFolder f : out.folders) parents.put(f.id, f.parentId);
        assertNull(parents.get("f1"), "first member of the cycle is moved to root");
        assertEquals("f1", parents.get("f2"));
        assertNull(parents.get("f3"));
        assertNull(parents.get("f4"));
        assertEquals("f2", parents.get("f5"));
        assertEquals(3, report.getWarnings().size());
    }

    @Test
    void viewReferencesAreCleared() {
        IrViewNode good = new IrViewNode("n1", IrViewNodeKind.ELEMENT, "a", null, null, new IrBounds(0, 0, 100, 50), null, null, null);
        IrViewNode bad = new IrViewNode("n2", IrViewNodeKind.ELEMENT, "ghost", "n2", null, new IrBounds(0, 0, 0, 50), null, null, null);
        IrViewConnection conn = new IrViewConnection("c1", "rGhost", "n1", "nGhost", "a", "ghost", null,
                List.of(new IrPoint(1, 2), new IrPoint(Double.NaN, 3)), null, null, null);
        IrView view = new IrView("v1", null, null, "fGhost", " layered ", List.of(good, bad), List.of(conn), null, null, null);
        ImportReport report = new ImportReport("test");

        IrModel out = ImportIrNormalizer.normalize(
                new IrModel(null, List.of(element("a", "BusinessActor", "A")), null, List.of(view), null), report, options());

        IrView v = out.views.get(0);
        assertEquals("Unnamed view", v.name);
        assertNull(v.folderId);
        assertEquals("layered", v.viewpoint);

        IrViewNode n2 = v.nodes.get(1);
        assertNull(n2.elementId);
        assertNull(n2.parentNodeId);
        assertNull(n2.bounds);
        assertNotNull(v.nodes.get(0).bounds);

        IrViewConnection c = v.connections.get(0);
        assertNull(c.relationshipId);
        assertEquals("n1", c.sourceNodeId);
        assertNull(c.targetNodeId);
        assertEquals("a", c.sourceElementId);
        assertNull(c.targetElementId);
        assertEquals(List.of(new IrPoint(1, 2)), c.points);
        assertFalse(report.getWarnings().isEmpty());
    }

    @Test
    void importedAtIsStampedOnlyWhenAbsent() {
        IrModel fresh = ImportIrNormalizer.normalize(IrModel.empty("bpmn2"), null, options());
        assertEquals("2024-05-01T10:00:00Z", fresh.meta.get(IrMeta.IMPORTED_AT_ISO));

        IrModel stamped = IrModel.empty("bpmn2").withMeta(Map.of(IrMeta.FORMAT, "bpmn2", IrMeta.IMPORTED_AT_ISO, "2020-01-01T00:00:00Z"));
        assertEquals("2020-01-01T00:00:00Z", ImportIrNormalizer.normalize(stamped, null, options()).meta.get(IrMeta.IMPORTED_AT_ISO));
    }

    @Test
    void normalizingTwiceIsIdempotentAndQuiet() {
        IrModel messy = messyModel();
        IrModel once = ImportIrNormalizer.normalize(messy, new ImportReport("first"), options());

        ImportReport second = new ImportReport("second");
        IrModel twice = ImportIrNormalizer.normalize(once, second, options());

        assertEquals(once, twice);
        assertTrue(second.getWarnings().isEmpty(), "second pass must not warn: " + second.getWarnings());
    }

    @Test
    void outputHasReferentialIntegrityAndUniqueIds() {
        IrModel out = ImportIrNormalizer.normalize(messyModel(), new ImportReport("test"), options());

        Set<String> elementIds = new HashSet<>();
        for (IrElement e : out.elements) assertTrue(elementIds.add(e.id), "duplicate element id " + e.id);
        for (IrRelationship r : out.relationships) {
            assertTrue(elementIds.contains(r.sourceId));
            assertTrue(elementIds.contains(r.targetId));
        }
        Set<String> folderIds = new HashSet<>();
        for (IrFolder f : out.folders) assertTrue(folderIds.add(f.id));
        for (IrFolder f : out.folders) assertTrue(f.parentId == null || folderIds.contains(f.parentId));
        Set<String> viewIds = new HashSet<>();
        for (IrView v : out.views) assertTrue(viewIds.add(v.id));
    }

    private static IrModel messyModel() {
        return new IrModel(
                List.of(new IrFolder("f1", " Root ", "f1", null, null, null, null),
                        new IrFolder("f1", "dup", null, null, null, null, null),
                        new IrFolder("f2", "", "f1", null, null, null, null)),
                List.of(element("a", "BusinessActor", "A"),
                        element("b", "", null),
                        element("a", "BusinessRole", "dup"),
                        new IrElement("c", "Goal", "C", null, "fGhost", "c", null, null, null, null)),
                List.of(new IrRelationship("r1", "Serving", "a", "b", " serves ", null, null, null, null, null),
                        new IrRelationship("r2", "Serving", "a", "zzz", null, null, null, null, null, null),
                        new IrRelationship("r1", "Flow", "b", "a", null, null, null, null, null, null)),
                List.of(new IrView("v1", "View", null, "f2", null,
                        List.of(new IrViewNode("n1", IrViewNodeKind.ELEMENT, "a", null, " A ", new IrBounds(1, 1, 10, 10), null, null, null),
                                new IrViewNode("n2", null, "zzz", "n9", null, null, null, null, null)),
                        List.of(new IrViewConnection("c1", "r2", "n1", "n2", null, null, null, null, null, null, null)),
                        null, null, null)),
                null);
    }

    private static IrElement element(String id, String type, String name) {
        return new IrElement(id, type, name, null, null, null, null, null, null, null);
    }

    private static NormalizeOptions options() {
        NormalizeOptions o = NormalizeOptions.forSource("Test");
        o.clock = FIXED;
        return o;
    }
}
