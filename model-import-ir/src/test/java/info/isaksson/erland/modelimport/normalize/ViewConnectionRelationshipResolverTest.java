package info.isaksson.erland.modelimport.normalize;

import info.isaksson.erland.modelimport.ir.IrElement;
import info.isaksson.erland.modelimport.ir.IrMaps;
import info.isaksson.erland.modelimport.ir.IrMeta;
import info.isaksson.erland.modelimport.ir.IrModel;
import info.isaksson.erland.modelimport.ir.IrRelationship;
import info.isaksson.erland.modelimport.ir.IrView;
import info.isaksson.erland.modelimport.ir.IrViewConnection;
import info.isaksson.erland.modelimport.ir.IrViewNode;
import info.isaksson.erland.modelimport.ir.IrViewNodeKind;
import info.isaksson.erland.modelimport.report.ImportReport;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ViewConnectionRelationshipResolverTest {

    @Test
    void singleForwardMatchIsAssigned() {
        ImportReport report = new ImportReport("test");
        IrModel out = ViewConnectionRelationshipResolver.resolve(
                model(List.of(rel("r1", "a", "b"))), report, "MEFF");

        IrViewConnection c = connection(out);
        assertEquals("r1", c.relationshipId);
        assertEquals("na", c.sourceNodeId);
        assertFalse(IrMaps.isTrue(c.meta, IrMeta.REVERSED));
        assertTrue(report.getWarnings().isEmpty());
    }

    @Test
    void singleReverseMatchSwapsEndpoints() {
        ImportReport report = new ImportReport("test");
        IrModel out = ViewConnectionRelationshipResolver.resolve(
                model(List.of(rel("r1", "b", "a"))), report, "MEFF");

        IrViewConnection c = connection(out);
        assertEquals("r1", c.relationshipId);
        assertEquals("nb", c.sourceNodeId);
        assertEquals("na", c.targetNodeId);
        assertEquals("b", c.sourceElementId);
        assertEquals("a", c.targetElementId);
        assertEquals(Boolean.TRUE, c.meta.get(IrMeta.REVERSED));
        assertTrue(report.getWarnings().isEmpty());
    }

    @Test
    void parallelRelationshipsAreLeftUnresolvedWithOneWarning() {
        ImportReport report = new ImportReport("test");
        IrModel out = ViewConnectionRelationshipResolver.resolve(
                model(List.of(rel("r1", "a", "b"), rel("r2", "a", "b"))), report, "BPMN2");

        assertNull(connection(out).relationshipId);
        assertEquals(1, report.getIssues(ViewConnectionRelationshipResolver.AMBIGUOUS).size());
        assertEquals(1, report.getWarnings().size());
        assertEquals("BPMN2: Diagram connection \"c1\" could not be mapped to a single relationship between \"a\" and \"b\" (matches: 2).",
                report.getWarnings().get(0));
    }

    @Test
    void forwardAndReverseTogetherPreferForward() {
        IrModel out = ViewConnectionRelationshipResolver.resolve(
                model(List.of(rel("r1", "a", "b"), rel("r2", "b", "a"))), new ImportReport("test"), "MEFF");
        assertEquals("r1", connection(out).relationshipId);
    }

    @Test
    void parallelForwardMatchesAreNotReplacedByASingleReverseMatch() {
        ImportReport report = new ImportReport("test");
        IrModel out = ViewConnectionRelationshipResolver.resolve(
                model(List.of(rel("r1", "a", "b"), rel("r2", "a", "b"), rel("r3", "b", "a"))), report, "MEFF");

        IrViewConnection c = connection(out);
        assertNull(c.relationshipId);
        assertEquals("na", c.sourceNodeId);
        assertFalse(IrMaps.isTrue(c.meta, IrMeta.REVERSED));
        assertEquals(1, report.getIssues(ViewConnectionRelationshipResolver.AMBIGUOUS).size());
        assertTrue(report.getWarnings().get(0).endsWith("(matches: 3)."), report.getWarnings().get(0));
    }

    @Test
    void explicitEndpointsWinOverNodesAndExistingIdsAreKept() {
        IrViewConnection explicit = new IrViewConnection("c1", null, null, null, "a", "b", null, null, null, null, null);
        IrViewConnection bound = new IrViewConnection("c2", "rX", "na", "nb", null, null, null, null, null, null, null);
        IrView v = new IrView("v", "V", null, null, null, List.of(), List.of(explicit, bound), null, null, null);
        IrModel in = new IrModel(null, elements(), List.of(rel("r1", "a", "b")), List.of(v), null);

        IrModel out = ViewConnectionRelationshipResolver.resolve(in, null, "EA XMI");
        assertEquals("r1", out.views.get(0).connections.get(0).relationshipId);
        assertEquals("rX", out.views.get(0).connections.get(1).relationshipId);
    }

    @Test
    void connectionWithoutResolvableEndpointsIsUntouched() {
        IrViewConnection c = new IrViewConnection("c1", null, "missing", "nb", null, null, null, null, null, null, null);
        IrView v = new IrView("v", "V", null, null, null, nodes(), List.of(c), null, null, null);
        IrModel in = new IrModel(null, elements(), List.of(rel("r1", "a", "b")), List.of(v), null);

        IrModel out = ViewConnectionRelationshipResolver.resolve(in, new ImportReport("test"), "MEFF");
        assertSame(c, out.views.get(0).connections.get(0));
    }

    private static IrModel model(List<IrRelationship> relationships) {
        IrViewConnection c = new IrViewConnection("c1", null, "na", "nb", null, null, null, null, null, null, null);
        IrView v = new IrView("v", "V", null, null, null, nodes(), List.of(c), null, null, null);
        return new IrModel(null, elements(), relationships, List.of(v), null);
    }

    private static List<IrViewNode> nodes() {
        return List.of(
                new IrViewNode("na", IrViewNodeKind.ELEMENT, "a", null, null, null, null, null, null),
                new IrViewNode("nb", IrViewNodeKind.ELEMENT, "b", null, null, null, null, null, null));
    }

    private static List<IrElement> elements() {
        return List.of(
                new IrElement("a", "BusinessActor", "A", null, null, null, null, null, null, null),
                new IrElement("b", "BusinessRole", "B", null, null, null, null, null, null, null));
    }

    private static IrRelationship rel(String id, String source, String target) {
        return new IrRelationship(id, "Serving", source, target, null, null, null, null, null, null);
    }

    private static IrViewConnection connection(IrModel model) {
        return model.views.get(0).connections.get(0);
    }
}
