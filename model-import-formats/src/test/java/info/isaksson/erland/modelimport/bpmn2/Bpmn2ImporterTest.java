package info.isaksson.erland.modelimport.bpmn2;

import info.isaksson.erland.modelimport.framework.ImportContext;
import info.isaksson.erland.modelimport.framework.ImportSource;
import info.isaksson.erland.modelimport.framework.ParsedImport;
import info.isaksson.erland.modelimport.framework.StructuralParseException;
import info.isaksson.erland.modelimport.ir.IrElement;
import info.isaksson.erland.modelimport.ir.IrMeta;
import info.isaksson.erland.modelimport.ir.IrModel;
import info.isaksson.erland.modelimport.ir.IrRelationship;
import info.isaksson.erland.modelimport.ir.IrTaggedValue;
import info.isaksson.erland.modelimport.ir.IrView;
import info.isaksson.erland.modelimport.ir.IrViewConnection;
import info.isaksson.erland.modelimport.ir.IrViewNode;
import info.isaksson.erland.modelimport.report.ImportReport;
import info.isaksson.erland.modelimport.testutil.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class Bpmn2ImporterTest {

    @Test
    void simpleProcessImportsEventsTaskAndFlows() {
        ParsedImport result = Fixtures.run("fixtures/bpmn2/scenario-a.bpmn");
        IrModel ir = result.ir;

        assertEquals(IrMeta.Formats.BPMN2, result.format);
        assertEquals(3, ir.elements.size());
        for (IrElement e : ir.elements) {
            assertFalse(e.name.isBlank(), e.id);
        }
        assertEquals("endEvent (End_1)", element(ir, "End_1").name);
        assertEquals("bpmn.startEvent", element(ir, "Start_1").type);
        assertEquals("bpmn.task", element(ir, "Task_1").type);

        Set<String> ids = ir.elements.stream().map(e -> e.id).collect(Collectors.toSet());
        assertEquals(2, ir.relationships.size());
        for (IrRelationship r : ir.relationships) {
            assertEquals("bpmn.sequenceFlow", r.type);
            assertTrue(ids.contains(r.sourceId));
            assertTrue(ids.contains(r.targetId));
        }
        assertEquals("http://example.com/orders", ir.meta.get("targetNamespace"));
        assertEquals("2024-05-01T10:00:00Z", ir.meta.get(IrMeta.IMPORTED_AT_ISO));
    }

    @Test
    void missingDiagramGetsAnAutoLayoutView() {
        ParsedImport result = Fixtures.run("fixtures/bpmn2/scenario-a.bpmn");

        assertEquals(1, result.ir.views.size());
        IrView auto = result.ir.views.get(0);
        assertEquals(Bpmn2DiagramParser.AUTO_VIEW_ID, auto.id);
        assertEquals(3, auto.nodes.size());
        assertEquals(2, auto.connections.size());
        for (IrViewNode n : auto.nodes) {
            assertEquals(Bpmn2DiagramParser.AUTO_NODE_WIDTH, n.bounds.width);
        }
        assertEquals(1, result.report.getIssues("bpmn2-no-diagram").size());
    }

    @Test
    void containmentFollowsPoolLaneAndSubProcess() {
        IrModel ir = Fixtures.run("fixtures/bpmn2/collaboration.bpmn").ir;

        assertEquals("bpmn.pool", element(ir, "Pool_Shop").type);
        assertNull(element(ir, "Pool_Shop").parentElementId);
        assertEquals("Pool_Shop", element(ir, "Lane_Clerk").parentElementId);
        assertEquals("Lane_Clerk", element(ir, "Task_Check").parentElementId);
        assertEquals("Lane_Clerk", element(ir, "Sub_Ship").parentElementId);
        assertEquals("Sub_Ship", element(ir, "Task_Pack").parentElementId, "sub-process nesting wins over the lane");
        assertEquals("Pool_Shop", element(ir, "Timer_Late").parentElementId);
        assertNull(element(ir, "Msg_Order").parentElementId, "global definitions stay top level");
        assertEquals("Proc_Shop", element(ir, "Pool_Shop").attrs.get("processRef"));
    }

    @Test
    void typeSpecificAttributesAndExtensionTags() {
        IrModel ir = Fixtures.run("fixtures/bpmn2/collaboration.bpmn").ir;

        IrElement check = element(ir, "Task_Check");
        assertEquals("bpmn.userTask", check.type);
        assertEquals("Verify stock and payment.", check.documentation);
        assertTrue(check.taggedValues.contains(new IrTaggedValue("ext:priority", "high")));

        IrElement timer = element(ir, "Timer_Late");
        assertEquals("boundary", timer.attrs.get("eventKind"));
        assertEquals(Boolean.FALSE, timer.attrs.get("cancelActivity"));
        assertEquals("Sub_Ship", timer.attrs.get("attachedToRef"));
        Map<?, ?> timerDef = (Map<?, ?>) timer.attrs.get("eventDefinition");
        assertEquals("timer", timerDef.get("kind"));
        assertEquals("PT2H", timerDef.get("timeDuration"));

        Map<?, ?> startDef = (Map<?, ?>) element(ir, "Start_Order").attrs.get("eventDefinition");
        assertEquals("message", startDef.get("kind"));
        assertEquals("Msg_Order", startDef.get("messageRef"));

        assertEquals("bpmn.gatewayExclusive", element(ir, "Gw_Stock").type);
        assertEquals(Boolean.TRUE, relationship(ir, "Flow_No").attrs.get("isDefault"));
        assertEquals("${inStock}", relationship(ir, "Flow_Yes").attrs.get("conditionExpression"));
        assertEquals("Camunda Modeler", ir.meta.get(IrMeta.TOOL));
    }

    @Test
    void unsupportedNodesAndTheirFlowsAreSkippedWithWarnings() {
        ParsedImport result = Fixtures.run("fixtures/bpmn2/collaboration.bpmn");

        assertTrue(result.ir.elements.stream().noneMatch(e -> e.id.equals("Send_Mail")));
        assertTrue(result.ir.relationships.stream().noneMatch(r -> r.id.equals("Flow_Mail")));
        assertEquals(4, result.ir.relationships.size());
        assertEquals(1, result.report.getIssues("bpmn2-unsupported-node").size());
        assertEquals(1, result.report.getIssues("bpmn2-missing-endpoint").size());
    }

    @Test
    void diagramShapesAndEdges() {
        ParsedImport result = Fixtures.run("fixtures/bpmn2/collaboration.bpmn");
        IrView view = result.ir.views.get(0);

        assertEquals("Diagram_1", view.id);
        assertEquals("Diagram (Collab_1)", view.name);
        assertEquals(Bpmn2DiagramParser.VIEWPOINT, view.viewpoint);
        assertEquals(List.of("Pool_Shop_di", "Lane_Clerk_di", "Gw_Stock_di", "Start_Order_di", "Task_Check_di"),
                view.nodes.stream().map(n -> n.id).toList(), "containers first, larger first, then by element id");

        IrViewNode gateway = view.nodes.get(2);
        assertNull(gateway.bounds, "a shape with an unparseable height has no bounds");

        assertEquals(2, view.connections.size());
        IrViewConnection flow1 = connection(view, "Flow_1_di");
        assertEquals("Flow_1", flow1.relationshipId);
        assertEquals(2, flow1.points.size());
        assertTrue(connection(view, "Flow_2_di").points.isEmpty(), "a single waypoint is no route");

        List<String> warnings = result.report.getWarnings();
        assertTrue(warnings.stream().anyMatch(w -> w.contains("unknown element 'Ghost'")));
        assertTrue(warnings.stream().anyMatch(w -> w.contains("unknown relationship 'Flow_Mail'")));
        assertTrue(warnings.stream().anyMatch(w -> w.contains("Invalid number in attribute 'height'")));
    }

    @Test
    void sniffAcceptsNamespaceOrPrefixedDefinitions() {
        assertTrue(Bpmn2Importer.looksLikeBpmn("<definitions xmlns=\"" + Bpmn2Importer.MODEL_NAMESPACE + "\">"));
        assertTrue(Bpmn2Importer.looksLikeBpmn("<bpmn2:definitions xmlns:bpmn2=\"urn:x\">"));
        assertFalse(Bpmn2Importer.looksLikeBpmn("<definitions xmlns=\"http://example.com/other\">"));
        assertFalse(Bpmn2Importer.looksLikeBpmn("<xmi:XMI/>"));
        assertFalse(Bpmn2Importer.looksLikeBpmn(""));
    }

    @Test
    void documentWithoutDefinitionsIsAStructuralError() {
        ImportSource source = Fixtures.text("empty.bpmn", "<process id=\"p\"/>");
        Bpmn2Importer importer = new Bpmn2Importer();

        StructuralParseException e = assertThrows(StructuralParseException.class,
                () -> importer.parse(source, ImportContext.of(source), new ImportReport(IrMeta.Formats.BPMN2)));
        assertTrue(e.getMessage().contains("missing <definitions>"));
    }

    @Test
    void malformedXmlIsAStructuralError() {
        ImportSource source = Fixtures.text("broken.bpmn", "<definitions><process></definitions>");
        Bpmn2Importer importer = new Bpmn2Importer();

        assertThrows(StructuralParseException.class,
                () -> importer.parse(source, ImportContext.of(source), new ImportReport(IrMeta.Formats.BPMN2)));
    }

    private static IrElement element(IrModel ir, String id) {
        return ir.elements.stream().filter(e -> e.id.equals(id)).findFirst().orElseThrow();
    }

    private static IrRelationship relationship(IrModel ir, String id) {
        return ir.relationships.stream().filter(r -> r.id.equals(id)).findFirst().orElseThrow();
    }

    private static IrViewConnection connection(IrView view, String id) {
        return view.connections.stream().filter(c -> c.id.equals(id)).findFirst().orElseThrow();
    }
}
