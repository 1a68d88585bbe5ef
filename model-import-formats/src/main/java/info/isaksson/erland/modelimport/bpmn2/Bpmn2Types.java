package info.isaksson.erland.modelimport.bpmn2;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** BPMN 2.0 local names and the {@code bpmn.*} type tokens they import as. */
final class Bpmn2Types {

    private Bpmn2Types() {}

    static final String POOL = "bpmn.pool";
    static final String LANE = "bpmn.lane";
    static final String SUB_PROCESS = "bpmn.subProcess";

    /** Local names scanned for elements, in scan order. Global definitions first so events can refer to them. */
    static final Map<String, String> NODE_TYPES = nodeTypes();

    static final Map<String, String> RELATIONSHIP_TYPES = relationshipTypes();

    /** Recognized but not imported; one warning per local name. */
    static final List<String> UNSUPPORTED = List.of(
            "sendTask", "receiveTask", "businessRuleTask", "complexGateway", "transaction", "eventSubProcess");

    static String nodeType(String localName) {
        return NODE_TYPES.get(localName.toLowerCase(Locale.ROOT));
    }

    static String relationshipType(String localName) {
        return RELATIONSHIP_TYPES.get(localName.toLowerCase(Locale.ROOT));
    }

    static boolean isContainer(String type) {
        return POOL.equals(type) || LANE.equals(type);
    }

    /** {@code "<kind> (<id>)"}, the name given to unnamed BPMN elements. */
    static String defaultName(String type, String id) {
        String shortType = type.startsWith("bpmn.") ? type.substring("bpmn.".length()) : type;
        return shortType + " (" + id + ")";
    }

    private static Map<String, String> nodeTypes() {
        Map<String, String> m = new LinkedHashMap<>();
        // Global definitions referenced by events and flows
        m.put("message", "bpmn.message");
        m.put("signal", "bpmn.signal");
        m.put("error", "bpmn.error");
        m.put("escalation", "bpmn.escalation");
        // Containers
        m.put("participant", POOL);
        m.put("lane", LANE);
        // Activities
        m.put("task", "bpmn.task");
        m.put("usertask", "bpmn.userTask");
        m.put("servicetask", "bpmn.serviceTask");
        m.put("scripttask", "bpmn.scriptTask");
        m.put("manualtask", "bpmn.manualTask");
        m.put("callactivity", "bpmn.callActivity");
        m.put("subprocess", SUB_PROCESS);
        // Events
        m.put("startevent", "bpmn.startEvent");
        m.put("endevent", "bpmn.endEvent");
        m.put("intermediatecatchevent", "bpmn.intermediateCatchEvent");
        m.put("intermediatethrowevent", "bpmn.intermediateThrowEvent");
        m.put("boundaryevent", "bpmn.boundaryEvent");
        // Gateways
        m.put("exclusivegateway", "bpmn.gatewayExclusive");
        m.put("parallelgateway", "bpmn.gatewayParallel");
        m.put("inclusivegateway", "bpmn.gatewayInclusive");
        m.put("eventbasedgateway", "bpmn.gatewayEventBased");
        // Artifacts
        m.put("textannotation", "bpmn.textAnnotation");
        m.put("dataobjectreference", "bpmn.dataObjectReference");
        m.put("datastorereference", "bpmn.dataStoreReference");
        m.put("group", "bpmn.group");
        return m;
    }

    private static Map<String, String> relationshipTypes() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("sequenceflow", "bpmn.sequenceFlow");
        m.put("messageflow", "bpmn.messageFlow");
        m.put("association", "bpmn.association");
        m.put("datainputassociation", "bpmn.dataInputAssociation");
        m.put("dataoutputassociation", "bpmn.dataOutputAssociation");
        return m;
    }
}
