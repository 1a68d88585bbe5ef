package info.isaksson.erland.modelimport.eaxmi;

import info.isaksson.erland.modelimport.xml.Xml;
import org.w3c.dom.Element;

import java.util.Locale;

/**
 * {@code bpmn.*} types for EA BPMN 2.0 profile tags. EA uses a few generic tags and puts the
 * kind into an attribute: {@code Activity activityType="Task" taskType="User"},
 * {@code Gateway gatewayType="Parallel"}.
 */
final class EaBpmnProfileTypes {

    private EaBpmnProfileTypes() {}

    static String relationshipType(String token) {
        return switch (key(token)) {
            case "sequenceflow" -> "bpmn.sequenceFlow";
            case "messageflow" -> "bpmn.messageFlow";
            case "association" -> "bpmn.association";
            case "datainputassociation" -> "bpmn.dataInputAssociation";
            case "dataoutputassociation", "dataassociation" -> "bpmn.dataOutputAssociation";
            default -> null;
        };
    }

    /** Null when the tag names no supported BPMN element. */
    static String elementType(String token, Element tag, Element base) {
        return switch (key(token)) {
            case "activity" -> activity(tag, base);
            case "task" -> task(attr(tag, base, "taskType"));
            case "usertask" -> "bpmn.userTask";
            case "servicetask" -> "bpmn.serviceTask";
            case "scripttask" -> "bpmn.scriptTask";
            case "manualtask" -> "bpmn.manualTask";
            case "subprocess" -> "bpmn.subProcess";
            case "callactivity" -> "bpmn.callActivity";
            case "startevent" -> "bpmn.startEvent";
            case "endevent" -> "bpmn.endEvent";
            case "intermediateevent", "intermediatecatchevent" -> "bpmn.intermediateCatchEvent";
            case "intermediatethrowevent" -> "bpmn.intermediateThrowEvent";
            case "boundaryevent" -> "bpmn.boundaryEvent";
            case "gateway" -> gateway(attr(tag, base, "gatewayType"));
            case "exclusivegateway" -> "bpmn.gatewayExclusive";
            case "parallelgateway" -> "bpmn.gatewayParallel";
            case "inclusivegateway" -> "bpmn.gatewayInclusive";
            case "eventbasedgateway" -> "bpmn.gatewayEventBased";
            case "pool", "participant" -> "bpmn.pool";
            case "lane" -> "bpmn.lane";
            case "dataobject", "dataobjectreference" -> "bpmn.dataObjectReference";
            case "datastore", "datastorereference" -> "bpmn.dataStoreReference";
            case "textannotation" -> "bpmn.textAnnotation";
            case "group" -> "bpmn.group";
            case "message" -> "bpmn.message";
            case "signal" -> "bpmn.signal";
            case "error" -> "bpmn.error";
            case "escalation" -> "bpmn.escalation";
            default -> null;
        };
    }

    private static String activity(Element tag, Element base) {
        String kind = key(attr(tag, base, "activityType"));
        if (kind.contains("subprocess")) return "bpmn.subProcess";
        if (kind.contains("callactivity")) return "bpmn.callActivity";
        return task(attr(tag, base, "taskType"));
    }

    private static String task(String taskType) {
        return switch (key(taskType)) {
            case "user" -> "bpmn.userTask";
            case "service" -> "bpmn.serviceTask";
            case "script" -> "bpmn.scriptTask";
            case "manual" -> "bpmn.manualTask";
            default -> "bpmn.task";
        };
    }

    private static String gateway(String gatewayType) {
        return switch (key(gatewayType)) {
            case "parallel" -> "bpmn.gatewayParallel";
            case "inclusive" -> "bpmn.gatewayInclusive";
            case "eventbased" -> "bpmn.gatewayEventBased";
            default -> "bpmn.gatewayExclusive";
        };
    }

    private static String attr(Element tag, Element base, String name) {
        String v = Xml.attrTrim(tag, name);
        return v != null || base == null ? v : Xml.attrTrim(base, name);
    }

    private static String key(String s) {
        return s == null ? "" : s.replaceAll("[^A-Za-z0-9]", "").toLowerCase(Locale.ROOT);
    }
}
