package info.isaksson.erland.modelimport.types;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The ArchiMate element and relationship types the canonical model supports, plus its built-in viewpoints.
 */
public final class ArchimatePalette {

    private ArchimatePalette() {}

    public static final Map<ArchimateLayer, List<String>> ELEMENT_TYPES_BY_LAYER = buildElementTypes();

    public static final List<String> RELATIONSHIP_TYPES = List.of(
            "Association",
            "Serving",
            "Realization",
            "Flow",
            "Composition",
            "Aggregation",
            "Assignment",
            "Access",
            "Influence",
            "Triggering",
            "Specialization"
    );

    public static final Set<String> VIEWPOINT_IDS = Set.of(
            "layered",
            "organization",
            "application-cooperation",
            "application-usage",
            "business-process-cooperation",
            "capability-map",
            "goal-realization",
            "implementation-deployment",
            "information-structure",
            "motivation",
            "physical",
            "product",
            "requirements-realization",
            "service-realization",
            "stakeholder",
            "strategy",
            "technology",
            "technology-usage",
            "value-stream",
            "migration"
    );

    private static final Map<String, ArchimateLayer> LAYER_BY_ELEMENT_TYPE = buildLayerIndex();

    public static boolean isElementType(String type) {
        return type != null && LAYER_BY_ELEMENT_TYPE.containsKey(type);
    }

    public static boolean isRelationshipType(String type) {
        return type != null && RELATIONSHIP_TYPES.contains(type);
    }

    /** Layer of a known element type, or null. */
    public static ArchimateLayer layerOf(String elementType) {
        return elementType == null ? null : LAYER_BY_ELEMENT_TYPE.get(elementType);
    }

    public static Set<String> elementTypes() {
        return LAYER_BY_ELEMENT_TYPE.keySet();
    }

    private static Map<ArchimateLayer, List<String>> buildElementTypes() {
        Map<ArchimateLayer, List<String>> m = new EnumMap<>(ArchimateLayer.class);
        m.put(ArchimateLayer.STRATEGY, List.of("Capability", "CourseOfAction", "Resource", "Outcome", "ValueStream"));
        m.put(ArchimateLayer.BUSINESS, List.of(
                "BusinessActor", "BusinessRole", "BusinessCollaboration", "BusinessInterface",
                "BusinessProcess", "BusinessFunction", "BusinessInteraction", "BusinessEvent",
                "BusinessService", "BusinessObject", "Contract", "Representation", "Product", "Grouping"));
        m.put(ArchimateLayer.APPLICATION, List.of(
                "ApplicationComponent", "ApplicationCollaboration", "ApplicationInterface",
                "ApplicationProcess", "ApplicationFunction", "ApplicationInteraction",
                "ApplicationEvent", "ApplicationService", "DataObject"));
        m.put(ArchimateLayer.TECHNOLOGY, List.of(
                "Node", "Device", "SystemSoftware", "TechnologyCollaboration", "TechnologyInterface",
                "TechnologyProcess", "TechnologyFunction", "TechnologyInteraction", "TechnologyEvent",
                "TechnologyService", "Path", "CommunicationNetwork", "Artifact"));
        m.put(ArchimateLayer.PHYSICAL, List.of("Facility", "Equipment", "DistributionNetwork", "Material", "Location"));
        m.put(ArchimateLayer.IMPLEMENTATION_MIGRATION, List.of("WorkPackage", "ImplementationEvent", "Deliverable", "Plateau", "Gap"));
        m.put(ArchimateLayer.MOTIVATION, List.of(
                "Stakeholder", "Driver", "Assessment", "Constraint", "Principle", "Value", "Meaning", "Goal", "Requirement"));
        return Collections.unmodifiableMap(m);
    }

    private static Map<String, ArchimateLayer> buildLayerIndex() {
        Map<String, ArchimateLayer> out = new LinkedHashMap<>();
        for (Map.Entry<ArchimateLayer, List<String>> e : ELEMENT_TYPES_BY_LAYER.entrySet()) {
            for (String t : e.getValue()) out.putIfAbsent(t, e.getKey());
        }
        return Collections.unmodifiableMap(out);
    }
}
