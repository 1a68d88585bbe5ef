package info.isaksson.erland.modelimport.ir;

/**
 * Well-known keys used in IR {@code meta} and {@code attrs} maps.
 *
 * <p>Parsers, normalizers and the apply stage communicate through these keys; keep them stable.</p>
 */
public final class IrMeta {

    private IrMeta() {}

    // Model level
    public static final String FORMAT = "format";
    public static final String TOOL = "tool";
    public static final String SOURCE_SYSTEM = "sourceSystem";
    public static final String MODEL_NAME = "modelName";
    public static final String IMPORTED_AT_ISO = "importedAtIso";

    // Entity level
    public static final String REVERSED = "reversed";
    public static final String OWNING_ELEMENT_ID = "owningElementId";
    public static final String OBJECT_TYPE = "objectType";
    public static final String EXTENSION_TAGS = "extensionTags";
    public static final String SOURCE_TYPE = "sourceType";
    public static final String REF_RAW = "refRaw";
    public static final String METACLASS = "metaclass";

    // Attrs
    public static final String UNRESOLVED_REFS = "unresolvedRefs";
    public static final String ASSOCIATION_RELATIONSHIP_ID = "associationRelationshipId";
    public static final String ASSOCIATION_CLASS_ELEMENT_ID = "associationClassElementId";

    /** Format identifiers written to {@link #FORMAT}. */
    public static final class Formats {
        private Formats() {}

        public static final String BPMN2 = "bpmn2";
        public static final String MEFF = "archimate-meff";
        public static final String EA_XMI = "ea-xmi-uml";
    }
}
