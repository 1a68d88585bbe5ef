package info.isaksson.erland.modelimport.types;

/** ArchiMate layers, used to place elements whose type could not be resolved. */
public enum ArchimateLayer {
    STRATEGY,
    BUSINESS,
    APPLICATION,
    TECHNOLOGY,
    PHYSICAL,
    IMPLEMENTATION_MIGRATION,
    MOTIVATION
}
