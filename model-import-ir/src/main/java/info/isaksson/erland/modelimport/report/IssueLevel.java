package info.isaksson.erland.modelimport.report;

/** Severity of an {@link ImportIssue}. */
public enum IssueLevel {
    INFO,
    WARN,
    ERROR
}
