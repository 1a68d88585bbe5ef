package info.isaksson.erland.modelimport.report;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Collects every non-fatal diagnostic of one import run.
 *
 * <p>Two views are kept: a flat list of warning texts (one entry per warning, in the order they were raised)
 * and deduplicated {@link ImportIssue}s. Unknown type counters are keyed {@code "ns:name"}.</p>
 *
 * <p>Not thread-safe; one report belongs to one import.</p>
 */
@JsonPropertyOrder({"source","warnings","issues","unknownElementTypes","unknownRelationshipTypes"})
public final class ImportReport {

    public static final int DEFAULT_MAX_SAMPLES = 5;

    /** Code used when a warning is raised without a specific code. */
    public static final String GENERIC_WARNING = "import-warning";

    private String source;
    private final int maxSamples;
    private final List<String> warnings = new ArrayList<>();
    private final Map<String, ImportIssue> issues = new LinkedHashMap<>();
    private final Map<String, Integer> unknownElementTypes = new TreeMap<>();
    private final Map<String, Integer> unknownRelationshipTypes = new TreeMap<>();

    public ImportReport(String source) {
        this(source, DEFAULT_MAX_SAMPLES);
    }

    public ImportReport(String source, int maxSamples) {
        this.source = source;
        this.maxSamples = Math.max(0, maxSamples);
    }

    public String getSource() { return source; }

    public void setSource(String source) { this.source = source; }

    public void warn(String message) {
        warn(GENERIC_WARNING, message, null);
    }

    public void warn(String code, String message) {
        warn(code, message, null);
    }

    public void warn(String code, String message, Map<String, String> context) {
        warnings.add(message);
        record(IssueLevel.WARN, code, message, context);
    }

    public void warn(String code, String message, String k1, String v1) {
        Map<String, String> ctx = new LinkedHashMap<>();
        ctx.put(k1, v1);
        warn(code, message, ctx);
    }

    public void warn(String code, String message, String k1, String v1, String k2, String v2) {
        Map<String, String> ctx = new LinkedHashMap<>();
        ctx.put(k1, v1);
        ctx.put(k2, v2);
        warn(code, message, ctx);
    }

    public void info(String code, String message) {
        info(code, message, null);
    }

    public void info(String code, String message, Map<String, String> context) {
        record(IssueLevel.INFO, code, message, context);
    }

    public void error(String code, String message, Map<String, String> context) {
        record(IssueLevel.ERROR, code, message, context);
    }

    public void countUnknownElementType(String ns, String name) {
        unknownElementTypes.merge(typeKey(ns, name), 1, Integer::sum);
    }

    public void countUnknownRelationshipType(String ns, String name) {
        unknownRelationshipTypes.merge(typeKey(ns, name), 1, Integer::sum);
    }

    /**
     * Merges counts from scanning the finished model into the counters recorded while parsing, keeping the
     * larger count per {@code "ns:name"} key. Types counted by a parser but later dropped or skipped stay reported.
     */
    public void mergeUnknownTypeCounts(Map<String, Integer> elements, Map<String, Integer> relationships) {
        if (elements != null) elements.forEach((k, v) -> unknownElementTypes.merge(k, v, Math::max));
        if (relationships != null) relationships.forEach((k, v) -> unknownRelationshipTypes.merge(k, v, Math::max));
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    /** Issues sorted by (level, code, message). */
    public List<ImportIssue> getIssues() {
        List<ImportIssue> out = new ArrayList<>(issues.values());
        out.sort(Comparator
                .comparing(ImportIssue::getLevel)
                .thenComparing(ImportIssue::getCode)
                .thenComparing(ImportIssue::getMessage));
        return Collections.unmodifiableList(out);
    }

    public List<ImportIssue> getIssues(String code) {
        List<ImportIssue> out = new ArrayList<>();
        for (ImportIssue i : getIssues()) {
            if (i.getCode().equals(code)) out.add(i);
        }
        return out;
    }

    public Map<String, Integer> getUnknownElementTypes() {
        return Collections.unmodifiableMap(unknownElementTypes);
    }

    public Map<String, Integer> getUnknownRelationshipTypes() {
        return Collections.unmodifiableMap(unknownRelationshipTypes);
    }

    @JsonIgnore
    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    private void record(IssueLevel level, String code, String message, Map<String, String> context) {
        String c = code == null || code.isBlank() ? GENERIC_WARNING : code;
        String m = message == null ? "" : message;
        ImportIssue issue = issues.computeIfAbsent(ImportIssue.key(level, c, m), k -> new ImportIssue(level, c, m));
        issue.record(context, maxSamples);
    }

    private static String typeKey(String ns, String name) {
        return (ns == null ? "" : ns) + ":" + (name == null ? "" : name);
    }
}
