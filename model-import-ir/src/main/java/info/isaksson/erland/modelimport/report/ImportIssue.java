package info.isaksson.erland.modelimport.report;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A deduplicated diagnostic. Identical (level, code, message) triples share one issue whose
 * {@link #count()} grows, keeping up to a bounded number of context samples.
 */
@JsonPropertyOrder({"level","code","message","count","samples"})
public final class ImportIssue {

    private final IssueLevel level;
    private final String code;
    private final String message;
    private int count;
    private final List<Map<String, String>> samples = new ArrayList<>();

    ImportIssue(IssueLevel level, String code, String message) {
        this.level = Objects.requireNonNull(level, "level must not be null");
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
    }

    void record(Map<String, String> context, int maxSamples) {
        count++;
        if (context != null && !context.isEmpty() && samples.size() < maxSamples) {
            samples.add(Collections.unmodifiableMap(new LinkedHashMap<>(context)));
        }
    }

    public IssueLevel getLevel() { return level; }

    public String getCode() { return code; }

    public String getMessage() { return message; }

    public int getCount() { return count; }

    public List<Map<String, String>> getSamples() {
        return Collections.unmodifiableList(samples);
    }

    static String key(IssueLevel level, String code, String message) {
        return level + "\u0000" + code + "\u0000" + message;
    }

    @Override public String toString() {
        return level + " [" + code + "] " + message + (count > 1 ? " (x" + count + ")" : "");
    }
}
