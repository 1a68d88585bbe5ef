package info.isaksson.erland.modelimport.report;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ImportReportTest {

    @Test
    void identicalIssuesAreCountedOnceWithBoundedSamples() {
        ImportReport report = new ImportReport("test", 2);
        for (int i = 0; i < 4; i++) {
            report.warn("dangling", "Dropped relationship", "id", "r" + i);
        }

        assertEquals(4, report.getWarnings().size(), "flat warnings keep one entry per warning");
        List<ImportIssue> issues = report.getIssues();
        assertEquals(1, issues.size());
        ImportIssue issue = issues.get(0);
        assertEquals(IssueLevel.WARN, issue.getLevel());
        assertEquals(4, issue.getCount());
        assertEquals(2, issue.getSamples().size());
        assertEquals(Map.of("id", "r0"), issue.getSamples().get(0));
    }

    @Test
    void defaultSampleLimitIsFive() {
        ImportReport report = new ImportReport("test");
        for (int i = 0; i < 8; i++) {
            report.warn("x", "same", "i", String.valueOf(i));
        }
        assertEquals(ImportReport.DEFAULT_MAX_SAMPLES, report.getIssues().get(0).getSamples().size());
    }

    @Test
    void differentLevelsOrMessagesAreSeparateIssues() {
        ImportReport report = new ImportReport("test");
        report.warn("code-b", "beta");
        report.warn("code-a", "alpha");
        report.warn("code-a", "alpha 2");
        report.info("code-a", "alpha");
        report.warn("plain warning without code");

        List<ImportIssue> issues = report.getIssues();
        assertEquals(5, issues.size());
        assertEquals(IssueLevel.INFO, issues.get(0).getLevel());
        assertEquals("code-a", issues.get(1).getCode());
        assertEquals("alpha", issues.get(1).getMessage());
        assertEquals(1, report.getIssues(ImportReport.GENERIC_WARNING).size());
        assertEquals(4, report.getWarnings().size(), "info issues do not add flat warnings");
    }

    @Test
    void unknownTypesAreKeyedByNamespaceAndName() {
        ImportReport report = new ImportReport("test");
        report.countUnknownElementType("archimate-meff", "Foo");
        report.countUnknownElementType("archimate-meff", "Foo");
        report.countUnknownRelationshipType("bpmn2", "weird");

        assertEquals(Map.of("archimate-meff:Foo", 2), report.getUnknownElementTypes());
        assertEquals(Map.of("bpmn2:weird", 1), report.getUnknownRelationshipTypes());

        report.mergeUnknownTypeCounts(Map.of("archimate-meff:Foo", 1, "x:y", 3), Map.of("bpmn2:weird", 4));
        assertEquals(Map.of("archimate-meff:Foo", 2, "x:y", 3), report.getUnknownElementTypes());
        assertEquals(Map.of("bpmn2:weird", 4), report.getUnknownRelationshipTypes());
    }
}
