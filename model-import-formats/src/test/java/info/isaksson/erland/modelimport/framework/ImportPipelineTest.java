package info.isaksson.erland.modelimport.framework;

import info.isaksson.erland.modelimport.bpmn2.Bpmn2Importer;
import info.isaksson.erland.modelimport.eaxmi.EaXmiImporter;
import info.isaksson.erland.modelimport.ir.IrElement;
import info.isaksson.erland.modelimport.ir.IrMeta;
import info.isaksson.erland.modelimport.ir.IrModel;
import info.isaksson.erland.modelimport.ir.IrRelationship;
import info.isaksson.erland.modelimport.meff.MeffImporter;
import info.isaksson.erland.modelimport.report.ImportReport;
import info.isaksson.erland.modelimport.testutil.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ImportPipelineTest {

    @Test
    void registryDiscoversBuiltInDialectsInPriorityOrder() {
        ImporterRegistry registry = ImporterRegistry.load();

        assertEquals(List.of(IrMeta.Formats.BPMN2, IrMeta.Formats.EA_XMI, IrMeta.Formats.MEFF),
                registry.importers().stream().map(Importer::id).toList());
        assertNotNull(registry.normalizerFor(IrMeta.Formats.BPMN2));
        assertNotNull(registry.normalizerFor(IrMeta.Formats.MEFF));
        assertNotNull(registry.normalizerFor(IrMeta.Formats.EA_XMI));
        assertNull(registry.normalizerFor("nope"));
    }

    @Test
    void registeringTheSameIdReplacesTheImporter() {
        ImporterRegistry registry = new ImporterRegistry(List.of(new MeffImporter(), new Bpmn2Importer()), List.of());
        registry.register(new FixedImporter("archimate-meff", 500, true));

        assertEquals(List.of("archimate-meff", IrMeta.Formats.BPMN2),
                registry.importers().stream().map(Importer::id).toList());
    }

    @Test
    void unrecognizedInputIsUnsupported() {
        ImportSource source = Fixtures.text("notes.txt", "just some text");

        UnsupportedImportFormatException e = assertThrows(UnsupportedImportFormatException.class,
                () -> Fixtures.run(source));
        assertEquals("notes.txt", e.getFileName());
        assertEquals("txt", e.getExtension());
    }

    @Test
    void throwingSnifferCountsAsNoMatch() {
        ImporterRegistry registry = new ImporterRegistry(
                List.of(new ThrowingSniffer(), new FixedImporter("fixed", 1, true)), List.of());

        assertEquals("fixed", registry.pick(ImportContext.of(Fixtures.text("a.xml", "<a/>"))).id());
    }

    @Test
    void pipelineStampsFormatAndRunsGenericNormalization() {
        ImporterRegistry registry = new ImporterRegistry(List.of(new FixedImporter("fixed", 1, true)), List.of());
        ImportPipelineOptions options = new ImportPipelineOptions();
        options.clock = Fixtures.FIXED_CLOCK;

        ParsedImport result = new ImportPipeline(registry).run(Fixtures.text("a.any", "x"), options);

        assertEquals("fixed", result.importerId);
        assertEquals("fixed", result.format, "meta.format falls back to the importer's format");
        assertEquals("2024-05-01T10:00:00Z", result.ir.meta.get(IrMeta.IMPORTED_AT_ISO));
        IrElement e = result.ir.elements.get(0);
        assertEquals("Unknown", e.type, "blank types become Unknown");
    }

    @Test
    void danglingRelationshipsSurviveBothNormalizersWhenDroppingIsOff() {
        ImportPipelineOptions options = new ImportPipelineOptions();
        options.clock = Fixtures.FIXED_CLOCK;
        options.dropDanglingRelationships = false;

        ParsedImport kept = new ImportPipeline(ImporterRegistry.load())
                .run(Fixtures.source("fixtures/meff/scenario-c.xml"), options);
        IrRelationship dangling = kept.ir.relationships.stream()
                .filter(r -> r.id.equals("id-rel-dangling")).findFirst().orElse(null);
        assertNotNull(dangling);
        assertEquals("id-missing", dangling.targetId);
        assertTrue(kept.report.getWarnings().stream().noneMatch(w -> w.contains("id-rel-dangling")),
                kept.report.getWarnings().toString());

        ParsedImport dropped = Fixtures.run("fixtures/meff/scenario-c.xml");
        assertTrue(dropped.ir.relationships.stream().noneMatch(r -> r.id.equals("id-rel-dangling")));
        assertEquals(1, dropped.report.getWarnings().stream().filter(w -> w.contains("id-rel-dangling")).count());
    }

    @Test
    void sniffingSeesOnlyTheConfiguredPrefix() {
        String padding = " ".repeat(64);
        ImportSource source = Fixtures.text("late.bin", padding + "<definitions xmlns=\"" + Bpmn2Importer.MODEL_NAMESPACE + "\"/>");

        assertTrue(new Bpmn2Importer().sniff(ImportContext.of(source)));
        assertFalse(new Bpmn2Importer().sniff(ImportContext.of(source, 32)));
        assertFalse(new EaXmiImporter().sniff(ImportContext.of(source)));
    }

    /** Accepts everything and returns one element with a blank type. */
    private static final class FixedImporter implements Importer {
        private final String id;
        private final int priority;
        private final boolean accept;

        FixedImporter(String id, int priority, boolean accept) {
            this.id = id;
            this.priority = priority;
            this.accept = accept;
        }

        @Override public String id() { return id; }
        @Override public String format() { return id; }
        @Override public String displayName() { return id; }
        @Override public int priority() { return priority; }
        @Override public List<String> extensions() { return List.of(); }
        @Override public boolean sniff(ImportContext ctx) { return accept; }

        @Override
        public IrModel parse(ImportSource source, ImportContext ctx, ImportReport report) {
            IrElement e = new IrElement("e1", " ", "Thing", null, null, null, null, null, null, null);
            return new IrModel(List.of(), List.of(e), List.of(), List.of(), Map.of());
        }
    }

    private static final class ThrowingSniffer implements Importer {
        @Override public String id() { return "throwing"; }
        @Override public String format() { return "throwing"; }
        @Override public String displayName() { return "throwing"; }
        @Override public int priority() { return 10; }
        @Override public List<String> extensions() { return List.of(); }
        @Override public boolean sniff(ImportContext ctx) { throw new IllegalStateException("boom"); }

        @Override
        public IrModel parse(ImportSource source, ImportContext ctx, ImportReport report) {
            throw new UnsupportedOperationException();
        }
    }
}
