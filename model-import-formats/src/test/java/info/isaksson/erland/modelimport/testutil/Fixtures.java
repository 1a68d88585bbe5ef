package info.isaksson.erland.modelimport.testutil;

import info.isaksson.erland.modelimport.framework.ImportPipeline;
import info.isaksson.erland.modelimport.framework.ImportPipelineOptions;
import info.isaksson.erland.modelimport.framework.ImportSource;
import info.isaksson.erland.modelimport.framework.ImporterRegistry;
import info.isaksson.erland.modelimport.framework.ParsedImport;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/** Test helper for loading fixture documents from the test classpath and running them through the pipeline. */
public final class Fixtures {
    private Fixtures() {}

    public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    /** Classpath-relative fixture, e.g. {@code fixtures/meff/scenario-c.xml}. */
    public static ImportSource source(String resource) {
        try (InputStream in = Fixtures.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) throw new IllegalStateException("Missing test resource: " + resource);
            String name = resource.substring(resource.lastIndexOf('/') + 1);
            return new ImportSource(name, in.readAllBytes(), null);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static ImportSource text(String fileName, String xml) {
        return new ImportSource(fileName, xml.getBytes(StandardCharsets.UTF_8), null);
    }

    public static ParsedImport run(ImportSource source) {
        ImportPipelineOptions o = new ImportPipelineOptions();
        o.clock = FIXED_CLOCK;
        return new ImportPipeline(ImporterRegistry.load()).run(source, o);
    }

    public static ParsedImport run(String resource) {
        return run(source(resource));
    }
}
