package info.isaksson.erland.modelimport.ir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class IrJsonDeterminismTest {

    @Test
    void writeMatchesGoldenArchimate() throws Exception {
        assertGoldenRoundTrip("ir/golden/archimate-mini.json");
    }

    @Test
    void readKeepsNodeOrderAndMeta() throws Exception {
        IrModel model = IrJson.read(golden("ir/golden/archimate-mini.json"));

        assertEquals("archimate-meff", model.format());
        IrView view = model.views.get(0);
        assertEquals("n-role", view.nodes.get(0).id, "node order is drawing order and must survive");
        assertEquals(IrViewNodeKind.NOTE, view.nodes.get(2).kind);
        assertTrue(IrMaps.isTrue(view.connections.get(0).meta, IrMeta.REVERSED));
        assertEquals(2, view.connections.get(0).points.size());
    }

    @Test
    void unorderedModelIsWrittenInCanonicalOrder() throws Exception {
        IrModel shuffled = new IrModel(
                null,
                java.util.List.of(
                        new IrElement("b", "BusinessRole", "B", null, null, null, null, null, null, null),
                        new IrElement("a", "BusinessActor", "A", null, null, null, null, null, null, null)),
                null, null, null);
        IrModel sorted = new IrModel(
                null,
                java.util.List.of(
                        new IrElement("a", "BusinessActor", "A", null, null, null, null, null, null, null),
                        new IrElement("b", "BusinessRole", "B", null, null, null, null, null, null, null)),
                null, null, null);

        assertEquals(IrJson.toJsonString(sorted), IrJson.toJsonString(shuffled));
    }

    private static void assertGoldenRoundTrip(String resourcePath) throws IOException, URISyntaxException {
        Path goldenPath = golden(resourcePath);
        String golden = Files.readString(goldenPath, StandardCharsets.UTF_8);

        IrModel model = IrJson.read(goldenPath);

        ObjectMapper om = new ObjectMapper();
        JsonNode goldenNode = om.readTree(golden);

        String rendered = IrJson.toJsonString(model);
        assertEquals(goldenNode, om.readTree(rendered), "Rendered JSON must be semantically equal to golden fixture.");
        assertTrue(rendered.endsWith("\n"));

        Path tmp = Files.createTempFile("irjson-", ".json");
        IrJson.write(model, tmp);
        String written = Files.readString(tmp, StandardCharsets.UTF_8);
        assertEquals(goldenNode, om.readTree(written), "Written JSON must be semantically equal to golden fixture.");

        Path tmp2 = Files.createTempFile("irjson-", ".json");
        IrJson.write(model, tmp2);
        assertEquals(written, Files.readString(tmp2, StandardCharsets.UTF_8), "Writing twice must produce identical output.");
    }

    private static Path golden(String resourcePath) throws URISyntaxException {
        return Path.of(IrJsonDeterminismTest.class.getClassLoader().getResource(resourcePath).toURI());
    }
}
