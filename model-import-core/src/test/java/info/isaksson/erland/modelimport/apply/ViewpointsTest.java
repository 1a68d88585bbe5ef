package info.isaksson.erland.modelimport.apply;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ViewpointsTest {

    @Test
    void resolvesBuiltInIdsAndNames() {
        assertEquals("layered", Viewpoints.resolve(null));
        assertEquals("layered", Viewpoints.resolve("  "));
        assertEquals("motivation", Viewpoints.resolve("motivation"));
        assertEquals("service-realization", Viewpoints.resolve("Service Realization"));
        assertEquals("application-cooperation", Viewpoints.resolve("ApplicationCooperation"));
        assertEquals("technology-usage", Viewpoints.resolve("Technology Usage Viewpoint"));
        assertEquals("layered", Viewpoints.resolve("Something Custom"));
    }
}
