package info.isaksson.erland.modelimport.apply;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class IdAllocatorTest {

    @Test
    void hashedIdsDependOnSeedAndKeyAndStayUnique() {
        IdAllocator a = IdAllocator.hashed("s1");
        IdAllocator b = IdAllocator.hashed("s1");

        String first = a.next("element", "x");
        assertEquals(first, b.next("element", "x"));
        assertTrue(first.matches("element_[0-9a-f]{32}"), first);

        String repeat = a.next("element", "x");
        assertNotEquals(first, repeat);
        assertEquals(repeat, b.next("element", "x"));

        assertNotEquals(first, IdAllocator.hashed("s2").next("element", "x"));
        assertNotEquals(first, IdAllocator.hashed("s1").next("folder", "x").replace("folder_", "element_"));
    }

    @Test
    void randomIdsCarryThePrefix() {
        IdAllocator random = IdAllocator.random();
        String id = random.next("view", "v1");
        assertTrue(id.startsWith("view_"));
        assertNotEquals(id, random.next("view", "v1"));
    }

    @Test
    void unknownTypePolicyParsesCliValues() {
        assertEquals(UnknownTypePolicy.IMPORT_AS_UNKNOWN, UnknownTypePolicy.parse("import"));
        assertEquals(UnknownTypePolicy.IMPORT_AS_UNKNOWN, UnknownTypePolicy.parse("Import-As-Unknown"));
        assertEquals(UnknownTypePolicy.SKIP, UnknownTypePolicy.parse(" skip "));
        assertThrows(IllegalArgumentException.class, () -> UnknownTypePolicy.parse("drop"));
    }
}
