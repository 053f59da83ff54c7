package flowgraph;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PortTest {

    @Test
    void testParseReadsDocumentForm() {
        assertEquals(Port.NEXT, Port.parse("Next"));
        assertEquals(Port.TRUE, Port.parse("True"));
        assertEquals(Port.FALSE, Port.parse("False"));
        assertEquals(Port.DEFAULT, Port.parse("Default"));

        Port port = Port.parse("Case('a')");
        assertEquals(Port.Kind.CASE, port.getKind());
        assertEquals("'a'", port.getCaseValue());
        assertEquals("Case('a')", port.toString());
    }

    @Test
    void testCasePortsCompareByValue() {
        assertEquals(Port.caseOf("1"), Port.caseOf("1"));
        assertNotEquals(Port.caseOf("1"), Port.caseOf("2"));
        assertNotEquals(Port.DEFAULT, Port.caseOf("default"));
    }

    @Test
    void testUnknownPortIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Port.parse("Sideways"));
    }
}
