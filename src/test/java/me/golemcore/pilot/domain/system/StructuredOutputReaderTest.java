package me.golemcore.pilot.domain.system;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class StructuredOutputReaderTest {

    private final StructuredOutputReader reader = new StructuredOutputReader(new ObjectMapper());

    @Test
    void shouldReadPlainObject() throws Exception {
        ObjectNode node = reader.readObject("  {\"adjustedQuery\": \"retry\"}  ");

        assertEquals("retry", node.get("adjustedQuery").asText());
    }

    @Test
    void shouldReadFencedObject() throws Exception {
        ObjectNode node = reader.readObject("Sure:\n```json\n{\"summary\": \"ok\"}\n```\nAnything else?");

        assertEquals("ok", node.get("summary").asText());
    }

    @Test
    void shouldReadObjectEmbeddedInProse() throws Exception {
        ObjectNode node = reader.readObject("The answer is {\"confidence\": 0.4} as requested.");

        assertEquals(0.4, node.get("confidence").asDouble(), 1e-9);
    }

    @Test
    void shouldRejectResponsesWithoutObject() {
        assertThrows(StructuredOutputReader.StructuredOutputException.class, () -> reader.readObject("no json"));
        assertThrows(StructuredOutputReader.StructuredOutputException.class, () -> reader.readObject(null));
        assertNull(StructuredOutputReader.extractJson("   "));
    }

    @Test
    void shouldRejectMalformedObject() {
        assertThrows(Exception.class, () -> reader.readObject("{\"steps\": [1, 2"));
    }
}
