package me.golemcore.chorus.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StructuredOutputParserTest {

    private final StructuredOutputParser parser = new StructuredOutputParser(new ObjectMapper());

    @Test
    void shouldParseWholeReplyAsObject() {
        Optional<JsonNode> node = parser.parseStrict("  {\"action\": \"nothing\"}\n");

        assertTrue(node.isPresent());
        assertEquals("nothing", parser.text(node.get(), "action"));
    }

    @Test
    void shouldRejectNonObjectJson() {
        assertTrue(parser.parseStrict("[1, 2]").isEmpty());
        assertTrue(parser.parseStrict("").isEmpty());
        assertTrue(parser.parseStrict(null).isEmpty());
    }

    @Test
    void shouldExtractObjectFromProse() {
        String reply = "Sure! Here you go: {\"journal\": [\"met {Bob}\"], \"core\": []} Hope it helps.";

        Optional<String> extracted = parser.extractFirstObject(reply);

        assertEquals("{\"journal\": [\"met {Bob}\"], \"core\": []}", extracted.orElseThrow());
    }

    @Test
    void shouldSkipUnbalancedOpeningBrace() {
        assertEquals("{\"a\": 1}", parser.extractFirstObject("{ broken and then {\"a\": 1}").orElse(null));
    }

    @Test
    void shouldFallBackToExtractionInLenientParse() {
        JsonNode node = parser.parseLenient("Answer:\n```json\n{\"consent\": \"yes\"}\n```").orElseThrow();

        assertEquals("yes", parser.text(node, "consent"));
    }

    @Test
    void shouldReadOnlyNonBlankStringsFromArray() {
        JsonNode node = parser.parseStrict("{\"items\": [\" one \", \"\", 3, null, \"two\"]}").orElseThrow();

        assertEquals(List.of("one", "two"), parser.stringArray(node, "items"));
        assertTrue(parser.stringArray(node, "missing").isEmpty());
    }

    @Test
    void shouldReadIntegersIncludingNumericStrings() {
        JsonNode node = parser.parseStrict("{\"ids\": [1, \"2\", \"x\", 3.5]}").orElseThrow();

        assertEquals(List.of(1, 2), parser.intArray(node, "ids"));
    }

    @Test
    void shouldDropIntegersOutsideIntRange() {
        JsonNode node = parser.parseStrict("{\"ids\": [4294967297, \"99999999999\", 2, \"3\"]}").orElseThrow();

        assertEquals(List.of(2, 3), parser.intArray(node, "ids"));
    }

    @Test
    void shouldReturnNullForMissingOrNullText() {
        JsonNode node = parser.parseStrict("{\"a\": null}").orElseThrow();

        assertNull(parser.text(node, "a"));
        assertNull(parser.text(node, "b"));
    }
}
