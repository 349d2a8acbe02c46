package org.dxworks.mdast.converter;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PandocAttributesTest {

    @Test
    void merge_IdClassesAndKeys() {
        Map<String, String> attributes = PandocAttributes.merge(new LinkedHashMap<>(), "{#intro .note .wide lang=en}");

        assertEquals("intro", attributes.get(PandocAttributes.ID));
        assertEquals("note wide", attributes.get(PandocAttributes.CLASS));
        assertEquals("en", attributes.get("lang"));
    }

    @Test
    void merge_FirstIdWinsLastKeyWins() {
        Map<String, String> attributes = new LinkedHashMap<>();
        PandocAttributes.merge(attributes, "{#first k=1}");
        PandocAttributes.merge(attributes, "{#second k=2 .c}");

        assertEquals("first", attributes.get("id"));
        assertEquals("2", attributes.get("k"));
        assertEquals("c", attributes.get("class"));
    }

    @Test
    void merge_IgnoresMalformedTokensAndMissingBraces() {
        Map<String, String> attributes = PandocAttributes.merge(new LinkedHashMap<>(), "  a=b=c plain x=1 ");

        assertEquals(Map.of("x", "1"), attributes);
    }

    @Test
    void merge_EmptyBlockAddsNothing() {
        assertTrue(PandocAttributes.merge(new LinkedHashMap<>(), "{}").isEmpty());
        assertTrue(PandocAttributes.merge(new LinkedHashMap<>(), "{   }").isEmpty());
    }
}
