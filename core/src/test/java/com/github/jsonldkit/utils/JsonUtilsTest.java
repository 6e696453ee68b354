package com.github.jsonldkit.utils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.net.URL;
import java.util.List;
import java.util.Map;

import org.junit.Test;

public class JsonUtilsTest {

    @Test
    @SuppressWarnings("unchecked")
    public void parsesIntoOrderedTree() throws Exception {
        final Object parsed = JsonUtils.fromString("{\"b\": [1, 2.5, true, null], \"a\": \"x\"}");
        assertTrue(parsed instanceof Map);
        final Map<String, Object> map = (Map<String, Object>) parsed;
        assertEquals("b", map.keySet().iterator().next());
        final List<Object> list = (List<Object>) map.get("b");
        assertEquals(4, list.size());
        assertEquals(Boolean.TRUE, list.get(2));
    }

    @Test
    public void canonicalStringSortsKeysAndFormatsNumbers() throws Exception {
        final Object parsed = JsonUtils
                .fromString("{\"b\": 1.0, \"a\": {\"d\": 1e21, \"c\": \"q\\\"\"}, \"\u00e9\": [false]}");
        assertEquals("{\"a\":{\"c\":\"q\\\"\",\"d\":1e+21},\"b\":1,\"\u00e9\":[false]}",
                JsonUtils.toCanonicalString(parsed));
    }

    @Test
    public void writesCompactJson() throws Exception {
        assertEquals("{\"a\":[1,\"x\"]}", JsonUtils.toString(JsonUtils.fromString("{\"a\": [1, \"x\"]}")));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void readsDocumentFromFileUrl() throws Exception {
        final URL url = getClass().getResource("/framing/library-in.jsonld");
        final Map<String, Object> doc = (Map<String, Object>) JsonUtils.fromURL(url);
        assertTrue(doc.containsKey("@graph"));
        assertEquals(JsonUtils.toString(doc), JsonUtils.toString(
                JsonUtils.fromURL(url, JsonUtils.getDefaultHttpClient())));
    }
}
