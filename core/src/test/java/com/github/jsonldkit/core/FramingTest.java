package com.github.jsonldkit.core;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import com.github.jsonldkit.core.JsonLdConsts.Embed;
import com.github.jsonldkit.core.JsonLdError.Error;
import com.github.jsonldkit.utils.JsonUtils;

public class FramingTest {

    private static Object load(String name) throws IOException {
        final InputStream in = FramingTest.class.getResourceAsStream("/framing/" + name);
        try {
            return JsonUtils.fromInputStream(in);
        } finally {
            in.close();
        }
    }

    @Test
    public void framesLibrary() throws Exception {
        final Map<String, Object> framed = JsonLdProcessor.frame(load("library-in.jsonld"),
                load("library-frame.jsonld"), new JsonLdOptions());
        final Object expected = load("library-out.jsonld");
        assertTrue(JsonUtils.toPrettyString(framed), JsonLdUtils.deepCompare(expected, framed));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void embedNeverLeavesReferences() throws Exception {
        final Map<String, Object> frame = (Map<String, Object>) load("library-frame.jsonld");
        final Map<String, Object> contains = (Map<String, Object>) frame.get("ex:contains");
        contains.put("@embed", "@never");

        final Map<String, Object> framed = JsonLdProcessor.frame(load("library-in.jsonld"),
                frame, new JsonLdOptions());
        final List<Object> graph = (List<Object>) framed.get("@graph");
        assertEquals(1, graph.size());
        final Map<String, Object> library = (Map<String, Object>) graph.get(0);
        final Object expected = JsonUtils
                .fromString("{\"@id\": \"http://example.org/library/the-republic\"}");
        assertTrue(JsonUtils.toString(library),
                JsonLdUtils.deepCompare(expected, library.get("ex:contains")));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void omitGraphReturnsSingleNodeAtTopLevel() throws Exception {
        final JsonLdOptions opts = new JsonLdOptions();
        opts.setOmitGraph(true);
        final Map<String, Object> framed = JsonLdProcessor.frame(load("library-in.jsonld"),
                load("library-frame.jsonld"), opts);
        assertFalse(framed.containsKey("@graph"));
        assertEquals("http://example.org/library", framed.get("@id"));
        assertEquals("ex:Library", framed.get("@type"));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void defaultFillsMissingProperty() throws Exception {
        final Object input = JsonUtils.fromString("{"
                + "\"@context\": {\"@vocab\": \"http://example.org/\"},"
                + "\"@id\": \"http://example.org/thing\","
                + "\"@type\": \"Thing\"}");
        final Object frame = JsonUtils.fromString("{"
                + "\"@context\": {\"@vocab\": \"http://example.org/\"},"
                + "\"@type\": \"Thing\","
                + "\"status\": {\"@default\": \"unknown\"}}");
        final JsonLdOptions opts = new JsonLdOptions();
        opts.setOmitGraph(true);
        final Map<String, Object> framed = JsonLdProcessor.frame(input, frame, opts);
        assertEquals("unknown", framed.get("status"));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void missingPropertyDefaultsToNull() throws Exception {
        final Object input = JsonUtils.fromString("{"
                + "\"@context\": {\"@vocab\": \"http://example.org/\"},"
                + "\"@id\": \"http://example.org/thing\","
                + "\"@type\": \"Thing\"}");
        final Object frame = JsonUtils.fromString("{"
                + "\"@context\": {\"@vocab\": \"http://example.org/\"},"
                + "\"@type\": \"Thing\","
                + "\"status\": {}}");
        final JsonLdOptions opts = new JsonLdOptions();
        opts.setOmitGraph(true);
        final Map<String, Object> framed = JsonLdProcessor.frame(input, frame, opts);
        assertTrue(framed.containsKey("status"));
        assertEquals(null, framed.get("status"));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void prunesBlankNodeIdentifiersUsedOnce() throws Exception {
        final Object input = JsonUtils.fromString("{"
                + "\"@context\": {\"@vocab\": \"http://example.org/\"},"
                + "\"@type\": \"Thing\","
                + "\"name\": \"anonymous\"}");
        final Object frame = JsonUtils.fromString("{"
                + "\"@context\": {\"@vocab\": \"http://example.org/\"},"
                + "\"@type\": \"Thing\"}");
        final JsonLdOptions opts = new JsonLdOptions();
        opts.setOmitGraph(true);
        final Map<String, Object> framed = JsonLdProcessor.frame(input, frame, opts);
        assertFalse(JsonUtils.toString(framed), framed.containsKey("@id"));
        assertEquals("anonymous", framed.get("name"));

        opts.setPruneBlankNodeIdentifiers(false);
        final Map<String, Object> unpruned = JsonLdProcessor.frame(input, frame, opts);
        assertEquals("_:b0", unpruned.get("@id"));
    }

    @Test
    public void embedValuesConvert() throws Exception {
        assertEquals(Embed.LAST, JsonLdApi.toEmbed(true));
        assertEquals(Embed.NEVER, JsonLdApi.toEmbed(false));
        assertEquals(Embed.ALWAYS, JsonLdApi.toEmbed("@always"));
        assertEquals(Embed.ONCE, JsonLdApi.toEmbed("@once"));
        try {
            JsonLdApi.toEmbed("@sometimes");
            fail("expected an invalid embed value error");
        } catch (final JsonLdError e) {
            assertEquals(Error.INVALID_EMBED_VALUE, e.getType());
        }
    }

    @Test
    public void frameMustBeAnObject() throws Exception {
        try {
            JsonLdProcessor.frame(load("library-in.jsonld"), JsonUtils.fromString("[1, 2]"),
                    new JsonLdOptions());
            fail("expected an invalid frame error");
        } catch (final JsonLdError e) {
            assertEquals(Error.INVALID_FRAME, e.getType());
        }
    }
}
