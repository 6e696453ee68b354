package com.github.jsonldkit.core;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;
import java.util.Map;

import org.junit.Test;

import com.github.jsonldkit.core.JsonLdError.Error;
import com.github.jsonldkit.utils.JsonUtils;
import com.github.jsonldkit.utils.Obj;

public class JsonLdProcessorTest {

    private static final String ALICE = "{"
            + "\"@context\": {"
            + "  \"name\": \"http://xmlns.com/foaf/0.1/name\","
            + "  \"knows\": {\"@id\": \"http://xmlns.com/foaf/0.1/knows\", \"@type\": \"@id\"}"
            + "},"
            + "\"@id\": \"http://example.org/alice\","
            + "\"name\": \"Alice\","
            + "\"knows\": \"http://example.org/bob\"}";

    private static final String ALICE_EXPANDED = "[{"
            + "\"@id\": \"http://example.org/alice\","
            + "\"http://xmlns.com/foaf/0.1/name\": [{\"@value\": \"Alice\"}],"
            + "\"http://xmlns.com/foaf/0.1/knows\": [{\"@id\": \"http://example.org/bob\"}]}]";

    @Test
    public void expandsAlice() throws Exception {
        final Object expanded = JsonLdProcessor.expand(JsonUtils.fromString(ALICE));
        assertTrue(JsonUtils.toString(expanded),
                JsonLdUtils.deepCompare(JsonUtils.fromString(ALICE_EXPANDED), expanded));
    }

    @Test
    public void expansionIsIdempotent() throws Exception {
        final List<Object> once = JsonLdProcessor.expand(JsonUtils.fromString(ALICE));
        final List<Object> twice = JsonLdProcessor.expand(once);
        assertTrue(JsonLdUtils.deepCompare(once, twice));
    }

    @Test
    public void expansionDropsUnmappedPropertiesAndTopLevelValues() throws Exception {
        final Object input = JsonUtils.fromString("{\"unmapped\": \"x\","
                + "\"http://example.org/p\": \"y\"}");
        final Object expanded = JsonLdProcessor.expand(input);
        final Object expected = JsonUtils
                .fromString("[{\"http://example.org/p\": [{\"@value\": \"y\"}]}]");
        assertTrue(JsonUtils.toString(expanded), JsonLdUtils.deepCompare(expected, expanded));

        assertTrue(JsonLdProcessor.expand(JsonUtils.fromString("[\"just a string\"]"))
                .isEmpty());
    }

    @Test
    public void compactionRoundTripsAlice() throws Exception {
        final Map<String, Object> input = (Map<String, Object>) JsonUtils.fromString(ALICE);
        final Map<String, Object> compacted = JsonLdProcessor.compact(
                JsonUtils.fromString(ALICE_EXPANDED), input.get("@context"), new JsonLdOptions());
        assertTrue(JsonUtils.toString(compacted), JsonLdUtils.deepCompare(input, compacted));
        assertEquals("@context", compacted.keySet().iterator().next());
    }

    @Test
    public void compactsLanguageMapsAndSets() throws Exception {
        final Object input = JsonUtils.fromString("[{"
                + "\"http://example.org/label\": ["
                + "  {\"@value\": \"chat\", \"@language\": \"fr\"},"
                + "  {\"@value\": \"cat\", \"@language\": \"en\"}],"
                + "\"http://example.org/tag\": [{\"@value\": \"one\"}]}]");
        final Object context = JsonUtils.fromString("{"
                + "\"label\": {\"@id\": \"http://example.org/label\", \"@container\": \"@language\"},"
                + "\"tag\": {\"@id\": \"http://example.org/tag\", \"@container\": \"@set\"}}");
        final Map<String, Object> compacted = JsonLdProcessor.compact(input, context,
                new JsonLdOptions());
        final Object expected = JsonUtils.fromString("{"
                + "\"label\": {\"fr\": \"chat\", \"en\": \"cat\"},"
                + "\"tag\": [\"one\"]}");
        compacted.remove("@context");
        assertTrue(JsonUtils.toString(compacted), JsonLdUtils.deepCompare(expected, compacted));
    }

    @Test
    public void flattensNestedBlankNodes() throws Exception {
        final Object input = JsonUtils.fromString("{"
                + "\"@context\": {\"@vocab\": \"http://schema.org/\"},"
                + "\"@id\": \"http://example.org/a\","
                + "\"knows\": {\"name\": \"Bob\"}}");
        final Object flattened = JsonLdProcessor.flatten(input, new JsonLdOptions());
        final Object expected = JsonUtils.fromString("["
                + "{\"@id\": \"_:b0\", \"http://schema.org/name\": [{\"@value\": \"Bob\"}]},"
                + "{\"@id\": \"http://example.org/a\","
                + " \"http://schema.org/knows\": [{\"@id\": \"_:b0\"}]}]");
        assertTrue(JsonUtils.toString(flattened), JsonLdUtils.deepCompare(expected, flattened));
    }

    @Test
    public void flattenWithContextWrapsGraph() throws Exception {
        final Object input = JsonUtils.fromString("[{"
                + "\"@id\": \"http://example.org/a\","
                + "\"http://schema.org/name\": [{\"@value\": \"A\"}]}]");
        final Object context = JsonUtils.fromString("{\"@vocab\": \"http://schema.org/\"}");
        final Map<String, Object> flattened = (Map<String, Object>) JsonLdProcessor
                .flatten(input, context, new JsonLdOptions());
        assertTrue(flattened.containsKey("@context"));
        final List<Object> graph = (List<Object>) flattened.get("@graph");
        assertEquals(1, graph.size());
        assertEquals("A", ((Map<String, Object>) graph.get(0)).get("name"));
    }

    @Test
    public void listOfListsIsRejected() throws Exception {
        final Object input = JsonUtils.fromString("{"
                + "\"@context\": {\"@vocab\": \"http://example.org/\"},"
                + "\"p\": {\"@list\": [[1, 2]]}}");
        try {
            JsonLdProcessor.expand(input);
            fail("expected a list of lists error");
        } catch (final JsonLdError e) {
            assertEquals(Error.LIST_OF_LISTS, e.getType());
        }
    }

    @Test
    public void listContainerOfListsIsRejected() throws Exception {
        final Object input = JsonUtils.fromString("{"
                + "\"@context\": {\"p\": {\"@id\": \"http://example.org/p\", \"@container\": \"@list\"}},"
                + "\"p\": [[\"a\"], \"b\"]}");
        try {
            JsonLdProcessor.expand(input);
            fail("expected a list of lists error");
        } catch (final JsonLdError e) {
            assertEquals(Error.LIST_OF_LISTS, e.getType());
        }
    }

    @Test
    public void valueObjectWithUnknownKeyIsRejected() throws Exception {
        final Object input = JsonUtils.fromString("{"
                + "\"http://example.org/p\": {\"@value\": \"x\", \"@id\": \"http://example.org/y\"}}");
        try {
            JsonLdProcessor.expand(input);
            fail("expected an invalid value object error");
        } catch (final JsonLdError e) {
            assertEquals(Error.INVALID_VALUE_OBJECT, e.getType());
        }
    }

    @Test
    public void expandsWithRemoteContext() throws Exception {
        final CachingDocumentLoader loader = new CachingDocumentLoader();
        loader.addDocument("http://example.com/ctx",
                JsonUtils.fromString("{\"@context\": {\"name\": \"http://schema.org/name\"}}"));
        final JsonLdOptions opts = new JsonLdOptions();
        opts.setDocumentLoader(loader);

        final Object input = JsonUtils
                .fromString("{\"@context\": \"http://example.com/ctx\", \"name\": \"x\"}");
        final Object expanded = JsonLdProcessor.expand(input, opts);
        final Object expected = JsonUtils
                .fromString("[{\"http://schema.org/name\": [{\"@value\": \"x\"}]}]");
        assertTrue(JsonLdUtils.deepCompare(expected, expanded));
    }

    @Test
    public void toRdfProducesNQuads() throws Exception {
        final JsonLdOptions opts = new JsonLdOptions();
        opts.setFormat(JsonLdConsts.APPLICATION_NQUADS);
        final Object nquads = JsonLdProcessor.toRDF(JsonUtils.fromString(ALICE), opts);
        assertEquals("<http://example.org/alice> <http://xmlns.com/foaf/0.1/knows> <http://example.org/bob> .\n"
                + "<http://example.org/alice> <http://xmlns.com/foaf/0.1/name> \"Alice\" .\n",
                nquads);
    }

    @Test
    public void toRdfCollectsNamespacesFromContext() throws Exception {
        final Object input = JsonUtils.fromString("{"
                + "\"@context\": {\"foaf\": \"http://xmlns.com/foaf/0.1/\"},"
                + "\"@id\": \"http://example.org/alice\","
                + "\"foaf:name\": \"Alice\"}");
        final RDFDataset dataset = (RDFDataset) JsonLdProcessor.toRDF(input);
        assertEquals("http://xmlns.com/foaf/0.1/", dataset.getNamespaces().get("foaf"));
        assertEquals(1, dataset.getQuads(JsonLdConsts.DEFAULT).size());
    }

    @Test
    public void toRdfBuildsListsFromFirstRest() throws Exception {
        final Object input = JsonUtils.fromString("{"
                + "\"@id\": \"http://example.org/s\","
                + "\"http://example.org/p\": {\"@list\": [\"a\", \"b\"]}}");
        final JsonLdOptions opts = new JsonLdOptions();
        opts.setFormat(JsonLdConsts.APPLICATION_NQUADS);
        final String nquads = (String) JsonLdProcessor.toRDF(input, opts);
        assertTrue(nquads, nquads.contains("<" + JsonLdConsts.RDF_FIRST + "> \"a\""));
        assertTrue(nquads, nquads.contains("<" + JsonLdConsts.RDF_REST + "> <"
                + JsonLdConsts.RDF_NIL + ">"));
        assertEquals(5, nquads.split("\n").length);
    }

    @Test
    public void fromRdfRebuildsWellFormedList() throws Exception {
        final String nquads = "<http://example.org/s> <http://example.org/p> _:l1 .\n"
                + "_:l1 <" + JsonLdConsts.RDF_FIRST + "> \"a\" .\n"
                + "_:l1 <" + JsonLdConsts.RDF_REST + "> _:l2 .\n"
                + "_:l2 <" + JsonLdConsts.RDF_FIRST + "> \"b\" .\n"
                + "_:l2 <" + JsonLdConsts.RDF_REST + "> <" + JsonLdConsts.RDF_NIL + "> .\n";
        final Object result = JsonLdProcessor.fromRDF(nquads, new JsonLdOptions());
        final Object expected = JsonUtils.fromString("[{"
                + "\"@id\": \"http://example.org/s\","
                + "\"http://example.org/p\": [{\"@list\": [{\"@value\": \"a\"}, {\"@value\": \"b\"}]}]}]");
        assertTrue(JsonUtils.toString(result), JsonLdUtils.deepCompare(expected, result));
    }

    @Test
    public void fromRdfLeavesMalformedListAsNodes() throws Exception {
        // no rdf:nil terminator
        final String nquads = "<http://example.org/s> <http://example.org/p> _:l1 .\n"
                + "_:l1 <" + JsonLdConsts.RDF_FIRST + "> \"a\" .\n"
                + "_:l1 <" + JsonLdConsts.RDF_REST + "> _:l2 .\n"
                + "_:l2 <" + JsonLdConsts.RDF_FIRST + "> \"b\" .\n";
        final List<Object> result = (List<Object>) JsonLdProcessor.fromRDF(nquads,
                new JsonLdOptions());
        assertEquals(3, result.size());
        assertFalse(JsonUtils.toString(result).contains("@list"));
    }

    @Test
    public void fromRdfUsesNativeTypesWhenAsked() throws Exception {
        final String nquads = "<http://example.org/s> <http://example.org/n> \"42\"^^<"
                + JsonLdConsts.XSD_INTEGER + "> .\n";
        final JsonLdOptions opts = new JsonLdOptions();
        opts.setUseNativeTypes(true);
        final Object result = JsonLdProcessor.fromRDF(nquads, opts);
        final Object expected = JsonUtils.fromString("[{"
                + "\"@id\": \"http://example.org/s\","
                + "\"http://example.org/n\": [{\"@value\": 42}]}]");
        assertTrue(JsonUtils.toString(result), JsonLdUtils.deepCompare(expected, result));
    }

    @Test
    public void fromRdfRejectsUnknownFormat() throws Exception {
        final JsonLdOptions opts = new JsonLdOptions();
        opts.setFormat("text/turtle");
        try {
            JsonLdProcessor.fromRDF("<http://a> <http://b> <http://c> .", opts);
            fail("expected an unknown format error");
        } catch (final JsonLdError e) {
            assertEquals(Error.UNKNOWN_FORMAT, e.getType());
        }
    }

    @Test
    public void toRdfWritesJsonLiteralsCanonically() throws Exception {
        final Object input = JsonUtils.fromString("{\"@id\": \"http://ex/s\","
                + "\"http://ex/p\": {\"@value\": {\"b\": 1.0, \"a\": [true]},"
                + "\"@type\": \"@json\"}}");
        final JsonLdOptions opts = new JsonLdOptions();
        opts.setFormat(JsonLdConsts.APPLICATION_NQUADS);
        final String nquads = (String) JsonLdProcessor.toRDF(input, opts);
        assertEquals("<http://ex/s> <http://ex/p> \"{\\\"a\\\":[true],\\\"b\\\":1}\""
                + "^^<http://www.w3.org/1999/02/22-rdf-syntax-ns#JSON> .\n", nquads);
    }

    @Test
    public void toRdfRejectsNonFiniteJsonNumber() throws Exception {
        final Map<String, Object> value = Obj.newMap(JsonLdConsts.VALUE,
                Obj.newMap("x", Double.NaN));
        value.put(JsonLdConsts.TYPE, JsonLdConsts.JSON);
        final Map<String, Object> input = Obj.newMap(JsonLdConsts.ID, "http://ex/s");
        input.put("http://ex/p", value);
        try {
            JsonLdProcessor.toRDF(input, new JsonLdOptions());
            fail("expected an invalid number format error");
        } catch (final JsonLdError e) {
            assertEquals(Error.INVALID_NUMBER_FORMAT, e.getType());
        }
    }

    @Test
    public void serializerRegistrySurvivesConcurrentUpdates() throws Exception {
        final String format = "text/x-quad-count";
        final Thread writer = new Thread(new Runnable() {
            @Override
            public void run() {
                for (int i = 0; i < 2000; i++) {
                    JsonLdProcessor.registerRDFSerializer(format + i, new JsonLdTripleCallback() {
                        @Override
                        public Object call(RDFDataset dataset) {
                            return dataset.getQuads(JsonLdConsts.DEFAULT).size();
                        }
                    });
                    JsonLdProcessor.removeRDFSerializer(format + i);
                }
            }
        });
        writer.start();

        final JsonLdOptions opts = new JsonLdOptions();
        opts.setFormat(JsonLdConsts.APPLICATION_NQUADS);
        final Object input = JsonUtils.fromString(ALICE);
        final Object expected = JsonLdProcessor.toRDF(input, opts);
        while (writer.isAlive()) {
            assertEquals(expected, JsonLdProcessor.toRDF(input, opts));
        }
        writer.join();

        opts.setFormat(format + 0);
        try {
            JsonLdProcessor.toRDF(input, opts);
            fail("expected an unknown format error");
        } catch (final JsonLdError e) {
            assertEquals(Error.UNKNOWN_FORMAT, e.getType());
        }
    }

    @Test
    public void registeredSerializerIsUsed() throws Exception {
        final String format = "text/x-quad-count";
        JsonLdProcessor.registerRDFSerializer(format, new JsonLdTripleCallback() {
            @Override
            public Object call(RDFDataset dataset) {
                return dataset.getQuads(JsonLdConsts.DEFAULT).size();
            }
        });
        try {
            final JsonLdOptions opts = new JsonLdOptions();
            opts.setFormat(format);
            assertEquals(2, JsonLdProcessor.toRDF(JsonUtils.fromString(ALICE), opts));
        } finally {
            JsonLdProcessor.removeRDFSerializer(format);
        }
    }
}
