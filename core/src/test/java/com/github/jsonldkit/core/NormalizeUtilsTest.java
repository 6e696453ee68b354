package com.github.jsonldkit.core;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.github.jsonldkit.core.JsonLdError.Error;
import com.github.jsonldkit.utils.JsonUtils;

public class NormalizeUtilsTest {

    private static JsonLdOptions nquadsOptions() {
        final JsonLdOptions opts = new JsonLdOptions();
        opts.setInputFormat(JsonLdConsts.APPLICATION_NQUADS);
        opts.setFormat(JsonLdConsts.APPLICATION_NQUADS);
        return opts;
    }

    private static String normalize(String nquads, JsonLdOptions opts) throws JsonLdError {
        return (String) JsonLdProcessor.normalize(nquads, opts);
    }

    @Test
    public void relabelsBlankNodesCanonically() throws Exception {
        final String first = "_:x <http://example.org/knows> _:y .\n"
                + "_:x <http://example.org/name> \"Alice\" .\n"
                + "_:y <http://example.org/name> \"Bob\" .\n";
        final String second = "_:q <http://example.org/name> \"Bob\" .\n"
                + "_:p <http://example.org/knows> _:q .\n"
                + "_:p <http://example.org/name> \"Alice\" .\n";

        final String canonical = normalize(first, nquadsOptions());
        assertEquals(canonical, normalize(second, nquadsOptions()));
        assertTrue(canonical, canonical.contains("_:c14n0"));
        assertTrue(canonical, canonical.contains("_:c14n1"));
        assertFalse(canonical, canonical.contains("_:x"));
        assertEquals(3, canonical.split("\n").length);
    }

    @Test
    public void distinguishesNonIsomorphicDatasets() throws Exception {
        final String first = "_:x <http://example.org/knows> _:y .\n"
                + "_:y <http://example.org/name> \"Bob\" .\n";
        final String second = "_:x <http://example.org/knows> _:y .\n"
                + "_:x <http://example.org/name> \"Bob\" .\n";
        assertNotEquals(normalize(first, nquadsOptions()), normalize(second, nquadsOptions()));
    }

    @Test
    public void canonicalizesSymmetricCycle() throws Exception {
        final String cycle = "_:a <http://example.org/next> _:b .\n"
                + "_:b <http://example.org/next> _:c .\n"
                + "_:c <http://example.org/next> _:a .\n";
        final String rotated = "_:c <http://example.org/next> _:a .\n"
                + "_:a <http://example.org/next> _:b .\n"
                + "_:b <http://example.org/next> _:c .\n";
        final String canonical = normalize(cycle, nquadsOptions());
        assertEquals(canonical, normalize(rotated, nquadsOptions()));
        assertTrue(canonical, canonical.contains("_:c14n2"));
    }

    @Test
    public void stopsWhenStepLimitIsExceeded() throws Exception {
        final String cycle = "_:a <http://example.org/next> _:b .\n"
                + "_:b <http://example.org/next> _:c .\n"
                + "_:c <http://example.org/next> _:a .\n";
        final JsonLdOptions opts = nquadsOptions();
        opts.setMaxCanonicalizationSteps(1);
        try {
            normalize(cycle, opts);
            fail("expected the canonicalization step limit to be hit");
        } catch (final JsonLdError e) {
            assertEquals(Error.CANONICALIZATION_COMPLEXITY_EXCEEDED, e.getType());
        }
    }

    @Test
    public void normalizesJsonLdInput() throws Exception {
        final Object input = JsonUtils.fromString("{"
                + "\"@context\": {\"@vocab\": \"http://example.org/\"},"
                + "\"name\": \"Alice\","
                + "\"knows\": {\"name\": \"Bob\"}}");
        final JsonLdOptions opts = new JsonLdOptions();
        opts.setFormat(JsonLdConsts.APPLICATION_NQUADS);
        final String canonical = (String) JsonLdProcessor.normalize(input, opts);
        assertTrue(canonical, canonical.contains("<http://example.org/name> \"Alice\" ."));
        assertTrue(canonical, canonical.contains("<http://example.org/knows> _:c14n"));
        assertFalse(canonical, canonical.contains("_:b"));
    }

    @Test
    public void returnsDatasetWithoutFormat() throws Exception {
        final JsonLdOptions opts = new JsonLdOptions();
        opts.setInputFormat(JsonLdConsts.APPLICATION_NQUADS);
        final Object result = JsonLdProcessor
                .normalize("_:x <http://example.org/name> \"Alice\" .\n", opts);
        assertTrue(result instanceof RDFDataset);
        final RDFDataset dataset = (RDFDataset) result;
        assertEquals("_:c14n0",
                dataset.getQuads(JsonLdConsts.DEFAULT).get(0).getSubject().getValue());
    }

    @Test
    public void unknownAlgorithmIsRejected() throws Exception {
        final JsonLdOptions opts = nquadsOptions();
        opts.setAlgorithm("URDNA1999");
        try {
            normalize("<http://a/s> <http://a/p> <http://a/o> .\n", opts);
            fail("expected an unknown algorithm error");
        } catch (final JsonLdError e) {
            assertEquals(Error.UNKNOWN_ERROR, e.getType());
        }
    }
}
