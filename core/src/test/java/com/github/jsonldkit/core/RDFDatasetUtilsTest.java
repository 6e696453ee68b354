package com.github.jsonldkit.core;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Test;

import com.github.jsonldkit.core.JsonLdError.Error;

public class RDFDatasetUtilsTest {

    @Test
    public void parsesLiteralsWithLanguageAndDatatype() throws Exception {
        final RDFDataset dataset = RDFDatasetUtils.parseNQuads(
                "<http://ex/s> <http://ex/p> \"chat\"@fr .\n"
                        + "<http://ex/s> <http://ex/q> \"5\"^^<http://www.w3.org/2001/XMLSchema#integer> .\n"
                        + "# a comment\n"
                        + "\n"
                        + "_:b0 <http://ex/p> <http://ex/o> <http://ex/g> .\n");

        final List<RDFDataset.Quad> quads = dataset.getQuads(JsonLdConsts.DEFAULT);
        assertEquals(2, quads.size());
        final RDFDataset.Node lang = quads.get(0).getObject();
        assertTrue(lang.isLiteral());
        assertEquals("chat", lang.getValue());
        assertEquals("fr", lang.getLanguage());
        assertEquals(JsonLdConsts.RDF_LANGSTRING, lang.getDatatype());
        assertEquals(JsonLdConsts.XSD_INTEGER, quads.get(1).getObject().getDatatype());

        final List<RDFDataset.Quad> named = dataset.getQuads("http://ex/g");
        assertEquals(1, named.size());
        assertTrue(named.get(0).getSubject().isBlankNode());
    }

    @Test
    public void dropsDuplicateQuads() throws Exception {
        final RDFDataset dataset = RDFDatasetUtils.parseNQuads(
                "<http://ex/s> <http://ex/p> <http://ex/o> .\n"
                        + "<http://ex/s> <http://ex/p> <http://ex/o> .\n");
        assertEquals(1, dataset.getQuads(JsonLdConsts.DEFAULT).size());
    }

    @Test
    public void escapesAndUnescapes() {
        final String raw = "line\nwith \"quotes\" and \\ tab\t";
        final String escaped = RDFDatasetUtils.escape(raw);
        assertEquals("line\\nwith \\\"quotes\\\" and \\\\ tab\\t", escaped);
        assertEquals(raw, RDFDatasetUtils.unescape(escaped));
        assertEquals("\u00e9", RDFDatasetUtils.unescape("\\u00E9"));
    }

    @Test
    public void serializesSortedNQuads() throws Exception {
        final String input = "<http://ex/s> <http://ex/p> \"b\" .\n"
                + "<http://ex/s> <http://ex/p> \"a\" .\n";
        final String output = RDFDatasetUtils.toNQuads(RDFDatasetUtils.parseNQuads(input));
        assertEquals("<http://ex/s> <http://ex/p> \"a\" .\n"
                + "<http://ex/s> <http://ex/p> \"b\" .\n", output);
    }

    @Test
    public void rejectsMalformedLine() {
        try {
            RDFDatasetUtils.parseNQuads("<http://ex/s> <http://ex/p> .\n");
            fail("expected a syntax error");
        } catch (final JsonLdError e) {
            assertEquals(Error.SYNTAX_ERROR, e.getType());
        }
    }
}
