package com.github.jsonldkit.impl;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.github.jsonldkit.core.JsonLdConsts;
import com.github.jsonldkit.core.JsonLdError;
import com.github.jsonldkit.core.RDFDataset;

public class NQuadRDFParserTest {

    @Test
    public void parsesAndSerializesBack() throws Exception {
        final String nquads = "<http://ex/s> <http://ex/p> \"o\" <http://ex/g> .\n";
        final RDFDataset dataset = new NQuadRDFParser().parse(nquads);
        assertEquals(1, dataset.getQuads("http://ex/g").size());
        assertEquals(nquads, new NQuadTripleCallback().call(dataset));
    }

    @Test
    public void rejectsNonStringInput() {
        try {
            new NQuadRDFParser().parse(Integer.valueOf(1));
            fail("expected an invalid input error");
        } catch (final JsonLdError e) {
            assertEquals(JsonLdError.Error.INVALID_INPUT, e.getType());
        }
    }

    @Test
    public void defaultGraphHasNoName() throws Exception {
        final RDFDataset dataset = new NQuadRDFParser()
                .parse("<http://ex/s> <http://ex/p> <http://ex/o> .\n");
        assertEquals(1, dataset.getQuads(JsonLdConsts.DEFAULT).size());
    }
}
