package com.github.jsonldkit.impl;

import static com.github.jsonldkit.core.RDFDatasetUtils.parseNQuads;

import com.github.jsonldkit.core.JsonLdError;
import com.github.jsonldkit.core.RDFDataset;
import com.github.jsonldkit.core.RDFParser;

public class NQuadRDFParser implements RDFParser {
    @Override
    public RDFDataset parse(Object input) throws JsonLdError {
        if (input instanceof String) {
            return parseNQuads((String) input);
        } else {
            throw new JsonLdError(JsonLdError.Error.INVALID_INPUT,
                    "N-Quads parser expected string input").setDetail("input", input);
        }
    }
}
