package com.github.jsonldkit.impl;

import com.github.jsonldkit.core.JsonLdTripleCallback;
import com.github.jsonldkit.core.RDFDataset;
import com.github.jsonldkit.core.RDFDatasetUtils;

public class NQuadTripleCallback implements JsonLdTripleCallback {
    @Override
    public Object call(RDFDataset dataset) {
        return RDFDatasetUtils.toNQuads(dataset);
    }
}
