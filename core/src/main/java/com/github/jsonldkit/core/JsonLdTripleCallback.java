package com.github.jsonldkit.core;

/**
 * Turns an {@link RDFDataset} into some other representation, e.g. N-Quads
 * text.
 */
public interface JsonLdTripleCallback {

    /**
     * @param dataset
     *            the dataset to serialize
     * @return the serialized dataset
     */
    Object call(RDFDataset dataset);
}
