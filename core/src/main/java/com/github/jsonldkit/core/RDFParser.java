package com.github.jsonldkit.core;

/**
 * Interface for parsing RDF into the RDF Dataset objects to be used by
 * JSONLD.
 *
 * @author Tristan
 */
public interface RDFParser {

    /**
     * Parse the input into the internal RDF Dataset format. The format is a
     * Map with the following structure:
     *
     * <pre>
     * {
     *   GRAPH_1: [ TRIPLE_1, TRIPLE_2, ..., TRIPLE_N ],
     *   ...
     *   GRAPH_N: [ ... ]
     * }
     * </pre>
     *
     * @param input
     *            The RDF library specific input to parse
     * @return The input parsed using the internal RDF Dataset format
     * @throws JsonLdError
     *             If there was an error parsing the input
     */
    RDFDataset parse(Object input) throws JsonLdError;
}
