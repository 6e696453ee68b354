package com.github.jsonldkit.core;

import static com.github.jsonldkit.utils.Obj.newMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.jsonldkit.core.JsonLdError.Error;
import com.github.jsonldkit.impl.NQuadRDFParser;
import com.github.jsonldkit.impl.NQuadTripleCallback;

/**
 * This class implements the <a href=
 * "http://www.w3.org/TR/json-ld11-api/#the-jsonldprocessor-interface" >
 * JsonLdProcessor interface</a>, except that it does not currently support
 * asynchronous processing, and hence does not return Promises, instead
 * directly returning the results.
 *
 * @author tristan
 *
 */
public class JsonLdProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLdProcessor.class);

    private static final Map<String, RDFParser> rdfParsers = new ConcurrentHashMap<String, RDFParser>();

    private static final Map<String, JsonLdTripleCallback> rdfSerializers = new ConcurrentHashMap<String, JsonLdTripleCallback>();

    static {
        registerRDFParser(JsonLdConsts.APPLICATION_NQUADS, new NQuadRDFParser());
        registerRDFParser(JsonLdConsts.APPLICATION_N_QUADS, new NQuadRDFParser());
        registerRDFSerializer(JsonLdConsts.APPLICATION_NQUADS, new NQuadTripleCallback());
        registerRDFSerializer(JsonLdConsts.APPLICATION_N_QUADS, new NQuadTripleCallback());
    }

    private JsonLdProcessor() {
    }

    /**
     * Compacts the given input using the context according to the steps in the
     * <a href="http://www.w3.org/TR/json-ld11-api/#compaction-algorithm">
     * Compaction algorithm</a>.
     *
     * @param input
     *            The input JSON-LD object, or the IRI of a remote document.
     * @param context
     *            The context object to use for the compaction algorithm.
     * @param opts
     *            The {@link JsonLdOptions} that are to be sent to the
     *            compaction algorithm.
     * @return The compacted JSON-LD document
     * @throws JsonLdError
     *             If there is an error compacting the input.
     */
    public static Map<String, Object> compact(Object input, Object context, JsonLdOptions opts)
            throws JsonLdError {
        // 1)
        opts = opts == null ? new JsonLdOptions("") : opts;

        // 2-6) NOTE: these are all the same steps as in expand
        final Object expanded = expand(input, opts);

        // 7)
        final Object localContext = unwrapContext(context);
        final Context activeCtx = new Context(opts).parse(localContext);

        // 8)
        final JsonLdApi api = new JsonLdApi(opts);
        Object compacted = api.compact(activeCtx, null, expanded, opts.getCompactArrays());

        // final step of Compaction Algorithm
        final Map<String, Object> rval = wrapCompacted(activeCtx, compacted);
        return withContext(rval, localContext);
    }

    @SuppressWarnings("unchecked")
    private static Object unwrapContext(Object context) {
        if (context instanceof Map
                && ((Map<String, Object>) context).containsKey(JsonLdConsts.CONTEXT)) {
            return ((Map<String, Object>) context).get(JsonLdConsts.CONTEXT);
        }
        return context;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> wrapCompacted(Context activeCtx, Object compacted)
            throws JsonLdError {
        if (compacted instanceof List) {
            final Map<String, Object> tmp = newMap();
            if (!((List<Object>) compacted).isEmpty()) {
                tmp.put(activeCtx.compactIri(JsonLdConsts.GRAPH, null, true, false), compacted);
            }
            return tmp;
        }
        if (compacted == null) {
            return newMap();
        }
        return (Map<String, Object>) compacted;
    }

    /**
     * Returns a copy of the compacted document with the given context as its
     * first entry, unless the context is empty.
     */
    @SuppressWarnings("unchecked")
    private static Map<String, Object> withContext(Map<String, Object> compacted,
            Object localContext) {
        final boolean emptyContext = localContext == null
                || (localContext instanceof Map && ((Map<String, Object>) localContext).isEmpty())
                || (localContext instanceof List && ((List<Object>) localContext).isEmpty());
        if (emptyContext) {
            return compacted;
        }
        final Map<String, Object> rval = newMap(JsonLdConsts.CONTEXT, localContext);
        rval.putAll(compacted);
        return rval;
    }

    /**
     * Expands the given input according to the steps in the
     * <a href="http://www.w3.org/TR/json-ld11-api/#expansion-algorithm">
     * Expansion algorithm</a>.
     *
     * @param input
     *            The input JSON-LD object, or the IRI of a remote document.
     * @param opts
     *            The {@link JsonLdOptions} that are to be sent to the
     *            expansion algorithm.
     * @return The expanded JSON-LD document
     * @throws JsonLdError
     *             If there is an error while expanding.
     */
    public static List<Object> expand(Object input, JsonLdOptions opts) throws JsonLdError {
        return expand(input, opts, false);
    }

    /**
     * Expands the given input with the default {@link JsonLdOptions}.
     */
    public static List<Object> expand(Object input) throws JsonLdError {
        return expand(input, new JsonLdOptions(""));
    }

    @SuppressWarnings("unchecked")
    private static List<Object> expand(Object input, JsonLdOptions opts, boolean frameExpansion)
            throws JsonLdError {
        opts = opts == null ? new JsonLdOptions("") : opts.copy();

        // 2)
        String contextUrl = null;
        if (input instanceof String) {
            final String url = JsonLdUrl.resolve(opts.getBase(), (String) input);
            final RemoteDocument remote = opts.getDocumentLoader().loadDocument(url);
            input = remote.getDocument();
            contextUrl = remote.getContextUrl();
            // the base given in options overrides the document's own URL
            if (opts.getBase() == null || opts.getBase().isEmpty()) {
                opts.setBase(remote.getDocumentUrl());
            }
        }

        // 3)
        Context activeCtx = new Context(opts);

        // 4)
        if (opts.getExpandContext() != null) {
            activeCtx = activeCtx.parse(unwrapContext(opts.getExpandContext()));
        }

        // 5)
        if (contextUrl != null) {
            LOG.debug("Applying linked context {}", contextUrl);
            activeCtx = activeCtx.parse(contextUrl);
        }

        // 6)
        final JsonLdApi api = new JsonLdApi(opts);
        api.frameExpansion = frameExpansion;
        Object expanded = api.expand(activeCtx, input);

        // final step of Expansion Algorithm
        if (expanded instanceof Map && ((Map<String, Object>) expanded).size() == 1
                && ((Map<String, Object>) expanded).containsKey(JsonLdConsts.GRAPH)) {
            expanded = ((Map<String, Object>) expanded).get(JsonLdConsts.GRAPH);
        } else if (expanded == null) {
            expanded = new ArrayList<Object>();
        }

        // normalize to an array
        return JsonLdUtils.arrayify(expanded);
    }

    /**
     * Flattens the given input and compacts it using the passed context
     * according to the steps in the
     * <a href="http://www.w3.org/TR/json-ld11-api/#flattening-algorithm">
     * Flattening algorithm</a>:
     *
     * @param input
     *            The input JSON-LD object, or the IRI of a remote document.
     * @param context
     *            The context to use for the compaction algorithm, or null to
     *            return the flattened nodes uncompacted.
     * @param opts
     *            The {@link JsonLdOptions} that are to be sent to the
     *            flattening algorithm.
     * @return The flattened JSON-LD document
     * @throws JsonLdError
     *             If there is an error while flattening.
     */
    @SuppressWarnings("unchecked")
    public static Object flatten(Object input, Object context, JsonLdOptions opts)
            throws JsonLdError {
        opts = opts == null ? new JsonLdOptions("") : opts;

        // 2-6) NOTE: these are all the same steps as in expand
        final Object expanded = expand(input, opts);
        // 7)
        final Object localContext = unwrapContext(context);
        // 8) NOTE: blank node generation variables are members of JsonLdApi
        final JsonLdApi api = new JsonLdApi(opts);

        // 1)
        final Map<String, Object> nodeMap = newMap();
        nodeMap.put(JsonLdConsts.DEFAULT, newMap());
        // 2)
        api.generateNodeMap(expanded, nodeMap);
        // 3)
        final Map<String, Object> defaultGraph = (Map<String, Object>) nodeMap
                .remove(JsonLdConsts.DEFAULT);
        // 4)
        for (final String graphName : nodeMap.keySet()) {
            final Map<String, Object> graph = (Map<String, Object>) nodeMap.get(graphName);
            // 4.1+4.2)
            Map<String, Object> entry = (Map<String, Object>) defaultGraph.get(graphName);
            if (entry == null) {
                entry = newMap(JsonLdConsts.ID, graphName);
                defaultGraph.put(graphName, entry);
            }
            // 4.3)
            final List<Object> graphNodes = new ArrayList<Object>();
            entry.put(JsonLdConsts.GRAPH, graphNodes);
            // 4.4)
            for (final String id : sortedKeys(graph)) {
                final Map<String, Object> node = (Map<String, Object>) graph.get(id);
                if (!(node.containsKey(JsonLdConsts.ID) && node.size() == 1)) {
                    graphNodes.add(node);
                }
            }
        }
        // 5)
        final List<Object> flattened = new ArrayList<Object>();
        // 6)
        for (final String id : sortedKeys(defaultGraph)) {
            final Map<String, Object> node = (Map<String, Object>) defaultGraph.get(id);
            if (!(node.containsKey(JsonLdConsts.ID) && node.size() == 1)) {
                flattened.add(node);
            }
        }
        // 7)
        if (localContext == null) {
            return flattened;
        }

        // 8)
        final Context activeCtx = new Context(opts).parse(localContext);
        Object compacted = api.compact(activeCtx, null, flattened, opts.getCompactArrays());
        if (!(compacted instanceof List)) {
            compacted = JsonLdUtils.arrayify(compacted);
        }
        final String alias = activeCtx.compactIri(JsonLdConsts.GRAPH, null, true, false);
        final Map<String, Object> rval = activeCtx.serialize();
        rval.put(alias, compacted);
        return rval;
    }

    /**
     * Flattens the given input without compacting it.
     */
    public static Object flatten(Object input, JsonLdOptions opts) throws JsonLdError {
        return flatten(input, null, opts);
    }

    private static List<String> sortedKeys(Map<String, Object> map) {
        final List<String> keys = new ArrayList<String>(map.keySet());
        Collections.sort(keys);
        return keys;
    }

    /**
     * Frames the given input using the frame according to the steps in the
     * <a href="http://www.w3.org/TR/json-ld11-framing/#framing-algorithm">
     * Framing Algorithm</a>.
     *
     * @param input
     *            The input JSON-LD object, or the IRI of a remote document.
     * @param frame
     *            The frame to use when re-arranging the data of input; either
     *            in the form of an JSON object or as IRI.
     * @param opts
     *            The {@link JsonLdOptions} that are to be sent to the framing
     *            algorithm.
     * @return The framed JSON-LD document
     * @throws JsonLdError
     *             If there is an error while framing.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> frame(Object input, Object frame, JsonLdOptions opts)
            throws JsonLdError {
        opts = opts == null ? new JsonLdOptions("") : opts;

        if (frame instanceof String) {
            final String url = JsonLdUrl.resolve(opts.getBase(), (String) frame);
            frame = opts.getDocumentLoader().loadDocument(url).getDocument();
        }
        if (frame instanceof List) {
            final List<Object> frames = (List<Object>) frame;
            if (frames.size() != 1) {
                throw new JsonLdError(Error.INVALID_FRAME,
                        "a frame must be a single object");
            }
            frame = frames.get(0);
        }
        if (!(frame instanceof Map)) {
            throw new JsonLdError(Error.INVALID_FRAME, "a frame must be an object");
        }
        final Object localContext = ((Map<String, Object>) frame).get(JsonLdConsts.CONTEXT);

        // 2-7) expand both input and frame
        final List<Object> expandedInput = expand(input, opts);
        final List<Object> expandedFrame = expand(frame, opts, true);

        final JsonLdApi api = new JsonLdApi(opts);
        final List<Object> framed = api.frame(expandedInput, expandedFrame);
        if (opts.getPruneBlankNodeIdentifiers()) {
            pruneBlankNodeIdentifiers(framed);
        }

        // 8-9) compaction
        final Context activeCtx = new Context(opts).parse(localContext);
        Object compacted = api.compact(activeCtx, null, framed, opts.getCompactArrays());
        final String graphAlias = activeCtx.compactIri(JsonLdConsts.GRAPH, null, true, false);
        Map<String, Object> rval;
        if (compacted instanceof List) {
            rval = newMap(graphAlias, compacted);
        } else if (compacted == null) {
            rval = newMap(graphAlias, new ArrayList<Object>());
        } else if (!opts.getOmitGraph()) {
            final List<Object> graph = new ArrayList<Object>();
            graph.add(compacted);
            rval = newMap(graphAlias, graph);
        } else {
            rval = (Map<String, Object>) compacted;
        }
        rval = (Map<String, Object>) removePreserve(activeCtx, rval, opts.getCompactArrays());
        return withContext(rval, localContext);
    }

    /**
     * Removes the @id of every blank node that is referenced only once in the
     * framed output.
     */
    static void pruneBlankNodeIdentifiers(List<Object> framed) {
        final Map<String, Integer> counts = new HashMap<String, Integer>();
        countBlankNodes(framed, counts);
        clearBlankNodes(framed, counts);
    }

    @SuppressWarnings("unchecked")
    private static void countBlankNodes(Object input, Map<String, Integer> counts) {
        if (input instanceof List) {
            for (final Object item : (List<Object>) input) {
                countBlankNodes(item, counts);
            }
        } else if (input instanceof Map) {
            final Map<String, Object> map = (Map<String, Object>) input;
            final Object id = map.get(JsonLdConsts.ID);
            if (JsonLdUtils.isBlankNodeId(id)) {
                final Integer count = counts.get(id);
                counts.put((String) id, count == null ? 1 : count + 1);
            }
            for (final Map.Entry<String, Object> entry : map.entrySet()) {
                if (!JsonLdConsts.ID.equals(entry.getKey())) {
                    countBlankNodes(entry.getValue(), counts);
                }
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static void clearBlankNodes(Object input, Map<String, Integer> counts) {
        if (input instanceof List) {
            for (final Object item : (List<Object>) input) {
                clearBlankNodes(item, counts);
            }
        } else if (input instanceof Map) {
            final Map<String, Object> map = (Map<String, Object>) input;
            final Object id = map.get(JsonLdConsts.ID);
            if (JsonLdUtils.isBlankNodeId(id) && counts.get(id) == 1) {
                map.remove(JsonLdConsts.ID);
            }
            for (final Object value : map.values()) {
                clearBlankNodes(value, counts);
            }
        }
    }

    /**
     * Replaces @preserve wrappers with their contents, and @null with null,
     * after framed output has been compacted.
     */
    @SuppressWarnings("unchecked")
    static Object removePreserve(Context ctx, Object input, boolean compactArrays)
            throws JsonLdError {
        // recurse through arrays
        if (input instanceof List) {
            final List<Object> output = new ArrayList<Object>();
            for (final Object i : (List<Object>) input) {
                final Object result = removePreserve(ctx, i, compactArrays);
                // drop nulls from arrays
                if (result != null) {
                    output.add(result);
                }
            }
            return output;
        }
        if (JsonLdConsts.NULL.equals(input)) {
            return null;
        }
        if (!(input instanceof Map)) {
            return input;
        }
        final Map<String, Object> map = (Map<String, Object>) input;
        // remove @preserve
        if (map.containsKey(JsonLdConsts.PRESERVE)) {
            final Object preserved = map.get(JsonLdConsts.PRESERVE);
            if (JsonLdConsts.NULL.equals(preserved)) {
                return null;
            }
            return removePreserve(ctx, preserved, compactArrays);
        }
        // skip @values
        if (JsonLdUtils.isValue(map)) {
            return map;
        }
        // recurse through @lists
        if (JsonLdUtils.isList(map)) {
            map.put(JsonLdConsts.LIST,
                    removePreserve(ctx, map.get(JsonLdConsts.LIST), compactArrays));
            return map;
        }
        // recurse through properties
        for (final String prop : new ArrayList<String>(map.keySet())) {
            Object result = removePreserve(ctx, map.get(prop), compactArrays);
            final List<String> container = ctx.getContainer(prop);
            if (compactArrays && result instanceof List && ((List<Object>) result).size() == 1
                    && !container.contains(JsonLdConsts.SET)
                    && !container.contains(JsonLdConsts.LIST)
                    && !JsonLdConsts.GRAPH.equals(ctx.expandIri(prop, false, true))) {
                result = ((List<Object>) result).get(0);
            }
            map.put(prop, result);
        }
        return map;
    }

    /**
     * Registers an {@link RDFParser} for the given format, so that
     * {@link #fromRDF(Object, JsonLdOptions)} and
     * {@link #normalize(Object, JsonLdOptions)} can read it.
     */
    public static void registerRDFParser(String format, RDFParser parser) {
        rdfParsers.put(format, parser);
    }

    public static void removeRDFParser(String format) {
        rdfParsers.remove(format);
    }

    /**
     * Registers a {@link JsonLdTripleCallback} that serializes datasets to the
     * given format.
     */
    public static void registerRDFSerializer(String format, JsonLdTripleCallback callback) {
        rdfSerializers.put(format, callback);
    }

    public static void removeRDFSerializer(String format) {
        rdfSerializers.remove(format);
    }

    /**
     * Converts an RDF dataset to JSON-LD.
     *
     * @param dataset
     *            a serialized string of RDF in a format specified by the
     *            format option or an RDF dataset to convert.
     * @param opts
     *            the options to use: [format] the format if input is not an
     *            array: 'application/nquads' for N-Quads (default).
     *            [useRdfType] true to use rdf:type, false to use @type
     *            (default: false). [useNativeTypes] true to convert XSD types
     *            into native types (boolean, integer, double), false not to
     *            (default: false).
     * @return A JSON-LD object.
     * @throws JsonLdError
     *             If there is an error converting the dataset to JSON-LD.
     */
    public static Object fromRDF(Object dataset, JsonLdOptions opts) throws JsonLdError {
        opts = opts == null ? new JsonLdOptions("") : opts;
        final String format = opts.getFormat() != null ? opts.getFormat()
                : JsonLdConsts.APPLICATION_NQUADS;
        final RDFParser parser = dataset instanceof RDFDataset ? null : rdfParsers.get(format);
        if (!(dataset instanceof RDFDataset) && parser == null) {
            throw new JsonLdError(Error.UNKNOWN_FORMAT, format);
        }
        return fromRDF(dataset, opts, parser);
    }

    /**
     * Converts an RDF dataset to JSON-LD, using a specific instance of
     * {@link RDFParser}.
     *
     * @param input
     *            a serialized string of RDF, or an {@link RDFDataset}.
     * @param opts
     *            the options to use
     * @param parser
     *            A specific instance of {@link RDFParser} to use for the
     *            conversion, or null when input is already a dataset.
     * @return A JSON-LD object.
     * @throws JsonLdError
     *             If there is an error converting the dataset to JSON-LD.
     */
    public static Object fromRDF(Object input, JsonLdOptions opts, RDFParser parser)
            throws JsonLdError {
        opts = opts == null ? new JsonLdOptions("") : opts;
        final RDFDataset dataset = input instanceof RDFDataset ? (RDFDataset) input
                : parser.parse(input);

        // convert from RDF
        final Object rval = new JsonLdApi(opts).fromRDF(dataset);

        return rval;
    }

    /**
     * Outputs the RDF dataset found in the given JSON-LD object.
     *
     * @param input
     *            the JSON-LD input.
     * @param callback
     *            A callback that is called when the input has been converted
     *            to Quads (null to use options.format instead).
     * @param opts
     *            the options to use: [base] the base IRI to use. [format] the
     *            format to use to output a string: 'application/nquads' for
     *            N-Quads. [produceGeneralizedRdf] true to output generalized
     *            RDF, false to produce only standard RDF (default: false).
     * @return The result of executing
     *         {@link JsonLdTripleCallback#call(RDFDataset)} on the results, or
     *         if {@link JsonLdOptions#getFormat()} is not null, a result in
     *         that format if it is found, or otherwise the raw
     *         {@link RDFDataset}.
     * @throws JsonLdError
     *             If there is an error converting the dataset to RDF.
     */
    @SuppressWarnings("unchecked")
    public static Object toRDF(Object input, JsonLdTripleCallback callback, JsonLdOptions opts)
            throws JsonLdError {
        opts = opts == null ? new JsonLdOptions("") : opts;

        final Object expandedInput = expand(input, opts);

        final JsonLdApi api = new JsonLdApi(expandedInput, opts);
        final RDFDataset dataset = api.toRDF();

        // namespaces from the input's own contexts
        for (final Object in : JsonLdUtils.arrayify(input)) {
            if (in instanceof Map && ((Map<String, Object>) in).containsKey(JsonLdConsts.CONTEXT)) {
                dataset.parseContext(((Map<String, Object>) in).get(JsonLdConsts.CONTEXT));
            }
        }

        if (callback != null) {
            return callback.call(dataset);
        }

        if (opts.getFormat() != null) {
            final JsonLdTripleCallback serializer = rdfSerializers.get(opts.getFormat());
            if (serializer == null) {
                throw new JsonLdError(Error.UNKNOWN_FORMAT, opts.getFormat());
            }
            return serializer.call(dataset);
        }

        return dataset;
    }

    /**
     * Outputs the RDF dataset found in the given JSON-LD object.
     *
     * @param input
     *            the JSON-LD input.
     * @param opts
     *            the options to use: [base] the base IRI to use. [format] the
     *            format to use to output a string: 'application/nquads' for
     *            N-Quads. [produceGeneralizedRdf] true to output generalized
     *            RDF, false to produce only standard RDF (default: false).
     * @return A JSON-LD object.
     * @throws JsonLdError
     *             If there is an error converting the dataset to RDF.
     */
    public static Object toRDF(Object input, JsonLdOptions opts) throws JsonLdError {
        return toRDF(input, null, opts);
    }

    /**
     * Outputs the RDF dataset found in the given JSON-LD object, using the
     * default {@link JsonLdOptions}.
     */
    public static Object toRDF(Object input) throws JsonLdError {
        return toRDF(input, new JsonLdOptions(""));
    }

    /**
     * Performs RDF dataset canonicalization on the given input. The input is
     * JSON-LD unless the 'inputFormat' option is used. The output is an RDF
     * dataset unless the 'format' option is used.
     *
     * @param input
     *            the input to normalize as JSON-LD or as a format specified by
     *            the 'inputFormat' option.
     * @param opts
     *            the options to use: [algorithm] the canonicalization algorithm
     *            to use, URDNA2015 (default) or URGNA2012. [inputFormat] the
     *            format if input is not JSON-LD: 'application/nquads' for
     *            N-Quads. [format] the format if output is a string:
     *            'application/nquads' for N-Quads.
     * @return The canonical N-Quads string, or the canonical RDF dataset.
     * @throws JsonLdError
     *             If there is an error normalizing the dataset.
     */
    public static Object normalize(Object input, JsonLdOptions opts) throws JsonLdError {
        opts = opts == null ? new JsonLdOptions("") : opts;

        final RDFDataset dataset;
        if (opts.getInputFormat() != null) {
            final RDFParser parser = rdfParsers.get(opts.getInputFormat());
            if (parser == null) {
                throw new JsonLdError(Error.UNKNOWN_FORMAT, opts.getInputFormat());
            }
            dataset = parser.parse(input);
        } else if (input instanceof RDFDataset) {
            dataset = (RDFDataset) input;
        } else {
            final JsonLdOptions toRdfOpts = opts.copy();
            toRdfOpts.setFormat(null);
            dataset = (RDFDataset) toRDF(input, toRdfOpts);
        }

        return new JsonLdApi(opts).normalize(dataset);
    }

    /**
     * Performs RDF dataset canonicalization on the given JSON-LD input with
     * the default {@link JsonLdOptions}.
     */
    public static Object normalize(Object input) throws JsonLdError {
        return normalize(input, new JsonLdOptions(""));
    }
}
