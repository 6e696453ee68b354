package com.github.jsonldkit.core;

import static com.github.jsonldkit.core.JsonLdConsts.RDF_FIRST;
import static com.github.jsonldkit.core.JsonLdConsts.RDF_JSON_LITERAL;
import static com.github.jsonldkit.core.JsonLdConsts.RDF_LANGSTRING;
import static com.github.jsonldkit.core.JsonLdConsts.RDF_NIL;
import static com.github.jsonldkit.core.JsonLdConsts.RDF_REST;
import static com.github.jsonldkit.core.JsonLdConsts.RDF_TYPE;
import static com.github.jsonldkit.core.JsonLdConsts.XSD_BOOLEAN;
import static com.github.jsonldkit.core.JsonLdConsts.XSD_DOUBLE;
import static com.github.jsonldkit.core.JsonLdConsts.XSD_INTEGER;
import static com.github.jsonldkit.core.JsonLdConsts.XSD_STRING;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.jsonldkit.utils.JsonUtils;

/**
 * An RDF dataset: graph names mapped to lists of {@link Quad}s, plus the
 * namespace prefixes collected while parsing.
 *
 * @author tristan
 */
public class RDFDataset extends LinkedHashMap<String, Object> {

    private static final long serialVersionUID = 2796344994239879165L;

    private static final Logger LOG = LoggerFactory.getLogger(RDFDataset.class);

    private static final Pattern PATTERN_INTEGER = Pattern.compile("^[\\-+]?[0-9]+$");
    private static final Pattern PATTERN_DOUBLE = Pattern
            .compile("^(\\+|-)?([0-9]+(\\.[0-9]*)?|\\.[0-9]+)([Ee](\\+|-)?[0-9]+)?$");
    private static final Pattern VALID_LANGUAGE = Pattern.compile("^[a-zA-Z]+(-[a-zA-Z0-9]+)*$");
    private static final Pattern INVALID_IRI_CHARS = Pattern.compile("[\\x00-\\x20<>\"{}|\\\\^`]");

    public static class Quad extends LinkedHashMap<String, Object> implements Comparable<Quad> {
        private static final long serialVersionUID = -7021918051975883082L;

        public Quad(final String subject, final String predicate, final String object,
                final String graph) {
            this(subject, predicate, object.startsWith("_:") ? new BlankNode(object)
                    : new IRI(object), graph);
        }

        public Quad(final String subject, final String predicate, final String value,
                final String datatype, final String language, final String graph) {
            this(subject, predicate, new Literal(value, datatype, language), graph);
        }

        private Quad(final String subject, final String predicate, final Node object,
                final String graph) {
            this(subject.startsWith("_:") ? new BlankNode(subject) : new IRI(subject),
                    new IRI(predicate), object, graph);
        }

        public Quad(final Node subject, final Node predicate, final Node object,
                final String graph) {
            super();
            put("subject", subject);
            put("predicate", predicate);
            put("object", object);
            if (graph != null && !JsonLdConsts.DEFAULT.equals(graph)) {
                put("name", graph.startsWith("_:") ? new BlankNode(graph) : new IRI(graph));
            }
        }

        public Node getSubject() {
            return (Node) get("subject");
        }

        public Node getPredicate() {
            return (Node) get("predicate");
        }

        public Node getObject() {
            return (Node) get("object");
        }

        public Node getGraph() {
            return (Node) get("name");
        }

        /**
         * A quad is valid when its IRIs contain no characters IRIs forbid and
         * its language tag, if any, is well formed.
         */
        boolean isValid() {
            for (final Object component : values()) {
                if (component != null && !((Node) component).isValid()) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public int compareTo(Quad o) {
            if (o == null) {
                return 1;
            }
            int rval = compareNodes(getGraph(), o.getGraph());
            if (rval != 0) {
                return rval;
            }
            rval = getSubject().compareTo(o.getSubject());
            if (rval != 0) {
                return rval;
            }
            rval = getPredicate().compareTo(o.getPredicate());
            if (rval != 0) {
                return rval;
            }
            return getObject().compareTo(o.getObject());
        }

        private static int compareNodes(Node a, Node b) {
            if (a == null) {
                return b == null ? 0 : -1;
            }
            return b == null ? 1 : a.compareTo(b);
        }
    }

    public static abstract class Node extends LinkedHashMap<String, Object>
            implements Comparable<Node> {
        private static final long serialVersionUID = 1460990331795672793L;

        public abstract boolean isLiteral();

        public abstract boolean isIRI();

        public abstract boolean isBlankNode();

        public String getValue() {
            return (String) get("value");
        }

        public String getDatatype() {
            return (String) get("datatype");
        }

        public String getLanguage() {
            return (String) get("language");
        }

        boolean isValid() {
            return true;
        }

        @Override
        public int compareTo(Node o) {
            if (o == null) {
                return 1;
            }
            if (this.isIRI()) {
                if (!o.isIRI()) {
                    // IRIs > everything
                    return 1;
                }
            } else if (this.isBlankNode()) {
                if (o.isIRI()) {
                    // IRI > blank node
                    return -1;
                } else if (o.isLiteral()) {
                    // blank node > literal
                    return 1;
                }
            } else if (o.isIRI() || o.isBlankNode()) {
                // literal < everything else
                return -1;
            }
            int rval = getValue().compareTo(o.getValue());
            if (rval == 0 && isLiteral()) {
                rval = compareStrings(getDatatype(), o.getDatatype());
                if (rval == 0) {
                    rval = compareStrings(getLanguage(), o.getLanguage());
                }
            }
            return rval;
        }

        private static int compareStrings(String a, String b) {
            if (a == null) {
                return b == null ? 0 : -1;
            }
            return b == null ? 1 : a.compareTo(b);
        }

        /**
         * Converts an RDF triple object to a JSON-LD object.
         *
         * @param useNativeTypes
         *            true to output native types, false not to.
         *
         * @return the JSON-LD object.
         */
        Map<String, Object> toObject(boolean useNativeTypes) {
            // If value is an an IRI or a blank node identifier, return a new
            // JSON object consisting of a single member @id whose value is set
            // to value.
            if (isIRI() || isBlankNode()) {
                final Map<String, Object> rval = new LinkedHashMap<String, Object>();
                rval.put(JsonLdConsts.ID, getValue());
                return rval;
            }

            // convert literal object to JSON-LD
            final Map<String, Object> rval = new LinkedHashMap<String, Object>();
            final String value = getValue();
            final String datatype = getDatatype();

            if (RDF_JSON_LITERAL.equals(datatype)) {
                try {
                    rval.put(JsonLdConsts.VALUE, JsonUtils.fromString(value));
                    rval.put(JsonLdConsts.TYPE, JsonLdConsts.JSON);
                    return rval;
                } catch (final IOException e) {
                    // not JSON after all; keep it as an ordinary typed literal
                    LOG.debug("rdf:JSON literal does not parse as JSON: {}", e.getMessage());
                    rval.clear();
                }
            }

            if (useNativeTypes) {
                if (XSD_STRING.equals(datatype)) {
                    rval.put(JsonLdConsts.VALUE, value);
                    return rval;
                } else if (XSD_BOOLEAN.equals(datatype)) {
                    if ("true".equals(value)) {
                        rval.put(JsonLdConsts.VALUE, Boolean.TRUE);
                        return rval;
                    } else if ("false".equals(value)) {
                        rval.put(JsonLdConsts.VALUE, Boolean.FALSE);
                        return rval;
                    }
                } else if (XSD_INTEGER.equals(datatype) && PATTERN_INTEGER.matcher(value).matches()) {
                    final BigInteger bigValue = new BigInteger(value);
                    if (bigValue.bitLength() < 32) {
                        rval.put(JsonLdConsts.VALUE, bigValue.intValue());
                    } else if (bigValue.bitLength() < 64) {
                        rval.put(JsonLdConsts.VALUE, bigValue.longValue());
                    } else {
                        rval.put(JsonLdConsts.VALUE, bigValue);
                    }
                    return rval;
                } else if (XSD_DOUBLE.equals(datatype) && PATTERN_DOUBLE.matcher(value).matches()) {
                    rval.put(JsonLdConsts.VALUE, Double.parseDouble(value));
                    return rval;
                }
                // fall through: keep the lexical form with its datatype
            }

            rval.put(JsonLdConsts.VALUE, value);
            if (RDF_LANGSTRING.equals(datatype)) {
                rval.put(JsonLdConsts.LANGUAGE, getLanguage());
            } else if (!XSD_STRING.equals(datatype)) {
                rval.put(JsonLdConsts.TYPE, datatype);
            }
            return rval;
        }
    }

    public static class Literal extends Node {
        private static final long serialVersionUID = 8124736271571220251L;

        public Literal(String value, String datatype, String language) {
            super();
            put("type", "literal");
            put("value", value);
            put("datatype", datatype != null ? datatype : XSD_STRING);
            if (language != null) {
                put("language", language);
            }
        }

        @Override
        public boolean isLiteral() {
            return true;
        }

        @Override
        public boolean isIRI() {
            return false;
        }

        @Override
        public boolean isBlankNode() {
            return false;
        }

        @Override
        boolean isValid() {
            final String language = getLanguage();
            if (language != null && !VALID_LANGUAGE.matcher(language).matches()) {
                return false;
            }
            return isValidIri(getDatatype());
        }
    }

    public static class IRI extends Node {
        private static final long serialVersionUID = 1540232072155490782L;

        public IRI(String iri) {
            super();
            put("type", "IRI");
            put("value", iri);
        }

        @Override
        public boolean isLiteral() {
            return false;
        }

        @Override
        public boolean isIRI() {
            return true;
        }

        @Override
        public boolean isBlankNode() {
            return false;
        }

        @Override
        boolean isValid() {
            return isValidIri(getValue());
        }
    }

    public static class BlankNode extends Node {
        private static final long serialVersionUID = -2842402820440697318L;

        public BlankNode(String attribute) {
            super();
            put("type", "blank node");
            put("value", attribute);
        }

        @Override
        public boolean isLiteral() {
            return false;
        }

        @Override
        public boolean isIRI() {
            return false;
        }

        @Override
        public boolean isBlankNode() {
            return true;
        }
    }

    static boolean isValidIri(String iri) {
        return iri != null && !INVALID_IRI_CHARS.matcher(iri).find();
    }

    private static final Node FIRST = new IRI(RDF_FIRST);
    private static final Node REST = new IRI(RDF_REST);
    private static final Node NIL = new IRI(RDF_NIL);

    private final Map<String, String> context;

    private JsonLdApi api;

    public RDFDataset() {
        super();
        put(JsonLdConsts.DEFAULT, new ArrayList<Quad>());
        context = new LinkedHashMap<String, String>();
    }

    public RDFDataset(JsonLdApi jsonLdApi) {
        this();
        this.api = jsonLdApi;
    }

    public void setNamespace(String ns, String prefix) {
        context.put(ns, prefix);
    }

    public String getNamespace(String ns) {
        return context.get(ns);
    }

    /**
     * clears all the namespaces in this dataset
     */
    public void clearNamespaces() {
        context.clear();
    }

    public Map<String, String> getNamespaces() {
        return context;
    }

    /**
     * Returns a valid context containing any namespaces set
     *
     * @return The context map
     */
    public Map<String, Object> getContext() {
        final Map<String, Object> rval = new LinkedHashMap<String, Object>();
        for (final Map.Entry<String, String> entry : context.entrySet()) {
            if ("".equals(entry.getKey())) {
                rval.put(JsonLdConsts.VOCAB, entry.getValue());
            } else {
                rval.put(entry.getKey(), entry.getValue());
            }
        }
        return rval;
    }

    /**
     * parses a context object and sets any namespaces found within it
     *
     * @param contextLike
     *            The context to parse
     * @throws JsonLdError
     *             If the context can't be parsed
     */
    public void parseContext(Object contextLike) throws JsonLdError {
        Context context;
        if (api != null) {
            context = new Context(api.opts);
        } else {
            context = new Context();
        }
        context = context.parse(contextLike);
        final Map<String, String> prefixes = context.getPrefixes(true);

        for (final Map.Entry<String, String> entry : prefixes.entrySet()) {
            final String key = entry.getKey();
            if (JsonLdConsts.VOCAB.equals(key)) {
                setNamespace("", entry.getValue());
            } else if (!JsonLdUtils.isKeyword(key)) {
                setNamespace(key, entry.getValue());
            }
        }
    }

    /**
     * Adds a triple to the @default graph of this dataset
     */
    public void addTriple(final String subject, final String predicate, final String value,
            final String datatype, final String language) {
        addQuad(subject, predicate, value, datatype, language, JsonLdConsts.DEFAULT);
    }

    /**
     * Adds a triple to the specified graph of this dataset
     */
    public void addQuad(final String s, final String p, final String value, final String datatype,
            final String language, String graph) {
        if (graph == null) {
            graph = JsonLdConsts.DEFAULT;
        }
        addQuad(new Quad(s, p, value, datatype, language, graph), graph);
    }

    /**
     * Adds a triple to the default graph of this dataset
     */
    public void addTriple(final String subject, final String predicate, final String object) {
        addQuad(subject, predicate, object, JsonLdConsts.DEFAULT);
    }

    /**
     * Adds a triple to the specified graph of this dataset
     */
    public void addQuad(final String subject, final String predicate, final String object,
            String graph) {
        if (graph == null) {
            graph = JsonLdConsts.DEFAULT;
        }
        addQuad(new Quad(subject, predicate, object.startsWith("_:") ? new BlankNode(object)
                : new IRI(object), graph), graph);
    }

    /**
     * Adds a quad to the given graph unless an equal quad is already there.
     */
    public void addQuad(final Quad quad, String graph) {
        if (graph == null) {
            graph = JsonLdConsts.DEFAULT;
        }
        List<Quad> quads = getQuads(graph);
        if (quads == null) {
            quads = new ArrayList<Quad>();
            put(graph, quads);
        }
        if (!quads.contains(quad)) {
            quads.add(quad);
        }
    }

    /**
     * Creates an array of RDF triples for the given graph.
     *
     * @param graphName
     *            The graph URI
     * @param graph
     *            the graph to create RDF triples for.
     */
    @SuppressWarnings("unchecked")
    void graphToRDF(String graphName, Map<String, Object> graph) throws JsonLdError {
        final List<Quad> triples = new ArrayList<Quad>();
        final List<String> ids = new ArrayList<String>(graph.keySet());
        Collections.sort(ids);
        for (final String id : ids) {
            if (JsonLdUtils.isRelativeIri(id)) {
                continue;
            }
            final Map<String, Object> node = (Map<String, Object>) graph.get(id);
            final List<String> properties = new ArrayList<String>(node.keySet());
            Collections.sort(properties);
            for (String property : properties) {
                final List<Object> values;
                // 3.3.1
                if (JsonLdConsts.TYPE.equals(property)) {
                    values = (List<Object>) node.get(JsonLdConsts.TYPE);
                    property = RDF_TYPE;
                } else if (JsonLdUtils.isKeyword(property)) {
                    continue;
                } else if (property.startsWith("_:") && !api.opts.getProduceGeneralizedRdf()) {
                    continue;
                } else if (JsonLdUtils.isRelativeIri(property)) {
                    continue;
                } else {
                    values = (List<Object>) node.get(property);
                }

                final Node subject = id.startsWith("_:") ? new BlankNode(id) : new IRI(id);
                final Node predicate = property.startsWith("_:") ? new BlankNode(property)
                        : new IRI(property);

                for (final Object item : values) {
                    final Node object;
                    if (JsonLdUtils.isList(item)) {
                        object = listToRDF(
                                (List<Object>) ((Map<String, Object>) item).get(JsonLdConsts.LIST),
                                graphName, triples);
                    } else {
                        object = objectToRDF(item, graphName, triples);
                    }
                    if (object != null) {
                        triples.add(new Quad(subject, predicate, object, graphName));
                    }
                }
            }
        }

        final List<Quad> sanitized = new ArrayList<Quad>(triples.size());
        for (final Quad triple : triples) {
            if (triple.isValid()) {
                sanitized.add(triple);
            } else {
                LOG.warn("Dropping invalid quad: {}", triple);
            }
        }
        put(graphName, sanitized);
    }

    /**
     * Converts a list into RDF first/rest statements on fresh blank nodes and
     * returns the head, or rdf:nil for an empty list.
     */
    @SuppressWarnings("unchecked")
    private Node listToRDF(List<Object> list, String graphName, List<Quad> triples)
            throws JsonLdError {
        if (list.isEmpty()) {
            return NIL;
        }
        final List<Node> bnodes = new ArrayList<Node>(list.size());
        for (int i = 0; i < list.size(); i++) {
            bnodes.add(new BlankNode(api.generateBlankNodeIdentifier()));
        }
        for (int i = 0; i < list.size(); i++) {
            final Node subject = bnodes.get(i);
            final Object item = list.get(i);
            final Node object;
            if (JsonLdUtils.isList(item)) {
                object = listToRDF((List<Object>) ((Map<String, Object>) item).get(JsonLdConsts.LIST),
                        graphName, triples);
            } else {
                object = objectToRDF(item, graphName, triples);
            }
            if (object != null) {
                triples.add(new Quad(subject, FIRST, object, graphName));
            }
            final Node rest = (i + 1 < bnodes.size()) ? bnodes.get(i + 1) : NIL;
            triples.add(new Quad(subject, REST, rest, graphName));
        }
        return bnodes.get(0);
    }

    /**
     * Converts a JSON-LD value object to an RDF literal or a JSON-LD string or
     * node object to an RDF resource.
     *
     * @param item
     *            the JSON-LD value or node object.
     * @return the RDF literal or RDF resource, or null when the item has no
     *         RDF representation.
     * @throws JsonLdError
     *             INVALID_NUMBER_FORMAT if a JSON literal holds NaN or an
     *             infinity
     */
    @SuppressWarnings("unchecked")
    private Node objectToRDF(Object item, String graphName, List<Quad> triples)
            throws JsonLdError {
        // convert value object to RDF
        if (JsonLdUtils.isValue(item)) {
            final Map<String, Object> valueObject = (Map<String, Object>) item;
            final Object value = valueObject.get(JsonLdConsts.VALUE);
            final Object datatype = valueObject.get(JsonLdConsts.TYPE);

            if (JsonLdConsts.JSON.equals(datatype)) {
                final String canonical;
                try {
                    canonical = JsonUtils.toCanonicalString(value);
                } catch (final IllegalArgumentException e) {
                    throw new JsonLdError(JsonLdError.Error.INVALID_NUMBER_FORMAT, value, e);
                }
                return new Literal(canonical, RDF_JSON_LITERAL, null);
            }
            // convert to XSD datatypes as appropriate
            if (value instanceof Boolean) {
                return new Literal(value.toString(),
                        datatype == null ? XSD_BOOLEAN : (String) datatype, null);
            } else if (value instanceof Number) {
                final Number number = (Number) value;
                if (isDoubleForm(number) || XSD_DOUBLE.equals(datatype)) {
                    return new Literal(getCanonicalDouble(number.doubleValue()),
                            datatype == null ? XSD_DOUBLE : (String) datatype, null);
                }
                return new Literal(toIntegerString(number),
                        datatype == null ? XSD_INTEGER : (String) datatype, null);
            } else if (valueObject.containsKey(JsonLdConsts.LANGUAGE)) {
                return new Literal((String) value,
                        datatype == null ? RDF_LANGSTRING : (String) datatype,
                        (String) valueObject.get(JsonLdConsts.LANGUAGE));
            } else {
                return new Literal((String) value,
                        datatype == null ? XSD_STRING : (String) datatype, null);
            }
        }
        // convert string/node object to RDF
        else {
            final String id;
            if (JsonLdUtils.isNodeObject(item)) {
                id = (String) ((Map<String, Object>) item).get(JsonLdConsts.ID);
                if (id == null || JsonLdUtils.isRelativeIri(id)) {
                    return null;
                }
            } else {
                id = (String) item;
            }
            if (id.startsWith("_:")) {
                return new BlankNode(id);
            } else {
                return new IRI(id);
            }
        }
    }

    /**
     * Numbers with a fractional part, or at least 1e21 in magnitude, are
     * written as xsd:double.
     */
    private static boolean isDoubleForm(Number number) {
        if (number instanceof Integer || number instanceof Long || number instanceof Short
                || number instanceof Byte) {
            return false;
        }
        if (number instanceof BigInteger) {
            return ((BigInteger) number).abs().compareTo(BigInteger.TEN.pow(21)) >= 0;
        }
        final double d = number.doubleValue();
        return d % 1 != 0 || Math.abs(d) >= 1e21;
    }

    private static String toIntegerString(Number number) {
        if (number instanceof BigInteger || number instanceof Integer || number instanceof Long
                || number instanceof Short || number instanceof Byte) {
            return number.toString();
        }
        return new BigDecimal(number.doubleValue()).toBigInteger().toString();
    }

    /**
     * Formats a double in the canonical XSD lexical form, e.g. 1.1E0.
     */
    static String getCanonicalDouble(double value) {
        final DecimalFormat df = new DecimalFormat("0.0###############E0",
                DecimalFormatSymbols.getInstance(Locale.US));
        return df.format(value);
    }

    /**
     * Returns a list of graph names used in this dataset.
     *
     * @return The set of graph names in this dataset
     */
    public Set<String> graphNames() {
        return keySet();
    }

    /**
     * Returns a list of quads for the given graph
     *
     * @param graphName
     *            The name of the graph
     * @return The list of quads for that graph
     */
    @SuppressWarnings("unchecked")
    public List<Quad> getQuads(String graphName) {
        return (List<Quad>) get(graphName);
    }
}
