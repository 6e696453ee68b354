package com.github.jsonldkit.core;

/**
 * Keywords, IRIs and option values used throughout the processor.
 *
 * @author tristan
 */
public final class JsonLdConsts {

    private JsonLdConsts() {
    }

    public static final String RDF_SYNTAX_NS = "http://www.w3.org/1999/02/22-rdf-syntax-ns#";
    public static final String RDF_SCHEMA_NS = "http://www.w3.org/2000/01/rdf-schema#";
    public static final String XSD_NS = "http://www.w3.org/2001/XMLSchema#";

    public static final String XSD_ANYTYPE = XSD_NS + "anyType";
    public static final String XSD_BOOLEAN = XSD_NS + "boolean";
    public static final String XSD_DOUBLE = XSD_NS + "double";
    public static final String XSD_INTEGER = XSD_NS + "integer";
    public static final String XSD_FLOAT = XSD_NS + "float";
    public static final String XSD_DECIMAL = XSD_NS + "decimal";
    public static final String XSD_ANYURI = XSD_NS + "anyURI";
    public static final String XSD_STRING = XSD_NS + "string";

    public static final String RDF_TYPE = RDF_SYNTAX_NS + "type";
    public static final String RDF_FIRST = RDF_SYNTAX_NS + "first";
    public static final String RDF_REST = RDF_SYNTAX_NS + "rest";
    public static final String RDF_NIL = RDF_SYNTAX_NS + "nil";
    public static final String RDF_LIST = RDF_SYNTAX_NS + "List";
    public static final String RDF_LANGSTRING = RDF_SYNTAX_NS + "langString";
    public static final String RDF_JSON_LITERAL = RDF_SYNTAX_NS + "JSON";
    public static final String RDF_PLAIN_LITERAL = RDF_SYNTAX_NS + "PlainLiteral";
    public static final String RDF_XML_LITERAL = RDF_SYNTAX_NS + "XMLLiteral";
    public static final String RDF_OBJECT = RDF_SYNTAX_NS + "object";

    public static final String LINK_HEADER_REL = "http://www.w3.org/ns/json-ld#context";

    public static final String TEXT_TURTLE = "text/turtle";
    public static final String APPLICATION_NQUADS = "application/nquads";
    public static final String APPLICATION_N_QUADS = "application/n-quads";
    public static final String APPLICATION_JSONLD = "application/ld+json";

    public static final String JSON_LD_1_0 = "json-ld-1.0";
    public static final String JSON_LD_1_1 = "json-ld-1.1";
    public static final String JSON_LD_1_1_FRAME = "json-ld-1.1-expand-frame";

    public static final String URDNA2015 = "URDNA2015";
    public static final String URGNA2012 = "URGNA2012";

    public static final String BASE = "@base";
    public static final String CONTAINER = "@container";
    public static final String CONTEXT = "@context";
    public static final String DEFAULT = "@default";
    public static final String DIRECTION = "@direction";
    public static final String EMBED = "@embed";
    public static final String EXPLICIT = "@explicit";
    public static final String GRAPH = "@graph";
    public static final String ID = "@id";
    public static final String IMPORT = "@import";
    public static final String INCLUDED = "@included";
    public static final String INDEX = "@index";
    public static final String JSON = "@json";
    public static final String LANGUAGE = "@language";
    public static final String LIST = "@list";
    public static final String NEST = "@nest";
    public static final String NONE = "@none";
    public static final String OMIT_DEFAULT = "@omitDefault";
    public static final String PREFIX = "@prefix";
    public static final String PRESERVE = "@preserve";
    public static final String PROPAGATE = "@propagate";
    public static final String PROTECTED = "@protected";
    public static final String REQUIRE_ALL = "@requireAll";
    public static final String REVERSE = "@reverse";
    public static final String SET = "@set";
    public static final String TYPE = "@type";
    public static final String VALUE = "@value";
    public static final String VERSION = "@version";
    public static final String VOCAB = "@vocab";
    public static final String ANY = "@any";
    public static final String NULL = "@null";

    /**
     * Values accepted for the @embed framing flag.
     */
    public enum Embed {
        ALWAYS("@always"), NEVER("@never"), LAST("@last"), LINK("@link"), ONCE("@once");

        private final String keyword;

        Embed(String keyword) {
            this.keyword = keyword;
        }

        @Override
        public String toString() {
            return keyword;
        }
    }
}
