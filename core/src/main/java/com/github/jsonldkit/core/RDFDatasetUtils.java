package com.github.jsonldkit.core;

import static com.github.jsonldkit.core.JsonLdConsts.RDF_LANGSTRING;
import static com.github.jsonldkit.core.JsonLdConsts.XSD_STRING;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.github.jsonldkit.core.JsonLdError.Error;

/**
 * N-Quads reading and writing for {@link RDFDataset}.
 */
public class RDFDatasetUtils {

    /**
     * Serializes every quad in the dataset, one per line, sorted.
     */
    public static String toNQuads(RDFDataset dataset) {
        final List<String> quads = new ArrayList<String>();
        for (String graphName : dataset.graphNames()) {
            final List<RDFDataset.Quad> triples = dataset.getQuads(graphName);
            if (JsonLdConsts.DEFAULT.equals(graphName)) {
                graphName = null;
            }
            for (final RDFDataset.Quad triple : triples) {
                quads.add(toNQuad(triple, graphName));
            }
        }
        Collections.sort(quads);
        final StringBuilder sb = new StringBuilder();
        for (final String quad : quads) {
            sb.append(quad);
        }
        return sb.toString();
    }

    /**
     * Serializes a single quad as one N-Quads line, including the trailing
     * newline. The graph name is written when it is not null.
     */
    public static String toNQuad(RDFDataset.Quad triple, String graphName) {
        final RDFDataset.Node s = triple.getSubject();
        final RDFDataset.Node p = triple.getPredicate();
        final RDFDataset.Node o = triple.getObject();

        final StringBuilder quad = new StringBuilder();

        // subject is an IRI or bnode
        appendResource(quad, s);
        quad.append(" ");
        // a bnode predicate only shows up in generalized RDF
        appendResource(quad, p);
        quad.append(" ");

        // object is IRI, bnode or literal
        if (o.isLiteral()) {
            quad.append("\"").append(escape(o.getValue())).append("\"");
            if (RDF_LANGSTRING.equals(o.getDatatype())) {
                quad.append("@").append(o.getLanguage());
            } else if (!XSD_STRING.equals(o.getDatatype())) {
                quad.append("^^<").append(escape(o.getDatatype())).append(">");
            }
        } else {
            appendResource(quad, o);
        }

        // graph
        if (graphName != null && !JsonLdConsts.DEFAULT.equals(graphName)) {
            if (graphName.startsWith("_:")) {
                quad.append(" ").append(graphName);
            } else {
                quad.append(" <").append(escape(graphName)).append(">");
            }
        }

        quad.append(" .\n");
        return quad.toString();
    }

    private static void appendResource(StringBuilder sb, RDFDataset.Node node) {
        if (node.isIRI()) {
            sb.append("<").append(escape(node.getValue())).append(">");
        } else {
            sb.append(node.getValue());
        }
    }

    /**
     * Escapes the characters N-Quads string literals and IRIs may not carry
     * raw.
     */
    public static String escape(String str) {
        final StringBuilder rval = new StringBuilder(str.length() + 8);
        for (int i = 0; i < str.length(); i++) {
            final char c = str.charAt(i);
            switch (c) {
            case '\\':
                rval.append("\\\\");
                break;
            case '"':
                rval.append("\\\"");
                break;
            case '\n':
                rval.append("\\n");
                break;
            case '\r':
                rval.append("\\r");
                break;
            case '\t':
                rval.append("\\t");
                break;
            default:
                rval.append(c);
            }
        }
        return rval.toString();
    }

    /**
     * Reverses {@link #escape(String)}, also decoding the \b, \f, \' and
     * \\uXXXX / \\UXXXXXXXX escapes N-Quads allows.
     */
    public static String unescape(String str) {
        if (str == null || str.indexOf('\\') == -1) {
            return str;
        }
        final StringBuilder rval = new StringBuilder(str.length());
        for (int i = 0; i < str.length(); i++) {
            final char c = str.charAt(i);
            if (c != '\\' || i + 1 >= str.length()) {
                rval.append(c);
                continue;
            }
            final char next = str.charAt(++i);
            switch (next) {
            case 't':
                rval.append('\t');
                break;
            case 'b':
                rval.append('\b');
                break;
            case 'n':
                rval.append('\n');
                break;
            case 'r':
                rval.append('\r');
                break;
            case 'f':
                rval.append('\f');
                break;
            case '"':
                rval.append('"');
                break;
            case '\'':
                rval.append('\'');
                break;
            case '\\':
                rval.append('\\');
                break;
            case 'u':
                if (i + 4 < str.length()) {
                    rval.append((char) Integer.parseInt(str.substring(i + 1, i + 5), 16));
                    i += 4;
                } else {
                    rval.append('\\').append(next);
                }
                break;
            case 'U':
                if (i + 8 < str.length()) {
                    rval.appendCodePoint(Integer.parseInt(str.substring(i + 1, i + 9), 16));
                    i += 8;
                } else {
                    rval.append('\\').append(next);
                }
                break;
            default:
                rval.append('\\').append(next);
            }
        }
        return rval.toString();
    }

    private static class Regex {
        // define partial regexes
        final public static Pattern IRI = Pattern.compile("(?:<([^:]+:[^>]*)>)");
        final public static Pattern BNODE = Pattern.compile("(_:(?:[A-Za-z0-9_]"
                + "|[\\u00C0-\\u00D6\\u00D8-\\u00F6\\u00F8-\\u02FF\\u0370-\\u037D\\u037F-\\u1FFF"
                + "\\u200C-\\u200D\\u2070-\\u218F\\u2C00-\\u2FEF\\u3001-\\uD7FF\\uF900-\\uFDCF\\uFDF0-\\uFFFD])"
                + "(?:(?:[A-Za-z0-9_.\\u00B7\\u0300-\\u036F\\u203F-\\u2040-"
                + "\\u00C0-\\u00D6\\u00D8-\\u00F6\\u00F8-\\u02FF\\u0370-\\u037D\\u037F-\\u1FFF"
                + "\\u200C-\\u200D\\u2070-\\u218F\\u2C00-\\u2FEF\\u3001-\\uD7FF\\uF900-\\uFDCF\\uFDF0-\\uFFFD])*"
                + "(?:[A-Za-z0-9_\\u00B7\\u0300-\\u036F\\u203F-\\u2040-"
                + "\\u00C0-\\u00D6\\u00D8-\\u00F6\\u00F8-\\u02FF\\u0370-\\u037D\\u037F-\\u1FFF"
                + "\\u200C-\\u200D\\u2070-\\u218F\\u2C00-\\u2FEF\\u3001-\\uD7FF\\uF900-\\uFDCF\\uFDF0-\\uFFFD]))?)");
        final public static Pattern PLAIN = Pattern.compile("\"([^\"\\\\]*(?:\\\\.[^\"\\\\]*)*)\"");
        final public static Pattern DATATYPE = Pattern.compile("(?:\\^\\^" + IRI + ")");
        final public static Pattern LANGUAGE = Pattern.compile("(?:@([a-zA-Z]+(?:-[a-zA-Z0-9]+)*))");
        final public static Pattern LITERAL = Pattern.compile("(?:" + PLAIN + "(?:" + DATATYPE
                + "|" + LANGUAGE + ")?)");
        final public static Pattern WS = Pattern.compile("[ \\t]+");
        final public static Pattern WSO = Pattern.compile("[ \\t]*");
        final public static Pattern EOLN = Pattern.compile("(?:\r\n)|(?:\n)|(?:\r)");
        final public static Pattern EMPTY_OR_COMMENT = Pattern.compile("^" + WSO + "(#.*)?$");

        // define quad part regexes
        final public static Pattern SUBJECT = Pattern.compile("(?:" + IRI + "|" + BNODE + ")" + WS);
        final public static Pattern PROPERTY = Pattern.compile(IRI.pattern() + WS.pattern());
        final public static Pattern OBJECT = Pattern.compile("(?:" + IRI + "|" + BNODE + "|"
                + LITERAL + ")" + WSO);
        final public static Pattern GRAPH = Pattern.compile("(?:\\.|(?:(?:" + IRI + "|" + BNODE
                + ")" + WSO + "\\.))");

        // full quad regex
        final public static Pattern QUAD = Pattern.compile("^" + WSO + SUBJECT + PROPERTY
                + OBJECT + GRAPH + WSO + "(#.*)?$");
    }

    /**
     * Parses RDF in the form of N-Quads.
     *
     * @param input
     *            the N-Quads input to parse.
     *
     * @return an RDF dataset.
     * @throws JsonLdError
     *             If there was an error parsing the N-Quads document.
     */
    public static RDFDataset parseNQuads(String input) throws JsonLdError {
        // build RDF dataset
        final RDFDataset dataset = new RDFDataset();

        // split N-Quad input into lines
        final String[] lines = Regex.EOLN.split(input);
        int lineNumber = 0;
        for (final String line : lines) {
            lineNumber++;

            // skip empty lines and comments
            if (Regex.EMPTY_OR_COMMENT.matcher(line).matches()) {
                continue;
            }

            // parse quad
            final Matcher match = Regex.QUAD.matcher(line);
            if (!match.matches()) {
                throw new JsonLdError(Error.SYNTAX_ERROR,
                        "Error while parsing N-Quads; invalid quad. line:" + lineNumber);
            }

            // get subject
            RDFDataset.Node subject;
            if (match.group(1) != null) {
                subject = new RDFDataset.IRI(unescape(match.group(1)));
            } else {
                subject = new RDFDataset.BlankNode(unescape(match.group(2)));
            }

            // get predicate
            final RDFDataset.Node predicate = new RDFDataset.IRI(unescape(match.group(3)));

            // get object
            RDFDataset.Node object;
            if (match.group(4) != null) {
                object = new RDFDataset.IRI(unescape(match.group(4)));
            } else if (match.group(5) != null) {
                object = new RDFDataset.BlankNode(unescape(match.group(5)));
            } else {
                final String language = unescape(match.group(8));
                final String datatype = match.group(7) != null ? unescape(match.group(7))
                        : match.group(8) != null ? RDF_LANGSTRING : XSD_STRING;
                final String unescaped = unescape(match.group(6));
                object = new RDFDataset.Literal(unescaped, datatype, language);
            }

            // get graph name ('@default' is used for the default graph)
            String name = JsonLdConsts.DEFAULT;
            if (match.group(9) != null) {
                name = unescape(match.group(9));
            } else if (match.group(10) != null) {
                name = unescape(match.group(10));
            }

            // add quad if unique to its graph
            dataset.addQuad(new RDFDataset.Quad(subject, predicate, object, name), name);
        }

        return dataset;
    }
}
