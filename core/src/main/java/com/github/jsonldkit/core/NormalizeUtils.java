package com.github.jsonldkit.core;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.jsonldkit.core.JsonLdError.Error;

/**
 * RDF dataset canonicalization, URDNA2015 or the older URGNA2012.
 *
 * http://json-ld.github.io/normalization/spec/
 *
 * @author tristan
 */
class NormalizeUtils {

    private static final Logger LOG = LoggerFactory.getLogger(NormalizeUtils.class);

    private static final String CANONICAL_PREFIX = "_:c14n";
    private static final String TEMPORARY_PREFIX = "_:b";

    private final boolean legacy;
    private final int maxSteps;
    private final JsonLdOptions options;

    private final List<RDFDataset.Quad> quads = new ArrayList<RDFDataset.Quad>();
    private final Map<String, List<RDFDataset.Quad>> blankNodeQuads = new LinkedHashMap<String, List<RDFDataset.Quad>>();
    private final Map<String, String> firstDegreeHashes = new HashMap<String, String>();
    private final IdentifierIssuer canonicalIssuer = new IdentifierIssuer(CANONICAL_PREFIX);
    private int steps;

    NormalizeUtils(JsonLdOptions options) throws JsonLdError {
        this.options = options;
        final String algorithm = options.getAlgorithm() == null ? JsonLdConsts.URDNA2015
                : options.getAlgorithm();
        if (JsonLdConsts.URDNA2015.equals(algorithm)) {
            legacy = false;
        } else if (JsonLdConsts.URGNA2012.equals(algorithm)) {
            legacy = true;
        } else {
            throw new JsonLdError(Error.UNKNOWN_ERROR, "unknown canonicalization algorithm: "
                    + algorithm);
        }
        this.maxSteps = options.getMaxCanonicalizationSteps();
    }

    /**
     * Canonicalizes the dataset.
     *
     * @return the N-Quads text when the format option asks for N-Quads, or
     *         else the canonical dataset
     * @throws JsonLdError
     *             if the format is unknown or the step limit is exceeded
     */
    Object normalize(RDFDataset dataset) throws JsonLdError {
        final List<String> lines = canonicalLines(dataset);

        final StringBuilder rval = new StringBuilder();
        for (final String line : lines) {
            rval.append(line);
        }
        final String format = options.getFormat();
        if (format != null) {
            if (JsonLdConsts.APPLICATION_NQUADS.equals(format)
                    || JsonLdConsts.APPLICATION_N_QUADS.equals(format)) {
                return rval.toString();
            }
            throw new JsonLdError(Error.UNKNOWN_FORMAT, format);
        }
        return RDFDatasetUtils.parseNQuads(rval.toString());
    }

    /**
     * Relabels every blank node with its canonical identifier and returns the
     * sorted N-Quads lines.
     */
    List<String> canonicalLines(RDFDataset dataset) throws JsonLdError {
        // 2) collect quads and index them by the blank nodes they mention
        for (final String graphName : dataset.graphNames()) {
            final List<RDFDataset.Quad> triples = dataset.getQuads(graphName);
            if (triples == null) {
                continue;
            }
            for (final RDFDataset.Quad triple : triples) {
                final RDFDataset.Quad quad = new RDFDataset.Quad(triple.getSubject(),
                        triple.getPredicate(), triple.getObject(), graphName);
                quads.add(quad);
                for (final RDFDataset.Node component : components(quad)) {
                    if (component != null && component.isBlankNode()) {
                        List<RDFDataset.Quad> list = blankNodeQuads.get(component.getValue());
                        if (list == null) {
                            list = new ArrayList<RDFDataset.Quad>();
                            blankNodeQuads.put(component.getValue(), list);
                        }
                        list.add(quad);
                    }
                }
            }
        }

        // 3)
        final List<String> nonNormalized = new ArrayList<String>(blankNodeQuads.keySet());
        Map<String, List<String>> hashToBlankNodes = new TreeMap<String, List<String>>();

        // 5) issue canonical ids for blank nodes with unique first degree
        // hashes, repeating while that still makes progress
        boolean simple = true;
        while (simple) {
            simple = false;
            hashToBlankNodes = new TreeMap<String, List<String>>();
            for (final String id : nonNormalized) {
                final String hash = hashFirstDegreeQuads(id);
                List<String> ids = hashToBlankNodes.get(hash);
                if (ids == null) {
                    ids = new ArrayList<String>();
                    hashToBlankNodes.put(hash, ids);
                }
                ids.add(id);
            }

            for (final String hash : new ArrayList<String>(hashToBlankNodes.keySet())) {
                final List<String> idList = hashToBlankNodes.get(hash);
                if (idList.size() > 1) {
                    continue;
                }
                final String id = idList.get(0);
                canonicalIssuer.getId(id);
                nonNormalized.remove(id);
                hashToBlankNodes.remove(hash);
                simple = true;
            }
        }

        // 6) the remaining groups share a first degree hash
        for (final Map.Entry<String, List<String>> entry : hashToBlankNodes.entrySet()) {
            final TreeMap<String, List<IdentifierIssuer>> hashPaths = new TreeMap<String, List<IdentifierIssuer>>();
            for (final String id : entry.getValue()) {
                // 6.2.1)
                if (canonicalIssuer.hasId(id)) {
                    continue;
                }
                // 6.2.2-3)
                final IdentifierIssuer issuer = new IdentifierIssuer(TEMPORARY_PREFIX);
                issuer.getId(id);

                // 6.2.4)
                final HashResult result = hashNDegreeQuads(id, issuer);
                List<IdentifierIssuer> issuers = hashPaths.get(result.hash);
                if (issuers == null) {
                    issuers = new ArrayList<IdentifierIssuer>();
                    hashPaths.put(result.hash, issuers);
                }
                issuers.add(result.issuer);
            }

            // 6.3) issue canonical ids in the order of the result hashes
            for (final List<IdentifierIssuer> issuers : hashPaths.values()) {
                for (final IdentifierIssuer resultIssuer : issuers) {
                    for (final String existing : resultIssuer.getOrder()) {
                        canonicalIssuer.getId(existing);
                    }
                }
            }
        }
        LOG.debug("Canonicalized {} blank nodes in {} steps", blankNodeQuads.size(), steps);

        // 7) relabel and serialize
        final List<String> lines = new ArrayList<String>(quads.size());
        for (final RDFDataset.Quad quad : quads) {
            final RDFDataset.Node graph = quad.getGraph();
            final String graphName = graph == null ? null : relabel(graph).getValue();
            final RDFDataset.Quad copy = new RDFDataset.Quad(relabel(quad.getSubject()),
                    quad.getPredicate(), relabel(quad.getObject()), graphName);
            lines.add(RDFDatasetUtils.toNQuad(copy, graphName));
        }
        Collections.sort(lines);
        return lines;
    }

    private RDFDataset.Node relabel(RDFDataset.Node node) {
        if (node.isBlankNode() && !node.getValue().startsWith(CANONICAL_PREFIX)) {
            return new RDFDataset.BlankNode(canonicalIssuer.getId(node.getValue()));
        }
        return node;
    }

    private static RDFDataset.Node[] components(RDFDataset.Quad quad) {
        return new RDFDataset.Node[] { quad.getSubject(), quad.getObject(), quad.getGraph() };
    }

    /**
     * Hash First Degree Quads: hashes the quads mentioning the blank node,
     * with the node itself written as _:a and any other blank node as _:z.
     */
    private String hashFirstDegreeQuads(String id) {
        final String cached = firstDegreeHashes.get(id);
        if (cached != null) {
            return cached;
        }

        final List<String> nquads = new ArrayList<String>();
        for (final RDFDataset.Quad quad : blankNodeQuads.get(id)) {
            final RDFDataset.Node graph = quad.getGraph();
            String graphName = null;
            if (graph != null) {
                graphName = firstDegreeComponent(id, graph, true).getValue();
            }
            final RDFDataset.Quad copy = new RDFDataset.Quad(
                    firstDegreeComponent(id, quad.getSubject(), false), quad.getPredicate(),
                    firstDegreeComponent(id, quad.getObject(), false), graphName);
            nquads.add(RDFDatasetUtils.toNQuad(copy, graphName));
        }
        Collections.sort(nquads);

        final MessageDigest md = createDigest();
        for (final String nquad : nquads) {
            md.update(nquad.getBytes(StandardCharsets.UTF_8));
        }
        final String hash = encodeHex(md.digest());
        firstDegreeHashes.put(id, hash);
        return hash;
    }

    private RDFDataset.Node firstDegreeComponent(String id, RDFDataset.Node component,
            boolean isGraph) {
        if (!component.isBlankNode()) {
            return component;
        }
        if (legacy && isGraph) {
            return new RDFDataset.BlankNode("_:g");
        }
        return new RDFDataset.BlankNode(id.equals(component.getValue()) ? "_:a" : "_:z");
    }

    /**
     * Hash Related Blank Node.
     */
    private String hashRelatedBlankNode(String related, RDFDataset.Quad quad,
            IdentifierIssuer issuer, String position) {
        // 1) prefer the canonical id, then the issuer's, then the first
        // degree hash
        final String id;
        if (canonicalIssuer.hasId(related)) {
            id = canonicalIssuer.getId(related);
        } else if (issuer.hasId(related)) {
            id = issuer.getId(related);
        } else {
            id = hashFirstDegreeQuads(related);
        }

        final MessageDigest md = createDigest();
        md.update(position.getBytes(StandardCharsets.UTF_8));
        if (!"g".equals(position)) {
            final String predicate = legacy ? quad.getPredicate().getValue()
                    : "<" + quad.getPredicate().getValue() + ">";
            md.update(predicate.getBytes(StandardCharsets.UTF_8));
        }
        md.update(id.getBytes(StandardCharsets.UTF_8));
        return encodeHex(md.digest());
    }

    /**
     * Hash N-Degree Quads: explores every ordering of each group of related
     * blank nodes and keeps the lexicographically least path.
     */
    private HashResult hashNDegreeQuads(String id, IdentifierIssuer issuer) throws JsonLdError {
        // 1-3)
        final Map<String, List<String>> hashToRelated = createHashToRelated(id, issuer);

        // 4)
        final MessageDigest md = createDigest();

        // 5)
        for (final Map.Entry<String, List<String>> entry : hashToRelated.entrySet()) {
            // 5.1)
            md.update(entry.getKey().getBytes(StandardCharsets.UTF_8));

            // 5.2-3)
            String chosenPath = "";
            IdentifierIssuer chosenIssuer = null;

            // 5.4)
            final Permutator permutator = new Permutator(entry.getValue());
            permutations: while (permutator.hasNext()) {
                final List<String> permutation = permutator.next();
                countStep();

                // 5.4.1-3)
                IdentifierIssuer issuerCopy = issuer.clone();
                final StringBuilder path = new StringBuilder();
                final List<String> recursionList = new ArrayList<String>();

                // 5.4.4)
                for (final String related : permutation) {
                    if (canonicalIssuer.hasId(related)) {
                        path.append(canonicalIssuer.getId(related));
                    } else {
                        if (!issuerCopy.hasId(related)) {
                            recursionList.add(related);
                        }
                        path.append(issuerCopy.getId(related));
                    }
                    // 5.4.4.3)
                    if (isWorsePath(path, chosenPath)) {
                        continue permutations;
                    }
                }

                // 5.4.5)
                for (final String related : recursionList) {
                    final HashResult result = hashNDegreeQuads(related, issuerCopy);
                    path.append(issuerCopy.getId(related));
                    path.append("<").append(result.hash).append(">");
                    issuerCopy = result.issuer;
                    // 5.4.5.5)
                    if (isWorsePath(path, chosenPath)) {
                        continue permutations;
                    }
                }

                // 5.4.6)
                if (chosenPath.isEmpty() || path.toString().compareTo(chosenPath) < 0) {
                    chosenPath = path.toString();
                    chosenIssuer = issuerCopy;
                }
            }

            // 5.5-6)
            md.update(chosenPath.getBytes(StandardCharsets.UTF_8));
            issuer = chosenIssuer;
        }

        // 6)
        return new HashResult(encodeHex(md.digest()), issuer);
    }

    private static boolean isWorsePath(CharSequence path, String chosenPath) {
        return !chosenPath.isEmpty() && path.length() >= chosenPath.length()
                && path.toString().compareTo(chosenPath) > 0;
    }

    private void countStep() throws JsonLdError {
        steps++;
        if (maxSteps >= 0 && steps > maxSteps) {
            throw new JsonLdError(Error.CANONICALIZATION_COMPLEXITY_EXCEEDED,
                    "more than " + maxSteps + " permutation steps");
        }
    }

    private Map<String, List<String>> createHashToRelated(String id, IdentifierIssuer issuer) {
        final Map<String, List<String>> hashToRelated = new TreeMap<String, List<String>>();
        for (final RDFDataset.Quad quad : blankNodeQuads.get(id)) {
            if (legacy) {
                // subject first, then object; graph names are not related
                final RDFDataset.Node s = quad.getSubject();
                final RDFDataset.Node o = quad.getObject();
                if (s.isBlankNode() && !id.equals(s.getValue())) {
                    addRelated(hashToRelated, s.getValue(),
                            hashRelatedBlankNode(s.getValue(), quad, issuer, "p"));
                } else if (o.isBlankNode() && !id.equals(o.getValue())) {
                    addRelated(hashToRelated, o.getValue(),
                            hashRelatedBlankNode(o.getValue(), quad, issuer, "r"));
                }
                continue;
            }
            final RDFDataset.Node[] components = components(quad);
            final String[] positions = { "s", "o", "g" };
            for (int i = 0; i < components.length; i++) {
                final RDFDataset.Node component = components[i];
                if (component != null && component.isBlankNode()
                        && !id.equals(component.getValue())) {
                    addRelated(hashToRelated, component.getValue(),
                            hashRelatedBlankNode(component.getValue(), quad, issuer,
                                    positions[i]));
                }
            }
        }
        return hashToRelated;
    }

    private static void addRelated(Map<String, List<String>> hashToRelated, String related,
            String hash) {
        List<String> list = hashToRelated.get(hash);
        if (list == null) {
            list = new ArrayList<String>();
            hashToRelated.put(hash, list);
        }
        list.add(related);
    }

    private MessageDigest createDigest() {
        try {
            return MessageDigest.getInstance(legacy ? "SHA-1" : "SHA-256");
        } catch (final NoSuchAlgorithmException e) {
            // every JRE ships both
            throw new IllegalStateException(e);
        }
    }

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    static String encodeHex(byte[] data) {
        final char[] out = new char[data.length * 2];
        for (int i = 0; i < data.length; i++) {
            out[2 * i] = HEX[(data[i] >> 4) & 0xf];
            out[2 * i + 1] = HEX[data[i] & 0xf];
        }
        return new String(out);
    }

    private static class HashResult {
        final String hash;
        final IdentifierIssuer issuer;

        HashResult(String hash, IdentifierIssuer issuer) {
            this.hash = hash;
            this.issuer = issuer;
        }
    }
}
