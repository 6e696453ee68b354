package com.github.jsonldkit.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A URL split into the components IRI resolution and relativization need.
 * Parsing is lenient: any string parses, and missing components are empty.
 */
public class JsonLdUrl {

    private static final Pattern PARSER = Pattern.compile(
            "^(?:([^:/?#]+):)?(?://((?:(([^:@]*)(?::([^:@]*))?)?@)?([^:/?#]*)(?::(\\d*))?))?((((?:[^?#/]*/)*)([^?#]*))(?:\\?([^#]*))?(?:#(.*))?)");

    public String href = "";
    public String protocol = "";
    public String host = "";
    public String auth = "";
    public String user = "";
    public String password = "";
    public String hostname = "";
    public String port = "";
    public String relative = "";
    public String path = "";
    public String directory = "";
    public String file = "";
    public String query = "";
    public String hash = "";

    // things not populated by the regex
    public String pathname = "";
    public String normalizedPath = "";
    public String authority = "";

    /**
     * True when the URL carried a query component, even an empty one.
     */
    private boolean hasQuery = false;
    private boolean hasAuthority = false;
    // path as written, before an empty path under an authority becomes "/"
    private String rawPath = "";

    public static JsonLdUrl parse(String url) {
        final JsonLdUrl rval = new JsonLdUrl();
        rval.href = url;

        final Matcher matcher = PARSER.matcher(url);
        if (matcher.find()) {
            rval.protocol = orEmpty(matcher.group(1));
            rval.hasAuthority = matcher.group(2) != null;
            rval.host = orEmpty(matcher.group(2));
            rval.auth = orEmpty(matcher.group(3));
            rval.user = orEmpty(matcher.group(4));
            rval.password = orEmpty(matcher.group(5));
            rval.hostname = orEmpty(matcher.group(6));
            rval.port = orEmpty(matcher.group(7));
            rval.relative = orEmpty(matcher.group(8));
            rval.path = orEmpty(matcher.group(9));
            rval.rawPath = rval.path;
            rval.directory = orEmpty(matcher.group(10));
            rval.file = orEmpty(matcher.group(11));
            rval.hasQuery = matcher.group(12) != null;
            rval.query = orEmpty(matcher.group(12));
            rval.hash = orEmpty(matcher.group(13));

            // normalize to node.js API
            if (!"".equals(rval.host) && "".equals(rval.path)) {
                rval.path = "/";
            }
            rval.pathname = rval.path;
            parseAuthority(rval);
            rval.normalizedPath = removeDotSegments(rval.pathname, !"".equals(rval.authority));
            if (!"".equals(rval.query)) {
                rval.path += "?" + rval.query;
            }
            if (!"".equals(rval.protocol)) {
                rval.protocol += ":";
            }
            if (!"".equals(rval.hash)) {
                rval.hash = "#" + rval.hash;
            }
        }
        return rval;
    }

    private static String orEmpty(String s) {
        return s == null ? "" : s;
    }

    /**
     * Removes dot segments from a URL path.
     *
     * RFC 3986 5.2.4 (reworked)
     */
    static String removeDotSegments(String path, boolean hasAuthority) {
        final StringBuilder rval = new StringBuilder();
        if (path.startsWith("/")) {
            rval.append('/');
        }
        final List<String> input = new ArrayList<String>(Arrays.asList(path.split("/", -1)));
        final List<String> output = new ArrayList<String>();
        for (int i = 0; i < input.size(); i++) {
            final String segment = input.get(i);
            final boolean lastSegment = i == input.size() - 1;
            if (".".equals(segment) || ("".equals(segment) && !lastSegment)) {
                if (lastSegment) {
                    output.add("");
                }
                continue;
            }
            if ("..".equals(segment)) {
                if (hasAuthority
                        || (!output.isEmpty() && !"..".equals(output.get(output.size() - 1)))) {
                    if (!output.isEmpty()) {
                        output.remove(output.size() - 1);
                    }
                } else {
                    output.add("..");
                }
                if (lastSegment) {
                    output.add("");
                }
                continue;
            }
            output.add(segment);
        }
        for (int i = 0; i < output.size(); i++) {
            if (i > 0) {
                rval.append('/');
            }
            rval.append(output.get(i));
        }
        return rval.toString();
    }

    private static void parseAuthority(JsonLdUrl parsed) {
        // parse authority for unparsed relative network-path reference
        if (parsed.href.indexOf(":") == -1 && parsed.href.startsWith("//")
                && "".equals(parsed.host)) {
            // must parse authority from pathname
            parsed.pathname = parsed.pathname.substring(2);
            final int idx = parsed.pathname.indexOf("/");
            if (idx == -1) {
                parsed.authority = parsed.pathname;
                parsed.pathname = "";
            } else {
                parsed.authority = parsed.pathname.substring(0, idx);
                parsed.pathname = parsed.pathname.substring(idx);
            }
        } else {
            // construct authority
            parsed.authority = parsed.host;
            if (!"".equals(parsed.auth)) {
                parsed.authority = parsed.auth + "@" + parsed.authority;
            }
        }
    }

    /**
     * Makes an absolute IRI relative to the given base, where possible.
     *
     * @param baseobj
     *            the base IRI, as a String or a JsonLdUrl.
     * @param iri
     *            the absolute IRI.
     * @return the relative IRI if relative to base, otherwise the absolute
     *         IRI.
     */
    public static String removeBase(Object baseobj, String iri) {
        if (baseobj == null) {
            return iri;
        }
        final JsonLdUrl base;
        if (baseobj instanceof String) {
            base = JsonLdUrl.parse((String) baseobj);
        } else {
            base = (JsonLdUrl) baseobj;
        }

        // establish base root
        String root = "";
        if (!"".equals(base.href)) {
            root += base.protocol + "//" + base.authority;
        } else if (iri.indexOf("//") != 0) {
            // support network-path reference with empty base
            root += "//";
        }

        // IRI not relative to base
        if (iri.indexOf(root) != 0) {
            return iri;
        }

        // remove root from IRI and parse remainder
        final JsonLdUrl rel = JsonLdUrl.parse(iri.substring(root.length()));

        // remove path segments that match
        final List<String> baseSegments = new ArrayList<String>(
                Arrays.asList(base.normalizedPath.split("/", -1)));
        final List<String> iriSegments = new ArrayList<String>(
                Arrays.asList(rel.normalizedPath.split("/", -1)));
        final int last = (rel.hash.length() > 0 || rel.query.length() > 0) ? 0 : 1;
        while (!baseSegments.isEmpty() && iriSegments.size() > last
                && baseSegments.get(0).equals(iriSegments.get(0))) {
            baseSegments.remove(0);
            iriSegments.remove(0);
        }

        // use '../' for each non-matching base segment
        final StringBuilder rval = new StringBuilder();
        if (!baseSegments.isEmpty()) {
            // don't count the last segment if it isn't a path (doesn't end in
            // '/'); don't count empty first segment, it means base began with
            // '/'
            if (!base.normalizedPath.endsWith("/") || "".equals(baseSegments.get(0))) {
                baseSegments.remove(baseSegments.size() - 1);
            }
            for (int i = 0; i < baseSegments.size(); i++) {
                rval.append("../");
            }
        }

        // prepend remaining segments
        for (int i = 0; i < iriSegments.size(); i++) {
            if (i > 0) {
                rval.append('/');
            }
            rval.append(iriSegments.get(i));
        }

        // add query and hash
        if (!"".equals(rel.query)) {
            rval.append('?').append(rel.query);
        }
        if (!"".equals(rel.hash)) {
            rval.append(rel.hash);
        }

        if (rval.length() == 0) {
            return "./";
        }
        return rval.toString();
    }

    /**
     * Resolves a reference against a base IRI.
     *
     * RFC 3986 5.2.2
     */
    public static String resolve(String baseUri, String pathToResolve) {
        if (baseUri == null || "".equals(baseUri)) {
            return pathToResolve;
        }
        if (pathToResolve == null || "".equals(pathToResolve.trim())) {
            // an empty reference resolves to the base without its fragment
            final int hashIdx = baseUri.indexOf('#');
            return hashIdx == -1 ? baseUri : baseUri.substring(0, hashIdx);
        }
        final JsonLdUrl ref = JsonLdUrl.parse(pathToResolve);
        final JsonLdUrl base = JsonLdUrl.parse(baseUri);

        String scheme;
        String authority;
        boolean withAuthority;
        String path;
        String query;
        boolean withQuery;

        if (!"".equals(ref.protocol)) {
            scheme = ref.protocol;
            authority = ref.host;
            withAuthority = ref.hasAuthority;
            path = removeDotSegments(ref.rawPath, withAuthority);
            query = ref.query;
            withQuery = ref.hasQuery;
        } else {
            scheme = base.protocol;
            if (ref.hasAuthority) {
                authority = ref.host;
                withAuthority = true;
                path = removeDotSegments(ref.rawPath, true);
                query = ref.query;
                withQuery = ref.hasQuery;
            } else {
                authority = base.host;
                withAuthority = base.hasAuthority;
                if ("".equals(ref.pathname)) {
                    path = base.pathname;
                    if (ref.hasQuery) {
                        query = ref.query;
                        withQuery = true;
                    } else {
                        query = base.query;
                        withQuery = base.hasQuery;
                    }
                } else {
                    if (ref.pathname.startsWith("/")) {
                        path = ref.pathname;
                    } else {
                        path = merge(base, ref.pathname);
                    }
                    path = removeDotSegments(path, true);
                    query = ref.query;
                    withQuery = ref.hasQuery;
                }
            }
        }
        final StringBuilder sb = new StringBuilder(scheme);
        if (withAuthority) {
            sb.append("//").append(authority);
        }
        sb.append(path);
        if (withQuery) {
            sb.append('?').append(query);
        }
        if (!"".equals(ref.hash)) {
            sb.append(ref.hash);
        }
        return sb.toString();
    }

    private static String merge(JsonLdUrl base, String refPath) {
        if (base.hasAuthority && "".equals(base.pathname)) {
            return "/" + refPath;
        }
        final int idx = base.pathname.lastIndexOf('/');
        return base.pathname.substring(0, idx + 1) + refPath;
    }
}
