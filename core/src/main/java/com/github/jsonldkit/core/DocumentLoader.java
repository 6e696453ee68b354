package com.github.jsonldkit.core;

import java.io.IOException;
import java.io.InputStream;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.protocol.HttpClientContext;
import org.apache.http.entity.ContentType;
import org.apache.http.impl.client.CloseableHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.jsonldkit.core.JsonLdError.Error;
import com.github.jsonldkit.utils.JsonUtils;

/**
 * Loads remote documents and contexts. http and https URLs go through an
 * Apache HttpClient, anything else through {@link URL#openStream()}.
 *
 * http://www.w3.org/TR/json-ld-api/#loaddocumentcallback
 */
public class DocumentLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentLoader.class);

    /**
     * Set this system property to "true" to refuse every http and https load.
     */
    public static final String DISALLOW_REMOTE_CONTEXT_LOADING = "com.github.jsonldkit.disallowRemoteContextLoading";

    public static final String APPLICATION_LD_JSON = "application/ld+json";

    private static final Pattern SPLIT_ON_COMMA = Pattern
            .compile("(?:<[^>]*?>|\"[^\"]*?\"|[^,])+");
    private static final Pattern LINK_HEADER = Pattern.compile("\\s*<([^>]*?)>\\s*(?:;\\s*(.*))?");
    private static final Pattern LINK_PARAMS = Pattern
            .compile("(.*?)=(?:(?:\"([^\"]*?)\")|([^\"]*?))\\s*(?:(?:;\\s*)|$)");
    private static final Pattern APPLICATION_JSON = Pattern.compile("^application/(\\w*\\+)?json$");

    private volatile CloseableHttpClient httpClient;

    public DocumentLoader() {
    }

    public DocumentLoader(CloseableHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /**
     * Loads the document at the given URL.
     *
     * @param url
     *            an absolute URL
     * @return the loaded document
     * @throws JsonLdError
     *             LOADING_DOCUMENT_FAILED if the document can't be retrieved
     *             or parsed, MULTIPLE_CONTEXT_LINK_HEADERS if the response
     *             links more than one context
     */
    public RemoteDocument loadDocument(String url) throws JsonLdError {
        final URL parsed;
        try {
            parsed = new URL(url);
        } catch (final MalformedURLException e) {
            throw new JsonLdError(Error.LOADING_DOCUMENT_FAILED, "error parsing URL: " + url, e);
        }
        final String protocol = parsed.getProtocol();
        if (!"http".equalsIgnoreCase(protocol) && !"https".equalsIgnoreCase(protocol)) {
            LOG.debug("Loading {} from {}", url, protocol);
            try {
                return new RemoteDocument(url, JsonUtils.fromURL(parsed, getHttpClient()));
            } catch (final IOException e) {
                throw new JsonLdError(Error.LOADING_DOCUMENT_FAILED, url, e);
            }
        }
        if (Boolean.getBoolean(DISALLOW_REMOTE_CONTEXT_LOADING)) {
            throw new JsonLdError(Error.LOADING_DOCUMENT_FAILED,
                    "remote document loading is disabled: " + url);
        }

        LOG.debug("Fetching {}", url);
        final HttpGet request = new HttpGet(url);
        request.addHeader("Accept", JsonUtils.ACCEPT_HEADER);
        final HttpClientContext context = HttpClientContext.create();
        try (CloseableHttpResponse response = getHttpClient().execute(request, context)) {
            final int status = response.getStatusLine().getStatusCode();
            if (status != 200 && status != 203) {
                throw new JsonLdError(Error.LOADING_DOCUMENT_FAILED,
                        "bad response status code: " + status).setDetail("url", url);
            }

            String finalUrl = url;
            final List<URI> redirects = context.getRedirectLocations();
            if (redirects != null && !redirects.isEmpty()) {
                finalUrl = redirects.get(redirects.size() - 1).toString();
            }

            final HttpEntity entity = response.getEntity();
            final ContentType type = ContentType.get(entity);
            final String contentType = type == null ? null : type.getMimeType();
            final String linkHeader = joinHeaders(response.getHeaders("Link"));

            final String alternate = linkedDocument(finalUrl, contentType, linkHeader);
            final RemoteDocument doc;
            if (alternate != null) {
                LOG.debug("Following alternate link from {} to {}", finalUrl, alternate);
                doc = loadDocument(alternate);
            } else {
                try (InputStream in = entity.getContent()) {
                    doc = new RemoteDocument(finalUrl, JsonUtils.fromInputStream(in));
                }
                doc.setContentType(contentType);
                if (linkHeader != null) {
                    doc.setContextUrl(contextLink(contentType, linkHeader));
                }
            }
            return doc;
        } catch (final IOException e) {
            throw new JsonLdError(Error.LOADING_DOCUMENT_FAILED, url, e);
        }
    }

    /**
     * Joins repeated header lines into one comma separated value, or returns
     * null when there are none.
     */
    static String joinHeaders(Header[] headers) {
        if (headers == null || headers.length == 0) {
            return null;
        }
        final StringBuilder sb = new StringBuilder();
        for (final Header header : headers) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(header.getValue());
        }
        return sb.toString();
    }

    /**
     * Returns the context linked from a response with the given content type,
     * or null. Only plain JSON responses take a linked context.
     *
     * @throws JsonLdError
     *             MULTIPLE_CONTEXT_LINK_HEADERS if more than one is linked
     */
    static String contextLink(String contentType, String linkHeader) throws JsonLdError {
        if (linkHeader == null || contentType == null || APPLICATION_LD_JSON.equals(contentType)
                || !APPLICATION_JSON.matcher(contentType).matches()) {
            return null;
        }
        final List<Map<String, String>> links = parseLinkHeader(linkHeader)
                .get(JsonLdConsts.LINK_HEADER_REL);
        if (links == null || links.isEmpty()) {
            return null;
        }
        if (links.size() > 1) {
            throw new JsonLdError(Error.MULTIPLE_CONTEXT_LINK_HEADERS, linkHeader);
        }
        return links.get(0).get("target");
    }

    /**
     * Returns the resolved URL of an application/ld+json alternate to follow
     * instead of a response that is not JSON at all, or null.
     */
    static String linkedDocument(String url, String contentType, String linkHeader) {
        if (linkHeader == null
                || (contentType != null && APPLICATION_JSON.matcher(contentType).matches())) {
            return null;
        }
        final List<Map<String, String>> alternates = parseLinkHeader(linkHeader).get("alternate");
        if (alternates == null || alternates.isEmpty()
                || !APPLICATION_LD_JSON.equals(alternates.get(0).get("type"))) {
            return null;
        }
        return JsonLdUrl.resolve(url, alternates.get(0).get("target"));
    }

    /**
     * Parses a Link header into its links keyed by their rel parameter. Each
     * link is a map holding its "target" and every parameter it carries.
     *
     * <pre>
     * Link: &lt;http://json-ld.org/contexts/person.jsonld&gt;;
     *   rel="http://www.w3.org/ns/json-ld#context"; type="application/ld+json"
     * </pre>
     */
    public static Map<String, List<Map<String, String>>> parseLinkHeader(String header) {
        final Map<String, List<Map<String, String>>> rval = new LinkedHashMap<String, List<Map<String, String>>>();

        // split on unbracketed/unquoted commas
        final Matcher entries = SPLIT_ON_COMMA.matcher(header);
        while (entries.find()) {
            final Matcher match = LINK_HEADER.matcher(entries.group());
            if (!match.matches()) {
                continue;
            }
            final Map<String, String> result = new LinkedHashMap<String, String>();
            result.put("target", match.group(1));
            final String params = match.group(2);
            if (params != null) {
                final Matcher param = LINK_PARAMS.matcher(params);
                while (param.find()) {
                    if (param.group(1).isEmpty()) {
                        continue;
                    }
                    result.put(param.group(1).trim(),
                            param.group(2) != null ? param.group(2) : param.group(3));
                }
            }
            final String rel = result.containsKey("rel") ? result.get("rel") : "";
            List<Map<String, String>> list = rval.get(rel);
            if (list == null) {
                list = new ArrayList<Map<String, String>>();
                rval.put(rel, list);
            }
            list.add(result);
        }
        return rval;
    }

    public CloseableHttpClient getHttpClient() {
        CloseableHttpClient result = httpClient;
        if (result == null) {
            synchronized (this) {
                result = httpClient;
                if (result == null) {
                    result = httpClient = JsonUtils.getDefaultHttpClient();
                }
            }
        }
        return result;
    }

    public void setHttpClient(CloseableHttpClient nextHttpClient) {
        httpClient = nextHttpClient;
    }
}
