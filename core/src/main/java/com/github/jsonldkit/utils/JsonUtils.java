package com.github.jsonldkit.utils;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.io.Writer;
import java.net.URL;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.http.HttpEntity;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.cache.CacheConfig;
import org.apache.http.impl.client.cache.CachingHttpClientBuilder;
import org.apache.http.message.BasicHeader;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * A bunch of functions to make loading JSON easy
 *
 * @author tristan
 *
 */
public class JsonUtils {

    /**
     * An HTTP Accept header that prefers JSON-LD.
     */
    public static final String ACCEPT_HEADER = "application/ld+json, application/json;q=0.9, application/javascript;q=0.5, text/javascript;q=0.5, text/plain;q=0.2, */*;q=0.1";

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final JsonFactory JSON_FACTORY = new JsonFactory(JSON_MAPPER);

    private static volatile CloseableHttpClient DEFAULT_HTTP_CLIENT;

    static {
        JSON_FACTORY.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        JSON_FACTORY.disable(JsonParser.Feature.AUTO_CLOSE_SOURCE);
    }

    private JsonUtils() {
    }

    /**
     * Parses a JSON-LD document from a string into an object made of
     * {@link Map}, {@link List}, {@link String}, {@link Number},
     * {@link Boolean} and null.
     *
     * @param jsonString
     *            The JSON-LD document as a string.
     * @return A JSON Object.
     * @throws JsonParseException
     *             If there was a JSON related error during parsing.
     * @throws IOException
     *             If there was an IO error during parsing.
     */
    public static Object fromString(String jsonString) throws JsonParseException, IOException {
        return fromReader(new java.io.StringReader(jsonString));
    }

    public static Object fromReader(Reader reader) throws IOException {
        final JsonParser jp = JSON_FACTORY.createParser(reader);
        return fromJsonParser(jp);
    }

    private static Object fromJsonParser(JsonParser jp) throws IOException {
        Object rval;
        final JsonToken initialToken = jp.nextToken();

        if (initialToken == JsonToken.START_ARRAY) {
            rval = jp.readValueAs(List.class);
        } else if (initialToken == JsonToken.START_OBJECT) {
            rval = jp.readValueAs(Map.class);
        } else if (initialToken == JsonToken.VALUE_STRING) {
            rval = jp.readValueAs(String.class);
        } else if (initialToken == JsonToken.VALUE_FALSE || initialToken == JsonToken.VALUE_TRUE) {
            rval = jp.readValueAs(Boolean.class);
        } else if (initialToken == JsonToken.VALUE_NUMBER_FLOAT
                || initialToken == JsonToken.VALUE_NUMBER_INT) {
            rval = jp.readValueAs(Number.class);
        } else if (initialToken == JsonToken.VALUE_NULL) {
            rval = null;
        } else {
            throw new JsonParseException(jp, "document doesn't start with a valid json element : "
                    + initialToken, jp.getCurrentLocation());
        }

        JsonToken t;
        try {
            t = jp.nextToken();
        } catch (final JsonParseException ex) {
            throw new JsonParseException(jp,
                    "Document contains more content after json-ld element - (possible mismatched {}?)",
                    jp.getCurrentLocation());
        }
        if (t != null) {
            throw new JsonParseException(jp,
                    "Document contains possible json content after the json-ld element - (possible mismatched {}?)",
                    jp.getCurrentLocation());
        }
        return rval;
    }

    public static Object fromInputStream(InputStream content) throws IOException {
        return fromInputStream(content, StandardCharsets.UTF_8);
    }

    public static Object fromInputStream(InputStream content, Charset charset) throws IOException {
        return fromReader(new InputStreamReader(content, charset));
    }

    public static void write(Writer writer, Object jsonObject) throws IOException {
        final JsonGenerator jw = JSON_FACTORY.createGenerator(writer);
        jw.writeObject(jsonObject);
        jw.flush();
    }

    public static void writePrettyPrint(Writer writer, Object jsonObject) throws IOException {
        final JsonGenerator jw = JSON_FACTORY.createGenerator(writer);
        jw.useDefaultPrettyPrinter();
        jw.writeObject(jsonObject);
        jw.flush();
    }

    public static String toPrettyString(Object jsonObject) throws IOException {
        final StringWriter sw = new StringWriter();
        writePrettyPrint(sw, jsonObject);
        return sw.toString();
    }

    public static String toString(Object jsonObject) throws IOException {
        final StringWriter sw = new StringWriter();
        write(sw, jsonObject);
        return sw.toString();
    }

    /**
     * Serializes a JSON value per the JSON Canonicalization Scheme (RFC 8785):
     * object keys sorted by UTF-16 code units, no whitespace, numbers in ES6
     * shortest form.
     */
    public static String toCanonicalString(Object value) {
        final StringBuilder sb = new StringBuilder();
        writeCanonical(sb, value);
        return sb.toString();
    }

    @SuppressWarnings("unchecked")
    private static void writeCanonical(StringBuilder sb, Object value) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof Boolean) {
            sb.append(value.toString());
        } else if (value instanceof Number) {
            sb.append(canonicalNumber((Number) value));
        } else if (value instanceof String) {
            writeCanonicalString(sb, (String) value);
        } else if (value instanceof List) {
            sb.append('[');
            boolean first = true;
            for (final Object item : (List<Object>) value) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                writeCanonical(sb, item);
            }
            sb.append(']');
        } else if (value instanceof Map) {
            final Map<String, Object> map = (Map<String, Object>) value;
            final List<String> keys = new ArrayList<String>(map.keySet());
            // String.compareTo orders by UTF-16 code unit
            Collections.sort(keys);
            sb.append('{');
            boolean first = true;
            for (final String key : keys) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                writeCanonicalString(sb, key);
                sb.append(':');
                writeCanonical(sb, map.get(key));
            }
            sb.append('}');
        } else {
            throw new IllegalArgumentException("Not a JSON value: " + value.getClass());
        }
    }

    private static String canonicalNumber(Number number) {
        return NumberFormatter.format(number.doubleValue());
    }

    private static void writeCanonicalString(StringBuilder sb, String value) {
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            switch (c) {
            case '"':
                sb.append("\\\"");
                break;
            case '\\':
                sb.append("\\\\");
                break;
            case '\b':
                sb.append("\\b");
                break;
            case '\f':
                sb.append("\\f");
                break;
            case '\n':
                sb.append("\\n");
                break;
            case '\r':
                sb.append("\\r");
                break;
            case '\t':
                sb.append("\\t");
                break;
            default:
                if (c < 0x20) {
                    sb.append(String.format("\\u%04x", (int) c));
                } else {
                    sb.append(c);
                }
            }
        }
        sb.append('"');
    }

    /**
     * Returns a JSON-LD document from the given {@link URL}, using the default
     * caching HTTP client for http and https URLs.
     */
    public static Object fromURL(URL url) throws JsonParseException, IOException {
        return fromURL(url, getDefaultHttpClient());
    }

    /**
     * Returns a JSON-LD document from the given {@link URL}, using the given
     * client for http and https URLs and {@link URL#openStream()} for anything
     * else.
     */
    public static Object fromURL(URL url, CloseableHttpClient httpClient)
            throws JsonParseException, IOException {
        final String protocol = url.getProtocol();
        if (!protocol.equalsIgnoreCase("http") && !protocol.equalsIgnoreCase("https")) {
            try (InputStream in = url.openStream()) {
                return fromInputStream(in);
            }
        }
        final HttpGet request = new HttpGet(url.toExternalForm());
        request.addHeader("Accept", ACCEPT_HEADER);
        try (CloseableHttpResponse response = httpClient.execute(request)) {
            final int status = response.getStatusLine().getStatusCode();
            if (status != 200 && status != 203) {
                throw new IOException("Can't retrieve " + url + ", status code: " + status);
            }
            final HttpEntity entity = response.getEntity();
            try (InputStream in = entity.getContent()) {
                return fromInputStream(in);
            }
        }
    }

    public static CloseableHttpClient getDefaultHttpClient() {
        CloseableHttpClient result = DEFAULT_HTTP_CLIENT;
        if (result == null) {
            synchronized (JsonUtils.class) {
                result = DEFAULT_HTTP_CLIENT;
                if (result == null) {
                    result = DEFAULT_HTTP_CLIENT = createDefaultHttpClient();
                }
            }
        }
        return result;
    }

    private static CloseableHttpClient createDefaultHttpClient() {
        final CacheConfig cacheConfig = CacheConfig.custom().setMaxCacheEntries(1000)
                .setMaxObjectSize(1024 * 128).build();
        return CachingHttpClientBuilder.create().setCacheConfig(cacheConfig)
                .setDefaultHeaders(
                        Collections.singletonList(new BasicHeader("Accept", ACCEPT_HEADER)))
                .useSystemProperties().build();
    }

    /**
     * A null-safe equals check using v1.equals(v2) if they are both not null.
     *
     * @param v1
     *            The source object for the equals check.
     * @param v2
     *            The object to be checked for equality using the first objects
     *            equals method.
     * @return True if the objects were both null. True if both objects were not
     *         null and v1.equals(v2). False otherwise.
     */
    public static boolean equals(Object v1, Object v2) {
        return v1 == null ? v2 == null : v1.equals(v2);
    }
}
