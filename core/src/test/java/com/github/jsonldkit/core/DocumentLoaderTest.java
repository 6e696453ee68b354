package com.github.jsonldkit.core;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;
import java.util.Map;

import org.apache.http.Header;
import org.apache.http.message.BasicHeader;
import org.junit.Test;

import com.github.jsonldkit.core.JsonLdError.Error;

public class DocumentLoaderTest {

    private static final String CONTEXT_LINK = "<http://example.com/context.jsonld>; "
            + "rel=\"http://www.w3.org/ns/json-ld#context\"; type=\"application/ld+json\"";

    @Test
    public void parsesLinkHeader() {
        final Map<String, List<Map<String, String>>> links = DocumentLoader
                .parseLinkHeader(CONTEXT_LINK + ", <http://example.com/next>; rel=\"next\"");
        final List<Map<String, String>> contexts = links.get(JsonLdConsts.LINK_HEADER_REL);
        assertEquals(1, contexts.size());
        assertEquals("http://example.com/context.jsonld", contexts.get(0).get("target"));
        assertEquals("application/ld+json", contexts.get(0).get("type"));
        assertEquals("http://example.com/next", links.get("next").get(0).get("target"));
    }

    @Test
    public void plainJsonTakesLinkedContext() throws Exception {
        assertEquals("http://example.com/context.jsonld",
                DocumentLoader.contextLink("application/json", CONTEXT_LINK));
        assertEquals("http://example.com/context.jsonld",
                DocumentLoader.contextLink("application/geo+json", CONTEXT_LINK));
    }

    @Test
    public void jsonLdIgnoresLinkedContext() throws Exception {
        assertNull(DocumentLoader.contextLink("application/ld+json", CONTEXT_LINK));
        assertNull(DocumentLoader.contextLink("text/html", CONTEXT_LINK));
        assertNull(DocumentLoader.contextLink("application/json", null));
    }

    @Test
    public void multipleContextLinksAreRejected() {
        try {
            DocumentLoader.contextLink("application/json", CONTEXT_LINK + ", "
                    + "<http://example.com/other.jsonld>; rel=\"http://www.w3.org/ns/json-ld#context\"");
            fail("expected a multiple context link headers error");
        } catch (final JsonLdError e) {
            assertEquals(Error.MULTIPLE_CONTEXT_LINK_HEADERS, e.getType());
        }
    }

    @Test
    public void contextLinksOnSeparateHeaderLinesAreRejected() {
        final String joined = DocumentLoader.joinHeaders(new Header[] {
                new BasicHeader("Link", CONTEXT_LINK),
                new BasicHeader("Link", "<http://example.com/other.jsonld>; "
                        + "rel=\"http://www.w3.org/ns/json-ld#context\"") });
        try {
            DocumentLoader.contextLink("application/json", joined);
            fail("expected a multiple context link headers error");
        } catch (final JsonLdError e) {
            assertEquals(Error.MULTIPLE_CONTEXT_LINK_HEADERS, e.getType());
        }
    }

    @Test
    public void joinsHeaderLines() {
        assertNull(DocumentLoader.joinHeaders(new Header[0]));
        assertEquals("<a>; rel=\"x\"", DocumentLoader
                .joinHeaders(new Header[] { new BasicHeader("Link", "<a>; rel=\"x\"") }));
    }

    @Test
    public void loadsFileUrls() throws Exception {
        final String url = getClass().getResource("/framing/library-frame.jsonld").toString();
        final RemoteDocument doc = new DocumentLoader().loadDocument(url);
        assertEquals(url, doc.getDocumentUrl());
        assertTrue(((Map<?, ?>) doc.getDocument()).containsKey("@context"));
    }

    @Test
    public void followsJsonLdAlternateOfHtml() {
        final String header = "<data.jsonld>; rel=\"alternate\"; type=\"application/ld+json\"";
        assertEquals("http://example.com/docs/data.jsonld",
                DocumentLoader.linkedDocument("http://example.com/docs/page", "text/html", header));
        assertNull(DocumentLoader.linkedDocument("http://example.com/docs/page",
                "application/json", header));
    }

    @Test
    public void rejectsMalformedUrl() {
        try {
            new DocumentLoader().loadDocument("not a url");
            fail("expected a loading error");
        } catch (final JsonLdError e) {
            assertEquals(Error.LOADING_DOCUMENT_FAILED, e.getType());
        }
    }
}
