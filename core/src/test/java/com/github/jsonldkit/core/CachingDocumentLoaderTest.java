package com.github.jsonldkit.core;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class CachingDocumentLoaderTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void servesAddedDocuments() throws Exception {
        final CachingDocumentLoader loader = new CachingDocumentLoader();
        assertFalse(loader.isCached("http://example.com/doc"));
        loader.addDocument("http://example.com/doc", Collections.singletonMap("a", 1));
        assertTrue(loader.isCached("http://example.com/doc"));

        final RemoteDocument doc = loader.loadDocument("http://example.com/doc");
        assertEquals("http://example.com/doc", doc.getDocumentUrl());
        assertEquals(1, ((Map<?, ?>) doc.getDocument()).get("a"));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void preloadsFromMappedLocation() throws Exception {
        final File file = folder.newFile("context.jsonld");
        final Writer writer = new OutputStreamWriter(new FileOutputStream(file),
                StandardCharsets.UTF_8);
        try {
            writer.write("{\"@context\": {\"name\": \"http://schema.org/name\"}}");
        } finally {
            writer.close();
        }

        final CachingDocumentLoader loader = new CachingDocumentLoader();
        loader.preloadWithMapping(Collections.singletonMap("http://example.com/context",
                file.toURI().toURL().toString()));
        assertTrue(loader.isCached("http://example.com/context"));

        final JsonLdOptions opts = new JsonLdOptions();
        opts.setDocumentLoader(loader);
        final Context ctx = new Context(opts).parse("http://example.com/context");
        assertEquals("http://schema.org/name", ctx.expandIri("name", false, true));

        final Map<String, Object> doc = (Map<String, Object>) loader
                .loadDocument("http://example.com/context").getDocument();
        assertTrue(doc.containsKey("@context"));
    }
}
