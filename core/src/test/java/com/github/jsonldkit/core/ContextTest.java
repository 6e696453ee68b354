package com.github.jsonldkit.core;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Map;

import org.junit.Test;

import com.github.jsonldkit.core.JsonLdError.Error;
import com.github.jsonldkit.utils.JsonUtils;

public class ContextTest {

    private static Context parse(String json) throws Exception {
        return new Context().parse(JsonUtils.fromString(json));
    }

    @Test
    public void expandsTermsAndCompactIris() throws Exception {
        final Context ctx = parse("{\"schema\": \"http://schema.org/\","
                + "\"name\": \"schema:name\"}");
        assertEquals("http://schema.org/name", ctx.expandIri("name", false, true));
        assertEquals("http://schema.org/Person", ctx.expandIri("schema:Person", false, true));
        // terms are not used for document-relative IRIs
        assertEquals("name", ctx.expandIri("name", false, false));
        assertEquals("@type", ctx.expandIri("@type", false, true));
    }

    @Test
    public void vocabularyMappingAppliesToUnknownTerms() throws Exception {
        final Context ctx = parse("{\"@vocab\": \"http://example.org/\"}");
        assertEquals("http://example.org/thing", ctx.expandIri("thing", false, true));
    }

    @Test
    public void resolvesRelativeIrisAgainstBase() throws Exception {
        final Context ctx = new Context(new JsonLdOptions("http://example.com/docs/doc"));
        assertEquals("http://example.com/docs/other", ctx.expandIri("other", true, false));
        assertEquals("http://example.com/root", ctx.expandIri("/root", true, false));
    }

    @Test
    public void compactsToTermsThenPrefixes() throws Exception {
        final Context ctx = parse("{\"schema\": \"http://schema.org/\","
                + "\"name\": \"http://schema.org/name\"}");
        assertEquals("name", ctx.compactIri("http://schema.org/name", null, true, false));
        assertEquals("schema:Person",
                ctx.compactIri("http://schema.org/Person", null, true, false));
        assertEquals("http://other.org/x",
                ctx.compactIri("http://other.org/x", null, true, false));
    }

    @Test
    public void recordsContainerAndTypeMappings() throws Exception {
        final Context ctx = parse("{\"tags\": {\"@id\": \"http://example.org/tags\","
                + "\"@container\": \"@set\"},"
                + "\"knows\": {\"@id\": \"http://example.org/knows\", \"@type\": \"@id\"},"
                + "\"label\": {\"@id\": \"http://example.org/label\", \"@language\": \"en\"}}");
        assertTrue(ctx.hasContainerMapping("tags", "@set"));
        assertFalse(ctx.hasContainerMapping("knows", "@set"));
        assertEquals("@id", ctx.getTypeMapping("knows"));
        assertEquals("en", ctx.getLanguageMapping("label"));
        assertNull(ctx.getTermDefinition("missing"));
    }

    @Test
    public void cyclicIriMappingIsRejected() throws Exception {
        try {
            parse("{\"a\": \"b:x\", \"b\": \"a:y\"}");
            fail("expected a cyclic IRI mapping error");
        } catch (final JsonLdError e) {
            assertEquals(Error.CYCLIC_IRI_MAPPING, e.getType());
        }
    }

    @Test
    public void protectedTermCannotBeRedefined() throws Exception {
        try {
            parse("[{\"@protected\": true, \"name\": \"http://schema.org/name\"},"
                    + "{\"name\": \"http://other.org/name\"}]");
            fail("expected a protected term redefinition error");
        } catch (final JsonLdError e) {
            assertEquals(Error.PROTECTED_TERM_REDEFINITION, e.getType());
        }
    }

    @Test
    public void identicalRedefinitionOfProtectedTermIsAllowed() throws Exception {
        final Context ctx = parse("[{\"@protected\": true, \"name\": \"http://schema.org/name\"},"
                + "{\"name\": \"http://schema.org/name\"}]");
        assertEquals("http://schema.org/name", ctx.expandIri("name", false, true));
        assertTrue(ctx.hasProtectedTerms());
    }

    @Test
    public void nullContextCannotClearProtectedTerms() throws Exception {
        try {
            parse("[{\"@protected\": true, \"name\": \"http://schema.org/name\"}, null]");
            fail("expected an invalid context nullification error");
        } catch (final JsonLdError e) {
            assertEquals(Error.INVALID_CONTEXT_NULLIFICATION, e.getType());
        }
    }

    @Test
    public void loadsRemoteContexts() throws Exception {
        final CachingDocumentLoader loader = new CachingDocumentLoader();
        loader.addDocument("http://example.com/context",
                JsonUtils.fromString("{\"@context\": {\"name\": \"http://schema.org/name\"}}"));
        final JsonLdOptions opts = new JsonLdOptions();
        opts.setDocumentLoader(loader);

        final Context ctx = new Context(opts).parse("http://example.com/context");
        assertEquals("http://schema.org/name", ctx.expandIri("name", false, true));
    }

    @Test
    public void recursiveRemoteContextIsRejected() throws Exception {
        final CachingDocumentLoader loader = new CachingDocumentLoader();
        loader.addDocument("http://example.com/a",
                JsonUtils.fromString("{\"@context\": \"http://example.com/b\"}"));
        loader.addDocument("http://example.com/b",
                JsonUtils.fromString("{\"@context\": \"http://example.com/a\"}"));
        final JsonLdOptions opts = new JsonLdOptions();
        opts.setDocumentLoader(loader);

        try {
            new Context(opts).parse("http://example.com/a");
            fail("expected a recursive context inclusion error");
        } catch (final JsonLdError e) {
            assertEquals(Error.RECURSIVE_CONTEXT_INCLUSION, e.getType());
        }
    }

    @Test
    public void remoteDocumentWithoutContextIsInvalid() throws Exception {
        final CachingDocumentLoader loader = new CachingDocumentLoader();
        loader.addDocument("http://example.com/empty", JsonUtils.fromString("{\"a\": 1}"));
        final JsonLdOptions opts = new JsonLdOptions();
        opts.setDocumentLoader(loader);

        try {
            new Context(opts).parse(Arrays.<Object> asList("http://example.com/empty"));
            fail("expected a remote context error");
        } catch (final JsonLdError e) {
            assertEquals(Error.INVALID_REMOTE_CONTEXT, e.getType());
        }
    }

    @Test
    @SuppressWarnings("unchecked")
    public void serializesActiveContext() throws Exception {
        final Context ctx = parse("{\"@vocab\": \"http://example.org/\","
                + "\"knows\": {\"@id\": \"http://xmlns.com/foaf/0.1/knows\", \"@type\": \"@id\"}}");
        final Map<String, Object> serialized = ctx.serialize();
        final Map<String, Object> inner = (Map<String, Object>) serialized.get("@context");
        assertEquals("http://example.org/", inner.get("@vocab"));
        final Map<String, Object> knows = (Map<String, Object>) inner.get("knows");
        assertEquals("@id", knows.get("@type"));
    }
}
