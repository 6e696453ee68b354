package com.github.jsonldkit.core;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class JsonLdUrlTest {

    private static final String BASE = "http://a/b/c/d;p?q";

    @Test
    public void resolvesNormalReferences() {
        assertEquals("http://a/b/c/g", JsonLdUrl.resolve(BASE, "g"));
        assertEquals("http://a/b/c/g", JsonLdUrl.resolve(BASE, "./g"));
        assertEquals("http://a/b/c/g/", JsonLdUrl.resolve(BASE, "g/"));
        assertEquals("http://a/g", JsonLdUrl.resolve(BASE, "/g"));
        assertEquals("http://g", JsonLdUrl.resolve(BASE, "//g"));
        assertEquals("http://a/b/c/d;p?y", JsonLdUrl.resolve(BASE, "?y"));
        assertEquals("http://a/b/c/g?y", JsonLdUrl.resolve(BASE, "g?y"));
        assertEquals("http://a/b/c/d;p?q#s", JsonLdUrl.resolve(BASE, "#s"));
        assertEquals("http://a/b/g", JsonLdUrl.resolve(BASE, "../g"));
        assertEquals("http://a/g", JsonLdUrl.resolve(BASE, "../../g"));
    }

    @Test
    public void absoluteReferencesStayAbsolute() {
        assertEquals("https://example.org/x", JsonLdUrl.resolve(BASE, "https://example.org/x"));
        assertEquals("http://g", JsonLdUrl.resolve(BASE, "http://g"));
        assertEquals("http://g?y", JsonLdUrl.resolve(BASE, "//g?y"));
    }

    @Test
    public void emptyBaseLeavesReferenceAlone() {
        assertEquals("g", JsonLdUrl.resolve("", "g"));
        assertEquals("g", JsonLdUrl.resolve(null, "g"));
    }

    @Test
    public void emptyReferenceDropsFragment() {
        assertEquals("http://a/b", JsonLdUrl.resolve("http://a/b#frag", ""));
    }

    @Test
    public void removesBase() {
        assertEquals("e", JsonLdUrl.removeBase("http://a/b/c/d", "http://a/b/c/e"));
        assertEquals("../x", JsonLdUrl.removeBase("http://a/b/c/d", "http://a/b/x"));
        assertEquals("http://example.org/x",
                JsonLdUrl.removeBase("http://a/b/c/d", "http://example.org/x"));
        assertEquals("http://a/b/c/e", JsonLdUrl.removeBase(null, "http://a/b/c/e"));
    }
}
