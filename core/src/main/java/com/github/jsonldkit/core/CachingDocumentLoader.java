package com.github.jsonldkit.core;

import java.util.HashMap;
import java.util.Map;

/**
 * A {@link DocumentLoader} that remembers every document once retrieved from
 * the loader it wraps. It can also be preloaded, which keeps tests off the
 * network.
 */
public class CachingDocumentLoader extends DocumentLoader {

    private final DocumentLoader nextLoader;
    private final Map<String, RemoteDocument> cache = new HashMap<String, RemoteDocument>();

    public CachingDocumentLoader() {
        this(new DocumentLoader());
    }

    public CachingDocumentLoader(DocumentLoader nextLoader) {
        this.nextLoader = nextLoader;
    }

    @Override
    public RemoteDocument loadDocument(String url) throws JsonLdError {
        synchronized (cache) {
            final RemoteDocument cached = cache.get(url);
            if (cached != null) {
                return cached;
            }
        }
        final RemoteDocument doc = nextLoader.loadDocument(url);
        synchronized (cache) {
            cache.put(url, doc);
        }
        return doc;
    }

    /**
     * Caches the given document under the given URL.
     */
    public void addDocument(String url, Object document) {
        synchronized (cache) {
            cache.put(url, new RemoteDocument(url, document));
        }
    }

    /**
     * Loads each mapped location through the wrapped loader and caches the
     * result under its source URL, e.g. a remote context served from a local
     * file.
     *
     * @param urlMap
     *            source URL to the location to load it from
     */
    public void preloadWithMapping(Map<String, String> urlMap) throws JsonLdError {
        for (final Map.Entry<String, String> entry : urlMap.entrySet()) {
            final RemoteDocument doc = nextLoader.loadDocument(entry.getValue());
            synchronized (cache) {
                cache.put(entry.getKey(), doc);
            }
        }
    }

    public boolean isCached(String url) {
        synchronized (cache) {
            return cache.containsKey(url);
        }
    }
}
