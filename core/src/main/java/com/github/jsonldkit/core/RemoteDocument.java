package com.github.jsonldkit.core;

/**
 * A document returned by a {@link DocumentLoader}: the parsed JSON, the URL
 * it was finally read from, and the context linked from the response, if
 * any.
 */
public class RemoteDocument {

    private String documentUrl;
    private Object document;
    private String contextUrl;
    private String contentType;

    public RemoteDocument(String url, Object document) {
        this(url, document, null);
    }

    public RemoteDocument(String url, Object document, String context) {
        this.documentUrl = url;
        this.document = document;
        this.contextUrl = context;
    }

    public String getDocumentUrl() {
        return documentUrl;
    }

    public void setDocumentUrl(String documentUrl) {
        this.documentUrl = documentUrl;
    }

    public Object getDocument() {
        return document;
    }

    public void setDocument(Object document) {
        this.document = document;
    }

    public String getContextUrl() {
        return contextUrl;
    }

    public void setContextUrl(String contextUrl) {
        this.contextUrl = contextUrl;
    }

    public String getContentType() {
        return contentType;
    }

    public void setContentType(String contentType) {
        this.contentType = contentType;
    }
}
