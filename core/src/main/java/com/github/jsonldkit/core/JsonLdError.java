package com.github.jsonldkit.core;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A JSON-LD processing error. The {@link Error} type carries the error code
 * defined by the JSON-LD API; details hold whatever caused it.
 */
public class JsonLdError extends Exception {

    private static final long serialVersionUID = -8685402790466459014L;

    private final Map<String, Object> details = new LinkedHashMap<String, Object>();
    private Error type;

    public JsonLdError(Error type, Object detail) {
        super(detail == null ? "" : detail.toString());
        this.type = type;
    }

    public JsonLdError(Error type, Object detail, Throwable cause) {
        super(detail == null ? "" : detail.toString(), cause);
        this.type = type;
    }

    public JsonLdError(Error type) {
        super("");
        this.type = type;
    }

    public JsonLdError setDetail(String key, Object val) {
        details.put(key, val);
        return this;
    }

    public enum Error {
        LOADING_DOCUMENT_FAILED("loading document failed"),

        LIST_OF_LISTS("list of lists"),

        INVALID_INDEX_VALUE("invalid @index value"),

        CONFLICTING_INDEXES("conflicting indexes"),

        INVALID_ID_VALUE("invalid @id value"),

        INVALID_LOCAL_CONTEXT("invalid local context"),

        MULTIPLE_CONTEXT_LINK_HEADERS("multiple context link headers"),

        LOADING_REMOTE_CONTEXT_FAILED("loading remote context failed"),

        INVALID_REMOTE_CONTEXT("invalid remote context"),

        RECURSIVE_CONTEXT_INCLUSION("recursive context inclusion"),

        CONTEXT_OVERFLOW("context overflow"),

        INVALID_BASE_IRI("invalid base IRI"),

        INVALID_VOCAB_MAPPING("invalid vocab mapping"),

        INVALID_DEFAULT_LANGUAGE("invalid default language"),

        INVALID_BASE_DIRECTION("invalid base direction"),

        KEYWORD_REDEFINITION("keyword redefinition"),

        INVALID_TERM_DEFINITION("invalid term definition"),

        INVALID_REVERSE_PROPERTY("invalid reverse property"),

        INVALID_IRI_MAPPING("invalid IRI mapping"),

        CYCLIC_IRI_MAPPING("cyclic IRI mapping"),

        INVALID_KEYWORD_ALIAS("invalid keyword alias"),

        INVALID_TYPE_MAPPING("invalid type mapping"),

        INVALID_LANGUAGE_MAPPING("invalid language mapping"),

        COLLIDING_KEYWORDS("colliding keywords"),

        INVALID_CONTAINER_MAPPING("invalid container mapping"),

        INVALID_TYPE_VALUE("invalid type value"),

        INVALID_VALUE_OBJECT("invalid value object"),

        INVALID_VALUE_OBJECT_VALUE("invalid value object value"),

        INVALID_LANGUAGE_TAGGED_STRING("invalid language-tagged string"),

        INVALID_LANGUAGE_TAGGED_VALUE("invalid language-tagged value"),

        INVALID_TYPED_VALUE("invalid typed value"),

        INVALID_SET_OR_LIST_OBJECT("invalid set or list object"),

        INVALID_LANGUAGE_MAP_VALUE("invalid language map value"),

        COMPACTION_TO_LIST_OF_LISTS("compaction to list of lists"),

        INVALID_REVERSE_PROPERTY_MAP("invalid reverse property map"),

        INVALID_REVERSE_VALUE("invalid @reverse value"),

        INVALID_REVERSE_PROPERTY_VALUE("invalid reverse property value"),

        INVALID_VERSION_VALUE("invalid @version value"),

        PROCESSING_MODE_CONFLICT("processing mode conflict"),

        INVALID_PREFIX_VALUE("invalid @prefix value"),

        INVALID_NEST_VALUE("invalid @nest value"),

        INVALID_CONTEXT_NULLIFICATION("invalid context nullification"),

        INVALID_CONTEXT_ENTRY("invalid context entry"),

        INVALID_IMPORT_VALUE("invalid @import value"),

        INVALID_PROPAGATE_VALUE("invalid @propagate value"),

        INVALID_PROTECTED_VALUE("invalid @protected value"),

        INVALID_INCLUDED_VALUE("invalid @included value"),

        INVALID_SCOPED_CONTEXT("invalid scoped context"),

        PROTECTED_TERM_REDEFINITION("protected term redefinition"),

        IRI_CONFUSED_WITH_PREFIX("IRI confused with prefix"),

        INVALID_EMBED_VALUE("invalid @embed value"),

        INVALID_FRAME("invalid frame"),

        CANONICALIZATION_COMPLEXITY_EXCEEDED("canonicalization complexity exceeded"),

        INVALID_NUMBER_FORMAT("invalid number format"),

        // not JSON-LD error codes
        SYNTAX_ERROR("syntax error"),

        PARSE_ERROR("parse error"),

        UNKNOWN_FORMAT("unknown format"),

        INVALID_INPUT("invalid input"),

        IO_ERROR("io error"),

        UNKNOWN_ERROR("unknown error");

        private final String error;

        private Error(String error) {
            this.error = error;
        }

        @Override
        public String toString() {
            return error;
        }
    }

    public JsonLdError setType(Error error) {
        this.type = error;
        return this;
    }

    public Error getType() {
        return type;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public String getMessage() {
        final String msg = super.getMessage();
        final StringBuilder sb = new StringBuilder(type.toString());
        if (msg != null && !"".equals(msg)) {
            sb.append(": ").append(msg);
        }
        for (final Map.Entry<String, Object> entry : details.entrySet()) {
            sb.append(" {").append(entry.getKey()).append(":").append(entry.getValue())
                    .append("}");
        }
        return sb.toString();
    }
}
