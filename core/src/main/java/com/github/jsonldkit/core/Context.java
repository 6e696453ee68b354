package com.github.jsonldkit.core;

import static com.github.jsonldkit.core.JsonLdConsts.ANY;
import static com.github.jsonldkit.core.JsonLdConsts.BASE;
import static com.github.jsonldkit.core.JsonLdConsts.CONTAINER;
import static com.github.jsonldkit.core.JsonLdConsts.CONTEXT;
import static com.github.jsonldkit.core.JsonLdConsts.DIRECTION;
import static com.github.jsonldkit.core.JsonLdConsts.GRAPH;
import static com.github.jsonldkit.core.JsonLdConsts.ID;
import static com.github.jsonldkit.core.JsonLdConsts.IMPORT;
import static com.github.jsonldkit.core.JsonLdConsts.INDEX;
import static com.github.jsonldkit.core.JsonLdConsts.JSON;
import static com.github.jsonldkit.core.JsonLdConsts.LANGUAGE;
import static com.github.jsonldkit.core.JsonLdConsts.LIST;
import static com.github.jsonldkit.core.JsonLdConsts.NEST;
import static com.github.jsonldkit.core.JsonLdConsts.NONE;
import static com.github.jsonldkit.core.JsonLdConsts.NULL;
import static com.github.jsonldkit.core.JsonLdConsts.PREFIX;
import static com.github.jsonldkit.core.JsonLdConsts.PRESERVE;
import static com.github.jsonldkit.core.JsonLdConsts.PROPAGATE;
import static com.github.jsonldkit.core.JsonLdConsts.PROTECTED;
import static com.github.jsonldkit.core.JsonLdConsts.REVERSE;
import static com.github.jsonldkit.core.JsonLdConsts.SET;
import static com.github.jsonldkit.core.JsonLdConsts.TYPE;
import static com.github.jsonldkit.core.JsonLdConsts.VALUE;
import static com.github.jsonldkit.core.JsonLdConsts.VERSION;
import static com.github.jsonldkit.core.JsonLdConsts.VOCAB;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.jsonldkit.core.JsonLdError.Error;

/**
 * A helper class which still stores all the values in a map but gives member
 * variables easily access certain keys
 *
 * @author tristan
 *
 */
public class Context extends LinkedHashMap<String, Object> {

    private static final long serialVersionUID = 2894534897574805571L;

    private static final Logger LOG = LoggerFactory.getLogger(Context.class);

    private static final int MAX_CONTEXT_URLS = 256;

    private static final String GEN_DELIMS = ":/?#[]@";

    private static final Set<String> CONTEXT_KEYWORDS = new HashSet<String>(Arrays.asList(BASE,
            DIRECTION, IMPORT, LANGUAGE, PROPAGATE, PROTECTED, VERSION, VOCAB));

    private static final Set<String> TERM_KEYS_1_0 = new HashSet<String>(
            Arrays.asList(CONTAINER, ID, LANGUAGE, REVERSE, TYPE));

    private static final Set<String> TERM_KEYS_1_1 = new HashSet<String>(Arrays.asList(CONTAINER,
            ID, LANGUAGE, REVERSE, TYPE, CONTEXT, DIRECTION, INDEX, NEST, PREFIX, PROTECTED));

    private static final Set<String> CONTAINER_KEYWORDS = new HashSet<String>(
            Arrays.asList(GRAPH, ID, INDEX, LANGUAGE, LIST, SET, TYPE));

    private JsonLdOptions options;
    private Map<String, Object> termDefinitions;
    private Map<String, Object> inverse = null;
    private Context previousContext = null;
    private Map<String, Object> remoteContextCache;

    public Context() {
        this(new JsonLdOptions());
    }

    public Context(JsonLdOptions options) {
        super();
        init(options);
    }

    private void init(JsonLdOptions options) {
        this.options = options;
        if (options.getBase() != null && !"".equals(options.getBase())) {
            this.put(BASE, options.getBase());
        }
        this.termDefinitions = new LinkedHashMap<String, Object>();
        this.remoteContextCache = new HashMap<String, Object>();
    }

    public JsonLdOptions getOptions() {
        return options;
    }

    /**
     * Context Processing Algorithm
     *
     * http://www.w3.org/TR/json-ld11-api/#context-processing-algorithm
     *
     * @param localContext
     *            The Local Context object.
     * @return The parsed and merged Context.
     * @throws JsonLdError
     *             If there is an error parsing the contexts.
     */
    public Context parse(Object localContext) throws JsonLdError {
        return parse(localContext, new ArrayList<String>(), false, true, false, true);
    }

    public Context parse(Object localContext, List<String> remoteContexts) throws JsonLdError {
        return parse(localContext, remoteContexts, false, true, false, true);
    }

    /**
     * Context Processing Algorithm with every flag exposed.
     *
     * @param localContext
     *            the local context, a map, a string, null or an array of
     *            those
     * @param remoteContexts
     *            the remote context URLs in the current chain of inclusion
     * @param parsingARemoteContext
     *            true when localContext was loaded from a remote document;
     *            such contexts cannot change @base
     * @param propagate
     *            false for contexts that do not survive into node objects
     * @param overrideProtected
     *            true when protected terms may be redefined
     * @param validateScopedContext
     *            false while eagerly checking a term's scoped context, which
     *            lets remote scoped contexts refer back to themselves
     * @return a new context; this context is left untouched
     * @throws JsonLdError
     *             on any context processing error
     */
    @SuppressWarnings("unchecked")
    public Context parse(Object localContext, List<String> remoteContexts,
            boolean parsingARemoteContext, boolean propagate, boolean overrideProtected,
            boolean validateScopedContext) throws JsonLdError {
        // 1. Initialize result to the result of cloning active context.
        Context result = this.clone();

        // 2)
        if (localContext instanceof Map
                && ((Map<String, Object>) localContext).get(PROPAGATE) instanceof Boolean) {
            propagate = (Boolean) ((Map<String, Object>) localContext).get(PROPAGATE);
        }

        // 3)
        if (!propagate && result.previousContext == null) {
            result.previousContext = this;
        }

        // 4)
        final List<Object> contexts = JsonLdUtils.arrayify(localContext);

        // 5)
        for (Object context : contexts) {
            // 5.1)
            if (context == null) {
                if (!overrideProtected && result.hasProtectedTerms()) {
                    throw new JsonLdError(Error.INVALID_CONTEXT_NULLIFICATION,
                            "tried to nullify a context with protected terms");
                }
                final Context reset = new Context(options);
                reset.remoteContextCache = remoteContextCache;
                if (!propagate) {
                    reset.previousContext = result;
                }
                result = reset;
                continue;
            }

            // 5.2)
            if (context instanceof String) {
                final String uri = JsonLdUrl.resolve((String) result.get(BASE), (String) context);
                // 5.2.2)
                if (remoteContexts.contains(uri)) {
                    if (!validateScopedContext) {
                        continue;
                    }
                    throw new JsonLdError(Error.RECURSIVE_CONTEXT_INCLUSION, uri);
                }
                if (remoteContexts.size() >= MAX_CONTEXT_URLS) {
                    throw new JsonLdError(Error.CONTEXT_OVERFLOW, uri);
                }
                final List<String> chain = new ArrayList<String>(remoteContexts);
                chain.add(uri);

                // 5.2.3) dereference the context
                final Object remoteContext = loadContext(uri);

                // 5.2.4)
                result = result.parse(remoteContext, chain, true, true, overrideProtected,
                        validateScopedContext);
                // 5.2.5)
                continue;
            }

            // 5.3)
            if (!(context instanceof Map)) {
                throw new JsonLdError(Error.INVALID_LOCAL_CONTEXT, context);
            }
            Map<String, Object> contextMap = (Map<String, Object>) context;

            // 5.5) @version
            if (contextMap.containsKey(VERSION)) {
                final Object version = contextMap.get(VERSION);
                if (!(version instanceof Number) || ((Number) version).doubleValue() != 1.1) {
                    throw new JsonLdError(Error.INVALID_VERSION_VALUE, version);
                }
                if (!options.isProcessingMode11()) {
                    throw new JsonLdError(Error.PROCESSING_MODE_CONFLICT,
                            "@version 1.1 in json-ld-1.0 mode");
                }
            }

            // 5.6) @import
            if (contextMap.containsKey(IMPORT)) {
                if (!options.isProcessingMode11()) {
                    throw new JsonLdError(Error.INVALID_CONTEXT_ENTRY,
                            "@import is not allowed in json-ld-1.0 mode");
                }
                final Object importValue = contextMap.get(IMPORT);
                if (!(importValue instanceof String)) {
                    throw new JsonLdError(Error.INVALID_IMPORT_VALUE, importValue);
                }
                final String importUri = JsonLdUrl.resolve((String) result.get(BASE),
                        (String) importValue);
                final Object imported = loadContext(importUri);
                if (!(imported instanceof Map)) {
                    throw new JsonLdError(Error.INVALID_REMOTE_CONTEXT, importUri);
                }
                if (((Map<String, Object>) imported).containsKey(IMPORT)) {
                    throw new JsonLdError(Error.INVALID_CONTEXT_ENTRY,
                            "imported context contains @import: " + importUri);
                }
                final Map<String, Object> merged = new LinkedHashMap<String, Object>(
                        (Map<String, Object>) imported);
                for (final Map.Entry<String, Object> entry : contextMap.entrySet()) {
                    if (!IMPORT.equals(entry.getKey())) {
                        merged.put(entry.getKey(), entry.getValue());
                    }
                }
                contextMap = merged;
            }

            // 5.7) @base, only outside remote contexts
            if (!parsingARemoteContext && contextMap.containsKey(BASE)) {
                final Object value = contextMap.get(BASE);
                if (value == null) {
                    result.remove(BASE);
                } else if (value instanceof String) {
                    if (JsonLdUtils.isAbsoluteIri((String) value)) {
                        result.put(BASE, value);
                    } else {
                        final String baseUri = (String) result.get(BASE);
                        if (baseUri == null || !JsonLdUtils.isAbsoluteIri(baseUri)) {
                            throw new JsonLdError(Error.INVALID_BASE_IRI, value);
                        }
                        result.put(BASE, JsonLdUrl.resolve(baseUri, (String) value));
                    }
                } else {
                    throw new JsonLdError(Error.INVALID_BASE_IRI,
                            "@base must be a string: " + value);
                }
            }

            // 5.8) @vocab
            if (contextMap.containsKey(VOCAB)) {
                final Object value = contextMap.get(VOCAB);
                if (value == null) {
                    result.remove(VOCAB);
                } else if (value instanceof String) {
                    final String vocab = (String) value;
                    if (!options.isProcessingMode11() && !JsonLdUtils.isAbsoluteIri(vocab)) {
                        throw new JsonLdError(Error.INVALID_VOCAB_MAPPING,
                                "@vocab must be an absolute IRI in json-ld-1.0 mode");
                    }
                    final String expanded = result.expandIri(vocab, true, true, null, null);
                    if (expanded == null || JsonLdUtils.isKeyword(expanded)) {
                        throw new JsonLdError(Error.INVALID_VOCAB_MAPPING, value);
                    }
                    result.put(VOCAB, expanded);
                } else {
                    throw new JsonLdError(Error.INVALID_VOCAB_MAPPING,
                            "@vocab must be a string or null");
                }
            }

            // 5.9) @language
            if (contextMap.containsKey(LANGUAGE)) {
                final Object value = contextMap.get(LANGUAGE);
                if (value == null) {
                    result.remove(LANGUAGE);
                } else if (value instanceof String) {
                    result.put(LANGUAGE, ((String) value).toLowerCase());
                } else {
                    throw new JsonLdError(Error.INVALID_DEFAULT_LANGUAGE, value);
                }
            }

            // 5.10) @direction
            if (contextMap.containsKey(DIRECTION)) {
                if (!options.isProcessingMode11()) {
                    throw new JsonLdError(Error.INVALID_CONTEXT_ENTRY,
                            "@direction is not allowed in json-ld-1.0 mode");
                }
                final Object value = contextMap.get(DIRECTION);
                if (value == null) {
                    result.remove(DIRECTION);
                } else if ("ltr".equals(value) || "rtl".equals(value)) {
                    result.put(DIRECTION, value);
                } else {
                    throw new JsonLdError(Error.INVALID_BASE_DIRECTION, value);
                }
            }

            // 5.11) @propagate
            if (contextMap.containsKey(PROPAGATE)) {
                if (!options.isProcessingMode11()) {
                    throw new JsonLdError(Error.INVALID_CONTEXT_ENTRY,
                            "@propagate is not allowed in json-ld-1.0 mode");
                }
                if (!(contextMap.get(PROPAGATE) instanceof Boolean)) {
                    throw new JsonLdError(Error.INVALID_PROPAGATE_VALUE,
                            contextMap.get(PROPAGATE));
                }
            }

            boolean protectedDefault = false;
            if (contextMap.containsKey(PROTECTED)) {
                final Object value = contextMap.get(PROTECTED);
                if (!(value instanceof Boolean)) {
                    throw new JsonLdError(Error.INVALID_PROTECTED_VALUE, value);
                }
                protectedDefault = (Boolean) value;
            }

            // 5.12)
            final Map<String, Boolean> defined = new LinkedHashMap<String, Boolean>();

            // 5.13)
            for (final String key : contextMap.keySet()) {
                if (CONTEXT_KEYWORDS.contains(key)) {
                    continue;
                }
                result.createTermDefinition(contextMap, key, defined, remoteContexts,
                        protectedDefault, overrideProtected);
            }
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private Object loadContext(String uri) throws JsonLdError {
        Object document = remoteContextCache.get(uri);
        if (document == null) {
            final RemoteDocument remote;
            try {
                remote = options.getDocumentLoader().loadDocument(uri);
            } catch (final JsonLdError e) {
                throw new JsonLdError(Error.LOADING_REMOTE_CONTEXT_FAILED, uri, e);
            }
            document = remote.getDocument();
            LOG.debug("Loaded remote context {}", uri);
            remoteContextCache.put(uri, document);
        }
        if (!(document instanceof Map)
                || !((Map<String, Object>) document).containsKey(CONTEXT)) {
            throw new JsonLdError(Error.INVALID_REMOTE_CONTEXT, uri);
        }
        return ((Map<String, Object>) document).get(CONTEXT);
    }

    /**
     * Create Term Definition Algorithm
     *
     * http://www.w3.org/TR/json-ld11-api/#create-term-definition
     *
     * @param context
     *            the local context being processed
     * @param term
     *            the term to define
     * @param defined
     *            terms already defined (true) or in progress (false)
     * @param remoteContexts
     *            remote context chain, for scoped context validation
     * @param protectedDefault
     *            the @protected value of the local context
     * @param overrideProtected
     *            true when protected terms may be redefined
     * @throws JsonLdError
     *             on any invalid definition
     */
    @SuppressWarnings("unchecked")
    private void createTermDefinition(Map<String, Object> context, String term,
            Map<String, Boolean> defined, List<String> remoteContexts, boolean protectedDefault,
            boolean overrideProtected) throws JsonLdError {
        // 1)
        if (defined.containsKey(term)) {
            if (Boolean.TRUE.equals(defined.get(term))) {
                return;
            }
            throw new JsonLdError(Error.CYCLIC_IRI_MAPPING, term);
        }

        // 2)
        if ("".equals(term)) {
            throw new JsonLdError(Error.INVALID_TERM_DEFINITION, "empty term");
        }
        defined.put(term, false);

        Object value = context.get(term);

        // 4) @type may only be made a @set or protected
        final boolean typeRedefinition = TYPE.equals(term) && options.isProcessingMode11()
                && value instanceof Map && !((Map<String, Object>) value).isEmpty()
                && isTypeRedefinition((Map<String, Object>) value);
        if (!typeRedefinition && JsonLdUtils.isKeyword(term)) {
            throw new JsonLdError(Error.KEYWORD_REDEFINITION, term);
        } else if (!typeRedefinition && JsonLdUtils.hasKeywordForm(term)) {
            // 5)
            LOG.warn("Ignoring term with the form of a keyword: {}", term);
            defined.put(term, true);
            return;
        }

        // 6)
        final Map<String, Object> previousDefinition = (Map<String, Object>) termDefinitions
                .remove(term);

        // 7)
        boolean simpleTerm = false;
        if (value == null) {
            final Map<String, Object> tmp = new LinkedHashMap<String, Object>();
            tmp.put(ID, null);
            value = tmp;
        } else if (value instanceof String) {
            final Map<String, Object> tmp = new LinkedHashMap<String, Object>();
            tmp.put(ID, value);
            value = tmp;
            simpleTerm = true;
        } else if (!(value instanceof Map)) {
            throw new JsonLdError(Error.INVALID_TERM_DEFINITION, value);
        }
        final Map<String, Object> val = (Map<String, Object>) value;

        // 9)
        final Map<String, Object> definition = new LinkedHashMap<String, Object>();
        if (val.containsKey(PROTECTED)) {
            if (!options.isProcessingMode11()) {
                throw new JsonLdError(Error.INVALID_TERM_DEFINITION, term);
            }
            if (!(val.get(PROTECTED) instanceof Boolean)) {
                throw new JsonLdError(Error.INVALID_PROTECTED_VALUE, val.get(PROTECTED));
            }
            if ((Boolean) val.get(PROTECTED)) {
                definition.put(PROTECTED, true);
            }
        } else if (protectedDefault) {
            definition.put(PROTECTED, true);
        }

        final Set<String> validKeys = options.isProcessingMode11() ? TERM_KEYS_1_1
                : TERM_KEYS_1_0;
        for (final String key : val.keySet()) {
            if (!validKeys.contains(key)) {
                throw new JsonLdError(Error.INVALID_TERM_DEFINITION,
                        "unexpected " + key + " in definition of " + term);
            }
        }

        // 12) type mapping
        if (val.containsKey(TYPE)) {
            final Object type = val.get(TYPE);
            if (!(type instanceof String)) {
                throw new JsonLdError(Error.INVALID_TYPE_MAPPING, type);
            }
            final String expandedType = expandIri((String) type, false, true, context, defined);
            if ((JSON.equals(expandedType) || NONE.equals(expandedType))
                    && !options.isProcessingMode11()) {
                throw new JsonLdError(Error.INVALID_TYPE_MAPPING, expandedType);
            }
            if (!ID.equals(expandedType) && !VOCAB.equals(expandedType)
                    && !JSON.equals(expandedType) && !NONE.equals(expandedType)
                    && (expandedType == null || !JsonLdUtils.isAbsoluteIri(expandedType)
                            || expandedType.startsWith("_:"))) {
                throw new JsonLdError(Error.INVALID_TYPE_MAPPING, expandedType);
            }
            definition.put(TYPE, expandedType);
        }

        // 13) reverse properties
        if (val.containsKey(REVERSE)) {
            if (val.containsKey(ID) || val.containsKey(NEST)) {
                throw new JsonLdError(Error.INVALID_REVERSE_PROPERTY, val);
            }
            final Object reverse = val.get(REVERSE);
            if (!(reverse instanceof String)) {
                throw new JsonLdError(Error.INVALID_IRI_MAPPING,
                        "Expected String for @reverse value. got "
                                + (reverse == null ? "null" : reverse.getClass()));
            }
            if (JsonLdUtils.hasKeywordForm((String) reverse)) {
                LOG.warn("Ignoring @reverse with the form of a keyword: {}", reverse);
                defined.put(term, true);
                return;
            }
            final String id = expandIri((String) reverse, false, true, context, defined);
            if (id == null || !JsonLdUtils.isAbsoluteIri(id)) {
                throw new JsonLdError(Error.INVALID_IRI_MAPPING, "Non-absolute @reverse IRI: "
                        + id);
            }
            definition.put(ID, id);
            if (val.containsKey(CONTAINER)) {
                final Object container = val.get(CONTAINER);
                if (container != null && !SET.equals(container) && !INDEX.equals(container)) {
                    throw new JsonLdError(Error.INVALID_REVERSE_PROPERTY,
                            "reverse properties only support index-containers");
                }
                if (container != null) {
                    definition.put(CONTAINER, JsonLdUtils.arrayify(container));
                }
            }
            definition.put(REVERSE, true);
            finishDefinition(term, definition, previousDefinition, defined, overrideProtected);
            return;
        }

        definition.put(REVERSE, false);

        // 14) IRI mapping
        if (val.containsKey(ID) && !term.equals(val.get(ID))) {
            final Object id = val.get(ID);
            if (id == null) {
                // a null mapping still records the term, so it can be protected
                definition.put(ID, null);
            } else if (!(id instanceof String)) {
                throw new JsonLdError(Error.INVALID_IRI_MAPPING,
                        "expected value of @id to be a string");
            } else if (!JsonLdUtils.isKeyword(id) && JsonLdUtils.hasKeywordForm((String) id)) {
                LOG.warn("Ignoring @id with the form of a keyword: {}", id);
                defined.put(term, true);
                return;
            } else {
                final String res = expandIri((String) id, false, true, context, defined);
                if (res == null
                        || !(JsonLdUtils.isKeyword(res) || JsonLdUtils.isAbsoluteIri(res))) {
                    throw new JsonLdError(Error.INVALID_IRI_MAPPING,
                            "resulting IRI mapping should be a keyword, absolute IRI or blank node");
                }
                if (CONTEXT.equals(res)) {
                    throw new JsonLdError(Error.INVALID_KEYWORD_ALIAS, "cannot alias @context");
                }
                // 14.2.4) a term that looks like an IRI must expand to itself
                if (isIriLikeTerm(term)) {
                    defined.put(term, true);
                    final String termIri = expandIri(term, false, true, context, defined);
                    if (!res.equals(termIri)) {
                        throw new JsonLdError(Error.INVALID_IRI_MAPPING,
                                term + " does not expand to " + res);
                    }
                    defined.put(term, false);
                }
                definition.put(ID, res);
                // 14.2.5)
                if (term.indexOf(':') < 0 && term.indexOf('/') < 0
                        && (!options.isProcessingMode11() || (simpleTerm
                                && (endsWithGenDelim(res) || res.startsWith("_:"))))) {
                    definition.put(PREFIX, true);
                }
            }
        } else if (term.indexOf(':', 1) > 0) {
            // 15) compact IRI
            final int colIndex = term.indexOf(':', 1);
            final String prefix = term.substring(0, colIndex);
            final String suffix = term.substring(colIndex + 1);
            if (context.containsKey(prefix)) {
                createTermDefinition(context, prefix, defined, remoteContexts, protectedDefault,
                        overrideProtected);
            }
            final Map<String, Object> prefixDefinition = getTermDefinition(prefix);
            if (prefixDefinition != null && prefixDefinition.get(ID) != null) {
                definition.put(ID, prefixDefinition.get(ID) + suffix);
            } else {
                definition.put(ID, term);
            }
        } else if (term.indexOf('/') >= 0) {
            // 16) relative IRI
            final String res = expandIri(term, false, true, null, null);
            if (res == null || !JsonLdUtils.isAbsoluteIri(res)) {
                throw new JsonLdError(Error.INVALID_IRI_MAPPING, term);
            }
            definition.put(ID, res);
        } else if (TYPE.equals(term)) {
            // 17)
            definition.put(ID, TYPE);
        } else if (this.containsKey(VOCAB)) {
            // 18)
            definition.put(ID, this.get(VOCAB) + term);
        } else {
            throw new JsonLdError(Error.INVALID_IRI_MAPPING,
                    "relative term definition without vocab mapping: " + term);
        }

        // 19) container mapping
        if (val.containsKey(CONTAINER)) {
            final List<String> container = validateContainer(val.get(CONTAINER));
            if (container.contains(TYPE)) {
                final Object type = definition.get(TYPE);
                if (type == null) {
                    definition.put(TYPE, ID);
                } else if (!ID.equals(type) && !VOCAB.equals(type)) {
                    throw new JsonLdError(Error.INVALID_TYPE_MAPPING,
                            "@type container requires @id or @vocab type mapping");
                }
            }
            definition.put(CONTAINER, container);
        }

        // 20) index mapping
        if (val.containsKey(INDEX)) {
            final List<String> container = (List<String>) definition.get(CONTAINER);
            if (!options.isProcessingMode11() || container == null
                    || !container.contains(INDEX)) {
                throw new JsonLdError(Error.INVALID_TERM_DEFINITION,
                        "@index requires an @index container");
            }
            final Object index = val.get(INDEX);
            if (!(index instanceof String) || JsonLdUtils.isKeyword(index)) {
                throw new JsonLdError(Error.INVALID_TERM_DEFINITION, "invalid @index: " + index);
            }
            final String expandedIndex = expandIri((String) index, false, true, context,
                    defined);
            if (expandedIndex == null || !JsonLdUtils.isAbsoluteIri(expandedIndex)) {
                throw new JsonLdError(Error.INVALID_TERM_DEFINITION, "invalid @index: " + index);
            }
            definition.put(INDEX, index);
        }

        // 21) scoped context, validated now and stored as given
        if (val.containsKey(CONTEXT)) {
            if (!options.isProcessingMode11()) {
                throw new JsonLdError(Error.INVALID_TERM_DEFINITION,
                        "scoped contexts need json-ld-1.1");
            }
            final Object scoped = val.get(CONTEXT);
            try {
                parse(scoped, new ArrayList<String>(remoteContexts), false, true, true, false);
            } catch (final JsonLdError e) {
                throw new JsonLdError(Error.INVALID_SCOPED_CONTEXT, term, e);
            }
            definition.put(CONTEXT, scoped);
        }

        // 22) language mapping
        if (val.containsKey(LANGUAGE) && !val.containsKey(TYPE)) {
            final Object language = val.get(LANGUAGE);
            if (language != null && !(language instanceof String)) {
                throw new JsonLdError(Error.INVALID_LANGUAGE_MAPPING,
                        "@language must be a string or null");
            }
            definition.put(LANGUAGE, language == null ? null : ((String) language).toLowerCase());
        }

        // 23) direction mapping
        if (val.containsKey(DIRECTION) && !val.containsKey(TYPE)) {
            final Object direction = val.get(DIRECTION);
            if (direction != null && !"ltr".equals(direction) && !"rtl".equals(direction)) {
                throw new JsonLdError(Error.INVALID_BASE_DIRECTION, direction);
            }
            definition.put(DIRECTION, direction);
        }

        // 24) nest value
        if (val.containsKey(NEST)) {
            final Object nest = val.get(NEST);
            if (!(nest instanceof String) || (!NEST.equals(nest) && JsonLdUtils.isKeyword(nest))) {
                throw new JsonLdError(Error.INVALID_NEST_VALUE, nest);
            }
            definition.put(NEST, nest);
        }

        // 25) prefix flag
        if (val.containsKey(PREFIX)) {
            if (term.indexOf(':') >= 0 || term.indexOf('/') >= 0) {
                throw new JsonLdError(Error.INVALID_TERM_DEFINITION,
                        "@prefix on a compact IRI or IRI term: " + term);
            }
            final Object prefix = val.get(PREFIX);
            if (!(prefix instanceof Boolean)) {
                throw new JsonLdError(Error.INVALID_PREFIX_VALUE, prefix);
            }
            if ((Boolean) prefix && JsonLdUtils.isKeyword(definition.get(ID))) {
                throw new JsonLdError(Error.INVALID_TERM_DEFINITION,
                        "keyword aliases cannot be prefixes: " + term);
            }
            if ((Boolean) prefix) {
                definition.put(PREFIX, true);
            } else {
                definition.remove(PREFIX);
            }
        }

        // 26)
        final Object id = definition.get(ID);
        if (CONTEXT.equals(id) || PRESERVE.equals(id)) {
            throw new JsonLdError(Error.INVALID_KEYWORD_ALIAS, id);
        }

        finishDefinition(term, definition, previousDefinition, defined, overrideProtected);
    }

    /**
     * Checks a redefinition against a protected previous definition and
     * stores the term.
     */
    private void finishDefinition(String term, Map<String, Object> definition,
            Map<String, Object> previousDefinition, Map<String, Boolean> defined,
            boolean overrideProtected) throws JsonLdError {
        Map<String, Object> toStore = definition;
        // 27)
        if (!overrideProtected && previousDefinition != null
                && Boolean.TRUE.equals(previousDefinition.get(PROTECTED))) {
            final Map<String, Object> compared = new LinkedHashMap<String, Object>(definition);
            compared.put(PROTECTED, true);
            if (!JsonLdUtils.deepCompare(compared, previousDefinition)) {
                throw new JsonLdError(Error.PROTECTED_TERM_REDEFINITION, term);
            }
            toStore = previousDefinition;
        }
        termDefinitions.put(term, toStore);
        defined.put(term, true);
    }

    private static boolean isTypeRedefinition(Map<String, Object> value) {
        for (final Map.Entry<String, Object> entry : value.entrySet()) {
            if (CONTAINER.equals(entry.getKey())) {
                if (!SET.equals(entry.getValue())) {
                    return false;
                }
            } else if (!PROTECTED.equals(entry.getKey())) {
                return false;
            }
        }
        return true;
    }

    private static boolean isIriLikeTerm(String term) {
        final int colon = term.indexOf(':');
        return (colon > 0 && colon < term.length() - 1) || term.indexOf('/') >= 0;
    }

    private static boolean endsWithGenDelim(String iri) {
        return !iri.isEmpty() && GEN_DELIMS.indexOf(iri.charAt(iri.length() - 1)) >= 0;
    }

    /**
     * Validates a @container value and returns it as a list of keywords.
     */
    private List<String> validateContainer(Object value) throws JsonLdError {
        if (!options.isProcessingMode11()) {
            if (!(value instanceof String) || GRAPH.equals(value) || ID.equals(value)
                    || TYPE.equals(value) || !CONTAINER_KEYWORDS.contains(value)) {
                throw new JsonLdError(Error.INVALID_CONTAINER_MAPPING, value);
            }
            return Collections.singletonList((String) value);
        }
        final List<String> container = new ArrayList<String>();
        for (final Object item : JsonLdUtils.arrayify(value)) {
            if (!(item instanceof String) || !CONTAINER_KEYWORDS.contains(item)) {
                throw new JsonLdError(Error.INVALID_CONTAINER_MAPPING, value);
            }
            if (!container.contains(item)) {
                container.add((String) item);
            }
        }
        if (container.isEmpty()) {
            throw new JsonLdError(Error.INVALID_CONTAINER_MAPPING, value);
        }
        boolean valid;
        if (container.contains(LIST)) {
            valid = container.size() == 1;
        } else if (container.contains(GRAPH)) {
            valid = !(container.contains(ID) && container.contains(INDEX));
            for (final String c : container) {
                if (!GRAPH.equals(c) && !ID.equals(c) && !INDEX.equals(c) && !SET.equals(c)) {
                    valid = false;
                }
            }
        } else {
            valid = container.size() == 1 || (container.size() == 2 && container.contains(SET));
        }
        if (!valid) {
            throw new JsonLdError(Error.INVALID_CONTAINER_MAPPING, value);
        }
        return container;
    }

    /**
     * IRI Expansion Algorithm
     *
     * http://www.w3.org/TR/json-ld11-api/#iri-expansion
     *
     * @param value
     * @param relative
     * @param vocab
     * @param context
     * @param defined
     * @return
     * @throws JsonLdError
     */
    @SuppressWarnings("unchecked")
    String expandIri(String value, boolean relative, boolean vocab, Map<String, Object> context,
            Map<String, Boolean> defined) throws JsonLdError {
        // 1)
        if (value == null || JsonLdUtils.isKeyword(value)) {
            return value;
        }
        // 2)
        if (JsonLdUtils.hasKeywordForm(value)) {
            return null;
        }
        // 3)
        if (context != null && context.containsKey(value)
                && !Boolean.TRUE.equals(defined.get(value))) {
            createTermDefinition(context, value, defined, new ArrayList<String>(), false, false);
        }
        // 4) 5)
        final Map<String, Object> td = (Map<String, Object>) termDefinitions.get(value);
        if (td != null) {
            final Object id = td.get(ID);
            if (JsonLdUtils.isKeyword(id)) {
                return (String) id;
            }
            if (vocab) {
                return (String) id;
            }
        }
        // 6)
        final int colIndex = value.indexOf(':', 1);
        if (colIndex > 0) {
            // 6.1)
            final String prefix = value.substring(0, colIndex);
            final String suffix = value.substring(colIndex + 1);
            // 6.2)
            if ("_".equals(prefix) || suffix.startsWith("//")) {
                return value;
            }
            // 6.3)
            if (context != null && context.containsKey(prefix)
                    && !Boolean.TRUE.equals(defined.get(prefix))) {
                createTermDefinition(context, prefix, defined, new ArrayList<String>(), false,
                        false);
            }
            // 6.4)
            final Map<String, Object> prefixDefinition = getTermDefinition(prefix);
            if (prefixDefinition != null && prefixDefinition.get(ID) != null
                    && Boolean.TRUE.equals(prefixDefinition.get(PREFIX))) {
                return prefixDefinition.get(ID) + suffix;
            }
            // 6.5)
            if (JsonLdUtils.isAbsoluteIri(value)) {
                return value;
            }
        }
        // 7)
        if (vocab && this.containsKey(VOCAB)) {
            return this.get(VOCAB) + value;
        }
        // 8)
        if (relative) {
            return JsonLdUrl.resolve((String) this.get(BASE), value);
        }
        return value;
    }

    /**
     * Expands an IRI against this context outside of context processing.
     */
    public String expandIri(String value, boolean relative, boolean vocab) throws JsonLdError {
        return expandIri(value, relative, vocab, null, null);
    }

    /**
     * IRI Compaction Algorithm
     *
     * http://www.w3.org/TR/json-ld11-api/#iri-compaction
     *
     * Compacts an IRI or keyword into a term or prefix if it can be. If the
     * IRI has an associated value it may be passed.
     *
     * @param iri
     *            the IRI to compact.
     * @param value
     *            the value to check or null.
     * @param relativeToVocab
     *            options for how to compact IRIs: vocab: true to split after
     *            vocab, false not to.
     * @param reverse
     *            true if a reverse property is being compacted, false if not.
     *
     * @return the compacted term, prefix, keyword alias, or the original IRI.
     * @throws JsonLdError
     *             when the IRI would be confused with a compact IRI
     */
    @SuppressWarnings("unchecked")
    String compactIri(String iri, Object value, boolean relativeToVocab, boolean reverse)
            throws JsonLdError {
        // 1)
        if (iri == null) {
            return null;
        }

        // 3)
        if (relativeToVocab && getInverse().containsKey(iri)) {
            // 3.1)
            String defaultLanguage = (String) this.get(LANGUAGE);
            if (this.containsKey(DIRECTION)) {
                defaultLanguage = ((defaultLanguage == null ? "" : defaultLanguage) + "_"
                        + this.get(DIRECTION)).toLowerCase();
            } else if (defaultLanguage == null) {
                defaultLanguage = NONE;
            }

            // 3.2)
            if (value instanceof Map && ((Map<String, Object>) value).containsKey(PRESERVE)) {
                value = JsonLdUtils.arrayify(((Map<String, Object>) value).get(PRESERVE)).get(0);
            }

            // 3.3)
            final List<String> containers = new ArrayList<String>();

            // 3.4)
            String typeLanguage = LANGUAGE;
            String typeLanguageValue = NULL;

            // 3.5)
            if (value instanceof Map && ((Map<String, Object>) value).containsKey(INDEX)
                    && !JsonLdUtils.isGraph(value)) {
                containers.add(INDEX);
                containers.add(INDEX + SET);
            }

            if (reverse) {
                // 3.6)
                typeLanguage = TYPE;
                typeLanguageValue = REVERSE;
                containers.add(SET);
            } else if (JsonLdUtils.isList(value)) {
                // 3.7)
                final Map<String, Object> valueMap = (Map<String, Object>) value;
                if (!valueMap.containsKey(INDEX)) {
                    containers.add(LIST);
                }
                final List<Object> list = (List<Object>) valueMap.get(LIST);
                String commonType = null;
                String commonLanguage = list.isEmpty() ? defaultLanguage : null;
                for (final Object item : list) {
                    String itemLanguage = NONE;
                    String itemType = NONE;
                    if (JsonLdUtils.isValue(item)) {
                        final Map<String, Object> itemMap = (Map<String, Object>) item;
                        if (itemMap.containsKey(DIRECTION)) {
                            itemLanguage = ((itemMap.containsKey(LANGUAGE)
                                    ? (String) itemMap.get(LANGUAGE)
                                    : "") + "_" + itemMap.get(DIRECTION)).toLowerCase();
                        } else if (itemMap.containsKey(LANGUAGE)) {
                            itemLanguage = ((String) itemMap.get(LANGUAGE)).toLowerCase();
                        } else if (itemMap.containsKey(TYPE)) {
                            itemType = (String) itemMap.get(TYPE);
                        } else {
                            itemLanguage = NULL;
                        }
                    } else {
                        itemType = ID;
                    }
                    if (commonLanguage == null) {
                        commonLanguage = itemLanguage;
                    } else if (!commonLanguage.equals(itemLanguage)
                            && JsonLdUtils.isValue(item)) {
                        commonLanguage = NONE;
                    }
                    if (commonType == null) {
                        commonType = itemType;
                    } else if (!commonType.equals(itemType)) {
                        commonType = NONE;
                    }
                    if (NONE.equals(commonLanguage) && NONE.equals(commonType)) {
                        break;
                    }
                }
                commonLanguage = commonLanguage == null ? NONE : commonLanguage;
                commonType = commonType == null ? NONE : commonType;
                if (!NONE.equals(commonType)) {
                    typeLanguage = TYPE;
                    typeLanguageValue = commonType;
                } else {
                    typeLanguageValue = commonLanguage;
                }
            } else if (JsonLdUtils.isGraph(value)) {
                // 3.8)
                final Map<String, Object> valueMap = (Map<String, Object>) value;
                if (valueMap.containsKey(INDEX)) {
                    containers.add(GRAPH + INDEX);
                    containers.add(GRAPH + INDEX + SET);
                }
                if (valueMap.containsKey(ID)) {
                    containers.add(GRAPH + ID);
                    containers.add(GRAPH + ID + SET);
                }
                containers.add(GRAPH);
                containers.add(GRAPH + SET);
                containers.add(SET);
                if (!valueMap.containsKey(INDEX)) {
                    containers.add(GRAPH + INDEX);
                    containers.add(GRAPH + INDEX + SET);
                }
                if (!valueMap.containsKey(ID)) {
                    containers.add(GRAPH + ID);
                    containers.add(GRAPH + ID + SET);
                }
                containers.add(INDEX);
                containers.add(INDEX + SET);
                typeLanguage = TYPE;
                typeLanguageValue = ID;
            } else {
                // 3.9)
                if (JsonLdUtils.isValue(value)) {
                    final Map<String, Object> valueMap = (Map<String, Object>) value;
                    if (valueMap.containsKey(DIRECTION) && !valueMap.containsKey(INDEX)) {
                        typeLanguageValue = ((valueMap.containsKey(LANGUAGE)
                                ? (String) valueMap.get(LANGUAGE)
                                : "") + "_" + valueMap.get(DIRECTION)).toLowerCase();
                        containers.add(LANGUAGE);
                        containers.add(LANGUAGE + SET);
                    } else if (valueMap.containsKey(LANGUAGE) && !valueMap.containsKey(INDEX)) {
                        typeLanguageValue = ((String) valueMap.get(LANGUAGE)).toLowerCase();
                        containers.add(LANGUAGE);
                        containers.add(LANGUAGE + SET);
                    } else if (valueMap.containsKey(TYPE)) {
                        typeLanguage = TYPE;
                        typeLanguageValue = (String) valueMap.get(TYPE);
                    }
                } else {
                    typeLanguage = TYPE;
                    typeLanguageValue = ID;
                    containers.add(ID);
                    containers.add(ID + SET);
                    containers.add(TYPE);
                    containers.add(SET + TYPE);
                }
                containers.add(SET);
            }

            // 3.10)
            containers.add(NONE);

            if (options.isProcessingMode11()) {
                // 3.11)
                if (!(value instanceof Map) || !((Map<String, Object>) value).containsKey(INDEX)) {
                    containers.add(INDEX);
                    containers.add(INDEX + SET);
                }
                // 3.12)
                if (JsonLdUtils.isValue(value) && ((Map<String, Object>) value).size() == 1) {
                    containers.add(LANGUAGE);
                    containers.add(LANGUAGE + SET);
                }
            }

            // 3.13)
            if (typeLanguageValue == null) {
                typeLanguageValue = NULL;
            }

            // 3.14)
            final List<String> preferredValues = new ArrayList<String>();

            // 3.15)
            if (REVERSE.equals(typeLanguageValue)) {
                preferredValues.add(REVERSE);
            }

            // 3.16)
            if ((REVERSE.equals(typeLanguageValue) || ID.equals(typeLanguageValue))
                    && value instanceof Map && ((Map<String, Object>) value).containsKey(ID)) {
                final Object id = ((Map<String, Object>) value).get(ID);
                final String result = id instanceof String
                        ? compactIri((String) id, null, true, false)
                        : null;
                final Map<String, Object> resultDefinition = result == null ? null
                        : getTermDefinition(result);
                if (resultDefinition != null && id.equals(resultDefinition.get(ID))) {
                    preferredValues.add(VOCAB);
                    preferredValues.add(ID);
                    preferredValues.add(NONE);
                } else {
                    preferredValues.add(ID);
                    preferredValues.add(VOCAB);
                    preferredValues.add(NONE);
                }
            } else {
                // 3.17)
                preferredValues.add(typeLanguageValue);
                preferredValues.add(NONE);
                if (JsonLdUtils.isList(value)
                        && ((List<Object>) ((Map<String, Object>) value).get(LIST)).isEmpty()) {
                    typeLanguage = ANY;
                }
            }

            // 3.18)
            preferredValues.add(ANY);

            // 3.19)
            final List<String> withDirection = new ArrayList<String>();
            for (final String preferred : preferredValues) {
                final int underscore = preferred.indexOf('_');
                if (underscore >= 0) {
                    withDirection.add(preferred.substring(underscore));
                }
            }
            preferredValues.addAll(withDirection);

            // 3.20)
            final String term = selectTerm(iri, containers, typeLanguage, preferredValues);

            // 3.21)
            if (term != null) {
                return term;
            }
        }

        // 4)
        if (relativeToVocab && this.containsKey(VOCAB)) {
            final String vocab = (String) this.get(VOCAB);
            if (iri.startsWith(vocab) && iri.length() > vocab.length()) {
                final String suffix = iri.substring(vocab.length());
                if (!termDefinitions.containsKey(suffix)) {
                    return suffix;
                }
            }
        }

        // 5)
        String compactIRI = null;

        // 6)
        for (final String term : termDefinitions.keySet()) {
            final Map<String, Object> termDefinition = (Map<String, Object>) termDefinitions
                    .get(term);
            if (termDefinition == null) {
                continue;
            }
            final String termIri = (String) termDefinition.get(ID);
            // 6.1)
            if (termIri == null || iri.equals(termIri) || !iri.startsWith(termIri)
                    || !Boolean.TRUE.equals(termDefinition.get(PREFIX))) {
                continue;
            }
            // 6.2)
            final String candidate = term + ":" + iri.substring(termIri.length());
            // 6.3)
            final Map<String, Object> candidateDefinition = getTermDefinition(candidate);
            if ((compactIRI == null
                    || JsonLdUtils.compareShortestLeast(candidate, compactIRI) < 0)
                    && (!termDefinitions.containsKey(candidate) || (candidateDefinition != null
                            && iri.equals(candidateDefinition.get(ID)) && value == null))) {
                compactIRI = candidate;
            }
        }

        // 7)
        if (compactIRI != null) {
            return compactIRI;
        }

        // 8)
        final int colIndex = iri.indexOf(':', 1);
        if (colIndex > 0 && !iri.substring(colIndex + 1).startsWith("//")) {
            final Map<String, Object> schemeDefinition = getTermDefinition(
                    iri.substring(0, colIndex));
            if (schemeDefinition != null && Boolean.TRUE.equals(schemeDefinition.get(PREFIX))) {
                throw new JsonLdError(Error.IRI_CONFUSED_WITH_PREFIX, iri);
            }
        }

        // 9)
        if (!relativeToVocab && options.getCompactToRelative()) {
            return JsonLdUrl.removeBase(this.get(BASE), iri);
        }

        // 10)
        return iri;
    }

    /**
     * Return a map of potential RDF prefixes based on the JSON-LD Term
     * Definitions in this context.
     * <p>
     * No guarantees of the prefixes are given, beyond that it will not contain
     * ":".
     *
     * @param onlyCommonPrefixes
     *            If <code>true</code>, the result will not include "not so
     *            useful" prefixes, such as "term1": "http://example.com/term1",
     *            e.g. all IRIs will end with "/" or "#". If <code>false</code>,
     *            all potential prefixes are returned.
     *
     * @return A map from prefix string to IRI string
     */
    @SuppressWarnings("unchecked")
    public Map<String, String> getPrefixes(boolean onlyCommonPrefixes) {
        final Map<String, String> prefixes = new LinkedHashMap<String, String>();
        for (final String term : termDefinitions.keySet()) {
            if (term.contains(":")) {
                continue;
            }
            final Map<String, Object> termDefinition = (Map<String, Object>) termDefinitions
                    .get(term);
            if (termDefinition == null) {
                continue;
            }
            final String id = (String) termDefinition.get(ID);
            if (id == null) {
                continue;
            }
            if (term.startsWith("@") || id.startsWith("@")) {
                continue;
            }
            if (!onlyCommonPrefixes || id.endsWith("/") || id.endsWith("#")) {
                prefixes.put(term, id);
            }
        }
        return prefixes;
    }

    /**
     * Inverse Context Creation
     *
     * http://www.w3.org/TR/json-ld11-api/#inverse-context-creation
     *
     * Generates an inverse context for use in the compaction algorithm, if not
     * already generated for the given active context.
     *
     * @return the inverse context.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getInverse() {
        // lazily create inverse
        if (inverse != null) {
            return inverse;
        }

        // 1)
        inverse = new LinkedHashMap<String, Object>();

        // 2)
        String defaultLanguage = NONE;
        if (this.get(LANGUAGE) != null) {
            defaultLanguage = ((String) this.get(LANGUAGE)).toLowerCase();
        }

        // create term selections for each mapping in the context, ordered by
        // shortest and then lexicographically least
        final List<String> terms = new ArrayList<String>(termDefinitions.keySet());
        Collections.sort(terms, JsonLdUtils.SHORTEST_LEAST);

        for (final String term : terms) {
            final Map<String, Object> definition = (Map<String, Object>) termDefinitions
                    .get(term);
            // 3.1)
            if (definition == null || definition.get(ID) == null) {
                continue;
            }

            // 3.2)
            String container = NONE;
            final List<String> containerMapping = (List<String>) definition.get(CONTAINER);
            if (containerMapping != null && !containerMapping.isEmpty()) {
                final List<String> sorted = new ArrayList<String>(containerMapping);
                Collections.sort(sorted);
                final StringBuilder joined = new StringBuilder();
                for (final String c : sorted) {
                    joined.append(c);
                }
                container = joined.toString();
            }

            // 3.3)
            final String iri = (String) definition.get(ID);

            // 3.4 + 3.5)
            Map<String, Object> containerMap = (Map<String, Object>) inverse.get(iri);
            if (containerMap == null) {
                containerMap = new LinkedHashMap<String, Object>();
                inverse.put(iri, containerMap);
            }

            // 3.6 + 3.7)
            Map<String, Object> typeLanguageMap = (Map<String, Object>) containerMap
                    .get(container);
            if (typeLanguageMap == null) {
                typeLanguageMap = new LinkedHashMap<String, Object>();
                typeLanguageMap.put(LANGUAGE, new LinkedHashMap<String, Object>());
                typeLanguageMap.put(TYPE, new LinkedHashMap<String, Object>());
                final Map<String, Object> anyMap = new LinkedHashMap<String, Object>();
                anyMap.put(NONE, term);
                typeLanguageMap.put(ANY, anyMap);
                containerMap.put(container, typeLanguageMap);
            }
            final Map<String, Object> languageMap = (Map<String, Object>) typeLanguageMap
                    .get(LANGUAGE);
            final Map<String, Object> typeMap = (Map<String, Object>) typeLanguageMap.get(TYPE);

            if (Boolean.TRUE.equals(definition.get(REVERSE))) {
                // 3.8)
                putIfAbsent(typeMap, REVERSE, term);
            } else if (NONE.equals(definition.get(TYPE))) {
                // 3.9)
                putIfAbsent(languageMap, ANY, term);
                putIfAbsent(typeMap, ANY, term);
            } else if (definition.containsKey(TYPE)) {
                // 3.10)
                putIfAbsent(typeMap, (String) definition.get(TYPE), term);
            } else if (definition.containsKey(LANGUAGE) && definition.containsKey(DIRECTION)) {
                // 3.11)
                final String language = (String) definition.get(LANGUAGE);
                final String direction = (String) definition.get(DIRECTION);
                final String langDir;
                if (language != null && direction != null) {
                    langDir = (language + "_" + direction).toLowerCase();
                } else if (language != null) {
                    langDir = language.toLowerCase();
                } else if (direction != null) {
                    langDir = "_" + direction;
                } else {
                    langDir = NULL;
                }
                putIfAbsent(languageMap, langDir, term);
            } else if (definition.containsKey(LANGUAGE)) {
                // 3.12)
                final String language = (String) definition.get(LANGUAGE);
                putIfAbsent(languageMap, language == null ? NULL : language.toLowerCase(),
                        term);
            } else if (definition.containsKey(DIRECTION)) {
                // 3.13)
                final String direction = (String) definition.get(DIRECTION);
                putIfAbsent(languageMap, direction == null ? NONE : "_" + direction, term);
            } else if (this.containsKey(DIRECTION)) {
                // 3.14)
                final String langDir = ((this.get(LANGUAGE) == null ? ""
                        : (String) this.get(LANGUAGE)) + "_" + this.get(DIRECTION)).toLowerCase();
                putIfAbsent(languageMap, langDir, term);
                putIfAbsent(languageMap, NONE, term);
                putIfAbsent(typeMap, NONE, term);
            } else {
                // 3.15)
                putIfAbsent(languageMap, defaultLanguage, term);
                putIfAbsent(languageMap, NONE, term);
                putIfAbsent(typeMap, NONE, term);
            }
        }

        // 4)
        return inverse;
    }

    private static void putIfAbsent(Map<String, Object> map, String key, String term) {
        if (!map.containsKey(key)) {
            map.put(key, term);
        }
    }

    /**
     * Term Selection
     *
     * http://www.w3.org/TR/json-ld11-api/#term-selection
     *
     * This algorithm, invoked via the IRI Compaction algorithm, makes use of an
     * active context's inverse context to find the term that is best used to
     * compact an IRI. Other information about a value associated with the IRI
     * is given, including which container mappings and which type mapping or
     * language mapping would be best used to express the value.
     *
     * @return the selected term.
     */
    @SuppressWarnings("unchecked")
    private String selectTerm(String iri, List<String> containers, String typeLanguage,
            List<String> preferredValues) {
        final Map<String, Object> inv = getInverse();
        // 1)
        final Map<String, Object> containerMap = (Map<String, Object>) inv.get(iri);
        // 2)
        for (final String container : containers) {
            // 2.1)
            if (!containerMap.containsKey(container)) {
                continue;
            }
            // 2.2)
            final Map<String, Object> typeLanguageMap = (Map<String, Object>) containerMap
                    .get(container);
            // 2.3)
            final Map<String, Object> valueMap = (Map<String, Object>) typeLanguageMap
                    .get(typeLanguage);
            // 2.4 )
            for (final String item : preferredValues) {
                // 2.4.1
                if (!valueMap.containsKey(item)) {
                    continue;
                }
                // 2.4.2
                return (String) valueMap.get(item);
            }
        }
        // 3)
        return null;
    }

    /**
     * Value Compaction Algorithm
     *
     * http://www.w3.org/TR/json-ld11-api/#value-compaction
     *
     * @param activeProperty
     *            The Active Property
     * @param value
     *            The value to compact
     * @return The compacted value: a scalar, or a copy of value with its keys
     *         compacted
     * @throws JsonLdError
     *             on IRI compaction errors
     */
    @SuppressWarnings("unchecked")
    public Object compactValue(String activeProperty, Map<String, Object> value)
            throws JsonLdError {
        // 1)
        final String language = getLanguageMapping(activeProperty);
        // 2)
        final String direction = getDirectionMapping(activeProperty);
        final String typeMapping = getTypeMapping(activeProperty);
        final boolean preserveIndex = value.containsKey(INDEX)
                && !getContainer(activeProperty).contains(INDEX);

        // 4)
        if (value.containsKey(ID)) {
            final boolean onlyId = value.size() == 1
                    || (value.size() == 2 && value.containsKey(INDEX) && !preserveIndex);
            if (onlyId && ID.equals(typeMapping)) {
                return compactIri((String) value.get(ID), null, false, false);
            }
            if (onlyId && VOCAB.equals(typeMapping)) {
                return compactIri((String) value.get(ID), null, true, false);
            }
            return value;
        }

        final Object valueValue = value.get(VALUE);
        final Object type = value.get(TYPE);
        if (!preserveIndex) {
            // 5)
            if (type != null && type.equals(typeMapping)) {
                return valueValue;
            }
            if (!NONE.equals(typeMapping) && type == null) {
                // 7)
                if (!(valueValue instanceof String)) {
                    return valueValue;
                }
                // 8)
                final Object valueLanguage = value.get(LANGUAGE);
                final Object valueDirection = value.get(DIRECTION);
                final boolean languageMatches = valueLanguage == null ? language == null
                        : language != null
                                && ((String) valueLanguage).equalsIgnoreCase(language);
                final boolean directionMatches = valueDirection == null ? direction == null
                        : valueDirection.equals(direction);
                if (languageMatches && directionMatches) {
                    return valueValue;
                }
            }
        }

        // 6) and 9) compact the keys, and any @type value
        final Map<String, Object> result = new LinkedHashMap<String, Object>();
        for (final Map.Entry<String, Object> entry : value.entrySet()) {
            Object v = entry.getValue();
            if (TYPE.equals(entry.getKey()) && v instanceof String) {
                v = compactIri((String) v, null, true, false);
            }
            result.put(compactIri(entry.getKey(), null, true, false), v);
        }
        return result;
    }

    /**
     * Value Expansion Algorithm
     *
     * http://www.w3.org/TR/json-ld11-api/#value-expansion
     *
     * @param activeProperty
     *            The Active Property
     * @param value
     *            The value to expand
     * @return The expanded value
     * @throws JsonLdError
     *             If there was an error during expansion.
     */
    public Map<String, Object> expandValue(String activeProperty, Object value)
            throws JsonLdError {
        final Map<String, Object> rval = new LinkedHashMap<String, Object>();
        final Map<String, Object> td = getTermDefinition(activeProperty);
        final Object typeMapping = td == null ? null : td.get(TYPE);
        // 1)
        if (ID.equals(typeMapping) && value instanceof String) {
            rval.put(ID, expandIri((String) value, true, false, null, null));
            return rval;
        }
        // 2)
        if (VOCAB.equals(typeMapping) && value instanceof String) {
            rval.put(ID, expandIri((String) value, true, true, null, null));
            return rval;
        }
        // 3)
        rval.put(VALUE, value);
        // 4)
        if (typeMapping != null && !ID.equals(typeMapping) && !VOCAB.equals(typeMapping)
                && !NONE.equals(typeMapping)) {
            rval.put(TYPE, typeMapping);
        }
        // 5)
        else if (value instanceof String) {
            // 5.1) 5.2)
            final String language = getLanguageMapping(activeProperty);
            if (language != null) {
                rval.put(LANGUAGE, language);
            }
            // 5.3) 5.4)
            final String direction = getDirectionMapping(activeProperty);
            if (direction != null) {
                rval.put(DIRECTION, direction);
            }
        }
        // 6)
        return rval;
    }

    /**
     * Serializes this context back to a JSON-LD @context object, for use in
     * compacted output.
     *
     * @return a map with a single @context entry
     * @throws JsonLdError
     *             on IRI compaction errors
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> serialize() throws JsonLdError {
        final Map<String, Object> ctx = new LinkedHashMap<String, Object>();
        if (this.get(BASE) != null && !this.get(BASE).equals(options.getBase())) {
            ctx.put(BASE, this.get(BASE));
        }
        if (this.get(LANGUAGE) != null) {
            ctx.put(LANGUAGE, this.get(LANGUAGE));
        }
        if (this.get(DIRECTION) != null) {
            ctx.put(DIRECTION, this.get(DIRECTION));
        }
        if (this.get(VOCAB) != null) {
            ctx.put(VOCAB, this.get(VOCAB));
        }
        for (final String term : termDefinitions.keySet()) {
            final Map<String, Object> definition = (Map<String, Object>) termDefinitions
                    .get(term);
            if (definition == null || definition.get(ID) == null) {
                ctx.put(term, null);
                continue;
            }
            final String id = (String) definition.get(ID);
            final boolean reverse = Boolean.TRUE.equals(definition.get(REVERSE));
            final List<String> container = (List<String>) definition.get(CONTAINER);
            if (!reverse && container == null && !definition.containsKey(TYPE)
                    && !definition.containsKey(LANGUAGE) && !definition.containsKey(DIRECTION)
                    && !definition.containsKey(CONTEXT) && !definition.containsKey(NEST)
                    && !definition.containsKey(PROTECTED)) {
                ctx.put(term, compactIri(id, null, false, false));
            } else {
                final Map<String, Object> defn = new LinkedHashMap<String, Object>();
                defn.put(reverse ? REVERSE : ID, compactIri(id, null, false, false));
                if (definition.containsKey(TYPE)) {
                    final String type = (String) definition.get(TYPE);
                    defn.put(TYPE, JsonLdUtils.isKeyword(type) ? type
                            : compactIri(type, null, false, false));
                }
                if (container != null) {
                    defn.put(CONTAINER, container.size() == 1 ? container.get(0) : container);
                }
                if (definition.containsKey(LANGUAGE)) {
                    defn.put(LANGUAGE, definition.get(LANGUAGE));
                }
                if (definition.containsKey(DIRECTION)) {
                    defn.put(DIRECTION, definition.get(DIRECTION));
                }
                if (definition.containsKey(INDEX)) {
                    defn.put(INDEX, definition.get(INDEX));
                }
                if (definition.containsKey(CONTEXT)) {
                    defn.put(CONTEXT, definition.get(CONTEXT));
                }
                if (definition.containsKey(NEST)) {
                    defn.put(NEST, definition.get(NEST));
                }
                if (definition.containsKey(PROTECTED)) {
                    defn.put(PROTECTED, true);
                }
                ctx.put(term, defn);
            }
        }

        final Map<String, Object> rval = new LinkedHashMap<String, Object>();
        if (!ctx.isEmpty()) {
            rval.put(CONTEXT, ctx);
        }
        return rval;
    }

    /**
     * Retrieve container mapping.
     *
     * @param property
     *            The Property to get a container mapping for.
     * @return The container mapping if any, else an empty list
     */
    @SuppressWarnings("unchecked")
    public List<String> getContainer(String property) {
        final Map<String, Object> td = getTermDefinition(property);
        if (td == null || td.get(CONTAINER) == null) {
            return Collections.emptyList();
        }
        return (List<String>) td.get(CONTAINER);
    }

    public boolean hasContainerMapping(String property, String val) {
        return getContainer(property).contains(val);
    }

    public boolean isReverseProperty(String property) {
        final Map<String, Object> td = getTermDefinition(property);
        return td != null && Boolean.TRUE.equals(td.get(REVERSE));
    }

    public String getTypeMapping(String property) {
        final Map<String, Object> td = getTermDefinition(property);
        return td == null ? null : (String) td.get(TYPE);
    }

    public String getLanguageMapping(String property) {
        final Map<String, Object> td = getTermDefinition(property);
        if (td != null && td.containsKey(LANGUAGE)) {
            return (String) td.get(LANGUAGE);
        }
        return (String) this.get(LANGUAGE);
    }

    public String getDirectionMapping(String property) {
        final Map<String, Object> td = getTermDefinition(property);
        if (td != null && td.containsKey(DIRECTION)) {
            return (String) td.get(DIRECTION);
        }
        return (String) this.get(DIRECTION);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getTermDefinition(String key) {
        if (key == null) {
            return null;
        }
        return (Map<String, Object>) termDefinitions.get(key);
    }

    /**
     * The property-scoped context of a term, or null. Callers tell a scoped
     * null context apart from no context through {@link #hasScopedContext}.
     */
    public Object getScopedContext(String term) {
        final Map<String, Object> td = getTermDefinition(term);
        return td == null ? null : td.get(CONTEXT);
    }

    public boolean hasScopedContext(String term) {
        final Map<String, Object> td = getTermDefinition(term);
        return td != null && td.containsKey(CONTEXT);
    }

    @SuppressWarnings("unchecked")
    public boolean hasProtectedTerms() {
        for (final Object definition : termDefinitions.values()) {
            if (definition != null
                    && Boolean.TRUE.equals(((Map<String, Object>) definition).get(PROTECTED))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the context that was active before a non-propagated context was
     * applied, or this context when there is none.
     */
    public Context revertToPreviousContext() {
        if (previousContext == null) {
            return this;
        }
        return previousContext;
    }

    public Context getPreviousContext() {
        return previousContext;
    }

    @Override
    public Context clone() {
        final Context rval = (Context) super.clone();
        // term definitions are never mutated once created, so a shallow copy
        // of the map is enough
        rval.termDefinitions = new LinkedHashMap<String, Object>(this.termDefinitions);
        rval.inverse = null;
        return rval;
    }
}
