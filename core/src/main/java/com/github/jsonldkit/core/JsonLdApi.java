package com.github.jsonldkit.core;

import static com.github.jsonldkit.core.JsonLdConsts.RDF_FIRST;
import static com.github.jsonldkit.core.JsonLdConsts.RDF_LIST;
import static com.github.jsonldkit.core.JsonLdConsts.RDF_NIL;
import static com.github.jsonldkit.core.JsonLdConsts.RDF_REST;
import static com.github.jsonldkit.core.JsonLdConsts.RDF_TYPE;
import static com.github.jsonldkit.core.JsonLdUtils.isKeyword;
import static com.github.jsonldkit.utils.Obj.newMap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.jsonldkit.core.JsonLdConsts.Embed;
import com.github.jsonldkit.core.JsonLdError.Error;

/**
 * A container object to maintain state relating to JsonLdOptions and the
 * current Context, and push these into the relevant algorithms in
 * JsonLdProcessor as necessary.
 *
 * @author tristan
 */
public class JsonLdApi {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLdApi.class);

    private static final Set<String> VALUE_OBJECT_KEYS = new HashSet<String>(
            Arrays.asList(JsonLdConsts.DIRECTION, JsonLdConsts.INDEX, JsonLdConsts.LANGUAGE,
                    JsonLdConsts.TYPE, JsonLdConsts.VALUE));

    private static final Set<String> FRAMING_KEYWORDS = new HashSet<String>(
            Arrays.asList(JsonLdConsts.DEFAULT, JsonLdConsts.EMBED, JsonLdConsts.EXPLICIT,
                    JsonLdConsts.OMIT_DEFAULT, JsonLdConsts.REQUIRE_ALL));

    JsonLdOptions opts;

    Object value = null;

    Context context = null;

    /**
     * Set while expanding a frame, which keeps wildcards and framing flags.
     */
    boolean frameExpansion = false;

    private final IdentifierIssuer issuer = new IdentifierIssuer("_:b");

    public JsonLdApi() {
        this(new JsonLdOptions(""));
    }

    public JsonLdApi(JsonLdOptions opts) {
        this.opts = opts == null ? new JsonLdOptions("") : opts;
    }

    public JsonLdApi(Object input, JsonLdOptions opts) throws JsonLdError {
        this(input, null, opts);
    }

    public JsonLdApi(Object input, Object context, JsonLdOptions opts) throws JsonLdError {
        this(opts);
        initialize(input, context);
    }

    /**
     * Initializes this object by cloning the input object using
     * {@link JsonLdUtils#clone(Object)}, and by parsing the context using
     * {@link Context#parse(Object)}.
     */
    private void initialize(Object input, Object context) throws JsonLdError {
        if (input instanceof List || input instanceof Map) {
            this.value = JsonLdUtils.clone(input);
        }
        this.context = new Context(opts);
        if (context != null) {
            this.context = this.context.parse(context);
        }
    }

    /**
     * Compaction Algorithm
     *
     * http://www.w3.org/TR/json-ld11-api/#compaction-algorithm
     *
     * @param activeCtx
     *            The Active Context
     * @param activeProperty
     *            The Active Property
     * @param element
     *            The current element
     * @param compactArrays
     *            True to compact arrays.
     * @return The compacted JSON-LD object.
     * @throws JsonLdError
     *             If there was an error during compaction.
     */
    @SuppressWarnings("unchecked")
    public Object compact(Context activeCtx, String activeProperty, Object element,
            boolean compactArrays) throws JsonLdError {
        // 1)
        final Context typeScopedContext = activeCtx;

        // 2)
        if (!(element instanceof Map) && !(element instanceof List)) {
            return element;
        }

        // 3)
        if (element instanceof List) {
            final List<Object> result = new ArrayList<Object>();
            for (final Object item : (List<Object>) element) {
                final Object compactedItem = compact(activeCtx, activeProperty, item,
                        compactArrays);
                if (compactedItem != null) {
                    result.add(compactedItem);
                }
            }
            if (compactArrays && result.size() == 1
                    && !JsonLdConsts.GRAPH.equals(activeProperty)
                    && !JsonLdConsts.SET.equals(activeProperty)
                    && !activeCtx.hasContainerMapping(activeProperty, JsonLdConsts.LIST)
                    && !activeCtx.hasContainerMapping(activeProperty, JsonLdConsts.SET)) {
                return result.get(0);
            }
            return result;
        }

        // 4)
        final Map<String, Object> elem = (Map<String, Object>) element;

        // 5)
        if (activeCtx.getPreviousContext() != null && !elem.containsKey(JsonLdConsts.VALUE)
                && !(elem.size() == 1 && elem.containsKey(JsonLdConsts.ID))) {
            activeCtx = activeCtx.revertToPreviousContext();
        }

        // 6)
        if (activeCtx.hasScopedContext(activeProperty)) {
            activeCtx = activeCtx.parse(activeCtx.getScopedContext(activeProperty),
                    new ArrayList<String>(), false, true, true, true);
        }

        // 7)
        if (elem.containsKey(JsonLdConsts.VALUE) || elem.containsKey(JsonLdConsts.ID)) {
            final Object compactedValue = activeCtx.compactValue(activeProperty, elem);
            if (!(compactedValue instanceof Map || compactedValue instanceof List)
                    || JsonLdConsts.JSON.equals(activeCtx.getTypeMapping(activeProperty))) {
                return compactedValue;
            }
        }

        // 8)
        if (JsonLdUtils.isList(elem)
                && activeCtx.hasContainerMapping(activeProperty, JsonLdConsts.LIST)) {
            return compact(activeCtx, activeProperty, elem.get(JsonLdConsts.LIST),
                    compactArrays);
        }

        // 9)
        final boolean insideReverse = JsonLdConsts.REVERSE.equals(activeProperty);

        // 10)
        final Map<String, Object> result = newMap();

        // 11)
        if (elem.containsKey(JsonLdConsts.TYPE)) {
            final List<String> compactedTypes = new ArrayList<String>();
            for (final Object type : JsonLdUtils.arrayify(elem.get(JsonLdConsts.TYPE))) {
                if (type instanceof String) {
                    compactedTypes
                            .add(typeScopedContext.compactIri((String) type, null, true, false));
                }
            }
            Collections.sort(compactedTypes);
            for (final String term : compactedTypes) {
                if (typeScopedContext.hasScopedContext(term)) {
                    activeCtx = activeCtx.parse(typeScopedContext.getScopedContext(term),
                            new ArrayList<String>(), false, false, false, true);
                }
            }
        }

        // 12)
        for (final String expandedProperty : JsonLdUtils.keys(elem, opts.isOrdered())) {
            final Object expandedValue = elem.get(expandedProperty);

            // 12.1)
            if (JsonLdConsts.ID.equals(expandedProperty)) {
                final Object compactedValue = expandedValue instanceof String
                        ? activeCtx.compactIri((String) expandedValue, null, false, false)
                        : expandedValue;
                result.put(activeCtx.compactIri(JsonLdConsts.ID, null, true, false),
                        compactedValue);
                continue;
            }

            // 12.2)
            if (JsonLdConsts.TYPE.equals(expandedProperty)) {
                final List<Object> compactedValue = new ArrayList<Object>();
                for (final Object type : JsonLdUtils.arrayify(expandedValue)) {
                    compactedValue.add(type instanceof String
                            ? typeScopedContext.compactIri((String) type, null, true, false)
                            : type);
                }
                final String alias = activeCtx.compactIri(JsonLdConsts.TYPE, null, true, false);
                final boolean asArray = !compactArrays || (opts.isProcessingMode11()
                        && activeCtx.hasContainerMapping(alias, JsonLdConsts.SET));
                JsonLdUtils.addValue(result, alias,
                        compactedValue.size() == 1 && !(expandedValue instanceof List)
                                ? compactedValue.get(0)
                                : compactedValue,
                        asArray || compactedValue.size() > 1);
                continue;
            }

            // 12.3)
            if (JsonLdConsts.REVERSE.equals(expandedProperty)) {
                final Map<String, Object> compactedValue = (Map<String, Object>) compact(
                        activeCtx, JsonLdConsts.REVERSE, expandedValue, compactArrays);
                for (final String property : new ArrayList<String>(compactedValue.keySet())) {
                    if (activeCtx.isReverseProperty(property)) {
                        final boolean asArray = !compactArrays
                                || activeCtx.hasContainerMapping(property, JsonLdConsts.SET);
                        JsonLdUtils.addValue(result, property, compactedValue.get(property),
                                asArray);
                        compactedValue.remove(property);
                    }
                }
                if (!compactedValue.isEmpty()) {
                    result.put(activeCtx.compactIri(JsonLdConsts.REVERSE, null, true, false),
                            compactedValue);
                }
                continue;
            }

            // 12.4)
            if (JsonLdConsts.PRESERVE.equals(expandedProperty)) {
                final Object compactedValue = compact(activeCtx, activeProperty, expandedValue,
                        compactArrays);
                if (!(compactedValue instanceof List
                        && ((List<Object>) compactedValue).isEmpty())) {
                    result.put(JsonLdConsts.PRESERVE, compactedValue);
                }
                continue;
            }

            // 12.5)
            if (JsonLdConsts.INDEX.equals(expandedProperty)
                    && activeCtx.hasContainerMapping(activeProperty, JsonLdConsts.INDEX)) {
                continue;
            }

            // 12.6)
            if (JsonLdConsts.DIRECTION.equals(expandedProperty)
                    || JsonLdConsts.INDEX.equals(expandedProperty)
                    || JsonLdConsts.LANGUAGE.equals(expandedProperty)
                    || JsonLdConsts.VALUE.equals(expandedProperty)) {
                result.put(activeCtx.compactIri(expandedProperty, null, true, false),
                        expandedValue);
                continue;
            }

            final List<Object> values = JsonLdUtils.arrayify(expandedValue);

            // 12.7)
            if (values.isEmpty()) {
                final String itemActiveProperty = activeCtx.compactIri(expandedProperty,
                        values, true, insideReverse);
                final Map<String, Object> nestResult = nestResult(activeCtx, result,
                        itemActiveProperty);
                JsonLdUtils.addValue(nestResult, itemActiveProperty, new ArrayList<Object>(),
                        true);
            }

            // 12.8)
            for (final Object expandedItem : values) {
                // 12.8.1)
                final String itemActiveProperty = activeCtx.compactIri(expandedProperty,
                        expandedItem, true, insideReverse);

                // 12.8.2)
                final Map<String, Object> nestResult = nestResult(activeCtx, result,
                        itemActiveProperty);

                // 12.8.3)
                final List<String> container = activeCtx.getContainer(itemActiveProperty);
                final boolean asArray = !compactArrays || container.contains(JsonLdConsts.SET)
                        || JsonLdConsts.GRAPH.equals(itemActiveProperty)
                        || JsonLdConsts.LIST.equals(itemActiveProperty);

                // 12.8.4) 12.8.5)
                Object inner = expandedItem;
                if (JsonLdUtils.isList(expandedItem)) {
                    inner = ((Map<String, Object>) expandedItem).get(JsonLdConsts.LIST);
                } else if (JsonLdUtils.isGraph(expandedItem)) {
                    inner = ((Map<String, Object>) expandedItem).get(JsonLdConsts.GRAPH);
                }
                Object compactedItem = compact(activeCtx, itemActiveProperty, inner,
                        compactArrays);

                // 12.8.6)
                if (JsonLdUtils.isList(expandedItem)) {
                    compactedItem = JsonLdUtils.arrayify(compactedItem);
                    if (!container.contains(JsonLdConsts.LIST)) {
                        final Map<String, Object> wrapper = newMap();
                        wrapper.put(activeCtx.compactIri(JsonLdConsts.LIST, null, true, false),
                                compactedItem);
                        final Map<String, Object> listItem = (Map<String, Object>) expandedItem;
                        if (listItem.containsKey(JsonLdConsts.INDEX)) {
                            wrapper.put(
                                    activeCtx.compactIri(JsonLdConsts.INDEX, null, true, false),
                                    listItem.get(JsonLdConsts.INDEX));
                        }
                        JsonLdUtils.addValue(nestResult, itemActiveProperty, wrapper, asArray);
                    } else {
                        if (!opts.isProcessingMode11()
                                && nestResult.containsKey(itemActiveProperty)) {
                            throw new JsonLdError(Error.COMPACTION_TO_LIST_OF_LISTS,
                                    "There cannot be two list objects associated with an active property that has a container mapping");
                        }
                        nestResult.put(itemActiveProperty, compactedItem);
                    }
                }
                // 12.8.7)
                else if (JsonLdUtils.isGraph(expandedItem)) {
                    final Map<String, Object> graphItem = (Map<String, Object>) expandedItem;
                    if (container.contains(JsonLdConsts.GRAPH)
                            && container.contains(JsonLdConsts.ID)) {
                        final Map<String, Object> mapObject = mapObject(nestResult,
                                itemActiveProperty);
                        final String mapKey = graphItem.containsKey(JsonLdConsts.ID)
                                ? activeCtx.compactIri((String) graphItem.get(JsonLdConsts.ID),
                                        null, false, false)
                                : activeCtx.compactIri(JsonLdConsts.NONE, null, true, false);
                        JsonLdUtils.addValue(mapObject, mapKey, compactedItem, asArray);
                    } else if (container.contains(JsonLdConsts.GRAPH)
                            && container.contains(JsonLdConsts.INDEX)
                            && JsonLdUtils.isSimpleGraph(expandedItem)) {
                        final Map<String, Object> mapObject = mapObject(nestResult,
                                itemActiveProperty);
                        final String mapKey = graphItem.containsKey(JsonLdConsts.INDEX)
                                ? (String) graphItem.get(JsonLdConsts.INDEX)
                                : activeCtx.compactIri(JsonLdConsts.NONE, null, true, false);
                        JsonLdUtils.addValue(mapObject, mapKey, compactedItem, asArray);
                    } else if (container.contains(JsonLdConsts.GRAPH)
                            && JsonLdUtils.isSimpleGraph(expandedItem)) {
                        if (compactedItem instanceof List
                                && ((List<Object>) compactedItem).size() > 1) {
                            compactedItem = newMap(activeCtx.compactIri(JsonLdConsts.INCLUDED,
                                    null, true, false), compactedItem);
                        }
                        JsonLdUtils.addValue(nestResult, itemActiveProperty, compactedItem,
                                asArray);
                    } else {
                        final Map<String, Object> wrapper = newMap(
                                activeCtx.compactIri(JsonLdConsts.GRAPH, null, true, false),
                                compactedItem);
                        if (graphItem.containsKey(JsonLdConsts.ID)) {
                            wrapper.put(activeCtx.compactIri(JsonLdConsts.ID, null, true, false),
                                    activeCtx.compactIri((String) graphItem.get(JsonLdConsts.ID),
                                            null, false, false));
                        }
                        if (graphItem.containsKey(JsonLdConsts.INDEX)) {
                            wrapper.put(
                                    activeCtx.compactIri(JsonLdConsts.INDEX, null, true, false),
                                    graphItem.get(JsonLdConsts.INDEX));
                        }
                        JsonLdUtils.addValue(nestResult, itemActiveProperty, wrapper, asArray);
                    }
                }
                // 12.8.8)
                else if (!container.contains(JsonLdConsts.GRAPH)
                        && (container.contains(JsonLdConsts.LANGUAGE)
                                || container.contains(JsonLdConsts.INDEX)
                                || container.contains(JsonLdConsts.ID)
                                || container.contains(JsonLdConsts.TYPE))) {
                    final Map<String, Object> mapObject = mapObject(nestResult,
                            itemActiveProperty);
                    final Map<String, Object> item = (Map<String, Object>) expandedItem;
                    String mapKey = null;
                    if (container.contains(JsonLdConsts.LANGUAGE)) {
                        if (item.containsKey(JsonLdConsts.VALUE)) {
                            compactedItem = item.get(JsonLdConsts.VALUE);
                        }
                        mapKey = (String) item.get(JsonLdConsts.LANGUAGE);
                    } else if (container.contains(JsonLdConsts.INDEX)) {
                        final Map<String, Object> td = activeCtx
                                .getTermDefinition(itemActiveProperty);
                        final String indexKey = td != null && td.get(JsonLdConsts.INDEX) != null
                                ? (String) td.get(JsonLdConsts.INDEX)
                                : JsonLdConsts.INDEX;
                        if (JsonLdConsts.INDEX.equals(indexKey)) {
                            mapKey = (String) item.get(JsonLdConsts.INDEX);
                        } else if (compactedItem instanceof Map) {
                            final String containerKey = activeCtx.compactIri(indexKey, null,
                                    true, false);
                            mapKey = takeFirstString((Map<String, Object>) compactedItem,
                                    containerKey);
                        }
                    } else if (container.contains(JsonLdConsts.ID)) {
                        final String containerKey = activeCtx.compactIri(JsonLdConsts.ID, null,
                                true, false);
                        if (compactedItem instanceof Map) {
                            mapKey = (String) ((Map<String, Object>) compactedItem)
                                    .remove(containerKey);
                        }
                    } else {
                        final String containerKey = activeCtx.compactIri(JsonLdConsts.TYPE,
                                null, true, false);
                        if (compactedItem instanceof Map) {
                            final Map<String, Object> compactedMap = (Map<String, Object>) compactedItem;
                            mapKey = takeFirstString(compactedMap, containerKey);
                            final String idKey = activeCtx.compactIri(JsonLdConsts.ID, null, true,
                                    false);
                            if (compactedMap.size() == 1 && compactedMap.containsKey(idKey)) {
                                compactedItem = compact(activeCtx, itemActiveProperty,
                                        newMap(JsonLdConsts.ID, item.get(JsonLdConsts.ID)),
                                        compactArrays);
                            }
                        }
                    }
                    if (mapKey == null) {
                        mapKey = activeCtx.compactIri(JsonLdConsts.NONE, null, true, false);
                    }
                    JsonLdUtils.addValue(mapObject, mapKey, compactedItem, asArray);
                }
                // 12.8.9)
                else {
                    JsonLdUtils.addValue(nestResult, itemActiveProperty, compactedItem, asArray);
                }
            }
        }

        // 13)
        return result;
    }

    public Object compact(Context activeCtx, String activeProperty, Object element)
            throws JsonLdError {
        return compact(activeCtx, activeProperty, element, opts.getCompactArrays());
    }

    /**
     * The map that compacted values of a property go into: the result itself,
     * or the entry of its nest term.
     */
    @SuppressWarnings("unchecked")
    private static Map<String, Object> nestResult(Context activeCtx, Map<String, Object> result,
            String itemActiveProperty) throws JsonLdError {
        final Map<String, Object> td = activeCtx.getTermDefinition(itemActiveProperty);
        if (td == null || !td.containsKey(JsonLdConsts.NEST)) {
            return result;
        }
        final String nestTerm = (String) td.get(JsonLdConsts.NEST);
        if (!JsonLdConsts.NEST.equals(nestTerm)
                && !JsonLdConsts.NEST.equals(activeCtx.expandIri(nestTerm, false, true))) {
            throw new JsonLdError(Error.INVALID_NEST_VALUE, nestTerm);
        }
        Map<String, Object> nested = (Map<String, Object>) result.get(nestTerm);
        if (nested == null) {
            nested = newMap();
            result.put(nestTerm, nested);
        }
        return nested;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> mapObject(Map<String, Object> nestResult,
            String itemActiveProperty) {
        Map<String, Object> mapObject = (Map<String, Object>) nestResult.get(itemActiveProperty);
        if (mapObject == null) {
            mapObject = newMap();
            nestResult.put(itemActiveProperty, mapObject);
        }
        return mapObject;
    }

    /**
     * Removes the first value of key from the map and returns it when it is a
     * string; any remaining values stay under key.
     */
    private static String takeFirstString(Map<String, Object> map, String key) {
        if (!map.containsKey(key)) {
            return null;
        }
        final List<Object> values = new ArrayList<Object>(JsonLdUtils.arrayify(map.get(key)));
        if (values.isEmpty() || !(values.get(0) instanceof String)) {
            return null;
        }
        final String first = (String) values.remove(0);
        if (values.isEmpty()) {
            map.remove(key);
        } else if (values.size() == 1) {
            map.put(key, values.get(0));
        } else {
            map.put(key, values);
        }
        return first;
    }

    /**
     * Expansion Algorithm
     *
     * http://www.w3.org/TR/json-ld11-api/#expansion-algorithm
     *
     * @param activeCtx
     *            The Active Context
     * @param activeProperty
     *            The Active Property
     * @param element
     *            The current element
     * @return The expanded JSON-LD object.
     * @throws JsonLdError
     *             If there was an error during expansion.
     */
    public Object expand(Context activeCtx, String activeProperty, Object element)
            throws JsonLdError {
        return expand(activeCtx, activeProperty, element, frameExpansion, false);
    }

    public Object expand(Context activeCtx, Object element) throws JsonLdError {
        return expand(activeCtx, null, element);
    }

    private Object expand(Context activeCtx, String activeProperty, Object element,
            boolean frameExpansion, boolean fromMap) throws JsonLdError {
        return expand(activeCtx, activeProperty, element, frameExpansion, fromMap, false);
    }

    @SuppressWarnings("unchecked")
    private Object expand(Context activeCtx, String activeProperty, Object element,
            boolean frameExpansion, boolean fromMap, boolean insideList) throws JsonLdError {
        // 1)
        if (element == null) {
            return null;
        }

        // 2)
        if (JsonLdConsts.DEFAULT.equals(activeProperty)) {
            frameExpansion = false;
        }

        // 3)
        final boolean hasPropertyScopedContext = activeCtx.hasScopedContext(activeProperty);
        final Object propertyScopedContext = activeCtx.getScopedContext(activeProperty);

        // 4)
        if (JsonLdUtils.isScalar(element)) {
            // 4.1)
            if (activeProperty == null || JsonLdConsts.GRAPH.equals(activeProperty)) {
                return null;
            }
            // 4.2)
            if (hasPropertyScopedContext) {
                activeCtx = activeCtx.parse(propertyScopedContext, new ArrayList<String>(),
                        false, true, true, true);
            }
            // 4.3)
            return activeCtx.expandValue(activeProperty, element);
        }

        // 5)
        if (element instanceof List) {
            final List<Object> result = new ArrayList<Object>();
            final boolean listContainer = insideList
                    || activeCtx.hasContainerMapping(activeProperty, JsonLdConsts.LIST);
            for (final Object item : (List<Object>) element) {
                // 5.2.1)
                Object v = expand(activeCtx, activeProperty, item, frameExpansion, fromMap);
                // 5.2.2)
                if (listContainer && (v instanceof List || JsonLdUtils.isList(v))) {
                    throw new JsonLdError(Error.LIST_OF_LISTS,
                            "lists of lists are not permitted.");
                }
                // 5.2.3)
                if (v instanceof List) {
                    result.addAll((List<Object>) v);
                } else if (v != null) {
                    result.add(v);
                }
            }
            return result;
        }

        // 6)
        final Map<String, Object> elem = (Map<String, Object>) element;

        // 7)
        if (activeCtx.getPreviousContext() != null && !fromMap) {
            boolean revert = true;
            for (final String key : elem.keySet()) {
                final String expandedKey = activeCtx.expandIri(key, false, true);
                if (JsonLdConsts.VALUE.equals(expandedKey)) {
                    revert = false;
                    break;
                }
                if (JsonLdConsts.ID.equals(expandedKey) && elem.size() == 1) {
                    revert = false;
                    break;
                }
            }
            if (revert) {
                activeCtx = activeCtx.revertToPreviousContext();
            }
        }

        // 8)
        if (hasPropertyScopedContext) {
            activeCtx = activeCtx.parse(propertyScopedContext, new ArrayList<String>(), false,
                    true, true, true);
        }

        // 9)
        if (elem.containsKey(JsonLdConsts.CONTEXT)) {
            activeCtx = activeCtx.parse(elem.get(JsonLdConsts.CONTEXT));
        }

        // 10)
        final Context typeScopedContext = activeCtx;

        // 11) and 12)
        String inputType = null;
        final List<String> sortedKeys = JsonLdUtils.keys(elem, true);
        for (final String key : sortedKeys) {
            if (!JsonLdConsts.TYPE.equals(activeCtx.expandIri(key, false, true))) {
                continue;
            }
            final List<String> terms = new ArrayList<String>();
            for (final Object term : JsonLdUtils.arrayify(elem.get(key))) {
                if (term instanceof String) {
                    terms.add((String) term);
                }
            }
            Collections.sort(terms);
            for (final String term : terms) {
                if (typeScopedContext.hasScopedContext(term)) {
                    activeCtx = activeCtx.parse(typeScopedContext.getScopedContext(term),
                            new ArrayList<String>(), false, false, false, true);
                }
            }
            if (inputType == null && !terms.isEmpty()) {
                final List<Object> raw = JsonLdUtils.arrayify(elem.get(key));
                final Object last = raw.get(raw.size() - 1);
                if (last instanceof String) {
                    inputType = activeCtx.expandIri((String) last, false, true);
                }
            }
        }

        // 13) and 14)
        Map<String, Object> result = newMap();
        expandObject(activeCtx, typeScopedContext, activeProperty, elem, result, inputType,
                frameExpansion);

        final String expandedActiveProperty = activeCtx.expandIri(activeProperty, false, true);
        Object rval = result;

        // 15)
        if (result.containsKey(JsonLdConsts.VALUE)) {
            // 15.1)
            for (final String key : result.keySet()) {
                if (!VALUE_OBJECT_KEYS.contains(key)) {
                    throw new JsonLdError(Error.INVALID_VALUE_OBJECT,
                            "value object has unknown keys: " + key);
                }
            }
            if (result.containsKey(JsonLdConsts.TYPE) && (result.containsKey(JsonLdConsts.LANGUAGE)
                    || result.containsKey(JsonLdConsts.DIRECTION))) {
                throw new JsonLdError(Error.INVALID_VALUE_OBJECT,
                        "an element containing @value may not contain both @type and either @language or @direction");
            }
            final Object rvalue = result.get(JsonLdConsts.VALUE);
            final Object type = result.get(JsonLdConsts.TYPE);
            if (JsonLdConsts.JSON.equals(type)) {
                // 15.2) any JSON value is allowed
            } else if (rvalue == null
                    || (rvalue instanceof List && ((List<Object>) rvalue).isEmpty())) {
                // 15.3)
                return null;
            } else if (!frameExpansion && !(rvalue instanceof String)
                    && result.containsKey(JsonLdConsts.LANGUAGE)) {
                // 15.4)
                throw new JsonLdError(Error.INVALID_LANGUAGE_TAGGED_VALUE,
                        "when an element contains @language, @value must be a string");
            } else if (!frameExpansion && type != null
                    && (!(type instanceof String) || !JsonLdUtils.isAbsoluteIri((String) type)
                            || ((String) type).startsWith("_:"))) {
                // 15.5)
                throw new JsonLdError(Error.INVALID_TYPED_VALUE,
                        "value of @type must be an IRI");
            }
        }
        // 16)
        else if (result.containsKey(JsonLdConsts.TYPE)
                && !(result.get(JsonLdConsts.TYPE) instanceof List)) {
            final List<Object> types = new ArrayList<Object>();
            types.add(result.get(JsonLdConsts.TYPE));
            result.put(JsonLdConsts.TYPE, types);
        }
        // 17)
        else if (result.containsKey(JsonLdConsts.SET) || result.containsKey(JsonLdConsts.LIST)) {
            // 17.1)
            if (result.size() > (result.containsKey(JsonLdConsts.INDEX) ? 2 : 1)) {
                throw new JsonLdError(Error.INVALID_SET_OR_LIST_OBJECT,
                        "@set or @list may only contain @index");
            }
            // 17.2)
            if (result.containsKey(JsonLdConsts.SET)) {
                rval = result.get(JsonLdConsts.SET);
            }
        }

        if (rval instanceof Map) {
            result = (Map<String, Object>) rval;
            // 18)
            if (result.size() == 1 && result.containsKey(JsonLdConsts.LANGUAGE)) {
                return null;
            }
            // 19)
            if (activeProperty == null || JsonLdConsts.GRAPH.equals(expandedActiveProperty)) {
                // 19.1)
                if (result.isEmpty() || result.containsKey(JsonLdConsts.VALUE)
                        || result.containsKey(JsonLdConsts.LIST)) {
                    return null;
                }
                // 19.2)
                if (!frameExpansion && result.size() == 1
                        && result.containsKey(JsonLdConsts.ID)) {
                    return null;
                }
            }
        }

        // 20)
        return rval;
    }

    /**
     * Steps 13 and 14 of the Expansion Algorithm: expands the entries of
     * element into result, then the entries of its nested values.
     */
    @SuppressWarnings("unchecked")
    private void expandObject(Context activeCtx, Context typeScopedContext,
            String activeProperty, Map<String, Object> element, Map<String, Object> result,
            String inputType, boolean frameExpansion) throws JsonLdError {
        final List<String> nests = new ArrayList<String>();
        final String expandedActiveProperty = activeCtx.expandIri(activeProperty, false, true);

        // 13)
        for (final String key : JsonLdUtils.keys(element, opts.isOrdered())) {
            final Object value = element.get(key);
            // 13.1)
            if (JsonLdConsts.CONTEXT.equals(key)) {
                continue;
            }
            // 13.2)
            final String expandedProperty = activeCtx.expandIri(key, false, true);
            // 13.3)
            if (expandedProperty == null
                    || (expandedProperty.indexOf(':') < 0 && !isKeyword(expandedProperty))) {
                if (key.startsWith("@")) {
                    LOG.warn("Dropping unknown keyword-like key: {}", key);
                }
                continue;
            }
            Object expandedValue = null;

            // 13.4)
            if (isKeyword(expandedProperty)) {
                // 13.4.1)
                if (JsonLdConsts.REVERSE.equals(expandedActiveProperty)) {
                    throw new JsonLdError(Error.INVALID_REVERSE_PROPERTY_MAP,
                            "a keyword cannot be used as a @reverse propery");
                }
                // 13.4.2)
                if (result.containsKey(expandedProperty)
                        && !JsonLdConsts.INCLUDED.equals(expandedProperty)
                        && !JsonLdConsts.TYPE.equals(expandedProperty)) {
                    throw new JsonLdError(Error.COLLIDING_KEYWORDS,
                            expandedProperty + " already exists in result");
                }
                // 13.4.3)
                if (JsonLdConsts.ID.equals(expandedProperty)) {
                    if (value instanceof String) {
                        expandedValue = activeCtx.expandIri((String) value, true, false);
                    } else if (frameExpansion && JsonLdUtils.isEmptyObject(value)) {
                        expandedValue = JsonLdUtils.arrayify(newMap());
                    } else if (frameExpansion && value instanceof List
                            && allStrings((List<Object>) value)) {
                        final List<Object> ids = new ArrayList<Object>();
                        for (final Object id : (List<Object>) value) {
                            ids.add(activeCtx.expandIri((String) id, true, false));
                        }
                        expandedValue = ids;
                    } else if (frameExpansion && JsonLdUtils.isEmptyObject(
                            value instanceof List && ((List<Object>) value).size() == 1
                                    ? ((List<Object>) value).get(0)
                                    : null)) {
                        expandedValue = value;
                    } else {
                        throw new JsonLdError(Error.INVALID_ID_VALUE,
                                "value of @id must be a string");
                    }
                }
                // 13.4.4)
                else if (JsonLdConsts.TYPE.equals(expandedProperty)) {
                    expandedValue = expandTypeValue(activeCtx, typeScopedContext, value,
                            frameExpansion);
                    if (result.containsKey(JsonLdConsts.TYPE)) {
                        final List<Object> merged = new ArrayList<Object>(
                                JsonLdUtils.arrayify(result.get(JsonLdConsts.TYPE)));
                        merged.addAll(JsonLdUtils.arrayify(expandedValue));
                        expandedValue = merged;
                    }
                }
                // 13.4.5)
                else if (JsonLdConsts.GRAPH.equals(expandedProperty)) {
                    expandedValue = JsonLdUtils.arrayify(expand(activeCtx, JsonLdConsts.GRAPH,
                            value, frameExpansion, false));
                }
                // 13.4.6)
                else if (JsonLdConsts.INCLUDED.equals(expandedProperty)) {
                    if (!opts.isProcessingMode11()) {
                        continue;
                    }
                    final List<Object> included = JsonLdUtils
                            .arrayify(expand(activeCtx, null, value, frameExpansion, false));
                    for (final Object node : included) {
                        if (!JsonLdUtils.isNodeObject(node)) {
                            throw new JsonLdError(Error.INVALID_INCLUDED_VALUE,
                                    "values of @included must be node objects");
                        }
                    }
                    if (result.containsKey(JsonLdConsts.INCLUDED)) {
                        final List<Object> merged = new ArrayList<Object>(
                                (List<Object>) result.get(JsonLdConsts.INCLUDED));
                        merged.addAll(included);
                        expandedValue = merged;
                    } else {
                        expandedValue = included;
                    }
                }
                // 13.4.7)
                else if (JsonLdConsts.VALUE.equals(expandedProperty)) {
                    if (JsonLdConsts.JSON.equals(inputType)) {
                        if (!opts.isProcessingMode11()) {
                            throw new JsonLdError(Error.INVALID_VALUE_OBJECT_VALUE,
                                    "@json values need json-ld-1.1");
                        }
                        expandedValue = value;
                    } else if (value == null || JsonLdUtils.isScalar(value)) {
                        expandedValue = value;
                    } else if (frameExpansion && (JsonLdUtils.isEmptyObject(value)
                            || value instanceof List)) {
                        expandedValue = JsonLdUtils.arrayify(value);
                    } else {
                        throw new JsonLdError(Error.INVALID_VALUE_OBJECT_VALUE,
                                "value of " + expandedProperty + " must be a scalar or null");
                    }
                    if (expandedValue == null) {
                        result.put(JsonLdConsts.VALUE, null);
                        continue;
                    }
                }
                // 13.4.8)
                else if (JsonLdConsts.LANGUAGE.equals(expandedProperty)) {
                    if (value instanceof String) {
                        expandedValue = ((String) value).toLowerCase();
                    } else if (frameExpansion && (JsonLdUtils.isEmptyObject(value)
                            || value instanceof List)) {
                        expandedValue = JsonLdUtils.arrayify(value);
                    } else {
                        throw new JsonLdError(Error.INVALID_LANGUAGE_TAGGED_STRING,
                                "Value of " + expandedProperty + " must be a string");
                    }
                }
                // 13.4.9)
                else if (JsonLdConsts.DIRECTION.equals(expandedProperty)) {
                    if (!opts.isProcessingMode11()) {
                        continue;
                    }
                    if ("ltr".equals(value) || "rtl".equals(value)) {
                        expandedValue = value;
                    } else if (frameExpansion && (JsonLdUtils.isEmptyObject(value)
                            || value instanceof List)) {
                        expandedValue = JsonLdUtils.arrayify(value);
                    } else {
                        throw new JsonLdError(Error.INVALID_BASE_DIRECTION, value);
                    }
                }
                // 13.4.10)
                else if (JsonLdConsts.INDEX.equals(expandedProperty)) {
                    if (!(value instanceof String)) {
                        throw new JsonLdError(Error.INVALID_INDEX_VALUE,
                                "Value of " + expandedProperty + " must be a string");
                    }
                    expandedValue = value;
                }
                // 13.4.11)
                else if (JsonLdConsts.LIST.equals(expandedProperty)) {
                    // 13.4.11.1)
                    if (activeProperty == null
                            || JsonLdConsts.GRAPH.equals(expandedActiveProperty)) {
                        continue;
                    }
                    // 13.4.11.2)
                    expandedValue = JsonLdUtils.arrayify(
                            expand(activeCtx, activeProperty, value, frameExpansion, false, true));
                    for (final Object o : (List<Object>) expandedValue) {
                        if (JsonLdUtils.isList(o)) {
                            throw new JsonLdError(Error.LIST_OF_LISTS,
                                    "A list may not contain another list");
                        }
                    }
                }
                // 13.4.12)
                else if (JsonLdConsts.SET.equals(expandedProperty)) {
                    expandedValue = expand(activeCtx, activeProperty, value, frameExpansion,
                            false);
                }
                // 13.4.13)
                else if (JsonLdConsts.REVERSE.equals(expandedProperty)) {
                    if (!(value instanceof Map)) {
                        throw new JsonLdError(Error.INVALID_REVERSE_VALUE,
                                "@reverse value must be an object");
                    }
                    expandedValue = expand(activeCtx, JsonLdConsts.REVERSE, value,
                            frameExpansion, false);
                    if (expandedValue instanceof Map) {
                        expandReverse((Map<String, Object>) expandedValue, result);
                    }
                    continue;
                }
                // 13.4.14)
                else if (JsonLdConsts.NEST.equals(expandedProperty)) {
                    if (!nests.contains(key)) {
                        nests.add(key);
                    }
                    continue;
                }
                // 13.4.15)
                else if (frameExpansion && FRAMING_KEYWORDS.contains(expandedProperty)) {
                    expandedValue = expand(activeCtx, expandedProperty, value, frameExpansion,
                            false);
                    if (expandedValue == null) {
                        expandedValue = value;
                    }
                } else {
                    LOG.debug("Ignoring keyword {} outside its context", expandedProperty);
                    continue;
                }

                // 13.4.16)
                if (expandedValue != null) {
                    result.put(expandedProperty, expandedValue);
                }
                continue;
            }

            // 13.5)
            final List<String> containerMapping = activeCtx.getContainer(key);

            // 13.6)
            if (JsonLdConsts.JSON.equals(activeCtx.getTypeMapping(key))) {
                final Map<String, Object> json = newMap(JsonLdConsts.VALUE, value);
                json.put(JsonLdConsts.TYPE, JsonLdConsts.JSON);
                expandedValue = json;
            }
            // 13.7)
            else if (containerMapping.contains(JsonLdConsts.LANGUAGE) && value instanceof Map) {
                expandedValue = expandLanguageMap(activeCtx, key, (Map<String, Object>) value);
            }
            // 13.8)
            else if ((containerMapping.contains(JsonLdConsts.INDEX)
                    || containerMapping.contains(JsonLdConsts.TYPE)
                    || containerMapping.contains(JsonLdConsts.ID)) && value instanceof Map) {
                expandedValue = expandIndexMap(activeCtx, key, containerMapping,
                        (Map<String, Object>) value, frameExpansion);
            }
            // 13.9)
            else {
                expandedValue = expand(activeCtx, key, value, frameExpansion, false);
            }

            // 13.10)
            if (expandedValue == null) {
                continue;
            }

            // 13.11)
            if (containerMapping.contains(JsonLdConsts.LIST) && !JsonLdUtils.isList(expandedValue)) {
                expandedValue = newMap(JsonLdConsts.LIST, JsonLdUtils.arrayify(expandedValue));
            }

            // 13.12)
            if (containerMapping.contains(JsonLdConsts.GRAPH)
                    && !containerMapping.contains(JsonLdConsts.ID)
                    && !containerMapping.contains(JsonLdConsts.INDEX)) {
                final List<Object> graphs = new ArrayList<Object>();
                for (final Object ev : JsonLdUtils.arrayify(expandedValue)) {
                    graphs.add(newMap(JsonLdConsts.GRAPH, JsonLdUtils.arrayify(ev)));
                }
                expandedValue = graphs;
            }

            // 13.13)
            if (activeCtx.isReverseProperty(key)) {
                final Map<String, Object> reverseMap = reverseMap(result);
                for (final Object item : JsonLdUtils.arrayify(expandedValue)) {
                    if (JsonLdUtils.isValue(item) || JsonLdUtils.isList(item)) {
                        throw new JsonLdError(Error.INVALID_REVERSE_PROPERTY_VALUE, item);
                    }
                    JsonLdUtils.addValue(reverseMap, expandedProperty, item, true);
                }
            }
            // 13.14)
            else {
                JsonLdUtils.addValue(result, expandedProperty, expandedValue, true);
            }
        }

        // 14)
        if (opts.isOrdered()) {
            Collections.sort(nests);
        }
        for (final String nestingKey : nests) {
            for (final Object nestedValue : JsonLdUtils.arrayify(element.get(nestingKey))) {
                if (!(nestedValue instanceof Map)) {
                    throw new JsonLdError(Error.INVALID_NEST_VALUE, nestingKey);
                }
                for (final String nestedKey : ((Map<String, Object>) nestedValue).keySet()) {
                    if (JsonLdConsts.VALUE.equals(activeCtx.expandIri(nestedKey, false, true))) {
                        throw new JsonLdError(Error.INVALID_NEST_VALUE,
                                "nested value may not contain @value");
                    }
                }
                expandObject(activeCtx, typeScopedContext, activeProperty,
                        (Map<String, Object>) nestedValue, result, inputType, frameExpansion);
            }
        }
    }

    private static boolean allStrings(List<Object> values) {
        for (final Object v : values) {
            if (!(v instanceof String)) {
                return false;
            }
        }
        return true;
    }

    @SuppressWarnings("unchecked")
    private Object expandTypeValue(Context activeCtx, Context typeScopedContext, Object value,
            boolean frameExpansion) throws JsonLdError {
        if (frameExpansion && JsonLdUtils.isEmptyObject(value)) {
            return value;
        }
        if (frameExpansion && value instanceof Map
                && ((Map<String, Object>) value).containsKey(JsonLdConsts.DEFAULT)) {
            final Object def = ((Map<String, Object>) value).get(JsonLdConsts.DEFAULT);
            if (!(def instanceof String)) {
                throw new JsonLdError(Error.INVALID_TYPE_VALUE, value);
            }
            return newMap(JsonLdConsts.DEFAULT, typeScopedContext.expandIri((String) def, true,
                    true));
        }
        if (value instanceof String) {
            return typeScopedContext.expandIri((String) value, true, true);
        }
        if (value instanceof List) {
            final List<Object> expanded = new ArrayList<Object>();
            for (final Object v : (List<Object>) value) {
                if (v instanceof String) {
                    expanded.add(typeScopedContext.expandIri((String) v, true, true));
                } else if (frameExpansion && JsonLdUtils.isEmptyObject(v)) {
                    expanded.add(v);
                } else {
                    throw new JsonLdError(Error.INVALID_TYPE_VALUE,
                            "@type value must be a string or array of strings");
                }
            }
            return expanded;
        }
        throw new JsonLdError(Error.INVALID_TYPE_VALUE,
                "@type value must be a string or array of strings");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> reverseMap(Map<String, Object> result) {
        Map<String, Object> reverseMap = (Map<String, Object>) result.get(JsonLdConsts.REVERSE);
        if (reverseMap == null) {
            reverseMap = newMap();
            result.put(JsonLdConsts.REVERSE, reverseMap);
        }
        return reverseMap;
    }

    /**
     * 13.4.13.3) and 13.4.13.4): merges an expanded @reverse map into result.
     */
    @SuppressWarnings("unchecked")
    private static void expandReverse(Map<String, Object> expandedValue,
            Map<String, Object> result) throws JsonLdError {
        if (expandedValue.containsKey(JsonLdConsts.REVERSE)) {
            final Map<String, Object> reverse = (Map<String, Object>) expandedValue
                    .get(JsonLdConsts.REVERSE);
            for (final Map.Entry<String, Object> entry : reverse.entrySet()) {
                JsonLdUtils.addValue(result, entry.getKey(), entry.getValue(), true);
            }
        }
        if (expandedValue.size() > (expandedValue.containsKey(JsonLdConsts.REVERSE) ? 1 : 0)) {
            final Map<String, Object> reverseMap = reverseMap(result);
            for (final Map.Entry<String, Object> entry : expandedValue.entrySet()) {
                if (JsonLdConsts.REVERSE.equals(entry.getKey())) {
                    continue;
                }
                for (final Object item : JsonLdUtils.arrayify(entry.getValue())) {
                    if (JsonLdUtils.isList(item) || JsonLdUtils.isValue(item)) {
                        throw new JsonLdError(Error.INVALID_REVERSE_PROPERTY_VALUE, item);
                    }
                    JsonLdUtils.addValue(reverseMap, entry.getKey(), item, true);
                }
            }
        }
    }

    /**
     * 13.7) expands a language map.
     */
    private List<Object> expandLanguageMap(Context activeCtx, String key,
            Map<String, Object> languageMap) throws JsonLdError {
        final List<Object> expandedValue = new ArrayList<Object>();
        final String direction = activeCtx.getDirectionMapping(key);
        for (final String language : JsonLdUtils.keys(languageMap, opts.isOrdered())) {
            final String expandedLanguage = activeCtx.expandIri(language, false, true);
            for (final Object item : JsonLdUtils.arrayify(languageMap.get(language))) {
                if (item == null) {
                    continue;
                }
                if (!(item instanceof String)) {
                    throw new JsonLdError(Error.INVALID_LANGUAGE_MAP_VALUE,
                            "Expected " + item + " to be a string");
                }
                final Map<String, Object> tmp = newMap(JsonLdConsts.VALUE, item);
                if (!JsonLdConsts.NONE.equals(expandedLanguage)) {
                    tmp.put(JsonLdConsts.LANGUAGE, language.toLowerCase());
                }
                if (direction != null) {
                    tmp.put(JsonLdConsts.DIRECTION, direction);
                }
                expandedValue.add(tmp);
            }
        }
        return expandedValue;
    }

    /**
     * 13.8) expands an index, @id or @type map.
     */
    @SuppressWarnings("unchecked")
    private List<Object> expandIndexMap(Context activeCtx, String key, List<String> container,
            Map<String, Object> value, boolean frameExpansion) throws JsonLdError {
        final List<Object> expandedValue = new ArrayList<Object>();
        final Map<String, Object> td = activeCtx.getTermDefinition(key);
        final String indexKey = td != null && td.get(JsonLdConsts.INDEX) != null
                ? (String) td.get(JsonLdConsts.INDEX)
                : JsonLdConsts.INDEX;
        final boolean typeOrIdMap = container.contains(JsonLdConsts.ID)
                || container.contains(JsonLdConsts.TYPE);

        for (final String index : JsonLdUtils.keys(value, opts.isOrdered())) {
            // 13.8.3.1) - 13.8.3.3)
            Context mapContext = activeCtx;
            if (container.contains(JsonLdConsts.TYPE)) {
                mapContext = typeOrIdMap ? activeCtx.revertToPreviousContext() : activeCtx;
                if (mapContext.hasScopedContext(index)) {
                    mapContext = mapContext.parse(mapContext.getScopedContext(index),
                            new ArrayList<String>(), false, false, false, true);
                }
            }

            // 13.8.3.4)
            final String expandedIndex = activeCtx.expandIri(index, false, true);

            // 13.8.3.5) 13.8.3.6)
            final List<Object> indexValues = JsonLdUtils.arrayify(expand(mapContext, key,
                    JsonLdUtils.arrayify(value.get(index)), frameExpansion, true));

            // 13.8.3.7)
            for (Object item : indexValues) {
                if (container.contains(JsonLdConsts.GRAPH) && !JsonLdUtils.isGraph(item)) {
                    item = newMap(JsonLdConsts.GRAPH, JsonLdUtils.arrayify(item));
                }
                final Map<String, Object> itemMap = (Map<String, Object>) item;
                if (container.contains(JsonLdConsts.INDEX)
                        && !JsonLdConsts.INDEX.equals(indexKey)
                        && !JsonLdConsts.NONE.equals(expandedIndex)) {
                    // property-valued index
                    final Object reExpandedIndex = activeCtx.expandValue(indexKey, index);
                    final String expandedIndexKey = activeCtx.expandIri(indexKey, false, true);
                    final List<Object> indexPropertyValues = new ArrayList<Object>();
                    indexPropertyValues.add(reExpandedIndex);
                    if (itemMap.containsKey(expandedIndexKey)) {
                        indexPropertyValues
                                .addAll(JsonLdUtils.arrayify(itemMap.get(expandedIndexKey)));
                    }
                    if (JsonLdUtils.isValue(itemMap)) {
                        throw new JsonLdError(Error.INVALID_VALUE_OBJECT,
                                "property-valued index on a value object");
                    }
                    itemMap.put(expandedIndexKey, indexPropertyValues);
                } else if (container.contains(JsonLdConsts.INDEX)
                        && !itemMap.containsKey(JsonLdConsts.INDEX)
                        && !JsonLdConsts.NONE.equals(expandedIndex)) {
                    itemMap.put(JsonLdConsts.INDEX, index);
                } else if (container.contains(JsonLdConsts.ID)
                        && !itemMap.containsKey(JsonLdConsts.ID)
                        && !JsonLdConsts.NONE.equals(expandedIndex)) {
                    itemMap.put(JsonLdConsts.ID, activeCtx.expandIri(index, true, false));
                } else if (container.contains(JsonLdConsts.TYPE)
                        && !JsonLdConsts.NONE.equals(expandedIndex)) {
                    final List<Object> types = new ArrayList<Object>();
                    types.add(expandedIndex);
                    if (itemMap.containsKey(JsonLdConsts.TYPE)) {
                        types.addAll(JsonLdUtils.arrayify(itemMap.get(JsonLdConsts.TYPE)));
                    }
                    itemMap.put(JsonLdConsts.TYPE, types);
                }
                expandedValue.add(itemMap);
            }
        }
        return expandedValue;
    }

    /**
     * Node Map Generation
     *
     * http://www.w3.org/TR/json-ld11-api/#node-map-generation
     *
     * Embedded nodes become references, input blank node labels are relabelled
     * through this instance's {@link IdentifierIssuer}.
     */
    void generateNodeMap(Object element, Map<String, Object> nodeMap) throws JsonLdError {
        generateNodeMap(element, nodeMap, JsonLdConsts.DEFAULT, null, null, null);
    }

    void generateNodeMap(Object element, Map<String, Object> nodeMap, String activeGraph)
            throws JsonLdError {
        generateNodeMap(element, nodeMap, activeGraph, null, null, null);
    }

    @SuppressWarnings("unchecked")
    void generateNodeMap(Object element, Map<String, Object> nodeMap, String activeGraph,
            Object activeSubject, String activeProperty, Map<String, Object> list)
            throws JsonLdError {
        // 1)
        if (element instanceof List) {
            for (final Object item : (List<Object>) element) {
                generateNodeMap(item, nodeMap, activeGraph, activeSubject, activeProperty, list);
            }
            return;
        }

        // for convenience
        final Map<String, Object> elem = (Map<String, Object>) element;

        // 2)
        Map<String, Object> graph = (Map<String, Object>) nodeMap.get(activeGraph);
        if (graph == null) {
            graph = newMap();
            nodeMap.put(activeGraph, graph);
        }
        final Map<String, Object> subjectNode = activeSubject instanceof String
                ? (Map<String, Object>) graph.get(activeSubject)
                : null;

        // 3)
        List<Object> types = null;
        if (elem.containsKey(JsonLdConsts.TYPE)) {
            types = new ArrayList<Object>();
            for (final Object type : JsonLdUtils.arrayify(elem.get(JsonLdConsts.TYPE))) {
                types.add(JsonLdUtils.isBlankNodeId(type) ? issuer.getId((String) type) : type);
            }
        }

        // 4)
        if (JsonLdUtils.isValue(elem)) {
            final Map<String, Object> valueObject = newMap();
            valueObject.putAll(elem);
            if (types != null) {
                valueObject.put(JsonLdConsts.TYPE, types.get(0));
            }
            if (list == null) {
                JsonLdUtils.mergeValue(subjectNode, activeProperty, valueObject);
            } else {
                ((List<Object>) list.get(JsonLdConsts.LIST)).add(valueObject);
            }
            return;
        }

        // 5)
        if (JsonLdUtils.isList(elem)) {
            final Map<String, Object> result = newMap(JsonLdConsts.LIST,
                    new ArrayList<Object>());
            generateNodeMap(elem.get(JsonLdConsts.LIST), nodeMap, activeGraph, activeSubject,
                    activeProperty, result);
            if (list == null) {
                JsonLdUtils.mergeValue(subjectNode, activeProperty, result);
            } else {
                ((List<Object>) list.get(JsonLdConsts.LIST)).add(result);
            }
            return;
        }

        // 6)
        // 6.1)
        String id = (String) elem.get(JsonLdConsts.ID);
        if (id == null) {
            id = issuer.getId();
        } else if (id.startsWith("_:")) {
            id = issuer.getId(id);
        }

        // 6.2)
        Map<String, Object> node = (Map<String, Object>) graph.get(id);
        if (node == null) {
            node = newMap(JsonLdConsts.ID, id);
            graph.put(id, node);
        }

        // 6.3)
        if (activeSubject instanceof Map) {
            JsonLdUtils.mergeValue(node, activeProperty, activeSubject);
        }
        // 6.4)
        else if (activeProperty != null) {
            final Map<String, Object> reference = newMap(JsonLdConsts.ID, id);
            if (list == null) {
                JsonLdUtils.mergeValue(subjectNode, activeProperty, reference);
            } else {
                ((List<Object>) list.get(JsonLdConsts.LIST)).add(reference);
            }
        }

        // 6.5)
        if (types != null) {
            for (final Object type : types) {
                JsonLdUtils.mergeValue(node, JsonLdConsts.TYPE, type);
            }
        }

        // 6.6)
        if (elem.containsKey(JsonLdConsts.INDEX)) {
            final Object elemIndex = elem.get(JsonLdConsts.INDEX);
            if (node.containsKey(JsonLdConsts.INDEX)) {
                if (!JsonLdUtils.deepCompare(node.get(JsonLdConsts.INDEX), elemIndex)) {
                    throw new JsonLdError(Error.CONFLICTING_INDEXES, id);
                }
            } else {
                node.put(JsonLdConsts.INDEX, elemIndex);
            }
        }

        // 6.7)
        if (elem.containsKey(JsonLdConsts.REVERSE)) {
            final Map<String, Object> referencedNode = newMap(JsonLdConsts.ID, id);
            final Map<String, Object> reverseMap = (Map<String, Object>) elem
                    .get(JsonLdConsts.REVERSE);
            for (final String property : reverseMap.keySet()) {
                for (final Object item : JsonLdUtils.arrayify(reverseMap.get(property))) {
                    generateNodeMap(item, nodeMap, activeGraph, referencedNode, property, null);
                }
            }
        }

        // 6.8)
        if (elem.containsKey(JsonLdConsts.GRAPH)) {
            generateNodeMap(elem.get(JsonLdConsts.GRAPH), nodeMap, id, null, null, null);
        }

        // 6.9)
        if (elem.containsKey(JsonLdConsts.INCLUDED)) {
            generateNodeMap(elem.get(JsonLdConsts.INCLUDED), nodeMap, activeGraph, null, null,
                    null);
        }

        // 6.10)
        final List<String> keys = new ArrayList<String>(elem.keySet());
        Collections.sort(keys);
        for (String property : keys) {
            if (JsonLdConsts.ID.equals(property) || JsonLdConsts.TYPE.equals(property)
                    || JsonLdConsts.INDEX.equals(property)
                    || JsonLdConsts.REVERSE.equals(property)
                    || JsonLdConsts.GRAPH.equals(property)
                    || JsonLdConsts.INCLUDED.equals(property)) {
                continue;
            }
            final Object value = elem.get(property);
            // 6.10.1)
            if (property.startsWith("_:")) {
                property = issuer.getId(property);
            }
            // 6.10.2)
            if (!node.containsKey(property)) {
                node.put(property, new ArrayList<Object>());
            }
            // 6.10.3)
            generateNodeMap(value, nodeMap, activeGraph, id, property, null);
        }
    }

    /**
     * Merge Node Maps: all graphs folded into one, for framing over the
     * merged graph.
     */
    @SuppressWarnings("unchecked")
    static Map<String, Object> mergeNodeMaps(Map<String, Object> graphs) {
        final Map<String, Object> result = newMap();
        for (final String graphName : graphs.keySet()) {
            final Map<String, Object> nodeMap = (Map<String, Object>) graphs.get(graphName);
            for (final String id : nodeMap.keySet()) {
                final Map<String, Object> node = (Map<String, Object>) nodeMap.get(id);
                Map<String, Object> mergedNode = (Map<String, Object>) result.get(id);
                if (mergedNode == null) {
                    mergedNode = newMap(JsonLdConsts.ID, id);
                    result.put(id, mergedNode);
                }
                for (final String property : node.keySet()) {
                    if (!JsonLdConsts.TYPE.equals(property) && isKeyword(property)) {
                        mergedNode.put(property, JsonLdUtils.clone(node.get(property)));
                    } else {
                        for (final Object item : JsonLdUtils.arrayify(node.get(property))) {
                            JsonLdUtils.mergeValue(mergedNode, property, JsonLdUtils.clone(item));
                        }
                    }
                }
            }
        }
        return result;
    }

    /**
     * Generates a blank node identifier for the given key, or a fresh one
     * when id is null. Identifiers come from this instance's issuer, so they
     * are consistent across one call.
     *
     * @param id
     *            The id, or null to generate a fresh, unused, blank node
     *            identifier.
     * @return A blank node identifier based on id if it was not null, or a
     *         fresh, unused, blank node identifier if it was null.
     */
    String generateBlankNodeIdentifier(String id) {
        return issuer.getId(id);
    }

    String generateBlankNodeIdentifier() {
        return issuer.getId();
    }

    /**
     * Framing state, shared across the recursion of one framing call.
     */
    private static class FramingContext {

        public Embed embed;

        public boolean explicit;

        public boolean omitDefault;

        public boolean requireAll;

        /** graph name mapped to its node map, including the merged graph */
        public Map<String, Object> graphMap;

        /** the name of the graph being framed */
        public String graph;

        public final List<String> graphStack = new ArrayList<String>();

        /** (graph, id) pairs of the nodes currently being embedded */
        public final List<String[]> subjectStack = new ArrayList<String[]>();

        /** per graph: node ids already embedded once */
        public final Map<String, Set<String>> uniqueEmbeds = new LinkedHashMap<String, Set<String>>();

        /** per graph: the output object created for each node id */
        public final Map<String, Map<String, Object>> link = new LinkedHashMap<String, Map<String, Object>>();

        public FramingContext(JsonLdOptions opts) {
            this.embed = opts.getEmbed();
            this.explicit = opts.getExplicit();
            this.omitDefault = opts.getOmitDefault();
            this.requireAll = opts.getRequireAll();
        }

        @SuppressWarnings("unchecked")
        public Map<String, Object> subjects() {
            return (Map<String, Object>) graphMap.get(graph);
        }
    }

    /**
     * Performs JSON-LD <a href="http://www.w3.org/TR/json-ld11-framing/">
     * framing</a>.
     *
     * @param input
     *            the expanded JSON-LD to frame.
     * @param frame
     *            the expanded JSON-LD frame to use.
     * @return the framed output.
     * @throws JsonLdError
     *             If the framing was not successful.
     */
    @SuppressWarnings("unchecked")
    public List<Object> frame(Object input, List<Object> frame) throws JsonLdError {
        final FramingContext state = new FramingContext(this.opts);

        final Map<String, Object> frameParam = frame != null && !frame.isEmpty()
                && frame.get(0) instanceof Map ? (Map<String, Object>) frame.get(0) : newMap();

        final Map<String, Object> graphMap = newMap();
        graphMap.put(JsonLdConsts.DEFAULT, newMap());
        generateNodeMap(input, graphMap);

        if (opts.getFrameDefault() || frameParam.containsKey(JsonLdConsts.GRAPH)) {
            state.graph = JsonLdConsts.DEFAULT;
        } else {
            state.graph = "@merged";
            graphMap.put(state.graph, mergeNodeMaps(graphMap));
        }
        state.graphMap = graphMap;

        final List<Object> framed = new ArrayList<Object>();
        frame(state, sortedIds(state.subjects()), frameParam, framed, null);
        return framed;
    }

    private static List<String> sortedIds(Map<String, Object> nodes) {
        final List<String> ids = new ArrayList<String>(nodes.keySet());
        Collections.sort(ids);
        return ids;
    }

    /**
     * Frames subjects according to the given frame.
     *
     * @param state
     *            the current framing state.
     * @param subjects
     *            the ids of the subjects to filter, in the current graph.
     * @param frame
     *            the frame.
     * @param parent
     *            the parent subject or top-level array.
     * @param property
     *            the parent property, initialized to null.
     * @throws JsonLdError
     *             If there was an error during framing.
     */
    @SuppressWarnings("unchecked")
    private void frame(FramingContext state, List<String> subjects, Map<String, Object> frame,
            Object parent, String property) throws JsonLdError {

        // 2) flags for this level
        final Embed embed = getFrameEmbed(frame, state.embed);
        final boolean explicitOn = getFrameFlag(frame, JsonLdConsts.EXPLICIT, state.explicit);
        final boolean requireAll = getFrameFlag(frame, JsonLdConsts.REQUIRE_ALL,
                state.requireAll);
        final Map<String, Object> flags = newMap();
        flags.put(JsonLdConsts.EMBED, embed.toString());
        flags.put(JsonLdConsts.EXPLICIT, explicitOn);
        flags.put(JsonLdConsts.REQUIRE_ALL, requireAll);

        // 3)
        final Map<String, Object> matches = filterSubjects(state, subjects, frame, requireAll);

        Set<String> uniqueEmbeds = state.uniqueEmbeds.get(state.graph);
        if (property == null || uniqueEmbeds == null) {
            uniqueEmbeds = new HashSet<String>();
            state.uniqueEmbeds.put(state.graph, uniqueEmbeds);
        }
        Map<String, Object> link = state.link.get(state.graph);
        if (link == null) {
            link = newMap();
            state.link.put(state.graph, link);
        }

        // 4)
        for (final String id : matches.keySet()) {
            final Map<String, Object> subject = (Map<String, Object>) matches.get(id);

            // 4.2)
            if (Embed.LINK.equals(embed) && link.containsKey(id)) {
                addFrameOutput(parent, property, link.get(id));
                continue;
            }

            // 4.1)
            final Map<String, Object> output = newMap(JsonLdConsts.ID, id);
            link.put(id, output);

            // 4.3)
            if (Embed.NEVER.equals(embed) || isCircular(state, id)) {
                addFrameOutput(parent, property, output);
                continue;
            }

            // 4.4)
            if (Embed.ONCE.equals(embed) || Embed.LAST.equals(embed)) {
                if (uniqueEmbeds.contains(id)) {
                    addFrameOutput(parent, property, output);
                    continue;
                }
                uniqueEmbeds.add(id);
            }

            state.subjectStack.add(new String[] { state.graph, id });

            // 4.5) subject is also the name of a graph
            if (state.graphMap.containsKey(id)) {
                boolean recurse;
                Map<String, Object> subframe;
                if (!frame.containsKey(JsonLdConsts.GRAPH)) {
                    recurse = !"@merged".equals(state.graph);
                    subframe = newMap();
                } else {
                    final List<Object> graphFrame = JsonLdUtils.arrayify(frame.get(JsonLdConsts.GRAPH));
                    subframe = !graphFrame.isEmpty() && graphFrame.get(0) instanceof Map
                            ? (Map<String, Object>) graphFrame.get(0)
                            : newMap();
                    recurse = !("@merged".equals(id) || JsonLdConsts.DEFAULT.equals(id));
                }
                if (recurse) {
                    state.graphStack.add(state.graph);
                    state.graph = id;
                    frame(state, sortedIds(state.subjects()), subframe, output,
                            JsonLdConsts.GRAPH);
                    state.graph = state.graphStack.remove(state.graphStack.size() - 1);
                }
            }

            // 4.6)
            if (frame.containsKey(JsonLdConsts.INCLUDED)) {
                final List<Object> includedFrame = JsonLdUtils
                        .arrayify(frame.get(JsonLdConsts.INCLUDED));
                if (!includedFrame.isEmpty() && includedFrame.get(0) instanceof Map) {
                    frame(state, subjects, (Map<String, Object>) includedFrame.get(0), output,
                            JsonLdConsts.INCLUDED);
                }
            }

            // 4.7) properties of the subject, ordered
            for (final String prop : sortedIds(subject)) {
                // 4.7.1)
                if (isKeyword(prop)) {
                    output.put(prop, JsonLdUtils.clone(subject.get(prop)));
                    continue;
                }

                // 4.7.2)
                if (explicitOn && !frame.containsKey(prop)) {
                    continue;
                }

                final List<Object> subframes = frame.containsKey(prop)
                        ? JsonLdUtils.arrayify(frame.get(prop))
                        : JsonLdUtils.arrayify(flags);
                final Map<String, Object> subframe = !subframes.isEmpty()
                        && subframes.get(0) instanceof Map
                                ? (Map<String, Object>) subframes.get(0)
                                : flags;

                // 4.7.3)
                for (final Object item : JsonLdUtils.arrayify(subject.get(prop))) {
                    if (JsonLdUtils.isList(item)) {
                        Map<String, Object> listFrame = flags;
                        if (subframe.containsKey(JsonLdConsts.LIST)) {
                            final List<Object> lf = JsonLdUtils
                                    .arrayify(subframe.get(JsonLdConsts.LIST));
                            if (!lf.isEmpty() && lf.get(0) instanceof Map) {
                                listFrame = (Map<String, Object>) lf.get(0);
                            }
                        }
                        final Map<String, Object> list = newMap(JsonLdConsts.LIST,
                                new ArrayList<Object>());
                        addFrameOutput(output, prop, list);
                        for (final Object listItem : (List<Object>) ((Map<String, Object>) item)
                                .get(JsonLdConsts.LIST)) {
                            if (JsonLdUtils.isNodeReference(listItem)) {
                                frame(state,
                                        Collections.singletonList((String) ((Map<String, Object>) listItem)
                                                .get(JsonLdConsts.ID)),
                                        listFrame, list, JsonLdConsts.LIST);
                            } else {
                                addFrameOutput(list, JsonLdConsts.LIST,
                                        JsonLdUtils.clone(listItem));
                            }
                        }
                    } else if (JsonLdUtils.isNodeReference(item)) {
                        frame(state,
                                Collections.singletonList(
                                        (String) ((Map<String, Object>) item).get(JsonLdConsts.ID)),
                                subframe, output, prop);
                    } else if (valueMatch(subframe, item)) {
                        addFrameOutput(output, prop, JsonLdUtils.clone(item));
                    }
                }
            }

            // 4.7.4) defaults, in sorted order
            for (final String prop : sortedIds(frame)) {
                if (isKeyword(prop)) {
                    continue;
                }
                final List<Object> pf = JsonLdUtils.arrayify(frame.get(prop));
                final Map<String, Object> propertyFrame = !pf.isEmpty() && pf.get(0) instanceof Map
                        ? (Map<String, Object>) pf.get(0)
                        : newMap();
                final boolean omitDefaultOn = getFrameFlag(propertyFrame,
                        JsonLdConsts.OMIT_DEFAULT, state.omitDefault);
                if (!omitDefaultOn && !output.containsKey(prop)) {
                    Object def = JsonLdConsts.NULL;
                    if (propertyFrame.containsKey(JsonLdConsts.DEFAULT)) {
                        def = JsonLdUtils.clone(propertyFrame.get(JsonLdConsts.DEFAULT));
                    }
                    final List<Object> preserved = new ArrayList<Object>();
                    preserved.add(newMap(JsonLdConsts.PRESERVE, JsonLdUtils.arrayify(def)));
                    output.put(prop, preserved);
                }
            }

            // 4.7.5) reverse properties
            if (frame.get(JsonLdConsts.REVERSE) instanceof Map) {
                final Map<String, Object> reverseFrame = (Map<String, Object>) frame
                        .get(JsonLdConsts.REVERSE);
                for (final String reverseProp : sortedIds(reverseFrame)) {
                    final List<Object> rf = JsonLdUtils.arrayify(reverseFrame.get(reverseProp));
                    final Map<String, Object> subframe = !rf.isEmpty() && rf.get(0) instanceof Map
                            ? (Map<String, Object>) rf.get(0)
                            : flags;
                    for (final String subjectId : sortedIds(state.subjects())) {
                        final Map<String, Object> node = (Map<String, Object>) state.subjects()
                                .get(subjectId);
                        if (!referencesId(node.get(reverseProp), id)) {
                            continue;
                        }
                        Map<String, Object> reverseOutput = (Map<String, Object>) output
                                .get(JsonLdConsts.REVERSE);
                        if (reverseOutput == null) {
                            reverseOutput = newMap();
                            output.put(JsonLdConsts.REVERSE, reverseOutput);
                        }
                        frame(state, Collections.singletonList(subjectId), subframe,
                                reverseOutput, reverseProp);
                    }
                }
            }

            // 4.8)
            addFrameOutput(parent, property, output);
            state.subjectStack.remove(state.subjectStack.size() - 1);
        }
    }

    @SuppressWarnings("unchecked")
    private static boolean referencesId(Object values, String id) {
        if (values == null) {
            return false;
        }
        for (final Object v : JsonLdUtils.arrayify(values)) {
            if (v instanceof Map && id.equals(((Map<String, Object>) v).get(JsonLdConsts.ID))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isCircular(FramingContext state, String id) {
        for (final String[] entry : state.subjectStack) {
            if (entry[0].equals(state.graph) && entry[1].equals(id)) {
                return true;
            }
        }
        return false;
    }

    @SuppressWarnings("unchecked")
    private static Object getFrameValue(Map<String, Object> frame, String name) {
        Object value = frame.get(name);
        if (value instanceof List) {
            if (!((List<Object>) value).isEmpty()) {
                value = ((List<Object>) value).get(0);
            }
        }
        if (value instanceof Map && ((Map<String, Object>) value).containsKey(JsonLdConsts.VALUE)) {
            value = ((Map<String, Object>) value).get(JsonLdConsts.VALUE);
        }
        return value;
    }

    private static boolean getFrameFlag(Map<String, Object> frame, String name,
            boolean thedefault) {
        final Object value = getFrameValue(frame, name);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return thedefault;
    }

    private static Embed getFrameEmbed(Map<String, Object> frame, Embed thedefault)
            throws JsonLdError {
        final Object value = getFrameValue(frame, JsonLdConsts.EMBED);
        if (value == null || value instanceof List) {
            return thedefault;
        }
        return toEmbed(value);
    }

    /**
     * Converts a JSON value of the @embed flag to an {@link Embed}.
     *
     * @param value
     *            a boolean, or one of the keywords @always, @never, @last,
     *            @link and @once
     * @return the embed mode
     * @throws JsonLdError
     *             INVALID_EMBED_VALUE for anything else
     */
    public static Embed toEmbed(Object value) throws JsonLdError {
        if (value instanceof Embed) {
            return (Embed) value;
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? Embed.LAST : Embed.NEVER;
        }
        if (value instanceof String) {
            for (final Embed embed : Embed.values()) {
                if (embed.toString().equals(value)) {
                    return embed;
                }
            }
        }
        throw new JsonLdError(Error.INVALID_EMBED_VALUE, value);
    }

    /**
     * Returns the subjects among ids that match the frame, ordered by id.
     */
    @SuppressWarnings("unchecked")
    private Map<String, Object> filterSubjects(FramingContext state, List<String> ids,
            Map<String, Object> frame, boolean requireAll) throws JsonLdError {
        final Map<String, Object> rval = new LinkedHashMap<String, Object>();
        final List<String> sorted = new ArrayList<String>(ids);
        Collections.sort(sorted);
        for (final String id : sorted) {
            final Map<String, Object> subject = (Map<String, Object>) state.subjects().get(id);
            if (subject != null && filterSubject(state, subject, frame, requireAll)) {
                rval.put(id, subject);
            }
        }
        return rval;
    }

    /**
     * Frame Matching: returns true if the subject matches the frame.
     */
    @SuppressWarnings("unchecked")
    private boolean filterSubject(FramingContext state, Map<String, Object> subject,
            Map<String, Object> frame, boolean requireAll) throws JsonLdError {
        boolean wildcard = true;
        boolean matchesSome = false;

        for (final String key : frame.keySet()) {
            boolean matchThis = false;
            final List<Object> nodeValues = subject.containsKey(key)
                    ? JsonLdUtils.arrayify(subject.get(key))
                    : new ArrayList<Object>();
            final List<Object> frameValues = JsonLdUtils.arrayify(frame.get(key));
            final boolean isEmpty = frame.get(key) == null || frameValues.isEmpty();

            if (JsonLdConsts.ID.equals(key)) {
                // match on any listed @id, or on the {} wildcard
                if (!frameValues.isEmpty() && JsonLdUtils.isEmptyObject(frameValues.get(0))) {
                    matchThis = true;
                } else {
                    matchThis = !nodeValues.isEmpty() && frameValues.contains(nodeValues.get(0));
                }
                if (!requireAll) {
                    return matchThis;
                }
            } else if (JsonLdConsts.TYPE.equals(key)) {
                wildcard = false;
                if (isEmpty) {
                    // match none
                    if (!nodeValues.isEmpty()) {
                        return false;
                    }
                    matchThis = true;
                } else if (frameValues.size() == 1
                        && JsonLdUtils.isEmptyObject(frameValues.get(0))) {
                    // wildcard: any type
                    matchThis = !nodeValues.isEmpty();
                } else {
                    for (final Object type : frameValues) {
                        if (type instanceof Map
                                && ((Map<String, Object>) type).containsKey(JsonLdConsts.DEFAULT)) {
                            matchThis = matchThis || nodeValues.isEmpty();
                        } else {
                            matchThis = matchThis || nodeValues.contains(type);
                        }
                    }
                    if (!requireAll) {
                        return matchThis;
                    }
                }
            } else if (isKeyword(key)) {
                continue;
            } else {
                final Object thisFrame = frameValues.isEmpty() ? null : frameValues.get(0);
                boolean hasDefault = false;
                if (thisFrame != null) {
                    if (!(thisFrame instanceof Map)) {
                        throw new JsonLdError(Error.INVALID_FRAME,
                                "property frames must be objects: " + key);
                    }
                    hasDefault = ((Map<String, Object>) thisFrame)
                            .containsKey(JsonLdConsts.DEFAULT);
                }
                wildcard = false;

                // absent with a default still matches
                if (nodeValues.isEmpty() && hasDefault) {
                    continue;
                }
                // [] matches only absence
                if (!nodeValues.isEmpty() && isEmpty) {
                    return false;
                }
                if (thisFrame == null) {
                    if (!nodeValues.isEmpty()) {
                        return false;
                    }
                    matchThis = true;
                } else {
                    final Map<String, Object> pattern = (Map<String, Object>) thisFrame;
                    if (JsonLdUtils.isList(pattern)) {
                        final List<Object> listPatterns = JsonLdUtils
                                .arrayify(pattern.get(JsonLdConsts.LIST));
                        final Object listValue = listPatterns.isEmpty() ? null
                                : listPatterns.get(0);
                        if (!nodeValues.isEmpty() && JsonLdUtils.isList(nodeValues.get(0))) {
                            final List<Object> nodeListValues = (List<Object>) ((Map<String, Object>) nodeValues
                                    .get(0)).get(JsonLdConsts.LIST);
                            for (final Object lv : nodeListValues) {
                                if (JsonLdUtils.isValue(listValue)
                                        ? valueMatch((Map<String, Object>) listValue, lv)
                                        : listValue instanceof Map && nodeMatch(state,
                                                (Map<String, Object>) listValue, lv,
                                                requireAll)) {
                                    matchThis = true;
                                    break;
                                }
                            }
                        }
                    } else if (JsonLdUtils.isValue(pattern)) {
                        for (final Object nv : nodeValues) {
                            if (valueMatch(pattern, nv)) {
                                matchThis = true;
                                break;
                            }
                        }
                    } else if (JsonLdUtils.isNodeReference(pattern)
                            || hasNonKeywordKeys(pattern)) {
                        for (final Object nv : nodeValues) {
                            if (nodeMatch(state, pattern, nv, requireAll)) {
                                matchThis = true;
                                break;
                            }
                        }
                    } else {
                        // {} wildcard: any value
                        matchThis = !nodeValues.isEmpty();
                    }
                }
            }

            // all non-defaulted values must match if requireAll is set
            if (!matchThis && requireAll) {
                return false;
            }
            matchesSome = matchesSome || matchThis;
        }

        // return true if wildcard or subject matches some properties
        return wildcard || matchesSome;
    }

    private static boolean hasNonKeywordKeys(Map<String, Object> pattern) {
        for (final String key : pattern.keySet()) {
            if (!isKeyword(key)) {
                return true;
            }
        }
        return false;
    }

    @SuppressWarnings("unchecked")
    private boolean nodeMatch(FramingContext state, Map<String, Object> pattern, Object value,
            boolean requireAll) throws JsonLdError {
        if (!(value instanceof Map) || !((Map<String, Object>) value).containsKey(JsonLdConsts.ID)) {
            return false;
        }
        final Map<String, Object> node = (Map<String, Object>) state.subjects()
                .get(((Map<String, Object>) value).get(JsonLdConsts.ID));
        return node != null && filterSubject(state, node, pattern, requireAll);
    }

    /**
     * Value pattern matching: @value, @type and @language each match exactly,
     * through the {} wildcard, or by absence when the pattern leaves them out.
     */
    @SuppressWarnings("unchecked")
    private static boolean valueMatch(Map<String, Object> pattern, Object value) {
        if (!(value instanceof Map)) {
            return false;
        }
        final Map<String, Object> v = (Map<String, Object>) value;
        final List<Object> v2 = patternValues(pattern, JsonLdConsts.VALUE);
        final List<Object> t2 = patternValues(pattern, JsonLdConsts.TYPE);
        final List<Object> l2 = patternValues(pattern, JsonLdConsts.LANGUAGE);
        if (v2.isEmpty() && t2.isEmpty() && l2.isEmpty()) {
            return true;
        }
        return patternMatch(v2, v.get(JsonLdConsts.VALUE), false)
                && patternMatch(t2, v.get(JsonLdConsts.TYPE), true)
                && patternMatch(l2, v.get(JsonLdConsts.LANGUAGE), true);
    }

    private static List<Object> patternValues(Map<String, Object> pattern, String key) {
        if (!pattern.containsKey(key) || pattern.get(key) == null) {
            return new ArrayList<Object>();
        }
        return JsonLdUtils.arrayify(pattern.get(key));
    }

    private static boolean patternMatch(List<Object> patterns, Object actual,
            boolean absentMatchesEmpty) {
        if (absentMatchesEmpty && actual == null && patterns.isEmpty()) {
            return true;
        }
        if (!patterns.isEmpty() && JsonLdUtils.isEmptyObject(patterns.get(0))) {
            return actual != null;
        }
        for (final Object p : patterns) {
            if (JsonLdUtils.scalarEquals(p, actual)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Adds framing output to the given parent.
     *
     * @param parent
     *            the parent to add to.
     * @param property
     *            the parent property.
     * @param output
     *            the output to add.
     */
    @SuppressWarnings("unchecked")
    private static void addFrameOutput(Object parent, String property, Object output) {
        if (parent instanceof Map) {
            List<Object> prop = (List<Object>) ((Map<String, Object>) parent).get(property);
            if (prop == null) {
                prop = new ArrayList<Object>();
                ((Map<String, Object>) parent).put(property, prop);
            }
            prop.add(output);
        } else {
            ((List<Object>) parent).add(output);
        }
    }

    /**
     * Helper class for node usages
     *
     * @author tristan
     */
    private static class UsagesNode {

        public UsagesNode(NodeMapNode node, String property, Map<String, Object> value) {
            this.node = node;
            this.property = property;
            this.value = value;
        }

        public NodeMapNode node = null;

        public String property = null;

        public Map<String, Object> value = null;
    }

    private static class NodeMapNode extends LinkedHashMap<String, Object> {

        private static final long serialVersionUID = 7347208384387460457L;

        public List<UsagesNode> usages = new ArrayList<UsagesNode>(4);

        public NodeMapNode(String id) {
            super();
            this.put(JsonLdConsts.ID, id);
        }

        /**
         * A well-formed list node is a blank node referenced exactly once,
         * with a single rdf:first and a single rdf:rest and nothing else
         * apart from an rdf:List type.
         */
        @SuppressWarnings("unchecked")
        public boolean isWellFormedListNode() {
            if (usages.size() != 1 || !JsonLdUtils.isBlankNodeId(get(JsonLdConsts.ID))) {
                return false;
            }
            int keys = 1;
            if (!(get(RDF_FIRST) instanceof List && ((List<Object>) get(RDF_FIRST)).size() == 1)) {
                return false;
            }
            keys++;
            if (!(get(RDF_REST) instanceof List && ((List<Object>) get(RDF_REST)).size() == 1)) {
                return false;
            }
            keys++;
            if (containsKey(JsonLdConsts.TYPE)) {
                final List<Object> types = (List<Object>) get(JsonLdConsts.TYPE);
                if (!(types.size() == 1 && RDF_LIST.equals(types.get(0)))) {
                    return false;
                }
                keys++;
            }
            return keys == size();
        }

        // return this node without the usages variable
        public Map<String, Object> serialize() {
            return new LinkedHashMap<String, Object>(this);
        }
    }

    /**
     * Converts RDF statements into JSON-LD.
     *
     * http://www.w3.org/TR/json-ld11-api/#serialize-rdf-as-json-ld-algorithm
     *
     * @param dataset
     *            the RDF statements.
     * @return A list of JSON-LD objects found in the given dataset.
     * @throws JsonLdError
     *             If there was an error during conversion from RDF to JSON-LD.
     */
    @SuppressWarnings("unchecked")
    public List<Object> fromRDF(final RDFDataset dataset) throws JsonLdError {
        // 1)
        final Map<String, NodeMapNode> defaultGraph = new LinkedHashMap<String, NodeMapNode>(4);
        // 2)
        final Map<String, Map<String, NodeMapNode>> graphMap = new LinkedHashMap<String, Map<String, NodeMapNode>>(
                4);
        graphMap.put(JsonLdConsts.DEFAULT, defaultGraph);

        // 3/3.1)
        for (final String name : dataset.graphNames()) {
            final List<RDFDataset.Quad> graph = dataset.getQuads(name);

            // 3.2+3.4)
            Map<String, NodeMapNode> nodeMap = graphMap.get(name);
            if (nodeMap == null) {
                nodeMap = new LinkedHashMap<String, NodeMapNode>();
                graphMap.put(name, nodeMap);
            }

            // 3.3)
            if (!JsonLdConsts.DEFAULT.equals(name) && !defaultGraph.containsKey(name)) {
                defaultGraph.put(name, new NodeMapNode(name));
            }

            // 3.5)
            for (final RDFDataset.Quad triple : graph) {
                final String subject = triple.getSubject().getValue();
                final String predicate = triple.getPredicate().getValue();
                final RDFDataset.Node object = triple.getObject();

                // 3.5.1+3.5.2)
                NodeMapNode node = nodeMap.get(subject);
                if (node == null) {
                    node = new NodeMapNode(subject);
                    nodeMap.put(subject, node);
                }

                // 3.5.3)
                if ((object.isIRI() || object.isBlankNode())
                        && !nodeMap.containsKey(object.getValue())) {
                    nodeMap.put(object.getValue(), new NodeMapNode(object.getValue()));
                }

                // 3.5.4)
                if (RDF_TYPE.equals(predicate) && (object.isIRI() || object.isBlankNode())
                        && !opts.getUseRdfType()) {
                    JsonLdUtils.mergeValue(node, JsonLdConsts.TYPE, object.getValue());
                    continue;
                }

                // 3.5.5)
                final Map<String, Object> value = object.toObject(opts.getUseNativeTypes());

                // 3.5.6+7)
                JsonLdUtils.mergeValue(node, predicate, value);

                // 3.5.8)
                if (object.isBlankNode() || object.isIRI()) {
                    // 3.5.8.1-3)
                    nodeMap.get(object.getValue()).usages
                            .add(new UsagesNode(node, predicate, value));
                }
            }
        }

        // 4)
        for (final String name : graphMap.keySet()) {
            final Map<String, NodeMapNode> graph = graphMap.get(name);

            // 4.1)
            if (!graph.containsKey(RDF_NIL)) {
                continue;
            }

            // 4.2)
            final NodeMapNode nil = graph.get(RDF_NIL);
            // 4.3)
            for (final UsagesNode usage : nil.usages) {
                // 4.3.1)
                NodeMapNode node = usage.node;
                String property = usage.property;
                Map<String, Object> head = usage.value;
                // 4.3.2)
                final List<Object> list = new ArrayList<Object>(4);
                final List<String> listNodes = new ArrayList<String>(4);
                // 4.3.3)
                while (RDF_REST.equals(property) && node.isWellFormedListNode()) {
                    // 4.3.3.1)
                    list.add(((List<Object>) node.get(RDF_FIRST)).get(0));
                    // 4.3.3.2)
                    listNodes.add((String) node.get(JsonLdConsts.ID));
                    // 4.3.3.3)
                    final UsagesNode nodeUsage = node.usages.get(0);
                    // 4.3.3.4)
                    node = nodeUsage.node;
                    property = nodeUsage.property;
                    head = nodeUsage.value;
                    // 4.3.3.5)
                    if (!JsonLdUtils.isBlankNodeId(node.get(JsonLdConsts.ID))) {
                        break;
                    }
                }
                if (list.isEmpty() && RDF_REST.equals(usage.property)) {
                    LOG.debug("Leaving malformed list ending at {} as plain nodes",
                            usage.node.get(JsonLdConsts.ID));
                    continue;
                }
                // 4.3.5)
                head.remove(JsonLdConsts.ID);
                // 4.3.6)
                Collections.reverse(list);
                // 4.3.7)
                head.put(JsonLdConsts.LIST, list);
                // 4.3.8)
                for (final String nodeId : listNodes) {
                    graph.remove(nodeId);
                }
            }
        }

        // 5)
        final List<Object> result = new ArrayList<Object>(4);
        // 6)
        final List<String> ids = new ArrayList<String>(defaultGraph.keySet());
        Collections.sort(ids);
        for (final String subject : ids) {
            final NodeMapNode node = defaultGraph.get(subject);
            // 6.1)
            if (graphMap.containsKey(subject)) {
                // 6.1.1)
                final List<Object> graphNodes = new ArrayList<Object>(4);
                node.put(JsonLdConsts.GRAPH, graphNodes);
                // 6.1.2)
                final List<String> keys = new ArrayList<String>(graphMap.get(subject).keySet());
                Collections.sort(keys);
                for (final String s : keys) {
                    final NodeMapNode n = graphMap.get(subject).get(s);
                    if (n.size() == 1 && n.containsKey(JsonLdConsts.ID)) {
                        continue;
                    }
                    graphNodes.add(n.serialize());
                }
            }
            // 6.2)
            if (node.size() == 1 && node.containsKey(JsonLdConsts.ID)) {
                continue;
            }
            result.add(node.serialize());
        }

        return result;
    }

    /**
     * Adds RDF triples for each graph in the current node map to an RDF
     * dataset.
     *
     * @return the RDF dataset.
     * @throws JsonLdError
     *             If there was an error converting from JSON-LD to RDF.
     */
    @SuppressWarnings("unchecked")
    public RDFDataset toRDF() throws JsonLdError {
        final Map<String, Object> nodeMap = newMap();
        nodeMap.put(JsonLdConsts.DEFAULT, newMap());
        generateNodeMap(this.value, nodeMap);

        final RDFDataset dataset = new RDFDataset(this);

        for (final String graphName : nodeMap.keySet()) {
            // 4.1)
            if (JsonLdUtils.isRelativeIri(graphName)) {
                continue;
            }
            final Map<String, Object> graph = (Map<String, Object>) nodeMap.get(graphName);
            dataset.graphToRDF(graphName, graph);
        }

        return dataset;
    }

    /**
     * Performs RDF dataset canonicalization on the given dataset.
     *
     * @param dataset
     *            the dataset to canonicalize.
     * @return The canonical N-Quads text when the format option asks for
     *         N-Quads, otherwise the canonical dataset
     * @throws JsonLdError
     *             If there was an error while normalizing.
     */
    public Object normalize(RDFDataset dataset) throws JsonLdError {
        return new NormalizeUtils(opts).normalize(dataset);
    }
}
