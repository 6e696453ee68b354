package com.github.jsonldkit.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Predicates and value helpers over the JSON tree (maps, lists, strings,
 * numbers, booleans and null).
 *
 * @author tristan
 */
public class JsonLdUtils {

    private static final Set<String> KEYWORDS = new HashSet<String>(Arrays.asList(
            JsonLdConsts.BASE, JsonLdConsts.CONTAINER, JsonLdConsts.CONTEXT, JsonLdConsts.DEFAULT,
            JsonLdConsts.DIRECTION, JsonLdConsts.EMBED, JsonLdConsts.EXPLICIT, JsonLdConsts.GRAPH,
            JsonLdConsts.ID, JsonLdConsts.IMPORT, JsonLdConsts.INCLUDED, JsonLdConsts.INDEX,
            JsonLdConsts.JSON, JsonLdConsts.LANGUAGE, JsonLdConsts.LIST, JsonLdConsts.NEST,
            JsonLdConsts.NONE, JsonLdConsts.OMIT_DEFAULT, JsonLdConsts.PREFIX,
            JsonLdConsts.PRESERVE, JsonLdConsts.PROPAGATE, JsonLdConsts.PROTECTED,
            JsonLdConsts.REQUIRE_ALL, JsonLdConsts.REVERSE, JsonLdConsts.SET, JsonLdConsts.TYPE,
            JsonLdConsts.VALUE, JsonLdConsts.VERSION, JsonLdConsts.VOCAB));

    private static final Pattern KEYWORD_FORM = Pattern.compile("^@[a-zA-Z]+$");

    private static final Pattern ABSOLUTE_IRI = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*:.*$");

    /**
     * Returns whether or not the given value is a keyword.
     *
     * @param key
     *            the value to check.
     * @return true if the value is a keyword, false if not.
     */
    public static boolean isKeyword(Object key) {
        return key instanceof String && KEYWORDS.contains(key);
    }

    /**
     * True for strings shaped like a keyword (an @ followed by letters),
     * whether or not the keyword is known.
     */
    static boolean hasKeywordForm(String value) {
        return KEYWORD_FORM.matcher(value).matches();
    }

    public static boolean isAbsoluteIri(String value) {
        if (value == null) {
            return false;
        }
        return value.startsWith("_:") || ABSOLUTE_IRI.matcher(value).matches();
    }

    static boolean isRelativeIri(String value) {
        return !(isKeyword(value) || isAbsoluteIri(value));
    }

    static boolean isBlankNodeId(Object value) {
        return value instanceof String && ((String) value).startsWith("_:");
    }

    /**
     * Compares two strings first by length, then lexicographically.
     */
    public static int compareShortestLeast(String a, String b) {
        if (a.length() < b.length()) {
            return -1;
        } else if (b.length() < a.length()) {
            return 1;
        }
        return Integer.signum(a.compareTo(b));
    }

    static final Comparator<String> SHORTEST_LEAST = new Comparator<String>() {
        @Override
        public int compare(String a, String b) {
            return compareShortestLeast(a, b);
        }
    };

    /**
     * Adds a value to a subject. If the value is an array, all values in the
     * array will be added.
     *
     * @param subject
     *            the subject to add the value to.
     * @param property
     *            the property that relates the value to the subject.
     * @param value
     *            the value to add.
     * @param propertyIsArray
     *            true if the property is always an array.
     * @param allowDuplicate
     *            true to allow duplicates (a shallow comparison of @id or
     *            value).
     */
    @SuppressWarnings("unchecked")
    static void addValue(Map<String, Object> subject, String property, Object value,
            boolean propertyIsArray, boolean allowDuplicate) {
        if (value instanceof List) {
            if (((List<Object>) value).isEmpty() && propertyIsArray
                    && !subject.containsKey(property)) {
                subject.put(property, new ArrayList<Object>());
            }
            for (final Object val : (List<Object>) value) {
                addValue(subject, property, val, propertyIsArray, allowDuplicate);
            }
        } else if (subject.containsKey(property)) {
            final boolean hasValue = !allowDuplicate && hasValue(subject, property, value);

            // make property an array if value not present or always an array
            if (!(subject.get(property) instanceof List) && (!hasValue || propertyIsArray)) {
                final List<Object> tmp = new ArrayList<Object>();
                tmp.add(subject.get(property));
                subject.put(property, tmp);
            }
            if (!hasValue) {
                ((List<Object>) subject.get(property)).add(value);
            }
        } else if (propertyIsArray) {
            final List<Object> tmp = new ArrayList<Object>();
            tmp.add(value);
            subject.put(property, tmp);
        } else {
            subject.put(property, value);
        }
    }

    static void addValue(Map<String, Object> subject, String property, Object value,
            boolean propertyIsArray) {
        addValue(subject, property, value, propertyIsArray, true);
    }

    /**
     * Appends a value to the array under the given key unless an equal value
     * is already there. List objects are always appended.
     */
    @SuppressWarnings("unchecked")
    static void mergeValue(Map<String, Object> obj, String key, Object value) {
        if (obj == null) {
            return;
        }
        List<Object> values = (List<Object>) obj.get(key);
        if (values == null) {
            values = new ArrayList<Object>();
            obj.put(key, values);
        }
        if (JsonLdConsts.LIST.equals(key) || isList(value) || !deepContains(values, value)) {
            values.add(value);
        }
    }

    static boolean deepContains(List<Object> values, Object value) {
        for (final Object item : values) {
            if (deepCompare(item, value, false)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Determines if the given value is a property of the given subject.
     */
    @SuppressWarnings("unchecked")
    static boolean hasValue(Map<String, Object> subject, String property, Object value) {
        if (!hasProperty(subject, property)) {
            return false;
        }
        Object val = subject.get(property);
        final boolean isList = isList(val);
        if (isList || val instanceof List) {
            if (isList) {
                val = ((Map<String, Object>) val).get(JsonLdConsts.LIST);
            }
            for (final Object i : (List<Object>) val) {
                if (compareValues(value, i)) {
                    return true;
                }
            }
        } else if (!(value instanceof List)) {
            return compareValues(value, val);
        }
        return false;
    }

    @SuppressWarnings("unchecked")
    static boolean hasProperty(Map<String, Object> subject, String property) {
        if (subject.containsKey(property)) {
            final Object value = subject.get(property);
            return !(value instanceof List) || !((List<Object>) value).isEmpty();
        }
        return false;
    }

    /**
     * Removes a value from a subject.
     */
    @SuppressWarnings("unchecked")
    static void removeValue(Map<String, Object> subject, String property, Object value,
            boolean propertyIsArray) {
        if (!subject.containsKey(property)) {
            return;
        }
        final List<Object> values = new ArrayList<Object>();
        for (final Object e : arrayify(subject.get(property))) {
            if (!compareValues(e, value)) {
                values.add(e);
            }
        }
        if (values.isEmpty()) {
            subject.remove(property);
        } else if (values.size() == 1 && !propertyIsArray) {
            subject.put(property, values.get(0));
        } else {
            subject.put(property, values);
        }
    }

    /**
     * Compares two JSON-LD values for equality. Two JSON-LD values will be
     * considered equal if:
     *
     * 1. They are both primitives of the same type and value. 2. They are both
     * &#64;values with the same @value, @type, @language and @index, OR 3. They
     * both have @ids they are the same.
     */
    @SuppressWarnings("unchecked")
    static boolean compareValues(Object v1, Object v2) {
        if (!(v1 instanceof Map) && !(v2 instanceof Map) && scalarEquals(v1, v2)) {
            return true;
        }
        if (isValue(v1) && isValue(v2)) {
            final Map<String, Object> m1 = (Map<String, Object>) v1;
            final Map<String, Object> m2 = (Map<String, Object>) v2;
            return scalarEquals(m1.get(JsonLdConsts.VALUE), m2.get(JsonLdConsts.VALUE))
                    && scalarEquals(m1.get(JsonLdConsts.TYPE), m2.get(JsonLdConsts.TYPE))
                    && scalarEquals(m1.get(JsonLdConsts.LANGUAGE), m2.get(JsonLdConsts.LANGUAGE))
                    && scalarEquals(m1.get(JsonLdConsts.INDEX), m2.get(JsonLdConsts.INDEX));
        }
        if (v1 instanceof Map && v2 instanceof Map
                && ((Map<String, Object>) v1).containsKey(JsonLdConsts.ID)
                && ((Map<String, Object>) v2).containsKey(JsonLdConsts.ID)) {
            return scalarEquals(((Map<String, Object>) v1).get(JsonLdConsts.ID),
                    ((Map<String, Object>) v2).get(JsonLdConsts.ID));
        }
        return false;
    }

    /**
     * Null-safe equality that compares numbers by value, so that an Integer
     * and a Long (or Double) holding the same number are equal.
     */
    static boolean scalarEquals(Object v1, Object v2) {
        if (v1 instanceof Number && v2 instanceof Number) {
            return toBigDecimal((Number) v1).compareTo(toBigDecimal((Number) v2)) == 0;
        }
        return v1 == null ? v2 == null : v1.equals(v2);
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal) {
            return (BigDecimal) n;
        } else if (n instanceof BigInteger) {
            return new BigDecimal((BigInteger) n);
        } else if (n instanceof Double || n instanceof Float) {
            final double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return BigDecimal.valueOf(Double.MAX_VALUE);
            }
            return new BigDecimal(d);
        }
        return BigDecimal.valueOf(n.longValue());
    }

    /**
     * Deep equality over the JSON tree. Arrays are compared as multisets
     * unless listOrderMatters is set.
     */
    @SuppressWarnings("unchecked")
    public static boolean deepCompare(Object v1, Object v2, boolean listOrderMatters) {
        if (v1 == null) {
            return v2 == null;
        } else if (v2 == null) {
            return false;
        } else if (v1 instanceof Map && v2 instanceof Map) {
            final Map<String, Object> m1 = (Map<String, Object>) v1;
            final Map<String, Object> m2 = (Map<String, Object>) v2;
            if (m1.size() != m2.size()) {
                return false;
            }
            for (final String key : m1.keySet()) {
                if (!m2.containsKey(key)
                        || !deepCompare(m1.get(key), m2.get(key), listOrderMatters)) {
                    return false;
                }
            }
            return true;
        } else if (v1 instanceof List && v2 instanceof List) {
            final List<Object> l1 = (List<Object>) v1;
            final List<Object> l2 = (List<Object>) v2;
            if (l1.size() != l2.size()) {
                return false;
            }
            // used to mark members of l2 that we have already matched to avoid
            // matching the same item twice for lists that have duplicates
            final boolean alreadyMatched[] = new boolean[l2.size()];
            for (int i = 0; i < l1.size(); i++) {
                final Object o1 = l1.get(i);
                boolean gotMatch = false;
                if (listOrderMatters) {
                    gotMatch = deepCompare(o1, l2.get(i), listOrderMatters);
                } else {
                    for (int j = 0; j < l2.size(); j++) {
                        if (!alreadyMatched[j] && deepCompare(o1, l2.get(j), listOrderMatters)) {
                            alreadyMatched[j] = true;
                            gotMatch = true;
                            break;
                        }
                    }
                }
                if (!gotMatch) {
                    return false;
                }
            }
            return true;
        }
        return scalarEquals(v1, v2);
    }

    public static boolean deepCompare(Object v1, Object v2) {
        return deepCompare(v1, v2, false);
    }

    /**
     * Returns true if the given value is a subject with properties.
     *
     * Note: A value is a subject if all of these hold true: 1. It is an
     * Object. 2. It is not a @value, @set, or @list. 3. It has more than 1 key
     * OR any existing key is not @id.
     */
    @SuppressWarnings("unchecked")
    static boolean isNode(Object v) {
        if (v instanceof Map) {
            final Map<String, Object> m = (Map<String, Object>) v;
            if (!(m.containsKey(JsonLdConsts.VALUE) || m.containsKey(JsonLdConsts.SET)
                    || m.containsKey(JsonLdConsts.LIST))) {
                return m.size() > 1 || !m.containsKey(JsonLdConsts.ID);
            }
        }
        return false;
    }

    /**
     * Returns true if the given value is a node reference: an object with a
     * single key, @id.
     */
    @SuppressWarnings("unchecked")
    static boolean isNodeReference(Object v) {
        return v instanceof Map && ((Map<String, Object>) v).size() == 1
                && ((Map<String, Object>) v).containsKey(JsonLdConsts.ID);
    }

    /**
     * Node objects per JSON-LD 1.1: maps that are not value, list or set
     * objects and are not graph objects once @graph is the only content.
     */
    @SuppressWarnings("unchecked")
    static boolean isNodeObject(Object v) {
        if (!(v instanceof Map)) {
            return false;
        }
        final Map<String, Object> m = (Map<String, Object>) v;
        return !(m.containsKey(JsonLdConsts.VALUE) || m.containsKey(JsonLdConsts.LIST)
                || m.containsKey(JsonLdConsts.SET));
    }

    /**
     * Returns true if the given value is a blank node: an object whose @id, if
     * any, begins with _: and which is not a value, set or list.
     */
    @SuppressWarnings("unchecked")
    static boolean isBlankNode(Object v) {
        if (v instanceof Map) {
            final Map<String, Object> m = (Map<String, Object>) v;
            if (m.containsKey(JsonLdConsts.ID)) {
                return isBlankNodeId(m.get(JsonLdConsts.ID));
            }
            return m.isEmpty() || !(m.containsKey(JsonLdConsts.VALUE)
                    || m.containsKey(JsonLdConsts.SET) || m.containsKey(JsonLdConsts.LIST));
        }
        return false;
    }

    /**
     * A graph object has @graph and may only also have @id and @index.
     */
    @SuppressWarnings("unchecked")
    static boolean isGraph(Object v) {
        if (!(v instanceof Map)) {
            return false;
        }
        final Map<String, Object> m = (Map<String, Object>) v;
        if (!m.containsKey(JsonLdConsts.GRAPH)) {
            return false;
        }
        for (final String key : m.keySet()) {
            if (!JsonLdConsts.ID.equals(key) && !JsonLdConsts.INDEX.equals(key)
                    && !JsonLdConsts.GRAPH.equals(key)) {
                return false;
            }
        }
        return true;
    }

    /**
     * A graph object without an @id.
     */
    @SuppressWarnings("unchecked")
    static boolean isSimpleGraph(Object v) {
        return isGraph(v) && !((Map<String, Object>) v).containsKey(JsonLdConsts.ID);
    }

    @SuppressWarnings("unchecked")
    static boolean isList(Object v) {
        return v instanceof Map && ((Map<String, Object>) v).containsKey(JsonLdConsts.LIST);
    }

    @SuppressWarnings("unchecked")
    static boolean isValue(Object v) {
        return v instanceof Map && ((Map<String, Object>) v).containsKey(JsonLdConsts.VALUE);
    }

    @SuppressWarnings("unchecked")
    static boolean isEmptyObject(Object v) {
        return v instanceof Map && ((Map<String, Object>) v).isEmpty();
    }

    static boolean isScalar(Object v) {
        return v instanceof String || v instanceof Number || v instanceof Boolean;
    }

    /**
     * True for the integer number types and for BigDecimals without a
     * fraction.
     */
    static boolean isIntegral(Object v) {
        if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte
                || v instanceof BigInteger) {
            return true;
        }
        if (v instanceof BigDecimal) {
            final BigDecimal d = (BigDecimal) v;
            return d.signum() == 0 || d.scale() <= 0 || d.stripTrailingZeros().scale() <= 0;
        }
        return false;
    }

    /**
     * Returns the value as a list, wrapping a single value.
     */
    @SuppressWarnings("unchecked")
    static List<Object> arrayify(Object v) {
        if (v instanceof List) {
            return (List<Object>) v;
        }
        final List<Object> rval = new ArrayList<Object>();
        rval.add(v);
        return rval;
    }

    /**
     * Deep copies maps and lists; scalars are immutable and returned as-is.
     */
    @SuppressWarnings("unchecked")
    public static Object clone(Object value) {
        if (value instanceof Map) {
            final Map<String, Object> rval = new LinkedHashMap<String, Object>();
            for (final Map.Entry<String, Object> entry : ((Map<String, Object>) value)
                    .entrySet()) {
                rval.put(entry.getKey(), clone(entry.getValue()));
            }
            return rval;
        } else if (value instanceof List) {
            final List<Object> rval = new ArrayList<Object>();
            for (final Object item : (List<Object>) value) {
                rval.add(clone(item));
            }
            return rval;
        }
        return value;
    }

    /**
     * Returns the keys of the map, sorted when requested, otherwise in
     * insertion order.
     */
    static List<String> keys(Map<String, Object> map, boolean ordered) {
        final List<String> keys = new ArrayList<String>(map.keySet());
        if (ordered) {
            Collections.sort(keys);
        }
        return keys;
    }
}
