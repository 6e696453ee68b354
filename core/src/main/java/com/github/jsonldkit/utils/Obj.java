package com.github.jsonldkit.utils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shorthands for building the insertion-ordered maps of the JSON tree.
 */
public class Obj {

    private Obj() {
    }

    public static Map<String, Object> newMap() {
        return new LinkedHashMap<String, Object>(4, 0.75f);
    }

    public static Map<String, Object> newMap(String key, Object value) {
        final Map<String, Object> result = newMap();
        result.put(key, value);
        return result;
    }
}
