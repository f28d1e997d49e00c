package org.stlint.analyzer.common.model;

import java.util.Map;

/*
Identifiers are case-insensitive. Lookups return the key as it was declared, so that a caller can
suggest the correct spelling.
 */
public class Names {

    public record Found<T>(String key, T value) {
    }

    private Names() {
    }

    public static boolean equal(String s1, String s2) {
        if (s1 == null || s2 == null) return s1 == s2;
        return s1.equalsIgnoreCase(s2);
    }

    public static boolean equal(String s1, String s2, boolean strict) {
        return strict ? s1 != null && s1.equals(s2) : equal(s1, s2);
    }

    public static <T> Found<T> find(Map<String, T> map, String key, boolean strict) {
        if (key == null) return null;
        T exact = map.get(key);
        if (exact != null) return new Found<>(key, exact);
        if (strict) return null;
        for (Map.Entry<String, T> e : map.entrySet()) {
            if (e.getKey().equalsIgnoreCase(key)) return new Found<>(e.getKey(), e.getValue());
        }
        return null;
    }

    public static <T> T get(Map<String, T> map, String key) {
        Found<T> found = find(map, key, false);
        return found == null ? null : found.value();
    }

    public static boolean contains(Iterable<String> names, String name) {
        for (String n : names) {
            if (equal(n, name)) return true;
        }
        return false;
    }
}
