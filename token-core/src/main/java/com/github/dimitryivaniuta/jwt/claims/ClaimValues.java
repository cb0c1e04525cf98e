package com.github.dimitryivaniuta.jwt.claims;

import java.util.*;

/**
 * Typed reads over a raw decoded claim map. Values come straight from the JSON
 * parser: strings, {@link Number}s, booleans, lists and nested maps.
 */
public final class ClaimValues {
    private ClaimValues() {}

    /** Read claim that may be array OR a single string; non-string elements are stringified. */
    public static List<String> getStringList(Map<String, ?> claims, String claim) {
        if (claims == null || claim == null) return List.of();
        Object v = claims.get(claim);
        if (v == null) return List.of();
        if (v instanceof Collection<?> c) {
            return c.stream().filter(Objects::nonNull).map(Object::toString).toList();
        }
        return List.of(v.toString());
    }

    public static Optional<String> getString(Map<String, ?> claims, String claim) {
        if (claims == null || claim == null) return Optional.empty();
        Object v = claims.get(claim);
        return v instanceof String s ? Optional.of(s) : Optional.empty();
    }

    /** Numeric claim as epoch seconds; fractional values are truncated. */
    public static OptionalLong getSeconds(Map<String, ?> claims, String claim) {
        if (claims == null || claim == null) return OptionalLong.empty();
        Object v = claims.get(claim);
        return v instanceof Number n ? OptionalLong.of(n.longValue()) : OptionalLong.empty();
    }

    /** Absent, JSON null, empty string and empty array all count as "not there". */
    public static boolean isPresent(Map<String, ?> claims, String claim) {
        if (claims == null || claim == null || !claims.containsKey(claim)) return false;
        Object v = claims.get(claim);
        if (v == null) return false;
        if (v instanceof String s) return !s.isEmpty();
        if (v instanceof Collection<?> c) return !c.isEmpty();
        return true;
    }
}
