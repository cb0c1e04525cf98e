package com.github.dimitryivaniuta.jwt.claims;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClaimValuesTest {

    @Test
    void testStringListFromArrayOrString() {
        final Map<String, Object> claims = Map.of(
                "roles", Arrays.asList("a", null, 7L),
                "aud", "https://a");

        assertEquals(List.of("a", "7"), ClaimValues.getStringList(claims, "roles"));
        assertEquals(List.of("https://a"), ClaimValues.getStringList(claims, "aud"));
        assertEquals(List.of(), ClaimValues.getStringList(claims, "missing"));
        assertEquals(List.of(), ClaimValues.getStringList(null, "aud"));
    }

    @Test
    void testStringOnlyForStrings() {
        final Map<String, Object> claims = Map.of("sub", "user-1", "n", 3);

        assertEquals(Optional.of("user-1"), ClaimValues.getString(claims, "sub"));
        assertEquals(Optional.empty(), ClaimValues.getString(claims, "n"));
    }

    @Test
    void testSeconds() {
        final Map<String, Object> claims = Map.of("exp", 1700000000L, "iat", 1.9d, "nbf", "x");

        assertEquals(OptionalLong.of(1700000000L), ClaimValues.getSeconds(claims, "exp"));
        assertEquals(OptionalLong.of(1L), ClaimValues.getSeconds(claims, "iat"));
        assertEquals(OptionalLong.empty(), ClaimValues.getSeconds(claims, "nbf"));
    }

    @Test
    void testPresence() {
        final Map<String, Object> claims = new HashMap<>();
        claims.put("null", null);
        claims.put("empty", "");
        claims.put("list", List.of());
        claims.put("zero", 0);
        claims.put("map", Map.of());

        assertFalse(ClaimValues.isPresent(claims, "absent"));
        assertFalse(ClaimValues.isPresent(claims, "null"));
        assertFalse(ClaimValues.isPresent(claims, "empty"));
        assertFalse(ClaimValues.isPresent(claims, "list"));
        assertTrue(ClaimValues.isPresent(claims, "zero"));
        assertTrue(ClaimValues.isPresent(claims, "map"));
    }
}
