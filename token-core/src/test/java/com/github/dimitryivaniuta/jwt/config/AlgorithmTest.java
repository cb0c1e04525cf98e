package com.github.dimitryivaniuta.jwt.config;

import java.util.Arrays;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlgorithmTest {

    @ParameterizedTest
    @EnumSource(Algorithm.class)
    void testExactlyOneFamily(final Algorithm algorithm) {
        final long families = Arrays.asList(algorithm.isSymmetric(), algorithm.isRsa(), algorithm.isEcdsa(), algorithm.isEdDsa())
                .stream()
                .filter(Boolean::booleanValue)
                .count();

        assertEquals(1, families);
        assertEquals(!algorithm.isSymmetric(), algorithm.isAsymmetric());
    }

    @Test
    void testFamilies() {
        assertTrue(Algorithm.HS384.isSymmetric());
        assertTrue(Algorithm.PS256.isRsa());
        assertTrue(Algorithm.ES512.isEcdsa());
        assertTrue(Algorithm.EdDSA.isEdDsa());
        assertFalse(Algorithm.RS256.isSymmetric());
    }

    @ParameterizedTest
    @EnumSource(Algorithm.class)
    void testFromJoseName(final Algorithm algorithm) {
        assertEquals(Optional.of(algorithm), Algorithm.from(algorithm.getValue()));
    }

    @Test
    void testFromIsLenient() {
        assertEquals(Optional.of(Algorithm.RS256), Algorithm.from(" rs256 "));
        assertEquals(Optional.of(Algorithm.EdDSA), Algorithm.from("EDDSA"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "none", "HS1024", "RSA"})
    void testFromUnknown(final String name) {
        assertEquals(Optional.empty(), Algorithm.from(name));
    }

    @Test
    void testFromNull() {
        assertEquals(Optional.empty(), Algorithm.from(null));
    }
}
