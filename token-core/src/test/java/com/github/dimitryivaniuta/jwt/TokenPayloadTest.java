package com.github.dimitryivaniuta.jwt;

import com.github.dimitryivaniuta.jwt.config.Algorithm;
import com.github.dimitryivaniuta.jwt.config.TokenConfig;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

import static com.github.dimitryivaniuta.jwt.TestKeys.NOW;
import static com.github.dimitryivaniuta.jwt.TestKeys.clockAt;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenPayloadTest {

    @Test
    void testAccessors() {
        final TokenPayload payload = new TokenPayload(claims());

        assertEquals("user-1", payload.getSubject());
        assertEquals("https://api.example.com", payload.getIssuer());
        assertEquals("jti-1", payload.getJti());
        assertEquals(Optional.of("sid-1"), payload.getSessionId());
        assertEquals("access", payload.getType());
        assertEquals(NOW, payload.getIssuedAt());
        assertEquals(NOW - 5, payload.getNotBefore());
        assertEquals(NOW + 3600, payload.getExpiration());
        assertEquals(List.of("https://a"), payload.getAudience());
        assertEquals(List.of("read", "write"), payload.getStringList("scope"));
    }

    @Test
    void testDefaultsWhenAbsent() {
        final TokenPayload payload = new TokenPayload(Map.of("sub", "user-1"));

        assertEquals("access", payload.getType());
        assertEquals(List.of(), payload.getAudience());
        assertEquals(Optional.empty(), payload.getSessionId());
        assertNull(payload.getJti());
        assertNull(payload.getClaim("missing"));
        assertFalse(payload.hasClaim("missing"));
    }

    @Test
    void testNonNumericDate() {
        final Map<String, Object> claims = claims();
        claims.put("exp", "soon");

        final TokenPayload payload = new TokenPayload(claims);

        assertThrows(IllegalStateException.class, payload::getExpiration);
    }

    @Test
    void testIsExpired() {
        final TokenPayload payload = new TokenPayload(claims());

        assertFalse(payload.isExpired(clockAt(NOW + 3600)));
        assertTrue(payload.isExpired(clockAt(NOW + 3601)));
    }

    @Test
    void testSnapshotIsImmutable() {
        final Map<String, Object> claims = claims();
        final TokenPayload payload = new TokenPayload(claims);
        claims.put("sub", "someone-else");

        assertEquals("user-1", payload.getSubject());
        assertThrows(UnsupportedOperationException.class, () -> payload.toMap().put("sub", "x"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testNestedValuesAreImmutable() {
        final Map<String, Object> claims = claims();
        claims.put("aud", new ArrayList<>(List.of("https://a")));
        claims.put("tags", new ArrayList<>(Arrays.asList("x", null)));
        final Map<String, Object> address = new HashMap<>();
        address.put("city", "Warsaw");
        address.put("zones", new ArrayList<>(List.of(1L, 2L)));
        claims.put("address", address);

        final TokenPayload payload = new TokenPayload(claims);

        assertThrows(UnsupportedOperationException.class,
                () -> ((List<Object>) payload.getClaim("aud")).add("https://evil"));
        assertThrows(UnsupportedOperationException.class,
                () -> ((List<Object>) payload.getClaim("tags")).set(1, "y"));
        final Map<String, Object> nested = (Map<String, Object>) payload.getClaim("address");
        assertThrows(UnsupportedOperationException.class, () -> nested.put("city", "Krakow"));
        assertThrows(UnsupportedOperationException.class, () -> ((List<Object>) nested.get("zones")).clear());
        assertEquals(List.of("https://a"), payload.getAudience());
        assertEquals(Arrays.asList("x", null), payload.getClaim("tags"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testDecodedAudienceCannotBeChanged() {
        final TokenManager manager = new TokenManager(TokenConfig.builder()
                .signingKey(TestKeys.HMAC)
                .algorithm(Algorithm.HS256)
                .issuer(TestKeys.ISSUER)
                .audience(List.of("https://a"))
                .build(), clockAt(NOW));
        final TokenPayload payload = manager.decode(manager.encode("user-1"));

        assertThrows(UnsupportedOperationException.class,
                () -> ((List<Object>) payload.getClaim("aud")).add("https://evil"));
        assertEquals(List.of("https://a"), payload.getAudience());
    }

    private static Map<String, Object> claims() {
        final Map<String, Object> claims = new HashMap<>();
        claims.put("sub", "user-1");
        claims.put("iss", "https://api.example.com");
        claims.put("aud", "https://a");
        claims.put("jti", "jti-1");
        claims.put("sid", "sid-1");
        claims.put("typ", "access");
        claims.put("iat", NOW);
        claims.put("nbf", NOW - 5);
        claims.put("exp", NOW + 3600);
        claims.put("scope", List.of("read", "write"));
        return claims;
    }
}
