package com.github.dimitryivaniuta.jwt.signer;

import com.github.dimitryivaniuta.jwt.claims.Claims;
import com.github.dimitryivaniuta.jwt.config.Algorithm;
import com.github.dimitryivaniuta.jwt.error.TokenException;
import com.github.dimitryivaniuta.jwt.error.TokenFailure;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSObject;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.Payload;
import com.nimbusds.jose.crypto.ECDSASigner;
import com.nimbusds.jose.crypto.ECDSAVerifier;
import com.nimbusds.jose.crypto.Ed25519Signer;
import com.nimbusds.jose.crypto.Ed25519Verifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.OctetKeyPair;
import com.nimbusds.jose.jwk.OctetSequenceKey;
import com.nimbusds.jose.jwk.RSAKey;
import java.text.ParseException;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;

/**
 * {@link TokenSigner} on top of Nimbus JOSE+JWT. Dispatches on the algorithm
 * family to pick the Nimbus signer/verifier and refuses keys of the wrong type.
 */
public class NimbusTokenSigner implements TokenSigner {

    private static final int SEGMENTS = 3;

    /** Time source for the nbf/exp window. */
    private final Clock clock;

    public NimbusTokenSigner() {
        this(Clock.systemUTC());
    }

    public NimbusTokenSigner(final Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String sign(final Map<String, Object> claims, final Algorithm algorithm, final JWK key) {
        Objects.requireNonNull(claims, "claims");
        Objects.requireNonNull(algorithm, "algorithm");
        if (key == null) {
            throw signingFailed("no signing key configured", null);
        }

        JWSSigner signer = signerFor(algorithm, key);
        var header = new JWSHeader.Builder(jwsAlgorithm(algorithm))
                .type(JOSEObjectType.JWT)
                .build();

        try {
            var jws = new JWSObject(header, new Payload(claims));
            jws.sign(signer);
            return jws.serialize();
        } catch (JOSEException e) {
            throw signingFailed(e.getMessage(), e);
        } catch (RuntimeException e) {
            // claim values the JSON writer cannot serialize
            throw signingFailed("Claims could not be serialized: " + e.getMessage(), e);
        }
    }

    @Override
    public Map<String, Object> verify(final String token, final Algorithm algorithm, final JWK key) {
        Objects.requireNonNull(algorithm, "algorithm");
        if (token == null || token.isBlank()) {
            throw malformed("Token is empty", null);
        }
        if (token.split("\\.", -1).length != SEGMENTS) {
            throw malformed("Wrong number of segments", null);
        }

        JWSObject jws;
        try {
            jws = JWSObject.parse(token);
        } catch (ParseException e) {
            throw malformed("Malformed token: " + e.getMessage(), e);
        }

        String alg = jws.getHeader().getAlgorithm().getName();
        if (!algorithm.getValue().equals(alg)) {
            throw malformed("Algorithm " + alg + " is not allowed, expected " + algorithm.getValue(), null);
        }

        Map<String, Object> claims = jws.getPayload().toJSONObject();
        if (claims == null) {
            throw malformed("Token payload is not a JSON object", null);
        }

        JWSVerifier verifier = verifierFor(algorithm, key);
        boolean valid;
        try {
            valid = jws.verify(verifier);
        } catch (JOSEException e) {
            throw new TokenException(new TokenFailure.InvalidSignature(), e);
        }
        if (!valid) {
            throw new TokenException(new TokenFailure.InvalidSignature());
        }

        checkTimeWindow(claims);
        return claims;
    }

    private void checkTimeWindow(final Map<String, Object> claims) {
        long now = clock.instant().getEpochSecond();

        Long nbf = numericClaim(claims, Claims.NOT_BEFORE);
        if (nbf != null && now < nbf) {
            throw new TokenException(TokenFailure.InvalidToken.notYetValid());
        }

        Long exp = numericClaim(claims, Claims.EXPIRATION);
        if (exp != null && now > exp) {
            throw new TokenException(new TokenFailure.Expired());
        }
    }

    private static Long numericClaim(final Map<String, Object> claims, final String name) {
        Object v = claims.get(name);
        if (v == null) return null;
        if (v instanceof Number n) return n.longValue();
        throw malformed("Payload " + name + " must be a number", null);
    }

    private static JWSSigner signerFor(final Algorithm algorithm, final JWK key) {
        try {
            if (algorithm.isSymmetric()) {
                if (key instanceof OctetSequenceKey oct) return new MACSigner(oct);
            } else if (algorithm.isRsa()) {
                if (key instanceof RSAKey rsa && rsa.isPrivate()) return new RSASSASigner(rsa);
            } else if (algorithm.isEcdsa()) {
                if (key instanceof ECKey ec && ec.isPrivate()) return new ECDSASigner(ec);
            } else if (key instanceof OctetKeyPair okp && okp.isPrivate()) {
                return new Ed25519Signer(okp);
            }
        } catch (JOSEException | IllegalArgumentException e) {
            throw signingFailed(e.getMessage(), e);
        }
        throw signingFailed(describe(key) + " cannot sign " + algorithm.getValue(), null);
    }

    private static JWSVerifier verifierFor(final Algorithm algorithm, final JWK key) {
        JWSVerifier verifier = null;
        try {
            if (algorithm.isSymmetric()) {
                if (key instanceof OctetSequenceKey oct) verifier = new MACVerifier(oct);
            } else if (algorithm.isRsa()) {
                if (key instanceof RSAKey rsa) verifier = new RSASSAVerifier(rsa.toPublicJWK());
            } else if (algorithm.isEcdsa()) {
                if (key instanceof ECKey ec) verifier = new ECDSAVerifier(ec.toPublicJWK());
            } else if (key instanceof OctetKeyPair okp) {
                verifier = new Ed25519Verifier(okp.toPublicJWK());
            }
        } catch (JOSEException | IllegalArgumentException e) {
            throw malformed("Verification key cannot be used with " + algorithm.getValue() + ": " + e.getMessage(), e);
        }
        if (verifier == null || !verifier.supportedJWSAlgorithms().contains(jwsAlgorithm(algorithm))) {
            throw malformed(describe(key) + " cannot verify " + algorithm.getValue(), null);
        }
        return verifier;
    }

    private static JWSAlgorithm jwsAlgorithm(final Algorithm algorithm) {
        return JWSAlgorithm.parse(algorithm.getValue());
    }

    private static String describe(final JWK key) {
        return key == null ? "Missing key" : "Key of type " + key.getKeyType();
    }

    private static TokenException signingFailed(final String detail, final Throwable cause) {
        return new TokenException(new TokenFailure.SigningFailed(detail), cause);
    }

    private static TokenException malformed(final String detail, final Throwable cause) {
        return new TokenException(TokenFailure.InvalidToken.malformed(detail), cause);
    }
}
