package com.github.dimitryivaniuta.jwt.signer;

import com.github.dimitryivaniuta.jwt.config.Algorithm;
import com.github.dimitryivaniuta.jwt.error.TokenException;
import com.nimbusds.jose.jwk.JWK;
import java.util.Map;

/**
 * Signing primitive behind the token manager: turns a claim map into a compact
 * JWS and back.
 *
 * <p>Implementations must be thread-safe. They check structure, signature and
 * the {@code exp}/{@code nbf} window; every other claim is left to the caller.</p>
 */
public interface TokenSigner {

    /**
     * Serializes and signs the claims as {@code base64url(header).base64url(payload).base64url(signature)}
     * with header {@code {"typ":"JWT","alg":<algorithm>}}.
     *
     * @param claims    final claim map, written as-is
     * @param algorithm JWS algorithm
     * @param key       private or shared key matching the algorithm family
     * @return compact token
     * @throws TokenException with {@code SigningFailed} when the key cannot sign with the algorithm
     */
    String sign(Map<String, Object> claims, Algorithm algorithm, JWK key);

    /**
     * Parses the compact token, verifies its signature with the key and checks
     * {@code nbf} and {@code exp} against the current time without any leeway.
     *
     * @param token     compact token, without a "Bearer " prefix
     * @param algorithm the only algorithm accepted in the header
     * @param key       public or shared key
     * @return decoded claims
     * @throws TokenException with {@code InvalidToken}, {@code InvalidSignature} or {@code Expired}
     */
    Map<String, Object> verify(String token, Algorithm algorithm, JWK key);
}
