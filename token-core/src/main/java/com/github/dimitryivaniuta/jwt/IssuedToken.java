package com.github.dimitryivaniuta.jwt;

import java.time.Duration;

/**
 * Value object for an issued access token and the identifiers stamped into it.
 *
 * @param token     compact JWS
 * @param jti       {@code jti} claim, unique per token
 * @param sessionId {@code sid} claim, for callers that track sessions
 * @param expiresIn configured lifetime
 */
public record IssuedToken(String token, String jti, String sessionId, Duration expiresIn) { }
