package com.github.dimitryivaniuta.jwt.claims;

import java.util.List;
import java.util.Set;

/** Well-known claim keys. */
public final class Claims {
    private Claims() {}
    public static final String ISSUER     = "iss";
    public static final String SUBJECT    = "sub";
    public static final String AUDIENCE   = "aud";
    public static final String ISSUED_AT  = "iat";
    public static final String EXPIRATION = "exp";
    public static final String NOT_BEFORE = "nbf";
    public static final String JWT_ID     = "jti";
    public static final String SESSION_ID = "sid";
    public static final String TYPE       = "typ";  // "access" for tokens this library accepts

    /** Claims the manager always writes itself; caller values under these keys are dropped. */
    public static final Set<String> PROTECTED = Set.of(ISSUER, SUBJECT, ISSUED_AT, EXPIRATION, JWT_ID, SESSION_ID);

    /** Default required-claims list, in check order. */
    public static final List<String> DEFAULT_REQUIRED = List.of(ISSUER, JWT_ID, EXPIRATION, ISSUED_AT, TYPE, SUBJECT);
}
