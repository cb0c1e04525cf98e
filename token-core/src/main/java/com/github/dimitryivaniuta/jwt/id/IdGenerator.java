package com.github.dimitryivaniuta.jwt.id;

/**
 * Source of unique token identifiers ({@code jti}, {@code sid}).
 */
@FunctionalInterface
public interface IdGenerator {

    String nextId();

    /** Version 7 UUIDs: millisecond timestamp prefix, random tail. */
    static IdGenerator timeOrdered() {
        return new TimeOrderedIdGenerator();
    }
}
