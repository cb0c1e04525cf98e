package com.github.dimitryivaniuta.jwt.id;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Objects;
import java.util.UUID;

/**
 * RFC 9562 version 7 UUIDs: 48 bits of Unix epoch milliseconds, the version
 * nibble, 12 random bits, the variant and 62 more random bits.
 * Ids generated in the same millisecond are ordered only by chance.
 */
public final class TimeOrderedIdGenerator implements IdGenerator {

    private final Clock clock;
    private final SecureRandom random;

    public TimeOrderedIdGenerator() {
        this(Clock.systemUTC(), new SecureRandom());
    }

    public TimeOrderedIdGenerator(final Clock clock, final SecureRandom random) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public String nextId() {
        return next().toString();
    }

    public UUID next() {
        long millis = clock.millis();
        long msb = (millis & 0xFFFF_FFFF_FFFFL) << 16
                | 0x7000L
                | (random.nextInt() & 0x0FFFL);
        long lsb = (random.nextLong() & 0x3FFF_FFFF_FFFF_FFFFL) | 0x8000_0000_0000_0000L;
        return new UUID(msb, lsb);
    }
}
