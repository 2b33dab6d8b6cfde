package info.isaksson.erland.uast.convert;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues node ids "1", "2", ... from an atomic counter. Safe for concurrent callers; every call
 * returns a distinct value.
 */
public final class NodeIdGenerator {

    private final AtomicLong counter = new AtomicLong();

    public String next() {
        return Long.toString(counter.incrementAndGet());
    }

    /** Number of ids issued so far. */
    public long issued() {
        return counter.get();
    }
}
