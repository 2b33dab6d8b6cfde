package info.isaksson.erland.uast.core;

import info.isaksson.erland.uast.model.Uast;

import java.nio.file.Path;

/** Conversion result container for programmatic usage. */
public final class UastResult {
    public final Uast uast;

    /** Number of nodes in the converted tree. */
    public final int nodeCount;

    public final long elapsedMillis;

    /** Present when the CST was read from a file. */
    public final Path source;

    UastResult(Uast uast, long elapsedMillis, Path source) {
        this.uast = uast;
        this.nodeCount = uast.nodeCount();
        this.elapsedMillis = elapsedMillis;
        this.source = source;
    }
}
