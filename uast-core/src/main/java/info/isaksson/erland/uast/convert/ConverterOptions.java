package info.isaksson.erland.uast.convert;

/**
 * Traversal tuning for {@link Converter}.
 *
 * <p>A node whose child count {@code n} satisfies {@code parallelThreshold < n < parallelUpperBound}
 * has its children converted as concurrent tasks, at most {@code maxConcurrent} of them running at
 * once. Every other node converts its children one after another.</p>
 */
public final class ConverterOptions {
    public static final int DEFAULT_PARALLEL_THRESHOLD = 50;
    public static final int DEFAULT_MAX_CONCURRENT = 100;
    public static final int DEFAULT_PARALLEL_UPPER_BOUND = 1000;

    public int parallelThreshold = DEFAULT_PARALLEL_THRESHOLD;
    public int maxConcurrent = DEFAULT_MAX_CONCURRENT;

    /** Nodes with at least this many children are always converted sequentially. */
    public int parallelUpperBound = DEFAULT_PARALLEL_UPPER_BOUND;

    public ConverterOptions copy() {
        ConverterOptions o = new ConverterOptions();
        o.parallelThreshold = parallelThreshold;
        o.maxConcurrent = maxConcurrent;
        o.parallelUpperBound = parallelUpperBound;
        return o;
    }

    boolean runsInParallel(int childCount) {
        return childCount > parallelThreshold && childCount < parallelUpperBound;
    }
}
