package info.isaksson.erland.uast.convert;

import info.isaksson.erland.uast.cst.CstNode;
import info.isaksson.erland.uast.model.InvalidInputException;
import info.isaksson.erland.uast.model.Uast;
import info.isaksson.erland.uast.model.UastLocation;
import info.isaksson.erland.uast.model.UastNode;
import info.isaksson.erland.uast.model.UastNodeType;
import info.isaksson.erland.uast.model.UastPosition;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Converts a CST into a {@link Uast}.
 *
 * <p>Each node gets an id, a normalized type, its token copied verbatim, a 1-based location, the
 * raw type under {@code properties["ts_type"]} and inferred roles. Children are converted either
 * sequentially or, for wide nodes (see {@link ConverterOptions}), as concurrent tasks. Null
 * children are dropped. In both cases the resulting sibling order matches the input order.</p>
 *
 * <p>Ids come from one counter per converter. Under parallel fan-out the id a given tree position
 * receives depends on scheduling; only uniqueness is guaranteed.</p>
 */
public final class Converter {

    private static final Logger logger = LogManager.getLogger(Converter.class);

    private final ConverterOptions options;
    private final KindMapper kindMapper = new KindMapper();
    private final NodeIdGenerator ids = new NodeIdGenerator();
    private final Supplier<ExecutorService> executors;

    public Converter() {
        this(new ConverterOptions());
    }

    public Converter(ConverterOptions options) {
        this(options, Run::newDefaultExecutor);
    }

    /** {@code executors} supplies one pool per conversion; the converter shuts it down afterwards. */
    Converter(ConverterOptions options, Supplier<ExecutorService> executors) {
        this.options = options == null ? new ConverterOptions() : options.copy();
        this.executors = executors;
    }

    /** Update fan-out tuning. Values {@code <= 0} leave the current setting unchanged. */
    public void setParallelizationParams(int threshold, int maxConcurrent) {
        if (threshold > 0) {
            options.parallelThreshold = threshold;
        }
        if (maxConcurrent > 0) {
            options.maxConcurrent = maxConcurrent;
        }
    }

    /** Register or replace a raw type mapping for later conversions by this converter. */
    public void addMappingRule(String rawType, UastNodeType type) {
        kindMapper.addMappingRule(rawType, type);
    }

    public void addMappingRules(Map<String, UastNodeType> rules) {
        if (rules == null) return;
        rules.forEach(kindMapper::addMappingRule);
    }

    public KindMapper kindMapper() {
        return kindMapper;
    }

    public int parallelThreshold() {
        return options.parallelThreshold;
    }

    public int maxConcurrent() {
        return options.maxConcurrent;
    }

    /**
     * Convert {@code root} and index the result.
     *
     * @throws InvalidInputException if {@code root} is null
     */
    public Uast convert(CstNode root, String language) {
        if (root == null) {
            throw new InvalidInputException("root node cannot be null");
        }

        long started = System.nanoTime();
        UastNode uastRoot;
        try (Run run = new Run(executors)) {
            uastRoot = convertNode(root, run);
        }
        Uast uast = new Uast(uastRoot, language);

        if (logger.isDebugEnabled()) {
            logger.debug("Converted {} CST into {} UAST nodes in {} ms",
                    language, uast.nodeCount(), (System.nanoTime() - started) / 1_000_000L);
        }
        return uast;
    }

    private UastNode convertNode(CstNode cst, Run run) {
        String id = ids.next();
        UastNodeType type = kindMapper.mapKind(cst.type);

        UastLocation location = new UastLocation(
                UastPosition.fromZeroBased(cst.startRow, cst.startColumn),
                UastPosition.fromZeroBased(cst.endRow, cst.endColumn)
        );

        List<UastNode> children = options.runsInParallel(cst.children.size())
                ? convertChildrenParallel(cst, run)
                : convertChildrenSequential(cst.children, run);

        return new UastNode(
                id,
                type,
                cst.text,
                RoleInference.inferRoles(type, cst.type),
                children,
                Map.of(UastNode.PROP_TS_TYPE, cst.type),
                location
        );
    }

    private List<UastNode> convertChildrenSequential(List<CstNode> children, Run run) {
        List<UastNode> result = new ArrayList<>(children.size());
        for (CstNode child : children) {
            if (child == null) continue;
            result.add(convertNode(child, run));
        }
        return result;
    }

    private List<UastNode> convertChildrenParallel(CstNode parent, Run run) {
        List<CstNode> children = parent.children;
        int limit = options.maxConcurrent;
        logger.debug("Converting {} children of '{}' in parallel (maxConcurrent={})", children.size(), parent.type, limit);

        // Each result lands in its input slot, so completion order never affects sibling order.
        UastNode[] slots = new UastNode[children.size()];
        Semaphore permits = new Semaphore(limit);
        List<Future<?>> pending = new ArrayList<>(children.size());

        try {
            for (int i = 0; i < children.size(); i++) {
                CstNode child = children.get(i);
                if (child == null) continue;

                permits.acquire();
                int slot = i;
                try {
                    pending.add(run.executor().submit(() -> {
                        try {
                            slots[slot] = convertNode(child, run);
                        } finally {
                            permits.release();
                        }
                    }));
                } catch (RejectedExecutionException e) {
                    permits.release();
                    throw e;
                }
            }
            for (Future<?> f : pending) {
                f.get();
            }
        } catch (InterruptedException e) {
            cancelAll(pending);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while converting children of '" + parent.type + "'", e);
        } catch (ExecutionException e) {
            cancelAll(pending);
            throw rethrow(e.getCause());
        } catch (RuntimeException e) {
            cancelAll(pending);
            throw e;
        }

        List<UastNode> result = new ArrayList<>(pending.size());
        for (UastNode node : slots) {
            if (node != null) result.add(node);
        }
        return result;
    }

    private static void cancelAll(List<Future<?>> pending) {
        for (Future<?> f : pending) {
            f.cancel(true);
        }
    }

    private static RuntimeException rethrow(Throwable cause) {
        if (cause instanceof RuntimeException) return (RuntimeException) cause;
        if (cause instanceof Error) throw (Error) cause;
        return new IllegalStateException("Child conversion failed", cause);
    }

    /**
     * Per-conversion task pool. Created on first fan-out and shut down when the conversion returns.
     * Threads are created on demand: a task that fans out itself blocks its own thread while its
     * children run on others, which a fixed-size pool could starve.
     */
    private static final class Run implements AutoCloseable {
        private static final AtomicInteger RUNS = new AtomicInteger();

        private final Supplier<ExecutorService> executors;
        private ExecutorService executor;

        Run(Supplier<ExecutorService> executors) {
            this.executors = executors;
        }

        static ExecutorService newDefaultExecutor() {
            return Executors.newCachedThreadPool(threadFactory("uast-convert-" + RUNS.incrementAndGet()));
        }

        synchronized ExecutorService executor() {
            if (executor == null) {
                executor = executors.get();
            }
            return executor;
        }

        // On success every task has finished; on failure this interrupts stragglers.
        @Override
        public synchronized void close() {
            if (executor != null) {
                executor.shutdownNow();
            }
        }

        private static ThreadFactory threadFactory(String prefix) {
            var counter = new AtomicInteger(0);
            return r -> {
                var thread = new Thread(r);
                thread.setName(prefix + "-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            };
        }
    }
}
