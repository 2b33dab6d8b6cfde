package info.isaksson.erland.uast.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A converted tree plus derived lookup indices.
 *
 * <p>On construction the tree is walked once, depth first in pre-order, and every node is
 * appended to the type index under its own type and, when it carries a non-empty token, to the
 * token index under that token. The indices are only ever rebuilt in full.</p>
 *
 * <p>Thread-safety: index reads/rebuilds and metadata reads/writes are guarded by two independent
 * read/write locks, so metadata writers never block index readers.</p>
 */
@JsonPropertyOrder({"root","language","metadata"})
public final class Uast {

    public final UastNode root;
    public final String language;

    private final Map<String, String> metadata = new LinkedHashMap<>();
    private final ReentrantReadWriteLock metadataLock = new ReentrantReadWriteLock();

    private Map<UastNodeType, List<UastNode>> typeIndex = new EnumMap<>(UastNodeType.class);
    private Map<String, List<UastNode>> tokenIndex = new HashMap<>();
    private int indexedNodeCount;
    private final ReentrantReadWriteLock indexLock = new ReentrantReadWriteLock();

    public Uast(UastNode root, String language) {
        this(root, language, null);
    }

    @JsonCreator
    public Uast(
            @JsonProperty("root") UastNode root,
            @JsonProperty("language") String language,
            @JsonProperty("metadata") Map<String, String> metadata
    ) {
        this.root = root;
        this.language = language == null ? "" : language;
        if (metadata != null) {
            this.metadata.putAll(metadata);
        }
        rebuildIndices();
    }

    /**
     * Recompute both indices from the current tree.
     */
    public void rebuildIndices() {
        Map<UastNodeType, List<UastNode>> types = new EnumMap<>(UastNodeType.class);
        Map<String, List<UastNode>> tokens = new HashMap<>();
        int count = 0;

        if (root != null) {
            Deque<UastNode> stack = new ArrayDeque<>();
            stack.push(root);
            while (!stack.isEmpty()) {
                UastNode node = stack.pop();
                count++;
                types.computeIfAbsent(node.type, k -> new ArrayList<>()).add(node);
                if (node.hasToken()) {
                    tokens.computeIfAbsent(node.token, k -> new ArrayList<>()).add(node);
                }
                // reverse push keeps pre-order with children left to right
                for (int i = node.children.size() - 1; i >= 0; i--) {
                    UastNode child = node.children.get(i);
                    if (child != null) stack.push(child);
                }
            }
        }

        indexLock.writeLock().lock();
        try {
            typeIndex = types;
            tokenIndex = tokens;
            indexedNodeCount = count;
        } finally {
            indexLock.writeLock().unlock();
        }
    }

    /** All nodes of the given type in pre-order. Never null; the list is a private copy. */
    public List<UastNode> findByType(UastNodeType type) {
        indexLock.readLock().lock();
        try {
            List<UastNode> nodes = typeIndex.get(type);
            return nodes == null ? new ArrayList<>() : new ArrayList<>(nodes);
        } finally {
            indexLock.readLock().unlock();
        }
    }

    /** All nodes whose token equals {@code token} in pre-order. Never null; the list is a private copy. */
    public List<UastNode> findByToken(String token) {
        indexLock.readLock().lock();
        try {
            List<UastNode> nodes = token == null ? null : tokenIndex.get(token);
            return nodes == null ? new ArrayList<>() : new ArrayList<>(nodes);
        } finally {
            indexLock.readLock().unlock();
        }
    }

    /** Types that have at least one indexed node. */
    public Set<UastNodeType> indexedTypes() {
        indexLock.readLock().lock();
        try {
            return typeIndex.isEmpty() ? EnumSet.noneOf(UastNodeType.class) : EnumSet.copyOf(typeIndex.keySet());
        } finally {
            indexLock.readLock().unlock();
        }
    }

    /** Distinct non-empty tokens present in the tree. */
    public Set<String> indexedTokens() {
        indexLock.readLock().lock();
        try {
            return Set.copyOf(tokenIndex.keySet());
        } finally {
            indexLock.readLock().unlock();
        }
    }

    /** Number of nodes reachable from {@link #root} at the last index build. */
    public int nodeCount() {
        indexLock.readLock().lock();
        try {
            return indexedNodeCount;
        } finally {
            indexLock.readLock().unlock();
        }
    }

    /** Insert or overwrite a metadata entry. */
    public void addMetadata(String key, String value) {
        if (key == null) throw new InvalidInputException("metadata key must not be null");
        metadataLock.writeLock().lock();
        try {
            metadata.put(key, value);
        } finally {
            metadataLock.writeLock().unlock();
        }
    }

    public String metadataValue(String key) {
        metadataLock.readLock().lock();
        try {
            return metadata.get(key);
        } finally {
            metadataLock.readLock().unlock();
        }
    }

    /** Snapshot of the metadata, sorted by key. */
    @JsonProperty("metadata")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public Map<String, String> getMetadata() {
        metadataLock.readLock().lock();
        try {
            return new TreeMap<>(metadata);
        } finally {
            metadataLock.readLock().unlock();
        }
    }
}
