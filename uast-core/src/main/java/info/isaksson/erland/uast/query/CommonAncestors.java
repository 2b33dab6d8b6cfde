package info.isaksson.erland.uast.query;

import info.isaksson.erland.uast.model.UastNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Root-relative paths and deepest common ancestors.
 *
 * <p>Paths are found by depth-first search from the root. The search remembers visited node ids,
 * so it terminates even on input that is not a proper tree. Path positions are compared by
 * reference, not by value.</p>
 */
public final class CommonAncestors {

    private CommonAncestors() {}

    /**
     * Deepest node that lies on the root path of every reachable input node.
     *
     * <ul>
     *   <li>empty or null input: {@code null}</li>
     *   <li>one input node: that node, reachable or not</li>
     *   <li>null root, or no input node reachable from it: {@code null}</li>
     * </ul>
     * Unreachable nodes are ignored when at least one other node is reachable.
     */
    public static UastNode commonAncestor(List<UastNode> nodes, UastNode root) {
        if (nodes == null || nodes.isEmpty()) return null;
        if (nodes.size() == 1) return nodes.get(0);
        if (root == null) return null;

        Set<UastNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<List<UastNode>> paths = new ArrayList<>();
        for (UastNode node : nodes) {
            if (node == null || !seen.add(node)) continue;
            List<UastNode> path = pathTo(node, root);
            if (!path.isEmpty()) {
                paths.add(path);
            }
        }
        if (paths.isEmpty()) return null;

        List<UastNode> shortest = paths.get(0);
        for (List<UastNode> p : paths) {
            if (p.size() < shortest.size()) shortest = p;
        }

        UastNode ancestor = null;
        for (int i = 0; i < shortest.size(); i++) {
            UastNode candidate = shortest.get(i);
            for (List<UastNode> p : paths) {
                if (p.get(i) != candidate) return ancestor;
            }
            ancestor = candidate;
        }
        return ancestor;
    }

    /**
     * Nodes from {@code root} down to and including {@code target}; empty if {@code target} is not
     * reachable.
     */
    public static List<UastNode> pathTo(UastNode target, UastNode root) {
        if (target == null || root == null) return List.of();
        if (root == target) return List.of(root);

        List<UastNode> path = new ArrayList<>();
        if (search(target, root, new HashSet<>(), path)) {
            Collections.reverse(path);
            return Collections.unmodifiableList(path);
        }
        return List.of();
    }

    // Appends target..root to reversedPath on success.
    private static boolean search(UastNode target, UastNode current, Set<Object> visited, List<UastNode> reversedPath) {
        if (current == null) return false;
        // keyed by id; nodes built without an id fall back to the node itself
        if (!visited.add(current.id != null ? current.id : current)) return false;

        if (current == target) {
            reversedPath.add(current);
            return true;
        }
        for (UastNode child : current.children) {
            if (search(target, child, visited, reversedPath)) {
                reversedPath.add(current);
                return true;
            }
        }
        return false;
    }
}
