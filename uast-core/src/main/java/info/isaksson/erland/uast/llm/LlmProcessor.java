package info.isaksson.erland.uast.llm;

import info.isaksson.erland.uast.format.SimpleTextFormat;
import info.isaksson.erland.uast.format.TextSupport;
import info.isaksson.erland.uast.format.UastFormat;
import info.isaksson.erland.uast.model.InvalidInputException;
import info.isaksson.erland.uast.model.Uast;
import info.isaksson.erland.uast.model.UastNode;
import info.isaksson.erland.uast.model.UastNodeType;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Prepares a converted tree for a language model prompt.
 *
 * <p>With a format set (the default is {@link SimpleTextFormat} without locations) the tree is
 * rendered by that format. With {@code setFormat(null)} the processor lists the prioritized node
 * types first, then the rest of the tree minus excluded types, capped at {@link #maxTotalTokens}
 * characters.</p>
 */
public final class LlmProcessor {

    static final String TRUNCATED = "... (truncated)";

    /** Per-node token cap in characters; {@code <= 0} disables it. */
    public int maxTokensPerNode = 100;

    /** Output cap in characters for the prioritized listing; {@code <= 0} disables it. */
    public int maxTotalTokens = 2000;

    public boolean includeLocations = false;

    public List<UastNodeType> prioritizeTypes = new ArrayList<>(List.of(UastNodeType.FUNCTION, UastNodeType.CLASS, UastNodeType.METHOD));

    /** Types left out of the remaining-tree walk together with their subtrees. */
    public List<UastNodeType> excludeTypes = new ArrayList<>(List.of(UastNodeType.UNKNOWN));

    private UastFormat format = new SimpleTextFormat(false);

    public void setFormat(UastFormat format) {
        this.format = format;
    }

    public UastFormat format() {
        return format;
    }

    public String process(Uast uast) throws IOException {
        if (uast == null || uast.root == null) {
            throw new InvalidInputException("UAST or root node cannot be null");
        }
        if (format != null) {
            return format.format(uast);
        }
        return processDefault(uast);
    }

    private String processDefault(Uast uast) {
        Output out = new Output(maxTotalTokens);

        StringBuilder header = new StringBuilder();
        TextSupport.appendHeader(header, uast.language, uast.getMetadata());
        header.append('\n');
        out.appendAlways(header);

        Set<UastNode> processed = Collections.newSetFromMap(new IdentityHashMap<>());
        for (UastNodeType type : prioritizeTypes) {
            List<UastNode> nodes = uast.findByType(type);
            if (nodes.isEmpty()) continue;
            out.appendLine(type.label + ":");
            for (UastNode node : nodes) {
                out.appendLine(nodeLine(node, 1));
            }
            out.appendLine("");
            for (UastNode node : nodes) {
                markProcessed(node, processed);
            }
        }

        out.appendLine("Other Important Elements:");
        processUnprocessed(uast.root, out, processed, 1);

        return out.finish();
    }

    private static void markProcessed(UastNode node, Set<UastNode> processed) {
        if (node == null || !processed.add(node)) return;
        for (UastNode child : node.children) {
            markProcessed(child, processed);
        }
    }

    private void processUnprocessed(UastNode node, Output out, Set<UastNode> processed, int indent) {
        if (node == null || processed.contains(node) || out.full()) return;
        if (excludeTypes.contains(node.type)) return;

        out.appendLine(nodeLine(node, indent));
        processed.add(node);

        for (UastNode child : node.children) {
            processUnprocessed(child, out, processed, indent + 1);
        }
    }

    private String nodeLine(UastNode node, int indent) {
        StringBuilder sb = new StringBuilder();
        sb.append("  ".repeat(indent)).append(node.type.label);
        if (node.hasToken()) {
            sb.append(": ").append(TextSupport.truncate(node.token, maxTokensPerNode));
        }
        TextSupport.appendRoles(sb, node.roles);
        if (includeLocations) {
            TextSupport.appendLocation(sb, node);
        }
        return sb.toString();
    }

    /** Multi-line description of one node (type, token, roles, location, properties, child types). */
    public String generateNodeSummary(UastNode node) {
        if (node == null) return "Empty node";

        StringBuilder sb = new StringBuilder();
        sb.append("Type: ").append(node.type.label).append('\n');

        if (node.hasToken()) {
            sb.append("Token: ").append(TextSupport.truncate(node.token, maxTokensPerNode)).append('\n');
        }
        if (!node.roles.isEmpty()) {
            sb.append("Roles: ");
            TextSupport.appendJoined(sb, node.roles);
            sb.append('\n');
        }
        if (node.location != null) {
            sb.append("Location: ").append(node.location).append('\n');
        }
        if (!node.properties.isEmpty()) {
            sb.append("Properties:\n");
            new TreeMap<>(node.properties).forEach((k, v) -> sb.append("  ").append(k).append(": ").append(v).append('\n'));
        }
        if (!node.children.isEmpty()) {
            sb.append("Children: ").append(node.children.size()).append('\n');
            Map<UastNodeType, Integer> counts = new LinkedHashMap<>();
            for (UastNode child : node.children) {
                counts.merge(child.type, 1, Integer::sum);
            }
            sb.append("Child Types: ");
            int i = 0;
            for (Map.Entry<UastNodeType, Integer> e : counts.entrySet()) {
                if (i++ > 0) sb.append(", ");
                sb.append(e.getKey().label).append(" (").append(e.getValue()).append(')');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /** Line sink that stops accepting lines once the character budget is exceeded. */
    private static final class Output {
        private final StringBuilder sb = new StringBuilder();
        private final int limit;
        private boolean truncated;

        Output(int limit) {
            this.limit = limit;
        }

        void appendAlways(CharSequence s) {
            sb.append(s);
        }

        void appendLine(String line) {
            if (full()) return;
            sb.append(line).append('\n');
            if (limit > 0 && sb.length() > limit) {
                truncated = true;
                sb.append(TRUNCATED).append('\n');
            }
        }

        boolean full() {
            return truncated;
        }

        String finish() {
            return sb.toString();
        }
    }
}
