package info.isaksson.erland.uast.format;

import info.isaksson.erland.uast.model.InvalidInputException;
import info.isaksson.erland.uast.model.Uast;
import info.isaksson.erland.uast.model.UastNode;

/**
 * Indented outline, one node per line:
 * <pre>
 * Language: go
 *
 * Structure:
 * File
 *   Function: hello [Declaration, Definition]
 * </pre>
 */
public final class SimpleTextFormat implements UastFormat {

    static final int MAX_DEPTH = 100;

    public final boolean includeLocations;

    public SimpleTextFormat(boolean includeLocations) {
        this.includeLocations = includeLocations;
    }

    @Override
    public String format(Uast uast) {
        if (uast == null) throw new InvalidInputException("cannot format null UAST");

        StringBuilder sb = new StringBuilder();
        TextSupport.appendHeader(sb, uast.language, uast.getMetadata());
        sb.append("\nStructure:\n");
        formatNode(sb, uast.root, 0);
        return sb.toString();
    }

    private void formatNode(StringBuilder sb, UastNode node, int indent) {
        if (node == null) return;

        if (indent > MAX_DEPTH) {
            sb.append("  ".repeat(indent)).append("[Excessive nesting - tree truncated]\n");
            return;
        }

        sb.append("  ".repeat(indent)).append(node.type.label);
        if (node.hasToken()) {
            sb.append(": ").append(TextSupport.abbreviate(node.token, TextSupport.MAX_TOKEN_LENGTH));
        }
        TextSupport.appendRoles(sb, node.roles);
        if (includeLocations) {
            TextSupport.appendLocation(sb, node);
        }
        sb.append('\n');

        for (UastNode child : node.children) {
            formatNode(sb, child, indent + 1);
        }
    }
}
