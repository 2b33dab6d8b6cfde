package info.isaksson.erland.uast.format;

import info.isaksson.erland.uast.model.InvalidInputException;
import info.isaksson.erland.uast.model.Uast;
import info.isaksson.erland.uast.model.UastNode;

/**
 * Box-drawing tree, e.g.
 * <pre>
 * └── File
 *     ├── Function: hello
 *     └── Class: Example
 * </pre>
 */
public final class TreeTextFormat implements UastFormat {

    static final int MAX_PREFIX_LENGTH = 200;

    @Override
    public String format(Uast uast) {
        if (uast == null) throw new InvalidInputException("cannot format null UAST");

        StringBuilder sb = new StringBuilder();
        sb.append("Language: ").append(uast.language).append("\n\n");
        formatNode(sb, uast.root, "", true);
        return sb.toString();
    }

    private static void formatNode(StringBuilder sb, UastNode node, String prefix, boolean last) {
        if (node == null) return;

        if (prefix.length() > MAX_PREFIX_LENGTH) {
            sb.append(prefix).append(last ? "└── " : "├── ").append("[Excessive depth - tree truncated]\n");
            return;
        }

        sb.append(prefix).append(last ? "└── " : "├── ");
        String childPrefix = prefix + (last ? "    " : "│   ");

        sb.append(node.type.label);
        if (node.hasToken()) {
            sb.append(": ").append(TextSupport.abbreviate(node.token, TextSupport.MAX_TOKEN_LENGTH));
        }
        sb.append('\n');

        for (int i = 0; i < node.children.size(); i++) {
            formatNode(sb, node.children.get(i), childPrefix, i == node.children.size() - 1);
        }
    }
}
