package info.isaksson.erland.uast.format;

import info.isaksson.erland.uast.model.UastNode;
import info.isaksson.erland.uast.model.UastRole;

import java.util.List;
import java.util.Map;

/** Line-building helpers shared by the text formats and the LLM processor. */
public final class TextSupport {

    /** Tokens longer than this are shortened by the text formats. */
    public static final int MAX_TOKEN_LENGTH = 100;

    private TextSupport() {}

    /** Cut to {@code max - 3} characters plus {@code ...} when longer than {@code max}. */
    public static String abbreviate(String token, int max) {
        if (token == null) return "";
        if (token.length() <= max) return token;
        return token.substring(0, Math.max(0, max - 3)) + "...";
    }

    /** Cut to {@code max} characters plus {@code ...}; a non-positive {@code max} disables the cut. */
    public static String truncate(String token, int max) {
        if (token == null) return "";
        if (max <= 0 || token.length() <= max) return token;
        return token.substring(0, max) + "...";
    }

    public static void appendRoles(StringBuilder sb, List<UastRole> roles) {
        if (roles == null || roles.isEmpty()) return;
        sb.append(" [");
        appendJoined(sb, roles);
        sb.append(']');
    }

    public static void appendJoined(StringBuilder sb, List<UastRole> roles) {
        for (int i = 0; i < roles.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(roles.get(i).label);
        }
    }

    public static void appendLocation(StringBuilder sb, UastNode node) {
        if (node.location == null) return;
        sb.append(" (").append(node.location).append(')');
    }

    public static void appendHeader(StringBuilder sb, String language, Map<String, String> metadata) {
        sb.append("Language: ").append(language).append('\n');
        if (metadata != null && !metadata.isEmpty()) {
            sb.append("Metadata:\n");
            metadata.forEach((k, v) -> sb.append("  ").append(k).append(": ").append(v).append('\n'));
        }
    }
}
