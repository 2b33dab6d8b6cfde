package info.isaksson.erland.uast.cst;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Concrete syntax tree node as produced by a Tree-sitter style parser.
 *
 * <p>Points are 0-based (row, column); the end point is exclusive. The children list may be
 * empty and may contain {@code null} entries. Nothing here is validated: negative or inverted
 * ranges are carried through as given.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"type","startByte","endByte","startPoint","endPoint","children","text"})
public final class CstNode {
    public final String type;
    public final int startByte;
    public final int endByte;

    @JsonIgnore public final int startRow;
    @JsonIgnore public final int startColumn;
    @JsonIgnore public final int endRow;
    @JsonIgnore public final int endColumn;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<CstNode> children;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final String text;

    @JsonCreator
    public CstNode(
            @JsonProperty("type") String type,
            @JsonProperty("startByte") int startByte,
            @JsonProperty("endByte") int endByte,
            @JsonProperty("startPoint") int[] startPoint,
            @JsonProperty("endPoint") int[] endPoint,
            @JsonProperty("children") List<CstNode> children,
            @JsonProperty("text") String text
    ) {
        this(type, startByte, endByte,
                coordinate(startPoint, 0), coordinate(startPoint, 1),
                coordinate(endPoint, 0), coordinate(endPoint, 1),
                children, text);
    }

    public CstNode(
            String type,
            int startByte,
            int endByte,
            int startRow,
            int startColumn,
            int endRow,
            int endColumn,
            List<CstNode> children,
            String text
    ) {
        this.type = type == null ? "" : type;
        this.startByte = startByte;
        this.endByte = endByte;
        this.startRow = startRow;
        this.startColumn = startColumn;
        this.endRow = endRow;
        this.endColumn = endColumn;
        // null entries are legal here, so List.copyOf is not an option
        this.children = children == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(children));
        this.text = text;
    }

    @JsonProperty("startPoint")
    public int[] startPoint() {
        return new int[] {startRow, startColumn};
    }

    @JsonProperty("endPoint")
    public int[] endPoint() {
        return new int[] {endRow, endColumn};
    }

    public static Builder builder(String type) {
        return new Builder(type);
    }

    private static int coordinate(int[] point, int index) {
        if (point == null || point.length <= index) return 0;
        return point[index];
    }

    @Override public String toString() {
        return "CstNode{" + type + " [" + startRow + "," + startColumn + "]-[" + endRow + "," + endColumn + "]"
                + (text == null ? "" : " '" + text + "'") + "}";
    }

    /** Fluent construction for callers that build CSTs in code. */
    public static final class Builder {
        private final String type;
        private int startByte;
        private int endByte;
        private int startRow;
        private int startColumn;
        private int endRow;
        private int endColumn;
        private String text;
        private final List<CstNode> children = new ArrayList<>();

        private Builder(String type) {
            this.type = type;
        }

        public Builder bytes(int start, int end) {
            this.startByte = start;
            this.endByte = end;
            return this;
        }

        public Builder span(int startRow, int startColumn, int endRow, int endColumn) {
            this.startRow = startRow;
            this.startColumn = startColumn;
            this.endRow = endRow;
            this.endColumn = endColumn;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        /** Appends a child; {@code null} is kept as a null entry. */
        public Builder child(CstNode child) {
            children.add(child);
            return this;
        }

        public Builder children(List<CstNode> more) {
            if (more != null) children.addAll(more);
            return this;
        }

        public CstNode build() {
            return new CstNode(type, startByte, endByte, startRow, startColumn, endRow, endColumn, children, text);
        }
    }
}
