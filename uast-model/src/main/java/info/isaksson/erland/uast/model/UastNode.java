package info.isaksson.erland.uast.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of the universal abstract syntax tree.
 *
 * <p>Nodes are immutable once built and own their children exclusively. Equality is identity:
 * two structurally equal nodes at different tree positions are different nodes.</p>
 */
@JsonPropertyOrder({"id","type","token","roles","children","properties","location"})
public final class UastNode {

    /** Property holding the raw parser node type the node was converted from. */
    public static final String PROP_TS_TYPE = "ts_type";

    public final String id;
    public final UastNodeType type;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final String token;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<UastRole> roles;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<UastNode> children;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final Map<String, String> properties;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final UastLocation location;

    @JsonCreator
    public UastNode(
            @JsonProperty("id") String id,
            @JsonProperty("type") UastNodeType type,
            @JsonProperty("token") String token,
            @JsonProperty("roles") List<UastRole> roles,
            @JsonProperty("children") List<UastNode> children,
            @JsonProperty("properties") Map<String, String> properties,
            @JsonProperty("location") UastLocation location
    ) {
        this.id = id;
        this.type = type == null ? UastNodeType.UNKNOWN : type;
        this.token = token;
        this.roles = roles == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(roles));
        this.children = children == null ? List.of() : nonNull(children);
        this.properties = properties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        this.location = location;
    }

    private static List<UastNode> nonNull(List<UastNode> children) {
        List<UastNode> out = new ArrayList<>(children.size());
        for (UastNode c : children) {
            if (c != null) out.add(c);
        }
        return Collections.unmodifiableList(out);
    }

    public boolean hasToken() {
        return token != null && !token.isEmpty();
    }

    /** Raw parser type, or {@code null} if the node did not come from a conversion. */
    public String tsType() {
        return properties.get(PROP_TS_TYPE);
    }

    @Override public String toString() {
        return "UastNode{" + id + " " + type.label + (hasToken() ? " '" + token + "'" : "") + "}";
    }
}
