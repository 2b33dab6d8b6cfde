package info.isaksson.erland.uast.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Structural tag on a node, independent of its {@link UastNodeType}.
 */
public enum UastRole {
    DECLARATION("Declaration"),
    DEFINITION("Definition"),
    CALL("Call"),
    REFERENCE("Reference"),
    IMPORT("Import"),
    EXPORT("Export"),
    STATEMENT("Statement"),
    EXPRESSION("Expression"),
    ARGUMENT("Argument"),
    RECEIVER("Receiver"),
    CONDITION("Condition"),
    BODY("Body");

    public final String label;

    UastRole(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static UastRole fromLabel(String v) {
        if (v != null) {
            String s = v.trim();
            for (UastRole r : values()) {
                if (r.label.equalsIgnoreCase(s) || r.name().equalsIgnoreCase(s)) return r;
            }
        }
        throw new IllegalArgumentException("Invalid role: " + v);
    }

    @Override
    public String toString() {
        return label;
    }
}
