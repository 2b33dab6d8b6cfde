package info.isaksson.erland.uast.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Normalized, language-agnostic node kinds.
 *
 * <p>Raw parser node types are mapped onto this closed set. Anything without a mapping becomes
 * {@link #UNKNOWN}.</p>
 */
public enum UastNodeType {
    FILE("File"),
    FUNCTION("Function"),
    CLASS("Class"),
    METHOD("Method"),
    VARIABLE("Variable"),
    LITERAL("Literal"),
    EXPRESSION("Expression"),
    STATEMENT("Statement"),
    IDENTIFIER("Identifier"),
    COMMENT("Comment"),
    ARGUMENT("Argument"),
    PARAMETER("Parameter"),
    RETURN("Return"),
    LOOP("Loop"),
    CONDITION("Condition"),
    ASSIGNMENT("Assignment"),
    OPERATOR("Operator"),
    CALL("Call"),
    IMPORT("Import"),
    PACKAGE("Package"),
    UNKNOWN("Unknown");

    /** Display and JSON form, e.g. {@code Function}. */
    public final String label;

    UastNodeType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Resolve a label (case-insensitive, also accepts the constant name). Unrecognized or blank
     * input resolves to {@link #UNKNOWN}.
     */
    @JsonCreator
    public static UastNodeType fromLabel(String v) {
        if (v == null) return UNKNOWN;
        String s = v.trim();
        for (UastNodeType t : values()) {
            if (t.label.equalsIgnoreCase(s) || t.name().equalsIgnoreCase(s)) return t;
        }
        return UNKNOWN;
    }

    /**
     * Strict variant of {@link #fromLabel(String)} for user-supplied values (CLI flags).
     */
    public static UastNodeType parseCli(String v) {
        if (v != null) {
            String s = v.trim();
            for (UastNodeType t : values()) {
                if (t.label.equalsIgnoreCase(s) || t.name().equalsIgnoreCase(s)) return t;
            }
        }
        throw new IllegalArgumentException("Invalid node type: " + v + " (expected one of: File, Function, Class, Method, ...)");
    }

    @Override
    public String toString() {
        return label;
    }
}
