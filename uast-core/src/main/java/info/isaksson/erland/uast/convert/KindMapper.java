package info.isaksson.erland.uast.convert;

import info.isaksson.erland.uast.model.UastNodeType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps raw parser node types to {@link UastNodeType}.
 *
 * <p>Each converter owns its own mapper, so custom rules registered on one converter never leak
 * into another. Rules are read at conversion time: a rule registered after a conversion does not
 * change trees that were already produced.</p>
 */
public final class KindMapper {

    private final Map<String, UastNodeType> rules = new ConcurrentHashMap<>();

    /** Mapper seeded with {@link #defaultRules()}. */
    public KindMapper() {
        rules.putAll(defaultRules());
    }

    /** Resolve a raw type; unmapped (or null) types resolve to {@link UastNodeType#UNKNOWN}. */
    public UastNodeType mapKind(String rawType) {
        if (rawType == null) return UastNodeType.UNKNOWN;
        UastNodeType t = rules.get(rawType);
        return t == null ? UastNodeType.UNKNOWN : t;
    }

    /** Register or replace the rule for {@code rawType}. */
    public void addMappingRule(String rawType, UastNodeType type) {
        if (rawType == null) throw new IllegalArgumentException("rawType must not be null");
        if (type == null) throw new IllegalArgumentException("type must not be null");
        rules.put(rawType, type);
    }

    /** Sorted snapshot of the current rules. */
    public Map<String, UastNodeType> rules() {
        return new TreeMap<>(rules);
    }

    /** The built-in table every mapper starts from. */
    public static Map<String, UastNodeType> defaultRules() {
        Map<String, UastNodeType> m = new LinkedHashMap<>();
        m.put("program", UastNodeType.FILE);
        m.put("function", UastNodeType.FUNCTION);
        m.put("function_definition", UastNodeType.FUNCTION);
        m.put("method_definition", UastNodeType.METHOD);
        m.put("class_definition", UastNodeType.CLASS);
        m.put("class", UastNodeType.CLASS);
        m.put("identifier", UastNodeType.IDENTIFIER);
        m.put("variable", UastNodeType.VARIABLE);
        m.put("string_literal", UastNodeType.LITERAL);
        m.put("number_literal", UastNodeType.LITERAL);
        m.put("integer_literal", UastNodeType.LITERAL);
        m.put("float_literal", UastNodeType.LITERAL);
        m.put("boolean_literal", UastNodeType.LITERAL);
        m.put("expression", UastNodeType.EXPRESSION);
        m.put("binary_expression", UastNodeType.EXPRESSION);
        m.put("call_expression", UastNodeType.CALL);
        m.put("statement", UastNodeType.STATEMENT);
        m.put("if_statement", UastNodeType.CONDITION);
        m.put("for_statement", UastNodeType.LOOP);
        m.put("while_statement", UastNodeType.LOOP);
        m.put("return_statement", UastNodeType.RETURN);
        m.put("import_statement", UastNodeType.IMPORT);
        m.put("package_declaration", UastNodeType.PACKAGE);
        m.put("comment", UastNodeType.COMMENT);
        return m;
    }
}
