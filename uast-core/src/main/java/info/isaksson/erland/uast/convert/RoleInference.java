package info.isaksson.erland.uast.convert;

import info.isaksson.erland.uast.model.UastNodeType;
import info.isaksson.erland.uast.model.UastRole;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives structural roles from a node's normalized type and its raw parser type.
 *
 * <p>Type-derived roles come first, raw-type roles are appended. Both may apply to one node.</p>
 */
public final class RoleInference {

    private RoleInference() {}

    public static List<UastRole> inferRoles(UastNodeType type, String rawType) {
        List<UastRole> roles = new ArrayList<>(2);

        if (type != null) {
            switch (type) {
                case FUNCTION:
                case METHOD:
                case CLASS:
                    roles.add(UastRole.DECLARATION);
                    roles.add(UastRole.DEFINITION);
                    break;
                case CALL:
                    roles.add(UastRole.CALL);
                    break;
                case IDENTIFIER:
                    roles.add(UastRole.REFERENCE);
                    break;
                case IMPORT:
                    roles.add(UastRole.IMPORT);
                    break;
                case STATEMENT:
                    roles.add(UastRole.STATEMENT);
                    break;
                case EXPRESSION:
                    roles.add(UastRole.EXPRESSION);
                    break;
                case ARGUMENT:
                case PARAMETER:
                    roles.add(UastRole.ARGUMENT);
                    break;
                case CONDITION:
                    roles.add(UastRole.CONDITION);
                    break;
                default:
                    break;
            }
        }

        if ("method_receiver".equals(rawType)) {
            roles.add(UastRole.RECEIVER);
        } else if ("function_body".equals(rawType) || "method_body".equals(rawType)) {
            roles.add(UastRole.BODY);
        }

        return roles;
    }
}
