package info.isaksson.erland.uast.query;

import info.isaksson.erland.uast.model.UastNode;
import info.isaksson.erland.uast.model.UastNodeType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class CommonAncestorsTest {

    private static UastNode n(String id, UastNode... children) {
        return new UastNode(id, UastNodeType.UNKNOWN, id, List.of(), List.of(children), Map.of(), null);
    }

    // R[A[X, Y[Z]], B]
    private final UastNode z = n("z");
    private final UastNode y = n("y", z);
    private final UastNode x = n("x");
    private final UastNode a = n("a", x, y);
    private final UastNode b = n("b");
    private final UastNode r = n("r", a, b);

    @Test
    void nodesInDifferentSubtrees_shareTheRoot() {
        assertSame(r, CommonAncestors.commonAncestor(List.of(x, b), r));
    }

    @Test
    void nodesInOneSubtree_shareTheDeepestCommonParent() {
        assertSame(a, CommonAncestors.commonAncestor(List.of(x, z), r));
        assertSame(a, CommonAncestors.commonAncestor(List.of(z, x, y), r));
    }

    @Test
    void ancestorOfTheOtherNode_isTheAnswer() {
        assertSame(y, CommonAncestors.commonAncestor(List.of(y, z), r));
        assertSame(r, CommonAncestors.commonAncestor(List.of(r, z), r));
    }

    @Test
    void emptyOrNullInput_yieldsNull() {
        assertNull(CommonAncestors.commonAncestor(List.of(), r));
        assertNull(CommonAncestors.commonAncestor(null, r));
    }

    @Test
    void singleNode_isReturnedEvenWhenUnreachable() {
        UastNode stray = n("stray");
        assertSame(stray, CommonAncestors.commonAncestor(List.of(stray), r));
        assertSame(x, CommonAncestors.commonAncestor(List.of(x), null));
    }

    @Test
    void nullRoot_yieldsNullForSeveralNodes() {
        assertNull(CommonAncestors.commonAncestor(List.of(x, b), null));
    }

    @Test
    void unreachableNodes_areIgnored() {
        UastNode stray = n("stray");
        assertSame(a, CommonAncestors.commonAncestor(List.of(x, stray, z), r));
        assertSame(x, CommonAncestors.commonAncestor(Arrays.asList(x, null, stray), r));
    }

    @Test
    void noReachableNodes_yieldsNull() {
        assertNull(CommonAncestors.commonAncestor(List.of(n("p"), n("q")), r));
    }

    @Test
    void repeatedNode_isItsOwnAncestor() {
        assertSame(z, CommonAncestors.commonAncestor(List.of(z, z), r));
    }

    @Test
    void sharedSubtree_isSearchedOnce() {
        UastNode shared = n("s");
        UastNode left = n("l", shared);
        UastNode right = n("rt", shared);
        UastNode root = n("root", left, right);

        assertEquals(List.of(root, left, shared), CommonAncestors.pathTo(shared, root));
        assertSame(root, CommonAncestors.commonAncestor(List.of(shared, right), root));
    }

    @Test
    void nodesWithoutIds_areStillFound() {
        UastNode leaf = n(null);
        UastNode mid = n(null, leaf);
        UastNode other = n(null);
        UastNode root = n(null, mid, other);

        assertSame(root, CommonAncestors.commonAncestor(List.of(leaf, other), root));
    }

    @Test
    void pathTo_runsFromRootToTarget() {
        assertEquals(List.of(r, a, y, z), CommonAncestors.pathTo(z, r));
        assertEquals(List.of(r), CommonAncestors.pathTo(r, r));
        assertTrue(CommonAncestors.pathTo(n("stray"), r).isEmpty());
        assertTrue(CommonAncestors.pathTo(null, r).isEmpty());
        assertTrue(CommonAncestors.pathTo(z, null).isEmpty());
    }
}
