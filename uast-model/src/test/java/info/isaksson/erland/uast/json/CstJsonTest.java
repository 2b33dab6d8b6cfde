package info.isaksson.erland.uast.json;

import info.isaksson.erland.uast.cst.CstNode;
import info.isaksson.erland.uast.model.InvalidInputException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class CstJsonTest {

    @Test
    void readsTreeSitterDocumentWithNullChildrenAndUnknownFields() throws Exception {
        CstNode root;
        try (InputStream in = CstJsonTest.class.getResourceAsStream("/cst/sparse.json")) {
            assertNotNull(in, "fixture must exist in test resources");
            root = CstJson.read(in);
        }

        assertEquals("program", root.type);
        assertEquals(42, root.endByte);
        assertEquals(3, root.endRow);
        assertEquals(3, root.children.size());
        assertNull(root.children.get(1), "null entries are preserved for the converter to drop");

        CstNode ident = root.children.get(0);
        assertEquals("identifier", ident.type);
        assertEquals("main", ident.text);
        assertEquals(0, ident.startColumn);
        assertEquals(4, ident.endColumn);
        assertTrue(ident.children.isEmpty(), "absent children decode as an empty list");

        CstNode comment = root.children.get(2);
        assertEquals(1, comment.startRow);
        assertEquals(2, comment.startColumn);
        assertNull(comment.text);
    }

    @Test
    void missingOrShortPointsDefaultToZero() throws Exception {
        CstNode n = CstJson.readFromString("{\"type\":\"x\",\"startPoint\":[7]}");
        assertEquals(7, n.startRow);
        assertEquals(0, n.startColumn);
        assertEquals(0, n.endRow);
        assertEquals(0, n.endColumn);
    }

    @Test
    void writesSparseJson() throws Exception {
        CstNode n = CstNode.builder("identifier").bytes(1, 5).span(0, 1, 0, 5).text("main").build();
        String json = CstJson.toJsonString(n);
        assertTrue(json.contains("\"startPoint\""), json);
        assertFalse(json.contains("\"children\""), "empty children are omitted: " + json);
        assertFalse(json.contains("startRow"), json);

        CstNode back = CstJson.readFromString(json);
        assertEquals(1, back.startColumn);
        assertEquals(5, back.endColumn);
        assertEquals("main", back.text);
    }

    @Test
    void rejectsNullArguments() {
        assertThrows(InvalidInputException.class, () -> CstJson.read((InputStream) null));
        assertThrows(InvalidInputException.class, () -> CstJson.read((Path) null));
        assertThrows(InvalidInputException.class, () -> CstJson.readFromString(null));
    }

    @Test
    void malformedJsonIsAnIoError() {
        InputStream in = new ByteArrayInputStream("{ not json".getBytes(StandardCharsets.UTF_8));
        assertThrows(IOException.class, () -> CstJson.read(in));
    }

    @Test
    void readsAndWritesDeeplyNestedTrees() throws Exception {
        int depth = 600;
        StringBuilder json = new StringBuilder();
        for (int i = 0; i < depth - 1; i++) {
            json.append("{\"type\":\"binary_expression\",\"children\":[");
        }
        json.append("{\"type\":\"identifier\",\"text\":\"x\"}");
        for (int i = 0; i < depth - 1; i++) {
            json.append("]}");
        }

        CstNode root = onLargeStack(() -> CstJson.readFromString(json.toString()));
        assertEquals(depth, depthOf(root));

        String written = onLargeStack(() -> CstJson.toJsonString(root));
        CstNode back = onLargeStack(() -> CstJson.readFromString(written));
        assertEquals(depth, depthOf(back));
    }

    private static int depthOf(CstNode node) {
        int depth = 0;
        CstNode n = node;
        while (n != null) {
            depth++;
            n = n.children.isEmpty() ? null : n.children.get(0);
        }
        return depth;
    }

    /** Jackson recurses per nesting level; keep deep documents off the default test thread stack. */
    static <T> T onLargeStack(Callable<T> work) throws Exception {
        AtomicReference<T> result = new AtomicReference<>();
        AtomicReference<Exception> failure = new AtomicReference<>();
        Thread t = new Thread(null, () -> {
            try {
                result.set(work.call());
            } catch (Exception e) {
                failure.set(e);
            }
        }, "deep-json", 64L * 1024 * 1024);
        t.start();
        t.join();
        if (failure.get() != null) throw failure.get();
        return result.get();
    }
}
