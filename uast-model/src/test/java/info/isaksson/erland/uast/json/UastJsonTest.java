package info.isaksson.erland.uast.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import info.isaksson.erland.uast.model.InvalidInputException;
import info.isaksson.erland.uast.model.Uast;
import info.isaksson.erland.uast.model.UastLocation;
import info.isaksson.erland.uast.model.UastNode;
import info.isaksson.erland.uast.model.UastNodeType;
import info.isaksson.erland.uast.model.UastPosition;
import info.isaksson.erland.uast.model.UastRole;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class UastJsonTest {

    private static Uast sample() {
        UastNode name = new UastNode("2", UastNodeType.IDENTIFIER, "main",
                List.of(UastRole.REFERENCE), List.of(), Map.of(UastNode.PROP_TS_TYPE, "identifier"),
                new UastLocation(new UastPosition(1, 6), new UastPosition(1, 10)));
        UastNode body = new UastNode("3", UastNodeType.UNKNOWN, "",
                List.of(UastRole.BODY), null, Map.of(UastNode.PROP_TS_TYPE, "function_body"), null);
        UastNode fn = new UastNode("1", UastNodeType.FUNCTION, "main",
                List.of(UastRole.DECLARATION, UastRole.DEFINITION), List.of(name, body),
                Map.of(UastNode.PROP_TS_TYPE, "function"),
                new UastLocation(new UastPosition(1, 1), new UastPosition(3, 2)));
        Uast uast = new Uast(fn, "go");
        uast.addMetadata("version", "1.0");
        uast.addMetadata("filename", "main.go");
        return uast;
    }

    @Test
    void omitsEmptyCollectionsAndTokensAndUsesLabels() throws Exception {
        JsonNode json = new ObjectMapper().readTree(UastJson.toJsonString(sample()));

        assertEquals("go", json.get("language").asText());
        JsonNode root = json.get("root");
        assertEquals("Function", root.get("type").asText());
        assertEquals("Declaration", root.get("roles").get(0).asText());
        assertEquals(1, root.get("location").get("start").get("line").asInt());

        JsonNode body = root.get("children").get(1);
        assertFalse(body.has("token"), "empty token must be omitted");
        assertFalse(body.has("children"), "empty children must be omitted");
        assertFalse(body.has("location"), "missing location must be omitted");
        assertEquals("function_body", body.get("properties").get("ts_type").asText());

        assertFalse(json.has("typeIndex"));
        assertFalse(json.has("tokenIndex"));
    }

    @Test
    void metadataIsSortedAndOmittedWhenEmpty() throws Exception {
        String s = UastJson.toJsonString(sample(), false);
        assertTrue(s.indexOf("\"filename\"") < s.indexOf("\"version\""), s);

        Uast bare = new Uast(sample().root, "go");
        assertFalse(UastJson.toJsonString(bare, false).contains("metadata"));
    }

    @Test
    void readRebuildsIndices(@TempDir Path tmp) throws Exception {
        Path out = tmp.resolve("nested/dir/tree.uast.json");
        UastJson.write(sample(), out);
        String written = Files.readString(out, StandardCharsets.UTF_8);
        assertTrue(written.endsWith("\n"));

        Uast back = UastJson.read(out);
        assertEquals("go", back.language);
        assertEquals("main.go", back.metadataValue("filename"));
        assertEquals(3, back.nodeCount());
        assertEquals(2, back.findByToken("main").size());
        assertEquals(List.of(UastRole.BODY), back.findByType(UastNodeType.UNKNOWN).get(0).roles);

        // writing the re-read tree is byte-for-byte stable
        Path again = tmp.resolve("again.json");
        UastJson.write(back, again);
        assertEquals(written, Files.readString(again, StandardCharsets.UTF_8));
    }

    @Test
    void unknownTypeLabelsReadAsUnknown() throws Exception {
        Uast u = UastJson.readFromString("{\"root\":{\"id\":\"1\",\"type\":\"Lambda\"},\"language\":\"x\"}");
        assertEquals(UastNodeType.UNKNOWN, u.root.type);
        assertEquals(1, u.findByType(UastNodeType.UNKNOWN).size());
    }

    @Test
    void rejectsNullArguments() {
        assertThrows(InvalidInputException.class, () -> UastJson.toJsonString(null));
        assertThrows(InvalidInputException.class, () -> UastJson.write(null, Path.of("x.json")));
        assertThrows(InvalidInputException.class, () -> UastJson.readFromString(null));
    }

    @Test
    void nullChildrenInDocumentAreDropped() throws Exception {
        Uast u = UastJson.readFromString(
                "{\"root\":{\"id\":\"1\",\"type\":\"File\",\"children\":[null,{\"id\":\"2\",\"type\":\"Identifier\",\"token\":\"x\"},null]},\"language\":\"go\"}");

        assertEquals(1, u.root.children.size());
        assertEquals("x", u.root.children.get(0).token);
        assertEquals(2, u.nodeCount());
    }

    @Test
    void deeplyNestedTreesSurviveWriteAndRead(@TempDir Path tmp) throws Exception {
        int depth = 600;
        UastNode node = new UastNode(Integer.toString(depth), UastNodeType.IDENTIFIER, "leaf", List.of(), List.of(), Map.of(), null);
        for (int i = depth - 1; i > 0; i--) {
            node = new UastNode(Integer.toString(i), UastNodeType.EXPRESSION, null, List.of(), List.of(node), Map.of(), null);
        }
        Uast uast = new Uast(node, "go");

        String compact = CstJsonTest.onLargeStack(() -> UastJson.toJsonString(uast, false));
        Uast back = CstJsonTest.onLargeStack(() -> UastJson.readFromString(compact));
        assertEquals(depth, back.nodeCount());
        assertEquals(1, back.findByToken("leaf").size());

        Path out = tmp.resolve("deep.uast.json");
        CstJsonTest.onLargeStack(() -> {
            UastJson.write(uast, out);
            return null;
        });
        assertEquals(depth, CstJsonTest.onLargeStack(() -> UastJson.read(out)).nodeCount());
    }
}
