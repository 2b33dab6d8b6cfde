package info.isaksson.erland.uast.core;

import info.isaksson.erland.uast.cst.CstNode;
import info.isaksson.erland.uast.json.CstJson;
import info.isaksson.erland.uast.model.InvalidInputException;
import info.isaksson.erland.uast.model.UastNodeType;
import info.isaksson.erland.uast.testutil.SampleTrees;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class UastServiceTest {

    @TempDir
    Path tmp;

    @Test
    void convert_appliesLanguageMetadataAndMappings() {
        UastOptions options = new UastOptions();
        options.language = "rust";
        options.metadata.put("source", "lib.rs");
        options.mappingRules.put("impl_block", UastNodeType.CLASS);

        CstNode cst = CstNode.builder("program")
                .child(CstNode.builder("impl_block").text("Point").build())
                .build();
        UastResult result = new UastService().convert(cst, options);

        assertEquals("rust", result.uast.language);
        assertEquals("lib.rs", result.uast.metadataValue("source"));
        assertEquals(1, result.uast.findByType(UastNodeType.CLASS).size());
        assertEquals(2, result.nodeCount);
        assertNull(result.source);
        assertTrue(result.elapsedMillis >= 0);
    }

    @Test
    void convert_withNullOptionsUsesDefaults() {
        UastResult result = new UastService().convert(SampleTrees.exampleGoCst(), null);
        assertEquals("unknown", result.uast.language);
        assertEquals(8, result.nodeCount);
    }

    @Test
    void mappingRules_doNotLeakAcrossCalls() {
        UastService service = new UastService();
        CstNode cst = CstNode.builder("impl_block").build();

        UastOptions custom = new UastOptions();
        custom.mappingRules.put("impl_block", UastNodeType.CLASS);
        assertEquals(UastNodeType.CLASS, service.convert(cst, custom).uast.root.type);
        assertEquals(UastNodeType.UNKNOWN, service.convert(cst, new UastOptions()).uast.root.type);
    }

    @Test
    void newConverter_carriesParallelSettings() {
        UastOptions options = new UastOptions();
        options.parallelThreshold = 5;
        assertEquals(5, new UastService().newConverter(options).parallelThreshold());
        assertEquals(100, new UastService().newConverter(options).maxConcurrent());
    }

    @Test
    void convertFile_readsCstJson() throws Exception {
        Path cst = tmp.resolve("example-go.json");
        Files.writeString(cst, CstJson.toJsonString(SampleTrees.exampleGoCst()), StandardCharsets.UTF_8);

        UastOptions options = new UastOptions();
        options.language = "go";
        UastResult result = new UastService().convertFile(cst, options);

        assertEquals(cst, result.source);
        assertEquals(8, result.nodeCount);
        assertEquals("Example", result.uast.findByType(UastNodeType.CLASS).get(0).token);
    }

    @Test
    void convertFile_reportsMissingOrBrokenFiles() throws Exception {
        UastService service = new UastService();
        assertThrows(IOException.class, () -> service.convertFile(tmp.resolve("missing.json"), new UastOptions()));

        Path broken = tmp.resolve("broken.json");
        Files.writeString(broken, "{\"type\": \"program\", \"children\": [", StandardCharsets.UTF_8);
        assertThrows(IOException.class, () -> service.convertFile(broken, new UastOptions()));

        assertThrows(InvalidInputException.class, () -> service.convertFile(null, new UastOptions()));
    }
}
