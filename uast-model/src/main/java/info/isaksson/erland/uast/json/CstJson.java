package info.isaksson.erland.uast.json;

import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import info.isaksson.erland.uast.cst.CstNode;
import info.isaksson.erland.uast.model.InvalidInputException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Decoding of Tree-sitter style CST JSON documents
 * ({@code type, startByte, endByte, startPoint, endPoint, children, text}).
 */
public final class CstJson {

    private static final ObjectMapper MAPPER = JsonSupport.createMapper();
    private static final DefaultPrettyPrinter PRETTY = JsonSupport.createPrettyPrinter();

    private CstJson() {}

    public static CstNode read(Path path) throws IOException {
        if (path == null) throw new InvalidInputException("path is null");
        try (var in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    /** Decode one CST document from a stream. The stream is not closed. */
    public static CstNode read(InputStream in) throws IOException {
        if (in == null) throw new InvalidInputException("reader cannot be null");
        return MAPPER.readValue(in, CstNode.class);
    }

    public static CstNode readFromString(String json) throws IOException {
        if (json == null) throw new InvalidInputException("json is null");
        return MAPPER.readValue(json, CstNode.class);
    }

    public static String toJsonString(CstNode node) throws IOException {
        if (node == null) throw new InvalidInputException("node is null");
        return MAPPER.writer(PRETTY).writeValueAsString(node) + "\n";
    }
}
