package info.isaksson.erland.uast.json;

import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import info.isaksson.erland.uast.model.InvalidInputException;
import info.isaksson.erland.uast.model.Uast;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON serialization for converted trees.
 *
 * <p>Only {@code root}, {@code language} and {@code metadata} are written. Empty collections and
 * empty tokens are omitted. Indices are rebuilt when reading.</p>
 */
public final class UastJson {

    private static final ObjectMapper MAPPER = JsonSupport.createMapper();
    private static final DefaultPrettyPrinter PRETTY = JsonSupport.createPrettyPrinter();

    private UastJson() {}

    public static Uast read(Path path) throws IOException {
        if (path == null) throw new InvalidInputException("path is null");
        try (var in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, Uast.class);
        }
    }

    public static Uast readFromString(String json) throws IOException {
        if (json == null) throw new InvalidInputException("json is null");
        return MAPPER.readValue(json, Uast.class);
    }

    public static void write(Uast uast, Path path) throws IOException {
        if (uast == null) throw new InvalidInputException("cannot save null UAST");
        if (path == null) throw new InvalidInputException("path is null");
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (var out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, uast);
            // Ensure trailing newline for diff-friendliness.
            out.write('\n');
        }
    }

    public static String toJsonString(Uast uast) throws IOException {
        return toJsonString(uast, true);
    }

    public static String toJsonString(Uast uast, boolean pretty) throws IOException {
        if (uast == null) throw new InvalidInputException("cannot format null UAST");
        if (pretty) {
            return MAPPER.writer(PRETTY).writeValueAsString(uast) + "\n";
        }
        return MAPPER.writeValueAsString(uast);
    }
}
