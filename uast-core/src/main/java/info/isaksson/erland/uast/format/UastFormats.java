package info.isaksson.erland.uast.format;

import info.isaksson.erland.uast.model.InvalidInputException;
import info.isaksson.erland.uast.model.Uast;

import java.io.IOException;

public final class UastFormats {

    private UastFormats() {}

    /** Render {@code uast} with {@code format}. */
    public static String toLlmFormat(Uast uast, UastFormat format) throws IOException {
        if (uast == null) throw new InvalidInputException("cannot format null UAST");
        if (format == null) throw new InvalidInputException("formatter cannot be null");
        return format.format(uast);
    }

    /** Resolve a CLI format name: {@code json | text | tree}. */
    public static UastFormat parseCli(String v, boolean pretty, boolean includeLocations) {
        String s = v == null ? "text" : v.trim().toLowerCase();
        switch (s) {
            case "json":
                return new JsonFormat(pretty);
            case "text":
            case "simple":
                return new SimpleTextFormat(includeLocations);
            case "tree":
                return new TreeTextFormat();
            default:
                throw new IllegalArgumentException("Invalid format: " + v + " (expected: json | text | tree)");
        }
    }
}
