package info.isaksson.erland.uast.format;

import info.isaksson.erland.uast.json.UastJson;
import info.isaksson.erland.uast.model.InvalidInputException;
import info.isaksson.erland.uast.model.Uast;

import java.io.IOException;

/** JSON output, compact or pretty-printed. */
public final class JsonFormat implements UastFormat {
    public final boolean pretty;

    public JsonFormat(boolean pretty) {
        this.pretty = pretty;
    }

    @Override
    public String format(Uast uast) throws IOException {
        if (uast == null) throw new InvalidInputException("cannot format null UAST");
        return UastJson.toJsonString(uast, pretty);
    }
}
