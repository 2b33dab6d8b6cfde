package info.isaksson.erland.uast.format;

import info.isaksson.erland.uast.model.Uast;

import java.io.IOException;

/**
 * Renders a converted tree as text for downstream consumers such as language models.
 */
public interface UastFormat {

    /**
     * @throws info.isaksson.erland.uast.model.InvalidInputException if {@code uast} is null
     */
    String format(Uast uast) throws IOException;
}
