package info.isaksson.erland.uast.core;

import info.isaksson.erland.uast.convert.Converter;
import info.isaksson.erland.uast.cst.CstNode;
import info.isaksson.erland.uast.json.CstJson;
import info.isaksson.erland.uast.model.InvalidInputException;
import info.isaksson.erland.uast.model.Uast;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Core API for turning CSTs into indexed trees.
 *
 * <p>CLI and server wrappers should use this class instead of re-implementing the pipeline. Each
 * call uses a fresh {@link Converter}, so mapping rules of one call never affect another.</p>
 */
public final class UastService {

    private static final Logger logger = LogManager.getLogger(UastService.class);

    /** Convert an in-memory CST. */
    public UastResult convert(CstNode root, UastOptions options) {
        return convert(root, options, null);
    }

    /** Read a CST JSON document and convert it. */
    public UastResult convertFile(Path cstJson, UastOptions options) throws IOException {
        if (cstJson == null) throw new InvalidInputException("cstJson must not be null");
        CstNode root = CstJson.read(cstJson);
        logger.info("Loaded CST from {}", cstJson);
        return convert(root, options, cstJson);
    }

    public Converter newConverter(UastOptions options) {
        if (options == null) options = new UastOptions();
        Converter converter = new Converter(options.converterOptions());
        converter.addMappingRules(options.mappingRules);
        return converter;
    }

    private UastResult convert(CstNode root, UastOptions options, Path source) {
        if (options == null) options = new UastOptions();

        long started = System.nanoTime();
        Uast uast = newConverter(options).convert(root, options.language);
        options.metadata.forEach(uast::addMetadata);
        long elapsed = (System.nanoTime() - started) / 1_000_000L;

        logger.info("Converted {} tree: {} nodes in {} ms", options.language, uast.nodeCount(), elapsed);
        return new UastResult(uast, elapsed, source);
    }
}
