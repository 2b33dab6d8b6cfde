package info.isaksson.erland.uast.core;

import info.isaksson.erland.uast.convert.ConverterOptions;
import info.isaksson.erland.uast.model.UastNodeType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options for {@link UastService}. Mirrors the CLI flags in structured form.
 */
public final class UastOptions {
    public String language = "unknown";

    /** Extra raw type mappings applied on top of the defaults; later entries win. */
    public final Map<String, UastNodeType> mappingRules = new LinkedHashMap<>();

    /** Copied onto the resulting tree. */
    public final Map<String, String> metadata = new LinkedHashMap<>();

    /** {@code <= 0} keeps the converter default. */
    public int parallelThreshold = 0;

    /** {@code <= 0} keeps the converter default. */
    public int maxConcurrent = 0;

    ConverterOptions converterOptions() {
        ConverterOptions o = new ConverterOptions();
        if (parallelThreshold > 0) o.parallelThreshold = parallelThreshold;
        if (maxConcurrent > 0) o.maxConcurrent = maxConcurrent;
        return o;
    }
}
