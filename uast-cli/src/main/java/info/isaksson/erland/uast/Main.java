package info.isaksson.erland.uast;

import info.isaksson.erland.uast.core.UastOptions;
import info.isaksson.erland.uast.core.UastResult;
import info.isaksson.erland.uast.core.UastService;
import info.isaksson.erland.uast.format.UastFormat;
import info.isaksson.erland.uast.format.UastFormats;
import info.isaksson.erland.uast.json.UastJson;
import info.isaksson.erland.uast.llm.LlmProcessor;
import info.isaksson.erland.uast.model.UastNodeType;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CLI entrypoint: read a CST JSON document, convert it and print (or write) the rendered tree.
 */
public final class Main {

    private static final UastService SERVICE = new UastService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        if (parsed.cst == null) {
            System.err.println("Error: --cst is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        final Path cstPath = Paths.get(parsed.cst).toAbsolutePath().normalize();
        if (!Files.exists(cstPath) || Files.isDirectory(cstPath)) {
            System.err.println("Error: --cst must point to an existing CST JSON file: " + cstPath);
            return 1;
        }

        final UastResult res;
        try {
            res = SERVICE.convertFile(cstPath, toCoreOptions(parsed));
        } catch (RuntimeException | IOException e) {
            System.err.println("Error: conversion failed.");
            System.err.println(e.getMessage());
            return 2;
        }

        if (parsed.writeUast != null) {
            final Path uastOut = Paths.get(parsed.writeUast).toAbsolutePath().normalize();
            try {
                UastJson.write(res.uast, uastOut);
            } catch (IOException e) {
                System.err.println("Error: could not write UAST to: " + uastOut);
                System.err.println(e.getMessage());
                return 2;
            }
        }

        final String rendered;
        try {
            rendered = render(parsed, res);
        } catch (RuntimeException | IOException e) {
            System.err.println("Error: formatting failed.");
            System.err.println(e.getMessage());
            return 2;
        }

        if (parsed.output == null) {
            System.out.print(rendered);
            if (!rendered.endsWith("\n")) System.out.println();
            return 0;
        }

        final Path out = Paths.get(parsed.output).toAbsolutePath().normalize();
        try {
            Path parent = out.getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(out, rendered);
        } catch (IOException e) {
            System.err.println("Error: could not write output to: " + out);
            System.err.println(e.getMessage());
            return 2;
        }

        System.out.println(
                "cst-to-uast\n" +
                "- CST: " + cstPath + "\n" +
                "- Output: " + out + "\n" +
                (parsed.writeUast != null ? "- UAST: " + Paths.get(parsed.writeUast).toAbsolutePath().normalize() + "\n" : "") +
                "- Language: " + res.uast.language + "\n" +
                "- Nodes: " + res.nodeCount
        );
        return 0;
    }

    private static String render(CliArgs parsed, UastResult res) throws IOException {
        if ("llm".equals(parsed.format)) {
            LlmProcessor processor = new LlmProcessor();
            processor.includeLocations = parsed.locations;
            processor.setFormat(null);
            return processor.process(res.uast);
        }
        UastFormat format = UastFormats.parseCli(parsed.format, parsed.pretty, parsed.locations);
        return UastFormats.toLlmFormat(res.uast, format);
    }

    private static UastOptions toCoreOptions(CliArgs parsed) {
        UastOptions o = new UastOptions();
        o.language = parsed.language;
        o.mappingRules.putAll(parsed.mappings);
        o.metadata.putAll(parsed.metadata);
        o.parallelThreshold = parsed.parallelThreshold;
        o.maxConcurrent = parsed.maxConcurrent;
        return o;
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String cst;
        String language = "unknown";
        String format = "text";
        boolean pretty = true;
        boolean locations = false;
        String output;
        String writeUast;
        int parallelThreshold = 0;
        int maxConcurrent = 0;
        final Map<String, UastNodeType> mappings = new LinkedHashMap<>();
        final Map<String, String> metadata = new LinkedHashMap<>();

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--cst":
                        out.cst = requireValue(args, ++i, "--cst");
                        break;
                    case "--language":
                        out.language = requireValue(args, ++i, "--language");
                        break;
                    case "--format":
                        out.format = parseFormat(requireValue(args, ++i, "--format"));
                        break;
                    case "--pretty":
                        out.pretty = parseBoolean(requireValue(args, ++i, "--pretty"), "--pretty");
                        break;
                    case "--locations":
                        out.locations = true;
                        break;
                    case "--output":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--write-uast":
                        out.writeUast = requireValue(args, ++i, "--write-uast");
                        break;
                    case "--map": {
                        String[] kv = splitPair(requireValue(args, ++i, "--map"), "--map");
                        out.mappings.put(kv[0], UastNodeType.parseCli(kv[1]));
                        break;
                    }
                    case "--meta": {
                        String[] kv = splitPair(requireValue(args, ++i, "--meta"), "--meta");
                        out.metadata.put(kv[0], kv[1]);
                        break;
                    }
                    case "--parallel-threshold":
                        out.parallelThreshold = parseInt(requireValue(args, ++i, "--parallel-threshold"), "--parallel-threshold");
                        break;
                    case "--max-concurrent":
                        out.maxConcurrent = parseInt(requireValue(args, ++i, "--max-concurrent"), "--max-concurrent");
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // allow a bare path as shorthand for --cst
                        if (out.cst == null) {
                            out.cst = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static boolean parseBoolean(String v, String flag) {
            if (v == null) throw new IllegalArgumentException("Missing value for " + flag);
            String s = v.trim().toLowerCase();
            if (s.equals("true") || s.equals("1") || s.equals("yes")) return true;
            if (s.equals("false") || s.equals("0") || s.equals("no")) return false;
            throw new IllegalArgumentException("Invalid boolean for " + flag + ": " + v);
        }

        static int parseInt(String v, String flag) {
            try {
                return Integer.parseInt(v.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for " + flag + ": " + v);
            }
        }

        static String parseFormat(String v) {
            String s = v.trim().toLowerCase();
            switch (s) {
                case "json":
                case "text":
                case "tree":
                case "llm":
                    return s;
                default:
                    throw new IllegalArgumentException("Invalid value for --format: " + v + " (expected one of: json|text|tree|llm)");
            }
        }

        /** Split {@code key=value}; the key must be non-empty. */
        static String[] splitPair(String v, String flag) {
            int idx = v.indexOf('=');
            if (idx <= 0) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v + " (expected key=value)");
            }
            return new String[] {v.substring(0, idx), v.substring(idx + 1)};
        }

        static void printHelp() {
            System.out.println(
                    "cst-to-uast\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar uast-cli.jar --cst <file.json> [--language <lang>] [--format <fmt>] [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --cst <file>               Tree-sitter CST as JSON (required)\n" +
                    "  --language <lang>          Language tag stored on the tree (default: unknown)\n" +
                    "  --format <fmt>             json | text | tree | llm (default: text)\n" +
                    "  --pretty <bool>            Pretty-print JSON output (default: true)\n" +
                    "  --locations                Include line:column ranges in text/llm output\n" +
                    "  --output <file>            Write rendered output to a file (default: stdout)\n" +
                    "  --write-uast <file>        Also write the converted tree as JSON\n" +
                    "  --map <raw>=<Type>         Map a raw CST type to a node type (repeatable),\n" +
                    "                             e.g. --map impl_block=Class\n" +
                    "  --meta <key>=<value>       Attach metadata to the tree (repeatable)\n" +
                    "  --parallel-threshold <n>   Convert children in parallel above n children (default: 50)\n" +
                    "  --max-concurrent <n>       Max concurrent child conversions per node (default: 100)\n" +
                    "  -h, --help                 Show help\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar uast-cli.jar --cst samples/cst/hello-go.json --language go\n" +
                    "  java -jar uast-cli.jar samples/cst/hello-go.json --format tree\n" +
                    "  java -jar uast-cli.jar --cst tree.json --format json --output out/tree.uast.json\n"
            );
        }
    }
}
