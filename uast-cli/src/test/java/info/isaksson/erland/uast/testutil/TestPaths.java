package info.isaksson.erland.uast.testutil;

import java.nio.file.Files;
import java.nio.file.Path;

/** Test helper to resolve paths relative to the repository root in multi-module builds. */
public final class TestPaths {

    private TestPaths() {}

    public static Path repoRoot() {
        Path p = Path.of("").toAbsolutePath().normalize();
        for (int i = 0; i < 10; i++) {
            if (Files.isDirectory(p.resolve("samples").resolve("cst"))) return p;
            p = p.getParent();
            if (p == null) break;
        }
        throw new IllegalStateException("Could not locate repo root (folder containing 'samples/cst'). Start dir: " + Path.of("").toAbsolutePath());
    }

    public static Path sampleCst(String name) {
        return repoRoot().resolve("samples").resolve("cst").resolve(name);
    }
}
