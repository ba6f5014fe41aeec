package etl.engine.source;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

final class SourcePaths {
    private SourcePaths() {}

    static Path resolve(Path baseDir, String path) {
        Path p = Path.of(path);
        if (p.isAbsolute() || baseDir == null) return p;
        return baseDir.resolve(p);
    }

    static void createParent(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
    }
}
