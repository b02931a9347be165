package sa.com.cloudsolutions.fortree.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceScannerTest {

    @Test
    void listsSourceFiles(@TempDir Path dir) throws IOException {
        Files.createDirectories(dir.resolve("src/sub"));
        Files.writeString(dir.resolve("src/b.F90"), "");
        Files.writeString(dir.resolve("src/sub/a.f"), "");
        Files.writeString(dir.resolve("src/notes.txt"), "");
        Files.writeString(dir.resolve("src/Makefile"), "");
        Files.writeString(dir.resolve("src/tree.JSON"), "");

        SourceScanner scanner = new SourceScanner(List.of(dir.resolve("src").toString(), dir.resolve("none").toString()),
                List.of("", ".json", ".txt"));

        assertEquals(List.of(dir.resolve("src/b.F90").toString(), dir.resolve("src/sub/a.f").toString()),
                scanner.getFiles());
    }

    @Test
    void extension() {
        assertEquals(".f90", SourceScanner.extension(Path.of("a/b.F90")));
        assertEquals("", SourceScanner.extension(Path.of("a/Makefile")));
        assertEquals("", SourceScanner.extension(Path.of(".hidden")));
    }
}
