package sa.com.cloudsolutions.fortree.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sa.com.cloudsolutions.fortree.depsolver.FileRecord;
import sa.com.cloudsolutions.fortree.exception.TreeException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Lists the source files found below the root directories of the tree.
 */
public class SourceScanner {
    private static final Logger logger = LoggerFactory.getLogger(SourceScanner.class);

    private final List<String> roots;
    private final List<String> excludedExtensions;

    /**
     * @param roots directories to walk
     * @param excludedExtensions extensions (with the leading dot) of the files to ignore; the empty
     *                           string excludes files without extension
     */
    public SourceScanner(Collection<String> roots, Collection<String> excludedExtensions) {
        this.roots = List.copyOf(roots);
        this.excludedExtensions = excludedExtensions.stream().map(e -> e.toLowerCase(Locale.ROOT)).toList();
    }

    public List<String> getRoots() {
        return roots;
    }

    /**
     * @return the normalised names of the files found, sorted
     */
    public List<String> getFiles() {
        List<String> filenames = new ArrayList<>();
        for (String root : roots) {
            Path rootPath = Paths.get(root);
            if (!Files.isDirectory(rootPath)) {
                logger.warn("{} is not a directory, skipped", root);
                continue;
            }
            try (Stream<Path> paths = Files.walk(rootPath)) {
                paths.filter(Files::isRegularFile)
                        .filter(p -> !excludedExtensions.contains(extension(p)))
                        .map(p -> FileRecord.normalizePath(p.toString()))
                        .forEach(filenames::add);
            } catch (IOException e) {
                throw new TreeException("Could not scan " + root, e);
            }
        }
        filenames.sort(null);
        return filenames;
    }

    static String extension(Path p) {
        String name = p.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }
}
