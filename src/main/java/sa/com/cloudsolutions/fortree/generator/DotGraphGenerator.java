package sa.com.cloudsolutions.fortree.generator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sa.com.cloudsolutions.fortree.configuration.Settings;
import sa.com.cloudsolutions.fortree.depsolver.DependencyGraph;
import sa.com.cloudsolutions.fortree.depsolver.DependencyTree;
import sa.com.cloudsolutions.fortree.depsolver.FileRecord;
import sa.com.cloudsolutions.fortree.depsolver.ScopeKind;
import sa.com.cloudsolutions.fortree.depsolver.ScopePath;
import sa.com.cloudsolutions.fortree.exception.RenderException;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Draws the neighbourhood of some files or units of a {@link DependencyTree} with Graphviz.
 *
 * <p>
 * The graph starts from the central nodes and follows <code>maxLower</code> levels of outgoing
 * edges and <code>maxUpper</code> levels of incoming edges; <code>null</code> means no limit.
 * A <code>.dot</code> output receives the description itself, any other extension is handed to
 * the dot command as the output format.
 * </p>
 */
public class DotGraphGenerator {
    private static final Logger logger = LoggerFactory.getLogger(DotGraphGenerator.class);
    private static final long RENDER_TIMEOUT_SECONDS = 120;

    private final DependencyTree tree;
    private final String dotCommand;

    public DotGraphGenerator(DependencyTree tree) {
        this(tree, Settings.getDotCommand());
    }

    public DotGraphGenerator(DependencyTree tree, String dotCommand) {
        this.tree = tree;
        this.dotCommand = dotCommand;
    }

    public void plotCompilTreeFromFile(String filename, Path output, Integer maxUpper, Integer maxLower)
            throws RenderException {
        render(compilationDot(List.of(FileRecord.normalizePath(filename)), maxUpper, maxLower, true), output);
    }

    public void plotCompilTreeFromScope(ScopePath scope, Path output, Integer maxUpper, Integer maxLower)
            throws RenderException {
        render(compilationDot(tree.scopeToFiles(scope), maxUpper, maxLower, false), output);
    }

    public void plotExecTreeFromScope(ScopePath scope, Path output, Integer maxUpper, Integer maxLower)
            throws RenderException {
        render(executionDot(List.of(scope), maxUpper, maxLower, false), output);
    }

    public void plotExecTreeFromFile(String filename, Path output, Integer maxUpper, Integer maxLower)
            throws RenderException {
        render(executionDot(tree.fileToScopes(filename), maxUpper, maxLower, true), output);
    }

    /**
     * Graph of the files needed by, and needing, the central files.
     *
     * @param frame group the central files in a frame
     */
    public String compilationDot(Collection<String> centralFiles, Integer maxUpper, Integer maxLower, boolean frame) {
        DotBuilder<String> dot = new DotBuilder<>(tree.getCompilationGraph().getGraph(), f -> null, f -> "black");
        for (String file : centralFiles) {
            dot.central(file, null);
        }
        for (String file : centralFiles) {
            dot.walk(file, maxLower, true);
            dot.walk(file, maxUpper, false);
        }
        if (frame) {
            dot.frame(centralFiles, null);
        }
        return dot.toString();
    }

    /**
     * Graph of the units called by, and calling, the central units. Every unit is drawn inside a
     * box naming its file; when all the central units come from the same file they share one frame.
     *
     * @param frame group the central units in a frame
     */
    public String executionDot(Collection<ScopePath> centralScopes, Integer maxUpper, Integer maxLower, boolean frame) {
        DotBuilder<ScopePath> dot = new DotBuilder<>(tree.getExecutionGraph(), this::fileOf,
                s -> !s.isAmbiguous() && s.getKind() == ScopeKind.FUNCTION ? "blue" : "green");

        Set<String> centralFiles = new LinkedHashSet<>();
        for (ScopePath scope : centralScopes) {
            centralFiles.add(fileOf(scope));
        }
        boolean sameFile = centralFiles.size() == 1;

        for (ScopePath scope : centralScopes) {
            dot.central(scope, sameFile ? null : fileOf(scope));
        }
        for (ScopePath scope : centralScopes) {
            dot.walk(scope, maxLower, true);
            dot.walk(scope, maxUpper, false);
        }
        if (frame || sameFile) {
            dot.frame(centralScopes, sameFile ? centralFiles.iterator().next() : null);
        }
        return dot.toString();
    }

    /**
     * Writes the description, or runs the dot command when the output is not a <code>.dot</code> file.
     */
    public void render(String dot, Path output) throws RenderException {
        String format = extension(output);
        if (format.equals("dot")) {
            try {
                Files.writeString(output, dot, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new RenderException("Could not write " + output, e);
            }
            return;
        }

        List<String> command = List.of(dotCommand, "-T" + format, "-o", output.toString());
        logger.info("Dot command: {}", String.join(" ", command));
        Path errors = null;
        try {
            // a file rather than a pipe, dot may write more warnings than the pipe holds
            errors = Files.createTempFile("fortree-dot", ".err");
            Process process = new ProcessBuilder(command)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectError(errors.toFile())
                    .start();
            try (OutputStream in = process.getOutputStream()) {
                in.write(dot.getBytes(StandardCharsets.UTF_8));
            }
            if (!process.waitFor(RENDER_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new RenderException(dotCommand + " timed out after " + RENDER_TIMEOUT_SECONDS + " seconds");
            }
            if (process.exitValue() != 0) {
                String stderr = Files.readString(errors, StandardCharsets.UTF_8);
                throw new RenderException(dotCommand + " exited with code " + process.exitValue() + ": " + stderr);
            }
        } catch (IOException e) {
            throw new RenderException("Could not run " + dotCommand, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RenderException("Interrupted while running " + dotCommand, e);
        } finally {
            deleteQuietly(errors);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.debug("Could not delete {}: {}", file, e.getMessage());
        }
    }

    static String extension(Path output) {
        String name = output.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private String fileOf(ScopePath scope) {
        if (scope.isAmbiguous()) {
            return null;
        }
        List<String> files = tree.scopeToFiles(scope);
        return files.isEmpty() ? null : files.get(0);
    }

    /**
     * Accumulates the statements of one digraph; a statement is never emitted twice.
     */
    private static class DotBuilder<N> {
        private final DependencyGraph<N> graph;
        private final Function<N, String> label;
        private final Function<N, String> color;
        private final Map<N, String> ids = new LinkedHashMap<>();
        private final Set<String> statements = new LinkedHashSet<>();
        private final Set<N> central = new HashSet<>();

        DotBuilder(DependencyGraph<N> graph, Function<N, String> label, Function<N, String> color) {
            this.graph = graph;
            this.label = label;
            this.color = color;
        }

        String id(N node) {
            return ids.computeIfAbsent(node, n -> "n" + ids.size());
        }

        /**
         * Central nodes keep the place given here even when a walk reaches them again.
         */
        void central(N node, String clusterLabel) {
            central.add(node);
            node(node, clusterLabel);
        }

        void node(N node, String clusterLabel) {
            StringBuilder sb = new StringBuilder();
            if (clusterLabel != null) {
                sb.append("subgraph cluster_").append(id(node)).append(" {\n");
                sb.append("label=\"").append(escape(clusterLabel)).append("\"\n");
            }
            sb.append(id(node)).append(" [label=\"").append(escape(node.toString()))
                    .append("\" color=\"").append(color.apply(node)).append("\"]\n");
            if (clusterLabel != null) {
                sb.append("}\n");
            }
            statements.add(sb.toString());
        }

        void link(N from, N to) {
            statements.add(id(from) + " -> " + id(to) + "\n");
        }

        void walk(N start, Integer level, boolean down) {
            if (level != null && level <= 0) {
                return;
            }
            Set<N> expanded = new HashSet<>();
            expanded.add(start);
            Deque<N> queue = new ArrayDeque<>();
            Map<N, Integer> depth = new LinkedHashMap<>();
            queue.add(start);
            depth.put(start, 0);
            while (!queue.isEmpty()) {
                N current = queue.poll();
                int d = depth.get(current);
                for (N next : down ? graph.successors(current) : graph.predecessors(current)) {
                    if (!central.contains(next)) {
                        node(next, label.apply(next));
                    }
                    if (down) {
                        link(current, next);
                    } else {
                        link(next, current);
                    }
                    if ((level == null || d + 1 < level) && expanded.add(next)) {
                        depth.put(next, d + 1);
                        queue.add(next);
                    }
                }
            }
        }

        void frame(Collection<N> nodes, String frameLabel) {
            StringBuilder sb = new StringBuilder("subgraph cluster_R {\n{rank=same");
            for (N n : nodes) {
                sb.append(' ').append(id(n));
            }
            sb.append("}\n");
            if (frameLabel != null) {
                sb.append("label=\"").append(escape(frameLabel)).append("\"\n");
            }
            sb.append("}\n");
            statements.add(sb.toString());
        }

        private static String escape(String text) {
            return text.replace("\\", "\\\\").replace("\"", "\\\"");
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("digraph D {\n");
            statements.forEach(sb::append);
            return sb.append("}\n").toString();
        }
    }
}
