package sa.com.cloudsolutions.fortree.depsolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns the raw INCLUDE and USE references of every file into file to file edges.
 */
public class CompilationGraphBuilder {
    private static final Logger logger = LoggerFactory.getLogger(CompilationGraphBuilder.class);

    private final IncludeResolver includeResolver;

    public CompilationGraphBuilder() {
        this(new IncludeResolver());
    }

    public CompilationGraphBuilder(IncludeResolver includeResolver) {
        this.includeResolver = includeResolver;
    }

    public CompilationGraph build(ProjectIndex index) {
        Map<String, Set<String>> edges = new LinkedHashMap<>();
        Map<String, Map<ScopePath, List<String>>> resolved = new HashMap<>();
        Set<String> tracked = index.knownFiles();
        for (String f : tracked) {
            edges.put(f, new LinkedHashSet<>());
        }

        for (FileRecord fileRecord : index.records()) {
            String filename = fileRecord.filename();
            Map<ScopePath, List<String>> resolvedInFile = new HashMap<>();
            for (Map.Entry<ScopePath, List<String>> e : fileRecord.includes().entrySet()) {
                List<String> found = new ArrayList<>();
                for (String inc : e.getValue()) {
                    Optional<String> target = includeResolver.resolve(filename, inc, tracked);
                    if (target.isPresent()) {
                        edges.get(filename).add(target.get());
                        found.add(target.get());
                    } else {
                        // kept as a literal so that the missing file shows up in the graph
                        logger.debug("Include {} of {} is not part of the tree", inc, filename);
                        edges.get(filename).add(inc);
                    }
                }
                resolvedInFile.put(e.getKey(), found);
            }
            resolved.put(filename, resolvedInFile);
        }

        for (FileRecord fileRecord : index.records()) {
            for (List<UseStatement> uses : fileRecord.uses().values()) {
                for (UseStatement use : uses) {
                    addUseEdge(index, fileRecord.filename(), use, edges);
                }
            }
        }
        return new CompilationGraph(new DependencyGraph<>(edges), resolved);
    }

    private void addUseEdge(ProjectIndex index, String filename, UseStatement use, Map<String, Set<String>> edges) {
        ScopePath module = ScopePath.of(ScopeKind.MODULE, use.module());
        List<String> found = index.filesDefining(module);
        if (found.size() == 1) {
            edges.get(filename).add(found.get(0));
        } else if (found.isEmpty()) {
            logger.info("No file containing the scope path {} has been found for file {}", module, filename);
        } else {
            logger.error("Several files containing the scope path {} have been found for file {}: {}",
                    module, filename, found);
        }
    }
}
