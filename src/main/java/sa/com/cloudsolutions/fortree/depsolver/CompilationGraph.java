package sa.com.cloudsolutions.fortree.depsolver;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The file level graph "file A needs file B to compile", together with the include statements
 * of each unit that could be matched to a tracked file.
 */
public class CompilationGraph {
    private final DependencyGraph<String> graph;
    private final Map<String, Map<ScopePath, List<String>>> resolvedIncludes;

    public CompilationGraph(DependencyGraph<String> graph, Map<String, Map<ScopePath, List<String>>> resolvedIncludes) {
        this.graph = graph;
        this.resolvedIncludes = Collections.unmodifiableMap(resolvedIncludes);
    }

    public DependencyGraph<String> getGraph() {
        return graph;
    }

    /**
     * @return the tracked files included by the unit; unresolved includes are not listed
     */
    public List<String> resolvedIncludes(String filename, ScopePath scope) {
        return resolvedIncludes.getOrDefault(filename, Map.of()).getOrDefault(scope, List.of());
    }
}
