package sa.com.cloudsolutions.fortree.depsolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sa.com.cloudsolutions.fortree.configuration.Settings;
import sa.com.cloudsolutions.fortree.exception.FortranParseException;
import sa.com.cloudsolutions.fortree.exception.TreeException;
import sa.com.cloudsolutions.fortree.parser.FortranUnitExtractor;
import sa.com.cloudsolutions.fortree.parser.SourceScanner;
import sa.com.cloudsolutions.fortree.parser.UnitExtractor;
import sa.com.cloudsolutions.fortree.persistence.TreeStore;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Knows which program unit is defined in which file of the source tree and how files and units
 * depend on each other.
 *
 * <p>
 * The tree keeps one {@link FileRecord} per analysed file. From these records it derives the
 * compilation graph (file level, built from INCLUDE and USE statements) and the execution graph
 * (unit level, built from CALL statements and function references). Both graphs are computed on
 * first use and thrown away as soon as any record changes; they are always rebuilt in full
 * because a single new file may change how references made in other files are resolved.
 * </p>
 *
 * <p>
 * Instances are not thread safe.
 * </p>
 */
public class DependencyTree {
    private static final Logger logger = LoggerFactory.getLogger(DependencyTree.class);

    /**
     * Where an explicit interface for a unit is declared.
     *
     * @param filename file containing the interface block
     * @param scope the unit as declared inside the interface block
     */
    public record InterfaceLocation(String filename, ScopePath scope) {}

    private final ProjectIndex index = new ProjectIndex();
    private final SourceScanner scanner;
    private final UnitExtractor extractor;
    private final CompilationGraphBuilder compilationGraphBuilder = new CompilationGraphBuilder();
    private final ExecutionGraphBuilder executionGraphBuilder = new ExecutionGraphBuilder();
    private final TreeStore store = new TreeStore();
    private final Set<String> signaled = new LinkedHashSet<>();
    private String cwd = Paths.get("").toAbsolutePath().toString();

    private CompilationGraph compilationGraph;
    private long compilationGraphVersion = -1;
    private DependencyGraph<ScopePath> executionGraph;
    private long executionGraphVersion = -1;

    public DependencyTree(SourceScanner scanner, UnitExtractor extractor) {
        this.scanner = scanner;
        this.extractor = extractor;
    }

    public DependencyTree(List<String> roots) {
        this(new SourceScanner(roots, Settings.getExcludedExtensions()), new FortranUnitExtractor());
    }

    /**
     * Creates the tree described by the configuration: the description file is loaded when it
     * exists, otherwise the directories are scanned and the description file is written.
     */
    public static DependencyTree fromSettings() {
        DependencyTree tree = new DependencyTree(Settings.getTree());
        tree.open(Settings.getDescTreeFile());
        return tree;
    }

    /**
     * Loads the description file if it exists, scans the source directories otherwise.
     *
     * @param descTreeFile json description of the tree, may be null
     * @return the files that could not be analysed
     */
    public Map<String, FortranParseException> open(String descTreeFile) {
        if (descTreeFile != null && Files.exists(Path.of(descTreeFile))) {
            load(Path.of(descTreeFile));
            return Map.of();
        }
        Map<String, FortranParseException> failures = build();
        if (descTreeFile != null) {
            save(Path.of(descTreeFile));
        }
        return failures;
    }

    /**
     * Analyses every file found under the source directories.
     *
     * @return the files that could not be analysed, they are not part of the tree
     */
    public Map<String, FortranParseException> build() {
        return update(scanner.getFiles());
    }

    /**
     * Analyses the new files and forgets the deleted ones.
     */
    public Map<String, FortranParseException> rescan() {
        Set<String> current = new LinkedHashSet<>(scanner.getFiles());
        Set<String> changed = new LinkedHashSet<>(current);
        changed.removeAll(index.knownFiles());
        for (String known : index.knownFiles()) {
            if (!current.contains(known)) {
                changed.add(known);
            }
        }
        return update(changed);
    }

    /**
     * Brings the tree up to date for the given files. Existing files are analysed again, missing
     * files are forgotten. A file that cannot be analysed does not prevent the others from being
     * processed.
     *
     * @return the files that could not be analysed
     */
    public Map<String, FortranParseException> update(Collection<String> filenames) {
        Map<String, FortranParseException> failures = new LinkedHashMap<>();
        for (String filename : filenames) {
            if (Files.isRegularFile(Path.of(filename))) {
                try {
                    analyzeFile(filename);
                } catch (FortranParseException e) {
                    logger.error("Could not analyse {}: {}", filename, e.getMessage());
                    failures.put(FileRecord.normalizePath(filename), e);
                }
            } else {
                forget(Set.of(filename));
            }
        }
        return failures;
    }

    /**
     * Analyses one file and replaces what was known about it.
     *
     * @throws FortranParseException if the file cannot be analysed; the file is then no longer
     *                               part of the tree
     */
    public void analyzeFile(String filename) throws FortranParseException {
        try {
            index.put(extractor.extract(filename));
        } catch (FortranParseException e) {
            index.remove(filename);
            throw e;
        }
    }

    /**
     * Stores a record produced elsewhere, replacing what was known about that file.
     */
    public void analyzeRecord(FileRecord fileRecord) {
        index.put(fileRecord);
    }

    public void forget(Set<String> filenames) {
        for (String f : filenames) {
            index.remove(f);
        }
    }

    public Set<String> knownFiles() {
        return index.knownFiles();
    }

    public boolean isValid() {
        return !index.isEmpty();
    }

    public List<String> getTree() {
        return scanner.getRoots();
    }

    public List<String> getFiles() {
        return scanner.getFiles();
    }

    public String getCwd() {
        return cwd;
    }

    public Optional<FileRecord> getRecord(String filename) {
        return index.get(filename);
    }

    /**
     * Marks a file as modified; it is analysed again by {@link #updateSignaled()}.
     */
    public void signal(String filename) {
        signaled.add(FileRecord.normalizePath(filename));
    }

    /**
     * @return the files signaled since the last call, the list is emptied
     */
    public Set<String> popSignaled() {
        Set<String> result = new LinkedHashSet<>(signaled);
        signaled.clear();
        return result;
    }

    public Map<String, FortranParseException> updateSignaled() {
        return update(popSignaled());
    }

    public void save(Path file) {
        store.save(file, cwd, index.records());
    }

    /**
     * Replaces the whole content of the tree with the saved one. A missing file leaves the tree empty.
     */
    public void load(Path file) {
        Optional<TreeStore.Snapshot> snapshot = store.load(file);
        index.replaceAll(snapshot.map(TreeStore.Snapshot::records).orElse(List.of()));
        snapshot.map(TreeStore.Snapshot::cwd).ifPresent(c -> cwd = c);
    }

    public CompilationGraph getCompilationGraph() {
        if (compilationGraph == null || compilationGraphVersion != index.getVersion()) {
            compilationGraph = compilationGraphBuilder.build(index);
            compilationGraphVersion = index.getVersion();
        }
        return compilationGraph;
    }

    public DependencyGraph<ScopePath> getExecutionGraph() {
        if (executionGraph == null || executionGraphVersion != index.getVersion()) {
            executionGraph = executionGraphBuilder.build(index, getCompilationGraph());
            executionGraphVersion = index.getVersion();
        }
        return executionGraph;
    }

    /**
     * @param filename initial file
     * @param level number of levels, null for no limit
     * @return the files needed to compile the initial file
     */
    public Set<String> needsFile(String filename, Integer level) {
        return Reachability.collect(getCompilationGraph().getGraph(), FileRecord.normalizePath(filename), level,
                Reachability.Direction.DOWN);
    }

    /**
     * @param filename initial file
     * @param level number of levels, null for no limit
     * @return the files that need the initial file to compile
     */
    public Set<String> neededByFile(String filename, Integer level) {
        return Reachability.collect(getCompilationGraph().getGraph(), FileRecord.normalizePath(filename), level,
                Reachability.Direction.UP);
    }

    /**
     * @param scope initial unit
     * @param level number of levels, null for no limit
     * @return the units called by the initial unit
     */
    public Set<ScopePath> callsScopes(ScopePath scope, Integer level) {
        return Reachability.collect(getExecutionGraph(), scope, level, Reachability.Direction.DOWN);
    }

    /**
     * @param scope initial unit
     * @param level number of levels, null for no limit
     * @return the units calling the initial unit
     */
    public Set<ScopePath> calledByScope(ScopePath scope, Integer level) {
        return Reachability.collect(getExecutionGraph(), scope, level, Reachability.Direction.UP);
    }

    public boolean isUnderStopScopes(ScopePath scope, Collection<ScopePath> stopScopes) {
        return isUnderStopScopes(scope, stopScopes, false, false);
    }

    /**
     * Tells whether the unit is called, directly or not, by one of the stop scopes.
     *
     * @param scope unit to test
     * @param stopScopes the units bounding the search
     * @param includeInterfaces when the unit is declared in an interface block, the test is done on
     *                          the unit implementing it; false if no such unit is known
     * @param includeStopScopes when true, a unit that is itself a stop scope is under the stop scopes
     */
    public boolean isUnderStopScopes(ScopePath scope, Collection<ScopePath> stopScopes,
                                     boolean includeInterfaces, boolean includeStopScopes) {
        if (includeInterfaces && scope.isInterfaceMember()) {
            ScopePath implementation = scope.leaf();
            if (getExecutionGraph().contains(implementation)) {
                return isUnderStopScopes(implementation, stopScopes, false, includeStopScopes);
            }
            return false;
        }
        if (includeStopScopes && stopScopes.contains(scope)) {
            return true;
        }
        return Reachability.reachesAny(getExecutionGraph(), scope, stopScopes, Reachability.Direction.UP);
    }

    /**
     * @return the files in which the unit is defined
     */
    public List<String> scopeToFiles(ScopePath scope) {
        return index.filesDefining(scope);
    }

    /**
     * @return the units defined in the file
     * @throws TreeException if the file is not part of the tree
     */
    public List<ScopePath> fileToScopes(String filename) {
        return index.get(filename)
                .map(FileRecord::units)
                .orElseThrow(() -> new TreeException(filename + " is not part of the tree"));
    }

    /**
     * Looks for an interface block declaring the given unit.
     */
    public Optional<InterfaceLocation> findScopeInterface(ScopePath scope) {
        List<ScopePath.Segment> wanted = scope.getSegments();
        for (FileRecord fileRecord : index.records()) {
            for (ScopePath unit : fileRecord.units()) {
                List<ScopePath.Segment> segments = unit.getSegments();
                int start = segments.size() - wanted.size();
                if (start >= 1 && segments.subList(start, segments.size()).equals(wanted)
                        && segments.get(start - 1).kind() == ScopeKind.INTERFACE) {
                    return Optional.of(new InterfaceLocation(fileRecord.filename(), unit));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * All the units of all the files.
     */
    public List<ScopePath> allScopes() {
        return new ArrayList<>(index.allUnits());
    }
}
