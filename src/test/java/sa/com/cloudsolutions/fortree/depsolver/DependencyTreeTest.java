package sa.com.cloudsolutions.fortree.depsolver;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import sa.com.cloudsolutions.fortree.configuration.Settings;
import sa.com.cloudsolutions.fortree.exception.FortranParseException;
import sa.com.cloudsolutions.fortree.exception.TreeException;
import sa.com.cloudsolutions.fortree.parser.FortranUnitExtractor;
import sa.com.cloudsolutions.fortree.parser.SourceScanner;
import sa.com.cloudsolutions.fortree.parser.UnitExtractor;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DependencyTreeTest {
    private static final String ROOT = "src/test/resources/fortran";
    private static final String MAIN = ROOT + "/app/main.F90";
    private static final String GEOMETRY = ROOT + "/lib/geometry.F90";
    private static final String CONSTANTS = ROOT + "/lib/constants.F90";
    private static final String LOGGING = ROOT + "/lib/logging.F90";
    private static final String FORMAT = ROOT + "/lib/format.h";

    private static final ScopePath PROG = ScopePath.parse("prog:MAIN");
    private static final ScopePath REPORT = ScopePath.parse("module:GEOMETRY/sub:REPORT");
    private static final ScopePath LOG_VALUE = ScopePath.parse("sub:LOG_VALUE");
    private static final ScopePath AREA_CIRCLE = ScopePath.parse("module:GEOMETRY/func:AREA_CIRCLE");
    private static final ScopePath AREA_SQUARE = ScopePath.parse("module:GEOMETRY/func:AREA_SQUARE");

    private static DependencyTree sample;

    @BeforeAll
    static void buildSample() {
        sample = newTree(List.of(ROOT));
        assertTrue(sample.build().isEmpty());
    }

    private static DependencyTree newTree(List<String> roots) {
        return new DependencyTree(new SourceScanner(roots, List.of("", ".txt", ".json")), new FortranUnitExtractor());
    }

    @Test
    void knownFiles() {
        assertEquals(Set.of(MAIN, GEOMETRY, CONSTANTS, LOGGING, FORMAT), sample.knownFiles());
        assertTrue(sample.isValid());
    }

    @Test
    void compilationDependencies() {
        assertEquals(Set.of(GEOMETRY, CONSTANTS), sample.needsFile(MAIN, null));
        assertEquals(Set.of(GEOMETRY), sample.needsFile("./" + MAIN, 1));
        assertEquals(Set.of(FORMAT), sample.needsFile(LOGGING, null));
        assertEquals(Set.of(GEOMETRY, MAIN), sample.neededByFile(CONSTANTS, null));
        assertEquals(Set.of(GEOMETRY), sample.neededByFile(CONSTANTS, 1));
        assertTrue(sample.needsFile(MAIN, 0).isEmpty());
    }

    @Test
    void executionDependencies() {
        assertEquals(Set.of(REPORT, AREA_CIRCLE, AREA_SQUARE), sample.callsScopes(PROG, 1));
        assertEquals(Set.of(REPORT, AREA_CIRCLE, AREA_SQUARE, LOG_VALUE), sample.callsScopes(PROG, null));
        assertEquals(Set.of(REPORT), sample.calledByScope(LOG_VALUE, 1));
        assertEquals(Set.of(REPORT, PROG), sample.calledByScope(LOG_VALUE, null));
    }

    @Test
    void stopScopes() {
        assertTrue(sample.isUnderStopScopes(LOG_VALUE, List.of(PROG)));
        assertFalse(sample.isUnderStopScopes(PROG, List.of(PROG)));
        assertTrue(sample.isUnderStopScopes(PROG, List.of(PROG), false, true));
        assertFalse(sample.isUnderStopScopes(REPORT, List.of(LOG_VALUE)));

        ScopePath member = ScopePath.parse("module:GEOMETRY/interface:AREA/func:AREA_SQUARE");
        assertFalse(sample.isUnderStopScopes(member, List.of(PROG), true, false));
    }

    @Test
    void scopesAndFiles() {
        assertEquals(List.of(GEOMETRY), sample.scopeToFiles(ScopePath.parse("module:GEOMETRY")));
        assertTrue(sample.scopeToFiles(ScopePath.parse("sub:SOLVE")).isEmpty());
        assertEquals(List.of(LOG_VALUE), sample.fileToScopes(LOGGING));
        assertThrows(TreeException.class, () -> sample.fileToScopes(ROOT + "/missing.F90"));
    }

    @Test
    void interfaceLocation() {
        DependencyTree.InterfaceLocation location = sample.findScopeInterface(ScopePath.parse("func:AREA_SQUARE"))
                .orElseThrow();
        assertEquals(GEOMETRY, location.filename());
        assertEquals(ScopePath.parse("module:GEOMETRY/interface:AREA/func:AREA_SQUARE"), location.scope());
        assertTrue(sample.findScopeInterface(LOG_VALUE).isEmpty());
    }

    @Test
    void analysingAgainChangesNothing() throws FortranParseException {
        DependencyTree tree = newTree(List.of(ROOT));
        tree.build();
        Map<ScopePath, List<ScopePath>> execution = new HashMap<>(tree.getExecutionGraph().asMap());
        Map<String, List<String>> compilation = new HashMap<>(tree.getCompilationGraph().getGraph().asMap());

        tree.analyzeFile(GEOMETRY);
        tree.analyzeFile(MAIN);

        assertEquals(execution, tree.getExecutionGraph().asMap());
        assertEquals(compilation, tree.getCompilationGraph().getGraph().asMap());
    }

    @Test
    void graphsFollowTheChanges(@TempDir Path dir) throws IOException, FortranParseException {
        Path a = dir.resolve("a.F90");
        Path b = dir.resolve("b.F90");
        Files.writeString(a, "subroutine a\n  call b\nend subroutine a\n");
        DependencyTree tree = newTree(List.of(dir.toString()));
        tree.build();
        ScopePath subA = ScopePath.parse("sub:A");
        assertTrue(tree.callsScopes(subA, null).isEmpty());

        Files.writeString(b, "subroutine b\nend subroutine b\n");
        tree.analyzeFile(b.toString());
        assertEquals(Set.of(ScopePath.parse("sub:B")), tree.callsScopes(subA, null));

        Files.delete(b);
        assertTrue(tree.rescan().isEmpty());
        assertEquals(Set.of(a.toString()), tree.knownFiles());
        assertTrue(tree.callsScopes(subA, null).isEmpty());
    }

    @Test
    void includeBecomesTrackedOnceTheFileIsAnalysed(@TempDir Path dir) throws IOException, FortranParseException {
        Path a = dir.resolve("a.F90");
        Path x = dir.resolve("x.inc");
        Files.writeString(a, "subroutine a\n  include 'x.inc'\nend subroutine a\n");
        DependencyTree tree = newTree(List.of(dir.toString()));
        tree.build();
        assertEquals(Set.of("x.inc"), tree.needsFile(a.toString(), null));

        Files.writeString(x, "! shared declarations\n");
        tree.analyzeFile(x.toString());
        assertEquals(Set.of(FileRecord.normalizePath(x.toString())), tree.needsFile(a.toString(), 1));

        tree.forget(Set.of(x.toString()));
        assertEquals(Set.of("x.inc"), tree.needsFile(a.toString(), 1));
    }

    @Test
    void failedAnalysisRemovesTheFile(@TempDir Path dir) throws IOException {
        Path a = dir.resolve("a.F90");
        Files.writeString(a, "subroutine a\nend subroutine a\n");
        DependencyTree tree = newTree(List.of(dir.toString()));
        tree.build();
        assertTrue(tree.knownFiles().contains(a.toString()));

        Files.writeString(a, "subroutine a\nend function a\n");
        Map<String, FortranParseException> failures = tree.update(List.of(a.toString()));
        assertEquals(Set.of(a.toString()), failures.keySet());
        assertFalse(tree.knownFiles().contains(a.toString()));
        assertFalse(tree.isValid());
    }

    @Test
    void extractorFailure() throws FortranParseException {
        UnitExtractor extractor = mock(UnitExtractor.class);
        when(extractor.extract("x.F90")).thenThrow(new FortranParseException("x.F90", "broken"));
        DependencyTree tree = new DependencyTree(mock(SourceScanner.class), extractor);
        tree.analyzeRecord(FileRecord.builder("x.F90").unit("sub:X").build());
        assertEquals(List.of(ScopePath.parse("sub:X")), tree.fileToScopes("x.F90"));

        assertThrows(FortranParseException.class, () -> tree.analyzeFile("x.F90"));
        assertTrue(tree.knownFiles().isEmpty());
        assertTrue(tree.getExecutionGraph().nodes().isEmpty());
    }

    @Test
    void signaledFiles(@TempDir Path dir) throws IOException {
        Path a = dir.resolve("a.F90");
        Files.writeString(a, "subroutine a\nend subroutine a\n");
        DependencyTree tree = newTree(List.of(dir.toString()));
        tree.build();

        Files.writeString(a, "subroutine a\n  call c\nend subroutine a\nsubroutine c\nend subroutine c\n");
        tree.signal(a.toString());
        tree.signal(a.toString());
        assertTrue(tree.updateSignaled().isEmpty());
        assertTrue(tree.popSignaled().isEmpty());
        assertEquals(Set.of(ScopePath.parse("sub:C")), tree.callsScopes(ScopePath.parse("sub:A"), null));

        tree.signal("./x.F90");
        assertEquals(Set.of("x.F90"), tree.popSignaled());
    }

    @Test
    void saveAndLoad(@TempDir Path dir) {
        Path json = dir.resolve("out/tree.json");
        sample.save(json);

        DependencyTree restored = newTree(List.of(ROOT));
        restored.load(json);
        assertEquals(sample.knownFiles(), restored.knownFiles());
        assertEquals(sample.getCwd(), restored.getCwd());
        for (ScopePath scope : sample.getExecutionGraph().nodes()) {
            assertEquals(new HashSet<>(sample.getExecutionGraph().successors(scope)),
                    new HashSet<>(restored.getExecutionGraph().successors(scope)), scope.toString());
        }
        assertEquals(sample.needsFile(MAIN, null), restored.needsFile(MAIN, null));

        DependencyTree empty = newTree(List.of(ROOT));
        empty.load(dir.resolve("nothing.json"));
        assertFalse(empty.isValid());
    }

    @Test
    void openBuildsThenLoads(@TempDir Path dir) throws IOException {
        Path json = dir.resolve("tree.json");
        DependencyTree first = newTree(List.of(ROOT));
        assertTrue(first.open(json.toString()).isEmpty());
        assertTrue(Files.exists(json));

        DependencyTree second = newTree(List.of(dir.resolve("elsewhere").toString()));
        second.open(json.toString());
        assertEquals(first.knownFiles(), second.knownFiles());
    }

    @Test
    void fromSettings(@TempDir Path dir) throws IOException {
        Path yml = dir.resolve("fortree.yml");
        Files.writeString(yml, "tree:\n  - " + ROOT + "/lib\ndesc_tree_file: " + dir.resolve("tree.json") + "\n");
        Settings.loadConfigMap(new File(yml.toString()));

        DependencyTree tree = DependencyTree.fromSettings();
        assertEquals(List.of(ROOT + "/lib"), tree.getTree());
        assertEquals(Set.of(GEOMETRY, CONSTANTS, LOGGING, FORMAT), tree.knownFiles());
        assertTrue(Files.exists(dir.resolve("tree.json")));
    }
}
