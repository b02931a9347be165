package sa.com.cloudsolutions.fortree.depsolver;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionGraphBuilderTest {
    private static final ScopePath PROG = ScopePath.parse("prog:MAIN");

    private static DependencyGraph<ScopePath> build(ProjectIndex index) {
        return new ExecutionGraphBuilder().build(index, new CompilationGraphBuilder().build(index));
    }

    private static ScopePath p(String text) {
        return ScopePath.parse(text);
    }

    @Test
    void callThroughUse() {
        ProjectIndex index = new ProjectIndex();
        index.put(FileRecord.builder("phys.F90").unit("module:PHYS").unit("module:PHYS/sub:STEP").build());
        index.put(FileRecord.builder("main.F90").use(PROG, new UseStatement("PHYS")).call(PROG, "step").build());

        assertEquals(List.of(p("module:PHYS/sub:STEP")), build(index).successors(PROG));
    }

    @Test
    void onlyClauseFiltersTheImportedNames() {
        ProjectIndex index = new ProjectIndex();
        index.put(FileRecord.builder("phys.F90").unit("module:PHYS").unit("module:PHYS/sub:STEP").build());
        index.put(FileRecord.builder("main.F90")
                .use(PROG, new UseStatement("PHYS", Set.of("INIT")))
                .call(PROG, "STEP").build());

        assertTrue(build(index).successors(PROG).isEmpty());
    }

    @Test
    void useOfTheEnclosingModuleIsVisible() {
        ScopePath sub = p("module:DRIVER/sub:RUN");
        ProjectIndex index = new ProjectIndex();
        index.put(FileRecord.builder("phys.F90").unit("module:PHYS").unit("module:PHYS/sub:STEP").build());
        index.put(FileRecord.builder("driver.F90")
                .use(p("module:DRIVER"), new UseStatement("PHYS"))
                .call(sub, "STEP").build());

        assertEquals(List.of(p("module:PHYS/sub:STEP")), build(index).successors(sub));
    }

    @Test
    void severalLocalDefinitionsGiveTheAmbiguousTarget() {
        ProjectIndex index = new ProjectIndex();
        index.put(FileRecord.builder("m1.F90").unit("module:M1").unit("module:M1/sub:FOO").build());
        index.put(FileRecord.builder("m2.F90").unit("module:M2").unit("module:M2/sub:FOO").build());
        index.put(FileRecord.builder("main.F90")
                .use(PROG, new UseStatement("M1"))
                .use(PROG, new UseStatement("M2"))
                .call(PROG, "FOO").build());

        DependencyGraph<ScopePath> graph = build(index);
        assertEquals(List.of(ScopePath.AMBIGUOUS), graph.successors(PROG));
        assertEquals("??", graph.successors(PROG).get(0).toString());
    }

    @Test
    void externalProcedureMustBeUnique() {
        ProjectIndex index = new ProjectIndex();
        index.put(FileRecord.builder("bar.F90").unit("sub:BAR").build());
        index.put(FileRecord.builder("baz1.F90").unit("sub:BAZ").build());
        index.put(FileRecord.builder("baz2.F90").unit("sub:BAZ").build());
        index.put(FileRecord.builder("main.F90").call(PROG, "BAR").call(PROG, "BAZ").call(PROG, "MISSING").build());

        assertEquals(List.of(p("sub:BAR")), build(index).successors(PROG));
    }

    @Test
    void containedAndSameScopeProcedures() {
        ScopePath a = p("module:M/sub:A");
        ProjectIndex index = new ProjectIndex();
        index.put(FileRecord.builder("m.F90")
                .unit("module:M")
                .unit(a)
                .unit("module:M/sub:A/sub:INNER")
                .unit("module:M/sub:B")
                .call(a, "INNER")
                .call(a, "B")
                .build());

        assertEquals(List.of(p("module:M/sub:A/sub:INNER"), p("module:M/sub:B")), build(index).successors(a));
    }

    @Test
    void includedProcedure() {
        ProjectIndex index = new ProjectIndex();
        index.put(FileRecord.builder("inc/ext.h").unit("sub:EXT").build());
        index.put(FileRecord.builder("main.F90").include(PROG, "inc/ext.h").call(PROG, "EXT").build());

        assertEquals(List.of(p("sub:EXT")), build(index).successors(PROG));
    }

    @Test
    void functionReferences() {
        ProjectIndex index = new ProjectIndex();
        index.put(FileRecord.builder("f.F90").unit("func:NORM").build());
        index.put(FileRecord.builder("main.F90").ambiguousRef(PROG, "NORM").ambiguousRef(PROG, "ARR").build());

        assertEquals(List.of(p("func:NORM")), build(index).successors(PROG));
    }

    @Test
    void genericInterfaceIsReplacedByItsProcedures() {
        ProjectIndex index = new ProjectIndex();
        index.put(FileRecord.builder("gen.F90")
                .unit("module:GEN")
                .unit("module:GEN/interface:SWAP")
                .unit("module:GEN/sub:SWAP_INT")
                .unit("module:GEN/sub:SWAP_REAL")
                .unit("module:GEN/interface:SWAP/sub:SWAP_INT")
                .unit("module:GEN/interface:SWAP/sub:SWAP_REAL")
                .build());
        index.put(FileRecord.builder("main.F90").use(PROG, new UseStatement("GEN", Set.of("SWAP")))
                .call(PROG, "SWAP").build());

        assertEquals(Set.of(p("module:GEN/sub:SWAP_INT"), p("module:GEN/sub:SWAP_REAL")),
                Set.copyOf(build(index).successors(PROG)));
    }

    @Test
    void genericInterfaceInViewHidesExternalProcedureOfTheSameName() {
        ProjectIndex index = new ProjectIndex();
        index.put(FileRecord.builder("gen.F90")
                .unit("module:GEN")
                .unit("module:GEN/interface:SWAP")
                .unit("module:GEN/sub:SWAP_INT")
                .unit("module:GEN/interface:SWAP/sub:SWAP_INT")
                .build());
        index.put(FileRecord.builder("legacy.F90").unit("sub:SWAP").build());
        index.put(FileRecord.builder("main.F90").use(PROG, new UseStatement("GEN")).call(PROG, "SWAP").build());

        assertEquals(List.of(p("module:GEN/sub:SWAP_INT")), build(index).successors(PROG));
    }

    @Test
    void externalGenericInterfaceIsUsedWhenNothingIsInView() {
        ProjectIndex index = new ProjectIndex();
        index.put(FileRecord.builder("norms.F90")
                .unit("interface:NORM")
                .unit("interface:NORM/sub:NORM2")
                .build());
        index.put(FileRecord.builder("main.F90").call(PROG, "NORM").build());

        assertEquals(List.of(p("sub:NORM2")), build(index).successors(PROG));
    }

    @Test
    void interfaceMemberWithoutImplementationPointsToTheExternalProcedure() {
        ProjectIndex index = new ProjectIndex();
        index.put(FileRecord.builder("api.F90")
                .unit("module:API")
                .unit("module:API/interface:SOLVE")
                .unit("module:API/interface:SOLVE/sub:SOLVE_EXT")
                .build());
        index.put(FileRecord.builder("solve.F90").unit("sub:SOLVE_EXT").build());
        index.put(FileRecord.builder("main.F90").use(PROG, new UseStatement("API")).call(PROG, "SOLVE").build());

        assertEquals(List.of(p("sub:SOLVE_EXT")), build(index).successors(PROG));
    }

    @Test
    void everyUnitIsANode() {
        ProjectIndex index = new ProjectIndex();
        index.put(FileRecord.builder("m.F90").unit("module:M").unit("module:M/sub:S").build());

        DependencyGraph<ScopePath> graph = build(index);
        assertTrue(graph.contains(p("module:M")));
        assertTrue(graph.contains(p("module:M/sub:S")));
        assertEquals(0, graph.edgeCount());
    }
}
