package sa.com.cloudsolutions.fortree.depsolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the call statements and the possible function references of every unit into unit to
 * unit edges.
 *
 * <p>
 * A name is looked up in the modules made visible by USE statements (in the calling scope or in
 * any enclosing scope), in the included files, in the CONTAINS part of the calling scope and in
 * the scope enclosing the caller. When exactly one of these places defines the name it is the
 * callee. When none does, a unit with that name outside of any module is accepted provided it is
 * unique. Several local matches are never guessed: the edge points to {@link ScopePath#AMBIGUOUS}.
 * </p>
 */
public class ExecutionGraphBuilder {
    private static final Logger logger = LoggerFactory.getLogger(ExecutionGraphBuilder.class);

    /**
     * Definitions found for one name, by place of definition.
     */
    static class Matches {
        final Set<ScopePath> viaUse = new LinkedHashSet<>();
        final List<ScopePath> global = new ArrayList<>();
        final List<ScopePath> viaInclude = new ArrayList<>();
        final List<ScopePath> viaContains = new ArrayList<>();
        final List<ScopePath> sameScope = new ArrayList<>();

        int localCount() {
            return viaUse.size() + viaInclude.size() + viaContains.size() + sameScope.size();
        }

        ScopePath firstLocal() {
            List<ScopePath> all = new ArrayList<>(viaUse);
            all.addAll(viaInclude);
            all.addAll(viaContains);
            all.addAll(sameScope);
            return all.get(0);
        }
    }

    public DependencyGraph<ScopePath> build(ProjectIndex index, CompilationGraph compilationGraph) {
        Map<ScopePath, List<ScopePath>> edges = new LinkedHashMap<>();
        for (ScopePath scope : index.allUnits()) {
            edges.put(scope, new ArrayList<>());
        }

        for (FileRecord fileRecord : index.records()) {
            resolveAll(index, compilationGraph, fileRecord, ScopeKind.SUBROUTINE, fileRecord.calls(), edges);
            resolveAll(index, compilationGraph, fileRecord, ScopeKind.FUNCTION, fileRecord.ambiguousRefs(), edges);
        }

        for (List<ScopePath> targets : edges.values()) {
            flattenInterfaces(index, targets);
        }
        return new DependencyGraph<>(edges);
    }

    private void resolveAll(ProjectIndex index, CompilationGraph compilationGraph, FileRecord fileRecord,
                            ScopeKind canonicKind, Map<ScopePath, Set<String>> references,
                            Map<ScopePath, List<ScopePath>> edges) {
        for (Map.Entry<ScopePath, Set<String>> e : references.entrySet()) {
            ScopePath scope = e.getKey();
            for (String name : e.getValue()) {
                Matches matches = search(index, compilationGraph, fileRecord, scope, name, canonicKind);
                if (matches.localCount() == 0) {
                    // a generic interface in view hides any external procedure of the same name
                    Matches generic = search(index, compilationGraph, fileRecord, scope, name, ScopeKind.INTERFACE);
                    if (generic.localCount() > 0) {
                        matches = generic;
                    } else {
                        matches.global.addAll(generic.global);
                    }
                }
                select(index, scope, name, canonicKind, matches)
                        .ifPresent(target -> edges.get(scope).add(target));
            }
        }
    }

    Matches search(ProjectIndex index, CompilationGraph compilationGraph, FileRecord fileRecord,
                   ScopePath scope, String name, ScopeKind kind) {
        Matches matches = new Matches();

        for (Map.Entry<ScopePath, List<UseStatement>> e : fileRecord.uses().entrySet()) {
            if (!e.getKey().isAncestorOrSelfOf(scope)) {
                continue;
            }
            for (UseStatement use : e.getValue()) {
                ScopePath target = ScopePath.of(ScopeKind.MODULE, use.module()).child(kind, name);
                if ((!use.hasOnly() || use.only().contains(name)) && index.isDefined(target)) {
                    matches.viaUse.add(target);
                }
            }
        }

        ScopePath external = ScopePath.of(kind, name);
        for (int i = 0; i < index.filesDefining(external).size(); i++) {
            matches.global.add(external);
        }

        for (String incFile : compilationGraph.resolvedIncludes(fileRecord.filename(), scope)) {
            Optional<FileRecord> included = index.get(incFile);
            if (included.isPresent() && included.get().defines(external)) {
                matches.viaInclude.add(external);
            }
        }

        ScopePath contained = scope.child(kind, name);
        if (fileRecord.defines(contained)) {
            matches.viaContains.add(contained);
        }

        ScopePath sibling = scope.sibling(kind, name);
        if (fileRecord.defines(sibling)) {
            matches.sameScope.add(sibling);
        }
        return matches;
    }

    Optional<ScopePath> select(ProjectIndex index, ScopePath scope, String name, ScopeKind canonicKind,
                               Matches matches) {
        int local = matches.localCount();
        if (local > 1) {
            logger.error("Several definitions of the program unit found for {} called in {}:", name, scope);
            logger.error("  found {} time(s) in USE statements", matches.viaUse.size());
            logger.error("  found {} time(s) in include files", matches.viaInclude.size());
            logger.error("  found {} time(s) in CONTAINS block", matches.viaContains.size());
            logger.error("  found {} time(s) in the same scope", matches.sameScope.size());
            return Optional.of(ScopePath.AMBIGUOUS);
        }
        if (local == 1) {
            ScopePath found = matches.firstLocal();
            if (canonicKind != ScopeKind.FUNCTION || index.isDefined(found)) {
                return Optional.of(found);
            }
            return Optional.empty();
        }
        if (matches.global.size() > 1) {
            logger.info("Several definitions of the program unit found for {} called in {}", name, scope);
        } else if (matches.global.size() == 1) {
            return Optional.of(matches.global.get(0));
        } else if (canonicKind != ScopeKind.FUNCTION) {
            // array indexing looks like a function call, not worth reporting
            logger.info("No definition of the program unit found for {} called in {}", name, scope);
        }
        return Optional.empty();
    }

    /**
     * Calling a named interface calls one of the procedures it groups. The interface is replaced
     * by all of them since the actual one cannot be known here.
     */
    private void flattenInterfaces(ProjectIndex index, List<ScopePath> targets) {
        for (ScopePath item : new ArrayList<>(targets)) {
            if (!item.isNamedInterface()) {
                continue;
            }
            List<String> files = index.filesDefining(item);
            if (files.size() != 1) {
                continue;
            }
            FileRecord fileRecord = index.get(files.get(0)).orElseThrow();
            targets.remove(item);
            for (ScopePath member : fileRecord.units()) {
                if (member.depth() == item.depth() + 1 && item.isAncestorOrSelfOf(member)) {
                    ScopePath sameScope = item.sibling(member.getKind(), member.getName());
                    targets.add(fileRecord.defines(sameScope) ? sameScope : member.leaf());
                }
            }
        }
    }
}
