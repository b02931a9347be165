package sa.com.cloudsolutions.fortree.depsolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Everything the tree knows about one source file: the units it defines and the raw references
 * made by each of those units.
 *
 * <p>
 * Records are immutable. Re-analysing a file produces a new record that replaces the old one.
 * </p>
 *
 * @param filename normalised path of the file
 * @param units every unit defined in the file, in order of appearance
 * @param includes include targets as written in the source, per unit
 * @param uses USE statements, per unit
 * @param calls names of the called subroutines, per unit
 * @param ambiguousRefs names that may be function calls or array references, per unit
 */
public record FileRecord(String filename,
                         List<ScopePath> units,
                         Map<ScopePath, List<String>> includes,
                         Map<ScopePath, List<UseStatement>> uses,
                         Map<ScopePath, Set<String>> calls,
                         Map<ScopePath, Set<String>> ambiguousRefs) {

    public FileRecord {
        filename = normalizePath(filename);
        if (filename.isEmpty()) {
            throw new IllegalArgumentException("A file record needs a file name");
        }
        Set<ScopePath> unique = new LinkedHashSet<>(units);
        if (unique.size() != units.size()) {
            throw new IllegalArgumentException("Duplicated unit in " + filename);
        }
        units = List.copyOf(units);
        includes = freeze(includes, List::copyOf, unique, filename);
        uses = freeze(uses, List::copyOf, unique, filename);
        calls = freeze(calls, FileRecord::upper, unique, filename);
        ambiguousRefs = freeze(ambiguousRefs, FileRecord::upper, unique, filename);
    }

    /**
     * Removes the leading current-directory markers so that <code>./src/a.F90</code> and
     * <code>src/a.F90</code> designate the same record.
     */
    public static String normalizePath(String path) {
        if (path == null) {
            return "";
        }
        String result = path;
        while (result.startsWith("./")) {
            result = result.substring(2);
        }
        return result;
    }

    public static Builder builder(String filename) {
        return new Builder(filename);
    }

    public boolean defines(ScopePath scope) {
        return units.contains(scope);
    }

    public List<String> includesOf(ScopePath scope) {
        return includes.getOrDefault(scope, List.of());
    }

    public List<UseStatement> usesOf(ScopePath scope) {
        return uses.getOrDefault(scope, List.of());
    }

    public Set<String> callsOf(ScopePath scope) {
        return calls.getOrDefault(scope, Set.of());
    }

    public Set<String> ambiguousRefsOf(ScopePath scope) {
        return ambiguousRefs.getOrDefault(scope, Set.of());
    }

    private static Set<String> upper(Set<String> names) {
        Set<String> result = new LinkedHashSet<>();
        for (String n : names) {
            result.add(n.toUpperCase(Locale.ROOT));
        }
        return Collections.unmodifiableSet(result);
    }

    private static <V> Map<ScopePath, V> freeze(Map<ScopePath, V> source, Function<V, V> copy,
                                               Set<ScopePath> units, String filename) {
        Map<ScopePath, V> result = new LinkedHashMap<>();
        if (source != null) {
            for (Map.Entry<ScopePath, V> e : source.entrySet()) {
                if (!units.contains(e.getKey())) {
                    throw new IllegalArgumentException(e.getKey() + " is not a unit of " + filename);
                }
                result.put(e.getKey(), copy.apply(e.getValue()));
            }
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Accumulates the units and references of one file as the extractor walks through it.
     */
    public static class Builder {
        private final String filename;
        private final List<ScopePath> units = new ArrayList<>();
        private final Map<ScopePath, List<String>> includes = new LinkedHashMap<>();
        private final Map<ScopePath, List<UseStatement>> uses = new LinkedHashMap<>();
        private final Map<ScopePath, Set<String>> calls = new LinkedHashMap<>();
        private final Map<ScopePath, Set<String>> ambiguousRefs = new LinkedHashMap<>();

        private Builder(String filename) {
            this.filename = filename;
        }

        public Builder unit(ScopePath scope) {
            if (!units.contains(scope)) {
                units.add(scope);
            }
            return this;
        }

        public Builder unit(String scope) {
            return unit(ScopePath.parse(scope));
        }

        public Builder include(ScopePath scope, String target) {
            unit(scope);
            includes.computeIfAbsent(scope, k -> new ArrayList<>()).add(target);
            return this;
        }

        public Builder use(ScopePath scope, UseStatement use) {
            unit(scope);
            uses.computeIfAbsent(scope, k -> new ArrayList<>()).add(use);
            return this;
        }

        public Builder call(ScopePath scope, String name) {
            unit(scope);
            calls.computeIfAbsent(scope, k -> new LinkedHashSet<>()).add(name);
            return this;
        }

        public Builder ambiguousRef(ScopePath scope, String name) {
            unit(scope);
            ambiguousRefs.computeIfAbsent(scope, k -> new LinkedHashSet<>()).add(name);
            return this;
        }

        public boolean hasUnit(ScopePath scope) {
            return units.contains(scope);
        }

        public List<ScopePath> getUnits() {
            return Collections.unmodifiableList(units);
        }

        public FileRecord build() {
            return new FileRecord(filename, units, includes, uses, calls, ambiguousRefs);
        }
    }
}
