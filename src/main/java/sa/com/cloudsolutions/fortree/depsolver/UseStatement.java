package sa.com.cloudsolutions.fortree.depsolver;

import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * A USE statement: the module name and, when the statement has an ONLY clause, the imported names.
 *
 * @param module upper case module name
 * @param only imported names, empty when the whole module is imported
 */
public record UseStatement(String module, Set<String> only) implements Comparable<UseStatement> {

    public UseStatement {
        if (module == null || module.isBlank()) {
            throw new IllegalArgumentException("A use statement needs a module name");
        }
        module = module.toUpperCase(Locale.ROOT);
        TreeSet<String> names = new TreeSet<>();
        if (only != null) {
            only.forEach(n -> names.add(n.toUpperCase(Locale.ROOT)));
        }
        only = Set.copyOf(names);
    }

    public UseStatement(String module) {
        this(module, Set.of());
    }

    public boolean hasOnly() {
        return !only.isEmpty();
    }

    /**
     * @return the imported names in alphabetical order
     */
    public TreeSet<String> sortedOnly() {
        return new TreeSet<>(only);
    }

    @Override
    public int compareTo(UseStatement o) {
        int c = module.compareTo(o.module);
        return c != 0 ? c : sortedOnly().toString().compareTo(o.sortedOnly().toString());
    }
}
