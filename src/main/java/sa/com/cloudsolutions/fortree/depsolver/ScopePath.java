package sa.com.cloudsolutions.fortree.depsolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Hierarchical identifier of a program unit, for example <code>module:PHYS/sub:COMPUTE</code>.
 *
 * <p>
 * The path is made of segments, outermost first. Names are always upper case because Fortran
 * is case-insensitive. The textual form is only used for storage and logging; comparisons are
 * done on the segments.
 * </p>
 */
public final class ScopePath implements Comparable<ScopePath> {
    /**
     * Name given to interface blocks that do not carry a generic name.
     */
    public static final String UNKNOWN_NAME = "--UNKNOWN--";
    /**
     * Target of a call that matched more than one definition.
     */
    public static final ScopePath AMBIGUOUS = new ScopePath(List.of());

    private static final String AMBIGUOUS_TEXT = "??";
    private static final String SEPARATOR = "/";

    public record Segment(ScopeKind kind, String name) {
        public Segment {
            if (kind == null || name == null || name.isBlank()) {
                throw new IllegalArgumentException("A scope segment needs a kind and a name");
            }
            name = name.toUpperCase(Locale.ROOT);
        }

        @Override
        public String toString() {
            return kind.getCode() + ":" + name;
        }
    }

    private final List<Segment> segments;

    private ScopePath(List<Segment> segments) {
        this.segments = List.copyOf(segments);
    }

    public static ScopePath of(ScopeKind kind, String name) {
        return new ScopePath(List.of(new Segment(kind, name)));
    }

    /**
     * Parses the textual form of a scope path.
     * @param text something like <code>module:FOO/sub:BAR</code> or <code>??</code>
     * @return the scope path
     * @throws IllegalArgumentException if the text is not a valid path
     */
    public static ScopePath parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Empty scope path");
        }
        if (AMBIGUOUS_TEXT.equals(text)) {
            return AMBIGUOUS;
        }
        List<Segment> result = new ArrayList<>();
        for (String part : text.split(SEPARATOR, -1)) {
            int colon = part.indexOf(':');
            if (colon <= 0 || colon == part.length() - 1) {
                throw new IllegalArgumentException("Malformed scope path segment '" + part + "' in " + text);
            }
            result.add(new Segment(ScopeKind.fromCode(part.substring(0, colon)), part.substring(colon + 1)));
        }
        return new ScopePath(result);
    }

    public ScopePath child(ScopeKind kind, String name) {
        return child(new Segment(kind, name));
    }

    public ScopePath child(Segment segment) {
        List<Segment> result = new ArrayList<>(segments);
        result.add(segment);
        return new ScopePath(result);
    }

    /**
     * @return the enclosing scope, empty for top level units
     */
    public Optional<ScopePath> parent() {
        if (segments.size() <= 1) {
            return Optional.empty();
        }
        return Optional.of(new ScopePath(segments.subList(0, segments.size() - 1)));
    }

    /**
     * A unit with the given kind and name, defined at the same level as this one.
     */
    public ScopePath sibling(ScopeKind kind, String name) {
        return parent().map(p -> p.child(kind, name)).orElseGet(() -> of(kind, name));
    }

    public List<Segment> getSegments() {
        return Collections.unmodifiableList(segments);
    }

    public Segment last() {
        if (segments.isEmpty()) {
            throw new IllegalStateException("The ambiguous scope has no segment");
        }
        return segments.get(segments.size() - 1);
    }

    public ScopeKind getKind() {
        return last().kind();
    }

    public String getName() {
        return last().name();
    }

    public int depth() {
        return segments.size();
    }

    public boolean isTopLevel() {
        return segments.size() == 1;
    }

    public boolean isAmbiguous() {
        return segments.isEmpty();
    }

    /**
     * True for this path and for every path it is nested in.
     * A USE statement of an enclosing scope is visible in all the scopes it contains.
     */
    public boolean isAncestorOrSelfOf(ScopePath other) {
        return other.segments.size() >= segments.size()
                && other.segments.subList(0, segments.size()).equals(segments);
    }

    /**
     * A named interface groups several procedures under a generic name.
     */
    public boolean isNamedInterface() {
        return !isAmbiguous() && getKind() == ScopeKind.INTERFACE && !UNKNOWN_NAME.equals(getName());
    }

    /**
     * True when the last segment is declared inside an interface block.
     */
    public boolean isInterfaceMember() {
        return segments.size() >= 2 && segments.get(segments.size() - 2).kind() == ScopeKind.INTERFACE;
    }

    /**
     * The unit reduced to its last segment, i.e. as it would be named if defined outside any module.
     */
    public ScopePath leaf() {
        return new ScopePath(List.of(last()));
    }

    @Override
    public int compareTo(ScopePath o) {
        return toString().compareTo(o.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ScopePath other && segments.equals(other.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        if (segments.isEmpty()) {
            return AMBIGUOUS_TEXT;
        }
        StringBuilder b = new StringBuilder();
        for (Segment s : segments) {
            if (!b.isEmpty()) {
                b.append(SEPARATOR);
            }
            b.append(s);
        }
        return b.toString();
    }
}
