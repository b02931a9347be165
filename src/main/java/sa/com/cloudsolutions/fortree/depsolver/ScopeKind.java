package sa.com.cloudsolutions.fortree.depsolver;

/**
 * The kinds of Fortran program units that may appear as a segment of a {@link ScopePath}.
 */
public enum ScopeKind {
    MODULE("module"),
    SUBMODULE("submodule"),
    SUBROUTINE("sub"),
    FUNCTION("func"),
    INTERFACE("interface"),
    TYPE("type"),
    PROGRAM("prog"),
    BLOCK_DATA("blockdata");

    private final String code;

    ScopeKind(String code) {
        this.code = code;
    }

    /**
     * @return the short name used in the textual form of scope paths
     */
    public String getCode() {
        return code;
    }

    public static ScopeKind fromCode(String code) {
        for (ScopeKind kind : values()) {
            if (kind.code.equals(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown scope kind: " + code);
    }
}
