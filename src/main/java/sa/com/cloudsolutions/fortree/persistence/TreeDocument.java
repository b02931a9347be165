package sa.com.cloudsolutions.fortree.persistence;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * On disk form of the project index.
 *
 * <p>
 * Every table is keyed by file name, then by scope path. Keys and values are sorted so that two
 * runs over the same sources produce the same document.
 * </p>
 */
public class TreeDocument {
    /**
     * A USE statement as stored in the document.
     */
    public record UseEntry(@JsonProperty("module") String module, @JsonProperty("only") List<String> only) {}

    @JsonProperty("cwd")
    private String cwd;
    @JsonProperty("scopes")
    private SortedMap<String, List<String>> scopes = new TreeMap<>();
    @JsonProperty("useList")
    private SortedMap<String, SortedMap<String, List<UseEntry>>> useList = new TreeMap<>();
    @JsonProperty("includeList")
    private SortedMap<String, SortedMap<String, List<String>>> includeList = new TreeMap<>();
    @JsonProperty("callList")
    private SortedMap<String, SortedMap<String, List<String>>> callList = new TreeMap<>();
    @JsonProperty("funcList")
    private SortedMap<String, SortedMap<String, List<String>>> funcList = new TreeMap<>();

    public String getCwd() {
        return cwd;
    }

    public void setCwd(String cwd) {
        this.cwd = cwd;
    }

    public SortedMap<String, List<String>> getScopes() {
        return scopes;
    }

    public SortedMap<String, SortedMap<String, List<UseEntry>>> getUseList() {
        return useList;
    }

    public SortedMap<String, SortedMap<String, List<String>>> getIncludeList() {
        return includeList;
    }

    public SortedMap<String, SortedMap<String, List<String>>> getCallList() {
        return callList;
    }

    public SortedMap<String, SortedMap<String, List<String>>> getFuncList() {
        return funcList;
    }
}
