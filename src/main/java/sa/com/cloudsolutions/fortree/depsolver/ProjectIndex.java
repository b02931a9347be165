package sa.com.cloudsolutions.fortree.depsolver;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * One {@link FileRecord} per analysed file.
 *
 * <p>
 * Every mutation bumps {@link #getVersion()}. The derived graphs remember the version they were
 * computed from and are discarded as soon as it changes.
 * </p>
 */
public class ProjectIndex {
    private final Map<String, FileRecord> records = new TreeMap<>();
    private long version;

    /**
     * Stores the record, replacing any previous record for the same file.
     */
    public void put(FileRecord fileRecord) {
        records.put(fileRecord.filename(), fileRecord);
        version++;
    }

    /**
     * @return true if a record was removed
     */
    public boolean remove(String filename) {
        boolean removed = records.remove(FileRecord.normalizePath(filename)) != null;
        if (removed) {
            version++;
        }
        return removed;
    }

    /**
     * Drops the current content and replaces it with the given records.
     */
    public void replaceAll(Collection<FileRecord> fileRecords) {
        records.clear();
        for (FileRecord r : fileRecords) {
            records.put(r.filename(), r);
        }
        version++;
    }

    public Optional<FileRecord> get(String filename) {
        return Optional.ofNullable(records.get(FileRecord.normalizePath(filename)));
    }

    public boolean contains(String filename) {
        return records.containsKey(FileRecord.normalizePath(filename));
    }

    /**
     * @return the names of the analysed files, in alphabetical order
     */
    public Set<String> knownFiles() {
        return Collections.unmodifiableSet(records.keySet());
    }

    public Collection<FileRecord> records() {
        return Collections.unmodifiableCollection(records.values());
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public long getVersion() {
        return version;
    }

    /**
     * @return the files in which the unit is defined; more than one entry means the name is ambiguous
     */
    public List<String> filesDefining(ScopePath scope) {
        List<String> result = new ArrayList<>();
        for (FileRecord r : records.values()) {
            if (r.defines(scope)) {
                result.add(r.filename());
            }
        }
        return result;
    }

    /**
     * True if the unit is defined in at least one file.
     */
    public boolean isDefined(ScopePath scope) {
        for (FileRecord r : records.values()) {
            if (r.defines(scope)) {
                return true;
            }
        }
        return false;
    }

    public Set<ScopePath> allUnits() {
        Set<ScopePath> result = new LinkedHashSet<>();
        for (FileRecord r : records.values()) {
            result.addAll(r.units());
        }
        return result;
    }
}
