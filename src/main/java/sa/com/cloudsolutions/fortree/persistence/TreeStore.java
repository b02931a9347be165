package sa.com.cloudsolutions.fortree.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sa.com.cloudsolutions.fortree.depsolver.FileRecord;
import sa.com.cloudsolutions.fortree.depsolver.ScopePath;
import sa.com.cloudsolutions.fortree.depsolver.UseStatement;
import sa.com.cloudsolutions.fortree.exception.TreeException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Saves and restores the project index as a json document.
 */
public class TreeStore {
    private static final Logger logger = LoggerFactory.getLogger(TreeStore.class);

    /**
     * Content of a saved document.
     *
     * @param cwd working directory at the time the document was written
     * @param records one record per file
     */
    public record Snapshot(String cwd, List<FileRecord> records) {}

    private final ObjectMapper mapper;

    public TreeStore() {
        mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public void save(Path file, String cwd, Collection<FileRecord> records) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(file.toFile(), toDocument(cwd, records));
            logger.debug("Tree description of {} files written to {}", records.size(), file);
        } catch (IOException e) {
            throw new TreeException("Could not write the tree description to " + file, e);
        }
    }

    /**
     * @return the saved content, empty if the file does not exist
     */
    public Optional<Snapshot> load(Path file) {
        if (!Files.exists(file)) {
            logger.info("No tree description found at {}", file);
            return Optional.empty();
        }
        try {
            TreeDocument document = mapper.readValue(file.toFile(), TreeDocument.class);
            return Optional.of(fromDocument(document));
        } catch (IOException | IllegalArgumentException e) {
            throw new TreeException("Could not read the tree description from " + file, e);
        }
    }

    TreeDocument toDocument(String cwd, Collection<FileRecord> records) {
        TreeDocument document = new TreeDocument();
        document.setCwd(cwd);
        for (FileRecord r : records) {
            document.getScopes().put(r.filename(), sorted(r.units().stream().map(ScopePath::toString).toList()));
            document.getIncludeList().put(r.filename(), table(r.includes(), TreeStore::sorted));
            document.getCallList().put(r.filename(), table(r.calls(), s -> sorted(new ArrayList<>(s))));
            document.getFuncList().put(r.filename(), table(r.ambiguousRefs(), s -> sorted(new ArrayList<>(s))));
            document.getUseList().put(r.filename(), table(r.uses(), uses -> uses.stream()
                    .sorted()
                    .map(u -> new TreeDocument.UseEntry(u.module(), new ArrayList<>(u.sortedOnly())))
                    .toList()));
        }
        return document;
    }

    Snapshot fromDocument(TreeDocument document) {
        List<FileRecord> records = new ArrayList<>();
        for (Map.Entry<String, List<String>> e : nullSafe(document.getScopes()).entrySet()) {
            String filename = e.getKey();
            FileRecord.Builder builder = FileRecord.builder(filename);
            e.getValue().forEach(builder::unit);
            forEach(document.getIncludeList(), filename, (scope, values) -> values.forEach(v -> builder.include(scope, v)));
            forEach(document.getCallList(), filename, (scope, values) -> values.forEach(v -> builder.call(scope, v)));
            forEach(document.getFuncList(), filename, (scope, values) -> values.forEach(v -> builder.ambiguousRef(scope, v)));
            forEach(document.getUseList(), filename, (scope, values) -> values.forEach(u ->
                    builder.use(scope, new UseStatement(u.module(),
                            u.only() == null ? null : new LinkedHashSet<>(u.only())))));
            records.add(builder.build());
        }
        return new Snapshot(document.getCwd(), records);
    }

    private static <V, T> SortedMap<String, List<T>> table(Map<ScopePath, V> source, Function<V, List<T>> convert) {
        SortedMap<String, List<T>> result = new TreeMap<>();
        for (Map.Entry<ScopePath, V> e : source.entrySet()) {
            result.put(e.getKey().toString(), convert.apply(e.getValue()));
        }
        return result;
    }

    private static <T> void forEach(Map<String, ? extends Map<String, List<T>>> table, String filename,
                                    BiConsumer<ScopePath, List<T>> action) {
        Map<String, List<T>> perScope = nullSafe(table).get(filename);
        if (perScope == null) {
            return;
        }
        for (Map.Entry<String, List<T>> e : perScope.entrySet()) {
            action.accept(ScopePath.parse(e.getKey()), e.getValue() == null ? List.of() : e.getValue());
        }
    }

    private static List<String> sorted(List<String> values) {
        List<String> result = new ArrayList<>(values);
        Collections.sort(result);
        return result;
    }

    private static <K, V> Map<K, V> nullSafe(Map<K, V> map) {
        return map == null ? Map.of() : map;
    }
}
