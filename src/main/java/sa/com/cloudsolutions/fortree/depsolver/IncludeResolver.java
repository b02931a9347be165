package sa.com.cloudsolutions.fortree.depsolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Finds which tracked file an INCLUDE statement refers to.
 *
 * <p>
 * Include statements often give a bare file name. The tiers are tried from the most precise to
 * the least precise one and the first tier that designates exactly one tracked file wins. A tier
 * matching several files is ambiguous and is skipped.
 * </p>
 */
public class IncludeResolver {
    private static final Logger logger = LoggerFactory.getLogger(IncludeResolver.class);

    /**
     * One way of matching an include target against a tracked file.
     */
    @FunctionalInterface
    public interface Tier {
        boolean matches(String includingFile, String target, String trackedFile);
    }

    /**
     * Same path once normalised.
     */
    public static final Tier EXACT = (includingFile, target, trackedFile) ->
            toPath(target).map(Path::normalize)
                    .equals(toPath(trackedFile).map(Path::normalize));

    /**
     * The target, taken relative to the directory of the including file, is the tracked file.
     */
    public static final Tier SUBDIRECTORY = (includingFile, target, trackedFile) -> {
        Optional<Path> inc = toPath(target);
        Optional<Path> from = toPath(includingFile);
        Optional<Path> tracked = toPath(trackedFile);
        if (inc.isEmpty() || from.isEmpty() || tracked.isEmpty() || inc.get().isAbsolute()) {
            return false;
        }
        Path dir = from.get().getParent();
        Path resolved = dir == null ? inc.get() : dir.resolve(inc.get());
        return resolved.toAbsolutePath().normalize().equals(tracked.get().toAbsolutePath().normalize());
    };

    /**
     * Same file name, directories ignored.
     */
    public static final Tier BASENAME = (includingFile, target, trackedFile) -> {
        Optional<Path> inc = toPath(target).map(Path::getFileName);
        return inc.isPresent() && inc.equals(toPath(trackedFile).map(Path::getFileName));
    };

    private final List<Tier> tiers;

    public IncludeResolver() {
        this(List.of(EXACT, SUBDIRECTORY, BASENAME));
    }

    public IncludeResolver(List<Tier> tiers) {
        this.tiers = List.copyOf(tiers);
    }

    /**
     * @param includingFile file containing the INCLUDE statement
     * @param target the file name given in the statement
     * @param trackedFiles every file known to the tree
     * @return the tracked file, or empty if no tier produced exactly one candidate
     */
    public Optional<String> resolve(String includingFile, String target, Collection<String> trackedFiles) {
        for (Tier tier : tiers) {
            List<String> candidates = new ArrayList<>();
            for (String f : trackedFiles) {
                if (tier.matches(includingFile, target, f)) {
                    candidates.add(f);
                }
            }
            if (candidates.size() == 1) {
                return Optional.of(candidates.get(0));
            }
            if (candidates.size() > 1) {
                logger.debug("Include of {} in {} matches several files: {}", target, includingFile, candidates);
            }
        }
        return Optional.empty();
    }

    private static Optional<Path> toPath(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Path.of(name));
        } catch (InvalidPathException e) {
            logger.debug("Not a valid path: {}", name);
            return Optional.empty();
        }
    }
}
