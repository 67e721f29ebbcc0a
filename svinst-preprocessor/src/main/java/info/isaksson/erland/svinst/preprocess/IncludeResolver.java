package info.isaksson.erland.svinst.preprocess;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Finds the file named by an {@code `include} directive.
 *
 * <p>Search order: the directory of the including file (not for {@code <...>} includes),
 * then each include directory in the order configured. Absolute names are used as given.</p>
 */
public final class IncludeResolver {

    private final List<Path> includeDirs;

    public IncludeResolver(List<Path> includeDirs) {
        this.includeDirs = includeDirs == null ? List.of() : List.copyOf(includeDirs);
    }

    public List<Path> includeDirs() {
        return includeDirs;
    }

    public Optional<Path> resolve(String name, Path currentDir, boolean angled) {
        if (name == null || name.isBlank()) return Optional.empty();
        final Path requested;
        try {
            requested = Path.of(name);
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
        if (requested.isAbsolute()) {
            return Files.isRegularFile(requested) ? Optional.of(requested.normalize()) : Optional.empty();
        }
        if (!angled && currentDir != null) {
            Path candidate = currentDir.resolve(requested).normalize();
            if (Files.isRegularFile(candidate)) return Optional.of(candidate);
        }
        for (Path dir : includeDirs) {
            Path candidate = dir.resolve(requested).normalize();
            if (Files.isRegularFile(candidate)) return Optional.of(candidate);
        }
        return Optional.empty();
    }
}
