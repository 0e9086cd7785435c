package io.hearthwarrio.sightline.core;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Resolves templates with {@code java.nio} glob syntax, relative to a base directory.
 * <p>
 * A source without glob metacharacters is a literal path and must name an existing regular file.
 * A pattern may match nothing, which is not an error. Results are sorted by path.
 */
public class GlobTemplateResolver implements TemplateResolver {

    private final Path baseDirectory;

    public GlobTemplateResolver() {
        this(Paths.get(""));
    }

    public GlobTemplateResolver(Path baseDirectory) {
        this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory must not be null");
    }

    public Path getBaseDirectory() {
        return baseDirectory;
    }

    @Override
    public List<Path> resolve(String templateSource) {
        Objects.requireNonNull(templateSource, "templateSource must not be null");

        if (!isPattern(templateSource)) {
            Path path = baseDirectory.resolve(templateSource);
            if (!Files.isRegularFile(path)) {
                throw new ConfigurationException("Template route doesn't exist: " + path);
            }
            return List.of(path);
        }

        String normalized = templateSource.replace('\\', '/');
        String[] segments = normalized.split("/", -1);

        int firstPattern = 0;
        while (firstPattern < segments.length && !isPattern(segments[firstPattern])) {
            firstPattern++;
        }

        StringBuilder root = new StringBuilder();
        for (int i = 0; i < firstPattern; i++) {
            root.append(segments[i]).append('/');
        }
        String glob = String.join("/", List.of(segments).subList(firstPattern, segments.length));

        Path rootDir = root.length() == 0 ? baseDirectory : baseDirectory.resolve(root.toString());
        if (!Files.isDirectory(rootDir)) {
            return List.of();
        }

        int depth = glob.contains("**") ? Integer.MAX_VALUE : segments.length - firstPattern;
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);

        try (Stream<Path> files = Files.walk(rootDir, depth)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> matcher.matches(rootDir.relativize(p)))
                    .sorted()
                    .collect(Collectors.toCollection(ArrayList::new));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list templates for pattern " + templateSource, e);
        }
    }

    static boolean isPattern(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '*' || c == '?' || c == '[' || c == '{') {
                return true;
            }
        }
        return false;
    }
}
