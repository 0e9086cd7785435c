package io.hearthwarrio.sightline.core;

import java.nio.file.Path;
import java.util.List;

/**
 * Turns a template source (literal path or glob pattern) into concrete template files.
 */
@FunctionalInterface
public interface TemplateResolver {

    /**
     * @param templateSource literal path or glob pattern
     * @return matching files, possibly empty for a pattern that matches nothing
     * @throws ConfigurationException if a literal path is given and does not name an existing file
     */
    List<Path> resolve(String templateSource);
}
