package io.hearthwarrio.sightline.core;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads a template file and decodes it to grayscale.
 */
public class TemplateLoader {

    private final ImageProcessor processor;

    public TemplateLoader(ImageProcessor processor) {
        this.processor = Objects.requireNonNull(processor, "processor must not be null");
    }

    /**
     * @throws ConfigurationException if the file is missing, unreadable or not a raster image
     */
    public GrayImage load(Path templatePath) {
        Objects.requireNonNull(templatePath, "templatePath must not be null");
        if (!Files.isRegularFile(templatePath)) {
            throw new ConfigurationException("Template route doesn't exist: " + templatePath);
        }

        byte[] bytes;
        try {
            bytes = Files.readAllBytes(templatePath);
        } catch (IOException e) {
            throw new ConfigurationException("Template cannot be read: " + templatePath, e);
        }

        try {
            return processor.decodeGray(bytes);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Template is not a readable image: " + templatePath, e);
        }
    }
}
