package com.eyelevel.documentanalysis.service.analysis;

import com.eyelevel.documentanalysis.model.ModelVariant;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Holds the prompt template of every {@link ModelVariant}, read once from the classpath at startup.
 * A missing template stops the application from starting.
 */
@Slf4j
@Component
public class PromptTemplateRegistry {

    static final String SEPARATOR = "\n\n";

    private final Map<ModelVariant, String> templates;

    public PromptTemplateRegistry() {
        final Map<ModelVariant, String> loaded = new EnumMap<>(ModelVariant.class);
        for (ModelVariant variant : ModelVariant.values()) {
            loaded.put(variant, load(variant.getTemplateLocation()));
            log.info("Loaded prompt template for model variant {} from '{}'.", variant, variant.getTemplateLocation());
        }
        this.templates = Collections.unmodifiableMap(loaded);
    }

    public String templateFor(final ModelVariant variant) {
        return templates.get(variant);
    }

    /**
     * Builds the model input: the template, a blank line, then the extracted text, with no other changes.
     */
    public String buildPrompt(final ModelVariant variant, final String extractedText) {
        return templateFor(variant) + SEPARATOR + extractedText;
    }

    private static String load(final String location) {
        try (InputStream in = new ClassPathResource(location).getInputStream()) {
            return IOUtils.toString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Prompt template not found on the classpath: " + location, e);
        }
    }
}
