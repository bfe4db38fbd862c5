package com.eyelevel.documentanalysis.model;

import com.eyelevel.documentanalysis.exception.InvalidModelException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The two supported analysis variants. Each one maps to exactly one prompt template.
 */
@Getter
@RequiredArgsConstructor
public enum ModelVariant {
    /**
     * Counter-guarantee analysis of legal documents.
     */
    A("prompts/CONTRAGARANTIAS.txt"),
    /**
     * Structured summary of social reports.
     */
    B("prompts/INFORMES_SOCIALES.txt");

    private final String templateLocation;

    /**
     * Resolves a variant from its client-facing code. Only the exact codes {@code "A"} and {@code "B"}
     * are accepted; there is no default.
     *
     * @param code The variant code sent by the client.
     * @return The matching {@link ModelVariant}.
     * @throws InvalidModelException if the code is null or not one of the supported variants.
     */
    public static ModelVariant fromCode(final String code) {
        if (code != null) {
            for (ModelVariant variant : values()) {
                if (variant.name().equals(code)) {
                    return variant;
                }
            }
        }
        throw new InvalidModelException(
                String.format("Unsupported model variant '%s'. Supported variants are: A, B.", code));
    }
}
