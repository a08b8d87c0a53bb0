package org.pragmatica.translator;

/**
 * Translator configuration options.
 *
 * @param fallbackEnabled       use the fallback catalog for keys missing from the translated one
 * @param structureCheckEnabled replace translations that are malformed or lose tags and placeholders
 *                              of the fallback message by the fallback message
 */
public record TranslatorConfig(
    boolean fallbackEnabled,
    boolean structureCheckEnabled
) {
    public static final TranslatorConfig DEFAULT = new TranslatorConfig(
        true,
        true
    );
}
