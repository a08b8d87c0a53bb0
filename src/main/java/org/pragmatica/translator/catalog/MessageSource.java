package org.pragmatica.translator.catalog;

import org.pragmatica.translator.plural.PluralLocale;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Message catalog of one locale: translation key to raw message markup.
 * Loading catalogs is left to the caller.
 */
public interface MessageSource {

    /**
     * Locale whose plural rules apply to this catalog.
     */
    PluralLocale locale();

    Optional<String> message(String key);

    Set<String> keys();

    /**
     * In-memory catalog backed by a copy of {@code messages}.
     */
    static MessageSource of(PluralLocale locale, Map<String, String> messages) {
        return new MapMessageSource(locale, messages);
    }
}
