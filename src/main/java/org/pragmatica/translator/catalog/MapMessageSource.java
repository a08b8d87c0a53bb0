package org.pragmatica.translator.catalog;

import org.pragmatica.translator.plural.PluralLocale;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable {@link MessageSource} over a map.
 */
public record MapMessageSource(PluralLocale locale, Map<String, String> messages) implements MessageSource {
    public MapMessageSource {
        messages = Map.copyOf(messages);
    }

    @Override
    public Optional<String> message(String key) {
        return Optional.ofNullable(messages.get(key));
    }

    @Override
    public Set<String> keys() {
        return messages.keySet();
    }
}
