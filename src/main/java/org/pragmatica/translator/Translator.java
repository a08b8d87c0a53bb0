package org.pragmatica.translator;

import org.pragmatica.translator.catalog.MessageSource;
import org.pragmatica.translator.error.MissingMessageException;
import org.pragmatica.translator.error.UnbalancedTagsException;
import org.pragmatica.translator.format.MessageFormatter;
import org.pragmatica.translator.parser.MessageParser;
import org.pragmatica.translator.plural.PluralLocale;
import org.pragmatica.translator.plural.PluralResolver;
import org.pragmatica.translator.tree.Node;
import org.pragmatica.translator.validate.StructureValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up messages by key and renders them.
 *
 * <p>Example usage:
 * <pre>{@code
 * var translator = Translator.builder(russian)
 *                            .fallback(english)
 *                            .build();
 *
 * translator.getMessageString("greeting", Map.of("name", "Anna"));
 * translator.getPluralString("files.count", 5, Map.of("count", 5));
 * }</pre>
 *
 * <p>Instances are immutable and may be shared between threads.
 */
public final class Translator {
    private static final Logger log = LoggerFactory.getLogger(Translator.class);

    private final MessageSource messages;
    private final Optional<MessageSource> fallback;
    private final TranslatorConfig config;

    private Translator(MessageSource messages, Optional<MessageSource> fallback, TranslatorConfig config) {
        this.messages = messages;
        this.fallback = fallback;
        this.config = config;
    }

    /**
     * Translator over a single catalog, without fallback.
     */
    public static Translator create(MessageSource messages) {
        return new Translator(messages, Optional.empty(), TranslatorConfig.DEFAULT);
    }

    public static Builder builder(MessageSource messages) {
        return new Builder(messages);
    }

    public PluralLocale locale() {
        return messages.locale();
    }

    /**
     * Render the message stored under {@code key}.
     *
     * @throws MissingMessageException if no catalog has the key
     */
    public List<Object> getMessage(String key, Map<String, ?> values) {
        var message = resolve(key, false);
        return MessageFormatter.format(MessageParser.parse(message.text()), values);
    }

    public String getMessageString(String key, Map<String, ?> values) {
        var message = resolve(key, false);
        return MessageFormatter.formatToString(MessageParser.parse(message.text()), values);
    }

    /**
     * Pick the plural form of {@code key} for {@code n} and render it.
     *
     * @throws MissingMessageException if no catalog has the key
     */
    public List<Object> getPlural(String key, long n, Map<String, ?> values) {
        return MessageFormatter.format(MessageParser.parse(pluralForm(key, n)), values);
    }

    public String getPluralString(String key, long n, Map<String, ?> values) {
        return MessageFormatter.formatToString(MessageParser.parse(pluralForm(key, n)), values);
    }

    private String pluralForm(String key, long n) {
        var message = resolve(key, true);
        return PluralResolver.selectForm(message.text(), n, message.locale(), key);
    }

    private Resolved resolve(String key, boolean plural) {
        var translated = messages.message(key);
        var base = fallback.flatMap(source -> source.message(key)
                                                    .map(text -> new Resolved(text, source.locale())));
        if (translated.isPresent()) {
            var message = new Resolved(translated.get(), messages.locale());
            if (config.structureCheckEnabled() && base.isPresent() && !isUsable(key, message, base.get(), plural)) {
                return base.get();
            }
            return message;
        }
        if (config.fallbackEnabled() && base.isPresent()) {
            log.debug("Message \"{}\" is missing for locale {}, using fallback", key, messages.locale().code());
            return base.get();
        }
        throw new MissingMessageException(key);
    }

    private boolean isUsable(String key, Resolved message, Resolved base, boolean plural) {
        if (plural) {
            if (!PluralResolver.hasValidForms(message.text(), message.locale())) {
                log.warn("Message \"{}\" has wrong number of plural forms for locale {}, using fallback",
                         key, message.locale().code());
                return false;
            }
            return true;
        }
        List<Node> baseNodes;
        try {
            baseNodes = MessageParser.parse(base.text());
        } catch (UnbalancedTagsException e) {
            log.debug("Fallback message \"{}\" is malformed, structure not checked", key);
            return true;
        }
        List<Node> nodes;
        try {
            nodes = MessageParser.parse(message.text());
        } catch (UnbalancedTagsException e) {
            log.warn("Message \"{}\" for locale {} is malformed, using fallback: {}",
                     key, message.locale().code(), e.getMessage());
            return false;
        }
        if (!StructureValidator.isStructurallyEquivalent(baseNodes, nodes)) {
            log.warn("Message \"{}\" for locale {} differs from fallback: {}",
                     key, message.locale().code(), StructureValidator.differences(baseNodes, nodes));
            return false;
        }
        return true;
    }

    private record Resolved(String text, PluralLocale locale) {}

    public static final class Builder {
        private final MessageSource messages;
        private MessageSource fallback;
        private boolean fallbackEnabled = TranslatorConfig.DEFAULT.fallbackEnabled();
        private boolean structureCheckEnabled = TranslatorConfig.DEFAULT.structureCheckEnabled();

        private Builder(MessageSource messages) {
            this.messages = messages;
        }

        /**
         * Catalog used for missing keys and as reference for the structure check, usually the source language.
         */
        public Builder fallback(MessageSource fallback) {
            this.fallback = fallback;
            return this;
        }

        public Builder fallbackEnabled(boolean enabled) {
            this.fallbackEnabled = enabled;
            return this;
        }

        public Builder structureCheck(boolean enabled) {
            this.structureCheckEnabled = enabled;
            return this;
        }

        public Builder config(TranslatorConfig config) {
            this.fallbackEnabled = config.fallbackEnabled();
            this.structureCheckEnabled = config.structureCheckEnabled();
            return this;
        }

        public Translator build() {
            var config = new TranslatorConfig(fallbackEnabled, structureCheckEnabled);
            return new Translator(messages, Optional.ofNullable(fallback), config);
        }
    }
}
