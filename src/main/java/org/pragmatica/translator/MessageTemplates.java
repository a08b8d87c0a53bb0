package org.pragmatica.translator;

import org.pragmatica.translator.format.MessageFormatter;
import org.pragmatica.translator.parser.MessageParser;
import org.pragmatica.translator.plural.PluralLocale;
import org.pragmatica.translator.plural.PluralResolver;
import org.pragmatica.translator.tree.Node;
import org.pragmatica.translator.validate.StructureValidator;

import java.util.List;
import java.util.Map;

/**
 * Entry point for working with message templates.
 *
 * <p>Example usage:
 * <pre>{@code
 * var nodes = MessageTemplates.parse("Hello, <b>%name%</b>!");
 * var text = MessageTemplates.render("Hello, <b>%name%</b>!",
 *                                    Map.of("name", "Anna",
 *                                           "b", (Function<String, String>) s -> "**" + s + "**"));
 * // "Hello, **Anna**!"
 * }</pre>
 */
public final class MessageTemplates {
    private MessageTemplates() {}

    /**
     * Parse message markup into nodes.
     */
    public static List<Node> parse(String message) {
        return MessageParser.parse(message);
    }

    /**
     * Substitute values into parsed nodes.
     */
    public static List<Object> format(List<Node> nodes, Map<String, ?> values) {
        return MessageFormatter.format(nodes, values);
    }

    /**
     * Parse and format a message into a single string.
     */
    public static String render(String message, Map<String, ?> values) {
        return MessageFormatter.formatToString(MessageParser.parse(message), values);
    }

    /**
     * Check that a translation keeps the tags and placeholders of its source message.
     */
    public static boolean isStructurallyEquivalent(String source, String translation) {
        return StructureValidator.isStructurallyEquivalent(MessageParser.parse(source), MessageParser.parse(translation));
    }

    /**
     * Select the plural form of {@code n} from a {@code |}-delimited string.
     */
    public static String selectForm(String pluralString, long n, PluralLocale locale, String key) {
        return PluralResolver.selectForm(pluralString, n, locale, key);
    }
}
