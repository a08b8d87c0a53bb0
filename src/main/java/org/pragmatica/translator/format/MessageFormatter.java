package org.pragmatica.translator.format;

import org.pragmatica.translator.error.MissingValueException;
import org.pragmatica.translator.tree.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a parsed message by substituting values for its tags, void tags and placeholders.
 *
 * <p>Example:
 * <pre>{@code
 * var nodes = MessageParser.parse("a <b>c</b> d");
 * MessageFormatter.format(nodes, Map.of("b", (Function<String, String>) s -> "[" + s + "]"));
 * // ["a ", "[c]", " d"]
 * }</pre>
 *
 * <p>Every name used by the message must be present in the value map; a missing one fails the
 * whole call with {@link MissingValueException} instead of rendering an empty string.
 */
public final class MessageFormatter {
    private final Map<String, MessageValue> values;

    private MessageFormatter(Map<String, MessageValue> values) {
        this.values = values;
    }

    /**
     * Render nodes into a list of parts. Text and literal values give strings, wrapper functions
     * give whatever they return.
     *
     * @param nodes  parsed message
     * @param values name to {@link CharSequence}, {@link Number}, {@link java.util.function.Function}
     *               or {@link MessageValue}
     */
    public static List<Object> format(List<Node> nodes, Map<String, ?> values) {
        var converted = new HashMap<String, MessageValue>();
        values.forEach((name, value) -> converted.put(name, MessageValue.of(name, value)));
        return Collections.unmodifiableList(new MessageFormatter(converted).render(nodes));
    }

    /**
     * Render nodes and concatenate the parts into a single string.
     */
    public static String formatToString(List<Node> nodes, Map<String, ?> values) {
        return join(format(nodes, values));
    }

    private List<Object> render(List<Node> nodes) {
        var parts = new ArrayList<Object>(nodes.size());
        for (var node : nodes) {
            parts.add(render(node));
        }
        return parts;
    }

    private Object render(Node node) {
        if (node instanceof Node.Text text) {
            return text.value();
        }
        if (node instanceof Node.Tag tag) {
            var children = join(render(tag.children()));
            return lookup(tag.name()).apply(children);
        }
        if (node instanceof Node.VoidTag voidTag) {
            return lookup(voidTag.name()).apply("");
        }
        if (node instanceof Node.Placeholder placeholder) {
            return lookup(placeholder.name()).apply("");
        }
        throw new IllegalStateException("Unknown node type: " + node);
    }

    private MessageValue lookup(String name) {
        var value = values.get(name);
        if (value == null) {
            throw new MissingValueException(name);
        }
        return value;
    }

    private static String join(List<Object> parts) {
        var sb = new StringBuilder();
        for (var part : parts) {
            sb.append(part);
        }
        return sb.toString();
    }
}
