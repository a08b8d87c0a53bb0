package org.pragmatica.translator.tree;

import java.util.Optional;

/**
 * Helpers over {@link Node} variants.
 */
public final class Nodes {
    private Nodes() {}

    /**
     * Name of a tag, void tag or placeholder; empty for text.
     */
    public static Optional<String> nameOf(Node node) {
        if (node instanceof Node.Tag tag) {
            return Optional.of(tag.name());
        }
        if (node instanceof Node.VoidTag voidTag) {
            return Optional.of(voidTag.name());
        }
        if (node instanceof Node.Placeholder placeholder) {
            return Optional.of(placeholder.name());
        }
        return Optional.empty();
    }

    /**
     * Short description used in diagnostics, e.g. {@code <b>}, {@code <br/>}, {@code %count%}.
     */
    public static String describe(Node node) {
        if (node instanceof Node.Tag tag) {
            return "<" + tag.name() + ">";
        }
        if (node instanceof Node.VoidTag voidTag) {
            return "<" + voidTag.name() + "/>";
        }
        if (node instanceof Node.Placeholder placeholder) {
            return "%" + placeholder.name() + "%";
        }
        return "text";
    }
}
