package org.pragmatica.translator.tree;

import java.util.List;

/**
 * Message tree node. A parsed message is an ordered list of sibling nodes.
 */
public sealed interface Node {

    /**
     * Literal text - a leaf.
     */
    record Text(String value) implements Node {}

    /**
     * Paired tag {@code <name>...</name>} with its children.
     */
    record Tag(String name, List<Node> children) implements Node {
        public Tag {
            children = List.copyOf(children);
        }
    }

    /**
     * Self-closing tag {@code <name/>}.
     */
    record VoidTag(String name) implements Node {}

    /**
     * Named substitution point {@code %name%}.
     */
    record Placeholder(String name) implements Node {}

    static Text text(String value) {
        return new Text(value);
    }

    static Tag tag(String name, List<Node> children) {
        return new Tag(name, children);
    }

    static Tag tag(String name, Node... children) {
        return new Tag(name, List.of(children));
    }

    static VoidTag voidTag(String name) {
        return new VoidTag(name);
    }

    static Placeholder placeholder(String name) {
        return new Placeholder(name);
    }
}
